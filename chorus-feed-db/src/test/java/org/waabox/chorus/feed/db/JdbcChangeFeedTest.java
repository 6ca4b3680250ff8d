package org.waabox.chorus.feed.db;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.chorus.feed.ChangeFeedException;
import org.waabox.chorus.feed.ChangeFeedHandle;
import org.waabox.chorus.feed.ChangeFeedListener;
import org.waabox.chorus.feed.ChangePayload;

/** Unit tests for {@link JdbcChangeFeed}.
 *
 * <p>Uses an H2 in-memory database. Most tests poll explicitly, with a
 * poll interval long enough that the background poller never fires.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcChangeFeedTest {

  /** The H2 in-memory data source used across all tests. */
  private DataSource dataSource;

  /** The feed under test. */
  private JdbcChangeFeed feed;

  @BeforeEach
  void setUp() {
    final JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:chorus_" + System.nanoTime()
        + ";DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    dataSource = ds;
    feed = new JdbcChangeFeed(JdbcChangeFeedConfig.create(dataSource,
        "chorus_change_log", Duration.ofHours(1)));
  }

  @AfterEach
  void tearDown() {
    feed.shutdown();
  }

  /** Collects what a handle receives. */
  private static final class Recorder implements ChangeFeedListener {

    private final List<ChangePayload> changes = new ArrayList<>();

    private final List<Throwable> failures = new ArrayList<>();

    @Override
    public void onChange(final ChangePayload payload) {
      changes.add(payload);
    }

    @Override
    public void onFailure(final Throwable cause) {
      failures.add(cause);
    }
  }

  @Test
  void whenStarting_shouldCreateTableIfNotExists() throws Exception {
    feed.start();

    try (final Connection conn = dataSource.getConnection()) {
      final ResultSet rs = conn.getMetaData().getTables(
          null, null, "CHORUS_CHANGE_LOG", null);
      assertTrue(rs.next(), "Table chorus_change_log should exist");
    }
  }

  @Test
  void whenRecordingChange_givenNewResource_shouldInsertVersionOne()
      throws Exception {
    feed.recordChange("members", "create");

    assertEquals(1L, versionOf("members"));
  }

  @Test
  void whenRecordingChange_givenExistingResource_shouldBumpVersion()
      throws Exception {
    feed.recordChange("members", "create");
    feed.recordChange("members", "update");
    feed.recordChange("members", "delete");

    assertEquals(3L, versionOf("members"));
  }

  @Test
  void whenPolling_givenChangeAfterOpen_shouldDeliverIt() throws Exception {
    final Recorder recorder = new Recorder();
    feed.open("members", recorder);

    feed.recordChange("members", "update");
    feed.poll();

    assertEquals(1, recorder.changes.size());
    final ChangePayload payload = recorder.changes.get(0);
    assertEquals("members", payload.resource());
    assertEquals("update", payload.action());
    assertEquals(1L, payload.version());
  }

  @Test
  void whenPolling_givenChangeBeforeOpen_shouldNotReplayIt()
      throws Exception {
    feed.recordChange("members", "create");
    final Recorder recorder = new Recorder();
    feed.open("members", recorder);

    feed.poll();

    assertTrue(recorder.changes.isEmpty());
  }

  @Test
  void whenPolling_givenNoNewVersion_shouldDeliverOnlyOnce()
      throws Exception {
    final Recorder recorder = new Recorder();
    feed.open("members", recorder);
    feed.recordChange("members", "update");

    feed.poll();
    feed.poll();

    assertEquals(1, recorder.changes.size());
  }

  @Test
  void whenPolling_givenOtherResourceChanged_shouldNotDeliver()
      throws Exception {
    final Recorder members = new Recorder();
    final Recorder events = new Recorder();
    feed.open("members", members);
    feed.open("events", events);

    feed.recordChange("events", "insert");
    feed.poll();

    assertTrue(members.changes.isEmpty());
    assertEquals(1, events.changes.size());
  }

  @Test
  void whenClosingHandle_shouldStopDelivering() throws Exception {
    final Recorder recorder = new Recorder();
    final ChangeFeedHandle handle = feed.open("members", recorder);

    feed.close(handle);
    feed.recordChange("members", "update");
    feed.poll();

    assertFalse(handle.isOpen());
    assertTrue(recorder.changes.isEmpty());
  }

  @Test
  void whenOpening_givenUnreachableDatabase_shouldThrowChangeFeedException()
      throws Exception {
    final DataSource broken = createMock(DataSource.class);
    expect(broken.getConnection())
        .andThrow(new SQLException("connection refused")).anyTimes();
    replay(broken);

    final JdbcChangeFeed unreachable = new JdbcChangeFeed(
        JdbcChangeFeedConfig.create(broken));

    assertThrows(ChangeFeedException.class, () ->
        unreachable.open("members", new Recorder())
    );
    verify(broken);
  }

  @Test
  void whenPollingFails_shouldBreakEveryOpenHandle() throws Exception {
    final ChangeFeedListener listener = createMock(ChangeFeedListener.class);
    listener.onFailure(anyObject(SQLException.class));
    expectLastCall().once();
    replay(listener);

    final JdbcChangeFeed fast = new JdbcChangeFeed(JdbcChangeFeedConfig
        .create(dataSource, "chorus_fast_log", Duration.ofMillis(50)));
    try {
      final ChangeFeedHandle handle = fast.open("members", listener);

      try (final Connection conn = dataSource.getConnection();
           final PreparedStatement ps = conn.prepareStatement(
               "DROP TABLE chorus_fast_log")) {
        ps.execute();
      }

      final long deadline = System.currentTimeMillis() + 5000;
      while (handle.isOpen() && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }

      assertFalse(handle.isOpen());
      verify(listener);
    } finally {
      fast.shutdown();
    }
  }

  @Test
  void whenPollerRuns_shouldDeliverWithoutExplicitPolling()
      throws Exception {
    final JdbcChangeFeed fast = new JdbcChangeFeed(JdbcChangeFeedConfig
        .create(dataSource, "chorus_live_log", Duration.ofMillis(50)));
    final CountDownLatch latch = new CountDownLatch(1);
    try {
      fast.open("events", new ChangeFeedListener() {
        @Override
        public void onChange(final ChangePayload payload) {
          latch.countDown();
        }

        @Override
        public void onFailure(final Throwable cause) {
        }
      });

      fast.recordChange("events", "insert");

      assertTrue(latch.await(5, TimeUnit.SECONDS));
    } finally {
      fast.shutdown();
    }
  }

  @Test
  void whenCreatingConfig_givenUnsafeTableName_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        JdbcChangeFeedConfig.create(dataSource, "log; DROP TABLE x",
            Duration.ofSeconds(1))
    );
  }

  @Test
  void whenCreatingConfig_givenZeroPollInterval_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        JdbcChangeFeedConfig.create(dataSource, "chorus_change_log",
            Duration.ZERO)
    );
  }

  /** Reads a resource's version straight from the table.
   *
   * @param resource the resource
   * @return the version
   */
  private long versionOf(final String resource) throws Exception {
    try (final Connection conn = dataSource.getConnection();
         final PreparedStatement ps = conn.prepareStatement(
             "SELECT version FROM chorus_change_log WHERE resource = ?")) {
      ps.setString(1, resource);
      try (final ResultSet rs = ps.executeQuery()) {
        assertTrue(rs.next(), "Row should exist for " + resource);
        return rs.getLong("version");
      }
    }
  }
}
