package org.waabox.chorus.feed.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.ChorusException;
import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.feed.ChangeFeedException;
import org.waabox.chorus.feed.ChangeFeedHandle;
import org.waabox.chorus.feed.ChangeFeedListener;
import org.waabox.chorus.feed.ChangePayload;

/**
 * A {@link ChangeFeed} backed by a change-log table polled over JDBC.
 *
 * <p>Writers call {@link #recordChange(String, String)}, which bumps the
 * version of the resource's row. A single daemon thread reads the table
 * every poll interval and delivers a {@link ChangePayload} to every open
 * handle whose resource advanced past the version that handle last saw.
 *
 * <p>The table is created automatically, if it does not already exist, by
 * {@link #start()}, which runs on the first {@link #open} at the latest.
 * A failing poll breaks every open handle: each one receives the error
 * through {@link ChangeFeedListener#onFailure(Throwable)} and is dropped.
 *
 * <p>Thread safety: this class is thread-safe. The open handles live in a
 * {@link CopyOnWriteArrayList}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcChangeFeed implements ChangeFeed {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcChangeFeed.class);

  /** The configuration for this feed, never null. */
  private final JdbcChangeFeedConfig config;

  /** The open handles. */
  private final List<JdbcHandle> handles = new CopyOnWriteArrayList<>();

  /** Whether the table was ensured and the poller started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** The scheduler that runs the polling task. */
  private volatile ScheduledExecutorService scheduler;

  /**
   * Creates a new JDBC change-feed. Nothing touches the database until
   * {@link #start()} or the first {@link #open}.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcChangeFeed(final JdbcChangeFeedConfig theConfig) {
    Objects.requireNonNull(theConfig, "config cannot be null");
    config = theConfig;
  }

  /**
   * Creates the change-log table if missing and starts polling.
   *
   * <p>Only the first call has an effect.
   *
   * @throws ChorusException if the table cannot be created
   */
  public synchronized void start() {
    if (started.get()) {
      return;
    }
    createTableIfNotExists();

    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "chorus-db-poll");
      thread.setDaemon(true);
      return thread;
    });

    final long intervalMillis = config.pollInterval().toMillis();

    scheduler.scheduleWithFixedDelay(this::pollQuietly,
        intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

    started.set(true);
    log.info("JdbcChangeFeed started on '{}', polling every {} ms",
        config.tableName(), intervalMillis);
  }

  /** {@inheritDoc}
   *
   * <p>Reads the resource's current version as the baseline: only changes
   * recorded after this call are delivered.
   */
  @Override
  public ChangeFeedHandle open(final String resource,
      final ChangeFeedListener listener) throws ChangeFeedException {
    Objects.requireNonNull(resource, "resource cannot be null");
    Objects.requireNonNull(listener, "listener cannot be null");

    try {
      start();
    } catch (final ChorusException e) {
      throw new ChangeFeedException(
          "Cannot start the change-feed for '" + resource + "'", e);
    }

    final long baseline;
    try {
      baseline = currentVersion(resource);
    } catch (final SQLException e) {
      throw new ChangeFeedException(
          "Cannot read the change-log for '" + resource + "'", e);
    }

    final JdbcHandle handle = new JdbcHandle(resource, listener, baseline);
    handles.add(handle);
    log.debug("Opened change-feed handle for '{}' at version {}", resource,
        baseline);
    return handle;
  }

  /** {@inheritDoc} */
  @Override
  public void close(final ChangeFeedHandle handle) {
    Objects.requireNonNull(handle, "handle cannot be null");
    if (handle instanceof JdbcHandle) {
      final JdbcHandle target = (JdbcHandle) handle;
      target.open = false;
      handles.remove(target);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void shutdown() {
    final ScheduledExecutorService current = scheduler;
    if (current != null) {
      current.shutdown();
      try {
        if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
          current.shutdownNow();
        }
      } catch (final InterruptedException e) {
        current.shutdownNow();
        Thread.currentThread().interrupt();
      }
      log.info("JdbcChangeFeed stopped");
    }
    for (final JdbcHandle handle : handles) {
      handle.open = false;
    }
    handles.clear();
  }

  /**
   * Records a change of a resource, bumping its version.
   *
   * <p>The first change of a resource inserts its row with version 1.
   *
   * @param resource the resource that changed, never null
   * @param action   the change kind, never null
   *
   * @throws ChorusException if the change cannot be written
   */
  public void recordChange(final String resource, final String action) {
    Objects.requireNonNull(resource, "resource cannot be null");
    Objects.requireNonNull(action, "action cannot be null");

    start();

    final String update = "UPDATE " + config.tableName()
        + " SET version = version + 1, action = ?, changed_at = ?"
        + " WHERE resource = ?";
    final String insert = "INSERT INTO " + config.tableName()
        + " (resource, version, action, changed_at) VALUES (?, 1, ?, ?)";
    final Timestamp now = Timestamp.from(Instant.now());

    try (final Connection conn = config.dataSource().getConnection()) {
      final int updated;
      try (final PreparedStatement ps = conn.prepareStatement(update)) {
        ps.setString(1, action);
        ps.setTimestamp(2, now);
        ps.setString(3, resource);
        updated = ps.executeUpdate();
      }
      if (updated == 0) {
        try (final PreparedStatement ps = conn.prepareStatement(insert)) {
          ps.setString(1, resource);
          ps.setString(2, action);
          ps.setTimestamp(3, now);
          ps.executeUpdate();
        }
      }

      log.debug("Recorded '{}' change for resource '{}'", action, resource);

    } catch (final SQLException e) {
      throw new ChorusException(
          "Failed to record change for resource '" + resource + "'", e);
    }
  }

  /**
   * Reads the change-log once and delivers the changes. Package-private
   * so tests can poll without waiting for the interval.
   *
   * @throws SQLException if the table cannot be read
   */
  void poll() throws SQLException {
    if (handles.isEmpty()) {
      return;
    }

    final String sql = "SELECT resource, version, action, changed_at FROM "
        + config.tableName();

    final Map<String, ChangePayload> latest = new HashMap<>();

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql);
         final ResultSet rs = ps.executeQuery()) {

      while (rs.next()) {
        final String resource = rs.getString("resource");
        latest.put(resource, ChangePayload.of(resource,
            rs.getString("action"), rs.getLong("version"),
            rs.getTimestamp("changed_at").toInstant()));
      }
    }

    for (final JdbcHandle handle : handles) {
      final ChangePayload payload = latest.get(handle.resource);
      if (payload != null && payload.version() > handle.lastSeen) {
        handle.lastSeen = payload.version();
        deliver(handle, payload);
      }
    }
  }

  /** Runs one poll, breaking every open handle if it fails. */
  private void pollQuietly() {
    try {
      poll();
    } catch (final SQLException e) {
      log.error("Error polling change-log table '{}'", config.tableName(), e);
      for (final JdbcHandle handle : handles) {
        handles.remove(handle);
        handle.open = false;
        try {
          handle.listener.onFailure(e);
        } catch (final Exception listenerError) {
          log.error("Listener failed handling a feed error for '{}'",
              handle.resource, listenerError);
        }
      }
    }
  }

  /**
   * Hands one change to a handle's listener.
   *
   * @param handle  the handle, never null
   * @param payload the change, never null
   */
  private void deliver(final JdbcHandle handle, final ChangePayload payload) {
    if (!handle.open) {
      return;
    }
    try {
      handle.listener.onChange(payload);
    } catch (final Exception e) {
      log.error("Listener threw exception for resource '{}'",
          handle.resource, e);
    }
  }

  /**
   * Reads the current version of a resource.
   *
   * @param resource the resource, never null
   * @return the version, or 0 if the resource never changed
   * @throws SQLException if the table cannot be read
   */
  private long currentVersion(final String resource) throws SQLException {
    final String sql = "SELECT version FROM " + config.tableName()
        + " WHERE resource = ?";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, resource);
      try (final ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong("version") : 0L;
      }
    }
  }

  /**
   * Creates the change-log table if it does not already exist.
   *
   * <p>Uses {@code CREATE TABLE IF NOT EXISTS} for idempotent DDL.
   */
  private void createTableIfNotExists() {
    final String ddl = "CREATE TABLE IF NOT EXISTS " + config.tableName()
        + " ("
        + "resource VARCHAR(255) NOT NULL, "
        + "version BIGINT NOT NULL, "
        + "action VARCHAR(64) NOT NULL, "
        + "changed_at TIMESTAMP NOT NULL, "
        + "PRIMARY KEY (resource)"
        + ")";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(ddl)) {

      ps.execute();
      log.debug("Ensured change-log table '{}' exists", config.tableName());

    } catch (final SQLException e) {
      throw new ChorusException(
          "Failed to create change-log table '" + config.tableName() + "'",
          e);
    }
  }

  /** A handle that remembers the last version it delivered. */
  private static final class JdbcHandle implements ChangeFeedHandle {

    /** The subscribed resource. */
    private final String resource;

    /** The listener to deliver to. */
    private final ChangeFeedListener listener;

    /** The last delivered version. Only the poller thread writes it. */
    private volatile long lastSeen;

    /** Whether the handle is still open. */
    private volatile boolean open = true;

    /** Creates a new handle.
     *
     * @param theResource the resource
     * @param theListener the listener
     * @param theBaseline the version at open time
     */
    private JdbcHandle(final String theResource,
        final ChangeFeedListener theListener, final long theBaseline) {
      resource = theResource;
      listener = theListener;
      lastSeen = theBaseline;
    }

    @Override
    public String resource() {
      return resource;
    }

    @Override
    public boolean isOpen() {
      return open;
    }
  }
}
