package org.waabox.chorus.feed.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.chorus.feed.ChangeFeedHandle;
import org.waabox.chorus.feed.ChangeFeedListener;
import org.waabox.chorus.feed.ChangePayload;
import org.waabox.chorus.feed.ChangePayloadCodec;

/** Unit tests for {@link KafkaChangeFeed} and {@link KafkaChangeFeedConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class KafkaChangeFeedTest {

  private static final TopicPartition PARTITION =
      new TopicPartition("chorus-changes", 0);

  private final Deque<MockConsumer<String, String>> consumers =
      new ArrayDeque<>();

  private MockConsumer<String, String> consumer;

  private MockProducer<String, String> producer;

  private KafkaChangeFeed feed;

  private long offset;

  @BeforeEach
  void setUp() {
    consumer = assignableConsumer();
    consumers.add(consumer);
    producer = new MockProducer<>(true, new StringSerializer(),
        new StringSerializer());

    final KafkaChangeFeedConfig config = KafkaChangeFeedConfig
        .create("localhost:9092")
        .withPollTimeout(Duration.ofMillis(10));

    feed = new KafkaChangeFeed(config, consumers::poll, () -> producer);
  }

  @AfterEach
  void tearDown() {
    feed.shutdown();
  }

  @Test
  void whenCreatingConfig_givenDefaults_shouldHaveCorrectValues() {
    final KafkaChangeFeedConfig config = KafkaChangeFeedConfig.create(
        "localhost:9092");

    assertEquals("localhost:9092", config.bootstrapServers());
    assertEquals("chorus-changes", config.topic());
    assertEquals("chorus-", config.consumerGroupPrefix());
    assertEquals(Duration.ofMillis(500), config.pollTimeout());
  }

  @Test
  void whenCreatingConfig_givenCustomValues_shouldHaveCustomValues() {
    final KafkaChangeFeedConfig config = KafkaChangeFeedConfig.create(
        "broker1:9092,broker2:9092", "custom-topic", "custom-prefix-");

    assertEquals("broker1:9092,broker2:9092", config.bootstrapServers());
    assertEquals("custom-topic", config.topic());
    assertEquals("custom-prefix-", config.consumerGroupPrefix());
  }

  @Test
  void whenCreatingConfig_givenBlankTopic_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> KafkaChangeFeedConfig.create("localhost:9092", " ", "p-"));
  }

  @Test
  void whenRecordArrives_givenHandleForItsResource_shouldDeliver()
      throws Exception {
    final RecordingListener members = new RecordingListener(1);
    final RecordingListener events = new RecordingListener(1);

    feed.open("members", members);
    feed.open("events", events);
    awaitAssignment(consumer);

    addRecord(consumer, ChangePayloadCodec.serialize(ChangePayload.of(
        "members", "update", 7, Instant.parse("2024-01-01T00:00:00Z"))));

    assertTrue(members.changes.await(5, TimeUnit.SECONDS));
    assertEquals(1, members.received.size());
    assertEquals("update", members.received.get(0).action());
    assertEquals(7L, members.received.get(0).version());
    assertTrue(events.received.isEmpty());
  }

  @Test
  void whenRecordArrives_givenUndecodableValue_shouldSkipIt()
      throws Exception {
    final RecordingListener listener = new RecordingListener(1);
    feed.open("members", listener);
    awaitAssignment(consumer);

    addRecord(consumer, "not json at all");
    addRecord(consumer, ChangePayloadCodec.serialize(ChangePayload.of(
        "members", "insert", 1, Instant.parse("2024-01-01T00:00:00Z"))));

    assertTrue(listener.changes.await(5, TimeUnit.SECONDS));
    assertEquals(1, listener.received.size());
    assertEquals("insert", listener.received.get(0).action());
    assertTrue(listener.failures.isEmpty());
  }

  @Test
  void whenDispatching_givenListenerThrows_shouldStillDeliverToOthers()
      throws Exception {
    final RecordingListener healthy = new RecordingListener(1);
    feed.open("members", new ChangeFeedListener() {
      @Override
      public void onChange(final ChangePayload payload) {
        throw new IllegalStateException("boom");
      }

      @Override
      public void onFailure(final Throwable cause) {
      }
    });
    feed.open("members", healthy);

    feed.dispatch(ChangePayload.of("members", "delete", 3,
        Instant.parse("2024-01-01T00:00:00Z")));

    assertEquals(1, healthy.received.size());
  }

  @Test
  void whenClosingHandle_givenLaterChange_shouldNotDeliver()
      throws Exception {
    final RecordingListener listener = new RecordingListener(1);
    final ChangeFeedHandle handle = feed.open("members", listener);

    feed.close(handle);
    feed.dispatch(ChangePayload.of("members", "update", 2,
        Instant.parse("2024-01-01T00:00:00Z")));

    assertFalse(handle.isOpen());
    assertTrue(listener.received.isEmpty());
  }

  @Test
  void whenConsumerFails_givenOpenHandles_shouldBreakThemAndRestartOnOpen()
      throws Exception {
    consumer.setPollException(new KafkaException("broker gone"));
    final MockConsumer<String, String> replacement = assignableConsumer();
    consumers.add(replacement);

    final RecordingListener listener = new RecordingListener(1);
    final ChangeFeedHandle handle = feed.open("members", listener);

    assertTrue(listener.failed.await(5, TimeUnit.SECONDS));
    assertEquals("broker gone", listener.failures.get(0).getMessage());
    assertFalse(handle.isOpen());
    awaitClosed(consumer);
    assertFalse(feed.isRunning());

    final RecordingListener reopened = new RecordingListener(1);
    feed.open("members", reopened);
    assertTrue(feed.isRunning());
    awaitAssignment(replacement);

    addRecord(replacement, ChangePayloadCodec.serialize(ChangePayload.of(
        "members", "update", 9, Instant.parse("2024-01-01T00:00:00Z"))));

    assertTrue(reopened.changes.await(5, TimeUnit.SECONDS));
    assertTrue(listener.received.isEmpty());
  }

  @Test
  void whenPublishing_givenPayload_shouldSendKeyedJsonToTopic() {
    final ChangePayload payload = new ChangePayload("members", "update", 4,
        Instant.parse("2024-01-01T00:00:00Z"), Map.of("id", "42"));

    feed.publish(payload);

    final List<ProducerRecord<String, String>> sent = producer.history();
    assertEquals(1, sent.size());
    assertEquals("chorus-changes", sent.get(0).topic());
    assertEquals("members", sent.get(0).key());
    assertEquals(payload, ChangePayloadCodec.deserialize(sent.get(0).value()));
  }

  @Test
  void whenShuttingDown_givenRunningConsumer_shouldCloseClients()
      throws Exception {
    final RecordingListener listener = new RecordingListener(1);
    final ChangeFeedHandle handle = feed.open("members", listener);
    feed.publish(ChangePayload.of("members", "update", 1,
        Instant.parse("2024-01-01T00:00:00Z")));

    feed.shutdown();

    assertFalse(feed.isRunning());
    assertFalse(handle.isOpen());
    assertTrue(consumer.closed());
    assertTrue(producer.closed());
  }

  private static MockConsumer<String, String> assignableConsumer() {
    final MockConsumer<String, String> created =
        new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    created.schedulePollTask(() -> {
      created.rebalance(List.of(PARTITION));
      created.updateBeginningOffsets(Map.of(PARTITION, 0L));
    });
    return created;
  }

  private void addRecord(final MockConsumer<String, String> target,
      final String value) {
    target.addRecord(new ConsumerRecord<>(PARTITION.topic(),
        PARTITION.partition(), offset++, "members", value));
  }

  private static void awaitAssignment(
      final MockConsumer<String, String> target) throws Exception {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (target.assignment().isEmpty()) {
      assertTrue(System.nanoTime() < deadline, "partition never assigned");
      Thread.sleep(5);
    }
  }

  private static void awaitClosed(final MockConsumer<String, String> target)
      throws Exception {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!target.closed()) {
      assertTrue(System.nanoTime() < deadline, "consumer never closed");
      Thread.sleep(5);
    }
  }

  private static final class RecordingListener implements ChangeFeedListener {

    private final List<ChangePayload> received = new CopyOnWriteArrayList<>();

    private final List<Throwable> failures = new CopyOnWriteArrayList<>();

    private final CountDownLatch changes;

    private final CountDownLatch failed = new CountDownLatch(1);

    private RecordingListener(final int expectedChanges) {
      changes = new CountDownLatch(expectedChanges);
    }

    @Override
    public void onChange(final ChangePayload payload) {
      received.add(payload);
      changes.countDown();
    }

    @Override
    public void onFailure(final Throwable cause) {
      failures.add(cause);
      failed.countDown();
    }
  }
}
