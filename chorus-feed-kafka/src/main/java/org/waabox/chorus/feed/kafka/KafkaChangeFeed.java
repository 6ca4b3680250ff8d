package org.waabox.chorus.feed.kafka;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.feed.ChangeFeedException;
import org.waabox.chorus.feed.ChangeFeedHandle;
import org.waabox.chorus.feed.ChangeFeedListener;
import org.waabox.chorus.feed.ChangePayload;
import org.waabox.chorus.feed.ChangePayloadCodec;

/** Kafka-based implementation of {@link ChangeFeed}.
 *
 * <p>One consumer, started by the first {@link #open}, reads the change
 * topic and routes each record to the open handles of the record's
 * resource. Every instance uses its own consumer group (broadcast
 * pattern) so that every node sees every change. Records are JSON strings
 * decoded with {@link ChangePayloadCodec}; records that cannot be decoded
 * are logged and skipped.
 *
 * <p>A consumer error other than the shutdown wakeup is fatal: every open
 * handle receives it through {@link ChangeFeedListener#onFailure} and is
 * dropped, and the next {@link #open} starts a fresh consumer.
 *
 * <p>Typical usage:
 * <pre>
 *   KafkaChangeFeedConfig config = KafkaChangeFeedConfig.create(
 *       "localhost:9092");
 *   KafkaChangeFeed feed = new KafkaChangeFeed(config);
 *   Chorus chorus = Chorus.builder().changeFeed(feed)
 *       .resources("members", "events").build();
 *   chorus.start();
 *   // ... writers ...
 *   feed.publish(ChangePayload.of("members", "update", 0, Instant.now()));
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeFeed implements ChangeFeed {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaChangeFeed.class);

  /** The Kafka configuration, never null. */
  private final KafkaChangeFeedConfig config;

  /** Creates the consumer, never null. */
  private final Supplier<Consumer<String, String>> consumerFactory;

  /** Creates the producer, never null. */
  private final Supplier<Producer<String, String>> producerFactory;

  /** The open handles, never null. Thread-safe. */
  private final List<KafkaHandle> handles = new CopyOnWriteArrayList<>();

  /** Flag indicating whether the poll loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The Kafka consumer, created on {@link #start()}. */
  private volatile Consumer<String, String> consumer;

  /** The Kafka producer, created on the first {@link #publish}. */
  private volatile Producer<String, String> producer;

  /** The daemon thread running the consumer poll loop. */
  private volatile Thread pollThread;

  /** Creates a new KafkaChangeFeed with the given configuration.
   *
   * @param theConfig the Kafka configuration, never null
   */
  public KafkaChangeFeed(final KafkaChangeFeedConfig theConfig) {
    this(theConfig, () -> createConsumer(theConfig),
        () -> createProducer(theConfig));
  }

  /** Creates a new KafkaChangeFeed with custom client factories.
   *
   * <p>Package-private for testability.
   *
   * @param theConfig          the Kafka configuration, never null
   * @param theConsumerFactory creates the consumer, never null
   * @param theProducerFactory creates the producer, never null
   */
  KafkaChangeFeed(final KafkaChangeFeedConfig theConfig,
      final Supplier<Consumer<String, String>> theConsumerFactory,
      final Supplier<Producer<String, String>> theProducerFactory) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    consumerFactory = Objects.requireNonNull(theConsumerFactory,
        "consumerFactory must not be null");
    producerFactory = Objects.requireNonNull(theProducerFactory,
        "producerFactory must not be null");
  }

  /** Starts the consumer poll loop. Only the first call has an effect. */
  public synchronized void start() {
    if (running.get()) {
      return;
    }

    final Consumer<String, String> created = consumerFactory.get();
    created.subscribe(Collections.singletonList(config.topic()));
    consumer = created;
    running.set(true);

    final Thread thread = new Thread(() -> pollLoop(created),
        "chorus-kafka-feed-poll");
    thread.setDaemon(true);
    pollThread = thread;
    thread.start();

    log.info("KafkaChangeFeed started on topic '{}' with bootstrap servers "
        + "'{}'", config.topic(), config.bootstrapServers());
  }

  /** {@inheritDoc} */
  @Override
  public ChangeFeedHandle open(final String resource,
      final ChangeFeedListener listener) throws ChangeFeedException {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    // Registered first, so a consumer failing right away reaches it.
    final KafkaHandle handle = new KafkaHandle(resource, listener);
    handles.add(handle);

    try {
      start();
    } catch (final RuntimeException e) {
      handles.remove(handle);
      handle.open = false;
      throw new ChangeFeedException(
          "Cannot start the Kafka consumer for '" + resource + "'", e);
    }

    log.debug("Opened Kafka change-feed handle for '{}'", resource);
    return handle;
  }

  /** {@inheritDoc} */
  @Override
  public void close(final ChangeFeedHandle handle) {
    Objects.requireNonNull(handle, "handle must not be null");
    if (handle instanceof KafkaHandle) {
      final KafkaHandle target = (KafkaHandle) handle;
      target.open = false;
      handles.remove(target);
    }
  }

  /** Publishes a change record for the other nodes.
   *
   * <p>The record is keyed by resource, so changes of one resource keep
   * their order. The send is asynchronous; failures are logged.
   *
   * @param payload the change, never null
   */
  public void publish(final ChangePayload payload) {
    Objects.requireNonNull(payload, "payload must not be null");

    final String json = ChangePayloadCodec.serialize(payload);
    final ProducerRecord<String, String> record = new ProducerRecord<>(
        config.topic(), payload.resource(), json);

    producer().send(record, (metadata, exception) -> {
      if (exception != null) {
        log.error("Failed to publish change for resource '{}': {}",
            payload.resource(), exception.getMessage(), exception);
      } else {
        log.debug("Published change for resource '{}' to partition {} "
            + "offset {}", payload.resource(), metadata.partition(),
            metadata.offset());
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void shutdown() {
    stopConsumer();

    for (final KafkaHandle handle : handles) {
      handle.open = false;
    }
    handles.clear();

    closeQuietly(producer, "producer");
    producer = null;

    log.info("KafkaChangeFeed stopped");
  }

  /** Routes one change to the open handles of its resource.
   *
   * <p>Package-private for testability.
   *
   * @param payload the change to dispatch, never null
   */
  void dispatch(final ChangePayload payload) {
    for (final KafkaHandle handle : handles) {
      if (!handle.open || !handle.resource.equals(payload.resource())) {
        continue;
      }
      try {
        handle.listener.onChange(payload);
      } catch (final Exception e) {
        log.error("Listener threw exception while processing change of "
            + "resource '{}': {}", payload.resource(), e.getMessage(), e);
      }
    }
  }

  /** Tells whether the consumer poll loop is running.
   *
   * @return true while consuming
   */
  boolean isRunning() {
    return running.get();
  }

  /** The main consumer poll loop. Runs in a daemon thread until
   * {@link #shutdown()} is called or the consumer fails.
   *
   * @param source the consumer this loop owns, never null
   */
  private void pollLoop(final Consumer<String, String> source) {
    try {
      while (running.get()) {
        final ConsumerRecords<String, String> records =
            source.poll(config.pollTimeout());
        for (final ConsumerRecord<String, String> record : records) {
          final ChangePayload payload;
          try {
            payload = ChangePayloadCodec.deserialize(record.value());
          } catch (final Exception e) {
            log.error("Failed to decode change record from partition {} "
                + "offset {}: {}", record.partition(), record.offset(),
                e.getMessage(), e);
            continue;
          }
          dispatch(payload);
        }
      }
    } catch (final WakeupException e) {
      if (running.get()) {
        failAll(source, e);
      } else {
        log.debug("Kafka poll loop woken up for shutdown");
      }
    } catch (final RuntimeException e) {
      failAll(source, e);
    }
  }

  /** Handles a fatal consumer error: breaks every open handle and drops
   * the consumer so the next open starts a new one.
   *
   * @param source the failed consumer, never null
   * @param cause  the error, never null
   */
  private void failAll(final Consumer<String, String> source,
      final Throwable cause) {
    log.error("Kafka consumer failed on topic '{}': {}", config.topic(),
        cause.getMessage(), cause);

    synchronized (this) {
      if (consumer == source) {
        running.set(false);
        consumer = null;
        pollThread = null;
      }
    }
    closeQuietly(source, "consumer");

    for (final KafkaHandle handle : handles) {
      handles.remove(handle);
      handle.open = false;
      try {
        handle.listener.onFailure(cause);
      } catch (final Exception e) {
        log.error("Listener failed handling a feed error for '{}'",
            handle.resource, e);
      }
    }
  }

  /** Stops the poll loop and closes the consumer. */
  private void stopConsumer() {
    final Consumer<String, String> current;
    final Thread thread;
    synchronized (this) {
      if (!running.getAndSet(false)) {
        return;
      }
      current = consumer;
      thread = pollThread;
      consumer = null;
      pollThread = null;
    }

    log.info("Stopping KafkaChangeFeed consumer...");

    if (current != null) {
      current.wakeup();
    }

    if (thread != null) {
      try {
        thread.join(5_000);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for poll thread to stop");
      }
    }

    closeQuietly(current, "consumer");
  }

  /** Returns the producer, creating it on first use.
   *
   * @return the producer, never null
   */
  private synchronized Producer<String, String> producer() {
    if (producer == null) {
      producer = producerFactory.get();
    }
    return producer;
  }

  /** Creates a new Kafka producer configured with string serializers.
   *
   * @param config the configuration, never null
   * @return the Kafka producer, never null
   */
  private static Producer<String, String> createProducer(
      final KafkaChangeFeedConfig config) {
    final Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    return new KafkaProducer<>(props);
  }

  /** Creates a new Kafka consumer configured with string deserializers
   * and a unique consumer group for broadcast semantics.
   *
   * @param config the configuration, never null
   * @return the Kafka consumer, never null
   */
  private static Consumer<String, String> createConsumer(
      final KafkaChangeFeedConfig config) {
    final String groupId = config.consumerGroupPrefix()
        + UUID.randomUUID();

    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return new KafkaConsumer<>(props);
  }

  /** Closes an AutoCloseable resource quietly, logging any errors.
   *
   * @param closeable the resource to close, may be null
   * @param name the name for logging purposes, never null
   */
  private static void closeQuietly(final AutoCloseable closeable,
      final String name) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (final Exception e) {
        log.warn("Error closing {}: {}", name, e.getMessage(), e);
      }
    }
  }

  /** A handle bound to one resource. */
  private static final class KafkaHandle implements ChangeFeedHandle {

    /** The subscribed resource. */
    private final String resource;

    /** The listener to deliver to. */
    private final ChangeFeedListener listener;

    /** Whether the handle is still open. */
    private volatile boolean open = true;

    /** Creates a new handle.
     *
     * @param theResource the resource
     * @param theListener the listener
     */
    private KafkaHandle(final String theResource,
        final ChangeFeedListener theListener) {
      resource = theResource;
      listener = theListener;
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
