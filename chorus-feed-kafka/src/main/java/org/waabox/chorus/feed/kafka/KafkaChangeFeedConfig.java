package org.waabox.chorus.feed.kafka;

import java.time.Duration;
import java.util.Objects;

/** Configuration for the Kafka change-feed.
 *
 * <p>Holds the broker addresses, the topic carrying change records, the
 * prefix of the per-instance consumer group, and how long each consumer
 * poll may block.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeFeedConfig {

  /** The default change topic. */
  private static final String DEFAULT_TOPIC = "chorus-changes";

  /** The default consumer group prefix. */
  private static final String DEFAULT_CONSUMER_GROUP_PREFIX = "chorus-";

  /** The default poll timeout. */
  private static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);

  /** The Kafka bootstrap servers, never null. */
  private final String bootstrapServers;

  /** The change topic, never null. */
  private final String topic;

  /** The consumer group prefix, never null. */
  private final String consumerGroupPrefix;

  /** How long one poll may block, never null. */
  private final Duration pollTimeout;

  /** Creates a new configuration.
   *
   * @param theBootstrapServers    the bootstrap servers, never null
   * @param theTopic               the change topic, never null
   * @param theConsumerGroupPrefix the consumer group prefix, never null
   * @param thePollTimeout         the poll timeout, never null
   */
  private KafkaChangeFeedConfig(final String theBootstrapServers,
      final String theTopic, final String theConsumerGroupPrefix,
      final Duration thePollTimeout) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    topic = Objects.requireNonNull(theTopic, "topic must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
    pollTimeout = Objects.requireNonNull(thePollTimeout,
        "pollTimeout must not be null");
    if (theTopic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
  }

  /** Creates a configuration with the default topic, prefix and timeout.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @return a new configuration, never null
   */
  public static KafkaChangeFeedConfig create(final String bootstrapServers) {
    return new KafkaChangeFeedConfig(bootstrapServers, DEFAULT_TOPIC,
        DEFAULT_CONSUMER_GROUP_PREFIX, DEFAULT_POLL_TIMEOUT);
  }

  /** Creates a configuration with a custom topic and prefix.
   *
   * @param bootstrapServers    the Kafka bootstrap servers, never null
   * @param topic               the change topic, never null
   * @param consumerGroupPrefix the consumer group prefix, never null
   * @return a new configuration, never null
   */
  public static KafkaChangeFeedConfig create(final String bootstrapServers,
      final String topic, final String consumerGroupPrefix) {
    return new KafkaChangeFeedConfig(bootstrapServers, topic,
        consumerGroupPrefix, DEFAULT_POLL_TIMEOUT);
  }

  /** Returns a copy of this configuration with another poll timeout.
   *
   * @param timeout the poll timeout, never null
   * @return a new configuration, never null
   */
  public KafkaChangeFeedConfig withPollTimeout(final Duration timeout) {
    return new KafkaChangeFeedConfig(bootstrapServers, topic,
        consumerGroupPrefix, timeout);
  }

  /** Returns the Kafka bootstrap servers.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /** Returns the change topic.
   *
   * @return the topic, never null
   */
  public String topic() {
    return topic;
  }

  /** Returns the consumer group prefix.
   *
   * @return the prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }

  /** Returns how long one poll may block.
   *
   * @return the poll timeout, never null
   */
  public Duration pollTimeout() {
    return pollTimeout;
  }
}
