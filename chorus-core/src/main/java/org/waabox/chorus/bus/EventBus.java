package org.waabox.chorus.bus;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.metrics.ChorusMetrics;
import org.waabox.chorus.metrics.NoopChorusMetrics;

/**
 * In-process publish/subscribe registry keyed by {@link Topic}.
 *
 * <p>Decouples the change-feed layer from the many consumers that react to
 * changes. Delivery is synchronous on the publishing thread and follows
 * registration order. Each listener invocation is isolated: a listener that
 * throws is logged and the remaining listeners still run. Nothing is
 * persisted; the bus is pure in-memory fan-out.
 *
 * <p>Thread safety: this class is thread-safe. Listeners may subscribe and
 * unsubscribe while a publication is in progress; the publication works on
 * the registrations present when it started.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventBus {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  /** The registrations, keyed by topic. */
  private final Map<Topic, List<ListenerToken>> registrations =
      new ConcurrentHashMap<>();

  /** The metrics reporter, never null. */
  private final ChorusMetrics metrics;

  /** Creates a bus that does not report metrics. */
  public EventBus() {
    this(new NoopChorusMetrics());
  }

  /**
   * Creates a bus reporting listener failures to the given metrics.
   *
   * @param theMetrics the metrics reporter, never null
   */
  public EventBus(final ChorusMetrics theMetrics) {
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Registers a listener for a topic.
   *
   * @param topic    the topic to listen to, never null
   * @param listener the listener, never null
   * @return the token that identifies this registration, never null
   */
  public ListenerToken subscribe(final Topic topic,
      final BusListener listener) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final ListenerToken token = new ListenerToken(this, topic, listener);
    registrations.compute(topic, (t, tokens) -> {
      final List<ListenerToken> target =
          tokens == null ? new CopyOnWriteArrayList<>() : tokens;
      target.add(token);
      return target;
    });
    return token;
  }

  /**
   * Removes exactly the registration identified by the token. Has no
   * effect if it was already removed.
   *
   * @param topic the topic of the registration, never null
   * @param token the token returned by {@link #subscribe}, never null
   */
  public void unsubscribe(final Topic topic, final ListenerToken token) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(token, "token must not be null");

    registrations.computeIfPresent(topic, (t, tokens) -> {
      tokens.remove(token);
      return tokens.isEmpty() ? null : tokens;
    });
  }

  /**
   * Publishes a generic event with no change notice.
   *
   * @param topic the topic, never null
   */
  public void publish(final Topic topic) {
    publish(topic, null);
  }

  /**
   * Publishes an event to every listener currently registered for the
   * topic.
   *
   * @param topic  the topic, never null
   * @param notice the change behind the publication, may be null
   */
  public void publish(final Topic topic, final ChangeNotice notice) {
    Objects.requireNonNull(topic, "topic must not be null");

    final List<ListenerToken> tokens = registrations.get(topic);
    if (tokens == null) {
      log.trace("No listeners for '{}'", topic);
      return;
    }

    final BusEvent event = new BusEvent(topic, notice);
    for (final ListenerToken token : tokens) {
      try {
        token.listener().onEvent(event);
      } catch (final Exception e) {
        log.error("Listener for '{}' threw: {}", topic, e.getMessage(), e);
        metrics.listenerFailed(topic.wireName(), e);
      }
    }
  }

  /**
   * Returns the number of registrations across all topics.
   *
   * @return the listener count
   */
  public int listenerCount() {
    int count = 0;
    for (final List<ListenerToken> tokens : registrations.values()) {
      count += tokens.size();
    }
    return count;
  }

  /**
   * Returns the number of registrations for one topic.
   *
   * @param topic the topic, never null
   * @return the listener count for the topic
   */
  public int listenerCount(final Topic topic) {
    Objects.requireNonNull(topic, "topic must not be null");
    final List<ListenerToken> tokens = registrations.get(topic);
    return tokens == null ? 0 : tokens.size();
  }

  /** Removes every registration. */
  public void clear() {
    registrations.clear();
  }

  /** Tells whether a token is still registered.
   *
   * @param token the token, never null
   * @return true if the registration is present
   */
  boolean isRegistered(final ListenerToken token) {
    final List<ListenerToken> tokens = registrations.get(token.topic());
    return tokens != null && tokens.contains(token);
  }
}
