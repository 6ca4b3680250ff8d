package org.waabox.chorus.bus;

/**
 * Identifies one registration on the {@link EventBus}.
 *
 * <p>Tokens compare by identity: registering the same listener twice
 * yields two tokens, and each removes exactly its own registration.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ListenerToken {

  /** The bus that issued this token, never null. */
  private final EventBus bus;

  /** The topic of the registration, never null. */
  private final Topic topic;

  /** The registered listener, never null. */
  private final BusListener listener;

  /**
   * Creates a token. Only the bus creates tokens.
   *
   * @param theBus      the issuing bus, never null
   * @param theTopic    the topic, never null
   * @param theListener the listener, never null
   */
  ListenerToken(final EventBus theBus, final Topic theTopic,
      final BusListener theListener) {
    bus = theBus;
    topic = theTopic;
    listener = theListener;
  }

  /**
   * Returns the topic of this registration.
   *
   * @return the topic, never null
   */
  public Topic topic() {
    return topic;
  }

  /** Returns the registered listener.
   *
   * @return the listener, never null
   */
  BusListener listener() {
    return listener;
  }

  /**
   * Removes this registration from its bus. Has no effect if it was
   * already removed.
   */
  public void cancel() {
    bus.unsubscribe(topic, this);
  }

  /**
   * Tells whether this registration is still present on its bus.
   *
   * @return true if the listener still receives events
   */
  public boolean isActive() {
    return bus.isRegistered(this);
  }

  @Override
  public String toString() {
    return "ListenerToken{topic=" + topic + "}";
  }
}
