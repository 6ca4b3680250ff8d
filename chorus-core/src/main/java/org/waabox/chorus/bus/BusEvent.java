package org.waabox.chorus.bus;

import java.util.Objects;
import java.util.Optional;

/**
 * A single delivery from the {@link EventBus} to a listener.
 *
 * @param topic  the topic the event was published on, never null
 * @param notice the change behind the publication, null for generic
 *               publications such as {@code forceRefresh}
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record BusEvent(Topic topic, ChangeNotice notice) {

  /**
   * Validates the topic.
   *
   * @param topic  the topic, never null
   * @param notice the notice, may be null
   */
  public BusEvent {
    Objects.requireNonNull(topic, "topic must not be null");
  }

  /**
   * Returns the change notice, if the publication carried one.
   *
   * @return the notice, never null
   */
  public Optional<ChangeNotice> findNotice() {
    return Optional.ofNullable(notice);
  }
}
