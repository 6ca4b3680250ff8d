package org.waabox.chorus.bus;

/**
 * A callback registered on the {@link EventBus} for one topic.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface BusListener {

  /**
   * Called synchronously on the publishing thread.
   *
   * <p>Exceptions are caught and logged by the bus; they never reach the
   * publisher or the other listeners.
   *
   * @param event the delivered event, never null
   */
  void onEvent(BusEvent event);
}
