package com.streamwatch.eventsource;

/**
 * Base interface for all events that {@link EventSource} delivers to listeners.
 *
 * @see MessageEvent
 * @see ConnectionEvent
 * @see FaultEvent
 */
public interface StreamEvent {
  /**
   * Returns the event type that listeners are registered for, such as "open",
   * "message", "error", or a type assigned by the server with an {@code event:} field.
   *
   * @return the event type
   */
  String getType();
}
