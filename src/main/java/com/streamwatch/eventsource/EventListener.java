package com.streamwatch.eventsource;

/**
 * A callback that receives events from an {@link EventSource}.
 * <p>
 * Listeners are called on the EventSource's event loop thread, in the order that events
 * were read from the stream. A listener may call {@link EventSource#close()}; no further
 * events are delivered after that, even if more were already buffered.
 *
 * @see EventSource#addEventListener(String, EventListener)
 * @see EventSource#setOnMessage(EventListener)
 */
@FunctionalInterface
public interface EventListener {
  /**
   * Called for each event of the type this listener was registered for.
   *
   * @param event a {@link MessageEvent}, {@link ConnectionEvent}, or {@link FaultEvent}
   * @throws Exception throwing an exception here does not affect the stream or other
   *   listeners; it is passed to the {@link ListenerErrorHandler}
   */
  void onEvent(StreamEvent event) throws Exception;
}
