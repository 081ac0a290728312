package com.streamwatch.eventsource;

/**
 * Receives exceptions thrown by {@link EventListener}s.
 * <p>
 * EventSource catches any exception from a listener so that it cannot interfere with
 * parsing, reconnection, or other listeners. The exception is then passed to this handler
 * in a separate task on the event loop, after the dispatch that raised it has finished.
 * The default handler logs the exception at WARN level.
 *
 * @see EventSource.Builder#listenerErrorHandler(ListenerErrorHandler)
 */
@FunctionalInterface
public interface ListenerErrorHandler {
  /**
   * Called with an exception that a listener threw.
   *
   * @param event the event that was being delivered
   * @param error the exception
   */
  void onListenerError(StreamEvent event, Exception error);
}
