package com.streamwatch.eventsource;

/**
 * Enum values that can be returned by {@link EventSource#getReadyState()}.
 */
public enum ReadyState {
  /**
   * The EventSource is attempting to make a connection, or is waiting for its retry
   * delay to elapse before making the next attempt.
   */
  CONNECTING(0),
  /**
   * The connection is active and the EventSource is dispatching events.
   */
  OPEN(1),
  /**
   * The EventSource has been closed and will not reconnect.
   */
  CLOSED(2);

  private final int code;

  ReadyState(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value used for this state by the browser EventSource API.
   *
   * @return 0, 1, or 2
   */
  public int getCode() {
    return code;
  }
}
