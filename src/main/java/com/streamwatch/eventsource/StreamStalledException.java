package com.streamwatch.eventsource;

import java.util.Objects;

/**
 * An exception indicating that the heartbeat watchdog saw no data at all from the
 * connection for longer than the heartbeat timeout, so EventSource dropped the
 * connection and is reconnecting.
 *
 * @see EventSource.Builder#heartbeatTimeout(long, java.util.concurrent.TimeUnit)
 */
@SuppressWarnings("serial")
public final class StreamStalledException extends StreamException {
  private final long timeoutMillis;
  private final long charsReceived;

  /**
   * Constructs an instance.
   *
   * @param timeoutMillis the heartbeat timeout that elapsed
   * @param charsReceived the number of characters received on this connection, or -1 if
   *   the server never responded
   */
  public StreamStalledException(long timeoutMillis, long charsReceived) {
    super("No activity within " + timeoutMillis + " milliseconds. " +
        (charsReceived < 0 ? "No response received." : charsReceived + " chars received.") +
        " Reconnecting.");
    this.timeoutMillis = timeoutMillis;
    this.charsReceived = charsReceived;
  }

  /**
   * Returns the heartbeat timeout that elapsed without activity.
   * @return the timeout in milliseconds
   */
  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  /**
   * Returns the number of characters that had been received on the stalled connection.
   * @return the character count, or -1 if no response was received
   */
  public long getCharsReceived() {
    return charsReceived;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    StreamStalledException that = (StreamStalledException) o;
    return timeoutMillis == that.timeoutMillis && charsReceived == that.charsReceived;
  }

  @Override
  public int hashCode() {
    return Objects.hash(timeoutMillis, charsReceived);
  }
}
