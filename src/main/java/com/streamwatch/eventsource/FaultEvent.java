package com.streamwatch.eventsource;

import java.util.Objects;

/**
 * Describes a failure in the stream.
 * <p>
 * This event, with the type "error", is delivered when an active connection or a
 * connection attempt has ended for any reason other than {@link EventSource#close()}.
 * By the time listeners see it, EventSource is already waiting to reconnect; see
 * {@link EventSource#getRetryDelayMillis()}.
 *
 * @see ConnectionEvent
 */
public final class FaultEvent implements StreamEvent {
  /**
   * The type of all fault events.
   */
  public static final String TYPE = "error";

  private final StreamException cause;

  /**
   * Creates an instance.
   *
   * @param cause the cause of the failure
   */
  public FaultEvent(StreamException cause) {
    this.cause = cause;
  }

  @Override
  public String getType() {
    return TYPE;
  }

  /**
   * Returns a {@link StreamException} describing the cause of the failure.
   *
   * @return the cause of the failure
   */
  public StreamException getCause() {
    return cause;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    FaultEvent that = (FaultEvent) o;
    return Objects.equals(cause, that.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cause);
  }

  @Override
  public String toString() {
    return "FaultEvent(" + cause + ")";
  }
}
