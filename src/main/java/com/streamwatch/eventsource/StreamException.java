package com.streamwatch.eventsource;

import java.util.Objects;

/**
 * Base class for all stream failures that {@link EventSource} reports through a
 * {@link FaultEvent}.
 * <p>
 * None of these are fatal: EventSource always schedules another connection attempt
 * after reporting one, until {@link EventSource#close()} is called.
 */
@SuppressWarnings("serial")
public class StreamException extends Exception {
  /**
   * Base class constructor.
   * @param message the failure message
   */
  protected StreamException(String message) {
    super(message);
  }

  /**
   * Base class constructor.
   * @param cause a wrapped exception
   */
  protected StreamException(Throwable cause) {
    super(cause);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    StreamException that = (StreamException) o;
    return Objects.equals(getMessage(), that.getMessage()) &&
        Objects.equals(getCause(), that.getCause());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getMessage(), getCause());
  }
}
