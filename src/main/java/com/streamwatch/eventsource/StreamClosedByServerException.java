package com.streamwatch.eventsource;

/**
 * An exception indicating that the stream ended because the server closed the
 * response normally, without a network error.
 * <p>
 * See {@link StreamException} for more about EventSource's error behavior.
 */
@SuppressWarnings("serial")
public class StreamClosedByServerException extends StreamException {
  /**
   * Constructs an instance.
   */
  public StreamClosedByServerException() {
    super("Stream closed by server");
  }

  @Override
  public boolean equals(Object o) {
    return o != null && getClass() == o.getClass();
  }

  @Override
  public int hashCode() {
    return 0;
  }
}
