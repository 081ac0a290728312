package com.streamwatch.eventsource;

import java.util.Objects;

import okhttp3.Headers;

/**
 * Describes the response that started a connection attempt.
 * <p>
 * An event with the type "open" is delivered when the server accepted the stream. An
 * event with the type "error" is delivered when the server answered with a status other
 * than 200 or with a content type other than {@code text/event-stream}; in that case
 * EventSource has already dropped the response and scheduled a reconnect, and
 * {@link #getCause()} says what was wrong with it.
 *
 * @see FaultEvent
 */
public final class ConnectionEvent implements StreamEvent {
  /**
   * The type of the event delivered when a stream has been opened.
   */
  public static final String OPEN = "open";
  /**
   * The type of the event delivered for a response that could not be used as a stream.
   */
  public static final String ERROR = "error";

  private final String type;
  private final int status;
  private final String statusText;
  private final Headers headers;
  private final UnsuccessfulResponseException cause;

  /**
   * Creates an instance with no cause.
   *
   * @param type {@link #OPEN} or {@link #ERROR}
   * @param status the HTTP status code
   * @param statusText the HTTP status message; null is changed to an empty string
   * @param headers the response headers; null is changed to an empty set
   */
  public ConnectionEvent(String type, int status, String statusText, Headers headers) {
    this(type, status, statusText, headers, null);
  }

  /**
   * Creates an instance.
   *
   * @param type {@link #OPEN} or {@link #ERROR}
   * @param status the HTTP status code
   * @param statusText the HTTP status message; null is changed to an empty string
   * @param headers the response headers; null is changed to an empty set
   * @param cause the reason the response was rejected, or null
   */
  public ConnectionEvent(String type, int status, String statusText, Headers headers,
      UnsuccessfulResponseException cause) {
    this.type = type;
    this.status = status;
    this.statusText = statusText == null ? "" : statusText;
    this.headers = headers == null ? Headers.of() : headers;
    this.cause = cause;
  }

  @Override
  public String getType() {
    return type;
  }

  /**
   * Returns the HTTP status code of the response.
   *
   * @return the status code
   */
  public int getStatus() {
    return status;
  }

  /**
   * Returns the HTTP status message of the response.
   *
   * @return the status message, or an empty string
   */
  public String getStatusText() {
    return statusText;
  }

  /**
   * Returns the response headers, in the order the server sent them.
   *
   * @return the headers
   */
  public Headers getHeaders() {
    return headers;
  }

  /**
   * Returns the reason the response was rejected. This is always null for an "open" event.
   *
   * @return the cause, or null
   */
  public UnsuccessfulResponseException getCause() {
    return cause;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ConnectionEvent that = (ConnectionEvent) o;
    return status == that.status &&
        Objects.equals(type, that.type) &&
        Objects.equals(statusText, that.statusText) &&
        Objects.equals(headers, that.headers) &&
        Objects.equals(cause, that.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, status, statusText, headers, cause);
  }

  @Override
  public String toString() {
    return "ConnectionEvent(" + type + "," + status + " " + statusText +
        (cause == null ? "" : "," + cause.getMessage()) + ")";
  }
}
