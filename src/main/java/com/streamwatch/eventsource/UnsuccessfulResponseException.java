package com.streamwatch.eventsource;

import java.util.Objects;

import okhttp3.Headers;

import static com.streamwatch.eventsource.Helpers.collapseWhitespace;

/**
 * Exception class that means the server answered a connection attempt with something
 * that is not an event stream: a status other than 200, or a {@code Content-Type} other
 * than {@code text/event-stream}.
 * <p>
 * EventSource logs this and delivers it as the {@link ConnectionEvent#getCause() cause}
 * of a {@link ConnectionEvent} of type "error", then retries as it does for any other
 * failure.
 */
@SuppressWarnings("serial")
public class UnsuccessfulResponseException extends StreamException {
  private final int status;
  private final String statusText;
  private final String contentType;
  private final Headers headers;

  /**
   * Constructs an instance.
   *
   * @param status the HTTP status code
   * @param statusText the HTTP status message, or null
   * @param contentType the value of the {@code Content-Type} header, or null
   * @param headers the response headers, or null
   */
  public UnsuccessfulResponseException(int status, String statusText, String contentType, Headers headers) {
    super(describe(status, statusText, contentType));
    this.status = status;
    this.statusText = statusText == null ? "" : statusText;
    this.contentType = contentType;
    this.headers = headers == null ? Headers.of() : headers;
  }

  /**
   * Returns the HTTP status code.
   * @return the status code
   */
  public int getStatus() {
    return status;
  }

  /**
   * Returns the HTTP status message.
   * @return the status message, or an empty string
   */
  public String getStatusText() {
    return statusText;
  }

  /**
   * Returns the value of the {@code Content-Type} response header.
   * @return the content type, or null if there was none
   */
  public String getContentType() {
    return contentType;
  }

  /**
   * Returns the response headers.
   * @return the headers
   */
  public Headers getHeaders() {
    return headers;
  }

  private static String describe(int status, String statusText, String contentType) {
    if (status != 200) {
      return "EventSource's response has a status " + status + " " +
          collapseWhitespace(statusText == null ? "" : statusText) +
          " that is not 200. Aborting the connection.";
    }
    return "EventSource's response has a Content-Type specifying an unsupported type: " +
        (contentType == null ? "-" : collapseWhitespace(contentType)) +
        ". Aborting the connection.";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    UnsuccessfulResponseException that = (UnsuccessfulResponseException) o;
    return status == that.status &&
        Objects.equals(statusText, that.statusText) &&
        Objects.equals(contentType, that.contentType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, statusText, contentType);
  }
}
