package com.streamwatch.eventsource;

import java.net.URI;
import java.util.Objects;

/**
 * An event record that was framed from the stream and delivered to listeners.
 * <p>
 * A record is produced each time the stream contains a blank line after at least one
 * {@code data:} field.
 */
public final class MessageEvent implements StreamEvent {
  /**
   * The default value of {@link #getType()} for all SSE messages that did not have an {@code event}
   * field. This constant is defined in the SSE specification.
   */
  public static final String DEFAULT_EVENT_TYPE = "message";

  private final String type;
  private final String data;
  private final String lastEventId;
  private final URI origin;

  /**
   * Simple constructor with event data only, using the default event type.
   *
   * @param data the event data; if null, will be changed to an empty string
   */
  public MessageEvent(String data) {
    this(null, data, null, null);
  }

  /**
   * Constructs a new instance.
   *
   * @param type the event type; if null or empty, {@link #DEFAULT_EVENT_TYPE} is used
   * @param data the event data; if null, will be changed to an empty string
   * @param lastEventId the event ID; if null, will be changed to an empty string
   * @param origin the stream endpoint
   */
  public MessageEvent(String type, String data, String lastEventId, URI origin) {
    this.type = type == null || type.isEmpty() ? DEFAULT_EVENT_TYPE : type;
    this.data = data == null ? "" : data;
    this.lastEventId = lastEventId == null ? "" : lastEventId;
    this.origin = origin;
  }

  /**
   * Returns the event type, from the {@code event:} field, or {@link #DEFAULT_EVENT_TYPE}.
   *
   * @return the event type
   */
  @Override
  public String getType() {
    return type;
  }

  /**
   * Returns the event data. Multiple {@code data:} lines are joined with a newline.
   *
   * @return the data string (never null)
   */
  public String getData() {
    return data;
  }

  /**
   * Returns the event ID that was in effect when this record was framed: either the
   * value of the record's own {@code id:} field, or the last ID seen on the stream.
   *
   * @return the event ID, or an empty string if none has been seen
   */
  public String getLastEventId() {
    return lastEventId;
  }

  /**
   * Returns the URI of the stream that this event came from.
   *
   * @return the stream URI
   */
  public URI getOrigin() {
    return origin;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    MessageEvent that = (MessageEvent) o;
    return Objects.equals(type, that.type) &&
        Objects.equals(data, that.data) &&
        Objects.equals(lastEventId, that.lastEventId) &&
        Objects.equals(origin, that.origin);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, data, lastEventId, origin);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("MessageEvent(type=")
        .append(type)
        .append(",data=")
        .append(data);
    if (!lastEventId.isEmpty()) {
      sb.append(",id=").append(lastEventId);
    }
    sb.append(",origin=").append(origin).append(')');
    return sb.toString();
  }
}
