package com.streamwatch.eventsource;

/**
 * Represents a "heartbeatTimeout:" line that was read from the stream. Like
 * {@link SetRetryDelayEvent}, it is applied by EventSource and never reaches listeners.
 */
final class SetHeartbeatTimeoutEvent implements StreamEvent {
  private final long timeoutMillis;

  SetHeartbeatTimeoutEvent(long timeoutMillis) {
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  public String getType() {
    return "heartbeatTimeout";
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SetHeartbeatTimeoutEvent that = (SetHeartbeatTimeoutEvent) o;
    return timeoutMillis == that.timeoutMillis;
  }

  @Override
  public int hashCode() {
    return (int)timeoutMillis;
  }

  @Override
  public String toString() {
    return "SetHeartbeatTimeoutEvent(" + timeoutMillis + ")";
  }
}
