package com.streamwatch.eventsource;

import com.launchdarkly.logging.LDLogger;

import java.net.URI;
import java.util.regex.Pattern;

import static com.streamwatch.eventsource.Helpers.MAXIMUM_DURATION_MILLIS;
import static com.streamwatch.eventsource.Helpers.clampDuration;

/**
 * All of the SSE parsing logic is implemented in this class.
 * <p>
 * EventSource creates a new FrameParser for every connection attempt. Each time the
 * transport delivers a piece of text, EventSource passes it to {@link #feed(String)} and
 * then calls {@link #nextEvent()} until it returns null. Text can be split anywhere,
 * including in the middle of a field name or between the two characters of a CRLF; the
 * events produced are the same as if the whole stream had been fed at once.
 * <p>
 * Only the part of the input up to the last line terminator is scanned. Anything after
 * that is held back until a later feed supplies its terminator, so a line is always
 * scanned in one piece and the field offsets below never span two pieces of input.
 * <p>
 * FrameParser should never be accessed by any thread other than the EventSource's event
 * loop.
 */
final class FrameParser {
  private static final String DATA = "data";
  private static final String EVENT = "event";
  private static final String ID = "id";
  private static final String RETRY = "retry";
  private static final String HEARTBEAT_TIMEOUT = "heartbeatTimeout";

  private static final Pattern DIGITS_ONLY = Pattern.compile("^[\\d]+$");
  private static final int MAX_DURATION_DIGITS = 18; // anything longer can't fit in a long

  private enum LineState {
    AFTER_CR, // swallows the '\n' of a CRLF
    FIELD_START,
    FIELD,
    VALUE_START,
    VALUE
  }

  private final URI origin;
  private final LDLogger logger;

  private final StringBuilder textBuffer = new StringBuilder(); // input after the last line terminator
  private String chunk = "";  // complete lines that are ready to be scanned
  private int position;       // next character of chunk to scan
  private LineState state = LineState.FIELD_START;
  private int fieldStart;
  private int valueStart;

  private final StringBuilder dataBuffer = new StringBuilder(); // each data line is preceded by '\n'
  private String eventTypeBuffer = "";
  private String lastEventIdBuffer;

  FrameParser(String lastEventId, URI origin, LDLogger logger) {
    this.lastEventIdBuffer = lastEventId == null ? "" : lastEventId;
    this.origin = origin;
    this.logger = logger;
  }

  /**
   * Adds text from the stream.
   *
   * @param text the decoded text, in any size
   */
  void feed(String text) {
    int n = Math.max(text.lastIndexOf('\n'), text.lastIndexOf('\r'));
    if (n == -1) {
      textBuffer.append(text);
      return;
    }
    String ready = textBuffer.append(text, 0, n + 1).toString();
    textBuffer.setLength(0);
    textBuffer.append(text, n + 1, text.length());
    if (position < chunk.length()) {
      // The caller stopped reading before the end of the previous input; keep the unread
      // part so that no events are lost.
      chunk = chunk + ready;
    } else {
      chunk = ready;
      position = 0;
    }
  }

  /**
   * Scans already-fed text until it produces something that EventSource must act on.
   * <p>
   * The return value is a {@link MessageEvent} for each dispatched record, a
   * {@link SetRetryDelayEvent} for a valid {@code retry:} line, or a
   * {@link SetHeartbeatTimeoutEvent} for a valid {@code heartbeatTimeout:} line. They are
   * returned in stream order, so a control field takes effect before any record that
   * follows it.
   *
   * @return the next event, or null if more input is needed
   */
  StreamEvent nextEvent() {
    while (position < chunk.length()) {
      int p = position++;
      char c = chunk.charAt(p);
      if (state == LineState.AFTER_CR && c == '\n') {
        state = LineState.FIELD_START;
        continue;
      }
      if (state == LineState.AFTER_CR) {
        state = LineState.FIELD_START;
      }
      if (c == '\r' || c == '\n') {
        StreamEvent event;
        if (state == LineState.FIELD_START) {
          event = dispatch(); // blank line
        } else {
          if (state == LineState.FIELD) {
            valueStart = p + 1; // no colon: the whole line is the field name
          }
          String field = chunk.substring(fieldStart, valueStart - 1);
          int start = valueStart < p && chunk.charAt(valueStart) == ' ' ? valueStart + 1 : valueStart;
          String value = start < p ? chunk.substring(start, p) : "";
          event = applyField(field, value);
        }
        state = c == '\r' ? LineState.AFTER_CR : LineState.FIELD_START;
        if (event != null) {
          return event;
        }
      } else {
        if (state == LineState.FIELD_START) {
          fieldStart = p;
          state = LineState.FIELD;
        }
        if (state == LineState.FIELD) {
          if (c == ':') {
            valueStart = p + 1;
            state = LineState.VALUE_START;
          }
        } else if (state == LineState.VALUE_START) {
          state = LineState.VALUE;
        }
      }
    }
    chunk = "";
    position = 0;
    return null;
  }

  private StreamEvent applyField(String field, String value) {
    switch (field) {
    case DATA:
      dataBuffer.append('\n').append(value);
      break;
    case ID:
      lastEventIdBuffer = value;
      break;
    case EVENT:
      eventTypeBuffer = value;
      break;
    case RETRY:
      long retry = parseDuration(value);
      if (retry > 0) {
        return new SetRetryDelayEvent(retry);
      }
      logger.debug("Ignoring invalid retry value: {}", value);
      break;
    case HEARTBEAT_TIMEOUT:
      long timeout = parseDuration(value);
      if (timeout > 0) {
        return new SetHeartbeatTimeoutEvent(timeout);
      }
      logger.debug("Ignoring invalid heartbeatTimeout value: {}", value);
      break;
    default:
      // For an unrecognized field name, including a comment line, we do nothing.
    }
    return null;
  }

  private MessageEvent dispatch() {
    MessageEvent message = null;
    if (dataBuffer.length() != 0) {
      message = new MessageEvent(
          eventTypeBuffer.isEmpty() ? MessageEvent.DEFAULT_EVENT_TYPE : eventTypeBuffer,
          dataBuffer.substring(1),
          lastEventIdBuffer,
          origin
          );
      dataBuffer.setLength(0);
      logger.debug("Received message: {}", message);
    }
    eventTypeBuffer = "";
    return message;
  }

  // Returns the clamped duration, or -1 if the value is not a positive integer.
  private static long parseDuration(String value) {
    if (!DIGITS_ONLY.matcher(value).matches()) {
      return -1;
    }
    String digits = value.replaceFirst("^0+(?=.)", "");
    if (digits.length() > MAX_DURATION_DIGITS) {
      return MAXIMUM_DURATION_MILLIS;
    }
    long n = Long.parseLong(digits);
    return n == 0 ? -1 : clampDuration(n);
  }
}
