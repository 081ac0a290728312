package com.streamwatch.eventsource;

import org.junit.Assert;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import okhttp3.Headers;

/**
 * A {@link TransportListener} that queues everything it receives, for tests that use a
 * {@link ConnectStrategy.Client} without EventSource.
 */
@SuppressWarnings("javadoc")
public class RecordingTransportListener implements TransportListener {
  private final BlockingQueue<Object> items = new LinkedBlockingQueue<>();

  public static final class Start {
    public final int status;
    public final String statusText;
    public final String contentType;
    public final Headers headers;

    Start(int status, String statusText, String contentType, Headers headers) {
      this.status = status;
      this.statusText = statusText;
      this.contentType = contentType;
      this.headers = headers;
    }
  }

  public static final class Finish {
    public final Throwable error;

    Finish(Throwable error) {
      this.error = error;
    }
  }

  @Override
  public void onStart(int status, String statusText, String contentType, Headers headers) {
    items.add(new Start(status, statusText, contentType, headers));
  }

  @Override
  public void onChunk(String text) {
    items.add(text);
  }

  @Override
  public void onFinish(Throwable error) {
    items.add(new Finish(error));
  }

  private Object next() {
    try {
      Object item = items.poll(5, TimeUnit.SECONDS);
      if (item == null) {
        Assert.fail("timed out waiting for transport callback");
      }
      return item;
    } catch (InterruptedException e) {
      throw new RuntimeException(e);
    }
  }

  public Start expectStart() {
    Object item = next();
    if (!(item instanceof Start)) {
      Assert.fail("expected start, got " + item);
    }
    return (Start)item;
  }

  /**
   * Reads chunks until their concatenation has the given length, and returns it.
   */
  public String expectText(int length) {
    StringBuilder sb = new StringBuilder();
    while (sb.length() < length) {
      Object item = next();
      if (!(item instanceof String)) {
        Assert.fail("expected text, got " + item + " after \"" + sb + "\"");
      }
      sb.append((String)item);
    }
    return sb.toString();
  }

  /**
   * Skips any text and returns the finish callback.
   */
  public Finish expectFinish() {
    while (true) {
      Object item = next();
      if (item instanceof Finish) {
        return (Finish)item;
      }
      if (item instanceof Start) {
        Assert.fail("unexpected second start");
      }
    }
  }
}
