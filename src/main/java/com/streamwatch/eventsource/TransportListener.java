package com.streamwatch.eventsource;

import okhttp3.Headers;

/**
 * Receives the progress of one connection attempt from a {@link ConnectStrategy.Client}.
 * <p>
 * For each call to {@link ConnectStrategy.Client#open(java.net.URI, boolean, Headers, TransportListener)}
 * the client must call {@link #onStart(int, String, String, Headers)} at most once, then
 * {@link #onChunk(String)} any number of times, then {@link #onFinish(Throwable)} exactly
 * once. These methods may be called from any thread, but not concurrently.
 */
public interface TransportListener {
  /**
   * Called when the response status and headers have been received.
   *
   * @param status the HTTP status code
   * @param statusText the HTTP status message, or an empty string
   * @param contentType the {@code Content-Type} header, or null
   * @param headers all response headers
   */
  void onStart(int status, String statusText, String contentType, Headers headers);

  /**
   * Called with the next piece of the response body. The text must already be decoded;
   * an incomplete multi-byte sequence is held back until the rest of it arrives.
   *
   * @param text the decoded text
   */
  void onChunk(String text);

  /**
   * Called when the attempt is over.
   *
   * @param error the failure, or null if the response ended normally or the attempt was
   *   cancelled through the handle returned by {@code open}
   */
  void onFinish(Throwable error);
}
