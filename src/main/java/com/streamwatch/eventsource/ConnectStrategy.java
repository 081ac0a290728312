package com.streamwatch.eventsource;

import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

import okhttp3.Headers;
import okhttp3.HttpUrl;

/**
 * Supplies the transport that {@link EventSource} reads a stream from.
 * <p>
 * {@link #http(URI)} returns the OkHttp implementation, {@link HttpConnectStrategy},
 * whose options are set by chaining:
 * <pre><code>
 *     EventSource.Builder builder = new EventSource.Builder(
 *       ConnectStrategy.http(myStreamUri)
 *         .connectTimeout(10, TimeUnit.SECONDS)
 *     );
 * </code></pre>
 * <p>
 * Another transport, such as one that replays a recorded stream, can be plugged in by
 * subclassing. A strategy holds configuration only; everything that belongs to one
 * EventSource lives in the {@link ConnectStrategy.Client} it creates.
 */
public abstract class ConnectStrategy {
  /**
   * Creates the client for one EventSource. It is called once, when the EventSource is
   * built, and the client is used for every attempt after that.
   *
   * @param logger the logger belonging to EventSource
   * @return a {@link Client} instance
   */
  public abstract Client createClient(LDLogger logger);

  /**
   * The transport state of one EventSource: for HTTP, a configured OkHttp client.
   * <p>
   * {@link #open} is called from the EventSource's event loop and must not block it.
   * {@link #close()} is called once, from {@link EventSource#close()}, after the active
   * attempt has been cancelled.
   */
  public static abstract class Client implements Closeable {
    /**
     * Starts a connection attempt and returns without waiting for it.
     * <p>
     * The client reports the progress of the attempt to {@code listener}, following the
     * contract described in {@link TransportListener}. When EventSource no longer wants
     * the attempt, it closes the returned handle; the client must then stop the attempt
     * and report {@link TransportListener#onFinish(Throwable)} with a null error, unless
     * it has already finished. Closing the handle more than once, or after the attempt
     * has finished, must be harmless.
     *
     * @param url the request URL, which already carries the {@code lastEventId} query
     *   parameter if there is one
     * @param withCredentials true if cookies and other credentials should be sent
     * @param headers additional request headers; these replace any default headers of
     *   the same name
     * @param listener receives the response
     * @return a handle for cancelling the attempt
     */
    public abstract Closeable open(URI url, boolean withCredentials, Headers headers,
        TransportListener listener);

    /**
     * Implements {@link EventSource#awaitClosed(long, java.util.concurrent.TimeUnit)}.
     *
     * @param timeoutMillis maximum amount of time to wait
     * @return true if all requests are now closed
     * @throws InterruptedException if the thread is interrupted
     */
    public abstract boolean awaitClosed(long timeoutMillis) throws InterruptedException;

    /**
     * Returns the base URI of the stream.
     * <p>
     * This value is returned by {@link EventSource#getUrl()}, is used as the origin of
     * every {@link MessageEvent}, and is the URI that {@code lastEventId} is added to.
     *
     * @return the stream URI
     */
    public abstract URI getOrigin();
  }

  /**
   * Returns the OkHttp transport for a stream URI, with default options.
   *
   * @param uri the stream URI
   * @return a configurable {@link HttpConnectStrategy}
   * @throws IllegalArgumentException if the argument is null, or if the scheme
   *   is not HTTP or HTTPS
   * @see #http(HttpUrl)
   */
  public static HttpConnectStrategy http(URI uri) {
    return new HttpConnectStrategy(uri);
  }

  /**
   * Same as {@link #http(URI)}, for a {@link URL}.
   *
   * @param url the stream URL
   * @return a configurable {@link HttpConnectStrategy}
   * @throws IllegalArgumentException if the argument is null, or if the scheme
   *   is not HTTP or HTTPS
   */
  public static HttpConnectStrategy http(URL url) {
    try {
      return new HttpConnectStrategy(url == null ? null : url.toURI());
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /**
   * Same as {@link #http(URI)}, for an OkHttp {@link HttpUrl}.
   *
   * @param url the stream URL
   * @return a configurable {@link HttpConnectStrategy}
   * @throws IllegalArgumentException if the argument is null, or if the scheme
   *   is not HTTP or HTTPS
   */
  public static HttpConnectStrategy http(HttpUrl url) {
    return new HttpConnectStrategy(url == null ? null : url.uri());
  }
}
