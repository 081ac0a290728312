package com.streamwatch.eventsource;

import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.Proxy.Type;
import java.net.URI;
import java.util.concurrent.TimeUnit;

import static com.streamwatch.eventsource.Helpers.UTF8;
import static com.streamwatch.eventsource.Helpers.timeUnitOrDefault;

import okhttp3.Authenticator;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.ConnectionPool;
import okhttp3.CookieJar;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * The OkHttp transport, and the place to configure it.
 * <p>
 * {@link EventSource.Builder#Builder(URI)} uses this with default settings. For anything
 * else, start from {@link ConnectStrategy#http(URI)} and chain the options below. Each
 * option returns a new instance, so a strategy can be shared between EventSources.
 * <pre><code>
 *   EventSource es = new EventSource.Builder(
 *     ConnectStrategy.http(myStreamUri)
 *       .connectTimeout(3, TimeUnit.SECONDS)
 *     )
 *     .header("Authorization", "xyz")
 *     .build();
 * </code></pre>
 * <p>
 * Each connection attempt is one asynchronous GET. The response body is decoded as
 * UTF-8 on an OkHttp dispatcher thread and handed to the EventSource a piece at a time.
 * Request headers belong to {@link EventSource.Builder}, not to this class.
 */
public class HttpConnectStrategy extends ConnectStrategy {
  /**
   * The default value for {@link #connectTimeout(long, TimeUnit)}: 10 seconds.
   */
  public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 10000;
  /**
   * The default value for {@link #writeTimeout(long, TimeUnit)}: 5 seconds.
   */
  public static final long DEFAULT_WRITE_TIMEOUT_MILLIS = 5000;
  /**
   * The default value for {@link #readTimeout(long, TimeUnit)}: zero, meaning no read
   * timeout. EventSource's heartbeat timeout already detects a stream that has stopped
   * sending data.
   */
  public static final long DEFAULT_READ_TIMEOUT_MILLIS = 0;
  /**
   * The default value for {@link #readBufferSize(int)}, in characters.
   */
  public static final int DEFAULT_READ_BUFFER_SIZE = 1000;

  private static final Headers DEFAULT_HEADERS = new Headers.Builder()
      .add("Accept", "text/event-stream")
      .add("Cache-Control", "no-cache")
      .build();

  final URI uri; // package-private visibility for tests
  private final ClientConfigurer clientConfigurer;
  private final OkHttpClient httpClient;
  private final RequestTransformer requestTransformer;
  private final CookieJar cookieJar;
  private final int readBufferSize;

  /**
   * A configuration step for {@link #clientBuilderActions(ClientConfigurer)}.
   */
  public static interface ClientConfigurer {
    /**
     * Applies settings to the OkHttp builder before the client is built.
     * @param builder the client builder
     */
    public void configure(OkHttpClient.Builder builder);
  }

  /**
   * A request rewriting step for {@link #requestTransformer(RequestTransformer)}.
   */
  public static interface RequestTransformer {
    /**
     * Returns the request to send in place of {@code input}, which may be {@code input}
     * itself.
     * @param input the request built so far
     * @return the request to send
     */
    public Request transformRequest(Request input);
  }

  HttpConnectStrategy(URI uri) {
    this(uri, null, null, null, null, DEFAULT_READ_BUFFER_SIZE);
  }

  private HttpConnectStrategy(
      URI uri,
      ClientConfigurer clientConfigurer,
      OkHttpClient httpClient,
      RequestTransformer requestTransformer,
      CookieJar cookieJar,
      int readBufferSize
      ) {
    if (uri == null) {
      throw new IllegalArgumentException("URI must not be null");
    }
    if (uri.getScheme() == null ||
        (!uri.getScheme().equalsIgnoreCase("http") && !uri.getScheme().equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("URI scheme must be http or https");
    }
    this.uri = uri;
    this.clientConfigurer = clientConfigurer;
    this.httpClient = httpClient;
    this.requestTransformer = requestTransformer;
    this.cookieJar = cookieJar;
    this.readBufferSize = readBufferSize;
  }

  @Override
  public Client createClient(LDLogger logger) {
    return new Client(logger);
  }

  // Client settings and request rewrites accumulate; later steps run after earlier ones.
  private HttpConnectStrategy addClientConfigurerAction(final ClientConfigurer next) {
    if (next == null) {
      return this;
    }
    final ClientConfigurer previous = clientConfigurer;
    ClientConfigurer combined = previous == null ? next : builder -> {
      previous.configure(builder);
      next.configure(builder);
    };
    return new HttpConnectStrategy(uri, combined, httpClient, requestTransformer,
        cookieJar, readBufferSize);
  }

  private HttpConnectStrategy addRequestTransformerAction(final RequestTransformer next) {
    if (next == null) {
      return this;
    }
    final RequestTransformer previous = requestTransformer;
    RequestTransformer combined = previous == null ? next :
      request -> next.transformRequest(previous.transformRequest(request));
    return new HttpConnectStrategy(uri, clientConfigurer, httpClient, combined,
        cookieJar, readBufferSize);
  }

  /**
   * Adds an arbitrary step to the building of the OkHttp client, for settings that have
   * no option of their own here.
   * <p>
   * Steps run once, when the EventSource is built, in the order they were added. The
   * timeout and proxy options are steps too, so they interleave with these in call order.
   * Steps are skipped entirely when {@link #httpClient(OkHttpClient)} is set.
   * <pre><code>
   *   EventSource es = new EventSource.Builder(
   *     ConnectStrategy.http(myStreamUri).clientBuilderActions(clientBuilder -&gt; {
   *       clientBuilder.sslSocketFactory(mySocketFactory, myTrustManager);
   *     });
   * </code></pre>
   *
   * @param configurer the step; null is ignored
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy clientBuilderActions(ClientConfigurer configurer) {
    return addClientConfigurerAction(configurer);
  }

  /**
   * Sets how long to wait for the TCP and TLS handshake of each attempt. A timeout is
   * reported to listeners as a {@link StreamIOException} and retried with backoff.
   *
   * @param connectTimeout the connection timeout, in whatever time unit is specified by
   *   {@code timeUnit}
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return a new HttpConnectStrategy instance with this property modified
   * @see #DEFAULT_CONNECT_TIMEOUT_MILLIS
   */
  public HttpConnectStrategy connectTimeout(final long connectTimeout, final TimeUnit timeUnit) {
    return addClientConfigurerAction(builder ->
      builder.connectTimeout(connectTimeout, timeUnitOrDefault(timeUnit)));
  }

  /**
   * Specifies the cookie jar that is used when {@link EventSource.Builder#withCredentials(boolean)}
   * is true. When it is false, no cookies are sent or stored regardless of this setting.
   *
   * @param cookieJar the cookie jar, or null for OkHttp's default (no cookies)
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy cookieJar(CookieJar cookieJar) {
    return new HttpConnectStrategy(uri, clientConfigurer, httpClient, requestTransformer,
        cookieJar, readBufferSize);
  }

  /**
   * Uses an existing OkHttp client instead of building one.
   * <p>
   * The client is used as it is: the timeout, proxy, cookie jar and
   * {@link #clientBuilderActions(ClientConfigurer)} options have no effect. The
   * EventSource never shuts it down, and {@link EventSource#awaitClosed(long, TimeUnit)}
   * does not wait for it.
   *
   * @param httpClient the client, or null to build one from the other options
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy httpClient(OkHttpClient httpClient) {
    return new HttpConnectStrategy(uri, clientConfigurer, httpClient, requestTransformer,
        cookieJar, readBufferSize);
  }

  /**
   * Sends every connection attempt through a proxy.
   *
   * @param proxy the proxy
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy proxy(final Proxy proxy) {
    return addClientConfigurerAction(builder -> builder.proxy(proxy));
  }

  /**
   * Sends every connection attempt through an HTTP proxy at the given address.
   *
   * @param proxyHost the proxy hostname
   * @param proxyPort the proxy port
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy proxy(String proxyHost, int proxyPort) {
    return proxy(new Proxy(Type.HTTP, new InetSocketAddress(proxyHost, proxyPort)));
  }

  /**
   * Answers proxy authentication challenges.
   *
   * @param proxyAuthenticator the authenticator
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy proxyAuthenticator(final Authenticator proxyAuthenticator) {
    return addClientConfigurerAction(builder -> builder.proxyAuthenticator(proxyAuthenticator));
  }

  /**
   * Specifies how many characters are read from the response body at a time. Each read
   * is delivered to the parser as soon as it completes, so this is an upper bound, not a
   * fixed chunk size.
   * <p>
   * Reads are queued for the EventSource's event loop. When listeners are slower than the
   * server, the reading thread waits once a fixed number of reads are queued, so the
   * memory held for one stream is bounded by a multiple of this size.
   *
   * @param readBufferSize the buffer size; values less than 1 are replaced by the default
   * @return a new HttpConnectStrategy instance with this property modified
   * @see #DEFAULT_READ_BUFFER_SIZE
   */
  public HttpConnectStrategy readBufferSize(int readBufferSize) {
    return new HttpConnectStrategy(uri, clientConfigurer, httpClient, requestTransformer,
        cookieJar, readBufferSize < 1 ? DEFAULT_READ_BUFFER_SIZE : readBufferSize);
  }

  /**
   * Sets the OkHttp read timeout, which is off by default. The heartbeat timeout of
   * {@link EventSource.Builder#heartbeatTimeout(long, TimeUnit)} is the usual way to
   * detect a silent stream; if this fires first, listeners get a
   * {@link StreamIOException} instead of a {@link StreamStalledException}.
   *
   * @param readTimeout the read timeout, in whatever time unit is specified by {@code timeUnit}
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return a new HttpConnectStrategy instance with this property modified
   * @see #DEFAULT_READ_TIMEOUT_MILLIS
   */
  public HttpConnectStrategy readTimeout(final long readTimeout, final TimeUnit timeUnit) {
    return addClientConfigurerAction(builder ->
      builder.readTimeout(readTimeout, timeUnitOrDefault(timeUnit)));
  }

  /**
   * Adds a step that can rewrite each request just before it is sent.
   * <p>
   * Steps run in the order they were added, on a request that already has the default
   * headers, the headers from {@link EventSource.Builder#headers(Headers)} and the
   * {@code lastEventId} query parameter.
   *
   * @param requestTransformer the step; null is ignored
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy requestTransformer(RequestTransformer requestTransformer) {
    return addRequestTransformerAction(requestTransformer);
  }

  /**
   * Sets how long sending the request may take.
   *
   * @param writeTimeout the write timeout, in whatever time unit is specified by {@code timeUnit}
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return a new HttpConnectStrategy instance with this property modified
   * @see #DEFAULT_WRITE_TIMEOUT_MILLIS
   */
  public HttpConnectStrategy writeTimeout(final long writeTimeout, final TimeUnit timeUnit) {
    return addClientConfigurerAction(builder ->
      builder.writeTimeout(writeTimeout, timeUnitOrDefault(timeUnit)));
  }

  class Client extends ConnectStrategy.Client { // package-private visibility for tests
    final OkHttpClient httpClient; // package-private visibility for tests
    final OkHttpClient anonymousHttpClient; // used when withCredentials is false
    private final LDLogger logger;

    // Options are read through HttpConnectStrategy.this, which is immutable.

    Client(LDLogger logger) {
      this.logger = logger;
      this.httpClient = createHttpClient();
      // newBuilder() shares the connection pool and dispatcher of the original client
      this.anonymousHttpClient = httpClient.newBuilder().cookieJar(CookieJar.NO_COOKIES).build();
    }

    @Override
    public Closeable open(URI url, boolean withCredentials, Headers headers,
        TransportListener listener) {
      Request request = createRequest(url, headers);
      Call call = (withCredentials ? httpClient : anonymousHttpClient).newCall(request);
      call.enqueue(new StreamingCallback(listener, readBufferSize, logger));
      return new RequestCloser(call);
    }

    @Override
    public void close() {
      // We need to shut down the HTTP client *if* it is one that we created, and not
      // one that the application provided to us.
      if (HttpConnectStrategy.this.httpClient == null) {
        httpClient.connectionPool().evictAll();
        httpClient.dispatcher().cancelAll();
        httpClient.dispatcher().executorService().shutdown();
      }
    }

    @Override
    public boolean awaitClosed(long timeoutMillis) throws InterruptedException {
      if (HttpConnectStrategy.this.httpClient != null) {
        return true;
      }
      return httpClient.dispatcher().executorService()
          .awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public URI getOrigin() {
      return uri;
    }

    private OkHttpClient createHttpClient() {
      if (HttpConnectStrategy.this.httpClient != null) {
        // We're configured to use a specific pre-existing client instance
        return HttpConnectStrategy.this.httpClient;
      }

      OkHttpClient.Builder builder = new OkHttpClient.Builder()
          .connectionPool(new ConnectionPool(1, 1, TimeUnit.SECONDS))
          .connectTimeout(DEFAULT_CONNECT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .readTimeout(DEFAULT_READ_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .writeTimeout(DEFAULT_WRITE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .retryOnConnectionFailure(false);
      if (cookieJar != null) {
        builder.cookieJar(cookieJar);
      }
      if (clientConfigurer != null) {
        clientConfigurer.configure(builder);
      }
      return builder.build();
    }

    private Request createRequest(URI url, Headers headers) {
      Request.Builder builder = new Request.Builder()
          .url(HttpUrl.get(url))
          .headers(DEFAULT_HEADERS);
      if (headers != null) {
        for (String name: headers.names()) {
          // Remove any previous default header with the same name
          builder.removeHeader(name);
          for (String value: headers.values(name)) {
            builder.addHeader(name, value);
          }
        }
      }
      return requestTransformer == null ? builder.build() :
        requestTransformer.transformRequest(builder.build());
    }
  }

  /**
   * Reads the response body on OkHttp's dispatcher thread and reports it to the
   * {@link TransportListener}.
   */
  private static final class StreamingCallback implements Callback {
    private final TransportListener listener;
    private final int readBufferSize;
    private final LDLogger logger;

    StreamingCallback(TransportListener listener, int readBufferSize, LDLogger logger) {
      this.listener = listener;
      this.readBufferSize = readBufferSize;
      this.logger = logger;
    }

    @Override
    public void onFailure(Call call, IOException e) {
      listener.onFinish(call.isCanceled() ? null : e);
    }

    @Override
    public void onResponse(Call call, Response response) {
      IOException error = null;
      try (Response r = response) {
        listener.onStart(r.code(), r.message(), r.header("Content-Type"), r.headers());
        ResponseBody body = r.body();
        if (body != null) {
          // InputStreamReader holds back an incomplete multi-byte sequence until the rest
          // of it has been read
          Reader reader = new InputStreamReader(body.byteStream(), UTF8);
          char[] buffer = new char[readBufferSize];
          int n;
          while ((n = reader.read(buffer)) != -1) {
            if (n > 0) {
              listener.onChunk(new String(buffer, 0, n));
            }
          }
        }
      } catch (IOException e) {
        error = e;
      }
      if (call.isCanceled()) {
        logger.debug("Stream request was cancelled");
        error = null;
      }
      listener.onFinish(error);
    }
  }

  private static class RequestCloser implements Closeable {
    private final Call call;

    RequestCloser(Call call) {
      this.call = call;
    }

    @Override
    public void close() {
      // EventSource calls this if it is deliberately stopping the stream.
      call.cancel();
    }
  }
}
