package com.streamwatch.eventsource;

import com.streamwatch.eventsource.HttpConnectStrategy.ClientConfigurer;
import com.streamwatch.eventsource.HttpConnectStrategy.RequestTransformer;
import com.launchdarkly.testhelpers.httptest.Handler;
import com.launchdarkly.testhelpers.httptest.Handlers;
import com.launchdarkly.testhelpers.httptest.HttpServer;
import com.launchdarkly.testhelpers.httptest.RequestInfo;
import com.launchdarkly.testhelpers.tcptest.TcpHandlers;
import com.launchdarkly.testhelpers.tcptest.TcpServer;

import org.hamcrest.Matchers;
import org.junit.Rule;
import org.junit.Test;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.Proxy.Type;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;

import okhttp3.Authenticator;
import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.OkHttpClient.Builder;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;

/**
 * Tests of the client configuration and HTTP behavior of HttpConnectStrategy, using an
 * embedded HTTP server as a target, but without using EventSource.
 */
@SuppressWarnings("javadoc")
public class HttpConnectStrategyTest {
  private static final URI TEST_URI = URI.create("http://test/uri");

  @Rule public TestScopedLoggerRule testLogger = new TestScopedLoggerRule();

  @Test
  public void createWithUri() {
    assertThat(ConnectStrategy.http(TEST_URI).uri, equalTo(TEST_URI));
  }

  @Test
  public void createWithUrl() throws Exception {
    assertThat(ConnectStrategy.http(TEST_URI.toURL()).uri, equalTo(TEST_URI));
  }

  @Test
  public void createWithHttpUrl() {
    assertThat(ConnectStrategy.http(HttpUrl.get(TEST_URI)).uri, equalTo(TEST_URI));
  }

  @Test(expected = IllegalArgumentException.class)
  public void createWithInvalidUriScheme() {
    ConnectStrategy.http(URI.create("ftp://no"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void createWithNullUri() {
    ConnectStrategy.http((URI)null);
  }

  @Test
  public void originIsConfiguredUri() throws Exception {
    try (ConnectStrategy.Client client = baseHttp().createClient(testLogger.getLogger())) {
      assertThat(client.getOrigin(), equalTo(TEST_URI));
    }
  }

  @Test
  public void defaultClientProperties() throws Exception {
    OkHttpClient client = makeClientFrom(baseHttp());

    assertThat(client.connectTimeoutMillis(),
        equalTo((int)HttpConnectStrategy.DEFAULT_CONNECT_TIMEOUT_MILLIS));
    assertThat(client.readTimeoutMillis(),
        equalTo((int)HttpConnectStrategy.DEFAULT_READ_TIMEOUT_MILLIS));
    assertThat(client.writeTimeoutMillis(),
        equalTo((int)HttpConnectStrategy.DEFAULT_WRITE_TIMEOUT_MILLIS));
    assertThat(client.retryOnConnectionFailure(), is(false));
    assertThat(client.proxy(), nullValue());
  }

  @Test
  public void clientTimeouts() throws Exception {
    OkHttpClient client = makeClientFrom(baseHttp()
        .connectTimeout(100, TimeUnit.MILLISECONDS)
        .readTimeout(1, TimeUnit.SECONDS)
        .writeTimeout(10, null));

    assertThat(client.connectTimeoutMillis(), equalTo(100));
    assertThat(client.readTimeoutMillis(), equalTo(1000));
    assertThat(client.writeTimeoutMillis(), equalTo(10));
  }

  @Test
  public void clientProxy() throws Exception {
    Proxy proxy = new Proxy(Type.HTTP, new InetSocketAddress("http://proxy.example.com", 8080));
    OkHttpClient client = makeClientFrom(baseHttp().proxy(proxy));

    assertThat(client.proxy(), sameInstance(proxy));
  }

  @Test
  public void clientProxyHostAndPort() throws Exception {
    String proxyHost = "proxy.example.com";
    int proxyPort = 8080;
    OkHttpClient client = makeClientFrom(baseHttp().proxy(proxyHost, proxyPort));

    assertThat(client.proxy(), Matchers.notNullValue());
    assertThat(((InetSocketAddress)client.proxy().address()).getHostName(), equalTo(proxyHost));
    assertThat(((InetSocketAddress)client.proxy().address()).getPort(), equalTo(proxyPort));
  }

  @Test
  public void clientProxyAuthenticator() throws Exception {
    Authenticator auth = new Authenticator() {
      public Request authenticate(Route route, Response response) throws IOException {
        return null;
      }
    };
    OkHttpClient client = makeClientFrom(baseHttp().proxyAuthenticator(auth));

    assertThat(client.proxyAuthenticator(), sameInstance(auth));
  }

  @Test
  public void clientBuilderActions() throws Exception {
    ClientConfigurer configurer1 = new ClientConfigurer() {
      @Override
      public void configure(Builder builder) {
        builder.connectTimeout(21, TimeUnit.SECONDS);
      }
    };
    ClientConfigurer configurer2 = new ClientConfigurer() {
      @Override
      public void configure(Builder builder) {
        builder.readTimeout(22, TimeUnit.SECONDS);
      }
    };
    OkHttpClient client = makeClientFrom(baseHttp()
        .clientBuilderActions(configurer1)
        .clientBuilderActions(null) // no-op
        .clientBuilderActions(configurer2));

    assertThat(client.connectTimeoutMillis(), equalTo(21000));
    assertThat(client.readTimeoutMillis(), equalTo(22000));
  }

  @Test
  public void cookieJarIsOnlyUsedWithCredentials() throws Exception {
    CookieJar jar = new CookieJar() {
      @Override
      public void saveFromResponse(HttpUrl url, List<Cookie> cookies) {}

      @Override
      public List<Cookie> loadForRequest(HttpUrl url) {
        return Collections.emptyList();
      }
    };
    try (ConnectStrategy.Client client = baseHttp().cookieJar(jar).createClient(testLogger.getLogger())) {
      HttpConnectStrategy.Client httpClient = (HttpConnectStrategy.Client)client;
      assertThat(httpClient.httpClient.cookieJar(), sameInstance(jar));
      assertThat(httpClient.anonymousHttpClient.cookieJar(), sameInstance(CookieJar.NO_COOKIES));
    }
  }

  @Test
  public void requestDefaultProperties() throws Exception {
    RequestInfo r = doRequestFrom(baseHttp(), "/stream", null);

    assertThat(r.getMethod(), equalTo("GET"));
    assertThat(r.getPath(), equalTo("/stream"));
    assertThat(r.getHeader("Accept"), equalTo("text/event-stream"));
    assertThat(r.getHeader("Cache-Control"), equalTo("no-cache"));
    assertThat(r.getHeader("Last-Event-Id"), nullValue());
  }

  @Test
  public void requestCustomHeadersReplaceDefaults() throws Exception {
    Headers headers = new Headers.Builder()
        .add("header1", "value1")
        .add("Accept", "text/event-stream, application/json")
        .build();
    RequestInfo r = doRequestFrom(baseHttp(), "/", headers);

    assertThat(r.getHeader("Accept"), equalTo("text/event-stream, application/json"));
    assertThat(r.getHeader("Cache-Control"), equalTo("no-cache"));
    assertThat(r.getHeader("header1"), equalTo("value1"));
  }

  @Test
  public void requestTransformer() throws Exception {
    RequestTransformer transform1 = new RequestTransformer() {
      @Override
      public Request transformRequest(Request r) {
        return r.newBuilder().addHeader("header1", "value1").build();
      }
    };
    RequestTransformer transform2 = new RequestTransformer() {
      @Override
      public Request transformRequest(Request r) {
        return r.newBuilder().header("header1", r.header("header1") + "+value2").build();
      }
    };
    RequestInfo r = doRequestFrom(baseHttp()
        .requestTransformer(transform1)
        .requestTransformer(null) // no-op
        .requestTransformer(transform2),
        "/", null);

    assertThat(r.getHeader("header1"), equalTo("value1+value2"));
  }

  @Test
  public void streamsResponseBody() throws Exception {
    Handler response = Handlers.all(
        Handlers.SSE.start(),
        Handlers.writeChunkString("data: hello\n\n"),
        Handlers.writeChunkString("data: world\n\n"),
        Handlers.hang()
        );
    try (HttpServer server = HttpServer.start(response)) {
      try (ConnectStrategy.Client client = baseHttp().createClient(testLogger.getLogger())) {
        RecordingTransportListener listener = new RecordingTransportListener();
        Closeable closer = client.open(server.getUri(), false, null, listener);

        RecordingTransportListener.Start start = listener.expectStart();
        assertThat(start.status, equalTo(200));
        assertThat(start.contentType, startsWith("text/event-stream"));
        assertThat(listener.expectText(26), equalTo("data: hello\n\ndata: world\n\n"));

        closer.close();
        assertThat(listener.expectFinish().error, nullValue());
      }
    }
  }

  @Test
  public void multiByteCharactersAreNeverSplit() throws Exception {
    String text = "data: é€✓ ü\n\n";
    Handler response = Handlers.all(
        Handlers.startChunks("text/event-stream", StandardCharsets.UTF_8),
        Handlers.writeChunkString(text)
        );
    try (HttpServer server = HttpServer.start(response)) {
      try (ConnectStrategy.Client client = baseHttp().readBufferSize(1)
          .createClient(testLogger.getLogger())) {
        RecordingTransportListener listener = new RecordingTransportListener();
        client.open(server.getUri(), false, null, listener);

        listener.expectStart();
        assertThat(listener.expectText(text.length()), equalTo(text));
        assertThat(listener.expectFinish().error, nullValue());
      }
    }
  }

  @Test
  public void errorStatusIsReportedInStart() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(503))) {
      try (ConnectStrategy.Client client = baseHttp().createClient(testLogger.getLogger())) {
        RecordingTransportListener listener = new RecordingTransportListener();
        client.open(server.getUri(), false, null, listener);

        assertThat(listener.expectStart().status, equalTo(503));
        assertThat(listener.expectFinish().error, nullValue());
      }
    }
  }

  @Test
  public void networkFailureIsReportedInFinish() throws Exception {
    try (TcpServer server = TcpServer.start(TcpHandlers.noResponse())) {
      try (ConnectStrategy.Client client = baseHttp().createClient(testLogger.getLogger())) {
        RecordingTransportListener listener = new RecordingTransportListener();
        client.open(server.getHttpUri(), false, null, listener);

        assertThat(listener.expectFinish().error, instanceOf(IOException.class));
      }
    }
  }

  @Test
  public void cancellingBeforeResponseIsReportedWithoutError() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.hang())) {
      try (ConnectStrategy.Client client = baseHttp().createClient(testLogger.getLogger())) {
        RecordingTransportListener listener = new RecordingTransportListener();
        Closeable closer = client.open(server.getUri(), false, null, listener);
        server.getRecorder().requireRequest();

        closer.close();
        closer.close(); // harmless
        assertThat(listener.expectFinish().error, nullValue());
      }
    }
  }

  @Test
  public void awaitClosed() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.hang())) {
      try (ConnectStrategy.Client client = baseHttp().createClient(testLogger.getLogger())) {
        client.close();
        assertThat(client.awaitClosed(1000), is(true));
      }
    }
  }

  @Test
  public void customClientIsUsedAndNotShutDown() throws Exception {
    OkHttpClient myClient = new OkHttpClient.Builder().build();
    try (ConnectStrategy.Client client = baseHttp()
        .httpClient(myClient)
        .createClient(testLogger.getLogger())) {
      assertThat(((HttpConnectStrategy.Client)client).httpClient, sameInstance(myClient));
      client.close();
      assertThat(myClient.dispatcher().executorService().isShutdown(), is(false));
    }
  }

  private HttpConnectStrategy baseHttp() {
    return ConnectStrategy.http(TEST_URI);
  }

  private OkHttpClient makeClientFrom(HttpConnectStrategy hcs) throws Exception {
    try (ConnectStrategy.Client client = hcs.createClient(testLogger.getLogger())) {
      return ((HttpConnectStrategy.Client)client).httpClient;
    }
  }

  private RequestInfo doRequestFrom(HttpConnectStrategy hcs, String path, Headers headers)
      throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(200))) {
      try (ConnectStrategy.Client client = hcs.createClient(testLogger.getLogger())) {
        RecordingTransportListener listener = new RecordingTransportListener();
        client.open(server.getUri().resolve(path), false, headers, listener);
        listener.expectFinish();

        return server.getRecorder().requireRequest();
      }
    }
  }
}
