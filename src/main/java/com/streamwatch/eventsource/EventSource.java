package com.streamwatch.eventsource;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import static com.streamwatch.eventsource.Helpers.clampDuration;
import static com.streamwatch.eventsource.Helpers.millisFromTimeUnit;

import okhttp3.Headers;
import okhttp3.HttpUrl;

/**
 * The SSE client.
 * <p>
 * By default, EventSource makes HTTP requests using OkHttp, but it can be configured
 * to read from any source. See {@link ConnectStrategy} and {@link HttpConnectStrategy}.
 * <p>
 * Instances are always configured and constructed with {@link Builder}. The client is
 * created in an inactive state, so that listeners can be registered before anything is
 * received; the first connection attempt is made when you call {@link #start()}.
 * <pre><code>
 *   EventSource es = new EventSource.Builder(URI.create("https://example.com/stream"))
 *     .logger(LDLogger.withAdapter(Logs.basic(), "stream"))
 *     .build();
 *   es.addEventListener("update", event -&gt; handleUpdate((MessageEvent)event));
 *   es.setOnError(event -&gt; System.err.println(event));
 *   es.start();
 * </code></pre>
 * <p>
 * Events are pushed to listeners from a single worker thread that the EventSource
 * maintains, in the order that they appear in the stream. A listener must not block for
 * long, since no other event can be processed until it returns.
 * <p>
 * The EventSource never gives up on its own. When a connection fails, ends, is rejected
 * by the server, or stops sending data for longer than the heartbeat timeout, listeners
 * for the "error" event are notified and another attempt is made after a backoff delay.
 * This continues until {@link #close()} is called.
 */
public class EventSource implements Closeable {
  /**
   * The default value for {@link Builder#retryDelay(long, TimeUnit)}: 1 second.
   */
  public static final long DEFAULT_RETRY_DELAY_MILLIS = 1000;
  /**
   * The default value for {@link Builder#heartbeatTimeout(long, TimeUnit)}: 45 seconds.
   */
  public static final long DEFAULT_HEARTBEAT_TIMEOUT_MILLIS = 45000;
  /**
   * The backoff delay never grows beyond this multiple of the initial retry delay.
   */
  public static final int MAX_RETRY_DELAY_MULTIPLIER = 16;

  private static final Pattern EVENT_STREAM_CONTENT_TYPE =
      Pattern.compile("^text/event-stream(;.*)?$", Pattern.CASE_INSENSITIVE);
  private static final long NO_ACTIVITY = -1;

  // Chunks posted to the event loop but not yet handled, per attempt. When the limit is
  // reached, the transport thread waits, which stops it reading from the socket.
  static final int MAX_PENDING_CHUNKS = 64;
  private static final long CHUNK_PERMIT_POLL_MILLIS = 100;

  private enum State {
    WAITING, // no attempt in progress; either not started yet or a retry timer is pending
    CONNECTING,
    OPEN,
    CLOSED
  }

  private final LDLogger logger;

  // The following final fields are set from the configuration builder.
  private final ConnectStrategy.Client client;
  private final Scheduler scheduler;
  private final URI url;
  private final boolean withCredentials;
  private final Headers headers;
  private final ListenerErrorHandler listenerErrorHandler;

  private final ListenerRegistry listeners = new ListenerRegistry();

  // These fields can be modified from other threads if they call close(). We use
  // AtomicReference because we need atomicity in updates.
  private final AtomicReference<State> state = new AtomicReference<>(State.WAITING);
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicReference<Closeable> transportCloser = new AtomicReference<>();
  private final AtomicReference<Scheduler.Task> retryTimer = new AtomicReference<>();
  private final AtomicReference<Scheduler.Task> heartbeatTimer = new AtomicReference<>();

  // The following mutable fields are not volatile because they are only accessed from
  // the event loop.
  private FrameParser parser;
  private long attempt; // incremented whenever the current attempt starts or ends
  private long lastActivityAt = NO_ACTIVITY;
  private long charsReceived;

  // These fields are written on the event loop, and can be read by other threads to
  // inspect the state of the stream.
  private volatile String lastEventId;
  private volatile long initialRetryMillis; // set at config time but may be changed by a "retry:" value
  private volatile long retryMillis;
  private volatile long heartbeatTimeoutMillis;

  private volatile EventListener onOpen;
  private volatile EventListener onMessage;
  private volatile EventListener onError;

  EventSource(Builder builder) {
    this.logger = builder.logger == null ? LDLogger.none() : builder.logger;
    this.client = builder.connectStrategy.createClient(logger);
    this.url = client.getOrigin();
    this.withCredentials = builder.withCredentials;
    this.headers = builder.headers.build();
    this.lastEventId = builder.lastEventId == null ? "" : builder.lastEventId;
    this.initialRetryMillis = this.retryMillis = builder.retryDelayMillis;
    this.heartbeatTimeoutMillis = builder.heartbeatTimeoutMillis;
    this.listenerErrorHandler = builder.listenerErrorHandler == null ?
        this::logListenerError : builder.listenerErrorHandler;
    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
    } else if (builder.executor != null) {
      this.scheduler = new ExecutorScheduler(builder.executor, false, logger);
    } else {
      this.scheduler = ExecutorScheduler.create(
          builder.threadBaseName == null ? "" : builder.threadBaseName, logger);
    }
  }

  /**
   * Returns the stream URL, as it was configured. The {@code lastEventId} query parameter
   * that is added to each request is not included.
   *
   * @return the stream URL
   */
  public URI getUrl() {
    return url;
  }

  /**
   * Returns true if requests are made with credentials such as cookies.
   *
   * @return the credentials mode
   * @see Builder#withCredentials(boolean)
   */
  public boolean isWithCredentials() {
    return withCredentials;
  }

  /**
   * Returns the logger that this EventSource is using.
   *
   * @return the logger
   * @see Builder#logger(LDLogger)
   */
  public LDLogger getLogger() {
    return logger;
  }

  /**
   * Returns the state of the stream.
   * <p>
   * This is {@link ReadyState#CONNECTING} both while a connection attempt is in progress
   * and while waiting to reconnect.
   *
   * @return the state
   */
  public ReadyState getReadyState() {
    switch (state.get()) {
    case OPEN:
      return ReadyState.OPEN;
    case CLOSED:
      return ReadyState.CLOSED;
    default:
      return ReadyState.CONNECTING;
    }
  }

  /**
   * Returns the ID value, if any, of the last known event.
   * <p>
   * This can be set initially with {@link Builder#lastEventId(String)}, and is updated
   * whenever an event is received that has an ID. Whether event IDs are supported depends
   * on the server; it may ignore this value.
   *
   * @return the last known event ID, or an empty string
   */
  public String getLastEventId() {
    return lastEventId;
  }

  /**
   * Returns the delay that will be used before the next reconnection attempt.
   * <p>
   * This starts out as the value set with {@link Builder#retryDelay(long, TimeUnit)}. It
   * doubles after each attempt, up to {@link #MAX_RETRY_DELAY_MULTIPLIER} times the initial
   * value, and goes back to the initial value whenever a stream is opened. The server can
   * change the initial value with a "retry:" field.
   *
   * @return the next retry delay in milliseconds
   */
  public long getRetryDelayMillis() {
    return retryMillis;
  }

  /**
   * Returns the current heartbeat timeout. The server can change this with a
   * "heartbeatTimeout:" field.
   *
   * @return the heartbeat timeout in milliseconds
   * @see Builder#heartbeatTimeout(long, TimeUnit)
   */
  public long getHeartbeatTimeoutMillis() {
    return heartbeatTimeoutMillis;
  }

  /**
   * Starts the first connection attempt.
   * <p>
   * This method returns immediately; the attempt is made on the EventSource's worker
   * thread. Calling it again, or after {@link #close()}, has no effect.
   */
  public void start() {
    if (state.get() == State.CLOSED || !started.compareAndSet(false, true)) {
      return;
    }
    scheduler.execute(this::connect);
  }

  /**
   * Registers a listener for an event type.
   * <p>
   * The type is "open", "error", "message" (for events that did not specify a type), or
   * any type that the server uses in an "event:" field. Listeners for a type are called in
   * the order they were added. Adding a listener that is already registered for the same
   * type has no effect.
   *
   * @param type the event type
   * @param listener the listener
   */
  public void addEventListener(String type, EventListener listener) {
    if (type != null && listener != null) {
      listeners.add(type, listener);
    }
  }

  /**
   * Unregisters a listener that was added with {@link #addEventListener(String, EventListener)}.
   *
   * @param type the event type
   * @param listener the listener
   */
  public void removeEventListener(String type, EventListener listener) {
    if (type != null && listener != null) {
      listeners.remove(type, listener);
    }
  }

  /**
   * Sets the primary handler for "open" events. It is called after any listeners that were
   * added with {@link #addEventListener(String, EventListener)}.
   *
   * @param onOpen the handler, or null to remove it
   */
  public void setOnOpen(EventListener onOpen) {
    this.onOpen = onOpen;
  }

  /**
   * Returns the primary handler for "open" events.
   *
   * @return the handler, or null
   */
  public EventListener getOnOpen() {
    return onOpen;
  }

  /**
   * Sets the primary handler for "message" events, meaning events that did not specify a
   * type. It is called after any listeners that were added with
   * {@link #addEventListener(String, EventListener)}.
   *
   * @param onMessage the handler, or null to remove it
   */
  public void setOnMessage(EventListener onMessage) {
    this.onMessage = onMessage;
  }

  /**
   * Returns the primary handler for "message" events.
   *
   * @return the handler, or null
   */
  public EventListener getOnMessage() {
    return onMessage;
  }

  /**
   * Sets the primary handler for "error" events. It is called after any listeners that were
   * added with {@link #addEventListener(String, EventListener)}.
   *
   * @param onError the handler, or null to remove it
   */
  public void setOnError(EventListener onError) {
    this.onError = onError;
  }

  /**
   * Returns the primary handler for "error" events.
   *
   * @return the handler, or null
   */
  public EventListener getOnError() {
    return onError;
  }

  /**
   * Permanently shuts down the EventSource.
   * <p>
   * Any active connection is dropped, pending reconnect and heartbeat timers are
   * cancelled, and no listener will be called afterward, including listeners for events
   * that arrived in the same piece of data as the event being delivered when this was
   * called. It is safe to call this from a listener, and to call it more than once.
   */
  @Override
  public void close() {
    State previous = state.getAndSet(State.CLOSED);
    if (previous == State.CLOSED) {
      return;
    }
    logger.debug("Closing EventSource");
    closeTransport();
    cancelTimer(retryTimer);
    cancelTimer(heartbeatTimer);
    try {
      client.close();
    } catch (IOException e) {
      logger.warn("Unexpected error when closing client: {}", LogValues.exceptionSummary(e));
    }
    scheduler.close();
  }

  /**
   * Blocks until all underlying threads have terminated and resources have been released.
   *
   * @param timeout maximum time to wait for everything to shut down, in whatever time
   *   unit is specified by {@code timeUnit}
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return {@code true} if all thread pools terminated within the specified timeout,
   *   {@code false} otherwise
   * @throws InterruptedException if this thread is interrupted while blocking
   */
  public boolean awaitClosed(long timeout, TimeUnit timeUnit) throws InterruptedException {
    final long deadline = System.currentTimeMillis() + millisFromTimeUnit(timeout, timeUnit);
    if (!scheduler.awaitTermination(millisFromTimeUnit(timeout, timeUnit))) {
      return false;
    }
    return client.awaitClosed(Math.max(0, deadline - System.currentTimeMillis()));
  }

  private void connect() {
    retryTimer.set(null);
    if (!state.compareAndSet(State.WAITING, State.CONNECTING)) {
      return;
    }
    final long token = ++attempt;
    lastActivityAt = NO_ACTIVITY;
    charsReceived = 0;
    parser = new FrameParser(lastEventId, url, logger);
    armHeartbeat(heartbeatTimeoutMillis);

    URI requestUrl = Helpers.withLastEventId(url, lastEventId);
    logger.debug("Attempting to connect to SSE stream at {}", requestUrl);
    Closeable closer;
    try {
      closer = client.open(requestUrl, withCredentials, headers, new AttemptListener(token));
    } catch (RuntimeException e) {
      logger.error("Unexpected error when opening stream: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      close();
      throw e;
    }
    transportCloser.set(closer);
    if (token != attempt || state.get() == State.CLOSED) {
      closeTransport();
    }
  }

  private void handleStart(long token, int status, String statusText, String contentType,
      Headers responseHeaders) {
    if (token != attempt || state.get() != State.CONNECTING) {
      return;
    }
    if (status == 200 && contentType != null &&
        EVENT_STREAM_CONTENT_TYPE.matcher(contentType).matches()) {
      if (!state.compareAndSet(State.CONNECTING, State.OPEN)) {
        return;
      }
      logger.info("Connected to SSE stream");
      lastActivityAt = scheduler.now();
      retryMillis = initialRetryMillis;
      dispatch(new ConnectionEvent(ConnectionEvent.OPEN, status, statusText, responseHeaders));
    } else {
      UnsuccessfulResponseException e = new UnsuccessfulResponseException(status, statusText,
          contentType, responseHeaders);
      logger.warn(e.getMessage());
      scheduleReconnect(new ConnectionEvent(ConnectionEvent.ERROR, status, statusText,
          responseHeaders, e));
    }
  }

  private void handleChunk(long token, String text) {
    if (token != attempt || state.get() != State.OPEN || text.isEmpty()) {
      return;
    }
    lastActivityAt = scheduler.now();
    charsReceived += text.length();
    parser.feed(text);

    StreamEvent event;
    // A listener may close the EventSource; nothing after that event is delivered.
    while (token == attempt && state.get() == State.OPEN && (event = parser.nextEvent()) != null) {
      if (event instanceof SetRetryDelayEvent) {
        long retry = ((SetRetryDelayEvent)event).getRetryMillis();
        logger.debug("Server set retry delay to {} milliseconds", retry);
        initialRetryMillis = retryMillis = retry;
      } else if (event instanceof SetHeartbeatTimeoutEvent) {
        long timeout = ((SetHeartbeatTimeoutEvent)event).getTimeoutMillis();
        logger.debug("Server set heartbeat timeout to {} milliseconds", timeout);
        heartbeatTimeoutMillis = timeout;
        if (heartbeatTimer.get() != null) {
          armHeartbeat(timeout);
        }
      } else {
        lastEventId = ((MessageEvent)event).getLastEventId();
        dispatch(event);
      }
    }
  }

  private void handleFinish(long token, Throwable error) {
    State current = state.get();
    if (token != attempt || (current != State.CONNECTING && current != State.OPEN)) {
      return;
    }
    StreamException cause;
    if (error == null) {
      logger.info("Stream closed by server");
      cause = new StreamClosedByServerException();
    } else {
      logger.warn("Connection to SSE stream failed: {}", LogValues.exceptionSummary(error));
      logger.debug(LogValues.exceptionTrace(error));
      if (error instanceof StreamException) {
        cause = (StreamException)error;
      } else if (error instanceof IOException) {
        cause = new StreamIOException((IOException)error);
      } else {
        cause = new StreamIOException(new IOException(error));
      }
    }
    scheduleReconnect(new FaultEvent(cause));
  }

  private void onHeartbeat(long token) {
    if (token != attempt) {
      return;
    }
    heartbeatTimer.set(null);
    State current = state.get();
    if (current != State.CONNECTING && current != State.OPEN) {
      return;
    }
    if (lastActivityAt == NO_ACTIVITY && transportCloser.get() != null) {
      StreamStalledException e = new StreamStalledException(heartbeatTimeoutMillis,
          current == State.CONNECTING ? -1 : charsReceived);
      logger.warn(e.getMessage());
      scheduleReconnect(new FaultEvent(e));
      return;
    }
    long now = scheduler.now();
    long next = lastActivityAt == NO_ACTIVITY ? heartbeatTimeoutMillis :
      Math.max(lastActivityAt + heartbeatTimeoutMillis - now, 1);
    lastActivityAt = NO_ACTIVITY;
    armHeartbeat(next);
  }

  private void scheduleReconnect(StreamEvent errorEvent) {
    State current = state.get();
    if ((current != State.CONNECTING && current != State.OPEN) ||
        !state.compareAndSet(current, State.WAITING)) {
      return;
    }
    attempt++;
    closeTransport();
    cancelTimer(heartbeatTimer);
    parser = null;

    long delay = retryMillis;
    logger.info("Waiting {} milliseconds before reconnecting", delay);
    armTimer(retryTimer, this::connect, delay);
    retryMillis = clampDuration(Math.min(initialRetryMillis * MAX_RETRY_DELAY_MULTIPLIER, delay * 2));

    dispatch(errorEvent);
  }

  private void armHeartbeat(long delayMillis) {
    final long token = attempt;
    armTimer(heartbeatTimer, () -> onHeartbeat(token), delayMillis);
  }

  private void armTimer(AtomicReference<Scheduler.Task> slot, Runnable action, long delayMillis) {
    cancelTimer(slot);
    slot.set(scheduler.schedule(action, delayMillis));
    if (state.get() == State.CLOSED) {
      cancelTimer(slot);
    }
  }

  private static void cancelTimer(AtomicReference<Scheduler.Task> slot) {
    Scheduler.Task task = slot.getAndSet(null);
    if (task != null) {
      task.cancel();
    }
  }

  private void closeTransport() {
    Closeable closer = transportCloser.getAndSet(null);
    if (closer != null) {
      try {
        closer.close();
      } catch (IOException e) {
        logger.debug("Unexpected error when closing connection: {}", LogValues.exceptionSummary(e));
      }
    }
  }

  private void dispatch(StreamEvent event) {
    for (EventListener listener: listeners.get(event.getType())) {
      if (state.get() == State.CLOSED) {
        return;
      }
      invokeListener(listener, event);
    }
    EventListener primary = primaryHandler(event.getType());
    if (primary != null && state.get() != State.CLOSED) {
      invokeListener(primary, event);
    }
  }

  private EventListener primaryHandler(String type) {
    switch (type) {
    case ConnectionEvent.OPEN:
      return onOpen;
    case MessageEvent.DEFAULT_EVENT_TYPE:
      return onMessage;
    case FaultEvent.TYPE:
      return onError;
    default:
      return null;
    }
  }

  private void invokeListener(EventListener listener, StreamEvent event) {
    try {
      listener.onEvent(event);
    } catch (Exception e) {
      // Reported on a later task so that the remaining listeners and events go first.
      scheduler.execute(() -> reportListenerError(event, e));
    }
  }

  private void reportListenerError(StreamEvent event, Exception error) {
    try {
      listenerErrorHandler.onListenerError(event, error);
    } catch (RuntimeException e) {
      logger.error("Unexpected error from ListenerErrorHandler: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
    }
  }

  private void logListenerError(StreamEvent event, Exception error) {
    logger.warn("Caught unexpected error from EventListener: {}", LogValues.exceptionSummary(error));
    logger.debug(LogValues.exceptionTrace(error));
  }

  // Posts every callback to the event loop, tagged with the attempt it belongs to.
  private final class AttemptListener implements TransportListener {
    private final long token;
    private final Semaphore chunkPermits = new Semaphore(MAX_PENDING_CHUNKS);

    AttemptListener(long token) {
      this.token = token;
    }

    @Override
    public void onStart(int status, String statusText, String contentType, Headers responseHeaders) {
      scheduler.execute(() -> handleStart(token, status, statusText, contentType, responseHeaders));
    }

    @Override
    public void onChunk(String text) {
      if (!awaitChunkPermit()) {
        return;
      }
      scheduler.execute(() -> {
        try {
          handleChunk(token, text);
        } finally {
          chunkPermits.release();
        }
      });
    }

    // Returns false if the EventSource was closed while waiting; queued tasks are then
    // never run, so their permits will not come back.
    private boolean awaitChunkPermit() {
      try {
        while (!chunkPermits.tryAcquire(CHUNK_PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          if (state.get() == State.CLOSED) {
            return false;
          }
        }
        return true;
      } catch (InterruptedException e) {
        logger.debug("Interrupted while waiting for the event loop; dropping stream data");
        Thread.currentThread().interrupt();
        return false;
      }
    }

    @Override
    public void onFinish(Throwable error) {
      scheduler.execute(() -> handleFinish(token, error));
    }
  }

  /**
   * Builder for configuring {@link EventSource}.
   */
  public static final class Builder {
    private final ConnectStrategy connectStrategy; // final because it's mandatory, set at constructor time
    private final Headers.Builder headers = new Headers.Builder();
    private boolean withCredentials;
    private String lastEventId;
    private long retryDelayMillis = DEFAULT_RETRY_DELAY_MILLIS;
    private long heartbeatTimeoutMillis = DEFAULT_HEARTBEAT_TIMEOUT_MILLIS;
    private LDLogger logger = null;
    private ListenerErrorHandler listenerErrorHandler;
    private String threadBaseName;
    private ScheduledExecutorService executor;
    private Scheduler scheduler; // only set by tests

    /**
     * Creates a new builder, specifying how it will connect to a stream.
     * <p>
     * The {@link ConnectStrategy} will handle all details of how to make a request.
     * By default, this is {@link HttpConnectStrategy}, which makes HTTP requests. To
     * customize the HTTP behavior, you can use methods of {@link HttpConnectStrategy}:
     * <pre><code>
     *     EventSource.Builder builder = new EventSource.Builder(
     *       ConnectStrategy.http(myStreamUri)
     *         .connectTimeout(10, TimeUnit.SECONDS)
     *     );
     * </code></pre>
     *
     * @param connectStrategy the object that will manage connections; must not be null
     * @throws IllegalArgumentException if the argument is null
     * @see #Builder(URI)
     */
    public Builder(ConnectStrategy connectStrategy) {
      if (connectStrategy == null) {
        throw new IllegalArgumentException("connectStrategy must not be null");
      }
      this.connectStrategy = connectStrategy;
    }

    /**
     * Creates a new builder that connects via HTTP, specifying only the stream URI.
     *
     * @param uri the stream URI
     * @throws IllegalArgumentException if the argument is null, or if the endpoint
     *   is not HTTP or HTTPS
     * @see #Builder(ConnectStrategy)
     */
    public Builder(URI uri) {
      this(ConnectStrategy.http(uri));
    }

    /**
     * Creates a new builder that connects via HTTP, specifying the stream URI as a string.
     *
     * @param url the stream URL
     * @throws IllegalArgumentException if the argument is null or cannot be parsed, or
     *   if the endpoint is not HTTP or HTTPS
     */
    public Builder(String url) {
      this(ConnectStrategy.http(url == null ? null : URI.create(url)));
    }

    /**
     * Creates a new builder that connects via HTTP, specifying only the stream URI.
     * <p>
     * This is the same as {@link #Builder(URI)}, but using the {@link URL} type.
     *
     * @param url the stream URL
     * @throws IllegalArgumentException if the argument is null, or if the endpoint
     *   is not HTTP or HTTPS
     */
    public Builder(URL url) {
      this(ConnectStrategy.http(url));
    }

    /**
     * Creates a new builder that connects via HTTP, specifying only the stream URI.
     * <p>
     * This is the same as {@link #Builder(URI)}, but using the OkHttp type
     * {@link HttpUrl}.
     *
     * @param url the stream URL
     * @throws IllegalArgumentException if the argument is null, or if the endpoint
     *   is not HTTP or HTTPS
     */
    public Builder(HttpUrl url) {
      this(ConnectStrategy.http(url));
    }

    /**
     * Adds request headers. Any header previously set on this builder with one of the
     * same names is replaced, and so is any default header that the {@link ConnectStrategy}
     * would send.
     *
     * @param headers the headers
     * @return the builder
     */
    public Builder headers(Headers headers) {
      if (headers != null) {
        for (String name: headers.names()) {
          this.headers.removeAll(name);
          for (String value: headers.values(name)) {
            this.headers.add(name, value);
          }
        }
      }
      return this;
    }

    /**
     * Sets a request header, replacing any previous value.
     *
     * @param name the header name
     * @param value the header value
     * @return the builder
     */
    public Builder header(String name, String value) {
      this.headers.set(name, value);
      return this;
    }

    /**
     * Specifies whether requests should include credentials, such as cookies.
     * <p>
     * The default is {@code false}. For {@link HttpConnectStrategy}, the cookie jar is
     * configured with {@link HttpConnectStrategy#cookieJar(okhttp3.CookieJar)}.
     *
     * @param withCredentials true to send credentials
     * @return the builder
     */
    public Builder withCredentials(boolean withCredentials) {
      this.withCredentials = withCredentials;
      return this;
    }

    /**
     * Sets the ID value of the last event received.
     * <p>
     * This will be sent to the remote server as the {@code lastEventId} query parameter
     * of the first request. After that, it is updated whenever an event is received that
     * has an ID.
     *
     * @param lastEventId the last event identifier
     * @return the builder
     */
    public Builder lastEventId(String lastEventId) {
      this.lastEventId = lastEventId;
      return this;
    }

    /**
     * Sets the initial delay before reconnecting.
     * <p>
     * The delay doubles after each connection attempt, up to
     * {@link EventSource#MAX_RETRY_DELAY_MULTIPLIER} times this value, and is reset to
     * this value whenever a stream is opened. It is always kept between 1 second and
     * 5 hours.
     *
     * @param retryDelay the initial retry delay, in whatever time unit is specified by
     *   {@code timeUnit}
     * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
     * @return the builder
     * @see EventSource#DEFAULT_RETRY_DELAY_MILLIS
     */
    public Builder retryDelay(long retryDelay, TimeUnit timeUnit) {
      retryDelayMillis = clampDuration(millisFromTimeUnit(retryDelay, timeUnit));
      return this;
    }

    /**
     * Sets how long the stream can go without receiving any data before EventSource
     * drops the connection and reconnects.
     * <p>
     * The value is kept between 1 second and 5 hours.
     *
     * @param heartbeatTimeout the timeout, in whatever time unit is specified by
     *   {@code timeUnit}
     * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
     * @return the builder
     * @see EventSource#DEFAULT_HEARTBEAT_TIMEOUT_MILLIS
     */
    public Builder heartbeatTimeout(long heartbeatTimeout, TimeUnit timeUnit) {
      heartbeatTimeoutMillis = clampDuration(millisFromTimeUnit(heartbeatTimeout, timeUnit));
      return this;
    }

    /**
     * Specifies a custom logger to receive EventSource logging.
     * <p>
     * This method uses the {@link LDLogger} type from
     * <a href="https://github.com/launchdarkly/java-logging">com.launchdarkly.logging</a>, a
     * facade that provides several logging implementations as well as the option to forward
     * log output to SLF4J or another framework. Here is an example of configuring it to use
     * the basic console logging implementation, and to tag the output with the name "logname":
     * <pre><code>
     *   // import com.launchdarkly.logging.*;
     *
     *   builder.logger(
     *      LDLogger.withAdapter(Logs.basic(), "logname")
     *   );
     * </code></pre>
     * <p>
     * If you do not provide a logger, the default is there is no log output.
     *
     * @param logger an {@link LDLogger} implementation, or null for no logging
     * @return the builder
     */
    public Builder logger(LDLogger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Specifies what to do when a listener throws an exception.
     * <p>
     * The handler is called on the EventSource's worker thread, after the events that
     * were being processed at the time have been delivered. The default is to log the
     * exception.
     *
     * @param listenerErrorHandler the handler, or null for the default
     * @return the builder
     */
    public Builder listenerErrorHandler(ListenerErrorHandler listenerErrorHandler) {
      this.listenerErrorHandler = listenerErrorHandler;
      return this;
    }

    /**
     * Sets a string that will be included in the name of the worker thread, to make it
     * easier to identify in thread dumps. This has no effect if
     * {@link #executor(ScheduledExecutorService)} is set.
     *
     * @param threadBaseName the name to include
     * @return the builder
     */
    public Builder threadBaseName(String threadBaseName) {
      this.threadBaseName = threadBaseName;
      return this;
    }

    /**
     * Specifies an executor to run the EventSource's work on, instead of a thread that it
     * creates.
     * <p>
     * The executor must run tasks one at a time, in the order they were submitted;
     * {@link java.util.concurrent.Executors#newSingleThreadScheduledExecutor()} is one
     * such executor. Closing the EventSource does not shut it down.
     *
     * @param executor the executor, or null to let EventSource create one
     * @return the builder
     */
    public Builder executor(ScheduledExecutorService executor) {
      this.executor = executor;
      return this;
    }

    Builder scheduler(Scheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Constructs an {@link EventSource} using the builder's current properties.
     * @return the new EventSource instance
     */
    public EventSource build() {
      return new EventSource(this);
    }
  }
}
