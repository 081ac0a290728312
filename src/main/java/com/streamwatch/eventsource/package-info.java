/**
 * A self-healing client for the
 * <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html#server-sent-events">Server-Sent
 * Events</a> (SSE) protocol.
 * <p>
 * The entry point for using this package is {@link com.streamwatch.eventsource.EventSource}.
 */
package com.streamwatch.eventsource;
