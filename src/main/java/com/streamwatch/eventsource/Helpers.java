package com.streamwatch.eventsource;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

abstract class Helpers {
  static final Charset UTF8 = StandardCharsets.UTF_8; // SSE streams are always UTF-8

  static final long MINIMUM_DURATION_MILLIS = 1000;
  static final long MAXIMUM_DURATION_MILLIS = 18000000;

  static final String LAST_EVENT_ID_QUERY_PARAMETER = "lastEventId";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private Helpers() {}

  static long millisFromTimeUnit(long duration, TimeUnit timeUnit) {
    return timeUnitOrDefault(timeUnit).toMillis(duration);
  }

  static TimeUnit timeUnitOrDefault(TimeUnit timeUnit) {
    return timeUnit == null ? TimeUnit.MILLISECONDS : timeUnit;
  }

  static long clampDuration(long millis) {
    return Math.min(Math.max(millis, MINIMUM_DURATION_MILLIS), MAXIMUM_DURATION_MILLIS);
  }

  static String collapseWhitespace(String s) {
    return WHITESPACE.matcher(s).replaceAll(" ");
  }

  // Returns the URL to request for a connection attempt. The last event ID travels as a
  // query parameter rather than a Last-Event-ID header, replacing any value already in
  // the URL; other parameters keep their order. data: and blob: URLs are left alone.
  static URI withLastEventId(URI url, String lastEventId) {
    if (lastEventId == null || lastEventId.isEmpty()) {
      return url;
    }
    String scheme = url.getScheme();
    if ("data".equalsIgnoreCase(scheme) || "blob".equalsIgnoreCase(scheme)) {
      return url;
    }
    String s = url.toString();
    String fragment = "";
    int hash = s.indexOf('#');
    if (hash >= 0) {
      fragment = s.substring(hash);
      s = s.substring(0, hash);
    }
    int q = s.indexOf('?');
    StringBuilder sb = new StringBuilder(q < 0 ? s : s.substring(0, q)).append('?');
    if (q >= 0) {
      for (String param: s.substring(q + 1).split("&")) {
        if (param.isEmpty()) {
          continue;
        }
        int eq = param.indexOf('=');
        String name = eq < 0 ? param : param.substring(0, eq);
        if (!name.equals(LAST_EVENT_ID_QUERY_PARAMETER)) {
          sb.append(param).append('&');
        }
      }
    }
    sb.append(LAST_EVENT_ID_QUERY_PARAMETER).append('=').append(encodeQueryValue(lastEventId))
      .append(fragment);
    return URI.create(sb.toString());
  }

  private static String encodeQueryValue(String value) {
    // URLEncoder does form encoding; a query component wants %20 rather than '+'
    return URLEncoder.encode(value, UTF8).replace("+", "%20");
  }
}
