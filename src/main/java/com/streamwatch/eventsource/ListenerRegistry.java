package com.streamwatch.eventsource;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event type to listener mapping for {@link EventSource#addEventListener(String, EventListener)}.
 * <p>
 * Listeners can be added and removed from any thread, including from inside a listener;
 * a change made during delivery of an event does not affect that delivery.
 */
final class ListenerRegistry {
  private final ConcurrentHashMap<String, CopyOnWriteArrayList<EventListener>> listeners =
      new ConcurrentHashMap<>();

  void add(String type, EventListener listener) {
    listeners.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).addIfAbsent(listener);
  }

  void remove(String type, EventListener listener) {
    CopyOnWriteArrayList<EventListener> list = listeners.get(type);
    if (list != null) {
      list.remove(listener);
    }
  }

  // Iterating over the returned list works on a snapshot.
  List<EventListener> get(String type) {
    List<EventListener> list = listeners.get(type);
    return list == null ? Collections.<EventListener>emptyList() : list;
  }
}
