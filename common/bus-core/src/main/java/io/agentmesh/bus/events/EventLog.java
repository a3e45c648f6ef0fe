package io.agentmesh.bus.events;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded, append-only ring of {@link BusEvent}s. Once {@code capacity} is reached each append
 * evicts the oldest entry.
 */
public final class EventLog {

  public static final int DEFAULT_CAPACITY = 10_000;

  private final int capacity;
  private final Clock clock;
  private final ArrayDeque<BusEvent> events;
  private long appended;

  public EventLog(int capacity, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.events = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  public EventLog(int capacity) {
    this(capacity, Clock.systemUTC());
  }

  public synchronized BusEvent append(String type, Map<String, Object> data) {
    appended++;
    BusEvent event = new BusEvent("evt_" + appended, clock.instant(), type, data);
    if (events.size() == capacity) {
      events.pollFirst();
    }
    events.addLast(event);
    return event;
  }

  /**
   * Returns up to {@code limit} of the most recent events whose type equals {@code typeFilter}
   * (any type when the filter is {@code null}), oldest first.
   */
  public synchronized List<BusEvent> query(int limit, String typeFilter) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    if (limit == 0 || events.isEmpty()) {
      return List.of();
    }
    List<BusEvent> matches = new ArrayList<>(Math.min(limit, events.size()));
    Iterator<BusEvent> newestFirst = events.descendingIterator();
    while (newestFirst.hasNext() && matches.size() < limit) {
      BusEvent event = newestFirst.next();
      if (typeFilter == null || typeFilter.equals(event.type())) {
        matches.add(event);
      }
    }
    Collections.reverse(matches);
    return List.copyOf(matches);
  }

  public synchronized int size() {
    return events.size();
  }

  public synchronized long totalAppended() {
    return appended;
  }
}
