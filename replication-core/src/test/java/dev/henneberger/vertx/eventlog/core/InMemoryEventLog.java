package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntUnaryOperator;

/**
 * Event table held in memory, usable as both source and destination.
 */
final class InMemoryEventLog implements EventSource, EventDestination {

  private final String name;
  private final TreeMap<Long, Event> rows = new TreeMap<>();
  private final List<List<Long>> writes = new CopyOnWriteArrayList<>();
  private final List<Long> cursorOpenedAfter = new CopyOnWriteArrayList<>();
  private final AtomicInteger openCursors = new AtomicInteger();
  private final AtomicInteger activeCopies = new AtomicInteger();
  private final AtomicInteger maxActiveCopies = new AtomicInteger();
  private volatile IntUnaryOperator reportedInsertCount = IntUnaryOperator.identity();
  private volatile long insertDelayMillis;
  private volatile boolean closed;

  InMemoryEventLog(String name) {
    this.name = name;
  }

  static Event event(long id) {
    return event(id, "entity-" + id);
  }

  static Event event(long id, String entityId) {
    return new Event(id, Instant.parse("2026-01-01T00:00:00Z").plusSeconds(id), entityId,
      new JsonObject().put("type", "PersonCreated").put("seq", id).put("name", "O'Brien"));
  }

  InMemoryEventLog withEvents(long fromInclusive, long toInclusive) {
    for (long id = fromInclusive; id <= toInclusive; id++) {
      append(event(id));
    }
    return this;
  }

  synchronized void append(Event event) {
    rows.put(event.id(), event);
  }

  synchronized List<Event> events() {
    return new ArrayList<>(rows.values());
  }

  List<List<Long>> writes() {
    return writes;
  }

  List<Long> cursorOpenedAfter() {
    return cursorOpenedAfter;
  }

  int openCursors() {
    return openCursors.get();
  }

  int maxActiveCopies() {
    return maxActiveCopies.get();
  }

  boolean closed() {
    return closed;
  }

  void reportInsertCount(IntUnaryOperator operator) {
    this.reportedInsertCount = operator;
  }

  void delayInserts(long millis) {
    this.insertDelayMillis = millis;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public synchronized long rowCount() {
    return rows.size();
  }

  @Override
  public synchronized long maximumEventId() {
    return rows.isEmpty() ? 0L : rows.lastKey();
  }

  @Override
  public synchronized Optional<Event> eventWithMinimumId() {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.firstEntry().getValue());
  }

  @Override
  public EventCursor openCursor(long afterId, int maxRows) {
    cursorOpenedAfter.add(afterId);
    List<Event> snapshot;
    synchronized (this) {
      snapshot = new ArrayList<>(rows.tailMap(afterId, false).values());
    }
    List<Event> capped = snapshot.subList(0, Math.min(maxRows, snapshot.size()));
    openCursors.incrementAndGet();
    return new EventCursor() {
      private int position;

      @Override
      public List<Event> next(int maxEvents) {
        int end = Math.min(capped.size(), position + maxEvents);
        List<Event> batch = new ArrayList<>(capped.subList(position, end));
        position = end;
        return batch;
      }

      @Override
      public void close() {
        openCursors.decrementAndGet();
      }
    };
  }

  @Override
  public int insert(List<Event> events) throws Exception {
    int active = activeCopies.incrementAndGet();
    maxActiveCopies.accumulateAndGet(active, Math::max);
    try {
      if (insertDelayMillis > 0) {
        Thread.sleep(insertDelayMillis);
      }
      List<Long> ids = new ArrayList<>();
      synchronized (this) {
        for (Event event : events) {
          if (rows.containsKey(event.id())) {
            throw new IllegalStateException("duplicate key " + event.id());
          }
          rows.put(event.id(), event);
          ids.add(event.id());
        }
      }
      writes.add(ids);
      return reportedInsertCount.applyAsInt(events.size());
    } finally {
      activeCopies.decrementAndGet();
    }
  }

  @Override
  public void close() {
    closed = true;
  }

  @Override
  public String toString() {
    return name;
  }
}
