package dev.henneberger.vertx.eventlog.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Largest event id the source is known to have assigned. Only ever moves up.
 */
public final class ReplicationGoal {

  private final AtomicLong maxEventSourceEventId;

  public ReplicationGoal() {
    this(0L);
  }

  public ReplicationGoal(long initial) {
    if (initial < 0) {
      throw new IllegalArgumentException("initial goal must be >= 0");
    }
    this.maxEventSourceEventId = new AtomicLong(initial);
  }

  public long get() {
    return maxEventSourceEventId.get();
  }

  /**
   * Raises the goal to {@code eventId} if it is larger than the current value.
   *
   * @return {@code true} if the goal moved
   */
  public boolean raiseTo(long eventId) {
    long current = maxEventSourceEventId.get();
    while (eventId > current) {
      if (maxEventSourceEventId.compareAndSet(current, eventId)) {
        return true;
      }
      current = maxEventSourceEventId.get();
    }
    return false;
  }

  @Override
  public String toString() {
    return Long.toString(get());
  }
}
