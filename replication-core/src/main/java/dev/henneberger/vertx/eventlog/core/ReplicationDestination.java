package dev.henneberger.vertx.eventlog.core;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One replica plus the coordinator state that belongs to it: the high-water mark and the busy flag.
 *
 * <p>Only the destination's own coordinator and copy cycles touch this object.
 */
public final class ReplicationDestination implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationDestination.class);

  private final EventDestination store;
  private final AtomicReference<CoordinatorState> state = new AtomicReference<>(CoordinatorState.IDLE);
  private volatile long maximumEventId;

  ReplicationDestination(EventDestination store, long maximumEventId) {
    this.store = Objects.requireNonNull(store, "store");
    if (maximumEventId < 0) {
      throw new IllegalArgumentException("maximumEventId must be >= 0");
    }
    this.maximumEventId = maximumEventId;
  }

  /**
   * Wraps {@code store}, taking the high-water mark from the replica's own stored maximum id.
   */
  public static ReplicationDestination open(EventDestination store) throws Exception {
    long storedMaximum = store.maximumEventId();
    LOG.info("Replication destination {} opened with maximum event id {}", store.name(), storedMaximum);
    return new ReplicationDestination(store, storedMaximum);
  }

  public String name() {
    return store.name();
  }

  public EventDestination store() {
    return store;
  }

  public long maximumEventId() {
    return maximumEventId;
  }

  public CoordinatorState state() {
    return state.get();
  }

  public boolean copyInProgress() {
    return state.get() == CoordinatorState.COPYING;
  }

  /**
   * Advances the high-water mark after a confirmed write. Never moves it backwards.
   */
  void advanceTo(long eventId) {
    if (eventId <= maximumEventId) {
      throw new ReplicationException(ReplicationException.Reason.OUT_OF_ORDER_ROW,
        "Cannot move maximum event id of " + name() + " from " + maximumEventId + " to " + eventId);
    }
    maximumEventId = eventId;
  }

  boolean tryBeginCopy() {
    return state.compareAndSet(CoordinatorState.IDLE, CoordinatorState.COPYING);
  }

  boolean endCopy() {
    return state.compareAndSet(CoordinatorState.COPYING, CoordinatorState.IDLE);
  }

  void markFailed() {
    state.set(CoordinatorState.FAILED);
  }

  @Override
  public void close() throws Exception {
    store.close();
  }
}
