package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.WorkerExecutor;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one destination towards the replication goal.
 *
 * <p>A trigger while idle starts a run on the worker pool that repeats copy cycles until the destination's
 * high-water mark reaches the goal. A trigger while a run is active is dropped. Before going idle the run
 * re-reads the goal, so a raise that lands during the final cycle is not lost.
 */
public final class ReplicationCoordinator {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationCoordinator.class);

  private final WorkerExecutor executor;
  private final ReplicationDestination destination;
  private final StreamingCopyEngine engine;
  private final ReplicationGoal goal;
  private final List<Handler<CoordinatorStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final AtomicLong cyclesCompleted = new AtomicLong();

  public ReplicationCoordinator(WorkerExecutor executor,
                                ReplicationDestination destination,
                                StreamingCopyEngine engine,
                                ReplicationGoal goal) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.destination = Objects.requireNonNull(destination, "destination");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.goal = Objects.requireNonNull(goal, "goal");
  }

  public ReplicationDestination destination() {
    return destination;
  }

  public long cyclesCompleted() {
    return cyclesCompleted.get();
  }

  public ReplicationSubscription onStateChange(Handler<CoordinatorStateChange> handler) {
    Handler<CoordinatorStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  /**
   * Requests a catch-up. Never blocks the caller.
   *
   * @return a future completing when the run started by this trigger ends, or immediately if the trigger was
   *   dropped because a run is already active
   */
  public Future<Void> trigger() {
    if (destination.maximumEventId() >= goal.get() || !destination.tryBeginCopy()) {
      return Future.succeededFuture();
    }
    emit(CoordinatorState.IDLE, CoordinatorState.COPYING, null);
    return executor.executeBlocking(() -> {
      catchUp();
      return null;
    }, false);
  }

  private void catchUp() throws Exception {
    try {
      do {
        while (destination.maximumEventId() < goal.get()) {
          long target = goal.get();
          long rowsReplicated = engine.runCycle(destination, target);
          cyclesCompleted.incrementAndGet();
          LOG.info("After replicate to {}  maxSourceId={} maxDestId={} Rows replicated: {}",
            destination.name(), goal.get(), destination.maximumEventId(), rowsReplicated);
        }
        destination.endCopy();
        emit(CoordinatorState.COPYING, CoordinatorState.IDLE, null);
      } while (destination.maximumEventId() < goal.get() && reacquire());
      LOG.info("Replication up-to-date with latest event source id {}  maxSourceId={} maxDestId={}",
        destination.name(), goal.get(), destination.maximumEventId());
    } catch (Exception | Error e) {
      destination.markFailed();
      LOG.error("Error detected processing replication request for {}  maxSourceId={} maxDestId={}",
        destination.name(), goal.get(), destination.maximumEventId(), e);
      emit(CoordinatorState.COPYING, CoordinatorState.FAILED, e);
      throw e;
    }
  }

  private boolean reacquire() {
    if (!destination.tryBeginCopy()) {
      return false;
    }
    emit(CoordinatorState.IDLE, CoordinatorState.COPYING, null);
    return true;
  }

  private void emit(CoordinatorState previous, CoordinatorState next, Throwable cause) {
    CoordinatorStateChange change =
      new CoordinatorStateChange(destination.name(), previous, next, cause, cyclesCompleted.get());
    for (Handler<CoordinatorStateChange> handler : stateHandlers) {
      handler.handle(change);
    }
  }
}
