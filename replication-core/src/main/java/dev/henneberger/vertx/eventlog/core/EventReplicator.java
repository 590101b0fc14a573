package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replicates one event source to one or more destinations.
 *
 * <p>{@link #start()} validates every destination against the source, subscribes to change notifications and
 * seeds a first catch-up for every destination. After that, any failure moves the replicator to
 * {@link ReplicatorState#FAILED} and is handed to the handlers registered with {@link #onFailure(Handler)}.
 * Deciding whether to exit is left to them.
 */
public class EventReplicator implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(EventReplicator.class);

  private final Vertx vertx;
  private final EventSource source;
  private final List<EventDestination> destinationStores;
  private final ChangeNotificationChannel notificationChannel;
  private final EventReplicatorOptions options;
  private final ReplicationGoal goal = new ReplicationGoal();
  private final WorkerExecutor executor;
  private final List<Handler<Throwable>> failureHandlers = new CopyOnWriteArrayList<>();
  private final List<Handler<CoordinatorStateChange>> coordinatorStateHandlers = new CopyOnWriteArrayList<>();

  private volatile List<ReplicationCoordinator> coordinators = Collections.emptyList();
  private volatile ChangeNotificationDispatcher dispatcher;
  private volatile ReplicationSubscription subscription;
  private volatile Promise<Void> startPromise;
  private volatile ReplicatorState state = ReplicatorState.CREATED;

  public EventReplicator(Vertx vertx,
                         EventSource source,
                         List<? extends EventDestination> destinations,
                         ChangeNotificationChannel notificationChannel,
                         EventReplicatorOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.source = Objects.requireNonNull(source, "source");
    this.destinationStores = List.copyOf(Objects.requireNonNull(destinations, "destinations"));
    if (destinationStores.isEmpty()) {
      throw new IllegalArgumentException("at least one replication destination is required");
    }
    this.notificationChannel = Objects.requireNonNull(notificationChannel, "notificationChannel");
    this.options = new EventReplicatorOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.executor = vertx.createSharedWorkerExecutor("event-replicator", this.options.getWorkerPoolSize());
  }

  public Future<Void> start() {
    Promise<Void> promiseToReturn;
    synchronized (this) {
      if (state == ReplicatorState.CLOSED) {
        return Future.failedFuture("replicator is closed");
      }
      if (state == ReplicatorState.FAILED) {
        return Future.failedFuture("replicator has failed");
      }
      if (state == ReplicatorState.RUNNING) {
        return Future.succeededFuture();
      }
      if (state == ReplicatorState.STARTING && startPromise != null) {
        return startPromise.future();
      }
      startPromise = Promise.promise();
      promiseToReturn = startPromise;
      state = ReplicatorState.STARTING;
    }

    executor.executeBlocking(this::prepare, false)
      .compose(v -> notificationChannel.subscribe(this::handleNotification, this::fail))
      .compose(active -> {
        subscription = active;
        return executor.executeBlocking(this::probeSourceMaximum, false);
      })
      .onSuccess(v -> {
        synchronized (this) {
          if (state != ReplicatorState.STARTING) {
            failStart(new IllegalStateException("replicator " + state.name().toLowerCase() + " during start"));
            return;
          }
          state = ReplicatorState.RUNNING;
        }
        LOG.info("Processing started for {} replication destination(s), goal {}", coordinators.size(), goal);
        completeStart();
        triggerAll().onFailure(this::fail);
      })
      .onFailure(err -> {
        LOG.error("Exception in replicator startup", err);
        ReplicationSubscription active = subscription;
        subscription = null;
        if (active != null) {
          active.cancel();
        }
        synchronized (this) {
          if (state == ReplicatorState.STARTING) {
            state = ReplicatorState.FAILED;
          }
        }
        failStart(err);
      });

    return promiseToReturn.future();
  }

  /**
   * Fires every coordinator. Safe to call redundantly; busy coordinators ignore the trigger.
   */
  public Future<Void> triggerAll() {
    ChangeNotificationDispatcher current = dispatcher;
    if (current == null || state != ReplicatorState.RUNNING) {
      return Future.failedFuture("replicator is not running");
    }
    return current.triggerAll();
  }

  public ReplicatorState state() {
    return state;
  }

  public long goal() {
    return goal.get();
  }

  public List<ReplicationCoordinator> coordinators() {
    return coordinators;
  }

  public ReplicationSubscription onFailure(Handler<Throwable> handler) {
    Handler<Throwable> resolved = Objects.requireNonNull(handler, "handler");
    failureHandlers.add(resolved);
    return () -> failureHandlers.remove(resolved);
  }

  public ReplicationSubscription onCoordinatorStateChange(Handler<CoordinatorStateChange> handler) {
    Handler<CoordinatorStateChange> resolved = Objects.requireNonNull(handler, "handler");
    coordinatorStateHandlers.add(resolved);
    return () -> coordinatorStateHandlers.remove(resolved);
  }

  @Override
  public void close() {
    synchronized (this) {
      if (state == ReplicatorState.CLOSED) {
        return;
      }
      state = ReplicatorState.CLOSED;
    }
    ReplicationSubscription current = subscription;
    subscription = null;
    if (current != null) {
      current.cancel();
    }

    for (ReplicationCoordinator coordinator : coordinators) {
      closeQuietly(coordinator.destination());
    }
    if (coordinators.isEmpty()) {
      for (EventDestination store : destinationStores) {
        closeQuietly(store);
      }
    }
    closeQuietly(source);
    executor.close();

    Promise<Void> pending = startPromise;
    startPromise = null;
    if (pending != null && !pending.future().isComplete()) {
      pending.fail("replicator closed before reaching RUNNING");
    }
  }

  private Void prepare() throws Exception {
    long sourceRowCount = source.rowCount();
    goal.raiseTo(source.maximumEventId());
    LOG.info("Event Source Client connected - Database: {}  Row Count: {}  Maximum Event id: {}",
      source.name(), sourceRowCount, goal);

    List<ReplicationDestination> opened = new ArrayList<>(destinationStores.size());
    for (EventDestination store : destinationStores) {
      opened.add(ReplicationDestination.open(store));
    }

    Optional<Event> sourceEventWithMinimumId = source.eventWithMinimumId();
    ConsistencyValidator validator =
      new ConsistencyValidator(source.name(), sourceEventWithMinimumId, sourceRowCount, goal);
    List<ConsistencyReport> reports = new ArrayList<>(opened.size());
    for (ReplicationDestination destination : opened) {
      reports.add(validator.validate(destination));
    }
    ConsistencyReport report = ConsistencyReport.merge(reports);
    if (!report.ok()) {
      throw new ConsistencyCheckFailedException(report);
    }

    StreamingCopyEngine engine =
      new StreamingCopyEngine(source, options.getMaxEventsPerRead(), options.getMaxEventsPerWrite());
    List<ReplicationCoordinator> created = new ArrayList<>(opened.size());
    for (ReplicationDestination destination : opened) {
      ReplicationCoordinator coordinator = new ReplicationCoordinator(executor, destination, engine, goal);
      coordinator.onStateChange(this::emitCoordinatorState);
      created.add(coordinator);
    }
    coordinators = Collections.unmodifiableList(created);
    dispatcher = new ChangeNotificationDispatcher(goal, created);
    return null;
  }

  // Catches events inserted between the first probe and LISTEN taking effect.
  private Void probeSourceMaximum() throws Exception {
    long maximum = source.maximumEventId();
    if (goal.raiseTo(maximum)) {
      LOG.info("Event source advanced to {} during startup", maximum);
    }
    return null;
  }

  private void handleNotification(String payload) {
    ChangeNotificationDispatcher current = dispatcher;
    if (current == null || state != ReplicatorState.RUNNING) {
      return;
    }
    try {
      current.onNotification(payload).onFailure(this::fail);
    } catch (ReplicationException e) {
      fail(e);
    }
  }

  private void fail(Throwable error) {
    synchronized (this) {
      if (state == ReplicatorState.CLOSED) {
        return;
      }
      state = ReplicatorState.FAILED;
    }
    LOG.error("Replication failed  maxSourceId={}", goal, error);
    for (Handler<Throwable> handler : failureHandlers) {
      vertx.runOnContext(v -> handler.handle(error));
    }
  }

  private void emitCoordinatorState(CoordinatorStateChange change) {
    for (Handler<CoordinatorStateChange> handler : coordinatorStateHandlers) {
      handler.handle(change);
    }
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.fail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception e) {
      LOG.warn("Failed to close {}", closeable, e);
    }
  }
}
