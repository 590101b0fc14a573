package dev.henneberger.vertx.eventlog.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeNotificationDispatcherTest {

  private Vertx vertx;
  private WorkerExecutor executor;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    executor = vertx.createSharedWorkerExecutor("dispatcher-test", 4);
  }

  @AfterEach
  void tearDown() throws Exception {
    executor.close();
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  @Test
  void parsesIntegerIds() {
    assertEquals(42L, ChangeNotificationDispatcher.parseEventId("{\"id\":42}"));
    assertEquals(42L, ChangeNotificationDispatcher.parseEventId("{\"id\":\"42\"}"));
    assertEquals(9_000_000_000L, ChangeNotificationDispatcher.parseEventId("{\"id\":9000000000,\"ts\":\"x\"}"));
  }

  @Test
  void rejectsMalformedPayloads() {
    for (String payload : new String[] {"not json", "", "[1,2]", "{}", "{\"id\":\"abc\"}", "{\"id\":1.5}",
      "{\"id\":0}", "{\"id\":true}", null}) {
      ReplicationException failure = assertThrows(ReplicationException.class,
        () -> ChangeNotificationDispatcher.parseEventId(payload), String.valueOf(payload));
      assertEquals(ReplicationException.Reason.MALFORMED_NOTIFICATION, failure.reason());
    }
  }

  @Test
  void raisesGoalOnlyUpwards() throws Exception {
    ReplicationGoal goal = new ReplicationGoal(10);
    ChangeNotificationDispatcher dispatcher = new ChangeNotificationDispatcher(goal, List.of());

    dispatcher.onNotification("{\"id\":7}");
    assertEquals(10, goal.get());
    dispatcher.onNotification("{\"id\":12}");
    assertEquals(12, goal.get());
    dispatcher.onNotification("{\"id\":11}");
    assertEquals(12, goal.get());
  }

  @Test
  void triggersEveryCoordinator() throws Exception {
    InMemoryEventLog source = new InMemoryEventLog("sourceDb").withEvents(1, 5);
    InMemoryEventLog first = new InMemoryEventLog("replicationDb1").withEvents(1, 3);
    InMemoryEventLog second = new InMemoryEventLog("replicationDb2");
    ReplicationGoal goal = new ReplicationGoal(3);
    StreamingCopyEngine engine = new StreamingCopyEngine(source, 100, 10);
    ReplicationCoordinator firstCoordinator =
      new ReplicationCoordinator(executor, ReplicationDestination.open(first), engine, goal);
    ReplicationCoordinator secondCoordinator =
      new ReplicationCoordinator(executor, ReplicationDestination.open(second), engine, goal);
    ChangeNotificationDispatcher dispatcher =
      new ChangeNotificationDispatcher(goal, List.of(firstCoordinator, secondCoordinator));

    dispatcher.onNotification("{\"id\":5}").toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

    assertEquals(5, firstCoordinator.destination().maximumEventId());
    assertEquals(5, secondCoordinator.destination().maximumEventId());
    assertEquals(2, source.cursorOpenedAfter().size());
    assertTrue(source.cursorOpenedAfter().containsAll(List.of(0L, 3L)));
    assertEquals(source.events(), first.events());
    assertEquals(source.events(), second.events());
  }
}
