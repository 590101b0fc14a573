package dev.henneberger.vertx.eventlog.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReplicationGoalTest {

  @Test
  void neverDecreases() {
    ReplicationGoal goal = new ReplicationGoal(5);

    assertTrue(goal.raiseTo(9));
    assertFalse(goal.raiseTo(7));
    assertFalse(goal.raiseTo(9));
    assertEquals(9, goal.get());
  }

  @Test
  void concurrentRaisesKeepTheLargestValue() throws Exception {
    ReplicationGoal goal = new ReplicationGoal();
    List<Thread> threads = new ArrayList<>();
    for (int t = 0; t < 8; t++) {
      int offset = t;
      Thread thread = new Thread(() -> {
        for (long id = 1; id <= 10_000; id++) {
          goal.raiseTo(id * 8 + offset);
        }
      });
      threads.add(thread);
      thread.start();
    }
    for (Thread thread : threads) {
      thread.join();
    }

    assertEquals(10_000L * 8 + 7, goal.get());
  }
}
