package dev.henneberger.vertx.eventlog.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

class EventReplicatorOptionsTest {

  @Test
  void readsFromJsonAndSerializesToJson() {
    EventReplicatorOptions options = new EventReplicatorOptions(new JsonObject()
      .put("maxEventsPerRead", 80_000)
      .put("maxEventsPerWrite", 20_000)
      .put("workerPoolSize", 6));

    assertEquals(80_000, options.getMaxEventsPerRead());
    assertEquals(20_000, options.getMaxEventsPerWrite());
    assertEquals(6, options.getWorkerPoolSize());
    assertEquals(20_000, options.toJson().getInteger("maxEventsPerWrite"));
  }

  @Test
  void defaultsMatchProductionCaps() {
    EventReplicatorOptions options = new EventReplicatorOptions();
    assertEquals(50_000, options.getMaxEventsPerRead());
    assertEquals(10_000, options.getMaxEventsPerWrite());
    options.validate();
  }

  @Test
  void rejectsWriteCapAboveReadCap() {
    EventReplicatorOptions options = new EventReplicatorOptions()
      .setMaxEventsPerRead(100)
      .setMaxEventsPerWrite(200);

    assertThrows(IllegalArgumentException.class, options::validate);
  }
}
