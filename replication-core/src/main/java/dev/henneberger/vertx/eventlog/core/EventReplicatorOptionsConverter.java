package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.json.JsonObject;

final class EventReplicatorOptionsConverter {

  private EventReplicatorOptionsConverter() {
  }

  static void fromJson(JsonObject json, EventReplicatorOptions options) {
    if (json == null) {
      return;
    }
    if (json.containsKey("maxEventsPerRead")) {
      options.setMaxEventsPerRead(json.getInteger("maxEventsPerRead"));
    }
    if (json.containsKey("maxEventsPerWrite")) {
      options.setMaxEventsPerWrite(json.getInteger("maxEventsPerWrite"));
    }
    if (json.containsKey("workerPoolSize")) {
      options.setWorkerPoolSize(json.getInteger("workerPoolSize"));
    }
  }

  static void toJson(EventReplicatorOptions options, JsonObject json) {
    json.put("maxEventsPerRead", options.getMaxEventsPerRead());
    json.put("maxEventsPerWrite", options.getMaxEventsPerWrite());
    json.put("workerPoolSize", options.getWorkerPoolSize());
  }
}
