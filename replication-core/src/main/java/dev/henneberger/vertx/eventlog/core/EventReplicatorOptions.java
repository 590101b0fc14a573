package dev.henneberger.vertx.eventlog.core;

import io.vertx.codegen.annotations.DataObject;
import io.vertx.core.json.JsonObject;

/**
 * Tuning for the copy cycles.
 */
@DataObject
public class EventReplicatorOptions {

  public static final int DEFAULT_MAX_EVENTS_PER_READ = 50_000;
  public static final int DEFAULT_MAX_EVENTS_PER_WRITE = 10_000;
  public static final int DEFAULT_WORKER_POOL_SIZE = 4;

  private int maxEventsPerRead;
  private int maxEventsPerWrite;
  private int workerPoolSize;

  public EventReplicatorOptions() {
    init();
  }

  public EventReplicatorOptions(JsonObject json) {
    init();
    EventReplicatorOptionsConverter.fromJson(json, this);
  }

  public EventReplicatorOptions(EventReplicatorOptions other) {
    this.maxEventsPerRead = other.maxEventsPerRead;
    this.maxEventsPerWrite = other.maxEventsPerWrite;
    this.workerPoolSize = other.workerPoolSize;
  }

  public int getMaxEventsPerRead() {
    return maxEventsPerRead;
  }

  public EventReplicatorOptions setMaxEventsPerRead(int maxEventsPerRead) {
    this.maxEventsPerRead = maxEventsPerRead;
    return this;
  }

  public int getMaxEventsPerWrite() {
    return maxEventsPerWrite;
  }

  public EventReplicatorOptions setMaxEventsPerWrite(int maxEventsPerWrite) {
    this.maxEventsPerWrite = maxEventsPerWrite;
    return this;
  }

  public int getWorkerPoolSize() {
    return workerPoolSize;
  }

  public EventReplicatorOptions setWorkerPoolSize(int workerPoolSize) {
    this.workerPoolSize = workerPoolSize;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    EventReplicatorOptionsConverter.toJson(this, json);
    return json;
  }

  public void validate() {
    OptionValidation.requireMin("maxEventsPerRead", maxEventsPerRead, 1);
    OptionValidation.requireMin("maxEventsPerWrite", maxEventsPerWrite, 1);
    OptionValidation.requireAtMost("maxEventsPerWrite", maxEventsPerWrite, "maxEventsPerRead", maxEventsPerRead);
    OptionValidation.requireMin("workerPoolSize", workerPoolSize, 1);
  }

  private void init() {
    maxEventsPerRead = DEFAULT_MAX_EVENTS_PER_READ;
    maxEventsPerWrite = DEFAULT_MAX_EVENTS_PER_WRITE;
    workerPoolSize = DEFAULT_WORKER_POOL_SIZE;
  }
}
