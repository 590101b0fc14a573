package dev.henneberger.vertx.eventlog.core;

public enum ReplicatorState {
  CREATED,
  STARTING,
  RUNNING,
  FAILED,
  CLOSED
}
