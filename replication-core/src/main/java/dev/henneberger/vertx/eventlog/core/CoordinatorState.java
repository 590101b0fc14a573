package dev.henneberger.vertx.eventlog.core;

public enum CoordinatorState {
  IDLE,
  COPYING,
  FAILED
}
