package dev.henneberger.vertx.eventlog.core;

@FunctionalInterface
public interface ReplicationSubscription {
  void cancel();
}
