package dev.henneberger.vertx.eventlog.core;

import java.util.Optional;

/**
 * Read side shared by the event source and every replication destination.
 *
 * <p>All methods block on database I/O and are called from worker threads only.
 */
public interface EventStore extends AutoCloseable {

  /**
   * Identity used in logs and error messages, usually the database name.
   */
  String name();

  long rowCount() throws Exception;

  /**
   * @return the largest stored id, or {@code 0} when the store is empty
   */
  long maximumEventId() throws Exception;

  Optional<Event> eventWithMinimumId() throws Exception;

  @Override
  void close() throws Exception;
}
