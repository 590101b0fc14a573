package dev.henneberger.vertx.eventlog.core;

import java.util.List;

/**
 * A replica of the event log, written only by the replicator.
 */
public interface EventDestination extends EventStore {

  /**
   * Writes all events in one statement, preserving their ids.
   *
   * @return the number of rows the database reports as inserted
   */
  int insert(List<Event> events) throws Exception;
}
