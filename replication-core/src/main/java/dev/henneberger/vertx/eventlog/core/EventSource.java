package dev.henneberger.vertx.eventlog.core;

/**
 * The authoritative, append-only event log. Never written to by the replicator.
 */
public interface EventSource extends EventStore {

  /**
   * Opens a streamed read of events with {@code id > afterId} in ascending id order, capped at
   * {@code maxRows}. The cursor owns its own connection; closing it releases both.
   */
  EventCursor openCursor(long afterId, int maxRows) throws Exception;
}
