package dev.henneberger.vertx.eventlog.core;

import java.util.List;

/**
 * Scoped, forward-only read over the event source.
 */
public interface EventCursor extends AutoCloseable {

  /**
   * @return up to {@code maxEvents} further events in id order, empty once the stream is drained
   */
  List<Event> next(int maxEvents) throws Exception;

  @Override
  void close() throws Exception;
}
