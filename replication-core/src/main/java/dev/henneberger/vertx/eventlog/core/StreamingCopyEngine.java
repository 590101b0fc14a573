package dev.henneberger.vertx.eventlog.core;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one bounded catch-up cycle for a single destination.
 *
 * <p>A cycle streams at most {@code maxEventsPerRead} events above the destination's high-water mark and writes
 * them in batches of at most {@code maxEventsPerWrite}. The high-water mark moves only after the destination
 * confirms every row of a batch.
 */
public final class StreamingCopyEngine {

  private static final Logger LOG = LoggerFactory.getLogger(StreamingCopyEngine.class);

  private final EventSource source;
  private final int maxEventsPerRead;
  private final int maxEventsPerWrite;

  public StreamingCopyEngine(EventSource source, int maxEventsPerRead, int maxEventsPerWrite) {
    this.source = Objects.requireNonNull(source, "source");
    OptionValidation.requireMin("maxEventsPerRead", maxEventsPerRead, 1);
    OptionValidation.requireMin("maxEventsPerWrite", maxEventsPerWrite, 1);
    this.maxEventsPerRead = maxEventsPerRead;
    this.maxEventsPerWrite = maxEventsPerWrite;
  }

  /**
   * @param goal the source id the caller expects to exist above the destination's high-water mark
   * @return rows copied by this cycle
   */
  public long runCycle(ReplicationDestination destination, long goal) throws Exception {
    Objects.requireNonNull(destination, "destination");
    String name = destination.name();
    LOG.info("Replicating events greater than {} to {}", destination.maximumEventId(), name);

    long rowsReplicated = 0;
    try (EventCursor cursor = source.openCursor(destination.maximumEventId(), maxEventsPerRead)) {
      List<Event> eventsToCopy;
      while (!(eventsToCopy = cursor.next(maxEventsPerWrite)).isEmpty()) {
        requireAscending(destination, eventsToCopy);
        int inserted = destination.store().insert(eventsToCopy);
        if (inserted != eventsToCopy.size()) {
          LOG.error("Program logic error for {}  Event Count: {}  Rows Inserted: {}",
            name, eventsToCopy.size(), inserted);
          throw new ReplicationException(ReplicationException.Reason.WRITE_COUNT_MISMATCH,
            "Inserted " + inserted + " rows into " + name + " but expected " + eventsToCopy.size());
        }
        destination.advanceTo(eventsToCopy.get(eventsToCopy.size() - 1).id());
        rowsReplicated += eventsToCopy.size();
      }
    }

    if (rowsReplicated == 0 && destination.maximumEventId() < goal) {
      LOG.error("Logic Error: No rows replicated to {}  maxDestId={} maxSourceId={}",
        name, destination.maximumEventId(), goal);
      throw new ReplicationException(ReplicationException.Reason.NO_ROWS_REPLICATED,
        "No rows replicated to " + name + " although event source maximum id is " + goal
          + " and destination maximum id is " + destination.maximumEventId());
    }
    return rowsReplicated;
  }

  private static void requireAscending(ReplicationDestination destination, List<Event> events) {
    long previous = destination.maximumEventId();
    for (Event event : events) {
      if (event.id() <= previous) {
        throw new ReplicationException(ReplicationException.Reason.OUT_OF_ORDER_ROW,
          "Event source returned id " + event.id() + " after " + previous + " for " + destination.name());
      }
      previous = event.id();
    }
  }
}
