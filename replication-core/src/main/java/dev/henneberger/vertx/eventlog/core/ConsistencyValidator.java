package dev.henneberger.vertx.eventlog.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup check that a replica holds a bounded prefix of the source log and was copied from it.
 *
 * <p>An empty destination always passes. A non-empty destination must have the same minimum-id event as the
 * source, no more rows than the source, and a maximum id no larger than the source's.
 */
public final class ConsistencyValidator {

  private static final Logger LOG = LoggerFactory.getLogger(ConsistencyValidator.class);

  private final String sourceName;
  private final Optional<Event> sourceEventWithMinimumId;
  private final long sourceRowCount;
  private final ReplicationGoal goal;

  public ConsistencyValidator(String sourceName,
                              Optional<Event> sourceEventWithMinimumId,
                              long sourceRowCount,
                              ReplicationGoal goal) {
    this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    this.sourceEventWithMinimumId = Objects.requireNonNull(sourceEventWithMinimumId, "sourceEventWithMinimumId");
    this.sourceRowCount = sourceRowCount;
    this.goal = Objects.requireNonNull(goal, "goal");
  }

  public ConsistencyReport validate(ReplicationDestination destination) throws Exception {
    String name = destination.name();
    long destinationRowCount = destination.store().rowCount();
    long sourceMaximumId = goal.get();
    LOG.info("Database: {}  Event Source Maximum Event id: {}  Replication Client Maximum Event id: {}"
        + "  Event Source Row Count: {}  Replication Client Row Count: {}",
      name, sourceMaximumId, destination.maximumEventId(), sourceRowCount, destinationRowCount);

    Optional<Event> destinationEventWithMinimumId = destination.store().eventWithMinimumId();
    if (destinationEventWithMinimumId.isEmpty()) {
      return new ConsistencyReport(List.of());
    }

    List<ConsistencyIssue> issues = new ArrayList<>();
    if (sourceEventWithMinimumId.isEmpty()) {
      issues.add(new ConsistencyIssue(
        name,
        ConsistencyIssue.SOURCE_EMPTY,
        "Event Source database (" + sourceName + ") events table is empty but Replication database ("
          + name + ") events table is not empty",
        "Point the replicator at the event source this replica was copied from."
      ));
    } else if (!sourceEventWithMinimumId.get().equals(destinationEventWithMinimumId.get())) {
      issues.add(new ConsistencyIssue(
        name,
        ConsistencyIssue.WRONG_DATABASE,
        "Row with minimum id in Event Source database (" + sourceName + ") events table: "
          + sourceEventWithMinimumId.get() + " doesn't match row with minimum id in Replication database ("
          + name + ") events table: " + destinationEventWithMinimumId.get(),
        "Verify the destination database belongs to this event source, or empty its events table."
      ));
    }

    if (destinationRowCount > sourceRowCount) {
      issues.add(new ConsistencyIssue(
        name,
        ConsistencyIssue.ROW_COUNT_EXCEEDS_SOURCE,
        "Replication database (" + name + ") row count (" + destinationRowCount
          + ") is greater than Event Source database (" + sourceName + ") row count (" + sourceRowCount + ")",
        "The replica holds rows the source does not; rebuild it from an empty events table."
      ));
    }
    if (destination.maximumEventId() > sourceMaximumId) {
      issues.add(new ConsistencyIssue(
        name,
        ConsistencyIssue.MAXIMUM_ID_EXCEEDS_SOURCE,
        "Replication database (" + name + ") maximum event id (" + destination.maximumEventId()
          + ") is greater than Event Source database (" + sourceName + ") maximum event id ("
          + sourceMaximumId + ")",
        "The replica is ahead of the source; rebuild it from an empty events table."
      ));
    }

    for (ConsistencyIssue issue : issues) {
      LOG.error("Consistency check failed for {}: [{}] {}", name, issue.code(), issue.message());
    }
    return new ConsistencyReport(issues);
  }
}
