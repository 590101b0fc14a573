package dev.henneberger.vertx.eventlog.core;

import java.util.Objects;

/**
 * Raised when a replication destination is not a non-diverged copy of the event source.
 */
public final class ConsistencyCheckFailedException extends IllegalStateException {

  private final ConsistencyReport report;

  public ConsistencyCheckFailedException(ConsistencyReport report) {
    super(ConsistencyReports.describeFailure(Objects.requireNonNull(report, "report")));
    this.report = report;
  }

  public ConsistencyReport report() {
    return report;
  }
}
