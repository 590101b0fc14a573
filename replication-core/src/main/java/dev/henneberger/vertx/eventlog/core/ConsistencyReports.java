package dev.henneberger.vertx.eventlog.core;

import java.util.Objects;
import java.util.stream.Collectors;

public final class ConsistencyReports {

  private ConsistencyReports() {
  }

  public static String describeFailure(ConsistencyReport report) {
    Objects.requireNonNull(report, "report");
    if (report.ok()) {
      return "Consistency check passed";
    }
    return "Consistency check failed: " + report.issues().stream()
      .map(ConsistencyReports::formatIssue)
      .collect(Collectors.joining("; "));
  }

  private static String formatIssue(ConsistencyIssue issue) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(issue.code()).append("] ")
      .append(issue.destination()).append(": ")
      .append(issue.message());
    if (issue.remediation() != null && !issue.remediation().isBlank()) {
      sb.append(" Remediation: ").append(issue.remediation());
    }
    return sb.toString();
  }
}
