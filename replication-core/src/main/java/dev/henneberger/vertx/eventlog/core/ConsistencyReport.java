package dev.henneberger.vertx.eventlog.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class ConsistencyReport {
  private final List<ConsistencyIssue> issues;

  public ConsistencyReport(List<ConsistencyIssue> issues) {
    Objects.requireNonNull(issues, "issues");
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public static ConsistencyReport merge(Collection<ConsistencyReport> reports) {
    List<ConsistencyIssue> all = new ArrayList<>();
    for (ConsistencyReport report : reports) {
      all.addAll(report.issues());
    }
    return new ConsistencyReport(all);
  }

  public boolean ok() {
    return issues.isEmpty();
  }

  public boolean hasIssue(String code) {
    for (ConsistencyIssue issue : issues) {
      if (issue.code().equals(code)) {
        return true;
      }
    }
    return false;
  }

  public List<ConsistencyIssue> issues() {
    return issues;
  }
}
