package dev.henneberger.vertx.eventlog.core;

import java.util.Objects;

/**
 * One reason a replication destination cannot be caught up from the event source. Every issue blocks startup.
 */
public final class ConsistencyIssue {
  public static final String WRONG_DATABASE = "WRONG_DATABASE";
  public static final String SOURCE_EMPTY = "SOURCE_EMPTY";
  public static final String ROW_COUNT_EXCEEDS_SOURCE = "ROW_COUNT_EXCEEDS_SOURCE";
  public static final String MAXIMUM_ID_EXCEEDS_SOURCE = "MAXIMUM_ID_EXCEEDS_SOURCE";

  private final String destination;
  private final String code;
  private final String message;
  private final String remediation;

  public ConsistencyIssue(String destination, String code, String message, String remediation) {
    this.destination = Objects.requireNonNull(destination, "destination");
    this.code = Objects.requireNonNull(code, "code");
    this.message = Objects.requireNonNull(message, "message");
    this.remediation = remediation;
  }

  public String destination() {
    return destination;
  }

  public String code() {
    return code;
  }

  public String message() {
    return message;
  }

  public String remediation() {
    return remediation;
  }
}
