package dev.henneberger.vertx.eventlog.core;

import java.util.Objects;

/**
 * Fatal replication failure. None of these are retried in-process.
 */
public final class ReplicationException extends IllegalStateException {

  public enum Reason {
    WRITE_COUNT_MISMATCH,
    NO_ROWS_REPLICATED,
    OUT_OF_ORDER_ROW,
    MALFORMED_NOTIFICATION,
    INVALID_QUERY_RESULT
  }

  private final Reason reason;

  public ReplicationException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public ReplicationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }
}
