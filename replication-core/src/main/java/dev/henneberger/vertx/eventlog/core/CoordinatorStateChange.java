package dev.henneberger.vertx.eventlog.core;

public final class CoordinatorStateChange {
  private final String destination;
  private final CoordinatorState previousState;
  private final CoordinatorState state;
  private final Throwable cause;
  private final long cyclesCompleted;

  public CoordinatorStateChange(String destination,
                                CoordinatorState previousState,
                                CoordinatorState state,
                                Throwable cause,
                                long cyclesCompleted) {
    this.destination = destination;
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.cyclesCompleted = cyclesCompleted;
  }

  public String destination() {
    return destination;
  }

  public CoordinatorState previousState() {
    return previousState;
  }

  public CoordinatorState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  public long cyclesCompleted() {
    return cyclesCompleted;
  }
}
