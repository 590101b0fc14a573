package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.Future;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns change notifications from the event source into goal raises and coordinator triggers.
 */
public final class ChangeNotificationDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeNotificationDispatcher.class);

  private final ReplicationGoal goal;
  private final List<ReplicationCoordinator> coordinators;

  public ChangeNotificationDispatcher(ReplicationGoal goal, List<ReplicationCoordinator> coordinators) {
    this.goal = Objects.requireNonNull(goal, "goal");
    this.coordinators = List.copyOf(Objects.requireNonNull(coordinators, "coordinators"));
  }

  /**
   * Handles one notification payload such as {@code {"id": 42}}.
   *
   * @return completion of the coordinator runs this notification started
   * @throws ReplicationException if the payload is not a JSON object with a positive integer {@code id}
   */
  public Future<Void> onNotification(String payload) {
    long eventId = parseEventId(payload);
    if (goal.raiseTo(eventId)) {
      LOG.debug("Replication goal raised to {}", eventId);
    }
    return triggerAll();
  }

  /**
   * Fires every coordinator without waiting. The returned future is for callers that want to wait anyway.
   */
  public Future<Void> triggerAll() {
    List<Future<Void>> runs = new ArrayList<>(coordinators.size());
    for (ReplicationCoordinator coordinator : coordinators) {
      runs.add(coordinator.trigger());
    }
    return Future.all(runs).mapEmpty();
  }

  static long parseEventId(String payload) {
    JsonObject json;
    try {
      json = new JsonObject(payload == null ? "" : payload);
    } catch (DecodeException | ClassCastException e) {
      LOG.error("Error parsing notification payload: {}", payload, e);
      throw new ReplicationException(ReplicationException.Reason.MALFORMED_NOTIFICATION,
        "Could not parse message payload: " + payload, e);
    }

    Object raw = json.getValue("id");
    if (raw instanceof Number) {
      Number number = (Number) raw;
      if (number.doubleValue() == Math.rint(number.doubleValue()) && number.longValue() > 0) {
        return number.longValue();
      }
    } else if (raw instanceof String) {
      try {
        long parsed = Long.parseLong(((String) raw).trim());
        if (parsed > 0) {
          return parsed;
        }
      } catch (NumberFormatException ignore) {
        // reported below
      }
    }
    LOG.error("Notification payload has no positive integer id: {}", payload);
    throw new ReplicationException(ReplicationException.Reason.MALFORMED_NOTIFICATION,
      raw + " is not a positive integer id in notification payload: " + payload);
  }
}
