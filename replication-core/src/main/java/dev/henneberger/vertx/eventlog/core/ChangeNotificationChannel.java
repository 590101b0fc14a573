package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * Push subscription to the source's change notifications.
 *
 * <p>Implementations must deliver payloads as the server pushes them, without polling the event table, and
 * must call handlers on a Vert.x context.
 */
public interface ChangeNotificationChannel {

  /**
   * @return a future completing once the subscription is active on the server
   */
  Future<ReplicationSubscription> subscribe(Handler<String> payloadHandler, Handler<Throwable> errorHandler);
}
