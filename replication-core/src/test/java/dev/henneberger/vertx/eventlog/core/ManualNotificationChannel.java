package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Notification channel driven by the test.
 */
final class ManualNotificationChannel implements ChangeNotificationChannel {

  private final Vertx vertx;
  private final AtomicInteger activeSubscriptions = new AtomicInteger();
  private volatile Handler<String> payloadHandler;
  private volatile Handler<Throwable> errorHandler;

  ManualNotificationChannel(Vertx vertx) {
    this.vertx = vertx;
  }

  @Override
  public Future<ReplicationSubscription> subscribe(Handler<String> payloadHandler, Handler<Throwable> errorHandler) {
    this.payloadHandler = payloadHandler;
    this.errorHandler = errorHandler;
    activeSubscriptions.incrementAndGet();
    return Future.succeededFuture(() -> {
      activeSubscriptions.decrementAndGet();
      this.payloadHandler = null;
    });
  }

  void publish(String payload) {
    Handler<String> handler = payloadHandler;
    if (handler != null) {
      vertx.runOnContext(v -> handler.handle(payload));
    }
  }

  void fail(Throwable error) {
    Handler<Throwable> handler = errorHandler;
    if (handler != null) {
      vertx.runOnContext(v -> handler.handle(error));
    }
  }

  int activeSubscriptions() {
    return activeSubscriptions.get();
  }
}
