/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.eventlog.pg;

import dev.henneberger.vertx.eventlog.core.ChangeNotificationChannel;
import dev.henneberger.vertx.eventlog.core.OptionValidation;
import dev.henneberger.vertx.eventlog.core.ReplicationSubscription;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives {@code NOTIFY} payloads for one channel on the event source.
 *
 * <p>Each subscription holds a dedicated connection and a daemon thread polling it. Payloads and errors are
 * delivered on the Vert.x context that subscribed.
 */
public final class PostgresNotificationChannel implements ChangeNotificationChannel {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresNotificationChannel.class);

  public static final String DEFAULT_CHANNEL = "eventsinsert";
  static final int POLL_TIMEOUT_MS = 500;

  private final Vertx vertx;
  private final PostgresConnections connections;
  private final String channel;

  public PostgresNotificationChannel(Vertx vertx, PostgresConnectionOptions options, String channel) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.connections = new PostgresConnections(options);
    OptionValidation.requireIdentifier("channel", channel);
    if (channel.indexOf('.') >= 0) {
      throw new IllegalArgumentException("channel must not be schema-qualified");
    }
    this.channel = channel;
  }

  public String channel() {
    return channel;
  }

  @Override
  public Future<ReplicationSubscription> subscribe(Handler<String> payloadHandler, Handler<Throwable> errorHandler) {
    Objects.requireNonNull(payloadHandler, "payloadHandler");
    Objects.requireNonNull(errorHandler, "errorHandler");
    Context context = vertx.getOrCreateContext();
    Promise<ReplicationSubscription> listening = Promise.promise();
    Listener listener = new Listener(context, payloadHandler, errorHandler, listening);
    Thread thread = new Thread(listener, "pg-listen-" + channel);
    thread.setDaemon(true);
    listener.thread = thread;
    thread.start();
    return listening.future();
  }

  private final class Listener implements Runnable {

    private final Context context;
    private final Handler<String> payloadHandler;
    private final Handler<Throwable> errorHandler;
    private final Promise<ReplicationSubscription> listening;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private volatile Thread thread;
    private volatile Connection connection;

    private Listener(Context context,
                     Handler<String> payloadHandler,
                     Handler<Throwable> errorHandler,
                     Promise<ReplicationSubscription> listening) {
      this.context = context;
      this.payloadHandler = payloadHandler;
      this.errorHandler = errorHandler;
      this.listening = listening;
    }

    @Override
    public void run() {
      boolean listenActive = false;
      try (Connection conn = connections.open()) {
        connection = conn;
        try (Statement statement = conn.createStatement()) {
          statement.execute("LISTEN " + channel);
        }
        PGConnection pgConnection = conn.unwrap(PGConnection.class);
        LOG.info("Listening for notifications on channel {} - {}", channel, connections.describe());
        listenActive = true;
        context.runOnContext(v -> listening.tryComplete(this::cancel));

        while (running.get()) {
          PGNotification[] notifications = pgConnection.getNotifications(POLL_TIMEOUT_MS);
          if (notifications == null) {
            continue;
          }
          for (PGNotification notification : notifications) {
            String payload = notification.getParameter();
            LOG.debug("Notification received on {}: {}", notification.getName(), payload);
            context.runOnContext(v -> {
              if (running.get()) {
                payloadHandler.handle(payload);
              }
            });
          }
        }
      } catch (SQLException | RuntimeException e) {
        if (!running.get()) {
          LOG.debug("Listener on channel {} stopped", channel, e);
          return;
        }
        running.set(false);
        if (listenActive) {
          LOG.error("Notification listener on channel {} failed", channel, e);
          context.runOnContext(v -> errorHandler.handle(e));
        } else {
          context.runOnContext(v -> listening.tryFail(e));
        }
      } finally {
        connection = null;
      }
    }

    private void cancel() {
      if (!running.compareAndSet(true, false)) {
        return;
      }
      Thread current = thread;
      if (current != null) {
        current.interrupt();
      }
      Connection conn = connection;
      if (conn != null) {
        try {
          conn.close();
        } catch (SQLException e) {
          LOG.warn("Failed to close listener connection for channel {}", channel, e);
        }
      }
    }
  }
}
