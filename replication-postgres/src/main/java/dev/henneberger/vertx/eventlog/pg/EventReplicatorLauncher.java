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

import dev.henneberger.vertx.eventlog.core.EventReplicator;
import dev.henneberger.vertx.eventlog.core.EventReplicatorOptions;
import io.vertx.core.Vertx;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: {@code EventReplicatorLauncher <config.json> [--dry-run]}.
 *
 * <p>Exit status 2 means the arguments or configuration were rejected, or {@code --dry-run} was given. Exit
 * status 1 means replication failed. A clean shutdown through SIGINT or SIGTERM exits with 0.
 */
public final class EventReplicatorLauncher {

  private static final Logger LOG = LoggerFactory.getLogger(EventReplicatorLauncher.class);

  static final String CONFIG_ENV = "REPLICATOR_CONFIG";
  static final int EXIT_FAILURE = 1;
  static final int EXIT_INVALID = 2;
  static final String USAGE = "Usage: EventReplicatorLauncher <config.json> [--dry-run]";

  private final Map<String, String> env;

  EventReplicatorLauncher(Map<String, String> env) {
    this.env = Objects.requireNonNull(env, "env");
  }

  public static void main(String[] args) {
    int exitCode = new EventReplicatorLauncher(System.getenv()).run(args);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  int run(String[] args) {
    boolean dryRun = false;
    List<String> positional = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--dry-run".equals(arg)) {
        dryRun = true;
      } else if ("-c".equals(arg) || "--config-filename".equals(arg)) {
        if (i + 1 >= args.length) {
          LOG.error("Invalid command line arguments: {} requires a file name\n{}", arg, USAGE);
          return EXIT_INVALID;
        }
        positional.add(args[++i]);
      } else if (arg.startsWith("-")) {
        LOG.error("Invalid command line arguments: unknown option {}\n{}", arg, USAGE);
        return EXIT_INVALID;
      } else {
        positional.add(arg);
      }
    }
    if (positional.isEmpty()) {
      String fromEnv = env.get(CONFIG_ENV);
      if (fromEnv != null && !fromEnv.isBlank()) {
        positional.add(fromEnv);
      }
    }
    if (positional.size() != 1) {
      LOG.error("Invalid command line arguments: exactly one configuration file is required\n{}", USAGE);
      return EXIT_INVALID;
    }

    Path configFile = Path.of(positional.get(0)).toAbsolutePath();
    EventReplicatorConfig config;
    try {
      LOG.info("Config File Name:  \"{}\"", configFile);
      config = EventReplicatorConfig.load(configFile);
    } catch (ConfigurationException e) {
      LOG.error(e.getMessage());
      return EXIT_INVALID;
    } catch (IOException e) {
      LOG.error("Exception detected processing configuration file {}", configFile, e);
      return EXIT_FAILURE;
    }

    LOG.info("Resolved configuration: {}", config.describe().encodePrettily());
    if (dryRun) {
      LOG.info("--dry-run specified, ending program");
      return EXIT_INVALID;
    }
    return replicate(config);
  }

  private int replicate(EventReplicatorConfig config) {
    EventReplicatorOptions options = config.replicatorOptions();
    Vertx vertx = Vertx.vertx();
    List<PostgresEventDestination> destinations = new ArrayList<>();
    PostgresEventSource source = null;
    try {
      source = PostgresEventSource.connect(config.eventSource(), options.getMaxEventsPerWrite());
      for (PostgresConnectionOptions destination : config.replicationDestinations()) {
        destinations.add(PostgresEventDestination.connect(destination));
      }
    } catch (SQLException e) {
      LOG.error("Unable to connect to database", e);
      closeAll(source, destinations);
      vertx.close();
      return EXIT_FAILURE;
    }

    PostgresNotificationChannel channel =
      new PostgresNotificationChannel(vertx, config.eventSource(), config.notificationChannel());
    EventReplicator replicator = new EventReplicator(vertx, source, destinations, channel, options);
    ReplicationLogging.attachDefaultLogging(replicator, LOG);

    CompletableFuture<Integer> exitCode = new CompletableFuture<>();
    replicator.onFailure(err -> exitCode.complete(EXIT_FAILURE));
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      if (exitCode.complete(0)) {
        LOG.info("Shutdown signal received");
      }
      replicator.close();
      vertx.close();
    }, "event-replicator-shutdown"));

    replicator.start().onFailure(err -> exitCode.complete(EXIT_FAILURE));

    int code = exitCode.join();
    if (code != 0) {
      replicator.close();
      vertx.close();
    }
    return code;
  }

  private static void closeAll(PostgresEventSource source, List<PostgresEventDestination> destinations) {
    List<AutoCloseable> stores = new ArrayList<>(destinations);
    if (source != null) {
      stores.add(source);
    }
    for (AutoCloseable store : stores) {
      try {
        store.close();
      } catch (Exception e) {
        LOG.warn("Failed to close {}", store, e);
      }
    }
  }
}
