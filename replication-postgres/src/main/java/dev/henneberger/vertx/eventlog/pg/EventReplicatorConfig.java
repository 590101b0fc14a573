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

import dev.henneberger.vertx.eventlog.core.EventReplicatorOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process configuration for the replicator: one event source, one or more replication destinations and the
 * copy tuning.
 *
 * <pre>
 * {
 *   "maxEventsPerRead": 50000,
 *   "maxEventsPerWrite": 10000,
 *   "connectTimeout": 15000,
 *   "notificationChannel": "eventsinsert",
 *   "eventSource": {"host": "localhost", "databaseName": "sourceDb", "user": "user1", "password": "..."},
 *   "replicationDestinations": [{"host": "localhost", "databaseName": "replicationDb1"}]
 * }
 * </pre>
 *
 * Connection objects accept every {@link PostgresConnectionOptions} key; {@code databaseName} is accepted as
 * an alias of {@code database}.
 */
public final class EventReplicatorConfig {

  private static final Logger LOG = LoggerFactory.getLogger(EventReplicatorConfig.class);

  public static final int MIN_MAX_EVENTS_PER_READ = EventReplicatorOptions.DEFAULT_MAX_EVENTS_PER_READ;
  public static final int MIN_MAX_EVENTS_PER_WRITE = EventReplicatorOptions.DEFAULT_MAX_EVENTS_PER_WRITE;

  private final PostgresConnectionOptions eventSource;
  private final List<PostgresConnectionOptions> replicationDestinations;
  private final EventReplicatorOptions replicatorOptions;
  private final String notificationChannel;

  private EventReplicatorConfig(PostgresConnectionOptions eventSource,
                                List<PostgresConnectionOptions> replicationDestinations,
                                EventReplicatorOptions replicatorOptions,
                                String notificationChannel) {
    this.eventSource = eventSource;
    this.replicationDestinations = List.copyOf(replicationDestinations);
    this.replicatorOptions = replicatorOptions;
    this.notificationChannel = notificationChannel;
  }

  public static EventReplicatorConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    String text = Files.readString(path, StandardCharsets.UTF_8);
    JsonObject json;
    try {
      json = new JsonObject(text);
    } catch (DecodeException e) {
      throw new ConfigurationException(List.of("configuration file " + path + " is not a JSON object: "
        + e.getMessage()));
    }
    return fromJson(json);
  }

  public static EventReplicatorConfig fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    List<String> errors = new ArrayList<>();

    int maxEventsPerRead = positiveInteger(json, "maxEventsPerRead", MIN_MAX_EVENTS_PER_READ, errors);
    if (maxEventsPerRead > 0 && maxEventsPerRead < MIN_MAX_EVENTS_PER_READ) {
      LOG.info("config.maxEventsPerRead set to minimum value of {}", MIN_MAX_EVENTS_PER_READ);
      maxEventsPerRead = MIN_MAX_EVENTS_PER_READ;
    }
    int maxEventsPerWrite = positiveInteger(json, "maxEventsPerWrite", MIN_MAX_EVENTS_PER_WRITE, errors);
    if (maxEventsPerWrite > 0 && maxEventsPerWrite < MIN_MAX_EVENTS_PER_WRITE) {
      LOG.info("config.maxEventsPerWrite set to minimum value of {}", MIN_MAX_EVENTS_PER_WRITE);
      maxEventsPerWrite = MIN_MAX_EVENTS_PER_WRITE;
    }
    if (maxEventsPerRead > 0 && maxEventsPerWrite > maxEventsPerRead) {
      errors.add("config.maxEventsPerWrite (" + maxEventsPerWrite + ") must not exceed config.maxEventsPerRead ("
        + maxEventsPerRead + ")");
    }
    int workerPoolSize =
      positiveInteger(json, "workerPoolSize", EventReplicatorOptions.DEFAULT_WORKER_POOL_SIZE, errors);
    int connectTimeout =
      positiveInteger(json, "connectTimeout", (int) PostgresConnectionOptions.DEFAULT_CONNECT_TIMEOUT_MS, errors);

    String notificationChannel = PostgresNotificationChannel.DEFAULT_CHANNEL;
    Object channelValue = json.getValue("notificationChannel");
    if (channelValue != null) {
      if (channelValue instanceof String && ((String) channelValue).matches("[A-Za-z_][A-Za-z0-9_]*")) {
        notificationChannel = (String) channelValue;
      } else {
        errors.add("config.notificationChannel is invalid:  " + channelValue);
      }
    }

    PostgresConnectionOptions source = connection(json.getValue("eventSource"), "config.eventSource",
      connectTimeout, errors);

    List<PostgresConnectionOptions> destinations = new ArrayList<>();
    Object destinationsValue = json.getValue("replicationDestinations");
    if (!(destinationsValue instanceof JsonArray)) {
      errors.add("config.replicationDestinations is not an Array or missing:  " + destinationsValue);
    } else if (((JsonArray) destinationsValue).isEmpty()) {
      errors.add("config.replicationDestinations has no elements");
    } else {
      JsonArray array = (JsonArray) destinationsValue;
      Set<String> seen = new LinkedHashSet<>();
      for (int i = 0; i < array.size(); i++) {
        PostgresConnectionOptions destination = connection(array.getValue(i),
          "config.replicationDestinations[" + i + "]", connectTimeout, errors);
        if (destination == null) {
          continue;
        }
        if (!seen.add(destination.hostDatabaseKey())) {
          errors.add("duplicate config.replicationDestinations host - databaseName combination detected at "
            + "replicationDestination[" + i + "]    host:  " + destination.getHost() + "   databaseName:  "
            + destination.getDatabase());
          continue;
        }
        destinations.add(destination);
      }
      if (source != null && seen.contains(source.hostDatabaseKey())) {
        errors.add("config.eventSource host - databaseName combination matches a "
          + "config.replicationDestination host - databaseName combination --  host:  " + source.getHost()
          + "   databaseName:  " + source.getDatabase());
      }
    }

    if (!errors.isEmpty()) {
      throw new ConfigurationException(errors);
    }

    EventReplicatorOptions options = new EventReplicatorOptions()
      .setMaxEventsPerRead(maxEventsPerRead)
      .setMaxEventsPerWrite(maxEventsPerWrite)
      .setWorkerPoolSize(workerPoolSize);
    return new EventReplicatorConfig(source, destinations, options, notificationChannel);
  }

  public PostgresConnectionOptions eventSource() {
    return new PostgresConnectionOptions(eventSource);
  }

  public List<PostgresConnectionOptions> replicationDestinations() {
    List<PostgresConnectionOptions> copies = new ArrayList<>(replicationDestinations.size());
    for (PostgresConnectionOptions destination : replicationDestinations) {
      copies.add(new PostgresConnectionOptions(destination));
    }
    return copies;
  }

  public EventReplicatorOptions replicatorOptions() {
    return new EventReplicatorOptions(replicatorOptions);
  }

  public String notificationChannel() {
    return notificationChannel;
  }

  /**
   * The resolved configuration with passwords removed, for logging.
   */
  public JsonObject describe() {
    JsonArray destinations = new JsonArray();
    for (PostgresConnectionOptions destination : replicationDestinations) {
      destinations.add(redacted(destination));
    }
    return new JsonObject()
      .put("eventSource", redacted(eventSource))
      .put("replicationDestinations", destinations)
      .put("maxEventsPerRead", replicatorOptions.getMaxEventsPerRead())
      .put("maxEventsPerWrite", replicatorOptions.getMaxEventsPerWrite())
      .put("workerPoolSize", replicatorOptions.getWorkerPoolSize())
      .put("notificationChannel", notificationChannel);
  }

  private static JsonObject redacted(PostgresConnectionOptions options) {
    JsonObject json = options.toJson();
    json.remove("password");
    return json;
  }

  private static PostgresConnectionOptions connection(Object value,
                                                      String name,
                                                      int connectTimeout,
                                                      List<String> errors) {
    if (!(value instanceof JsonObject)) {
      errors.add("connection parameters for " + name + " are missing or invalid");
      return null;
    }
    JsonObject json = ((JsonObject) value).copy();
    if (!json.containsKey("database") && json.containsKey("databaseName")) {
      json.put("database", json.getValue("databaseName"));
    }
    json.remove("databaseName");

    int before = errors.size();
    requireText(json, "host", name, errors);
    requireText(json, "database", name, errors);
    optionalText(json, "user", name, errors);
    optionalText(json, "password", name, errors);
    optionalText(json, "passwordEnv", name, errors);
    if (errors.size() > before) {
      return null;
    }
    if (!json.containsKey("connectTimeoutMs")) {
      json.put("connectTimeoutMs", (long) connectTimeout);
    }

    try {
      PostgresConnectionOptions options = new PostgresConnectionOptions(json);
      options.validate();
      return options;
    } catch (ClassCastException | NullPointerException | IllegalArgumentException e) {
      errors.add(name + " is invalid:  " + e.getMessage());
      return null;
    }
  }

  private static void requireText(JsonObject json, String key, String name, List<String> errors) {
    Object value = json.getValue(key);
    if (!(value instanceof String) || ((String) value).isBlank()) {
      errors.add(name + "." + ("database".equals(key) ? "databaseName" : key) + " is missing or invalid:  " + value);
    }
  }

  private static void optionalText(JsonObject json, String key, String name, List<String> errors) {
    Object value = json.getValue(key);
    if (value != null && !(value instanceof String)) {
      errors.add(name + "." + key + " is invalid:  " + value);
    }
  }

  private static int positiveInteger(JsonObject json, String key, int defaultValue, List<String> errors) {
    Object value = json.getValue(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      long number = ((Number) value).longValue();
      if (number > 0 && number <= Integer.MAX_VALUE) {
        return (int) number;
      }
    }
    errors.add("config." + key + " is not a positive integer:  " + value);
    return -1;
  }
}
