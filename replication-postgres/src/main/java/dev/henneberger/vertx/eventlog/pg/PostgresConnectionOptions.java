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

import dev.henneberger.vertx.eventlog.core.OptionValidation;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.core.json.JsonObject;

/**
 * Connection settings for one events database, either the event source or a replication destination.
 */
@DataObject
public class PostgresConnectionOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_TABLE = "events";
  public static final long DEFAULT_CONNECT_TIMEOUT_MS = 15_000L;

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String table;
  private long connectTimeoutMs;
  private long statementTimeoutMs;

  public PostgresConnectionOptions() {
    init();
  }

  public PostgresConnectionOptions(JsonObject json) {
    init();
    PostgresConnectionOptionsConverter.fromJson(json, this);
  }

  public PostgresConnectionOptions(PostgresConnectionOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.table = other.table;
    this.connectTimeoutMs = other.connectTimeoutMs;
    this.statementTimeoutMs = other.statementTimeoutMs;
  }

  public String getHost() {
    return host;
  }

  public PostgresConnectionOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresConnectionOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresConnectionOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresConnectionOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresConnectionOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresConnectionOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresConnectionOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getTable() {
    return table;
  }

  public PostgresConnectionOptions setTable(String table) {
    this.table = table;
    return this;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public PostgresConnectionOptions setConnectTimeoutMs(long connectTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
    return this;
  }

  /**
   * Per-statement timeout, {@code 0} for none.
   */
  public long getStatementTimeoutMs() {
    return statementTimeoutMs;
  }

  public PostgresConnectionOptions setStatementTimeoutMs(long statementTimeoutMs) {
    this.statementTimeoutMs = statementTimeoutMs;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresConnectionOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresConnectionOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresConnectionOptions(json);
  }

  /**
   * {@code host_database}, lower-cased. Two options naming the same key point at the same events table.
   */
  public String hostDatabaseKey() {
    return String.valueOf(host).toLowerCase() + '_' + String.valueOf(database).toLowerCase();
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.requireIdentifier("table", table);
    OptionValidation.requireMin("connectTimeoutMs", connectTimeoutMs, 1L);
    OptionValidation.requireMin("statementTimeoutMs", statementTimeoutMs, 0L);
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    table = DEFAULT_TABLE;
    connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    statementTimeoutMs = 0L;
  }
}
