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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens JDBC connections for one {@link PostgresConnectionOptions}.
 */
final class PostgresConnections {

  private final PostgresConnectionOptions options;

  PostgresConnections(PostgresConnectionOptions options) {
    this.options = new PostgresConnectionOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
  }

  PostgresConnectionOptions options() {
    return options;
  }

  String database() {
    return options.getDatabase();
  }

  String table() {
    return options.getTable();
  }

  Connection open() throws SQLException {
    return DriverManager.getConnection(jdbcUrl(), connectionProperties());
  }

  void applyStatementTimeout(Statement statement) throws SQLException {
    if (options.getStatementTimeoutMs() > 0) {
      statement.setQueryTimeout(toSeconds(options.getStatementTimeoutMs()));
    }
  }

  String jdbcUrl() {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase();
  }

  String describe() {
    return "Database: " + options.getDatabase() + "    Host: " + options.getHost() + "    user: "
      + options.getUser() + "    SSL Connection: " + options.getSsl();
  }

  Properties connectionProperties() {
    Properties props = new Properties();
    if (options.getUser() != null && !options.getUser().isBlank()) {
      PGProperty.USER.set(props, options.getUser());
    }

    String password = resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    int timeoutSeconds = toSeconds(options.getConnectTimeoutMs());
    PGProperty.CONNECT_TIMEOUT.set(props, timeoutSeconds);
    PGProperty.LOGIN_TIMEOUT.set(props, timeoutSeconds);
    PGProperty.APPLICATION_NAME.set(props, "vertx-eventlog-replicator");

    if (Boolean.TRUE.equals(options.getSsl())) {
      props.setProperty("ssl", "true");
    }
    return props;
  }

  private String resolvePassword() {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }

  static int toSeconds(long millis) {
    return (int) Math.max(1L, (millis + 999L) / 1000L);
  }
}
