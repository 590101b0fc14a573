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

import dev.henneberger.vertx.eventlog.core.Event;
import dev.henneberger.vertx.eventlog.core.EventDestination;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A replication destination written through one long-lived connection in auto-commit mode, so every
 * multi-row insert is its own transaction.
 */
public final class PostgresEventDestination extends AbstractPostgresEventStore implements EventDestination {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresEventDestination.class);

  private PostgresEventDestination(PostgresConnections connections) throws SQLException {
    super(connections);
  }

  public static PostgresEventDestination connect(PostgresConnectionOptions options) throws SQLException {
    PostgresEventDestination destination = new PostgresEventDestination(new PostgresConnections(options));
    LOG.debug("Opened replication destination {}", destination.connections.describe());
    return destination;
  }

  @Override
  public synchronized int insert(List<Event> events) throws SQLException {
    if (events.isEmpty()) {
      return 0;
    }
    String sql = EventInsertStatement.format(connections.table(), events);
    try (Statement statement = connection.createStatement()) {
      connections.applyStatementTimeout(statement);
      return statement.executeUpdate(sql);
    }
  }
}
