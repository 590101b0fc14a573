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
import dev.henneberger.vertx.eventlog.core.EventStore;
import dev.henneberger.vertx.eventlog.core.ReplicationException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Events table behind one long-lived connection.
 */
abstract class AbstractPostgresEventStore implements EventStore {

  protected final PostgresConnections connections;
  protected final Connection connection;

  protected AbstractPostgresEventStore(PostgresConnections connections) throws SQLException {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.connection = connections.open();
  }

  @Override
  public String name() {
    return connections.database();
  }

  @Override
  public synchronized long rowCount() throws SQLException {
    Long count = selectScalar("SELECT count(*) AS count FROM " + connections.table());
    return count == null ? 0L : count;
  }

  @Override
  public synchronized long maximumEventId() throws SQLException {
    // the minimum value for the id column is 1, so an empty table reports 0
    Long maxId = selectScalar("SELECT max(id) AS max_id FROM " + connections.table());
    if (maxId == null) {
      return 0L;
    }
    if (maxId < Event.MINIMUM_ID) {
      throw new ReplicationException(ReplicationException.Reason.INVALID_QUERY_RESULT,
        "Maximum " + connections.table() + ".id (" + maxId + ") is invalid for database " + name());
    }
    return maxId;
  }

  @Override
  public synchronized Optional<Event> eventWithMinimumId() throws SQLException {
    String table = connections.table();
    String sql = "SELECT id, ts, entity_id, event FROM " + table
      + " WHERE id = (SELECT min(id) FROM " + table + ")";
    try (Statement statement = connection.createStatement()) {
      connections.applyStatementTimeout(statement);
      try (ResultSet rs = statement.executeQuery(sql)) {
        if (!rs.next()) {
          return Optional.empty();
        }
        long minId = rs.getLong("id");
        if (minId < Event.MINIMUM_ID) {
          throw new ReplicationException(ReplicationException.Reason.INVALID_QUERY_RESULT,
            "Minimum " + table + ".id (" + minId + ") is invalid for database " + name());
        }
        Event event = mapRow(rs, name());
        if (rs.next()) {
          throw new ReplicationException(ReplicationException.Reason.INVALID_QUERY_RESULT,
            "More than one row returned for minimum id " + minId + " in database " + name());
        }
        return Optional.of(event);
      }
    }
  }

  @Override
  public void close() throws SQLException {
    connection.close();
  }

  @Override
  public String toString() {
    return connections.describe();
  }

  private Long selectScalar(String sql) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      connections.applyStatementTimeout(statement);
      try (ResultSet rs = statement.executeQuery(sql)) {
        if (!rs.next()) {
          return null;
        }
        long value = rs.getLong(1);
        Long result = rs.wasNull() ? null : value;
        if (rs.next()) {
          throw new ReplicationException(ReplicationException.Reason.INVALID_QUERY_RESULT,
            "Row count returned for SELECT statement is invalid for database " + name() + ": " + sql);
        }
        return result;
      }
    }
  }

  static Event mapRow(ResultSet rs, String database) throws SQLException {
    long id = rs.getLong("id");
    OffsetDateTime ts = rs.getObject("ts", OffsetDateTime.class);
    String entityId = rs.getString("entity_id");
    String payload = rs.getString("event");
    if (ts == null || entityId == null || payload == null) {
      throw new ReplicationException(ReplicationException.Reason.INVALID_QUERY_RESULT,
        "Event " + id + " in database " + database + " has a null column");
    }
    // the document text is copied as read so replicas stay byte-identical to the source
    return new Event(id, ts.toInstant(), entityId, payload);
  }
}
