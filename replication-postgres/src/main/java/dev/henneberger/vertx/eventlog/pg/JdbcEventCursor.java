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
import dev.henneberger.vertx.eventlog.core.EventCursor;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Streams events from a server-side cursor on a connection dedicated to one copy cycle.
 *
 * <p>pgjdbc only uses a portal, rather than buffering the whole result, when auto-commit is off and a fetch
 * size is set.
 */
final class JdbcEventCursor implements EventCursor {

  private final String database;
  private final Connection connection;
  private final PreparedStatement statement;
  private final ResultSet resultSet;
  private boolean exhausted;
  private boolean closed;

  private JdbcEventCursor(String database, Connection connection, PreparedStatement statement, ResultSet resultSet) {
    this.database = database;
    this.connection = connection;
    this.statement = statement;
    this.resultSet = resultSet;
  }

  static JdbcEventCursor open(PostgresConnections connections, long afterId, int maxRows, int fetchSize)
    throws SQLException {
    String sql = "SELECT id, ts, entity_id, event FROM " + connections.table()
      + " WHERE id > ? ORDER BY id LIMIT ?";
    Connection connection = connections.open();
    PreparedStatement statement = null;
    try {
      connection.setAutoCommit(false);
      connection.setReadOnly(true);
      statement = connection.prepareStatement(sql);
      statement.setFetchSize(fetchSize);
      connections.applyStatementTimeout(statement);
      statement.setLong(1, afterId);
      statement.setInt(2, maxRows);
      ResultSet resultSet = statement.executeQuery();
      return new JdbcEventCursor(connections.database(), connection, statement, resultSet);
    } catch (SQLException | RuntimeException e) {
      if (statement != null) {
        closeSuppressed(statement, e);
      }
      closeSuppressed(connection, e);
      throw e;
    }
  }

  @Override
  public List<Event> next(int maxEvents) throws SQLException {
    List<Event> events = new ArrayList<>(Math.min(maxEvents, 1024));
    while (!exhausted && events.size() < maxEvents) {
      if (resultSet.next()) {
        events.add(AbstractPostgresEventStore.mapRow(resultSet, database));
      } else {
        exhausted = true;
      }
    }
    return events;
  }

  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    SQLException failure = null;
    try {
      resultSet.close();
    } catch (SQLException e) {
      failure = e;
    }
    try {
      statement.close();
    } catch (SQLException e) {
      failure = chain(failure, e);
    }
    try {
      connection.rollback();
    } catch (SQLException e) {
      failure = chain(failure, e);
    }
    try {
      connection.close();
    } catch (SQLException e) {
      failure = chain(failure, e);
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static SQLException chain(SQLException first, SQLException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }

  private static void closeSuppressed(AutoCloseable closeable, Exception primary) {
    try {
      closeable.close();
    } catch (Exception e) {
      primary.addSuppressed(e);
    }
  }
}
