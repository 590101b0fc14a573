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

import dev.henneberger.vertx.eventlog.core.EventCursor;
import dev.henneberger.vertx.eventlog.core.EventSource;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The event source. Startup probes use the long-lived connection; every cursor gets its own connection.
 */
public final class PostgresEventSource extends AbstractPostgresEventStore implements EventSource {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresEventSource.class);

  private final int fetchSize;

  private PostgresEventSource(PostgresConnections connections, int fetchSize) throws SQLException {
    super(connections);
    this.fetchSize = fetchSize;
  }

  /**
   * @param fetchSize rows pulled from the server-side cursor per round trip
   */
  public static PostgresEventSource connect(PostgresConnectionOptions options, int fetchSize) throws SQLException {
    if (fetchSize < 1) {
      throw new IllegalArgumentException("fetchSize must be >= 1");
    }
    PostgresEventSource source = new PostgresEventSource(new PostgresConnections(options), fetchSize);
    LOG.debug("Opened event source {}", source.connections.describe());
    return source;
  }

  @Override
  public EventCursor openCursor(long afterId, int maxRows) throws SQLException {
    return JdbcEventCursor.open(connections, afterId, maxRows, fetchSize);
  }
}
