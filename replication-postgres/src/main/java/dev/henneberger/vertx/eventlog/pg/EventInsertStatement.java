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
import java.util.List;

/**
 * Builds the multi-row insert for one write batch.
 *
 * <p>Values are written as string literals so that a batch of any size is a single statement regardless of
 * the driver's bind parameter limit. Ids are explicit; the destination must not generate them.
 */
final class EventInsertStatement {

  private EventInsertStatement() {
  }

  static String format(String table, List<Event> events) {
    if (events.isEmpty()) {
      throw new IllegalArgumentException("events must not be empty");
    }
    StringBuilder sql = new StringBuilder(64 + events.size() * 128)
      .append("INSERT INTO ").append(table).append(" (id, ts, entity_id, event) VALUES ");
    for (int i = 0; i < events.size(); i++) {
      Event event = events.get(i);
      if (i > 0) {
        sql.append(", ");
      }
      sql.append("('").append(event.id()).append("', '")
        .append(event.timestamp()).append("', ")
        .append(quote(event.entityId())).append(", ")
        .append(quote(event.payloadText())).append(')');
    }
    return sql.toString();
  }

  static String quote(String value) {
    return '\'' + value.replace("'", "''") + '\'';
  }
}
