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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.eventlog.core.Event;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventInsertStatementTest {

  private static final Instant TS = Instant.parse("2024-03-01T12:30:00.123456Z");

  @Test
  void writesOneRowPerEventWithExplicitIds() {
    List<Event> events = List.of(
      new Event(7, TS, "person-1", new JsonObject().put("name", "created")),
      new Event(8, TS, "person-2", new JsonObject().put("name", "updated")));

    String sql = EventInsertStatement.format("events", events);

    assertEquals("INSERT INTO events (id, ts, entity_id, event) VALUES "
      + "('7', '2024-03-01T12:30:00.123456Z', 'person-1', '{\"name\":\"created\"}'), "
      + "('8', '2024-03-01T12:30:00.123456Z', 'person-2', '{\"name\":\"updated\"}')", sql);
  }

  @Test
  void doublesSingleQuotesInEntityIdAndPayload() {
    Event event = new Event(1, TS, "o'brien", new JsonObject().put("lastName", "O'Brien"));

    String sql = EventInsertStatement.format("events", List.of(event));

    assertTrue(sql.contains("'o''brien'"), sql);
    assertTrue(sql.contains("'{\"lastName\":\"O''Brien\"}'"), sql);
  }

  @Test
  void copiesPayloadTextVerbatim() {
    String decimal = "{\"amount\": 12345678901234567.123456789}";
    String array = "[1, {\"b\": 2,  \"a\": 1}, \"x\"]";
    List<Event> events = List.of(
      new Event(1, TS, "e1", decimal),
      new Event(2, TS, "e2", array));

    String sql = EventInsertStatement.format("events", events);

    assertTrue(sql.contains("'" + decimal + "'"), sql);
    assertTrue(sql.contains("'" + array + "'"), sql);
  }

  @Test
  void usesTheConfiguredTable() {
    Event event = new Event(1, TS, "e", new JsonObject());

    assertTrue(EventInsertStatement.format("audit.events", List.of(event)).startsWith("INSERT INTO audit.events "));
  }

  @Test
  void rejectsEmptyBatches() {
    assertThrows(IllegalArgumentException.class, () -> EventInsertStatement.format("events", List.of()));
  }

  @Test
  void quoteWrapsAndEscapes() {
    assertEquals("''''", EventInsertStatement.quote("'"));
    assertEquals("'plain'", EventInsertStatement.quote("plain"));
  }
}
