package dev.henneberger.vertx.eventlog.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class EventTest {

  private static final Instant TS = Instant.parse("2026-03-01T10:15:30.123456Z");

  @Test
  void comparesEveryField() {
    Event event = new Event(7, TS, "person-1", new JsonObject().put("name", "Ann"));

    assertEquals(event, new Event(7, TS, "person-1", new JsonObject().put("name", "Ann")));
    assertNotEquals(event, new Event(8, TS, "person-1", new JsonObject().put("name", "Ann")));
    assertNotEquals(event, new Event(7, TS.plusNanos(1000), "person-1", new JsonObject().put("name", "Ann")));
    assertNotEquals(event, new Event(7, TS, "person-2", new JsonObject().put("name", "Ann")));
    assertNotEquals(event, new Event(7, TS, "person-1", new JsonObject().put("name", "Bob")));
  }

  @Test
  void keepsPayloadTextAsGiven() {
    String text = "{\"amount\": 12345678901234567.123456789,  \"amount\": 1}";
    Event event = new Event(1, TS, "person-1", text);

    assertEquals(text, event.payloadText());
    assertEquals(text, event.toJson().getString("event"));
  }

  @Test
  void comparesPayloadsAsText() {
    Event compact = new Event(1, TS, "person-1", "{\"a\":1,\"b\":2}");

    assertEquals(compact, new Event(1, TS, "person-1", "{\"a\":1,\"b\":2}"));
    assertNotEquals(compact, new Event(1, TS, "person-1", "{\"b\":2,\"a\":1}"));
    assertNotEquals(compact, new Event(1, TS, "person-1", "{\"a\": 1, \"b\": 2}"));
  }

  @Test
  void acceptsDocumentsThatAreNotObjects() {
    Event array = new Event(1, TS, "person-1", "[1, 2, 3]");
    Event scalar = new Event(2, TS, "person-1", "42");

    assertInstanceOf(JsonArray.class, array.decodePayload());
    assertEquals(3, ((JsonArray) array.decodePayload()).size());
    assertEquals(42, scalar.decodePayload());
  }

  @Test
  void encodesJsonObjectPayloads() {
    Event event = new Event(1, TS, "person-1", new JsonObject().put("name", "Ann"));

    assertEquals("{\"name\":\"Ann\"}", event.payloadText());
    assertEquals("Ann", ((JsonObject) event.decodePayload()).getString("name"));
  }

  @Test
  void ordersById() {
    List<Event> events = new ArrayList<>(List.of(
      new Event(3, TS, "a", new JsonObject()),
      new Event(1, TS, "b", new JsonObject()),
      new Event(2, TS, "c", new JsonObject())));

    events.sort(Event.BY_ID);

    assertEquals(List.of(1L, 2L, 3L), events.stream().map(Event::id).collect(Collectors.toList()));
  }

  @Test
  void rejectsIdsBelowOne() {
    assertThrows(IllegalArgumentException.class, () -> new Event(0, TS, "a", new JsonObject()));
  }
}
