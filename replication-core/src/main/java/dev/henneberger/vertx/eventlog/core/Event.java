package dev.henneberger.vertx.eventlog.core;

import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * One immutable record of the event log.
 *
 * <p>The {@code id} is assigned once by the event source and is never reused, so two events with the same id
 * must be equal field for field wherever they are copied. The payload is kept as the exact document text read
 * from the source and is compared as text.
 */
public final class Event {

  public static final long MINIMUM_ID = 1L;

  public static final Comparator<Event> BY_ID = Comparator.comparingLong(Event::id);

  private final long id;
  private final Instant timestamp;
  private final String entityId;
  private final String payload;

  public Event(long id, Instant timestamp, String entityId, JsonObject payload) {
    this(id, timestamp, entityId, Objects.requireNonNull(payload, "payload").encode());
  }

  /**
   * @param payloadText the JSON document exactly as stored; it is never reparsed or re-encoded
   */
  public Event(long id, Instant timestamp, String entityId, String payloadText) {
    if (id < MINIMUM_ID) {
      throw new IllegalArgumentException("id must be >= " + MINIMUM_ID + " but was " + id);
    }
    this.id = id;
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.entityId = Objects.requireNonNull(entityId, "entityId");
    this.payload = Objects.requireNonNull(payloadText, "payloadText");
  }

  public long id() {
    return id;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String entityId() {
    return entityId;
  }

  public String payloadText() {
    return payload;
  }

  /**
   * Decodes the payload on each call. The result may be a {@code JsonObject}, a {@code JsonArray} or a scalar,
   * and numbers lose precision beyond what a {@code double} holds.
   */
  public Object decodePayload() {
    return Json.decodeValue(payload);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("id", id)
      .put("ts", timestamp.toString())
      .put("entity_id", entityId)
      .put("event", payload);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Event)) {
      return false;
    }
    Event that = (Event) other;
    return id == that.id
      && timestamp.equals(that.timestamp)
      && entityId.equals(that.entityId)
      && payload.equals(that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, timestamp, entityId, payload);
  }

  @Override
  public String toString() {
    return toJson().encode();
  }
}
