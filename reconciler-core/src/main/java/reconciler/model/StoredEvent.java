package reconciler.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Raw event as returned by {@link reconciler.spi.EventStore#listOpen(String)}.
 *
 * @param eventId   event-store handle
 * @param startsAt  the event's start time; for deletion intents this is the due time
 * @param createdAt when the event was created, or {@code null} if the store does not say
 * @param metadata  flat key/value metadata attached to the event
 */
public record StoredEvent(
    String eventId,
    Instant startsAt,
    Instant createdAt,
    Map<String, String> metadata
) {

  public StoredEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(startsAt, "startsAt");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
