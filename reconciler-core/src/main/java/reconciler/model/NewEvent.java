package reconciler.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Event to be created through {@link reconciler.spi.EventStore#create(NewEvent)}.
 *
 * @param summary     one-line title
 * @param description free-text body
 * @param startsAt    start of the event (the deletion time)
 * @param endsAt      end of the event
 * @param metadata    flat key/value metadata, see {@link IntentMetadata}
 */
public record NewEvent(
    String summary,
    String description,
    Instant startsAt,
    Instant endsAt,
    Map<String, String> metadata
) {

  public NewEvent {
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(startsAt, "startsAt");
    Objects.requireNonNull(endsAt, "endsAt");
    if (endsAt.isBefore(startsAt)) {
      throw new IllegalArgumentException("endsAt must not be before startsAt");
    }
    description = description == null ? "" : description;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
