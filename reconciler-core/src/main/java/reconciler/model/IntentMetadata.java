package reconciler.model;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the metadata keys that carry a deletion intent on an event-store record, and
 * converts between {@link StoredEvent}/{@link NewEvent} and {@link DeletionIntent}.
 *
 * <p>All values are strings. {@code reminder_sent} is {@code "true"} or {@code "false"};
 * a missing key reads as {@code false}.
 */
public final class IntentMetadata {
  private static final Logger logger = Logger.getLogger(IntentMetadata.class.getName());

  /** Tag value under {@link #TYPE} that marks an event as a deletion intent. */
  public static final String TAG = "deletion-intent";

  public static final String TYPE = "type";
  public static final String RESOURCE_ID = "resource_id";
  public static final String RESOURCE_NAME = "resource_name";
  public static final String REQUESTOR = "requestor";
  public static final String REMINDER_SENT = "reminder_sent";
  public static final String SCHEDULED_BY = "scheduled_by";

  static final String SCHEDULER_NAME = "deletion-reconciler";

  private static final Duration EVENT_LENGTH = Duration.ofMinutes(1);

  private IntentMetadata() {
  }

  /**
   * Builds the event for a new intent. The event starts at {@code executeAt} and lasts
   * one minute; {@code reminder_sent} starts out {@code false}.
   */
  public static NewEvent newIntentEvent(String resourceId, String resourceName,
      String requestor, Instant executeAt) {
    Objects.requireNonNull(resourceId, "resourceId");
    Objects.requireNonNull(executeAt, "executeAt");

    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(TYPE, TAG);
    metadata.put(RESOURCE_ID, resourceId);
    metadata.put(RESOURCE_NAME, resourceName == null ? "" : resourceName);
    metadata.put(REQUESTOR, requestor == null ? "" : requestor);
    metadata.put(REMINDER_SENT, "false");
    metadata.put(SCHEDULED_BY, SCHEDULER_NAME);

    String described = resourceName == null || resourceName.isBlank()
        ? resourceId : resourceId + " (" + resourceName + ")";
    String description = "Scheduled deletion of resource " + described + ".";
    if (requestor != null && !requestor.isBlank()) {
      description += "\nRequested by <@" + requestor + ">";
    }
    return new NewEvent(
        "Resource " + resourceId + " scheduled for deletion",
        description,
        executeAt,
        executeAt.plus(EVENT_LENGTH),
        metadata);
  }

  /**
   * Metadata patch that flips {@code reminder_sent} to {@code true}. There is no
   * counterpart that sets it back.
   */
  public static Map<String, String> reminderSentPatch() {
    return Map.of(REMINDER_SENT, "true");
  }

  /**
   * Decodes a stored event. Events without a {@code resource_id} are skipped with a
   * warning rather than failing the whole poll.
   *
   * @return the decoded intent, or empty if the event does not carry one
   */
  public static Optional<DeletionIntent> decode(StoredEvent event) {
    Map<String, String> md = event.metadata();
    String resourceId = trimToNull(md.get(RESOURCE_ID));
    if (resourceId == null) {
      logger.log(Level.WARNING, "Deletion event {0} missing resource_id; skipping", event.eventId());
      return Optional.empty();
    }
    return Optional.of(new DeletionIntent(
        event.eventId(),
        resourceId,
        trimToNull(md.get(RESOURCE_NAME)),
        md.getOrDefault(REQUESTOR, ""),
        event.createdAt(),
        event.startsAt(),
        isReminderSent(md)));
  }

  public static boolean isReminderSent(Map<String, String> metadata) {
    String raw = metadata.get(REMINDER_SENT);
    return raw != null && raw.trim().toLowerCase(Locale.ROOT).equals("true");
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
