package reconciler.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Read-only snapshot of a scheduled deletion, decoded from an event-store record on
 * every poll. Never mutated locally; a state change is committed to the store and
 * observed on the next poll.
 *
 * @param intentId     opaque event-store handle, stable for the intent's lifetime
 * @param resourceId   id of the resource to delete (string form of an integer id)
 * @param resourceName display name cached when the intent was created, or {@code null}
 * @param requestor    id of the user who scheduled the deletion
 * @param createdAt    when the deletion was scheduled
 * @param executeAt    when the deletion is due
 * @param reminderSent whether the day-before reminder has been committed
 * @see IntentMetadata#decode(StoredEvent)
 */
public record DeletionIntent(
    String intentId,
    String resourceId,
    String resourceName,
    String requestor,
    Instant createdAt,
    Instant executeAt,
    boolean reminderSent
) {

  public DeletionIntent {
    Objects.requireNonNull(intentId, "intentId");
    Objects.requireNonNull(resourceId, "resourceId");
    Objects.requireNonNull(executeAt, "executeAt");
    requestor = requestor == null ? "" : requestor;
    createdAt = createdAt == null ? executeAt : createdAt;
    if (resourceName != null && resourceName.isBlank()) {
      resourceName = null;
    }
  }

  /**
   * Returns the instant from which the reminder becomes due.
   *
   * @param reminderWindow how long before {@link #executeAt()} the reminder opens
   * @return {@code executeAt - reminderWindow}
   */
  public Instant reminderAt(Duration reminderWindow) {
    return executeAt.minus(reminderWindow);
  }

  /**
   * Returns {@code "<id>"} or {@code "<id> (<name>)"} for user-facing text.
   */
  public String describeResource() {
    return resourceName == null ? resourceId : resourceId + " (" + resourceName + ")";
  }

  public boolean hasRequestor() {
    return !requestor.isBlank();
  }
}
