package reconciler.decision;

import reconciler.model.DeletionIntent;

import java.util.Objects;

/**
 * What one poll learned about one intent: either a fresh snapshot, or the fact that an
 * intent tracked on an earlier poll is no longer in the store.
 *
 * @param intentId       the intent's event-store id
 * @param snapshot       the fresh snapshot, or {@code null} if the intent is absent
 * @param previouslySeen whether an earlier poll in this process saw the intent
 */
public record IntentObservation(String intentId, DeletionIntent snapshot, boolean previouslySeen) {

  public IntentObservation {
    Objects.requireNonNull(intentId, "intentId");
    if (snapshot != null && !snapshot.intentId().equals(intentId)) {
      throw new IllegalArgumentException("snapshot belongs to " + snapshot.intentId() + ", not " + intentId);
    }
  }

  public static IntentObservation present(DeletionIntent snapshot, boolean previouslySeen) {
    return new IntentObservation(snapshot.intentId(), snapshot, previouslySeen);
  }

  public static IntentObservation vanished(String intentId) {
    return new IntentObservation(intentId, null, true);
  }

  public boolean isPresent() {
    return snapshot != null;
  }
}
