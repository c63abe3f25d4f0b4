package reconciler.execute;

import reconciler.model.DeletionIntent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local memory of the reconciler. Holds two things only:
 * <ul>
 *   <li>the intents seen by the previous poll, to tell a vanished intent from one that
 *       was never there;</li>
 *   <li>the intents executed by this process, so a later poll that still lists them
 *       never triggers a second delete.</li>
 * </ul>
 *
 * <p>Neither is authoritative: the event store is. Both are lost on restart, where the
 * resource existence check takes over as the guard against a second delete.
 *
 * <p>This class is thread-safe.
 */
public final class IntentTracker {
  private final Map<String, DeletionIntent> lastSeen = new ConcurrentHashMap<>();
  private final Set<String> executed = ConcurrentHashMap.newKeySet();
  private final Map<String, ExecutionOutcome> awaitingEventPurge = new ConcurrentHashMap<>();

  /**
   * Replaces the previously seen intents with {@code present}.
   *
   * <p>An intent executed by this process that has now left the store is finished: it
   * is dropped here and never reported as vanished.
   *
   * @param present every intent listed by the current poll
   * @return the intents seen by the previous poll and missing from this one, excluding
   *     executed ones
   */
  public synchronized List<DeletionIntent> observe(Collection<DeletionIntent> present) {
    Map<String, DeletionIntent> current = new HashMap<>();
    for (DeletionIntent intent : present) {
      current.put(intent.intentId(), intent);
    }
    List<DeletionIntent> vanished = new ArrayList<>();
    for (DeletionIntent previous : lastSeen.values()) {
      String id = previous.intentId();
      if (current.containsKey(id)) {
        continue;
      }
      if (executed.contains(id)) {
        awaitingEventPurge.remove(id);
      } else {
        vanished.add(previous);
      }
    }
    lastSeen.clear();
    lastSeen.putAll(current);
    return vanished;
  }

  public boolean isTracked(String intentId) {
    return lastSeen.containsKey(intentId);
  }

  public int trackedCount() {
    return lastSeen.size();
  }

  /**
   * Drops the seen-set entry for an intent that left the store. The executed mark, if
   * any, is kept for the process lifetime.
   */
  public void forget(String intentId) {
    lastSeen.remove(intentId);
    awaitingEventPurge.remove(intentId);
  }

  /**
   * Marks the intent as executed. Its event still has to be removed from the store.
   *
   * @param outcome {@link ExecutionOutcome#DELETED} or {@link ExecutionOutcome#ALREADY_GONE}
   */
  public void markExecuted(String intentId, ExecutionOutcome outcome) {
    executed.add(intentId);
    awaitingEventPurge.put(intentId, outcome);
  }

  public void markEventPurged(String intentId) {
    awaitingEventPurge.remove(intentId);
  }

  public boolean isExecuted(String intentId) {
    return executed.contains(intentId);
  }

  /**
   * Returns how an executed intent ended if its event is still waiting to be removed.
   */
  public Optional<ExecutionOutcome> pendingEventPurge(String intentId) {
    return Optional.ofNullable(awaitingEventPurge.get(intentId));
  }
}
