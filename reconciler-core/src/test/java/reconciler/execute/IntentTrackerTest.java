package reconciler.execute;

import reconciler.model.DeletionIntent;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntentTrackerTest {

  private static final Instant AT = Instant.parse("2025-03-12T23:59:59Z");

  private static DeletionIntent intent(String id) {
    return new DeletionIntent(id, "10" + id.length(), null, "U1", null, AT, false);
  }

  @Test
  void observeReportsVanishedIntents() {
    IntentTracker tracker = new IntentTracker();
    tracker.observe(List.of(intent("a"), intent("b")));

    List<DeletionIntent> vanished = tracker.observe(List.of(intent("b")));

    assertEquals(1, vanished.size());
    assertEquals("a", vanished.get(0).intentId());
    assertFalse(tracker.isTracked("a"));
    assertTrue(tracker.isTracked("b"));
  }

  @Test
  void executedIntentLeavingTheStoreIsNotReportedAsVanished() {
    IntentTracker tracker = new IntentTracker();
    tracker.observe(List.of(intent("a"), intent("b")));
    tracker.markExecuted("a", ExecutionOutcome.DELETED);

    List<DeletionIntent> vanished = tracker.observe(List.of());

    assertEquals(List.of("b"), vanished.stream().map(DeletionIntent::intentId).toList());
    assertFalse(tracker.isTracked("a"));
    assertTrue(tracker.isExecuted("a"));
    assertTrue(tracker.pendingEventPurge("a").isEmpty());
  }

  @Test
  void firstObservationHasNothingVanished() {
    assertTrue(new IntentTracker().observe(List.of(intent("a"))).isEmpty());
  }

  @Test
  void executedMarkSurvivesForget() {
    IntentTracker tracker = new IntentTracker();
    tracker.markExecuted("a", ExecutionOutcome.DELETED);
    assertEquals(ExecutionOutcome.DELETED, tracker.pendingEventPurge("a").orElseThrow());

    tracker.forget("a");

    assertTrue(tracker.isExecuted("a"));
    assertTrue(tracker.pendingEventPurge("a").isEmpty());
  }

  @Test
  void failureStreaks() {
    FailureTracker failures = new FailureTracker();

    assertEquals(1, failures.recordFailure("a"));
    assertEquals(2, failures.recordFailure("a"));
    assertEquals(1, failures.recordFailure("b"));
    failures.reset("a");

    assertEquals(0, failures.streak("a"));
    assertEquals(1, failures.streak("b"));
  }
}
