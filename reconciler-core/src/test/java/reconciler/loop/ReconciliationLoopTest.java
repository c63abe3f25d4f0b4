package reconciler.loop;

import reconciler.CountingMetricsExporter;
import reconciler.MutableClock;
import reconciler.RecordingNotifier;
import reconciler.StubEventStore;
import reconciler.StubResourceControl;
import reconciler.TransientCollaboratorException;
import reconciler.execute.ActionExecutor;
import reconciler.execute.TimedCalls;
import reconciler.model.IntentMetadata;
import reconciler.model.ResourceStatus;
import reconciler.model.StoredEvent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationLoopTest {

  private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

  private StubEventStore store;
  private StubResourceControl resources;
  private RecordingNotifier notifier;
  private CountingMetricsExporter metrics;
  private MutableClock clock;
  private TimedCalls calls;
  private ReconciliationLoop loop;

  @BeforeEach
  void setUp() {
    store = new StubEventStore();
    resources = new StubResourceControl();
    notifier = new RecordingNotifier();
    metrics = new CountingMetricsExporter();
    clock = new MutableClock(NOW);
    calls = new TimedCalls(Duration.ofSeconds(5));
    loop = newLoop(Duration.ofMinutes(5));
  }

  @AfterEach
  void tearDown() {
    loop.close();
    calls.close();
  }

  private ReconciliationLoop newLoop(Duration checkInterval) {
    return newLoop(checkInterval, Duration.ofSeconds(1));
  }

  private ReconciliationLoop newLoop(Duration checkInterval, Duration gracePeriod) {
    ActionExecutor executor = ActionExecutor.builder()
        .eventStore(store)
        .resourceControl(resources)
        .notifier(notifier)
        .calls(calls)
        .metrics(metrics)
        .build();
    return ReconciliationLoop.builder()
        .eventStore(store)
        .executor(executor)
        .calls(calls)
        .metrics(metrics)
        .clock(clock)
        .checkInterval(checkInterval)
        .retryPolicy(new FixedDelayRetryPolicy(Duration.ofSeconds(60)))
        .gracePeriod(gracePeriod)
        .build();
  }

  /** Replaces the default loop with one whose resource deletes block until released. */
  private BlockingResourceControl useBlockingDeletes(Duration gracePeriod) {
    BlockingResourceControl blocking = new BlockingResourceControl();
    resources = blocking;
    loop.close();
    loop = newLoop(Duration.ofHours(1), gracePeriod);
    return blocking;
  }

  // ── One cycle ────────────────────────────────────────────────────

  @Test
  void runOnce_drivesEachIntentToItsDueAction() {
    resources.add("101", "a", ResourceStatus.RUNNING)
        .add("102", "b", ResourceStatus.RUNNING)
        .add("103", "c", ResourceStatus.RUNNING);
    store.add("101", "U1", NOW.minus(Duration.ofHours(1)), false);
    String remind = store.add("102", "U1", NOW.plus(Duration.ofHours(20)), false);
    store.add("103", "U1", NOW.plus(Duration.ofDays(2)), false);

    IterationReport report = loop.runOnce();

    assertFalse(report.fetchFailed());
    assertEquals(3, report.openIntents());
    assertEquals(1, report.executions());
    assertEquals(1, report.reminders());
    assertEquals(0, report.failures());
    assertEquals(List.of("101"), resources.deleted);
    assertTrue(IntentMetadata.isReminderSent(store.get(remind).metadata()));
    assertEquals(3, metrics.openIntents.get());
    assertTrue(metrics.cycleDurationMs.get() >= 0);
  }

  @Test
  void runOnce_reminderIsNotRepeatedNextCycle() {
    store.add("102", "U1", NOW.plus(Duration.ofHours(20)), false);
    loop.runOnce();
    int sent = notifier.count();

    clock.advance(Duration.ofMinutes(5));
    IterationReport second = loop.runOnce();

    assertEquals(0, second.reminders());
    assertEquals(sent, notifier.count());
  }

  @Test
  void runOnce_failureIsIsolatedToItsIntent() {
    resources.add("101", "a", ResourceStatus.RUNNING).add("102", "b", ResourceStatus.RUNNING);
    resources.deleteFailures.put("101", new TransientCollaboratorException("locked"));
    String failing = store.add("101", "U1", NOW.minus(Duration.ofHours(2)), true);
    store.add("102", "U1", NOW.minus(Duration.ofHours(1)), true);

    IterationReport report = loop.runOnce();

    assertEquals(1, report.failures());
    assertEquals(1, report.executions());
    assertEquals(List.of("102"), resources.deleted);
    assertTrue(store.contains(failing));
  }

  @Test
  void runOnce_failedDeleteIsRetriedNextCycle() {
    resources.add("101", "a", ResourceStatus.RUNNING);
    resources.deleteFailures.put("101", new TransientCollaboratorException("locked"));
    store.add("101", "U1", NOW.minus(Duration.ofHours(1)), true);
    loop.runOnce();

    resources.deleteFailures.clear();
    IterationReport report = loop.runOnce();

    assertEquals(1, report.executions());
    assertEquals(List.of("101"), resources.deleted);
    assertEquals(0, store.size());
  }

  @Test
  void runOnce_duplicateIntents_actsOnEarliestOnly() {
    resources.add("101", "a", ResourceStatus.RUNNING);
    store.add("101", "U1", NOW.minus(Duration.ofHours(1)), true);
    String later = store.add("101", "U2", NOW.plus(Duration.ofHours(3)), false);

    IterationReport report = loop.runOnce();

    assertEquals(1, report.duplicates());
    assertEquals(1, report.executions());
    assertEquals(0, report.reminders());
    assertEquals(1, metrics.duplicateIntent.get());
    assertEquals(1, resources.deleteCalls.get());
    assertTrue(store.contains(later));
    assertFalse(IntentMetadata.isReminderSent(store.get(later).metadata()));
  }

  @Test
  void runOnce_vanishedIntentIsPurged() {
    String id = store.add("101", "U1", NOW.plus(Duration.ofDays(2)), false);
    loop.runOnce();

    store.remove(id);
    IterationReport report = loop.runOnce();

    assertEquals(1, report.purges());
    assertEquals(1, metrics.purged.get());
    assertEquals(0, notifier.count());
  }

  @Test
  void runOnce_executedIntentIsNotPurgedOnceItsEventIsGone() {
    resources.add("101", "a", ResourceStatus.RUNNING);
    store.add("101", "U1", NOW.minus(Duration.ofHours(1)), true);

    IterationReport first = loop.runOnce();
    IterationReport second = loop.runOnce();

    assertEquals(1, first.executions());
    assertEquals(0, second.openIntents());
    assertEquals(0, second.purges());
    assertEquals(0, second.actions());
    assertEquals(0, metrics.purged.get());
    assertEquals(1, metrics.deleted.get());
  }

  @Test
  void runOnce_undecodableEventIsSkipped() {
    store.putRaw(new StoredEvent("raw-1", NOW, null, Map.of(IntentMetadata.TYPE, IntentMetadata.TAG)));
    store.add("101", "U1", NOW.plus(Duration.ofDays(2)), false);

    IterationReport report = loop.runOnce();

    assertEquals(1, report.openIntents());
    assertEquals(0, report.failures());
  }

  // ── Fetch failures ───────────────────────────────────────────────

  @Test
  void fetchFailure_switchesToRetryDelay() {
    store.listFailure = new TransientCollaboratorException("calendar down");

    IterationReport report = loop.runOnce();

    assertTrue(report.fetchFailed());
    assertEquals(1, loop.consecutiveFetchFailures());
    assertEquals(60_000L, loop.nextDelayMs());
    assertEquals(1, metrics.fetchFailed.get());

    store.listFailure = null;
    loop.runOnce();

    assertEquals(0, loop.consecutiveFetchFailures());
    assertEquals(Duration.ofMinutes(5).toMillis(), loop.nextDelayMs());
  }

  @Test
  void fetchFailure_doesNotPurgeTrackedIntents() {
    store.add("101", "U1", NOW.plus(Duration.ofDays(2)), false);
    loop.runOnce();

    store.listFailure = new TransientCollaboratorException("calendar down");
    IterationReport report = loop.runOnce();

    assertEquals(0, report.purges());
    assertEquals(0, metrics.purged.get());
  }

  // ── Lifecycle ────────────────────────────────────────────────────

  @Test
  void start_runsFirstCycleImmediately() throws InterruptedException {
    loop.start();
    loop.start();

    long deadline = System.currentTimeMillis() + 5_000;
    while (store.listCount.get() == 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertTrue(loop.isRunning());
    assertEquals(1, store.listCount.get());
  }

  @Test
  void start_afterClose_throwsISE() {
    loop.close();

    assertThrows(IllegalStateException.class, () -> loop.start());
  }

  @Test
  void runOnce_afterClose_doesNothing() {
    store.add("101", "U1", NOW.minus(Duration.ofHours(1)), false);
    loop.close();

    IterationReport report = loop.runOnce();

    assertEquals(0, report.actions());
    assertEquals(0, store.listCount.get());
  }

  @Test
  void close_isIdempotent() {
    loop.start();
    loop.close();
    loop.close();

    assertFalse(loop.isRunning());
  }

  @Test
  void close_letsInFlightCycleFinishWithinGracePeriod() throws Exception {
    BlockingResourceControl blocking = useBlockingDeletes(Duration.ofSeconds(5));
    blocking.add("101", "a", ResourceStatus.RUNNING);
    store.add("101", "U1", NOW.minus(Duration.ofHours(1)), true);

    loop.start();
    assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));
    Thread releaser = new Thread(() -> {
      try {
        Thread.sleep(200);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      blocking.release.countDown();
    });
    releaser.start();

    long started = System.nanoTime();
    loop.close();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertTrue(elapsedMs < 5_000, "close took " + elapsedMs + " ms");
    assertEquals(List.of("101"), blocking.deleted);
    assertEquals(0, store.size());
    assertFalse(blocking.interrupted.await(100, TimeUnit.MILLISECONDS));
    assertFalse(loop.isRunning());
    releaser.join();
  }

  @Test
  void close_interruptsCycleThatOutlivesGracePeriod() throws Exception {
    BlockingResourceControl blocking = useBlockingDeletes(Duration.ofMillis(200));
    blocking.add("101", "a", ResourceStatus.RUNNING);
    String id = store.add("101", "U1", NOW.minus(Duration.ofHours(1)), true);

    loop.start();
    assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));

    long started = System.nanoTime();
    try {
      loop.close();
    } finally {
      blocking.release.countDown();
    }
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertTrue(elapsedMs < 200 + 5_000, "close took " + elapsedMs + " ms");
    assertTrue(blocking.interrupted.await(5, TimeUnit.SECONDS));
    assertTrue(blocking.deleted.isEmpty());
    assertTrue(store.contains(id));
    assertFalse(loop.isRunning());
  }

  // ── Validation ───────────────────────────────────────────────────

  @Test
  void missingExecutor_throwsNPE() {
    assertThrows(NullPointerException.class, () ->
        ReconciliationLoop.builder().eventStore(store).calls(calls).build());
  }

  @Test
  void nonPositiveInterval_throwsIAE() {
    assertThrows(IllegalArgumentException.class, () -> newLoop(Duration.ZERO));
  }

  static class BlockingResourceControl extends StubResourceControl {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final CountDownLatch interrupted = new CountDownLatch(1);

    @Override
    public void delete(String resourceId) {
      entered.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        interrupted.countDown();
        Thread.currentThread().interrupt();
        throw new TransientCollaboratorException("delete of " + resourceId + " interrupted");
      }
      super.delete(resourceId);
    }
  }
}
