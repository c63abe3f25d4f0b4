package reconciler;

import reconciler.command.Command;
import reconciler.command.Reply;
import reconciler.loop.IterationReport;
import reconciler.model.ResourceStatus;
import reconciler.spi.Audience;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcilerTest {

  private final StubEventStore store = new StubEventStore();
  private final StubResourceControl resources = new StubResourceControl()
      .add("101", "web", ResourceStatus.RUNNING);
  private final RecordingNotifier notifier = new RecordingNotifier();

  private Reconciler.Builder baseBuilder() {
    return Reconciler.builder()
        .eventStore(store)
        .resourceControl(resources)
        .notifier(notifier);
  }

  // ── Build validation ─────────────────────────────────────────────

  @Test
  void missingEventStore_throwsConfigurationException() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> Reconciler.builder().resourceControl(resources).notifier(notifier).build());
    assertEquals("eventStore is required", e.getMessage());
  }

  @Test
  void missingResourceControl_throwsConfigurationException() {
    assertThrows(ConfigurationException.class,
        () -> Reconciler.builder().eventStore(store).notifier(notifier).build());
  }

  @Test
  void missingNotifier_throwsConfigurationException() {
    assertThrows(ConfigurationException.class,
        () -> Reconciler.builder().eventStore(store).resourceControl(resources).build());
  }

  @Test
  void builderReuse_throwsISE() {
    Reconciler.Builder builder = baseBuilder();
    try (Reconciler ignored = builder.build()) {
      assertThrows(IllegalStateException.class, builder::build);
    }
  }

  @Test
  void invalidDeletionDelay_throwsIAE() {
    assertThrows(IllegalArgumentException.class,
        () -> baseBuilder().deletionDelay(Duration.ofHours(1)).build());
  }

  // ── Lifecycle ────────────────────────────────────────────────────

  @Test
  void buildDoesNotStartPolling() {
    try (Reconciler reconciler = baseBuilder().build()) {
      assertFalse(reconciler.loop().isRunning());
      assertEquals(0, store.listCount.get());
    }
  }

  @Test
  void startPollsImmediately() throws InterruptedException {
    try (Reconciler reconciler = baseBuilder().checkInterval(Duration.ofHours(1)).build()) {
      reconciler.start();
      reconciler.start();

      assertTrue(reconciler.loop().isRunning());
      long deadline = System.currentTimeMillis() + 5_000;
      while (store.listCount.get() == 0 && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(1, store.listCount.get());
    }
  }

  @Test
  void startAfterClose_throwsISE() {
    Reconciler reconciler = baseBuilder().build();
    reconciler.close();

    assertFalse(reconciler.loop().isRunning());
    assertThrows(IllegalStateException.class, reconciler::start);
  }

  @Test
  void closeClosesCloseableMetrics() {
    ClosingMetrics metrics = new ClosingMetrics();
    Reconciler reconciler = baseBuilder().metrics(metrics).build();

    reconciler.close();

    assertTrue(metrics.closed);
  }

  // ── End to end ───────────────────────────────────────────────────

  @Test
  void scheduledDeletion_remindsThenDeletes() {
    MutableClock clock = new MutableClock(Instant.parse("2025-03-10T09:30:00Z"));
    try (Reconciler reconciler = baseBuilder().clock(clock).build()) {
      Reply reply = reconciler.commands().handle(new Command.ScheduleDeletion("101"), "U1");
      assertTrue(reply.text().startsWith("Resource 101 (web) will be deleted on 2025-03-12 23:59 UTC"));

      IterationReport early = reconciler.loop().runOnce();
      assertEquals(0, early.actions());

      clock.set(Instant.parse("2025-03-12T08:00:00Z"));
      IterationReport remind = reconciler.loop().runOnce();
      assertEquals(1, remind.reminders());
      assertEquals(1, notifier.textsTo(Audience.user("U1")).size());

      IterationReport again = reconciler.loop().runOnce();
      assertEquals(0, again.actions());

      clock.set(Instant.parse("2025-03-13T00:00:00Z"));
      IterationReport execute = reconciler.loop().runOnce();
      assertEquals(1, execute.executions());
      assertEquals(1, resources.deleted.size());
      assertEquals(0, store.size());
    }
  }

  static class ClosingMetrics extends CountingMetricsExporter implements AutoCloseable {
    volatile boolean closed;

    @Override
    public void close() {
      closed = true;
    }
  }
}
