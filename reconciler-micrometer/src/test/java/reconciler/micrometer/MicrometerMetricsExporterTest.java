package reconciler.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void reminderCounters() {
    exporter.incrementReminderSent();
    exporter.incrementReminderSent();
    exporter.incrementReminderCommitFailed();

    assertEquals(2.0, counter("reconciler.reminder.sent").count());
    assertEquals(1.0, counter("reconciler.reminder.commit.failed").count());
  }

  @Test
  void executionCounters() {
    exporter.incrementDeleted();
    exporter.incrementAlreadyGone();
    exporter.incrementAlreadyGone();
    exporter.incrementActionFailed();

    assertEquals(1.0, counter("reconciler.execute.deleted").count());
    assertEquals(2.0, counter("reconciler.execute.already_gone").count());
    assertEquals(1.0, counter("reconciler.action.failed").count());
  }

  @Test
  void loopCounters() {
    exporter.incrementPurged();
    exporter.incrementDuplicateIntent();
    exporter.incrementFetchFailed();
    exporter.incrementFetchFailed();

    assertEquals(1.0, counter("reconciler.intent.purged").count());
    assertEquals(1.0, counter("reconciler.intent.duplicate").count());
    assertEquals(2.0, counter("reconciler.fetch.failed").count());
  }

  @Test
  void gaugesTrackLatestValue() {
    exporter.recordOpenIntents(4);
    exporter.recordCycleDurationMs(250L);
    assertEquals(4.0, gauge("reconciler.intents.open").value());
    assertEquals(250.0, gauge("reconciler.cycle.duration.ms").value());

    exporter.recordOpenIntents(0);
    assertEquals(0.0, gauge("reconciler.intents.open").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "lab.reconciler");
    custom.incrementDeleted();
    custom.recordOpenIntents(2);

    assertEquals(1.0, counter("lab.reconciler.execute.deleted").count());
    assertEquals(2.0, gauge("lab.reconciler.intents.open").value());
    assertEquals(0.0, counter("reconciler.execute.deleted").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementDeleted();

    exporter.close();
    exporter.incrementDeleted();
    exporter.recordOpenIntents(9);

    assertNull(registry.find("reconciler.execute.deleted").counter());
    assertNull(registry.find("reconciler.intents.open").gauge());
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "reconciler."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
