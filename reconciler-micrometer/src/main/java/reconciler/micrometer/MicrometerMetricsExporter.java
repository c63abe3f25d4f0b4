package reconciler.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import reconciler.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code reconciler.reminder.sent}: reminders delivered</li>
 *   <li>{@code reconciler.reminder.commit.failed}: reminders delivered but not recorded on the event</li>
 *   <li>{@code reconciler.execute.deleted}: resources deleted</li>
 *   <li>{@code reconciler.execute.already_gone}: due intents whose resource had already disappeared</li>
 *   <li>{@code reconciler.intent.purged}: intents dropped from local tracking</li>
 *   <li>{@code reconciler.action.failed}: actions that failed and will be re-attempted</li>
 *   <li>{@code reconciler.intent.duplicate}: extra open intents for an already scheduled resource</li>
 *   <li>{@code reconciler.fetch.failed}: cycles whose event-store fetch failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code reconciler.intents.open}: open intents seen by the last successful fetch</li>
 *   <li>{@code reconciler.cycle.duration.ms}: duration of the last cycle</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final List<Meter> meters = new ArrayList<>();

  private final Counter reminderSent;
  private final Counter reminderCommitFailed;
  private final Counter deleted;
  private final Counter alreadyGone;
  private final Counter purged;
  private final Counter actionFailed;
  private final Counter duplicateIntent;
  private final Counter fetchFailed;

  private final AtomicInteger openIntents = new AtomicInteger();
  private final AtomicLong cycleDurationMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "reconciler"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "reconciler");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * reconcilers against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "lab.reconciler"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.reminderSent = counter("reminder.sent", "Reminders delivered");
    this.reminderCommitFailed = counter("reminder.commit.failed",
        "Reminders delivered whose reminder_sent flag could not be stored");
    this.deleted = counter("execute.deleted", "Resources deleted");
    this.alreadyGone = counter("execute.already_gone", "Due intents whose resource was already gone");
    this.purged = counter("intent.purged", "Intents dropped from local tracking");
    this.actionFailed = counter("action.failed", "Actions that failed and will be re-attempted");
    this.duplicateIntent = counter("intent.duplicate", "Extra open intents for the same resource");
    this.fetchFailed = counter("fetch.failed", "Cycles whose event-store fetch failed");

    meters.add(Gauge.builder(namePrefix + ".intents.open", openIntents, AtomicInteger::get)
        .description("Open intents seen by the last successful fetch")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".cycle.duration.ms", cycleDurationMs, AtomicLong::get)
        .description("Duration of the last reconciliation cycle")
        .register(registry));
  }

  private Counter counter(String suffix, String description) {
    Counter counter = Counter.builder(namePrefix + "." + suffix)
        .description(description)
        .register(registry);
    meters.add(counter);
    return counter;
  }

  private void increment(Counter counter) {
    if (!closed) {
      counter.increment();
    }
  }

  @Override
  public void incrementReminderSent() {
    increment(reminderSent);
  }

  @Override
  public void incrementReminderCommitFailed() {
    increment(reminderCommitFailed);
  }

  @Override
  public void incrementDeleted() {
    increment(deleted);
  }

  @Override
  public void incrementAlreadyGone() {
    increment(alreadyGone);
  }

  @Override
  public void incrementPurged() {
    increment(purged);
  }

  @Override
  public void incrementActionFailed() {
    increment(actionFailed);
  }

  @Override
  public void incrementDuplicateIntent() {
    increment(duplicateIntent);
  }

  @Override
  public void incrementFetchFailed() {
    increment(fetchFailed);
  }

  @Override
  public void recordOpenIntents(int count) {
    if (closed) return;
    openIntents.set(count);
  }

  @Override
  public void recordCycleDurationMs(long durationMs) {
    if (closed) return;
    cycleDurationMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry. Called by
   * {@link reconciler.Reconciler#close()}.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
