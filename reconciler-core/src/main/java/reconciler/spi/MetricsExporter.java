package reconciler.spi;

/**
 * Observability hook for exporting reconciler counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge
 * into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * A reminder was delivered (whether or not its commit succeeded).
   */
  void incrementReminderSent();

  /**
   * A reminder was delivered but {@code reminder_sent=true} could not be committed;
   * the next cycle may send it again.
   */
  void incrementReminderCommitFailed();

  /**
   * A resource was deleted by the executor.
   */
  void incrementDeleted();

  /**
   * A due intent found its resource already gone.
   */
  void incrementAlreadyGone();

  /**
   * Local tracking for a vanished or cancelled intent was dropped.
   */
  void incrementPurged();

  /**
   * An executor action failed and will be re-attempted next cycle.
   */
  void incrementActionFailed();

  /**
   * A second open intent for the same resource was seen and left for manual review.
   */
  default void incrementDuplicateIntent() {
  }

  /**
   * The cycle's event-store fetch failed.
   */
  default void incrementFetchFailed() {
  }

  /**
   * Records the number of open intents seen by the last successful fetch.
   */
  void recordOpenIntents(int count);

  /**
   * Records how long the last cycle took, fetch included.
   */
  default void recordCycleDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementReminderSent() {
    }

    @Override
    public void incrementReminderCommitFailed() {
    }

    @Override
    public void incrementDeleted() {
    }

    @Override
    public void incrementAlreadyGone() {
    }

    @Override
    public void incrementPurged() {
    }

    @Override
    public void incrementActionFailed() {
    }

    @Override
    public void recordOpenIntents(int count) {
    }
  }
}
