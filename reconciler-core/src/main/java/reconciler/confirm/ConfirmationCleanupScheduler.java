package reconciler.confirm;

import reconciler.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that evicts unanswered confirmations older than a maximum age.
 *
 * <p>Runs on its own daemon thread, independent of the reconciliation loop, so a slow
 * reconciliation cycle never delays expiry and vice versa.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see ConfirmationCleanupScheduler.Builder
 * @see ConfirmationRegistry#cleanup(Duration)
 */
public final class ConfirmationCleanupScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConfirmationCleanupScheduler.class.getName());

  /** Default time between two cleanup runs. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

  private final ConfirmationRegistry registry;
  private final Duration maxAge;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> cleanupTask;
  private volatile boolean closed;

  private ConfirmationCleanupScheduler(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");

    if (builder.maxAge != null && builder.maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must be >= 0");
    }
    if (builder.interval == null || builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }

    this.maxAge = builder.maxAge != null ? builder.maxAge : ConfirmationRegistry.DEFAULT_MAX_AGE;
    this.intervalMs = builder.interval.toMillis();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled cleanup loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ConfirmationCleanupScheduler has been closed");
    }
    if (cleanupTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("reconciler-confirm-cleanup-"));
    cleanupTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single cleanup run. May be invoked directly for testing.
   *
   * @return the number of evicted tokens
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      int evicted = registry.cleanup(maxAge);
      if (evicted > 0) {
        logger.log(Level.INFO, "Evicted {0} expired confirmations older than {1}",
            new Object[]{evicted, maxAge});
      }
      return evicted;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Confirmation cleanup failed", e);
      return 0;
    }
  }

  /** Cancels the cleanup schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (cleanupTask != null) {
      cleanupTask.cancel(false);
      cleanupTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link ConfirmationCleanupScheduler}. */
  public static final class Builder {
    private ConfirmationRegistry registry;
    private Duration maxAge;
    private Duration interval = DEFAULT_INTERVAL;

    private Builder() {}

    /**
     * Sets the registry to clean up.
     *
     * <p><b>Required.</b>
     *
     * @param registry the confirmation registry
     * @return this builder
     */
    public Builder registry(ConfirmationRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the age after which an unanswered confirmation is evicted.
     *
     * <p>Optional. Defaults to 1 hour. Must be &ge; 0.
     *
     * @param maxAge the maximum token age
     * @return this builder
     */
    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    /**
     * Sets the time between cleanup runs.
     *
     * <p>Optional. Defaults to 5 minutes. Must be positive.
     *
     * @param interval the cleanup interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link ConfirmationCleanupScheduler#start()} to begin.
     *
     * @return a new {@link ConfirmationCleanupScheduler}
     * @throws NullPointerException     if {@code registry} is null
     * @throws IllegalArgumentException if {@code maxAge} is negative or {@code interval}
     *                                  is not positive
     */
    public ConfirmationCleanupScheduler build() {
      return new ConfirmationCleanupScheduler(this);
    }
  }
}
