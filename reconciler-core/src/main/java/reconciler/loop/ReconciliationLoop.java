package reconciler.loop;

import reconciler.decision.IntentAction;
import reconciler.decision.IntentObservation;
import reconciler.decision.IntentStateMachine;
import reconciler.execute.ActionExecutor;
import reconciler.execute.ExecutionOutcome;
import reconciler.execute.IntentTracker;
import reconciler.execute.TimedCalls;
import reconciler.model.DeletionIntent;
import reconciler.model.IntentMetadata;
import reconciler.model.StoredEvent;
import reconciler.spi.EventStore;
import reconciler.spi.MetricsExporter;
import reconciler.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded loop that periodically re-reads every open intent from the event
 * store and drives each one through the {@link IntentStateMachine}.
 *
 * <p>Each cycle is a full reconciliation, never an incremental diff:
 * <ol>
 *   <li>one {@link EventStore#listOpen} call;</li>
 *   <li>group by resource, keeping the earliest {@code executeAt}; further intents for
 *       the same resource are logged as a logic error and left alone;</li>
 *   <li>emit {@link IntentAction#PURGE} for every intent seen last cycle and missing now;</li>
 *   <li>decide and execute each remaining intent in turn.</li>
 * </ol>
 *
 * <p>A failed action is isolated to its intent; the rest of the batch continues. A
 * failed fetch schedules the next cycle after the {@link RetryPolicy} delay instead of
 * the check interval. Nothing ever stops the loop except {@link #close()}.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized; cycles run on one daemon thread and never overlap, also with direct
 * {@link #runOnce()} calls.
 *
 * @see ReconciliationLoop.Builder
 */
public final class ReconciliationLoop implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReconciliationLoop.class.getName());

  /** Default time between two successful cycles. */
  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(5);

  /** Default time an in-flight cycle gets to finish on close. */
  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(30);

  private static final Comparator<DeletionIntent> EARLIEST_FIRST =
      Comparator.comparing(DeletionIntent::executeAt).thenComparing(DeletionIntent::intentId);

  private final EventStore eventStore;
  private final ActionExecutor executor;
  private final TimedCalls calls;
  private final IntentStateMachine stateMachine;
  private final IntentTracker tracker;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long checkIntervalMs;
  private final Duration gracePeriod;

  // serializes scheduled and direct runOnce() calls
  private final Object cycleLock = new Object();

  private ScheduledThreadPoolExecutor scheduler;
  private volatile ScheduledFuture<?> nextCycle;
  private volatile boolean closed;
  private volatile int consecutiveFetchFailures;

  private ReconciliationLoop(Builder builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.executor = Objects.requireNonNull(builder.executor, "executor");
    this.calls = Objects.requireNonNull(builder.calls, "calls");

    Duration checkInterval = Objects.requireNonNull(builder.checkInterval, "checkInterval");
    Duration gracePeriod = Objects.requireNonNull(builder.gracePeriod, "gracePeriod");
    if (checkInterval.isNegative() || checkInterval.isZero()) {
      throw new IllegalArgumentException("checkInterval must be positive");
    }
    if (gracePeriod.isNegative()) {
      throw new IllegalArgumentException("gracePeriod must be >= 0");
    }

    this.checkIntervalMs = checkInterval.toMillis();
    this.gracePeriod = gracePeriod;
    this.stateMachine = builder.stateMachine != null ? builder.stateMachine : new IntentStateMachine();
    this.tracker = executor.tracker();
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new FixedDelayRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the loop. The first cycle runs immediately; later ones follow the check
   * interval, or the retry delay after a failed fetch. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the loop has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ReconciliationLoop has been closed");
    }
    if (scheduler != null) {
      return;
    }
    scheduler = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("reconciler-loop-"));
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    nextCycle = scheduler.schedule(this::cycle, 0, TimeUnit.MILLISECONDS);
  }

  public boolean isRunning() {
    return scheduler != null && !closed;
  }

  /**
   * Number of cycles in a row whose fetch failed; zero after a successful fetch.
   */
  public int consecutiveFetchFailures() {
    return consecutiveFetchFailures;
  }

  /**
   * Delay before the next cycle given the current fetch-failure streak.
   */
  long nextDelayMs() {
    int failures = consecutiveFetchFailures;
    return failures > 0 ? retryPolicy.computeDelayMs(failures) : checkIntervalMs;
  }

  private void cycle() {
    try {
      runOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reconciliation cycle failed", t);
    }
    scheduleNext();
  }

  private void scheduleNext() {
    ScheduledThreadPoolExecutor current = scheduler;
    if (closed || current == null) {
      return;
    }
    try {
      nextCycle = current.schedule(this::cycle, nextDelayMs(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Loop closed while scheduling the next cycle");
    }
  }

  /**
   * Executes a single reconciliation cycle. Called by the scheduler, but may also be
   * invoked directly for testing; concurrent calls run one after the other. Returns
   * immediately once the loop is closed.
   *
   * @return what the cycle did
   */
  public IterationReport runOnce() {
    if (closed) {
      return IterationReport.skipped();
    }
    long startedNanos = System.nanoTime();
    try {
      IterationReport report;
      synchronized (cycleLock) {
        report = closed ? IterationReport.skipped() : reconcile(clock.instant());
      }
      if (report.actions() > 0 || report.duplicates() > 0) {
        logger.log(Level.INFO, "Reconciliation cycle: {0}", report);
      } else {
        logger.log(Level.FINE, "Reconciliation cycle: {0}", report);
      }
      return report;
    } finally {
      metrics.recordCycleDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos));
    }
  }

  private IterationReport reconcile(Instant now) {
    Optional<List<DeletionIntent>> fetched = fetchOpenIntents();
    if (fetched.isEmpty()) {
      consecutiveFetchFailures++;
      metrics.incrementFetchFailed();
      return IterationReport.failedFetch();
    }
    consecutiveFetchFailures = 0;

    List<DeletionIntent> open = fetched.get();
    metrics.recordOpenIntents(open.size());

    Map<String, Boolean> seenBefore = new LinkedHashMap<>();
    for (DeletionIntent intent : open) {
      seenBefore.put(intent.intentId(), tracker.isTracked(intent.intentId()));
    }
    List<DeletionIntent> vanished = tracker.observe(open);

    List<DeletionIntent> duplicates = new ArrayList<>();
    List<DeletionIntent> primaries = selectEarliestPerResource(open, duplicates);
    for (DeletionIntent duplicate : duplicates) {
      metrics.incrementDuplicateIntent();
      logger.log(Level.SEVERE, "Duplicate open intent {0} for resource {1}; only the earliest is acted on",
          new Object[]{duplicate.intentId(), duplicate.resourceId()});
    }

    IterationReport.Tally tally = new IterationReport.Tally(open.size(), duplicates.size());
    for (DeletionIntent gone : vanished) {
      act(now, IntentObservation.vanished(gone.intentId()), tally);
    }
    for (DeletionIntent intent : primaries) {
      if (Thread.currentThread().isInterrupted()) {
        logger.log(Level.WARNING, "Cycle interrupted; remaining intents are left for the next cycle");
        break;
      }
      act(now, IntentObservation.present(intent, seenBefore.getOrDefault(intent.intentId(), false)), tally);
    }
    return tally.toReport();
  }

  private Optional<List<DeletionIntent>> fetchOpenIntents() {
    List<StoredEvent> events;
    try {
      events = calls.call("listOpen", () -> eventStore.listOpen(IntentMetadata.TAG));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch open intents; retrying after back-off", e);
      return Optional.empty();
    }
    List<DeletionIntent> intents = new ArrayList<>(events.size());
    for (StoredEvent event : events) {
      try {
        IntentMetadata.decode(event).ifPresent(intents::add);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Skipping undecodable event " + event.eventId(), e);
      }
    }
    return Optional.of(intents);
  }

  private static List<DeletionIntent> selectEarliestPerResource(List<DeletionIntent> open,
      List<DeletionIntent> duplicates) {
    List<DeletionIntent> sorted = new ArrayList<>(open);
    sorted.sort(EARLIEST_FIRST);
    Map<String, DeletionIntent> byResource = new LinkedHashMap<>();
    for (DeletionIntent intent : sorted) {
      if (byResource.putIfAbsent(intent.resourceId(), intent) != null) {
        duplicates.add(intent);
      }
    }
    return new ArrayList<>(byResource.values());
  }

  private void act(Instant now, IntentObservation observation, IterationReport.Tally tally) {
    IntentAction action = stateMachine.decide(now, observation);
    if (action == IntentAction.NONE) {
      return;
    }
    if (observation.isPresent() && logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Intent {0} is {1}; running {2}", new Object[]{
          observation.intentId(), stateMachine.stateOf(now, observation.snapshot()), action});
    }
    ExecutionOutcome outcome;
    try {
      outcome = executor.apply(action, observation);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Action " + action + " failed for intent " + observation.intentId(), e);
      outcome = ExecutionOutcome.FAILED;
    }
    tally.count(outcome);
  }

  /**
   * Stops scheduling further cycles. An in-flight cycle gets the grace period to finish,
   * after which its thread is interrupted.
   */
  @Override
  public synchronized void close() {
    closed = true;
    ScheduledFuture<?> pending = nextCycle;
    if (pending != null) {
      pending.cancel(false);
      nextCycle = null;
    }
    if (scheduler == null) {
      return;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Cycle still running after {0}; interrupting", gracePeriod);
        scheduler.shutdownNow();
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for {@link ReconciliationLoop}.
   */
  public static final class Builder {
    private EventStore eventStore;
    private ActionExecutor executor;
    private TimedCalls calls;
    private IntentStateMachine stateMachine;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
    private Duration gracePeriod = DEFAULT_GRACE_PERIOD;

    private Builder() {
    }

    /**
     * Sets the event store polled every cycle.
     *
     * <p><b>Required.</b>
     *
     * @param eventStore the remote event store
     * @return this builder
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the executor that performs decided actions. Its {@link IntentTracker} is
     * also the loop's seen-set.
     *
     * <p><b>Required.</b>
     *
     * @param executor the action executor
     * @return this builder
     */
    public Builder executor(ActionExecutor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the timed-call runner used for the fetch.
     *
     * <p><b>Required.</b>
     *
     * @param calls the timed-call runner
     * @return this builder
     */
    public Builder calls(TimedCalls calls) {
      this.calls = calls;
      return this;
    }

    /**
     * Sets the decision function.
     *
     * <p>Optional. Defaults to a state machine with a 24 hour reminder window.
     *
     * @param stateMachine the state machine
     * @return this builder
     */
    public Builder stateMachine(IntentStateMachine stateMachine) {
      this.stateMachine = stateMachine;
      return this;
    }

    /**
     * Sets the delay policy applied after a failed fetch.
     *
     * <p>Optional. Defaults to a fixed 60 second delay.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock that supplies "now" to every decision.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the time between two successful cycles.
     *
     * <p>Optional. Defaults to 5 minutes. Must be positive.
     *
     * @param checkInterval the check interval
     * @return this builder
     */
    public Builder checkInterval(Duration checkInterval) {
      this.checkInterval = checkInterval;
      return this;
    }

    /**
     * Sets how long {@link ReconciliationLoop#close()} waits for an in-flight cycle.
     *
     * <p>Optional. Defaults to 30 seconds. Must be &ge; 0.
     *
     * @param gracePeriod the grace period
     * @return this builder
     */
    public Builder gracePeriod(Duration gracePeriod) {
      this.gracePeriod = gracePeriod;
      return this;
    }

    /**
     * Builds the loop. Call {@link ReconciliationLoop#start()} to begin.
     *
     * @return a new {@link ReconciliationLoop}
     * @throws NullPointerException     if {@code eventStore}, {@code executor} or
     *                                  {@code calls} is null
     * @throws IllegalArgumentException if {@code checkInterval} is not positive or
     *                                  {@code gracePeriod} is negative
     */
    public ReconciliationLoop build() {
      return new ReconciliationLoop(this);
    }
  }
}
