package reconciler;

import reconciler.command.CommandHandler;
import reconciler.confirm.ConfirmationCleanupScheduler;
import reconciler.confirm.ConfirmationRegistry;
import reconciler.decision.IntentStateMachine;
import reconciler.execute.ActionExecutor;
import reconciler.execute.TimedCalls;
import reconciler.loop.FixedDelayRetryPolicy;
import reconciler.loop.ReconciliationLoop;
import reconciler.loop.RetryPolicy;
import reconciler.spi.EventStore;
import reconciler.spi.MetricsExporter;
import reconciler.spi.Notifier;
import reconciler.spi.ResourceControl;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the {@link ReconciliationLoop}, the
 * {@link ConfirmationRegistry} with its {@link ConfirmationCleanupScheduler}, and a
 * {@link CommandHandler} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Reconciler reconciler = Reconciler.builder()
 *     .eventStore(calendar)
 *     .resourceControl(proxmox)
 *     .notifier(slack)
 *     .build()) {
 *   reconciler.start();
 *   Reply reply = reconciler.commands().handle(new Command.ScheduleDeletion("103"), "U123");
 * }
 * }</pre>
 *
 * @see ReconciliationLoop
 * @see CommandHandler
 */
public final class Reconciler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Reconciler.class.getName());

  private final ReconciliationLoop loop;
  private final ConfirmationCleanupScheduler cleanup;
  private final ConfirmationRegistry confirmations;
  private final CommandHandler commands;
  private final ActionExecutor executor;
  private final TimedCalls calls;
  private final MetricsExporter metrics;

  private Reconciler(ReconciliationLoop loop, ConfirmationCleanupScheduler cleanup,
      ConfirmationRegistry confirmations, CommandHandler commands, ActionExecutor executor,
      TimedCalls calls, MetricsExporter metrics) {
    this.loop = loop;
    this.cleanup = cleanup;
    this.confirmations = confirmations;
    this.commands = commands;
    this.executor = executor;
    this.calls = calls;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the reconciliation loop and the confirmation cleanup loop. Subsequent calls
   * are no-ops.
   *
   * @throws IllegalStateException if the reconciler has been closed
   */
  public synchronized void start() {
    loop.start();
    try {
      cleanup.start();
    } catch (RuntimeException e) {
      loop.close();
      throw e;
    }
    logger.log(Level.INFO, "Reconciler started");
  }

  public ReconciliationLoop loop() {
    return loop;
  }

  public CommandHandler commands() {
    return commands;
  }

  public ConfirmationRegistry confirmations() {
    return confirmations;
  }

  public ActionExecutor executor() {
    return executor;
  }

  /**
   * Shuts down components in order: confirmation cleanup, reconciliation loop, call
   * executor, and the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      cleanup.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      loop.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      calls.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
    logger.log(Level.INFO, "Reconciler closed");
  }

  /**
   * Builder for {@link Reconciler}.
   */
  public static final class Builder {
    private EventStore eventStore;
    private ResourceControl resourceControl;
    private Notifier notifier;
    private MetricsExporter metrics;
    private Clock clock;
    private RetryPolicy retryPolicy;
    private Duration checkInterval = ReconciliationLoop.DEFAULT_CHECK_INTERVAL;
    private Duration retryDelay = FixedDelayRetryPolicy.DEFAULT_DELAY;
    private Duration gracePeriod = ReconciliationLoop.DEFAULT_GRACE_PERIOD;
    private Duration callTimeout = TimedCalls.DEFAULT_TIMEOUT;
    private Duration reminderWindow = IntentStateMachine.DEFAULT_REMINDER_WINDOW;
    private Duration deletionDelay = CommandHandler.DEFAULT_DELETION_DELAY;
    private Duration confirmationMaxAge = ConfirmationRegistry.DEFAULT_MAX_AGE;
    private Duration cleanupInterval = ConfirmationCleanupScheduler.DEFAULT_INTERVAL;
    private int failureNotifyThreshold = 3;
    private String broadcastChannel = ActionExecutor.DEFAULT_BROADCAST_CHANNEL;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the remote event store holding the intents.
     *
     * <p><b>Required.</b>
     *
     * @param eventStore the event store
     * @return this builder
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the resource control API.
     *
     * <p><b>Required.</b>
     *
     * @param resourceControl the resource control API
     * @return this builder
     */
    public Builder resourceControl(ResourceControl resourceControl) {
      this.resourceControl = resourceControl;
      return this;
    }

    /**
     * Sets the chat notifier.
     *
     * <p><b>Required.</b>
     *
     * @param notifier the notifier
     * @return this builder
     */
    public Builder notifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /**
     * Sets the metrics exporter. If it is {@link AutoCloseable} it is closed with the
     * reconciler.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the time between two successful reconciliation cycles.
     *
     * <p>Optional. Defaults to 5 minutes.
     *
     * @param checkInterval the check interval
     * @return this builder
     */
    public Builder checkInterval(Duration checkInterval) {
      this.checkInterval = checkInterval;
      return this;
    }

    /**
     * Sets the fixed delay before the next cycle after a failed fetch. Ignored when a
     * {@link #retryPolicy(RetryPolicy)} is set.
     *
     * <p>Optional. Defaults to 60 seconds.
     *
     * @param retryDelay the retry delay
     * @return this builder
     */
    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    /**
     * Sets a custom back-off policy after failed fetches.
     *
     * <p>Optional. Defaults to a fixed delay of {@link #retryDelay(Duration)}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how long {@link Reconciler#close()} waits for an in-flight cycle.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param gracePeriod the grace period
     * @return this builder
     */
    public Builder gracePeriod(Duration gracePeriod) {
      this.gracePeriod = gracePeriod;
      return this;
    }

    /**
     * Sets the timeout applied to every collaborator call.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param callTimeout the per-call timeout
     * @return this builder
     */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /**
     * Sets how long before the deletion the reminder becomes due.
     *
     * <p>Optional. Defaults to 24 hours.
     *
     * @param reminderWindow the reminder window
     * @return this builder
     */
    public Builder reminderWindow(Duration reminderWindow) {
      this.reminderWindow = reminderWindow;
      return this;
    }

    /**
     * Sets how many days after scheduling a deletion happens.
     *
     * <p>Optional. Defaults to 2 days.
     *
     * @param deletionDelay the deletion delay
     * @return this builder
     */
    public Builder deletionDelay(Duration deletionDelay) {
      this.deletionDelay = deletionDelay;
      return this;
    }

    /**
     * Optional. Defaults to 1 hour.
     *
     * @param confirmationMaxAge age after which unanswered confirmations are evicted
     * @return this builder
     */
    public Builder confirmationMaxAge(Duration confirmationMaxAge) {
      this.confirmationMaxAge = confirmationMaxAge;
      return this;
    }

    /**
     * Optional. Defaults to 5 minutes.
     *
     * @param cleanupInterval time between confirmation cleanup runs
     * @return this builder
     */
    public Builder cleanupInterval(Duration cleanupInterval) {
      this.cleanupInterval = cleanupInterval;
      return this;
    }

    /**
     * Sets after how many consecutive transient delete failures a failure is announced.
     *
     * <p>Optional. Defaults to {@code 3}.
     *
     * @param failureNotifyThreshold the threshold
     * @return this builder
     */
    public Builder failureNotifyThreshold(int failureNotifyThreshold) {
      this.failureNotifyThreshold = failureNotifyThreshold;
      return this;
    }

    /**
     * Optional. Defaults to {@value ActionExecutor#DEFAULT_BROADCAST_CHANNEL}.
     *
     * @param broadcastChannel channel receiving reminders and notices
     * @return this builder
     */
    public Builder broadcastChannel(String broadcastChannel) {
      this.broadcastChannel = broadcastChannel;
      return this;
    }

    /**
     * Builds the reconciler. Call {@link Reconciler#start()} to begin polling.
     *
     * @return a new {@link Reconciler}
     * @throws ConfigurationException   if a required collaborator is missing
     * @throws IllegalArgumentException if a duration or threshold is out of range
     * @throws IllegalStateException    if this builder was already used
     */
    public Reconciler build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      requireCollaborator(eventStore, "eventStore");
      requireCollaborator(resourceControl, "resourceControl");
      requireCollaborator(notifier, "notifier");

      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
      IntentStateMachine stateMachine = new IntentStateMachine(reminderWindow);
      RetryPolicy effectiveRetry = retryPolicy != null ? retryPolicy : new FixedDelayRetryPolicy(retryDelay);

      TimedCalls calls = new TimedCalls(callTimeout);
      try {
        ActionExecutor executor = ActionExecutor.builder()
            .eventStore(eventStore)
            .resourceControl(resourceControl)
            .notifier(notifier)
            .calls(calls)
            .metrics(effectiveMetrics)
            .broadcastChannel(broadcastChannel)
            .failureNotifyThreshold(failureNotifyThreshold)
            .build();
        ReconciliationLoop loop = ReconciliationLoop.builder()
            .eventStore(eventStore)
            .executor(executor)
            .calls(calls)
            .stateMachine(stateMachine)
            .retryPolicy(effectiveRetry)
            .metrics(effectiveMetrics)
            .clock(effectiveClock)
            .checkInterval(checkInterval)
            .gracePeriod(gracePeriod)
            .build();
        ConfirmationRegistry confirmations = new ConfirmationRegistry(effectiveClock);
        ConfirmationCleanupScheduler cleanup = ConfirmationCleanupScheduler.builder()
            .registry(confirmations)
            .maxAge(confirmationMaxAge)
            .interval(cleanupInterval)
            .build();
        CommandHandler commands = CommandHandler.builder()
            .eventStore(eventStore)
            .resourceControl(resourceControl)
            .notifier(notifier)
            .confirmations(confirmations)
            .calls(calls)
            .clock(effectiveClock)
            .deletionDelay(deletionDelay)
            .broadcastChannel(broadcastChannel)
            .build();
        return new Reconciler(loop, cleanup, confirmations, commands, executor, calls, effectiveMetrics);
      } catch (RuntimeException e) {
        calls.close();
        throw e;
      }
    }

    private static void requireCollaborator(Object collaborator, String name) {
      if (collaborator == null) {
        throw new ConfigurationException(name + " is required");
      }
    }
  }
}
