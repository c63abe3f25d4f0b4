package reconciler.execute;

import reconciler.Messages;
import reconciler.NotFoundException;
import reconciler.TransientCollaboratorException;
import reconciler.decision.IntentAction;
import reconciler.decision.IntentObservation;
import reconciler.model.DeletionIntent;
import reconciler.model.IntentMetadata;
import reconciler.spi.Audience;
import reconciler.spi.EventStore;
import reconciler.spi.MetricsExporter;
import reconciler.spi.Notifier;
import reconciler.spi.ResourceControl;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs the side effect for a decided {@link IntentAction} and then commits the
 * resulting state to the event store.
 *
 * <p>The side effect always comes first and the remote commit last:
 * <ul>
 *   <li>{@link IntentAction#SEND_REMINDER}: notify the requestor and the broadcast
 *       channel, then set {@code reminder_sent=true}. A failed commit leaves a window in
 *       which the reminder is sent again; that is accepted, a skipped reminder is not.</li>
 *   <li>{@link IntentAction#EXECUTE}: check the resource still exists, delete it, delete
 *       the event, then send the completion notice. A failed delete leaves the intent
 *       untouched so the next cycle retries.</li>
 *   <li>{@link IntentAction#PURGE}: drop local tracking; no remote call.</li>
 * </ul>
 *
 * <p>Every failure is caught, logged and reported as {@link ExecutionOutcome#FAILED};
 * nothing is retried inline. Create instances via {@link #builder()}.
 */
public final class ActionExecutor {
  private static final Logger logger = Logger.getLogger(ActionExecutor.class.getName());

  /** Channel that receives reminders and completion notices unless configured otherwise. */
  public static final String DEFAULT_BROADCAST_CHANNEL = "#proxmox";

  private final EventStore eventStore;
  private final ResourceControl resourceControl;
  private final Notifier notifier;
  private final TimedCalls calls;
  private final IntentTracker tracker;
  private final FailureTracker failures;
  private final MetricsExporter metrics;
  private final String broadcastChannel;
  private final int failureNotifyThreshold;

  private ActionExecutor(Builder builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.resourceControl = Objects.requireNonNull(builder.resourceControl, "resourceControl");
    this.notifier = Objects.requireNonNull(builder.notifier, "notifier");
    this.calls = Objects.requireNonNull(builder.calls, "calls");
    this.broadcastChannel = Objects.requireNonNull(builder.broadcastChannel, "broadcastChannel");
    if (broadcastChannel.isBlank()) {
      throw new IllegalArgumentException("broadcastChannel must not be blank");
    }
    if (builder.failureNotifyThreshold <= 0) {
      throw new IllegalArgumentException("failureNotifyThreshold must be > 0");
    }
    this.tracker = builder.tracker != null ? builder.tracker : new IntentTracker();
    this.failures = builder.failures != null ? builder.failures : new FailureTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.failureNotifyThreshold = builder.failureNotifyThreshold;
  }

  public static Builder builder() {
    return new Builder();
  }

  public IntentTracker tracker() {
    return tracker;
  }

  public FailureTracker failures() {
    return failures;
  }

  /**
   * Runs {@code action} for {@code observation}.
   *
   * @throws IllegalArgumentException for {@link IntentAction#NONE}, or if the action
   *     needs a snapshot and the observation has none
   */
  public ExecutionOutcome apply(IntentAction action, IntentObservation observation) {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(observation, "observation");
    if (action == IntentAction.PURGE) {
      return purge(observation.intentId());
    }
    if (action == IntentAction.NONE) {
      throw new IllegalArgumentException("Nothing to execute for NONE");
    }
    if (!observation.isPresent()) {
      throw new IllegalArgumentException(action + " needs a snapshot for " + observation.intentId());
    }
    return action == IntentAction.EXECUTE
        ? execute(observation.snapshot())
        : sendReminder(observation.snapshot());
  }

  // ── Reminder ─────────────────────────────────────────────────────

  public ExecutionOutcome sendReminder(DeletionIntent intent) {
    if (tracker.isExecuted(intent.intentId())) {
      logger.log(Level.FINE, "Reminder suppressed for executed intent {0}", intent.intentId());
      return ExecutionOutcome.SUPPRESSED;
    }

    String text = Messages.reminder(intent);
    try {
      if (intent.hasRequestor()) {
        notify(Audience.user(intent.requestor()), text);
      }
      notify(Audience.channel(broadcastChannel), text);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to send reminder for intent " + intent.intentId()
          + " (resource " + intent.resourceId() + "); will retry next cycle", e);
      metrics.incrementActionFailed();
      return ExecutionOutcome.FAILED;
    }
    metrics.incrementReminderSent();

    try {
      calls.run("updateMetadata(" + intent.intentId() + ")",
          () -> eventStore.updateMetadata(intent.intentId(), IntentMetadata.reminderSentPatch()));
    } catch (NotFoundException e) {
      logger.log(Level.INFO, "Intent {0} disappeared before its reminder was recorded; treating as cancelled",
          intent.intentId());
      return purge(intent.intentId());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Reminder sent for intent " + intent.intentId()
          + " but reminder_sent could not be recorded; it may be sent again", e);
      metrics.incrementReminderCommitFailed();
      return ExecutionOutcome.REMINDER_COMMIT_FAILED;
    }
    logger.log(Level.INFO, "Reminder sent for resource {0}, deletion at {1}",
        new Object[]{intent.resourceId(), intent.executeAt()});
    return ExecutionOutcome.NOTIFIED;
  }

  // ── Execute ──────────────────────────────────────────────────────

  public ExecutionOutcome execute(DeletionIntent intent) {
    String intentId = intent.intentId();
    if (tracker.isExecuted(intentId)) {
      return tracker.pendingEventPurge(intentId)
          .map(outcome -> purgeEvent(intent, outcome))
          .orElseGet(() -> {
            logger.log(Level.WARNING, "Intent {0} was already executed but is still listed; skipping",
                intentId);
            return ExecutionOutcome.SUPPRESSED;
          });
    }

    ExecutionOutcome deleted;
    try {
      if (resourceExists(intent.resourceId())) {
        deleted = deleteResource(intent);
      } else {
        logger.log(Level.INFO, "Resource {0} no longer exists; skipping delete for intent {1}",
            new Object[]{intent.resourceId(), intentId});
        deleted = ExecutionOutcome.ALREADY_GONE;
      }
    } catch (RuntimeException e) {
      onDeleteFailure(intent, e);
      return ExecutionOutcome.FAILED;
    }

    failures.reset(intentId);
    tracker.markExecuted(intentId, deleted);
    if (deleted == ExecutionOutcome.DELETED) {
      metrics.incrementDeleted();
    } else {
      metrics.incrementAlreadyGone();
    }
    return purgeEvent(intent, deleted);
  }

  private boolean resourceExists(String resourceId) {
    try {
      return calls.call("exists(" + resourceId + ")", () -> resourceControl.exists(resourceId));
    } catch (NotFoundException e) {
      return false;
    }
  }

  private ExecutionOutcome deleteResource(DeletionIntent intent) {
    try {
      calls.run("delete(" + intent.resourceId() + ")", () -> resourceControl.delete(intent.resourceId()));
    } catch (NotFoundException e) {
      logger.log(Level.INFO, "Resource {0} vanished during delete; treating as deleted", intent.resourceId());
      return ExecutionOutcome.ALREADY_GONE;
    }
    logger.log(Level.INFO, "Deleted resource {0} for intent {1}",
        new Object[]{intent.resourceId(), intent.intentId()});
    return ExecutionOutcome.DELETED;
  }

  private ExecutionOutcome purgeEvent(DeletionIntent intent, ExecutionOutcome deleted) {
    try {
      calls.run("delete event(" + intent.intentId() + ")", () -> eventStore.delete(intent.intentId()));
    } catch (NotFoundException e) {
      logger.log(Level.FINE, "Event {0} already removed", intent.intentId());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Resource " + intent.resourceId() + " is gone but event "
          + intent.intentId() + " could not be removed; will retry the event removal only", e);
      metrics.incrementActionFailed();
      return ExecutionOutcome.FAILED;
    }
    tracker.markEventPurged(intent.intentId());

    String text = deleted == ExecutionOutcome.DELETED
        ? Messages.deleted(intent)
        : Messages.alreadyGone(intent);
    bestEffortNotify(intent, text);
    return deleted;
  }

  private void onDeleteFailure(DeletionIntent intent, RuntimeException failure) {
    metrics.incrementActionFailed();
    int streak = failures.recordFailure(intent.intentId());
    boolean transientFailure = failure instanceof TransientCollaboratorException;
    logger.log(Level.WARNING, "Failed to delete resource " + intent.resourceId() + " for intent "
        + intent.intentId() + " (attempt " + streak + "); intent left for the next cycle", failure);

    // Transient failures are surfaced once, when the streak reaches the threshold.
    if (!transientFailure || streak == failureNotifyThreshold) {
      bestEffortNotify(intent, Messages.deletionFailed(intent, failure, streak));
    }
  }

  // ── Purge ────────────────────────────────────────────────────────

  public ExecutionOutcome purge(String intentId) {
    tracker.forget(intentId);
    failures.reset(intentId);
    metrics.incrementPurged();
    logger.log(Level.INFO, "Intent {0} cancelled externally; local tracking dropped", intentId);
    return ExecutionOutcome.PURGED;
  }

  // ── Notification helpers ─────────────────────────────────────────

  private void notify(Audience audience, String text) {
    calls.run("notify(" + audience + ")", () -> notifier.notify(audience, text));
  }

  private void bestEffortNotify(DeletionIntent intent, String text) {
    if (intent.hasRequestor()) {
      try {
        notify(Audience.user(intent.requestor()), text);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to notify requestor of resource " + intent.resourceId(), e);
      }
    }
    try {
      notify(Audience.channel(broadcastChannel), text);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to notify " + broadcastChannel + " about resource "
          + intent.resourceId(), e);
    }
  }

  /**
   * Builder for {@link ActionExecutor}.
   */
  public static final class Builder {
    private EventStore eventStore;
    private ResourceControl resourceControl;
    private Notifier notifier;
    private TimedCalls calls;
    private IntentTracker tracker;
    private FailureTracker failures;
    private MetricsExporter metrics;
    private String broadcastChannel = DEFAULT_BROADCAST_CHANNEL;
    private int failureNotifyThreshold = 3;

    private Builder() {
    }

    /**
     * Sets the event store holding the intents.
     *
     * <p><b>Required.</b>
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the resource control API used for the existence check and the delete.
     *
     * <p><b>Required.</b>
     */
    public Builder resourceControl(ResourceControl resourceControl) {
      this.resourceControl = resourceControl;
      return this;
    }

    /**
     * Sets the notifier for reminders and completion notices.
     *
     * <p><b>Required.</b>
     */
    public Builder notifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /**
     * Sets the timed-call runner wrapping every collaborator call.
     *
     * <p><b>Required.</b> The caller owns it and closes it.
     */
    public Builder calls(TimedCalls calls) {
      this.calls = calls;
      return this;
    }

    /**
     * Optional. Defaults to a fresh tracker.
     */
    public Builder tracker(IntentTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    /**
     * Optional. Defaults to a fresh tracker.
     */
    public Builder failures(FailureTracker failures) {
      this.failures = failures;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the channel that receives every reminder and completion notice.
     *
     * <p>Optional. Defaults to {@value ActionExecutor#DEFAULT_BROADCAST_CHANNEL}.
     */
    public Builder broadcastChannel(String broadcastChannel) {
      this.broadcastChannel = broadcastChannel;
      return this;
    }

    /**
     * Sets after how many consecutive transient delete failures the failure is
     * announced. Non-transient failures are announced immediately.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
     */
    public Builder failureNotifyThreshold(int failureNotifyThreshold) {
      this.failureNotifyThreshold = failureNotifyThreshold;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if {@code failureNotifyThreshold <= 0} or the
     *                                  broadcast channel is blank
     */
    public ActionExecutor build() {
      return new ActionExecutor(this);
    }
  }
}
