package reconciler.decision;

import reconciler.model.DeletionIntent;
import reconciler.model.IntentState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Pure decision function: given the current time and what the latest poll saw, which
 * action is due.
 *
 * <p>Rules are evaluated in order, first match wins:
 * <ol>
 *   <li>absent now but seen on an earlier poll → {@link IntentAction#PURGE}</li>
 *   <li>{@code now >= executeAt} → {@link IntentAction#EXECUTE}; overdue is treated as due</li>
 *   <li>{@code now >= executeAt - reminderWindow} and no reminder sent →
 *       {@link IntentAction#SEND_REMINDER}</li>
 *   <li>otherwise → {@link IntentAction#NONE}</li>
 * </ol>
 *
 * <p>No timers and no local state: every cycle re-derives the decision from the
 * freshest remote read, so a restarted process picks up exactly where the store says
 * it is. This class is immutable and thread-safe.
 */
public final class IntentStateMachine {

  /** Default reminder window: one day before the deletion. */
  public static final Duration DEFAULT_REMINDER_WINDOW = Duration.ofHours(24);

  private final Duration reminderWindow;

  public IntentStateMachine() {
    this(DEFAULT_REMINDER_WINDOW);
  }

  /**
   * @param reminderWindow how long before {@code executeAt} the reminder becomes due; must be positive
   */
  public IntentStateMachine(Duration reminderWindow) {
    Objects.requireNonNull(reminderWindow, "reminderWindow");
    if (reminderWindow.isNegative() || reminderWindow.isZero()) {
      throw new IllegalArgumentException("reminderWindow must be positive");
    }
    this.reminderWindow = reminderWindow;
  }

  public Duration reminderWindow() {
    return reminderWindow;
  }

  /**
   * Decides the action for an intent present in the current poll.
   */
  public IntentAction decide(Instant now, DeletionIntent snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    return decide(now, IntentObservation.present(snapshot, false));
  }

  /**
   * Decides the action for one observation.
   */
  public IntentAction decide(Instant now, IntentObservation observation) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(observation, "observation");

    if (!observation.isPresent()) {
      return observation.previouslySeen() ? IntentAction.PURGE : IntentAction.NONE;
    }
    DeletionIntent intent = observation.snapshot();
    if (!now.isBefore(intent.executeAt())) {
      return IntentAction.EXECUTE;
    }
    if (!intent.reminderSent() && !now.isBefore(intent.reminderAt(reminderWindow))) {
      return IntentAction.SEND_REMINDER;
    }
    return IntentAction.NONE;
  }

  /**
   * Derives the lifecycle state of a present intent. {@link IntentState#EXECUTED} and
   * {@link IntentState#CANCELLED} are never returned here: executed intents are removed
   * from the store and cancelled ones are by definition absent.
   */
  public IntentState stateOf(Instant now, DeletionIntent intent) {
    if (!now.isBefore(intent.executeAt())) {
      return IntentState.EXECUTE_DUE;
    }
    if (intent.reminderSent()) {
      return IntentState.REMINDER_SENT;
    }
    if (!now.isBefore(intent.reminderAt(reminderWindow))) {
      return IntentState.REMINDER_DUE;
    }
    return IntentState.SCHEDULED;
  }
}
