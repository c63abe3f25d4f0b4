package reconciler.model;

/**
 * Lifecycle state of a deletion intent, derived from a snapshot and the current time.
 * Not stored anywhere.
 *
 * <pre>
 * SCHEDULED → REMINDER_DUE → REMINDER_SENT → EXECUTE_DUE → EXECUTED
 *     └────────────┬─────────────┘
 *              CANCELLED   (intent vanished from the store between polls)
 * </pre>
 */
public enum IntentState {
  SCHEDULED,
  REMINDER_DUE,
  REMINDER_SENT,
  EXECUTE_DUE,
  EXECUTED,
  CANCELLED;

  /**
   * Whether no further executor action can follow this state.
   */
  public boolean isTerminal() {
    return this == EXECUTED || this == CANCELLED;
  }
}
