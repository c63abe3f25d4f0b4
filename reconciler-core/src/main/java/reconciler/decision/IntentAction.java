package reconciler.decision;

/**
 * The single action due for an intent in a given cycle.
 */
public enum IntentAction {
  /** Nothing to do this cycle. */
  NONE,
  /** Notify the requestor and the channel, then commit {@code reminder_sent=true}. */
  SEND_REMINDER,
  /** Delete the resource (if it still exists), notify, then remove the event. */
  EXECUTE,
  /** The intent vanished from the store; drop local tracking, no remote call. */
  PURGE
}
