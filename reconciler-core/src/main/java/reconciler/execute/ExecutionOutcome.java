package reconciler.execute;

/**
 * Result of one {@link ActionExecutor} invocation.
 */
public enum ExecutionOutcome {
  /** Reminder delivered and {@code reminder_sent=true} committed. */
  NOTIFIED,
  /** Reminder delivered but the commit failed; the next cycle may remind again. */
  REMINDER_COMMIT_FAILED,
  /** Resource deleted and its event purged. */
  DELETED,
  /** Resource was already gone; its event was purged without a delete call. */
  ALREADY_GONE,
  /** Local tracking dropped for an intent that left the store. */
  PURGED,
  /** The intent already reached a terminal state in this process; nothing was done. */
  SUPPRESSED,
  /** The action failed and is left for the next cycle. */
  FAILED;

  /**
   * Returns whether the action ended in a failure that the next cycle will re-attempt.
   */
  public boolean isFailure() {
    return this == FAILED;
  }
}
