package reconciler.loop;

import reconciler.execute.ExecutionOutcome;

/**
 * Summary of one reconciliation cycle.
 *
 * @param fetchFailed     whether the event-store fetch failed, in which case nothing else ran
 * @param openIntents     intents listed by the fetch, duplicates included
 * @param reminders       reminders delivered, whether or not their commit succeeded
 * @param executions      intents executed, deleted or found already gone
 * @param purges          intents whose local tracking was dropped
 * @param failures        actions that failed and are left for the next cycle
 * @param duplicates      extra open intents for an already-seen resource, left untouched
 * @param suppressed      actions skipped because the intent already reached a terminal state
 */
public record IterationReport(
    boolean fetchFailed,
    int openIntents,
    int reminders,
    int executions,
    int purges,
    int failures,
    int duplicates,
    int suppressed
) {

  static IterationReport failedFetch() {
    return new IterationReport(true, 0, 0, 0, 0, 0, 0, 0);
  }

  static IterationReport skipped() {
    return new IterationReport(false, 0, 0, 0, 0, 0, 0, 0);
  }

  /** Total number of executor invocations in the cycle. */
  public int actions() {
    return reminders + executions + purges + failures + suppressed;
  }

  static final class Tally {
    private final int openIntents;
    private final int duplicates;
    private int reminders;
    private int executions;
    private int purges;
    private int failures;
    private int suppressed;

    Tally(int openIntents, int duplicates) {
      this.openIntents = openIntents;
      this.duplicates = duplicates;
    }

    void count(ExecutionOutcome outcome) {
      switch (outcome) {
        case NOTIFIED, REMINDER_COMMIT_FAILED -> reminders++;
        case DELETED, ALREADY_GONE -> executions++;
        case PURGED -> purges++;
        case SUPPRESSED -> suppressed++;
        case FAILED -> failures++;
      }
    }

    IterationReport toReport() {
      return new IterationReport(false, openIntents, reminders, executions, purges, failures,
          duplicates, suppressed);
    }
  }
}
