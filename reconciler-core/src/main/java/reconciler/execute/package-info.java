/**
 * Side effects and remote commits for decided intent actions.
 *
 * <p>{@link reconciler.execute.ActionExecutor} performs reminders, deletions and purges;
 * {@link reconciler.execute.IntentTracker} and {@link reconciler.execute.FailureTracker}
 * hold the little process-local state the reconciler keeps;
 * {@link reconciler.execute.TimedCalls} puts a timeout on every collaborator call.
 */
package reconciler.execute;
