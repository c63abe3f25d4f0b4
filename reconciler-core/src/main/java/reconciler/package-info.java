/**
 * Deletion-intent reconciler: schedules deferred resource deletions in a remote event
 * store, reminds the owner a day ahead, and performs the deletion when due.
 *
 * <p>The remote store is the only durable state. Every cycle of the
 * {@link reconciler.loop.ReconciliationLoop} re-reads it and lets the
 * {@link reconciler.decision.IntentStateMachine} decide what is due; the
 * {@link reconciler.execute.ActionExecutor} performs the side effect before committing
 * the new state back to the store.
 *
 * <p>Start with {@link reconciler.Reconciler#builder()}.
 */
package reconciler;
