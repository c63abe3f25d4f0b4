/**
 * Stateless decision logic for deletion intents.
 *
 * @see reconciler.decision.IntentStateMachine
 */
package reconciler.decision;
