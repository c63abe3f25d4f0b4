/**
 * The scheduled reconciliation loop and its back-off policies.
 *
 * @see reconciler.loop.ReconciliationLoop
 */
package reconciler.loop;
