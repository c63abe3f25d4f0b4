/**
 * In-memory confirmations for disruptive actions requested outside the calendar flow.
 */
package reconciler.confirm;
