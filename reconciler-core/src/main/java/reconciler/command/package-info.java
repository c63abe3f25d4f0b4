/**
 * Closed command set at the classifier boundary and its handler.
 */
package reconciler.command;
