/**
 * Value types read from and written to the collaborators.
 *
 * <p>{@link reconciler.model.DeletionIntent} is the typed view of an event-store record;
 * {@link reconciler.model.IntentMetadata} defines how it is encoded in the record's
 * flat metadata.
 */
package reconciler.model;
