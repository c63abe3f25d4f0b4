package reconciler.spi;

import reconciler.model.NewEvent;
import reconciler.model.StoredEvent;

import java.util.List;
import java.util.Map;

/**
 * Remote calendar-like store that holds the authoritative state of every deletion
 * intent. The reconciler owns no other durable state.
 *
 * <p>Every method is a potentially blocking network call. Implementations throw
 * {@link reconciler.TransientCollaboratorException} for network errors and timeouts
 * and {@link reconciler.NotFoundException} when the addressed event is gone. Wire
 * encoding is entirely the implementation's concern.
 */
public interface EventStore {

  /**
   * Returns every open event carrying {@code type=<tag>} in its metadata, regardless of
   * its start time. Executed intents are removed from the store, so "open" means
   * "still present".
   *
   * @param tag value of the {@code type} metadata key
   * @return the open events, in any order
   */
  List<StoredEvent> listOpen(String tag);

  /**
   * Creates an event.
   *
   * @param event the event to create
   * @return the id assigned by the store
   */
  String create(NewEvent event);

  /**
   * Merges {@code patch} into the event's metadata. Keys absent from the patch keep
   * their current values.
   *
   * @throws reconciler.NotFoundException if the event no longer exists
   */
  void updateMetadata(String eventId, Map<String, String> patch);

  /**
   * Deletes the event.
   *
   * @throws reconciler.NotFoundException if the event no longer exists
   */
  void delete(String eventId);
}
