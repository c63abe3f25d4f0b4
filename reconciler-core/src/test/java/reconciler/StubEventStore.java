package reconciler;

import reconciler.model.DeletionIntent;
import reconciler.model.IntentMetadata;
import reconciler.model.NewEvent;
import reconciler.model.StoredEvent;
import reconciler.spi.EventStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory EventStore stub with failure injection.
 */
public class StubEventStore implements EventStore {
  private final Map<String, StoredEvent> events = new LinkedHashMap<>();
  private final AtomicInteger ids = new AtomicInteger();

  public final AtomicInteger listCount = new AtomicInteger();
  public final AtomicInteger updateCount = new AtomicInteger();
  public final AtomicInteger deleteCount = new AtomicInteger();
  public final List<NewEvent> created = new ArrayList<>();

  public volatile RuntimeException listFailure;
  public volatile RuntimeException updateFailure;
  public volatile RuntimeException deleteFailure;

  /** Stores an intent the way the scheduler would have created it. */
  public synchronized String add(String resourceId, String requestor, Instant executeAt, boolean reminderSent) {
    String id = "evt-" + ids.incrementAndGet();
    Map<String, String> metadata = new HashMap<>(
        IntentMetadata.newIntentEvent(resourceId, null, requestor, executeAt).metadata());
    metadata.put(IntentMetadata.REMINDER_SENT, String.valueOf(reminderSent));
    events.put(id, new StoredEvent(id, executeAt, null, metadata));
    return id;
  }

  public synchronized String add(DeletionIntent intent) {
    Map<String, String> metadata = new HashMap<>(IntentMetadata.newIntentEvent(
        intent.resourceId(), intent.resourceName(), intent.requestor(), intent.executeAt()).metadata());
    metadata.put(IntentMetadata.REMINDER_SENT, String.valueOf(intent.reminderSent()));
    events.put(intent.intentId(), new StoredEvent(intent.intentId(), intent.executeAt(), intent.createdAt(), metadata));
    return intent.intentId();
  }

  public synchronized void putRaw(StoredEvent event) {
    events.put(event.eventId(), event);
  }

  public synchronized void remove(String eventId) {
    events.remove(eventId);
  }

  public synchronized boolean contains(String eventId) {
    return events.containsKey(eventId);
  }

  public synchronized StoredEvent get(String eventId) {
    return events.get(eventId);
  }

  public synchronized int size() {
    return events.size();
  }

  @Override
  public synchronized List<StoredEvent> listOpen(String tag) {
    listCount.incrementAndGet();
    if (listFailure != null) {
      throw listFailure;
    }
    List<StoredEvent> open = new ArrayList<>();
    for (StoredEvent event : events.values()) {
      if (tag.equals(event.metadata().get(IntentMetadata.TYPE))) {
        open.add(event);
      }
    }
    return open;
  }

  @Override
  public synchronized String create(NewEvent event) {
    String id = "evt-" + ids.incrementAndGet();
    created.add(event);
    events.put(id, new StoredEvent(id, event.startsAt(), Instant.EPOCH, event.metadata()));
    return id;
  }

  @Override
  public synchronized void updateMetadata(String eventId, Map<String, String> patch) {
    updateCount.incrementAndGet();
    if (updateFailure != null) {
      throw updateFailure;
    }
    if (!events.containsKey(eventId)) {
      throw new NotFoundException("event " + eventId);
    }
    patch(eventId, patch);
  }

  @Override
  public synchronized void delete(String eventId) {
    deleteCount.incrementAndGet();
    if (deleteFailure != null) {
      throw deleteFailure;
    }
    if (events.remove(eventId) == null) {
      throw new NotFoundException("event " + eventId);
    }
  }

  private void patch(String eventId, Map<String, String> patch) {
    StoredEvent current = events.get(eventId);
    Map<String, String> merged = new HashMap<>(current.metadata());
    merged.putAll(patch);
    events.put(eventId, new StoredEvent(eventId, current.startsAt(), current.createdAt(), merged));
  }
}
