package reconciler.demo;

import reconciler.NotFoundException;
import reconciler.model.IntentMetadata;
import reconciler.model.NewEvent;
import reconciler.model.StoredEvent;
import reconciler.spi.EventStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calendar stand-in that keeps events in a map.
 */
final class InMemoryEventStore implements EventStore {
  private final Map<String, StoredEvent> events = new LinkedHashMap<>();
  private final Clock clock;
  private int nextId = 1;

  InMemoryEventStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized List<StoredEvent> listOpen(String tag) {
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
    String id = "cal-" + nextId++;
    events.put(id, new StoredEvent(id, event.startsAt(), clock.instant(), event.metadata()));
    return id;
  }

  @Override
  public synchronized void updateMetadata(String eventId, Map<String, String> patch) {
    StoredEvent current = events.get(eventId);
    if (current == null) {
      throw new NotFoundException("event " + eventId);
    }
    Map<String, String> merged = new HashMap<>(current.metadata());
    merged.putAll(patch);
    events.put(eventId, new StoredEvent(eventId, current.startsAt(), current.createdAt(), merged));
  }

  @Override
  public synchronized void delete(String eventId) {
    if (events.remove(eventId) == null) {
      throw new NotFoundException("event " + eventId);
    }
  }

  synchronized int size() {
    return events.size();
  }
}
