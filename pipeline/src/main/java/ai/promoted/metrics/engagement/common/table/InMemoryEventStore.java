package ai.promoted.metrics.engagement.common.table;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.EventIdentity;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeMap;

/** Events kept sorted by identity. */
public class InMemoryEventStore implements EventStore {
  private final TreeMap<EventIdentity, CanonicalEvent> events;

  public InMemoryEventStore() {
    this.events = new TreeMap<>();
  }

  public InMemoryEventStore(Collection<CanonicalEvent> initial) {
    this();
    insertAll(initial);
  }

  @Override
  public int deleteMatching(Set<EventIdentity> identities) {
    int deleted = 0;
    for (EventIdentity identity : identities) {
      if (events.remove(identity) != null) {
        deleted++;
      }
    }
    return deleted;
  }

  @Override
  public void insertAll(Collection<CanonicalEvent> newEvents) {
    Set<EventIdentity> batch = new HashSet<>();
    for (CanonicalEvent event : newEvents) {
      EventIdentity identity = event.identity();
      Preconditions.checkState(batch.add(identity), "Duplicate identity in batch, %s", identity);
      Preconditions.checkState(
          !events.containsKey(identity), "Identity is already stored, %s", identity);
    }
    for (CanonicalEvent event : newEvents) {
      events.put(event.identity(), event);
    }
  }

  @Override
  public ImmutableList<CanonicalEvent> scan() {
    return ImmutableList.copyOf(events.values());
  }

  @Override
  public int size() {
    return events.size();
  }
}
