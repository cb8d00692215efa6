package ai.promoted.metrics.engagement.common.table;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.EventIdentity;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Set;

/**
 * The accumulated set of events. Identities are unique: callers remove matching identities with
 * {@link #deleteMatching} before {@link #insertAll}.
 */
public interface EventStore {

  /** Removes every stored event whose identity is in {@code identities}. Returns the count. */
  int deleteMatching(Set<EventIdentity> identities);

  /**
   * Adds {@code events}.
   *
   * @throws IllegalStateException if an identity is already stored or repeats within the batch
   */
  void insertAll(Collection<CanonicalEvent> events);

  /** All events ordered by identity. */
  ImmutableList<CanonicalEvent> scan();

  int size();
}
