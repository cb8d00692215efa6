package ai.promoted.metrics.engagement.job.ingest;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.EventIdentity;
import ai.promoted.metrics.engagement.common.table.EventStore;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Merges a batch into the {@link EventStore}: stored events with a batch identity are deleted,
 * then the batch is inserted. Afterwards each identity is stored once, with the batch's values.
 */
public class UpsertEngine {
  private static final Logger LOGGER = LogManager.getLogger(UpsertEngine.class);

  private final EventStore store;

  public UpsertEngine(EventStore store) {
    this.store = store;
  }

  /**
   * @param events unique by identity
   */
  public MergeResult merge(List<CanonicalEvent> events) {
    ImmutableSet<EventIdentity> identities =
        events.stream().map(CanonicalEvent::identity).collect(ImmutableSet.toImmutableSet());
    int replaced = store.deleteMatching(identities);
    store.insertAll(events);
    MergeResult result = MergeResult.create(events.size(), replaced);
    LOGGER.debug(
        "Merged {} events, replaced {}, store size {}",
        result.inserted(),
        result.replaced(),
        store.size());
    return result;
  }
}
