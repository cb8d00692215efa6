package ai.promoted.metrics.engagement.job.enrich;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the enriched view of the store: derived features, organizational attributes as of each
 * event's session date and content titles.
 */
public class EventEnricher {
  private final FeatureDeriver featureDeriver;
  private final OrgSnapshotIndex orgSnapshots;
  private final ContentCatalog contentCatalog;

  public EventEnricher(
      FeatureDeriver featureDeriver, OrgSnapshotIndex orgSnapshots, ContentCatalog contentCatalog) {
    this.featureDeriver = featureDeriver;
    this.orgSnapshots = orgSnapshots;
    this.contentCatalog = contentCatalog;
  }

  /** Returns events ordered by {@code (session_date, user_id, session_id, event_order)}. */
  public ImmutableList<EnrichedEvent> enrich(List<CanonicalEvent> events) {
    return featureDeriver.derive(events).stream()
        .map(this::enrich)
        .collect(ImmutableList.toImmutableList());
  }

  private EnrichedEvent enrich(EnrichedEvent derived) {
    OrgResolution org = orgSnapshots.resolve(derived.event().orgId(), derived.sessionDate());
    EnrichedEvent.Builder builder =
        derived.toBuilder().setOrgMatch(org.match()).setOrgAttributes(org.attributes());
    Optional<ContentCatalog.Entry> content = contentCatalog.lookup(derived.contentId());
    if (content.isPresent()) {
      builder.setContentTitle(content.get().title()).setContentKeys(content.get().keys());
    }
    return builder.build();
  }
}
