package ai.promoted.metrics.engagement.job.enrich;

import ai.promoted.metrics.engagement.common.functions.AsOfLookup;
import ai.promoted.metrics.engagement.common.records.OrgMatch;
import ai.promoted.metrics.engagement.common.records.OrgSnapshot;
import java.time.LocalDate;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Organizational snapshots per actor for as-of lookups. An event gets the latest snapshot dated on
 * or before its session date, else the earliest later snapshot.
 */
public final class OrgSnapshotIndex {
  private static final OrgSnapshotIndex UNAVAILABLE = new OrgSnapshotIndex(null);

  @Nullable private final AsOfLookup<String, LocalDate, OrgSnapshot> lookup;

  private OrgSnapshotIndex(@Nullable AsOfLookup<String, LocalDate, OrgSnapshot> lookup) {
    this.lookup = lookup;
  }

  public static OrgSnapshotIndex of(Iterable<OrgSnapshot> snapshots) {
    return new OrgSnapshotIndex(
        AsOfLookup.create(snapshots, OrgSnapshot::actorId, OrgSnapshot::snapshotDate));
  }

  /**
   * For runs without a readable feed. Every event resolves to {@link
   * OrgMatch#REFERENCE_UNAVAILABLE}.
   */
  public static OrgSnapshotIndex unavailable() {
    return UNAVAILABLE;
  }

  public boolean isAvailable() {
    return lookup != null;
  }

  public int actorCount() {
    return lookup == null ? 0 : lookup.keyCount();
  }

  public int snapshotCount() {
    return lookup == null ? 0 : lookup.rowCount();
  }

  /** Snapshots dropped because a later row had the same actor and date. */
  public int replacedCount() {
    return lookup == null ? 0 : lookup.replacedCount();
  }

  /**
   * @param orgId normalized organizational identifier
   */
  public OrgResolution resolve(@Nullable String orgId, LocalDate eventDate) {
    if (lookup == null) {
      return OrgResolution.unmatched(OrgMatch.REFERENCE_UNAVAILABLE);
    }
    if (orgId == null) {
      return OrgResolution.unmatched(OrgMatch.NO_ORG_ID);
    }
    Optional<AsOfLookup.Match<OrgSnapshot>> match = lookup.lookup(orgId, eventDate);
    if (match.isEmpty()) {
      return OrgResolution.unmatched(OrgMatch.NO_SNAPSHOT);
    }
    return OrgResolution.matched(
        match.get().following() ? OrgMatch.NEAREST_FOLLOWING : OrgMatch.AS_OF,
        match.get().dimension().attributes());
  }
}
