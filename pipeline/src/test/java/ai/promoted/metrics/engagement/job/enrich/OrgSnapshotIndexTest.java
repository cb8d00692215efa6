package ai.promoted.metrics.engagement.job.enrich;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.promoted.metrics.engagement.common.records.OrgMatch;
import ai.promoted.metrics.engagement.common.records.OrgSnapshot;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

public class OrgSnapshotIndexTest {
  private final OrgSnapshotIndex index =
      OrgSnapshotIndex.of(
          ImmutableList.of(
              snapshot("01234567", "2026-01-01", "Markets"),
              snapshot("01234567", "2026-02-01", "Retail"),
              snapshot("07654321", "2026-02-01", "Wealth")));

  @Test
  public void asOf() {
    OrgResolution resolution = index.resolve("01234567", LocalDate.parse("2026-02-25"));
    assertEquals(OrgMatch.AS_OF, resolution.match());
    assertEquals(ImmutableMap.of(OrgColumns.DIVISION, "Retail"), resolution.attributes());

    assertEquals(
        "Markets",
        index
            .resolve("01234567", LocalDate.parse("2026-01-31"))
            .attributes()
            .get(OrgColumns.DIVISION));
  }

  @Test
  public void nearestFollowing() {
    OrgResolution resolution = index.resolve("01234567", LocalDate.parse("2025-12-24"));
    assertEquals(OrgMatch.NEAREST_FOLLOWING, resolution.match());
    assertEquals(ImmutableMap.of(OrgColumns.DIVISION, "Markets"), resolution.attributes());
  }

  @Test
  public void unmatched() {
    assertEquals(
        OrgResolution.unmatched(OrgMatch.NO_SNAPSHOT),
        index.resolve("99999999", LocalDate.parse("2026-02-25")));
    assertEquals(
        OrgResolution.unmatched(OrgMatch.NO_ORG_ID),
        index.resolve(null, LocalDate.parse("2026-02-25")));
  }

  @Test
  public void unavailable() {
    OrgSnapshotIndex unavailable = OrgSnapshotIndex.unavailable();
    assertFalse(unavailable.isAvailable());
    assertEquals(
        OrgMatch.REFERENCE_UNAVAILABLE,
        unavailable.resolve("01234567", LocalDate.parse("2026-02-25")).match());
    assertEquals(
        OrgMatch.REFERENCE_UNAVAILABLE,
        unavailable.resolve(null, LocalDate.parse("2026-02-25")).match());
  }

  @Test
  public void counts() {
    assertTrue(index.isAvailable());
    assertEquals(2, index.actorCount());
    assertEquals(3, index.snapshotCount());
    assertEquals(0, index.replacedCount());
  }

  private static OrgSnapshot snapshot(String actorId, String date, String division) {
    return OrgSnapshot.create(
        actorId, LocalDate.parse(date), ImmutableMap.of(OrgColumns.DIVISION, division));
  }
}
