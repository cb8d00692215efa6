package ai.promoted.metrics.engagement.job.enrich;

import static ai.promoted.metrics.engagement.common.testing.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.promoted.metrics.engagement.common.functions.ActionClassifier;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.records.OrgMatch;
import ai.promoted.metrics.engagement.common.records.OrgSnapshot;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

public class EventEnricherTest {
  private final FeatureDeriver deriver =
      new FeatureDeriver(ZoneId.of("Europe/Berlin"), ActionClassifier.withDefaultRules());
  private final ContentCatalog catalog =
      ContentCatalog.of(
          ImmutableMap.of("15", ContentCatalog.Entry.create("Remote work", "hr;remote")));

  @Test
  public void enrich() {
    OrgSnapshotIndex snapshots =
        OrgSnapshotIndex.of(
            ImmutableList.of(
                OrgSnapshot.create(
                    "01234567",
                    LocalDate.parse("2026-02-01"),
                    ImmutableMap.of(OrgColumns.DIVISION, "Retail", OrgColumns.REGION, "EMEA"))));
    EventEnricher enricher = new EventEnricher(deriver, snapshots, catalog);

    ImmutableList<EnrichedEvent> enriched =
        enricher.enrich(
            ImmutableList.of(
                event("2026-02-25T10:00:00Z", "u1", "s1")
                    .setOrgId("01234567")
                    .setLinkLabel("15Read full story")
                    .build(),
                event("2026-02-25T10:00:01Z", "u1", "s1")
                    .setOrgId("99999999")
                    .setLinkLabel("16Like")
                    .build(),
                event("2026-02-25T10:00:02Z", "u1", "s1").build()));

    EnrichedEvent matched = enriched.get(0);
    assertEquals(OrgMatch.AS_OF, matched.orgMatch());
    assertEquals("Retail", matched.orgAttribute(OrgColumns.DIVISION));
    assertEquals("EMEA", matched.orgAttribute(OrgColumns.REGION));
    assertEquals("Remote work", matched.contentTitle());
    assertEquals("hr;remote", matched.contentKeys());
    assertEquals(1, matched.eventOrder());

    EnrichedEvent unmatched = enriched.get(1);
    assertEquals(OrgMatch.NO_SNAPSHOT, unmatched.orgMatch());
    assertTrue(unmatched.orgAttributes().isEmpty());
    assertEquals("16", unmatched.contentId());
    assertNull(unmatched.contentTitle());

    assertEquals(OrgMatch.NO_ORG_ID, enriched.get(2).orgMatch());
  }

  @Test
  public void referenceUnavailable() {
    EventEnricher enricher =
        new EventEnricher(deriver, OrgSnapshotIndex.unavailable(), ContentCatalog.empty());

    ImmutableList<EnrichedEvent> enriched =
        enricher.enrich(
            ImmutableList.of(
                event("2026-02-25T10:00:00Z", "u1", "s1").setOrgId("01234567").build(),
                event("2026-02-25T10:00:01Z", "u1", "s1").build()));

    assertTrue(enriched.stream().allMatch(e -> e.orgMatch() == OrgMatch.REFERENCE_UNAVAILABLE));
    assertTrue(enriched.stream().allMatch(e -> e.orgAttributes().isEmpty()));
  }
}
