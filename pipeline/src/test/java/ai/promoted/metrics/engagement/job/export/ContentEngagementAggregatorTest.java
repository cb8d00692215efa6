package ai.promoted.metrics.engagement.job.export;

import static ai.promoted.metrics.engagement.common.testing.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.promoted.metrics.engagement.common.functions.ActionClassifier;
import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.ContentEngagementRow;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.records.OrgSnapshot;
import ai.promoted.metrics.engagement.job.enrich.ContentCatalog;
import ai.promoted.metrics.engagement.job.enrich.EventEnricher;
import ai.promoted.metrics.engagement.job.enrich.FeatureDeriver;
import ai.promoted.metrics.engagement.job.enrich.OrgColumns;
import ai.promoted.metrics.engagement.job.enrich.OrgSnapshotIndex;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.time.ZoneId;
import javax.annotation.Nullable;
import org.junit.jupiter.api.Test;

public class ContentEngagementAggregatorTest {
  private static final LocalDate FEB_25 = LocalDate.parse("2026-02-25");

  private final EventEnricher enricher =
      new EventEnricher(
          new FeatureDeriver(ZoneId.of("Europe/Berlin"), ActionClassifier.withDefaultRules()),
          OrgSnapshotIndex.of(
              ImmutableList.of(
                  snapshot("00000001", "Retail", "EMEA"),
                  snapshot("00000002", "Retail", "EMEA"),
                  snapshot("00000003", "Markets", "APAC"))),
          ContentCatalog.of(
              ImmutableMap.of("10", ContentCatalog.Entry.create("Remote work", "hr;remote"))));

  private final ContentEngagementAggregator aggregator = new ContentEngagementAggregator();

  @Test
  public void aggregate() {
    ImmutableList<EnrichedEvent> events =
        enricher.enrich(
            ImmutableList.of(
                click("2026-02-25T10:00:00Z", "u1", "00000001", "10Read full story"),
                click("2026-02-25T10:00:05Z", "u1", "00000001", "10 like"),
                click("2026-02-25T10:01:00Z", "u2", "00000002", "10Submit"),
                click("2026-02-25T10:02:00Z", "u3", "00000003", "10Read full story"),
                click("2026-02-25T10:03:00Z", "u4", null, "9Cancel"),
                click("2026-02-25T10:04:00Z", "u1", "00000001", "10Print"),
                click("2026-02-25T10:05:00Z", "u1", "00000001", "Home")));

    ImmutableList<ContentEngagementRow> rows = aggregator.aggregate(events);

    assertEquals(3, rows.size());

    ContentEngagementRow nine = rows.get(0);
    assertEquals("9", nine.contentId());
    assertEquals(FEB_25, nine.date());
    assertNull(nine.orgDivision());
    assertEquals(1, nine.totalEvents());
    assertEquals(0, nine.uniqueUsers());
    assertEquals(1, nine.uniqueSessions());
    assertEquals(1, nine.count(ActionCategory.CANCEL));
    assertNull(nine.contentTitle());

    ContentEngagementRow markets = rows.get(1);
    assertEquals("10", markets.contentId());
    assertEquals("Markets", markets.orgDivision());
    assertEquals("APAC", markets.orgRegion());
    assertEquals(1, markets.totalEvents());
    assertEquals(1, markets.count(ActionCategory.READ));

    ContentEngagementRow retail = rows.get(2);
    assertEquals("10", retail.contentId());
    assertEquals("Retail", retail.orgDivision());
    assertEquals("EMEA", retail.orgRegion());
    assertEquals(3, retail.totalEvents());
    assertEquals(2, retail.uniqueUsers());
    assertEquals(2, retail.uniqueSessions());
    assertEquals(1, retail.count(ActionCategory.READ));
    assertEquals(1, retail.count(ActionCategory.LIKE));
    assertEquals(1, retail.count(ActionCategory.SUBMIT));
    assertEquals(0, retail.count(ActionCategory.OPEN_FORM));
    assertEquals(0, retail.count(ActionCategory.OTHER));
    assertEquals("Remote work", retail.contentTitle());
    assertEquals("hr;remote", retail.contentKeys());
  }

  @Test
  public void otherActionsAreNotAggregated() {
    ImmutableList<EnrichedEvent> events =
        enricher.enrich(
            ImmutableList.of(click("2026-02-25T10:00:00Z", "u1", "00000001", "10Print")));

    assertTrue(aggregator.aggregate(events).isEmpty());
  }

  private static CanonicalEvent click(
      String timestamp, String userId, @Nullable String orgId, String linkLabel) {
    return event(timestamp, userId, "s1").setOrgId(orgId).setLinkLabel(linkLabel).build();
  }

  private static OrgSnapshot snapshot(String actorId, String division, String region) {
    return OrgSnapshot.create(
        actorId,
        LocalDate.parse("2026-01-01"),
        ImmutableMap.of(OrgColumns.DIVISION, division, OrgColumns.REGION, region));
  }
}
