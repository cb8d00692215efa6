package ai.promoted.metrics.engagement.job.enrich;

import static ai.promoted.metrics.engagement.common.testing.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ai.promoted.metrics.engagement.common.functions.ActionClassifier;
import ai.promoted.metrics.engagement.common.functions.GapBucket;
import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.records.OrgMatch;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

public class FeatureDeriverTest {
  private final FeatureDeriver deriver =
      new FeatureDeriver(ZoneId.of("Europe/Berlin"), ActionClassifier.withDefaultRules());

  @Test
  public void sessionFeatures() {
    CanonicalEvent first =
        event("2026-02-25T10:00:00Z", "u1", "s1")
            .setOrgId("01234567")
            .setLinkLabel("15Read full story")
            .build();
    CanonicalEvent second = event("2026-02-25T10:00:01Z", "u1", "s1").build();
    CanonicalEvent third = event("2026-02-25T10:05:00Z", "u1", "s1").setName("view").build();

    ImmutableList<EnrichedEvent> derived = deriver.derive(ImmutableList.of(third, first, second));

    assertEquals(3, derived.size());
    EnrichedEvent e1 = derived.get(0);
    assertEquals(first, e1.event());
    assertEquals(1, e1.eventOrder());
    assertEquals(LocalDateTime.parse("2026-02-25T11:00:00"), e1.timestampLocal());
    assertEquals(LocalDate.parse("2026-02-25"), e1.sessionDate());
    assertEquals("2026-02-25_u1_s1", e1.sessionKey());
    assertEquals(11, e1.eventHour());
    assertEquals("Wednesday", e1.eventWeekday());
    assertEquals(3, e1.eventWeekdayNum());
    assertNull(e1.prevEvent());
    assertNull(e1.prevTimestamp());
    assertNull(e1.msSincePrevEvent());
    assertEquals(GapBucket.FIRST_EVENT, e1.timeSincePrevBucket());
    assertEquals("15", e1.contentId());
    assertEquals(ActionCategory.READ, e1.actionType());
    assertEquals(OrgMatch.REFERENCE_UNAVAILABLE, e1.orgMatch());

    EnrichedEvent e2 = derived.get(1);
    assertEquals(2, e2.eventOrder());
    assertEquals("click", e2.prevEvent());
    assertEquals(Instant.parse("2026-02-25T10:00:00Z"), e2.prevTimestamp());
    assertEquals(1_000L, e2.msSincePrevEvent());
    assertEquals("0.5-1s", e2.timeSincePrevBucket().label());
    assertNull(e2.contentId());
    assertEquals(ActionCategory.OTHER, e2.actionType());
    assertEquals(OrgMatch.NO_ORG_ID, e2.orgMatch());

    EnrichedEvent e3 = derived.get(2);
    assertEquals(third, e3.event());
    assertEquals(3, e3.eventOrder());
    assertEquals(299_000L, e3.msSincePrevEvent());
    assertEquals("> 60s", e3.timeSincePrevBucket().label());
  }

  @Test
  public void sessionSplitsAtLocalMidnight() {
    // 23:59:30 and 00:00:30 in Berlin.
    CanonicalEvent beforeMidnight = event("2026-02-25T22:59:30Z", "u2", "s2").build();
    CanonicalEvent afterMidnight = event("2026-02-25T23:00:30Z", "u2", "s2").build();

    ImmutableList<EnrichedEvent> derived =
        deriver.derive(ImmutableList.of(afterMidnight, beforeMidnight));

    assertEquals("2026-02-25_u2_s2", derived.get(0).sessionKey());
    assertEquals(1, derived.get(0).eventOrder());
    assertEquals(23, derived.get(0).eventHour());
    assertEquals("2026-02-26_u2_s2", derived.get(1).sessionKey());
    assertEquals(1, derived.get(1).eventOrder());
    assertEquals(GapBucket.FIRST_EVENT, derived.get(1).timeSincePrevBucket());
    assertEquals("Thursday", derived.get(1).eventWeekday());
  }

  @Test
  public void equalTimestampsOrderByName() {
    CanonicalEvent view = event("2026-02-25T10:00:00Z", "u1", "s1").setName("view").build();
    CanonicalEvent click = event("2026-02-25T10:00:00Z", "u1", "s1").setName("click").build();

    ImmutableList<EnrichedEvent> derived = deriver.derive(ImmutableList.of(view, click));

    assertEquals(click, derived.get(0).event());
    assertEquals(view, derived.get(1).event());
    assertEquals(0L, derived.get(1).msSincePrevEvent());
    assertEquals(GapBucket.UNDER_HALF_SECOND, derived.get(1).timeSincePrevBucket());
  }

  @Test
  public void sessionsAreOrderedByDateUserAndSession() {
    ImmutableList<EnrichedEvent> derived =
        deriver.derive(
            ImmutableList.of(
                event("2026-02-26T09:00:00Z", "a", "s1").build(),
                event("2026-02-25T09:00:00Z", "b", "s1").build(),
                event("2026-02-25T10:00:00Z", "a", "s2").build(),
                event("2026-02-25T11:00:00Z", "a", "s1").build()));

    assertEquals(
        ImmutableList.of(
            "2026-02-25_a_s1", "2026-02-25_a_s2", "2026-02-25_b_s1", "2026-02-26_a_s1"),
        derived.stream().map(EnrichedEvent::sessionKey).collect(ImmutableList.toImmutableList()));
  }
}
