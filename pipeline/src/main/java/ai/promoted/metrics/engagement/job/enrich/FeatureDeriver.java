package ai.promoted.metrics.engagement.job.enrich;

import ai.promoted.metrics.engagement.common.functions.ActionClassifier;
import ai.promoted.metrics.engagement.common.functions.ContentIds;
import ai.promoted.metrics.engagement.common.functions.GapBucket;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.records.OrgMatch;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Derives time, session and action features. Results depend only on the events, the reporting
 * timezone and the classifier.
 *
 * <p>A session is {@code (session_date, user_id, session_id)} where the session date is the local
 * date of the event. Within a session, events are ordered by {@code (timestamp, name)}.
 * Organizational columns are left for {@link EventEnricher}.
 */
public class FeatureDeriver {
  private static final Comparator<CanonicalEvent> SESSION_ORDER =
      Comparator.comparing(CanonicalEvent::timestamp).thenComparing(CanonicalEvent::name);

  private final ZoneId reportingZone;
  private final ActionClassifier classifier;

  public FeatureDeriver(ZoneId reportingZone, ActionClassifier classifier) {
    this.reportingZone = reportingZone;
    this.classifier = classifier;
  }

  /** Returns events ordered by {@code (session_date, user_id, session_id, event_order)}. */
  public ImmutableList<EnrichedEvent> derive(List<CanonicalEvent> events) {
    Map<SessionKey, List<CanonicalEvent>> sessions = new TreeMap<>();
    for (CanonicalEvent event : events) {
      SessionKey key = new SessionKey(localDate(event), event.userId(), event.sessionId());
      sessions.computeIfAbsent(key, k -> new ArrayList<>()).add(event);
    }

    ImmutableList.Builder<EnrichedEvent> result =
        ImmutableList.builderWithExpectedSize(events.size());
    sessions.forEach(
        (key, sessionEvents) -> {
          sessionEvents.sort(SESSION_ORDER);
          CanonicalEvent previous = null;
          int order = 0;
          for (CanonicalEvent event : sessionEvents) {
            order++;
            result.add(derive(event, key, order, previous));
            previous = event;
          }
        });
    return result.build();
  }

  private EnrichedEvent derive(
      CanonicalEvent event, SessionKey key, int order, @Nullable CanonicalEvent previous) {
    LocalDateTime local = LocalDateTime.ofInstant(event.timestamp(), reportingZone);
    Long gapMillis =
        previous == null
            ? null
            : Duration.between(previous.timestamp(), event.timestamp()).toMillis();
    return EnrichedEvent.builder()
        .setEvent(event)
        .setOrgMatch(event.orgId() == null ? OrgMatch.NO_ORG_ID : OrgMatch.REFERENCE_UNAVAILABLE)
        .setTimestampLocal(local)
        .setSessionDate(key.date)
        .setSessionKey(key.toString())
        .setEventHour(local.getHour())
        .setEventWeekday(local.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
        .setEventWeekdayNum(local.getDayOfWeek().getValue())
        .setEventOrder(order)
        .setPrevEvent(previous == null ? null : previous.name())
        .setPrevTimestamp(previous == null ? null : previous.timestamp())
        .setMsSincePrevEvent(gapMillis)
        .setTimeSincePrevBucket(GapBucket.of(gapMillis))
        .setContentId(ContentIds.fromLabel(event.linkLabel()))
        .setActionType(classifier.classify(event.linkLabel()))
        .build();
  }

  private LocalDate localDate(CanonicalEvent event) {
    return LocalDate.ofInstant(event.timestamp(), reportingZone);
  }

  private static final class SessionKey implements Comparable<SessionKey> {
    private static final Comparator<SessionKey> ORDER =
        Comparator.<SessionKey, LocalDate>comparing(key -> key.date)
            .thenComparing(key -> key.userId)
            .thenComparing(key -> key.sessionId);

    private final LocalDate date;
    private final String userId;
    private final String sessionId;

    SessionKey(LocalDate date, String userId, String sessionId) {
      this.date = date;
      this.userId = userId;
      this.sessionId = sessionId;
    }

    @Override
    public int compareTo(SessionKey other) {
      return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof SessionKey)) {
        return false;
      }
      return compareTo((SessionKey) o) == 0;
    }

    @Override
    public int hashCode() {
      return Objects.hash(date, userId, sessionId);
    }

    @Override
    public String toString() {
      return date + "_" + userId + "_" + sessionId;
    }
  }
}
