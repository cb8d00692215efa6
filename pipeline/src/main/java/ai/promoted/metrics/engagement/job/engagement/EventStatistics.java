package ai.promoted.metrics.engagement.job.engagement;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.records.OrgMatch;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/** Profile of the enriched store for the run summary. */
@AutoValue
public abstract class EventStatistics {
  static final String NO_LINK_TYPE = "(none)";
  private static final int TOP_UNMATCHED = 10;
  private static final int CATCH_ALL_SAMPLES = 5;

  public abstract long rowCount();

  @Nullable
  public abstract Instant firstEvent();

  @Nullable
  public abstract Instant lastEvent();

  public abstract long uniqueUsers();

  public abstract long uniqueSessions();

  public abstract long uniqueOrgIds();

  /** Every {@link OrgMatch}, including zero counts. */
  public abstract ImmutableMap<OrgMatch, Long> orgMatchCounts();

  /** Org ids without any snapshot, most frequent first. */
  public abstract ImmutableMap<String, Long> topUnmatchedOrgIds();

  /** Every {@link ActionCategory}, including zero counts. */
  public abstract ImmutableMap<ActionCategory, Long> actionCounts();

  /** Most frequent labels that fell through to the catch-all category. */
  public abstract ImmutableList<String> catchAllSampleLabels();

  /** Most frequent first. */
  public abstract ImmutableMap<String, Long> linkTypeCounts();

  public long matchedCount() {
    return orgMatchCounts().entrySet().stream()
        .filter(entry -> entry.getKey().isMatched())
        .mapToLong(Map.Entry::getValue)
        .sum();
  }

  public static EventStatistics of(List<EnrichedEvent> events) {
    Instant first = null;
    Instant last = null;
    Set<String> users = new HashSet<>();
    Set<String> sessions = new HashSet<>();
    Set<String> orgIds = new HashSet<>();
    Map<String, Long> unmatched = new HashMap<>();
    Map<String, Long> catchAllLabels = new HashMap<>();
    Map<String, Long> linkTypes = new HashMap<>();
    for (EnrichedEvent enriched : events) {
      Instant timestamp = enriched.event().timestamp();
      first = first == null || timestamp.isBefore(first) ? timestamp : first;
      last = last == null || timestamp.isAfter(last) ? timestamp : last;
      users.add(enriched.event().userId());
      sessions.add(enriched.sessionKey());
      if (enriched.event().orgId() != null) {
        orgIds.add(enriched.event().orgId());
      }
      if (enriched.orgMatch() == OrgMatch.NO_SNAPSHOT) {
        unmatched.merge(enriched.event().orgId(), 1L, Long::sum);
      }
      if (!enriched.actionType().isReportable() && enriched.event().linkLabel() != null) {
        catchAllLabels.merge(enriched.event().linkLabel(), 1L, Long::sum);
      }
      String linkType = enriched.event().linkType();
      linkTypes.merge(linkType == null ? NO_LINK_TYPE : linkType, 1L, Long::sum);
    }
    return new AutoValue_EventStatistics(
        events.size(),
        first,
        last,
        users.size(),
        sessions.size(),
        orgIds.size(),
        countAll(OrgMatch.values(), events, EnrichedEvent::orgMatch),
        mostFrequent(unmatched, TOP_UNMATCHED),
        countAll(ActionCategory.values(), events, EnrichedEvent::actionType),
        mostFrequent(catchAllLabels, CATCH_ALL_SAMPLES).keySet().asList(),
        mostFrequent(linkTypes, Integer.MAX_VALUE));
  }

  private static <E extends Enum<E>> ImmutableMap<E, Long> countAll(
      E[] values, List<EnrichedEvent> events, Function<EnrichedEvent, E> getValue) {
    Map<E, Long> counts =
        events.stream().collect(Collectors.groupingBy(getValue, Collectors.counting()));
    return Arrays.stream(values)
        .collect(
            ImmutableMap.toImmutableMap(Function.identity(), v -> counts.getOrDefault(v, 0L)));
  }

  // Ties are broken by key so summaries are stable.
  private static ImmutableMap<String, Long> mostFrequent(Map<String, Long> counts, int limit) {
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(limit)
        .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, Map.Entry::getValue));
  }
}
