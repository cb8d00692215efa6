package ai.promoted.metrics.engagement.job.export;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.records.ContentEngagementRow;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.job.enrich.OrgColumns;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Aggregates events per {@code (content_id, date, org_division, org_region)}. Only events with a
 * content id and a reportable action count. Rows are sorted by the key, content ids numerically.
 */
public class ContentEngagementAggregator {

  public ImmutableList<ContentEngagementRow> aggregate(List<EnrichedEvent> events) {
    Map<Key, List<EnrichedEvent>> groups = new TreeMap<>(Key.ORDER);
    for (EnrichedEvent event : events) {
      if (event.contentId() == null || !event.actionType().isReportable()) {
        continue;
      }
      Key key =
          new Key(
              event.contentId(),
              event.sessionDate(),
              event.orgAttribute(OrgColumns.DIVISION),
              event.orgAttribute(OrgColumns.REGION));
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(event);
    }

    ImmutableList.Builder<ContentEngagementRow> rows = ImmutableList.builder();
    groups.forEach((key, group) -> rows.add(toRow(key, group)));
    return rows.build();
  }

  private static ContentEngagementRow toRow(Key key, List<EnrichedEvent> group) {
    Set<String> users = new HashSet<>();
    Set<String> sessions = new HashSet<>();
    Map<ActionCategory, Long> counts = new EnumMap<>(ActionCategory.class);
    ActionCategory.reportable().forEach(category -> counts.put(category, 0L));
    String title = null;
    String keys = null;
    for (EnrichedEvent event : group) {
      if (event.event().orgId() != null) {
        users.add(event.event().orgId());
      }
      sessions.add(event.sessionKey());
      counts.merge(event.actionType(), 1L, Long::sum);
      title = title != null ? title : event.contentTitle();
      keys = keys != null ? keys : event.contentKeys();
    }
    return ContentEngagementRow.builder()
        .setContentId(key.contentId)
        .setDate(key.date)
        .setOrgDivision(key.division)
        .setOrgRegion(key.region)
        .setTotalEvents(group.size())
        .setUniqueUsers(users.size())
        .setUniqueSessions(sessions.size())
        .setActionCounts(ImmutableMap.copyOf(counts))
        .setContentTitle(title)
        .setContentKeys(keys)
        .build();
  }

  private static final class Key {
    // Digit strings compare numerically when shorter strings sort first.
    private static final Comparator<String> CONTENT_ID =
        Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());
    private static final Comparator<String> NULLABLE =
        Comparator.nullsFirst(Comparator.naturalOrder());
    static final Comparator<Key> ORDER =
        Comparator.<Key, String>comparing(key -> key.contentId, CONTENT_ID)
            .thenComparing(key -> key.date)
            .thenComparing(key -> key.division, NULLABLE)
            .thenComparing(key -> key.region, NULLABLE);

    private final String contentId;
    private final LocalDate date;
    @Nullable private final String division;
    @Nullable private final String region;

    Key(String contentId, LocalDate date, @Nullable String division, @Nullable String region) {
      this.contentId = contentId;
      this.date = date;
      this.division = division;
      this.region = region;
    }
  }
}
