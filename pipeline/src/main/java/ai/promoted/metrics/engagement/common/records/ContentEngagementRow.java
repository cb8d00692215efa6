package ai.promoted.metrics.engagement.common.records;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import javax.annotation.Nullable;

/** Engagement of one piece of content on one day for one organizational slice. */
@AutoValue
public abstract class ContentEngagementRow {

  public abstract String contentId();

  public abstract LocalDate date();

  @Nullable
  public abstract String orgDivision();

  @Nullable
  public abstract String orgRegion();

  public abstract long totalEvents();

  /** Distinct organizational identifiers. */
  public abstract long uniqueUsers();

  public abstract long uniqueSessions();

  /** Count per reportable category. Categories without events map to zero. */
  public abstract ImmutableMap<ActionCategory, Long> actionCounts();

  @Nullable
  public abstract String contentTitle();

  @Nullable
  public abstract String contentKeys();

  public long count(ActionCategory category) {
    return actionCounts().getOrDefault(category, 0L);
  }

  public static Builder builder() {
    return new AutoValue_ContentEngagementRow.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setContentId(String contentId);

    public abstract Builder setDate(LocalDate date);

    public abstract Builder setOrgDivision(@Nullable String orgDivision);

    public abstract Builder setOrgRegion(@Nullable String orgRegion);

    public abstract Builder setTotalEvents(long totalEvents);

    public abstract Builder setUniqueUsers(long uniqueUsers);

    public abstract Builder setUniqueSessions(long uniqueSessions);

    public abstract Builder setActionCounts(ImmutableMap<ActionCategory, Long> actionCounts);

    public abstract Builder setContentTitle(@Nullable String contentTitle);

    public abstract Builder setContentKeys(@Nullable String contentKeys);

    public abstract ContentEngagementRow build();
  }
}
