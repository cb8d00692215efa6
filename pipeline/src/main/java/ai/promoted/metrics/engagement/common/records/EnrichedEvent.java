package ai.promoted.metrics.engagement.common.records;

import ai.promoted.metrics.engagement.common.functions.GapBucket;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import javax.annotation.Nullable;

/**
 * A stored event with its organizational attributes and derived features. Always rebuilt from the
 * store and the reference data; never persisted as a source of truth.
 */
@AutoValue
public abstract class EnrichedEvent {

  public abstract CanonicalEvent event();

  public abstract OrgMatch orgMatch();

  /** Organizational output column to value. Empty when {@link #orgMatch()} is not matched. */
  public abstract ImmutableMap<String, String> orgAttributes();

  /** Event time in the reporting timezone. */
  public abstract LocalDateTime timestampLocal();

  public abstract LocalDate sessionDate();

  /** {@code <session_date>_<user_id>_<session_id>}. */
  public abstract String sessionKey();

  public abstract int eventHour();

  public abstract String eventWeekday();

  /** ISO day of week, Monday = 1. */
  public abstract int eventWeekdayNum();

  /** 1-based position within the session. */
  public abstract int eventOrder();

  @Nullable
  public abstract String prevEvent();

  @Nullable
  public abstract Instant prevTimestamp();

  @Nullable
  public abstract Long msSincePrevEvent();

  public abstract GapBucket timeSincePrevBucket();

  @Nullable
  public abstract String contentId();

  public abstract ActionCategory actionType();

  @Nullable
  public abstract String contentTitle();

  @Nullable
  public abstract String contentKeys();

  @Nullable
  public String orgAttribute(String column) {
    return orgAttributes().get(column);
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_EnrichedEvent.Builder().setOrgAttributes(ImmutableMap.of());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setEvent(CanonicalEvent event);

    public abstract Builder setOrgMatch(OrgMatch orgMatch);

    public abstract Builder setOrgAttributes(ImmutableMap<String, String> orgAttributes);

    public abstract Builder setTimestampLocal(LocalDateTime timestampLocal);

    public abstract Builder setSessionDate(LocalDate sessionDate);

    public abstract Builder setSessionKey(String sessionKey);

    public abstract Builder setEventHour(int eventHour);

    public abstract Builder setEventWeekday(String eventWeekday);

    public abstract Builder setEventWeekdayNum(int eventWeekdayNum);

    public abstract Builder setEventOrder(int eventOrder);

    public abstract Builder setPrevEvent(@Nullable String prevEvent);

    public abstract Builder setPrevTimestamp(@Nullable Instant prevTimestamp);

    public abstract Builder setMsSincePrevEvent(@Nullable Long msSincePrevEvent);

    public abstract Builder setTimeSincePrevBucket(GapBucket timeSincePrevBucket);

    public abstract Builder setContentId(@Nullable String contentId);

    public abstract Builder setActionType(ActionCategory actionType);

    public abstract Builder setContentTitle(@Nullable String contentTitle);

    public abstract Builder setContentKeys(@Nullable String contentKeys);

    public abstract EnrichedEvent build();
  }
}
