package ai.promoted.metrics.engagement.job.export;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.ContentEngagementRow;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.util.TimeUtil;
import ai.promoted.metrics.engagement.job.enrich.OrgColumns;
import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import javax.annotation.Nullable;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

/** Converts enriched events and aggregates to artifact rows. */
public final class ArtifactRecords {
  private static final DateTimeFormatter MILLIS_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

  public static GenericRecord toEventRecord(EnrichedEvent enriched) {
    CanonicalEvent event = enriched.event();
    GenericData.Record record = new GenericData.Record(ArtifactSchemas.EVENT_SCHEMA);
    record.put("timestamp", TimeUtil.toEpochMicros(event.timestamp()));
    record.put(
        "timestamp_utc_str", MILLIS_FORMAT.format(event.timestamp().atZone(ZoneOffset.UTC)));
    record.put(
        "timestamp_local",
        TimeUtil.toEpochMicros(enriched.timestampLocal().toInstant(ZoneOffset.UTC)));
    record.put("timestamp_local_str", MILLIS_FORMAT.format(enriched.timestampLocal()));
    record.put("user_id", event.userId());
    record.put("session_id", event.sessionId());
    record.put("name", event.name());
    record.put("org_id", event.orgId());
    record.put("email", event.email());
    record.put("link_label", event.linkLabel());
    record.put("link_type", event.linkType());
    record.put("page_url", event.pageUrl());
    record.put("source_file", event.sourceFile());
    record.put("session_date", (int) enriched.sessionDate().toEpochDay());
    record.put("session_key", enriched.sessionKey());
    record.put("event_hour", enriched.eventHour());
    record.put("event_weekday", enriched.eventWeekday());
    record.put("event_weekday_num", enriched.eventWeekdayNum());
    record.put("event_order", enriched.eventOrder());
    record.put("prev_event", enriched.prevEvent());
    record.put(
        "prev_timestamp",
        enriched.prevTimestamp() == null ? null : TimeUtil.toEpochMicros(enriched.prevTimestamp()));
    record.put("ms_since_prev_event", enriched.msSincePrevEvent());
    record.put("sec_since_prev_event", seconds(enriched.msSincePrevEvent()));
    record.put("time_since_prev_bucket", enriched.timeSincePrevBucket().label());
    record.put("content_id", enriched.contentId());
    record.put("action_type", enriched.actionType().label());
    record.put("content_title", enriched.contentTitle());
    record.put("content_keys", enriched.contentKeys());
    record.put("org_match", enriched.orgMatch().name());
    for (String column : OrgColumns.OUTPUT) {
      record.put(column, enriched.orgAttribute(column));
    }
    return record;
  }

  public static GenericRecord toContentEngagementRecord(ContentEngagementRow row) {
    GenericData.Record record = new GenericData.Record(ArtifactSchemas.CONTENT_ENGAGEMENT_SCHEMA);
    record.put("content_id", row.contentId());
    record.put("date", (int) row.date().toEpochDay());
    record.put(OrgColumns.DIVISION, row.orgDivision());
    record.put(OrgColumns.REGION, row.orgRegion());
    record.put("total_events", row.totalEvents());
    record.put("unique_users", row.uniqueUsers());
    record.put("unique_sessions", row.uniqueSessions());
    for (ActionCategory category : ActionCategory.reportable()) {
      record.put(category.countColumn(), row.count(category));
    }
    record.put("content_title", row.contentTitle());
    record.put("content_keys", row.contentKeys());
    return record;
  }

  // Milliseconds to seconds with three decimals.
  @Nullable
  static Double seconds(@Nullable Long millis) {
    return millis == null ? null : BigDecimal.valueOf(millis, 3).doubleValue();
  }

  private ArtifactRecords() {}
}
