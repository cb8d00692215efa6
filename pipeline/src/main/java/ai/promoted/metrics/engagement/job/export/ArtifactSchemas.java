package ai.promoted.metrics.engagement.job.export;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.table.Tables;
import ai.promoted.metrics.engagement.job.enrich.OrgColumns;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.SchemaBuilder.FieldAssembler;

/** Fixed Avro schemas of the Parquet artifacts. Every column is present on every run. */
public interface ArtifactSchemas {
  String NAMESPACE = "ai.promoted.metrics.engagement.artifact";

  Schema LOCAL_TIMESTAMP_MICROS =
      LogicalTypes.localTimestampMicros().addToSchema(Schema.create(Schema.Type.LONG));

  Schema EVENT_SCHEMA = eventSchema();

  Schema CONTENT_ENGAGEMENT_SCHEMA = contentEngagementSchema();

  private static Schema eventSchema() {
    FieldAssembler<Schema> fields =
        SchemaBuilder.record("EngagementEvent")
            .namespace(NAMESPACE)
            .fields()
            .name("timestamp")
            .type(Tables.TIMESTAMP_MICROS)
            .noDefault()
            .requiredString("timestamp_utc_str")
            .name("timestamp_local")
            .type(LOCAL_TIMESTAMP_MICROS)
            .noDefault()
            .requiredString("timestamp_local_str")
            .requiredString("user_id")
            .requiredString("session_id")
            .requiredString("name")
            .optionalString("org_id")
            .optionalString("email")
            .optionalString("link_label")
            .optionalString("link_type")
            .optionalString("page_url")
            .requiredString("source_file")
            .name("session_date")
            .type(Tables.DATE)
            .noDefault()
            .requiredString("session_key")
            .requiredInt("event_hour")
            .requiredString("event_weekday")
            .requiredInt("event_weekday_num")
            .requiredInt("event_order")
            .optionalString("prev_event")
            .name("prev_timestamp")
            .type(Tables.nullable(Tables.TIMESTAMP_MICROS))
            .withDefault(null)
            .optionalLong("ms_since_prev_event")
            .optionalDouble("sec_since_prev_event")
            .requiredString("time_since_prev_bucket")
            .optionalString("content_id")
            .requiredString("action_type")
            .optionalString("content_title")
            .optionalString("content_keys")
            .requiredString("org_match");
    for (String column : OrgColumns.OUTPUT) {
      fields = fields.optionalString(column);
    }
    return fields.endRecord();
  }

  private static Schema contentEngagementSchema() {
    FieldAssembler<Schema> fields =
        SchemaBuilder.record("ContentEngagement")
            .namespace(NAMESPACE)
            .fields()
            .requiredString("content_id")
            .name("date")
            .type(Tables.DATE)
            .noDefault()
            .optionalString(OrgColumns.DIVISION)
            .optionalString(OrgColumns.REGION)
            .requiredLong("total_events")
            .requiredLong("unique_users")
            .requiredLong("unique_sessions");
    for (ActionCategory category : ActionCategory.reportable()) {
      fields = fields.requiredLong(category.countColumn());
    }
    return fields.optionalString("content_title").optionalString("content_keys").endRecord();
  }
}
