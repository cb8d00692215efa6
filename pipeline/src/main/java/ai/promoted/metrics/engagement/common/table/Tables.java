package ai.promoted.metrics.engagement.common.table;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;

/** Avro schemas of the persisted store. */
public interface Tables {
  String NAMESPACE = "ai.promoted.metrics.engagement.store";

  Schema TIMESTAMP_MICROS =
      LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));

  Schema DATE = LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));

  Schema EVENT_SCHEMA =
      SchemaBuilder.record("StoredEvent")
          .namespace(NAMESPACE)
          .fields()
          .name("timestamp")
          .type(TIMESTAMP_MICROS)
          .noDefault()
          .requiredString("user_id")
          .requiredString("session_id")
          .requiredString("name")
          .optionalString("org_id")
          .optionalString("email")
          .optionalString("link_label")
          .optionalString("link_type")
          .optionalString("page_url")
          .requiredString("source_file")
          .endRecord();

  Schema MANIFEST_SCHEMA =
      SchemaBuilder.record("ProcessedFile")
          .namespace(NAMESPACE)
          .fields()
          .requiredString("filename")
          .requiredString("content_hash")
          .requiredLong("row_count")
          .name("processed_at")
          .type(TIMESTAMP_MICROS)
          .noDefault()
          .name("extracted_date")
          .type(nullable(DATE))
          .withDefault(null)
          .endRecord();

  static Schema nullable(Schema schema) {
    return Schema.createUnion(Schema.create(Schema.Type.NULL), schema);
  }
}
