package ai.promoted.metrics.engagement.common.table;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.ProcessedFileRecord;
import ai.promoted.metrics.engagement.common.util.TimeUtil;
import java.time.LocalDate;
import javax.annotation.Nullable;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

/** Converts store records to and from Avro {@link GenericRecord}s. */
public final class StoreRecords {

  public static GenericRecord fromEvent(CanonicalEvent event) {
    GenericData.Record record = new GenericData.Record(Tables.EVENT_SCHEMA);
    record.put("timestamp", TimeUtil.toEpochMicros(event.timestamp()));
    record.put("user_id", event.userId());
    record.put("session_id", event.sessionId());
    record.put("name", event.name());
    record.put("org_id", event.orgId());
    record.put("email", event.email());
    record.put("link_label", event.linkLabel());
    record.put("link_type", event.linkType());
    record.put("page_url", event.pageUrl());
    record.put("source_file", event.sourceFile());
    return record;
  }

  public static CanonicalEvent toEvent(GenericRecord record) {
    return CanonicalEvent.builder()
        .setTimestamp(TimeUtil.fromEpochMicros((Long) record.get("timestamp")))
        .setUserId(record.get("user_id").toString())
        .setSessionId(record.get("session_id").toString())
        .setName(record.get("name").toString())
        .setOrgId(string(record.get("org_id")))
        .setEmail(string(record.get("email")))
        .setLinkLabel(string(record.get("link_label")))
        .setLinkType(string(record.get("link_type")))
        .setPageUrl(string(record.get("page_url")))
        .setSourceFile(record.get("source_file").toString())
        .build();
  }

  public static GenericRecord fromProcessedFile(ProcessedFileRecord file) {
    GenericData.Record record = new GenericData.Record(Tables.MANIFEST_SCHEMA);
    record.put("filename", file.filename());
    record.put("content_hash", file.contentHash());
    record.put("row_count", file.rowCount());
    record.put("processed_at", TimeUtil.toEpochMicros(file.processedAt()));
    record.put(
        "extracted_date",
        file.extractedDate() == null ? null : (int) file.extractedDate().toEpochDay());
    return record;
  }

  public static ProcessedFileRecord toProcessedFile(GenericRecord record) {
    Object extractedDate = record.get("extracted_date");
    return ProcessedFileRecord.create(
        record.get("filename").toString(),
        record.get("content_hash").toString(),
        (Long) record.get("row_count"),
        TimeUtil.fromEpochMicros((Long) record.get("processed_at")),
        extractedDate == null ? null : LocalDate.ofEpochDay((Integer) extractedDate));
  }

  // Avro returns Utf8 for strings.
  @Nullable
  private static String string(@Nullable Object value) {
    return value == null ? null : value.toString();
  }

  private StoreRecords() {}
}
