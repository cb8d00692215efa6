package ai.promoted.metrics.engagement.job.ingest;

import ai.promoted.metrics.engagement.common.format.TabularFile;
import ai.promoted.metrics.engagement.common.format.TimestampParser;
import ai.promoted.metrics.engagement.common.format.TimestampParser.ParsedTimestamp;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.EventIdentity;
import ai.promoted.metrics.engagement.common.util.ActorIds;
import ai.promoted.metrics.engagement.common.util.StringUtil;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps the columns of an export onto the fixed event schema.
 *
 * <p>Exports from different tools name the same field differently. Each field has candidate
 * headers in priority order; headers are compared trimmed and case-insensitive. Coalesced fields
 * take the first non-blank value of all matching columns.
 */
public class SchemaNormalizer {
  private static final Logger LOGGER = LogManager.getLogger(SchemaNormalizer.class);

  enum EventField {
    TIMESTAMP(true, false, "timestamp", "timestamp [UTC]"),
    USER_ID(true, false, "user_Id", "user_id"),
    SESSION_ID(true, false, "session_Id", "session_id"),
    NAME(true, false, "name"),
    ORG_ID(false, true, "CP_GPN", "GPN"),
    EMAIL(false, true, "Email", "CP_Email"),
    LINK_LABEL(false, false, "CP_Link_label", "Link_label"),
    LINK_TYPE(false, false, "CP_Link_Type", "CP_LinkType"),
    PAGE_URL(false, false, "url", "CP_Page_url", "page_url");

    private final boolean required;
    private final boolean coalesced;
    private final ImmutableList<String> candidates;

    EventField(boolean required, boolean coalesced, String... candidates) {
      this.required = required;
      this.coalesced = coalesced;
      this.candidates = ImmutableList.copyOf(candidates);
    }

    ImmutableList<String> candidates() {
      return candidates;
    }
  }

  /**
   * @throws InputFileException when a required column is missing or no row is valid
   */
  public NormalizedFile normalize(TabularFile file, String sourceFile) throws InputFileException {
    Map<EventField, ImmutableList<Integer>> columns = resolveColumns(file, sourceFile);
    ImmutableList<String> droppedColumns = droppedColumns(file);
    if (!droppedColumns.isEmpty()) {
      LOGGER.info(
          "Dropping {} unmapped columns from {}: {}",
          droppedColumns.size(),
          sourceFile,
          droppedColumns);
    }

    Map<EventIdentity, CanonicalEvent> events = new LinkedHashMap<>();
    int rejected = 0;
    int collisions = 0;
    boolean anySubSecond = false;
    for (List<String> row : file.rows()) {
      Optional<ParsedTimestamp> timestamp =
          TimestampParser.parse(value(file, row, columns.get(EventField.TIMESTAMP)));
      String userId = value(file, row, columns.get(EventField.USER_ID));
      String sessionId = value(file, row, columns.get(EventField.SESSION_ID));
      String name = value(file, row, columns.get(EventField.NAME));
      if (timestamp.isEmpty() || userId == null || sessionId == null || name == null) {
        rejected++;
        continue;
      }
      anySubSecond |= timestamp.get().subSecond();
      CanonicalEvent event =
          CanonicalEvent.builder()
              .setTimestamp(timestamp.get().instant())
              .setUserId(userId)
              .setSessionId(sessionId)
              .setName(name)
              .setOrgId(ActorIds.normalize(value(file, row, columns.get(EventField.ORG_ID))))
              .setEmail(value(file, row, columns.get(EventField.EMAIL)))
              .setLinkLabel(value(file, row, columns.get(EventField.LINK_LABEL)))
              .setLinkType(value(file, row, columns.get(EventField.LINK_TYPE)))
              .setPageUrl(value(file, row, columns.get(EventField.PAGE_URL)))
              .setSourceFile(sourceFile)
              .build();
      // Remove first so the surviving row keeps the later file position.
      if (events.remove(event.identity()) != null) {
        collisions++;
      }
      events.put(event.identity(), event);
    }

    if (events.isEmpty()) {
      throw new InputFileException(
          sourceFile, "No valid rows among " + file.rowCount() + " data rows");
    }
    if (rejected > 0) {
      LOGGER.warn(
          "Rejected {} of {} rows in {} (blank required value or unparseable timestamp)",
          rejected,
          file.rowCount(),
          sourceFile);
    }
    if (collisions > 0) {
      LOGGER.warn(
          "{} rows in {} share an identity with a later row; the later row was kept",
          collisions,
          sourceFile);
    }
    boolean precisionWarning = !anySubSecond;
    if (precisionWarning) {
      LOGGER.warn(
          "{} has no sub-second timestamps; distinct clicks within one second may collapse",
          sourceFile);
    }
    return NormalizedFile.builder()
        .setSourceFile(sourceFile)
        .setEvents(ImmutableList.copyOf(events.values()))
        .setSourceRowCount(file.rowCount())
        .setRejectedRowCount(rejected)
        .setCollisionCount(collisions)
        .setDroppedColumns(droppedColumns)
        .setPrecisionWarning(precisionWarning)
        .build();
  }

  private static Map<EventField, ImmutableList<Integer>> resolveColumns(
      TabularFile file, String sourceFile) throws InputFileException {
    Map<EventField, ImmutableList<Integer>> columns = new EnumMap<>(EventField.class);
    List<String> missing = new ArrayList<>();
    for (EventField field : EventField.values()) {
      ImmutableList<Integer> indexes = file.findColumns(field.candidates());
      if (!field.coalesced && indexes.size() > 1) {
        indexes = indexes.subList(0, 1);
      }
      if (field.required && indexes.isEmpty()) {
        missing.add(field.name().toLowerCase(Locale.ROOT));
      }
      columns.put(field, indexes);
    }
    if (!missing.isEmpty()) {
      throw new InputFileException(
          sourceFile, "Missing required columns " + missing + ", headers=" + file.headers());
    }
    return columns;
  }

  // Headers that match a candidate of any field are mapped, even when a higher priority column won.
  private static ImmutableList<String> droppedColumns(TabularFile file) {
    Set<Integer> mapped = new HashSet<>();
    for (EventField field : EventField.values()) {
      mapped.addAll(file.findColumns(field.candidates()));
    }
    ImmutableList.Builder<String> dropped = ImmutableList.builder();
    for (int i = 0; i < file.headers().size(); i++) {
      if (!mapped.contains(i)) {
        dropped.add(file.headers().get(i));
      }
    }
    return dropped.build();
  }

  @Nullable
  private static String value(TabularFile file, List<String> row, List<Integer> indexes) {
    for (int index : indexes) {
      String value = StringUtil.trimToNull(file.cell(row, index));
      if (value != null) {
        return value;
      }
    }
    return null;
  }
}
