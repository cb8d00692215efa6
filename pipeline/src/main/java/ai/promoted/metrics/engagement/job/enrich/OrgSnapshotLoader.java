package ai.promoted.metrics.engagement.job.enrich;

import ai.promoted.metrics.engagement.common.format.TabularFile;
import ai.promoted.metrics.engagement.common.format.TabularFiles;
import ai.promoted.metrics.engagement.common.format.TimestampParser;
import ai.promoted.metrics.engagement.common.records.OrgSnapshot;
import ai.promoted.metrics.engagement.common.util.ActorIds;
import ai.promoted.metrics.engagement.common.util.StringUtil;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads the organizational snapshot feed. Each row is one actor's attributes as of a snapshot
 * date, given either as {@code snapshot_date} or as {@code snapshot_year} and {@code
 * snapshot_month} (the first of the month).
 */
public class OrgSnapshotLoader {
  private static final Logger LOGGER = LogManager.getLogger(OrgSnapshotLoader.class);

  private static final ImmutableList<String> ACTOR_COLUMNS = ImmutableList.of("actor_id", "gpn");
  private static final ImmutableList<String> DATE_COLUMNS = ImmutableList.of("snapshot_date");
  private static final ImmutableList<String> YEAR_COLUMNS = ImmutableList.of("snapshot_year");
  private static final ImmutableList<String> MONTH_COLUMNS = ImmutableList.of("snapshot_month");

  /**
   * Loads the feed, or returns {@link OrgSnapshotIndex#unavailable()} with a warning when it is not
   * configured, missing or unreadable. A bad feed never fails the run.
   */
  public OrgSnapshotIndex loadOrUnavailable(Optional<Path> feed) {
    if (feed.isEmpty()) {
      LOGGER.warn("No --orgSnapshot feed configured; organizational columns will be empty");
      return OrgSnapshotIndex.unavailable();
    }
    Path path = feed.get();
    if (!Files.isRegularFile(path)) {
      LOGGER.warn(
          "Organizational snapshot feed not found: {}; organizational columns will be empty", path);
      return OrgSnapshotIndex.unavailable();
    }
    try {
      OrgSnapshotIndex index = OrgSnapshotIndex.of(load(path));
      LOGGER.info(
          "Loaded {} organizational snapshots for {} actors from {}",
          index.snapshotCount(),
          index.actorCount(),
          path);
      if (index.replacedCount() > 0) {
        LOGGER.warn(
            "{} snapshot rows repeat an (actor, date) pair; the last row was kept",
            index.replacedCount());
      }
      return index;
    } catch (IOException e) {
      LOGGER.warn(
          "Could not read organizational snapshot feed {}; organizational columns will be empty",
          path,
          e);
      return OrgSnapshotIndex.unavailable();
    }
  }

  /**
   * @throws IOException when the file cannot be read or lacks the actor or date columns
   */
  public ImmutableList<OrgSnapshot> load(Path path) throws IOException {
    TabularFile file = TabularFiles.read(path);
    OptionalInt actorColumn = file.findColumn(ACTOR_COLUMNS);
    OptionalInt dateColumn = file.findColumn(DATE_COLUMNS);
    OptionalInt yearColumn = file.findColumn(YEAR_COLUMNS);
    OptionalInt monthColumn = file.findColumn(MONTH_COLUMNS);
    if (actorColumn.isEmpty()) {
      throw new IOException(
          "Snapshot feed has no actor column " + ACTOR_COLUMNS + ", file=" + path);
    }
    if (dateColumn.isEmpty() && (yearColumn.isEmpty() || monthColumn.isEmpty())) {
      throw new IOException(
          "Snapshot feed needs snapshot_date or snapshot_year and snapshot_month, file=" + path);
    }

    Map<Integer, String> attributeColumns = new LinkedHashMap<>();
    for (int i = 0; i < file.headers().size(); i++) {
      int index = i;
      OrgColumns.outputColumn(file.headers().get(i))
          .ifPresent(column -> attributeColumns.put(index, column));
    }

    ImmutableList.Builder<OrgSnapshot> snapshots = ImmutableList.builder();
    int skipped = 0;
    for (List<String> row : file.rows()) {
      String actorId = ActorIds.normalize(file.cell(row, actorColumn.getAsInt()));
      LocalDate date =
          dateColumn.isPresent()
              ? parseDate(file.cell(row, dateColumn.getAsInt()))
              : yearMonth(
                  file.cell(row, yearColumn.getAsInt()), file.cell(row, monthColumn.getAsInt()));
      if (actorId == null || date == null) {
        skipped++;
        continue;
      }
      ImmutableMap.Builder<String, String> attributes = ImmutableMap.builder();
      attributeColumns.forEach(
          (index, column) -> {
            String value = StringUtil.trimToNull(file.cell(row, index));
            if (value != null) {
              attributes.put(column, value);
            }
          });
      snapshots.add(OrgSnapshot.create(actorId, date, attributes.buildKeepingLast()));
    }
    if (skipped > 0) {
      LOGGER.warn("Skipped {} snapshot rows without an actor or a snapshot date", skipped);
    }
    return snapshots.build();
  }

  @VisibleForTesting
  @Nullable
  static LocalDate parseDate(String value) {
    return TimestampParser.parse(value)
        .map(parsed -> parsed.instant().atZone(ZoneOffset.UTC).toLocalDate())
        .orElse(null);
  }

  @VisibleForTesting
  @Nullable
  static LocalDate yearMonth(String year, String month) {
    Integer y = parseInt(year);
    Integer m = parseInt(month);
    if (y == null || m == null) {
      return null;
    }
    try {
      return LocalDate.of(y, m, 1);
    } catch (DateTimeException e) {
      return null;
    }
  }

  // Spreadsheet and parquet doubles render as "2026.0".
  @Nullable
  private static Integer parseInt(String value) {
    String trimmed = StringUtil.trimToNull(value);
    return trimmed == null ? null : Ints.tryParse(trimmed.replaceFirst("\\.0+$", ""));
  }
}
