package ai.promoted.metrics.engagement.common.records;

import com.google.auto.value.AutoValue;
import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import javax.annotation.Nullable;

/** Manifest entry for an input file that was merged into the event store. */
@AutoValue
public abstract class ProcessedFileRecord implements Serializable {
  private static final long serialVersionUID = 1L;

  public abstract String filename();

  /** Hex SHA-256 of the file bytes. */
  public abstract String contentHash();

  public abstract long rowCount();

  public abstract Instant processedAt();

  /** Date suffix from the filename. Null when the file was ordered by modification time. */
  @Nullable
  public abstract LocalDate extractedDate();

  public static ProcessedFileRecord create(
      String filename,
      String contentHash,
      long rowCount,
      Instant processedAt,
      @Nullable LocalDate extractedDate) {
    return new AutoValue_ProcessedFileRecord(
        filename, contentHash, rowCount, processedAt, extractedDate);
  }
}
