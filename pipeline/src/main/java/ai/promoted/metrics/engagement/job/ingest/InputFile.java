package ai.promoted.metrics.engagement.job.ingest;

import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import java.time.LocalDate;
import javax.annotation.Nullable;

/** A scanned export with its content hash, ordering date and classification. */
@AutoValue
public abstract class InputFile {

  public abstract Path path();

  public abstract String filename();

  /** Hex SHA-256 of the file bytes. */
  public abstract String contentHash();

  /** The date suffix of the name, or the UTC date of the last-modified time. */
  public abstract LocalDate orderingDate();

  /** The date suffix of the name. Null when the file has none. */
  @Nullable
  public abstract LocalDate extractedDate();

  public abstract FileClassification classification();

  public static InputFile create(
      Path path,
      String contentHash,
      LocalDate orderingDate,
      @Nullable LocalDate extractedDate,
      FileClassification classification) {
    return new AutoValue_InputFile(
        path,
        path.getFileName().toString(),
        contentHash,
        orderingDate,
        extractedDate,
        classification);
  }
}
