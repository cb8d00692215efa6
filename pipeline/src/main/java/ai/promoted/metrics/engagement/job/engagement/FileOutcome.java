package ai.promoted.metrics.engagement.job.engagement;

import ai.promoted.metrics.engagement.job.ingest.FileClassification;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Per-file result of a run. */
@AutoValue
public abstract class FileOutcome {

  public abstract String filename();

  public abstract FileClassification classification();

  public abstract FileStatus status();

  /** Events merged into the store. */
  public abstract int rowsLoaded();

  /** Stored events replaced by this file's version. */
  public abstract int rowsReplaced();

  public abstract int rowsRejected();

  public abstract int collisions();

  public abstract ImmutableList<String> droppedColumns();

  public abstract boolean precisionWarning();

  @Nullable
  public abstract String failureReason();

  public static Builder builder() {
    return new AutoValue_FileOutcome.Builder()
        .setRowsLoaded(0)
        .setRowsReplaced(0)
        .setRowsRejected(0)
        .setCollisions(0)
        .setDroppedColumns(ImmutableList.of())
        .setPrecisionWarning(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFilename(String filename);

    public abstract Builder setClassification(FileClassification classification);

    public abstract Builder setStatus(FileStatus status);

    public abstract Builder setRowsLoaded(int rowsLoaded);

    public abstract Builder setRowsReplaced(int rowsReplaced);

    public abstract Builder setRowsRejected(int rowsRejected);

    public abstract Builder setCollisions(int collisions);

    public abstract Builder setDroppedColumns(ImmutableList<String> droppedColumns);

    public abstract Builder setPrecisionWarning(boolean precisionWarning);

    public abstract Builder setFailureReason(@Nullable String failureReason);

    public abstract FileOutcome build();
  }
}
