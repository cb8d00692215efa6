package ai.promoted.metrics.engagement.job.ingest;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The events of one input file on the fixed event schema, with load diagnostics. */
@AutoValue
public abstract class NormalizedFile {

  public abstract String sourceFile();

  /** Unique by identity. */
  public abstract ImmutableList<CanonicalEvent> events();

  /** Data rows in the file, before rejection and collapsing. */
  public abstract int sourceRowCount();

  /** Rows with a blank required value or an unparseable timestamp. */
  public abstract int rejectedRowCount();

  /** Rows replaced by a later row with the same identity in this file. */
  public abstract int collisionCount();

  /** Headers that map to no event field. */
  public abstract ImmutableList<String> droppedColumns();

  /** True when no row had a sub-second timestamp. */
  public abstract boolean precisionWarning();

  public static Builder builder() {
    return new AutoValue_NormalizedFile.Builder()
        .setRejectedRowCount(0)
        .setCollisionCount(0)
        .setDroppedColumns(ImmutableList.of())
        .setPrecisionWarning(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSourceFile(String sourceFile);

    public abstract Builder setEvents(ImmutableList<CanonicalEvent> events);

    public abstract Builder setSourceRowCount(int sourceRowCount);

    public abstract Builder setRejectedRowCount(int rejectedRowCount);

    public abstract Builder setCollisionCount(int collisionCount);

    public abstract Builder setDroppedColumns(ImmutableList<String> droppedColumns);

    public abstract Builder setPrecisionWarning(boolean precisionWarning);

    public abstract NormalizedFile build();
  }
}
