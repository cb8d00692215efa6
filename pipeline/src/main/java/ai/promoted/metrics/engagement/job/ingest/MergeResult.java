package ai.promoted.metrics.engagement.job.ingest;

import com.google.auto.value.AutoValue;

/** Counts of one upsert. */
@AutoValue
public abstract class MergeResult {

  public abstract int inserted();

  /** Stored events that were removed because an inserted event has the same identity. */
  public abstract int replaced();

  public int added() {
    return inserted() - replaced();
  }

  public static MergeResult create(int inserted, int replaced) {
    return new AutoValue_MergeResult(inserted, replaced);
  }
}
