package ai.promoted.metrics.engagement.job.ingest;

import com.google.auto.value.AutoValue;

/** One merge step of an {@link IngestPlan}. */
@AutoValue
public abstract class PlannedFile {

  public abstract InputFile file();

  /**
   * True when an unchanged file is merged again because an earlier-dated file changed. Replaying
   * keeps the latest-dated version of each overlapping event in the store. A replay is skipped when
   * no earlier-dated file of the same run committed.
   */
  public abstract boolean replay();

  public static PlannedFile create(InputFile file, boolean replay) {
    return new AutoValue_PlannedFile(file, replay);
  }
}
