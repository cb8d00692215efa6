package ai.promoted.metrics.engagement.job.ingest;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Which scanned files to merge, in merge order, and which to skip. */
@AutoValue
public abstract class IngestPlan {

  /** Ascending {@code (orderingDate, filename)}. */
  public abstract ImmutableList<PlannedFile> merges();

  public abstract ImmutableList<InputFile> skipped();

  public static IngestPlan create(
      ImmutableList<PlannedFile> merges, ImmutableList<InputFile> skipped) {
    return new AutoValue_IngestPlan(merges, skipped);
  }

  public boolean isEmpty() {
    return merges().isEmpty();
  }
}
