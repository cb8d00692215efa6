package ai.promoted.metrics.engagement.job.export;

import com.google.auto.value.AutoValue;

/** Row counts of the published artifacts. */
@AutoValue
public abstract class ArtifactCounts {

  public abstract long eventRows();

  public abstract long contentEngagementRows();

  public static ArtifactCounts create(long eventRows, long contentEngagementRows) {
    return new AutoValue_ArtifactCounts(eventRows, contentEngagementRows);
  }
}
