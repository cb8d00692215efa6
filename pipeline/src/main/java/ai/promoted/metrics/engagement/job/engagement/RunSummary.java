package ai.promoted.metrics.engagement.job.engagement;

import ai.promoted.metrics.engagement.job.export.ArtifactCounts;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import javax.annotation.Nullable;

/** Everything an operator needs to judge a run. */
@AutoValue
public abstract class RunSummary {

  public abstract Instant startedAt();

  public abstract Instant finishedAt();

  public abstract boolean fullReset();

  @Nullable
  public abstract String forcedFile();

  /** One outcome per scanned file, in merge order. */
  public abstract ImmutableList<FileOutcome> files();

  public abstract EventStatistics statistics();

  public abstract boolean orgReferenceAvailable();

  public abstract int orgSnapshotCount();

  public abstract int contentCatalogSize();

  public abstract ArtifactCounts artifacts();

  public long count(FileStatus status) {
    return files().stream().filter(file -> file.status() == status).count();
  }

  public boolean hasFailures() {
    return count(FileStatus.FAILED) > 0;
  }

  /** 0 when no file failed, 1 otherwise. */
  public int exitCode() {
    return hasFailures() ? 1 : 0;
  }

  public static Builder builder() {
    return new AutoValue_RunSummary.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setStartedAt(Instant startedAt);

    public abstract Builder setFinishedAt(Instant finishedAt);

    public abstract Builder setFullReset(boolean fullReset);

    public abstract Builder setForcedFile(@Nullable String forcedFile);

    public abstract Builder setFiles(ImmutableList<FileOutcome> files);

    public abstract Builder setStatistics(EventStatistics statistics);

    public abstract Builder setOrgReferenceAvailable(boolean orgReferenceAvailable);

    public abstract Builder setOrgSnapshotCount(int orgSnapshotCount);

    public abstract Builder setContentCatalogSize(int contentCatalogSize);

    public abstract Builder setArtifacts(ArtifactCounts artifacts);

    public abstract RunSummary build();
  }
}
