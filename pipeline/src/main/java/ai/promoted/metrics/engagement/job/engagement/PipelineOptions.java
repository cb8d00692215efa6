package ai.promoted.metrics.engagement.job.engagement;

import ai.promoted.metrics.engagement.common.constant.Constants;
import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Optional;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/** Inputs of one {@link EngagementPipeline} run. */
@AutoValue
public abstract class PipelineOptions {

  public abstract Path inputDir();

  public abstract Path outputDir();

  public abstract Optional<Path> orgSnapshot();

  public abstract Optional<Path> contentCatalog();

  public abstract ZoneId reportingZone();

  public abstract CompressionCodecName compressionCodecName();

  public abstract Optional<String> forcedFile();

  public abstract boolean fullReset();

  public static Builder builder() {
    return new AutoValue_PipelineOptions.Builder()
        .setReportingZone(ZoneId.of(Constants.DEFAULT_REPORTING_TIME_ZONE))
        .setCompressionCodecName(CompressionCodecName.SNAPPY)
        .setFullReset(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setInputDir(Path inputDir);

    public abstract Builder setOutputDir(Path outputDir);

    public abstract Builder setOrgSnapshot(Optional<Path> orgSnapshot);

    public abstract Builder setOrgSnapshot(Path orgSnapshot);

    public abstract Builder setContentCatalog(Optional<Path> contentCatalog);

    public abstract Builder setContentCatalog(Path contentCatalog);

    public abstract Builder setReportingZone(ZoneId reportingZone);

    public abstract Builder setCompressionCodecName(CompressionCodecName compressionCodecName);

    public abstract Builder setForcedFile(Optional<String> forcedFile);

    public abstract Builder setForcedFile(String forcedFile);

    public abstract Builder setFullReset(boolean fullReset);

    public abstract PipelineOptions build();
  }
}
