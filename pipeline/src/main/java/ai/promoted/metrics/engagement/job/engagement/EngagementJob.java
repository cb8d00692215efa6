package ai.promoted.metrics.engagement.job.engagement;

import ai.promoted.metrics.engagement.common.job.BaseJob;
import ai.promoted.metrics.engagement.common.job.InputSegment;
import ai.promoted.metrics.engagement.common.job.JobSegment;
import ai.promoted.metrics.engagement.common.job.OutputSegment;
import ai.promoted.metrics.engagement.common.job.ReferenceDataSegment;
import ai.promoted.metrics.engagement.common.job.StoreSegment;
import ai.promoted.metrics.engagement.common.table.EngagementStore;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

@CommandLine.Command(
    name = "engagement",
    mixinStandardHelpOptions = true,
    version = "engagement 1.0.0",
    description =
        "Merges click-analytics exports into the event store and publishes the engagement"
            + " Parquet artifacts.")
public class EngagementJob extends BaseJob {
  private static final Logger LOGGER = LogManager.getLogger(EngagementJob.class);

  @CommandLine.Mixin public final InputSegment input = new InputSegment();
  @CommandLine.Mixin public final StoreSegment store = new StoreSegment();
  @CommandLine.Mixin public final OutputSegment output = new OutputSegment();
  @CommandLine.Mixin public final ReferenceDataSegment referenceData = new ReferenceDataSegment();

  @VisibleForTesting Clock clock = Clock.systemUTC();

  public static void main(String[] args) {
    System.exit(executeMain(new EngagementJob(), args));
  }

  @Override
  public Set<JobSegment> getInnerSegments() {
    return ImmutableSet.of(input, store, output, referenceData);
  }

  @Override
  public void validateArgs() {
    super.validateArgs();
    Preconditions.checkArgument(
        !(store.fullReset && input.getForcedFile().isPresent()),
        "--fullReset merges every input file; it cannot be combined with --force.");
  }

  @Override
  protected String getDefaultBaseJobName() {
    return "engagement";
  }

  @Override
  protected int startJob() throws Exception {
    EngagementStore engagementStore = store.openStore();
    RunSummary summary = new EngagementPipeline(engagementStore, clock).run(pipelineOptions());
    SummaryReporter reporter = new SummaryReporter();
    reporter.log(summary);
    Optional<Path> summaryFile = output.getSummaryFile();
    if (summaryFile.isPresent()) {
      reporter.writeJson(summary, summaryFile.get());
    }
    if (summary.hasFailures()) {
      LOGGER.error(
          "{} input files failed; they stay pending for the next run",
          summary.count(FileStatus.FAILED));
    }
    return summary.exitCode();
  }

  @VisibleForTesting
  PipelineOptions pipelineOptions() {
    return PipelineOptions.builder()
        .setInputDir(input.getInputDir())
        .setOutputDir(output.getOutputDir())
        .setOrgSnapshot(referenceData.getOrgSnapshot())
        .setContentCatalog(referenceData.getContentCatalog())
        .setReportingZone(referenceData.getReportingZone())
        .setCompressionCodecName(output.compressionCodecName)
        .setForcedFile(input.getForcedFile())
        .setFullReset(store.fullReset)
        .build();
  }
}
