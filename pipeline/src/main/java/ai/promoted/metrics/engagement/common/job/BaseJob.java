package ai.promoted.metrics.engagement.common.job;

import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Option;

/** Base class for command line batch jobs. Subclasses add segments with {@code @Mixin}. */
public abstract class BaseJob implements CompositeJobSegment, Callable<Integer> {
  private static final Logger LOGGER = LogManager.getLogger(BaseJob.class);

  @Option(
      names = {"--jobName"},
      defaultValue = "",
      description = "The name of the job.  Defaults to the job's base name.")
  public String jobName = "";

  @Option(
      names = {"--jobLabel"},
      defaultValue = "",
      description = "Label prefixed to the job name, e.g. an environment.  Defaults to empty.")
  public String jobLabel = "";

  /** Parses {@code args} and runs {@code job}. Returns the process exit code. */
  public static int executeMain(BaseJob job, String[] args) {
    return new CommandLine(job).execute(args);
  }

  @Override
  public Integer call() throws Exception {
    validateArgs();
    LOGGER.info("Starting {}", getJobName());
    int exitCode = startJob();
    LOGGER.info("Finished {} exitCode={}", getJobName(), exitCode);
    return exitCode;
  }

  /** The name used when {@code --jobName} is not set. */
  protected abstract String getDefaultBaseJobName();

  /** Runs the job after the args were validated. Returns the process exit code. */
  protected abstract int startJob() throws Exception;

  public String getJobName() {
    String name = jobName.isEmpty() ? getDefaultBaseJobName() : jobName;
    return jobLabel.isEmpty() ? name : jobLabel + "." + name;
  }
}
