package ai.promoted.metrics.engagement.common.job;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import picocli.CommandLine.Option;

/** Where click-analytics exports are read from. */
public class InputSegment implements JobSegment {

  @Option(
      names = {"--inputDir"},
      defaultValue = "input",
      description = "Directory with CSV/XLSX exports.  Default=input")
  public String inputDir = "input";

  @Option(
      names = {"--force"},
      defaultValue = "",
      description =
          "Name of one file in --inputDir to merge even if it is unchanged.  Default=empty")
  public String force = "";

  @Override
  public void validateArgs() {
    Preconditions.checkArgument(!inputDir.isBlank(), "--inputDir must be specified.");
    Preconditions.checkArgument(
        !force.contains("/") && !force.contains("\\"),
        "--force takes a file name inside --inputDir, not a path: %s",
        force);
  }

  public Path getInputDir() {
    return Paths.get(inputDir);
  }

  public Optional<String> getForcedFile() {
    return force.isBlank() ? Optional.empty() : Optional.of(force.trim());
  }
}
