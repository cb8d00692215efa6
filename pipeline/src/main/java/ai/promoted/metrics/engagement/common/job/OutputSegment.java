package ai.promoted.metrics.engagement.common.job;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import picocli.CommandLine.Option;

/** Where the Parquet artifacts and the run summary go. */
public class OutputSegment implements JobSegment {

  @Option(
      names = {"--outputDir"},
      defaultValue = "output",
      description = "Directory for the Parquet artifacts.  Default=output")
  public String outputDir = "output";

  @Option(
      names = {"--compressionCodecName"},
      description =
          "Compression codec for parquet. Valid values: ${COMPLETION-CANDIDATES}. Default SNAPPY")
  public CompressionCodecName compressionCodecName = CompressionCodecName.SNAPPY;

  @Option(
      names = {"--summaryFile"},
      defaultValue = "",
      description = "Optional path for a JSON copy of the run summary.  Default=empty")
  public String summaryFile = "";

  @Override
  public void validateArgs() {
    Preconditions.checkArgument(!outputDir.isBlank(), "--outputDir must be specified.");
  }

  public Path getOutputDir() {
    return Paths.get(outputDir);
  }

  public Optional<Path> getSummaryFile() {
    return summaryFile.isBlank() ? Optional.empty() : Optional.of(Paths.get(summaryFile));
  }
}
