package ai.promoted.metrics.engagement.job.export;

import ai.promoted.metrics.engagement.common.constant.Constants;
import ai.promoted.metrics.engagement.common.format.ParquetFiles;
import ai.promoted.metrics.engagement.common.records.ContentEngagementRow;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.util.AtomicFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/**
 * Writes the event and content engagement artifacts. Each file is written to a hidden in-progress
 * sibling and moved over the previous artifact, so readers never see a partial file.
 */
public class ArtifactExporter {
  private static final Logger LOGGER = LogManager.getLogger(ArtifactExporter.class);

  private final Path outputDir;
  private final CompressionCodecName compressionCodecName;

  public ArtifactExporter(Path outputDir, CompressionCodecName compressionCodecName) {
    this.outputDir = outputDir;
    this.compressionCodecName = compressionCodecName;
  }

  public Path getEventsArtifact() {
    return outputDir.resolve(Constants.EVENTS_ARTIFACT_FILE);
  }

  public Path getContentEngagementArtifact() {
    return outputDir.resolve(Constants.CONTENT_ARTIFACT_FILE);
  }

  public ArtifactCounts export(List<EnrichedEvent> events, List<ContentEngagementRow> rows)
      throws IOException {
    Files.createDirectories(outputDir);
    write(
        getEventsArtifact(),
        ArtifactSchemas.EVENT_SCHEMA,
        events,
        ArtifactRecords::toEventRecord);
    write(
        getContentEngagementArtifact(),
        ArtifactSchemas.CONTENT_ENGAGEMENT_SCHEMA,
        rows,
        ArtifactRecords::toContentEngagementRecord);
    return ArtifactCounts.create(events.size(), rows.size());
  }

  private <T> void write(
      Path target, Schema schema, List<T> rows, Function<T, GenericRecord> toRecord)
      throws IOException {
    Path inProgress = AtomicFiles.inProgressPath(target);
    Files.deleteIfExists(inProgress);
    try {
      try (ParquetWriter<GenericRecord> writer =
          AvroParquetWriter.<GenericRecord>builder(ParquetFiles.outputFile(inProgress))
              .withSchema(schema)
              .withDataModel(GenericData.get())
              .withConf(ParquetFiles.localConfiguration())
              .withCompressionCodec(compressionCodecName)
              .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
              .build()) {
        for (T row : rows) {
          writer.write(toRecord.apply(row));
        }
      }
      AtomicFiles.publish(inProgress, target);
    } catch (IOException | RuntimeException e) {
      AtomicFiles.discard(inProgress);
      throw e;
    }
    LOGGER.info("Wrote {} ({} rows, {})", target, rows.size(), compressionCodecName);
  }
}
