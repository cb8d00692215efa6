package ai.promoted.metrics.engagement.common.table;

import ai.promoted.metrics.engagement.common.constant.Constants;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.ProcessedFileRecord;
import ai.promoted.metrics.engagement.common.util.AtomicFiles;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.apache.avro.Schema;
import org.apache.avro.file.CodecFactory;
import org.apache.avro.file.DataFileReader;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Persists the store as two snappy Avro container files under one directory.
 *
 * <p>A commit writes the events file before the manifest file, each through an in-progress file and
 * an atomic move. A crash between the two leaves the new events with the old manifest, so the file
 * is merged again on the next run and the merge replaces its own rows.
 */
public class AvroEngagementStore extends InMemoryEngagementStore {
  private static final Logger LOGGER = LogManager.getLogger(AvroEngagementStore.class);

  private final Path eventsFile;
  private final Path manifestFile;

  private AvroEngagementStore(
      Path directory,
      ImmutableList<CanonicalEvent> events,
      ImmutableList<ProcessedFileRecord> files) {
    super(events, files);
    this.eventsFile = directory.resolve(Constants.EVENTS_STORE_FILE);
    this.manifestFile = directory.resolve(Constants.MANIFEST_STORE_FILE);
  }

  /** Opens the store in {@code directory}, creating the directory if needed. */
  public static AvroEngagementStore open(Path directory) throws IOException {
    Files.createDirectories(directory);
    ImmutableList<CanonicalEvent> events =
        readAll(
            directory.resolve(Constants.EVENTS_STORE_FILE),
            Tables.EVENT_SCHEMA,
            StoreRecords::toEvent);
    ImmutableList<ProcessedFileRecord> files =
        readAll(
            directory.resolve(Constants.MANIFEST_STORE_FILE),
            Tables.MANIFEST_SCHEMA,
            StoreRecords::toProcessedFile);
    LOGGER.info(
        "Opened store {}: {} events, {} processed files", directory, events.size(), files.size());
    return new AvroEngagementStore(directory, events, files);
  }

  @Override
  protected void persist(
      ImmutableList<CanonicalEvent> events, ImmutableList<ProcessedFileRecord> files)
      throws IOException {
    write(eventsFile, Tables.EVENT_SCHEMA, events, StoreRecords::fromEvent);
    write(manifestFile, Tables.MANIFEST_SCHEMA, files, StoreRecords::fromProcessedFile);
  }

  @Override
  public void reset() throws IOException {
    Files.deleteIfExists(eventsFile);
    Files.deleteIfExists(manifestFile);
    super.reset();
    LOGGER.info("Deleted store files {} and {}", eventsFile, manifestFile);
  }

  private static <T> ImmutableList<T> readAll(
      Path file, Schema schema, Function<GenericRecord, T> convert) throws IOException {
    if (!Files.exists(file)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    try (DataFileReader<GenericRecord> reader =
        new DataFileReader<>(file.toFile(), new GenericDatumReader<>(schema))) {
      for (GenericRecord record : reader) {
        builder.add(convert.apply(record));
      }
    }
    return builder.build();
  }

  private static <T> void write(
      Path file, Schema schema, ImmutableList<T> rows, Function<T, GenericRecord> convert)
      throws IOException {
    Path inProgress = AtomicFiles.inProgressPath(file);
    try {
      try (DataFileWriter<GenericRecord> writer =
          new DataFileWriter<>(new GenericDatumWriter<GenericRecord>(schema))) {
        writer.setCodec(CodecFactory.snappyCodec());
        writer.create(schema, inProgress.toFile());
        for (T row : rows) {
          writer.append(convert.apply(row));
        }
      }
      AtomicFiles.publish(inProgress, file);
    } catch (IOException | RuntimeException e) {
      AtomicFiles.discard(inProgress);
      throw e;
    }
  }
}
