package ai.promoted.metrics.engagement.job.ingest;

import ai.promoted.metrics.engagement.common.format.TabularFiles;
import ai.promoted.metrics.engagement.common.records.ProcessedFileRecord;
import ai.promoted.metrics.engagement.common.table.ManifestStore;
import ai.promoted.metrics.engagement.common.util.FileDates;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds the exports that changed since they were last merged.
 *
 * <p>Files are ordered by {@code (orderingDate, filename)} so that the latest-dated version of an
 * event wins regardless of directory listing order.
 */
public class DeltaDetector {
  private static final Logger LOGGER = LogManager.getLogger(DeltaDetector.class);

  private static final Comparator<InputFile> ORDER =
      Comparator.comparing(InputFile::orderingDate).thenComparing(InputFile::filename);

  private final ManifestStore manifest;

  public DeltaDetector(ManifestStore manifest) {
    this.manifest = manifest;
  }

  /** Lists, hashes and classifies the exports in {@code inputDir}, in merge order. */
  public ImmutableList<InputFile> scan(Path inputDir) throws IOException {
    if (!Files.isDirectory(inputDir)) {
      throw new IOException("Input directory does not exist, dir=" + inputDir);
    }
    List<InputFile> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir)) {
      for (Path path : stream) {
        if (isExport(path)) {
          files.add(describe(path));
        }
      }
    }
    files.sort(ORDER);
    LOGGER.info("Found {} input files in {}", files.size(), inputDir);
    return ImmutableList.copyOf(files);
  }

  /** Compares a file's hash with its manifest entry. */
  public FileClassification classify(String filename, String contentHash) {
    Optional<ProcessedFileRecord> entry = manifest.lookup(filename);
    if (entry.isEmpty()) {
      return FileClassification.NEW;
    }
    return entry.get().contentHash().equals(contentHash)
        ? FileClassification.UNCHANGED
        : FileClassification.MODIFIED;
  }

  /**
   * Merges every new or modified file. Every unchanged file that orders after the first of them is
   * planned as a replay, which the run performs only once an earlier-dated merge has committed.
   *
   * @param files in merge order, as returned by {@link #scan}
   */
  public IngestPlan plan(ImmutableList<InputFile> files) {
    ImmutableList.Builder<PlannedFile> merges = ImmutableList.builder();
    ImmutableList.Builder<InputFile> skipped = ImmutableList.builder();
    boolean changedEarlier = false;
    for (InputFile file : files) {
      if (file.classification().needsMerge()) {
        merges.add(PlannedFile.create(file, false));
        changedEarlier = true;
      } else if (changedEarlier) {
        LOGGER.info("Unchanged {} orders after a changed file; planned as replay", file.filename());
        merges.add(PlannedFile.create(file, true));
      } else {
        skipped.add(file);
      }
    }
    return IngestPlan.create(merges.build(), skipped.build());
  }

  /** Merges only {@code filename}, whatever its classification. */
  public IngestPlan planForced(ImmutableList<InputFile> files, String filename)
      throws IOException {
    InputFile forced =
        files.stream()
            .filter(file -> file.filename().equals(filename))
            .findFirst()
            .orElseThrow(() -> new IOException("Forced file is not an input file: " + filename));
    LOGGER.info("Forcing {} ({})", filename, forced.classification());
    return IngestPlan.create(
        ImmutableList.of(PlannedFile.create(forced, false)),
        files.stream()
            .filter(file -> !file.filename().equals(filename))
            .collect(ImmutableList.toImmutableList()));
  }

  private InputFile describe(Path path) throws IOException {
    String filename = path.getFileName().toString();
    String hash = hash(path);
    Optional<LocalDate> extractedDate = FileDates.fromFilename(filename);
    LocalDate orderingDate;
    if (extractedDate.isPresent()) {
      orderingDate = extractedDate.get();
    } else {
      orderingDate =
          Files.getLastModifiedTime(path).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
      LOGGER.warn(
          "{} has no _YYYY_MM_DD date suffix; ordering it by modification date {}",
          filename,
          orderingDate);
    }
    return InputFile.create(
        path, hash, orderingDate, extractedDate.orElse(null), classify(filename, hash));
  }

  @VisibleForTesting
  static String hash(Path path) throws IOException {
    return com.google.common.io.Files.asByteSource(path.toFile()).hash(Hashing.sha256()).toString();
  }

  @VisibleForTesting
  static boolean isExport(Path path) {
    String name = path.getFileName().toString();
    return Files.isRegularFile(path)
        && !name.startsWith(".")
        && !name.startsWith("~$")
        && TabularFiles.EVENT_EXTENSIONS.contains(TabularFiles.extension(path));
  }
}
