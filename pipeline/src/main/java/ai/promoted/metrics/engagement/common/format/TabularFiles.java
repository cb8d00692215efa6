package ai.promoted.metrics.engagement.common.format;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/** Picks a {@link TabularFileReader} by file extension. */
public final class TabularFiles {

  /** Extensions of click-analytics exports. */
  public static final ImmutableSet<String> EVENT_EXTENSIONS = ImmutableSet.of("csv", "xlsx", "xls");

  private static final CsvTabularFileReader CSV = new CsvTabularFileReader();
  private static final SpreadsheetTabularFileReader SPREADSHEET =
      new SpreadsheetTabularFileReader();
  private static final ParquetTabularFileReader PARQUET = new ParquetTabularFileReader();

  private static final ImmutableMap<String, TabularFileReader> READERS =
      ImmutableMap.of(
          "csv", CSV,
          "xlsx", SPREADSHEET,
          "xls", SPREADSHEET,
          "parquet", PARQUET);

  public static String extension(Path path) {
    return Files.getFileExtension(path.getFileName().toString()).toLowerCase(Locale.ROOT);
  }

  public static boolean isSupported(Path path) {
    return READERS.containsKey(extension(path));
  }

  public static TabularFile read(Path path) throws IOException {
    TabularFileReader reader = READERS.get(extension(path));
    if (reader == null) {
      throw new IOException("Unsupported file type, file=" + path);
    }
    return reader.read(path);
  }

  private TabularFiles() {}
}
