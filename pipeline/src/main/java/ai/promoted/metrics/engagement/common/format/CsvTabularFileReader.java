package ai.promoted.metrics.engagement.common.format;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads delimited text exports. The first record is the header. Handles a UTF-8 byte order mark
 * and the semicolon, tab and pipe separated files written by some spreadsheet tools.
 */
public class CsvTabularFileReader implements TabularFileReader {
  private static final char BOM = '\uFEFF';
  private static final char[] SEPARATORS = {',', ';', '\t', '|'};

  private final CsvMapper csvMapper;

  public CsvTabularFileReader() {
    this.csvMapper = new CsvMapper();
    csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  @Override
  public TabularFile read(Path path) throws IOException {
    String content = Files.readString(path, StandardCharsets.UTF_8);
    if (!content.isEmpty() && content.charAt(0) == BOM) {
      content = content.substring(1);
    }
    CsvSchema schema =
        CsvSchema.emptySchema().withColumnSeparator(detectSeparator(content)).withQuoteChar('"');

    ImmutableList<String> headers = null;
    ImmutableList.Builder<ImmutableList<String>> rows = ImmutableList.builder();
    try (MappingIterator<String[]> iterator =
        csvMapper.readerFor(String[].class).with(schema).readValues(content)) {
      while (iterator.hasNextValue()) {
        String[] record = iterator.nextValue();
        if (headers == null) {
          headers = ImmutableList.copyOf(record);
        } else {
          rows.add(
              Arrays.stream(record)
                  .map(cell -> cell == null ? "" : cell)
                  .collect(ImmutableList.toImmutableList()));
        }
      }
    }
    if (headers == null) {
      throw new IOException("File has no header row, file=" + path);
    }
    return TabularFile.create(headers, rows.build());
  }

  // Only the header line is inspected.  Earlier candidates win ties, so commas win by default.
  @VisibleForTesting
  static char detectSeparator(String content) {
    int end = content.indexOf('\n');
    String header = end >= 0 ? content.substring(0, end) : content;
    char separator = SEPARATORS[0];
    long best = 0;
    for (char candidate : SEPARATORS) {
      long count = header.chars().filter(c -> c == candidate).count();
      if (count > best) {
        separator = candidate;
        best = count;
      }
    }
    return separator;
  }
}
