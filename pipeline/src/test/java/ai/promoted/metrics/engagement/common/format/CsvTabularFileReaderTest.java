package ai.promoted.metrics.engagement.common.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.promoted.metrics.engagement.common.testing.ExportFiles;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CsvTabularFileReaderTest {
  @TempDir Path tempDir;

  private final CsvTabularFileReader reader = new CsvTabularFileReader();

  @Test
  public void readCommaSeparated() throws IOException {
    Path file =
        ExportFiles.writeCsv(
            tempDir.resolve("export.csv"),
            "timestamp,user_Id,CP_Link_label",
            "2026-02-25 14:03:01.123,u1,\"15Read, then share\"",
            "",
            "2026-02-25 14:03:02.456,u2,");

    TabularFile table = reader.read(file);

    assertEquals(ImmutableList.of("timestamp", "user_Id", "CP_Link_label"), table.headers());
    assertEquals(2, table.rowCount());
    assertEquals(
        ImmutableList.of("2026-02-25 14:03:01.123", "u1", "15Read, then share"),
        table.rows().get(0));
    assertEquals("", table.cell(table.rows().get(1), 2));
  }

  @Test
  public void readSemicolonSeparatedWithByteOrderMark() throws IOException {
    Path file =
        ExportFiles.writeCsv(
            tempDir.resolve("export.csv"),
            "\uFEFFtimestamp;user_Id;name",
            "25.02.2026 14:03:01;u1;click");

    TabularFile table = reader.read(file);

    assertEquals(ImmutableList.of("timestamp", "user_Id", "name"), table.headers());
    assertEquals(ImmutableList.of("25.02.2026 14:03:01", "u1", "click"), table.rows().get(0));
  }

  @Test
  public void headerOnly() throws IOException {
    Path file = ExportFiles.writeCsv(tempDir.resolve("export.csv"), "timestamp,user_Id,name");
    TabularFile table = reader.read(file);
    assertEquals(3, table.headers().size());
    assertEquals(0, table.rowCount());
  }

  @Test
  public void emptyFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("empty.csv"));
    assertThrows(IOException.class, () -> reader.read(file));
  }

  @Test
  public void readTabSeparated() throws IOException {
    Path file =
        ExportFiles.writeCsv(
            tempDir.resolve("export.csv"),
            "timestamp\tuser_Id\tname",
            "2026-02-25 14:03:01\tu1\tclick, then read");

    TabularFile table = reader.read(file);

    assertEquals(ImmutableList.of("timestamp", "user_Id", "name"), table.headers());
    assertEquals(
        ImmutableList.of("2026-02-25 14:03:01", "u1", "click, then read"), table.rows().get(0));
  }

  @Test
  public void detectTabAndPipe() {
    assertEquals('\t', CsvTabularFileReader.detectSeparator("a\tb\tc,d\ne"));
    assertEquals('|', CsvTabularFileReader.detectSeparator("a|b|c;d"));
    assertEquals(',', CsvTabularFileReader.detectSeparator("a,b|c"));
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        ", | a,b,c",
        "; | a;b;c",
        ", | a;b,c",
        ", | single",
        "; | a;b\nc,d,e,f",
      })
  void detectSeparator(char expected, String content) {
    assertEquals(expected, CsvTabularFileReader.detectSeparator(content.replace("\\n", "\n")));
  }
}
