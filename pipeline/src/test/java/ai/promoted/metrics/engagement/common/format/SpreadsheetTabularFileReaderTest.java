package ai.promoted.metrics.engagement.common.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.promoted.metrics.engagement.common.testing.ExportFiles;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SpreadsheetTabularFileReaderTest {
  @TempDir Path tempDir;

  private final SpreadsheetTabularFileReader reader = new SpreadsheetTabularFileReader();

  @Test
  public void readFirstSheet() throws IOException {
    Path file =
        ExportFiles.writeXlsx(
            tempDir.resolve("export.xlsx"),
            ImmutableList.of("timestamp", "user_Id", "CP_GPN", "CP_Link_label"),
            ImmutableList.of(
                Arrays.<Object>asList(
                    LocalDateTime.of(2026, 2, 25, 14, 3, 1), "u1", 1234567, "15Read"),
                Arrays.<Object>asList(
                    LocalDateTime.of(2026, 2, 25, 14, 3, 2), "u2", null, null)));

    TabularFile table = reader.read(file);

    assertEquals(
        ImmutableList.of("timestamp", "user_Id", "CP_GPN", "CP_Link_label"), table.headers());
    assertEquals(2, table.rowCount());
    assertEquals(
        ImmutableList.of("2026-02-25 14:03:01", "u1", "1234567", "15Read"), table.rows().get(0));
    assertEquals(ImmutableList.of("2026-02-25 14:03:02", "u2", "", ""), table.rows().get(1));
  }

  @Test
  public void skipEmptyRows() throws IOException {
    Path file =
        ExportFiles.writeXlsx(
            tempDir.resolve("export.xlsx"),
            ImmutableList.of("name", "user_Id"),
            ImmutableList.of(
                Arrays.<Object>asList("click", "u1"),
                Arrays.<Object>asList(null, null),
                Arrays.<Object>asList("view", "u2")));

    TabularFile table = reader.read(file);

    assertEquals(
        ImmutableList.of(ImmutableList.of("click", "u1"), ImmutableList.of("view", "u2")),
        table.rows());
  }

  @Test
  public void notASpreadsheet() throws IOException {
    Path file = tempDir.resolve("export.xlsx");
    Files.writeString(file, "timestamp,user_Id\n");
    assertThrows(IOException.class, () -> reader.read(file));
  }
}
