package ai.promoted.metrics.engagement.common.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.promoted.metrics.engagement.common.testing.ExportFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TabularFilesTest {
  @TempDir Path tempDir;

  @Test
  public void extension() {
    assertEquals("xlsx", TabularFiles.extension(Paths.get("in", "export_2026_02_25.XLSX")));
    assertEquals("", TabularFiles.extension(Paths.get("README")));
  }

  @Test
  public void isSupported() {
    assertTrue(TabularFiles.isSupported(Paths.get("a.csv")));
    assertTrue(TabularFiles.isSupported(Paths.get("a.xls")));
    assertTrue(TabularFiles.isSupported(Paths.get("snapshots.parquet")));
    assertFalse(TabularFiles.isSupported(Paths.get("notes.txt")));
    assertFalse(TabularFiles.EVENT_EXTENSIONS.contains("parquet"));
  }

  @Test
  public void readByExtension() throws IOException {
    Path csv = ExportFiles.writeCsv(tempDir.resolve("a.CSV"), "name,user_Id", "click,u1");
    assertEquals(1, TabularFiles.read(csv).rowCount());
  }

  @Test
  public void readUnsupported() throws IOException {
    Path txt = ExportFiles.writeCsv(tempDir.resolve("notes.txt"), "name");
    assertThrows(IOException.class, () -> TabularFiles.read(txt));
  }
}
