package ai.promoted.metrics.engagement.job.enrich;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.promoted.metrics.engagement.common.testing.ExportFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ContentCatalogLoaderTest {
  @TempDir Path tempDir;

  private final ContentCatalogLoader loader = new ContentCatalogLoader();

  @Test
  public void load() throws IOException {
    Path catalog =
        ExportFiles.writeCsv(
            tempDir.resolve("stories.csv"),
            "Story ID,Title,keys",
            "15.0,Remote work,hr;remote",
            "16,Volunteering,",
            ",No id,x");

    ContentCatalog loaded = loader.load(catalog);

    assertEquals(2, loaded.size());
    assertEquals(
        Optional.of(ContentCatalog.Entry.create("Remote work", "hr;remote")), loaded.lookup("15"));
    assertEquals(
        Optional.of(ContentCatalog.Entry.create("Volunteering", null)), loaded.lookup("16"));
    assertTrue(loaded.lookup("17").isEmpty());
    assertTrue(loaded.lookup(null).isEmpty());
  }

  @Test
  public void missingTitleColumn() throws IOException {
    Path catalog = ExportFiles.writeCsv(tempDir.resolve("stories.csv"), "StoryID,keys", "15,x");
    assertThrows(IOException.class, () -> loader.load(catalog));
    assertEquals(0, loader.loadOrEmpty(Optional.of(catalog)).size());
  }

  @Test
  public void loadOrEmpty() {
    assertEquals(0, loader.loadOrEmpty(Optional.empty()).size());
    assertEquals(0, loader.loadOrEmpty(Optional.of(tempDir.resolve("missing.csv"))).size());
  }
}
