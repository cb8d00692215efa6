package ai.promoted.metrics.engagement.job.enrich;

import ai.promoted.metrics.engagement.common.format.TabularFile;
import ai.promoted.metrics.engagement.common.format.TabularFiles;
import ai.promoted.metrics.engagement.common.util.StringUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads the optional content catalog. A missing catalog leaves title columns empty. */
public class ContentCatalogLoader {
  private static final Logger LOGGER = LogManager.getLogger(ContentCatalogLoader.class);

  private static final ImmutableList<String> ID_COLUMNS =
      ImmutableList.of("StoryID", "Story ID", "story_id", "content_id");
  private static final ImmutableList<String> TITLE_COLUMNS =
      ImmutableList.of("Title", "Story Title", "story_title", "content_title");
  private static final ImmutableList<String> KEYS_COLUMNS =
      ImmutableList.of("keys", "story_keys", "content_keys");

  public ContentCatalog loadOrEmpty(Optional<Path> catalog) {
    if (catalog.isEmpty()) {
      return ContentCatalog.empty();
    }
    Path path = catalog.get();
    if (!Files.isRegularFile(path)) {
      LOGGER.info("Content catalog not found: {}; title columns will be empty", path);
      return ContentCatalog.empty();
    }
    try {
      ContentCatalog loaded = load(path);
      LOGGER.info("Loaded content catalog: {} entries from {}", loaded.size(), path);
      return loaded;
    } catch (IOException e) {
      LOGGER.warn("Could not read content catalog {}; title columns will be empty", path, e);
      return ContentCatalog.empty();
    }
  }

  public ContentCatalog load(Path path) throws IOException {
    TabularFile file = TabularFiles.read(path);
    OptionalInt idColumn = file.findColumn(ID_COLUMNS);
    OptionalInt titleColumn = file.findColumn(TITLE_COLUMNS);
    OptionalInt keysColumn = file.findColumn(KEYS_COLUMNS);
    if (idColumn.isEmpty() || titleColumn.isEmpty()) {
      throw new IOException(
          "Content catalog needs one of " + ID_COLUMNS + " and one of " + TITLE_COLUMNS);
    }
    Map<String, ContentCatalog.Entry> entries = new LinkedHashMap<>();
    for (List<String> row : file.rows()) {
      String id = StringUtil.trimToNull(file.cell(row, idColumn.getAsInt()));
      if (id == null) {
        continue;
      }
      entries.put(
          id.replaceFirst("\\.0+$", ""),
          ContentCatalog.Entry.create(
              StringUtil.trimToNull(file.cell(row, titleColumn.getAsInt())),
              keysColumn.isPresent()
                  ? StringUtil.trimToNull(file.cell(row, keysColumn.getAsInt()))
                  : null));
    }
    return ContentCatalog.of(ImmutableMap.copyOf(entries));
  }
}
