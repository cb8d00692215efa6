package ai.promoted.metrics.engagement.common.format;

import java.io.IOException;
import java.nio.file.Path;

/** Reads one physical file encoding into a {@link TabularFile}. */
public interface TabularFileReader {

  /**
   * @throws IOException when the file cannot be read or is not valid for this encoding
   */
  TabularFile read(Path path) throws IOException;
}
