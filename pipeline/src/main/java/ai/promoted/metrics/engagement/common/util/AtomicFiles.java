package ai.promoted.metrics.engagement.common.util;

import ai.promoted.metrics.engagement.common.constant.Constants;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Write-then-rename publishing. Readers of {@code target} see either the previous file or the new
 * one, never a partial write.
 */
public final class AtomicFiles {
  private static final Logger LOGGER = LogManager.getLogger(AtomicFiles.class);

  /** Hidden sibling of {@code target} to write into before {@link #publish}. */
  public static Path inProgressPath(Path target) {
    return target.resolveSibling(
        Constants.IN_PROGRESS_PREFIX + target.getFileName() + Constants.IN_PROGRESS_SUFFIX);
  }

  /** Moves {@code inProgress} over {@code target} in one step. */
  public static void publish(Path inProgress, Path target) throws IOException {
    Files.move(
        inProgress, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.debug("Published {}", target);
  }

  /** Removes a leftover in-progress file after a failed write. */
  public static void discard(Path inProgress) {
    try {
      Files.deleteIfExists(inProgress);
    } catch (IOException e) {
      LOGGER.warn("Could not delete in-progress file {}", inProgress, e);
    }
  }

  private AtomicFiles() {}
}
