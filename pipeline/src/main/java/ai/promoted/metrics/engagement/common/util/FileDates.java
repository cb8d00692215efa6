package ai.promoted.metrics.engagement.common.util;

import com.google.common.io.Files;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads the logical export date from file names like {@code campaign_export_2026_02_25.csv}. */
public final class FileDates {
  private static final Pattern DATE_SUFFIX = Pattern.compile("_(\\d{4})_(\\d{2})_(\\d{2})$");

  /** Returns the date suffix of the file stem, or empty if absent or not a calendar date. */
  public static Optional<LocalDate> fromFilename(String filename) {
    Matcher m = DATE_SUFFIX.matcher(Files.getNameWithoutExtension(filename));
    if (!m.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          LocalDate.of(
              Integer.parseInt(m.group(1)),
              Integer.parseInt(m.group(2)),
              Integer.parseInt(m.group(3))));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  private FileDates() {}
}
