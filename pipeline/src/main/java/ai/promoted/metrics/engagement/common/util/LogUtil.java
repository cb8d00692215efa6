package ai.promoted.metrics.engagement.common.util;

import com.google.common.annotations.VisibleForTesting;
import java.util.Locale;

public class LogUtil {
  // Labels come from free-form page metadata.  Keep summary lines readable.
  private static final int MAX_LENGTH = 60;

  public static String truncate(String value) {
    return truncate(value, MAX_LENGTH);
  }

  @VisibleForTesting
  static String truncate(String value, int maxLength) {
    if (value.length() > maxLength) {
      return value.substring(0, maxLength) + " (TRUNCATED)";
    } else {
      return value;
    }
  }

  /** Formats {@code part / total} as a percentage with one decimal. Zero totals are 0.0%. */
  public static String percent(long part, long total) {
    double pct = total > 0 ? 100.0 * part / total : 0.0;
    return String.format(Locale.ROOT, "%.1f%%", pct);
  }
}
