package ai.promoted.metrics.engagement.common.util;

import java.util.Locale;
import javax.annotation.Nullable;

/** Utilities for Strings. */
public final class StringUtil {

  public static boolean isBlank(@Nullable String in) {
    return in == null || in.isBlank();
  }

  /** Returns the trimmed value or null when it is blank. */
  @Nullable
  public static String trimToNull(@Nullable String in) {
    return isBlank(in) ? null : in.trim();
  }

  /** Case-insensitive substring check. Null text never matches. */
  public static boolean containsIgnoreCase(@Nullable String text, String needle) {
    return text != null && text.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
  }

  /** Header comparisons ignore case and surrounding whitespace. */
  public static String headerKey(String header) {
    return header.trim().toLowerCase(Locale.ROOT);
  }

  private StringUtil() {}
}
