package ai.promoted.metrics.engagement.common.functions;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Extracts the content identifier that prefixes link labels, e.g. "15" from "15Read full story".
 */
public final class ContentIds {
  private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

  @Nullable
  public static String fromLabel(@Nullable String label) {
    if (label == null) {
      return null;
    }
    Matcher m = LEADING_DIGITS.matcher(label);
    return m.find() ? m.group(1) : null;
  }

  private ContentIds() {}
}
