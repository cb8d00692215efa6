package ai.promoted.metrics.engagement.common.util;

import ai.promoted.metrics.engagement.common.constant.Constants;
import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Normalizes organizational identifiers so both sides of the organizational join agree.
 *
 * <p>The identifier arrives as text from CSV exports and as a number from spreadsheet exports
 * ("1234567.0" for "01234567"). Numeric identifiers are left-padded with zeros to {@link
 * Constants#ORG_ID_WIDTH}. Identifiers that are longer or not numeric are only trimmed.
 */
public final class ActorIds {
  private static final Pattern TRAILING_DECIMAL = Pattern.compile("\\.0+$");

  @Nullable
  public static String normalize(@Nullable String rawId) {
    String id = StringUtil.trimToNull(rawId);
    if (id == null) {
      return null;
    }
    id = TRAILING_DECIMAL.matcher(id).replaceFirst("");
    if (id.isEmpty()) {
      return null;
    }
    if (CharMatcher.inRange('0', '9').matchesAllOf(id)) {
      return Strings.padStart(id, Constants.ORG_ID_WIDTH, '0');
    }
    return id;
  }

  private ActorIds() {}
}
