package ai.promoted.metrics.engagement.common.format;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.apache.poi.ss.usermodel.DateUtil;

/**
 * Parses the timestamp layouts seen in analytics exports into UTC instants.
 *
 * <p>Values without an offset are UTC. Fractions are truncated to microseconds. Plain numbers are
 * read as spreadsheet date serials.
 */
public final class TimestampParser {
  private static final Pattern SERIAL = Pattern.compile("^\\d+(\\.\\d+)?$");

  private static final ImmutableList<DateTimeFormatter> FORMATTERS =
      ImmutableList.of(
          dayFirst("d/M/uuuu"), dayFirst("d.M.uuuu"), dayFirst("d-M-uuuu"), yearFirst());

  /** A parsed value and whether it carried a non-zero sub-second part. */
  @AutoValue
  public abstract static class ParsedTimestamp {
    public abstract Instant instant();

    public abstract boolean subSecond();

    static ParsedTimestamp create(Instant instant) {
      return new AutoValue_TimestampParser_ParsedTimestamp(instant, instant.getNano() != 0);
    }
  }

  /** Returns empty when the text matches no supported layout. */
  public static Optional<ParsedTimestamp> parse(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String value = text.trim();
    if (SERIAL.matcher(value).matches()) {
      return parseSerial(value);
    }
    for (DateTimeFormatter formatter : FORMATTERS) {
      try {
        TemporalAccessor parsed = formatter.parse(value);
        LocalDateTime local = LocalDateTime.from(parsed);
        ZoneOffset offset =
            parsed.isSupported(ChronoField.OFFSET_SECONDS)
                ? ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS))
                : ZoneOffset.UTC;
        return Optional.of(
            ParsedTimestamp.create(local.toInstant(offset).truncatedTo(ChronoUnit.MICROS)));
      } catch (DateTimeException e) {
        // Try the next layout.
      }
    }
    return Optional.empty();
  }

  private static Optional<ParsedTimestamp> parseSerial(String value) {
    double serial = Double.parseDouble(value);
    if (!DateUtil.isValidExcelDate(serial) || serial < 1) {
      return Optional.empty();
    }
    LocalDateTime local = DateUtil.getLocalDateTime(serial);
    return Optional.of(
        ParsedTimestamp.create(local.toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS)));
  }

  private static DateTimeFormatter dayFirst(String datePattern) {
    return withOptionalTime(new DateTimeFormatterBuilder().appendPattern(datePattern))
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);
  }

  private static DateTimeFormatter yearFirst() {
    return withOptionalTime(new DateTimeFormatterBuilder().appendPattern("uuuu-MM-dd"))
        .optionalStart()
        .appendOffset("+HH:MM", "Z")
        .optionalEnd()
        .optionalStart()
        .appendOffset("+HHMM", "Z")
        .optionalEnd()
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);
  }

  private static DateTimeFormatterBuilder withOptionalTime(DateTimeFormatterBuilder builder) {
    return builder
        .optionalStart()
        .optionalStart()
        .appendLiteral('T')
        .optionalEnd()
        .optionalStart()
        .appendLiteral(' ')
        .optionalEnd()
        .appendPattern("H:mm")
        .optionalStart()
        .appendPattern(":ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .optionalEnd()
        .optionalEnd()
        .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
        .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
        .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
        .parseDefaulting(ChronoField.NANO_OF_SECOND, 0);
  }

  private TimestampParser() {}
}
