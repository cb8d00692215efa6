package ai.promoted.metrics.engagement.common.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.promoted.metrics.engagement.common.format.TimestampParser.ParsedTimestamp;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TimestampParserTest {
  @ParameterizedTest
  @CsvSource({
    "2026-02-25T14:03:01.123Z, true, 2026-02-25 14:03:01.123",
    "2026-02-25T14:03:01Z, false, 2026-02-25 14:03:01",
    "2026-02-25T14:03:01Z, false, 2026-02-25T14:03:01Z",
    "2026-02-25T14:03:01.123456Z, true, 2026-02-25T14:03:01.123456789",
    "2026-02-25T14:03:01Z, false, 2026-02-25T15:03:01+01:00",
    "2026-02-25T14:03:00Z, false, 2026-02-25 14:03",
    "2026-02-25T00:00:00Z, false, 2026-02-25",
    "2026-02-25T14:03:00Z, false, 25/02/2026 14:03",
    "2026-02-25T04:03:01.5Z, true, 25.2.2026 4:03:01.5",
    "2026-02-25T14:03:01Z, false, 25-02-2026 14:03:01",
    "2026-02-25T12:00:00Z, false, 46078.5",
    "2026-02-25T00:00:00Z, false, 46078",
  })
  void parse(String expectedInstant, boolean expectedSubSecond, String text) {
    ParsedTimestamp parsed = TimestampParser.parse(text).orElseThrow();
    assertEquals(Instant.parse(expectedInstant), parsed.instant());
    assertEquals(expectedSubSecond, parsed.subSecond());
  }

  @ParameterizedTest
  @CsvSource({
    "not a date",
    "2026-02-30 10:00:00",
    "2026-13-01",
    "31/02/2026",
    "14:03:01",
    "0",
  })
  void unparseable(String text) {
    assertEquals(Optional.empty(), TimestampParser.parse(text));
  }

  @Test
  public void blank() {
    assertTrue(TimestampParser.parse(null).isEmpty());
    assertTrue(TimestampParser.parse("  ").isEmpty());
  }
}
