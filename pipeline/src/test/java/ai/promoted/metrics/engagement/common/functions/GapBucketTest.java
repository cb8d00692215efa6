package ai.promoted.metrics.engagement.common.functions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class GapBucketTest {
  @ParameterizedTest
  @CsvSource({
    "< 0.5s, 0",
    "< 0.5s, 499",
    "0.5-1s, 500",
    "0.5-1s, 1000",
    "1-2s, 1001",
    "1-2s, 2000",
    "2-5s, 2001",
    "2-5s, 5000",
    "5-10s, 10000",
    "10-30s, 10001",
    "10-30s, 30000",
    "30-60s, 60000",
    "> 60s, 60001",
    "> 60s, 299000",
  })
  void of(String expectedLabel, long gapMillis) {
    assertEquals(expectedLabel, GapBucket.of(gapMillis).label());
  }

  @Test
  public void firstEvent() {
    assertEquals(GapBucket.FIRST_EVENT, GapBucket.of(null));
    assertEquals("First Event", GapBucket.FIRST_EVENT.label());
  }

  @Test
  public void negativeGap() {
    assertThrows(IllegalArgumentException.class, () -> GapBucket.of(-1L));
  }
}
