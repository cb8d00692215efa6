package ai.promoted.metrics.engagement.common.functions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ContentIdsTest {
  @ParameterizedTest
  @CsvSource({
    "15, 15Read full story",
    "007, 007Like",
    "2026, 2026",
    ", Read full story",
    ", ' 15Read'",
  })
  void fromLabel(String expected, String label) {
    assertEquals(expected, ContentIds.fromLabel(label));
  }

  @Test
  public void nullLabel() {
    assertNull(ContentIds.fromLabel(null));
  }
}
