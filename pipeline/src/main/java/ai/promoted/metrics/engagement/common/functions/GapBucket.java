package ai.promoted.metrics.engagement.common.functions;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * Categorical ranges for the time since the previous event of a session.
 *
 * <p>The ranges partition {@code [0, inf)}. The first range is {@code [0, 500)}; every later range
 * is lower-exclusive and upper-inclusive, so an exact one-second gap (common in whole-second
 * exports) lands in {@code 0.5-1s}.
 */
public enum GapBucket {
  FIRST_EVENT("First Event", -1, -1),
  UNDER_HALF_SECOND("< 0.5s", 0, 499),
  HALF_TO_ONE_SECOND("0.5-1s", 500, 1_000),
  ONE_TO_TWO_SECONDS("1-2s", 1_001, 2_000),
  TWO_TO_FIVE_SECONDS("2-5s", 2_001, 5_000),
  FIVE_TO_TEN_SECONDS("5-10s", 5_001, 10_000),
  TEN_TO_THIRTY_SECONDS("10-30s", 10_001, 30_000),
  THIRTY_TO_SIXTY_SECONDS("30-60s", 30_001, 60_000),
  OVER_SIXTY_SECONDS("> 60s", 60_001, Long.MAX_VALUE);

  private final String label;
  // Inclusive bounds in milliseconds.
  private final long minMillis;
  private final long maxMillis;

  GapBucket(String label, long minMillis, long maxMillis) {
    this.label = label;
    this.minMillis = minMillis;
    this.maxMillis = maxMillis;
  }

  public String label() {
    return label;
  }

  /** Returns the bucket for a gap. A null gap means there is no previous event. */
  public static GapBucket of(@Nullable Long gapMillis) {
    if (gapMillis == null) {
      return FIRST_EVENT;
    }
    Preconditions.checkArgument(gapMillis >= 0, "gap must be non-negative, gap=%s", gapMillis);
    for (GapBucket bucket : values()) {
      if (bucket != FIRST_EVENT && gapMillis >= bucket.minMillis && gapMillis <= bucket.maxMillis) {
        return bucket;
      }
    }
    throw new IllegalStateException("No bucket for gap=" + gapMillis);
  }
}
