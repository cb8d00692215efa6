package ai.promoted.metrics.engagement.common.util;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/** Conversions for Avro and Parquet {@code timestamp-micros} values. */
public final class TimeUtil {
  private static final long MICROS_PER_SECOND = TimeUnit.SECONDS.toMicros(1);

  public static long toEpochMicros(Instant instant) {
    return Math.addExact(
        Math.multiplyExact(instant.getEpochSecond(), MICROS_PER_SECOND),
        TimeUnit.NANOSECONDS.toMicros(instant.getNano()));
  }

  public static Instant fromEpochMicros(long micros) {
    return Instant.ofEpochSecond(
        Math.floorDiv(micros, MICROS_PER_SECOND),
        TimeUnit.MICROSECONDS.toNanos(Math.floorMod(micros, MICROS_PER_SECOND)));
  }

  private TimeUtil() {}
}
