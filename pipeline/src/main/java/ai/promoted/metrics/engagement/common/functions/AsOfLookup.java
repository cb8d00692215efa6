package ai.promoted.metrics.engagement.common.functions;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * A temporal lookup that enriches facts with a dimension table. Will return the dimension row whose
 * time is the largest among the ones that are less than or equal to the fact time. When the fact
 * predates every dimension row of its key, the earliest row is returned instead and flagged as
 * {@link Match#following()}.
 *
 * <p>Rows are kept sorted per key so each lookup is a binary search. When two rows share a key and
 * a time, the one offered last wins.
 */
public final class AsOfLookup<KEY, TIME extends Comparable<? super TIME>, DIMENSION> {

  private final ImmutableMap<KEY, ImmutableList<TIME>> times;
  private final ImmutableMap<KEY, ImmutableList<DIMENSION>> dimensions;
  private final int replacedCount;

  private AsOfLookup(
      ImmutableMap<KEY, ImmutableList<TIME>> times,
      ImmutableMap<KEY, ImmutableList<DIMENSION>> dimensions,
      int replacedCount) {
    this.times = times;
    this.dimensions = dimensions;
    this.replacedCount = replacedCount;
  }

  public static <KEY, TIME extends Comparable<? super TIME>, DIMENSION>
      AsOfLookup<KEY, TIME, DIMENSION> create(
          Iterable<DIMENSION> rows,
          Function<DIMENSION, KEY> getKey,
          Function<DIMENSION, TIME> getTime) {
    Map<KEY, TreeMap<TIME, DIMENSION>> byKey = new HashMap<>();
    int replaced = 0;
    for (DIMENSION row : rows) {
      TreeMap<TIME, DIMENSION> versions =
          byKey.computeIfAbsent(getKey.apply(row), key -> new TreeMap<>());
      if (versions.put(getTime.apply(row), row) != null) {
        replaced++;
      }
    }
    ImmutableMap.Builder<KEY, ImmutableList<TIME>> timesBuilder = ImmutableMap.builder();
    ImmutableMap.Builder<KEY, ImmutableList<DIMENSION>> dimensionsBuilder = ImmutableMap.builder();
    byKey.forEach(
        (key, versions) -> {
          timesBuilder.put(key, ImmutableList.copyOf(versions.keySet()));
          dimensionsBuilder.put(key, ImmutableList.copyOf(versions.values()));
        });
    return new AsOfLookup<>(timesBuilder.build(), dimensionsBuilder.build(), replaced);
  }

  /** Returns the dimension row for {@code key} at {@code time}, or empty if the key is unknown. */
  public Optional<Match<DIMENSION>> lookup(KEY key, TIME time) {
    List<TIME> keyTimes = times.get(key);
    if (keyTimes == null || keyTimes.isEmpty()) {
      return Optional.empty();
    }
    List<DIMENSION> keyDimensions = dimensions.get(key);
    int atOrBefore = upperBound(keyTimes, time) - 1;
    if (atOrBefore >= 0) {
      return Optional.of(Match.create(keyDimensions.get(atOrBefore), false));
    }
    return Optional.of(Match.create(keyDimensions.get(0), true));
  }

  public int keyCount() {
    return times.size();
  }

  public int rowCount() {
    return times.values().stream().mapToInt(List::size).sum();
  }

  /** Rows dropped because a later row had the same key and time. */
  public int replacedCount() {
    return replacedCount;
  }

  // Index of the first element greater than time.
  private static <TIME extends Comparable<? super TIME>> int upperBound(
      List<TIME> sorted, TIME time) {
    int low = 0;
    int high = sorted.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (sorted.get(mid).compareTo(time) <= 0) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /** A matched dimension row. */
  @AutoValue
  public abstract static class Match<DIMENSION> {
    public abstract DIMENSION dimension();

    /** True when the row is dated after the fact (fallback match). */
    public abstract boolean following();

    static <DIMENSION> Match<DIMENSION> create(DIMENSION dimension, boolean following) {
      return new AutoValue_AsOfLookup_Match<>(dimension, following);
    }
  }
}
