package ai.promoted.metrics.engagement.common.format;

import ai.promoted.metrics.engagement.common.util.StringUtil;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * A parsed file: one header row and string cells. Empty cells are empty strings. Rows can be
 * shorter than the header; missing trailing cells read as empty.
 */
@AutoValue
public abstract class TabularFile {

  public abstract ImmutableList<String> headers();

  public abstract ImmutableList<ImmutableList<String>> rows();

  public static TabularFile create(
      ImmutableList<String> headers, ImmutableList<ImmutableList<String>> rows) {
    return new AutoValue_TabularFile(headers, rows);
  }

  public int rowCount() {
    return rows().size();
  }

  public String cell(List<String> row, int column) {
    return column < row.size() ? row.get(column) : "";
  }

  /** Index of the first header that matches one of the candidates, in candidate order. */
  public OptionalInt findColumn(List<String> candidates) {
    for (String candidate : candidates) {
      String key = StringUtil.headerKey(candidate);
      OptionalInt index =
          IntStream.range(0, headers().size())
              .filter(i -> StringUtil.headerKey(headers().get(i)).equals(key))
              .findFirst();
      if (index.isPresent()) {
        return index;
      }
    }
    return OptionalInt.empty();
  }

  /** Indexes of every header that matches a candidate, in candidate order. */
  public ImmutableList<Integer> findColumns(List<String> candidates) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (String candidate : candidates) {
      String key = StringUtil.headerKey(candidate);
      IntStream.range(0, headers().size())
          .filter(i -> StringUtil.headerKey(headers().get(i)).equals(key))
          .forEach(builder::add);
    }
    return builder.build().stream().distinct().collect(ImmutableList.toImmutableList());
  }
}
