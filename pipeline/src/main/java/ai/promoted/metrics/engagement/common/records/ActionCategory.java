package ai.promoted.metrics.engagement.common.records;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import javax.annotation.Nullable;

/**
 * Action categories derived from link labels. {@link #OTHER} is the catch-all: it stays on the
 * event rows but is left out of aggregates and report breakdowns.
 */
public enum ActionCategory {
  OPEN_FORM("Open Form", "open_forms"),
  SUBMIT("Submit", "submits"),
  CANCEL("Cancel", "cancels"),
  READ("Read", "reads"),
  LIKE("Like", "likes"),
  OTHER("Other", null);

  private static final ImmutableList<ActionCategory> REPORTABLE =
      Arrays.stream(values())
          .filter(ActionCategory::isReportable)
          .collect(ImmutableList.toImmutableList());

  private final String label;
  @Nullable private final String countColumn;

  ActionCategory(String label, @Nullable String countColumn) {
    this.label = label;
    this.countColumn = countColumn;
  }

  /** Value written to the {@code action_type} column. */
  public String label() {
    return label;
  }

  /** Aggregate column that counts this category. Null for the catch-all. */
  @Nullable
  public String countColumn() {
    return countColumn;
  }

  public boolean isReportable() {
    return countColumn != null;
  }

  public static ImmutableList<ActionCategory> reportable() {
    return REPORTABLE;
  }
}
