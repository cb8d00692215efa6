package ai.promoted.metrics.engagement.common.functions;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.util.StringUtil;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/** One (predicate, category) entry of an {@link ActionClassifier}. */
@AutoValue
public abstract class ActionRule {

  /** Human readable form of the predicate for logs. */
  public abstract String description();

  abstract Predicate<String> predicate();

  public abstract ActionCategory category();

  public boolean matches(@Nullable String label) {
    return label != null && predicate().test(label);
  }

  /** Matches labels that contain {@code needle}, ignoring case. */
  public static ActionRule containsIgnoreCase(String needle, ActionCategory category) {
    Preconditions.checkArgument(!StringUtil.isBlank(needle), "needle must be set");
    return create(
        "contains '" + needle + "'",
        label -> StringUtil.containsIgnoreCase(label, needle),
        category);
  }

  public static ActionRule create(
      String description, Predicate<String> predicate, ActionCategory category) {
    return new AutoValue_ActionRule(description, predicate, category);
  }
}
