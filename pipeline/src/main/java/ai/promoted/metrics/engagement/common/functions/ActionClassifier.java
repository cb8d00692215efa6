package ai.promoted.metrics.engagement.common.functions;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Classifies link labels with an ordered rule list. The first matching rule wins; labels that match
 * nothing (including missing labels) get the catch-all category.
 *
 * <p>Order matters. "Read" is checked after "Share your story", "Submit" and "Cancel" so that a
 * label like "Cancel reading" stays a cancel.
 */
public final class ActionClassifier {

  private static final ImmutableList<ActionRule> DEFAULT_RULES =
      ImmutableList.of(
          ActionRule.containsIgnoreCase("Share your story", ActionCategory.OPEN_FORM),
          ActionRule.containsIgnoreCase("Submit", ActionCategory.SUBMIT),
          ActionRule.containsIgnoreCase("Cancel", ActionCategory.CANCEL),
          ActionRule.containsIgnoreCase("Read", ActionCategory.READ),
          ActionRule.containsIgnoreCase("like", ActionCategory.LIKE));

  private final ImmutableList<ActionRule> rules;
  private final ActionCategory catchAll;

  public ActionClassifier(ImmutableList<ActionRule> rules, ActionCategory catchAll) {
    Preconditions.checkArgument(
        !catchAll.isReportable(), "catch-all category must not be reportable, was %s", catchAll);
    this.rules = rules;
    this.catchAll = catchAll;
  }

  public static ActionClassifier withDefaultRules() {
    return new ActionClassifier(DEFAULT_RULES, ActionCategory.OTHER);
  }

  public ActionCategory classify(@Nullable String label) {
    for (ActionRule rule : rules) {
      if (rule.matches(label)) {
        return rule.category();
      }
    }
    return catchAll;
  }
}
