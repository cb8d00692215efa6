package ai.promoted.metrics.engagement.common.functions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ActionClassifierTest {
  private final ActionClassifier classifier = ActionClassifier.withDefaultRules();

  @ParameterizedTest
  @CsvSource({
    "OPEN_FORM, Share your story",
    "OPEN_FORM, 15Share your story and read more",
    "SUBMIT, 15Submit",
    "SUBMIT, submit and read",
    "CANCEL, Cancel reading",
    "READ, 15Read full story",
    "READ, READ MORE",
    "LIKE, 15Like",
    "LIKE, 15 likes",
    "OTHER, Download PDF",
    "OTHER, 15",
  })
  void classify(ActionCategory expected, String label) {
    assertEquals(expected, classifier.classify(label));
  }

  @Test
  public void missingLabel() {
    assertEquals(ActionCategory.OTHER, classifier.classify(null));
    assertEquals(ActionCategory.OTHER, classifier.classify(""));
  }

  @Test
  public void customRules() {
    ActionClassifier custom =
        new ActionClassifier(
            ImmutableList.of(ActionRule.containsIgnoreCase("Read", ActionCategory.READ)),
            ActionCategory.OTHER);
    assertEquals(ActionCategory.READ, custom.classify("Cancel reading"));
    assertEquals(ActionCategory.OTHER, custom.classify("Submit"));
  }

  @Test
  public void reportableCatchAll() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ActionClassifier(ImmutableList.of(), ActionCategory.READ));
  }
}
