package ai.promoted.metrics.engagement.common.job;

import java.util.Set;

/** A {@code Composite} for {@code JobSegment}. */
public interface CompositeJobSegment extends JobSegment {

  /** Returns a set of inner JobSegments. Not ones passed into constructors. */
  Set<JobSegment> getInnerSegments();

  @Override
  default void validateArgs() {
    for (JobSegment segment : getInnerSegments()) {
      segment.validateArgs();
    }
  }
}
