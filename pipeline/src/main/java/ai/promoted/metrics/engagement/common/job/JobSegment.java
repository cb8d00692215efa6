package ai.promoted.metrics.engagement.common.job;

/** Interface to define a modular segment of a job's command line. */
public interface JobSegment {

  /**
   * Make sure the command line args are valid. Throw {@link IllegalArgumentException} for any cli
   * argument inconsistency. IMPORTANT: call all ancestor and interface validateArgs to ensure
   * correct behavior.
   */
  void validateArgs();
}
