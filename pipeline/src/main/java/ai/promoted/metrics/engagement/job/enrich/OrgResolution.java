package ai.promoted.metrics.engagement.job.enrich;

import ai.promoted.metrics.engagement.common.records.OrgMatch;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** The organizational attributes resolved for one event. */
@AutoValue
public abstract class OrgResolution {

  public abstract OrgMatch match();

  /** Empty unless {@link OrgMatch#isMatched()}. */
  public abstract ImmutableMap<String, String> attributes();

  public static OrgResolution unmatched(OrgMatch match) {
    return new AutoValue_OrgResolution(match, ImmutableMap.of());
  }

  public static OrgResolution matched(OrgMatch match, ImmutableMap<String, String> attributes) {
    return new AutoValue_OrgResolution(match, attributes);
  }
}
