package ai.promoted.metrics.engagement.common.records;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.time.LocalDate;

/** Organizational attributes of one actor as of {@link #snapshotDate()}. */
@AutoValue
public abstract class OrgSnapshot implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Normalized organizational identifier. */
  public abstract String actorId();

  public abstract LocalDate snapshotDate();

  /** Output column (e.g. {@code org_division}) to value. Blank values are left out. */
  public abstract ImmutableMap<String, String> attributes();

  public static OrgSnapshot create(
      String actorId, LocalDate snapshotDate, ImmutableMap<String, String> attributes) {
    return new AutoValue_OrgSnapshot(actorId, snapshotDate, attributes);
  }
}
