package ai.promoted.metrics.engagement.common.records;

import com.google.auto.value.AutoValue;
import java.io.Serializable;
import java.time.Instant;
import java.util.Comparator;

/**
 * The merge key of a stored event. Two rows with the same identity are the same event, so a later
 * file's row replaces an earlier one.
 *
 * <p>Exports truncated to whole seconds can map two real clicks onto one identity. That is an
 * accepted precision limit of the upstream export and is not corrected here.
 */
@AutoValue
public abstract class EventIdentity implements Comparable<EventIdentity>, Serializable {
  private static final long serialVersionUID = 1L;

  private static final Comparator<EventIdentity> ORDER =
      Comparator.comparing(EventIdentity::timestamp)
          .thenComparing(EventIdentity::userId)
          .thenComparing(EventIdentity::sessionId)
          .thenComparing(EventIdentity::name);

  public abstract Instant timestamp();

  public abstract String userId();

  public abstract String sessionId();

  public abstract String name();

  public static EventIdentity create(
      Instant timestamp, String userId, String sessionId, String name) {
    return new AutoValue_EventIdentity(timestamp, userId, sessionId, name);
  }

  @Override
  public int compareTo(EventIdentity other) {
    return ORDER.compare(this, other);
  }
}
