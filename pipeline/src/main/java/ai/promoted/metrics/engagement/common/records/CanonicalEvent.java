package ai.promoted.metrics.engagement.common.records;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import java.io.Serializable;
import java.time.Instant;
import javax.annotation.Nullable;

/** A click event after its source columns were mapped onto the fixed event schema. */
@AutoValue
public abstract class CanonicalEvent implements Serializable {
  private static final long serialVersionUID = 1L;

  /** UTC event time. At most microsecond precision. */
  public abstract Instant timestamp();

  public abstract String userId();

  public abstract String sessionId();

  public abstract String name();

  /** Normalized organizational identifier used for the organizational join. */
  @Nullable
  public abstract String orgId();

  @Nullable
  public abstract String email();

  @Nullable
  public abstract String linkLabel();

  @Nullable
  public abstract String linkType();

  @Nullable
  public abstract String pageUrl();

  /** Name of the input file whose version of this event is stored. */
  public abstract String sourceFile();

  @Memoized
  public EventIdentity identity() {
    return EventIdentity.create(timestamp(), userId(), sessionId(), name());
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CanonicalEvent.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setTimestamp(Instant timestamp);

    public abstract Builder setUserId(String userId);

    public abstract Builder setSessionId(String sessionId);

    public abstract Builder setName(String name);

    public abstract Builder setOrgId(@Nullable String orgId);

    public abstract Builder setEmail(@Nullable String email);

    public abstract Builder setLinkLabel(@Nullable String linkLabel);

    public abstract Builder setLinkType(@Nullable String linkType);

    public abstract Builder setPageUrl(@Nullable String pageUrl);

    public abstract Builder setSourceFile(String sourceFile);

    public abstract CanonicalEvent build();
  }
}
