package ai.promoted.metrics.engagement.job.enrich;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import javax.annotation.Nullable;

/** Content titles and keywords by content id. */
public final class ContentCatalog {
  private static final ContentCatalog EMPTY = new ContentCatalog(ImmutableMap.of());

  private final ImmutableMap<String, Entry> entries;

  private ContentCatalog(ImmutableMap<String, Entry> entries) {
    this.entries = entries;
  }

  public static ContentCatalog of(ImmutableMap<String, Entry> entries) {
    return new ContentCatalog(entries);
  }

  public static ContentCatalog empty() {
    return EMPTY;
  }

  public Optional<Entry> lookup(@Nullable String contentId) {
    return contentId == null ? Optional.empty() : Optional.ofNullable(entries.get(contentId));
  }

  public int size() {
    return entries.size();
  }

  /** One catalog row. */
  @AutoValue
  public abstract static class Entry {
    @Nullable
    public abstract String title();

    @Nullable
    public abstract String keys();

    public static Entry create(@Nullable String title, @Nullable String keys) {
      return new AutoValue_ContentCatalog_Entry(title, keys);
    }
  }
}
