package ai.promoted.metrics.engagement.common.table;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.ProcessedFileRecord;
import com.google.common.collect.ImmutableList;
import java.io.IOException;

/**
 * Keeps a working copy and the last committed copy in memory. Subclasses make commits durable by
 * overriding {@link #persist}.
 */
public class InMemoryEngagementStore implements EngagementStore {
  private ImmutableList<CanonicalEvent> committedEvents;
  private ImmutableList<ProcessedFileRecord> committedFiles;
  private InMemoryEventStore events;
  private InMemoryManifestStore manifest;

  public InMemoryEngagementStore() {
    this(ImmutableList.of(), ImmutableList.of());
  }

  protected InMemoryEngagementStore(
      ImmutableList<CanonicalEvent> committedEvents,
      ImmutableList<ProcessedFileRecord> committedFiles) {
    this.committedEvents = committedEvents;
    this.committedFiles = committedFiles;
    rollback();
  }

  @Override
  public EventStore events() {
    return events;
  }

  @Override
  public ManifestStore manifest() {
    return manifest;
  }

  @Override
  public void commit() throws IOException {
    ImmutableList<CanonicalEvent> newEvents = events.scan();
    ImmutableList<ProcessedFileRecord> newFiles = manifest.entries();
    persist(newEvents, newFiles);
    committedEvents = newEvents;
    committedFiles = newFiles;
  }

  @Override
  public void rollback() {
    events = new InMemoryEventStore(committedEvents);
    manifest = new InMemoryManifestStore(committedFiles);
  }

  @Override
  public void reset() throws IOException {
    committedEvents = ImmutableList.of();
    committedFiles = ImmutableList.of();
    rollback();
  }

  /** Called by {@link #commit()} before the in-memory committed copy moves forward. */
  protected void persist(
      ImmutableList<CanonicalEvent> events, ImmutableList<ProcessedFileRecord> files)
      throws IOException {}
}
