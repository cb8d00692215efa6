package ai.promoted.metrics.engagement.common.table;

import java.io.IOException;

/**
 * The event store and the processed-file manifest with a shared commit. Changes go to a working
 * copy; {@link #commit()} makes them durable together and {@link #rollback()} discards them.
 */
public interface EngagementStore {

  EventStore events();

  ManifestStore manifest();

  void commit() throws IOException;

  /** Restores the working copy to the last commit. */
  void rollback();

  /** Deletes all events and manifest entries, committed or not. */
  void reset() throws IOException;
}
