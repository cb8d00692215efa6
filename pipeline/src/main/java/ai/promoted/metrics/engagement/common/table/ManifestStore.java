package ai.promoted.metrics.engagement.common.table;

import ai.promoted.metrics.engagement.common.records.ProcessedFileRecord;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Which input files were merged, keyed by filename. */
public interface ManifestStore {

  Optional<ProcessedFileRecord> lookup(String filename);

  /** Inserts or replaces the entry for {@link ProcessedFileRecord#filename()}. */
  void record(ProcessedFileRecord file);

  /** Entries ordered by filename. */
  ImmutableList<ProcessedFileRecord> entries();
}
