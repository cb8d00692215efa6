package ai.promoted.metrics.engagement.common.table;

import ai.promoted.metrics.engagement.common.records.ProcessedFileRecord;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Optional;
import java.util.TreeMap;

public class InMemoryManifestStore implements ManifestStore {
  private final TreeMap<String, ProcessedFileRecord> files = new TreeMap<>();

  public InMemoryManifestStore() {}

  public InMemoryManifestStore(Collection<ProcessedFileRecord> initial) {
    initial.forEach(this::record);
  }

  @Override
  public Optional<ProcessedFileRecord> lookup(String filename) {
    return Optional.ofNullable(files.get(filename));
  }

  @Override
  public void record(ProcessedFileRecord file) {
    files.put(file.filename(), file);
  }

  @Override
  public ImmutableList<ProcessedFileRecord> entries() {
    return ImmutableList.copyOf(files.values());
  }
}
