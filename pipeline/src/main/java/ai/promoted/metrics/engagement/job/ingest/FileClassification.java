package ai.promoted.metrics.engagement.job.ingest;

/** An input file compared with its manifest entry. */
public enum FileClassification {
  /** Not in the manifest. */
  NEW,
  /** Same content hash as the manifest entry. */
  UNCHANGED,
  /** Different content hash than the manifest entry. */
  MODIFIED;

  public boolean needsMerge() {
    return this != UNCHANGED;
  }
}
