package ai.promoted.metrics.engagement.job.engagement;

/** What a run did with one input file. */
public enum FileStatus {
  /** New or modified; merged and committed. */
  PROCESSED,
  /** Unchanged but merged again after an earlier-dated file changed. */
  REPLAYED,
  /** Unchanged; not read. */
  SKIPPED,
  /** Not merged. The store is unchanged for this file, which stays new or modified. */
  FAILED
}
