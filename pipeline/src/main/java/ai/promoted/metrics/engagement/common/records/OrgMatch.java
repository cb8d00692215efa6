package ai.promoted.metrics.engagement.common.records;

/** How an event's organizational attributes were resolved. */
public enum OrgMatch {
  /** Latest snapshot on or before the event date. */
  AS_OF,
  /** The event predates the actor's first snapshot, so the earliest later snapshot was used. */
  NEAREST_FOLLOWING,
  /** The event has an organizational identifier but no snapshot exists for it. */
  NO_SNAPSHOT,
  /** The event carries no organizational identifier. */
  NO_ORG_ID,
  /** The snapshot feed was missing or unreadable for this run. */
  REFERENCE_UNAVAILABLE;

  public boolean isMatched() {
    return this == AS_OF || this == NEAREST_FOLLOWING;
  }
}
