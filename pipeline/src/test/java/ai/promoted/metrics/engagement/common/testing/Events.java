package ai.promoted.metrics.engagement.common.testing;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import java.time.Instant;

/** Builders for test events. */
public class Events {

  /** A minimal event named {@code click} at {@code timestamp}. */
  public static CanonicalEvent.Builder event(String timestamp, String userId, String sessionId) {
    return CanonicalEvent.builder()
        .setTimestamp(Instant.parse(timestamp))
        .setUserId(userId)
        .setSessionId(sessionId)
        .setName("click")
        .setSourceFile("export_2026_02_25.csv");
  }
}
