package ai.promoted.metrics.engagement.job.ingest;

import static ai.promoted.metrics.engagement.common.testing.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.table.InMemoryEventStore;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

public class UpsertEngineTest {

  @Test
  public void laterBatchReplacesOverlap() {
    InMemoryEventStore store = new InMemoryEventStore();
    UpsertEngine engine = new UpsertEngine(store);
    CanonicalEvent a1 = event("2026-02-24T10:00:00Z", "u1", "s1").setSourceFile("a.csv").build();
    CanonicalEvent a2 = event("2026-02-24T10:00:01Z", "u1", "s1").setSourceFile("a.csv").build();
    CanonicalEvent a3 = event("2026-02-24T10:00:02Z", "u1", "s1").setSourceFile("a.csv").build();

    assertEquals(MergeResult.create(3, 0), engine.merge(ImmutableList.of(a1, a2, a3)));

    CanonicalEvent b2 = a2.toBuilder().setSourceFile("b.csv").setLinkLabel("15Read").build();
    CanonicalEvent b3 = a3.toBuilder().setSourceFile("b.csv").build();
    CanonicalEvent b4 = event("2026-02-24T10:00:03Z", "u1", "s1").setSourceFile("b.csv").build();
    MergeResult result = engine.merge(ImmutableList.of(b2, b3, b4));

    assertEquals(MergeResult.create(3, 2), result);
    assertEquals(1, result.added());
    assertEquals(ImmutableList.of(a1, b2, b3, b4), store.scan());
  }

  @Test
  public void mergingTheSameBatchTwiceIsIdempotent() {
    InMemoryEventStore store = new InMemoryEventStore();
    UpsertEngine engine = new UpsertEngine(store);
    ImmutableList<CanonicalEvent> batch =
        ImmutableList.of(
            event("2026-02-24T10:00:00Z", "u1", "s1").build(),
            event("2026-02-24T10:00:01Z", "u2", "s2").build());

    engine.merge(batch);
    ImmutableList<CanonicalEvent> afterFirst = store.scan();
    assertEquals(MergeResult.create(2, 2), engine.merge(batch));

    assertEquals(afterFirst, store.scan());
  }
}
