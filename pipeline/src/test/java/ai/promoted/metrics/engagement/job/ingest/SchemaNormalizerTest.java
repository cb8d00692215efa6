package ai.promoted.metrics.engagement.job.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.promoted.metrics.engagement.common.format.TabularFile;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import org.junit.jupiter.api.Test;

public class SchemaNormalizerTest {
  private static final String SOURCE = "export_2026_02_25.csv";
  private static final ImmutableList<String> BASIC_HEADERS =
      ImmutableList.of("timestamp", "user_Id", "session_Id", "name", "CP_Link_label");

  private final SchemaNormalizer normalizer = new SchemaNormalizer();

  @Test
  public void mapAlternateHeaders() throws InputFileException {
    TabularFile file =
        TabularFile.create(
            ImmutableList.of(
                "Timestamp [UTC]",
                "USER_ID",
                "session_id",
                " Name ",
                "CP_GPN",
                "GPN",
                "CP_Email",
                "Link_label",
                "CP_LinkType",
                "page_url",
                "utm_campaign"),
            ImmutableList.of(
                ImmutableList.of(
                    "2026-02-25 14:03:01.250",
                    "u1",
                    "s1",
                    "click",
                    "",
                    "1234567.0",
                    "jane@example.com",
                    "15Read",
                    "button",
                    "https://intranet/stories/15",
                    "spring")));

    NormalizedFile normalized = normalizer.normalize(file, SOURCE);

    assertEquals(
        ImmutableList.of(
            CanonicalEvent.builder()
                .setTimestamp(Instant.parse("2026-02-25T14:03:01.250Z"))
                .setUserId("u1")
                .setSessionId("s1")
                .setName("click")
                .setOrgId("01234567")
                .setEmail("jane@example.com")
                .setLinkLabel("15Read")
                .setLinkType("button")
                .setPageUrl("https://intranet/stories/15")
                .setSourceFile(SOURCE)
                .build()),
        normalized.events());
    assertEquals(ImmutableList.of("utm_campaign"), normalized.droppedColumns());
    assertFalse(normalized.precisionWarning());
    assertEquals(0, normalized.rejectedRowCount());
  }

  @Test
  public void rejectRowsAndCollapseCollisions() throws InputFileException {
    TabularFile file =
        TabularFile.create(
            BASIC_HEADERS,
            ImmutableList.of(
                ImmutableList.of("2026-02-25 14:03:01", "u1", "s1", "click", "A"),
                ImmutableList.of("yesterday", "u1", "s1", "click", "X"),
                ImmutableList.of("2026-02-25 14:03:02", "u2", "s2", "click", "C"),
                ImmutableList.of("2026-02-25 14:03:03", " ", "s1", "click", "X"),
                ImmutableList.of("2026-02-25 14:03:01", "u1", "s1", "click", "B"),
                ImmutableList.of("2026-02-25 14:03:04", "u1")));

    NormalizedFile normalized = normalizer.normalize(file, SOURCE);

    assertEquals(6, normalized.sourceRowCount());
    assertEquals(3, normalized.rejectedRowCount());
    assertEquals(1, normalized.collisionCount());
    // The later row of a collision wins and keeps its later position.
    assertEquals(
        ImmutableList.of("C", "B"),
        normalized.events().stream()
            .map(CanonicalEvent::linkLabel)
            .collect(ImmutableList.toImmutableList()));
    assertTrue(normalized.precisionWarning());
    assertTrue(normalized.droppedColumns().isEmpty());
  }

  @Test
  public void missingRequiredColumn() {
    TabularFile file =
        TabularFile.create(
            ImmutableList.of("timestamp", "user_Id", "name"),
            ImmutableList.of(ImmutableList.of("2026-02-25 14:03:01", "u1", "click")));

    InputFileException e =
        assertThrows(InputFileException.class, () -> normalizer.normalize(file, SOURCE));

    assertEquals(SOURCE, e.getFilename());
    assertTrue(e.getMessage().contains("session_id"), e.getMessage());
  }

  @Test
  public void noValidRows() {
    TabularFile file =
        TabularFile.create(
            BASIC_HEADERS,
            ImmutableList.of(ImmutableList.of("not a time", "u1", "s1", "click", "A")));
    assertThrows(InputFileException.class, () -> normalizer.normalize(file, SOURCE));
  }

  @Test
  public void headerOnly() {
    TabularFile file = TabularFile.create(BASIC_HEADERS, ImmutableList.of());
    assertThrows(InputFileException.class, () -> normalizer.normalize(file, SOURCE));
  }
}
