package ai.promoted.metrics.engagement.job.engagement;

import ai.promoted.metrics.engagement.common.records.ActionCategory;
import ai.promoted.metrics.engagement.common.records.OrgMatch;
import ai.promoted.metrics.engagement.common.util.LogUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Logs a {@link RunSummary} and writes it as JSON. */
public class SummaryReporter {
  private static final Logger LOGGER = LogManager.getLogger(SummaryReporter.class);

  private final ObjectMapper mapper;

  public SummaryReporter() {
    this(new ObjectMapper());
  }

  public SummaryReporter(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public void log(RunSummary summary) {
    LOGGER.info(
        "Files: {} processed, {} replayed, {} skipped, {} failed",
        summary.count(FileStatus.PROCESSED),
        summary.count(FileStatus.REPLAYED),
        summary.count(FileStatus.SKIPPED),
        summary.count(FileStatus.FAILED));
    for (FileOutcome file : summary.files()) {
      if (file.status() == FileStatus.FAILED) {
        LOGGER.error("  {} FAILED: {}", file.filename(), file.failureReason());
      } else if (file.status() != FileStatus.SKIPPED) {
        LOGGER.info(
            "  {} {} ({}): loaded={} replaced={} rejected={} collisions={} droppedColumns={}"
                + " precisionWarning={}",
            file.filename(),
            file.status(),
            file.classification(),
            file.rowsLoaded(),
            file.rowsReplaced(),
            file.rowsRejected(),
            file.collisions(),
            file.droppedColumns().size(),
            file.precisionWarning());
      }
    }

    EventStatistics stats = summary.statistics();
    LOGGER.info(
        "Store: {} events from {} to {}, {} users, {} sessions, {} org ids",
        stats.rowCount(),
        stats.firstEvent(),
        stats.lastEvent(),
        stats.uniqueUsers(),
        stats.uniqueSessions(),
        stats.uniqueOrgIds());

    if (!summary.orgReferenceAvailable()) {
      LOGGER.warn("Organizational reference unavailable: org columns are empty for every event");
    }
    LOGGER.info(
        "Org join coverage: {} of {} events matched ({})",
        stats.matchedCount(),
        stats.rowCount(),
        LogUtil.percent(stats.matchedCount(), stats.rowCount()));
    for (Map.Entry<OrgMatch, Long> entry : stats.orgMatchCounts().entrySet()) {
      LOGGER.info("  {}: {}", entry.getKey(), entry.getValue());
    }
    if (!stats.topUnmatchedOrgIds().isEmpty()) {
      LOGGER.warn("Top org ids without a snapshot: {}", stats.topUnmatchedOrgIds());
    }

    for (Map.Entry<ActionCategory, Long> entry : stats.actionCounts().entrySet()) {
      if (entry.getKey().isReportable()) {
        LOGGER.info("  action {}: {}", entry.getKey().label(), entry.getValue());
      }
    }
    long catchAll =
        stats.actionCounts().entrySet().stream()
            .filter(entry -> !entry.getKey().isReportable())
            .mapToLong(Map.Entry::getValue)
            .sum();
    LOGGER.info(
        "  unclassified actions: {} ({}), sample labels: {}",
        catchAll,
        LogUtil.percent(catchAll, stats.rowCount()),
        stats.catchAllSampleLabels().stream().map(LogUtil::truncate).collect(Collectors.toList()));
    LOGGER.info("Link types: {}", stats.linkTypeCounts());
    LOGGER.info(
        "Artifacts: {} event rows, {} content engagement rows",
        summary.artifacts().eventRows(),
        summary.artifacts().contentEngagementRows());
  }

  public void writeJson(RunSummary summary, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toJson(summary));
    LOGGER.info("Wrote run summary to {}", file);
  }

  public ObjectNode toJson(RunSummary summary) {
    ObjectNode root = mapper.createObjectNode();
    root.put("started_at", summary.startedAt().toString());
    root.put("finished_at", summary.finishedAt().toString());
    root.put("full_reset", summary.fullReset());
    root.put("forced_file", summary.forcedFile());
    root.put("exit_code", summary.exitCode());

    ArrayNode files = root.putArray("files");
    for (FileOutcome outcome : summary.files()) {
      ObjectNode file = files.addObject();
      file.put("filename", outcome.filename());
      file.put("classification", outcome.classification().name());
      file.put("status", outcome.status().name());
      file.put("rows_loaded", outcome.rowsLoaded());
      file.put("rows_replaced", outcome.rowsReplaced());
      file.put("rows_rejected", outcome.rowsRejected());
      file.put("collisions", outcome.collisions());
      ArrayNode dropped = file.putArray("dropped_columns");
      outcome.droppedColumns().forEach(dropped::add);
      file.put("precision_warning", outcome.precisionWarning());
      file.put("failure_reason", outcome.failureReason());
    }

    EventStatistics stats = summary.statistics();
    ObjectNode store = root.putObject("store");
    store.put("row_count", stats.rowCount());
    store.put("first_event", stats.firstEvent() == null ? null : stats.firstEvent().toString());
    store.put("last_event", stats.lastEvent() == null ? null : stats.lastEvent().toString());
    store.put("unique_users", stats.uniqueUsers());
    store.put("unique_sessions", stats.uniqueSessions());
    store.put("unique_org_ids", stats.uniqueOrgIds());

    ObjectNode org = root.putObject("org_join");
    org.put("reference_available", summary.orgReferenceAvailable());
    org.put("snapshot_count", summary.orgSnapshotCount());
    ObjectNode matches = org.putObject("matches");
    stats.orgMatchCounts().forEach((match, count) -> matches.put(match.name(), count));
    ObjectNode unmatched = org.putObject("top_unmatched_org_ids");
    stats.topUnmatchedOrgIds().forEach(unmatched::put);

    ObjectNode actions = root.putObject("action_types");
    stats.actionCounts().forEach((category, count) -> actions.put(category.label(), count));
    ArrayNode samples = root.putArray("unclassified_sample_labels");
    stats.catchAllSampleLabels().forEach(samples::add);
    ObjectNode linkTypes = root.putObject("link_types");
    stats.linkTypeCounts().forEach(linkTypes::put);

    root.put("content_catalog_size", summary.contentCatalogSize());
    ObjectNode artifacts = root.putObject("artifacts");
    artifacts.put("event_rows", summary.artifacts().eventRows());
    artifacts.put("content_engagement_rows", summary.artifacts().contentEngagementRows());
    return root;
  }
}
