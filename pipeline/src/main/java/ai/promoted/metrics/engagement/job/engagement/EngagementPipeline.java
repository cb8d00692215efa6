package ai.promoted.metrics.engagement.job.engagement;

import ai.promoted.metrics.engagement.common.format.TabularFile;
import ai.promoted.metrics.engagement.common.format.TabularFiles;
import ai.promoted.metrics.engagement.common.functions.ActionClassifier;
import ai.promoted.metrics.engagement.common.records.CanonicalEvent;
import ai.promoted.metrics.engagement.common.records.ContentEngagementRow;
import ai.promoted.metrics.engagement.common.records.EnrichedEvent;
import ai.promoted.metrics.engagement.common.records.ProcessedFileRecord;
import ai.promoted.metrics.engagement.common.table.EngagementStore;
import ai.promoted.metrics.engagement.job.enrich.ContentCatalog;
import ai.promoted.metrics.engagement.job.enrich.ContentCatalogLoader;
import ai.promoted.metrics.engagement.job.enrich.EventEnricher;
import ai.promoted.metrics.engagement.job.enrich.FeatureDeriver;
import ai.promoted.metrics.engagement.job.enrich.OrgSnapshotIndex;
import ai.promoted.metrics.engagement.job.enrich.OrgSnapshotLoader;
import ai.promoted.metrics.engagement.job.export.ArtifactCounts;
import ai.promoted.metrics.engagement.job.export.ArtifactExporter;
import ai.promoted.metrics.engagement.job.export.ContentEngagementAggregator;
import ai.promoted.metrics.engagement.job.ingest.DeltaDetector;
import ai.promoted.metrics.engagement.job.ingest.IngestPlan;
import ai.promoted.metrics.engagement.job.ingest.InputFile;
import ai.promoted.metrics.engagement.job.ingest.InputFileException;
import ai.promoted.metrics.engagement.job.ingest.MergeResult;
import ai.promoted.metrics.engagement.job.ingest.NormalizedFile;
import ai.promoted.metrics.engagement.job.ingest.PlannedFile;
import ai.promoted.metrics.engagement.job.ingest.SchemaNormalizer;
import ai.promoted.metrics.engagement.job.ingest.UpsertEngine;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One incremental run: merge changed exports into the store one file at a time, then rebuild the
 * enriched view and publish the artifacts.
 *
 * <p>Each merged file is one commit. A file that cannot be read, normalized or committed is rolled
 * back and reported as {@link FileStatus#FAILED}; the other files continue. A failed file does not
 * trigger replays of the unchanged files dated after it. Artifacts are rebuilt
 * from the whole store on every run.
 */
public class EngagementPipeline {
  private static final Logger LOGGER = LogManager.getLogger(EngagementPipeline.class);

  private final EngagementStore store;
  private final Clock clock;
  private final SchemaNormalizer normalizer = new SchemaNormalizer();
  private final OrgSnapshotLoader orgSnapshotLoader = new OrgSnapshotLoader();
  private final ContentCatalogLoader contentCatalogLoader = new ContentCatalogLoader();
  private final ContentEngagementAggregator aggregator = new ContentEngagementAggregator();

  public EngagementPipeline(EngagementStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /**
   * @throws IOException when the input directory cannot be scanned, a full reset finds no input
   *     files, or the artifacts cannot be written
   */
  public RunSummary run(PipelineOptions options) throws IOException {
    Instant startedAt = clock.instant();
    DeltaDetector detector = new DeltaDetector(store.manifest());
    ImmutableList<InputFile> files = detector.scan(options.inputDir());
    if (options.fullReset()) {
      if (files.isEmpty()) {
        throw new IOException(
            "Full reset found no input files in " + options.inputDir() + "; the store was kept");
      }
      LOGGER.warn("Full reset: deleting the store and merging all {} input files", files.size());
      store.reset();
      detector = new DeltaDetector(store.manifest());
      files = detector.scan(options.inputDir());
    }

    IngestPlan plan =
        options.forcedFile().isPresent()
            ? detector.planForced(files, options.forcedFile().get())
            : detector.plan(files);
    LOGGER.info(
        "Plan: {} files to merge, {} unchanged files skipped",
        plan.merges().size(),
        plan.skipped().size());

    Map<String, FileOutcome> outcomes = new HashMap<>();
    for (InputFile skipped : plan.skipped()) {
      outcomes.put(skipped.filename(), skippedOutcome(skipped));
    }
    // Replays only run after an earlier-dated file of this run committed.
    boolean committedEarlier = false;
    for (PlannedFile planned : plan.merges()) {
      InputFile file = planned.file();
      if (planned.replay() && !committedEarlier) {
        LOGGER.info("Skipping replay of {}; no earlier-dated file was merged", file.filename());
        outcomes.put(file.filename(), skippedOutcome(file));
        continue;
      }
      FileOutcome outcome = mergeFile(planned);
      committedEarlier |= outcome.status() != FileStatus.FAILED;
      outcomes.put(file.filename(), outcome);
    }

    ImmutableList<CanonicalEvent> events = store.events().scan();
    OrgSnapshotIndex orgSnapshots = orgSnapshotLoader.loadOrUnavailable(options.orgSnapshot());
    ContentCatalog contentCatalog = contentCatalogLoader.loadOrEmpty(options.contentCatalog());
    EventEnricher enricher =
        new EventEnricher(
            new FeatureDeriver(options.reportingZone(), ActionClassifier.withDefaultRules()),
            orgSnapshots,
            contentCatalog);
    ImmutableList<EnrichedEvent> enriched = enricher.enrich(events);
    ImmutableList<ContentEngagementRow> contentRows = aggregator.aggregate(enriched);
    ArtifactCounts artifacts =
        new ArtifactExporter(options.outputDir(), options.compressionCodecName())
            .export(enriched, contentRows);

    return RunSummary.builder()
        .setStartedAt(startedAt)
        .setFinishedAt(clock.instant())
        .setFullReset(options.fullReset())
        .setForcedFile(options.forcedFile().orElse(null))
        .setFiles(
            files.stream()
                .map(file -> outcomes.get(file.filename()))
                .collect(ImmutableList.toImmutableList()))
        .setStatistics(EventStatistics.of(enriched))
        .setOrgReferenceAvailable(orgSnapshots.isAvailable())
        .setOrgSnapshotCount(orgSnapshots.snapshotCount())
        .setContentCatalogSize(contentCatalog.size())
        .setArtifacts(artifacts)
        .build();
  }

  private FileOutcome mergeFile(PlannedFile planned) {
    InputFile file = planned.file();
    FileOutcome.Builder outcome =
        FileOutcome.builder()
            .setFilename(file.filename())
            .setClassification(file.classification());
    try {
      NormalizedFile normalized = normalizer.normalize(read(file), file.filename());
      outcome
          .setRowsRejected(normalized.rejectedRowCount())
          .setCollisions(normalized.collisionCount())
          .setDroppedColumns(normalized.droppedColumns())
          .setPrecisionWarning(normalized.precisionWarning());
      MergeResult merge = new UpsertEngine(store.events()).merge(normalized.events());
      store
          .manifest()
          .record(
              ProcessedFileRecord.create(
                  file.filename(),
                  file.contentHash(),
                  normalized.events().size(),
                  clock.instant(),
                  file.extractedDate()));
      commit(file.filename());
      LOGGER.info(
          "{} {}: {} events loaded, {} replaced, store size {}",
          planned.replay() ? "Replayed" : "Merged",
          file.filename(),
          merge.inserted(),
          merge.replaced(),
          store.events().size());
      return outcome
          .setStatus(planned.replay() ? FileStatus.REPLAYED : FileStatus.PROCESSED)
          .setRowsLoaded(merge.inserted())
          .setRowsReplaced(merge.replaced())
          .build();
    } catch (InputFileException | StoreCommitException e) {
      store.rollback();
      LOGGER.error("Failed to merge {}; it will be retried on the next run", file.filename(), e);
      return outcome.setStatus(FileStatus.FAILED).setFailureReason(e.getMessage()).build();
    } catch (RuntimeException e) {
      store.rollback();
      throw e;
    }
  }

  private static FileOutcome skippedOutcome(InputFile file) {
    return FileOutcome.builder()
        .setFilename(file.filename())
        .setClassification(file.classification())
        .setStatus(FileStatus.SKIPPED)
        .build();
  }

  private static TabularFile read(InputFile file) throws InputFileException {
    try {
      return TabularFiles.read(file.path());
    } catch (IOException e) {
      throw new InputFileException(file.filename(), "Unreadable file: " + e.getMessage(), e);
    }
  }

  private void commit(String filename) throws StoreCommitException {
    try {
      store.commit();
    } catch (IOException e) {
      throw new StoreCommitException(filename, e);
    }
  }
}
