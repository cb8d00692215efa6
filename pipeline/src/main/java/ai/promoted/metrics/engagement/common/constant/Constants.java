package ai.promoted.metrics.engagement.common.constant;

/** Utility containing useful constants. */
public interface Constants {

  // Reporting timezone for local dates, hours and sessions.
  String DEFAULT_REPORTING_TIME_ZONE = "Europe/Berlin";

  // Persisted store layout.  Both files are Avro container files.
  String EVENTS_STORE_FILE = "events.avro";
  String MANIFEST_STORE_FILE = "processed_files.avro";

  // Output artifacts.  Downstream dashboards read these paths.
  String EVENTS_ARTIFACT_FILE = "events_raw.parquet";
  String CONTENT_ARTIFACT_FILE = "events_story.parquet";

  // Artifacts are written here first and then moved into place.
  String IN_PROGRESS_PREFIX = ".";
  String IN_PROGRESS_SUFFIX = ".inprogress";

  /**
   * Width of a normalized organizational identifier. Spreadsheet exports turn the identifier into
   * a number, which drops leading zeros and can add a trailing ".0".
   */
  int ORG_ID_WIDTH = 8;
}
