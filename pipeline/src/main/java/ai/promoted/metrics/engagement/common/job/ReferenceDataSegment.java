package ai.promoted.metrics.engagement.common.job;

import ai.promoted.metrics.engagement.common.constant.Constants;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;
import picocli.CommandLine.Option;

/** Reference feeds used for enrichment and the reporting timezone. */
public class ReferenceDataSegment implements JobSegment {

  @Option(
      names = {"--orgSnapshot"},
      defaultValue = "",
      description =
          "Organizational snapshot feed (.parquet or .csv).  Without it, org columns stay empty.")
  public String orgSnapshot = "";

  @Option(
      names = {"--contentCatalog"},
      defaultValue = "",
      description = "Optional content catalog with titles (.csv, .xlsx or .parquet).")
  public String contentCatalog = "";

  @Option(
      names = {"--reportingTimeZone"},
      defaultValue = Constants.DEFAULT_REPORTING_TIME_ZONE,
      description = "IANA timezone for local dates and hours.  Default=Europe/Berlin")
  public String reportingTimeZone = Constants.DEFAULT_REPORTING_TIME_ZONE;

  @Override
  public void validateArgs() {
    try {
      ZoneId.of(reportingTimeZone);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException(
          "--reportingTimeZone is not a valid timezone: " + reportingTimeZone, e);
    }
  }

  public ZoneId getReportingZone() {
    return ZoneId.of(reportingTimeZone);
  }

  public Optional<Path> getOrgSnapshot() {
    return orgSnapshot.isBlank() ? Optional.empty() : Optional.of(Paths.get(orgSnapshot));
  }

  public Optional<Path> getContentCatalog() {
    return contentCatalog.isBlank() ? Optional.empty() : Optional.of(Paths.get(contentCatalog));
  }
}
