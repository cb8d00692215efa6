package ai.promoted.metrics.engagement.job.enrich;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Optional;

/** Maps snapshot feed columns to the organizational output columns of the event artifact. */
public interface OrgColumns {
  String PREFIX = "org_";
  String DIVISION = "org_division";
  String REGION = "org_region";

  ImmutableMap<String, String> SOURCE_TO_OUTPUT =
      ImmutableMap.<String, String>builder()
          .put("gcrs_division_desc", DIVISION)
          .put("gcrs_unit_desc", "org_unit")
          .put("gcrs_area_desc", "org_area")
          .put("gcrs_sector_desc", "org_sector")
          .put("gcrs_segment_desc", "org_segment")
          .put("gcrs_function_desc", "org_function")
          .put("ou_code", "org_ou_code")
          .put("work_location_country", "org_country")
          .put("work_location_region", REGION)
          .put("job_title", "org_job_title")
          .put("job_family", "org_job_family")
          .put("management_level", "org_management_level")
          .put("cost_center", "org_cost_center")
          .build();

  /** Output columns in artifact order. Always present, null when unmatched. */
  ImmutableList<String> OUTPUT = SOURCE_TO_OUTPUT.values().asList();

  /** The output column for a feed header, or empty if the header is not organizational. */
  static Optional<String> outputColumn(String header) {
    String key = header.trim().toLowerCase(Locale.ROOT);
    if (SOURCE_TO_OUTPUT.containsKey(key)) {
      return Optional.of(SOURCE_TO_OUTPUT.get(key));
    }
    return OUTPUT.contains(key) ? Optional.of(key) : Optional.empty();
  }
}
