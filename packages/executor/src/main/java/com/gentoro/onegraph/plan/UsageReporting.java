package com.gentoro.onegraph.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Usage data attached to a plan by the planner. Carried along untouched; nothing in the
 * executor interprets it.
 */
public record UsageReporting(
    @JsonProperty("statsReportKey") String statsReportKey,
    @JsonProperty("referencedFieldsByType") Map<String, List<String>> referencedFieldsByType) {

  public UsageReporting {
    statsReportKey = statsReportKey == null ? "" : statsReportKey;
    referencedFieldsByType =
        referencedFieldsByType == null ? Map.of() : Map.copyOf(referencedFieldsByType);
  }

  public static UsageReporting empty() {
    return new UsageReporting("", Map.of());
  }
}
