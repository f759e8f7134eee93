package com.gentoro.onegraph.plan;

import org.apache.commons.configuration2.Configuration;

/**
 * Execution switches of a plan.
 *
 * @param enableVariableDeduplication send each distinct representation only once per fetch
 */
public record QueryPlanOptions(boolean enableVariableDeduplication) {

  public static final String DEDUPLICATION_KEY = "execution.enable-variable-deduplication";

  public static QueryPlanOptions defaults() {
    return new QueryPlanOptions(true);
  }

  public static QueryPlanOptions fromConfiguration(Configuration configuration) {
    if (configuration == null) {
      return defaults();
    }
    return new QueryPlanOptions(configuration.getBoolean(DEDUPLICATION_KEY, true));
  }
}
