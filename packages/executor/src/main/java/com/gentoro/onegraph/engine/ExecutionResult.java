package com.gentoro.onegraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onegraph.graphql.GraphqlError;
import com.gentoro.onegraph.json.JsonValues;
import java.util.List;

/**
 * Outcome of executing a plan node: the value it contributes and the errors it produced.
 *
 * @param value contribution to the response tree; JSON {@code null} when there is none
 * @param errors errors with absolute paths
 */
public record ExecutionResult(JsonNode value, List<GraphqlError> errors) {

  public ExecutionResult {
    value = value == null ? JsonValues.empty() : value;
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static ExecutionResult of(JsonNode value) {
    return new ExecutionResult(value, List.of());
  }

  public static ExecutionResult failed(GraphqlError error) {
    return new ExecutionResult(JsonValues.empty(), List.of(error));
  }
}
