package com.gentoro.onegraph.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.onegraph.selection.Selection;
import java.util.List;

/**
 * A single call to a service.
 *
 * @param serviceName registry name of the service to call
 * @param requires selections identifying the entities to resolve; empty for a root fetch
 * @param variableUsages names of the request variables forwarded to the service
 * @param operation GraphQL operation text sent to the service
 * @param operationName optional operation name
 * @param operationKind query, mutation or subscription
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchNode(
    @JsonProperty("serviceName") String serviceName,
    @JsonProperty("requires") List<Selection> requires,
    @JsonProperty("variableUsages") List<String> variableUsages,
    @JsonProperty("operation") String operation,
    @JsonProperty("operationName") String operationName,
    @JsonProperty("operationKind") OperationKind operationKind) {

  public FetchNode {
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalArgumentException("fetch serviceName must not be blank");
    }
    requires = requires == null ? List.of() : List.copyOf(requires);
    variableUsages = variableUsages == null ? List.of() : List.copyOf(variableUsages);
    operation = operation == null ? "" : operation;
    operationKind = operationKind == null ? OperationKind.QUERY : operationKind;
  }

  public static FetchNode root(String serviceName, String operation, List<String> variableUsages) {
    return new FetchNode(serviceName, List.of(), variableUsages, operation, null, null);
  }

  public static FetchNode entities(
      String serviceName, List<Selection> requires, String operation, List<String> variableUsages) {
    return new FetchNode(serviceName, requires, variableUsages, operation, null, null);
  }

  /** A fetch with required selections resolves entities through {@code _entities}. */
  @JsonIgnore
  public boolean isEntityFetch() {
    return !requires.isEmpty();
  }
}
