package com.gentoro.onegraph.graphql;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** The body sent to a subgraph: operation text, optional operation name and variables. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphqlRequest(
    @JsonProperty("query") String query,
    @JsonProperty("operationName") String operationName,
    @JsonProperty("variables") ObjectNode variables) {

  public GraphqlRequest {
    variables = variables == null ? JsonNodeFactory.instance.objectNode() : variables;
  }
}
