package com.gentoro.onegraph.graphql;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.json.ResponsePath;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * A GraphQL response: the {@code data} tree and the {@code errors} list.
 *
 * <p>A response that carries a {@code path} is an incremental patch (a deferred chunk) rather than
 * the primary response of a request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphqlResponse(
    @JsonProperty("data") JsonNode data,
    @JsonProperty("errors") List<GraphqlError> errors,
    @JsonProperty("extensions") ObjectNode extensions,
    @JsonProperty("path") ResponsePath path) {

  public GraphqlResponse {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static GraphqlResponse of(JsonNode data, List<GraphqlError> errors) {
    return new GraphqlResponse(data, errors, null, null);
  }

  public static GraphqlResponse ofData(JsonNode data) {
    return new GraphqlResponse(data, List.of(), null, null);
  }

  public static GraphqlResponse ofErrors(List<GraphqlError> errors) {
    return new GraphqlResponse(null, errors, null, null);
  }

  @JsonIgnore
  public boolean isPrimary() {
    return path == null;
  }

  @JsonProperty("errors")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public List<GraphqlError> errors() {
    return errors;
  }

  /**
   * Decode a response body. Unknown members are ignored; a missing {@code errors} member yields an
   * empty list.
   */
  public static GraphqlResponse fromJson(String body) throws JsonProcessingException {
    JsonNode root = JacksonUtility.getJsonMapper().readTree(body);
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("GraphQL response must be a JSON object");
    }
    List<GraphqlError> errors = new ArrayList<>();
    JsonNode errorsNode = root.get("errors");
    if (errorsNode != null && errorsNode.isArray()) {
      for (JsonNode e : errorsNode) {
        errors.add(JacksonUtility.getJsonMapper().treeToValue(e, GraphqlError.class));
      }
    }
    JsonNode extensions = root.get("extensions");
    JsonNode path = root.get("path");
    return new GraphqlResponse(
        root.get("data"),
        errors,
        extensions instanceof ObjectNode o ? o : null,
        path == null || path.isNull() ? null : ResponsePath.fromJson(path));
  }

  public String toJson() {
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize response", e);
    }
  }
}
