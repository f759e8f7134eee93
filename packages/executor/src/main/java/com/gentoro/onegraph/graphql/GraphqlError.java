package com.gentoro.onegraph.graphql;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.json.ResponsePath;
import java.util.List;

/**
 * An entry of the {@code errors} array of a GraphQL response.
 *
 * @param message human readable description
 * @param path location in the response the error applies to; {@code null} when not tied to a
 *     field
 * @param locations positions in the operation text; may be empty
 * @param extensions free-form details such as {@code code} or {@code service}; may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GraphqlError(
    @JsonProperty("message") String message,
    @JsonProperty("path") @JsonInclude(JsonInclude.Include.NON_NULL) ResponsePath path,
    @JsonProperty("locations") List<Location> locations,
    @JsonProperty("extensions") ObjectNode extensions) {

  public GraphqlError {
    message = message == null ? "" : message;
    locations = locations == null ? List.of() : List.copyOf(locations);
  }

  public static GraphqlError of(String message, ResponsePath path) {
    return new GraphqlError(message, path, List.of(), null);
  }

  public GraphqlError withPath(ResponsePath newPath) {
    return new GraphqlError(message, newPath, locations, extensions);
  }
}
