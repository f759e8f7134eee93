package com.gentoro.onegraph.selection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an object of the response satisfies a fetch's required selections and, if so,
 * projects it to the representation sent to the service.
 */
@FunctionalInterface
public interface SelectionMatcher {

  /**
   * @return the projected representation, or empty when the object does not match (for example
   *     it is of another type or lacks a required field)
   */
  Optional<JsonNode> matches(ObjectNode candidate, List<Selection> requires);
}
