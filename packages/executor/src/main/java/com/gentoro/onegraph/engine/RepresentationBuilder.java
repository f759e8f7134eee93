package com.gentoro.onegraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.json.JsonValues;
import com.gentoro.onegraph.json.PathValue;
import com.gentoro.onegraph.json.ResponsePath;
import com.gentoro.onegraph.selection.Selection;
import com.gentoro.onegraph.selection.SelectionMatcher;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the representations an entity fetch sends.
 *
 * <p>Every object found under the current path is projected through the fetch's required
 * selections. With deduplication on, equal projections share one batch slot; otherwise each
 * matched object gets its own. Slots are numbered in discovery order.
 */
public class RepresentationBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(RepresentationBuilder.class);

  private final SelectionMatcher matcher;

  public RepresentationBuilder(SelectionMatcher matcher) {
    if (matcher == null) {
      throw new IllegalArgumentException("SelectionMatcher cannot be null");
    }
    this.matcher = matcher;
  }

  /**
   * @return the batch, or empty when no object under {@code currentPath} matches {@code requires}
   */
  public Optional<Representations> build(
      List<Selection> requires, JsonNode data, ResponsePath currentPath, boolean deduplicate) {
    ArrayNode batch = JsonNodeFactory.instance.arrayNode();
    Map<ResponsePath, Integer> pathIndexes = new LinkedHashMap<>();
    Map<JsonNode, Integer> seen = new HashMap<>();

    List<PathValue> candidates = JsonValues.selectValuesAndPaths(data, currentPath);
    for (PathValue candidate : candidates) {
      if (!(candidate.value() instanceof ObjectNode object)) {
        continue;
      }
      Optional<JsonNode> projected = matcher.matches(object, requires);
      if (projected.isEmpty()) {
        continue;
      }
      JsonNode representation = projected.get();
      Integer index = deduplicate ? seen.get(representation) : null;
      if (index == null) {
        index = batch.size();
        batch.add(representation);
        if (deduplicate) {
          seen.put(representation, index);
        }
      }
      pathIndexes.put(candidate.path(), index);
    }

    log.trace(
        "Built {} representation(s) for {} matched path(s) under {} out of {} candidate(s)",
        batch.size(),
        pathIndexes.size(),
        currentPath,
        candidates.size());
    return batch.isEmpty() ? Optional.empty() : Optional.of(new Representations(batch, pathIndexes));
  }
}
