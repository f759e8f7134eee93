package com.gentoro.onegraph.engine;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.gentoro.onegraph.json.ResponsePath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The batch of representations sent by one entity fetch, together with the response paths each
 * batch slot belongs to. Lives only for the duration of that fetch.
 */
public final class Representations {

  private final ArrayNode batch;
  private final Map<ResponsePath, Integer> pathIndexes;
  private final List<List<ResponsePath>> invertedPaths;

  Representations(ArrayNode batch, Map<ResponsePath, Integer> pathIndexes) {
    this.batch = batch;
    this.pathIndexes = Collections.unmodifiableMap(pathIndexes);
    List<List<ResponsePath>> inverted = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      inverted.add(new ArrayList<>());
    }
    pathIndexes.forEach((path, index) -> inverted.get(index).add(path));
    this.invertedPaths = inverted;
  }

  /** Representations in discovery order. */
  public ArrayNode batch() {
    return batch;
  }

  /** Every matched response path mapped to its batch slot, in discovery order. */
  public Map<ResponsePath, Integer> pathIndexes() {
    return pathIndexes;
  }

  /** Response paths sharing slot {@code index}, in discovery order; empty if out of range. */
  public List<ResponsePath> pathsAt(int index) {
    if (index < 0 || index >= invertedPaths.size()) {
      return List.of();
    }
    return Collections.unmodifiableList(invertedPaths.get(index));
  }

  public int size() {
    return batch.size();
  }
}
