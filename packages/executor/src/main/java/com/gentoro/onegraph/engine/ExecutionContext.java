package com.gentoro.onegraph.engine;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.selection.SelectionMatcher;
import com.gentoro.onegraph.selection.SelectionSetMatcher;
import com.gentoro.onegraph.service.ServiceRegistry;

/**
 * Per-request inputs of an execution.
 *
 * @param variables variables of the client request; fetches forward the ones they use
 * @param services services the plan fetches from
 * @param selectionMatcher projects response objects to representations
 */
public record ExecutionContext(
    ObjectNode variables, ServiceRegistry services, SelectionMatcher selectionMatcher) {

  public ExecutionContext {
    if (services == null) {
      throw new IllegalArgumentException("ServiceRegistry cannot be null");
    }
    variables = variables == null ? JsonNodeFactory.instance.objectNode() : variables;
    selectionMatcher = selectionMatcher == null ? new SelectionSetMatcher() : selectionMatcher;
  }

  public ExecutionContext(ObjectNode variables, ServiceRegistry services) {
    this(variables, services, null);
  }
}
