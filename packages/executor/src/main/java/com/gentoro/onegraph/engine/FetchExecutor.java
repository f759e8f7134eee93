package com.gentoro.onegraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.exception.FetchException;
import com.gentoro.onegraph.graphql.GraphqlError;
import com.gentoro.onegraph.graphql.GraphqlRequest;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import com.gentoro.onegraph.json.JsonValues;
import com.gentoro.onegraph.json.PathElement;
import com.gentoro.onegraph.json.ResponsePath;
import com.gentoro.onegraph.plan.FetchNode;
import com.gentoro.onegraph.plan.QueryPlanOptions;
import com.gentoro.onegraph.service.ServiceEndpoint;
import com.gentoro.onegraph.utility.FutureUtility;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Executes one {@link FetchNode} at a location of the response.
 *
 * <p>A root fetch (no {@code requires}) sends the request variables it uses and places the
 * returned {@code data} at the current path. An entity fetch collects representations of the
 * objects under the current path, sends them as the {@code representations} variable, and writes
 * each returned entity back to every path that shares its batch slot.
 *
 * <p>The returned value is a fresh tree holding only what the fetch contributes; the input value
 * is never modified. Failures that prevent the fetch from producing data complete the future with
 * a {@link FetchException}. Cancelling the returned future cancels the service call.
 */
public class FetchExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(FetchExecutor.class);

  static final String REPRESENTATIONS = "representations";
  static final String ENTITIES = "_entities";

  private final ExecutionContext context;
  private final QueryPlanOptions options;
  private final RepresentationBuilder representationBuilder;

  public FetchExecutor(ExecutionContext context, QueryPlanOptions options) {
    if (context == null) {
      throw new IllegalArgumentException("ExecutionContext cannot be null");
    }
    this.context = context;
    this.options = options == null ? QueryPlanOptions.defaults() : options;
    this.representationBuilder = new RepresentationBuilder(context.selectionMatcher());
  }

  public CompletableFuture<ExecutionResult> execute(
      FetchNode fetch, ResponsePath currentPath, JsonNode data) {
    try {
      return fetch.isEntityFetch()
          ? executeEntityFetch(fetch, currentPath, data)
          : executeRootFetch(fetch, currentPath, data);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  // ─────────────────────────────────────────────────────────────────────────
  // Root fetch
  // ─────────────────────────────────────────────────────────────────────────

  private CompletableFuture<ExecutionResult> executeRootFetch(
      FetchNode fetch, ResponsePath currentPath, JsonNode data) {
    if (!currentPath.isEmpty() && JsonValues.selectValuesAndPaths(data, currentPath).isEmpty()) {
      log.debug(
          "Skipping fetch from '{}' at {}: nothing to resolve", fetch.serviceName(), currentPath);
      return CompletableFuture.completedFuture(ExecutionResult.of(JsonValues.empty()));
    }
    ServiceEndpoint endpoint = context.services().lookup(fetch.serviceName());
    GraphqlRequest request =
        new GraphqlRequest(fetch.operation(), fetch.operationName(), selectVariables(fetch));
    log.debug("Fetching from '{}' at {}", fetch.serviceName(), currentPath);
    CompletableFuture<GraphqlResponse> call = endpoint.call(request);
    return FutureUtility.propagateCancellation(
        call.thenApply(response -> rootResponseAtPath(fetch, currentPath, request, response)),
        call);
  }

  private ExecutionResult rootResponseAtPath(
      FetchNode fetch, ResponsePath currentPath, GraphqlRequest request, GraphqlResponse response) {
    traceSubfetch(fetch, request, response);
    requirePrimary(fetch, response);

    ResponsePath target = currentPath.withoutTrailingFlatten();
    List<GraphqlError> errors = new ArrayList<>(response.errors().size());
    for (GraphqlError error : response.errors()) {
      errors.add(error.path() == null ? error : error.withPath(target.join(error.path())));
    }
    if (JsonValues.isAbsent(response.data())) {
      return new ExecutionResult(JsonValues.empty(), errors);
    }
    try {
      return new ExecutionResult(JsonValues.fromPath(target, response.data()), errors);
    } catch (IllegalArgumentException e) {
      throw FetchException.invalidContent(fetch.serviceName(), e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────
  // Entity fetch
  // ─────────────────────────────────────────────────────────────────────────

  private CompletableFuture<ExecutionResult> executeEntityFetch(
      FetchNode fetch, ResponsePath currentPath, JsonNode data) {
    Optional<Representations> built =
        representationBuilder.build(
            fetch.requires(), data, currentPath, options.enableVariableDeduplication());
    if (built.isEmpty()) {
      log.debug(
          "Skipping fetch from '{}' at {}: no matching representations",
          fetch.serviceName(),
          currentPath);
      return CompletableFuture.completedFuture(
          ExecutionResult.of(data == null ? JsonValues.empty() : data.deepCopy()));
    }
    Representations representations = built.get();
    ServiceEndpoint endpoint = context.services().lookup(fetch.serviceName());

    ObjectNode variables = selectVariables(fetch);
    variables.set(REPRESENTATIONS, representations.batch());
    GraphqlRequest request = new GraphqlRequest(fetch.operation(), fetch.operationName(), variables);
    log.debug(
        "Fetching {} representation(s) from '{}' at {}",
        representations.size(),
        fetch.serviceName(),
        currentPath);
    CompletableFuture<GraphqlResponse> call = endpoint.call(request);
    return FutureUtility.propagateCancellation(
        call.thenApply(
            response -> entityResponseAtPath(fetch, currentPath, representations, request, response)),
        call);
  }

  private ExecutionResult entityResponseAtPath(
      FetchNode fetch,
      ResponsePath currentPath,
      Representations representations,
      GraphqlRequest request,
      GraphqlResponse response) {
    traceSubfetch(fetch, request, response);
    requirePrimary(fetch, response);

    List<GraphqlError> errors = new ArrayList<>();
    for (GraphqlError error : response.errors()) {
      errors.addAll(rebaseEntityError(error, currentPath, representations));
    }

    JsonNode entities = JsonValues.isAbsent(response.data()) ? null : response.data().get(ENTITIES);
    if (entities == null && !errors.isEmpty()) {
      // the service failed the whole request and said why
      return new ExecutionResult(JsonValues.empty(), errors);
    }
    if (entities == null) {
      throw FetchException.malformedResponse(
          fetch.serviceName(), "missing key `" + ENTITIES + "`");
    }
    if (!entities.isArray()) {
      throw FetchException.malformedResponse(
          fetch.serviceName(), "`" + ENTITIES + "` is not an array");
    }
    if (entities.size() != representations.size()) {
      throw FetchException.malformedResponse(
          fetch.serviceName(),
          "expected %d entities, received %d".formatted(representations.size(), entities.size()));
    }

    JsonNode value = JsonValues.empty();
    try {
      for (int index = 0; index < entities.size(); index++) {
        JsonNode entity = entities.get(index);
        List<ResponsePath> paths = representations.pathsAt(index);
        for (int i = 0; i < paths.size(); i++) {
          value = JsonValues.insertAt(value, paths.get(i), i == 0 ? entity : entity.deepCopy());
        }
      }
    } catch (IllegalArgumentException e) {
      throw FetchException.invalidContent(fetch.serviceName(), e.getMessage());
    }
    return new ExecutionResult(value, errors);
  }

  /**
   * An error under {@code _entities/<i>} is copied to every response path that shared slot
   * {@code i}. Locations refer to the service's operation and are dropped.
   */
  private static List<GraphqlError> rebaseEntityError(
      GraphqlError error, ResponsePath currentPath, Representations representations) {
    ResponsePath path = error.path();
    GraphqlError stripped =
        new GraphqlError(error.message(), path, List.of(), error.extensions());
    if (path == null) {
      return List.of(stripped);
    }
    if (path.size() >= 2
        && path.get(0) instanceof PathElement.Key key
        && ENTITIES.equals(key.name())
        && path.get(1) instanceof PathElement.Index index) {
      List<ResponsePath> targets = representations.pathsAt(index.value());
      if (!targets.isEmpty()) {
        ResponsePath rest = path.subPath(2);
        List<GraphqlError> out = new ArrayList<>(targets.size());
        for (ResponsePath target : targets) {
          out.add(stripped.withPath(target.join(rest)));
        }
        return out;
      }
      return List.of(stripped.withPath(currentPath));
    }
    return List.of(stripped.withPath(currentPath.join(path)));
  }

  // ─────────────────────────────────────────────────────────────────────────
  // Helpers
  // ─────────────────────────────────────────────────────────────────────────

  private ObjectNode selectVariables(FetchNode fetch) {
    ObjectNode selected = JsonNodeFactory.instance.objectNode();
    for (String name : fetch.variableUsages()) {
      JsonNode value = context.variables().get(name);
      if (value != null) {
        selected.set(name, value);
      }
    }
    return selected;
  }

  private static void requirePrimary(FetchNode fetch, GraphqlResponse response) {
    if (!response.isPrimary()) {
      throw FetchException.unexpectedPatchResponse(fetch.serviceName());
    }
  }

  private static void traceSubfetch(
      FetchNode fetch, GraphqlRequest request, GraphqlResponse response) {
    if (log.isTraceEnabled()) {
      log.trace(
          "Fetch from '{}'\nOperation:\n{}\nVariables: {}\nResponse: {}",
          fetch.serviceName(),
          fetch.operation(),
          JacksonUtility.toJsonString(request.variables()),
          JacksonUtility.toPrettyJsonString(response));
    }
  }
}
