package com.gentoro.onegraph.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onegraph.engine.ExecutionContext;
import com.gentoro.onegraph.engine.ExecutionResult;
import com.gentoro.onegraph.engine.PlanExecutor;
import com.gentoro.onegraph.exception.ExceptionUtil;
import com.gentoro.onegraph.exception.FetchException;
import com.gentoro.onegraph.exception.PlanException;
import com.gentoro.onegraph.graphql.GraphqlError;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import com.gentoro.onegraph.service.ServiceRegistry;
import com.gentoro.onegraph.utility.FutureUtility;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A plan for answering one client request, ready to be executed.
 *
 * <p>JSON form:
 *
 * <pre>{@code
 * {
 *   "node": { "kind": "Sequence", "nodes": [ ... ] },
 *   "usageReporting": { "statsReportKey": "...", "referencedFieldsByType": { ... } }
 * }
 * }</pre>
 *
 * A bare plan node (an object with a {@code kind}) is accepted as well.
 */
public class QueryPlan {
  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(QueryPlan.class);

  private final PlanNode root;
  private final UsageReporting usageReporting;
  private final QueryPlanOptions options;

  public QueryPlan(PlanNode root, UsageReporting usageReporting, QueryPlanOptions options) {
    if (root == null) {
      throw new IllegalArgumentException("Plan root cannot be null");
    }
    this.root = root;
    this.usageReporting = usageReporting == null ? UsageReporting.empty() : usageReporting;
    this.options = options == null ? QueryPlanOptions.defaults() : options;
  }

  public QueryPlan(PlanNode root) {
    this(root, null, null);
  }

  // ─────────────────────────────────────────────────────────────────────────
  // Construction
  // ─────────────────────────────────────────────────────────────────────────

  /**
   * Parse a plan from JSON.
   *
   * @throws PlanException if the JSON is invalid or does not describe a plan
   */
  public static QueryPlan fromJson(String json, QueryPlanOptions options) {
    if (json == null || json.trim().isEmpty()) {
      throw new PlanException("Plan JSON cannot be null or empty");
    }
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(json);
    } catch (JsonProcessingException e) {
      throw new PlanException("Invalid plan JSON: " + e.getOriginalMessage(), e);
    }
    return fromNode(node, options);
  }

  public static QueryPlan fromNode(JsonNode node, QueryPlanOptions options) {
    if (node == null || !node.isObject()) {
      throw new PlanException("Plan must be a JSON object");
    }
    JsonNode rootNode = node.has("kind") ? node : node.get("node");
    if (rootNode == null) {
      throw new PlanException("Plan must have a 'node' field");
    }
    try {
      PlanNode root = PlanNode.Deserializer.fromJson(rootNode);
      UsageReporting usage =
          node.hasNonNull("usageReporting")
              ? JacksonUtility.getJsonMapper()
                  .treeToValue(node.get("usageReporting"), UsageReporting.class)
              : UsageReporting.empty();
      return new QueryPlan(root, usage, options);
    } catch (IOException | IllegalArgumentException e) {
      throw new PlanException("Invalid plan: " + e.getMessage(), e);
    }
  }

  // ─────────────────────────────────────────────────────────────────────────
  // Execution
  // ─────────────────────────────────────────────────────────────────────────

  /**
   * Check that every service the plan fetches from is registered.
   *
   * @return a response carrying one {@code UNKNOWN_SERVICE} error per distinct unknown service,
   *     or empty when the plan can be executed
   */
  public Optional<GraphqlResponse> validate(ServiceRegistry services) {
    Set<String> unknown = new LinkedHashSet<>();
    for (String service : serviceUsage()) {
      if (!services.contains(service)) {
        unknown.add(service);
      }
    }
    if (unknown.isEmpty()) {
      return Optional.empty();
    }
    List<GraphqlError> errors = new ArrayList<>(unknown.size());
    for (String service : unknown) {
      errors.add(FetchException.unknownService(service).toGraphqlError(null));
    }
    log.warn("Plan references unknown services: {}", unknown);
    return Optional.of(GraphqlResponse.ofErrors(errors));
  }

  /**
   * Execute the plan. The returned future completes normally unless it is cancelled; cancelling
   * it aborts the service calls still in flight and stops any remaining sequence steps.
   */
  public CompletableFuture<GraphqlResponse> execute(ExecutionContext context) {
    if (log.isTraceEnabled()) {
      log.trace("Executing query plan:\n{}", JacksonUtility.toPrettyJsonString(root));
    }
    CompletableFuture<ExecutionResult> execution;
    try {
      execution = new PlanExecutor(context, options).execute(root);
    } catch (RuntimeException e) {
      execution = CompletableFuture.failedFuture(e);
    }
    CompletableFuture<GraphqlResponse> response =
        execution
            .thenApply(result -> GraphqlResponse.of(result.value(), result.errors()))
            .exceptionally(
                t -> {
                  log.error("Query plan execution failed", ExceptionUtil.unwrap(t));
                  return GraphqlResponse.ofErrors(
                      List.of(GraphqlError.of(ExceptionUtil.extractErrorMessage(t), null)));
                });
    return FutureUtility.propagateCancellation(response, execution);
  }

  // ─────────────────────────────────────────────────────────────────────────
  // Inspection
  // ─────────────────────────────────────────────────────────────────────────

  public boolean containsMutations() {
    boolean[] found = {false};
    root.forEachFetch(
        fetch -> {
          if (fetch.operationKind() == OperationKind.MUTATION) {
            found[0] = true;
          }
        });
    return found[0];
  }

  /** Service names of every fetch in plan order; duplicates are kept. */
  public List<String> serviceUsage() {
    List<String> services = new ArrayList<>();
    root.forEachFetch(fetch -> services.add(fetch.serviceName()));
    return services;
  }

  public PlanNode getRoot() {
    return root;
  }

  public UsageReporting getUsageReporting() {
    return usageReporting;
  }

  public QueryPlanOptions getOptions() {
    return options;
  }
}
