package com.gentoro.onegraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.exception.ExceptionUtil;
import com.gentoro.onegraph.exception.FetchException;
import com.gentoro.onegraph.exception.OneGraphErrorCode;
import com.gentoro.onegraph.graphql.GraphqlError;
import com.gentoro.onegraph.json.JsonValues;
import com.gentoro.onegraph.json.ResponsePath;
import com.gentoro.onegraph.plan.FetchNode;
import com.gentoro.onegraph.plan.PlanNode;
import com.gentoro.onegraph.plan.QueryPlanOptions;
import com.gentoro.onegraph.utility.FutureUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Interprets a query plan tree.
 *
 * <p>Execution semantics:
 *
 * <ul>
 *   <li>{@code Sequence}: children run one after the other. Each child sees the input merged with
 *       the results of the children before it.
 *   <li>{@code Parallel}: children start together against the same input. Their results are merged
 *       in declared order once all have completed.
 *   <li>{@code Flatten}: the child runs at the current path extended with the flatten path.
 *   <li>{@code Fetch}: delegated to {@link FetchExecutor}. A failing fetch contributes no value and
 *       exactly one error located at the current path.
 * </ul>
 *
 * <p>The input value handed to a node is never modified. One executor serves one request.
 *
 * <p>Cancelling a returned future cancels the in-flight service calls beneath it, and a cancelled
 * {@code Sequence} launches no further steps. Nothing already merged is rolled back.
 */
public class PlanExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(PlanExecutor.class);

  private final FetchExecutor fetchExecutor;

  public PlanExecutor(ExecutionContext context, QueryPlanOptions options) {
    this(new FetchExecutor(context, options));
  }

  PlanExecutor(FetchExecutor fetchExecutor) {
    this.fetchExecutor = fetchExecutor;
  }

  /** Execute {@code root} from the top of the response: empty path, empty object. */
  public CompletableFuture<ExecutionResult> execute(PlanNode root) {
    return execute(root, ResponsePath.empty(), JsonNodeFactory.instance.objectNode());
  }

  public CompletableFuture<ExecutionResult> execute(
      PlanNode node, ResponsePath currentPath, JsonNode parentValue) {
    log.trace("Executing {} at {}", node.kind(), currentPath);
    if (node instanceof PlanNode.Sequence sequence) {
      return executeSequence(sequence, currentPath, parentValue);
    } else if (node instanceof PlanNode.Parallel parallel) {
      return executeParallel(parallel, currentPath, parentValue);
    } else if (node instanceof PlanNode.Flatten flatten) {
      return execute(flatten.node(), currentPath.join(flatten.path()), parentValue);
    } else if (node instanceof PlanNode.Fetch fetch) {
      return executeFetch(fetch.fetch(), currentPath, parentValue);
    }
    throw new IllegalStateException("Unsupported plan node: " + node);
  }

  private CompletableFuture<ExecutionResult> executeSequence(
      PlanNode.Sequence sequence, ResponsePath currentPath, JsonNode parentValue) {
    Accumulator accumulator =
        new Accumulator(parentValue == null ? JsonValues.empty() : parentValue.deepCopy());
    AtomicBoolean cancelled = new AtomicBoolean();
    AtomicReference<CompletableFuture<ExecutionResult>> running = new AtomicReference<>();
    CompletableFuture<Accumulator> chain = CompletableFuture.completedFuture(accumulator);
    for (PlanNode child : sequence.nodes()) {
      chain =
          chain.thenCompose(
              acc -> {
                if (cancelled.get()) {
                  throw new CancellationException("Sequence cancelled before " + child.kind());
                }
                CompletableFuture<ExecutionResult> step = execute(child, currentPath, acc.value);
                running.set(step);
                if (cancelled.get()) {
                  step.cancel(true);
                }
                return step.thenApply(acc::merge);
              });
    }
    CompletableFuture<ExecutionResult> result = chain.thenApply(Accumulator::toResult);
    result.whenComplete(
        (r, t) -> {
          if (result.isCancelled()) {
            cancelled.set(true);
            CompletableFuture<ExecutionResult> step = running.get();
            if (step != null) {
              step.cancel(true);
            }
          }
        });
    return result;
  }

  private CompletableFuture<ExecutionResult> executeParallel(
      PlanNode.Parallel parallel, ResponsePath currentPath, JsonNode parentValue) {
    List<CompletableFuture<ExecutionResult>> branches = new ArrayList<>(parallel.nodes().size());
    for (PlanNode child : parallel.nodes()) {
      branches.add(execute(child, currentPath, parentValue));
    }
    return FutureUtility.propagateCancellation(
        CompletableFuture.allOf(branches.toArray(new CompletableFuture<?>[0]))
            .thenApply(
                ignored -> {
                  Accumulator accumulator = new Accumulator(JsonValues.empty());
                  for (CompletableFuture<ExecutionResult> branch : branches) {
                    accumulator.merge(branch.join());
                  }
                  return accumulator.toResult();
                }),
        branches);
  }

  private CompletableFuture<ExecutionResult> executeFetch(
      FetchNode fetch, ResponsePath currentPath, JsonNode parentValue) {
    CompletableFuture<ExecutionResult> call;
    try {
      call = fetchExecutor.execute(fetch, currentPath, parentValue);
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }
    return FutureUtility.propagateCancellation(
        call.handle(
            (result, failure) -> {
              if (failure == null) {
                return result;
              }
              return ExecutionResult.failed(toGraphqlError(fetch, currentPath, failure));
            }),
        call);
  }

  private static GraphqlError toGraphqlError(
      FetchNode fetch, ResponsePath currentPath, Throwable failure) {
    Throwable cause = ExceptionUtil.unwrap(failure);
    if (cause instanceof FetchException fetchException) {
      log.warn("Fetch error at {}: {}", currentPath, fetchException.getMessage());
      return fetchException.toGraphqlError(currentPath);
    }
    log.warn(
        "Fetch from '{}' at {} failed unexpectedly: {}",
        fetch.serviceName(),
        currentPath,
        ExceptionUtil.formatCompactStackTrace(cause),
        cause);
    ObjectNode extensions = JsonNodeFactory.instance.objectNode();
    extensions.put("code", OneGraphErrorCode.EXECUTION_ERROR.name());
    extensions.put("service", fetch.serviceName());
    return new GraphqlError(
        "Fetch error: " + ExceptionUtil.extractErrorMessage(cause),
        currentPath,
        List.of(),
        extensions);
  }

  /** Value and errors gathered by a Sequence or Parallel node. */
  private static final class Accumulator {
    private JsonNode value;
    private final List<GraphqlError> errors = new ArrayList<>();

    Accumulator(JsonNode value) {
      this.value = value;
    }

    Accumulator merge(ExecutionResult result) {
      value = JsonValues.deepMerge(value, result.value());
      errors.addAll(result.errors());
      return this;
    }

    ExecutionResult toResult() {
      return new ExecutionResult(value, errors);
    }
  }
}
