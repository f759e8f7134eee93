package com.gentoro.onegraph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.engine.ExecutionContext;
import com.gentoro.onegraph.exception.ConfigurationException;
import com.gentoro.onegraph.exception.PlanException;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import com.gentoro.onegraph.plan.QueryPlan;
import com.gentoro.onegraph.plan.QueryPlanOptions;
import com.gentoro.onegraph.selection.SelectionSetMatcher;
import com.gentoro.onegraph.service.HttpServiceEndpoint;
import com.gentoro.onegraph.service.OkHttpFactory;
import com.gentoro.onegraph.service.ServiceRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Wires configuration, logging and the configured services together. */
public class OneGraph {

  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(OneGraph.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private OkHttpClient httpClient;
  private ServiceRegistry serviceRegistry;
  private QueryPlanOptions queryPlanOptions;

  public OneGraph(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs));
  }

  public OneGraph(StartupParameters startupParameters) {
    this.startupParameters = startupParameters;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.onegraph.logging.LoggingService.applyConfiguration(configuration());

    this.httpClient = OkHttpFactory.create(configuration());
    this.serviceRegistry = new ServiceRegistry();
    for (Map.Entry<String, String> service : configurationProvider.services().entrySet()) {
      try {
        serviceRegistry.register(
            service.getKey(),
            new HttpServiceEndpoint(service.getKey(), service.getValue(), httpClient));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(e.getMessage(), e);
      }
      log.info("Registered service '{}' at {}", service.getKey(), service.getValue());
    }
    this.queryPlanOptions = QueryPlanOptions.fromConfiguration(configuration());
    log.debug(
        "Variable deduplication {}",
        queryPlanOptions.enableVariableDeduplication() ? "enabled" : "disabled");
  }

  public QueryPlan loadPlan(Path planFile) {
    try {
      return QueryPlan.fromJson(
          Files.readString(planFile, StandardCharsets.UTF_8), queryPlanOptions);
    } catch (IOException e) {
      throw new PlanException("Could not read plan file " + planFile, e);
    }
  }

  /**
   * Validate the plan against the configured services, then execute it. A plan that references
   * unknown services is not executed.
   */
  public CompletableFuture<GraphqlResponse> execute(QueryPlan plan, ObjectNode variables) {
    Optional<GraphqlResponse> early = plan.validate(serviceRegistry);
    if (early.isPresent()) {
      return CompletableFuture.completedFuture(early.get());
    }
    return plan.execute(
        new ExecutionContext(variables, serviceRegistry, new SelectionSetMatcher()));
  }

  public void shutdown() {
    if (httpClient != null) {
      httpClient.dispatcher().executorService().shutdown();
      httpClient.connectionPool().evictAll();
    }
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ServiceRegistry serviceRegistry() {
    return serviceRegistry;
  }

  public QueryPlanOptions queryPlanOptions() {
    return queryPlanOptions;
  }
}
