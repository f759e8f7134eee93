package com.gentoro.onegraph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.exception.ConfigurationException;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import com.gentoro.onegraph.plan.QueryPlan;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Executes one plan and prints the response:
 *
 * <pre>
 * OneGraphApp --config application.yaml --plan plan.json [--variables variables.json]
 * </pre>
 */
public class OneGraphApp {

  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(OneGraphApp.class);

  public static void main(String[] args) {
    OneGraph app = null;
    try {
      app = new OneGraph(args);
      app.initialize();
      String planFile = app.startupParameters().getParameter("plan", String.class);
      if (planFile == null) {
        throw new ConfigurationException("Missing required parameter --plan");
      }
      QueryPlan plan = app.loadPlan(Path.of(planFile));
      ObjectNode variables =
          readVariables(app.startupParameters().getParameter("variables", String.class));
      GraphqlResponse response = app.execute(plan, variables).join();
      System.out.println(JacksonUtility.toPrettyJsonString(response));
    } catch (Exception e) {
      log.error("Plan execution failed", e);
      System.exit(1);
    } finally {
      if (app != null) {
        app.shutdown();
      }
    }
  }

  private static ObjectNode readVariables(String file) {
    if (file == null) {
      return null;
    }
    try {
      JsonNode node = JacksonUtility.getJsonMapper().readTree(Path.of(file).toFile());
      if (!(node instanceof ObjectNode variables)) {
        throw new ConfigurationException("Variables file must contain a JSON object: " + file);
      }
      return variables;
    } catch (IOException e) {
      throw new ConfigurationException("Could not read variables file " + file, e);
    }
  }
}
