package com.gentoro.onegraph.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.gentoro.onegraph.json.ResponsePath;
import com.gentoro.onegraph.selection.Selection;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Node of a query plan tree.
 *
 * <p>Four kinds of nodes, discriminated by {@code kind} in JSON:
 *
 * <ol>
 *   <li>{@code Sequence}: children run one after the other, each seeing the previous results.
 *   <li>{@code Parallel}: children run concurrently against the same input.
 *   <li>{@code Fetch}: one service call, see {@link FetchNode}.
 *   <li>{@code Flatten}: runs its child at {@code path} relative to the current location.
 * </ol>
 */
@JsonDeserialize(using = PlanNode.Deserializer.class)
public sealed interface PlanNode {

  @JsonProperty("kind")
  String kind();

  static Sequence sequence(PlanNode... nodes) {
    return new Sequence(List.of(nodes));
  }

  static Parallel parallel(PlanNode... nodes) {
    return new Parallel(List.of(nodes));
  }

  static Fetch fetch(FetchNode fetch) {
    return new Fetch(fetch);
  }

  static Flatten flatten(ResponsePath path, PlanNode node) {
    return new Flatten(path, node);
  }

  /** Visit every fetch of the tree in plan order. */
  default void forEachFetch(Consumer<FetchNode> visitor) {
    if (this instanceof Sequence sequence) {
      sequence.nodes().forEach(n -> n.forEachFetch(visitor));
    } else if (this instanceof Parallel parallel) {
      parallel.nodes().forEach(n -> n.forEachFetch(visitor));
    } else if (this instanceof Flatten flatten) {
      flatten.node().forEachFetch(visitor);
    } else if (this instanceof Fetch fetch) {
      visitor.accept(fetch.fetch());
    }
  }

  /** Custom deserializer for the {@code kind} discriminated union. */
  class Deserializer extends JsonDeserializer<PlanNode> {
    @Override
    public PlanNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = p.getCodec().readTree(p);
      return fromJson(node);
    }

    public static PlanNode fromJson(JsonNode node) throws IOException {
      if (node == null || !node.isObject()) {
        throw new IOException("Plan node must be a JSON object");
      }
      if (!node.has("kind")) {
        throw new IOException("Plan node must have 'kind' field");
      }
      String kind = node.get("kind").asText();
      switch (kind) {
        case "Sequence":
          return new Sequence(readNodes(node.get("nodes"), kind));
        case "Parallel":
          return new Parallel(readNodes(node.get("nodes"), kind));
        case "Flatten":
          {
            ResponsePath path;
            try {
              path = ResponsePath.fromJson(node.get("path"));
            } catch (IllegalArgumentException e) {
              throw new IOException("Invalid Flatten path: " + e.getMessage(), e);
            }
            if (!node.has("node")) {
              throw new IOException("Flatten node must have 'node' field");
            }
            return new Flatten(path, fromJson(node.get("node")));
          }
        case "Fetch":
          return new Fetch(readFetch(node));
        default:
          throw new IOException("Unknown plan node kind '" + kind + "'");
      }
    }

    private static List<PlanNode> readNodes(JsonNode array, String kind) throws IOException {
      if (array == null || !array.isArray()) {
        throw new IOException(kind + " node must have a 'nodes' array");
      }
      List<PlanNode> out = new ArrayList<>(array.size());
      for (JsonNode child : array) {
        out.add(fromJson(child));
      }
      return out;
    }

    private static FetchNode readFetch(JsonNode node) throws IOException {
      ObjectMapper mapper = JacksonUtility.getJsonMapper();
      JsonNode serviceName = node.get("serviceName");
      if (serviceName == null || !serviceName.isTextual() || serviceName.asText().isBlank()) {
        throw new IOException("Fetch node must have a 'serviceName'");
      }
      List<Selection> requires = new ArrayList<>();
      JsonNode requiresNode = node.get("requires");
      if (requiresNode != null && requiresNode.isArray()) {
        for (JsonNode selection : requiresNode) {
          requires.add(Selection.Deserializer.fromJson(selection));
        }
      }
      List<String> variableUsages =
          node.has("variableUsages")
              ? mapper.convertValue(node.get("variableUsages"), new TypeReference<List<String>>() {})
              : List.of();
      OperationKind operationKind;
      try {
        operationKind = OperationKind.fromJson(textOrNull(node.get("operationKind")));
      } catch (IllegalArgumentException e) {
        throw new IOException(e.getMessage(), e);
      }
      return new FetchNode(
          serviceName.asText(),
          requires,
          variableUsages,
          textOrNull(node.get("operation")),
          textOrNull(node.get("operationName")),
          operationKind);
    }

    private static String textOrNull(JsonNode node) {
      return node == null || node.isNull() ? null : node.asText();
    }
  }

  @JsonPropertyOrder({"kind", "nodes"})
  record Sequence(@JsonProperty("nodes") List<PlanNode> nodes) implements PlanNode {
    public Sequence {
      nodes = List.copyOf(nodes);
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
      return "Sequence";
    }
  }

  @JsonPropertyOrder({"kind", "nodes"})
  record Parallel(@JsonProperty("nodes") List<PlanNode> nodes) implements PlanNode {
    public Parallel {
      nodes = List.copyOf(nodes);
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
      return "Parallel";
    }
  }

  @JsonPropertyOrder({"kind"})
  record Fetch(@JsonUnwrapped FetchNode fetch) implements PlanNode {
    public Fetch {
      if (fetch == null) {
        throw new IllegalArgumentException("fetch must not be null");
      }
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
      return "Fetch";
    }
  }

  @JsonPropertyOrder({"kind", "path", "node"})
  record Flatten(@JsonProperty("path") ResponsePath path, @JsonProperty("node") PlanNode node)
      implements PlanNode {
    public Flatten {
      path = path == null ? ResponsePath.empty() : path;
      if (node == null) {
        throw new IllegalArgumentException("flatten node must not be null");
      }
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
      return "Flatten";
    }
  }
}
