package com.gentoro.onegraph.selection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Part of the selection set a fetch {@code requires} from the objects it resolves.
 *
 * <p>Two types of nodes:
 *
 * <ol>
 *   <li>Field: {@code { "kind": "Field", "name": "id", "alias": "...", "selections": [...] }}
 *   <li>Inline fragment: {@code { "kind": "InlineFragment", "typeCondition": "User",
 *       "selections": [...] }}
 * </ol>
 */
@JsonDeserialize(using = Selection.Deserializer.class)
public sealed interface Selection {

  String TYPENAME = "__typename";

  @JsonProperty("kind")
  String kind();

  static Field field(String name) {
    return new Field(null, name, null);
  }

  static Field field(String name, List<Selection> selections) {
    return new Field(null, name, selections);
  }

  static InlineFragment inlineFragment(String typeCondition, List<Selection> selections) {
    return new InlineFragment(typeCondition, selections);
  }

  /** Custom deserializer for the {@code kind} discriminated union. */
  class Deserializer extends JsonDeserializer<Selection> {
    @Override
    public Selection deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = p.getCodec().readTree(p);
      return fromJson(node);
    }

    public static Selection fromJson(JsonNode node) throws IOException {
      if (node == null || !node.isObject()) {
        throw new IOException("Selection must be a JSON object");
      }
      if (!node.has("kind")) {
        throw new IOException("Selection must have 'kind' field");
      }
      String kind = node.get("kind").asText();
      switch (kind) {
        case "Field":
          {
            JsonNode name = node.get("name");
            if (name == null || !name.isTextual()) {
              throw new IOException("Field selection must have a 'name'");
            }
            JsonNode selections = node.get("selections");
            return new Field(
                textOrNull(node.get("alias")),
                name.asText(),
                selections == null || selections.isNull() ? null : readList(selections));
          }
        case "InlineFragment":
          return new InlineFragment(
              textOrNull(node.get("typeCondition")), readList(node.get("selections")));
        default:
          throw new IOException("Unknown selection kind '" + kind + "'");
      }
    }

    private static List<Selection> readList(JsonNode array) throws IOException {
      List<Selection> out = new ArrayList<>();
      if (array == null || array.isNull()) {
        return out;
      }
      if (!array.isArray()) {
        throw new IOException("'selections' must be an array");
      }
      for (JsonNode child : array) {
        out.add(fromJson(child));
      }
      return out;
    }

    private static String textOrNull(JsonNode node) {
      return node == null || node.isNull() ? null : node.asText();
    }
  }

  /**
   * A field. The value is read from, and written to, the response key {@link #responseKey()}.
   * {@code selections} is {@code null} for leaf fields.
   */
  @JsonPropertyOrder({"kind", "alias", "name", "selections"})
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Field(
      @JsonProperty("alias") String alias,
      @JsonProperty("name") String name,
      @JsonProperty("selections") List<Selection> selections)
      implements Selection {

    public Field {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("field name must not be empty");
      }
      selections = selections == null ? null : List.copyOf(selections);
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
      return "Field";
    }

    public String responseKey() {
      return alias != null ? alias : name;
    }
  }

  /** Selections that apply only when the object's {@code __typename} matches. */
  @JsonPropertyOrder({"kind", "typeCondition", "selections"})
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record InlineFragment(
      @JsonProperty("typeCondition") String typeCondition,
      @JsonProperty("selections") List<Selection> selections)
      implements Selection {

    public InlineFragment {
      selections = selections == null ? List.of() : List.copyOf(selections);
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
      return "InlineFragment";
    }
  }
}
