package com.gentoro.onegraph.selection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.json.JsonValues;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema-less {@link SelectionMatcher}.
 *
 * <p>Fields are copied by response key (alias when present), recursing into sub-selections and
 * through arrays element by element. Inline fragments apply when their type condition equals the
 * object's {@code __typename}, or unconditionally when they have none. Without a schema there is
 * nothing to infer a type from, so {@code __typename} is required like any other field. An object
 * that lacks a required field, or whose projection is empty, does not match; inside a nested object
 * a miss turns that nested value into {@code null}.
 */
public class SelectionSetMatcher implements SelectionMatcher {

  @Override
  public Optional<JsonNode> matches(ObjectNode candidate, List<Selection> requires) {
    JsonNode projected = project(candidate, requires);
    return projected.isObject() && !projected.isEmpty() ? Optional.of(projected) : Optional.empty();
  }

  private JsonNode project(JsonNode input, List<Selection> selections) {
    if (!(input instanceof ObjectNode content)) {
      return NullNode.getInstance();
    }
    JsonNode typename = content.get(Selection.TYPENAME);
    String currentType = typename != null && typename.isTextual() ? typename.asText() : null;

    ObjectNode output = JsonNodeFactory.instance.objectNode();
    for (Selection selection : selections) {
      if (selection instanceof Selection.Field field) {
        String key = field.responseKey();
        JsonNode value = content.get(key);
        if (value == null) {
          return NullNode.getInstance();
        }
        output.set(key, projectField(value, field.selections()));
      } else if (selection instanceof Selection.InlineFragment fragment) {
        if (fragment.typeCondition() != null && !fragment.typeCondition().equals(currentType)) {
          continue;
        }
        JsonNode selected = project(content, fragment.selections());
        if (selected instanceof ObjectNode fields) {
          Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
          while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode existing = output.get(e.getKey());
            output.set(
                e.getKey(),
                existing == null ? e.getValue() : JsonValues.deepMerge(existing, e.getValue()));
          }
        }
      }
    }
    return output;
  }

  private JsonNode projectField(JsonNode value, List<Selection> subSelections) {
    if (value.isArray()) {
      ArrayNode out = JsonNodeFactory.instance.arrayNode(value.size());
      for (JsonNode element : value) {
        out.add(subSelections == null ? element.deepCopy() : project(element, subSelections));
      }
      return out;
    }
    if (subSelections == null) {
      return value.deepCopy();
    }
    return project(value, subSelections);
  }
}
