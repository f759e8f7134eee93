package com.gentoro.onegraph.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Operations on the JSON response tree.
 *
 * <p>Values are Jackson {@link JsonNode}s. The merge and insert operations mutate and return the
 * target container; callers own the target and must not pass a tree that another branch is still
 * reading.
 */
public final class JsonValues {

  private JsonValues() {}

  /** JSON {@code null}, used as the "no contribution" value of a plan branch. */
  public static JsonNode empty() {
    return NullNode.getInstance();
  }

  public static boolean isAbsent(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }

  /**
   * Merge {@code addition} into {@code target} and return the result.
   *
   * <ul>
   *   <li>Object + Object: keys are merged recursively; keys present on one side only are kept.
   *   <li>Array + Array: elements are merged position by position; extra elements of {@code
   *       addition} are appended.
   *   <li>A {@code null} addition leaves {@code target} untouched.
   *   <li>Any other pairing: {@code addition} replaces {@code target}.
   * </ul>
   *
   * @return the merged value; this is {@code target} itself when it is a container that was merged
   *     into, otherwise {@code addition}
   */
  public static JsonNode deepMerge(JsonNode target, JsonNode addition) {
    if (isAbsent(addition)) {
      return target == null ? empty() : target;
    }
    if (isAbsent(target)) {
      return addition;
    }
    if (target.isObject() && addition.isObject()) {
      ObjectNode into = (ObjectNode) target;
      Iterator<Map.Entry<String, JsonNode>> it = addition.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        JsonNode existing = into.get(e.getKey());
        into.set(e.getKey(), existing == null ? e.getValue() : deepMerge(existing, e.getValue()));
      }
      return into;
    }
    if (target.isArray() && addition.isArray()) {
      ArrayNode into = (ArrayNode) target;
      for (int i = 0; i < addition.size(); i++) {
        if (i < into.size()) {
          into.set(i, deepMerge(into.get(i), addition.get(i)));
        } else {
          into.add(addition.get(i));
        }
      }
      return into;
    }
    return addition;
  }

  /**
   * Build a fresh value holding {@code leaf} at {@code path}: keys become single-entry objects and
   * indices become arrays padded with {@code null} up to the index.
   *
   * @throws IllegalArgumentException when the path contains a flatten marker
   */
  public static JsonNode fromPath(ResponsePath path, JsonNode leaf) {
    JsonNode current = leaf == null ? empty() : leaf;
    List<PathElement> elements = path.elements();
    for (int i = elements.size() - 1; i >= 0; i--) {
      PathElement element = elements.get(i);
      if (element instanceof PathElement.Key key) {
        ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
        wrapper.set(key.name(), current);
        current = wrapper;
      } else if (element instanceof PathElement.Index index) {
        ArrayNode wrapper = JsonNodeFactory.instance.arrayNode();
        for (int pad = 0; pad < index.value(); pad++) {
          wrapper.addNull();
        }
        wrapper.add(current);
        current = wrapper;
      } else {
        throw new IllegalArgumentException("cannot build a value along " + path);
      }
    }
    return current;
  }

  /**
   * Write {@code value} at {@code path} inside {@code tree}, creating intermediate objects and
   * arrays as needed. A value already present at {@code path} is replaced.
   *
   * @return the root of the updated tree (a new container when {@code tree} could not hold the
   *     first path element)
   * @throws IllegalArgumentException when the path contains a flatten marker
   */
  public static JsonNode insertAt(JsonNode tree, ResponsePath path, JsonNode value) {
    return insertAt(tree, path.elements(), 0, value == null ? empty() : value, path);
  }

  private static JsonNode insertAt(
      JsonNode node, List<PathElement> elements, int pos, JsonNode value, ResponsePath path) {
    if (pos == elements.size()) {
      return value;
    }
    PathElement element = elements.get(pos);
    if (element instanceof PathElement.Key key) {
      ObjectNode obj =
          node instanceof ObjectNode existing ? existing : JsonNodeFactory.instance.objectNode();
      obj.set(key.name(), insertAt(obj.get(key.name()), elements, pos + 1, value, path));
      return obj;
    }
    if (element instanceof PathElement.Index index) {
      ArrayNode arr =
          node instanceof ArrayNode existing ? existing : JsonNodeFactory.instance.arrayNode();
      while (arr.size() <= index.value()) {
        arr.addNull();
      }
      arr.set(index.value(), insertAt(arr.get(index.value()), elements, pos + 1, value, path));
      return arr;
    }
    throw new IllegalArgumentException("cannot insert along " + path);
  }

  /**
   * Enumerate the values reachable under {@code path} with their concrete paths.
   *
   * <p>Keys descend into objects, indices into arrays, and {@code @} into every array element. An
   * array met where a key is expected, or at the end of the path, is expanded element by element
   * so that only non-array values are reported. Missing keys, out of range indices and {@code
   * null}s produce no result.
   */
  public static List<PathValue> selectValuesAndPaths(JsonNode data, ResponsePath path) {
    List<PathValue> out = new ArrayList<>();
    collect(data, path.elements(), 0, ResponsePath.empty(), out);
    return out;
  }

  private static void collect(
      JsonNode data,
      List<PathElement> elements,
      int pos,
      ResponsePath current,
      List<PathValue> out) {
    if (isAbsent(data)) {
      return;
    }
    if (pos == elements.size()) {
      if (data.isArray()) {
        for (int i = 0; i < data.size(); i++) {
          collect(data.get(i), elements, pos, current.appendIndex(i), out);
        }
      } else {
        out.add(new PathValue(current, data));
      }
      return;
    }
    PathElement element = elements.get(pos);
    if (element instanceof PathElement.Key key) {
      if (data.isObject()) {
        collect(data.get(key.name()), elements, pos + 1, current.append(key), out);
      } else if (data.isArray()) {
        for (int i = 0; i < data.size(); i++) {
          collect(data.get(i), elements, pos, current.appendIndex(i), out);
        }
      }
    } else if (element instanceof PathElement.Index index) {
      if (data.isArray() && index.value() < data.size()) {
        collect(data.get(index.value()), elements, pos + 1, current.append(index), out);
      }
    } else if (data.isArray()) {
      for (int i = 0; i < data.size(); i++) {
        collect(data.get(i), elements, pos + 1, current.appendIndex(i), out);
      }
    }
  }
}
