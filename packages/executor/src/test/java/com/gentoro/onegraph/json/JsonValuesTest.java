package com.gentoro.onegraph.json;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class JsonValuesTest {

  private static JsonNode json(String text) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(text);
  }

  @Test
  void mergesObjectsRecursively() throws Exception {
    JsonNode target = json("{\"a\": 1, \"b\": {\"c\": 1}}");
    JsonNode merged = JsonValues.deepMerge(target, json("{\"b\": {\"d\": 2}, \"e\": 3}"));
    assertEquals(json("{\"a\": 1, \"b\": {\"c\": 1, \"d\": 2}, \"e\": 3}"), merged);
  }

  @Test
  void laterScalarWins() throws Exception {
    assertEquals(
        json("{\"a\": 2}"), JsonValues.deepMerge(json("{\"a\": 1}"), json("{\"a\": 2}")));
    assertEquals(
        json("{\"a\": \"x\"}"),
        JsonValues.deepMerge(json("{\"a\": {\"b\": 1}}"), json("{\"a\": \"x\"}")));
  }

  @Test
  @DisplayName("a null addition never overwrites")
  void nullAdditionIsNoOp() throws Exception {
    assertEquals(
        json("{\"a\": 1, \"b\": 2}"),
        JsonValues.deepMerge(json("{\"a\": 1, \"b\": 2}"), json("{\"a\": null}")));
    assertEquals(json("{\"a\": 1}"), JsonValues.deepMerge(json("{\"a\": 1}"), NullNode.getInstance()));
    assertEquals(json("{\"a\": 1}"), JsonValues.deepMerge(NullNode.getInstance(), json("{\"a\": 1}")));
    assertTrue(JsonValues.deepMerge(null, null).isNull());
  }

  @Test
  @DisplayName("arrays merge position by position")
  void mergesArraysPositionally() throws Exception {
    JsonNode target = json("{\"t\": [{\"id\": 1}, {\"id\": 2}]}");
    JsonNode merged =
        JsonValues.deepMerge(target, json("{\"t\": [null, {\"name\": \"b\"}, {\"id\": 3}]}"));
    assertEquals(
        json("{\"t\": [{\"id\": 1}, {\"id\": 2, \"name\": \"b\"}, {\"id\": 3}]}"), merged);
  }

  @Test
  void fromPathBuildsSingleBranch() throws Exception {
    assertEquals(
        json("{\"a\": [null, {\"b\": 5}]}"),
        JsonValues.fromPath(ResponsePath.parse("a/1/b"), IntNode.valueOf(5)));
    assertEquals(IntNode.valueOf(5), JsonValues.fromPath(ResponsePath.empty(), IntNode.valueOf(5)));
    assertThrows(
        IllegalArgumentException.class,
        () -> JsonValues.fromPath(ResponsePath.parse("a/@"), IntNode.valueOf(5)));
  }

  @Test
  void insertAtCreatesIntermediates() throws Exception {
    JsonNode tree = json("{\"t\": [{\"id\": 1}]}");
    JsonNode updated =
        JsonValues.insertAt(tree, ResponsePath.parse("t/2/name"), TextNode.valueOf("c"));
    assertEquals(json("{\"t\": [{\"id\": 1}, null, {\"name\": \"c\"}]}"), updated);

    JsonNode fresh =
        JsonValues.insertAt(JsonValues.empty(), ResponsePath.parse("a/b"), IntNode.valueOf(1));
    assertEquals(json("{\"a\": {\"b\": 1}}"), fresh);
  }

  @Test
  void insertAtReplacesLeaf() throws Exception {
    JsonNode tree = json("{\"a\": {\"b\": 1, \"c\": 2}}");
    JsonValues.insertAt(tree, ResponsePath.parse("a/b"), json("{\"x\": true}"));
    assertEquals(json("{\"a\": {\"b\": {\"x\": true}, \"c\": 2}}"), tree);
  }

  @Test
  void selectsEveryObjectUnderAnArray() throws Exception {
    JsonNode data = json("{\"t\": [{\"id\": 1}, null, {\"id\": 3}]}");
    List<PathValue> values = JsonValues.selectValuesAndPaths(data, ResponsePath.parse("t"));
    assertEquals(2, values.size());
    assertEquals(ResponsePath.parse("t/0"), values.get(0).path());
    assertEquals(ResponsePath.parse("t/2"), values.get(1).path());
    assertEquals(json("{\"id\": 3}"), values.get(1).value());

    List<PathValue> flattened = JsonValues.selectValuesAndPaths(data, ResponsePath.parse("t/@"));
    assertEquals(
        List.of(ResponsePath.parse("t/0"), ResponsePath.parse("t/2")),
        flattened.stream().map(PathValue::path).toList());
  }

  @Test
  void selectsThroughNestedArrays() throws Exception {
    JsonNode data =
        json(
            """
            {
              "products": [
                { "reviews": [ { "author": { "id": "u1" } }, { "author": { "id": "u2" } } ] },
                { "reviews": [ { "author": { "id": "u1" } } ] }
              ]
            }
            """);
    List<PathValue> values =
        JsonValues.selectValuesAndPaths(data, ResponsePath.parse("products/@/reviews/@/author"));
    assertEquals(
        List.of(
            ResponsePath.parse("products/0/reviews/0/author"),
            ResponsePath.parse("products/0/reviews/1/author"),
            ResponsePath.parse("products/1/reviews/0/author")),
        values.stream().map(PathValue::path).toList());
  }

  @Test
  void missingDataSelectsNothing() throws Exception {
    JsonNode data = json("{\"t\": [{\"id\": 1}], \"n\": null}");
    assertTrue(JsonValues.selectValuesAndPaths(data, ResponsePath.parse("x")).isEmpty());
    assertTrue(JsonValues.selectValuesAndPaths(data, ResponsePath.parse("t/5")).isEmpty());
    assertTrue(JsonValues.selectValuesAndPaths(data, ResponsePath.parse("n")).isEmpty());
    assertTrue(JsonValues.selectValuesAndPaths(null, ResponsePath.empty()).isEmpty());
    assertEquals(1, JsonValues.selectValuesAndPaths(data, ResponsePath.empty()).size());
  }
}
