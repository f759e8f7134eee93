package com.gentoro.onegraph.json;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class ResponsePathTest {

  @Test
  void parsesKeysIndicesAndFlatten() {
    ResponsePath path = ResponsePath.parse("/topProducts/@/reviews/0");
    assertEquals(4, path.size());
    assertEquals(PathElement.key("topProducts"), path.get(0));
    assertSame(PathElement.flatten(), path.get(1));
    assertEquals(PathElement.key("reviews"), path.get(2));
    assertEquals(PathElement.index(0), path.get(3));
    assertEquals("/topProducts/@/reviews/0", path.toString());
  }

  @Test
  void emptyPath() {
    assertTrue(ResponsePath.parse("").isEmpty());
    assertTrue(ResponsePath.parse("/").isEmpty());
    assertEquals(ResponsePath.empty(), ResponsePath.of());
    assertNull(ResponsePath.empty().parent());
    assertEquals("/", ResponsePath.empty().toString());
  }

  @Test
  void joinAndParent() {
    ResponsePath base = ResponsePath.parse("a/b");
    ResponsePath joined = base.join(ResponsePath.parse("x/1"));
    assertEquals(ResponsePath.parse("a/b/x/1"), joined);
    assertEquals(ResponsePath.parse("a/b/x"), joined.parent());
    assertSame(base, base.join(ResponsePath.empty()));
    assertEquals(base, ResponsePath.empty().join(base));
    // the original is unchanged
    assertEquals(2, base.size());
  }

  @Test
  void startsWith() {
    ResponsePath path = ResponsePath.parse("_entities/1/name");
    assertTrue(path.startsWith(ResponsePath.parse("_entities")));
    assertTrue(path.startsWith(ResponsePath.empty()));
    assertFalse(path.startsWith(ResponsePath.parse("_entities/2")));
    assertFalse(ResponsePath.parse("a").startsWith(ResponsePath.parse("a/b")));
  }

  @Test
  void equalityIsStructural() {
    ResponsePath a = ResponsePath.of(PathElement.key("t"), PathElement.index(2));
    ResponsePath b = ResponsePath.parse("t/2");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, ResponsePath.parse("t/@"));
  }

  @Test
  void trailingFlattenIsDropped() {
    assertEquals(ResponsePath.parse("a/b"), ResponsePath.parse("a/b/@").withoutTrailingFlatten());
    assertEquals(ResponsePath.parse("a/@/b"), ResponsePath.parse("a/@/b").withoutTrailingFlatten());
    assertTrue(ResponsePath.parse("a/@/b").containsFlatten());
    assertFalse(ResponsePath.parse("a/0/b").containsFlatten());
  }

  @Test
  @DisplayName("JSON form is an array of strings and integers")
  void jsonRoundTrip() throws Exception {
    ResponsePath path = ResponsePath.parse("a/0/@");
    String json = JacksonUtility.getJsonMapper().writeValueAsString(path);
    assertEquals("[\"a\",0,\"@\"]", json);

    ResponsePath read = JacksonUtility.getJsonMapper().readValue(json, ResponsePath.class);
    assertEquals(path, read);
  }

  @Test
  void fromJsonNode() throws Exception {
    JsonNode node = JacksonUtility.getJsonMapper().readTree("[\"users\", 3, \"name\"]");
    assertEquals(ResponsePath.parse("users/3/name"), ResponsePath.fromJson(node));
    assertTrue(ResponsePath.fromJson(null).isEmpty());

    JsonNode invalid = JacksonUtility.getJsonMapper().readTree("{\"a\": 1}");
    assertThrows(IllegalArgumentException.class, () -> ResponsePath.fromJson(invalid));
    JsonNode badSegment = JacksonUtility.getJsonMapper().readTree("[true]");
    assertThrows(IllegalArgumentException.class, () -> ResponsePath.fromJson(badSegment));
  }

  @Test
  void subPathAndIteration() {
    ResponsePath path = ResponsePath.parse("_entities/1/name");
    assertEquals(ResponsePath.parse("name"), path.subPath(2));
    assertTrue(path.subPath(5).isEmpty());
    assertEquals(List.of("_entities", 1, "name"), path.toJsonValues());
    int count = 0;
    for (PathElement ignored : path) {
      count++;
    }
    assertEquals(3, count);
  }

  @Test
  void rejectsNegativeIndex() {
    assertThrows(IllegalArgumentException.class, () -> PathElement.index(-1));
  }
}
