package com.gentoro.onegraph.graphql;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onegraph.json.ResponsePath;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.Test;

public class GraphqlResponseTest {

  @Test
  void parsesDataAndErrors() throws Exception {
    GraphqlResponse response =
        GraphqlResponse.fromJson(
            """
            {
              "data": { "me": { "id": "1" } },
              "errors": [
                {
                  "message": "oops",
                  "path": ["me", "friends", 0],
                  "locations": [ { "line": 2, "column": 5 } ],
                  "extensions": { "code": "FORBIDDEN" }
                }
              ],
              "extensions": { "cost": 3 }
            }
            """);

    assertTrue(response.isPrimary());
    assertEquals("1", response.data().get("me").get("id").asText());
    assertEquals(1, response.errors().size());
    GraphqlError error = response.errors().get(0);
    assertEquals("oops", error.message());
    assertEquals(ResponsePath.parse("me/friends/0"), error.path());
    assertEquals(List.of(new Location(2, 5)), error.locations());
    assertEquals("FORBIDDEN", error.extensions().get("code").asText());
    assertEquals(3, response.extensions().get("cost").asInt());
  }

  @Test
  void missingErrorsIsAnEmptyList() throws Exception {
    GraphqlResponse response = GraphqlResponse.fromJson("{\"data\": null}");
    assertTrue(response.errors().isEmpty());
    assertTrue(response.data().isNull());
  }

  @Test
  void responseWithPathIsAPatch() throws Exception {
    GraphqlResponse response =
        GraphqlResponse.fromJson("{\"data\": {\"a\": 1}, \"path\": [\"x\", 0]}");
    assertFalse(response.isPrimary());
    assertEquals(ResponsePath.parse("x/0"), response.path());
  }

  @Test
  void rejectsNonObjectBodies() {
    assertThrows(IllegalArgumentException.class, () -> GraphqlResponse.fromJson("[1, 2]"));
    assertThrows(JsonProcessingException.class, () -> GraphqlResponse.fromJson("<html>"));
  }

  @Test
  void serializesWithoutEmptyMembers() throws Exception {
    GraphqlResponse response =
        GraphqlResponse.ofData(JacksonUtility.getJsonMapper().readTree("{\"a\": 1}"));
    JsonNode wire = JacksonUtility.getJsonMapper().readTree(response.toJson());
    assertEquals(1, wire.get("data").get("a").asInt());
    assertFalse(wire.has("errors"));
    assertFalse(wire.has("path"));
    assertFalse(wire.has("primary"));

    GraphqlError error = GraphqlError.of("boom", null);
    JsonNode errorWire =
        JacksonUtility.getJsonMapper().readTree(
            JacksonUtility.getJsonMapper().writeValueAsString(error));
    assertEquals("boom", errorWire.get("message").asText());
    assertFalse(errorWire.has("path"));
    assertFalse(errorWire.has("locations"));
  }

  @Test
  void requestCarriesVariables() throws Exception {
    GraphqlRequest request = new GraphqlRequest("{ a }", null, null);
    JsonNode wire =
        JacksonUtility.getJsonMapper().readTree(
            JacksonUtility.getJsonMapper().writeValueAsString(request));
    assertEquals("{ a }", wire.get("query").asText());
    assertFalse(wire.has("operationName"));
    assertTrue(wire.get("variables").isObject());
  }

  @Test
  void rootLevelErrorKeepsItsEmptyPath() throws Exception {
    GraphqlError error = GraphqlError.of("boom", ResponsePath.empty());
    JsonNode wire =
        JacksonUtility.getJsonMapper()
            .readTree(JacksonUtility.getJsonMapper().writeValueAsString(error));
    assertTrue(wire.get("path").isArray());
    assertEquals(0, wire.get("path").size());
  }
}
