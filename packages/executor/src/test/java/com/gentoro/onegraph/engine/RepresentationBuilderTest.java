package com.gentoro.onegraph.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onegraph.json.ResponsePath;
import com.gentoro.onegraph.selection.Selection;
import com.gentoro.onegraph.selection.SelectionSetMatcher;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class RepresentationBuilderTest {

  private static final List<Selection> REQUIRES =
      List.of(Selection.field("__typename"), Selection.field("id"));

  private static final String DATA =
      """
      {
        "t": [
          { "__typename": "User", "id": "a", "x": 1 },
          { "__typename": "User", "id": "a", "x": 2 },
          { "__typename": "User", "id": "b" }
        ]
      }
      """;

  private final RepresentationBuilder builder = new RepresentationBuilder(new SelectionSetMatcher());

  private static JsonNode json(String text) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(text);
  }

  @Test
  @DisplayName("equal projections share a batch slot")
  void deduplicatesEqualRepresentations() throws Exception {
    Representations reps =
        builder.build(REQUIRES, json(DATA), ResponsePath.parse("t/@"), true).orElseThrow();

    assertEquals(
        json(
            "[{\"__typename\": \"User\", \"id\": \"a\"}, {\"__typename\": \"User\", \"id\": \"b\"}]"),
        reps.batch());
    assertEquals(
        Map.of(
            ResponsePath.parse("t/0"), 0,
            ResponsePath.parse("t/1"), 0,
            ResponsePath.parse("t/2"), 1),
        reps.pathIndexes());
    assertEquals(
        List.of(ResponsePath.parse("t/0"), ResponsePath.parse("t/1")), reps.pathsAt(0));
    assertEquals(List.of(ResponsePath.parse("t/2")), reps.pathsAt(1));
    assertTrue(reps.pathsAt(2).isEmpty());
  }

  @Test
  void withoutDeduplicationEveryMatchGetsASlot() throws Exception {
    Representations reps =
        builder.build(REQUIRES, json(DATA), ResponsePath.parse("t"), false).orElseThrow();

    assertEquals(3, reps.size());
    assertEquals(reps.batch().get(0), reps.batch().get(1));
    assertEquals(
        List.of(0, 1, 2), List.copyOf(reps.pathIndexes().values()));
    assertEquals(
        List.of(ResponsePath.parse("t/0"), ResponsePath.parse("t/1"), ResponsePath.parse("t/2")),
        List.copyOf(reps.pathIndexes().keySet()));
  }

  @Test
  void nonMatchingCandidatesAreSkipped() throws Exception {
    JsonNode data =
        json(
            """
            { "t": [ { "__typename": "User", "id": "a" }, { "__typename": "User" }, null ] }
            """);
    Representations reps =
        builder.build(REQUIRES, data, ResponsePath.parse("t"), true).orElseThrow();
    assertEquals(1, reps.size());
    assertEquals(Map.of(ResponsePath.parse("t/0"), 0), reps.pathIndexes());
  }

  @Test
  void noMatchYieldsEmpty() throws Exception {
    Optional<Representations> reps =
        builder.build(REQUIRES, json("{\"t\": [{\"name\": \"x\"}]}"), ResponsePath.parse("t"), true);
    assertTrue(reps.isEmpty());
    assertTrue(
        builder.build(REQUIRES, json("{}"), ResponsePath.parse("missing"), true).isEmpty());
  }

  @Test
  void customMatcherIsUsed() throws Exception {
    RepresentationBuilder everything =
        new RepresentationBuilder((candidate, requires) -> Optional.of(candidate.deepCopy()));
    Representations reps =
        everything.build(REQUIRES, json(DATA), ResponsePath.parse("t"), true).orElseThrow();
    assertEquals(3, reps.size());
  }
}
