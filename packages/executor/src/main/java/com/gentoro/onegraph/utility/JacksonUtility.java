package com.gentoro.onegraph.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Shared Jackson {@link ObjectMapper} instances. */
public final class JacksonUtility {

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .setSerializationInclusion(JsonInclude.Include.NON_NULL)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Serialize a node for log output; never throws. */
  public static String toJsonString(JsonNode node) {
    if (node == null) {
      return "null";
    }
    try {
      return JSON_MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      return "(could not serialize)";
    }
  }

  /** Pretty-printed variant of {@link #toJsonString(JsonNode)}. */
  public static String toPrettyJsonString(Object value) {
    try {
      return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      return "(could not serialize)";
    }
  }
}
