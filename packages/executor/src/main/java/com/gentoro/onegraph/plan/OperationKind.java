package com.gentoro.onegraph.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** GraphQL operation type of a fetch. */
public enum OperationKind {
  QUERY,
  MUTATION,
  SUBSCRIPTION;

  @JsonValue
  public String toJson() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Case-insensitive lookup; {@code null} or blank means {@link #QUERY}. */
  @JsonCreator
  public static OperationKind fromJson(String value) {
    if (value == null || value.isBlank()) {
      return QUERY;
    }
    for (OperationKind kind : values()) {
      if (kind.name().equalsIgnoreCase(value.trim())) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown operation kind '" + value + "'");
  }
}
