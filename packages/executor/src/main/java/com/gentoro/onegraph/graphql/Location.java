package com.gentoro.onegraph.graphql;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Line and column of an error in the operation text. */
public record Location(@JsonProperty("line") int line, @JsonProperty("column") int column) {}
