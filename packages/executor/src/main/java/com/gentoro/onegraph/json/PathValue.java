package com.gentoro.onegraph.json;

import com.fasterxml.jackson.databind.JsonNode;

/** A value found in a response tree together with its concrete location. */
public record PathValue(ResponsePath path, JsonNode value) {}
