package com.gentoro.onegraph.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable description of a failure. */
public record ErrorDetails(
    String type,
    String message,
    OneGraphErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
