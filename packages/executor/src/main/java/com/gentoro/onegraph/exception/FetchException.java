package com.gentoro.onegraph.exception;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onegraph.graphql.GraphqlError;
import com.gentoro.onegraph.json.ResponsePath;
import java.util.List;

/**
 * A failure local to a single fetch. The interpreter turns it into exactly one response error at
 * the path the fetch was executed on; the rest of the response is unaffected.
 */
public class FetchException extends OneGraphException {

  /** Failure categories, also used as {@code extensions.code} in the response error. */
  public enum Kind {
    UNKNOWN_SERVICE,
    SUBREQUEST_HTTP_ERROR,
    SUBREQUEST_UNEXPECTED_PATCH_RESPONSE,
    INVALID_CONTENT,
    MALFORMED_RESPONSE
  }

  private final Kind kind;
  private final String service;
  private final String reason;
  private final Integer statusCode;

  private FetchException(
      Kind kind, String service, String reason, Integer statusCode, String message, Throwable cause) {
    super(OneGraphErrorCode.FETCH_ERROR, message, cause);
    this.kind = kind;
    this.service = service;
    this.reason = reason;
    this.statusCode = statusCode;
    withContext("kind", kind.name());
    withContext("service", service);
    withContext("reason", reason);
    withContext("status", statusCode);
  }

  public static FetchException unknownService(String service) {
    return new FetchException(
        Kind.UNKNOWN_SERVICE,
        service,
        null,
        null,
        "unknown service '%s'".formatted(service),
        null);
  }

  public static FetchException httpError(String service, String reason, Throwable cause) {
    return httpError(service, null, reason, cause);
  }

  public static FetchException httpError(
      String service, Integer statusCode, String reason, Throwable cause) {
    return new FetchException(
        Kind.SUBREQUEST_HTTP_ERROR,
        service,
        reason,
        statusCode,
        "HTTP fetch failed from '%s': %s".formatted(service, reason),
        cause);
  }

  public static FetchException unexpectedPatchResponse(String service) {
    return new FetchException(
        Kind.SUBREQUEST_UNEXPECTED_PATCH_RESPONSE,
        service,
        null,
        null,
        "service '%s' returned a PATCH response which was not expected".formatted(service),
        null);
  }

  public static FetchException invalidContent(String service, String reason) {
    return new FetchException(
        Kind.INVALID_CONTENT, service, reason, null, "invalid content: %s".formatted(reason), null);
  }

  public static FetchException malformedResponse(String service, String reason) {
    return malformedResponse(service, reason, null);
  }

  public static FetchException malformedResponse(String service, String reason, Throwable cause) {
    return new FetchException(
        Kind.MALFORMED_RESPONSE,
        service,
        reason,
        null,
        "service '%s' response was malformed: %s".formatted(service, reason),
        cause);
  }

  public Kind getKind() {
    return kind;
  }

  public String getService() {
    return service;
  }

  public String getReason() {
    return reason;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  /** Response error anchored at {@code path}, with {@code code} and {@code service} extensions. */
  public GraphqlError toGraphqlError(ResponsePath path) {
    ObjectNode extensions = JsonNodeFactory.instance.objectNode();
    extensions.put("code", kind.name());
    if (service != null) {
      extensions.put("service", service);
    }
    if (reason != null) {
      extensions.put("reason", reason);
    }
    if (statusCode != null) {
      extensions.put("http.status", statusCode);
    }
    return new GraphqlError(getMessage(), path, List.of(), extensions);
  }
}
