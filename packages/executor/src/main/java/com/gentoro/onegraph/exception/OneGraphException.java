package com.gentoro.onegraph.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for OneGraph.
 *
 * <p>Every exception carries a {@link OneGraphErrorCode} and an optional context map with
 * structured details (service name, path, reason) used when the exception is turned into a
 * response error.
 */
public class OneGraphException extends RuntimeException {

  private final OneGraphErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public OneGraphException(OneGraphErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public OneGraphException(OneGraphErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public OneGraphErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public OneGraphException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }
}
