package com.gentoro.onegraph.exception;

/** Errors while loading or interpreting the application configuration. */
public class ConfigurationException extends OneGraphException {
  public ConfigurationException(String message) {
    super(OneGraphErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(OneGraphErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
