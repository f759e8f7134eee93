package com.gentoro.onegraph.exception;

/** Error categories reported by OneGraph components. */
public enum OneGraphErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  PLAN_ERROR,
  FETCH_ERROR,
  EXECUTION_ERROR
}
