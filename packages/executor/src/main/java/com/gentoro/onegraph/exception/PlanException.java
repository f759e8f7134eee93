package com.gentoro.onegraph.exception;

/** Thrown when a query plan cannot be parsed or is structurally invalid. */
public class PlanException extends OneGraphException {
  public PlanException(String message) {
    super(OneGraphErrorCode.PLAN_ERROR, message);
  }

  public PlanException(String message, Throwable cause) {
    super(OneGraphErrorCode.PLAN_ERROR, message, cause);
  }
}
