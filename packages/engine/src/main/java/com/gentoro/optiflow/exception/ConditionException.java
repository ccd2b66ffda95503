package com.gentoro.optiflow.exception;

/** A branch condition is malformed or evaluation failed. */
public class ConditionException extends OptiFlowException {
  public ConditionException(String message) {
    super(OptiFlowErrorCode.CONDITION_ERROR, message);
  }

  public ConditionException(String message, Throwable cause) {
    super(OptiFlowErrorCode.CONDITION_ERROR, message, cause);
  }
}
