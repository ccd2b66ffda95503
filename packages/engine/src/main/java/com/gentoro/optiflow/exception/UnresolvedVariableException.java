package com.gentoro.optiflow.exception;

/**
 * A template placeholder references a variable that has no entry in the mapping, or tries to
 * increment a variable that is not numeric.
 */
public class UnresolvedVariableException extends OptiFlowException {
  public UnresolvedVariableException(String message) {
    super(OptiFlowErrorCode.UNRESOLVED_VARIABLE, message);
  }

  public UnresolvedVariableException(String message, Throwable cause) {
    super(OptiFlowErrorCode.UNRESOLVED_VARIABLE, message, cause);
  }
}
