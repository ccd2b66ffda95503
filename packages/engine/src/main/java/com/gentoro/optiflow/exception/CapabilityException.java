package com.gentoro.optiflow.exception;

/**
 * Raised when an external work unit fails: it is not registered, it threw, it returned something
 * other than a JSON object, or its payload misses a declared output.
 */
public class CapabilityException extends OptiFlowException {
  public CapabilityException(String message) {
    super(OptiFlowErrorCode.CAPABILITY_ERROR, message);
  }

  public CapabilityException(String message, Throwable cause) {
    super(OptiFlowErrorCode.CAPABILITY_ERROR, message, cause);
  }
}
