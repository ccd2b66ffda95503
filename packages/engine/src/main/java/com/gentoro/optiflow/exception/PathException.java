package com.gentoro.optiflow.exception;

/** A store path is malformed or its destination cannot be constructed. */
public class PathException extends OptiFlowException {
  public PathException(String message) {
    super(OptiFlowErrorCode.PATH_ERROR, message);
  }

  public PathException(String message, Throwable cause) {
    super(OptiFlowErrorCode.PATH_ERROR, message, cause);
  }
}
