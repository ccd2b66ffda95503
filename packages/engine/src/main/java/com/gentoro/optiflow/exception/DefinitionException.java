package com.gentoro.optiflow.exception;

/** Workflow definition failed validation at load time. */
public class DefinitionException extends OptiFlowException {
  public DefinitionException(String message) {
    super(OptiFlowErrorCode.DEFINITION_ERROR, message);
  }

  public DefinitionException(String message, Throwable cause) {
    super(OptiFlowErrorCode.DEFINITION_ERROR, message, cause);
  }
}
