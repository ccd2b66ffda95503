package com.gentoro.optiflow.exception;

/** The store document could not be loaded or flushed. */
public class StoreException extends OptiFlowException {
  public StoreException(String message) {
    super(OptiFlowErrorCode.STORE_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(OptiFlowErrorCode.STORE_ERROR, message, cause);
  }
}
