package com.gentoro.optiflow.exception;

/** Application configuration is missing or invalid. */
public class ConfigurationException extends OptiFlowException {
  public ConfigurationException(String message) {
    super(OptiFlowErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(OptiFlowErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
