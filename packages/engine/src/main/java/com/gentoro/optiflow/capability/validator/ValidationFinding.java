package com.gentoro.optiflow.capability.validator;

/** One message reported by a validation tool. */
public record ValidationFinding(String tool, String severity, String message) {

  public static final String ERROR = "error";
  public static final String INFO = "info";
}
