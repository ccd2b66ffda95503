package com.gentoro.optiflow.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the engine.
 *
 * <p>Every failure carries an {@link OptiFlowErrorCode} so the command line surface can report the
 * error kind and map it to an exit status, and an optional context map with the identifiers that
 * help an operator locate the problem (node id, path, variable name).
 */
public class OptiFlowException extends RuntimeException {

  private final OptiFlowErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public OptiFlowException(OptiFlowErrorCode code, String message) {
    super(message);
    this.code = code == null ? OptiFlowErrorCode.UNKNOWN : code;
  }

  public OptiFlowException(OptiFlowErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? OptiFlowErrorCode.UNKNOWN : code;
  }

  public OptiFlowErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry; returns this exception for fluent use at the throw site. */
  public OptiFlowException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }
}
