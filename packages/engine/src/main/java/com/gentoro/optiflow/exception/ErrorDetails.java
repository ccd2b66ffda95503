package com.gentoro.optiflow.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable view of a failure used for logs and command line reports. */
public record ErrorDetails(
    String type,
    String message,
    OptiFlowErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
