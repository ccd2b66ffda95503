package com.gentoro.optiflow.exception;

/**
 * Wraps any failure raised while a single workflow node was being resolved, dispatched or merged.
 *
 * <p>The error code is inherited from the cause so that callers still see the original kind
 * (unresolved variable, path, capability, condition); the failing node id is kept alongside.
 */
public class NodeExecutionException extends OptiFlowException {

  private final String nodeId;

  public NodeExecutionException(String nodeId, OptiFlowException cause) {
    super(
        cause.getCode(),
        "Node '%s' failed (%s): %s".formatted(nodeId, cause.getCode(), cause.getMessage()),
        cause);
    this.nodeId = nodeId;
    withContext("nodeId", nodeId);
    cause.getContext().forEach(this::withContext);
  }

  public String getNodeId() {
    return nodeId;
  }
}
