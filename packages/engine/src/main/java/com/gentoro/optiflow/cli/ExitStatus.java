package com.gentoro.optiflow.cli;

import com.gentoro.optiflow.exception.NodeExecutionException;

/** Process exit codes of the command line. */
public enum ExitStatus {
  /** The workflow ran to {@code END} or past its last node, or validation passed. */
  COMPLETED(0),
  /** A node failed; the store holds the state after the last successful node. */
  NODE_FAILURE(1),
  /** The workflow, store or configuration could not be read or is invalid. */
  INVALID_INPUT(2);

  private final int code;

  ExitStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ExitStatus of(Throwable failure) {
    return failure instanceof NodeExecutionException ? NODE_FAILURE : INVALID_INPUT;
  }
}
