package com.gentoro.optiflow.engine;

/**
 * Summary of a completed run.
 *
 * @param workflow workflow name.
 * @param termination how the run ended.
 * @param lastNodeId id of the last node that ran.
 * @param visitedNodes number of node executions, counting revisits.
 * @param executedNodes execute nodes that invoked their capability.
 * @param skippedNodes execute nodes skipped because their output was present.
 */
public record WorkflowRunResult(
    String workflow,
    Termination termination,
    String lastNodeId,
    int visitedNodes,
    int executedNodes,
    int skippedNodes) {

  public enum Termination {
    /** A routing target of {@code END} was reached. */
    END_REACHED,
    /** Execution fell through the last node of the flow. */
    FLOW_EXHAUSTED
  }
}
