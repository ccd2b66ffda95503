package com.gentoro.optiflow.workflow;

/** One step of a workflow's {@code flow}. */
public sealed interface WorkflowNode permits ExecuteNode, ConditionalNode {

  /** Sentinel target that ends the run. */
  String END = "END";

  String id();
}
