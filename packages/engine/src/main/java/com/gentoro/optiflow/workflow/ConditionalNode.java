package com.gentoro.optiflow.workflow;

import java.util.List;

/**
 * Node that routes control flow. Branches are tried in order; the first match wins, otherwise the
 * run continues at {@code elseTarget}.
 */
public record ConditionalNode(String id, List<Branch> branches, String elseTarget)
    implements WorkflowNode {

  public ConditionalNode {
    branches = List.copyOf(branches);
  }
}
