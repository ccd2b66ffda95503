package com.gentoro.optiflow.workflow;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, validated workflow definition. Instances are produced by {@link WorkflowLoader}; the
 * loader guarantees unique node ids and resolvable routing targets.
 *
 * @param name display name.
 * @param codeType free-form tag describing the artifacts the workflow optimizes.
 * @param vars initial variable mapping.
 * @param flow ordered, non-empty node list.
 */
public record WorkflowDefinition(
    String name, String codeType, ObjectNode vars, List<WorkflowNode> flow) {

  public WorkflowDefinition {
    vars = vars == null ? JsonNodeFactory.instance.objectNode() : vars.deepCopy();
    flow = List.copyOf(flow);
  }

  /** Returns a copy; the definition never changes during a run. */
  @Override
  public ObjectNode vars() {
    return vars.deepCopy();
  }

  /** Position of every node id in {@link #flow()}. */
  public Map<String, Integer> nodeIndex() {
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < flow.size(); i++) {
      index.put(flow.get(i).id(), i);
    }
    return index;
  }
}
