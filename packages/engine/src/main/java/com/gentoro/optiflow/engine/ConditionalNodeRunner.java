package com.gentoro.optiflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.optiflow.exception.OptiFlowException;
import com.gentoro.optiflow.workflow.Branch;
import com.gentoro.optiflow.workflow.ConditionalNode;

/**
 * Runs {@link ConditionalNode}s: branches are tested in declaration order and the first match
 * decides the target; the {@code else} target applies when none matches. Templates are rendered
 * against a scratch copy, so routing never changes the variables.
 */
public class ConditionalNodeRunner {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(ConditionalNodeRunner.class);

  public NodeOutcome run(ConditionalNode node, JsonNode store, WorkflowVariables vars) {
    WorkflowVariables scratch = vars.copy();
    int position = 0;
    for (Branch branch : node.branches()) {
      boolean matched;
      try {
        matched = ConditionEvaluator.matches(branch, scratch, store);
      } catch (OptiFlowException e) {
        throw e.withContext("branch", position);
      }
      if (matched) {
        log.info(
            "Node '{}' branch #{} matched, routing to '{}'", node.id(), position, branch.target());
        return NodeOutcome.routed(node.id(), branch.target());
      }
      position++;
    }
    log.info("Node '{}' matched no branch, routing to '{}'", node.id(), node.elseTarget());
    return NodeOutcome.routed(node.id(), node.elseTarget());
  }
}
