package com.gentoro.optiflow.workflow;

/**
 * A single routing option of a {@link ConditionalNode}.
 *
 * @param value template of the operand under test; may be {@code null} for scripted conditions.
 * @param condition predicate applied to the resolved value; {@code null} always matches.
 * @param target node id or {@link WorkflowNode#END}.
 */
public record Branch(String value, BranchCondition condition, String target) {}
