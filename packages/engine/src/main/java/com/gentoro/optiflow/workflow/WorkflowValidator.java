package com.gentoro.optiflow.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.optiflow.exception.DefinitionException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Structural validation of a workflow definition before anything runs.
 *
 * <p>The validator performs fast, predictable checks on the raw JSON: required fields and their
 * types, node-type specific contracts, unique node ids and routing targets that point at declared
 * nodes (or {@code END}). It does not evaluate templates or expressions; those are checked when the
 * node runs. Every failure is reported as a {@link DefinitionException} naming the offending node.
 *
 * <p>Minimal example of a valid definition:
 *
 * <pre>{@code
 * {
 *   "name": "score-loop",
 *   "code_type": "kubernetes",
 *   "vars": {"iter": 0},
 *   "flow": [
 *     {"id": "score", "type": "execute", "node": "scorer",
 *      "outputs": {"result": "optimization_flow.evaluation_{{++iter}}"}},
 *     {"id": "check", "type": "conditional",
 *      "branches": [{"value": "{{iter}}", "condition": {"op": ">=", "compare_to": "3"},
 *                    "goto": "END"}],
 *      "else": "score"}
 *   ]
 * }
 * }</pre>
 */
public final class WorkflowValidator {

  static final String TYPE_EXECUTE = "execute";
  static final String TYPE_CONDITIONAL = "conditional";

  private static final Set<String> ROOT_FIELDS = Set.of("name", "code_type", "vars", "flow");
  private static final Set<String> EXECUTE_FIELDS =
      Set.of("id", "type", "node", "skipIfOutputPresent", "inputs", "outputs");
  private static final Set<String> CONDITIONAL_FIELDS = Set.of("id", "type", "branches", "else");
  private static final Set<String> BRANCH_FIELDS = Set.of("value", "condition", "goto");
  private static final Set<String> CONDITION_FIELDS =
      Set.of("op", "compare_to", "expression", "python");

  private WorkflowValidator() {}

  /**
   * Validate the given definition.
   *
   * <ul>
   *   <li>Root object with textual {@code name} and {@code code_type}
   *   <li>Optional {@code vars} object
   *   <li>Non-empty {@code flow} array of node objects with unique, non-blank ids
   *   <li>Node-type specific required fields and their types
   *   <li>Every {@code goto}/{@code else} target is {@code END} or a declared node id
   * </ul>
   */
  public static void validate(JsonNode definition) {
    if (definition == null || !definition.isObject()) {
      throw new DefinitionException("Workflow definition must be a non-null JSON object");
    }
    rejectUnknownFields("workflow", definition, ROOT_FIELDS);
    requireText(definition, "name", "workflow");
    requireText(definition, "code_type", "workflow");

    JsonNode vars = definition.get("vars");
    if (vars != null && !vars.isNull() && !vars.isObject()) {
      throw new DefinitionException("Workflow 'vars' must be a JSON object");
    }

    JsonNode flow = definition.get("flow");
    if (flow == null || !flow.isArray() || flow.isEmpty()) {
      throw new DefinitionException("Workflow must contain at least one node in 'flow'");
    }

    Set<String> ids = new HashSet<>();
    for (JsonNode node : flow) {
      if (node == null || !node.isObject()) {
        throw new DefinitionException("Every 'flow' entry must be a JSON object");
      }
      JsonNode id = node.get("id");
      if (id == null || !id.isTextual() || id.asText().isBlank()) {
        throw new DefinitionException("Node id must be a non-empty string");
      }
      if (!ids.add(id.asText())) {
        throw new DefinitionException("Duplicate node id detected: '" + id.asText() + "'");
      }
    }

    for (JsonNode node : flow) {
      String nodeId = node.get("id").asText();
      switch (nodeType(node)) {
        case TYPE_EXECUTE -> validateExecuteNode(nodeId, node);
        case TYPE_CONDITIONAL -> validateConditionalNode(nodeId, node, ids);
        default ->
            throw new DefinitionException(
                "Node '" + nodeId + "' has unsupported type '" + nodeType(node) + "'");
      }
    }
  }

  /**
   * Determine a node's type. An explicit {@code type} wins; otherwise a node with {@code branches}
   * is conditional and a node with {@code node} is an execute node.
   */
  static String nodeType(JsonNode node) {
    JsonNode type = node.get("type");
    if (type != null && type.isTextual()) {
      return type.asText();
    }
    if (node.has("branches")) {
      return TYPE_CONDITIONAL;
    }
    if (node.has("node")) {
      return TYPE_EXECUTE;
    }
    throw new DefinitionException(
        "Node '" + node.path("id").asText() + "' is missing required 'type' field");
  }

  private static void validateExecuteNode(String nodeId, JsonNode node) {
    rejectUnknownFields("node '" + nodeId + "'", node, EXECUTE_FIELDS);
    requireText(node, "node", "node '" + nodeId + "'");

    JsonNode skip = node.get("skipIfOutputPresent");
    if (skip != null && !skip.isNull() && !skip.isBoolean()) {
      throw new DefinitionException(
          "Node '" + nodeId + "' field 'skipIfOutputPresent' must be a boolean");
    }

    JsonNode inputs = node.get("inputs");
    if (inputs != null && !inputs.isNull() && !inputs.isObject()) {
      throw new DefinitionException("Node '" + nodeId + "' field 'inputs' must be an object");
    }

    JsonNode outputs = node.get("outputs");
    if (outputs != null && !outputs.isNull()) {
      if (!outputs.isObject()) {
        throw new DefinitionException("Node '" + nodeId + "' field 'outputs' must be an object");
      }
      for (Iterator<String> it = outputs.fieldNames(); it.hasNext(); ) {
        String name = it.next();
        JsonNode destination = outputs.get(name);
        if (!destination.isTextual() || destination.asText().isBlank()) {
          throw new DefinitionException(
              "Node '%s' output '%s' must be a non-empty template string".formatted(nodeId, name));
        }
        if (ExecuteNode.isVariableOutput(name)
            && name.length() == ExecuteNode.VARIABLE_PREFIX.length()) {
          throw new DefinitionException(
              "Node '%s' output '%s' does not name a variable".formatted(nodeId, name));
        }
      }
    }
    if (skip != null && skip.asBoolean()
        && (outputs == null || !outputs.has(ExecuteNode.PRIMARY_OUTPUT))) {
      throw new DefinitionException(
          "Node '%s' sets skipIfOutputPresent but declares no '%s' output"
              .formatted(nodeId, ExecuteNode.PRIMARY_OUTPUT));
    }
  }

  private static void validateConditionalNode(String nodeId, JsonNode node, Set<String> ids) {
    rejectUnknownFields("node '" + nodeId + "'", node, CONDITIONAL_FIELDS);
    JsonNode branches = node.get("branches");
    if (branches == null || !branches.isArray() || branches.isEmpty()) {
      throw new DefinitionException(
          "Conditional node '" + nodeId + "' requires at least one branch");
    }
    int position = 0;
    for (JsonNode branch : branches) {
      String where = "branch #%d of node '%s'".formatted(position++, nodeId);
      if (!branch.isObject()) {
        throw new DefinitionException("The " + where + " must be a JSON object");
      }
      rejectUnknownFields(where, branch, BRANCH_FIELDS);
      JsonNode value = branch.get("value");
      if (value != null && !value.isNull() && !value.isValueNode()) {
        throw new DefinitionException("Field 'value' of " + where + " must be a scalar template");
      }
      JsonNode condition = branch.get("condition");
      if (condition != null && !condition.isNull()) {
        validateCondition(where, condition, value != null && !value.isNull());
      }
      requireTarget(branch, "goto", where, ids);
    }
    requireTarget(node, "else", "node '" + nodeId + "'", ids);
  }

  private static void validateCondition(String where, JsonNode condition, boolean hasValue) {
    if (!condition.isObject()) {
      throw new DefinitionException("Condition of " + where + " must be a JSON object");
    }
    rejectUnknownFields("condition of " + where, condition, CONDITION_FIELDS);
    JsonNode expression =
        condition.has("expression") ? condition.get("expression") : condition.get("python");
    boolean comparator = condition.has("op") || condition.has("compare_to");
    if (condition.has("expression") && condition.has("python")) {
      throw new DefinitionException(
          "Condition of " + where + " cannot define both 'expression' and 'python'");
    }
    if (expression != null) {
      if (comparator) {
        throw new DefinitionException(
            "Condition of " + where + " cannot mix a scripted expression with comparator fields");
      }
      if (!expression.isTextual() || expression.asText().isBlank()) {
        throw new DefinitionException("Scripted condition of " + where + " must not be empty");
      }
      return;
    }
    if (!condition.has("op") || !condition.has("compare_to")) {
      throw new DefinitionException(
          "Comparator condition of " + where + " requires both 'op' and 'compare_to'");
    }
    String op = condition.get("op").asText();
    if (!BranchCondition.OPERATORS.contains(op)) {
      throw new DefinitionException(
          "Unsupported comparator '%s' in %s; expected one of %s"
              .formatted(op, where, BranchCondition.OPERATORS));
    }
    if (!condition.get("compare_to").isValueNode()) {
      throw new DefinitionException("Field 'compare_to' of " + where + " must be a scalar");
    }
    if (!hasValue) {
      throw new DefinitionException("Comparator-based " + where + " must provide a 'value'");
    }
  }

  private static void requireTarget(JsonNode owner, String field, String where, Set<String> ids) {
    JsonNode target = owner.get(field);
    if (target == null || !target.isTextual() || target.asText().isBlank()) {
      throw new DefinitionException("The " + where + " is missing required '" + field + "'");
    }
    String id = target.asText();
    if (!WorkflowNode.END.equals(id) && !ids.contains(id)) {
      throw new DefinitionException(
          "The %s routes '%s' to unknown node '%s'".formatted(where, field, id));
    }
  }

  private static void requireText(JsonNode owner, String field, String where) {
    JsonNode value = owner.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new DefinitionException(
          "Field '" + field + "' of " + where + " must be a non-empty string");
    }
  }

  private static void rejectUnknownFields(String where, JsonNode owner, Set<String> allowed) {
    for (Iterator<String> it = owner.fieldNames(); it.hasNext(); ) {
      String field = it.next();
      if (!allowed.contains(field)) {
        throw new DefinitionException(
            "Unknown field '%s' in %s; allowed fields are %s"
                .formatted(field, where, List.copyOf(allowed)));
      }
    }
  }
}
