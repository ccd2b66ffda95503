package com.gentoro.optiflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.exception.UnresolvedVariableException;
import java.util.Optional;

/**
 * Mutable variable mapping of one workflow run.
 *
 * <p>An instance is created per node from the workflow defaults overlaid with the {@code vars}
 * snapshot of the store, threaded by reference through template resolution, and written back to
 * the store when the node completes. The first node of an invocation starts from the defaults
 * instead (see {@link #forReplay(ObjectNode, JsonNode)}). There is no process-wide instance.
 * Node runners work on a {@link #copy()} and {@link #replaceWith(WorkflowVariables) commit} it
 * only when the node succeeds.
 */
public final class WorkflowVariables {

  private final ObjectNode values;

  private WorkflowVariables(ObjectNode values) {
    this.values = values;
  }

  public static WorkflowVariables empty() {
    return new WorkflowVariables(JsonNodeFactory.instance.objectNode());
  }

  /** Wrap a deep copy of {@code values}. */
  public static WorkflowVariables of(ObjectNode values) {
    return new WorkflowVariables(
        values == null ? JsonNodeFactory.instance.objectNode() : values.deepCopy());
  }

  /**
   * Build the mapping for a node: workflow defaults first, then every entry of the persisted
   * snapshot, which wins on conflicts.
   */
  public static WorkflowVariables fromStore(ObjectNode defaults, JsonNode persisted) {
    WorkflowVariables vars = of(defaults);
    if (persisted != null && persisted.isObject()) {
      vars.values.setAll(((ObjectNode) persisted).deepCopy());
    }
    return vars;
  }

  /**
   * Build the mapping for the first node of an invocation. Declared variables restart from their
   * workflow defaults so that counters are rebuilt by replaying the flow; persisted entries that
   * the workflow does not declare are carried over.
   */
  public static WorkflowVariables forReplay(ObjectNode defaults, JsonNode persisted) {
    WorkflowVariables vars = empty();
    if (persisted != null && persisted.isObject()) {
      vars.values.setAll(((ObjectNode) persisted).deepCopy());
    }
    if (defaults != null) {
      vars.values.setAll(defaults.deepCopy());
    }
    return vars;
  }

  public boolean has(String name) {
    return values.has(name);
  }

  public Optional<JsonNode> get(String name) {
    return Optional.ofNullable(values.get(name));
  }

  /**
   * Look up a dotted path inside the mapping, e.g. {@code limits.max_iterations}. Only objects are
   * traversed; anything else yields an empty result.
   */
  public Optional<JsonNode> lookup(String path) {
    if (path == null || path.isBlank()) {
      return Optional.empty();
    }
    if (values.has(path)) {
      return Optional.of(values.get(path));
    }
    JsonNode current = values;
    for (String part : path.split("\\.")) {
      String key = part.trim();
      if (key.isEmpty()) {
        continue;
      }
      if (current == null || !current.isObject() || !current.has(key)) {
        return Optional.empty();
      }
      current = current.get(key);
    }
    return current == values ? Optional.empty() : Optional.of(current);
  }

  public void set(String name, JsonNode value) {
    values.set(name, value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy());
  }

  /**
   * Increment the numeric variable at {@code path} by one.
   *
   * @param post when true return the value before the increment, otherwise the new value.
   * @throws UnresolvedVariableException when the variable does not exist or is not a number.
   */
  public JsonNode increment(String path, boolean post) {
    String[] parts = path.split("\\.");
    ObjectNode container = values;
    for (int i = 0; i < parts.length - 1; i++) {
      JsonNode next = container.get(parts[i].trim());
      if (next == null || !next.isObject()) {
        throw new UnresolvedVariableException("Variable '" + path + "' not found for increment");
      }
      container = (ObjectNode) next;
    }
    String key = parts[parts.length - 1].trim();
    if (key.isEmpty()) {
      throw new UnresolvedVariableException("Invalid variable name for increment: '" + path + "'");
    }
    JsonNode current = container.get(key);
    if (current == null) {
      throw new UnresolvedVariableException("Variable '" + path + "' not found for increment");
    }
    if (!current.isNumber()) {
      throw new UnresolvedVariableException(
          "Variable '" + path + "' must be numeric to increment, found " + current.getNodeType());
    }
    JsonNode incremented = plusOne(current);
    container.set(key, incremented);
    return post ? current : incremented;
  }

  private static JsonNode plusOne(JsonNode number) {
    if (number.isIntegralNumber() && number.canConvertToLong()) {
      long next = number.longValue() + 1;
      return next <= Integer.MAX_VALUE && next >= Integer.MIN_VALUE
          ? IntNode.valueOf((int) next)
          : LongNode.valueOf(next);
    }
    return DoubleNode.valueOf(number.doubleValue() + 1.0);
  }

  /** Independent deep copy used as a working or scratch mapping. */
  public WorkflowVariables copy() {
    return new WorkflowVariables(values.deepCopy());
  }

  /** Replace every entry with the entries of {@code other}; used to commit a working copy. */
  public void replaceWith(WorkflowVariables other) {
    values.removeAll();
    values.setAll(other.values.deepCopy());
  }

  /** Deep copy of the current entries, suitable for persisting or exposing read-only. */
  public ObjectNode snapshot() {
    return values.deepCopy();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
