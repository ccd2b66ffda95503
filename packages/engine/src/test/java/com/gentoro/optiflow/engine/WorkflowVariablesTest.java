package com.gentoro.optiflow.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.exception.UnresolvedVariableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WorkflowVariablesTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private ObjectNode json(String text) throws Exception {
    return (ObjectNode) mapper.readTree(text);
  }

  @Test
  @DisplayName("persisted values override workflow defaults")
  void persistedOverridesDefaults() throws Exception {
    WorkflowVariables vars =
        WorkflowVariables.fromStore(
            json("{\"iter\": 0, \"threshold\": 0.9}"), json("{\"iter\": 2, \"last\": \"x\"}"));

    assertEquals(2, vars.get("iter").orElseThrow().asInt());
    assertEquals(0.9, vars.get("threshold").orElseThrow().asDouble());
    assertTrue(vars.has("last"));
  }

  @Test
  @DisplayName("increments keep integers integral and nested counters work")
  void increments() throws Exception {
    WorkflowVariables vars = WorkflowVariables.of(json("{\"score\": 0.5, \"loop\": {\"i\": 1}}"));

    assertEquals(1.5, vars.increment("score", false).asDouble());
    assertEquals(1, vars.increment("loop.i", true).asInt());
    assertEquals(2, vars.lookup("loop.i").orElseThrow().asInt());
    assertTrue(vars.lookup("loop.i").orElseThrow().isInt());
    assertThrows(UnresolvedVariableException.class, () -> vars.increment("loop.j", false));
  }

  @Test
  @DisplayName("copies are independent until committed")
  void copyAndCommit() throws Exception {
    WorkflowVariables vars = WorkflowVariables.of(json("{\"n\": 1}"));
    WorkflowVariables working = vars.copy();
    working.increment("n", false);

    assertEquals(1, vars.get("n").orElseThrow().asInt());
    vars.replaceWith(working);
    assertEquals(2, vars.get("n").orElseThrow().asInt());
    assertFalse(vars.lookup("n.deeper").isPresent());
  }
}
