package com.gentoro.optiflow.workflow;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.optiflow.exception.DefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link WorkflowValidator}. */
class WorkflowValidatorTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  @DisplayName("valid loop workflow passes validation")
  void validWorkflowPasses() throws Exception {
    String json =
        """
        {
          "name": "score-loop",
          "code_type": "kubernetes",
          "vars": {"iter": 0},
          "flow": [
            {"id": "score", "type": "execute", "node": "scorer", "skipIfOutputPresent": true,
             "inputs": {"manifest": "inputs.code"},
             "outputs": {"result": "results.evaluation_{{++iter}}", "manifest_key": "inputs.code"}},
            {"id": "check", "type": "conditional",
             "branches": [
               {"value": "{{iter}}", "condition": {"op": ">=", "compare_to": 3}, "goto": "END"},
               {"condition": {"python": "value < 0.9"}, "value": "0.5", "goto": "score"}
             ],
             "else": "score"}
          ]
        }
        """;
    JsonNode definition = mapper.readTree(json);
    assertDoesNotThrow(() -> WorkflowValidator.validate(definition));
  }

  @Test
  @DisplayName("empty flow fails")
  void emptyFlowFails() throws Exception {
    JsonNode definition =
        mapper.readTree("{\"name\": \"w\", \"code_type\": \"k8s\", \"flow\": []}");
    assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(definition));
  }

  @Test
  @DisplayName("duplicate node ids fail")
  void duplicateIdsFail() throws Exception {
    String json =
        """
        {
          "name": "w", "code_type": "k8s",
          "flow": [
            {"id": "a", "type": "execute", "node": "x"},
            {"id": "a", "type": "execute", "node": "y"}
          ]
        }
        """;
    JsonNode definition = mapper.readTree(json);
    DefinitionException e =
        assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(definition));
    assertTrue(e.getMessage().contains("Duplicate"));
  }

  @Test
  @DisplayName("goto must reference END or an existing node")
  void unknownTargetFails() throws Exception {
    String json =
        """
        {
          "name": "w", "code_type": "k8s",
          "flow": [
            {"id": "c", "type": "conditional",
             "branches": [{"value": "1", "condition": {"op": "==", "compare_to": "1"},
                           "goto": "missing"}],
             "else": "END"}
          ]
        }
        """;
    JsonNode definition = mapper.readTree(json);
    DefinitionException e =
        assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(definition));
    assertTrue(e.getMessage().contains("missing"));
  }

  @Test
  @DisplayName("conditional nodes require an else target")
  void missingElseFails() throws Exception {
    String json =
        """
        {
          "name": "w", "code_type": "k8s",
          "flow": [
            {"id": "c", "type": "conditional",
             "branches": [{"value": "1", "condition": {"op": "==", "compare_to": "1"},
                           "goto": "END"}]}
          ]
        }
        """;
    JsonNode definition = mapper.readTree(json);
    assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(definition));
  }

  @Test
  @DisplayName("unsupported comparator fails")
  void unsupportedComparatorFails() throws Exception {
    String json =
        """
        {
          "name": "w", "code_type": "k8s",
          "flow": [
            {"id": "c", "type": "conditional",
             "branches": [{"value": "1", "condition": {"op": "=~", "compare_to": "1"},
                           "goto": "END"}],
             "else": "END"}
          ]
        }
        """;
    JsonNode definition = mapper.readTree(json);
    assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(definition));
  }

  @Test
  @DisplayName("skipIfOutputPresent without a result output fails")
  void skipWithoutResultOutputFails() throws Exception {
    String json =
        """
        {
          "name": "w", "code_type": "k8s",
          "flow": [
            {"id": "a", "type": "execute", "node": "x", "skipIfOutputPresent": true,
             "outputs": {"report": "results.report"}}
          ]
        }
        """;
    JsonNode definition = mapper.readTree(json);
    assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(definition));
  }

  @Test
  @DisplayName("unknown node types and unknown fields fail")
  void unknownTypeAndFieldsFail() throws Exception {
    JsonNode badType =
        mapper.readTree(
            """
            {"name": "w", "code_type": "k8s",
             "flow": [{"id": "a", "type": "parallel", "node": "x"}]}
            """);
    JsonNode badField =
        mapper.readTree(
            """
            {"name": "w", "code_type": "k8s",
             "flow": [{"id": "a", "type": "execute", "node": "x", "retries": 3}]}
            """);
    assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(badType));
    assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(badField));
  }

  @Test
  @DisplayName("a comparator condition needs a branch value")
  void comparatorWithoutValueFails() throws Exception {
    String json =
        """
        {
          "name": "w", "code_type": "k8s",
          "flow": [
            {"id": "c", "type": "conditional",
             "branches": [{"condition": {"op": "==", "compare_to": "1"}, "goto": "END"}],
             "else": "END"}
          ]
        }
        """;
    JsonNode definition = mapper.readTree(json);
    assertThrows(DefinitionException.class, () -> WorkflowValidator.validate(definition));
  }
}
