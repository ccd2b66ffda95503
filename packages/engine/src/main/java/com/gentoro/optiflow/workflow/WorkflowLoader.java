package com.gentoro.optiflow.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.exception.DefinitionException;
import com.gentoro.optiflow.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads workflow definitions from JSON and turns them into {@link WorkflowDefinition} instances.
 * Validation through {@link WorkflowValidator} always happens first, so a definition returned from
 * here is safe to execute.
 */
public final class WorkflowLoader {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(WorkflowLoader.class);

  private WorkflowLoader() {}

  /** Read, validate and map the definition stored at {@code path}. */
  public static WorkflowDefinition load(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new DefinitionException("Workflow definition not found: " + path);
    }
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(path.toFile());
    } catch (IOException e) {
      throw new DefinitionException("Workflow definition " + path + " is not valid JSON", e);
    }
    WorkflowDefinition definition = fromJson(root);
    log.debug(
        "Loaded workflow '{}' ({} nodes) from {}",
        definition.name(),
        definition.flow().size(),
        path);
    return definition;
  }

  /** Validate and map an already parsed definition. */
  public static WorkflowDefinition fromJson(JsonNode root) {
    WorkflowValidator.validate(root);

    List<WorkflowNode> flow = new ArrayList<>();
    for (JsonNode node : root.get("flow")) {
      flow.add(
          switch (WorkflowValidator.nodeType(node)) {
            case WorkflowValidator.TYPE_EXECUTE -> toExecuteNode(node);
            case WorkflowValidator.TYPE_CONDITIONAL -> toConditionalNode(node);
            default ->
                throw new DefinitionException(
                    "Unsupported node type encountered: " + node.path("type").asText());
          });
    }
    JsonNode vars = root.get("vars");
    return new WorkflowDefinition(
        root.get("name").asText(),
        root.get("code_type").asText(),
        vars != null && vars.isObject() ? (ObjectNode) vars : null,
        flow);
  }

  private static ExecuteNode toExecuteNode(JsonNode node) {
    Map<String, String> outputs = new LinkedHashMap<>();
    JsonNode outputsNode = node.get("outputs");
    if (outputsNode != null && outputsNode.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = outputsNode.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        outputs.put(e.getKey(), e.getValue().asText());
      }
    }
    JsonNode inputs = node.get("inputs");
    return new ExecuteNode(
        node.get("id").asText(),
        node.get("node").asText(),
        node.path("skipIfOutputPresent").asBoolean(false),
        inputs != null && inputs.isObject() ? (ObjectNode) inputs : null,
        outputs);
  }

  private static ConditionalNode toConditionalNode(JsonNode node) {
    List<Branch> branches = new ArrayList<>();
    for (JsonNode branch : node.get("branches")) {
      JsonNode value = branch.get("value");
      branches.add(
          new Branch(
              value == null || value.isNull() ? null : value.asText(),
              toCondition(branch.get("condition")),
              branch.get("goto").asText()));
    }
    return new ConditionalNode(node.get("id").asText(), branches, node.get("else").asText());
  }

  private static BranchCondition toCondition(JsonNode condition) {
    if (condition == null || condition.isNull()) {
      return null;
    }
    if (condition.has("expression")) {
      return BranchCondition.scripted(condition.get("expression").asText());
    }
    if (condition.has("python")) {
      return BranchCondition.scripted(condition.get("python").asText());
    }
    return BranchCondition.comparator(
        condition.get("op").asText(), condition.get("compare_to").asText());
  }
}
