package com.gentoro.optiflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.capability.CapabilityRegistry;
import com.gentoro.optiflow.exception.CapabilityException;
import com.gentoro.optiflow.exception.OptiFlowException;
import com.gentoro.optiflow.exception.PathException;
import com.gentoro.optiflow.store.StoreAccessor;
import com.gentoro.optiflow.store.StorePath;
import com.gentoro.optiflow.workflow.ExecuteNode;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs {@link ExecuteNode}s.
 *
 * <p>Execution order for one node:
 *
 * <ol>
 *   <li>Render inputs, then output destinations in declaration order, against a working copy of
 *       the variables. Increments happen exactly once per node, whether it runs or is skipped.
 *   <li>If {@code skipIfOutputPresent} is set and the primary output already exists, commit the
 *       working variables, apply variable outputs and stop.
 *   <li>Replace every input that names an existing store path by the stored value.
 *   <li>Invoke the capability with a snapshot of the store, including current variables.
 *   <li>Write each value output with metadata to a staged copy of the store, attach provenance to
 *       the primary output, apply variable outputs, and only then publish the staged store and
 *       commit the variables.
 * </ol>
 *
 * <p>An output whose name matches an existing variable also updates that variable: a value output
 * with the returned value, a provenance output with its rendered path. On skip, a matching value
 * output is re-read from the stored destination.
 *
 * <p>A failure at any step leaves both {@code store} and {@code vars} untouched.
 */
public class ExecuteNodeRunner {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(ExecuteNodeRunner.class);

  private final CapabilityRegistry registry;
  private final Clock clock;

  public ExecuteNodeRunner(CapabilityRegistry registry, Clock clock) {
    this.registry = registry;
    this.clock = clock;
  }

  public NodeOutcome run(ExecuteNode node, ObjectNode store, WorkflowVariables vars) {
    WorkflowVariables working = vars.copy();
    ObjectNode inputs = (ObjectNode) TemplateResolver.renderValue(node.inputs(), working, store);
    Map<String, JsonNode> destinations = new LinkedHashMap<>();
    node.outputs()
        .forEach(
            (name, template) ->
                destinations.put(name, render(node, name, template, working, store)));

    if (node.skipIfOutputPresent()) {
      String primary = asPath(node, ExecuteNode.PRIMARY_OUTPUT, destinations);
      if (StoreAccessor.isPresent(store, primary)) {
        applyVariableOutputs(node, destinations, working);
        syncNamedVariablesOnSkip(destinations, working, store);
        vars.replaceWith(working);
        log.info("Skipping node '{}': output already present at '{}'", node.id(), primary);
        return NodeOutcome.skipped(node.id());
      }
    }

    ObjectNode params = dereferenceInputs(inputs, store);
    ObjectNode context = store.deepCopy();
    context.set("vars", working.snapshot());
    log.debug("Invoking capability '{}' for node '{}'", node.node(), node.id());
    JsonNode result = registry.invoke(node.node(), context, params);

    ObjectNode staged = store.deepCopy();
    writeOutputs(node, result, destinations, staged, working);
    applyVariableOutputs(node, destinations, working);

    store.removeAll();
    store.setAll(staged);
    vars.replaceWith(working);
    log.info("Node '{}' executed capability '{}'", node.id(), node.node());
    return NodeOutcome.executed(node.id());
  }

  private void writeOutputs(
      ExecuteNode node,
      JsonNode result,
      Map<String, JsonNode> destinations,
      ObjectNode staged,
      WorkflowVariables working) {
    String primary = primaryOutput(node);
    if (primary != null && (result == null || !result.isObject())) {
      throw new CapabilityException(
              "Capability '%s' must return an object, got %s"
                  .formatted(node.node(), result == null ? "nothing" : result.getNodeType()))
          .withContext("node", node.id());
    }

    Map<String, String> provenance = new LinkedHashMap<>();
    destinations.forEach(
        (name, rendered) -> {
          if (ExecuteNode.isProvenanceOutput(name)) {
            provenance.put(name, TemplateResolver.stringify(rendered));
            if (working.has(name)) {
              working.set(name, rendered);
            }
          }
        });
    if (primary == null && !provenance.isEmpty()) {
      log.debug("Node '{}' declares provenance but no value output to attach it to", node.id());
    }

    Instant now = clock.instant();
    for (String name : node.outputs().keySet()) {
      if (!ExecuteNode.isValueOutput(name)) {
        continue;
      }
      JsonNode value = result.get(name);
      if (value == null) {
        throw new CapabilityException(
                "Capability '%s' returned no value for declared output '%s'"
                    .formatted(node.node(), name))
            .withContext("node", node.id());
      }
      if (working.has(name)) {
        working.set(name, value);
      }
      String path = asPath(node, name, destinations);
      if (path.startsWith(ExecuteNode.VARIABLE_PREFIX)) {
        working.set(variableName(node, path), value);
        continue;
      }
      StoreAccessor.writeWithMetadata(
          staged, path, value, now, name.equals(primary) ? provenance : null);
      log.debug("Node '{}' wrote output '{}' to '{}'", node.id(), name, path);
    }
  }

  /** {@code vars.<name>} outputs assign the rendered destination value to the named variable. */
  private static void applyVariableOutputs(
      ExecuteNode node, Map<String, JsonNode> destinations, WorkflowVariables working) {
    destinations.forEach(
        (name, rendered) -> {
          if (ExecuteNode.isVariableOutput(name)) {
            working.set(variableName(node, name), rendered);
          }
        });
  }

  private static void syncNamedVariablesOnSkip(
      Map<String, JsonNode> destinations, WorkflowVariables working, JsonNode store) {
    destinations.forEach(
        (name, rendered) -> {
          if (ExecuteNode.isVariableOutput(name) || !working.has(name)) {
            return;
          }
          if (ExecuteNode.isProvenanceOutput(name) || !rendered.isTextual()) {
            working.set(name, rendered);
            return;
          }
          String path = rendered.asText().trim();
          working.set(
              name,
              StorePath.tryParse(path)
                  .flatMap(p -> StoreAccessor.resolve(store, p))
                  .orElse(rendered));
        });
  }

  /** Inputs whose text names an existing store path are replaced by the stored value. */
  private static ObjectNode dereferenceInputs(ObjectNode inputs, JsonNode store) {
    ObjectNode params = JsonNodeFactory.instance.objectNode();
    for (Iterator<Map.Entry<String, JsonNode>> it = inputs.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode value = e.getValue();
      if (value.isTextual() && !value.asText().isBlank()) {
        Optional<JsonNode> stored =
            StorePath.tryParse(value.asText().trim())
                .flatMap(path -> StoreAccessor.resolve(store, path));
        if (stored.isPresent()) {
          params.set(e.getKey(), stored.get().deepCopy());
          continue;
        }
      }
      params.set(e.getKey(), value);
    }
    return params;
  }

  /** The output named {@code result}, or else the first declared value output. */
  private static String primaryOutput(ExecuteNode node) {
    String first = null;
    for (String name : node.outputs().keySet()) {
      if (!ExecuteNode.isValueOutput(name)) {
        continue;
      }
      if (ExecuteNode.PRIMARY_OUTPUT.equals(name)) {
        return name;
      }
      if (first == null) {
        first = name;
      }
    }
    return first;
  }

  private static JsonNode render(
      ExecuteNode node, String name, String template, WorkflowVariables vars, JsonNode store) {
    try {
      return TemplateResolver.render(template, vars, store);
    } catch (OptiFlowException e) {
      throw e.withContext("output", name).withContext("node", node.id());
    }
  }

  private static String asPath(ExecuteNode node, String name, Map<String, JsonNode> destinations) {
    JsonNode rendered = destinations.get(name);
    if (rendered == null || !rendered.isValueNode() || rendered.isNull()) {
      throw new PathException(
              "Output '%s' of node '%s' did not render to a store path".formatted(name, node.id()))
          .withContext("node", node.id());
    }
    String path = TemplateResolver.stringify(rendered).trim();
    if (path.isEmpty()) {
      throw new PathException(
              "Output '%s' of node '%s' rendered to an empty path".formatted(name, node.id()))
          .withContext("node", node.id());
    }
    return path;
  }

  private static String variableName(ExecuteNode node, String qualified) {
    String name = qualified.substring(ExecuteNode.VARIABLE_PREFIX.length()).trim();
    if (name.isEmpty()) {
      throw new PathException(
          "Node '" + node.id() + "' assigns to an unnamed variable");
    }
    return name;
  }
}
