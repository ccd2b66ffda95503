package com.gentoro.optiflow.workflow;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node that dispatches to an external capability and persists what it returns.
 *
 * <p>Output names follow three conventions: names ending in {@value #PROVENANCE_SUFFIX} are
 * provenance outputs whose rendered template is stored verbatim, names starting with {@value
 * #VARIABLE_PREFIX} assign a workflow variable, and every other name is a value output that the
 * capability must return. The output named {@value #PRIMARY_OUTPUT} is the primary artifact used
 * for skip detection.
 *
 * @param id unique node id.
 * @param node capability reference, a registry name or a fully qualified class name.
 * @param skipIfOutputPresent skip the node when its primary output already exists in the store.
 * @param inputs parameter templates; string leaves of nested values are templates too.
 * @param outputs logical output name to destination template, in declaration order.
 */
public record ExecuteNode(
    String id,
    String node,
    boolean skipIfOutputPresent,
    ObjectNode inputs,
    Map<String, String> outputs)
    implements WorkflowNode {

  public static final String PRIMARY_OUTPUT = "result";
  public static final String PROVENANCE_SUFFIX = "_key";
  public static final String VARIABLE_PREFIX = "vars.";

  public ExecuteNode {
    inputs = inputs == null ? JsonNodeFactory.instance.objectNode() : inputs.deepCopy();
    outputs =
        outputs == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
  }

  @Override
  public ObjectNode inputs() {
    return inputs.deepCopy();
  }

  public static boolean isProvenanceOutput(String name) {
    return name.endsWith(PROVENANCE_SUFFIX);
  }

  public static boolean isVariableOutput(String name) {
    return name.startsWith(VARIABLE_PREFIX);
  }

  public static boolean isValueOutput(String name) {
    return !isProvenanceOutput(name) && !isVariableOutput(name);
  }
}
