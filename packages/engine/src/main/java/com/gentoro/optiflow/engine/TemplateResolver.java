package com.gentoro.optiflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.optiflow.exception.UnresolvedVariableException;
import com.gentoro.optiflow.store.StoreAccessor;
import com.gentoro.optiflow.utility.JacksonUtility;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Renders {@code {{...}}} placeholders against the workflow variables and the store.
 *
 * <p>Supported placeholder forms:
 *
 * <ul>
 *   <li>{@code {{++name}}}: pre-increment, substitutes the new value
 *   <li>{@code {{name++}}}: post-increment, substitutes the old value
 *   <li>{@code {{vars.a.b}}}: nested variable lookup
 *   <li>{@code {{store.a.b}}}: store lookup
 *   <li>{@code {{name}}}: top-level variable
 *   <li>{@code true}, {@code false}, {@code null}/{@code none} and numbers as literals
 * </ul>
 *
 * <p>Placeholders are evaluated strictly left to right, so increments inside one template observe
 * each other. A template consisting of exactly one placeholder keeps the value's JSON type; any
 * other template renders to text. Rendering mutates {@code vars} when increments are present.
 */
public final class TemplateResolver {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^{}]+)}}");
  private static final String VARS_PREFIX = "vars.";
  private static final String STORE_PREFIX = "store.";

  private TemplateResolver() {}

  /**
   * Render a template.
   *
   * @return the typed value when the template is a single placeholder, otherwise a text node.
   * @throws UnresolvedVariableException when a placeholder refers to nothing.
   */
  public static JsonNode render(String template, WorkflowVariables vars, JsonNode store) {
    if (template == null) {
      return NullNode.getInstance();
    }
    Matcher single = PLACEHOLDER.matcher(StringUtils.strip(template));
    if (single.matches()) {
      return evaluate(single.group(1).trim(), vars, store);
    }
    Matcher matcher = PLACEHOLDER.matcher(template);
    if (!matcher.find()) {
      return TextNode.valueOf(template);
    }

    StringBuilder out = new StringBuilder();
    int last = 0;
    do {
      out.append(template, last, matcher.start());
      out.append(stringify(evaluate(matcher.group(1).trim(), vars, store)));
      last = matcher.end();
    } while (matcher.find());
    out.append(template.substring(last));
    return TextNode.valueOf(out.toString());
  }

  /** Render a template and return its text form. */
  public static String renderText(String template, WorkflowVariables vars, JsonNode store) {
    return stringify(render(template, vars, store));
  }

  /**
   * Render every string leaf of {@code value}, descending into objects and arrays. Non-string
   * leaves are copied unchanged. The input is never modified.
   */
  public static JsonNode renderValue(JsonNode value, WorkflowVariables vars, JsonNode store) {
    if (value == null) {
      return NullNode.getInstance();
    }
    if (value.isTextual()) {
      return render(value.asText(), vars, store);
    }
    if (value.isObject()) {
      ObjectNode out = JsonNodeFactory.instance.objectNode();
      for (Iterator<Map.Entry<String, JsonNode>> it = value.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        out.set(e.getKey(), renderValue(e.getValue(), vars, store));
      }
      return out;
    }
    if (value.isArray()) {
      ArrayNode out = JsonNodeFactory.instance.arrayNode();
      for (JsonNode item : value) {
        out.add(renderValue(item, vars, store));
      }
      return out;
    }
    return value.deepCopy();
  }

  /**
   * Text form used when a value is interpolated: booleans as {@code true}/{@code false}, null as
   * {@code null}, containers as compact JSON.
   */
  public static String stringify(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return "null";
    }
    if (value.isTextual()) {
      return value.asText();
    }
    if (value.isContainerNode()) {
      return JacksonUtility.toCompactJson(value);
    }
    return value.asText();
  }

  /**
   * Parse a literal token: {@code true}, {@code false}, {@code null}/{@code none} (any case) or a
   * number.
   */
  public static Optional<JsonNode> parseLiteral(String token) {
    if (token == null) {
      return Optional.empty();
    }
    String text = token.trim();
    switch (text.toLowerCase()) {
      case "true":
        return Optional.of(BooleanNode.TRUE);
      case "false":
        return Optional.of(BooleanNode.FALSE);
      case "null":
      case "none":
        return Optional.of(NullNode.getInstance());
      default:
        break;
    }
    if (NumberUtils.isParsable(text)) {
      if (text.contains(".")) {
        return Optional.of(DoubleNode.valueOf(Double.parseDouble(text)));
      }
      try {
        return Optional.of(LongNode.valueOf(Long.parseLong(text)));
      } catch (NumberFormatException e) {
        return Optional.of(DoubleNode.valueOf(Double.parseDouble(text)));
      }
    }
    return Optional.empty();
  }

  private static JsonNode evaluate(String expression, WorkflowVariables vars, JsonNode store) {
    if (expression.isEmpty()) {
      throw new UnresolvedVariableException("Empty placeholder in template");
    }
    if (expression.startsWith("++")) {
      return vars.increment(expression.substring(2).trim(), false).deepCopy();
    }
    if (expression.endsWith("++")) {
      return vars.increment(expression.substring(0, expression.length() - 2).trim(), true)
          .deepCopy();
    }
    if (expression.startsWith(VARS_PREFIX)) {
      String path = expression.substring(VARS_PREFIX.length());
      return vars.lookup(path)
          .map(n -> (JsonNode) n.deepCopy())
          .orElseThrow(
              () -> new UnresolvedVariableException("Variable '" + path + "' is not defined"));
    }
    if (expression.startsWith(STORE_PREFIX)) {
      String path = expression.substring(STORE_PREFIX.length());
      return StoreAccessor.resolve(store, path)
          .map(n -> (JsonNode) n.deepCopy())
          .orElseThrow(
              () ->
                  new UnresolvedVariableException(
                      "Store path '" + path + "' referenced by template is not present"));
    }
    Optional<JsonNode> variable = vars.get(expression);
    if (variable.isPresent()) {
      return variable.get().deepCopy();
    }
    return parseLiteral(expression)
        .orElseThrow(
            () ->
                new UnresolvedVariableException(
                    "Unresolved template placeholder '{{" + expression + "}}'"));
  }
}
