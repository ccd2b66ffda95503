package com.gentoro.optiflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.optiflow.exception.ConditionException;
import com.gentoro.optiflow.store.StoreAccessor;
import com.gentoro.optiflow.store.StorePath;
import com.gentoro.optiflow.workflow.Branch;
import com.gentoro.optiflow.workflow.BranchCondition;
import java.util.Optional;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Decides whether a branch of a conditional node matches.
 *
 * <p>Comparator conditions render {@code value} and {@code compare_to}, resolve each side to an
 * operand and compare with these rules:
 *
 * <ol>
 *   <li>if either side is numeric, both are compared as numbers; when the other side cannot be
 *       read as a number only {@code !=} holds
 *   <li>if both sides are booleans they are compared as booleans
 *   <li>otherwise both sides are compared as text
 * </ol>
 *
 * <p>Scripted conditions are delegated to {@link ScriptedExpressionEvaluator}. A branch without a
 * condition always matches.
 */
public final class ConditionEvaluator {

  private ConditionEvaluator() {}

  /**
   * Evaluate a branch. Templates are rendered against {@code vars}, so callers pass a scratch copy
   * when increments must not leak.
   *
   * @throws ConditionException when the condition cannot be evaluated.
   */
  public static boolean matches(Branch branch, WorkflowVariables vars, JsonNode store) {
    BranchCondition condition = branch.condition();
    if (condition == null) {
      return true;
    }
    JsonNode value =
        branch.value() == null
            ? null
            : resolveOperand(TemplateResolver.render(branch.value(), vars, store), vars, store);
    if (condition.isScripted()) {
      String expression = TemplateResolver.renderText(condition.expression(), vars, store);
      return ScriptedExpressionEvaluator.evaluate(expression, value, vars.snapshot(), store);
    }
    JsonNode compareTo =
        resolveOperand(TemplateResolver.render(condition.compareTo(), vars, store), vars, store);
    return compare(condition.op(), value, compareTo);
  }

  /**
   * Resolve a rendered operand. Text is tried, in order, as a variable path, as a store path and as
   * a literal; text that is none of these is used as is. Typed values pass through.
   */
  public static JsonNode resolveOperand(JsonNode rendered, WorkflowVariables vars, JsonNode store) {
    if (rendered == null || !rendered.isTextual()) {
      return rendered;
    }
    String text = rendered.asText().trim();
    if (text.isEmpty()) {
      return rendered;
    }
    Optional<JsonNode> variable = vars.lookup(text);
    if (variable.isPresent()) {
      return variable.get();
    }
    Optional<JsonNode> stored =
        StorePath.tryParse(text).flatMap(path -> StoreAccessor.resolve(store, path));
    if (stored.isPresent()) {
      return stored.get();
    }
    return TemplateResolver.parseLiteral(text).orElse(TextNode.valueOf(rendered.asText()));
  }

  /** Compare two operands with one of {@link BranchCondition#OPERATORS}. */
  public static boolean compare(String op, JsonNode left, JsonNode right) {
    Double leftNumber = asNumber(left);
    Double rightNumber = asNumber(right);
    if (leftNumber != null || rightNumber != null) {
      if (leftNumber == null || rightNumber == null) {
        return "!=".equals(op);
      }
      return holds(op, Double.compare(leftNumber, rightNumber));
    }
    Boolean leftBool = asBoolean(left);
    Boolean rightBool = asBoolean(right);
    if (leftBool != null && rightBool != null) {
      return holds(op, Boolean.compare(leftBool, rightBool));
    }
    return holds(op, TemplateResolver.stringify(left).compareTo(TemplateResolver.stringify(right)));
  }

  private static boolean holds(String op, int comparison) {
    return switch (op) {
      case "==" -> comparison == 0;
      case "!=" -> comparison != 0;
      case ">" -> comparison > 0;
      case ">=" -> comparison >= 0;
      case "<" -> comparison < 0;
      case "<=" -> comparison <= 0;
      default -> throw new ConditionException("Unsupported comparator '" + op + "'");
    };
  }

  private static Double asNumber(JsonNode node) {
    if (node == null) {
      return null;
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      String text = node.asText().trim();
      return NumberUtils.isParsable(text) ? Double.valueOf(text) : null;
    }
    return null;
  }

  private static Boolean asBoolean(JsonNode node) {
    if (node == null) {
      return null;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isTextual()) {
      String text = node.asText().trim();
      if ("true".equalsIgnoreCase(text)) {
        return Boolean.TRUE;
      }
      if ("false".equalsIgnoreCase(text)) {
        return Boolean.FALSE;
      }
    }
    return null;
  }
}
