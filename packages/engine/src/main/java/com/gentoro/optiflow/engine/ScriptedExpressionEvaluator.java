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
import com.gentoro.optiflow.exception.ConditionException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Sandboxed evaluator for scripted branch conditions.
 *
 * <p>Expressions use a small Python-like syntax and can read three bindings, all deep copies so
 * evaluation never mutates workflow state:
 *
 * <ul>
 *   <li>{@code value}: the resolved branch value, numeric text coerced to a number
 *   <li>{@code vars}: the variable mapping, numeric text values coerced to numbers
 *   <li>{@code store}: the store document
 * </ul>
 *
 * <p>Supported syntax:
 *
 * <ul>
 *   <li>Logic: {@code or}/{@code ||}, {@code and}/{@code &&}, {@code not}/{@code !}, evaluated with
 *       short-circuit semantics
 *   <li>Comparisons: {@code == != < <= > >=}, {@code in}, {@code not in}, {@code is}, {@code is
 *       not}, chainable as in {@code 0 < x <= 10}
 *   <li>Arithmetic: {@code + - * / // %} and unary minus
 *   <li>Access: {@code a.b}, {@code a['b']}, {@code a[0]} (negative indexes count from the end)
 *   <li>Literals: numbers, quoted strings, lists, {@code True/False/None} and {@code
 *       true/false/null}
 *   <li>Functions: {@code len}, {@code abs}, {@code min}, {@code max}
 * </ul>
 *
 * <p>Examples:
 *
 * <pre>{@code
 * value >= vars.threshold and store['results']['passed']
 * len(store.findings) == 0 or vars.iter >= 5
 * 'error' not in value
 * }</pre>
 *
 * <p>The final value is interpreted by truthiness. Any syntax or type error is reported as a {@link
 * ConditionException}.
 */
public final class ScriptedExpressionEvaluator {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final String s;
  private final int n;
  private int i;
  private final Map<String, JsonNode> bindings;

  private ScriptedExpressionEvaluator(String expr, Map<String, JsonNode> bindings) {
    this.s = expr;
    this.n = expr.length();
    this.i = 0;
    this.bindings = bindings;
  }

  /**
   * Evaluate {@code expression} and interpret the result as a boolean.
   *
   * @param value resolved branch value, may be null.
   * @param vars variable mapping.
   * @param store store document.
   */
  public static boolean evaluate(String expression, JsonNode value, JsonNode vars, JsonNode store) {
    return truthy(evaluateValue(expression, value, vars, store));
  }

  /** Evaluate {@code expression} and return the raw result. */
  public static JsonNode evaluateValue(
      String expression, JsonNode value, JsonNode vars, JsonNode store) {
    if (expression == null || expression.isBlank()) {
      throw new ConditionException("Scripted condition is empty");
    }
    Map<String, JsonNode> bindings =
        Map.of(
            "value", coerceNumeric(value),
            "vars", coerceNumericFields(vars),
            "store", store == null ? NullNode.getInstance() : store.deepCopy());
    ScriptedExpressionEvaluator p = new ScriptedExpressionEvaluator(expression, bindings);
    try {
      JsonNode result = p.parseOr(true);
      p.skipWs();
      if (p.i < p.n) {
        throw p.error("Unexpected input '" + p.s.substring(p.i) + "'");
      }
      return result;
    } catch (ArithmeticException | NumberFormatException e) {
      throw new ConditionException(
          "Failed to evaluate condition '" + expression + "': " + e.getMessage(), e);
    }
  }

  /** Python-style truthiness: null, false, zero and empty text or containers are false. */
  public static boolean truthy(JsonNode v) {
    if (v == null || v.isNull() || v.isMissingNode()) return false;
    if (v.isBoolean()) return v.booleanValue();
    if (v.isNumber()) return v.doubleValue() != 0.0;
    if (v.isTextual()) return !v.asText().isEmpty();
    if (v.isContainerNode()) return v.size() > 0;
    return true;
  }

  // Each parse method takes an 'active' flag; inactive branches are parsed but not evaluated.

  // Grammar: or := and (('or' | '||') and)*
  private JsonNode parseOr(boolean active) {
    JsonNode left = parseAnd(active);
    while (matchKeyword("or") || match("||")) {
      boolean done = active && truthy(left);
      JsonNode right = parseAnd(active && !done);
      if (active && !done) {
        left = right;
      }
    }
    return left;
  }

  // Grammar: and := not (('and' | '&&') not)*
  private JsonNode parseAnd(boolean active) {
    JsonNode left = parseNot(active);
    while (matchKeyword("and") || match("&&")) {
      boolean done = active && !truthy(left);
      JsonNode right = parseNot(active && !done);
      if (active && !done) {
        left = right;
      }
    }
    return left;
  }

  // Grammar: not := ('not' | '!') not | comparison
  private JsonNode parseNot(boolean active) {
    if (matchKeyword("not") || (peek() == '!' && peekAt(1) != '=' && match("!"))) {
      JsonNode operand = parseNot(active);
      return active ? BooleanNode.valueOf(!truthy(operand)) : NullNode.getInstance();
    }
    return parseComparison(active);
  }

  // Grammar: comparison := additive (op additive)*
  private JsonNode parseComparison(boolean active) {
    JsonNode left = parseAdditive(active);
    boolean compared = false;
    boolean holds = true;
    String op;
    while ((op = readComparisonOperator()) != null) {
      boolean evaluate = active && holds;
      JsonNode right = parseAdditive(evaluate);
      if (evaluate) {
        holds = compare(op, left, right);
      }
      left = right;
      compared = true;
    }
    if (!compared) {
      return left;
    }
    return active ? BooleanNode.valueOf(holds) : NullNode.getInstance();
  }

  // Grammar: additive := multiplicative (('+' | '-') multiplicative)*
  private JsonNode parseAdditive(boolean active) {
    JsonNode left = parseMultiplicative(active);
    while (true) {
      skipWs();
      char c = peek();
      if (c != '+' && c != '-') {
        return left;
      }
      i++;
      JsonNode right = parseMultiplicative(active);
      if (active) {
        left = arithmetic(String.valueOf(c), left, right);
      }
    }
  }

  // Grammar: multiplicative := unary (('*' | '/' | '//' | '%') unary)*
  private JsonNode parseMultiplicative(boolean active) {
    JsonNode left = parseUnary(active);
    while (true) {
      String op = readAny("//", "*", "/", "%");
      if (op == null) {
        return left;
      }
      JsonNode right = parseUnary(active);
      if (active) {
        left = arithmetic(op, left, right);
      }
    }
  }

  // Grammar: unary := ('-' | '+') unary | postfix
  private JsonNode parseUnary(boolean active) {
    if (match("-")) {
      JsonNode operand = parseUnary(active);
      if (!active) return operand;
      if (!operand.isNumber()) throw error("Unary '-' requires a number, got " + describe(operand));
      return operand.isIntegralNumber()
          ? LongNode.valueOf(-operand.longValue())
          : DoubleNode.valueOf(-operand.doubleValue());
    }
    if (match("+")) {
      JsonNode operand = parseUnary(active);
      if (active && !operand.isNumber()) {
        throw error("Unary '+' requires a number, got " + describe(operand));
      }
      return operand;
    }
    return parsePostfix(active);
  }

  // Grammar: postfix := primary ('.' name | '[' or ']')*
  private JsonNode parsePostfix(boolean active) {
    JsonNode current = parsePrimary(active);
    while (true) {
      skipWs();
      if (peek() == '.' && !Character.isDigit(peekAt(1))) {
        i++;
        String name = readIdentifier();
        if (name == null) throw error("Expected member name after '.'");
        if (active) current = member(current, name);
      } else if (peek() == '[') {
        i++;
        JsonNode key = parseOr(active);
        expect("]");
        if (active) current = subscript(current, key);
      } else {
        return current;
      }
    }
  }

  private JsonNode parsePrimary(boolean active) {
    skipWs();
    char c = peek();
    if (c == '(') {
      i++;
      JsonNode inner = parseOr(active);
      expect(")");
      return inner;
    }
    if (c == '[') {
      i++;
      ArrayNode list = NODES.arrayNode();
      if (!match("]")) {
        do {
          list.add(parseOr(active));
        } while (match(","));
        expect("]");
      }
      return list;
    }
    if (c == '"' || c == '\'') {
      return TextNode.valueOf(readString());
    }
    if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekAt(1)))) {
      return readNumber();
    }
    String name = readIdentifier();
    if (name == null) {
      throw error(i < n ? "Unexpected character '" + c + "'" : "Unexpected end of expression");
    }
    switch (name) {
      case "True", "true" -> {
        return BooleanNode.TRUE;
      }
      case "False", "false" -> {
        return BooleanNode.FALSE;
      }
      case "None", "null" -> {
        return NullNode.getInstance();
      }
      default -> {}
    }
    if (peek() == '(') {
      i++;
      List<JsonNode> args = new ArrayList<>();
      if (!match(")")) {
        do {
          args.add(parseOr(active));
        } while (match(","));
        expect(")");
      }
      return active ? call(name, args) : NullNode.getInstance();
    }
    JsonNode bound = bindings.get(name);
    if (bound == null) {
      if (active) throw error("Unknown name '" + name + "'");
      return NullNode.getInstance();
    }
    return bound;
  }

  private JsonNode member(JsonNode target, String name) {
    if (target.isObject()) {
      JsonNode v = target.get(name);
      return v == null ? NullNode.getInstance() : v;
    }
    throw error("Cannot read '" + name + "' of " + describe(target));
  }

  private JsonNode subscript(JsonNode target, JsonNode key) {
    if (target.isObject()) {
      JsonNode v = target.get(key.isTextual() ? key.asText() : TemplateResolver.stringify(key));
      return v == null ? NullNode.getInstance() : v;
    }
    if (target.isArray() || target.isTextual()) {
      if (!key.isIntegralNumber()) {
        throw error("Index must be an integer, got " + describe(key));
      }
      int size = target.isArray() ? target.size() : target.asText().length();
      int index = key.intValue() < 0 ? size + key.intValue() : key.intValue();
      if (index < 0 || index >= size) {
        throw error("Index " + key.intValue() + " out of range for length " + size);
      }
      return target.isArray()
          ? target.get(index)
          : TextNode.valueOf(String.valueOf(target.asText().charAt(index)));
    }
    throw error("Cannot index " + describe(target));
  }

  private JsonNode call(String name, List<JsonNode> args) {
    switch (name) {
      case "len" -> {
        requireArgs(name, args, 1);
        JsonNode arg = args.get(0);
        if (arg.isTextual()) return LongNode.valueOf(arg.asText().length());
        if (arg.isContainerNode()) return LongNode.valueOf(arg.size());
        throw error("len() not supported for " + describe(arg));
      }
      case "abs" -> {
        requireArgs(name, args, 1);
        JsonNode arg = args.get(0);
        if (!arg.isNumber()) throw error("abs() requires a number, got " + describe(arg));
        return arg.isIntegralNumber()
            ? LongNode.valueOf(Math.abs(arg.longValue()))
            : DoubleNode.valueOf(Math.abs(arg.doubleValue()));
      }
      case "min", "max" -> {
        List<JsonNode> candidates = args;
        if (args.size() == 1 && args.get(0).isArray()) {
          candidates = new ArrayList<>();
          args.get(0).forEach(candidates::add);
        }
        if (candidates.isEmpty()) throw error(name + "() arg is an empty sequence");
        JsonNode best = candidates.get(0);
        for (JsonNode candidate : candidates.subList(1, candidates.size())) {
          int cmp = order(candidate, best);
          if ("min".equals(name) ? cmp < 0 : cmp > 0) {
            best = candidate;
          }
        }
        return best;
      }
      default -> throw error("Unknown function '" + name + "'");
    }
  }

  private void requireArgs(String name, List<JsonNode> args, int count) {
    if (args.size() != count) {
      throw error(name + "() takes exactly " + count + " argument(s), got " + args.size());
    }
  }

  private boolean compare(String op, JsonNode a, JsonNode b) {
    return switch (op) {
      case "==" -> same(a, b);
      case "!=" -> !same(a, b);
      case "<" -> order(a, b) < 0;
      case "<=" -> order(a, b) <= 0;
      case ">" -> order(a, b) > 0;
      case ">=" -> order(a, b) >= 0;
      case "in" -> contains(b, a);
      case "not in" -> !contains(b, a);
      case "is" -> a.isNull() || b.isNull() ? a.isNull() && b.isNull() : same(a, b);
      case "is not" -> a.isNull() || b.isNull() ? !(a.isNull() && b.isNull()) : !same(a, b);
      default -> throw error("Unsupported operator '" + op + "'");
    };
  }

  private static boolean same(JsonNode a, JsonNode b) {
    if (a.isNumber() && b.isNumber()) {
      return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
    }
    return a.equals(b);
  }

  private int order(JsonNode a, JsonNode b) {
    if (a.isNumber() && b.isNumber()) return Double.compare(a.doubleValue(), b.doubleValue());
    if (a.isTextual() && b.isTextual()) return a.asText().compareTo(b.asText());
    if (a.isBoolean() && b.isBoolean()) return Boolean.compare(a.booleanValue(), b.booleanValue());
    throw error("Cannot order " + describe(a) + " and " + describe(b));
  }

  private boolean contains(JsonNode container, JsonNode item) {
    if (container.isTextual()) {
      if (!item.isTextual()) throw error("'in <string>' requires a string, got " + describe(item));
      return container.asText().contains(item.asText());
    }
    if (container.isArray()) {
      for (JsonNode element : container) {
        if (same(element, item)) return true;
      }
      return false;
    }
    if (container.isObject()) {
      return item.isTextual() && container.has(item.asText());
    }
    throw error("'in' requires a string, list or object, got " + describe(container));
  }

  private JsonNode arithmetic(String op, JsonNode a, JsonNode b) {
    if ("+".equals(op)) {
      if (a.isTextual() && b.isTextual()) return TextNode.valueOf(a.asText() + b.asText());
      if (a.isArray() && b.isArray()) {
        ArrayNode joined = ((ArrayNode) a).deepCopy();
        joined.addAll(((ArrayNode) b).deepCopy());
        return joined;
      }
    }
    if (!a.isNumber() || !b.isNumber()) {
      throw error("Unsupported operands for '" + op + "': " + describe(a) + " and " + describe(b));
    }
    boolean integral = a.isIntegralNumber() && b.isIntegralNumber();
    if (("/".equals(op) || "//".equals(op) || "%".equals(op)) && b.doubleValue() == 0.0) {
      throw error("Division by zero");
    }
    if (integral && !"/".equals(op)) {
      long x = a.longValue();
      long y = b.longValue();
      return LongNode.valueOf(
          switch (op) {
            case "+" -> Math.addExact(x, y);
            case "-" -> Math.subtractExact(x, y);
            case "*" -> Math.multiplyExact(x, y);
            case "//" -> Math.floorDiv(x, y);
            default -> Math.floorMod(x, y);
          });
    }
    double x = a.doubleValue();
    double y = b.doubleValue();
    return DoubleNode.valueOf(
        switch (op) {
          case "+" -> x + y;
          case "-" -> x - y;
          case "*" -> x * y;
          case "/" -> x / y;
          case "//" -> Math.floor(x / y);
          default -> x - y * Math.floor(x / y);
        });
  }

  private static JsonNode coerceNumeric(JsonNode value) {
    if (value == null) {
      return NullNode.getInstance();
    }
    if (value.isTextual()) {
      String text = value.asText().trim();
      if (NumberUtils.isParsable(text)) {
        return TemplateResolver.parseLiteral(text).orElse(value);
      }
    }
    return value.deepCopy();
  }

  private static JsonNode coerceNumericFields(JsonNode vars) {
    ObjectNode out = NODES.objectNode();
    if (vars != null && vars.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = vars.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        out.set(e.getKey(), coerceNumeric(e.getValue()));
      }
    }
    return out;
  }

  private static String describe(JsonNode v) {
    return v.getNodeType().name().toLowerCase() + " " + TemplateResolver.stringify(v);
  }

  private ConditionException error(String message) {
    return new ConditionException(message + " in condition '" + s + "' at position " + i);
  }

  // Lexer helpers
  private void skipWs() {
    while (i < n && Character.isWhitespace(s.charAt(i))) i++;
  }

  private boolean match(String token) {
    skipWs();
    if (s.startsWith(token, i)) {
      i += token.length();
      return true;
    }
    return false;
  }

  private boolean matchKeyword(String keyword) {
    skipWs();
    int end = i + keyword.length();
    if (s.startsWith(keyword, i) && (end >= n || !isIdentifierPart(s.charAt(end)))) {
      i = end;
      return true;
    }
    return false;
  }

  private void expect(String token) {
    if (!match(token)) throw error("Expected '" + token + "'");
  }

  private char peek() {
    skipWs();
    return i < n ? s.charAt(i) : '\0';
  }

  private char peekAt(int offset) {
    return i + offset < n ? s.charAt(i + offset) : '\0';
  }

  private String readAny(String... ops) {
    skipWs();
    for (String op : ops) {
      if (s.startsWith(op, i)) {
        i += op.length();
        return op;
      }
    }
    return null;
  }

  private String readComparisonOperator() {
    String op = readAny("==", "!=", "<=", ">=", "<", ">");
    if (op != null) return op;
    if (matchKeyword("in")) return "in";
    if (matchKeyword("is")) return matchKeyword("not") ? "is not" : "is";
    int mark = i;
    if (matchKeyword("not")) {
      if (matchKeyword("in")) return "not in";
      i = mark;
    }
    return null;
  }

  private String readIdentifier() {
    skipWs();
    int start = i;
    if (i < n && (Character.isLetter(s.charAt(i)) || s.charAt(i) == '_')) {
      i++;
      while (i < n && isIdentifierPart(s.charAt(i))) i++;
    }
    return start == i ? null : s.substring(start, i);
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private JsonNode readNumber() {
    skipWs();
    int start = i;
    boolean decimal = false;
    while (i < n && Character.isDigit(s.charAt(i))) i++;
    if (i < n && s.charAt(i) == '.') {
      decimal = true;
      i++;
      while (i < n && Character.isDigit(s.charAt(i))) i++;
    }
    if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      decimal = true;
      i++;
      if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
      while (i < n && Character.isDigit(s.charAt(i))) i++;
    }
    String num = s.substring(start, i);
    return decimal
        ? DoubleNode.valueOf(Double.parseDouble(num))
        : LongNode.valueOf(Long.parseLong(num));
  }

  private String readString() {
    skipWs();
    char quote = s.charAt(i++);
    StringBuilder sb = new StringBuilder();
    while (i < n) {
      char c = s.charAt(i++);
      if (c == quote) return sb.toString();
      if (c == '\\' && i < n) {
        char e = s.charAt(i++);
        switch (e) {
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          default -> sb.append(e);
        }
      } else {
        sb.append(c);
      }
    }
    throw error("Unterminated string literal");
  }
}
