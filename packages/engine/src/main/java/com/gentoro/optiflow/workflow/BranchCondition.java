package com.gentoro.optiflow.workflow;

import java.util.List;

/**
 * Predicate of a {@link Branch}: either a comparator ({@code op} + {@code compare_to}) or a
 * scripted boolean expression. Exactly one form is set; the loader enforces it.
 */
public record BranchCondition(String op, String compareTo, String expression) {

  public static final List<String> OPERATORS = List.of(">=", "<=", ">", "<", "==", "!=");

  public static BranchCondition comparator(String op, String compareTo) {
    return new BranchCondition(op, compareTo, null);
  }

  public static BranchCondition scripted(String expression) {
    return new BranchCondition(null, null, expression);
  }

  public boolean isScripted() {
    return expression != null;
  }
}
