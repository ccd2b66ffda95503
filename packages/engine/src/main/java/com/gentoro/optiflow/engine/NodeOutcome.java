package com.gentoro.optiflow.engine;

/**
 * Result of running a single node.
 *
 * @param nodeId id of the node that ran.
 * @param kind what happened.
 * @param target routing target chosen by a conditional node, {@code null} for execute nodes.
 */
public record NodeOutcome(String nodeId, Kind kind, String target) {

  public enum Kind {
    EXECUTED,
    SKIPPED,
    ROUTED
  }

  public static NodeOutcome executed(String nodeId) {
    return new NodeOutcome(nodeId, Kind.EXECUTED, null);
  }

  public static NodeOutcome skipped(String nodeId) {
    return new NodeOutcome(nodeId, Kind.SKIPPED, null);
  }

  public static NodeOutcome routed(String nodeId, String target) {
    return new NodeOutcome(nodeId, Kind.ROUTED, target);
  }

  /** True when the loop should jump rather than fall through to the next node. */
  public boolean isRouted() {
    return kind == Kind.ROUTED;
  }
}
