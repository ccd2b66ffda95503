package com.gentoro.optiflow.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.capability.CapabilityRegistry;
import com.gentoro.optiflow.exception.ExceptionUtil;
import com.gentoro.optiflow.exception.NodeExecutionException;
import com.gentoro.optiflow.exception.OptiFlowErrorCode;
import com.gentoro.optiflow.exception.OptiFlowException;
import com.gentoro.optiflow.store.StoreRepository;
import com.gentoro.optiflow.workflow.ConditionalNode;
import com.gentoro.optiflow.workflow.ExecuteNode;
import com.gentoro.optiflow.workflow.WorkflowDefinition;
import com.gentoro.optiflow.workflow.WorkflowNode;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Stateless execution loop for workflow definitions.
 *
 * <p>The only state the engine keeps while running is the index of the current node. Everything
 * else lives in the store document, which is reloaded before and flushed after every node:
 *
 * <ol>
 *   <li>Load the store from the {@link StoreRepository}.
 *   <li>Rebuild the variables from the workflow defaults overlaid with the stored {@code vars}.
 *       The first node of an invocation starts from the defaults alone.
 *   <li>Run the node ({@link ExecuteNodeRunner} or {@link ConditionalNodeRunner}).
 *   <li>Write the variables back under {@code vars} and flush the store.
 *   <li>Move to the successor, or to the routing target of a conditional node.
 * </ol>
 *
 * <p>The run ends when a target of {@code END} is reached or execution falls off the last node.
 * There is no iteration limit; loops terminate through their conditions. Because every node is
 * flushed, a process killed at any point can be resumed by running the same workflow against the
 * same store. Every invocation starts at the first node with the variables reset to the workflow
 * defaults, and nodes marked {@code skipIfOutputPresent} replay their variable effects without
 * invoking the capability again, so the counters of the earlier run are rebuilt step by step and
 * execution resumes at the first node whose output is missing.
 *
 * <p>A node failure is raised as a {@link NodeExecutionException}. The store keeps the state
 * flushed after the last successful node.
 */
public class WorkflowEngine {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(WorkflowEngine.class);

  /** Store entry holding the persisted variable snapshot. */
  public static final String VARS_KEY = "vars";

  private final ExecuteNodeRunner executeRunner;
  private final ConditionalNodeRunner conditionalRunner;

  public WorkflowEngine(CapabilityRegistry registry) {
    this(registry, Clock.systemUTC());
  }

  public WorkflowEngine(CapabilityRegistry registry, Clock clock) {
    this(new ExecuteNodeRunner(registry, clock), new ConditionalNodeRunner());
  }

  public WorkflowEngine(ExecuteNodeRunner executeRunner, ConditionalNodeRunner conditionalRunner) {
    this.executeRunner = executeRunner;
    this.conditionalRunner = conditionalRunner;
  }

  /**
   * Run {@code workflow} against the store managed by {@code repository}.
   *
   * @return summary of the run.
   * @throws com.gentoro.optiflow.exception.StoreException if the store cannot be read before the
   *     first node runs.
   * @throws NodeExecutionException if a node fails.
   */
  public WorkflowRunResult run(WorkflowDefinition workflow, StoreRepository repository) {
    List<WorkflowNode> flow = workflow.flow();
    Map<String, Integer> index = workflow.nodeIndex();
    ObjectNode defaults = workflow.vars();

    // fail fast on an unreadable store before any node is touched
    repository.load();
    log.info(
        "Running workflow '{}' ({} nodes) against {}",
        workflow.name(),
        flow.size(),
        repository.location());

    int current = 0;
    int visited = 0;
    int executed = 0;
    int skipped = 0;
    String lastNodeId = null;
    WorkflowRunResult.Termination termination = WorkflowRunResult.Termination.FLOW_EXHAUSTED;

    while (current < flow.size()) {
      WorkflowNode node = flow.get(current);
      lastNodeId = node.id();
      visited++;
      NodeOutcome outcome = runNode(node, repository, defaults, visited == 1);
      switch (outcome.kind()) {
        case EXECUTED -> executed++;
        case SKIPPED -> skipped++;
        default -> {}
      }

      if (!outcome.isRouted()) {
        current++;
        continue;
      }
      if (WorkflowNode.END.equals(outcome.target())) {
        termination = WorkflowRunResult.Termination.END_REACHED;
        break;
      }
      current = index.get(outcome.target());
    }

    WorkflowRunResult result =
        new WorkflowRunResult(workflow.name(), termination, lastNodeId, visited, executed, skipped);
    log.info(
        "Workflow '{}' finished ({}): {} node visits, {} executed, {} skipped, last node '{}'",
        workflow.name(),
        termination,
        visited,
        executed,
        skipped,
        lastNodeId);
    return result;
  }

  private NodeOutcome runNode(
      WorkflowNode node, StoreRepository repository, ObjectNode defaults, boolean replay) {
    try {
      ObjectNode store = repository.load();
      WorkflowVariables vars =
          replay
              ? WorkflowVariables.forReplay(defaults, store.get(VARS_KEY))
              : WorkflowVariables.fromStore(defaults, store.get(VARS_KEY));
      log.debug("Node '{}' starting with vars {}", node.id(), vars);

      NodeOutcome outcome;
      if (node instanceof ExecuteNode execute) {
        outcome = executeRunner.run(execute, store, vars);
      } else if (node instanceof ConditionalNode conditional) {
        outcome = conditionalRunner.run(conditional, store, vars);
      } else {
        throw new OptiFlowException(
            OptiFlowErrorCode.DEFINITION_ERROR,
            "Unsupported node type " + node.getClass().getSimpleName());
      }

      store.set(VARS_KEY, vars.snapshot());
      repository.save(store);
      return outcome;
    } catch (OptiFlowException e) {
      NodeExecutionException failure = new NodeExecutionException(node.id(), e);
      log.error("{} {}", failure.getMessage(), ExceptionUtil.toErrorDetails(e));
      throw failure;
    } catch (RuntimeException e) {
      NodeExecutionException failure =
          new NodeExecutionException(
              node.id(),
              new OptiFlowException(
                  OptiFlowErrorCode.UNKNOWN, ExceptionUtil.extractErrorMessage(e), e));
      log.error("{} at {}", failure.getMessage(), ExceptionUtil.formatCompactStackTrace(e));
      throw failure;
    }
  }
}
