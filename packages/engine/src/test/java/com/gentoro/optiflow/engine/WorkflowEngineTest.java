package com.gentoro.optiflow.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.capability.Capability;
import com.gentoro.optiflow.capability.CapabilityRegistry;
import com.gentoro.optiflow.exception.CapabilityException;
import com.gentoro.optiflow.exception.NodeExecutionException;
import com.gentoro.optiflow.exception.OptiFlowErrorCode;
import com.gentoro.optiflow.exception.StoreException;
import com.gentoro.optiflow.store.JsonFileStoreRepository;
import com.gentoro.optiflow.store.StoreRepository;
import com.gentoro.optiflow.workflow.WorkflowDefinition;
import com.gentoro.optiflow.workflow.WorkflowLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowEngineTest {

  private static final String LOOP_WORKFLOW =
      """
      {
        "name": "optimize",
        "code_type": "kubernetes",
        "vars": {"iter": 0},
        "flow": [
          {"id": "score", "type": "execute", "node": "scorer", "skipIfOutputPresent": true,
           "inputs": {"manifest": "inputs.code"},
           "outputs": {"result": "results.evaluation_{{++iter}}", "manifest_key": "inputs.code"}},
          {"id": "check", "type": "conditional",
           "branches": [
             {"value": "{{iter}}", "condition": {"op": ">=", "compare_to": "3"}, "goto": "END"}
           ],
           "else": "score"}
        ]
      }
      """;

  @TempDir Path dir;

  private final ObjectMapper mapper = new ObjectMapper();
  private CapabilityRegistry registry;
  private WorkflowEngine engine;
  private Path storeFile;

  @BeforeEach
  void setUp() throws Exception {
    registry = new CapabilityRegistry();
    engine =
        new WorkflowEngine(
            registry, Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    storeFile = dir.resolve("store.json");
    Files.writeString(storeFile, "{\"inputs\": {\"code\": \"kind: Deployment\"}}");
  }

  private WorkflowDefinition workflow(String json) throws Exception {
    return WorkflowLoader.fromJson(mapper.readTree(json));
  }

  private JsonNode storeOnDisk() throws Exception {
    return mapper.readTree(storeFile.toFile());
  }

  @Test
  @DisplayName("loop runs three passes and persists every evaluation")
  void loopRunsToEnd() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    registry.register(
        "scorer",
        (context, params) -> {
          ObjectNode out = mapper.createObjectNode();
          out.putObject("result")
              .put("score", calls.incrementAndGet() / 10.0)
              .put("manifest", params.get("manifest").asText());
          return out;
        });

    WorkflowRunResult result =
        engine.run(workflow(LOOP_WORKFLOW), new JsonFileStoreRepository(storeFile));

    assertEquals(WorkflowRunResult.Termination.END_REACHED, result.termination());
    assertEquals(6, result.visitedNodes());
    assertEquals(3, result.executedNodes());
    assertEquals(0, result.skippedNodes());
    assertEquals("check", result.lastNodeId());

    JsonNode store = storeOnDisk();
    assertEquals(3, store.at("/vars/iter").asInt());
    for (int i = 1; i <= 3; i++) {
      JsonNode evaluation = store.at("/results/evaluation_" + i);
      assertEquals(i / 10.0, evaluation.get("score").asDouble());
      assertEquals("kind: Deployment", evaluation.get("manifest").asText());
      assertEquals("inputs.code", evaluation.get("manifest_key").asText());
      assertEquals("2026-03-01T10:00:00Z", evaluation.get("created_at").asText());
    }
    assertTrue(store.at("/results/evaluation_4").isMissingNode());
  }

  @Test
  @DisplayName("existing outputs are skipped without invoking the capability")
  void idempotentSkip() throws Exception {
    Files.writeString(
        storeFile,
        """
        {"inputs": {"code": "kind: Deployment"},
         "results": {"evaluation_1": {"score": 0.1, "created_at": "2025-12-31T00:00:00Z"}}}
        """);
    JsonNode previous = storeOnDisk().at("/results/evaluation_1");
    Capability scorer = mock(Capability.class);
    registry.register("scorer", scorer);
    String single = LOOP_WORKFLOW.replace("\"compare_to\": \"3\"", "\"compare_to\": \"1\"");

    WorkflowRunResult result = engine.run(workflow(single), new JsonFileStoreRepository(storeFile));

    verify(scorer, never()).evaluate(any(), any());
    assertEquals(1, result.skippedNodes());
    assertEquals(0, result.executedNodes());
    assertEquals(previous, storeOnDisk().at("/results/evaluation_1"));
    assertEquals(1, storeOnDisk().at("/vars/iter").asInt());
  }

  @Test
  @DisplayName("a failing node keeps the store as flushed after the last good node")
  void failureKeepsLastGoodState() throws Exception {
    registry
        .register("scorer", (context, params) -> mapper.readTree("{\"result\": {\"score\": 1}}"))
        .register(
            "fixer",
            (context, params) -> {
              throw new IllegalStateException("model unavailable");
            });
    WorkflowDefinition definition =
        workflow(
            """
            {
              "name": "fix", "code_type": "kubernetes", "vars": {"iter": 0},
              "flow": [
                {"id": "score", "node": "scorer",
                 "outputs": {"result": "results.evaluation_{{++iter}}"}},
                {"id": "fix", "node": "fixer",
                 "outputs": {"result": "results.fix_{{++iter}}"}}
              ]
            }
            """);

    NodeExecutionException e =
        assertThrows(
            NodeExecutionException.class,
            () -> engine.run(definition, new JsonFileStoreRepository(storeFile)));

    assertEquals("fix", e.getNodeId());
    assertEquals(OptiFlowErrorCode.CAPABILITY_ERROR, e.getCode());
    assertInstanceOf(CapabilityException.class, e.getCause());
    JsonNode store = storeOnDisk();
    assertEquals(1, store.at("/vars/iter").asInt());
    assertEquals(1, store.at("/results/evaluation_1/score").asInt());
    assertFalse(store.path("results").has("fix_2"));
  }

  @Test
  @DisplayName("falling off the last node ends the run")
  void flowExhausted() throws Exception {
    registry.register("scorer", (context, params) -> mapper.readTree("{\"result\": 1}"));
    WorkflowDefinition definition =
        workflow(
            """
            {"name": "once", "code_type": "k8s",
             "flow": [{"id": "only", "node": "scorer", "outputs": {"result": "results.once"}}]}
            """);

    WorkflowRunResult result = engine.run(definition, new JsonFileStoreRepository(storeFile));

    assertEquals(WorkflowRunResult.Termination.FLOW_EXHAUSTED, result.termination());
    assertEquals("only", result.lastNodeId());
    assertEquals(1, storeOnDisk().at("/results/once").asInt());
    assertTrue(storeOnDisk().at("/vars").isObject());
  }

  @Test
  @DisplayName("an unreadable store fails before any node runs")
  void unreadableStore() throws Exception {
    Capability scorer = mock(Capability.class);
    registry.register("scorer", scorer);

    assertThrows(
        StoreException.class,
        () ->
            engine.run(
                workflow(LOOP_WORKFLOW), new JsonFileStoreRepository(dir.resolve("absent.json"))));
    verify(scorer, never()).evaluate(any(), any());
  }

  @Test
  @DisplayName("unexpected runtime failures are reported against the node")
  void unexpectedFailure() throws Exception {
    registry.register("scorer", (context, params) -> mapper.readTree("{\"result\": 1}"));
    StoreRepository repository = mock(StoreRepository.class);
    when(repository.load()).thenAnswer(invocation -> mapper.createObjectNode());
    when(repository.location()).thenReturn("memory");
    doThrow(new IllegalStateException("disk gone")).when(repository).save(any());

    NodeExecutionException e =
        assertThrows(
            NodeExecutionException.class, () -> engine.run(workflow(LOOP_WORKFLOW), repository));

    assertEquals("score", e.getNodeId());
    assertEquals(OptiFlowErrorCode.UNKNOWN, e.getCode());
    assertTrue(e.getMessage().contains("disk gone"));
  }

  @Test
  @DisplayName("score threshold and iteration bound stop the loop after three passes")
  void scoreThresholdAndIterationBound() throws Exception {
    Capability scorer = mock(Capability.class);
    when(scorer.evaluate(any(), any()))
        .thenAnswer(invocation -> mapper.readTree("{\"result\": {\"score\": 0.5}}"));
    registry.register("scorer", scorer);
    WorkflowDefinition definition =
        workflow(
            """
            {
              "name": "optimize", "code_type": "kubernetes", "vars": {"iter": 0},
              "flow": [
                {"id": "score", "node": "scorer", "skipIfOutputPresent": true,
                 "outputs": {"result": "results.evaluation_{{++iter}}"}},
                {"id": "good_enough", "type": "conditional",
                 "branches": [
                   {"value": "results.evaluation_{{iter}}.score",
                    "condition": {"op": ">=", "compare_to": "0.9"}, "goto": "END"}
                 ],
                 "else": "bounded"},
                {"id": "bounded", "type": "conditional",
                 "branches": [
                   {"value": "{{iter}}", "condition": {"op": ">=", "compare_to": "3"},
                    "goto": "END"}
                 ],
                 "else": "score"}
              ]
            }
            """);

    WorkflowRunResult result = engine.run(definition, new JsonFileStoreRepository(storeFile));

    verify(scorer, times(3)).evaluate(any(), any());
    assertEquals(WorkflowRunResult.Termination.END_REACHED, result.termination());
    assertEquals("bounded", result.lastNodeId());
    assertEquals(9, result.visitedNodes());
    assertEquals(0, result.skippedNodes());
    JsonNode store = storeOnDisk();
    assertEquals(3, store.at("/vars/iter").asInt());
    assertEquals(3, store.get("results").size());
    for (int i = 1; i <= 3; i++) {
      assertEquals(0.5, store.at("/results/evaluation_" + i + "/score").asDouble());
    }
  }

  @Test
  @DisplayName("a rerun after a failure replays finished nodes and resumes at the failed one")
  void rerunResumesAtFailedNode() throws Exception {
    List<String> calls = new ArrayList<>();
    AtomicBoolean validatorDown = new AtomicBoolean(true);
    registry
        .register("evaluator", recording("evaluate", calls))
        .register("transformer", recording("transform", calls))
        .register(
            "validator",
            (context, params) -> {
              calls.add("validate");
              if (validatorDown.get()) {
                throw new IllegalStateException("validator unreachable");
              }
              return mapper.readTree("{\"result\": {\"passed\": true}}");
            });
    WorkflowDefinition definition =
        workflow(
            """
            {
              "name": "pipeline", "code_type": "kubernetes", "vars": {"iter": 0},
              "flow": [
                {"id": "evaluate", "node": "evaluator", "skipIfOutputPresent": true,
                 "outputs": {"result": "r.eval_{{iter}}"}},
                {"id": "transform", "node": "transformer", "skipIfOutputPresent": true,
                 "outputs": {"result": "r.code_{{++iter}}"}},
                {"id": "validate", "node": "validator", "skipIfOutputPresent": true,
                 "outputs": {"result": "r.val_{{iter}}"}}
              ]
            }
            """);

    NodeExecutionException first =
        assertThrows(
            NodeExecutionException.class,
            () -> engine.run(definition, new JsonFileStoreRepository(storeFile)));
    assertEquals("validate", first.getNodeId());
    assertEquals(1, storeOnDisk().at("/vars/iter").asInt());
    JsonNode before = storeOnDisk().get("r");

    validatorDown.set(false);
    WorkflowRunResult rerun = engine.run(definition, new JsonFileStoreRepository(storeFile));

    assertEquals(List.of("evaluate", "transform", "validate", "validate"), calls);
    assertEquals(2, rerun.skippedNodes());
    assertEquals(1, rerun.executedNodes());
    JsonNode store = storeOnDisk();
    assertEquals(1, store.at("/vars/iter").asInt());
    assertEquals(before.get("eval_0"), store.at("/r/eval_0"));
    assertEquals(before.get("code_1"), store.at("/r/code_1"));
    assertTrue(store.at("/r/val_1/passed").asBoolean());
    assertEquals(3, store.get("r").size());
  }

  @Test
  @DisplayName("rerunning a completed loop skips every pass and leaves the store unchanged")
  void rerunOfCompletedRun() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    registry.register(
        "scorer",
        (context, params) -> {
          calls.incrementAndGet();
          return mapper.readTree("{\"result\": {\"score\": 0.1}}");
        });
    engine.run(workflow(LOOP_WORKFLOW), new JsonFileStoreRepository(storeFile));
    JsonNode completed = storeOnDisk();

    WorkflowRunResult rerun =
        engine.run(workflow(LOOP_WORKFLOW), new JsonFileStoreRepository(storeFile));

    assertEquals(3, calls.get());
    assertEquals(WorkflowRunResult.Termination.END_REACHED, rerun.termination());
    assertEquals(3, rerun.skippedNodes());
    assertEquals(0, rerun.executedNodes());
    assertEquals(completed, storeOnDisk());
  }

  private Capability recording(String name, List<String> calls) {
    return (context, params) -> {
      calls.add(name);
      return mapper.readTree("{\"result\": {\"node\": \"" + name + "\"}}");
    };
  }
}
