package com.gentoro.optiflow.capability.validator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandValidatorCapabilityTest {

  private static final String MANIFEST = "apiVersion: v1\nkind: Pod\n";

  @TempDir Path dir;

  private static JsonNode validate(List<String> command, long timeoutMs, ObjectNode params)
      throws Exception {
    CommandValidatorCapability validator =
        new CommandValidatorCapability("kubeconform", command, timeoutMs);
    return validator.evaluate(JsonNodeFactory.instance.objectNode(), params).get("result");
  }

  private static ObjectNode manifest(String text) {
    return JsonNodeFactory.instance.objectNode().put("manifest", text);
  }

  @Test
  @DisplayName("exit code zero passes and output lines become info findings")
  void passingCommand() throws Exception {
    JsonNode report =
        validate(
            List.of("sh", "-c", "grep -q 'kind: Pod' && echo 'summary: 1 valid'"),
            5000,
            manifest(MANIFEST));

    assertTrue(report.get("passed").asBoolean());
    assertEquals("pass", report.get("overall_result").asText());
    assertEquals("info", report.at("/findings/0/severity").asText());
    assertEquals("summary: 1 valid", report.at("/findings/0/message").asText());
  }

  @Test
  @DisplayName("a nonzero exit code is a failure attributable to the manifest")
  void failingCommand() throws Exception {
    JsonNode report =
        validate(
            List.of("sh", "-c", "cat >/dev/null; echo 'line 2: missing limits'; exit 3"),
            5000,
            manifest(MANIFEST));

    assertFalse(report.get("passed").asBoolean());
    assertEquals("fail", report.get("overall_result").asText());
    assertTrue(report.get("content_attributable").asBoolean());
    assertTrue(report.get("reason").asText().contains("exit=3"));
    assertEquals("error", report.at("/findings/0/severity").asText());
    assertEquals("kubeconform", report.at("/findings/0/tool").asText());
  }

  @Test
  @DisplayName("output larger than the pipe buffer is still attributed to the manifest")
  void largeOutput() throws Exception {
    JsonNode report =
        validate(
            List.of(
                "sh",
                "-c",
                "cat >/dev/null; yes 'line 7: missing resource limits' | head -n 5000; exit 1"),
            10_000,
            manifest(MANIFEST));

    assertFalse(report.get("passed").asBoolean());
    assertTrue(report.get("content_attributable").asBoolean());
    assertTrue(report.get("reason").asText().contains("exit=1"), report.get("reason").asText());
    assertEquals(200, report.get("findings").size());
    assertEquals("line 7: missing resource limits", report.at("/findings/0/message").asText());
  }

  @Test
  @DisplayName("a missing binary or a timeout is not the manifest's fault")
  void toolFailures() throws Exception {
    JsonNode missing = validate(List.of("/nonexistent/kubeconform"), 5000, manifest(MANIFEST));
    JsonNode slow = validate(List.of("sh", "-c", "sleep 5"), 200, manifest(MANIFEST));

    assertFalse(missing.get("passed").asBoolean());
    assertFalse(missing.get("content_attributable").asBoolean());
    assertTrue(missing.get("reason").asText().startsWith("validator spawn failed"));
    assertFalse(slow.get("passed").asBoolean());
    assertFalse(slow.get("content_attributable").asBoolean());
    assertTrue(slow.get("reason").asText().contains("timeout"));
  }

  @Test
  @DisplayName("the manifest may come from a code object or a file")
  void manifestSources() throws Exception {
    List<String> command = List.of("sh", "-c", "grep -q 'kind: Pod'");
    ObjectNode fromObject = JsonNodeFactory.instance.objectNode();
    fromObject.putObject("manifest").put("code", MANIFEST);
    Path file = dir.resolve("pod.yaml");
    Files.writeString(file, MANIFEST);
    ObjectNode fromFile =
        JsonNodeFactory.instance.objectNode().put("manifest_path", file.toString());

    assertTrue(validate(command, 5000, fromObject).get("passed").asBoolean());
    assertTrue(validate(command, 5000, fromFile).get("passed").asBoolean());
    assertFalse(validate(command, 5000, manifest("kind: Service")).get("passed").asBoolean());
    assertThrows(
        IllegalArgumentException.class,
        () -> validate(command, 5000, JsonNodeFactory.instance.objectNode()));
  }
}
