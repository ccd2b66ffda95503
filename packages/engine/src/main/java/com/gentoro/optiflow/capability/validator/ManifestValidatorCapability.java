package com.gentoro.optiflow.capability.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.capability.Capability;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for capabilities that validate a deployment manifest.
 *
 * <p>The manifest is taken from the {@code manifest} input, either as text or as an object carrying
 * the text under {@code code}, or read from the file named by {@code manifest_path}. The report is
 * returned under the {@code result} output:
 *
 * <pre>{@code
 * {"result": {"passed": false, "overall_result": "fail", "content_attributable": true,
 *             "reason": "...",
 *             "findings": [{"tool": "...", "severity": "error", "message": "..."}]}}
 * }</pre>
 */
public abstract class ManifestValidatorCapability implements Capability {

  public static final String MANIFEST = "manifest";
  public static final String MANIFEST_PATH = "manifest_path";
  public static final String RESULT = "result";

  @Override
  public final JsonNode evaluate(JsonNode context, ObjectNode params) throws Exception {
    String manifest = readManifest(params);
    ValidationReport report = validate(manifest, params);
    ObjectNode out = JsonNodeFactory.instance.objectNode();
    out.set(RESULT, report.toJson());
    return out;
  }

  /** Validate the manifest text. */
  protected abstract ValidationReport validate(String manifest, ObjectNode params)
      throws Exception;

  static String readManifest(ObjectNode params) throws IOException {
    JsonNode manifest = params.get(MANIFEST);
    if (manifest != null && manifest.isTextual()) {
      return manifest.asText();
    }
    if (manifest != null && manifest.isObject() && manifest.path("code").isTextual()) {
      return manifest.get("code").asText();
    }
    JsonNode path = params.get(MANIFEST_PATH);
    if (path != null && path.isTextual() && !path.asText().isBlank()) {
      return Files.readString(Path.of(path.asText()), StandardCharsets.UTF_8);
    }
    throw new IllegalArgumentException(
        "Manifest validation requires a textual '" + MANIFEST + "' or a '" + MANIFEST_PATH
            + "' input");
  }
}
