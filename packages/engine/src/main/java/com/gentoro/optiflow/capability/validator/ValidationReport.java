package com.gentoro.optiflow.capability.validator;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Outcome of validating a manifest.
 *
 * @param passed whether the manifest passed every check.
 * @param contentAttributable whether a failure is caused by the manifest content rather than the
 *     tooling (a crashed or missing validator is not the manifest's fault).
 * @param reason short human-readable summary.
 * @param findings individual messages, possibly empty.
 */
public record ValidationReport(
    boolean passed, boolean contentAttributable, String reason, List<ValidationFinding> findings) {

  public static final String PASS = "pass";
  public static final String FAIL = "fail";

  public ValidationReport {
    findings = findings == null ? List.of() : List.copyOf(findings);
    reason = reason == null ? "" : reason;
  }

  public static ValidationReport pass(String reason, List<ValidationFinding> findings) {
    return new ValidationReport(true, false, reason, findings);
  }

  public static ValidationReport contentFailure(String reason, List<ValidationFinding> findings) {
    return new ValidationReport(false, true, reason, findings);
  }

  public static ValidationReport toolFailure(String reason) {
    return new ValidationReport(false, false, reason, List.of());
  }

  public String overallResult() {
    return passed ? PASS : FAIL;
  }

  /** JSON form stored in the workflow store. */
  public ObjectNode toJson() {
    ObjectNode out = JsonNodeFactory.instance.objectNode();
    out.put("passed", passed);
    out.put("overall_result", overallResult());
    out.put("content_attributable", contentAttributable);
    out.put("reason", reason);
    ArrayNode list = out.putArray("findings");
    for (ValidationFinding finding : findings) {
      list.addObject()
          .put("tool", finding.tool())
          .put("severity", finding.severity())
          .put("message", finding.message());
    }
    return out;
  }
}
