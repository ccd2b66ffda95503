package com.gentoro.optiflow.capability.validator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Validates a manifest by piping it to an external command.
 *
 * <p>The manifest is written to the command's standard input while the combined output is read
 * on a separate thread, so a chatty command cannot stall on a full pipe. Exit code zero means the
 * manifest passed; any other exit code is a failure attributable to the content, with each
 * non-blank output line reported as a finding. A command that cannot be started or exceeds its
 * timeout produces a failure that is not attributable to the content.
 */
public final class CommandValidatorCapability extends ManifestValidatorCapability {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(CommandValidatorCapability.class);

  public static final long DEFAULT_TIMEOUT_MS = 60_000L;
  private static final int MAX_REASON_CHARS = 512;
  private static final int MAX_FINDINGS = 200;
  private static final long OUTPUT_GRACE_SECONDS = 5;

  private final String name;
  private final List<String> command;
  private final long timeoutMs;

  public CommandValidatorCapability(String name, List<String> command, long timeoutMs) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("validator name cannot be empty");
    }
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("validator command cannot be empty: " + name);
    }
    this.name = name;
    this.command = List.copyOf(command);
    this.timeoutMs = Math.max(100L, timeoutMs);
  }

  public String name() {
    return name;
  }

  @Override
  protected ValidationReport validate(String manifest, ObjectNode params) {
    ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
    pb.redirectErrorStream(true);
    Process process;
    try {
      process = pb.start();
    } catch (IOException e) {
      log.warn("Validator '{}' could not be started: {}", name, e.getMessage());
      return ValidationReport.toolFailure("validator spawn failed: " + e.getMessage());
    }

    CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process));
    try {
      try (OutputStream stdin = process.getOutputStream()) {
        stdin.write(manifest.getBytes(StandardCharsets.UTF_8));
        stdin.flush();
      } catch (IOException e) {
        // the command may exit without reading its input
        log.debug("Validator '{}' did not consume the manifest: {}", name, e.getMessage());
      }

      boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(1, TimeUnit.SECONDS);
        output.cancel(true);
        log.warn("Validator '{}' timed out after {} ms", name, timeoutMs);
        return ValidationReport.toolFailure(
            "validator timeout after " + Duration.ofMillis(timeoutMs));
      }

      String combined = output.get(OUTPUT_GRACE_SECONDS, TimeUnit.SECONDS);
      int exit = process.exitValue();
      List<ValidationFinding> findings =
          findings(combined, exit == 0 ? ValidationFinding.INFO : ValidationFinding.ERROR);
      log.debug("Validator '{}' exited with {} ({} findings)", name, exit, findings.size());
      if (exit == 0) {
        return ValidationReport.pass(name + " passed", findings);
      }
      return ValidationReport.contentFailure(
          name + " exit=" + exit + " output=" + truncate(combined), findings);
    } catch (ExecutionException e) {
      process.destroyForcibly();
      return ValidationReport.toolFailure(
          "validator execution failed: " + e.getCause().getMessage());
    } catch (TimeoutException e) {
      process.destroyForcibly();
      output.cancel(true);
      return ValidationReport.toolFailure("validator output not closed after exit");
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      return ValidationReport.toolFailure("validator interrupted");
    }
  }

  private static String readOutput(Process process) {
    try (InputStream in = process.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private List<ValidationFinding> findings(String output, String severity) {
    List<ValidationFinding> out = new ArrayList<>();
    for (String line : output.split("\\R")) {
      if (line.isBlank()) {
        continue;
      }
      if (out.size() == MAX_FINDINGS) {
        break;
      }
      out.add(new ValidationFinding(name, severity, line.strip()));
    }
    return out;
  }

  private static String truncate(String raw) {
    if (raw == null) {
      return "";
    }
    String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
    if (normalized.length() <= MAX_REASON_CHARS) {
      return normalized;
    }
    return normalized.substring(0, MAX_REASON_CHARS) + "...";
  }
}
