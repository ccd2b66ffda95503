package com.gentoro.optiflow.exception;

import java.time.Instant;
import java.util.StringJoiner;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private static final int MAX_FRAMES = 10;

  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or command line reports.
   * If the throwable is an {@link OptiFlowException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof OptiFlowException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        OptiFlowErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Single-line rendering of the top {@value #MAX_FRAMES} stack frames, in call order, e.g.
   * {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}.
   */
  public static String formatCompactStackTrace(Throwable t) {
    if (t == null || t.getStackTrace().length == 0) {
      return "";
    }
    StringJoiner frames = new StringJoiner(" > ");
    StackTraceElement[] elements = t.getStackTrace();
    for (int i = 0; i < Math.min(elements.length, MAX_FRAMES); i++) {
      StackTraceElement e = elements[i];
      String location = e.getFileName() == null ? "Unknown Source" : e.getFileName();
      if (e.getLineNumber() >= 0) {
        location += ":" + e.getLineNumber();
      }
      frames.add(e.getClassName() + "." + e.getMethodName() + " (" + location + ")");
    }
    return frames.toString();
  }

  /**
   * Extract a one-line, user-facing message from a throwable. Walks the cause chain and returns
   * the deepest message that is not blank, prefixed with the simple class name of the throwable
   * that carried it.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable carrier = null;
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        carrier = current;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    if (carrier == null) {
      return t.getClass().getSimpleName();
    }
    if (carrier == t) {
      return carrier.getMessage();
    }
    return carrier.getClass().getSimpleName() + ": " + carrier.getMessage();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
