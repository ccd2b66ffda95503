package com.gentoro.optiflow.store;

import com.gentoro.optiflow.exception.PathException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Parsed form of a dotted store path.
 *
 * <p>Segments are separated by dots; list positions can be written either as a dotted numeric
 * segment or in brackets, so {@code results.runs.0.score} and {@code results.runs[0].score} are the
 * same path. Empty segments (for example a doubled dot) are ignored. A segment made only of digits
 * is an index segment.
 */
public final class StorePath {

  /** One step of a path: either a field name or a list index. */
  public record Segment(String name, int index) {
    static Segment field(String name) {
      return new Segment(name, -1);
    }

    static Segment position(int index) {
      return new Segment(Integer.toString(index), index);
    }

    public boolean isIndex() {
      return index >= 0;
    }
  }

  private final String raw;
  private final List<Segment> segments;

  private StorePath(String raw, List<Segment> segments) {
    this.raw = raw;
    this.segments = Collections.unmodifiableList(segments);
  }

  /**
   * Parse a path.
   *
   * @throws PathException when the path is null, blank, has no usable segment, or contains an
   *     unbalanced or non-numeric bracket index.
   */
  public static StorePath parse(String path) {
    if (path == null || path.isBlank()) {
      throw new PathException("Store path must be a non-empty string");
    }
    List<Segment> out = new ArrayList<>();
    for (String part : path.split("\\.")) {
      String token = part.trim();
      if (token.isEmpty()) {
        continue;
      }
      int bracket = token.indexOf('[');
      String head = bracket < 0 ? token : token.substring(0, bracket).trim();
      if (!head.isEmpty()) {
        out.add(toSegment(head));
      }
      while (bracket >= 0) {
        int close = token.indexOf(']', bracket);
        if (close < 0) {
          throw new PathException("Unbalanced '[' in store path '" + path + "'");
        }
        String inner = token.substring(bracket + 1, close).trim();
        if (!isDigits(inner)) {
          throw new PathException(
              "Bracket segment '[" + inner + "]' in store path '" + path + "' is not an index");
        }
        out.add(Segment.position(Integer.parseInt(inner)));
        bracket = token.indexOf('[', close);
        if (bracket < 0 && close + 1 < token.length()) {
          throw new PathException("Unexpected characters after ']' in store path '" + path + "'");
        }
      }
    }
    if (out.isEmpty()) {
      throw new PathException("Store path '" + path + "' has no segments");
    }
    return new StorePath(path, out);
  }

  /** Lenient variant of {@link #parse(String)} for text that may or may not be a path. */
  public static Optional<StorePath> tryParse(String path) {
    try {
      return Optional.of(parse(path));
    } catch (PathException e) {
      return Optional.empty();
    }
  }

  private static Segment toSegment(String token) {
    if (isDigits(token)) {
      return Segment.position(Integer.parseInt(token));
    }
    return Segment.field(token);
  }

  private static boolean isDigits(String token) {
    if (token.isEmpty() || token.length() > 9) {
      return false;
    }
    for (int i = 0; i < token.length(); i++) {
      if (!Character.isDigit(token.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  public List<Segment> segments() {
    return segments;
  }

  public Segment last() {
    return segments.get(segments.size() - 1);
  }

  public String raw() {
    return raw;
  }

  @Override
  public String toString() {
    return raw;
  }
}
