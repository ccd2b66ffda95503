package com.gentoro.optiflow.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.exception.PathException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Addressable read/write access to a store document through {@link StorePath} expressions.
 *
 * <p>Reads are lenient: any missing segment, out-of-range index or traversal through a scalar
 * yields an empty result. Writes are strict: intermediate containers are created on demand
 * (objects for named segments, arrays for numeric ones), but writing through a container of the
 * wrong kind fails with {@link PathException}. Only the passed document is touched; flushing is the
 * caller's responsibility.
 */
public final class StoreAccessor {

  /** Field carrying the creation time of object-valued outputs. */
  public static final String CREATED_AT = "created_at";

  /** Suffix of the sibling entry describing a scalar-valued output. */
  public static final String METADATA_SUFFIX = "_metadata";

  private StoreAccessor() {}

  /**
   * Resolve {@code path} against {@code root}.
   *
   * @return the node found at the path (possibly a JSON {@code null}), or empty when any segment is
   *     missing.
   * @throws PathException only when the path itself cannot be parsed.
   */
  public static Optional<JsonNode> resolve(JsonNode root, String path) {
    return resolve(root, StorePath.parse(path));
  }

  public static Optional<JsonNode> resolve(JsonNode root, StorePath path) {
    JsonNode current = root;
    for (StorePath.Segment segment : path.segments()) {
      if (current == null) {
        return Optional.empty();
      }
      if (current.isObject()) {
        current = current.get(segment.name());
      } else if (current.isArray() && segment.isIndex()) {
        current = segment.index() < current.size() ? current.get(segment.index()) : null;
      } else {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(current);
  }

  /** True when {@code path} resolves to a present value that is not JSON {@code null}. */
  public static boolean isPresent(JsonNode root, String path) {
    return resolve(root, path).filter(node -> !node.isNull()).isPresent();
  }

  /**
   * Write a deep copy of {@code value} at {@code path}, creating intermediate containers as needed
   * and overwriting any existing leaf.
   *
   * @throws PathException when the destination cannot be constructed.
   */
  public static void write(ObjectNode root, String path, JsonNode value) {
    StorePath parsed = StorePath.parse(path);
    JsonNode container = ensureParent(root, parsed);
    setChild(container, parsed.last(), copyOf(value), parsed);
  }

  /**
   * Write {@code value} and annotate it with metadata.
   *
   * <p>Object values receive a {@code created_at} field and the provenance entries, none of which
   * overwrite a field the value already carries. Any other value gets a {@code <leaf>_metadata}
   * sibling object holding the same information. Values written at a list position carry no
   * metadata since a list has no room for siblings.
   */
  public static void writeWithMetadata(
      ObjectNode root,
      String path,
      JsonNode value,
      Instant createdAt,
      Map<String, String> provenance) {
    StorePath parsed = StorePath.parse(path);
    JsonNode container = ensureParent(root, parsed);
    StorePath.Segment leaf = parsed.last();
    JsonNode stored = copyOf(value);
    setChild(container, leaf, stored, parsed);

    String timestamp = (createdAt == null ? Instant.now() : createdAt).toString();
    if (stored.isObject()) {
      annotate((ObjectNode) stored, timestamp, provenance);
    } else if (container.isObject()) {
      ObjectNode metadata = JsonNodeFactory.instance.objectNode();
      annotate(metadata, timestamp, provenance);
      ((ObjectNode) container).set(leaf.name() + METADATA_SUFFIX, metadata);
    }
  }

  private static void annotate(
      ObjectNode target, String timestamp, Map<String, String> provenance) {
    if (!target.has(CREATED_AT)) {
      target.put(CREATED_AT, timestamp);
    }
    if (provenance != null) {
      provenance.forEach(
          (key, ref) -> {
            if (!target.has(key)) {
              target.put(key, ref);
            }
          });
    }
  }

  private static JsonNode ensureParent(ObjectNode root, StorePath path) {
    List<StorePath.Segment> segments = path.segments();
    JsonNode current = root;
    for (int i = 0; i < segments.size() - 1; i++) {
      StorePath.Segment segment = segments.get(i);
      JsonNode child = childOf(current, segment, path);
      if (child == null || child.isNull()) {
        child =
            segments.get(i + 1).isIndex()
                ? JsonNodeFactory.instance.arrayNode()
                : JsonNodeFactory.instance.objectNode();
        setChild(current, segment, child, path);
      } else if (!child.isContainerNode()) {
        throw new PathException(
            "Cannot traverse through scalar value at segment '%s' of path '%s'"
                .formatted(segment.name(), path));
      }
      current = child;
    }
    return current;
  }

  private static JsonNode childOf(JsonNode container, StorePath.Segment segment, StorePath path) {
    checkKind(container, segment, path);
    if (container.isArray()) {
      return segment.index() < container.size() ? container.get(segment.index()) : null;
    }
    return container.get(segment.name());
  }

  private static void setChild(
      JsonNode container, StorePath.Segment segment, JsonNode value, StorePath path) {
    checkKind(container, segment, path);
    if (container.isArray()) {
      ArrayNode array = (ArrayNode) container;
      while (array.size() <= segment.index()) {
        array.addNull();
      }
      array.set(segment.index(), value);
    } else {
      ((ObjectNode) container).set(segment.name(), value);
    }
  }

  private static void checkKind(JsonNode container, StorePath.Segment segment, StorePath path) {
    if (segment.isIndex() && !container.isArray()) {
      throw new PathException(
          "Cannot index non-list value with numeric segment '%s' of path '%s'"
              .formatted(segment.name(), path));
    }
    if (!segment.isIndex() && !container.isObject()) {
      throw new PathException(
          "Cannot address field '%s' of path '%s' inside a non-object value"
              .formatted(segment.name(), path));
    }
  }

  private static JsonNode copyOf(JsonNode value) {
    return value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy();
  }
}
