package com.gentoro.optiflow.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Durable backing location of one store document.
 *
 * <p>Implementations must make {@link #save(ObjectNode)} all-or-nothing: a concurrent reader sees
 * either the previous complete document or the new one, never a partial write.
 */
public interface StoreRepository {

  /** Read the current document from durable storage; never served from a cache. */
  ObjectNode load();

  /** Replace the stored document with {@code document}. */
  void save(ObjectNode document);

  /** Human readable description of the backing location, used in logs. */
  String location();
}
