package com.gentoro.optiflow.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * External unit of work invoked by execute nodes.
 *
 * <p>A capability receives a read-only snapshot of the store, including the current variables
 * under {@code vars}, and the node's resolved inputs. It returns an object with one entry per value
 * output the node declares. Capabilities should be stateless with respect to the engine: they
 * never see the live store and anything they do to the snapshot is discarded.
 */
@FunctionalInterface
public interface Capability {

  /**
   * Evaluate the capability.
   *
   * @param context deep copy of the store document.
   * @param params resolved node inputs.
   * @return an object keyed by output name.
   * @throws Exception any failure; the engine reports it as a capability error of the node.
   */
  JsonNode evaluate(JsonNode context, ObjectNode params) throws Exception;
}
