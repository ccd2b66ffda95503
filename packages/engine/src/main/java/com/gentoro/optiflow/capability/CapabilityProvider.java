package com.gentoro.optiflow.capability;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable capabilities.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.optiflow.capability.CapabilityProvider
 */
public interface CapabilityProvider {
  /** Name under which the capability is referenced from workflow nodes, e.g. "scorer". */
  String id();

  /** Whether the provider can operate in the current runtime (e.g., enabled, tools present). */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  /** Create the capability instance. */
  Capability create(Configuration configuration);
}
