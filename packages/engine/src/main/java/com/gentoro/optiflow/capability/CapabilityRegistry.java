package com.gentoro.optiflow.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.capability.validator.CommandValidatorCapability;
import com.gentoro.optiflow.exception.CapabilityException;
import com.gentoro.optiflow.exception.ConfigurationException;
import com.gentoro.optiflow.exception.ExceptionUtil;
import com.gentoro.optiflow.exception.OptiFlowException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.configuration2.Configuration;

/**
 * Registry of named capabilities that can be invoked by execute nodes.
 *
 * <p>A node's {@code node} field is looked up by registered name first. When no capability is
 * registered under that name and the reference looks like a fully qualified class name, the class
 * is instantiated through its public no-argument constructor and cached under that name.
 *
 * <p>The typical lifecycle is:
 *
 * <ol>
 *   <li>Create a registry, usually through {@link #fromConfiguration(Configuration)}.
 *   <li>Register additional capabilities programmatically if needed.
 *   <li>Pass the registry to the workflow engine.
 * </ol>
 */
public class CapabilityRegistry {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(CapabilityRegistry.class);

  /** Backing map of capability name to implementation. */
  private final Map<String, Capability> capabilities = new ConcurrentHashMap<>();

  /**
   * Build a registry from every available source, later sources overriding earlier ones:
   *
   * <ol>
   *   <li>{@link CapabilityProvider} implementations found through {@link ServiceLoader}
   *   <li>{@code capabilities.<name>.class} entries naming a {@link Capability} class
   *   <li>{@code validators.<name>.command} entries, registered as command validators
   * </ol>
   */
  public static CapabilityRegistry fromConfiguration(Configuration configuration) {
    CapabilityRegistry registry = new CapabilityRegistry();
    registry.loadProviders(configuration);
    registry.loadConfiguredClasses(configuration);
    registry.loadCommandValidators(configuration);
    return registry;
  }

  /**
   * Register a capability.
   *
   * @param name symbolic name used from workflow nodes.
   * @param capability the implementation.
   * @return this registry for fluent usage.
   */
  public CapabilityRegistry register(String name, Capability capability) {
    if (name == null || name.isBlank()) {
      throw new ConfigurationException("Capability name must not be blank");
    }
    if (capability == null) {
      throw new ConfigurationException("Capability '" + name + "' must not be null");
    }
    Capability previous = capabilities.put(name, capability);
    if (previous != null && previous != capability) {
      log.info("Capability '{}' replaced by {}", name, capability.getClass().getName());
    }
    return this;
  }

  public Optional<Capability> find(String name) {
    return Optional.ofNullable(capabilities.get(name));
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(capabilities.keySet()));
  }

  /**
   * Resolve a node's capability reference.
   *
   * @throws CapabilityException when the reference names neither a registered capability nor a
   *     loadable {@link Capability} class.
   */
  public Capability resolve(String reference) {
    Capability registered = capabilities.get(reference);
    if (registered != null) {
      return registered;
    }
    if (reference == null || !reference.contains(".")) {
      throw new CapabilityException("No capability registered with name '" + reference + "'");
    }
    return capabilities.computeIfAbsent(reference, CapabilityRegistry::instantiate);
  }

  /**
   * Invoke a capability.
   *
   * @param reference capability name or class name as written in the workflow.
   * @param context store snapshot handed to the capability.
   * @param params resolved node inputs.
   * @return the capability result (may be {@code null}).
   * @throws CapabilityException if the capability cannot be resolved or if it throws.
   */
  public JsonNode invoke(String reference, JsonNode context, ObjectNode params) {
    Capability capability = resolve(reference);
    try {
      return capability.evaluate(context, params);
    } catch (OptiFlowException e) {
      throw e;
    } catch (Exception e) {
      throw new CapabilityException(
          "Capability '%s' failed: %s".formatted(reference, ExceptionUtil.extractErrorMessage(e)),
          e);
    }
  }

  private void loadProviders(Configuration configuration) {
    for (CapabilityProvider provider : ServiceLoader.load(CapabilityProvider.class)) {
      if (!provider.isAvailable(configuration)) {
        log.debug("Capability provider '{}' is not available, skipping", provider.id());
        continue;
      }
      register(provider.id(), provider.create(configuration));
      log.debug("Registered capability '{}' from provider {}", provider.id(), provider.getClass());
    }
  }

  private void loadConfiguredClasses(Configuration configuration) {
    Configuration section = configuration.subset("capabilities");
    for (String name : topLevelNames(section)) {
      String className = section.getString(name + ".class", null);
      if (className == null || className.isBlank()) {
        throw new ConfigurationException(
            "Capability '" + name + "' is configured without a 'class' entry");
      }
      register(name, instantiate(className.trim()));
      log.debug("Registered capability '{}' from class {}", name, className);
    }
  }

  private void loadCommandValidators(Configuration configuration) {
    Configuration section = configuration.subset("validators");
    for (String name : topLevelNames(section)) {
      List<String> command = section.getList(String.class, name + ".command", List.of());
      if (command.isEmpty()) {
        throw new ConfigurationException(
            "Validator '" + name + "' is configured without a 'command' entry");
      }
      long timeoutMs =
          section.getLong(name + ".timeout-ms", CommandValidatorCapability.DEFAULT_TIMEOUT_MS);
      register(name, new CommandValidatorCapability(name, command, timeoutMs));
      log.debug("Registered command validator '{}': {}", name, command);
    }
  }

  private static Set<String> topLevelNames(Configuration section) {
    Set<String> names = new LinkedHashSet<>();
    for (Iterator<String> it = section.getKeys(); it.hasNext(); ) {
      String key = it.next();
      int dot = key.indexOf('.');
      names.add(dot < 0 ? key : key.substring(0, dot));
    }
    return names;
  }

  private static Capability instantiate(String className) {
    Class<?> type;
    try {
      type = Class.forName(className, true, CapabilityRegistry.class.getClassLoader());
    } catch (ClassNotFoundException | LinkageError e) {
      throw new CapabilityException(
          "No capability registered with name '" + className + "' and no such class", e);
    }
    if (!Capability.class.isAssignableFrom(type)) {
      throw new CapabilityException(
          "Class '" + className + "' does not implement " + Capability.class.getName());
    }
    try {
      return (Capability) type.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new CapabilityException(
          "Capability class '" + className + "' could not be instantiated", e);
    }
  }

  @Override
  public String toString() {
    return "CapabilityRegistry" + names();
  }
}
