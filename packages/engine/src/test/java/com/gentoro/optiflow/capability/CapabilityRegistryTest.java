package com.gentoro.optiflow.capability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.capability.validator.CommandValidatorCapability;
import com.gentoro.optiflow.exception.CapabilityException;
import com.gentoro.optiflow.exception.ConditionException;
import com.gentoro.optiflow.exception.ConfigurationException;
import java.io.IOException;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CapabilityRegistryTest {

  private final ObjectNode params = JsonNodeFactory.instance.objectNode().put("k", "v");
  private final ObjectNode context = JsonNodeFactory.instance.objectNode();

  @Test
  @DisplayName("providers are discovered through ServiceLoader")
  void discoversProviders() {
    CapabilityRegistry registry = CapabilityRegistry.fromConfiguration(new BaseConfiguration());

    assertTrue(registry.names().contains("echo"));
    JsonNode result = registry.invoke("echo", context, params);
    assertEquals("v", result.at("/result/k").asText());
  }

  @Test
  @DisplayName("unavailable providers are skipped")
  void skipsUnavailableProviders() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("echo.disabled", true);

    assertFalse(CapabilityRegistry.fromConfiguration(config).find("echo").isPresent());
  }

  @Test
  @DisplayName("configured classes and command validators are registered by name")
  void registersConfiguredCapabilities() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("capabilities.shout.class", EchoCapability.class.getName());
    config.addProperty("validators.lint.command", List.of("sh", "-c", "exit 0"));
    config.addProperty("validators.lint.timeout-ms", 5000);

    CapabilityRegistry registry = CapabilityRegistry.fromConfiguration(config);

    assertInstanceOf(EchoCapability.class, registry.find("shout").orElseThrow());
    CommandValidatorCapability lint =
        assertInstanceOf(CommandValidatorCapability.class, registry.find("lint").orElseThrow());
    assertEquals("lint", lint.name());
  }

  @Test
  @DisplayName("incomplete configuration entries are rejected")
  void rejectsIncompleteEntries() {
    BaseConfiguration noClass = new BaseConfiguration();
    noClass.addProperty("capabilities.bad.kind", "x");
    BaseConfiguration noCommand = new BaseConfiguration();
    noCommand.addProperty("validators.lint.timeout-ms", 10);

    assertThrows(ConfigurationException.class, () -> CapabilityRegistry.fromConfiguration(noClass));
    assertThrows(
        ConfigurationException.class, () -> CapabilityRegistry.fromConfiguration(noCommand));
    assertThrows(
        ConfigurationException.class,
        () -> new CapabilityRegistry().register(" ", new EchoCapability()));
  }

  @Test
  @DisplayName("a fully qualified class name is instantiated once and cached")
  void resolvesClassNames() {
    CapabilityRegistry registry = new CapabilityRegistry();

    Capability first = registry.resolve(EchoCapability.class.getName());
    Capability second = registry.resolve(EchoCapability.class.getName());

    assertInstanceOf(EchoCapability.class, first);
    assertSame(first, second);
  }

  @Test
  @DisplayName("unknown names and unusable classes are capability errors")
  void unresolvableReferences() {
    CapabilityRegistry registry = new CapabilityRegistry();

    assertThrows(CapabilityException.class, () -> registry.resolve("scorer"));
    assertThrows(CapabilityException.class, () -> registry.resolve("com.example.MissingScorer"));
    assertThrows(CapabilityException.class, () -> registry.resolve("java.lang.String"));
  }

  @Test
  @DisplayName("invoke wraps foreign exceptions and passes engine exceptions through")
  void invokeWrapsFailures() {
    CapabilityRegistry registry =
        new CapabilityRegistry()
            .register(
                "io",
                (ctx, p) -> {
                  throw new IOException("connection reset");
                })
            .register(
                "cond",
                (ctx, p) -> {
                  throw new ConditionException("bad expression");
                });

    CapabilityException wrapped =
        assertThrows(CapabilityException.class, () -> registry.invoke("io", context, params));
    assertTrue(wrapped.getMessage().contains("connection reset"));
    assertInstanceOf(IOException.class, wrapped.getCause());
    assertThrows(ConditionException.class, () -> registry.invoke("cond", context, params));
  }
}
