package com.gentoro.optiflow;

import com.gentoro.optiflow.exception.ConfigurationException;
import com.gentoro.optiflow.store.JsonFileStoreRepository;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration.
 *
 * <p>Configuration is YAML, read either from an explicit file or from {@value #DEFAULT_RESOURCE}
 * on the classpath. Values may reference environment variables and system properties through the
 * usual interpolation syntax, e.g. {@code ${env:KUBECONFORM_BIN}}.
 *
 * <pre>{@code
 * store:
 *   keep-backup: true
 *   backup-suffix: .bak
 * capabilities:
 *   scorer:
 *     class: com.acme.ScoreCapability
 * validators:
 *   kubeconform:
 *     command: [kubeconform, -strict, -summary, "-"]
 *     timeout-ms: 30000
 * logging:
 *   level:
 *     root: INFO
 * }</pre>
 */
public class OptiFlowConfiguration {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(OptiFlowConfiguration.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;
  private final String source;

  /**
   * Configuration from {@code file}, or from the classpath resource {@value #DEFAULT_RESOURCE} when
   * {@code file} is null. A missing classpath resource yields an empty configuration.
   */
  public OptiFlowConfiguration(Path file) {
    if (file == null) {
      this.source = "classpath:" + DEFAULT_RESOURCE;
      this.config = readClasspath();
    } else {
      this.source = file.toString();
      this.config = readFile(file);
    }
    log.debug("Configuration loaded from {}", source);
  }

  /** Wrap an existing configuration, mostly useful in tests. */
  public OptiFlowConfiguration(Configuration config) {
    this.source = "memory";
    this.config = config;
  }

  public Configuration config() {
    return config;
  }

  public String source() {
    return source;
  }

  public boolean keepStoreBackup() {
    return config.getBoolean("store.keep-backup", false);
  }

  public String storeBackupSuffix() {
    return config.getString("store.backup-suffix", JsonFileStoreRepository.DEFAULT_BACKUP_SUFFIX);
  }

  private static Configuration readFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file not found: " + file);
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, file.toString());
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration file " + file, e);
    }
  }

  private static Configuration readClasspath() {
    InputStream in =
        OptiFlowConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      log.debug("No {} on the classpath, using an empty configuration", DEFAULT_RESOURCE);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader, "classpath:" + DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read classpath " + DEFAULT_RESOURCE, e);
    }
  }

  private static Configuration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Invalid configuration in " + source, e);
    }
    return yaml;
  }
}
