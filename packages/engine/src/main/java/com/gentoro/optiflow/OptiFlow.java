package com.gentoro.optiflow;

import com.gentoro.optiflow.capability.CapabilityRegistry;
import com.gentoro.optiflow.engine.WorkflowEngine;
import com.gentoro.optiflow.engine.WorkflowRunResult;
import com.gentoro.optiflow.logging.LoggingService;
import com.gentoro.optiflow.store.JsonFileStoreRepository;
import com.gentoro.optiflow.store.StoreRepository;
import com.gentoro.optiflow.workflow.WorkflowDefinition;
import com.gentoro.optiflow.workflow.WorkflowLoader;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Application entry point wiring configuration, capabilities and the engine together.
 *
 * <p>An instance holds no run state; each {@link #run(Path, Path)} reads the workflow and store
 * from disk, so a fresh process can pick up where a previous one stopped.
 */
public class OptiFlow {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(OptiFlow.class);

  private final OptiFlowConfiguration configuration;
  private final WorkflowEngine engine;

  public OptiFlow(OptiFlowConfiguration configuration) {
    this(configuration, null, Clock.systemUTC());
  }

  /**
   * @param registry capabilities to use; when null they are discovered from the configuration.
   */
  public OptiFlow(OptiFlowConfiguration configuration, CapabilityRegistry registry, Clock clock) {
    this.configuration = configuration;
    int levels = LoggingService.applyConfiguration(configuration.config());
    if (levels > 0) {
      log.debug("Applied {} logger level(s) from {}", levels, configuration.source());
    }
    CapabilityRegistry capabilities =
        registry != null ? registry : CapabilityRegistry.fromConfiguration(configuration.config());
    this.engine = new WorkflowEngine(capabilities, clock);
    log.debug("Capabilities available: {}", capabilities.names());
  }

  /** Load and validate a workflow definition without running it. */
  public WorkflowDefinition validate(Path workflow) {
    return WorkflowLoader.load(workflow);
  }

  /** Run {@code workflow} against the store document at {@code store}. */
  public WorkflowRunResult run(Path workflow, Path store) {
    WorkflowDefinition definition = validate(workflow);
    return engine.run(definition, openStore(store));
  }

  public StoreRepository openStore(Path store) {
    return new JsonFileStoreRepository(
        store, configuration.keepStoreBackup(), configuration.storeBackupSuffix());
  }
}
