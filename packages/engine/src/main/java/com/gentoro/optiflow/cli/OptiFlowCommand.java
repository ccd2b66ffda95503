package com.gentoro.optiflow.cli;

import com.gentoro.optiflow.OptiFlow;
import com.gentoro.optiflow.OptiFlowConfiguration;
import com.gentoro.optiflow.engine.WorkflowRunResult;
import com.gentoro.optiflow.exception.ExceptionUtil;
import com.gentoro.optiflow.exception.NodeExecutionException;
import com.gentoro.optiflow.exception.OptiFlowException;
import com.gentoro.optiflow.utility.JacksonUtility;
import com.gentoro.optiflow.workflow.WorkflowDefinition;
import com.gentoro.optiflow.workflow.WorkflowLoader;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "optiflow",
    mixinStandardHelpOptions = true,
    description = "Stateless workflow engine driving optimization pipelines over a JSON store",
    subcommands = {OptiFlowCommand.RunCommand.class, OptiFlowCommand.ValidateCommand.class})
public final class OptiFlowCommand implements Runnable {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(OptiFlowCommand.class);

  @Spec CommandSpec spec;

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }

  OptiFlow optiFlow(Path configFile) {
    return new OptiFlow(new OptiFlowConfiguration(configFile));
  }

  static int fail(CommandSpec spec, OptiFlowException e) {
    PrintWriter err = spec.commandLine().getErr();
    if (e instanceof NodeExecutionException node) {
      err.printf(
          "error: node '%s' failed [%s]: %s%n",
          node.getNodeId(), node.getCode(), ExceptionUtil.extractErrorMessage(node.getCause()));
    } else {
      err.printf("error [%s]: %s%n", e.getCode(), ExceptionUtil.extractErrorMessage(e));
    }
    err.flush();
    return ExitStatus.of(e).code();
  }

  @Command(name = "run", description = "Run a workflow against a store document")
  static final class RunCommand implements Callable<Integer> {
    @ParentCommand OptiFlowCommand parent;

    @Spec CommandSpec spec;

    @Parameters(index = "0", description = "Workflow definition JSON file")
    Path workflow;

    @Parameters(index = "1", description = "Store document JSON file, updated in place")
    Path store;

    @Option(
        names = {"--config"},
        description = "YAML configuration file (default: classpath application.yaml)")
    Path config;

    @Override
    public Integer call() {
      try {
        WorkflowRunResult result = parent.optiFlow(config).run(workflow, store);
        log.info("Run summary: {}", JacksonUtility.toPrettyJson(result));
        return ExitStatus.COMPLETED.code();
      } catch (OptiFlowException e) {
        log.debug("Run of {} against {} failed", workflow, store, e);
        return fail(spec, e);
      }
    }
  }

  @Command(name = "validate", description = "Validate a workflow definition without running it")
  static final class ValidateCommand implements Callable<Integer> {
    @Spec CommandSpec spec;

    @Parameters(index = "0", description = "Workflow definition JSON file")
    Path workflow;

    @Override
    public Integer call() {
      try {
        WorkflowDefinition definition = WorkflowLoader.load(workflow);
        spec.commandLine()
            .getOut()
            .printf(
                "Workflow '%s' is valid (%d nodes)%n", definition.name(), definition.flow().size());
        spec.commandLine().getOut().flush();
        return ExitStatus.COMPLETED.code();
      } catch (OptiFlowException e) {
        return fail(spec, e);
      }
    }
  }
}
