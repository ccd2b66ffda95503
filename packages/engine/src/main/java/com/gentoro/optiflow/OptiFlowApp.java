package com.gentoro.optiflow;

import com.gentoro.optiflow.cli.OptiFlowCommand;
import picocli.CommandLine;

public final class OptiFlowApp {
  private OptiFlowApp() {}

  public static void main(String[] args) {
    int code = new CommandLine(new OptiFlowCommand()).execute(args);
    System.exit(code);
  }
}
