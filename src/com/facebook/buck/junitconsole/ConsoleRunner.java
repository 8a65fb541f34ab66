/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole;

import static com.facebook.buck.junitconsole.CheckDependency.requiresClass;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.PrintStream;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.ParserProperties;

/**
 * Launcher of the JUnit console runner.
 *
 * <p>Usage: {@code ConsoleRunner [options] TESTS...} where each test is {@code ClassName}, {@code
 * ClassName#method} or {@code @argfile}. Run without arguments for the list of options.
 */
public class ConsoleRunner {

  private ConsoleRunner() {
    // Launcher class.
  }

  public static void main(String[] args) {
    // Ensure that both junit and hamcrest are on the classpath
    if (!requiresClass(System.err, "junit", "org.junit.Test")
        || !requiresClass(System.err, "hamcrest", "org.hamcrest.Description")) {
      System.exit(1);
    }
    ExitCode exitCode = run(System.out, System.err, /* exitOnFinish */ true, args);
    System.exit(exitCode.getCode());
  }

  /** Prevent {@link System#exit(int)} execution so it can be used in unit tests. */
  @VisibleForTesting
  static ExitCode run(PrintStream out, PrintStream err, boolean exitOnFinish, String... args) {
    ConsoleRunnerOptions options = new ConsoleRunnerOptions();
    // @argfiles hold whitespace separated specs, they are expanded by the options.
    CmdLineParser parser =
        new CmdLineParser(options, ParserProperties.defaults().withAtSyntax(false));
    ImmutableList<String> tests;
    RunnerConfig config;
    try {
      parser.parseArgument(args);
      tests = options.getTests();
      config = options.toConfig();
    } catch (CmdLineException | InvalidCmdLineArgumentException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return ExitCode.INVALID_ARGUMENTS;
    } catch (IOException e) {
      err.println("Cannot read arg file: " + e.getMessage());
      return ExitCode.INVALID_ARGUMENTS;
    }
    if (tests.isEmpty()) {
      err.println("No tests given");
      parser.printUsage(err);
      return ExitCode.INVALID_ARGUMENTS;
    }
    return new ConsoleRunnerImpl(config, out, err, exitOnFinish).run(tests);
  }
}
