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

import com.facebook.buck.junitconsole.concurrency.Concurrency;
import com.facebook.buck.junitconsole.concurrency.ConcurrencyResolver;
import com.facebook.buck.junitconsole.output.OutputMode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import javax.annotation.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.StringArrayOptionHandler;

/**
 * Command line of the console runner, filled in by args4j. Options whose values need checking
 * beyond their type are bound to setters that throw {@link InvalidCmdLineArgumentException}.
 */
public class ConsoleRunnerOptions {

  private static final Splitter WHITESPACE_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  @Option(name = "-fail-fast", usage = "Causes the test suite run to fail fast.")
  private boolean failFast;

  @Option(name = "-output-mode", usage = "Specify what part of output should be passed to stdout.")
  private OutputMode outputMode = OutputMode.ALL;

  @Option(
      name = "-suppress-output",
      usage = "Suppresses the console echo of test output, same as -output-mode NONE.")
  private boolean suppressOutput;

  @Option(name = "-xmlreport", usage = "Create ant compatible junit xml report files in -outdir.")
  private boolean xmlReport;

  @Option(
      name = "-outdir",
      usage = "Directory to output test captures and junit xml reports to.",
      metaVar = "DIR")
  private File outdir = new File(System.getProperty("java.io.tmpdir"));

  @Option(
      name = "-per-test-timer",
      usage = "Show a description of each test and timer for each test class.")
  private boolean perTestTimer;

  @Option(
      name = "-default-concurrency",
      usage = "Specify how to parallelize running tests.",
      metaVar = "CONCURRENCY")
  @Nullable
  private Concurrency defaultConcurrency;

  @Option(
      name = "-default-parallel",
      usage = "DEPRECATED: use -default-concurrency PARALLEL_CLASSES instead.")
  private boolean defaultParallel;

  @Option(
      name = "-parallel-methods",
      usage = "DEPRECATED: use -default-concurrency PARALLEL_METHODS instead.")
  private boolean parallelMethods;

  private int parallelThreads;

  private int testShard = -1;
  private int numTestShards = -1;

  private int numRetries;

  @Argument(
      usage = "Names of junit test classes or test methods to run. Names prefixed with @ are"
          + " considered arg file paths and these will be loaded and the whitespace delimited"
          + " arguments found inside added to the list.",
      required = true,
      metaVar = "TESTS",
      handler = StringArrayOptionHandler.class)
  private String[] tests = {};

  @Option(
      name = "-parallel-threads",
      usage = "Number of threads to execute tests in parallel. Must be positive, or 0 to set"
          + " automatically.",
      metaVar = "N")
  public void setParallelThreads(int parallelThreads) {
    if (parallelThreads < 0) {
      throw new InvalidCmdLineArgumentException(
          "-parallel-threads: %d is not a valid thread count. Must be positive or 0.",
          parallelThreads);
    }
    this.parallelThreads = parallelThreads;
  }

  @Option(
      name = "-test-shard",
      usage = "Subset of tests to run, in the form M/N, 0 <= M < N. For example, 1/3 means run"
          + " tests number 2, 5, 8, 11, ...",
      metaVar = "M/N")
  public void setTestShard(String shard) {
    String errorMessage =
        String.format(
            "-test-shard should be in the form M/N, where M and N are integers, 0 <= M < N,"
                + " got %s",
            shard);
    List<String> parts = Splitter.on('/').splitToList(shard);
    if (parts.size() != 2) {
      throw new InvalidCmdLineArgumentException("%s", errorMessage);
    }
    int shardIndex;
    int shardCount;
    try {
      shardIndex = Integer.parseInt(parts.get(0));
      shardCount = Integer.parseInt(parts.get(1));
    } catch (NumberFormatException e) {
      throw new InvalidCmdLineArgumentException("%s", errorMessage);
    }
    if (shardIndex < 0 || shardCount <= 0 || shardIndex >= shardCount) {
      throw new InvalidCmdLineArgumentException("%s", errorMessage);
    }
    this.testShard = shardIndex;
    this.numTestShards = shardCount;
  }

  @Option(
      name = "-num-retries",
      usage = "Number of attempts to retry each failing test, 0 by default.",
      metaVar = "N")
  public void setNumRetries(int numRetries) {
    if (numRetries < 0) {
      throw new InvalidCmdLineArgumentException(
          "-num-retries: %d is not a valid retry count. Must not be negative.", numRetries);
    }
    this.numRetries = numRetries;
  }

  /** The test specs, with every {@code @argfile} replaced by the specs it lists. */
  public ImmutableList<String> getTests() throws IOException {
    ImmutableList.Builder<String> expanded = ImmutableList.builder();
    for (String test : tests) {
      if (test.startsWith("@")) {
        String content =
            new String(
                Files.readAllBytes(new File(test.substring(1)).toPath()), StandardCharsets.UTF_8);
        expanded.addAll(WHITESPACE_SPLITTER.split(content));
      } else {
        expanded.add(test);
      }
    }
    return expanded.build();
  }

  public RunnerConfig toConfig() {
    RunnerConfig.Builder builder =
        RunnerConfig.builder()
            .failFast(failFast)
            .outputMode(suppressOutput ? OutputMode.NONE : outputMode)
            .xmlReport(xmlReport)
            .outdir(outdir)
            .perTestTimer(perTestTimer)
            .defaultConcurrency(
                ConcurrencyResolver.computeConcurrencyOption(
                    defaultConcurrency, defaultParallel, parallelMethods))
            .parallelThreads(parallelThreads)
            .numRetries(numRetries);
    if (numTestShards > 0) {
      builder.testShard(testShard, numTestShards);
    }
    return builder.build();
  }
}
