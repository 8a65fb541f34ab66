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
import com.facebook.buck.junitconsole.output.OutputMode;
import com.google.common.base.Preconditions;
import java.io.File;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Settings of one console run.
 *
 * <p>The levels at which {@code java.util.logging} records of tests are captured come from the
 * system properties {@value #STD_OUT_LOG_LEVEL_PROPERTY} and {@value #STD_ERR_LOG_LEVEL_PROPERTY}
 * when the config is built.
 *
 * @see System#getProperty(String)
 */
public class RunnerConfig {

  static final String STD_OUT_LOG_LEVEL_PROPERTY =
      "com.facebook.buck.junitconsole.stdOutLogLevel";
  static final String STD_ERR_LOG_LEVEL_PROPERTY =
      "com.facebook.buck.junitconsole.stdErrLogLevel";

  private boolean failFast;
  private OutputMode outputMode = OutputMode.ALL;
  private boolean xmlReport;
  private File outdir = new File(System.getProperty("java.io.tmpdir"));
  private boolean perTestTimer;
  private Concurrency defaultConcurrency = Concurrency.SERIAL;
  private int parallelThreads;
  private int testShard = -1;
  private int numTestShards = -1;
  private int numRetries;
  private Level stdOutLogLevel = Level.INFO;
  private Level stdErrLogLevel = Level.WARNING;

  private RunnerConfig() {}

  private RunnerConfig(RunnerConfig config) {
    this.failFast = config.failFast;
    this.outputMode = config.outputMode;
    this.xmlReport = config.xmlReport;
    this.outdir = config.outdir;
    this.perTestTimer = config.perTestTimer;
    this.defaultConcurrency = config.defaultConcurrency;
    this.parallelThreads = config.parallelThreads;
    this.testShard = config.testShard;
    this.numTestShards = config.numTestShards;
    this.numRetries = config.numRetries;
    this.stdOutLogLevel =
        Optional.ofNullable(System.getProperty(STD_OUT_LOG_LEVEL_PROPERTY))
            .map(Level::parse)
            .orElse(config.stdOutLogLevel);
    this.stdErrLogLevel =
        Optional.ofNullable(System.getProperty(STD_ERR_LOG_LEVEL_PROPERTY))
            .map(Level::parse)
            .orElse(config.stdErrLogLevel);
  }

  public boolean isFailFast() {
    return failFast;
  }

  public OutputMode getOutputMode() {
    return outputMode;
  }

  public boolean isXmlReport() {
    return xmlReport;
  }

  public File getOutdir() {
    return outdir;
  }

  public boolean isPerTestTimer() {
    return perTestTimer;
  }

  public Concurrency getDefaultConcurrency() {
    return defaultConcurrency;
  }

  /** Size of the worker pools; a configured value of 0 means one thread per processor. */
  public int getParallelThreads() {
    return parallelThreads > 0 ? parallelThreads : Runtime.getRuntime().availableProcessors();
  }

  public boolean isSharded() {
    return numTestShards > 0;
  }

  public int getTestShard() {
    return testShard;
  }

  public int getNumTestShards() {
    return numTestShards;
  }

  public int getNumRetries() {
    return numRetries;
  }

  public Level getStdOutLogLevel() {
    return stdOutLogLevel;
  }

  public Level getStdErrLogLevel() {
    return stdErrLogLevel;
  }

  /**
   * @return New instance of a builder for {@link RunnerConfig}
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder class for {@link RunnerConfig} */
  public static class Builder {

    private RunnerConfig base = new RunnerConfig();

    public Builder failFast(boolean failFast) {
      base.failFast = failFast;
      return this;
    }

    public Builder outputMode(OutputMode outputMode) {
      base.outputMode = Preconditions.checkNotNull(outputMode);
      return this;
    }

    public Builder xmlReport(boolean xmlReport) {
      base.xmlReport = xmlReport;
      return this;
    }

    public Builder outdir(File outdir) {
      base.outdir = Preconditions.checkNotNull(outdir);
      return this;
    }

    public Builder perTestTimer(boolean perTestTimer) {
      base.perTestTimer = perTestTimer;
      return this;
    }

    public Builder defaultConcurrency(Concurrency defaultConcurrency) {
      base.defaultConcurrency = Preconditions.checkNotNull(defaultConcurrency);
      return this;
    }

    public Builder parallelThreads(int parallelThreads) {
      Preconditions.checkArgument(parallelThreads >= 0, "Thread count must not be negative");
      base.parallelThreads = parallelThreads;
      return this;
    }

    public Builder testShard(int testShard, int numTestShards) {
      Preconditions.checkArgument(
          numTestShards > 0 && testShard >= 0 && testShard < numTestShards,
          "Invalid test shard %s/%s",
          testShard,
          numTestShards);
      base.testShard = testShard;
      base.numTestShards = numTestShards;
      return this;
    }

    public Builder numRetries(int numRetries) {
      Preconditions.checkArgument(numRetries >= 0, "Retry count must not be negative");
      base.numRetries = numRetries;
      return this;
    }

    public Builder stdOutLogLevel(Level stdOutLogLevel) {
      base.stdOutLogLevel = Preconditions.checkNotNull(stdOutLogLevel);
      return this;
    }

    public Builder stdErrLogLevel(Level stdErrLogLevel) {
      base.stdErrLogLevel = Preconditions.checkNotNull(stdErrLogLevel);
      return this;
    }

    public RunnerConfig build() {
      return new RunnerConfig(base);
    }
  }
}
