/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.execution;

import java.io.PrintStream;
import org.junit.internal.builders.AllDefaultPossibilitiesBuilder;
import org.junit.internal.builders.JUnit4Builder;
import org.junit.runner.Runner;

/**
 * JUnit's default runner selection ({@code @RunWith}, JUnit 3 {@code suite()} methods, JUnit 3
 * classes, then JUnit 4) with plain JUnit 4 classes run by {@link
 * BlockJUnit4ClassRunnerWithRetry}. Classes that pick their own runner are never retried.
 */
public class RetryingRunnerBuilder extends AllDefaultPossibilitiesBuilder {

  private final JUnit4Builder jUnit4RunnerBuilder;

  public RetryingRunnerBuilder(int numRetries, TestLedger ledger, PrintStream err) {
    super(/* canUseSuiteMethod */ true);
    this.jUnit4RunnerBuilder =
        new JUnit4Builder() {
          @Override
          public Runner runnerForClass(Class<?> testClass) throws Throwable {
            return new BlockJUnit4ClassRunnerWithRetry(testClass, numRetries, ledger, err);
          }
        };
  }

  @Override
  protected JUnit4Builder junit4Builder() {
    return jUnit4RunnerBuilder;
  }
}
