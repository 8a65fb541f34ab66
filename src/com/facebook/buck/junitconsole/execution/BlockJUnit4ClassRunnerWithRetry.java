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

import com.facebook.buck.junitconsole.log.Logger;
import java.io.PrintStream;
import org.junit.internal.AssumptionViolatedException;
import org.junit.runners.BlockJUnit4ClassRunner;
import org.junit.runners.model.FrameworkMethod;
import org.junit.runners.model.InitializationError;
import org.junit.runners.model.Statement;

/**
 * Re-runs a failing test method up to {@code numRetries} more times. Every attempt builds a fresh
 * method block, so it gets a new test instance and the full {@code @Before}/{@code @After} chain.
 * Attempts of one method run one after another on the thread that runs the method, and only the
 * outcome of the last attempt reaches the notifier.
 */
public class BlockJUnit4ClassRunnerWithRetry extends BlockJUnit4ClassRunner {

  private static final Logger LOG = Logger.get(BlockJUnit4ClassRunnerWithRetry.class);

  private final int numRetries;
  private final TestLedger ledger;
  private final PrintStream err;

  public BlockJUnit4ClassRunnerWithRetry(
      Class<?> testClass, int numRetries, TestLedger ledger, PrintStream err)
      throws InitializationError {
    super(testClass);
    this.numRetries = numRetries;
    this.ledger = ledger;
    this.err = err;
  }

  @Override
  protected Statement methodBlock(FrameworkMethod method) {
    if (numRetries <= 0) {
      return super.methodBlock(method);
    }
    return new Statement() {
      @Override
      public void evaluate() throws Throwable {
        evaluateWithRetries(method);
      }
    };
  }

  private void evaluateWithRetries(FrameworkMethod method) throws Throwable {
    String className = getTestClass().getName();
    String methodName = testName(method);
    Throwable lastFailure = null;
    int attempts = numRetries + 1;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      if (attempt > 1) {
        ledger.record(className, methodName, attempt);
        LOG.info("Retrying %s#%s, attempt %d of %d", className, methodName, attempt, attempts);
      }
      try {
        super.methodBlock(method).evaluate();
        if (attempt > 1) {
          err.printf(
              "Test %s#%s is FLAKY; passed after %d attempts%n", className, methodName, attempt);
        }
        return;
      } catch (AssumptionViolatedException e) {
        throw e;
      } catch (Throwable t) {
        LOG.warn(t, "Attempt %d of %s#%s failed", attempt, className, methodName);
        lastFailure = t;
      }
    }
    throw lastFailure;
  }
}
