/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.report;

import com.facebook.buck.junitconsole.log.Logger;
import com.google.common.collect.ImmutableList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;
import org.junit.runner.notification.RunNotifier;

/**
 * Tracks the tests in flight so that, if the VM exits while they run (a test calling {@code
 * System.exit}, say), they can be failed and the run finished before the VM goes away. That way
 * the log files and reports of the run still get written.
 */
@RunListener.ThreadSafe
public class ShutdownListener extends RunListener {

  private static final Logger LOG = Logger.get(ShutdownListener.class);

  private final RunNotifier notifier;
  private final Result result;
  private final Set<Description> inFlight = ConcurrentHashMap.newKeySet();

  public ShutdownListener(RunNotifier notifier, Result result) {
    this.notifier = notifier;
    this.result = result;
  }

  @Override
  public void testStarted(Description description) {
    inFlight.add(description);
  }

  @Override
  public void testFinished(Description description) {
    inFlight.remove(description);
  }

  public ImmutableList<Description> getTestsInFlight() {
    return ImmutableList.copyOf(inFlight);
  }

  /** Fails every test in flight and finishes the run. */
  public void unexpectedShutdown() {
    for (Description description : getTestsInFlight()) {
      LOG.error("VM exited while %s was running", Descriptions.displayName(description));
      notifier.fireTestFailure(
          new Failure(description, new UnknownError("Abnormal VM exit - test crashed.")));
      notifier.fireTestFinished(description);
    }
    notifier.fireTestRunFinished(result);
  }
}
