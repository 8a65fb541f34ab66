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

import com.facebook.buck.junitconsole.concurrency.StopSignal;
import com.facebook.buck.junitconsole.log.Logger;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;
import org.junit.runner.notification.RunNotifier;

/**
 * Asks the notifier to stop at the first failure. JUnit then refuses to start any further test,
 * and the schedulers stop dispatching work; tests already running finish normally.
 */
@RunListener.ThreadSafe
public class FailFastListener extends RunListener implements StopSignal {

  private static final Logger LOG = Logger.get(FailFastListener.class);

  private final RunNotifier notifier;
  private final AtomicReference<Failure> firstFailure = new AtomicReference<>();

  public FailFastListener(RunNotifier notifier) {
    this.notifier = notifier;
  }

  @Override
  public void testFailure(Failure failure) {
    if (firstFailure.compareAndSet(null, failure)) {
      LOG.info("Fail fast: stopping the run after %s failed", failure.getTestHeader());
      notifier.pleaseStop();
    }
  }

  @Override
  public boolean isStopRequested() {
    return firstFailure.get() != null;
  }

  @Nullable
  public Failure getFirstFailure() {
    return firstFailure.get();
  }
}
