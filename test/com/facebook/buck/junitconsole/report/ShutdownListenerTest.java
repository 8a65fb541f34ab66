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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.Test;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.notification.RunListener;
import org.junit.runner.notification.RunNotifier;

public class ShutdownListenerTest {

  private static final Description CRASHING =
      Description.createTestDescription("com.example.FooTest", "callsExit");
  private static final Description DONE =
      Description.createTestDescription("com.example.FooTest", "done");

  @Test
  public void tracksTestsInFlight() {
    ShutdownListener listener = new ShutdownListener(new RunNotifier(), new Result());

    listener.testStarted(CRASHING);
    listener.testStarted(DONE);
    listener.testFinished(DONE);

    assertThat(listener.getTestsInFlight(), contains(CRASHING));
  }

  @Test
  public void unexpectedShutdownFailsTestsInFlightAndFinishesTheRun() throws Exception {
    RunNotifier notifier = new RunNotifier();
    Result result = new Result();
    notifier.addListener(result.createListener());
    RunListener observer = mock(RunListener.class);
    notifier.addListener(observer);
    ShutdownListener listener = new ShutdownListener(notifier, result);
    notifier.addListener(listener);

    notifier.fireTestStarted(CRASHING);
    listener.unexpectedShutdown();

    assertEquals(1, result.getFailureCount());
    assertEquals(UnknownError.class, result.getFailures().get(0).getException().getClass());
    verify(observer).testFinished(CRASHING);
    verify(observer).testRunFinished(any(Result.class));
    assertThat(listener.getTestsInFlight(), empty());
  }
}
