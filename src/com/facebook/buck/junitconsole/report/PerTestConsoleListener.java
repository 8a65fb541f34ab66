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

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.junit.runner.Description;
import org.junit.runner.notification.Failure;

/** Prints a line with the elapsed time of every test instead of JUnit's progress dots. */
public class PerTestConsoleListener extends ConsoleListener {

  private final Map<Description, Long> startNanos = new ConcurrentHashMap<>();
  private final Map<Description, Boolean> failed = new ConcurrentHashMap<>();

  public PerTestConsoleListener(PrintStream out) {
    super(out);
  }

  @Override
  public void testStarted(Description description) {
    startNanos.put(description, System.nanoTime());
  }

  @Override
  public void testFailure(Failure failure) {
    Description description = failure.getDescription();
    if (startNanos.containsKey(description)) {
      failed.put(description, Boolean.TRUE);
    } else {
      super.testFailure(failure);
    }
  }

  @Override
  public void testIgnored(Description description) {
    getOut().println(Descriptions.displayName(description) + " IGNORED");
  }

  @Override
  public void testFinished(Description description) {
    Long start = startNanos.remove(description);
    if (start == null) {
      return;
    }
    double seconds = (System.nanoTime() - start) / (double) TimeUnit.SECONDS.toNanos(1);
    String status = failed.remove(description) != null ? "FAILED" : "OK";
    getOut()
        .println(
            String.format(
                Locale.ROOT,
                "%s %s (%.3fs)",
                Descriptions.displayName(description),
                status,
                seconds));
  }
}
