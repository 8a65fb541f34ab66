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
import org.junit.internal.TextListener;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;

/**
 * JUnit's text summary, with failures headed by {@code Class#method}. A failure that arrives
 * after the summary was printed, such as a listener that broke while the run was finishing, is
 * printed right away so it cannot go unnoticed.
 */
public class ConsoleListener extends TextListener {

  private final PrintStream out;
  private volatile boolean runFinished;

  public ConsoleListener(PrintStream out) {
    super(out);
    this.out = out;
  }

  protected PrintStream getOut() {
    return out;
  }

  @Override
  public void testRunFinished(Result result) {
    super.testRunFinished(result);
    runFinished = true;
  }

  @Override
  public void testFailure(Failure failure) {
    if (runFinished) {
      out.println("Failure after the test run finished:");
      printFailure(failure, "1");
      out.flush();
      return;
    }
    super.testFailure(failure);
  }

  @Override
  protected void printFailure(Failure each, String prefix) {
    out.println(prefix + ") " + Descriptions.displayName(each.getDescription()));
    out.print(each.getTrace());
  }
}
