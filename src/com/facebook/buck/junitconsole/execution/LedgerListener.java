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

import org.junit.runner.Description;
import org.junit.runner.notification.RunListener;

/** Records the first attempt of every started test; retries are recorded by the retrying runner. */
@RunListener.ThreadSafe
public class LedgerListener extends RunListener {

  private final TestLedger ledger;

  public LedgerListener(TestLedger ledger) {
    this.ledger = ledger;
  }

  @Override
  public void testStarted(Description description) {
    String methodName = description.getMethodName();
    ledger.record(
        description.getClassName(),
        methodName != null ? methodName : description.getDisplayName(),
        1);
  }
}
