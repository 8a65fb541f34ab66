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

/** Process exit status of a console run. */
public enum ExitCode {
  /** Every test that ran passed, possibly after retries. Also used when no test ran. */
  SUCCESS(0),
  /** At least one test failed or errored, or a listener failed while reporting. */
  TESTS_FAILED(1),
  /** A test spec could not be parsed or resolved; nothing ran. */
  INVALID_SPECS(2),
  /** The run was stopped early by fail fast. */
  ABORTED(3),
  /** The command line could not be parsed; nothing ran. */
  INVALID_ARGUMENTS(4);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }
}
