/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.output;

/** Which captured test output is echoed to the console. Log files always get everything. */
public enum OutputMode {
  /** Echo the output of every test, and class setup and teardown output. */
  ALL,
  /** Echo the output of failed tests only. */
  FAILURE_ONLY,
  /** Echo nothing. */
  NONE,
}
