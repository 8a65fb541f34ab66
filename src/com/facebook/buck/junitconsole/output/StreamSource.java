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

/** Captured output of a test class, by fully qualified class name. */
public interface StreamSource {

  /** Everything the class wrote to stdout, empty if it wrote nothing or never ran. */
  byte[] readOut(String className);

  /** Everything the class wrote to stderr, empty if it wrote nothing or never ran. */
  byte[] readErr(String className);
}
