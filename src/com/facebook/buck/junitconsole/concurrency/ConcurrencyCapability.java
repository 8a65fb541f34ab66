/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.concurrency;

import java.util.Optional;

/** Answers whether a test class declares its own concurrency mode. */
public interface ConcurrencyCapability {

  /** A capability for which no class declares anything. */
  ConcurrencyCapability NONE = testClass -> Optional.empty();

  /**
   * @return the mode the class asks for, or empty when the run default applies to it.
   */
  Optional<Concurrency> declaredConcurrency(Class<?> testClass);
}
