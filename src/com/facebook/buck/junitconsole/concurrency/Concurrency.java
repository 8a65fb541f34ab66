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

/** How the classes and methods of a group of tests may be scheduled relative to each other. */
public enum Concurrency {
  SERIAL(false, false),
  PARALLEL_CLASSES(true, false),
  PARALLEL_METHODS(false, true),
  PARALLEL_CLASSES_AND_METHODS(true, true);

  private final boolean parallelClasses;
  private final boolean parallelMethods;

  Concurrency(boolean parallelClasses, boolean parallelMethods) {
    this.parallelClasses = parallelClasses;
    this.parallelMethods = parallelMethods;
  }

  public boolean shouldRunClassesParallel() {
    return parallelClasses;
  }

  public boolean shouldRunMethodsParallel() {
    return parallelMethods;
  }
}
