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

import javax.annotation.Nullable;

/** Turns the concurrency flags of the command line into the run-wide default mode. */
public final class ConcurrencyResolver {

  private ConcurrencyResolver() {}

  /**
   * Computes the run-wide default mode from the command line. An explicit {@code
   * -default-concurrency} wins over the deprecated boolean flags; with no flag at all tests run
   * serially.
   */
  public static Concurrency computeConcurrencyOption(
      @Nullable Concurrency explicit, boolean defaultParallel, boolean parallelMethods) {
    if (explicit != null) {
      return explicit;
    }
    if (defaultParallel && parallelMethods) {
      return Concurrency.PARALLEL_CLASSES_AND_METHODS;
    }
    if (defaultParallel) {
      return Concurrency.PARALLEL_CLASSES;
    }
    if (parallelMethods) {
      return Concurrency.PARALLEL_METHODS;
    }
    return Concurrency.SERIAL;
  }
}
