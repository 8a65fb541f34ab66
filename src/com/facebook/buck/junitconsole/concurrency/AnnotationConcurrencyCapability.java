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

import com.facebook.buck.junitconsole.annotations.TestParallel;
import com.facebook.buck.junitconsole.annotations.TestParallelClassesAndMethods;
import com.facebook.buck.junitconsole.annotations.TestParallelMethods;
import com.facebook.buck.junitconsole.annotations.TestSerial;
import java.util.Optional;

/**
 * Reads the concurrency annotations of a test class, including those inherited from its
 * superclasses. When a class carries more than one of them the most restrictive one wins.
 */
public final class AnnotationConcurrencyCapability implements ConcurrencyCapability {

  public static final AnnotationConcurrencyCapability INSTANCE =
      new AnnotationConcurrencyCapability();

  private AnnotationConcurrencyCapability() {}

  @Override
  public Optional<Concurrency> declaredConcurrency(Class<?> testClass) {
    if (testClass.isAnnotationPresent(TestSerial.class)) {
      return Optional.of(Concurrency.SERIAL);
    }
    if (testClass.isAnnotationPresent(TestParallel.class)) {
      return Optional.of(Concurrency.PARALLEL_CLASSES);
    }
    if (testClass.isAnnotationPresent(TestParallelMethods.class)) {
      return Optional.of(Concurrency.PARALLEL_METHODS);
    }
    if (testClass.isAnnotationPresent(TestParallelClassesAndMethods.class)) {
      return Optional.of(Concurrency.PARALLEL_CLASSES_AND_METHODS);
    }
    return Optional.empty();
  }
}
