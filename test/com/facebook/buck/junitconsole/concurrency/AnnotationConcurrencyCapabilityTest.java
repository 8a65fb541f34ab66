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

import static org.junit.Assert.assertEquals;

import com.facebook.buck.junitconsole.annotations.TestParallel;
import com.facebook.buck.junitconsole.annotations.TestParallelClassesAndMethods;
import com.facebook.buck.junitconsole.annotations.TestParallelMethods;
import com.facebook.buck.junitconsole.annotations.TestSerial;
import java.util.Optional;
import org.junit.Test;

public class AnnotationConcurrencyCapabilityTest {

  @TestSerial
  static class Serial {}

  @TestParallel
  static class Parallel {}

  @TestParallelMethods
  static class ParallelMethods {}

  @TestParallelClassesAndMethods
  static class ParallelClassesAndMethods {}

  static class InheritsSerial extends Serial {}

  @TestParallel
  static class ParallelSubclassOfSerial extends Serial {}

  @TestParallelMethods
  @TestParallelClassesAndMethods
  static class BothMethodModes {}

  static class Plain {}

  private static Optional<Concurrency> declared(Class<?> testClass) {
    return AnnotationConcurrencyCapability.INSTANCE.declaredConcurrency(testClass);
  }

  @Test
  public void eachAnnotationMapsToItsMode() {
    assertEquals(Optional.of(Concurrency.SERIAL), declared(Serial.class));
    assertEquals(Optional.of(Concurrency.PARALLEL_CLASSES), declared(Parallel.class));
    assertEquals(Optional.of(Concurrency.PARALLEL_METHODS), declared(ParallelMethods.class));
    assertEquals(
        Optional.of(Concurrency.PARALLEL_CLASSES_AND_METHODS),
        declared(ParallelClassesAndMethods.class));
  }

  @Test
  public void annotationsAreInherited() {
    assertEquals(Optional.of(Concurrency.SERIAL), declared(InheritsSerial.class));
  }

  @Test
  public void mostRestrictiveAnnotationWins() {
    assertEquals(Optional.of(Concurrency.SERIAL), declared(ParallelSubclassOfSerial.class));
    assertEquals(Optional.of(Concurrency.PARALLEL_METHODS), declared(BothMethodModes.class));
  }

  @Test
  public void unannotatedClassDeclaresNothing() {
    assertEquals(Optional.empty(), declared(Plain.class));
  }
}
