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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.junit.runner.Runner;
import org.junit.runners.model.RunnerBuilder;

/** Hands out runners that were built and filtered before the concurrency groups were formed. */
public class PlannedRunnerBuilder extends RunnerBuilder {

  private final ImmutableMap<Class<?>, Runner> runners;

  public PlannedRunnerBuilder(Map<Class<?>, Runner> runners) {
    this.runners = ImmutableMap.copyOf(runners);
  }

  @Override
  public Runner runnerForClass(Class<?> testClass) {
    // null tells the suite to skip the class.
    return runners.get(testClass);
  }
}
