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

import com.facebook.buck.junitconsole.spec.TestClasses;
import com.google.common.collect.ImmutableSet;
import org.junit.runner.Description;
import org.junit.runner.manipulation.Filter;

/**
 * Keeps the methods named by a spec. A name without a parameter suffix also selects every
 * parameterized instance of the method, so {@code testFoo} keeps {@code testFoo[0]} and {@code
 * testFoo[1]} while {@code testFoo[1]} keeps only itself.
 */
public class SpecMethodFilter extends Filter {

  private final ImmutableSet<String> methods;

  public SpecMethodFilter(Iterable<String> methods) {
    this.methods = ImmutableSet.copyOf(methods);
  }

  @Override
  public boolean shouldRun(Description description) {
    if (description.isTest()) {
      String methodName = description.getMethodName();
      return methodName != null
          && (methods.contains(methodName)
              || methods.contains(TestClasses.baseMethodName(methodName)));
    }
    for (Description child : description.getChildren()) {
      if (shouldRun(child)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String describe() {
    return "Methods " + String.join(", ", methods);
  }
}
