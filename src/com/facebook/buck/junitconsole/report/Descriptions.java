/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.report;

import com.google.common.base.CharMatcher;
import org.junit.runner.Description;
import org.junit.runner.notification.Failure;

/** Naming rules for JUnit descriptions in console output and reports. */
public final class Descriptions {

  /** Method name used for failures that belong to a class rather than one of its methods. */
  public static final String CLASS_METHOD = "classMethod";

  private static final CharMatcher FILE_NAME_SAFE =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("._$-"));

  private Descriptions() {}

  public static String methodName(Description description) {
    String methodName = description.getMethodName();
    return methodName != null ? methodName : CLASS_METHOD;
  }

  /** {@code com.example.FooTest#testBar}, or {@code com.example.FooTest#classMethod}. */
  public static String displayName(Description description) {
    return description.getClassName() + "#" + methodName(description);
  }

  /** Assertion failures are reported as failures, every other exception as an error. */
  public static boolean isAssertionFailure(Failure failure) {
    return failure.getException() instanceof AssertionError;
  }

  public static String sanitizeFileName(String name) {
    return FILE_NAME_SAFE.negate().replaceFrom(name, '_');
  }
}
