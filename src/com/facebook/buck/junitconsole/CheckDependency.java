/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole;

import java.io.PrintStream;

class CheckDependency {

  private CheckDependency() {
    // Utility class.
  }

  /**
   * Validate the presence of the class, printing a hint to {@code err} if it is missing.
   *
   * @param classToLoad name of the class that is required for the execution to continue.
   * @return true if the class could be loaded
   */
  static boolean requiresClass(PrintStream err, String name, String classToLoad) {
    try {
      Class.forName(classToLoad, false, CheckDependency.class.getClassLoader());
      return true;
    } catch (ClassNotFoundException e) {
      err.println(
          "Unable to locate " + name + " on the classpath. Please add as a test dependency.");
      return false;
    }
  }
}
