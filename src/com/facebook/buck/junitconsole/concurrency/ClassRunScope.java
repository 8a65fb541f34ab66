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

import org.junit.runner.Description;

/**
 * Brackets the execution of one test class inside a concurrency group, on the thread that runs
 * the class. Output produced outside of any single test (class setup and teardown) is attributed
 * through it.
 */
public interface ClassRunScope {

  Handle enter(Description classDescription);

  interface Handle extends AutoCloseable {
    @Override
    void close();
  }
}
