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

/**
 * A command line argument with a value that parses but makes no sense. The message is meant to be
 * shown to the user as it is, without a stack trace.
 */
public class InvalidCmdLineArgumentException extends RuntimeException {

  public InvalidCmdLineArgumentException(String formatString, Object... args) {
    super(String.format(formatString, args));
  }
}
