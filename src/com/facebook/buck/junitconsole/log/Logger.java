/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.log;

import java.util.logging.Level;
import javax.annotation.Nullable;

/**
 * Thin wrapper around {@link java.util.logging.Logger} with {@link String#format} style messages.
 *
 * <p>Usage: {@code private static final Logger LOG = Logger.get(Foo.class);}
 */
public final class Logger {

  private final java.util.logging.Logger julLogger;

  private Logger(java.util.logging.Logger julLogger) {
    this.julLogger = julLogger;
  }

  public static Logger get(Class<?> cls) {
    return new Logger(java.util.logging.Logger.getLogger(cls.getName()));
  }

  public void debug(String format, Object... args) {
    log(Level.FINE, null, format, args);
  }

  public void info(String format, Object... args) {
    log(Level.INFO, null, format, args);
  }

  public void warn(String format, Object... args) {
    log(Level.WARNING, null, format, args);
  }

  public void warn(Throwable t, String format, Object... args) {
    log(Level.WARNING, t, format, args);
  }

  public void error(String format, Object... args) {
    log(Level.SEVERE, null, format, args);
  }

  private void log(Level level, @Nullable Throwable t, String format, Object... args) {
    if (!julLogger.isLoggable(level)) {
      return;
    }
    String message = args.length == 0 ? format : String.format(format, args);
    if (t == null) {
      julLogger.log(level, message);
    } else {
      julLogger.log(level, message, t);
    }
  }
}
