/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.output;

import java.io.OutputStream;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;
import javax.annotation.Nullable;

/**
 * Sends {@code java.util.logging} records emitted by tests to the routed standard streams, so they
 * end up in the captured output of the test that logged them.
 */
public class JavaUtilLoggingHelper {

  private JavaUtilLoggingHelper() {}

  /** Container class for the handlers installed by {@link #setupLogging}. */
  public static class LogHandlers {
    @Nullable private final Handler stdOutHandler;
    @Nullable private final Handler stdErrHandler;
    @Nullable private final Level previousRootLevel;

    LogHandlers(
        @Nullable Handler stdOutHandler,
        @Nullable Handler stdErrHandler,
        @Nullable Level previousRootLevel) {
      this.stdOutHandler = stdOutHandler;
      this.stdErrHandler = stdErrHandler;
      this.previousRootLevel = previousRootLevel;
    }

    @Nullable
    public Handler getStdOutHandler() {
      return stdOutHandler;
    }

    @Nullable
    public Handler getStdErrHandler() {
      return stdErrHandler;
    }
  }

  /**
   * Adds two handlers to the root logger: one writing records at {@code stdOutLogLevel} or above
   * to {@code out}, one writing records at {@code stdErrLogLevel} or above to {@code err}. The
   * root logger is opened up to FINE while they are installed.
   */
  public static LogHandlers setupLogging(
      OutputStream out, OutputStream err, Level stdOutLogLevel, Level stdErrLogLevel) {
    Logger rootLogger = LogManager.getLogManager().getLogger("");
    if (rootLogger == null) {
      return new LogHandlers(null, null, null);
    }
    Level previousRootLevel = rootLogger.getLevel();
    rootLogger.setLevel(Level.FINE);

    JulLogFormatter formatter = new JulLogFormatter();
    Handler stdOutHandler = addStreamHandler(rootLogger, out, formatter, stdOutLogLevel);
    Handler stdErrHandler = addStreamHandler(rootLogger, err, formatter, stdErrLogLevel);
    return new LogHandlers(stdOutHandler, stdErrHandler, previousRootLevel);
  }

  /**
   * Adds a handler to the logger that flushes after every record, so each record is written on
   * the thread that logged it.
   */
  public static Handler addStreamHandler(
      Logger logger, OutputStream stream, Formatter formatter, Level level) {
    Handler result =
        new StreamHandler(stream, formatter) {
          @Override
          public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
          }
        };
    result.setLevel(level);
    logger.addHandler(result);
    return result;
  }

  /** Flushes and removes a log handler from the logger. */
  public static void flushAndRemoveLogHandler(Logger logger, @Nullable Handler handler) {
    if (handler != null) {
      handler.flush();
      logger.removeHandler(handler);
    }
  }

  /** Removes the handlers and restores the root logger's level. */
  public static void cleanupLogging(LogHandlers handlers) {
    Logger rootLogger = LogManager.getLogManager().getLogger("");
    if (rootLogger == null) {
      return;
    }
    flushAndRemoveLogHandler(rootLogger, handlers.getStdOutHandler());
    flushAndRemoveLogHandler(rootLogger, handlers.getStdErrHandler());
    if (handlers.previousRootLevel != null) {
      rootLogger.setLevel(handlers.previousRootLevel);
    }
  }
}
