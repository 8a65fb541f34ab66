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

import com.facebook.buck.junitconsole.concurrency.ClassRunScope;
import com.facebook.buck.junitconsole.log.Logger;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;

/**
 * Captures what tests write to {@code System.out} and {@code System.err}.
 *
 * <p>Each running test gets its own buffers, selected through the {@link RoutingOutputStream}s by
 * the thread that runs it. When the test finishes its buffers are appended to its class's log as
 * one block and, depending on the {@link OutputMode}, echoed to the console as one block. Output
 * a class produces outside of its tests (class setup and teardown) goes straight into the class
 * log and is echoed only in {@link OutputMode#ALL}.
 *
 * <p>When the run finishes each class log is written to {@code <outdir>/<class>.out.txt} and
 * {@code <outdir>/<class>.err.txt}, whatever the output mode.
 */
@RunListener.ThreadSafe
public class StreamCapturingListener extends RunListener implements StreamSource, ClassRunScope {

  private static final Logger LOG = Logger.get(StreamCapturingListener.class);

  private final RoutingOutputStream routedOut;
  private final RoutingOutputStream routedErr;
  private final PrintStream consoleOut;
  private final PrintStream consoleErr;
  private final OutputMode outputMode;
  private final File outdir;

  private final ConcurrentMap<String, ClassCapture> classCaptures = new ConcurrentHashMap<>();
  private final ConcurrentMap<Description, TestCapture> testCaptures = new ConcurrentHashMap<>();
  private final Object consoleLock = new Object();

  public StreamCapturingListener(
      RoutingOutputStream routedOut,
      RoutingOutputStream routedErr,
      PrintStream consoleOut,
      PrintStream consoleErr,
      OutputMode outputMode,
      File outdir) {
    this.routedOut = routedOut;
    this.routedErr = routedErr;
    this.consoleOut = consoleOut;
    this.consoleErr = consoleErr;
    this.outputMode = outputMode;
    this.outdir = outdir;
  }

  private ClassCapture classCapture(String className) {
    return classCaptures.computeIfAbsent(className, name -> new ClassCapture());
  }

  @Override
  public Handle enter(Description classDescription) {
    ClassCapture classCapture = classCapture(classDescription.getClassName());
    ByteArrayOutputStream echoOut = new ByteArrayOutputStream();
    ByteArrayOutputStream echoErr = new ByteArrayOutputStream();
    OutputStream previousOut;
    OutputStream previousErr;
    if (outputMode == OutputMode.ALL) {
      previousOut = routedOut.route(new EchoingOutputStream(classCapture.out, echoOut));
      previousErr = routedErr.route(new EchoingOutputStream(classCapture.err, echoErr));
    } else {
      previousOut = routedOut.route(classCapture.out);
      previousErr = routedErr.route(classCapture.err);
    }
    return () -> {
      routedOut.route(previousOut);
      routedErr.route(previousErr);
      echo(echoOut.toByteArray(), echoErr.toByteArray());
    };
  }

  @Override
  public void testStarted(Description description) {
    classCapture(description.getClassName());
    TestCapture capture = new TestCapture();
    testCaptures.put(description, capture);
    capture.previousOut = routedOut.route(capture.out);
    capture.previousErr = routedErr.route(capture.err);
  }

  @Override
  public void testFailure(Failure failure) {
    Description description = failure.getDescription();
    TestCapture capture = testCaptures.get(description);
    if (capture != null) {
      capture.failed = true;
    } else {
      // Class level failure, make sure the class gets its log files.
      classCapture(description.getClassName());
    }
  }

  @Override
  public void testIgnored(Description description) {
    classCapture(description.getClassName());
  }

  @Override
  public void testFinished(Description description) {
    TestCapture capture = testCaptures.remove(description);
    if (capture == null) {
      return;
    }
    routedOut.route(capture.previousOut);
    routedErr.route(capture.previousErr);

    byte[] out = capture.out.toByteArray();
    byte[] err = capture.err.toByteArray();
    classCapture(description.getClassName()).append(out, err);
    if (outputMode == OutputMode.ALL || (outputMode == OutputMode.FAILURE_ONLY && capture.failed)) {
      echo(out, err);
    }
  }

  private void echo(byte[] out, byte[] err) {
    if (out.length == 0 && err.length == 0) {
      return;
    }
    synchronized (consoleLock) {
      consoleOut.write(out, 0, out.length);
      consoleOut.flush();
      consoleErr.write(err, 0, err.length);
      consoleErr.flush();
    }
  }

  @Override
  public void testRunFinished(Result result) throws IOException {
    for (Map.Entry<String, ClassCapture> entry : classCaptures.entrySet()) {
      String className = entry.getKey();
      ClassCapture capture = entry.getValue();
      Files.write(new File(outdir, className + ".out.txt").toPath(), capture.out.toByteArray());
      Files.write(new File(outdir, className + ".err.txt").toPath(), capture.err.toByteArray());
      LOG.debug("Wrote captured output of %s to %s", className, outdir);
    }
  }

  @Override
  public byte[] readOut(String className) {
    ClassCapture capture = classCaptures.get(className);
    return capture == null ? new byte[0] : capture.out.toByteArray();
  }

  @Override
  public byte[] readErr(String className) {
    ClassCapture capture = classCaptures.get(className);
    return capture == null ? new byte[0] : capture.err.toByteArray();
  }

  /** Class output written while the console echo is on goes to both the log and the echo. */
  private static class EchoingOutputStream extends OutputStream {
    private final ByteArrayOutputStream log;
    private final ByteArrayOutputStream echo;

    EchoingOutputStream(ByteArrayOutputStream log, ByteArrayOutputStream echo) {
      this.log = log;
      this.echo = echo;
    }

    @Override
    public void write(int b) {
      log.write(b);
      echo.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) {
      log.write(b, off, len);
      echo.write(b, off, len);
    }
  }

  /** Everything one class wrote. Writes to the buffers are atomic per call. */
  private static class ClassCapture {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    void append(byte[] testOut, byte[] testErr) {
      out.write(testOut, 0, testOut.length);
      err.write(testErr, 0, testErr.length);
    }
  }

  private static class TestCapture {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    @Nullable private OutputStream previousOut;
    @Nullable private OutputStream previousErr;
    private volatile boolean failed;
  }
}
