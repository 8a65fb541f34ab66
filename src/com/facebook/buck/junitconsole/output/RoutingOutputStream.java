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

import java.io.IOException;
import java.io.OutputStream;
import javax.annotation.Nullable;

/**
 * An OutputStream that writes to whatever stream the calling thread has been routed to, and to a
 * fallback stream for threads that have not been routed. Installed as {@code System.out} and
 * {@code System.err} so that each test thread's output lands in that test's own buffer.
 *
 * <p>Routing is per thread and is not inherited: threads a test starts itself write to the
 * fallback.
 */
public class RoutingOutputStream extends OutputStream {

  private final OutputStream fallback;
  private final ThreadLocal<OutputStream> target = new ThreadLocal<>();

  public RoutingOutputStream(OutputStream fallback) {
    this.fallback = fallback;
  }

  /**
   * Routes the calling thread to {@code newTarget}, or back to the fallback when it is null.
   *
   * @return the stream the thread was routed to before, null if it used the fallback
   */
  @Nullable
  public OutputStream route(@Nullable OutputStream newTarget) {
    OutputStream previous = target.get();
    if (newTarget == null) {
      target.remove();
    } else {
      target.set(newTarget);
    }
    return previous;
  }

  private OutputStream current() {
    OutputStream routed = target.get();
    return routed != null ? routed : fallback;
  }

  @Override
  public void write(int b) throws IOException {
    current().write(b);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    current().write(b, off, len);
  }

  @Override
  public void flush() throws IOException {
    current().flush();
  }

  /** Flushes only; neither the fallback nor any target is owned by this stream. */
  @Override
  public void close() throws IOException {
    flush();
  }
}
