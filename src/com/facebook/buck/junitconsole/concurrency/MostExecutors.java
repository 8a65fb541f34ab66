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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class MostExecutors {

  private MostExecutors() {}

  /** A fixed size pool whose threads are named {@code <threadName>-<n>}. */
  public static ExecutorService newFixedThreadPool(int threads, String threadName) {
    return Executors.newFixedThreadPool(threads, new NamedThreadFactory(threadName));
  }

  /**
   * Shuts down the executor and waits for its tasks. If they are still running after the timeout
   * the executor is interrupted, and if that does not stop them either {@code exception} is
   * thrown.
   */
  public static void shutdownOrThrow(
      ExecutorService service, long timeout, TimeUnit unit, RuntimeException exception) {
    boolean terminated = false;
    service.shutdown();
    try {
      terminated = service.awaitTermination(timeout, unit);
    } catch (InterruptedException e) {
      terminated = false;
    } finally {
      if (!terminated) {
        service.shutdownNow();
        try {
          terminated = service.awaitTermination(timeout, unit);
        } catch (InterruptedException e) {
          terminated = false;
        }
      }
    }
    if (!terminated) {
      throw exception;
    }
  }

  /** Gives each thread of a pool a meaningful and distinct name. */
  static class NamedThreadFactory implements ThreadFactory {

    private final AtomicInteger threadCount = new AtomicInteger(0);
    private final String threadName;

    NamedThreadFactory(String threadName) {
      this.threadName = threadName;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread newThread = Executors.defaultThreadFactory().newThread(r);
      newThread.setName(String.format(threadName + "-%d", threadCount.incrementAndGet()));
      return newThread;
    }
  }
}
