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

import com.facebook.buck.junitconsole.log.Logger;
import com.google.common.base.Throwables;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.junit.runner.notification.StoppedByUserException;
import org.junit.runners.model.RunnerScheduler;

/**
 * Runs the children of one JUnit {@code ParentRunner} on a shared pool. {@link #finished()} waits
 * only for the children this scheduler submitted, so several runners can share one pool.
 *
 * <p>Once a stop has been requested no further children are submitted; children already running
 * are left to complete.
 */
public class ParallelScheduler implements RunnerScheduler {

  private static final Logger LOG = Logger.get(ParallelScheduler.class);

  private final ExecutorService executor;
  private final StopSignal stopSignal;
  private final List<Future<?>> futures = new ArrayList<>();

  public ParallelScheduler(ExecutorService executor, StopSignal stopSignal) {
    this.executor = executor;
    this.stopSignal = stopSignal;
  }

  @Override
  public void schedule(Runnable childStatement) {
    if (stopSignal.isStopRequested()) {
      return;
    }
    synchronized (futures) {
      futures.add(executor.submit(() -> runChild(childStatement)));
    }
  }

  private static void runChild(Runnable childStatement) {
    try {
      childStatement.run();
    } catch (StoppedByUserException e) {
      // The notifier refused to start a test; the run is being stopped.
      LOG.debug("Stop requested, %s did not start", Thread.currentThread().getName());
    }
  }

  @Override
  public void finished() {
    List<Future<?>> submitted;
    synchronized (futures) {
      submitted = new ArrayList<>(futures);
      futures.clear();
    }
    Throwable failure = null;
    boolean interrupted = false;
    for (Future<?> future : submitted) {
      while (true) {
        try {
          future.get();
          break;
        } catch (InterruptedException e) {
          interrupted = true;
        } catch (ExecutionException e) {
          if (failure == null) {
            failure = e.getCause();
          } else {
            failure.addSuppressed(e.getCause());
          }
          break;
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    if (failure != null) {
      Throwables.throwIfUnchecked(failure);
      throw new RuntimeException(failure);
    }
  }
}
