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

import com.google.common.base.Preconditions;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.junit.runner.Computer;
import org.junit.runner.Runner;
import org.junit.runner.notification.RunNotifier;
import org.junit.runners.ParentRunner;
import org.junit.runners.Suite;
import org.junit.runners.model.InitializationError;
import org.junit.runners.model.RunnerBuilder;

/**
 * Builds the JUnit suite for one concurrency group.
 *
 * <p>Classes of a class-parallel group are dispatched to a class pool, methods of a
 * method-parallel group to a method pool. Both pools are sized by the thread count, are created
 * lazily and live only as long as the group: they are shut down when the suite returned by {@link
 * #getSuite} finishes running. Method parallelism only applies to classes whose runner is a
 * {@link ParentRunner}; other runners run their methods serially.
 */
public class ConcurrentComputer extends Computer {

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

  private final Concurrency concurrency;
  private final int threads;
  private final StopSignal stopSignal;
  private final ClassRunScope classRunScope;

  @Nullable private ExecutorService classPool;
  @Nullable private ExecutorService methodPool;

  public ConcurrentComputer(
      Concurrency concurrency, int threads, StopSignal stopSignal, ClassRunScope classRunScope) {
    Preconditions.checkArgument(threads > 0, "Thread count must be positive, got %s", threads);
    this.concurrency = concurrency;
    this.threads = threads;
    this.stopSignal = stopSignal;
    this.classRunScope = classRunScope;
  }

  @Override
  public Runner getSuite(RunnerBuilder builder, Class<?>[] classes) throws InitializationError {
    RunnerBuilder groupBuilder =
        new RunnerBuilder() {
          @Override
          public Runner runnerForClass(Class<?> testClass) throws Throwable {
            return getRunner(builder, testClass);
          }
        };
    ConcurrencyGroupSuite suite = new ConcurrencyGroupSuite(groupBuilder, classes);
    if (concurrency.shouldRunClassesParallel()) {
      suite.setScheduler(new ParallelScheduler(classPool(), stopSignal));
    }
    return suite;
  }

  @Override
  protected Runner getRunner(RunnerBuilder builder, Class<?> testClass) throws Throwable {
    Runner runner = super.getRunner(builder, testClass);
    if (concurrency.shouldRunMethodsParallel() && runner instanceof ParentRunner) {
      ((ParentRunner<?>) runner).setScheduler(new ParallelScheduler(methodPool(), stopSignal));
    }
    return runner;
  }

  private synchronized ExecutorService classPool() {
    if (classPool == null) {
      classPool = MostExecutors.newFixedThreadPool(threads, "junit-classes");
    }
    return classPool;
  }

  private synchronized ExecutorService methodPool() {
    if (methodPool == null) {
      methodPool = MostExecutors.newFixedThreadPool(threads, "junit-methods");
    }
    return methodPool;
  }

  /** Shuts down whichever pools this group created. */
  public synchronized void shutdown() {
    if (classPool != null) {
      MostExecutors.shutdownOrThrow(
          classPool,
          SHUTDOWN_TIMEOUT_SECONDS,
          TimeUnit.SECONDS,
          new IllegalStateException("Class pool did not terminate for " + concurrency));
      classPool = null;
    }
    if (methodPool != null) {
      MostExecutors.shutdownOrThrow(
          methodPool,
          SHUTDOWN_TIMEOUT_SECONDS,
          TimeUnit.SECONDS,
          new IllegalStateException("Method pool did not terminate for " + concurrency));
      methodPool = null;
    }
  }

  private class ConcurrencyGroupSuite extends Suite {

    ConcurrencyGroupSuite(RunnerBuilder builder, Class<?>[] classes) throws InitializationError {
      super(builder, classes);
    }

    @Override
    protected String getName() {
      return "concurrency-" + concurrency.name();
    }

    @Override
    protected void runChild(Runner runner, RunNotifier notifier) {
      if (stopSignal.isStopRequested()) {
        return;
      }
      try (ClassRunScope.Handle ignored = classRunScope.enter(runner.getDescription())) {
        super.runChild(runner, notifier);
      }
    }

    @Override
    public void run(RunNotifier notifier) {
      try {
        super.run(notifier);
      } finally {
        shutdown();
      }
    }
  }
}
