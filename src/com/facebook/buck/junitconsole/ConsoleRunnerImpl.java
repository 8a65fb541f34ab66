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

import com.facebook.buck.junitconsole.concurrency.AnnotationConcurrencyCapability;
import com.facebook.buck.junitconsole.concurrency.Concurrency;
import com.facebook.buck.junitconsole.concurrency.ConcurrentComputer;
import com.facebook.buck.junitconsole.concurrency.StopSignal;
import com.facebook.buck.junitconsole.execution.FailFastListener;
import com.facebook.buck.junitconsole.execution.LedgerListener;
import com.facebook.buck.junitconsole.execution.PlannedRunnerBuilder;
import com.facebook.buck.junitconsole.execution.RetryingRunnerBuilder;
import com.facebook.buck.junitconsole.execution.SpecMethodFilter;
import com.facebook.buck.junitconsole.execution.TestLedger;
import com.facebook.buck.junitconsole.execution.TestShardFilter;
import com.facebook.buck.junitconsole.log.Logger;
import com.facebook.buck.junitconsole.output.JavaUtilLoggingHelper;
import com.facebook.buck.junitconsole.output.RoutingOutputStream;
import com.facebook.buck.junitconsole.output.StreamCapturingListener;
import com.facebook.buck.junitconsole.report.AntJunitXmlReportListener;
import com.facebook.buck.junitconsole.report.ConsoleListener;
import com.facebook.buck.junitconsole.report.Descriptions;
import com.facebook.buck.junitconsole.report.PerTestConsoleListener;
import com.facebook.buck.junitconsole.report.ShutdownListener;
import com.facebook.buck.junitconsole.spec.Spec;
import com.facebook.buck.junitconsole.spec.SpecException;
import com.facebook.buck.junitconsole.spec.SpecParser;
import com.facebook.buck.junitconsole.spec.SpecSet;
import com.facebook.buck.junitconsole.spec.TestMethod;
import com.facebook.buck.junitconsole.spec.TestRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.Runner;
import org.junit.runner.manipulation.Filter;
import org.junit.runner.manipulation.Filterable;
import org.junit.runner.manipulation.NoTestsRemainException;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;
import org.junit.runner.notification.RunNotifier;
import org.junit.runner.notification.StoppedByUserException;
import org.junit.runners.model.InitializationError;

/**
 * Runs the tests named by a list of specs and reports on them.
 *
 * <p>One {@link #run} call parses the specs, builds and filters a JUnit runner per class, applies
 * sharding, and then runs the classes one concurrency group after another: serial classes first on
 * the calling thread, then the class-parallel, method-parallel and fully parallel groups, each on
 * worker pools of its own. Test output is captured per test, the console gets JUnit's summary and
 * optionally XML reports are written. The result is an {@link ExitCode}; with {@code
 * exitOnFinish} the VM exits with it.
 */
public class ConsoleRunnerImpl {

  private static final Logger LOG = Logger.get(ConsoleRunnerImpl.class);

  /** The order in which concurrency groups run. */
  @VisibleForTesting
  static final ImmutableList<Concurrency> GROUP_ORDER =
      ImmutableList.of(
          Concurrency.SERIAL,
          Concurrency.PARALLEL_CLASSES,
          Concurrency.PARALLEL_METHODS,
          Concurrency.PARALLEL_CLASSES_AND_METHODS);

  private final RunnerConfig config;
  private final PrintStream consoleOut;
  private final PrintStream consoleErr;
  private final boolean exitOnFinish;
  private final TestRegistry registry;
  private final List<RunListener> extraListeners = new ArrayList<>();

  private TestLedger ledger = new TestLedger();

  public ConsoleRunnerImpl(
      RunnerConfig config, PrintStream consoleOut, PrintStream consoleErr, boolean exitOnFinish) {
    this(
        config,
        consoleOut,
        consoleErr,
        exitOnFinish,
        TestRegistry.forClassLoader(ConsoleRunnerImpl.class.getClassLoader()));
  }

  public ConsoleRunnerImpl(
      RunnerConfig config,
      PrintStream consoleOut,
      PrintStream consoleErr,
      boolean exitOnFinish,
      TestRegistry registry) {
    this.config = config;
    this.consoleOut = consoleOut;
    this.consoleErr = consoleErr;
    this.exitOnFinish = exitOnFinish;
    this.registry = registry;
  }

  /** Adds a listener notified after the built-in ones, before fail fast. */
  public void addListener(RunListener listener) {
    extraListeners.add(listener);
  }

  /** Every test call of the most recent run, retries included. */
  public TestLedger getLedger() {
    return ledger;
  }

  /**
   * Runs the tests. {@code System.out} and {@code System.err} are replaced for the duration of the
   * run and restored afterwards.
   *
   * @param tests test specs, {@code ClassName} or {@code ClassName#method}; must not be empty
   * @return the exit status, unless this runner exits the VM
   */
  public ExitCode run(List<String> tests) {
    ledger = new TestLedger();
    PrintStream originalOut = System.out;
    PrintStream originalErr = System.err;
    RoutingOutputStream routedOut = new RoutingOutputStream(consoleOut);
    RoutingOutputStream routedErr = new RoutingOutputStream(consoleErr);
    System.setOut(new PrintStream(routedOut, true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(routedErr, true, StandardCharsets.UTF_8));
    JavaUtilLoggingHelper.LogHandlers logHandlers =
        JavaUtilLoggingHelper.setupLogging(
            routedOut, routedErr, config.getStdOutLogLevel(), config.getStdErrLogLevel());

    ExitCode exitCode;
    try {
      exitCode = runTests(tests, routedOut, routedErr);
    } finally {
      JavaUtilLoggingHelper.cleanupLogging(logHandlers);
      System.setOut(originalOut);
      System.setErr(originalErr);
    }
    return exit(exitCode);
  }

  private ExitCode runTests(
      List<String> tests, RoutingOutputStream routedOut, RoutingOutputStream routedErr) {
    File outdir = config.getOutdir();
    if (!outdir.exists() && !outdir.mkdirs()) {
      throw new IllegalStateException("Failed to create output directory: " + outdir);
    }

    ImmutableList<Spec> specs;
    try {
      specs = new SpecParser(registry, AnnotationConcurrencyCapability.INSTANCE).parse(tests);
    } catch (SpecException e) {
      consoleErr.println("Error parsing specs: " + e.getMessage());
      return ExitCode.INVALID_SPECS;
    }

    RunNotifier notifier = new RunNotifier();
    Result result = new Result();
    notifier.addFirstListener(result.createListener());

    StreamCapturingListener streamCapturingListener =
        new StreamCapturingListener(
            routedOut, routedErr, consoleOut, consoleErr, config.getOutputMode(), outdir);
    notifier.addListener(streamCapturingListener);
    notifier.addListener(new LedgerListener(ledger));
    ShutdownListener shutdownListener = new ShutdownListener(notifier, result);
    notifier.addListener(shutdownListener);
    notifier.addListener(
        config.isPerTestTimer()
            ? new PerTestConsoleListener(consoleOut)
            : new ConsoleListener(consoleOut));
    if (config.isXmlReport()) {
      notifier.addListener(new AntJunitXmlReportListener(outdir, streamCapturingListener));
    }
    for (RunListener listener : extraListeners) {
      notifier.addListener(listener);
    }
    StopSignal stopSignal = StopSignal.NEVER;
    FailFastListener failFastListener = null;
    if (config.isFailFast()) {
      failFastListener = new FailFastListener(notifier);
      notifier.addListener(failFastListener);
      stopSignal = failFastListener;
    }

    Map<Class<?>, Runner> runners = planRunners(specs);
    SpecSet specSet = new SpecSet(runnableSpecs(specs, runners), config.getDefaultConcurrency());

    Description runDescription = Description.createSuiteDescription("junit-console-runner");
    for (Runner runner : runners.values()) {
      runDescription.addChild(runner.getDescription());
    }

    boolean initializationFailed = false;
    boolean stopped = false;
    Thread unexpectedExitHook = createUnexpectedExitHook(shutdownListener, consoleOut);
    Runtime.getRuntime().addShutdownHook(unexpectedExitHook);
    try {
      notifier.fireTestRunStarted(runDescription);
      for (Concurrency concurrency : GROUP_ORDER) {
        SpecSet group = specSet.extract(concurrency);
        if (group.isEmpty() || stopSignal.isStopRequested()) {
          continue;
        }
        LOG.debug("Running %d classes with concurrency %s", group.size(), concurrency);
        ConcurrentComputer computer =
            new ConcurrentComputer(
                concurrency, config.getParallelThreads(), stopSignal, streamCapturingListener);
        computer.getSuite(new PlannedRunnerBuilder(runners), group.classes()).run(notifier);
      }
    } catch (StoppedByUserException e) {
      stopped = true;
    } catch (InitializationError e) {
      initializationFailed = true;
      consoleErr.println("Error initializing JUnit: " + e.getCauses());
    } finally {
      // If we're exiting via a thrown exception, we'll get a better message by letting it
      // propagate than by halt()ing.
      Runtime.getRuntime().removeShutdownHook(unexpectedExitHook);
    }

    boolean aborted = stopped || stopSignal.isStopRequested();
    notifier.fireTestRunFinished(result);

    if (aborted) {
      Failure firstFailure =
          failFastListener != null ? failFastListener.getFirstFailure() : null;
      consoleErr.println(
          "Test run aborted"
              + (firstFailure != null
                  ? " after " + Descriptions.displayName(firstFailure.getDescription()) + " failed"
                  : ""));
      return ExitCode.ABORTED;
    }
    if (initializationFailed || !result.wasSuccessful()) {
      return ExitCode.TESTS_FAILED;
    }
    return ExitCode.SUCCESS;
  }

  /**
   * Builds one runner per spec, narrowed to the spec's methods and to this run's shard. Classes
   * left without tests are dropped.
   */
  private Map<Class<?>, Runner> planRunners(List<Spec> specs) {
    RetryingRunnerBuilder builder =
        new RetryingRunnerBuilder(config.getNumRetries(), ledger, consoleErr);
    Map<Class<?>, Runner> runners = new LinkedHashMap<>();
    for (Spec spec : specs) {
      Runner runner = builder.safeRunnerForClass(spec.getTestClass());
      if (runner != null && !spec.isWholeClass()) {
        runner = applyFilter(runner, new SpecMethodFilter(spec.getMethods()));
      }
      if (runner != null) {
        runners.put(spec.getTestClass(), runner);
      } else {
        LOG.warn("No tests of %s match %s", spec.getSpecName(), spec.getMethods());
      }
    }
    if (config.isSharded()) {
      applyShard(runners);
    }
    return runners;
  }

  private void applyShard(Map<Class<?>, Runner> runners) {
    TestShardFilter shardFilter =
        new TestShardFilter(config.getTestShard(), config.getNumTestShards());
    List<TestMethod> allMethods = new ArrayList<>();
    for (Map.Entry<Class<?>, Runner> entry : runners.entrySet()) {
      for (Description leaf : TestShardFilter.leaves(entry.getValue().getDescription())) {
        allMethods.add(TestShardFilter.toTestMethod(leaf, entry.getKey()));
      }
    }
    ImmutableSortedSet<TestMethod> selected = shardFilter.select(allMethods);
    LOG.debug(
        "Shard %d/%d has %d of %d tests",
        config.getTestShard(),
        config.getNumTestShards(),
        selected.size(),
        allMethods.size());

    Iterator<Map.Entry<Class<?>, Runner>> iterator = runners.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<Class<?>, Runner> entry = iterator.next();
      Runner runner = entry.getValue();
      Filter filter = TestShardFilter.keeping(selected, entry.getKey());
      Runner filtered;
      if (runner instanceof Filterable) {
        filtered = applyFilter(runner, filter);
      } else {
        // Runners that cannot be filtered, such as the ones reporting a broken class, run in
        // the shard their only test belongs to.
        filtered = filter.shouldRun(runner.getDescription()) ? runner : null;
      }
      if (filtered == null) {
        iterator.remove();
      }
    }
  }

  @Nullable
  private static Runner applyFilter(Runner runner, Filter filter) {
    try {
      filter.apply(runner);
      return runner;
    } catch (NoTestsRemainException e) {
      LOG.debug("%s: no tests remain after %s", runner.getDescription(), filter.describe());
      return null;
    }
  }

  private static List<Spec> runnableSpecs(List<Spec> specs, Map<Class<?>, Runner> runners) {
    List<Spec> runnable = new ArrayList<>();
    for (Spec spec : specs) {
      if (runners.containsKey(spec.getTestClass())) {
        runnable.add(spec);
      }
    }
    return runnable;
  }

  /**
   * Returns a shutdown hook that reports a VM exiting while tests still run, such as a test
   * calling {@code System.exit}, which would otherwise go unnoticed.
   */
  private static Thread createUnexpectedExitHook(ShutdownListener listener, PrintStream out) {
    return new Thread("junit-unexpected-exit") {
      @Override
      public void run() {
        try {
          listener.unexpectedShutdown();
          // We want to trap and log no matter why abort failed for a better end user message.
        } catch (Exception e) {
          out.println(e);
          e.printStackTrace(out);
        }
        out.println("FATAL: VM exiting unexpectedly.");
        out.flush();
        Runtime.getRuntime().halt(1);
      }
    };
  }

  private ExitCode exit(ExitCode exitCode) {
    if (exitOnFinish) {
      System.exit(exitCode.getCode());
    }
    return exitCode;
  }
}
