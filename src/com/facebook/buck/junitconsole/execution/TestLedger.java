/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.execution;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Every test method invocation of one run, retries included, in the order they were made. Safe to
 * record into from any number of test threads.
 */
public final class TestLedger {

  private final Queue<TestCall> calls = new ConcurrentLinkedQueue<>();

  public void record(String className, String methodName, int attempt) {
    calls.add(new TestCall(className, methodName, attempt));
  }

  public ImmutableList<TestCall> getCalls() {
    return ImmutableList.copyOf(calls);
  }

  /** Method names in call order, one entry per attempt. */
  public ImmutableList<String> getCalledMethodNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (TestCall call : calls) {
      names.add(call.getMethodName());
    }
    return names.build();
  }

  public int countCalls(String className, String methodName) {
    int count = 0;
    for (TestCall call : calls) {
      if (call.getClassName().equals(className) && call.getMethodName().equals(methodName)) {
        count++;
      }
    }
    return count;
  }

  public static final class TestCall {
    private final String className;
    private final String methodName;
    private final int attempt;

    public TestCall(String className, String methodName, int attempt) {
      this.className = className;
      this.methodName = methodName;
      this.attempt = attempt;
    }

    public String getClassName() {
      return className;
    }

    public String getMethodName() {
      return methodName;
    }

    /** 1 for the first invocation, 2 for the first retry and so on. */
    public int getAttempt() {
      return attempt;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof TestCall)) {
        return false;
      }
      TestCall that = (TestCall) o;
      return attempt == that.attempt
          && className.equals(that.className)
          && methodName.equals(that.methodName);
    }

    @Override
    public int hashCode() {
      return Objects.hash(className, methodName, attempt);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("test", className + "#" + methodName)
          .add("attempt", attempt)
          .toString();
    }
  }
}
