/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.spec;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import java.util.Objects;

/**
 * One test method of one class. Instances sort by canonical class name and then by method name,
 * which is the order sharding assigns them to shards in.
 */
public final class TestMethod implements Comparable<TestMethod> {

  private final Class<?> testClass;
  private final String name;

  public TestMethod(Class<?> testClass, String name) {
    this.testClass = Preconditions.checkNotNull(testClass);
    this.name = Preconditions.checkNotNull(name);
  }

  public Class<?> getTestClass() {
    return testClass;
  }

  public String getName() {
    return name;
  }

  private String sortName() {
    String canonicalName = testClass.getCanonicalName();
    return canonicalName != null ? canonicalName : testClass.getName();
  }

  @Override
  public int compareTo(TestMethod that) {
    return ComparisonChain.start()
        .compare(sortName(), that.sortName())
        .compare(testClass.getName(), that.testClass.getName())
        .compare(name, that.name)
        .result();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TestMethod)) {
      return false;
    }
    TestMethod that = (TestMethod) o;
    return testClass.equals(that.testClass) && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(testClass, name);
  }

  @Override
  public String toString() {
    return testClass.getName() + "#" + name;
  }
}
