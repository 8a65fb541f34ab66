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

import com.facebook.buck.junitconsole.spec.TestMethod;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import org.junit.runner.Description;
import org.junit.runner.manipulation.Filter;

/**
 * Splits the test methods of a run into {@code numShards} disjoint shards. Methods are sorted by
 * {@link TestMethod} order and the method at index {@code i} belongs to shard {@code i %
 * numShards}, so every shard of the same method set sees the same assignment.
 */
public class TestShardFilter {

  private final int shard;
  private final int numShards;

  public TestShardFilter(int shard, int numShards) {
    Preconditions.checkArgument(numShards > 0, "Number of shards must be positive");
    Preconditions.checkArgument(
        shard >= 0 && shard < numShards, "Shard %s out of range 0..%s", shard, numShards - 1);
    this.shard = shard;
    this.numShards = numShards;
  }

  /** The methods of {@code allMethods} that belong to this shard, in sorted order. */
  public ImmutableSortedSet<TestMethod> select(Collection<TestMethod> allMethods) {
    ImmutableSortedSet.Builder<TestMethod> selected = ImmutableSortedSet.naturalOrder();
    int index = 0;
    for (TestMethod method : ImmutableSortedSet.copyOf(allMethods)) {
      if (index % numShards == shard) {
        selected.add(method);
      }
      index++;
    }
    return selected.build();
  }

  /** A filter keeping only the leaves of {@code specClass} that are in {@code selected}. */
  public static Filter keeping(ImmutableSet<TestMethod> selected, Class<?> specClass) {
    return new Filter() {
      @Override
      public boolean shouldRun(Description description) {
        if (description.isTest()) {
          return selected.contains(toTestMethod(description, specClass));
        }
        for (Description child : description.getChildren()) {
          if (shouldRun(child)) {
            return true;
          }
        }
        return false;
      }

      @Override
      public String describe() {
        return "Test shard of " + specClass.getName();
      }
    };
  }

  /** Every leaf below {@code description}, in description order. */
  public static ImmutableList<Description> leaves(Description description) {
    ImmutableList.Builder<Description> leaves = ImmutableList.builder();
    collectLeaves(description, leaves);
    return leaves.build();
  }

  private static void collectLeaves(
      Description description, ImmutableList.Builder<Description> leaves) {
    if (description.isTest()) {
      leaves.add(description);
      return;
    }
    for (Description child : description.getChildren()) {
      collectLeaves(child, leaves);
    }
  }

  /**
   * The method a leaf description stands for. Leaves of nested or inherited suites keep their own
   * class when JUnit can resolve it.
   */
  public static TestMethod toTestMethod(Description leaf, Class<?> specClass) {
    Class<?> testClass = leaf.getTestClass();
    String methodName = leaf.getMethodName();
    return new TestMethod(
        testClass != null ? testClass : specClass,
        methodName != null ? methodName : leaf.getDisplayName());
  }
}
