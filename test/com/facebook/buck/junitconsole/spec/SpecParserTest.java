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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.facebook.buck.junitconsole.annotations.TestSerial;
import com.facebook.buck.junitconsole.concurrency.AnnotationConcurrencyCapability;
import com.facebook.buck.junitconsole.concurrency.Concurrency;
import com.facebook.buck.junitconsole.concurrency.ConcurrencyCapability;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;
import junit.framework.TestCase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

public class SpecParserTest {

  public static class SimpleTest {
    @Test
    public void testOne() {}

    @Test
    public void testTwo() {}
  }

  @TestSerial
  public static class SerialTest {
    @Test
    public void testOne() {}
  }

  @RunWith(Parameterized.class)
  public static class ParameterizedTest {
    @Parameterized.Parameters
    public static Collection<Object[]> data() {
      return Arrays.asList(new Object[][] {{1}, {2}});
    }

    private final int value;

    public ParameterizedTest(int value) {
      this.value = value;
    }

    @Test
    public void testValue() {
      assertTrue(value > 0);
    }
  }

  public static class Junit3Test extends TestCase {
    public void testSomething() {}
  }

  public abstract static class AbstractTest {
    @Test
    public void testOne() {}
  }

  public interface InterfaceTest {}

  static class NonPublicTest {
    @Test
    public void testOne() {}
  }

  public static class NoTestMethods {
    public void helper() {}
  }

  public static class ConstructorWithArgs {
    public ConstructorWithArgs(String unused) {}

    @Test
    public void testOne() {}
  }

  public static class BrokenStaticInit {
    static final int VALUE = explode();

    private static int explode() {
      throw new IllegalStateException("static init");
    }

    @Test
    public void testOne() {}
  }

  private static ImmutableList<Spec> parse(String... specs) throws SpecException {
    return new SpecParser(
            TestRegistry.forClassLoader(SpecParserTest.class.getClassLoader()),
            AnnotationConcurrencyCapability.INSTANCE)
        .parse(Arrays.asList(specs));
  }

  private static SpecException parseFailure(String... specs) {
    try {
      parse(specs);
    } catch (SpecException e) {
      return e;
    }
    throw new AssertionError("Expected a SpecException for " + Arrays.toString(specs));
  }

  @Test
  public void emptyInputIsRejected() {
    SpecException e = parseFailure();
    assertEquals("", e.getSpec());
    assertThat(e.getMessage(), containsString("Must supply at least one test spec"));
  }

  @Test
  public void bareClassNameRequestsWholeClass() throws SpecException {
    ImmutableList<Spec> specs = parse(SimpleTest.class.getName());
    assertEquals(1, specs.size());
    assertEquals(SimpleTest.class, specs.get(0).getTestClass());
    assertTrue(specs.get(0).isWholeClass());
  }

  @Test
  public void methodsOfOneClassAreMergedInOrder() throws SpecException {
    ImmutableList<Spec> specs =
        parse(SimpleTest.class.getName() + "#testTwo", SimpleTest.class.getName() + "#testOne");
    assertEquals(1, specs.size());
    assertThat(specs.get(0).getMethods(), contains("testTwo", "testOne"));
  }

  @Test
  public void classesKeepTheOrderTheyWereNamedIn() throws SpecException {
    ImmutableList<Spec> specs = parse(SerialTest.class.getName(), SimpleTest.class.getName());
    assertEquals(SerialTest.class, specs.get(0).getTestClass());
    assertEquals(SimpleTest.class, specs.get(1).getTestClass());
  }

  @Test
  public void duplicateMethodSpecsAreKept() throws SpecException {
    ImmutableList<Spec> specs =
        parse(SimpleTest.class.getName() + "#testOne", SimpleTest.class.getName() + "#testOne");
    assertThat(specs.get(0).getMethods(), contains("testOne", "testOne"));
  }

  @Test
  public void repeatedWholeClassSpecIsHarmless() throws SpecException {
    ImmutableList<Spec> specs = parse(SimpleTest.class.getName(), SimpleTest.class.getName());
    assertEquals(1, specs.size());
    assertTrue(specs.get(0).isWholeClass());
  }

  @Test
  public void parameterizedMethodNameIsKeptVerbatim() throws SpecException {
    ImmutableList<Spec> specs = parse(ParameterizedTest.class.getName() + "#testValue[1]");
    assertThat(specs.get(0).getMethods(), contains("testValue[1]"));
  }

  @Test
  public void junit3ClassIsATestClass() throws SpecException {
    ImmutableList<Spec> specs = parse(Junit3Test.class.getName() + "#testSomething");
    assertThat(specs.get(0).getMethods(), contains("testSomething"));
  }

  @Test
  public void classAnnotationBecomesOverride() throws SpecException {
    ImmutableList<Spec> specs = parse(SerialTest.class.getName(), SimpleTest.class.getName());
    assertEquals(Optional.of(Concurrency.SERIAL), specs.get(0).getConcurrencyOverride());
    assertEquals(Optional.empty(), specs.get(1).getConcurrencyOverride());
  }

  @Test
  public void annotationsAreIgnoredWithoutACapability() throws SpecException {
    ImmutableList<Spec> specs =
        new SpecParser(
                TestRegistry.forClassLoader(SpecParserTest.class.getClassLoader()),
                ConcurrencyCapability.NONE)
            .parse(ImmutableList.of(SerialTest.class.getName()));
    assertEquals(Optional.empty(), specs.get(0).getConcurrencyOverride());
  }

  @Test
  public void nonTestClassesContributeNothing() throws SpecException {
    assertThat(
        parse(
            AbstractTest.class.getName(),
            InterfaceTest.class.getName(),
            NonPublicTest.class.getName(),
            NoTestMethods.class.getName(),
            ConstructorWithArgs.class.getName()),
        empty());
  }

  @Test
  public void staticInitializerDoesNotRunWhileParsing() throws SpecException {
    ImmutableList<Spec> specs = parse(BrokenStaticInit.class.getName());
    assertEquals(BrokenStaticInit.class.getName(), specs.get(0).getSpecName());
  }

  @Test
  public void missingClassIsAnError() {
    SpecException e = parseFailure("com.example.DoesNotExist");
    assertEquals("com.example.DoesNotExist", e.getSpec());
    assertThat(e.getMessage(), containsString("Class com.example.DoesNotExist not found"));
  }

  @Test
  public void missingMethodIsAnError() {
    SpecException e = parseFailure(SimpleTest.class.getName() + "#testThree");
    assertThat(e.getMessage(), containsString("Method testThree not found"));
  }

  @Test
  public void moreThanOneHashIsAnError() {
    SpecException e = parseFailure(SimpleTest.class.getName() + "#testOne#testTwo");
    assertThat(e.getMessage(), containsString("Expected only one # in spec"));
  }

  @Test
  public void emptyMethodIsAnError() {
    parseFailure(SimpleTest.class.getName() + "#");
  }

  @Test
  public void emptyClassIsAnError() {
    parseFailure("#testOne");
  }

  @Test
  public void wholeClassAfterMethodIsAConflict() {
    SpecException e =
        parseFailure(SimpleTest.class.getName() + "#testOne", SimpleTest.class.getName());
    assertThat(
        e.getMessage(),
        containsString("Request for entire class already requesting individual methods"));
  }

  @Test
  public void methodAfterWholeClassIsAConflict() {
    SpecException e =
        parseFailure(SimpleTest.class.getName(), SimpleTest.class.getName() + "#testOne");
    assertThat(
        e.getMessage(),
        containsString("Request for individual methods when entire class already requested"));
  }

  @Test
  public void firstBadSpecIsReported() {
    SpecException e = parseFailure(SimpleTest.class.getName(), "com.example.Missing", "#x");
    assertEquals("com.example.Missing", e.getSpec());
  }
}
