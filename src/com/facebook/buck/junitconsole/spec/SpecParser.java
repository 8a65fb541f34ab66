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

import com.facebook.buck.junitconsole.concurrency.ConcurrencyCapability;
import com.facebook.buck.junitconsole.log.Logger;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns command line test specs into {@link Spec}s.
 *
 * <p>A spec is either a class name, {@code com.example.FooTest}, or a class name and a method,
 * {@code com.example.FooTest#testBar}. Method names are kept verbatim, so parameterized names like
 * {@code testBar[1]} are allowed. Specs for the same class are merged in the order given; asking
 * for a whole class and for single methods of it in the same run is an error.
 */
public class SpecParser {

  private static final Logger LOG = Logger.get(SpecParser.class);

  private static final Splitter METHOD_SPLITTER = Splitter.on('#');

  private final TestRegistry registry;
  private final ConcurrencyCapability capability;

  public SpecParser(TestRegistry registry, ConcurrencyCapability capability) {
    this.registry = registry;
    this.capability = capability;
  }

  /**
   * @param specStrings the specs to parse
   * @return one spec per runnable class, in the order the classes were first named
   * @throws SpecException when no spec is given, or for the first spec that cannot be resolved or
   *     that conflicts with an earlier one
   */
  public ImmutableList<Spec> parse(List<String> specStrings) throws SpecException {
    if (specStrings.isEmpty()) {
      throw new SpecException("", "Must supply at least one test spec");
    }
    Map<Class<?>, Spec> specs = new LinkedHashMap<>();
    for (String specString : specStrings) {
      parseOne(specString, specs);
    }
    return ImmutableList.copyOf(specs.values());
  }

  private void parseOne(String specString, Map<Class<?>, Spec> specs) throws SpecException {
    List<String> parts = METHOD_SPLITTER.splitToList(specString);
    if (parts.size() > 2) {
      throw new SpecException(specString, "Expected only one # in spec");
    }
    String className = parts.get(0);
    if (className.isEmpty()) {
      throw new SpecException(specString, "Missing class name");
    }
    Class<?> testClass = loadClass(specString, className);
    if (!TestClasses.mightBeATestClass(testClass)) {
      LOG.debug("Skipping %s, it is not a test class", className);
      return;
    }

    Spec existing = specs.get(testClass);
    if (parts.size() == 1) {
      if (existing != null && !existing.isWholeClass()) {
        throw new SpecException(
            specString, "Request for entire class already requesting individual methods");
      }
      if (existing == null) {
        specs.put(testClass, new Spec(testClass, capability.declaredConcurrency(testClass)));
      }
      return;
    }

    String methodName = parts.get(1);
    if (methodName.isEmpty()) {
      throw new SpecException(specString, "Missing method name after #");
    }
    if (!TestClasses.hasPublicMethod(testClass, methodName)) {
      throw new SpecException(
          specString, String.format("Method %s not found in class %s", methodName, className));
    }
    if (existing != null && existing.isWholeClass()) {
      throw new SpecException(
          specString, "Request for individual methods when entire class already requested");
    }
    Spec base = existing;
    if (base == null) {
      base = new Spec(testClass, capability.declaredConcurrency(testClass));
    }
    specs.put(testClass, base.withMethod(methodName));
  }

  private Class<?> loadClass(String specString, String className) throws SpecException {
    try {
      return registry.load(className);
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      throw new SpecException(
          specString, String.format("Class %s not found in classpath.", className), e);
    } catch (LinkageError e) {
      throw new SpecException(
          specString, String.format("Class %s could not be loaded.", className), e);
    }
  }
}
