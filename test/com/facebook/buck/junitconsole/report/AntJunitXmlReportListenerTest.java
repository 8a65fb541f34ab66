/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.buck.junitconsole.report;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.facebook.buck.junitconsole.output.StreamSource;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

public class AntJunitXmlReportListenerTest {

  private static final String FOO = "com.example.FooTest";

  @Rule public final TemporaryFolder temp = new TemporaryFolder();

  private StreamSource streamSource;
  private AntJunitXmlReportListener listener;

  @Before
  public void setUp() {
    streamSource = mock(StreamSource.class);
    when(streamSource.readOut(anyString())).thenReturn(new byte[0]);
    when(streamSource.readErr(anyString())).thenReturn(new byte[0]);
    listener = new AntJunitXmlReportListener(temp.getRoot(), streamSource);
  }

  private static Description method(String name) {
    return Description.createTestDescription(FOO, name);
  }

  private static Description run(Description... methods) {
    Description fooClass = Description.createSuiteDescription(FOO);
    for (Description method : methods) {
      fooClass.addChild(method);
    }
    Description run = Description.createSuiteDescription("junit-console-runner");
    run.addChild(fooClass);
    return run;
  }

  private void pass(Description description) {
    listener.testStarted(description);
    listener.testFinished(description);
  }

  private void fail(Description description, Throwable t) {
    listener.testStarted(description);
    listener.testFailure(new Failure(description, t));
    listener.testFinished(description);
  }

  private Element readSuite(String className) throws Exception {
    File report = new File(temp.getRoot(), "TEST-" + className + ".xml");
    assertTrue("missing " + report, report.exists());
    Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(report);
    return document.getDocumentElement();
  }

  private static Element testCase(Element suite, String name) {
    NodeList cases = suite.getElementsByTagName("testcase");
    for (int i = 0; i < cases.getLength(); i++) {
      Element testCase = (Element) cases.item(i);
      if (name.equals(testCase.getAttribute("name"))) {
        return testCase;
      }
    }
    throw new AssertionError("No test case " + name);
  }

  @Test
  public void countsFailuresErrorsAndSkips() throws Exception {
    Description passing = method("passing");
    Description failing = method("failing");
    Description erroring = method("erroring");
    Description ignored = method("ignored");
    listener.testRunStarted(run(passing, failing, erroring, ignored));

    pass(passing);
    fail(failing, new AssertionError("expected 1"));
    fail(erroring, new IllegalStateException("broken"));
    listener.testIgnored(ignored);
    listener.testRunFinished(new Result());

    Element suite = readSuite(FOO);
    assertEquals("testsuite", suite.getTagName());
    assertEquals(FOO, suite.getAttribute("name"));
    assertEquals("4", suite.getAttribute("tests"));
    assertEquals("1", suite.getAttribute("failures"));
    assertEquals("1", suite.getAttribute("errors"));
    assertEquals("1", suite.getAttribute("skipped"));
    assertFalse(suite.getAttribute("hostname").isEmpty());
    assertFalse(suite.getAttribute("timestamp").isEmpty());
    assertEquals(1, suite.getElementsByTagName("properties").getLength());

    Element failure = (Element) testCase(suite, "failing").getElementsByTagName("failure").item(0);
    assertEquals(AssertionError.class.getName(), failure.getAttribute("type"));
    assertEquals("expected 1", failure.getAttribute("message"));
    assertThat(failure.getTextContent(), containsString("expected 1"));

    Element error = (Element) testCase(suite, "erroring").getElementsByTagName("error").item(0);
    assertEquals(IllegalStateException.class.getName(), error.getAttribute("type"));

    assertEquals(1, testCase(suite, "ignored").getElementsByTagName("skipped").getLength());
    assertEquals(0, testCase(suite, "passing").getChildNodes().getLength());
    assertEquals(FOO, testCase(suite, "passing").getAttribute("classname"));
  }

  @Test
  public void classLevelFailureIsReportedAsClassMethod() throws Exception {
    Description fooClass = Description.createSuiteDescription(FOO);
    listener.testRunStarted(run(method("neverRuns")));

    listener.testFailure(new Failure(fooClass, new RuntimeException("setup failed")));
    listener.testRunFinished(new Result());

    Element suite = readSuite(FOO);
    assertEquals("1", suite.getAttribute("tests"));
    assertEquals("1", suite.getAttribute("errors"));
    Element classMethod = testCase(suite, Descriptions.CLASS_METHOD);
    assertEquals(1, classMethod.getElementsByTagName("error").getLength());
  }

  @Test
  public void capturedOutputIsIncluded() throws Exception {
    when(streamSource.readOut(FOO)).thenReturn("out <1>\n".getBytes(StandardCharsets.UTF_8));
    when(streamSource.readErr(FOO)).thenReturn("err\u0000\n".getBytes(StandardCharsets.UTF_8));
    Description passing = method("passing");
    listener.testRunStarted(run(passing));

    pass(passing);
    listener.testRunFinished(new Result());

    Element suite = readSuite(FOO);
    assertEquals("out <1>\n", suite.getElementsByTagName("system-out").item(0).getTextContent());
    assertEquals("err\uFFFD\n", suite.getElementsByTagName("system-err").item(0).getTextContent());
  }

  @Test
  public void classesThatNeverRanGetNoReport() throws Exception {
    Description filteredOut = method("filteredOut");
    listener.testRunStarted(run(filteredOut));

    listener.testRunFinished(new Result());

    assertThat(listener.getSuiteNames(), contains(FOO));
    assertFalse(new File(temp.getRoot(), "TEST-" + FOO + ".xml").exists());
  }

  @Test
  public void failingMessagesAreEscaped() throws Exception {
    Description failing = method("failing");
    listener.testRunStarted(run(failing));

    fail(failing, new AssertionError("<\"quoted\" & 'single'>\nnext"));
    listener.testRunFinished(new Result());

    Element failure =
        (Element) testCase(readSuite(FOO), "failing").getElementsByTagName("failure").item(0);
    assertEquals("<\"quoted\" & 'single'>\nnext", failure.getAttribute("message"));
  }

  @Test
  public void reportIsWellFormedEvenWithControlCharacters() throws Exception {
    Description failing = method("failing");
    listener.testRunStarted(run(failing));

    fail(failing, new AssertionError("bell\u0007 & <tag>"));
    listener.testRunFinished(new Result());

    File report = new File(temp.getRoot(), "TEST-" + FOO + ".xml");
    String xml = Files.readString(report.toPath(), StandardCharsets.UTF_8);
    assertThat(xml, startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\""));
    assertThat(xml, containsString("\n  <testcase"));
    Element failure =
        (Element) testCase(readSuite(FOO), "failing").getElementsByTagName("failure").item(0);
    assertEquals("bell\uFFFD & <tag>", failure.getAttribute("message"));
    assertThat(failure.getTextContent(), containsString("bell\uFFFD & <tag>"));
  }
}
