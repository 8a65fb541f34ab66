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

import static com.facebook.buck.junitconsole.report.TestXmlEscaper.TEXT_ESCAPER;

import com.facebook.buck.junitconsole.log.Logger;
import com.facebook.buck.junitconsole.output.StreamSource;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes one Ant style JUnit XML report per test class, {@code <outdir>/TEST-<class>.xml}, when
 * the run finishes. Only classes with at least one test that ran, was skipped or failed get a
 * report.
 *
 * <p>Failures not attributable to a method (class setup errors, JUnit's own test mechanism
 * failures) are recorded as a {@code classMethod} test case of their class.
 */
@RunListener.ThreadSafe
public class AntJunitXmlReportListener extends RunListener {

  private static final Logger LOG = Logger.get(AntJunitXmlReportListener.class);

  private final File outdir;
  private final StreamSource streamSource;
  private final String hostname;

  private final Map<String, TestSuite> suites = new LinkedHashMap<>();
  private final Map<Description, TestCase> cases = new HashMap<>();

  public AntJunitXmlReportListener(File outdir, StreamSource streamSource) {
    this.outdir = outdir;
    this.streamSource = streamSource;
    this.hostname = localHostname();
  }

  private static String localHostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      LOG.debug("Cannot resolve local host name: %s", e.getMessage());
      return "localhost";
    }
  }

  @Override
  public synchronized void testRunStarted(Description description) {
    registerLeaves(description);
  }

  private void registerLeaves(Description description) {
    if (description.isTest()) {
      if (description.getMethodName() != null) {
        testCaseFor(description);
      }
      return;
    }
    for (Description child : description.getChildren()) {
      registerLeaves(child);
    }
  }

  private TestSuite testSuiteFor(Description description) {
    return suites.computeIfAbsent(description.getClassName(), TestSuite::new);
  }

  private TestCase testCaseFor(Description description) {
    TestCase testCase = cases.get(description);
    if (testCase == null) {
      TestSuite suite = testSuiteFor(description);
      testCase = new TestCase(description.getClassName(), Descriptions.methodName(description));
      suite.testCases.add(testCase);
      cases.put(description, testCase);
    }
    return testCase;
  }

  @Override
  public synchronized void testStarted(Description description) {
    testSuiteFor(description).started();
    testCaseFor(description).started();
  }

  @Override
  public synchronized void testFinished(Description description) {
    testCaseFor(description).finished();
    testSuiteFor(description).finished();
  }

  @Override
  public synchronized void testFailure(Failure failure) {
    TestCase testCase = testCaseFor(failure.getDescription());
    TestSuite suite = testSuiteFor(failure.getDescription());
    suite.started();
    Problem problem = new Problem(failure);
    if (Descriptions.isAssertionFailure(failure)) {
      testCase.failure = problem;
    } else {
      testCase.error = problem;
    }
    testCase.reported = true;
  }

  @Override
  public synchronized void testAssumptionFailure(Failure failure) {
    TestCase testCase = testCaseFor(failure.getDescription());
    testSuiteFor(failure.getDescription()).started();
    testCase.skipped = true;
    testCase.reported = true;
  }

  @Override
  public synchronized void testIgnored(Description description) {
    TestCase testCase = testCaseFor(description);
    testSuiteFor(description).started();
    testCase.skipped = true;
    testCase.reported = true;
  }

  @Override
  public synchronized void testRunFinished(Result result) throws IOException {
    for (TestSuite suite : suites.values()) {
      if (suite.wasStarted()) {
        writeSuite(suite);
      }
    }
  }

  private void writeSuite(TestSuite suite) throws IOException {
    File reportFile =
        new File(outdir, String.format("TEST-%s.xml", Descriptions.sanitizeFileName(suite.name)));
    try {
      Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
      doc.setXmlStandalone(true);
      doc.appendChild(createSuiteElement(doc, suite));

      Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
      transformer.setOutputProperty(OutputKeys.INDENT, "yes");
      transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
      try (OutputStream out = new BufferedOutputStream(new FileOutputStream(reportFile))) {
        transformer.transform(new DOMSource(doc), new StreamResult(out));
      }
    } catch (ParserConfigurationException | TransformerException e) {
      throw new IOException("Unable to write the XML report for " + suite.name, e);
    }
    LOG.debug("Wrote %s", reportFile);
  }

  private Element createSuiteElement(Document doc, TestSuite suite) {
    List<TestCase> reported = suite.reportedCases();
    int failures = 0;
    int errors = 0;
    int skipped = 0;
    for (TestCase testCase : reported) {
      if (testCase.failure != null) {
        failures++;
      } else if (testCase.error != null) {
        errors++;
      } else if (testCase.skipped) {
        skipped++;
      }
    }

    // <testsuite name="..." tests="..." failures="..." errors="..." skipped="..." time="...">
    Element suiteEl = doc.createElement("testsuite");
    setAttribute(suiteEl, "name", suite.name);
    setAttribute(suiteEl, "tests", Integer.toString(reported.size()));
    setAttribute(suiteEl, "failures", Integer.toString(failures));
    setAttribute(suiteEl, "errors", Integer.toString(errors));
    setAttribute(suiteEl, "skipped", Integer.toString(skipped));
    setAttribute(suiteEl, "time", formatSeconds(suite.elapsedNanos()));
    setAttribute(suiteEl, "timestamp", suite.timestamp());
    setAttribute(suiteEl, "hostname", hostname);

    Element propertiesEl = doc.createElement("properties");
    for (Map.Entry<String, String> property : systemProperties().entrySet()) {
      Element propertyEl = doc.createElement("property");
      setAttribute(propertyEl, "name", property.getKey());
      setAttribute(propertyEl, "value", property.getValue());
      propertiesEl.appendChild(propertyEl);
    }
    suiteEl.appendChild(propertiesEl);

    for (TestCase testCase : reported) {
      suiteEl.appendChild(createTestCaseElement(doc, testCase));
    }

    String out = new String(streamSource.readOut(suite.name), StandardCharsets.UTF_8);
    String err = new String(streamSource.readErr(suite.name), StandardCharsets.UTF_8);
    suiteEl.appendChild(createTextElement(doc, "system-out", out));
    suiteEl.appendChild(createTextElement(doc, "system-err", err));
    return suiteEl;
  }

  private static Element createTestCaseElement(Document doc, TestCase testCase) {
    Element testCaseEl = doc.createElement("testcase");
    setAttribute(testCaseEl, "classname", testCase.classname);
    setAttribute(testCaseEl, "name", testCase.name);
    setAttribute(testCaseEl, "time", formatSeconds(testCase.elapsedNanos));
    if (testCase.failure != null) {
      testCaseEl.appendChild(createProblemElement(doc, "failure", testCase.failure));
    } else if (testCase.error != null) {
      testCaseEl.appendChild(createProblemElement(doc, "error", testCase.error));
    } else if (testCase.skipped) {
      testCaseEl.appendChild(doc.createElement("skipped"));
    }
    return testCaseEl;
  }

  /** {@code <failure type="..." message="...">stack trace</failure>}, or the same as error. */
  private static Element createProblemElement(Document doc, String tag, Problem problem) {
    Element problemEl = createTextElement(doc, tag, problem.trace);
    setAttribute(problemEl, "type", problem.type);
    if (problem.message != null) {
      setAttribute(problemEl, "message", problem.message);
    }
    return problemEl;
  }

  private static Element createTextElement(Document doc, String tag, String text) {
    Element element = doc.createElement(tag);
    element.appendChild(doc.createTextNode(TEXT_ESCAPER.escape(text)));
    return element;
  }

  private static void setAttribute(Element element, String name, String value) {
    element.setAttribute(name, TEXT_ESCAPER.escape(value));
  }

  private static ImmutableSortedMap<String, String> systemProperties() {
    Properties properties = System.getProperties();
    ImmutableSortedMap.Builder<String, String> sorted = ImmutableSortedMap.naturalOrder();
    for (String name : properties.stringPropertyNames()) {
      sorted.put(name, properties.getProperty(name));
    }
    return sorted.build();
  }

  private static String formatSeconds(long nanos) {
    return String.format(Locale.ROOT, "%.3f", nanos / (double) TimeUnit.SECONDS.toNanos(1));
  }

  @VisibleForTesting
  synchronized ImmutableList<String> getSuiteNames() {
    return ImmutableList.copyOf(suites.keySet());
  }

  /** A failure or error of one test case. */
  private static class Problem {
    private final String type;
    @Nullable private final String message;
    private final String trace;

    Problem(Failure failure) {
      Throwable exception = failure.getException();
      this.type = exception != null ? exception.getClass().getName() : "unknown";
      this.message = failure.getMessage();
      this.trace = failure.getTrace();
    }
  }

  private static class TestCase {
    private final String classname;
    private final String name;
    private long startNanos;
    private long elapsedNanos;
    private boolean started;
    private boolean reported;
    private boolean skipped;
    @Nullable private Problem failure;
    @Nullable private Problem error;

    TestCase(String classname, String name) {
      this.classname = classname;
      this.name = name;
    }

    void started() {
      started = true;
      startNanos = System.nanoTime();
    }

    void finished() {
      if (started) {
        elapsedNanos = System.nanoTime() - startNanos;
      }
    }
  }

  private static class TestSuite {
    private final String name;
    private final List<TestCase> testCases = new ArrayList<>();
    @Nullable private LocalDateTime startTime;
    private long startNanos;
    private long endNanos;

    TestSuite(String name) {
      this.name = name;
    }

    void started() {
      if (startTime == null) {
        startTime = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        startNanos = System.nanoTime();
        endNanos = startNanos;
      }
    }

    void finished() {
      endNanos = System.nanoTime();
    }

    boolean wasStarted() {
      return startTime != null;
    }

    long elapsedNanos() {
      return endNanos - startNanos;
    }

    String timestamp() {
      return startTime == null ? "" : DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(startTime);
    }

    List<TestCase> reportedCases() {
      List<TestCase> reported = new ArrayList<>();
      for (TestCase testCase : testCases) {
        if (testCase.started || testCase.reported) {
          reported.add(testCase);
        }
      }
      return reported;
    }
  }
}
