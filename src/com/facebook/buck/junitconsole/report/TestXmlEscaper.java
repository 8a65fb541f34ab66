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

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Cleans text before it goes into an XML report. The DOM serializer escapes markup itself but
 * passes characters that XML 1.0 does not allow, such as most control characters and {@code
 * U+FFFE}, straight through, which leaves a report no parser accepts. Those are replaced by {@code
 * U+FFFD}.
 */
public final class TestXmlEscaper {

  private TestXmlEscaper() {}

  private static final char REPLACEMENT = '\uFFFD';

  /** For element text and attribute values. Tabs and line breaks are kept. */
  public static final Escaper TEXT_ESCAPER =
      Escapers.builder()
          .setSafeRange((char) 0x20, REPLACEMENT)
          .setUnsafeReplacement(String.valueOf(REPLACEMENT))
          .addEscape('\t', "\t")
          .addEscape('\n', "\n")
          .addEscape('\r', "\r")
          .build();
}
