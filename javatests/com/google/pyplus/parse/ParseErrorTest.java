/*
 * Copyright 2016 Google Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pyplus.parse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.pyplus.diag.LexError;
import com.google.pyplus.diag.PyPlusError;
import com.google.pyplus.diag.SourceFile;
import com.google.pyplus.diag.SyntaxError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the full diagnostic text of parse errors. */
@RunWith(JUnit4.class)
public class ParseErrorTest {

  @Test
  public void badClassName() {
    PyPlusError e = parseError("x = 1\nclass 3: pass\n");
    assertThat(e).isInstanceOf(SyntaxError.class);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            lines(
                "Test.ppy:2: error: expected class name, got number '3'",
                "class 3: pass",
                "      ^"));
  }

  @Test
  public void defaultAfterVarargs() {
    PyPlusError e = parseError("def f(*args, b=1): pass");
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            normalizeNewlines(
                """
                Test.ppy:1: error: default argument follows *args/**kwargs
                def f(*args, b=1): pass
                              ^"""));
  }

  @Test
  public void doubleComma() {
    PyPlusError e = parseError("def f(a,, b):\n    pass\n");
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            lines(
                "Test.ppy:1: error: unexpected ',' in parameter list",
                "def f(a,, b):",
                "        ^"));
  }

  @Test
  public void unterminatedString() {
    PyPlusError e = parseError("s = 'abc\n");
    assertThat(e).isInstanceOf(LexError.class);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(lines("Test.ppy:1: error: unterminated string literal", "s = 'abc", "    ^"));
  }

  @Test
  public void inconsistentDedent() {
    PyPlusError e = parseError("if a:\n    b\n  c\n");
    assertThat(e).isInstanceOf(LexError.class);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            lines(
                "Test.ppy:3: error: unindent does not match any outer indentation level",
                "  c",
                "  ^"));
  }

  @Test
  public void missingColon() {
    PyPlusError e = parseError("while True\n    pass\n");
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            lines("Test.ppy:1: error: expected ':', got newline", "while True", "          ^"));
  }

  @Test
  public void unexpectedIndentInBody() {
    PyPlusError e = parseError("def f():\n    x\n        y\n");
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(lines("Test.ppy:3: error: unexpected indent", "        y", "        ^"));
  }

  private static PyPlusError parseError(String input) {
    return assertThrows(
        PyPlusError.class, () -> Parser.parse(new SourceFile("Test.ppy", input)));
  }

  private static String lines(String... lines) {
    return String.join(System.lineSeparator(), lines);
  }

  static String normalizeNewlines(String input) {
    return input.replace("\n", System.lineSeparator());
  }
}
