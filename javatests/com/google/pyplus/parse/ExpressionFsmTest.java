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

import com.google.pyplus.diag.SourceFile;
import com.google.pyplus.tree.Tree.Expression;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

@RunWith(Parameterized.class)
public class ExpressionFsmTest {

  @Parameterized.Parameters
  public static Iterable<Object[]> parameters() {
    return Arrays.asList(
        new Object[][] {
          {
            "14", "14",
          },
          {
            "1 + 2 * 3", "(1 + (2 * 3))",
          },
          {
            "1 * 2 + 3", "((1 * 2) + 3)",
          },
          {
            "1 - 2 - 3", "((1 - 2) - 3)",
          },
          {
            "2 ** 3 ** 2", "(2 ** (3 ** 2))",
          },
          {
            "(1 + 2) * 3", "((1 + 2) * 3)",
          },
          {
            "((1))", "1",
          },
          {
            "((1 + 2) / (1 + 2))", "((1 + 2) / (1 + 2))",
          },
          {
            "-x ** 2", "(-(x ** 2))",
          },
          {
            "-x * 2", "((-x) * 2)",
          },
          {
            "2 ** -1", "(2 ** (-1))",
          },
          {
            "~a + +b", "((~a) + (+b))",
          },
          {
            "a or b and c", "(a or (b and c))",
          },
          {
            "not a or b", "((not a) or b)",
          },
          {
            "a == b < c", "(a == (b < c))",
          },
          {
            "a | b ^ c & d", "(a | (b ^ (c & d)))",
          },
          {
            "a << 1 + 2", "(a << (1 + 2))",
          },
          {
            "a // b % c @ d", "(((a // b) % c) @ d)",
          },
          {
            "x not in y", "(x not in y)",
          },
          {
            "x is not None", "(x is not None)",
          },
          {
            "x in xs and y is z", "((x in xs) and (y is z))",
          },
          {
            "True and None or False", "((True and None) or False)",
          },
          {
            "'s' + \"t\"", "('s' + \"t\")",
          },
          {
            "[1, 2, 3,]", "[1, 2, 3]",
          },
          {
            "[]", "[]",
          },
          {
            "[a + 1, [b]]", "[(a + 1), [b]]",
          },
          {
            "f()", "f()",
          },
          {
            "f(1, x=2)", "f(1, x=2)",
          },
          {
            "a.b.c", "a.b.c",
          },
          {
            "obj.method(a + b)[0]", "obj.method((a + b))[0]",
          },
          {
            "(a + b).c", "(a + b).c",
          },
          {
            "-a.b", "(-a.b)",
          },
          {
            "(-2) ** 2", "((-2) ** 2)",
          },
          {
            "(-a).b", "(-a).b",
          },
          {
            "(not a)(b)", "(not a)(b)",
          },
          {
            "(-a)[0]", "(-a)[0]",
          },
          {
            "1 +\\\n 2", "(1 + 2)",
          },
          {
            "(1 +\n 2)", "(1 + 2)",
          },
        });
  }

  final String input;
  final String expected;

  public ExpressionFsmTest(String input, String expected) {
    this.input = input;
    this.expected = expected;
  }

  @Test
  public void test() {
    Parser parser = new Parser(new SourceFile(null, input));
    Expression tree = parser.parseExpression();
    assertThat(tree.toString()).isEqualTo(expected);
    assertThat(parser.peek().kind()).isEqualTo(TokenKind.EOF);
  }

  @Test
  public void printedFormParsesToSameTree() {
    Parser parser = new Parser(new SourceFile(null, expected));
    assertThat(parser.parseExpression().toString()).isEqualTo(expected);
  }
}
