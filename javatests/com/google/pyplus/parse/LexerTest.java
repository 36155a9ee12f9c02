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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.pyplus.diag.LexError;
import com.google.pyplus.diag.PyPlusError.ErrorKind;
import com.google.pyplus.diag.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LexerTest {

  @Test
  public void simple() {
    assertThat(lex("x = 1\n"))
        .containsExactly("IDENTIFIER(x)", "OPERATOR(=)", "NUMBER(1)", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void empty() {
    assertThat(lex("")).containsExactly("EOF");
  }

  @Test
  public void indentation() {
    String input =
        """
        if x:
            y
            if z:
                w
        v
        """;
    assertThat(lex(input))
        .containsExactly(
            "IF", "IDENTIFIER(x)", "COLON", "NEWLINE",
            "INDENT", "IDENTIFIER(y)", "NEWLINE",
            "IF", "IDENTIFIER(z)", "COLON", "NEWLINE",
            "INDENT", "IDENTIFIER(w)", "NEWLINE",
            "DEDENT", "DEDENT", "IDENTIFIER(v)", "NEWLINE",
            "EOF")
        .inOrder();
  }

  @Test
  public void dedentAtEndOfInput() {
    assertThat(lex("def f():\n    pass"))
        .containsExactly(
            "DEF", "IDENTIFIER(f)", "LPAREN", "RPAREN", "COLON", "NEWLINE", "INDENT", "PASS",
            "DEDENT", "EOF")
        .inOrder();
  }

  @Test
  public void indentsAreBalanced() {
    String input =
        """
        class A:
            def f(self):
                if x:
                    while y:
                        pass
            def g(self):
                pass
        """;
    ImmutableList<Token> tokens = Lexer.tokenize(new SourceFile(null, input));
    long indents = tokens.stream().filter(t -> t.kind() == TokenKind.INDENT).count();
    long dedents = tokens.stream().filter(t -> t.kind() == TokenKind.DEDENT).count();
    assertThat(indents).isEqualTo(5);
    assertThat(dedents).isEqualTo(indents);
    assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.EOF);
  }

  @Test
  public void blankAndCommentLines() {
    assertThat(lex("if x:\n    y\n\n  # comment\n    z\n"))
        .containsExactly(
            "IF", "IDENTIFIER(x)", "COLON", "NEWLINE",
            "INDENT", "IDENTIFIER(y)", "NEWLINE",
            "NEWLINE",
            "NEWLINE",
            "IDENTIFIER(z)", "NEWLINE",
            "DEDENT", "EOF")
        .inOrder();
  }

  @Test
  public void trailingComment() {
    assertThat(lex("x  # the answer\n"))
        .containsExactly("IDENTIFIER(x)", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void tabsCountAsFourColumns() {
    assertThat(lex("if x:\n\ty\n    z\n"))
        .containsExactly(
            "IF", "IDENTIFIER(x)", "COLON", "NEWLINE",
            "INDENT", "IDENTIFIER(y)", "NEWLINE",
            "IDENTIFIER(z)", "NEWLINE",
            "DEDENT", "EOF")
        .inOrder();
  }

  @Test
  public void implicitLineJoining() {
    assertThat(lex("x = (1,\n     2)\n"))
        .containsExactly(
            "IDENTIFIER(x)", "OPERATOR(=)", "LPAREN", "NUMBER(1)", "COMMA", "NUMBER(2)", "RPAREN",
            "NEWLINE", "EOF")
        .inOrder();
    assertThat(lex("xs = [\n  1,\n]\n"))
        .containsExactly(
            "IDENTIFIER(xs)", "OPERATOR(=)", "LBRACKET", "NUMBER(1)", "COMMA", "RBRACKET",
            "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void explicitLineJoining() {
    assertThat(lex("x = 1 + \\\n    2\n"))
        .containsExactly(
            "IDENTIFIER(x)", "OPERATOR(=)", "NUMBER(1)", "OPERATOR(+)", "NUMBER(2)", "NEWLINE",
            "EOF")
        .inOrder();
  }

  @Test
  public void crlf() {
    ImmutableList<Token> tokens = Lexer.tokenize(new SourceFile(null, "x\r\ny\r\n"));
    assertThat(tokens.stream().map(Token::toString).collect(toImmutableList()))
        .containsExactly("IDENTIFIER(x)", "NEWLINE", "IDENTIFIER(y)", "NEWLINE", "EOF")
        .inOrder();
    assertThat(tokens.get(2).line()).isEqualTo(2);
    assertThat(tokens.get(2).column()).isEqualTo(1);
  }

  @Test
  public void keywords() {
    assertThat(lex("async def match case None True False is not in define"))
        .containsExactly(
            "ASYNC", "DEF", "IDENTIFIER(match)", "IDENTIFIER(case)", "NONE", "TRUE", "FALSE",
            "IS", "NOT", "IN", "IDENTIFIER(define)", "EOF")
        .inOrder();
  }

  @Test
  public void identifiers() {
    assertThat(lex("_private snake_case x1 rb"))
        .containsExactly(
            "IDENTIFIER(_private)", "IDENTIFIER(snake_case)", "IDENTIFIER(x1)", "IDENTIFIER(rb)",
            "EOF")
        .inOrder();
  }

  @Test
  public void strings() {
    assertThat(lex("'a' \"b\" r'\\d' b\"x\" Rb'y' f'{x}' ''"))
        .containsExactly(
            "STRING('a')",
            "STRING(\"b\")",
            "STRING(r'\\d')",
            "STRING(b\"x\")",
            "STRING(Rb'y')",
            "STRING(f'{x}')",
            "STRING('')",
            "EOF")
        .inOrder();
  }

  @Test
  public void escapesArePassedThrough() {
    assertThat(lex("'it\\'s' \"\\n\""))
        .containsExactly("STRING('it\\'s')", "STRING(\"\\n\")", "EOF")
        .inOrder();
  }

  @Test
  public void tripleQuotedString() {
    ImmutableList<Token> tokens =
        Lexer.tokenize(new SourceFile(null, "s = '''a\n\"b\"\n'''\nx\n"));
    assertThat(tokens.stream().map(Token::toString).collect(toImmutableList()))
        .containsExactly(
            "IDENTIFIER(s)", "OPERATOR(=)", "STRING('''a\n\"b\"\n''')", "NEWLINE", "IDENTIFIER(x)",
            "NEWLINE", "EOF")
        .inOrder();
    Token x = tokens.get(4);
    assertThat(x.line()).isEqualTo(4);
    assertThat(x.column()).isEqualTo(1);
  }

  @Test
  public void numbers() {
    assertThat(lex("1 2.5 .5 1e10 1E-5 3.14e+2 1_000 0x1F 0o17 0b101"))
        .containsExactly(
            "NUMBER(1)",
            "NUMBER(2.5)",
            "NUMBER(.5)",
            "NUMBER(1e10)",
            "NUMBER(1E-5)",
            "NUMBER(3.14e+2)",
            "NUMBER(1_000)",
            "NUMBER(0x1F)",
            "NUMBER(0o17)",
            "NUMBER(0b101)",
            "EOF")
        .inOrder();
  }

  @Test
  public void operators() {
    assertThat(lex("a **= b // c -> d := e != f << g"))
        .containsExactly(
            "IDENTIFIER(a)", "OPERATOR(**=)", "IDENTIFIER(b)", "OPERATOR(//)", "IDENTIFIER(c)",
            "OPERATOR(->)", "IDENTIFIER(d)", "OPERATOR(:=)", "IDENTIFIER(e)", "OPERATOR(!=)",
            "IDENTIFIER(f)", "OPERATOR(<<)", "IDENTIFIER(g)", "EOF")
        .inOrder();
    assertThat(lex("x>>=1")).containsExactly("IDENTIFIER(x)", "OPERATOR(>>=)", "NUMBER(1)", "EOF");
    assertThat(lex("-~!@"))
        .containsExactly("OPERATOR(-)", "OPERATOR(~)", "OPERATOR(!)", "OPERATOR(@)", "EOF");
  }

  @Test
  public void delimiters() {
    assertThat(lex("a[b]{c}.d;e:f,g"))
        .containsExactly(
            "IDENTIFIER(a)", "LBRACKET", "IDENTIFIER(b)", "RBRACKET", "LBRACE", "IDENTIFIER(c)",
            "RBRACE", "DOT", "IDENTIFIER(d)", "SEMICOLON", "IDENTIFIER(e)", "COLON",
            "IDENTIFIER(f)", "COMMA", "IDENTIFIER(g)", "EOF")
        .inOrder();
  }

  @Test
  public void positions() {
    ImmutableList<Token> tokens =
        Lexer.tokenize(new SourceFile(null, "def f():\n    return 42\n"));
    Token indent = tokens.get(6);
    Token ret = tokens.get(7);
    assertThat(indent.kind()).isEqualTo(TokenKind.INDENT);
    assertThat(indent.text()).isEmpty();
    assertThat(ret.kind()).isEqualTo(TokenKind.RETURN);
    assertThat(ret.line()).isEqualTo(2);
    assertThat(ret.column()).isEqualTo(5);
    assertThat(ret.position()).isEqualTo(13);
    assertThat(ret.text()).isEqualTo("return");
  }

  @Test
  public void tokenizingIsRepeatable() {
    SourceFile source = new SourceFile(null, "def f(a, b=1):\n    return a + b\n");
    assertThat(Lexer.tokenize(source)).isEqualTo(Lexer.tokenize(source));
  }

  @Test
  public void unterminatedString() {
    LexError e = assertThrows(LexError.class, () -> lex("'unterminated"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNTERMINATED_STRING);
    assertThat(e.line()).isEqualTo(1);
    assertThat(e.column()).isEqualTo(1);
  }

  @Test
  public void stringEndsAtLineBreak() {
    LexError e = assertThrows(LexError.class, () -> lex("x = 'abc\n'\n"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNTERMINATED_STRING);
    assertThat(e.column()).isEqualTo(5);
  }

  @Test
  public void unterminatedTripleQuotedString() {
    LexError e = assertThrows(LexError.class, () -> lex("x = \"\"\"abc\n\ndef"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNTERMINATED_TRIPLE_STRING);
    assertThat(e.line()).isEqualTo(1);
  }

  @Test
  public void unexpectedCharacter() {
    LexError e = assertThrows(LexError.class, () -> lex("x = $"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNEXPECTED_CHARACTER);
    assertThat(e.message()).isEqualTo("unexpected character: '$'");
    assertThat(e.column()).isEqualTo(5);
  }

  @Test
  public void strayBackslash() {
    LexError e = assertThrows(LexError.class, () -> lex("x \\ y"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNEXPECTED_CHARACTER);
  }

  @Test
  public void inconsistentDedent() {
    LexError e = assertThrows(LexError.class, () -> lex("if x:\n    y\n  z\n"));
    assertThat(e.kind()).isEqualTo(ErrorKind.INCONSISTENT_DEDENT);
    assertThat(e.line()).isEqualTo(3);
    assertThat(e.column()).isEqualTo(3);
    assertThat(e)
        .hasMessageThat()
        .contains("unindent does not match any outer indentation level");
  }

  private static ImmutableList<String> lex(String input) {
    return Lexer.tokenize(new SourceFile(null, input)).stream()
        .map(Token::toString)
        .collect(toImmutableList());
  }
}
