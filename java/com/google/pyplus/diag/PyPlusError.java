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

package com.google.pyplus.diag;

import static com.google.common.base.MoreObjects.firstNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A front end error. Exactly one is reported per parse: the first error aborts tokenizing or
 * parsing, and no partial tree is produced.
 */
public class PyPlusError extends Error {

  /** The broad class of an error, which selects the thrown subclass. */
  public enum Category {
    /** Malformed input at the character level; see {@link LexError}. */
    LEX,
    /** A token that does not fit the active parsing state; see {@link SyntaxError}. */
    SYNTAX,
    /** A broken parser invariant; see {@link StructuralError}. */
    STRUCTURAL
  }

  /** A diagnostic kind. */
  public enum ErrorKind {
    UNEXPECTED_CHARACTER(Category.LEX, "unexpected character: %s"),
    UNTERMINATED_STRING(Category.LEX, "unterminated string literal"),
    UNTERMINATED_TRIPLE_STRING(Category.LEX, "unterminated triple-quoted string literal"),
    INCONSISTENT_DEDENT(Category.LEX, "unindent does not match any outer indentation level"),
    EXPECTED_TOKEN(Category.SYNTAX, "expected %s, got %s"),
    EXPECTED_EXPRESSION(Category.SYNTAX, "expected expression, got %s"),
    EXPECTED_INDENTED_BLOCK(Category.SYNTAX, "expected an indented block, got %s"),
    UNEXPECTED_TOKEN(Category.SYNTAX, "unexpected token: %s"),
    UNEXPECTED_INDENT(Category.SYNTAX, "unexpected indent"),
    UNEXPECTED_EOF(Category.SYNTAX, "unexpected end of input"),
    UNMATCHED_PAREN(Category.SYNTAX, "unmatched '('"),
    INVALID_EXPRESSION_STATE(Category.SYNTAX, "invalid expression state"),
    INVALID_ASSIGNMENT_TARGET(Category.SYNTAX, "invalid assignment target"),
    INVALID_DECORATOR_TARGET(
        Category.SYNTAX, "decorators must precede a function or class definition, got %s"),
    ASYNC_WITHOUT_DEF(Category.SYNTAX, "expected 'def' after 'async', got %s"),
    UNEXPECTED_COMMA(Category.SYNTAX, "unexpected ',' in parameter list"),
    DEFAULT_AFTER_VARIADIC(Category.SYNTAX, "default argument follows *args/**kwargs"),
    NON_DEFAULT_AFTER_DEFAULT(Category.SYNTAX, "non-default argument follows default argument"),
    DUPLICATE_VARARG(Category.SYNTAX, "duplicate *args parameter"),
    DUPLICATE_KWARG(Category.SYNTAX, "duplicate **kwargs parameter"),
    PARAMETER_AFTER_KWARGS(Category.SYNTAX, "parameter follows **kwargs"),
    NO_TRANSITION(Category.STRUCTURAL, "no transition registered for state %s in %s");

    private final Category category;
    private final String message;

    ErrorKind(Category category, String message) {
      this.category = category;
      this.message = message;
    }

    /** The category of this kind of error. */
    public Category category() {
      return category;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param position the diagnostic position, a character offset into the source
   * @param kind the error kind
   * @param args format args
   */
  public static PyPlusError format(
      SourceFile source, int position, ErrorKind kind, Object... args) {
    String path = firstNonNull(source.path(), "<>");
    LineMap lineMap = source.lineMap();
    int lineNumber = lineMap.lineNumber(position);
    int column = lineMap.column(position);
    String message = kind.format(args);

    StringBuilder sb = new StringBuilder(path).append(":");
    sb.append(lineNumber).append(": error: ");
    sb.append(message.trim()).append(System.lineSeparator());
    sb.append(CharMatcher.breakingWhitespace().trimTrailingFrom(lineMap.line(position)))
        .append(System.lineSeparator());
    sb.append(Strings.repeat(" ", column)).append('^');
    String diagnostic = sb.toString();

    ImmutableList<Object> argList = ImmutableList.copyOf(args);
    return switch (kind.category()) {
      case LEX -> new LexError(kind, diagnostic, message, lineNumber, column + 1, argList);
      case SYNTAX -> new SyntaxError(kind, diagnostic, message, lineNumber, column + 1, argList);
      case STRUCTURAL ->
          new StructuralError(kind, diagnostic, message, lineNumber, column + 1, argList);
    };
  }

  private final ErrorKind kind;
  private final String message;
  private final int line;
  private final int column;
  private final ImmutableList<Object> args;

  PyPlusError(
      ErrorKind kind,
      String diagnostic,
      String message,
      int line,
      int column,
      ImmutableList<Object> args) {
    super(diagnostic);
    this.kind = kind;
    this.message = message;
    this.line = line;
    this.column = column;
    this.args = args;
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The diagnostic message, without location information. */
  public String message() {
    return message;
  }

  /** The one-indexed line of the offending input. */
  public int line() {
    return line;
  }

  /** The one-indexed column of the offending input. */
  public int column() {
    return column;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }
}
