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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.pyplus.diag.LineMap;
import com.google.pyplus.diag.PyPlusError;
import com.google.pyplus.diag.PyPlusError.ErrorKind;
import com.google.pyplus.diag.SourceFile;

/**
 * An indentation-aware Python++ lexer.
 *
 * <p>Produces the whole token stream eagerly. Line breaks outside brackets become {@code NEWLINE}
 * tokens, and changes in the indentation of non-blank lines become {@code INDENT} and {@code
 * DEDENT} tokens. The stream always ends with every open indentation level closed, followed by
 * {@code EOF}.
 */
public class Lexer {

  private static final int TAB_WIDTH = 4;

  /** The end-of-input sentinel for {@link #ch}. */
  private static final int EOI = -1;

  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "b", "u", "f", "rb", "br", "fr", "rf");

  private static final ImmutableSet<String> THREE_CHAR_OPERATORS =
      ImmutableSet.of("**=", "//=", ">>=", "<<=");

  private static final ImmutableSet<String> TWO_CHAR_OPERATORS =
      ImmutableSet.of(
          "==", "!=", "<=", ">=", "**", "//", "<<", ">>", "->", "+=", "-=", "*=", "/=", "%=", "&=",
          "|=", "^=", "@=", ":=");

  private static final ImmutableSet<String> ONE_CHAR_OPERATORS =
      ImmutableSet.of("+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "=", "!");

  /** Tokenizes the given source. */
  public static ImmutableList<Token> tokenize(SourceFile source) {
    return new Lexer(source).lex();
  }

  private final SourceFile source;
  private final String input;
  private final LineMap lineMap;
  private final IndentStack indents = new IndentStack();
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  /** The index of the current input character. */
  private int idx;

  /** The current input character, or {@link #EOI}. */
  private int ch;

  /** The start position of the current token. */
  private int position;

  /** The number of open brackets; line breaks are not significant while this is non-zero. */
  private int bracketDepth;

  /** True if the next character starts a logical line. */
  private boolean atLineStart = true;

  private Lexer(SourceFile source) {
    this.source = source;
    this.input = source.source();
    this.lineMap = source.lineMap();
    this.idx = -1;
    eat();
  }

  /** Consumes an input character. */
  private void eat() {
    idx++;
    ch = idx < input.length() ? input.charAt(idx) : EOI;
  }

  /** Returns the character {@code offset} characters after the current one, or {@link #EOI}. */
  private int lookahead(int offset) {
    int i = idx + offset;
    return i < input.length() ? input.charAt(i) : EOI;
  }

  private void emit(TokenKind kind, int start, int end) {
    tokens.add(
        new Token(
            kind,
            input.substring(start, end),
            lineMap.lineNumber(start),
            lineMap.column(start) + 1,
            start));
  }

  private void emitSynthetic(TokenKind kind, int at) {
    tokens.add(new Token(kind, "", lineMap.lineNumber(at), lineMap.column(at) + 1, at));
  }

  private PyPlusError error(int at, ErrorKind kind, Object... args) {
    return PyPlusError.format(source, at, kind, args);
  }

  private ImmutableList<Token> lex() {
    while (true) {
      if (atLineStart) {
        atLineStart = false;
        indentation();
      }
      position = idx;
      switch (ch) {
        case EOI -> {
          for (int i = indents.close(); i > 0; i--) {
            emitSynthetic(TokenKind.DEDENT, input.length());
          }
          emitSynthetic(TokenKind.EOF, input.length());
          return tokens.build();
        }
        case ' ', '\t', '\f' -> eat();
        case '\r', '\n' -> {
          lineBreak();
          if (bracketDepth == 0) {
            emitSynthetic(TokenKind.NEWLINE, position);
            atLineStart = true;
          }
        }
        case '#' -> {
          while (ch != '\n' && ch != '\r' && ch != EOI) {
            eat();
          }
        }
        case '\\' -> {
          eat();
          if (ch != '\n' && ch != '\r') {
            throw error(position, ErrorKind.UNEXPECTED_CHARACTER, "'\\'");
          }
          // an explicit line join: the break is not significant
          lineBreak();
        }
        case '\'', '"' -> string(position);
        case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> number();
        case '.' -> {
          if (isDigit(lookahead(1))) {
            number();
          } else {
            eat();
            emit(TokenKind.DOT, position, idx);
          }
        }
        case '(' -> open(TokenKind.LPAREN);
        case '[' -> open(TokenKind.LBRACKET);
        case '{' -> open(TokenKind.LBRACE);
        case ')' -> close(TokenKind.RPAREN);
        case ']' -> close(TokenKind.RBRACKET);
        case '}' -> close(TokenKind.RBRACE);
        case ',' -> single(TokenKind.COMMA);
        case ';' -> single(TokenKind.SEMICOLON);
        case ':' -> {
          if (lookahead(1) == '=') {
            operator();
          } else {
            single(TokenKind.COLON);
          }
        }
        case '+', '-', '*', '/', '%', '@', '&', '|', '^', '~', '<', '>', '=', '!' -> operator();
        default -> {
          if (ch == '_' || Character.isLetter(ch)) {
            identifier();
          } else {
            throw error(position, ErrorKind.UNEXPECTED_CHARACTER, "'" + (char) ch + "'");
          }
        }
      }
    }
  }

  /**
   * Measures the indentation of a new line, and emits {@code INDENT} or {@code DEDENT} tokens if
   * the line has content. Blank and comment-only lines leave the indentation unchanged.
   */
  private void indentation() {
    int width = 0;
    while (true) {
      switch (ch) {
        case ' ' -> width++;
        case '\t' -> width += TAB_WIDTH;
        case '\f' -> width = 0;
        default -> {
          if (ch == '\n' || ch == '\r' || ch == '#' || ch == EOI) {
            return;
          }
          IndentStack.Change change = indents.update(width);
          if (!change.consistent()) {
            throw error(idx, ErrorKind.INCONSISTENT_DEDENT);
          }
          for (int i = 0; i < change.indents(); i++) {
            emitSynthetic(TokenKind.INDENT, idx);
          }
          for (int i = 0; i < change.dedents(); i++) {
            emitSynthetic(TokenKind.DEDENT, idx);
          }
          return;
        }
      }
      eat();
    }
  }

  /** Consumes a line break, treating {@code \r\n} as one break. */
  private void lineBreak() {
    if (ch == '\r' && lookahead(1) == '\n') {
      eat();
    }
    eat();
  }

  private void single(TokenKind kind) {
    eat();
    emit(kind, position, idx);
  }

  private void open(TokenKind kind) {
    bracketDepth++;
    single(kind);
  }

  private void close(TokenKind kind) {
    if (bracketDepth > 0) {
      bracketDepth--;
    }
    single(kind);
  }

  private void operator() {
    for (int length = 3; length > 0; length--) {
      if (idx + length > input.length()) {
        continue;
      }
      String op = input.substring(idx, idx + length);
      ImmutableSet<String> operators =
          switch (length) {
            case 3 -> THREE_CHAR_OPERATORS;
            case 2 -> TWO_CHAR_OPERATORS;
            default -> ONE_CHAR_OPERATORS;
          };
      if (operators.contains(op)) {
        for (int i = 0; i < length; i++) {
          eat();
        }
        emit(TokenKind.OPERATOR, position, idx);
        return;
      }
    }
    throw error(position, ErrorKind.UNEXPECTED_CHARACTER, "'" + (char) ch + "'");
  }

  private void identifier() {
    while (ch == '_' || (ch != EOI && Character.isLetterOrDigit(ch))) {
      eat();
    }
    String text = input.substring(position, idx);
    if ((ch == '\'' || ch == '"') && STRING_PREFIXES.contains(Ascii.toLowerCase(text))) {
      string(position);
      return;
    }
    TokenKind keyword = TokenKind.keyword(text);
    emit(keyword != null ? keyword : TokenKind.IDENTIFIER, position, idx);
  }

  /**
   * Lexes a string literal whose opening quote is the current character. The lexeme starts at
   * {@code start}, which precedes the quote if the literal has a prefix. Escapes are skipped over,
   * not interpreted.
   */
  private void string(int start) {
    int quote = ch;
    eat();
    if (ch == quote && lookahead(1) == quote) {
      eat();
      eat();
      tripleQuotedString(start, quote);
      return;
    }
    while (true) {
      if (ch == quote) {
        eat();
        emit(TokenKind.STRING, start, idx);
        return;
      }
      switch (ch) {
        case EOI, '\n', '\r' -> throw error(start, ErrorKind.UNTERMINATED_STRING);
        case '\\' -> {
          eat();
          if (ch == EOI) {
            throw error(start, ErrorKind.UNTERMINATED_STRING);
          }
          if (ch == '\r' && lookahead(1) == '\n') {
            eat();
          }
          eat();
        }
        default -> eat();
      }
    }
  }

  private void tripleQuotedString(int start, int quote) {
    while (true) {
      if (ch == quote && lookahead(1) == quote && lookahead(2) == quote) {
        eat();
        eat();
        eat();
        emit(TokenKind.STRING, start, idx);
        return;
      }
      switch (ch) {
        case EOI -> throw error(start, ErrorKind.UNTERMINATED_TRIPLE_STRING);
        case '\\' -> {
          eat();
          if (ch == EOI) {
            throw error(start, ErrorKind.UNTERMINATED_TRIPLE_STRING);
          }
          eat();
        }
        default -> eat();
      }
    }
  }

  /** Lexes a numeric literal. The text is not validated. */
  private void number() {
    if (ch == '0' && isRadixPrefix(lookahead(1))) {
      eat();
      eat();
      while (ch == '_' || (ch != EOI && Character.isLetterOrDigit(ch))) {
        eat();
      }
      emit(TokenKind.NUMBER, position, idx);
      return;
    }
    while (true) {
      switch (ch) {
        case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '.', '_' -> eat();
        case 'e', 'E' -> {
          eat();
          if (ch == '+' || ch == '-') {
            eat();
          }
        }
        default -> {
          emit(TokenKind.NUMBER, position, idx);
          return;
        }
      }
    }
  }

  private static boolean isRadixPrefix(int c) {
    return switch (c) {
      case 'x', 'X', 'o', 'O', 'b', 'B' -> true;
      default -> false;
    };
  }

  private static boolean isDigit(int c) {
    return '0' <= c && c <= '9';
  }
}
