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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** Python++ token kinds. */
public enum TokenKind {
  IDENTIFIER,
  NUMBER,
  STRING,
  OPERATOR,
  LPAREN("("),
  RPAREN(")"),
  LBRACE("{"),
  RBRACE("}"),
  LBRACKET("["),
  RBRACKET("]"),
  COLON(":"),
  COMMA(","),
  SEMICOLON(";"),
  DOT("."),
  INDENT,
  DEDENT,
  NEWLINE,
  EOF,
  FALSE("False"),
  NONE("None"),
  TRUE("True"),
  AND("and"),
  AS("as"),
  ASYNC("async"),
  BREAK("break"),
  CLASS("class"),
  CONTINUE("continue"),
  DEF("def"),
  ELIF("elif"),
  ELSE("else"),
  EXCEPT("except"),
  FINALLY("finally"),
  FOR("for"),
  FROM("from"),
  IF("if"),
  IMPORT("import"),
  IN("in"),
  IS("is"),
  NOT("not"),
  OR("or"),
  PASS("pass"),
  RAISE("raise"),
  RETURN("return"),
  TRY("try"),
  WHILE("while"),
  WITH("with");

  private static final ImmutableMap<String, TokenKind> KEYWORDS;

  static {
    ImmutableMap.Builder<String, TokenKind> keywords = ImmutableMap.builder();
    for (TokenKind kind : values()) {
      if (kind.isKeyword()) {
        keywords.put(kind.value, kind);
      }
    }
    KEYWORDS = keywords.buildOrThrow();
  }

  private final @Nullable String value;

  TokenKind() {
    this(null);
  }

  TokenKind(@Nullable String value) {
    this.value = value;
  }

  /** Returns the keyword kind for the given identifier text, or {@code null}. */
  static @Nullable TokenKind keyword(String text) {
    return KEYWORDS.get(text);
  }

  /** Returns true if this kind is a reserved word. */
  public boolean isKeyword() {
    return value != null && Character.isLetter(value.charAt(0));
  }

  /** A human-readable description of this kind, for diagnostics. */
  public String describe() {
    if (value != null) {
      return "'" + value + "'";
    }
    return switch (this) {
      case IDENTIFIER -> "identifier";
      case NUMBER -> "number";
      case STRING -> "string";
      case OPERATOR -> "operator";
      case INDENT -> "indent";
      case DEDENT -> "dedent";
      case NEWLINE -> "newline";
      case EOF -> "end of input";
      default -> throw new AssertionError(this);
    };
  }
}
