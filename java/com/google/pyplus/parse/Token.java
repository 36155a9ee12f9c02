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

import static java.util.Objects.requireNonNull;

/**
 * A token.
 *
 * @param kind the token kind
 * @param text the source text of the token; empty for synthetic tokens
 * @param line the one-indexed line of the first character
 * @param column the one-indexed column of the first character
 * @param position the zero-indexed character offset of the first character
 */
public record Token(TokenKind kind, String text, int line, int column, int position) {

  public Token {
    requireNonNull(kind);
    requireNonNull(text);
  }

  /** Returns true if this is an operator token with the given text. */
  public boolean isOperator(String op) {
    return kind == TokenKind.OPERATOR && text.equals(op);
  }

  /**
   * Returns true if this is an identifier spelling the given soft keyword. Soft keywords such as
   * {@code match} and {@code case} are lexed as identifiers and only act as keywords where a
   * statement expects them.
   */
  public boolean isSoftKeyword(String word) {
    return kind == TokenKind.IDENTIFIER && text.equals(word);
  }

  /** A description of this token for diagnostics, e.g. {@code identifier 'x'}. */
  public String describe() {
    return switch (kind) {
      case IDENTIFIER, NUMBER, STRING, OPERATOR -> kind.describe() + " '" + text + "'";
      default -> kind.describe();
    };
  }

  @Override
  public String toString() {
    return switch (kind) {
      case IDENTIFIER, NUMBER, STRING, OPERATOR -> kind.name() + "(" + text + ")";
      default -> kind.name();
    };
  }
}
