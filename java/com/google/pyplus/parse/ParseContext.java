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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pyplus.diag.PyPlusError;
import com.google.pyplus.diag.PyPlusError.ErrorKind;
import com.google.pyplus.tree.Tree;
import com.google.pyplus.tree.Tree.Expression;
import org.jspecify.annotations.Nullable;

/**
 * The token cursor of a parse, and the entry points that state machines use to parse nested
 * constructs.
 */
public interface ParseContext {

  /** The current token. */
  Token peek();

  /** The token {@code offset} tokens after the current one; {@code EOF} past the end. */
  Token peek(int offset);

  /** Moves past the current token. Does nothing at the end of the stream. */
  void advance();

  /** Returns true if the current token has the given kind. */
  boolean check(TokenKind kind);

  /**
   * Consumes a token of the given kind and returns it.
   *
   * @param expected a description of what was expected, for the diagnostic
   * @throws PyPlusError if the current token has a different kind
   */
  @CanIgnoreReturnValue
  Token consume(TokenKind kind, String expected);

  /**
   * Parses one statement starting at the current token. Returns {@code null} for statements that
   * produce no node ({@code pass}).
   */
  @Nullable Tree parseStatement();

  /** Parses an expression starting at the current token. */
  Expression parseExpression();

  /** Parses a type annotation starting at the current token. */
  Tree.Type parseType();

  /** Creates a diagnostic at the given token. */
  PyPlusError error(Token token, ErrorKind kind, Object... args);
}
