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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.pyplus.diag.PyPlusError.ErrorKind;
import com.google.pyplus.tree.Tree;
import org.jspecify.annotations.Nullable;

/**
 * Parses the body of a compound statement, starting at its {@code :}.
 *
 * <p>The body is either an indented block, whose closing {@code DEDENT} is consumed, or a sequence
 * of simple statements on the same line as the colon. A body consisting only of {@code pass}
 * produces an empty list.
 */
public class SuiteFsm extends StateMachine<SuiteFsm.State, ImmutableList<Tree>> {

  /** Parser states. */
  public enum State {
    INITIAL,
    AFTER_COLON,
    EXPECT_INDENT,
    BODY
  }

  private final ImmutableList.Builder<Tree> body = ImmutableList.builder();

  public SuiteFsm() {
    super(State.INITIAL);
  }

  @Override
  protected ImmutableMap<State, Transition> transitions() {
    return Maps.immutableEnumMap(
        ImmutableMap.<State, Transition>of(
            State.INITIAL, this::initial,
            State.AFTER_COLON, this::afterColon,
            State.EXPECT_INDENT, this::expectIndent,
            State.BODY, this::body));
  }

  private void initial(Token token) {
    if (token.kind() != TokenKind.COLON) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "':'", token.describe());
      return;
    }
    setState(State.AFTER_COLON);
  }

  private void afterColon(Token token) {
    switch (token.kind()) {
      case NEWLINE -> setState(State.EXPECT_INDENT);
      case EOF, DEDENT, INDENT ->
          fail(token, ErrorKind.EXPECTED_INDENTED_BLOCK, token.describe());
      default -> {
        inline();
        selfAdvanced();
        accept(body.build());
      }
    }
  }

  /** Parses the simple statements following the colon, up to and including the line break. */
  private void inline() {
    while (true) {
      add(ctx().parseStatement());
      if (!ctx().check(TokenKind.SEMICOLON)) {
        break;
      }
      ctx().advance();
      if (ctx().check(TokenKind.NEWLINE) || ctx().check(TokenKind.EOF)) {
        break;
      }
    }
    if (ctx().check(TokenKind.NEWLINE)) {
      ctx().advance();
    }
  }

  private void expectIndent(Token token) {
    switch (token.kind()) {
      case NEWLINE -> {}
      case INDENT -> setState(State.BODY);
      default -> fail(token, ErrorKind.EXPECTED_INDENTED_BLOCK, token.describe());
    }
  }

  private void body(Token token) {
    switch (token.kind()) {
      case NEWLINE, SEMICOLON -> {}
      case DEDENT -> {
        ctx().advance();
        accept(body.build());
      }
      default -> {
        add(ctx().parseStatement());
        selfAdvanced();
      }
    }
  }

  private void add(@Nullable Tree statement) {
    if (statement != null) {
      body.add(statement);
    }
  }
}
