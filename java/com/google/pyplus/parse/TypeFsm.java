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
import com.google.pyplus.tree.Tree.FunctionType;
import com.google.pyplus.tree.Tree.GenericType;
import com.google.pyplus.tree.Tree.SimpleType;
import com.google.pyplus.tree.Tree.Type;

/**
 * Parses a type annotation: a possibly dotted name, optionally parameterized ({@code
 * Dict[str, int]}), optionally followed by {@code -> ReturnType}. Function types group to the
 * right.
 */
public class TypeFsm extends StateMachine<TypeFsm.State, Type> {

  /** Parser states. */
  public enum State {
    INITIAL,
    AFTER_NAME,
    EXPECT_NAME_PART,
    EXPECT_PARAM,
    AFTER_PARAM,
    AFTER_TYPE,
    EXPECT_RETURN
  }

  private final StringBuilder name = new StringBuilder();
  private final ImmutableList.Builder<Type> params = ImmutableList.builder();
  private int position;
  private Type type;

  public TypeFsm() {
    super(State.INITIAL);
  }

  @Override
  protected ImmutableMap<State, Transition> transitions() {
    return Maps.immutableEnumMap(
        ImmutableMap.<State, Transition>builder()
            .put(State.INITIAL, this::initial)
            .put(State.AFTER_NAME, this::afterName)
            .put(State.EXPECT_NAME_PART, this::expectNamePart)
            .put(State.EXPECT_PARAM, this::expectParam)
            .put(State.AFTER_PARAM, this::afterParam)
            .put(State.AFTER_TYPE, this::afterType)
            .put(State.EXPECT_RETURN, this::expectReturn)
            .buildOrThrow());
  }

  private void initial(Token token) {
    switch (token.kind()) {
      case IDENTIFIER, NONE -> {
        position = token.position();
        name.append(token.text());
        setState(State.AFTER_NAME);
      }
      default -> fail(token, ErrorKind.EXPECTED_TOKEN, "type", token.describe());
    }
  }

  private void afterName(Token token) {
    switch (token.kind()) {
      case DOT -> {
        name.append('.');
        setState(State.EXPECT_NAME_PART);
      }
      case LBRACKET -> setState(State.EXPECT_PARAM);
      default -> {
        type = new SimpleType(position, name.toString());
        afterType(token);
      }
    }
  }

  private void expectNamePart(Token token) {
    if (token.kind() != TokenKind.IDENTIFIER) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "identifier", token.describe());
      return;
    }
    name.append(token.text());
    setState(State.AFTER_NAME);
  }

  private void expectParam(Token token) {
    params.add(ctx().parseType());
    selfAdvanced();
    setState(State.AFTER_PARAM);
  }

  private void afterParam(Token token) {
    switch (token.kind()) {
      case COMMA -> setState(State.EXPECT_PARAM);
      case RBRACKET -> {
        type = new GenericType(position, name.toString(), params.build());
        setState(State.AFTER_TYPE);
      }
      default -> fail(token, ErrorKind.EXPECTED_TOKEN, "',' or ']'", token.describe());
    }
  }

  private void afterType(Token token) {
    if (token.isOperator("->")) {
      setState(State.EXPECT_RETURN);
      return;
    }
    accept(type);
  }

  private void expectReturn(Token token) {
    Type returnType = ctx().parseType();
    accept(new FunctionType(position, type, returnType));
  }
}
