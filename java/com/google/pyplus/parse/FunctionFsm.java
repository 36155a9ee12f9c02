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
import com.google.pyplus.tree.Tree.ClassDefinition;
import com.google.pyplus.tree.Tree.Definition;
import com.google.pyplus.tree.Tree.Expression;
import com.google.pyplus.tree.Tree.FunctionDefinition;
import com.google.pyplus.tree.Tree.KwArgParameter;
import com.google.pyplus.tree.Tree.Param;
import com.google.pyplus.tree.Tree.Parameter;
import com.google.pyplus.tree.Tree.Type;
import com.google.pyplus.tree.Tree.VarArgParameter;
import java.util.Optional;

/**
 * Parses a function or class definition, starting at {@code def} or {@code class}. A leading
 * {@code async} is consumed by the caller.
 *
 * <p>Parameter list rules are enforced as transitions: at most one {@code *args} and one {@code
 * **kwargs}, nothing after {@code **kwargs}, no defaults on or after a variadic parameter, and no
 * parameter without a default after one with a default.
 */
public class FunctionFsm extends StateMachine<FunctionFsm.State, Definition> {

  /** Parser states. */
  public enum State {
    INITIAL,
    EXPECT_NAME,
    EXPECT_SIGNATURE,
    PARSE_PARAMS,
    EXPECT_VARARG_NAME,
    EXPECT_KWARG_NAME,
    AFTER_PARAM_NAME,
    PARSE_ANNOTATION,
    AFTER_ANNOTATION,
    PARSE_DEFAULT,
    AFTER_PARAM,
    AFTER_SIGNATURE,
    PARSE_RETURN_TYPE,
    AFTER_CLASS_NAME,
    PARSE_BASES,
    AFTER_BASE,
    EXPECT_BODY
  }

  private enum ParamKind {
    POSITIONAL,
    VARARG,
    KWARG
  }

  private final boolean async;

  private boolean isClass;
  private int position;
  private String name;
  private final ImmutableList.Builder<Param> params = ImmutableList.builder();
  private final ImmutableList.Builder<Expression> bases = ImmutableList.builder();
  private Optional<Type> returnType = Optional.empty();

  private boolean seenVararg;
  private boolean seenKwarg;
  private boolean seenDefault;

  // the parameter being parsed
  private ParamKind paramKind;
  private String paramName;
  private int paramPosition;
  private Optional<Type> annotation;

  public FunctionFsm(boolean async) {
    super(State.INITIAL);
    this.async = async;
  }

  @Override
  protected ImmutableMap<State, Transition> transitions() {
    return Maps.immutableEnumMap(
        ImmutableMap.<State, Transition>builder()
            .put(State.INITIAL, this::initial)
            .put(State.EXPECT_NAME, this::expectName)
            .put(State.EXPECT_SIGNATURE, this::expectSignature)
            .put(State.PARSE_PARAMS, this::parseParams)
            .put(State.EXPECT_VARARG_NAME, t -> expectVariadicName(t, ParamKind.VARARG))
            .put(State.EXPECT_KWARG_NAME, t -> expectVariadicName(t, ParamKind.KWARG))
            .put(State.AFTER_PARAM_NAME, this::afterParamName)
            .put(State.PARSE_ANNOTATION, this::parseAnnotation)
            .put(State.AFTER_ANNOTATION, this::afterAnnotation)
            .put(State.PARSE_DEFAULT, this::parseDefault)
            .put(State.AFTER_PARAM, this::afterParam)
            .put(State.AFTER_SIGNATURE, this::afterSignature)
            .put(State.PARSE_RETURN_TYPE, this::parseReturnType)
            .put(State.AFTER_CLASS_NAME, this::afterClassName)
            .put(State.PARSE_BASES, this::parseBases)
            .put(State.AFTER_BASE, this::afterBase)
            .put(State.EXPECT_BODY, this::expectBody)
            .buildOrThrow());
  }

  private void initial(Token token) {
    switch (token.kind()) {
      case DEF -> {
        position = token.position();
        setState(State.EXPECT_NAME);
      }
      case CLASS -> {
        if (async) {
          fail(token, ErrorKind.ASYNC_WITHOUT_DEF, token.describe());
          return;
        }
        isClass = true;
        position = token.position();
        setState(State.EXPECT_NAME);
      }
      default -> fail(token, ErrorKind.UNEXPECTED_TOKEN, token.describe());
    }
  }

  private void expectName(Token token) {
    if (token.kind() != TokenKind.IDENTIFIER) {
      String expected = isClass ? "class name" : "function name";
      fail(token, ErrorKind.EXPECTED_TOKEN, expected, token.describe());
      return;
    }
    name = token.text();
    setState(isClass ? State.AFTER_CLASS_NAME : State.EXPECT_SIGNATURE);
  }

  private void expectSignature(Token token) {
    if (token.kind() != TokenKind.LPAREN) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "'('", token.describe());
      return;
    }
    setState(State.PARSE_PARAMS);
  }

  /** At the start of a parameter, or at the closing parenthesis. */
  private void parseParams(Token token) {
    switch (token.kind()) {
      case RPAREN -> setState(State.AFTER_SIGNATURE);
      case IDENTIFIER -> {
        if (seenKwarg) {
          fail(token, ErrorKind.PARAMETER_AFTER_KWARGS);
          return;
        }
        beginParam(ParamKind.POSITIONAL, token);
        setState(State.AFTER_PARAM_NAME);
      }
      case COMMA -> fail(token, ErrorKind.UNEXPECTED_COMMA);
      default -> {
        if (token.isOperator("*")) {
          if (seenKwarg) {
            fail(token, ErrorKind.PARAMETER_AFTER_KWARGS);
          } else if (seenVararg) {
            fail(token, ErrorKind.DUPLICATE_VARARG);
          } else {
            paramPosition = token.position();
            setState(State.EXPECT_VARARG_NAME);
          }
        } else if (token.isOperator("**")) {
          if (seenKwarg) {
            fail(token, ErrorKind.DUPLICATE_KWARG);
          } else {
            paramPosition = token.position();
            setState(State.EXPECT_KWARG_NAME);
          }
        } else {
          fail(token, ErrorKind.EXPECTED_TOKEN, "parameter", token.describe());
        }
      }
    }
  }

  private void expectVariadicName(Token token, ParamKind kind) {
    if (token.kind() != TokenKind.IDENTIFIER) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "parameter name", token.describe());
      return;
    }
    int start = paramPosition;
    beginParam(kind, token);
    paramPosition = start;
    setState(State.AFTER_PARAM_NAME);
  }

  private void beginParam(ParamKind kind, Token token) {
    paramKind = kind;
    paramName = token.text();
    paramPosition = token.position();
    annotation = Optional.empty();
  }

  private void afterParamName(Token token) {
    if (token.kind() == TokenKind.COLON) {
      setState(State.PARSE_ANNOTATION);
      return;
    }
    afterAnnotation(token);
  }

  private void parseAnnotation(Token token) {
    annotation = Optional.of(ctx().parseType());
    selfAdvanced();
    setState(State.AFTER_ANNOTATION);
  }

  private void afterAnnotation(Token token) {
    if (token.isOperator("=")) {
      if (paramKind != ParamKind.POSITIONAL || seenVararg || seenKwarg) {
        fail(token, ErrorKind.DEFAULT_AFTER_VARIADIC);
        return;
      }
      setState(State.PARSE_DEFAULT);
      return;
    }
    if (paramKind == ParamKind.POSITIONAL && seenDefault && !seenVararg) {
      fail(token, ErrorKind.NON_DEFAULT_AFTER_DEFAULT);
      return;
    }
    params.add(
        switch (paramKind) {
          case POSITIONAL -> new Parameter(paramPosition, paramName, annotation, Optional.empty());
          case VARARG -> {
            seenVararg = true;
            yield new VarArgParameter(paramPosition, paramName, annotation);
          }
          case KWARG -> {
            seenKwarg = true;
            yield new KwArgParameter(paramPosition, paramName, annotation);
          }
        });
    afterParam(token);
  }

  private void parseDefault(Token token) {
    Expression defaultValue = ctx().parseExpression();
    params.add(new Parameter(paramPosition, paramName, annotation, Optional.of(defaultValue)));
    seenDefault = true;
    selfAdvanced();
    setState(State.AFTER_PARAM);
  }

  /** After a complete parameter: only a comma or the closing parenthesis may follow. */
  private void afterParam(Token token) {
    switch (token.kind()) {
      case COMMA -> setState(State.PARSE_PARAMS);
      case RPAREN -> setState(State.AFTER_SIGNATURE);
      default -> fail(token, ErrorKind.EXPECTED_TOKEN, "',' or ')'", token.describe());
    }
  }

  private void afterSignature(Token token) {
    if (token.isOperator("->")) {
      setState(State.PARSE_RETURN_TYPE);
      return;
    }
    setState(State.EXPECT_BODY);
    selfAdvanced();
  }

  private void parseReturnType(Token token) {
    returnType = Optional.of(ctx().parseType());
    selfAdvanced();
    setState(State.EXPECT_BODY);
  }

  private void afterClassName(Token token) {
    if (token.kind() == TokenKind.LPAREN) {
      setState(State.PARSE_BASES);
      return;
    }
    setState(State.EXPECT_BODY);
    selfAdvanced();
  }

  private void parseBases(Token token) {
    if (token.kind() == TokenKind.RPAREN) {
      setState(State.EXPECT_BODY);
      return;
    }
    bases.add(ctx().parseExpression());
    selfAdvanced();
    setState(State.AFTER_BASE);
  }

  private void afterBase(Token token) {
    switch (token.kind()) {
      case COMMA -> setState(State.PARSE_BASES);
      case RPAREN -> setState(State.EXPECT_BODY);
      default -> fail(token, ErrorKind.EXPECTED_TOKEN, "',' or ')'", token.describe());
    }
  }

  private void expectBody(Token token) {
    ImmutableList<Tree> body = new SuiteFsm().parse(ctx());
    if (isClass) {
      accept(new ClassDefinition(position, name, bases.build(), body, ImmutableList.of()));
    } else {
      accept(
          new FunctionDefinition(
              position, name, params.build(), returnType, body, async, ImmutableList.of()));
    }
  }
}
