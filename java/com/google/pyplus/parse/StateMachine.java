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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pyplus.diag.PyPlusError;
import com.google.pyplus.diag.PyPlusError.ErrorKind;
import org.jspecify.annotations.Nullable;

/**
 * A token-driven finite state machine that parses one construct.
 *
 * <p>Each state has one {@link Transition}, which inspects the current token and either moves to
 * another state, records a result, or records an error. {@link #parse} drives the machine: it
 * feeds the current token to the handler of the current state and, unless the handler finished the
 * machine or consumed input itself, advances past the token.
 *
 * <p>Machines are single-use. The {@link ParseContext} is only held for the duration of {@link
 * #parse}.
 *
 * @param <S> the state type
 * @param <R> the result type
 */
public abstract class StateMachine<S extends Enum<S>, R> {

  /** The handler for one state. */
  @FunctionalInterface
  protected interface Transition {
    void apply(Token token);
  }

  private S state;
  private @Nullable R result;
  private @Nullable PyPlusError error;
  private @Nullable ParseContext context;
  private @Nullable ImmutableMap<S, Transition> table;
  private boolean selfAdvanced;
  private boolean used;

  protected StateMachine(S initial) {
    this.state = requireNonNull(initial);
  }

  /** The transition table. Called once per machine. */
  protected abstract ImmutableMap<S, Transition> transitions();

  /** Runs the machine from the current token until it produces a result. */
  @CanIgnoreReturnValue
  public final R parse(ParseContext context) {
    checkState(!used, "%s is single-use", getClass().getSimpleName());
    used = true;
    this.context = context;
    try {
      while (true) {
        Token token = context.peek();
        transition(token);
        if (error != null) {
          throw error;
        }
        if (result != null) {
          return result;
        }
        if (selfAdvanced) {
          selfAdvanced = false;
          continue;
        }
        if (token.kind() == TokenKind.EOF) {
          throw context.error(token, ErrorKind.UNEXPECTED_EOF);
        }
        context.advance();
      }
    } finally {
      this.context = null;
    }
  }

  /** Feeds one token to the handler of the current state. */
  public final void transition(Token token) {
    checkState(!isDone(), "%s has already finished", getClass().getSimpleName());
    if (table == null) {
      table = transitions();
    }
    Transition handler = table.get(state);
    if (handler == null) {
      error = ctx().error(token, ErrorKind.NO_TRANSITION, state, getClass().getSimpleName());
      return;
    }
    handler.apply(token);
  }

  public S state() {
    return state;
  }

  /** The recorded error, if the machine failed. */
  public @Nullable PyPlusError error() {
    return error;
  }

  /** The recorded result, if the machine finished. */
  public @Nullable R result() {
    return result;
  }

  /** Returns true once a result or an error has been recorded. */
  public boolean isDone() {
    return result != null || error != null;
  }

  protected void setState(S state) {
    this.state = requireNonNull(state);
  }

  /** Records the result. The token that triggered the transition is not consumed. */
  protected void accept(R result) {
    checkState(!isDone());
    this.result = requireNonNull(result);
  }

  /** Records an error at the given token. */
  protected void fail(Token token, ErrorKind kind, Object... args) {
    checkState(!isDone());
    this.error = ctx().error(token, kind, args);
  }

  /**
   * Marks the current step as having consumed its own input, so that the driving loop does not
   * advance.
   */
  protected void selfAdvanced() {
    selfAdvanced = true;
  }

  /** The context of the running parse. */
  protected ParseContext ctx() {
    checkState(context != null, "%s is not running", getClass().getSimpleName());
    return context;
  }
}
