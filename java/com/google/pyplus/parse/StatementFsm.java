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
import com.google.pyplus.tree.Tree.ExceptHandler;
import com.google.pyplus.tree.Tree.Expression;
import com.google.pyplus.tree.Tree.ForStatement;
import com.google.pyplus.tree.Tree.Identifier;
import com.google.pyplus.tree.Tree.IfStatement;
import com.google.pyplus.tree.Tree.MatchCase;
import com.google.pyplus.tree.Tree.MatchStatement;
import com.google.pyplus.tree.Tree.Statement;
import com.google.pyplus.tree.Tree.TryStatement;
import com.google.pyplus.tree.Tree.WhileStatement;
import com.google.pyplus.tree.Tree.WithItem;
import com.google.pyplus.tree.Tree.WithStatement;
import java.util.Optional;

/**
 * Parses a compound control-flow statement: {@code if}, {@code while}, {@code for}, {@code try},
 * {@code with} or {@code match}.
 *
 * <p>After each block the machine looks at the next token to decide whether another clause
 * ({@code elif}, {@code else}, {@code except}, {@code finally}, {@code case}) follows. Blocks are
 * parsed by {@link SuiteFsm}, which hands each statement back to the driver.
 */
public class StatementFsm extends StateMachine<StatementFsm.State, Statement> {

  /** Soft keywords; both are ordinary identifiers outside a match statement. */
  static final String MATCH = "match";

  static final String CASE = "case";

  /** Parser states. */
  public enum State {
    INITIAL,
    CONDITION,
    FOR_TARGET,
    FOR_IN,
    BODY,
    AFTER_BODY,
    ELSE_BODY,
    TRY_BODY,
    AFTER_TRY_CLAUSE,
    EXCEPT_CLAUSE,
    EXCEPT_ALIAS,
    EXCEPT_ALIAS_NAME,
    HANDLER_BODY,
    FINALLY_BODY,
    WITH_ITEM,
    WITH_ALIAS,
    WITH_ALIAS_NAME,
    AFTER_WITH_ITEM,
    MATCH_SUBJECT,
    MATCH_COLON,
    MATCH_NEWLINE,
    MATCH_INDENT,
    EXPECT_CASE,
    CASE_PATTERN,
    CASE_GUARD,
    CASE_GUARD_EXPRESSION,
    CASE_BODY
  }

  private enum Family {
    IF,
    WHILE,
    FOR,
    TRY,
    WITH,
    MATCH
  }

  private Family family;
  private int position;

  // if, while, for
  private Expression condition;
  private Identifier target;
  private ImmutableList<Tree> body;
  private Optional<ImmutableList<Tree>> elseBody = Optional.empty();

  // try
  private final ImmutableList.Builder<ExceptHandler> handlers = ImmutableList.builder();
  private Optional<ImmutableList<Tree>> finalBody = Optional.empty();
  private int clausePosition;
  private Optional<Expression> exceptionType;
  private Optional<String> alias;

  // with
  private final ImmutableList.Builder<WithItem> items = ImmutableList.builder();
  private Expression context;

  // match
  private final ImmutableList.Builder<MatchCase> cases = ImmutableList.builder();
  private boolean seenCase;
  private Expression pattern;
  private Optional<Expression> guard;

  public StatementFsm() {
    super(State.INITIAL);
  }

  @Override
  protected ImmutableMap<State, Transition> transitions() {
    return Maps.immutableEnumMap(
        ImmutableMap.<State, Transition>builder()
            .put(State.INITIAL, this::initial)
            .put(State.CONDITION, this::condition)
            .put(State.FOR_TARGET, this::forTarget)
            .put(State.FOR_IN, this::forIn)
            .put(State.BODY, this::body)
            .put(State.AFTER_BODY, this::afterBody)
            .put(State.ELSE_BODY, this::elseBody)
            .put(State.TRY_BODY, this::tryBody)
            .put(State.AFTER_TRY_CLAUSE, this::afterTryClause)
            .put(State.EXCEPT_CLAUSE, this::exceptClause)
            .put(State.EXCEPT_ALIAS, this::exceptAlias)
            .put(State.EXCEPT_ALIAS_NAME, this::exceptAliasName)
            .put(State.HANDLER_BODY, this::handlerBody)
            .put(State.FINALLY_BODY, this::finallyBody)
            .put(State.WITH_ITEM, this::withItem)
            .put(State.WITH_ALIAS, this::withAlias)
            .put(State.WITH_ALIAS_NAME, this::withAliasName)
            .put(State.AFTER_WITH_ITEM, this::afterWithItem)
            .put(State.MATCH_SUBJECT, this::matchSubject)
            .put(State.MATCH_COLON, this::matchColon)
            .put(State.MATCH_NEWLINE, this::matchNewline)
            .put(State.MATCH_INDENT, this::matchIndent)
            .put(State.EXPECT_CASE, this::expectCase)
            .put(State.CASE_PATTERN, this::casePattern)
            .put(State.CASE_GUARD, this::caseGuard)
            .put(State.CASE_GUARD_EXPRESSION, this::caseGuardExpression)
            .put(State.CASE_BODY, this::caseBody)
            .buildOrThrow());
  }

  private void initial(Token token) {
    position = token.position();
    switch (token.kind()) {
      // an elif clause is parsed as a nested if statement
      case IF, ELIF -> start(Family.IF, State.CONDITION);
      case WHILE -> start(Family.WHILE, State.CONDITION);
      case FOR -> start(Family.FOR, State.FOR_TARGET);
      case TRY -> start(Family.TRY, State.TRY_BODY);
      case WITH -> start(Family.WITH, State.WITH_ITEM);
      case IDENTIFIER -> {
        if (token.isSoftKeyword(MATCH)) {
          start(Family.MATCH, State.MATCH_SUBJECT);
        } else {
          fail(token, ErrorKind.UNEXPECTED_TOKEN, token.describe());
        }
      }
      default -> fail(token, ErrorKind.UNEXPECTED_TOKEN, token.describe());
    }
  }

  private void start(Family family, State next) {
    this.family = family;
    setState(next);
  }

  private void condition(Token token) {
    condition = ctx().parseExpression();
    selfAdvanced();
    setState(State.BODY);
  }

  private void forTarget(Token token) {
    if (token.kind() != TokenKind.IDENTIFIER) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "identifier", token.describe());
      return;
    }
    target = new Identifier(token.position(), token.text());
    setState(State.FOR_IN);
  }

  private void forIn(Token token) {
    if (token.kind() != TokenKind.IN) {
      fail(token, ErrorKind.EXPECTED_TOKEN, TokenKind.IN.describe(), token.describe());
      return;
    }
    setState(State.CONDITION);
  }

  private void body(Token token) {
    body = suite();
    setState(State.AFTER_BODY);
  }

  private void afterBody(Token token) {
    if (token.kind() == TokenKind.ELIF && family == Family.IF) {
      Statement elif = new StatementFsm().parse(ctx());
      elseBody = Optional.of(ImmutableList.of(elif));
      finish();
    } else if (token.kind() == TokenKind.ELSE && family != Family.WITH) {
      setState(State.ELSE_BODY);
    } else {
      finish();
    }
  }

  private void elseBody(Token token) {
    elseBody = Optional.of(suite());
    finish();
  }

  private void tryBody(Token token) {
    body = suite();
    setState(State.AFTER_TRY_CLAUSE);
  }

  private void afterTryClause(Token token) {
    switch (token.kind()) {
      case EXCEPT -> {
        clausePosition = token.position();
        exceptionType = Optional.empty();
        alias = Optional.empty();
        setState(State.EXCEPT_CLAUSE);
      }
      case FINALLY -> setState(State.FINALLY_BODY);
      default -> finish();
    }
  }

  private void exceptClause(Token token) {
    if (token.kind() == TokenKind.COLON) {
      handlerBody(token);
      return;
    }
    exceptionType = Optional.of(ctx().parseExpression());
    selfAdvanced();
    setState(State.EXCEPT_ALIAS);
  }

  private void exceptAlias(Token token) {
    if (token.kind() == TokenKind.AS) {
      setState(State.EXCEPT_ALIAS_NAME);
      return;
    }
    handlerBody(token);
  }

  private void exceptAliasName(Token token) {
    if (token.kind() != TokenKind.IDENTIFIER) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "identifier", token.describe());
      return;
    }
    alias = Optional.of(token.text());
    setState(State.HANDLER_BODY);
  }

  private void handlerBody(Token token) {
    handlers.add(new ExceptHandler(clausePosition, exceptionType, alias, suite()));
    setState(State.AFTER_TRY_CLAUSE);
  }

  private void finallyBody(Token token) {
    finalBody = Optional.of(suite());
    finish();
  }

  private void withItem(Token token) {
    clausePosition = token.position();
    context = ctx().parseExpression();
    alias = Optional.empty();
    selfAdvanced();
    setState(State.WITH_ALIAS);
  }

  private void withAlias(Token token) {
    if (token.kind() == TokenKind.AS) {
      setState(State.WITH_ALIAS_NAME);
      return;
    }
    afterWithItem(token);
  }

  private void withAliasName(Token token) {
    if (token.kind() != TokenKind.IDENTIFIER) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "identifier", token.describe());
      return;
    }
    alias = Optional.of(token.text());
    setState(State.AFTER_WITH_ITEM);
  }

  private void afterWithItem(Token token) {
    items.add(new WithItem(clausePosition, context, alias));
    if (token.kind() == TokenKind.COMMA) {
      setState(State.WITH_ITEM);
      return;
    }
    setState(State.BODY);
    selfAdvanced();
  }

  private void matchSubject(Token token) {
    context = ctx().parseExpression();
    selfAdvanced();
    setState(State.MATCH_COLON);
  }

  private void matchColon(Token token) {
    if (token.kind() != TokenKind.COLON) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "':'", token.describe());
      return;
    }
    setState(State.MATCH_NEWLINE);
  }

  private void matchNewline(Token token) {
    if (token.kind() != TokenKind.NEWLINE) {
      fail(token, ErrorKind.EXPECTED_TOKEN, "newline", token.describe());
      return;
    }
    setState(State.MATCH_INDENT);
  }

  private void matchIndent(Token token) {
    switch (token.kind()) {
      case NEWLINE -> {}
      case INDENT -> setState(State.EXPECT_CASE);
      default -> fail(token, ErrorKind.EXPECTED_INDENTED_BLOCK, token.describe());
    }
  }

  private void expectCase(Token token) {
    if (token.isSoftKeyword(CASE)) {
      clausePosition = token.position();
      guard = Optional.empty();
      seenCase = true;
      setState(State.CASE_PATTERN);
      return;
    }
    switch (token.kind()) {
      case NEWLINE -> {}
      case DEDENT -> {
        if (!seenCase) {
          fail(token, ErrorKind.EXPECTED_TOKEN, "'" + CASE + "'", token.describe());
          return;
        }
        ctx().advance();
        finish();
      }
      default -> fail(token, ErrorKind.EXPECTED_TOKEN, "'" + CASE + "'", token.describe());
    }
  }

  private void casePattern(Token token) {
    pattern = ctx().parseExpression();
    selfAdvanced();
    setState(State.CASE_GUARD);
  }

  private void caseGuard(Token token) {
    if (token.kind() == TokenKind.IF) {
      setState(State.CASE_GUARD_EXPRESSION);
      return;
    }
    caseBody(token);
  }

  private void caseGuardExpression(Token token) {
    guard = Optional.of(ctx().parseExpression());
    selfAdvanced();
    setState(State.CASE_BODY);
  }

  private void caseBody(Token token) {
    cases.add(new MatchCase(clausePosition, pattern, guard, suite()));
    setState(State.EXPECT_CASE);
  }

  /** Parses a block with {@link SuiteFsm}. Always consumes input, starting at the colon. */
  private ImmutableList<Tree> suite() {
    ImmutableList<Tree> suite = new SuiteFsm().parse(ctx());
    selfAdvanced();
    return suite;
  }

  /** Builds the statement. The current token, which starts the next statement, is left alone. */
  private void finish() {
    accept(
        switch (family) {
          case IF -> new IfStatement(position, condition, body, elseBody);
          case WHILE -> new WhileStatement(position, condition, body, elseBody);
          case FOR -> new ForStatement(position, target, condition, body, elseBody);
          case TRY -> new TryStatement(position, body, handlers.build(), finalBody);
          case WITH -> new WithStatement(position, items.build(), body);
          case MATCH -> new MatchStatement(position, context, cases.build());
        });
  }
}
