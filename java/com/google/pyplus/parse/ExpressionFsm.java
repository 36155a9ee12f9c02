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

import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.pyplus.diag.PyPlusError.ErrorKind;
import com.google.pyplus.tree.OperatorKind;
import com.google.pyplus.tree.Tree.Attribute;
import com.google.pyplus.tree.Tree.BinaryOp;
import com.google.pyplus.tree.Tree.Call;
import com.google.pyplus.tree.Tree.Expression;
import com.google.pyplus.tree.Tree.Identifier;
import com.google.pyplus.tree.Tree.Keyword;
import com.google.pyplus.tree.Tree.ListLiteral;
import com.google.pyplus.tree.Tree.Literal;
import com.google.pyplus.tree.Tree.LiteralKind;
import com.google.pyplus.tree.Tree.Subscript;
import com.google.pyplus.tree.Tree.UnaryOp;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * Parses an expression by operator-precedence climbing over an operand stack and an operator
 * stack.
 *
 * <p>The expression ends at the first token that cannot continue it, including a {@code )} with
 * no matching {@code (}. That token is not consumed.
 */
public class ExpressionFsm extends StateMachine<ExpressionFsm.State, Expression> {

  /** Parser states. */
  public enum State {
    EXPECT_OPERAND,
    EXPECT_OPERATOR
  }

  private static final ImmutableMap<String, OperatorKind> BINARY_OPERATORS =
      ImmutableMap.<String, OperatorKind>builder()
          .put("==", OperatorKind.EQUAL)
          .put("!=", OperatorKind.NOT_EQUAL)
          .put("<", OperatorKind.LESS_THAN)
          .put(">", OperatorKind.GREATER_THAN)
          .put("<=", OperatorKind.LESS_THAN_EQ)
          .put(">=", OperatorKind.GREATER_THAN_EQ)
          .put("|", OperatorKind.BITWISE_OR)
          .put("^", OperatorKind.BITWISE_XOR)
          .put("&", OperatorKind.BITWISE_AND)
          .put("<<", OperatorKind.SHIFT_LEFT)
          .put(">>", OperatorKind.SHIFT_RIGHT)
          .put("+", OperatorKind.PLUS)
          .put("-", OperatorKind.MINUS)
          .put("*", OperatorKind.MULT)
          .put("/", OperatorKind.DIVIDE)
          .put("//", OperatorKind.FLOOR_DIVIDE)
          .put("%", OperatorKind.MODULO)
          .put("@", OperatorKind.MATMUL)
          .put("**", OperatorKind.POWER)
          .buildOrThrow();

  private static final ImmutableMap<String, OperatorKind> PREFIX_OPERATORS =
      ImmutableMap.of(
          "+", OperatorKind.UNARY_PLUS, "-", OperatorKind.NEG, "~", OperatorKind.BITWISE_COMP);

  /**
   * An operator stack entry: an operator, or the sentinel for an open parenthesis if {@code op} is
   * null.
   */
  private record Frame(@Nullable OperatorKind op, Token token) {}

  private final Deque<Expression> operands = new ArrayDeque<>();
  private final Deque<Frame> operators = new ArrayDeque<>();
  private int openParens;

  public ExpressionFsm() {
    super(State.EXPECT_OPERAND);
  }

  @Override
  protected ImmutableMap<State, Transition> transitions() {
    return Maps.immutableEnumMap(
        ImmutableMap.<State, Transition>of(
            State.EXPECT_OPERAND, this::expectOperand,
            State.EXPECT_OPERATOR, this::expectOperator));
  }

  private void expectOperand(Token token) {
    switch (token.kind()) {
      case NUMBER -> operand(new Literal(token.position(), LiteralKind.NUMBER, token.text()));
      case STRING -> operand(new Literal(token.position(), LiteralKind.STRING, token.text()));
      case TRUE -> operand(new Literal(token.position(), LiteralKind.TRUE, token.text()));
      case FALSE -> operand(new Literal(token.position(), LiteralKind.FALSE, token.text()));
      case NONE -> operand(new Literal(token.position(), LiteralKind.NONE, token.text()));
      case IDENTIFIER -> operand(new Identifier(token.position(), token.text()));
      case LPAREN -> {
        operators.push(new Frame(null, token));
        openParens++;
      }
      case LBRACKET -> {
        operand(listLiteral(token));
        selfAdvanced();
      }
      case NOT -> operators.push(new Frame(OperatorKind.NOT, token));
      case OPERATOR -> {
        OperatorKind op = PREFIX_OPERATORS.get(token.text());
        if (op == null) {
          fail(token, ErrorKind.EXPECTED_EXPRESSION, token.describe());
          return;
        }
        operators.push(new Frame(op, token));
      }
      default -> fail(token, ErrorKind.EXPECTED_EXPRESSION, token.describe());
    }
  }

  private void expectOperator(Token token) {
    switch (token.kind()) {
      case OPERATOR -> {
        OperatorKind op = BINARY_OPERATORS.get(token.text());
        if (op == null) {
          finish(token);
          return;
        }
        binary(op, token);
      }
      case AND -> binary(OperatorKind.AND, token);
      case OR -> binary(OperatorKind.OR, token);
      case IN -> binary(OperatorKind.IN, token);
      case IS -> {
        if (ctx().peek(1).kind() == TokenKind.NOT) {
          binary(OperatorKind.IS_NOT, token);
          ctx().advance();
          ctx().advance();
          selfAdvanced();
        } else {
          binary(OperatorKind.IS, token);
        }
      }
      case NOT -> {
        if (ctx().peek(1).kind() != TokenKind.IN) {
          finish(token);
          return;
        }
        binary(OperatorKind.NOT_IN, token);
        ctx().advance();
        ctx().advance();
        selfAdvanced();
      }
      case RPAREN -> {
        if (openParens == 0) {
          finish(token);
          return;
        }
        closeParen();
      }
      case LPAREN -> {
        operands.push(call(operands.pop()));
        selfAdvanced();
      }
      case DOT -> {
        ctx().advance();
        Token name = ctx().consume(TokenKind.IDENTIFIER, "attribute name");
        Expression value = operands.pop();
        operands.push(new Attribute(value.position(), value, name.text()));
        selfAdvanced();
      }
      case LBRACKET -> {
        ctx().advance();
        Expression index = ctx().parseExpression();
        ctx().consume(TokenKind.RBRACKET, "']'");
        Expression value = operands.pop();
        operands.push(new Subscript(value.position(), value, index));
        selfAdvanced();
      }
      default -> finish(token);
    }
  }

  private void operand(Expression expression) {
    operands.push(expression);
    setState(State.EXPECT_OPERATOR);
  }

  private void binary(OperatorKind op, Token token) {
    while (!operators.isEmpty()
        && operators.peek().op() != null
        && bindsFirst(operators.peek(), op)) {
      reduce();
    }
    operators.push(new Frame(op, token));
    setState(State.EXPECT_OPERAND);
  }

  /** Returns true if the stacked operator must be reduced before {@code incoming} is pushed. */
  private static boolean bindsFirst(Frame top, OperatorKind incoming) {
    int topRank = top.op().prec().rank();
    int incomingRank = incoming.prec().rank();
    return incoming.isRightAssociative() ? topRank > incomingRank : topRank >= incomingRank;
  }

  private void closeParen() {
    while (operators.peek().op() != null) {
      reduce();
    }
    operators.pop();
    openParens--;
  }

  private void reduce() {
    Frame frame = operators.pop();
    OperatorKind op = frame.op();
    verify(op != null, "reduce of a parenthesis");
    if (op.isUnary()) {
      verify(!operands.isEmpty());
      operands.push(new UnaryOp(frame.token().position(), op, operands.pop()));
      return;
    }
    verify(operands.size() >= 2);
    Expression right = operands.pop();
    Expression left = operands.pop();
    operands.push(new BinaryOp(left.position(), op, left, right));
  }

  /** Reduces everything and records the result. {@code token} is left for the caller. */
  private void finish(Token token) {
    while (!operators.isEmpty()) {
      Frame top = operators.peek();
      if (top.op() == null) {
        switch (token.kind()) {
          case EOF, NEWLINE, DEDENT -> fail(top.token(), ErrorKind.UNMATCHED_PAREN);
          // a token that cannot continue the group, e.g. the ',' of a tuple
          default -> fail(token, ErrorKind.UNEXPECTED_TOKEN, token.describe());
        }
        return;
      }
      reduce();
    }
    if (operands.size() != 1) {
      fail(token, ErrorKind.INVALID_EXPRESSION_STATE);
      return;
    }
    accept(operands.pop());
  }

  /** Parses {@code [a, b, ...]}, starting at the {@code [}. */
  private ListLiteral listLiteral(Token open) {
    ctx().advance();
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    while (!ctx().check(TokenKind.RBRACKET)) {
      elements.add(ctx().parseExpression());
      if (!ctx().check(TokenKind.COMMA)) {
        break;
      }
      ctx().advance();
    }
    ctx().consume(TokenKind.RBRACKET, "']'");
    return new ListLiteral(open.position(), elements.build());
  }

  /** Parses the arguments of a call, starting at the {@code (}. */
  private Call call(Expression func) {
    ctx().advance();
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    ImmutableList.Builder<Keyword> keywords = ImmutableList.builder();
    while (!ctx().check(TokenKind.RPAREN)) {
      Token token = ctx().peek();
      if (token.kind() == TokenKind.IDENTIFIER && ctx().peek(1).isOperator("=")) {
        ctx().advance();
        ctx().advance();
        keywords.add(new Keyword(token.position(), token.text(), ctx().parseExpression()));
      } else {
        args.add(ctx().parseExpression());
      }
      if (!ctx().check(TokenKind.COMMA)) {
        break;
      }
      ctx().advance();
    }
    ctx().consume(TokenKind.RPAREN, "')'");
    return new Call(func.position(), func, args.build(), keywords.build());
  }
}
