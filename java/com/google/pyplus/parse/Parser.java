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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pyplus.diag.PyPlusError;
import com.google.pyplus.diag.PyPlusError.ErrorKind;
import com.google.pyplus.diag.SourceFile;
import com.google.pyplus.tree.OperatorKind;
import com.google.pyplus.tree.Tree;
import com.google.pyplus.tree.Tree.Alias;
import com.google.pyplus.tree.Tree.Assignment;
import com.google.pyplus.tree.Tree.BinaryOp;
import com.google.pyplus.tree.Tree.BreakStatement;
import com.google.pyplus.tree.Tree.ContinueStatement;
import com.google.pyplus.tree.Tree.Definition;
import com.google.pyplus.tree.Tree.Expression;
import com.google.pyplus.tree.Tree.Identifier;
import com.google.pyplus.tree.Tree.ImportFrom;
import com.google.pyplus.tree.Tree.ImportStatement;
import com.google.pyplus.tree.Tree.Program;
import com.google.pyplus.tree.Tree.RaiseStatement;
import com.google.pyplus.tree.Tree.ReturnStatement;
import com.google.pyplus.tree.Tree.Type;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A parser for Python++.
 *
 * <p>The parser owns the token stream and the cursor, and dispatches each statement to the state
 * machine for its construct. Simple statements are parsed directly. The first error aborts the
 * parse.
 */
public class Parser implements ParseContext {

  private static final ImmutableMap<String, OperatorKind> AUGMENTED_ASSIGNMENTS =
      ImmutableMap.<String, OperatorKind>builder()
          .put("+=", OperatorKind.PLUS)
          .put("-=", OperatorKind.MINUS)
          .put("*=", OperatorKind.MULT)
          .put("/=", OperatorKind.DIVIDE)
          .put("//=", OperatorKind.FLOOR_DIVIDE)
          .put("%=", OperatorKind.MODULO)
          .put("@=", OperatorKind.MATMUL)
          .put("**=", OperatorKind.POWER)
          .put("&=", OperatorKind.BITWISE_AND)
          .put("|=", OperatorKind.BITWISE_OR)
          .put("^=", OperatorKind.BITWISE_XOR)
          .put("<<=", OperatorKind.SHIFT_LEFT)
          .put(">>=", OperatorKind.SHIFT_RIGHT)
          .buildOrThrow();

  /** Parses the given source. */
  public static Program parse(String source) {
    return parse(new SourceFile(null, source));
  }

  /** Parses the given source file. */
  public static Program parse(SourceFile source) {
    return new Parser(source).program();
  }

  private final SourceFile source;
  private final ImmutableList<Token> tokens;
  private int index;

  public Parser(SourceFile source) {
    this.source = source;
    this.tokens = Lexer.tokenize(source);
  }

  /** Parses statements until the end of input. */
  public Program program() {
    ImmutableList.Builder<Tree> body = ImmutableList.builder();
    while (true) {
      switch (peek().kind()) {
        case EOF -> {
          return new Program(0, body.build());
        }
        case NEWLINE, SEMICOLON -> advance();
        default -> {
          Tree statement = parseStatement();
          if (statement != null) {
            body.add(statement);
          }
        }
      }
    }
  }

  @Override
  public Token peek() {
    return peek(0);
  }

  @Override
  public Token peek(int offset) {
    int i = index + offset;
    // the stream always ends with EOF
    return i < tokens.size() ? tokens.get(i) : tokens.get(tokens.size() - 1);
  }

  @Override
  public void advance() {
    if (index < tokens.size() - 1) {
      index++;
    }
  }

  @Override
  public boolean check(TokenKind kind) {
    return peek().kind() == kind;
  }

  @CanIgnoreReturnValue
  @Override
  public Token consume(TokenKind kind, String expected) {
    Token token = peek();
    if (token.kind() != kind) {
      throw error(token, ErrorKind.EXPECTED_TOKEN, expected, token.describe());
    }
    advance();
    return token;
  }

  @Override
  public Expression parseExpression() {
    return new ExpressionFsm().parse(this);
  }

  @Override
  public Type parseType() {
    return new TypeFsm().parse(this);
  }

  @Override
  public PyPlusError error(Token token, ErrorKind kind, Object... args) {
    return error(token.position(), kind, args);
  }

  private PyPlusError error(int position, ErrorKind kind, Object... args) {
    return PyPlusError.format(source, position, kind, args);
  }

  @Override
  public @Nullable Tree parseStatement() {
    Token token = peek();
    if (token.isOperator("@")) {
      return decorated();
    }
    switch (token.kind()) {
      case ASYNC -> {
        Token next = peek(1);
        if (next.kind() != TokenKind.DEF) {
          throw error(next, ErrorKind.ASYNC_WITHOUT_DEF, next.describe());
        }
        advance();
        return new FunctionFsm(/* async= */ true).parse(this);
      }
      case DEF, CLASS -> {
        return new FunctionFsm(/* async= */ false).parse(this);
      }
      case IF, WHILE, FOR, TRY, WITH -> {
        return new StatementFsm().parse(this);
      }
      case IDENTIFIER -> {
        if (startsMatchStatement()) {
          return new StatementFsm().parse(this);
        }
        return expressionStatement();
      }
      case PASS -> {
        advance();
        endSimpleStatement();
        return null;
      }
      case RETURN -> {
        advance();
        Optional<Expression> value = optionalExpression();
        endSimpleStatement();
        return new ReturnStatement(token.position(), value);
      }
      case RAISE -> {
        advance();
        Optional<Expression> exception = optionalExpression();
        endSimpleStatement();
        return new RaiseStatement(token.position(), exception);
      }
      case BREAK -> {
        advance();
        endSimpleStatement();
        return new BreakStatement(token.position());
      }
      case CONTINUE -> {
        advance();
        endSimpleStatement();
        return new ContinueStatement(token.position());
      }
      case IMPORT -> {
        return importStatement();
      }
      case FROM -> {
        return importFrom();
      }
      case ELIF, ELSE, EXCEPT, FINALLY ->
          throw error(token, ErrorKind.UNEXPECTED_TOKEN, token.describe());
      case INDENT -> throw error(token, ErrorKind.UNEXPECTED_INDENT);
      default -> {
        return expressionStatement();
      }
    }
  }

  /**
   * Returns true if the current identifier is the soft keyword {@code match} opening a match
   * statement: it is followed by a subject, and the logical line has a {@code :} outside brackets.
   */
  private boolean startsMatchStatement() {
    if (!peek().isSoftKeyword(StatementFsm.MATCH) || check(1, TokenKind.COLON)) {
      return false;
    }
    int depth = 0;
    for (int offset = 1; ; offset++) {
      switch (peek(offset).kind()) {
        case LPAREN, LBRACKET, LBRACE -> depth++;
        case RPAREN, RBRACKET, RBRACE -> depth = Math.max(0, depth - 1);
        case COLON -> {
          if (depth == 0) {
            return true;
          }
        }
        case NEWLINE, SEMICOLON, EOF -> {
          return false;
        }
        default -> {}
      }
    }
  }

  private boolean check(int offset, TokenKind kind) {
    return peek(offset).kind() == kind;
  }

  /** Parses one or more {@code @decorator} lines and the definition they apply to. */
  private Tree decorated() {
    ImmutableList.Builder<Expression> decorators = ImmutableList.builder();
    while (peek().isOperator("@")) {
      advance();
      decorators.add(parseExpression());
      consume(TokenKind.NEWLINE, "newline");
      while (check(TokenKind.NEWLINE)) {
        advance();
      }
    }
    Token next = peek();
    switch (next.kind()) {
      case DEF, CLASS, ASYNC -> {}
      default -> throw error(next, ErrorKind.INVALID_DECORATOR_TARGET, next.describe());
    }
    Definition definition = (Definition) requireNonNull(parseStatement());
    return definition.withDecorators(decorators.build());
  }

  private Tree expressionStatement() {
    Expression expression = parseExpression();
    Token token = peek();
    if (token.isOperator("=")) {
      Identifier target = assignmentTarget(expression);
      advance();
      Expression value = parseExpression();
      endSimpleStatement();
      return new Assignment(expression.position(), target, value, Optional.empty());
    }
    if (token.kind() == TokenKind.COLON) {
      Identifier target = assignmentTarget(expression);
      advance();
      Type annotation = parseType();
      Token eq = peek();
      if (!eq.isOperator("=")) {
        throw error(eq, ErrorKind.EXPECTED_TOKEN, "'='", eq.describe());
      }
      advance();
      Expression value = parseExpression();
      endSimpleStatement();
      return new Assignment(expression.position(), target, value, Optional.of(annotation));
    }
    OperatorKind augmented =
        token.kind() == TokenKind.OPERATOR ? AUGMENTED_ASSIGNMENTS.get(token.text()) : null;
    if (augmented != null) {
      Identifier target = assignmentTarget(expression);
      advance();
      Expression value = parseExpression();
      endSimpleStatement();
      return new Assignment(
          expression.position(),
          target,
          new BinaryOp(target.position(), augmented, target, value),
          Optional.empty());
    }
    endSimpleStatement();
    return expression;
  }

  private Identifier assignmentTarget(Expression expression) {
    if (!(expression instanceof Identifier)) {
      throw error(expression.position(), ErrorKind.INVALID_ASSIGNMENT_TARGET);
    }
    return (Identifier) expression;
  }

  private ImportStatement importStatement() {
    Token start = consume(TokenKind.IMPORT, "'import'");
    ImmutableList.Builder<Alias> names = ImmutableList.builder();
    do {
      int position = peek().position();
      String name = dottedName();
      names.add(new Alias(position, name, asName()));
    } while (commaSeparator());
    endSimpleStatement();
    return new ImportStatement(start.position(), names.build());
  }

  private ImportFrom importFrom() {
    Token start = consume(TokenKind.FROM, "'from'");
    StringBuilder module = new StringBuilder();
    // relative imports
    while (check(TokenKind.DOT)) {
      advance();
      module.append('.');
    }
    if (module.length() == 0 || check(TokenKind.IDENTIFIER)) {
      module.append(dottedName());
    }
    consume(TokenKind.IMPORT, "'import'");
    ImmutableList.Builder<Alias> names = ImmutableList.builder();
    Token token = peek();
    if (token.isOperator("*")) {
      advance();
      names.add(new Alias(token.position(), "*", Optional.empty()));
    } else {
      boolean parenthesized = check(TokenKind.LPAREN);
      if (parenthesized) {
        advance();
      }
      do {
        Token name = consume(TokenKind.IDENTIFIER, "identifier");
        names.add(new Alias(name.position(), name.text(), asName()));
        // a trailing comma is allowed inside parentheses
      } while (commaSeparator() && !(parenthesized && check(TokenKind.RPAREN)));
      if (parenthesized) {
        consume(TokenKind.RPAREN, "')'");
      }
    }
    endSimpleStatement();
    return new ImportFrom(start.position(), module.toString(), names.build());
  }

  private String dottedName() {
    StringBuilder name = new StringBuilder(consume(TokenKind.IDENTIFIER, "module name").text());
    while (check(TokenKind.DOT)) {
      advance();
      name.append('.').append(consume(TokenKind.IDENTIFIER, "identifier").text());
    }
    return name.toString();
  }

  private Optional<String> asName() {
    if (!check(TokenKind.AS)) {
      return Optional.empty();
    }
    advance();
    return Optional.of(consume(TokenKind.IDENTIFIER, "identifier").text());
  }

  private boolean commaSeparator() {
    if (!check(TokenKind.COMMA)) {
      return false;
    }
    advance();
    return true;
  }

  private Optional<Expression> optionalExpression() {
    return atEndOfSimpleStatement() ? Optional.empty() : Optional.of(parseExpression());
  }

  private boolean atEndOfSimpleStatement() {
    return switch (peek().kind()) {
      case NEWLINE, SEMICOLON, DEDENT, EOF -> true;
      default -> false;
    };
  }

  /**
   * Checks that a simple statement ends here. The terminator is left for the enclosing statement
   * list.
   */
  private void endSimpleStatement() {
    if (!atEndOfSimpleStatement()) {
      throw error(peek(), ErrorKind.UNEXPECTED_TOKEN, peek().describe());
    }
  }
}
