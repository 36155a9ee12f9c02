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

package com.google.pyplus.tree;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.pyplus.tree.Tree.Alias;
import com.google.pyplus.tree.Tree.Assignment;
import com.google.pyplus.tree.Tree.Attribute;
import com.google.pyplus.tree.Tree.BinaryOp;
import com.google.pyplus.tree.Tree.BreakStatement;
import com.google.pyplus.tree.Tree.Call;
import com.google.pyplus.tree.Tree.ClassDefinition;
import com.google.pyplus.tree.Tree.ContinueStatement;
import com.google.pyplus.tree.Tree.ExceptHandler;
import com.google.pyplus.tree.Tree.Expression;
import com.google.pyplus.tree.Tree.ForStatement;
import com.google.pyplus.tree.Tree.FunctionDefinition;
import com.google.pyplus.tree.Tree.FunctionType;
import com.google.pyplus.tree.Tree.GenericType;
import com.google.pyplus.tree.Tree.Identifier;
import com.google.pyplus.tree.Tree.IfStatement;
import com.google.pyplus.tree.Tree.ImportFrom;
import com.google.pyplus.tree.Tree.ImportStatement;
import com.google.pyplus.tree.Tree.Keyword;
import com.google.pyplus.tree.Tree.KwArgParameter;
import com.google.pyplus.tree.Tree.ListLiteral;
import com.google.pyplus.tree.Tree.Literal;
import com.google.pyplus.tree.Tree.MatchCase;
import com.google.pyplus.tree.Tree.MatchStatement;
import com.google.pyplus.tree.Tree.Param;
import com.google.pyplus.tree.Tree.Parameter;
import com.google.pyplus.tree.Tree.Program;
import com.google.pyplus.tree.Tree.RaiseStatement;
import com.google.pyplus.tree.Tree.ReturnStatement;
import com.google.pyplus.tree.Tree.SimpleType;
import com.google.pyplus.tree.Tree.Subscript;
import com.google.pyplus.tree.Tree.TryStatement;
import com.google.pyplus.tree.Tree.UnaryOp;
import com.google.pyplus.tree.Tree.VarArgParameter;
import com.google.pyplus.tree.Tree.WhileStatement;
import com.google.pyplus.tree.Tree.WithItem;
import com.google.pyplus.tree.Tree.WithStatement;
import java.util.List;
import java.util.Optional;

/**
 * A pretty-printer for {@link Tree}s.
 *
 * <p>Output is Python-like source. Binary and unary operations are always parenthesized so that the
 * shape of an expression tree is visible in the output, and so that the output parses back to the
 * same tree.
 */
public class Pretty implements Tree.Visitor<Void, Void> {

  public static String pretty(Tree tree) {
    Pretty pretty = new Pretty();
    tree.accept(pretty, null);
    return pretty.sb.toString();
  }

  private final StringBuilder sb = new StringBuilder();
  int indent = 0;
  boolean newLine = false;

  /** Terminates the current line, unless it is already empty. */
  void endLine() {
    if (!newLine) {
      append('\n');
    }
  }

  Pretty append(char c) {
    if (c == '\n') {
      newLine = true;
    } else if (newLine) {
      sb.append(Strings.repeat(" ", indent * 4));
      newLine = false;
    }
    sb.append(c);
    return this;
  }

  Pretty append(String s) {
    if (newLine) {
      sb.append(Strings.repeat(" ", indent * 4));
      newLine = false;
    }
    sb.append(s);
    return this;
  }

  private void printStatements(List<? extends Tree> statements) {
    for (Tree t : statements) {
      t.accept(this, null);
      endLine();
    }
  }

  private void printSuite(List<? extends Tree> body) {
    append(':');
    endLine();
    indent++;
    if (body.isEmpty()) {
      append("pass");
      endLine();
    } else {
      printStatements(body);
    }
    indent--;
  }

  private void printElse(Optional<ImmutableList<Tree>> elseBody) {
    if (elseBody.isPresent()) {
      append("else");
      printSuite(elseBody.get());
    }
  }

  private void printList(List<? extends Tree> trees) {
    boolean first = true;
    for (Tree t : trees) {
      if (!first) {
        append(", ");
      }
      t.accept(this, null);
      first = false;
    }
  }

  private void printDecorators(ImmutableList<Expression> decorators) {
    for (Expression decorator : decorators) {
      append('@');
      decorator.accept(this, null);
      endLine();
    }
  }

  private void printAnnotation(Param param) {
    if (param.annotation().isPresent()) {
      append(": ");
      param.annotation().get().accept(this, null);
    }
  }

  @Override
  public Void visitProgram(Program program, Void input) {
    printStatements(program.body());
    return null;
  }

  @Override
  public Void visitFunctionDefinition(FunctionDefinition functionDefinition, Void input) {
    printDecorators(functionDefinition.decorators());
    if (functionDefinition.isAsync()) {
      append("async ");
    }
    append("def ").append(functionDefinition.name()).append('(');
    printList(functionDefinition.params());
    append(')');
    if (functionDefinition.returnType().isPresent()) {
      append(" -> ");
      functionDefinition.returnType().get().accept(this, null);
    }
    printSuite(functionDefinition.body());
    return null;
  }

  @Override
  public Void visitClassDefinition(ClassDefinition classDefinition, Void input) {
    printDecorators(classDefinition.decorators());
    append("class ").append(classDefinition.name());
    if (!classDefinition.bases().isEmpty()) {
      append('(');
      printList(classDefinition.bases());
      append(')');
    }
    printSuite(classDefinition.body());
    return null;
  }

  @Override
  public Void visitIfStatement(IfStatement ifStatement, Void input) {
    append("if ");
    printIfTail(ifStatement);
    return null;
  }

  private void printIfTail(IfStatement ifStatement) {
    ifStatement.condition().accept(this, null);
    printSuite(ifStatement.body());
    if (ifStatement.elseBody().isPresent()) {
      ImmutableList<Tree> elseBody = ifStatement.elseBody().get();
      if (elseBody.size() == 1 && elseBody.get(0) instanceof IfStatement) {
        append("elif ");
        printIfTail((IfStatement) elseBody.get(0));
      } else {
        printElse(ifStatement.elseBody());
      }
    }
  }

  @Override
  public Void visitWhileStatement(WhileStatement whileStatement, Void input) {
    append("while ");
    whileStatement.condition().accept(this, null);
    printSuite(whileStatement.body());
    printElse(whileStatement.elseBody());
    return null;
  }

  @Override
  public Void visitForStatement(ForStatement forStatement, Void input) {
    append("for ");
    forStatement.target().accept(this, null);
    append(" in ");
    forStatement.iterable().accept(this, null);
    printSuite(forStatement.body());
    printElse(forStatement.elseBody());
    return null;
  }

  @Override
  public Void visitTryStatement(TryStatement tryStatement, Void input) {
    append("try");
    printSuite(tryStatement.body());
    for (ExceptHandler handler : tryStatement.handlers()) {
      handler.accept(this, null);
    }
    if (tryStatement.finalBody().isPresent()) {
      append("finally");
      printSuite(tryStatement.finalBody().get());
    }
    return null;
  }

  @Override
  public Void visitExceptHandler(ExceptHandler exceptHandler, Void input) {
    append("except");
    if (exceptHandler.exceptionType().isPresent()) {
      append(' ');
      exceptHandler.exceptionType().get().accept(this, null);
    }
    if (exceptHandler.alias().isPresent()) {
      append(" as ").append(exceptHandler.alias().get());
    }
    printSuite(exceptHandler.body());
    return null;
  }

  @Override
  public Void visitWithStatement(WithStatement withStatement, Void input) {
    append("with ");
    printList(withStatement.items());
    printSuite(withStatement.body());
    return null;
  }

  @Override
  public Void visitWithItem(WithItem withItem, Void input) {
    withItem.context().accept(this, null);
    if (withItem.alias().isPresent()) {
      append(" as ").append(withItem.alias().get());
    }
    return null;
  }

  @Override
  public Void visitMatchStatement(MatchStatement matchStatement, Void input) {
    append("match ");
    matchStatement.subject().accept(this, null);
    append(':');
    endLine();
    indent++;
    for (MatchCase c : matchStatement.cases()) {
      c.accept(this, null);
    }
    indent--;
    return null;
  }

  @Override
  public Void visitMatchCase(MatchCase matchCase, Void input) {
    append("case ");
    matchCase.pattern().accept(this, null);
    if (matchCase.guard().isPresent()) {
      append(" if ");
      matchCase.guard().get().accept(this, null);
    }
    printSuite(matchCase.body());
    return null;
  }

  @Override
  public Void visitAssignment(Assignment assignment, Void input) {
    assignment.target().accept(this, null);
    if (assignment.annotation().isPresent()) {
      append(": ");
      assignment.annotation().get().accept(this, null);
    }
    append(" = ");
    assignment.value().accept(this, null);
    return null;
  }

  @Override
  public Void visitReturnStatement(ReturnStatement returnStatement, Void input) {
    append("return");
    if (returnStatement.value().isPresent()) {
      append(' ');
      returnStatement.value().get().accept(this, null);
    }
    return null;
  }

  @Override
  public Void visitRaiseStatement(RaiseStatement raiseStatement, Void input) {
    append("raise");
    if (raiseStatement.exception().isPresent()) {
      append(' ');
      raiseStatement.exception().get().accept(this, null);
    }
    return null;
  }

  @Override
  public Void visitBreakStatement(BreakStatement breakStatement, Void input) {
    append("break");
    return null;
  }

  @Override
  public Void visitContinueStatement(ContinueStatement continueStatement, Void input) {
    append("continue");
    return null;
  }

  @Override
  public Void visitImportStatement(ImportStatement importStatement, Void input) {
    append("import ");
    printList(importStatement.names());
    return null;
  }

  @Override
  public Void visitImportFrom(ImportFrom importFrom, Void input) {
    append("from ").append(importFrom.module()).append(" import ");
    printList(importFrom.names());
    return null;
  }

  @Override
  public Void visitAlias(Alias alias, Void input) {
    append(alias.name());
    if (alias.asName().isPresent()) {
      append(" as ").append(alias.asName().get());
    }
    return null;
  }

  @Override
  public Void visitBinaryOp(BinaryOp binaryOp, Void input) {
    append('(');
    binaryOp.left().accept(this, null);
    append(" " + binaryOp.operator() + " ");
    binaryOp.right().accept(this, null);
    append(')');
    return null;
  }

  @Override
  public Void visitUnaryOp(UnaryOp unaryOp, Void input) {
    append("(");
    switch (unaryOp.operator()) {
      case NOT -> append("not ");
      case UNARY_PLUS, NEG, BITWISE_COMP -> append(unaryOp.operator().symbol());
      default -> throw new AssertionError(unaryOp.operator().name());
    }
    unaryOp.operand().accept(this, null);
    append(")");
    return null;
  }

  @Override
  public Void visitLiteral(Literal literal, Void input) {
    append(literal.value());
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier identifier, Void input) {
    append(identifier.name());
    return null;
  }

  @Override
  public Void visitListLiteral(ListLiteral listLiteral, Void input) {
    append('[');
    printList(listLiteral.elements());
    append(']');
    return null;
  }

  @Override
  public Void visitCall(Call call, Void input) {
    call.func().accept(this, null);
    append('(');
    printList(call.args());
    if (!call.args().isEmpty() && !call.keywords().isEmpty()) {
      append(", ");
    }
    printList(call.keywords());
    append(')');
    return null;
  }

  @Override
  public Void visitKeyword(Keyword keyword, Void input) {
    append(keyword.name()).append('=');
    keyword.value().accept(this, null);
    return null;
  }

  @Override
  public Void visitAttribute(Attribute attribute, Void input) {
    attribute.value().accept(this, null);
    append('.').append(attribute.name());
    return null;
  }

  @Override
  public Void visitSubscript(Subscript subscript, Void input) {
    subscript.value().accept(this, null);
    append('[');
    subscript.index().accept(this, null);
    append(']');
    return null;
  }

  @Override
  public Void visitParameter(Parameter parameter, Void input) {
    append(parameter.name());
    printAnnotation(parameter);
    if (parameter.defaultValue().isPresent()) {
      append(parameter.annotation().isPresent() ? " = " : "=");
      parameter.defaultValue().get().accept(this, null);
    }
    return null;
  }

  @Override
  public Void visitVarArgParameter(VarArgParameter varArgParameter, Void input) {
    append('*').append(varArgParameter.name());
    printAnnotation(varArgParameter);
    return null;
  }

  @Override
  public Void visitKwArgParameter(KwArgParameter kwArgParameter, Void input) {
    append("**").append(kwArgParameter.name());
    printAnnotation(kwArgParameter);
    return null;
  }

  @Override
  public Void visitSimpleType(SimpleType simpleType, Void input) {
    append(simpleType.name());
    return null;
  }

  @Override
  public Void visitGenericType(GenericType genericType, Void input) {
    append(genericType.base()).append('[');
    printList(genericType.params());
    append(']');
    return null;
  }

  @Override
  public Void visitFunctionType(FunctionType functionType, Void input) {
    functionType.paramType().accept(this, null);
    append(" -> ");
    functionType.returnType().accept(this, null);
    return null;
  }
}
