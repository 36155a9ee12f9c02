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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * A Python++ AST node.
 *
 * <p>Nodes are immutable and built bottom-up. Statement bodies are lists of {@link Tree}s because a
 * bare expression is a valid statement.
 */
public abstract class Tree {

  /** The kind of a node. {@link #typeName} is the discriminant exposed to tree consumers. */
  public enum Kind {
    PROGRAM("Program"),
    FUNCTION_DEFINITION("FunctionDefinition"),
    CLASS_DEFINITION("ClassDefinition"),
    IF_STATEMENT("IfStatement"),
    WHILE_STATEMENT("WhileStatement"),
    FOR_STATEMENT("ForStatement"),
    TRY_STATEMENT("TryStatement"),
    EXCEPT_HANDLER("ExceptHandler"),
    WITH_STATEMENT("WithStatement"),
    WITH_ITEM("WithItem"),
    MATCH_STATEMENT("MatchStatement"),
    MATCH_CASE("MatchCase"),
    ASSIGNMENT("Assignment"),
    RETURN_STATEMENT("ReturnStatement"),
    RAISE_STATEMENT("RaiseStatement"),
    BREAK_STATEMENT("BreakStatement"),
    CONTINUE_STATEMENT("ContinueStatement"),
    IMPORT_STATEMENT("ImportStatement"),
    IMPORT_FROM("ImportFrom"),
    ALIAS("Alias"),
    BINARY_OP("BinaryOp"),
    UNARY_OP("UnaryOp"),
    LITERAL("Literal"),
    IDENTIFIER("Identifier"),
    LIST_LITERAL("ListLiteral"),
    CALL("Call"),
    KEYWORD("Keyword"),
    ATTRIBUTE("Attribute"),
    SUBSCRIPT("Subscript"),
    PARAMETER("Parameter"),
    VAR_ARG_PARAMETER("VarArgParameter"),
    KW_ARG_PARAMETER("KwArgParameter"),
    SIMPLE_TYPE("SimpleType"),
    GENERIC_TYPE("GenericType"),
    FUNCTION_TYPE("FunctionType");

    private final String typeName;

    Kind(String typeName) {
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }
  }

  private final int position;

  protected Tree(int position) {
    this.position = position;
  }

  public abstract Kind kind();

  public abstract <I, O> O accept(Visitor<I, O> visitor, I input);

  /** The character offset of the first token of this node. */
  public int position() {
    return position;
  }

  /** The type discriminant, e.g. {@code "BinaryOp"}. */
  public String type() {
    return kind().typeName();
  }

  @Override
  public String toString() {
    return Pretty.pretty(this);
  }

  /** A statement. */
  public abstract static class Statement extends Tree {
    protected Statement(int position) {
      super(position);
    }
  }

  /** An expression. */
  public abstract static class Expression extends Tree {
    protected Expression(int position) {
      super(position);
    }
  }

  /** A type annotation. */
  public abstract static class Type extends Tree {
    protected Type(int position) {
      super(position);
    }
  }

  /** A function parameter. */
  public abstract static class Param extends Tree {

    private final String name;
    private final Optional<Type> annotation;

    protected Param(int position, String name, Optional<Type> annotation) {
      super(position);
      this.name = requireNonNull(name);
      this.annotation = requireNonNull(annotation);
    }

    public String name() {
      return name;
    }

    public Optional<Type> annotation() {
      return annotation;
    }
  }

  /** A decorated definition: a function or a class. */
  public abstract static class Definition extends Statement {

    private final String name;
    private final ImmutableList<Tree> body;
    private final ImmutableList<Expression> decorators;

    protected Definition(
        int position, String name, ImmutableList<Tree> body, ImmutableList<Expression> decorators) {
      super(position);
      this.name = requireNonNull(name);
      this.body = requireNonNull(body);
      this.decorators = requireNonNull(decorators);
    }

    public String name() {
      return name;
    }

    public ImmutableList<Tree> body() {
      return body;
    }

    /** Decorator expressions, outermost first. Empty if the definition is not decorated. */
    public ImmutableList<Expression> decorators() {
      return decorators;
    }

    /** Returns a copy of this definition with the given decorators. */
    public abstract Definition withDecorators(ImmutableList<Expression> decorators);
  }

  /** A compilation unit: the root of every parse. */
  public static class Program extends Tree {

    private final ImmutableList<Tree> body;

    public Program(int position, ImmutableList<Tree> body) {
      super(position);
      this.body = requireNonNull(body);
    }

    @Override
    public Kind kind() {
      return Kind.PROGRAM;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitProgram(this, input);
    }

    public ImmutableList<Tree> body() {
      return body;
    }
  }

  /** A function definition, {@code [async] def name(params) [-> type]: body}. */
  public static class FunctionDefinition extends Definition {

    private final ImmutableList<Param> params;
    private final Optional<Type> returnType;
    private final boolean async;

    public FunctionDefinition(
        int position,
        String name,
        ImmutableList<Param> params,
        Optional<Type> returnType,
        ImmutableList<Tree> body,
        boolean async,
        ImmutableList<Expression> decorators) {
      super(position, name, body, decorators);
      this.params = requireNonNull(params);
      this.returnType = requireNonNull(returnType);
      this.async = async;
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_DEFINITION;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitFunctionDefinition(this, input);
    }

    public ImmutableList<Param> params() {
      return params;
    }

    public Optional<Type> returnType() {
      return returnType;
    }

    public boolean isAsync() {
      return async;
    }

    @Override
    public FunctionDefinition withDecorators(ImmutableList<Expression> decorators) {
      return new FunctionDefinition(
          position(), name(), params, returnType, body(), async, decorators);
    }
  }

  /** A class definition, {@code class name[(bases)]: body}. */
  public static class ClassDefinition extends Definition {

    private final ImmutableList<Expression> bases;

    public ClassDefinition(
        int position,
        String name,
        ImmutableList<Expression> bases,
        ImmutableList<Tree> body,
        ImmutableList<Expression> decorators) {
      super(position, name, body, decorators);
      this.bases = requireNonNull(bases);
    }

    @Override
    public Kind kind() {
      return Kind.CLASS_DEFINITION;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitClassDefinition(this, input);
    }

    public ImmutableList<Expression> bases() {
      return bases;
    }

    @Override
    public ClassDefinition withDecorators(ImmutableList<Expression> decorators) {
      return new ClassDefinition(position(), name(), bases, body(), decorators);
    }
  }

  /** An {@code if} statement. An {@code elif} chain is an else body holding a nested {@code if}. */
  public static class IfStatement extends Statement {

    private final Expression condition;
    private final ImmutableList<Tree> body;
    private final Optional<ImmutableList<Tree>> elseBody;

    public IfStatement(
        int position,
        Expression condition,
        ImmutableList<Tree> body,
        Optional<ImmutableList<Tree>> elseBody) {
      super(position);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
      this.elseBody = requireNonNull(elseBody);
    }

    @Override
    public Kind kind() {
      return Kind.IF_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitIfStatement(this, input);
    }

    public Expression condition() {
      return condition;
    }

    public ImmutableList<Tree> body() {
      return body;
    }

    public Optional<ImmutableList<Tree>> elseBody() {
      return elseBody;
    }
  }

  /** A {@code while} loop. */
  public static class WhileStatement extends Statement {

    private final Expression condition;
    private final ImmutableList<Tree> body;
    private final Optional<ImmutableList<Tree>> elseBody;

    public WhileStatement(
        int position,
        Expression condition,
        ImmutableList<Tree> body,
        Optional<ImmutableList<Tree>> elseBody) {
      super(position);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
      this.elseBody = requireNonNull(elseBody);
    }

    @Override
    public Kind kind() {
      return Kind.WHILE_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitWhileStatement(this, input);
    }

    public Expression condition() {
      return condition;
    }

    public ImmutableList<Tree> body() {
      return body;
    }

    public Optional<ImmutableList<Tree>> elseBody() {
      return elseBody;
    }
  }

  /** A {@code for target in iterable} loop. */
  public static class ForStatement extends Statement {

    private final Identifier target;
    private final Expression iterable;
    private final ImmutableList<Tree> body;
    private final Optional<ImmutableList<Tree>> elseBody;

    public ForStatement(
        int position,
        Identifier target,
        Expression iterable,
        ImmutableList<Tree> body,
        Optional<ImmutableList<Tree>> elseBody) {
      super(position);
      this.target = requireNonNull(target);
      this.iterable = requireNonNull(iterable);
      this.body = requireNonNull(body);
      this.elseBody = requireNonNull(elseBody);
    }

    @Override
    public Kind kind() {
      return Kind.FOR_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitForStatement(this, input);
    }

    public Identifier target() {
      return target;
    }

    public Expression iterable() {
      return iterable;
    }

    public ImmutableList<Tree> body() {
      return body;
    }

    public Optional<ImmutableList<Tree>> elseBody() {
      return elseBody;
    }
  }

  /** A {@code try} statement with its handlers and optional {@code finally} body. */
  public static class TryStatement extends Statement {

    private final ImmutableList<Tree> body;
    private final ImmutableList<ExceptHandler> handlers;
    private final Optional<ImmutableList<Tree>> finalBody;

    public TryStatement(
        int position,
        ImmutableList<Tree> body,
        ImmutableList<ExceptHandler> handlers,
        Optional<ImmutableList<Tree>> finalBody) {
      super(position);
      this.body = requireNonNull(body);
      this.handlers = requireNonNull(handlers);
      this.finalBody = requireNonNull(finalBody);
    }

    @Override
    public Kind kind() {
      return Kind.TRY_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitTryStatement(this, input);
    }

    public ImmutableList<Tree> body() {
      return body;
    }

    public ImmutableList<ExceptHandler> handlers() {
      return handlers;
    }

    public Optional<ImmutableList<Tree>> finalBody() {
      return finalBody;
    }
  }

  /** An {@code except [type [as alias]]:} clause. */
  public static class ExceptHandler extends Tree {

    private final Optional<Expression> exceptionType;
    private final Optional<String> alias;
    private final ImmutableList<Tree> body;

    public ExceptHandler(
        int position,
        Optional<Expression> exceptionType,
        Optional<String> alias,
        ImmutableList<Tree> body) {
      super(position);
      checkArgument(exceptionType.isPresent() || alias.isEmpty(), "alias without exception type");
      this.exceptionType = exceptionType;
      this.alias = requireNonNull(alias);
      this.body = requireNonNull(body);
    }

    @Override
    public Kind kind() {
      return Kind.EXCEPT_HANDLER;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitExceptHandler(this, input);
    }

    public Optional<Expression> exceptionType() {
      return exceptionType;
    }

    public Optional<String> alias() {
      return alias;
    }

    public ImmutableList<Tree> body() {
      return body;
    }
  }

  /** A {@code with} statement. */
  public static class WithStatement extends Statement {

    private final ImmutableList<WithItem> items;
    private final ImmutableList<Tree> body;

    public WithStatement(int position, ImmutableList<WithItem> items, ImmutableList<Tree> body) {
      super(position);
      checkArgument(!items.isEmpty(), "with statement without items");
      this.items = items;
      this.body = requireNonNull(body);
    }

    @Override
    public Kind kind() {
      return Kind.WITH_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitWithStatement(this, input);
    }

    public ImmutableList<WithItem> items() {
      return items;
    }

    public ImmutableList<Tree> body() {
      return body;
    }
  }

  /** One {@code context [as alias]} item of a {@code with} statement. */
  public static class WithItem extends Tree {

    private final Expression context;
    private final Optional<String> alias;

    public WithItem(int position, Expression context, Optional<String> alias) {
      super(position);
      this.context = requireNonNull(context);
      this.alias = requireNonNull(alias);
    }

    @Override
    public Kind kind() {
      return Kind.WITH_ITEM;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitWithItem(this, input);
    }

    public Expression context() {
      return context;
    }

    public Optional<String> alias() {
      return alias;
    }
  }

  /** A {@code match} statement. */
  public static class MatchStatement extends Statement {

    private final Expression subject;
    private final ImmutableList<MatchCase> cases;

    public MatchStatement(int position, Expression subject, ImmutableList<MatchCase> cases) {
      super(position);
      checkArgument(!cases.isEmpty(), "match statement without cases");
      this.subject = requireNonNull(subject);
      this.cases = cases;
    }

    @Override
    public Kind kind() {
      return Kind.MATCH_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitMatchStatement(this, input);
    }

    public Expression subject() {
      return subject;
    }

    public ImmutableList<MatchCase> cases() {
      return cases;
    }
  }

  /** A {@code case pattern [if guard]:} clause. Patterns are plain expressions. */
  public static class MatchCase extends Tree {

    private final Expression pattern;
    private final Optional<Expression> guard;
    private final ImmutableList<Tree> body;

    public MatchCase(
        int position, Expression pattern, Optional<Expression> guard, ImmutableList<Tree> body) {
      super(position);
      this.pattern = requireNonNull(pattern);
      this.guard = requireNonNull(guard);
      this.body = requireNonNull(body);
    }

    @Override
    public Kind kind() {
      return Kind.MATCH_CASE;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitMatchCase(this, input);
    }

    public Expression pattern() {
      return pattern;
    }

    public Optional<Expression> guard() {
      return guard;
    }

    public ImmutableList<Tree> body() {
      return body;
    }
  }

  /** An assignment to a name, with an optional type annotation. */
  public static class Assignment extends Statement {

    private final Identifier target;
    private final Expression value;
    private final Optional<Type> annotation;

    public Assignment(
        int position, Identifier target, Expression value, Optional<Type> annotation) {
      super(position);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
      this.annotation = requireNonNull(annotation);
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGNMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitAssignment(this, input);
    }

    public Identifier target() {
      return target;
    }

    public Expression value() {
      return value;
    }

    public Optional<Type> annotation() {
      return annotation;
    }
  }

  /** A {@code return} statement. */
  public static class ReturnStatement extends Statement {

    private final Optional<Expression> value;

    public ReturnStatement(int position, Optional<Expression> value) {
      super(position);
      this.value = requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.RETURN_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitReturnStatement(this, input);
    }

    public Optional<Expression> value() {
      return value;
    }
  }

  /** A {@code raise} statement. */
  public static class RaiseStatement extends Statement {

    private final Optional<Expression> exception;

    public RaiseStatement(int position, Optional<Expression> exception) {
      super(position);
      this.exception = requireNonNull(exception);
    }

    @Override
    public Kind kind() {
      return Kind.RAISE_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitRaiseStatement(this, input);
    }

    public Optional<Expression> exception() {
      return exception;
    }
  }

  /** A {@code break} statement. */
  public static class BreakStatement extends Statement {

    public BreakStatement(int position) {
      super(position);
    }

    @Override
    public Kind kind() {
      return Kind.BREAK_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitBreakStatement(this, input);
    }
  }

  /** A {@code continue} statement. */
  public static class ContinueStatement extends Statement {

    public ContinueStatement(int position) {
      super(position);
    }

    @Override
    public Kind kind() {
      return Kind.CONTINUE_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitContinueStatement(this, input);
    }
  }

  /** An {@code import a.b [as c], ...} statement. */
  public static class ImportStatement extends Statement {

    private final ImmutableList<Alias> names;

    public ImportStatement(int position, ImmutableList<Alias> names) {
      super(position);
      checkArgument(!names.isEmpty(), "import without names");
      this.names = names;
    }

    @Override
    public Kind kind() {
      return Kind.IMPORT_STATEMENT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitImportStatement(this, input);
    }

    public ImmutableList<Alias> names() {
      return names;
    }
  }

  /** A {@code from module import name [as alias], ...} statement. */
  public static class ImportFrom extends Statement {

    private final String module;
    private final ImmutableList<Alias> names;

    public ImportFrom(int position, String module, ImmutableList<Alias> names) {
      super(position);
      checkArgument(!names.isEmpty(), "import without names");
      this.module = requireNonNull(module);
      this.names = names;
    }

    @Override
    public Kind kind() {
      return Kind.IMPORT_FROM;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitImportFrom(this, input);
    }

    /** The dotted module name. */
    public String module() {
      return module;
    }

    public ImmutableList<Alias> names() {
      return names;
    }
  }

  /** An imported name, {@code name [as asName]}. */
  public static class Alias extends Tree {

    private final String name;
    private final Optional<String> asName;

    public Alias(int position, String name, Optional<String> asName) {
      super(position);
      this.name = requireNonNull(name);
      this.asName = requireNonNull(asName);
    }

    @Override
    public Kind kind() {
      return Kind.ALIAS;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitAlias(this, input);
    }

    public String name() {
      return name;
    }

    public Optional<String> asName() {
      return asName;
    }
  }

  /** A binary operation. */
  public static class BinaryOp extends Expression {

    private final OperatorKind operator;
    private final Expression left;
    private final Expression right;

    public BinaryOp(int position, OperatorKind operator, Expression left, Expression right) {
      super(position);
      checkArgument(!operator.isUnary(), "%s is not a binary operator", operator);
      this.operator = operator;
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public Kind kind() {
      return Kind.BINARY_OP;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitBinaryOp(this, input);
    }

    public OperatorKind operator() {
      return operator;
    }

    public Expression left() {
      return left;
    }

    public Expression right() {
      return right;
    }
  }

  /** A prefix operation. */
  public static class UnaryOp extends Expression {

    private final OperatorKind operator;
    private final Expression operand;

    public UnaryOp(int position, OperatorKind operator, Expression operand) {
      super(position);
      checkArgument(operator.isUnary(), "%s is not a unary operator", operator);
      this.operator = operator;
      this.operand = requireNonNull(operand);
    }

    @Override
    public Kind kind() {
      return Kind.UNARY_OP;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitUnaryOp(this, input);
    }

    public OperatorKind operator() {
      return operator;
    }

    public Expression operand() {
      return operand;
    }
  }

  /** The kind of a {@link Literal}. */
  public enum LiteralKind {
    NUMBER,
    STRING,
    TRUE,
    FALSE,
    NONE
  }

  /**
   * A literal. The value is the source text of the literal; numbers are not converted and string
   * escapes are not interpreted.
   */
  public static class Literal extends Expression {

    private final LiteralKind literalKind;
    private final String value;

    public Literal(int position, LiteralKind literalKind, String value) {
      super(position);
      this.literalKind = requireNonNull(literalKind);
      this.value = requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitLiteral(this, input);
    }

    public LiteralKind literalKind() {
      return literalKind;
    }

    public String value() {
      return value;
    }
  }

  /** A simple name. */
  public static class Identifier extends Expression {

    private final String name;

    public Identifier(int position, String name) {
      super(position);
      this.name = requireNonNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.IDENTIFIER;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitIdentifier(this, input);
    }

    public String name() {
      return name;
    }
  }

  /** A list display, {@code [a, b, ...]}. */
  public static class ListLiteral extends Expression {

    private final ImmutableList<Expression> elements;

    public ListLiteral(int position, ImmutableList<Expression> elements) {
      super(position);
      this.elements = requireNonNull(elements);
    }

    @Override
    public Kind kind() {
      return Kind.LIST_LITERAL;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitListLiteral(this, input);
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }
  }

  /** A call, {@code func(args..., name=value...)}. */
  public static class Call extends Expression {

    private final Expression func;
    private final ImmutableList<Expression> args;
    private final ImmutableList<Keyword> keywords;

    public Call(
        int position,
        Expression func,
        ImmutableList<Expression> args,
        ImmutableList<Keyword> keywords) {
      super(position);
      this.func = requireNonNull(func);
      this.args = requireNonNull(args);
      this.keywords = requireNonNull(keywords);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitCall(this, input);
    }

    public Expression func() {
      return func;
    }

    public ImmutableList<Expression> args() {
      return args;
    }

    public ImmutableList<Keyword> keywords() {
      return keywords;
    }
  }

  /** A keyword argument of a {@link Call}. */
  public static class Keyword extends Tree {

    private final String name;
    private final Expression value;

    public Keyword(int position, String name, Expression value) {
      super(position);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.KEYWORD;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitKeyword(this, input);
    }

    public String name() {
      return name;
    }

    public Expression value() {
      return value;
    }
  }

  /** An attribute reference, {@code value.name}. */
  public static class Attribute extends Expression {

    private final Expression value;
    private final String name;

    public Attribute(int position, Expression value, String name) {
      super(position);
      this.value = requireNonNull(value);
      this.name = requireNonNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.ATTRIBUTE;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitAttribute(this, input);
    }

    public Expression value() {
      return value;
    }

    public String name() {
      return name;
    }
  }

  /** A subscript, {@code value[index]}. */
  public static class Subscript extends Expression {

    private final Expression value;
    private final Expression index;

    public Subscript(int position, Expression value, Expression index) {
      super(position);
      this.value = requireNonNull(value);
      this.index = requireNonNull(index);
    }

    @Override
    public Kind kind() {
      return Kind.SUBSCRIPT;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitSubscript(this, input);
    }

    public Expression value() {
      return value;
    }

    public Expression index() {
      return index;
    }
  }

  /** A positional parameter, {@code name [: type] [= default]}. */
  public static class Parameter extends Param {

    private final Optional<Expression> defaultValue;

    public Parameter(
        int position, String name, Optional<Type> annotation, Optional<Expression> defaultValue) {
      super(position, name, annotation);
      this.defaultValue = requireNonNull(defaultValue);
    }

    @Override
    public Kind kind() {
      return Kind.PARAMETER;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitParameter(this, input);
    }

    public Optional<Expression> defaultValue() {
      return defaultValue;
    }
  }

  /** A {@code *name} parameter. */
  public static class VarArgParameter extends Param {

    public VarArgParameter(int position, String name, Optional<Type> annotation) {
      super(position, name, annotation);
    }

    @Override
    public Kind kind() {
      return Kind.VAR_ARG_PARAMETER;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitVarArgParameter(this, input);
    }
  }

  /** A {@code **name} parameter. */
  public static class KwArgParameter extends Param {

    public KwArgParameter(int position, String name, Optional<Type> annotation) {
      super(position, name, annotation);
    }

    @Override
    public Kind kind() {
      return Kind.KW_ARG_PARAMETER;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitKwArgParameter(this, input);
    }
  }

  /** A named type, possibly dotted: {@code int}, {@code typing.Any}. */
  public static class SimpleType extends Type {

    private final String name;

    public SimpleType(int position, String name) {
      super(position);
      this.name = requireNonNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.SIMPLE_TYPE;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitSimpleType(this, input);
    }

    public String name() {
      return name;
    }
  }

  /** A parameterized type, {@code base[params...]}. */
  public static class GenericType extends Type {

    private final String base;
    private final ImmutableList<Type> params;

    public GenericType(int position, String base, ImmutableList<Type> params) {
      super(position);
      checkArgument(!params.isEmpty(), "generic type %s without parameters", base);
      this.base = requireNonNull(base);
      this.params = params;
    }

    @Override
    public Kind kind() {
      return Kind.GENERIC_TYPE;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitGenericType(this, input);
    }

    public String base() {
      return base;
    }

    public ImmutableList<Type> params() {
      return params;
    }
  }

  /** A function type, {@code paramType -> returnType}. */
  public static class FunctionType extends Type {

    private final Type paramType;
    private final Type returnType;

    public FunctionType(int position, Type paramType, Type returnType) {
      super(position);
      this.paramType = requireNonNull(paramType);
      this.returnType = requireNonNull(returnType);
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_TYPE;
    }

    @Override
    public <I, O> O accept(Visitor<I, O> visitor, I input) {
      return visitor.visitFunctionType(this, input);
    }

    public Type paramType() {
      return paramType;
    }

    public Type returnType() {
      return returnType;
    }
  }

  /** A visitor for {@link Tree}s. */
  public interface Visitor<I, O> {
    O visitProgram(Program program, I input);

    O visitFunctionDefinition(FunctionDefinition functionDefinition, I input);

    O visitClassDefinition(ClassDefinition classDefinition, I input);

    O visitIfStatement(IfStatement ifStatement, I input);

    O visitWhileStatement(WhileStatement whileStatement, I input);

    O visitForStatement(ForStatement forStatement, I input);

    O visitTryStatement(TryStatement tryStatement, I input);

    O visitExceptHandler(ExceptHandler exceptHandler, I input);

    O visitWithStatement(WithStatement withStatement, I input);

    O visitWithItem(WithItem withItem, I input);

    O visitMatchStatement(MatchStatement matchStatement, I input);

    O visitMatchCase(MatchCase matchCase, I input);

    O visitAssignment(Assignment assignment, I input);

    O visitReturnStatement(ReturnStatement returnStatement, I input);

    O visitRaiseStatement(RaiseStatement raiseStatement, I input);

    O visitBreakStatement(BreakStatement breakStatement, I input);

    O visitContinueStatement(ContinueStatement continueStatement, I input);

    O visitImportStatement(ImportStatement importStatement, I input);

    O visitImportFrom(ImportFrom importFrom, I input);

    O visitAlias(Alias alias, I input);

    O visitBinaryOp(BinaryOp binaryOp, I input);

    O visitUnaryOp(UnaryOp unaryOp, I input);

    O visitLiteral(Literal literal, I input);

    O visitIdentifier(Identifier identifier, I input);

    O visitListLiteral(ListLiteral listLiteral, I input);

    O visitCall(Call call, I input);

    O visitKeyword(Keyword keyword, I input);

    O visitAttribute(Attribute attribute, I input);

    O visitSubscript(Subscript subscript, I input);

    O visitParameter(Parameter parameter, I input);

    O visitVarArgParameter(VarArgParameter varArgParameter, I input);

    O visitKwArgParameter(KwArgParameter kwArgParameter, I input);

    O visitSimpleType(SimpleType simpleType, I input);

    O visitGenericType(GenericType genericType, I input);

    O visitFunctionType(FunctionType functionType, I input);
  }
}
