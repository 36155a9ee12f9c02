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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.pyplus.diag.PyPlusError.ErrorKind;
import com.google.pyplus.diag.SourceFile;
import com.google.pyplus.diag.SyntaxError;
import com.google.pyplus.tree.OperatorKind;
import com.google.pyplus.tree.Tree;
import com.google.pyplus.tree.Tree.Assignment;
import com.google.pyplus.tree.Tree.BinaryOp;
import com.google.pyplus.tree.Tree.ClassDefinition;
import com.google.pyplus.tree.Tree.FunctionDefinition;
import com.google.pyplus.tree.Tree.ImportFrom;
import com.google.pyplus.tree.Tree.ImportStatement;
import com.google.pyplus.tree.Tree.MatchStatement;
import com.google.pyplus.tree.Tree.Program;
import com.google.pyplus.tree.Tree.RaiseStatement;
import com.google.pyplus.tree.Tree.ReturnStatement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParserTest {

  @Test
  public void empty() {
    Program program = Parser.parse("");
    assertThat(program.type()).isEqualTo("Program");
    assertThat(program.body()).isEmpty();
    assertThat(program.position()).isEqualTo(0);
  }

  @Test
  public void blankLinesAndComments() {
    Program program = Parser.parse("\n# comment\n\nx\n\n");
    assertThat(program.body()).hasSize(1);
  }

  @Test
  public void passProducesNothing() {
    assertThat(Parser.parse("pass\npass; pass\n").body()).isEmpty();
  }

  @Test
  public void semicolons() {
    Program program = Parser.parse("a = 1; b = 2\n");
    assertThat(program.body()).hasSize(2);
    assertThat(program.toString()).isEqualTo("a = 1\nb = 2\n");
  }

  @Test
  public void decorators() {
    String input =
        """
        @cache
        @app.route("/")
        def f():
            pass
        """;
    FunctionDefinition f = (FunctionDefinition) single(input);
    assertThat(f.decorators()).hasSize(2);
    assertThat(f.decorators().get(1).type()).isEqualTo("Call");
    assertThat(f.toString()).isEqualTo(input);
  }

  @Test
  public void decoratedClass() {
    ClassDefinition c = (ClassDefinition) single("@dataclass\n\nclass Point:\n    x: int = 0\n");
    assertThat(c.decorators()).hasSize(1);
    assertThat(c.body()).hasSize(1);
  }

  @Test
  public void decoratedAsync() {
    FunctionDefinition f = (FunctionDefinition) single("@d\nasync def f(): pass\n");
    assertThat(f.isAsync()).isTrue();
    assertThat(f.decorators()).hasSize(1);
  }

  @Test
  public void invalidDecoratorTarget() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("@d\nx = 1\n"));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_DECORATOR_TARGET);
    assertThat(e.line()).isEqualTo(2);
  }

  @Test
  public void asyncWithoutDef() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("async class A: pass"));
    assertThat(e.kind()).isEqualTo(ErrorKind.ASYNC_WITHOUT_DEF);
    assertThat(e.message()).isEqualTo("expected 'def' after 'async', got 'class'");
  }

  @Test
  public void imports() {
    ImportStatement statement = (ImportStatement) single("import os, a.b as c\n");
    assertThat(statement.names()).hasSize(2);
    assertThat(statement.names().get(1).name()).isEqualTo("a.b");
    assertThat(statement.names().get(1).asName()).hasValue("c");
    assertThat(statement.toString()).isEqualTo("import os, a.b as c");
  }

  @Test
  public void importFrom() {
    ImportFrom statement = (ImportFrom) single("from ..pkg.mod import (a, b as c,)\n");
    assertThat(statement.module()).isEqualTo("..pkg.mod");
    assertThat(statement.names()).hasSize(2);
    assertThat(statement.toString()).isEqualTo("from ..pkg.mod import a, b as c");
  }

  @Test
  public void importFromPackage() {
    ImportFrom statement = (ImportFrom) single("from . import x\n");
    assertThat(statement.module()).isEqualTo(".");
    assertThat(statement.names().get(0).name()).isEqualTo("x");
  }

  @Test
  public void importStar() {
    ImportFrom statement = (ImportFrom) single("from os.path import *\n");
    assertThat(statement.names().get(0).name()).isEqualTo("*");
    assertThat(statement.toString()).isEqualTo("from os.path import *");
  }

  @Test
  public void importRequiresName() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("import 1\n"));
    assertThat(e.message()).isEqualTo("expected module name, got number '1'");
  }

  @Test
  public void assignment() {
    Assignment assignment = (Assignment) single("x = y + 1\n");
    assertThat(assignment.type()).isEqualTo("Assignment");
    assertThat(assignment.target().name()).isEqualTo("x");
    assertThat(assignment.value().type()).isEqualTo("BinaryOp");
    assertThat(assignment.annotation()).isEmpty();
  }

  @Test
  public void annotatedAssignment() {
    Assignment assignment = (Assignment) single("x: List[int] = []\n");
    assertThat(assignment.annotation().get().type()).isEqualTo("GenericType");
    assertThat(assignment.value().type()).isEqualTo("ListLiteral");
    assertThat(assignment.toString()).isEqualTo("x: List[int] = []");
  }

  @Test
  public void annotationRequiresValue() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("x: int\n"));
    assertThat(e.message()).isEqualTo("expected '=', got newline");
  }

  @Test
  public void augmentedAssignment() {
    Assignment assignment = (Assignment) single("total //= 2\n");
    BinaryOp value = (BinaryOp) assignment.value();
    assertThat(value.operator()).isEqualTo(OperatorKind.FLOOR_DIVIDE);
    assertThat(assignment.toString()).isEqualTo("total = (total // 2)");
  }

  @Test
  public void invalidAssignmentTarget() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("y = 0\na.b = 1\n"));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ASSIGNMENT_TARGET);
    assertThat(e.line()).isEqualTo(2);
    assertThat(e.column()).isEqualTo(1);
  }

  @Test
  public void invalidAugmentedAssignmentTarget() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("f(x) += 1\n"));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ASSIGNMENT_TARGET);
  }

  @Test
  public void simpleStatements() {
    String input =
        """
        def f(x):
            while x:
                if x: break
                continue
            raise ValueError(x)
            return
        """;
    FunctionDefinition f = (FunctionDefinition) single(input);
    assertThat(f.body().stream().map(Tree::type))
        .containsExactly("WhileStatement", "RaiseStatement", "ReturnStatement")
        .inOrder();
    assertThat(((RaiseStatement) f.body().get(1)).exception()).isPresent();
    assertThat(((ReturnStatement) f.body().get(2)).value()).isEmpty();
    assertThat(f.toString()).isEqualTo(input.replace("if x: break", "if x:\n            break"));
  }

  @Test
  public void returnValue() {
    ReturnStatement statement = (ReturnStatement) single("return a\n");
    assertThat(statement.value().get().type()).isEqualTo("Identifier");
  }

  @Test
  public void clauseWithoutStatement() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("else: pass\n"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNEXPECTED_TOKEN);
    assertThat(e.message()).isEqualTo("unexpected token: 'else'");
  }

  @Test
  public void unexpectedIndent() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("x\n    y\n"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNEXPECTED_INDENT);
    assertThat(e.line()).isEqualTo(2);
  }

  @Test
  public void trailingTokens() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("x y\n"));
    assertThat(e.message()).isEqualTo("unexpected token: identifier 'y'");
    assertThat(e.column()).isEqualTo(3);
  }

  @Test
  public void cursorStopsAtEndOfInput() {
    Parser parser = new Parser(new SourceFile(null, "x"));
    assertThat(parser.peek(5).kind()).isEqualTo(TokenKind.EOF);
    parser.advance();
    parser.advance();
    parser.advance();
    assertThat(parser.check(TokenKind.EOF)).isTrue();
  }

  @Test
  public void consume() {
    Parser parser = new Parser(new SourceFile(null, "x"));
    SyntaxError e =
        assertThrows(SyntaxError.class, () -> parser.consume(TokenKind.DEF, "'def'"));
    assertThat(e.message()).isEqualTo("expected 'def', got identifier 'x'");
    assertThat(parser.consume(TokenKind.IDENTIFIER, "identifier").text()).isEqualTo("x");
    assertThat(parser.check(TokenKind.EOF)).isTrue();
  }

  @Test
  public void matchAndCaseAreIdentifiersOutsideMatchStatements() {
    Assignment call = (Assignment) single("m = re.match(p, s)\n");
    assertThat(call.toString()).isEqualTo("m = re.match(p, s)\n");

    Assignment assignment = (Assignment) single("match = 1\n");
    assertThat(assignment.target().name()).isEqualTo("match");

    FunctionDefinition f = (FunctionDefinition) single("def case(x): pass\n");
    assertThat(f.name()).isEqualTo("case");

    assertThat(single("match(x)\n").type()).isEqualTo("Call");
    assertThat(single("match: int = 1\n").type()).isEqualTo("Assignment");
  }

  @Test
  public void matchStatementWithSoftKeywords() {
    String input =
        """
        match (command):
            case 1:
                case = 2
        """;
    MatchStatement statement = (MatchStatement) single(input);
    assertThat(statement.subject().type()).isEqualTo("Identifier");
    assertThat(statement.cases()).hasSize(1);
    Assignment body = (Assignment) statement.cases().get(0).body().get(0);
    assertThat(body.target().name()).isEqualTo("case");
  }

  private static Tree single(String input) {
    Program program = Parser.parse(input);
    assertThat(program.body()).hasSize(1);
    return program.body().get(0);
  }
}
