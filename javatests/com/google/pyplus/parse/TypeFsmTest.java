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

import com.google.pyplus.diag.SourceFile;
import com.google.pyplus.diag.SyntaxError;
import com.google.pyplus.tree.Tree.FunctionType;
import com.google.pyplus.tree.Tree.GenericType;
import com.google.pyplus.tree.Tree.SimpleType;
import com.google.pyplus.tree.Tree.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TypeFsmTest {

  @Test
  public void simple() {
    SimpleType type = (SimpleType) type("int");
    assertThat(type.name()).isEqualTo("int");
    assertThat(type.type()).isEqualTo("SimpleType");
  }

  @Test
  public void dottedName() {
    assertThat(((SimpleType) type("collections.abc.Mapping")).name())
        .isEqualTo("collections.abc.Mapping");
  }

  @Test
  public void none() {
    assertThat(((SimpleType) type("None")).name()).isEqualTo("None");
  }

  @Test
  public void generic() {
    GenericType type = (GenericType) type("Dict[str, List[int]]");
    assertThat(type.base()).isEqualTo("Dict");
    assertThat(type.params()).hasSize(2);
    assertThat(type.params().get(1).type()).isEqualTo("GenericType");
    assertThat(type.toString()).isEqualTo("Dict[str, List[int]]");
  }

  @Test
  public void dottedGeneric() {
    GenericType type = (GenericType) type("typing.Optional[None]");
    assertThat(type.base()).isEqualTo("typing.Optional");
    assertThat(((SimpleType) type.params().get(0)).name()).isEqualTo("None");
  }

  @Test
  public void functionType() {
    FunctionType type = (FunctionType) type("int -> str");
    assertThat(((SimpleType) type.paramType()).name()).isEqualTo("int");
    assertThat(((SimpleType) type.returnType()).name()).isEqualTo("str");
  }

  @Test
  public void functionTypesGroupToTheRight() {
    FunctionType type = (FunctionType) type("A -> B -> C");
    assertThat(type.paramType().type()).isEqualTo("SimpleType");
    assertThat(type.returnType().type()).isEqualTo("FunctionType");
    assertThat(type.toString()).isEqualTo("A -> B -> C");
  }

  @Test
  public void functionTypeParameter() {
    GenericType type = (GenericType) type("Callable[int -> str]");
    assertThat(type.params().get(0).type()).isEqualTo("FunctionType");
    assertThat(type.toString()).isEqualTo("Callable[int -> str]");
  }

  @Test
  public void stopsAtFollowingToken() {
    Parser parser = new Parser(new SourceFile(null, "List[int] = x"));
    Type type = parser.parseType();
    assertThat(type.toString()).isEqualTo("List[int]");
    assertThat(parser.peek().isOperator("=")).isTrue();
  }

  @Test
  public void position() {
    Parser parser = new Parser(new SourceFile(null, "Dict[str, int]"));
    GenericType type = (GenericType) parser.parseType();
    assertThat(type.position()).isEqualTo(0);
    assertThat(type.params().get(1).position()).isEqualTo(10);
  }

  @Test
  public void emptyParameters() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> type("List[]"));
    assertThat(e.message()).isEqualTo("expected type, got ']'");
  }

  @Test
  public void missingComma() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> type("Dict[str int]"));
    assertThat(e.message()).isEqualTo("expected ',' or ']', got identifier 'int'");
  }

  @Test
  public void unclosedParameters() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> type("List[int"));
    assertThat(e.message()).isEqualTo("expected ',' or ']', got end of input");
  }

  @Test
  public void trailingDot() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> type("typing."));
    assertThat(e.message()).isEqualTo("expected identifier, got end of input");
  }

  @Test
  public void notAType() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> type("42"));
    assertThat(e.message()).isEqualTo("expected type, got number '42'");
  }

  private static Type type(String input) {
    return new Parser(new SourceFile(null, input)).parseType();
  }
}
