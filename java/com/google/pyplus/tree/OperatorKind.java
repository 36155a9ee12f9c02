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

/** An operator kind, with precedence. */
public enum OperatorKind {
  OR("or", Precedence.OR),
  AND("and", Precedence.AND),
  EQUAL("==", Precedence.EQUALITY),
  NOT_EQUAL("!=", Precedence.EQUALITY),
  IN("in", Precedence.EQUALITY),
  NOT_IN("not in", Precedence.EQUALITY),
  IS("is", Precedence.EQUALITY),
  IS_NOT("is not", Precedence.EQUALITY),
  LESS_THAN("<", Precedence.RELATIONAL),
  GREATER_THAN(">", Precedence.RELATIONAL),
  LESS_THAN_EQ("<=", Precedence.RELATIONAL),
  GREATER_THAN_EQ(">=", Precedence.RELATIONAL),
  BITWISE_OR("|", Precedence.BITWISE_OR),
  BITWISE_XOR("^", Precedence.BITWISE_XOR),
  BITWISE_AND("&", Precedence.BITWISE_AND),
  SHIFT_LEFT("<<", Precedence.SHIFT),
  SHIFT_RIGHT(">>", Precedence.SHIFT),
  PLUS("+", Precedence.ADDITIVE),
  MINUS("-", Precedence.ADDITIVE),
  MULT("*", Precedence.MULTIPLICATIVE),
  DIVIDE("/", Precedence.MULTIPLICATIVE),
  FLOOR_DIVIDE("//", Precedence.MULTIPLICATIVE),
  MODULO("%", Precedence.MULTIPLICATIVE),
  MATMUL("@", Precedence.MULTIPLICATIVE),
  POWER("**", Precedence.POWER),
  UNARY_PLUS("+", Precedence.UNARY),
  NEG("-", Precedence.UNARY),
  BITWISE_COMP("~", Precedence.UNARY),
  NOT("not", Precedence.UNARY);

  private final String symbol;
  private final Precedence prec;

  OperatorKind(String symbol, Precedence prec) {
    this.symbol = symbol;
    this.prec = prec;
  }

  /** The operator as written in source. */
  public String symbol() {
    return symbol;
  }

  public Precedence prec() {
    return prec;
  }

  /** Returns true for prefix operators. */
  public boolean isUnary() {
    return prec == Precedence.UNARY;
  }

  /** Returns true for operators that group right-to-left, i.e. {@code **}. */
  public boolean isRightAssociative() {
    return this == POWER;
  }

  @Override
  public String toString() {
    return symbol;
  }

  /**
   * Operator precedence groups, from loosest to tightest binding.
   *
   * <p>Prefix operators share the multiplicative rank: they are only ever reduced by an incoming
   * binary operator, so an equal rank already makes them bind tighter than {@code *} and looser
   * than {@code **}.
   */
  public enum Precedence {
    OR(1),
    AND(2),
    EQUALITY(3),
    RELATIONAL(4),
    BITWISE_OR(5),
    BITWISE_XOR(6),
    BITWISE_AND(7),
    SHIFT(8),
    ADDITIVE(9),
    MULTIPLICATIVE(10),
    UNARY(10),
    POWER(11);

    private final int rank;

    Precedence(int rank) {
      this.rank = rank;
    }

    public int rank() {
      return rank;
    }
  }
}
