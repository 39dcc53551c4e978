/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.vform.ast;

import com.google.common.base.CaseFormat;
import net.hydromatic.vform.compile.ArityException;

/** Kinds of {@link Core.Exp} node. The set is closed. */
public enum Op {
  // terminals
  ARGUMENT(Family.TERMINAL, "v"),
  COEFFICIENT(Family.TERMINAL, "w"),
  CONSTANT(Family.TERMINAL, ""),
  IDENTITY(Family.TERMINAL, "I"),
  ZERO(Family.TERMINAL, "0"),
  SPATIAL_COORDINATE(Family.TERMINAL, "x"),
  FACET_NORMAL(Family.TERMINAL, "n"),
  CELL_VOLUME(Family.TERMINAL, "volume"),
  CIRCUMRADIUS(Family.TERMINAL, "circumradius"),
  FACET_AREA(Family.TERMINAL, "facetarea"),
  LABEL(Family.TERMINAL, "l"),

  // algebra
  SUM(Family.ALGEBRA, 2, -1, " + ", 3, true),
  PRODUCT(Family.ALGEBRA, 2, -1, " * ", 4, true),
  DIVISION(Family.ALGEBRA, 2, 2, " / ", 4, false),
  POWER(Family.ALGEBRA, 2, 2, " ** ", 5, false),
  ABS(Family.ALGEBRA, 1),
  SIGN(Family.ALGEBRA, 1),
  SQRT(Family.ALGEBRA, 1),
  EXP(Family.ALGEBRA, 1),
  LN(Family.ALGEBRA, 1),
  SIN(Family.ALGEBRA, 1),
  COS(Family.ALGEBRA, 1),

  // tensor algebra
  INDEXED(Family.TENSOR, 1),
  COMPONENT_TENSOR(Family.TENSOR, 1),
  INDEX_SUM(Family.TENSOR, 1),
  LIST_TENSOR(Family.TENSOR, 1, -1),
  INNER(Family.TENSOR, 2),
  OUTER(Family.TENSOR, 2),
  DOT(Family.TENSOR, 2),
  CROSS(Family.TENSOR, 2),
  TRANSPOSED(Family.TENSOR, 1),
  TRACE(Family.TENSOR, 1),
  DETERMINANT(Family.TENSOR, 1),
  INVERSE(Family.TENSOR, 1),
  DEVIATORIC(Family.TENSOR, 1),

  // differential
  GRAD(Family.DIFFERENTIAL, 1),
  DIV(Family.DIFFERENTIAL, 1),
  CURL(Family.DIFFERENTIAL, 1),
  TIME_DERIVATIVE(Family.DIFFERENTIAL, 1),
  /** Gateaux derivative marker: integrand, coefficient, direction. */
  COEFFICIENT_DERIVATIVE(Family.DIFFERENTIAL, 3),
  /** Labelled expression: expression, label. */
  VARIABLE(Family.DIFFERENTIAL, 2),
  /** Derivative with respect to a variable: expression, variable. */
  VARIABLE_DERIVATIVE(Family.DIFFERENTIAL, 2),

  // conditions
  EQ(Family.CONDITION, 2, 2, " == ", 2, false),
  NE(Family.CONDITION, 2, 2, " != ", 2, false),
  LT(Family.CONDITION, 2, 2, " < ", 2, false),
  LE(Family.CONDITION, 2, 2, " <= ", 2, false),
  GT(Family.CONDITION, 2, 2, " > ", 2, false),
  GE(Family.CONDITION, 2, 2, " >= ", 2, false),
  AND(Family.CONDITION, 2, 2, " && ", 1, false),
  OR(Family.CONDITION, 2, 2, " || ", 0, false),
  NOT(Family.CONDITION, 1),
  CONDITIONAL(Family.CONDITION, 3),

  // compound
  POSITIVE_RESTRICTED(Family.COMPOUND, 1),
  NEGATIVE_RESTRICTED(Family.COMPOUND, 1),
  AVG(Family.COMPOUND, 1),
  JUMP(Family.COMPOUND, 1, 2);

  /** Group of related kinds. */
  public final Family family;
  /** Minimum number of operands. */
  public final int minArity;
  /** Maximum number of operands, or -1 if unbounded. */
  public final int maxArity;
  /** Whether the order of operands is immaterial. */
  public final boolean commutative;
  /** Padded infix name, e.g. " + ", or null if the operator is written
   * as a function call. */
  public final String padded;
  /** Function or terminal name, e.g. "grad", "v". */
  public final String opName;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op(Family family, String opName) {
    this(family, 0, 0, null, opName, 99, 99, false);
  }

  Op(Family family, int arity) {
    this(family, arity, arity);
  }

  Op(Family family, int minArity, int maxArity) {
    this(family, minArity, maxArity, null, null, 99, 99, false);
  }

  Op(Family family, int minArity, int maxArity, String padded,
      int precedence, boolean commutative) {
    this(family, minArity, maxArity, padded, null,
        precedence * 2, precedence * 2 + 1, commutative);
  }

  Op(Family family, int minArity, int maxArity, String padded, String opName,
      int left, int right, boolean commutative) {
    this.family = family;
    this.minArity = minArity;
    this.maxArity = maxArity;
    this.padded = padded;
    this.opName = opName != null
        ? opName
        : CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_UNDERSCORE, name());
    this.left = left;
    this.right = right;
    this.commutative = commutative;
  }

  /** Whether this is a terminal kind. */
  public boolean isTerminal() {
    return family == Family.TERMINAL;
  }

  /** Whether this is a comparison or logical operator, whose value is a
   * boolean rather than a number. */
  public boolean isCondition() {
    return family == Family.CONDITION && this != CONDITIONAL;
  }

  /** Whether this is one of the two restrictions. */
  public boolean isRestriction() {
    return this == POSITIVE_RESTRICTED || this == NEGATIVE_RESTRICTED;
  }

  /** Whether this is one of the scalar math functions sqrt, exp, ln, sin,
   * cos. */
  public boolean isMathFunction() {
    switch (this) {
    case SQRT:
    case EXP:
    case LN:
    case SIN:
    case COS:
      return true;
    default:
      return false;
    }
  }

  /** Checks that {@code n} is a valid number of operands.
   *
   * @throws ArityException if it is not */
  public void checkArity(int n) {
    if (n < minArity || maxArity >= 0 && n > maxArity) {
      final String expected =
          maxArity < 0 ? "at least " + minArity
              : minArity == maxArity ? Integer.toString(minArity)
              : minArity + " to " + maxArity;
      throw new ArityException(
          "expected " + expected + " operand(s), got " + n, this);
    }
  }

  /** Group of related kinds. */
  public enum Family {
    TERMINAL,
    ALGEBRA,
    TENSOR,
    DIFFERENTIAL,
    CONDITION,
    COMPOUND
  }
}

// End Op.java
