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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Function that computes a value for each kind of expression node, given the
 * values already computed for its operands.
 *
 * <p>There is one method per kind (or per group of kinds that share a
 * signature, such as the math functions). An implementation must handle every
 * kind; extend {@link DefaultExprFunction} to fall back to a default.
 *
 * <p>Use {@link Traversals#map} to apply a function to an expression tree.
 *
 * @param <R> Result type
 */
public interface ExprFunction<R> {
  /** Whether the traversal should not visit the operands of a node. If this
   * method returns true, the handler receives null for every operand
   * result. */
  default boolean isCutoff(Core.Exp e) {
    return false;
  }

  R argument(Core.Argument e);

  R coefficient(Core.Coefficient e);

  R constant(Core.Constant e);

  R identity(Core.Identity e);

  R zero(Core.Zero e);

  R geometric(Core.Geometric e);

  R label(Core.Label e);

  R sum(Core.Exp e, List<R> operands);

  R product(Core.Exp e, List<R> operands);

  R division(Core.Exp e, R numerator, R denominator);

  R power(Core.Exp e, R base, R exponent);

  R abs(Core.Exp e, R operand);

  R sign(Core.Exp e, R operand);

  /** Handles sqrt, exp, ln, sin and cos. */
  R mathFunction(Core.Exp e, R operand);

  R indexed(Core.Indexed e, R operand);

  R componentTensor(Core.ComponentTensor e, R operand);

  R indexSum(Core.IndexSum e, R operand);

  R listTensor(Core.Exp e, List<R> operands);

  R inner(Core.Exp e, R a, R b);

  R outer(Core.Exp e, R a, R b);

  R dot(Core.Exp e, R a, R b);

  R cross(Core.Exp e, R a, R b);

  R transposed(Core.Exp e, R a);

  R trace(Core.Exp e, R a);

  R determinant(Core.Exp e, R a);

  R inverse(Core.Exp e, R a);

  R deviatoric(Core.Exp e, R a);

  R grad(Core.Grad e, R operand);

  R div(Core.Exp e, R operand);

  R curl(Core.Exp e, R operand);

  R timeDerivative(Core.Exp e, R operand);

  R coefficientDerivative(Core.Exp e, R integrand, R coefficient,
      R direction);

  R variable(Core.Exp e, R expression, R label);

  R variableDerivative(Core.Exp e, R f, R variable);

  /** Handles the comparisons and the binary logical operators. */
  R condition(Core.Exp e, R left, R right);

  R not(Core.Exp e, R operand);

  R conditional(Core.Exp e, R condition, R ifTrue, R ifFalse);

  /** Handles both restrictions. */
  R restricted(Core.Exp e, R operand);

  R avg(Core.Exp e, R operand);

  R jump(Core.Exp e, List<R> operands);

  /** Calls the handler for the kind of {@code e}. */
  default R apply(Core.Exp e, List<@Nullable R> operands) {
    switch (e.op) {
    case ARGUMENT:
      return argument((Core.Argument) e);
    case COEFFICIENT:
      return coefficient((Core.Coefficient) e);
    case CONSTANT:
      return constant((Core.Constant) e);
    case IDENTITY:
      return identity((Core.Identity) e);
    case ZERO:
      return zero((Core.Zero) e);
    case SPATIAL_COORDINATE:
    case FACET_NORMAL:
    case CELL_VOLUME:
    case CIRCUMRADIUS:
    case FACET_AREA:
      return geometric((Core.Geometric) e);
    case LABEL:
      return label((Core.Label) e);
    case SUM:
      return sum(e, operands);
    case PRODUCT:
      return product(e, operands);
    case DIVISION:
      return division(e, operands.get(0), operands.get(1));
    case POWER:
      return power(e, operands.get(0), operands.get(1));
    case ABS:
      return abs(e, operands.get(0));
    case SIGN:
      return sign(e, operands.get(0));
    case SQRT:
    case EXP:
    case LN:
    case SIN:
    case COS:
      return mathFunction(e, operands.get(0));
    case INDEXED:
      return indexed((Core.Indexed) e, operands.get(0));
    case COMPONENT_TENSOR:
      return componentTensor((Core.ComponentTensor) e, operands.get(0));
    case INDEX_SUM:
      return indexSum((Core.IndexSum) e, operands.get(0));
    case LIST_TENSOR:
      return listTensor(e, operands);
    case INNER:
      return inner(e, operands.get(0), operands.get(1));
    case OUTER:
      return outer(e, operands.get(0), operands.get(1));
    case DOT:
      return dot(e, operands.get(0), operands.get(1));
    case CROSS:
      return cross(e, operands.get(0), operands.get(1));
    case TRANSPOSED:
      return transposed(e, operands.get(0));
    case TRACE:
      return trace(e, operands.get(0));
    case DETERMINANT:
      return determinant(e, operands.get(0));
    case INVERSE:
      return inverse(e, operands.get(0));
    case DEVIATORIC:
      return deviatoric(e, operands.get(0));
    case GRAD:
      return grad((Core.Grad) e, operands.get(0));
    case DIV:
      return div(e, operands.get(0));
    case CURL:
      return curl(e, operands.get(0));
    case TIME_DERIVATIVE:
      return timeDerivative(e, operands.get(0));
    case COEFFICIENT_DERIVATIVE:
      return coefficientDerivative(e, operands.get(0), operands.get(1),
          operands.get(2));
    case VARIABLE:
      return variable(e, operands.get(0), operands.get(1));
    case VARIABLE_DERIVATIVE:
      return variableDerivative(e, operands.get(0), operands.get(1));
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
    case AND:
    case OR:
      return condition(e, operands.get(0), operands.get(1));
    case NOT:
      return not(e, operands.get(0));
    case CONDITIONAL:
      return conditional(e, operands.get(0), operands.get(1),
          operands.get(2));
    case POSITIVE_RESTRICTED:
    case NEGATIVE_RESTRICTED:
      return restricted(e, operands.get(0));
    case AVG:
      return avg(e, operands.get(0));
    case JUMP:
      return jump(e, operands);
    default:
      throw new AssertionError("unknown kind " + e.op);
    }
  }
}

// End ExprFunction.java
