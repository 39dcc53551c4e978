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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.vform.compile.ShapeInference;
import net.hydromatic.vform.compile.ShapeInference.Typing;
import net.hydromatic.vform.compile.ShapeMismatchException;
import net.hydromatic.vform.space.FunctionSpace;
import net.hydromatic.vform.space.Mesh;

/**
 * Builds {@link Core} nodes.
 *
 * <p>Every method validates arity, shapes and indices before it creates a
 * node, and throws a {@link net.hydromatic.vform.compile.FormException} if
 * they are invalid. Methods do not simplify; {@code sum(a, zero)} is a sum.
 */
public enum CoreBuilder {
  /** The singleton instance of the core builder. The short name is
   * convenient for use via 'import static'. */
  core;

  private final AtomicInteger nextCoefficientCount = new AtomicInteger();
  private final AtomicInteger nextLabelCount = new AtomicInteger();

  private final Core.Constant zeroConstant = new Core.Constant(BigDecimal.ZERO);
  private final Core.Constant oneConstant = new Core.Constant(BigDecimal.ONE);

  // terminals

  /** Creates an argument. */
  public Core.Argument argument(FunctionSpace space, int number) {
    return new Core.Argument(space, number);
  }

  /** Creates a test function, argument number 0. */
  public Core.Argument testFunction(FunctionSpace space) {
    return argument(space, 0);
  }

  /** Creates a trial function, argument number 1. */
  public Core.Argument trialFunction(FunctionSpace space) {
    return argument(space, 1);
  }

  /** Creates a coefficient with a new count. */
  public Core.Coefficient coefficient(FunctionSpace space) {
    return new Core.Coefficient(space,
        nextCoefficientCount.getAndIncrement());
  }

  /** Creates a coefficient with a given count. */
  public Core.Coefficient coefficient(FunctionSpace space, int count) {
    checkArgument(count >= 0, "negative count %s", count);
    return new Core.Coefficient(space, count);
  }

  /** Creates a scalar constant. */
  public Core.Constant constant(BigDecimal value) {
    if (value.signum() == 0) {
      return zeroConstant;
    }
    if (value.compareTo(BigDecimal.ONE) == 0) {
      return oneConstant;
    }
    return new Core.Constant(value);
  }

  /** Creates an integer constant. */
  public Core.Constant constant(long value) {
    return constant(BigDecimal.valueOf(value));
  }

  /** Creates a real constant. */
  public Core.Constant constant(double value) {
    checkArgument(Double.isFinite(value), "constant must be finite: %s",
        value);
    return constant(BigDecimal.valueOf(value));
  }

  public Core.Constant one() {
    return oneConstant;
  }

  /** Creates the identity matrix of a given dimension. */
  public Core.Identity identity(int dim) {
    checkArgument(dim > 0, "dimension must be positive: %s", dim);
    return new Core.Identity(dim);
  }

  /** Creates a zero of given shape, with no free indices. */
  public Core.Zero zero(Shape shape) {
    return new Core.Zero(shape, ImmutableSortedMap.of());
  }

  /** Creates a zero of given shape and free indices. */
  public Core.Zero zero(Shape shape, Map<Index, Integer> freeIndices) {
    return new Core.Zero(shape, ImmutableSortedMap.copyOf(freeIndices));
  }

  /** Creates a zero with the same shape and free indices as an
   * expression. */
  public Core.Zero zeroLike(Core.Exp e) {
    if (e.op == Op.ZERO) {
      return (Core.Zero) e;
    }
    return new Core.Zero(e.shape, e.freeIndices);
  }

  public Core.Geometric spatialCoordinate(Mesh mesh) {
    return new Core.Geometric(Op.SPATIAL_COORDINATE, mesh);
  }

  public Core.Geometric facetNormal(Mesh mesh) {
    return new Core.Geometric(Op.FACET_NORMAL, mesh);
  }

  public Core.Geometric cellVolume(Mesh mesh) {
    return new Core.Geometric(Op.CELL_VOLUME, mesh);
  }

  public Core.Geometric circumradius(Mesh mesh) {
    return new Core.Geometric(Op.CIRCUMRADIUS, mesh);
  }

  public Core.Geometric facetArea(Mesh mesh) {
    return new Core.Geometric(Op.FACET_AREA, mesh);
  }

  /** Creates a label with a new count. */
  public Core.Label label() {
    return new Core.Label(nextLabelCount.getAndIncrement());
  }

  /** Creates a label with a given count. */
  public Core.Label label(int count) {
    return new Core.Label(count);
  }

  // algebra

  public Core.Exp sum(Core.Exp... operands) {
    return sum(ImmutableList.copyOf(operands));
  }

  public Core.Exp sum(List<? extends Core.Exp> operands) {
    return operator(Op.SUM, operands);
  }

  /** Creates {@code a - b}. */
  public Core.Exp minus(Core.Exp a, Core.Exp b) {
    return sum(a, negate(b));
  }

  /** Creates {@code -1 * a}. */
  public Core.Exp negate(Core.Exp a) {
    return product(constant(-1), a);
  }

  public Core.Exp product(Core.Exp... operands) {
    return product(ImmutableList.copyOf(operands));
  }

  public Core.Exp product(List<? extends Core.Exp> operands) {
    return operator(Op.PRODUCT, operands);
  }

  public Core.Exp division(Core.Exp numerator, Core.Exp denominator) {
    return operator(Op.DIVISION, ImmutableList.of(numerator, denominator));
  }

  public Core.Exp power(Core.Exp base, Core.Exp exponent) {
    return operator(Op.POWER, ImmutableList.of(base, exponent));
  }

  public Core.Exp abs(Core.Exp a) {
    return operator(Op.ABS, ImmutableList.of(a));
  }

  public Core.Exp sign(Core.Exp a) {
    return operator(Op.SIGN, ImmutableList.of(a));
  }

  public Core.Exp sqrt(Core.Exp a) {
    return operator(Op.SQRT, ImmutableList.of(a));
  }

  public Core.Exp exp(Core.Exp a) {
    return operator(Op.EXP, ImmutableList.of(a));
  }

  public Core.Exp ln(Core.Exp a) {
    return operator(Op.LN, ImmutableList.of(a));
  }

  public Core.Exp sin(Core.Exp a) {
    return operator(Op.SIN, ImmutableList.of(a));
  }

  public Core.Exp cos(Core.Exp a) {
    return operator(Op.COS, ImmutableList.of(a));
  }

  // tensor algebra

  public Core.Indexed indexed(Core.Exp a, IndexBase... indices) {
    return indexed(a, ImmutableList.copyOf(indices));
  }

  public Core.Indexed indexed(Core.Exp a, List<? extends IndexBase> indices) {
    final ImmutableList<IndexBase> list = ImmutableList.copyOf(indices);
    final Typing typing = ShapeInference.indexed(a, list);
    return new Core.Indexed(a, list, typing.freeIndices);
  }

  public Core.ComponentTensor componentTensor(Core.Exp a, Index... indices) {
    return componentTensor(a, ImmutableList.copyOf(indices));
  }

  public Core.ComponentTensor componentTensor(Core.Exp a,
      List<Index> indices) {
    final ImmutableList<Index> list = ImmutableList.copyOf(indices);
    final Typing typing = ShapeInference.componentTensor(a, list);
    return new Core.ComponentTensor(a, list, typing.shape, typing.freeIndices);
  }

  public Core.IndexSum indexSum(Core.Exp a, Index index) {
    final Typing typing = ShapeInference.indexSum(a, index);
    final int dimension = a.freeIndices.get(index);
    return new Core.IndexSum(a, index, dimension, typing.freeIndices);
  }

  public Core.Exp listTensor(Core.Exp... operands) {
    return listTensor(ImmutableList.copyOf(operands));
  }

  public Core.Exp listTensor(List<? extends Core.Exp> operands) {
    return operator(Op.LIST_TENSOR, operands);
  }

  public Core.Exp inner(Core.Exp a, Core.Exp b) {
    return operator(Op.INNER, ImmutableList.of(a, b));
  }

  public Core.Exp outer(Core.Exp a, Core.Exp b) {
    return operator(Op.OUTER, ImmutableList.of(a, b));
  }

  public Core.Exp dot(Core.Exp a, Core.Exp b) {
    return operator(Op.DOT, ImmutableList.of(a, b));
  }

  public Core.Exp cross(Core.Exp a, Core.Exp b) {
    return operator(Op.CROSS, ImmutableList.of(a, b));
  }

  public Core.Exp transposed(Core.Exp a) {
    return operator(Op.TRANSPOSED, ImmutableList.of(a));
  }

  public Core.Exp trace(Core.Exp a) {
    return operator(Op.TRACE, ImmutableList.of(a));
  }

  public Core.Exp determinant(Core.Exp a) {
    return operator(Op.DETERMINANT, ImmutableList.of(a));
  }

  public Core.Exp inverse(Core.Exp a) {
    return operator(Op.INVERSE, ImmutableList.of(a));
  }

  public Core.Exp deviatoric(Core.Exp a) {
    return operator(Op.DEVIATORIC, ImmutableList.of(a));
  }

  // differential

  /** Creates a spatial gradient. The geometric dimension comes from the
   * domain of the operand. */
  public Core.Grad grad(Core.Exp a) {
    return grad(a, ShapeInference.geometricDimension(Op.GRAD, a));
  }

  /** Creates a spatial gradient with a given geometric dimension. */
  public Core.Grad grad(Core.Exp a, int dim) {
    checkArgument(dim > 0, "dimension must be positive: %s", dim);
    if (a.op.isCondition()) {
      throw new ShapeMismatchException(
          "condition " + a.op + " cannot be an operand", Op.GRAD);
    }
    return new Core.Grad(a, dim);
  }

  public Core.Exp div(Core.Exp a) {
    return operator(Op.DIV, ImmutableList.of(a));
  }

  public Core.Exp curl(Core.Exp a) {
    return operator(Op.CURL, ImmutableList.of(a));
  }

  public Core.Exp timeDerivative(Core.Exp a) {
    return operator(Op.TIME_DERIVATIVE, ImmutableList.of(a));
  }

  /** Creates a marker for the Gateaux derivative of {@code integrand} with
   * respect to {@code coefficient} in a given direction. */
  public Core.Exp coefficientDerivative(Core.Exp integrand,
      Core.Exp coefficient, Core.Exp direction) {
    return operator(Op.COEFFICIENT_DERIVATIVE,
        ImmutableList.of(integrand, coefficient, direction));
  }

  /** Creates a variable with a new label. */
  public Core.Exp variable(Core.Exp e) {
    return variable(e, label());
  }

  public Core.Exp variable(Core.Exp e, Core.Label label) {
    return operator(Op.VARIABLE, ImmutableList.of(e, label));
  }

  /** Creates a marker for the derivative of {@code f} with respect to a
   * variable. */
  public Core.Exp variableDerivative(Core.Exp f, Core.Exp variable) {
    return operator(Op.VARIABLE_DERIVATIVE, ImmutableList.of(f, variable));
  }

  // conditions

  /** Creates a comparison or logical operator. */
  public Core.Exp condition(Op op, Core.Exp a, Core.Exp b) {
    checkArgument(op.isCondition() && op != Op.NOT, "not a binary condition: "
        + op);
    return operator(op, ImmutableList.of(a, b));
  }

  public Core.Exp eq(Core.Exp a, Core.Exp b) {
    return condition(Op.EQ, a, b);
  }

  public Core.Exp lt(Core.Exp a, Core.Exp b) {
    return condition(Op.LT, a, b);
  }

  public Core.Exp gt(Core.Exp a, Core.Exp b) {
    return condition(Op.GT, a, b);
  }

  public Core.Exp and(Core.Exp a, Core.Exp b) {
    return condition(Op.AND, a, b);
  }

  public Core.Exp or(Core.Exp a, Core.Exp b) {
    return condition(Op.OR, a, b);
  }

  public Core.Exp not(Core.Exp a) {
    return operator(Op.NOT, ImmutableList.of(a));
  }

  public Core.Exp conditional(Core.Exp condition, Core.Exp ifTrue,
      Core.Exp ifFalse) {
    return operator(Op.CONDITIONAL,
        ImmutableList.of(condition, ifTrue, ifFalse));
  }

  // compound

  /** Creates the restriction of an expression to one side of an interior
   * facet. */
  public Core.Exp restricted(Op side, Core.Exp a) {
    checkArgument(side.isRestriction(), "not a restriction: %s", side);
    return operator(side, ImmutableList.of(a));
  }

  /** Restriction to the '+' side. */
  public Core.Exp plusSide(Core.Exp a) {
    return restricted(Op.POSITIVE_RESTRICTED, a);
  }

  /** Restriction to the '-' side. */
  public Core.Exp minusSide(Core.Exp a) {
    return restricted(Op.NEGATIVE_RESTRICTED, a);
  }

  public Core.Exp avg(Core.Exp a) {
    return operator(Op.AVG, ImmutableList.of(a));
  }

  public Core.Exp jump(Core.Exp a) {
    return operator(Op.JUMP, ImmutableList.of(a));
  }

  public Core.Exp jump(Core.Exp a, Core.Exp normal) {
    return operator(Op.JUMP, ImmutableList.of(a, normal));
  }

  // generic

  /** Creates a node of a kind that has no metadata. Checks the number of
   * operands before anything else. */
  public Core.Exp apply(Op op, List<? extends Core.Exp> operands) {
    op.checkArity(operands.size());
    switch (op) {
    case GRAD:
      return grad(operands.get(0));
    case INDEXED:
    case COMPONENT_TENSOR:
    case INDEX_SUM:
      throw new IllegalArgumentException("kind " + op + " requires indices");
    default:
      if (op.isTerminal()) {
        throw new IllegalArgumentException("kind " + op + " is a terminal");
      }
      return operator(op, operands);
    }
  }

  /** Creates a node with the same kind and metadata as an existing node, but
   * different operands. */
  public Core.Exp reconstruct(Core.Exp e, List<? extends Core.Exp> operands) {
    switch (e.op) {
    case INDEXED:
      return indexed(operands.get(0), ((Core.Indexed) e).indices);
    case COMPONENT_TENSOR:
      return componentTensor(operands.get(0),
          ((Core.ComponentTensor) e).indices);
    case INDEX_SUM:
      return indexSum(operands.get(0), ((Core.IndexSum) e).index);
    case GRAD:
      e.op.checkArity(operands.size());
      return grad(operands.get(0), ((Core.Grad) e).dim);
    default:
      if (e.op.isTerminal()) {
        checkArgument(operands.isEmpty(), "terminal has no operands");
        return e;
      }
      return operator(e.op, operands);
    }
  }

  private Core.Exp operator(Op op, List<? extends Core.Exp> operands) {
    final ImmutableList<Core.Exp> list = ImmutableList.copyOf(operands);
    final Typing typing = ShapeInference.infer(op, list);
    return new Core.Operator(op, list, typing.shape, typing.freeIndices);
  }
}

// End CoreBuilder.java
