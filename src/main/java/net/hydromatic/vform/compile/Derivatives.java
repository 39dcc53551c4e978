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
package net.hydromatic.vform.compile;

import static net.hydromatic.vform.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.ExprFunction;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.ReuseTransformer;
import net.hydromatic.vform.ast.Shape;
import net.hydromatic.vform.ast.Traversals;
import net.hydromatic.vform.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic differentiation.
 *
 * <p>{@link #resolve(Core.Exp)} replaces every derivative marker in an
 * expression (Gateaux derivative, gradient, divergence, curl, derivative
 * with respect to a variable) by its value. Markers are resolved innermost
 * first, so when a ruleset is applied to an operand, the operand contains no
 * unresolved markers. After resolution, every gradient is applied to a
 * terminal (or to a gradient or time derivative of a terminal).
 *
 * <p>The result is not simplified. Call {@link Simplifier} afterwards.
 */
public final class Derivatives {
  private Derivatives() {}

  /** Resolves every derivative marker in an expression. */
  public static Core.Exp resolve(Core.Exp e) {
    return Traversals.map(e, new DerivativeResolver());
  }

  /** Returns the Gateaux derivative of an expression, which must contain no
   * derivative markers, with respect to a coefficient in a direction. */
  public static Core.Exp gateaux(Core.Exp f, Core.Coefficient coefficient,
      Core.Exp direction) {
    return new GateauxRuleset(coefficient, direction).apply(f);
  }

  /** Returns the spatial gradient of an expression, which must contain no
   * derivative markers. */
  public static Core.Exp grad(Core.Exp f, int dim) {
    return new GradRuleset(dim).apply(f);
  }

  /** Returns the derivative of an expression, which must contain no
   * derivative markers, with respect to a variable. */
  public static Core.Exp variableDerivative(Core.Exp f, Core.Exp variable) {
    return new VariableRuleset(variable).apply(f);
  }

  /** Resolves derivative markers, innermost first. */
  private static class DerivativeResolver extends ReuseTransformer {
    @Override
    public Core.Exp grad(Core.Grad e, Core.Exp operand) {
      return Derivatives.grad(operand, e.dim);
    }

    @Override
    public Core.Exp div(Core.Exp e, Core.Exp operand) {
      return Traversals.map(CompoundLowering.lowerNode(e.copy(
          ImmutableList.of(operand))), this);
    }

    @Override
    public Core.Exp curl(Core.Exp e, Core.Exp operand) {
      return Traversals.map(CompoundLowering.lowerNode(e.copy(
          ImmutableList.of(operand))), this);
    }

    @Override
    public Core.Exp coefficientDerivative(Core.Exp e, Core.Exp integrand,
        Core.Exp coefficient, Core.Exp direction) {
      return gateaux(integrand, (Core.Coefficient) coefficient, direction);
    }

    @Override
    public Core.Exp variableDerivative(Core.Exp e, Core.Exp f,
        Core.Exp variable) {
      return Derivatives.variableDerivative(f, variable);
    }
  }

  /** Rules for differentiating each kind of expression.
   *
   * <p>The derivative of an expression {@code e} has shape
   * {@code e.shape + varShape} and the same free indices as {@code e}.
   * Handlers receive the derivatives of the operands; conditions have no
   * derivative, and their handlers return null. Handlers that need the
   * derivative of some other expression call {@link #apply}. */
  abstract static class DerivativeRuleset implements ExprFunction<Core.Exp> {
    /** Shape of the variable of differentiation. */
    final Shape varShape;
    private final Traversals.Mapper<Core.Exp> mapper;

    DerivativeRuleset(Shape varShape) {
      this.varShape = varShape;
      this.mapper = Traversals.mapper(this);
    }

    /** Returns the derivative of an expression. */
    Core.Exp apply(Core.Exp e) {
      return mapper.apply(e);
    }

    /** Returns the zero derivative of an expression. */
    Core.Exp zeroDerivative(Core.Exp e) {
      return core.zero(e.shape.concat(varShape), e.freeIndices);
    }

    static boolean isZero(Core.@Nullable Exp e) {
      return e == null || Simplifier.isZero(e);
    }

    /** Returns the sum of the non-zero terms, or the zero derivative of
     * {@code e}. */
    Core.Exp sumNonZero(Core.Exp e, List<Core.Exp> terms) {
      final List<Core.Exp> list = new ArrayList<>();
      for (Core.Exp term : terms) {
        if (!isZero(term)) {
          list.add(term);
        }
      }
      switch (list.size()) {
      case 0:
        return zeroDerivative(e);
      case 1:
        return list.get(0);
      default:
        return core.sum(list);
      }
    }

    /** Returns the derivative of a compound operator, by lowering it into
     * simpler operators. */
    Core.Exp lowered(Core.Exp e) {
      return apply(CompoundLowering.lowerNode(e));
    }

    /** Returns the product of an expression with the derivative of a true
     * scalar: {@code a * db} if the variable is scalar, otherwise
     * {@code outer(a, db)}. */
    Core.Exp scale(Core.Exp a, Core.Exp db) {
      return varShape.isScalar() ? core.product(a, db)
          : CompoundLowering.outer(a, db);
    }

    // terminals

    @Override
    public Core.Exp constant(Core.Constant e) {
      return zeroDerivative(e);
    }

    @Override
    public Core.Exp identity(Core.Identity e) {
      return zeroDerivative(e);
    }

    @Override
    public Core.Exp zero(Core.Zero e) {
      return zeroDerivative(e);
    }

    @Override
    public Core.@Nullable Exp label(Core.Label e) {
      return null;
    }

    // algebra

    @Override
    public Core.Exp sum(Core.Exp e, List<Core.Exp> operands) {
      return sumNonZero(e, operands);
    }

    @Override
    public Core.Exp product(Core.Exp e, List<Core.Exp> operands) {
      final List<Core.Exp> terms = new ArrayList<>();
      for (int k = 0; k < operands.size(); k++) {
        if (!isZero(operands.get(k))) {
          terms.add(productTerm(e, k, operands.get(k)));
        }
      }
      return sumNonZero(e, terms);
    }

    /** Returns the term of the product rule in which factor {@code k} is
     * replaced by its derivative. */
    private Core.Exp productTerm(Core.Exp e, int k, Core.Exp dk) {
      if (varShape.isScalar()) {
        return core.product(Static.replace(e.operands, k, dk));
      }
      final List<Index> tt = Index.create(e.rank());
      final List<Index> kk = Index.create(varShape.rank());
      final List<Core.Exp> factors = new ArrayList<>();
      for (int j = 0; j < e.operands.size(); j++) {
        final Core.Exp operand = e.operand(j);
        final List<Index> own = operand.rank() == 0 ? ImmutableList.of() : tt;
        if (j == k) {
          factors.add(CompoundLowering.index(dk, Static.concat(own, kk)));
        } else {
          factors.add(CompoundLowering.index(operand, own));
        }
      }
      return CompoundLowering.asTensor(core.product(factors),
          Static.concat(tt, kk));
    }

    @Override
    public Core.Exp division(Core.Exp e, Core.Exp numerator,
        Core.Exp denominator) {
      final Core.Exp f = e.operand(0);
      final Core.Exp g = e.operand(1);
      if (isZero(denominator)) {
        return isZero(numerator) ? zeroDerivative(e)
            : core.division(numerator, g);
      }
      // d(f/g) = (df - f/g * dg) / g
      final Core.Exp second = scale(core.division(f, g), denominator);
      return core.division(
          isZero(numerator) ? core.negate(second)
              : core.minus(numerator, second),
          g);
    }

    @Override
    public Core.Exp power(Core.Exp e, Core.Exp base, Core.Exp exponent) {
      final Core.Exp f = e.operand(0);
      final Core.Exp g = e.operand(1);
      final List<Core.Exp> terms = new ArrayList<>();
      if (!isZero(base)) {
        terms.add(
            core.product(g, core.power(f, core.minus(g, core.one())), base));
      }
      if (!isZero(exponent)) {
        terms.add(core.product(e, core.ln(f), exponent));
      }
      return sumNonZero(e, terms);
    }

    @Override
    public Core.Exp abs(Core.Exp e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      return core.product(core.sign(e.operand(0)), operand);
    }

    @Override
    public Core.Exp sign(Core.Exp e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      throw new DifferentiationException("sign is not differentiable at 0; "
          + "operand " + e.operand(0) + " depends on the variable", e.op);
    }

    @Override
    public Core.Exp mathFunction(Core.Exp e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      final Core.Exp f = e.operand(0);
      switch (e.op) {
      case SQRT:
        return core.division(operand, core.product(core.constant(2), e));
      case EXP:
        return core.product(e, operand);
      case LN:
        return core.division(operand, f);
      case SIN:
        return core.product(core.cos(f), operand);
      case COS:
        return core.negate(core.product(core.sin(f), operand));
      default:
        throw new AssertionError(e.op);
      }
    }

    // tensor algebra

    @Override
    public Core.Exp indexed(Core.Indexed e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      final List<Index> kk = Index.create(varShape.rank());
      return CompoundLowering.asTensor(
          core.indexed(operand, Static.concat(e.indices, kk)), kk);
    }

    @Override
    public Core.Exp componentTensor(Core.ComponentTensor e,
        Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      final List<Index> kk = Index.create(varShape.rank());
      return core.componentTensor(CompoundLowering.index(operand, kk),
          Static.concat(e.indices, kk));
    }

    @Override
    public Core.Exp indexSum(Core.IndexSum e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      return core.indexSum(operand, e.index);
    }

    @Override
    public Core.Exp listTensor(Core.Exp e, List<Core.Exp> operands) {
      boolean allZero = true;
      for (Core.Exp operand : operands) {
        allZero &= isZero(operand);
      }
      return allZero ? zeroDerivative(e) : core.listTensor(operands);
    }

    @Override
    public Core.Exp inner(Core.Exp e, Core.Exp a, Core.Exp b) {
      return lowered(e);
    }

    @Override
    public Core.Exp outer(Core.Exp e, Core.Exp a, Core.Exp b) {
      return lowered(e);
    }

    @Override
    public Core.Exp dot(Core.Exp e, Core.Exp a, Core.Exp b) {
      return lowered(e);
    }

    @Override
    public Core.Exp cross(Core.Exp e, Core.Exp a, Core.Exp b) {
      return lowered(e);
    }

    @Override
    public Core.Exp transposed(Core.Exp e, Core.Exp a) {
      return lowered(e);
    }

    @Override
    public Core.Exp trace(Core.Exp e, Core.Exp a) {
      return lowered(e);
    }

    @Override
    public Core.Exp determinant(Core.Exp e, Core.Exp a) {
      return lowered(e);
    }

    @Override
    public Core.Exp inverse(Core.Exp e, Core.Exp a) {
      return lowered(e);
    }

    @Override
    public Core.Exp deviatoric(Core.Exp e, Core.Exp a) {
      return lowered(e);
    }

    // differential

    @Override
    public Core.Exp div(Core.Exp e, Core.Exp operand) {
      return lowered(e);
    }

    @Override
    public Core.Exp curl(Core.Exp e, Core.Exp operand) {
      return lowered(e);
    }

    @Override
    public Core.Exp coefficientDerivative(Core.Exp e, Core.Exp integrand,
        Core.Exp coefficient, Core.Exp direction) {
      throw new DifferentiationException("nested derivative must be "
          + "resolved before the enclosing derivative", e.op);
    }

    @Override
    public Core.Exp variableDerivative(Core.Exp e, Core.Exp f,
        Core.Exp variable) {
      throw new DifferentiationException("nested derivative must be "
          + "resolved before the enclosing derivative", e.op);
    }

    @Override
    public Core.Exp variable(Core.Exp e, Core.Exp expression,
        Core.Exp label) {
      return expression;
    }

    // conditions

    @Override
    public Core.@Nullable Exp condition(Core.Exp e, Core.Exp left,
        Core.Exp right) {
      return null;
    }

    @Override
    public Core.@Nullable Exp not(Core.Exp e, Core.Exp operand) {
      return null;
    }

    @Override
    public Core.Exp conditional(Core.Exp e, Core.Exp condition,
        Core.Exp ifTrue, Core.Exp ifFalse) {
      if (isZero(ifTrue) && isZero(ifFalse)) {
        return zeroDerivative(e);
      }
      return core.conditional(e.operand(0), ifTrue, ifFalse);
    }

    // compound

    @Override
    public Core.Exp restricted(Core.Exp e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      return core.restricted(e.op, operand);
    }

    @Override
    public Core.Exp avg(Core.Exp e, Core.Exp operand) {
      return lowered(e);
    }

    @Override
    public Core.Exp jump(Core.Exp e, List<Core.Exp> operands) {
      return lowered(e);
    }
  }

  /** Rules for the Gateaux derivative with respect to a coefficient, in a
   * direction. The variable is scalar; the direction has the shape of the
   * coefficient. */
  static class GateauxRuleset extends DerivativeRuleset {
    private final Core.Coefficient coefficient;
    private final Core.Exp direction;

    GateauxRuleset(Core.Coefficient coefficient, Core.Exp direction) {
      super(Shape.SCALAR);
      this.coefficient = coefficient;
      this.direction = direction;
    }

    @Override
    public boolean isCutoff(Core.Exp e) {
      return e.op == Op.GRAD;
    }

    @Override
    public Core.Exp argument(Core.Argument e) {
      return zeroDerivative(e);
    }

    @Override
    public Core.Exp coefficient(Core.Coefficient e) {
      return e.equals(coefficient) ? direction : zeroDerivative(e);
    }

    @Override
    public Core.Exp geometric(Core.Geometric e) {
      return zeroDerivative(e);
    }

    /** The derivative of {@code grad(grad(f))} is {@code grad(grad(df))}.
     * The gradients of the direction are resolved, because the direction
     * may be an expression. */
    @Override
    public Core.Exp grad(Core.Grad e, Core.Exp operand) {
      final List<Integer> dims = new ArrayList<>();
      Core.Exp o = e;
      while (o.op == Op.GRAD) {
        dims.add(0, ((Core.Grad) o).dim);
        o = o.operand(0);
      }
      if (!o.isTerminal() && o.op != Op.TIME_DERIVATIVE) {
        throw new DifferentiationException("expected gradient of a "
            + "terminal, got gradient of " + o.op, e.op);
      }
      Core.Exp d = apply(o);
      if (isZero(d)) {
        return zeroDerivative(e);
      }
      for (int dim : dims) {
        d = Derivatives.grad(d, dim);
      }
      return d;
    }

    @Override
    public Core.Exp timeDerivative(Core.Exp e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      return core.timeDerivative(operand);
    }

    @Override
    public Core.Exp inner(Core.Exp e, Core.Exp da, Core.Exp db) {
      final Core.Exp a = e.operand(0);
      final Core.Exp b = e.operand(1);
      return sumNonZero(e, bilinear(
          isZero(da) ? null : core.inner(da, b),
          isZero(db) ? null : core.inner(a, db)));
    }

    @Override
    public Core.Exp outer(Core.Exp e, Core.Exp da, Core.Exp db) {
      final Core.Exp a = e.operand(0);
      final Core.Exp b = e.operand(1);
      return sumNonZero(e, bilinear(
          isZero(da) ? null : core.outer(da, b),
          isZero(db) ? null : core.outer(a, db)));
    }

    @Override
    public Core.Exp dot(Core.Exp e, Core.Exp da, Core.Exp db) {
      final Core.Exp a = e.operand(0);
      final Core.Exp b = e.operand(1);
      return sumNonZero(e, bilinear(
          isZero(da) ? null : core.dot(da, b),
          isZero(db) ? null : core.dot(a, db)));
    }

    @Override
    public Core.Exp cross(Core.Exp e, Core.Exp da, Core.Exp db) {
      final Core.Exp a = e.operand(0);
      final Core.Exp b = e.operand(1);
      return sumNonZero(e, bilinear(
          isZero(da) ? null : core.cross(da, b),
          isZero(db) ? null : core.cross(a, db)));
    }

    private static List<Core.Exp> bilinear(Core.@Nullable Exp x,
        Core.@Nullable Exp y) {
      final List<Core.Exp> list = new ArrayList<>();
      if (x != null) {
        list.add(x);
      }
      if (y != null) {
        list.add(y);
      }
      return list;
    }

    @Override
    public Core.Exp transposed(Core.Exp e, Core.Exp da) {
      return isZero(da) ? zeroDerivative(e) : core.transposed(da);
    }

    @Override
    public Core.Exp trace(Core.Exp e, Core.Exp da) {
      return isZero(da) ? zeroDerivative(e) : core.trace(da);
    }

    @Override
    public Core.Exp deviatoric(Core.Exp e, Core.Exp da) {
      return isZero(da) ? zeroDerivative(e) : core.deviatoric(da);
    }

    /** d det(A) = det(A) tr(inv(A) . dA). */
    @Override
    public Core.Exp determinant(Core.Exp e, Core.Exp da) {
      if (isZero(da)) {
        return zeroDerivative(e);
      }
      final Core.Exp a = e.operand(0);
      return core.product(e, core.trace(core.dot(core.inverse(a), da)));
    }

    /** d inv(A) = -inv(A) . dA . inv(A). */
    @Override
    public Core.Exp inverse(Core.Exp e, Core.Exp da) {
      if (isZero(da)) {
        return zeroDerivative(e);
      }
      return core.negate(core.dot(core.dot(e, da), e));
    }
  }

  /** Rules for the spatial gradient. The variable has shape
   * {@code (dim)}. */
  static class GradRuleset extends DerivativeRuleset {
    private final int dim;

    GradRuleset(int dim) {
      super(Shape.of(dim));
      this.dim = dim;
    }

    @Override
    public boolean isCutoff(Core.Exp e) {
      return e.op == Op.GRAD || e.op == Op.TIME_DERIVATIVE;
    }

    private Core.Exp terminalGrad(Core.Exp e) {
      return e.isCellwiseConstant() ? zeroDerivative(e) : core.grad(e, dim);
    }

    @Override
    public Core.Exp argument(Core.Argument e) {
      return terminalGrad(e);
    }

    @Override
    public Core.Exp coefficient(Core.Coefficient e) {
      return terminalGrad(e);
    }

    @Override
    public Core.Exp geometric(Core.Geometric e) {
      if (e.op == Op.SPATIAL_COORDINATE) {
        return core.identity(dim);
      }
      return terminalGrad(e);
    }

    @Override
    public Core.Exp grad(Core.Grad e, Core.Exp operand) {
      return terminalGrad(e);
    }

    @Override
    public Core.Exp timeDerivative(Core.Exp e, Core.Exp operand) {
      return terminalGrad(e);
    }
  }

  /** Rules for the derivative with respect to a variable. The variable has
   * the shape of the labelled expression. */
  static class VariableRuleset extends DerivativeRuleset {
    private final Core.Exp label;

    VariableRuleset(Core.Exp variable) {
      super(variable.shape);
      if (variable.op != Op.VARIABLE) {
        throw new DifferentiationException("can only differentiate with "
            + "respect to a variable, not " + variable.op,
            Op.VARIABLE_DERIVATIVE);
      }
      this.label = variable.operand(1);
    }

    private boolean matches(Core.Exp e) {
      return e.op == Op.VARIABLE && e.operand(1).equals(label);
    }

    @Override
    public boolean isCutoff(Core.Exp e) {
      return matches(e);
    }

    @Override
    public Core.Exp argument(Core.Argument e) {
      return zeroDerivative(e);
    }

    @Override
    public Core.Exp coefficient(Core.Coefficient e) {
      return zeroDerivative(e);
    }

    @Override
    public Core.Exp geometric(Core.Geometric e) {
      return zeroDerivative(e);
    }

    @Override
    public Core.Exp variable(Core.Exp e, Core.Exp expression,
        Core.Exp label) {
      if (matches(e)) {
        return identity(varShape);
      }
      return expression;
    }

    /** Returns the identity tensor of shape {@code shape + shape}. */
    private static Core.Exp identity(Shape shape) {
      switch (shape.rank()) {
      case 0:
        return core.one();
      case 1:
        return core.identity(shape.dim(0));
      default:
        final List<Index> ii = Index.create(shape.rank());
        final List<Index> kk = Index.create(shape.rank());
        final List<Core.Exp> factors = new ArrayList<>();
        for (int r = 0; r < shape.rank(); r++) {
          factors.add(
              core.indexed(core.identity(shape.dim(r)), ii.get(r),
                  kk.get(r)));
        }
        return core.componentTensor(core.product(factors),
            Static.concat(ii, kk));
      }
    }

    @Override
    public Core.Exp grad(Core.Grad e, Core.Exp operand) {
      return spatial(e, operand);
    }

    @Override
    public Core.Exp timeDerivative(Core.Exp e, Core.Exp operand) {
      return spatial(e, operand);
    }

    private Core.Exp spatial(Core.Exp e, Core.Exp operand) {
      if (isZero(operand)) {
        return zeroDerivative(e);
      }
      throw new DifferentiationException("cannot differentiate "
          + e.op.opName + " of an expression that depends on the variable",
          e.op);
    }
  }
}

// End Derivatives.java
