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
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.FixedIndex;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.ReuseTransformer;
import net.hydromatic.vform.ast.Traversals;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites an expression into a simpler, equivalent form.
 *
 * <p>The rewrite is a single bottom-up pass; each node is simplified after
 * its operands. Rules include:
 *
 * <ul>
 *   <li>{@code x + 0 → x}, {@code x * 0 → 0}, {@code x * 1 → x};
 *   <li>constant folding;
 *   <li>flattening of nested sums and products, sorting of their operands,
 *   and collection of like terms ({@code x + x → 2 * x});
 *   <li>index notation: {@code as_tensor(A[i, j], (i, j)) → A},
 *   {@code as_tensor(X, (i, j))[k, l] → X[k, l]},
 *   {@code A[i, i] → tr(A)}, {@code A[i, j] * B[i, j] → inner(A, B)};
 *   <li>restrictions, averages and jumps of globally constant expressions;
 *   <li>conditionals whose condition is constant, or whose branches are
 *   equal.
 * </ul>
 *
 * <p>Every rewrite preserves the shape and free indices of the node it
 * replaces.
 */
public class Simplifier extends ReuseTransformer {
  private final boolean lowerIndexNotation;

  /** Creates a Simplifier.
   *
   * @param lowerIndexNotation Whether to rewrite index notation into
   *   compound operators ({@code trace}, {@code inner}) where possible */
  public Simplifier(boolean lowerIndexNotation) {
    this.lowerIndexNotation = lowerIndexNotation;
  }

  /** Simplifies an expression. */
  public static Core.Exp simplify(Core.Exp e) {
    return simplify(e, true);
  }

  /** Simplifies an expression, optionally rewriting index notation into
   * compound operators. */
  public static Core.Exp simplify(Core.Exp e, boolean lowerIndexNotation) {
    return Traversals.map(e, new Simplifier(lowerIndexNotation));
  }

  private Core.Exp again(Core.Exp e) {
    return Traversals.map(e, this);
  }

  /** Checks that a rewrite has preserved shape and free indices. */
  private static Core.Exp check(Core.Exp e, Core.Exp result) {
    if (!result.shape.equals(e.shape)
        || !result.freeIndices.equals(e.freeIndices)) {
      throw new AssertionError("simplification of " + e + " changed shape "
          + e.shape + " and free indices " + e.freeIndices.keySet()
          + " to " + result.shape + " and " + result.freeIndices.keySet());
    }
    return result;
  }

  /** Whether an expression is zero: a typed zero or the constant 0. */
  static boolean isZero(Core.Exp e) {
    return e.op == Op.ZERO
        || e.op == Op.CONSTANT && ((Core.Constant) e).value.signum() == 0;
  }

  /** Returns the value of a scalar constant expression, or null. */
  static @Nullable BigDecimal constantValue(Core.Exp e) {
    switch (e.op) {
    case CONSTANT:
      return ((Core.Constant) e).value;
    case ZERO:
      return e.isTrueScalar() ? BigDecimal.ZERO : null;
    default:
      return null;
    }
  }

  /** Evaluates a condition whose operands are constant; returns null if it
   * is not constant. */
  static @Nullable Boolean evaluate(Core.Exp c) {
    switch (c.op) {
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      final BigDecimal left = constantValue(c.operand(0));
      final BigDecimal right = constantValue(c.operand(1));
      if (left == null || right == null) {
        return null;
      }
      final int compare = left.compareTo(right);
      switch (c.op) {
      case EQ:
        return compare == 0;
      case NE:
        return compare != 0;
      case LT:
        return compare < 0;
      case LE:
        return compare <= 0;
      case GT:
        return compare > 0;
      default:
        return compare >= 0;
      }
    case AND:
    case OR:
      final Boolean a = evaluate(c.operand(0));
      final Boolean b = evaluate(c.operand(1));
      final boolean dominant = c.op == Op.OR;
      if (a != null && a == dominant || b != null && b == dominant) {
        return dominant;
      }
      return a == null || b == null ? null : !dominant;
    case NOT:
      final Boolean x = evaluate(c.operand(0));
      return x == null ? null : !x;
    default:
      return null;
    }
  }

  // algebra

  @Override
  public Core.Exp sum(Core.Exp e, List<Core.Exp> operands) {
    final List<Core.Exp> terms = new ArrayList<>();
    for (Core.Exp operand : operands) {
      if (operand.op == Op.SUM) {
        terms.addAll(operand.operands);
      } else {
        terms.add(operand);
      }
    }
    BigDecimal constant = BigDecimal.ZERO;
    final Map<Core.Exp, BigDecimal> coefficients = new LinkedHashMap<>();
    for (Core.Exp term : terms) {
      if (isZero(term)) {
        continue;
      }
      if (term.op == Op.CONSTANT) {
        constant = constant.add(((Core.Constant) term).value);
        continue;
      }
      BigDecimal coefficient = BigDecimal.ONE;
      Core.Exp rest = term;
      if (term.op == Op.PRODUCT && term.operand(0).op == Op.CONSTANT) {
        coefficient = ((Core.Constant) term.operand(0)).value;
        rest = term.operands.size() == 2
            ? term.operand(1)
            : core.product(term.operands.subList(1, term.operands.size()));
      }
      coefficients.merge(rest, coefficient, BigDecimal::add);
    }
    final List<Core.Exp> list = new ArrayList<>();
    if (constant.signum() != 0) {
      list.add(core.constant(constant));
    }
    coefficients.forEach((rest, coefficient) -> {
      if (coefficient.signum() == 0) {
        return;
      }
      if (coefficient.compareTo(BigDecimal.ONE) == 0) {
        list.add(rest);
        return;
      }
      final List<Core.Exp> factors = new ArrayList<>();
      factors.add(core.constant(coefficient));
      if (rest.op == Op.PRODUCT) {
        factors.addAll(rest.operands);
      } else {
        factors.add(rest);
      }
      list.add(core.product(factors));
    });
    list.sort(Core.ORDERING);
    switch (list.size()) {
    case 0:
      return check(e, core.zeroLike(e));
    case 1:
      return check(e, list.get(0));
    default:
      return check(e, e.copy(list));
    }
  }

  @Override
  public Core.Exp product(Core.Exp e, List<Core.Exp> operands) {
    for (Core.Exp operand : operands) {
      if (isZero(operand)) {
        return check(e, core.zeroLike(e));
      }
    }
    final List<Core.Exp> factors = new ArrayList<>();
    for (int i = 0; i < operands.size(); i++) {
      final Core.Exp operand = operands.get(i);
      if (operand.op == Op.PRODUCT && canFlatten(operand, operands, i)) {
        factors.addAll(operand.operands);
      } else {
        factors.add(operand);
      }
    }
    BigDecimal constant = BigDecimal.ONE;
    final List<Core.Exp> list = new ArrayList<>();
    for (Core.Exp factor : factors) {
      if (factor.op == Op.CONSTANT) {
        constant = constant.multiply(((Core.Constant) factor).value);
      } else {
        list.add(factor);
      }
    }
    if (constant.signum() == 0) {
      return check(e, core.zeroLike(e));
    }
    list.sort(Core.ORDERING);
    if (lowerIndexNotation && list.size() == 2) {
      final Core.Exp inner = toInner(list.get(0), list.get(1));
      if (inner != null) {
        list.clear();
        list.add(inner);
      }
    }
    if (constant.compareTo(BigDecimal.ONE) != 0) {
      list.add(0, core.constant(constant));
    }
    switch (list.size()) {
    case 0:
      return check(e, core.one());
    case 1:
      return check(e, list.get(0));
    default:
      return check(e, e.copy(list));
    }
  }

  /** Whether the operands of a nested product can be merged into the outer
   * product. They cannot if an index contracted within the nested product
   * is free in another factor of the outer product. */
  private static boolean canFlatten(Core.Exp product, List<Core.Exp> operands,
      int ordinal) {
    final Set<Index> contracted = new TreeSet<>();
    for (Core.Exp factor : product.operands) {
      contracted.addAll(factor.freeIndices.keySet());
    }
    contracted.removeAll(product.freeIndices.keySet());
    if (contracted.isEmpty()) {
      return true;
    }
    for (int i = 0; i < operands.size(); i++) {
      if (i != ordinal) {
        for (Index index : operands.get(i).freeIndices.keySet()) {
          if (contracted.contains(index)) {
            return false;
          }
        }
      }
    }
    return true;
  }

  /** Rewrites {@code A[i, j] * B[i, j]} as {@code inner(A, B)}, or returns
   * null. */
  private static Core.@Nullable Exp toInner(Core.Exp a, Core.Exp b) {
    if (a.op != Op.INDEXED || b.op != Op.INDEXED) {
      return null;
    }
    final Core.Indexed ia = (Core.Indexed) a;
    final Core.Indexed ib = (Core.Indexed) b;
    final Core.Exp ta = a.operand(0);
    final Core.Exp tb = b.operand(0);
    if (!ia.indices.equals(ib.indices)
        || !ta.shape.equals(tb.shape)
        || !ta.freeIndices.isEmpty()
        || !tb.freeIndices.isEmpty()
        || !a.freeIndices.equals(b.freeIndices)) {
      return null;
    }
    final Set<IndexBase> distinct = new HashSet<>(ia.indices);
    if (distinct.size() != ia.indices.size()) {
      return null;
    }
    for (IndexBase index : ia.indices) {
      if (index.isFixed()) {
        return null;
      }
    }
    return core.inner(ta, tb);
  }

  @Override
  public Core.Exp division(Core.Exp e, Core.Exp numerator,
      Core.Exp denominator) {
    if (isZero(denominator)) {
      throw new ArithmeticException("division by zero in " + e);
    }
    if (isZero(numerator)) {
      return check(e, core.zeroLike(e));
    }
    final BigDecimal d = constantValue(denominator);
    if (d != null && d.compareTo(BigDecimal.ONE) == 0) {
      return check(e, numerator);
    }
    final BigDecimal n = constantValue(numerator);
    if (n != null && d != null) {
      return check(e, core.constant(divide(n, d)));
    }
    return check(e, e.copy(ImmutableList.of(numerator, denominator)));
  }

  private static BigDecimal divide(BigDecimal n, BigDecimal d) {
    try {
      return n.divide(d);
    } catch (ArithmeticException ex) {
      // Non-terminating decimal expansion
      return n.divide(d, MathContext.DECIMAL64);
    }
  }

  @Override
  public Core.Exp power(Core.Exp e, Core.Exp base, Core.Exp exponent) {
    final BigDecimal b = constantValue(base);
    final BigDecimal x = constantValue(exponent);
    if (x != null && x.signum() == 0
        || b != null && b.compareTo(BigDecimal.ONE) == 0) {
      return check(e, core.one());
    }
    if (x != null && x.compareTo(BigDecimal.ONE) == 0) {
      return check(e, base);
    }
    if (b != null && b.signum() == 0 && x != null && x.signum() > 0) {
      return check(e, core.zeroLike(e));
    }
    if (b != null && x != null) {
      final BigDecimal folded = pow(b, x);
      if (folded != null) {
        return check(e, core.constant(folded));
      }
    }
    return check(e, e.copy(ImmutableList.of(base, exponent)));
  }

  private static @Nullable BigDecimal pow(BigDecimal b, BigDecimal x) {
    if (x.scale() <= 0 && x.abs().compareTo(BigDecimal.valueOf(64)) <= 0) {
      final int n = x.intValueExact();
      if (n >= 0) {
        return b.pow(n);
      }
      if (b.signum() != 0) {
        return divide(BigDecimal.ONE, b.pow(-n));
      }
      return null;
    }
    final double d = Math.pow(b.doubleValue(), x.doubleValue());
    return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
  }

  @Override
  public Core.Exp abs(Core.Exp e, Core.Exp operand) {
    final BigDecimal v = constantValue(operand);
    if (v != null) {
      return check(e, v.signum() == 0 ? core.zeroLike(e)
          : core.constant(v.abs()));
    }
    if (operand.op == Op.ABS) {
      return check(e, operand);
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp sign(Core.Exp e, Core.Exp operand) {
    final BigDecimal v = constantValue(operand);
    if (v != null) {
      return check(e, v.signum() == 0 ? core.zeroLike(e)
          : core.constant(v.signum()));
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp mathFunction(Core.Exp e, Core.Exp operand) {
    final BigDecimal v = constantValue(operand);
    if (v != null) {
      final double d = v.doubleValue();
      final double result;
      switch (e.op) {
      case SQRT:
        result = Math.sqrt(d);
        break;
      case EXP:
        result = Math.exp(d);
        break;
      case LN:
        result = Math.log(d);
        break;
      case SIN:
        result = Math.sin(d);
        break;
      case COS:
        result = Math.cos(d);
        break;
      default:
        throw new AssertionError(e.op);
      }
      if (Double.isFinite(result)) {
        return check(e, core.constant(result));
      }
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  // tensor algebra

  @Override
  public Core.Exp indexed(Core.Indexed e, Core.Exp operand) {
    if (isZero(operand)) {
      return check(e, core.zeroLike(e));
    }
    if (e.indices.isEmpty()) {
      return check(e, operand);
    }
    switch (operand.op) {
    case COMPONENT_TENSOR:
      final Core.ComponentTensor tensor = (Core.ComponentTensor) operand;
      if (distinctLabels(e.indices)) {
        final ImmutableMap.Builder<Index, IndexBase> mapping =
            ImmutableMap.builder();
        for (int i = 0; i < e.indices.size(); i++) {
          mapping.put(tensor.indices.get(i), e.indices.get(i));
        }
        return check(e,
            again(IndexRenamer.rename(tensor.operand(0), mapping.build())));
      }
      break;
    case LIST_TENSOR:
      if (e.indices.get(0).isFixed()) {
        final Core.Exp entry =
            operand.operand(((FixedIndex) e.indices.get(0)).value);
        final List<IndexBase> rest = e.indices.subList(1, e.indices.size());
        return check(e,
            rest.isEmpty() ? entry : again(core.indexed(entry, rest)));
      }
      break;
    case IDENTITY:
      if (e.indices.get(0).isFixed() && e.indices.get(1).isFixed()) {
        return check(e, e.indices.get(0).equals(e.indices.get(1))
            ? core.one() : core.zeroLike(e));
      }
      break;
    default:
      break;
    }
    if (lowerIndexNotation
        && e.indices.size() == 2
        && !e.indices.get(0).isFixed()
        && e.indices.get(0).equals(e.indices.get(1))) {
      return check(e, core.trace(operand));
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  private static boolean distinctLabels(List<IndexBase> indices) {
    final Set<IndexBase> labels = new HashSet<>();
    for (IndexBase index : indices) {
      if (!index.isFixed() && !labels.add(index)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Core.Exp componentTensor(Core.ComponentTensor e, Core.Exp operand) {
    if (isZero(operand)) {
      return check(e, core.zeroLike(e));
    }
    if (operand.op == Op.INDEXED
        && ((Core.Indexed) operand).indices.equals(e.indices)) {
      return check(e, operand.operand(0));
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp indexSum(Core.IndexSum e, Core.Exp operand) {
    if (isZero(operand)) {
      return check(e, core.zeroLike(e));
    }
    if (e.dimension == 1) {
      return check(e,
          again(
              IndexRenamer.rename(operand,
                  ImmutableMap.of(e.index, FixedIndex.of(0)))));
    }
    if (operand.op == Op.INDEXED
        && operand.operand(0).op == Op.LIST_TENSOR
        && ((Core.Indexed) operand).indices.size() == 1
        && ((Core.Indexed) operand).indices.get(0).equals(e.index)) {
      return check(e, again(core.sum(operand.operand(0).operands)));
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp listTensor(Core.Exp e, List<Core.Exp> operands) {
    boolean allZero = true;
    for (Core.Exp operand : operands) {
      allZero &= isZero(operand);
    }
    if (allZero) {
      return check(e, core.zeroLike(e));
    }
    final Core.Exp source = listSource(operands);
    if (source != null) {
      return check(e, source);
    }
    return check(e, e.copy(operands));
  }

  /** If a list is {@code [B[0], B[1], ..., B[n - 1]]} for a vector
   * {@code B} of dimension n, returns {@code B}; otherwise null. */
  private static Core.@Nullable Exp listSource(List<Core.Exp> operands) {
    Core.Exp source = null;
    for (int i = 0; i < operands.size(); i++) {
      final Core.Exp operand = operands.get(i);
      if (operand.op != Op.INDEXED
          || !((Core.Indexed) operand).indices.equals(
              ImmutableList.of(FixedIndex.of(i)))) {
        return null;
      }
      if (source == null) {
        source = operand.operand(0);
      } else if (!source.equals(operand.operand(0))) {
        return null;
      }
    }
    return source != null && source.shape.dim(0) == operands.size()
        ? source : null;
  }

  @Override
  public Core.Exp inner(Core.Exp e, Core.Exp a, Core.Exp b) {
    return bilinear(e, a, b);
  }

  @Override
  public Core.Exp outer(Core.Exp e, Core.Exp a, Core.Exp b) {
    return bilinear(e, a, b);
  }

  @Override
  public Core.Exp dot(Core.Exp e, Core.Exp a, Core.Exp b) {
    if (a.op == Op.IDENTITY && b.rank() > 0 && b.freeIndices.isEmpty()) {
      return check(e, b);
    }
    if (b.op == Op.IDENTITY && a.rank() > 0 && a.freeIndices.isEmpty()) {
      return check(e, a);
    }
    return bilinear(e, a, b);
  }

  @Override
  public Core.Exp cross(Core.Exp e, Core.Exp a, Core.Exp b) {
    return bilinear(e, a, b);
  }

  private Core.Exp bilinear(Core.Exp e, Core.Exp a, Core.Exp b) {
    if (isZero(a) || isZero(b)) {
      return check(e, core.zeroLike(e));
    }
    return check(e, e.copy(ImmutableList.of(a, b)));
  }

  @Override
  public Core.Exp transposed(Core.Exp e, Core.Exp a) {
    if (isZero(a)) {
      return check(e, core.zeroLike(e));
    }
    if (a.op == Op.TRANSPOSED || a.op == Op.IDENTITY) {
      return check(e, a.op == Op.IDENTITY ? a : a.operand(0));
    }
    return check(e, e.copy(ImmutableList.of(a)));
  }

  @Override
  public Core.Exp trace(Core.Exp e, Core.Exp a) {
    if (isZero(a)) {
      return check(e, core.zeroLike(e));
    }
    if (a.op == Op.IDENTITY) {
      return check(e, core.constant(((Core.Identity) a).dim));
    }
    return check(e, e.copy(ImmutableList.of(a)));
  }

  @Override
  public Core.Exp determinant(Core.Exp e, Core.Exp a) {
    if (isZero(a)) {
      return check(e, core.zeroLike(e));
    }
    if (a.op == Op.IDENTITY) {
      return check(e, core.one());
    }
    return check(e, e.copy(ImmutableList.of(a)));
  }

  @Override
  public Core.Exp inverse(Core.Exp e, Core.Exp a) {
    if (isZero(a)) {
      throw new ArithmeticException("inverse of zero matrix in " + e);
    }
    if (a.op == Op.IDENTITY) {
      return check(e, a);
    }
    return check(e, e.copy(ImmutableList.of(a)));
  }

  @Override
  public Core.Exp deviatoric(Core.Exp e, Core.Exp a) {
    if (isZero(a) || a.op == Op.IDENTITY) {
      return check(e, core.zeroLike(e));
    }
    return check(e, e.copy(ImmutableList.of(a)));
  }

  // differential

  @Override
  public Core.Exp grad(Core.Grad e, Core.Exp operand) {
    return linear(e, operand);
  }

  @Override
  public Core.Exp div(Core.Exp e, Core.Exp operand) {
    return linear(e, operand);
  }

  @Override
  public Core.Exp curl(Core.Exp e, Core.Exp operand) {
    return linear(e, operand);
  }

  @Override
  public Core.Exp timeDerivative(Core.Exp e, Core.Exp operand) {
    return linear(e, operand);
  }

  private Core.Exp linear(Core.Exp e, Core.Exp operand) {
    if (isZero(operand)) {
      return check(e, core.zeroLike(e));
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp coefficientDerivative(Core.Exp e, Core.Exp integrand,
      Core.Exp coefficient, Core.Exp direction) {
    if (isZero(integrand) || isZero(direction)) {
      return check(e, core.zeroLike(e));
    }
    return check(e,
        e.copy(ImmutableList.of(integrand, coefficient, direction)));
  }

  @Override
  public Core.Exp variable(Core.Exp e, Core.Exp expression, Core.Exp label) {
    if (isZero(expression)) {
      return check(e, core.zeroLike(e));
    }
    return check(e, e.copy(ImmutableList.of(expression, label)));
  }

  @Override
  public Core.Exp variableDerivative(Core.Exp e, Core.Exp f,
      Core.Exp variable) {
    if (isZero(f)) {
      return check(e, core.zeroLike(e));
    }
    return check(e, e.copy(ImmutableList.of(f, variable)));
  }

  // conditions

  @Override
  public Core.Exp not(Core.Exp e, Core.Exp operand) {
    if (operand.op == Op.NOT) {
      return check(e, operand.operand(0));
    }
    return check(e, e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp conditional(Core.Exp e, Core.Exp condition,
      Core.Exp ifTrue, Core.Exp ifFalse) {
    final Boolean value = evaluate(condition);
    if (value != null) {
      return check(e, value ? ifTrue : ifFalse);
    }
    if (ifTrue.equals(ifFalse)
        || isZero(ifTrue) && isZero(ifFalse)) {
      return check(e, isZero(ifTrue) ? core.zeroLike(e) : ifTrue);
    }
    return check(e, e.copy(ImmutableList.of(condition, ifTrue, ifFalse)));
  }

  // compound

  @Override
  public Core.Exp restricted(Core.Exp e, Core.Exp operand) {
    return check(e, Analysis.isGlobalConstant(operand) ? operand
        : e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp avg(Core.Exp e, Core.Exp operand) {
    return check(e, Analysis.isGlobalConstant(operand) ? operand
        : e.copy(ImmutableList.of(operand)));
  }

  @Override
  public Core.Exp jump(Core.Exp e, List<Core.Exp> operands) {
    if (isZero(operands.get(0))
        || operands.size() == 1
            && Analysis.isGlobalConstant(operands.get(0))) {
      return check(e, core.zeroLike(e));
    }
    return check(e, e.copy(operands));
  }
}

// End Simplifier.java
