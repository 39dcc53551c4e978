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
import net.hydromatic.vform.ast.FixedIndex;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.ReuseTransformer;
import net.hydromatic.vform.ast.Traversals;
import net.hydromatic.vform.util.Static;

/**
 * Rewrites compound operators in terms of simpler ones.
 *
 * <p>Tensor-algebra operators (inner, outer, dot, cross, transposed, trace,
 * determinant, inverse, deviatoric) become index notation, products and
 * sums. Divergence and curl become components of a gradient. Jump and
 * average become restrictions.
 */
public final class CompoundLowering {
  private CompoundLowering() {}

  /** Lowers every compound operator in an expression. */
  public static Core.Exp lower(Core.Exp e) {
    return Traversals.map(e, new Lowerer());
  }

  /** Whether a kind is lowered by {@link #lowerNode}. */
  public static boolean isCompound(Op op) {
    switch (op) {
    case INNER:
    case OUTER:
    case DOT:
    case CROSS:
    case TRANSPOSED:
    case TRACE:
    case DETERMINANT:
    case INVERSE:
    case DEVIATORIC:
    case DIV:
    case CURL:
    case JUMP:
    case AVG:
      return true;
    default:
      return false;
    }
  }

  /** Lowers the root node of an expression. Its operands are not changed;
   * the nodes created to replace the root are not compound. Returns the
   * expression unchanged if the root is not compound. */
  public static Core.Exp lowerNode(Core.Exp e) {
    switch (e.op) {
    case INNER:
      return inner(e.operand(0), e.operand(1));
    case OUTER:
      return outer(e.operand(0), e.operand(1));
    case DOT:
      return dot(e.operand(0), e.operand(1));
    case CROSS:
      return cross(e.operand(0), e.operand(1));
    case TRANSPOSED:
      return transposed(e.operand(0));
    case TRACE:
      return trace(e.operand(0));
    case DETERMINANT:
      return determinant(e.operand(0));
    case INVERSE:
      return inverse(e.operand(0));
    case DEVIATORIC:
      return deviatoric(e.operand(0));
    case DIV:
      return div(e.operand(0));
    case CURL:
      return curl(e.operand(0));
    case JUMP:
      return e.operands.size() == 1
          ? jump(e.operand(0))
          : jump(e.operand(0), e.operand(1));
    case AVG:
      return core.division(
          core.sum(core.plusSide(e.operand(0)), core.minusSide(e.operand(0))),
          core.constant(2));
    default:
      return e;
    }
  }

  /** Returns {@code a[indices]}, or {@code a} if there are no indices. */
  static Core.Exp index(Core.Exp a, List<? extends IndexBase> indices) {
    return indices.isEmpty() ? a : core.indexed(a, indices);
  }

  /** Returns {@code as_tensor(a, indices)}, or {@code a} if there are no
   * indices. */
  static Core.Exp asTensor(Core.Exp a, List<Index> indices) {
    return indices.isEmpty() ? a : core.componentTensor(a, indices);
  }

  static Core.Exp inner(Core.Exp a, Core.Exp b) {
    final List<Index> ii = Index.create(a.rank());
    return core.product(index(a, ii), index(b, ii));
  }

  static Core.Exp outer(Core.Exp a, Core.Exp b) {
    final List<Index> ii = Index.create(a.rank());
    final List<Index> jj = Index.create(b.rank());
    return asTensor(core.product(index(a, ii), index(b, jj)),
        Static.concat(ii, jj));
  }

  static Core.Exp dot(Core.Exp a, Core.Exp b) {
    if (a.rank() == 0 && b.rank() == 0) {
      return core.product(a, b);
    }
    final List<Index> ii = Index.create(a.rank() - 1);
    final List<Index> jj = Index.create(b.rank() - 1);
    final Index k = Index.create();
    return asTensor(
        core.product(index(a, Static.append(ii, k)),
            index(b, Static.concat(ImmutableList.of(k), jj))),
        Static.concat(ii, jj));
  }

  static Core.Exp cross(Core.Exp a, Core.Exp b) {
    return core.listTensor(crossComponent(a, b, 1, 2),
        crossComponent(a, b, 2, 0),
        crossComponent(a, b, 0, 1));
  }

  private static Core.Exp crossComponent(Core.Exp a, Core.Exp b, int i,
      int j) {
    return core.minus(core.product(at(a, i), at(b, j)),
        core.product(at(a, j), at(b, i)));
  }

  static Core.Exp transposed(Core.Exp a) {
    final Index i = Index.create();
    final Index j = Index.create();
    return core.componentTensor(core.indexed(a, i, j), j, i);
  }

  static Core.Exp trace(Core.Exp a) {
    final Index i = Index.create();
    return core.indexed(a, i, i);
  }

  static Core.Exp determinant(Core.Exp a) {
    if (a.rank() == 0) {
      return a;
    }
    return minorDeterminant(a, range(a.shape.dim(0)), range(a.shape.dim(1)));
  }

  /** Determinant of the sub-matrix of {@code a} with the given rows and
   * columns, by cofactor expansion along the first row. */
  private static Core.Exp minorDeterminant(Core.Exp a, List<Integer> rows,
      List<Integer> columns) {
    final int r = rows.get(0);
    switch (rows.size()) {
    case 1:
      return at(a, r, columns.get(0));
    case 2:
      final int r1 = rows.get(1);
      final int c0 = columns.get(0);
      final int c1 = columns.get(1);
      return core.minus(core.product(at(a, r, c0), at(a, r1, c1)),
          core.product(at(a, r, c1), at(a, r1, c0)));
    default:
      final List<Core.Exp> terms = new ArrayList<>();
      for (int j = 0; j < columns.size(); j++) {
        final Core.Exp term =
            core.product(at(a, r, columns.get(j)),
                minorDeterminant(a, Static.skip(rows, 1),
                    Static.remove(columns, j)));
        terms.add(j % 2 == 0 ? term : core.negate(term));
      }
      return core.sum(terms);
    }
  }

  static Core.Exp inverse(Core.Exp a) {
    if (a.rank() == 0) {
      return core.division(core.one(), a);
    }
    final int n = a.shape.dim(0);
    final List<Integer> all = range(n);
    final List<Core.Exp> rows = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      final List<Core.Exp> row = new ArrayList<>();
      for (int j = 0; j < n; j++) {
        if (n == 1) {
          row.add(core.one());
          continue;
        }
        // Adjugate is the transpose of the cofactor matrix.
        final Core.Exp minor =
            minorDeterminant(a, Static.remove(all, j), Static.remove(all, i));
        row.add((i + j) % 2 == 0 ? minor : core.negate(minor));
      }
      rows.add(core.listTensor(row));
    }
    return core.division(core.listTensor(rows), determinant(a));
  }

  static Core.Exp deviatoric(Core.Exp a) {
    final int n = a.shape.dim(0);
    return core.minus(a,
        core.product(core.division(trace(a), core.constant(n)),
            core.identity(n)));
  }

  static Core.Exp div(Core.Exp v) {
    final Core.Exp g = core.grad(v, v.shape.last());
    final List<Index> ii = Index.create(v.rank() - 1);
    final Index k = Index.create();
    return asTensor(core.indexed(g, Static.append(Static.append(ii, k), k)),
        ii);
  }

  static Core.Exp curl(Core.Exp v) {
    final int n = v.shape.dim(0);
    final Core.Exp g = core.grad(v, n);
    if (n == 2) {
      return core.minus(at(g, 1, 0), at(g, 0, 1));
    }
    return core.listTensor(core.minus(at(g, 2, 1), at(g, 1, 2)),
        core.minus(at(g, 0, 2), at(g, 2, 0)),
        core.minus(at(g, 1, 0), at(g, 0, 1)));
  }

  static Core.Exp jump(Core.Exp v) {
    return core.minus(core.plusSide(v), core.minusSide(v));
  }

  static Core.Exp jump(Core.Exp v, Core.Exp normal) {
    final Core.Exp vp = core.plusSide(v);
    final Core.Exp vm = core.minusSide(v);
    final Core.Exp np = core.plusSide(normal);
    final Core.Exp nm = core.minusSide(normal);
    if (v.rank() == 0) {
      return core.sum(core.product(vp, np), core.product(vm, nm));
    }
    return core.sum(dot(vp, np), dot(vm, nm));
  }

  /** Returns the component of {@code a} at fixed indices. */
  private static Core.Exp at(Core.Exp a, int... indices) {
    final List<IndexBase> list = new ArrayList<>();
    for (int index : indices) {
      list.add(FixedIndex.of(index));
    }
    return core.indexed(a, list);
  }

  private static List<Integer> range(int n) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(i);
    }
    return b.build();
  }

  /** Lowers each node after its operands. */
  private static class Lowerer extends ReuseTransformer {
    @Override
    protected Core.Exp operator(Core.Exp e, List<Core.Exp> operands) {
      return lowerNode(e.copy(operands));
    }
  }
}

// End CompoundLowering.java
