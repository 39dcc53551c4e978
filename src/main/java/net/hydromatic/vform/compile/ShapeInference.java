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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.FixedIndex;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.Shape;
import net.hydromatic.vform.space.Mesh;

/**
 * Computes the shape and free indices of an expression node from those of its
 * operands, and validates that the operands are compatible.
 *
 * <p>{@link net.hydromatic.vform.ast.CoreBuilder} calls these methods before
 * it creates each node, so an invalid node is never created. {@link
 * #recompute(Core.Exp)} re-validates an existing node.
 */
public final class ShapeInference {
  private ShapeInference() {}

  /** Infers the typing of a node that has no metadata other than its
   * kind. */
  public static Typing infer(Op op, List<Core.Exp> operands) {
    op.checkArity(operands.size());
    switch (op) {
    case SUM:
    case LIST_TENSOR:
      checkNoConditions(op, operands);
      final Typing first = Typing.of(operands.get(0));
      for (Core.Exp operand : operands) {
        if (!operand.shape.equals(first.shape)) {
          throw new ShapeMismatchException("operands have shapes "
              + shapes(operands), op);
        }
        if (!operand.freeIndices.equals(first.freeIndices)) {
          throw new ShapeMismatchException("operands have different free "
              + "indices " + freeIndices(operands), op);
        }
      }
      if (op == Op.LIST_TENSOR) {
        final Shape shape =
            Shape.of(operands.size()).concat(first.shape);
        return new Typing(shape, first.freeIndices);
      }
      return first;

    case PRODUCT:
      checkNoConditions(op, operands);
      return product(operands);

    case DIVISION:
      checkNoConditions(op, operands);
      checkTrueScalar(op, operands.get(1), "denominator");
      return Typing.of(operands.get(0));

    case POWER:
    case ABS:
    case SIGN:
    case SQRT:
    case EXP:
    case LN:
    case SIN:
    case COS:
      checkNoConditions(op, operands);
      for (Core.Exp operand : operands) {
        checkTrueScalar(op, operand, "operand");
      }
      return Typing.SCALAR;

    case INNER:
      checkNoConditions(op, operands);
      if (!operands.get(0).shape.equals(operands.get(1).shape)) {
        throw new ShapeMismatchException("operands have shapes "
            + shapes(operands), op);
      }
      return new Typing(Shape.SCALAR, disjointUnion(op, operands));

    case OUTER:
      checkNoConditions(op, operands);
      return new Typing(operands.get(0).shape.concat(operands.get(1).shape),
          disjointUnion(op, operands));

    case DOT:
      checkNoConditions(op, operands);
      final Shape a = operands.get(0).shape;
      final Shape b = operands.get(1).shape;
      if (a.rank() == 0 || b.rank() == 0 || a.last() != b.dim(0)) {
        throw new ShapeMismatchException("cannot contract last axis of "
            + a + " with first axis of " + b, op);
      }
      return new Typing(a.skipLast(1).concat(b.skip(1)),
          disjointUnion(op, operands));

    case CROSS:
      checkNoConditions(op, operands);
      for (Core.Exp operand : operands) {
        if (!operand.shape.equals(Shape.of(3))) {
          throw new ShapeMismatchException("operands must be 3-vectors, "
              + "have shapes " + shapes(operands), op);
        }
      }
      return new Typing(Shape.of(3), disjointUnion(op, operands));

    case TRANSPOSED:
      checkNoConditions(op, operands);
      final Core.Exp t = operands.get(0);
      if (t.rank() != 2) {
        throw new ShapeMismatchException("operand must have rank 2, has "
            + "shape " + t.shape, op);
      }
      return new Typing(Shape.of(t.shape.dim(1), t.shape.dim(0)),
          t.freeIndices);

    case TRACE:
    case DETERMINANT:
    case INVERSE:
    case DEVIATORIC:
      checkNoConditions(op, operands);
      final Core.Exp m = operands.get(0);
      if (!m.shape.isSquare()) {
        throw new ShapeMismatchException("operand must be a square matrix, "
            + "has shape " + m.shape, op);
      }
      return op == Op.TRACE || op == Op.DETERMINANT
          ? new Typing(Shape.SCALAR, m.freeIndices)
          : Typing.of(m);

    case DIV:
      checkNoConditions(op, operands);
      final Core.Exp v = operands.get(0);
      if (v.rank() == 0) {
        throw new ShapeMismatchException("cannot take divergence of a "
            + "scalar", op);
      }
      final int gdim = geometricDimension(op, v);
      if (v.shape.last() != gdim) {
        throw new ShapeMismatchException("last axis of " + v.shape
            + " does not match geometric dimension " + gdim, op);
      }
      return new Typing(v.shape.skipLast(1), v.freeIndices);

    case CURL:
      checkNoConditions(op, operands);
      final Core.Exp c = operands.get(0);
      if (c.shape.equals(Shape.of(3))) {
        return Typing.of(c);
      } else if (c.shape.equals(Shape.of(2))) {
        return new Typing(Shape.SCALAR, c.freeIndices);
      }
      throw new ShapeMismatchException("operand must be a 2- or 3-vector, "
          + "has shape " + c.shape, op);

    case TIME_DERIVATIVE:
    case POSITIVE_RESTRICTED:
    case NEGATIVE_RESTRICTED:
    case AVG:
      checkNoConditions(op, operands);
      return Typing.of(operands.get(0));

    case JUMP:
      checkNoConditions(op, operands);
      if (operands.size() == 1) {
        return Typing.of(operands.get(0));
      }
      final Core.Exp jv = operands.get(0);
      final Core.Exp jn = operands.get(1);
      if (jn.rank() != 1) {
        throw new ShapeMismatchException("normal must be a vector, has "
            + "shape " + jn.shape, op);
      }
      if (jv.rank() == 0) {
        return new Typing(jn.shape, disjointUnion(op, operands));
      }
      if (jv.shape.last() != jn.shape.dim(0)) {
        throw new ShapeMismatchException("last axis of " + jv.shape
            + " does not match normal " + jn.shape, op);
      }
      return new Typing(jv.shape.skipLast(1), disjointUnion(op, operands));

    case COEFFICIENT_DERIVATIVE:
      checkNoConditions(op, operands);
      final Core.Exp w = operands.get(1);
      final Core.Exp dir = operands.get(2);
      if (w.op != Op.COEFFICIENT) {
        throw new DifferentiationException("can only differentiate with "
            + "respect to a coefficient, not " + w.op, op);
      }
      if (!dir.shape.equals(w.shape)) {
        throw new ShapeMismatchException("direction shape " + dir.shape
            + " does not match coefficient shape " + w.shape, op);
      }
      if (!dir.freeIndices.isEmpty()) {
        throw new ShapeMismatchException("direction has free indices "
            + dir.freeIndices.keySet(), op);
      }
      return Typing.of(operands.get(0));

    case VARIABLE:
      checkNoConditions(op, operands);
      if (operands.get(1).op != Op.LABEL) {
        throw new ShapeMismatchException("second operand must be a label, "
            + "not " + operands.get(1).op, op);
      }
      return Typing.of(operands.get(0));

    case VARIABLE_DERIVATIVE:
      checkNoConditions(op, operands);
      final Core.Exp f = operands.get(0);
      final Core.Exp var = operands.get(1);
      if (var.op != Op.VARIABLE) {
        throw new DifferentiationException("can only differentiate with "
            + "respect to a variable, not " + var.op, op);
      }
      if (!var.freeIndices.isEmpty()) {
        throw new ShapeMismatchException("variable has free indices "
            + var.freeIndices.keySet(), op);
      }
      return new Typing(f.shape.concat(var.shape), f.freeIndices);

    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      checkNoConditions(op, operands);
      for (Core.Exp operand : operands) {
        checkTrueScalar(op, operand, "operand");
      }
      return Typing.SCALAR;

    case AND:
    case OR:
    case NOT:
      for (Core.Exp operand : operands) {
        checkCondition(op, operand);
      }
      return Typing.SCALAR;

    case CONDITIONAL:
      checkCondition(op, operands.get(0));
      final List<Core.Exp> branches = operands.subList(1, 3);
      checkNoConditions(op, branches);
      if (!branches.get(0).shape.equals(branches.get(1).shape)
          || !branches.get(0).freeIndices.equals(
              branches.get(1).freeIndices)) {
        throw new ShapeMismatchException("branches have shapes "
            + shapes(branches) + " and free indices "
            + freeIndices(branches), op);
      }
      return Typing.of(branches.get(0));

    default:
      throw new AssertionError("kind has metadata: " + op);
    }
  }

  private static Typing product(List<Core.Exp> operands) {
    Core.Exp tensor = null;
    for (Core.Exp operand : operands) {
      if (!operand.shape.isScalar()) {
        if (tensor != null) {
          throw new ShapeMismatchException("product of non-scalar operands "
              + "with shapes " + shapes(operands)
              + "; use inner, outer or dot", Op.PRODUCT);
        }
        tensor = operand;
      }
    }
    final Map<Index, Integer> counts = new HashMap<>();
    final Map<Index, Integer> ranges = new HashMap<>();
    for (Core.Exp operand : operands) {
      operand.freeIndices.forEach((index, range) -> {
        counts.merge(index, 1, Integer::sum);
        final Integer prev = ranges.put(index, range);
        if (prev != null && !prev.equals(range)) {
          throw new ShapeMismatchException("index " + index + " has ranges "
              + prev + " and " + range, Op.PRODUCT);
        }
      });
    }
    final SortedMap<Index, Integer> free = new TreeMap<>();
    counts.forEach((index, count) -> {
      if (count > 2) {
        throw new IndexRepetitionException("index " + index + " occurs "
            + count + " times", Op.PRODUCT);
      }
      if (count == 1) {
        free.put(index, ranges.get(index));
      }
    });
    return new Typing(tensor == null ? Shape.SCALAR : tensor.shape,
        ImmutableSortedMap.copyOfSorted(free));
  }

  /** Infers the typing of {@code a[indices]}. A label that occurs twice in
   * the multi-index is summed. */
  public static Typing indexed(Core.Exp a, List<? extends IndexBase> indices) {
    checkNoConditions(Op.INDEXED, ImmutableList.of(a));
    if (indices.size() != a.rank()) {
      throw new ShapeMismatchException("expression of shape " + a.shape
          + " indexed by " + indices.size() + " indices", Op.INDEXED);
    }
    final Map<Index, Integer> counts = new HashMap<>();
    final SortedMap<Index, Integer> ranges = new TreeMap<>();
    for (int i = 0; i < indices.size(); i++) {
      final IndexBase index = indices.get(i);
      final int dim = a.shape.dim(i);
      if (index.isFixed()) {
        final int value = ((FixedIndex) index).value;
        if (value >= dim) {
          throw new ShapeMismatchException("fixed index " + value
              + " out of range for axis of dimension " + dim, Op.INDEXED);
        }
        continue;
      }
      final Index label = (Index) index;
      if (a.freeIndices.containsKey(label)) {
        throw new IndexRepetitionException("index " + label
            + " is already free in the indexed expression", Op.INDEXED);
      }
      counts.merge(label, 1, Integer::sum);
      final Integer prev = ranges.put(label, dim);
      if (prev != null && prev != dim) {
        throw new ShapeMismatchException("index " + label + " has ranges "
            + prev + " and " + dim, Op.INDEXED);
      }
    }
    final SortedMap<Index, Integer> free = new TreeMap<>(a.freeIndices);
    counts.forEach((label, count) -> {
      if (count > 2) {
        throw new IndexRepetitionException("index " + label + " occurs "
            + count + " times", Op.INDEXED);
      }
      if (count == 1) {
        free.put(label, ranges.get(label));
      }
    });
    return new Typing(Shape.SCALAR, ImmutableSortedMap.copyOfSorted(free));
  }

  /** Infers the typing of {@code as_tensor(a, indices)}. */
  public static Typing componentTensor(Core.Exp a, List<Index> indices) {
    checkNoConditions(Op.COMPONENT_TENSOR, ImmutableList.of(a));
    if (!a.shape.isScalar()) {
      throw new ShapeMismatchException("operand must be scalar, has shape "
          + a.shape, Op.COMPONENT_TENSOR);
    }
    final SortedMap<Index, Integer> free = new TreeMap<>(a.freeIndices);
    final List<Integer> dims = new ArrayList<>();
    for (Index index : indices) {
      final Integer range = free.remove(index);
      if (range == null) {
        if (indices.indexOf(index) != indices.lastIndexOf(index)) {
          throw new IndexRepetitionException("index " + index
              + " occurs more than once", Op.COMPONENT_TENSOR);
        }
        throw new UnresolvedIndexException("index " + index
            + " is not free in operand", Op.COMPONENT_TENSOR);
      }
      dims.add(range);
    }
    return new Typing(Shape.of(dims), ImmutableSortedMap.copyOfSorted(free));
  }

  /** Infers the typing of the sum of {@code a} over {@code index}. */
  public static Typing indexSum(Core.Exp a, Index index) {
    checkNoConditions(Op.INDEX_SUM, ImmutableList.of(a));
    if (!a.freeIndices.containsKey(index)) {
      throw new UnresolvedIndexException("index " + index
          + " is not free in summand", Op.INDEX_SUM);
    }
    final SortedMap<Index, Integer> free = new TreeMap<>(a.freeIndices);
    free.remove(index);
    return new Typing(a.shape, ImmutableSortedMap.copyOfSorted(free));
  }

  /** Returns the geometric dimension of the domain of an expression, for
   * use by a spatial derivative. */
  public static int geometricDimension(Op op, Core.Exp e) {
    final List<Mesh> domains = Analysis.extractDomains(e);
    if (domains.isEmpty()) {
      throw new ShapeMismatchException("cannot find the domain of the "
          + "operand, so its geometric dimension is unknown", op);
    }
    final int gdim = domains.get(0).geometricDimension();
    for (Mesh mesh : domains) {
      if (mesh.geometricDimension() != gdim) {
        throw new ShapeMismatchException("operand is defined on domains of "
            + "different geometric dimension: " + domains, op);
      }
    }
    return gdim;
  }

  /** Recomputes the typing of an existing node from its operands, and
   * checks that it matches the node. */
  public static Typing recompute(Core.Exp e) {
    final Typing typing;
    switch (e.op) {
    case ARGUMENT:
    case COEFFICIENT:
    case CONSTANT:
    case IDENTITY:
    case ZERO:
    case SPATIAL_COORDINATE:
    case FACET_NORMAL:
    case CELL_VOLUME:
    case CIRCUMRADIUS:
    case FACET_AREA:
    case LABEL:
      return Typing.of(e);
    case INDEXED:
      typing = indexed(e.operand(0), ((Core.Indexed) e).indices);
      break;
    case COMPONENT_TENSOR:
      typing = componentTensor(e.operand(0), ((Core.ComponentTensor) e).indices);
      break;
    case INDEX_SUM:
      final Core.IndexSum indexSum = (Core.IndexSum) e;
      typing = indexSum(e.operand(0), indexSum.index);
      final int range =
          requireNonNull(e.operand(0).freeIndices.get(indexSum.index));
      if (range != indexSum.dimension) {
        throw new ShapeMismatchException("index " + indexSum.index
            + " has range " + range + ", sum has dimension "
            + indexSum.dimension, e.op);
      }
      break;
    case GRAD:
      final int dim = ((Core.Grad) e).dim;
      if (!Analysis.extractDomains(e.operand(0)).isEmpty()
          && geometricDimension(e.op, e.operand(0)) != dim) {
        throw new ShapeMismatchException("gradient has dimension " + dim
            + ", domain has a different geometric dimension", e.op);
      }
      typing = new Typing(e.operand(0).shape.append(dim),
          e.operand(0).freeIndices);
      break;
    default:
      typing = infer(e.op, e.operands);
    }
    if (!typing.shape.equals(e.shape)
        || !typing.freeIndices.equals(e.freeIndices)) {
      throw new ShapeMismatchException("node has shape " + e.shape
          + " and free indices " + e.freeIndices.keySet()
          + " but operands imply " + typing, e.op);
    }
    return typing;
  }

  private static ImmutableSortedMap<Index, Integer> disjointUnion(Op op,
      List<Core.Exp> operands) {
    final SortedMap<Index, Integer> free = new TreeMap<>();
    for (Core.Exp operand : operands) {
      operand.freeIndices.forEach((index, range) -> {
        if (free.put(index, range) != null) {
          throw new IndexRepetitionException("index " + index
              + " is free in more than one operand", op);
        }
      });
    }
    return ImmutableSortedMap.copyOfSorted(free);
  }

  private static void checkTrueScalar(Op op, Core.Exp e, String role) {
    if (!e.shape.isScalar()) {
      throw new ShapeMismatchException(role + " must be scalar, has shape "
          + e.shape, op);
    }
    if (!e.freeIndices.isEmpty()) {
      throw new ShapeMismatchException(role + " must not have free indices, "
          + "has " + e.freeIndices.keySet(), op);
    }
  }

  private static void checkCondition(Op op, Core.Exp e) {
    if (!e.op.isCondition()) {
      throw new ShapeMismatchException("operand must be a condition, not "
          + e.op, op);
    }
  }

  private static void checkNoConditions(Op op, List<Core.Exp> operands) {
    for (Core.Exp operand : operands) {
      if (operand.op.isCondition()) {
        throw new ShapeMismatchException("condition " + operand.op
            + " cannot be an operand", op);
      }
    }
  }

  private static String shapes(List<Core.Exp> operands) {
    final StringBuilder b = new StringBuilder();
    for (Core.Exp operand : operands) {
      if (b.length() > 0) {
        b.append(" and ");
      }
      b.append(operand.shape);
    }
    return b.toString();
  }

  private static String freeIndices(List<Core.Exp> operands) {
    final StringBuilder b = new StringBuilder();
    for (Core.Exp operand : operands) {
      if (b.length() > 0) {
        b.append(" and ");
      }
      b.append(operand.freeIndices.keySet());
    }
    return b.toString();
  }

  /** Shape and free indices of an expression. */
  public static final class Typing {
    static final Typing SCALAR =
        new Typing(Shape.SCALAR, ImmutableSortedMap.of());

    public final Shape shape;
    public final ImmutableSortedMap<Index, Integer> freeIndices;

    public Typing(Shape shape, ImmutableSortedMap<Index, Integer> freeIndices) {
      this.shape = requireNonNull(shape);
      this.freeIndices = requireNonNull(freeIndices);
    }

    static Typing of(Core.Exp e) {
      return new Typing(e.shape, e.freeIndices);
    }

    @Override
    public int hashCode() {
      return Objects.hash(shape, freeIndices);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Typing
              && shape.equals(((Typing) o).shape)
              && freeIndices.equals(((Typing) o).freeIndices);
    }

    @Override
    public String toString() {
      return "shape " + shape + " and free indices " + freeIndices.keySet();
    }
  }
}

// End ShapeInference.java
