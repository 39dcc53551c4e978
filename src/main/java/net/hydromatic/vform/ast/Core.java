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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.vform.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Ordering;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import net.hydromatic.vform.space.FunctionSpace;
import net.hydromatic.vform.space.Mesh;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression nodes.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Nodes are immutable; create them using {@link CoreBuilder#core},
 * which validates arity, shapes and indices.
 *
 * <p>Every node has a structural notion of equality ({@link Exp#equals}) and a
 * per-construction identity ({@link Exp#id}). Two nodes built separately from
 * the same operands are equal but have different ids.
 */
public class Core {
  private Core() {}

  /** Deterministic total order on expressions. Compares kind, then
   * kind-specific metadata, then operands. */
  public static final Ordering<Exp> ORDERING = Ordering.from(Core::compare);

  private static int compare(Exp e1, Exp e2) {
    if (e1 == e2) {
      return 0;
    }
    int c = e1.op.compareTo(e2.op);
    if (c != 0) {
      return c;
    }
    c = e1.compareMetadata(e2);
    if (c != 0) {
      return c;
    }
    c = Integer.compare(e1.operands.size(), e2.operands.size());
    for (int i = 0; c == 0 && i < e1.operands.size(); i++) {
      c = compare(e1.operands.get(i), e2.operands.get(i));
    }
    return c;
  }

  static int compareIndices(List<? extends IndexBase> list1,
      List<? extends IndexBase> list2) {
    int c = Integer.compare(list1.size(), list2.size());
    for (int i = 0; c == 0 && i < list1.size(); i++) {
      c = compareIndex(list1.get(i), list2.get(i));
    }
    return c;
  }

  static int compareIndex(IndexBase i1, IndexBase i2) {
    if (i1.isFixed() != i2.isFixed()) {
      return i1.isFixed() ? -1 : 1;
    }
    return i1.isFixed()
        ? Integer.compare(((FixedIndex) i1).value, ((FixedIndex) i2).value)
        : ((Index) i1).compareTo((Index) i2);
  }

  /** Base class of all expression nodes. */
  public abstract static class Exp {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    public final Op op;
    public final ImmutableList<Exp> operands;
    public final Shape shape;
    /** Free index labels, and their ranges. */
    public final ImmutableSortedMap<Index, Integer> freeIndices;
    /** Identity of this node, unique to each construction. */
    public final long id;

    private int hash;

    Exp(Op op, ImmutableList<Exp> operands, Shape shape,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      this.op = requireNonNull(op);
      this.operands = requireNonNull(operands);
      this.shape = requireNonNull(shape);
      this.freeIndices = requireNonNull(freeIndices);
      this.id = NEXT_ID.getAndIncrement();
    }

    public Exp operand(int i) {
      return operands.get(i);
    }

    public int rank() {
      return shape.rank();
    }

    public boolean isTerminal() {
      return op.isTerminal();
    }

    public boolean isZero() {
      return op == Op.ZERO;
    }

    /** Whether this expression is a scalar with no free indices. */
    public boolean isTrueScalar() {
      return shape.isScalar() && freeIndices.isEmpty();
    }

    /** Whether the value of this expression is constant within each cell. */
    public boolean isCellwiseConstant() {
      for (Exp operand : operands) {
        if (!operand.isCellwiseConstant()) {
          return false;
        }
      }
      return true;
    }

    /** Returns a copy of this expression with different operands, or this
     * expression if the operands are the same. */
    public Exp copy(List<Exp> operands) {
      if (sameOperands(operands)) {
        return this;
      }
      return core.reconstruct(this, operands);
    }

    private boolean sameOperands(List<Exp> operands) {
      if (operands.size() != this.operands.size()) {
        return false;
      }
      for (int i = 0; i < operands.size(); i++) {
        if (operands.get(i) != this.operands.get(i)) {
          return false;
        }
      }
      return true;
    }

    /** Compares the metadata of this node with another node of the same
     * kind. */
    int compareMetadata(Exp e) {
      return 0;
    }

    boolean metadataEquals(Exp e) {
      return true;
    }

    int metadataHash() {
      return 0;
    }

    @Override
    public int hashCode() {
      int h = hash;
      if (h == 0) {
        h = Objects.hash(op, metadataHash(), operands);
        if (h == 0) {
          h = 1;
        }
        hash = h;
      }
      return h;
    }

    /** Structural equality: same kind, same metadata, equal operands. */
    @Override
    public boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof Exp)) {
        return false;
      }
      final Exp e = (Exp) o;
      return op == e.op
          && hashCode() == e.hashCode()
          && metadataEquals(e)
          && operands.equals(e.operands);
    }

    @Override
    public String toString() {
      return ExprWriter.write(this);
    }
  }

  /** Expression with no operands. */
  public abstract static class Terminal extends Exp {
    Terminal(Op op, Shape shape) {
      this(op, shape, ImmutableSortedMap.of());
    }

    Terminal(Op op, Shape shape,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      super(op, ImmutableList.of(), shape, freeIndices);
      checkArgument(op.isTerminal());
    }

    /** Returns the domain on which this terminal is defined, or null if it is
     * defined everywhere. */
    public @Nullable Mesh domain() {
      return null;
    }

    @Override
    public boolean isCellwiseConstant() {
      return true;
    }
  }

  /** Base class of {@link Argument} and {@link Coefficient}: a function in
   * a function space. */
  public abstract static class FormFunction extends Terminal {
    public final FunctionSpace space;

    FormFunction(Op op, FunctionSpace space) {
      super(op, space.valueShape());
      this.space = space;
    }

    @Override
    public Mesh domain() {
      return space.mesh;
    }

    @Override
    public boolean isCellwiseConstant() {
      return space.element.isCellwiseConstant();
    }

    /** Whether this function is constant over the whole domain. */
    public boolean isGlobalConstant() {
      return space.element.isGlobalConstant();
    }
  }

  /** Unknown function: a test function (number 0), trial function
   * (number 1), or higher. */
  public static class Argument extends FormFunction {
    public final int number;

    Argument(FunctionSpace space, int number) {
      super(Op.ARGUMENT, space);
      checkArgument(number >= 0, "negative argument number %s", number);
      this.number = number;
    }

    @Override
    int compareMetadata(Exp e) {
      final Argument a = (Argument) e;
      final int c = Integer.compare(number, a.number);
      return c != 0 ? c : space.toString().compareTo(a.space.toString());
    }

    @Override
    boolean metadataEquals(Exp e) {
      return number == ((Argument) e).number
          && space.equals(((Argument) e).space);
    }

    @Override
    int metadataHash() {
      return Objects.hash(number, space);
    }
  }

  /** Known function, identified by its count. */
  public static class Coefficient extends FormFunction {
    public final int count;

    Coefficient(FunctionSpace space, int count) {
      super(Op.COEFFICIENT, space);
      this.count = count;
    }

    @Override
    int compareMetadata(Exp e) {
      final Coefficient c2 = (Coefficient) e;
      final int c = Integer.compare(count, c2.count);
      return c != 0 ? c : space.toString().compareTo(c2.space.toString());
    }

    @Override
    boolean metadataEquals(Exp e) {
      return count == ((Coefficient) e).count
          && space.equals(((Coefficient) e).space);
    }

    @Override
    int metadataHash() {
      return Objects.hash(count, space);
    }
  }

  /** Scalar literal. */
  public static class Constant extends Terminal {
    public final BigDecimal value;

    Constant(BigDecimal value) {
      super(Op.CONSTANT, Shape.SCALAR);
      this.value = value.signum() == 0 ? BigDecimal.ZERO
          : value.stripTrailingZeros();
    }

    /** Whether the value is an integer. */
    public boolean isInteger() {
      return value.signum() == 0 || value.scale() <= 0;
    }

    public boolean isOne() {
      return value.compareTo(BigDecimal.ONE) == 0;
    }

    @Override
    int compareMetadata(Exp e) {
      return value.compareTo(((Constant) e).value);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return value.equals(((Constant) e).value);
    }

    @Override
    int metadataHash() {
      return value.hashCode();
    }
  }

  /** Identity matrix of a given dimension. */
  public static class Identity extends Terminal {
    public final int dim;

    Identity(int dim) {
      super(Op.IDENTITY, Shape.of(dim, dim));
      this.dim = dim;
    }

    @Override
    int compareMetadata(Exp e) {
      return Integer.compare(dim, ((Identity) e).dim);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return dim == ((Identity) e).dim;
    }

    @Override
    int metadataHash() {
      return dim;
    }
  }

  /** Typed zero. It has a shape and may have free indices, so that it can
   * stand in for any expression. */
  public static class Zero extends Terminal {
    Zero(Shape shape, ImmutableSortedMap<Index, Integer> freeIndices) {
      super(Op.ZERO, shape, freeIndices);
    }

    @Override
    int compareMetadata(Exp e) {
      final int c = shape.compareTo(e.shape);
      return c != 0 ? c
          : freeIndices.toString().compareTo(e.freeIndices.toString());
    }

    @Override
    boolean metadataEquals(Exp e) {
      return shape.equals(e.shape) && freeIndices.equals(e.freeIndices);
    }

    @Override
    int metadataHash() {
      return Objects.hash(shape, freeIndices);
    }
  }

  /** Geometric quantity of a mesh: spatial coordinate, facet normal, cell
   * volume, circumradius or facet area. */
  public static class Geometric extends Terminal {
    public final Mesh mesh;

    Geometric(Op op, Mesh mesh) {
      super(op, shape(op, mesh));
      this.mesh = mesh;
    }

    private static Shape shape(Op op, Mesh mesh) {
      switch (op) {
      case SPATIAL_COORDINATE:
      case FACET_NORMAL:
        return Shape.of(mesh.geometricDimension());
      case CELL_VOLUME:
      case CIRCUMRADIUS:
      case FACET_AREA:
        return Shape.SCALAR;
      default:
        throw new AssertionError("not a geometric quantity: " + op);
      }
    }

    @Override
    public Mesh domain() {
      return mesh;
    }

    @Override
    public boolean isCellwiseConstant() {
      switch (op) {
      case SPATIAL_COORDINATE:
        return false;
      case FACET_NORMAL:
        return mesh.isAffine();
      default:
        return true;
      }
    }

    @Override
    int compareMetadata(Exp e) {
      return Mesh.ORDERING.compare(mesh, ((Geometric) e).mesh);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return mesh.equals(((Geometric) e).mesh);
    }

    @Override
    int metadataHash() {
      return mesh.hashCode();
    }
  }

  /** Tag that identifies a variable. */
  public static class Label extends Terminal {
    public final int count;

    Label(int count) {
      super(Op.LABEL, Shape.SCALAR);
      this.count = count;
    }

    @Override
    int compareMetadata(Exp e) {
      return Integer.compare(count, ((Label) e).count);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return count == ((Label) e).count;
    }

    @Override
    int metadataHash() {
      return count;
    }
  }

  /** Expression with one or more operands and no metadata other than its
   * kind. */
  public static class Operator extends Exp {
    Operator(Op op, ImmutableList<Exp> operands, Shape shape,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      super(op, operands, shape, freeIndices);
      checkArgument(!op.isTerminal());
    }
  }

  /** Component access {@code A[i, 0, j]}. */
  public static class Indexed extends Operator {
    public final ImmutableList<IndexBase> indices;

    Indexed(Exp operand, ImmutableList<IndexBase> indices,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      super(Op.INDEXED, ImmutableList.of(operand), Shape.SCALAR, freeIndices);
      this.indices = indices;
    }

    @Override
    int compareMetadata(Exp e) {
      return compareIndices(indices, ((Indexed) e).indices);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return indices.equals(((Indexed) e).indices);
    }

    @Override
    int metadataHash() {
      return indices.hashCode();
    }
  }

  /** Tensor whose components are given by a scalar expression with free
   * indices, {@code as_tensor(A, (i, j))}. */
  public static class ComponentTensor extends Operator {
    public final ImmutableList<Index> indices;

    ComponentTensor(Exp operand, ImmutableList<Index> indices, Shape shape,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      super(Op.COMPONENT_TENSOR, ImmutableList.of(operand), shape,
          freeIndices);
      this.indices = indices;
    }

    @Override
    int compareMetadata(Exp e) {
      return compareIndices(indices, ((ComponentTensor) e).indices);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return indices.equals(((ComponentTensor) e).indices);
    }

    @Override
    int metadataHash() {
      return indices.hashCode();
    }
  }

  /** Sum of an expression over all values of an index. */
  public static class IndexSum extends Operator {
    public final Index index;
    public final int dimension;

    IndexSum(Exp operand, Index index, int dimension,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      super(Op.INDEX_SUM, ImmutableList.of(operand), operand.shape,
          freeIndices);
      this.index = index;
      this.dimension = dimension;
    }

    @Override
    int compareMetadata(Exp e) {
      final IndexSum s = (IndexSum) e;
      final int c = index.compareTo(s.index);
      return c != 0 ? c : Integer.compare(dimension, s.dimension);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return index.equals(((IndexSum) e).index)
          && dimension == ((IndexSum) e).dimension;
    }

    @Override
    int metadataHash() {
      return Objects.hash(index, dimension);
    }
  }

  /** Spatial gradient. Appends the geometric dimension of the domain to the
   * shape of its operand. */
  public static class Grad extends Operator {
    /** Geometric dimension. */
    public final int dim;

    Grad(Exp operand, int dim) {
      super(Op.GRAD, ImmutableList.of(operand), operand.shape.append(dim),
          operand.freeIndices);
      this.dim = dim;
    }

    @Override
    public boolean isCellwiseConstant() {
      return operand(0).isCellwiseConstant();
    }

    @Override
    int compareMetadata(Exp e) {
      return Integer.compare(dim, ((Grad) e).dim);
    }

    @Override
    boolean metadataEquals(Exp e) {
      return dim == ((Grad) e).dim;
    }

    @Override
    int metadataHash() {
      return dim;
    }
  }
}

// End Core.java
