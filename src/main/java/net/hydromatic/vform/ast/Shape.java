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
import java.util.List;

/**
 * Shape of a tensor-valued expression: an ordered list of non-negative
 * dimensions.
 *
 * <p>A scalar has the empty shape, {@link #SCALAR}; a 3-vector has shape
 * {@code (3)}; a 2 by 3 matrix has shape {@code (2, 3)}.
 */
public final class Shape implements Comparable<Shape> {
  public static final Shape SCALAR = new Shape(ImmutableList.of());

  public final ImmutableList<Integer> dims;

  private Shape(ImmutableList<Integer> dims) {
    this.dims = dims;
  }

  /** Creates a shape. */
  public static Shape of(int... dims) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int dim : dims) {
      b.add(dim);
    }
    return of(b.build());
  }

  /** Creates a shape from a list of dimensions. */
  public static Shape of(List<Integer> dims) {
    if (dims.isEmpty()) {
      return SCALAR;
    }
    for (int dim : dims) {
      checkArgument(dim >= 0, "negative dimension %s", dim);
    }
    return new Shape(ImmutableList.copyOf(dims));
  }

  public int rank() {
    return dims.size();
  }

  public boolean isScalar() {
    return dims.isEmpty();
  }

  public int dim(int i) {
    return dims.get(i);
  }

  /** Returns the last dimension. */
  public int last() {
    return dims.get(dims.size() - 1);
  }

  /** Number of scalar components. */
  public int size() {
    int n = 1;
    for (int dim : dims) {
      n *= dim;
    }
    return n;
  }

  /** Whether this is a square rank-2 shape. */
  public boolean isSquare() {
    return dims.size() == 2 && dims.get(0).equals(dims.get(1));
  }

  /** Returns this shape with one dimension appended. */
  public Shape append(int dim) {
    return of(
        ImmutableList.<Integer>builder().addAll(dims).add(dim).build());
  }

  /** Returns this shape followed by another. */
  public Shape concat(Shape shape) {
    if (shape.isScalar()) {
      return this;
    }
    if (isScalar()) {
      return shape;
    }
    return of(
        ImmutableList.<Integer>builder().addAll(dims).addAll(shape.dims)
            .build());
  }

  /** Returns this shape with its first {@code n} dimensions removed. */
  public Shape skip(int n) {
    return of(dims.subList(n, dims.size()));
  }

  /** Returns this shape with its last {@code n} dimensions removed. */
  public Shape skipLast(int n) {
    return of(dims.subList(0, dims.size() - n));
  }

  /** Returns the shape with the first {@code n} dimensions. */
  public Shape prefix(int n) {
    return of(dims.subList(0, n));
  }

  /** Whether this shape ends with the given shape. */
  public boolean endsWith(Shape suffix) {
    return suffix.rank() <= rank()
        && dims.subList(rank() - suffix.rank(), rank()).equals(suffix.dims);
  }

  /** Returns the components of this shape in row-major order; each component
   * is a list of integers of length {@link #rank()}. */
  public List<List<Integer>> components() {
    final ImmutableList.Builder<List<Integer>> b = ImmutableList.builder();
    addComponents(b, ImmutableList.of());
    return b.build();
  }

  private void addComponents(ImmutableList.Builder<List<Integer>> b,
      ImmutableList<Integer> prefix) {
    if (prefix.size() == dims.size()) {
      b.add(prefix);
      return;
    }
    final int dim = dims.get(prefix.size());
    for (int i = 0; i < dim; i++) {
      addComponents(b,
          ImmutableList.<Integer>builder().addAll(prefix).add(i).build());
    }
  }

  @Override
  public int compareTo(Shape o) {
    int c = Integer.compare(dims.size(), o.dims.size());
    for (int i = 0; c == 0 && i < dims.size(); i++) {
      c = Integer.compare(dims.get(i), o.dims.get(i));
    }
    return c;
  }

  @Override
  public int hashCode() {
    return dims.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Shape && dims.equals(((Shape) o).dims);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("(");
    for (int i = 0; i < dims.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(dims.get(i));
    }
    return b.append(")").toString();
  }
}

// End Shape.java
