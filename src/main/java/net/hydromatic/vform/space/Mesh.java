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
package net.hydromatic.vform.space;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Integration domain.
 *
 * <p>A mesh is identified by its id and its coordinate element. Two meshes
 * created with the same id and an equal coordinate element are equal.
 */
public class Mesh {
  private static final AtomicInteger NEXT_ID = new AtomicInteger(1000);

  /** Ordering by geometric dimension, topological dimension, cell and id. */
  public static final Ordering<Mesh> ORDERING =
      Ordering.from(
          Comparator.comparingInt(Mesh::geometricDimension)
              .thenComparingInt(Mesh::topologicalDimension)
              .thenComparing(Mesh::cell)
              .thenComparingInt(m -> m.id));

  public final FiniteElement coordinateElement;
  public final int id;

  private Mesh(FiniteElement coordinateElement, int id) {
    this.coordinateElement = requireNonNull(coordinateElement);
    this.id = id;
    checkArgument(coordinateElement.valueShape.rank() == 1,
        "coordinate element must be vector-valued: %s", coordinateElement);
    checkArgument(
        coordinateElement.valueShape.dim(0)
            >= coordinateElement.cell.topologicalDimension,
        "geometric dimension is less than topological dimension of %s",
        coordinateElement.cell);
  }

  /** Creates a mesh with a given id. */
  public static Mesh of(FiniteElement coordinateElement, int id) {
    return new Mesh(coordinateElement, id);
  }

  /** Creates a mesh with a new unique id. */
  public static Mesh of(FiniteElement coordinateElement) {
    return new Mesh(coordinateElement, NEXT_ID.getAndIncrement());
  }

  /** Creates an affine mesh of a given cell, embedded in a space of the same
   * dimension as the cell. */
  public static Mesh of(Cell cell) {
    return of(
        FiniteElement.vectorLagrange(cell, 1, cell.topologicalDimension));
  }

  /** Returns the list of distinct meshes in a list, in order of first
   * occurrence. */
  public static List<Mesh> join(Iterable<Mesh> meshes) {
    final Set<Mesh> set = new LinkedHashSet<>();
    meshes.forEach(set::add);
    return ImmutableList.copyOf(set);
  }

  public Cell cell() {
    return coordinateElement.cell;
  }

  public int geometricDimension() {
    return coordinateElement.valueShape.dim(0);
  }

  public int topologicalDimension() {
    return coordinateElement.cell.topologicalDimension;
  }

  /** Whether the coordinate field is affine, in which case facet normals and
   * cell volumes are constant on each cell. */
  public boolean isAffine() {
    return coordinateElement.cell.simplex && coordinateElement.degree == 1;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, coordinateElement);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Mesh
            && id == ((Mesh) o).id
            && coordinateElement.equals(((Mesh) o).coordinateElement);
  }

  @Override
  public String toString() {
    return "Mesh(" + coordinateElement + ", " + id + ")";
  }
}

// End Mesh.java
