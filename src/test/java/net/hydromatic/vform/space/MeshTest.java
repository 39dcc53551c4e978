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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.vform.ast.Shape;
import org.junit.jupiter.api.Test;

/** Tests for {@link Mesh}, {@link FiniteElement} and
 * {@link FunctionSpace}. */
class MeshTest {
  @Test
  void testEquality() {
    final FiniteElement e = FiniteElement.vectorLagrange(Cell.TRIANGLE, 1, 2);
    assertThat(Mesh.of(e, 7), is(Mesh.of(e, 7)));
    assertThat(Mesh.of(e, 7).hashCode(), is(Mesh.of(e, 7).hashCode()));
    assertThat(Mesh.of(e, 7), not(is(Mesh.of(e, 8))));
    assertThat(Mesh.of(e), not(is(Mesh.of(e))));
    assertThat(
        Mesh.of(FiniteElement.vectorLagrange(Cell.TRIANGLE, 2, 2), 7),
        not(is(Mesh.of(e, 7))));
  }

  @Test
  void testProperties() {
    final Mesh triangle = Mesh.of(Cell.TRIANGLE);
    assertThat(triangle.geometricDimension(), is(2));
    assertThat(triangle.topologicalDimension(), is(2));
    assertThat(triangle.isAffine(), is(true));
    final Mesh manifold =
        Mesh.of(FiniteElement.vectorLagrange(Cell.TRIANGLE, 2, 3));
    assertThat(manifold.geometricDimension(), is(3));
    assertThat(manifold.topologicalDimension(), is(2));
    assertThat(manifold.isAffine(), is(false));

    // coordinate element must be a vector, of at least the cell's dimension
    assertThrows(IllegalArgumentException.class,
        () -> Mesh.of(FiniteElement.lagrange(Cell.TRIANGLE, 1)));
    assertThrows(IllegalArgumentException.class,
        () -> Mesh.of(FiniteElement.vectorLagrange(Cell.TETRAHEDRON, 1, 2)));
  }

  @Test
  void testJoinAndOrdering() {
    final Mesh t1 = Mesh.of(Cell.TRIANGLE);
    final Mesh t2 = Mesh.of(Cell.TRIANGLE);
    final Mesh tet = Mesh.of(Cell.TETRAHEDRON);
    assertThat(Mesh.join(ImmutableList.of(t2, t1, t2, tet, t1)),
        contains(t2, t1, tet));
    assertThat(Mesh.ORDERING.sortedCopy(ImmutableList.of(tet, t2, t1)),
        contains(t1, t2, tet));
  }

  @Test
  void testCell() {
    assertThat(Cell.lookup("tetrahedron"), is(Cell.TETRAHEDRON));
    assertThat(Cell.TRIANGLE.facetCount(), is(3));
    assertThat(Cell.HEXAHEDRON.facetCount(), is(6));
    assertThat(Cell.QUADRILATERAL.simplex, is(false));
    assertThrows(IllegalArgumentException.class, () -> Cell.lookup("cube"));
  }

  @Test
  void testFunctionSpace() {
    final Mesh mesh = Mesh.of(Cell.TRIANGLE);
    final FunctionSpace p1 =
        new FunctionSpace(mesh, FiniteElement.lagrange(Cell.TRIANGLE, 1));
    assertThat(p1.valueShape(), is(Shape.SCALAR));
    assertThat(p1,
        is(new FunctionSpace(mesh, FiniteElement.lagrange(Cell.TRIANGLE, 1))));
    final FunctionSpace real =
        new FunctionSpace(mesh, FiniteElement.real(Cell.TRIANGLE, Shape.of(2)));
    assertThat(real.valueShape(), is(Shape.of(2)));
    assertThat(real.element.isGlobalConstant(), is(true));
    assertThat(real.element.isCellwiseConstant(), is(true));
    assertThat(p1.element.isCellwiseConstant(), is(false));
  }
}

// End MeshTest.java
