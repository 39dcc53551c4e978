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
package net.hydromatic.vform;

import static net.hydromatic.vform.ast.CoreBuilder.core;

import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.Shape;
import net.hydromatic.vform.space.Cell;
import net.hydromatic.vform.space.FiniteElement;
import net.hydromatic.vform.space.FunctionSpace;
import net.hydromatic.vform.space.Mesh;

/** Meshes, function spaces and terminals shared by tests.
 *
 * <p>Coefficients are created with explicit counts, so that tests do not
 * depend on the order in which they run. */
public class Fixtures {
  /** Affine triangle mesh in 2D. */
  public final Mesh triangle =
      Mesh.of(FiniteElement.vectorLagrange(Cell.TRIANGLE, 1, 2), 1);

  /** Affine tetrahedron mesh in 3D. */
  public final Mesh tetrahedron =
      Mesh.of(FiniteElement.vectorLagrange(Cell.TETRAHEDRON, 1, 3), 2);

  /** Scalar P1 space on the triangle mesh. */
  public final FunctionSpace p1 =
      new FunctionSpace(triangle, FiniteElement.lagrange(Cell.TRIANGLE, 1));

  /** Scalar P2 space on the triangle mesh. */
  public final FunctionSpace p2 =
      new FunctionSpace(triangle, FiniteElement.lagrange(Cell.TRIANGLE, 2));

  /** Vector P1 space on the triangle mesh. */
  public final FunctionSpace vp1 =
      new FunctionSpace(triangle,
          FiniteElement.vectorLagrange(Cell.TRIANGLE, 1, 2));

  /** Tensor P1 space on the triangle mesh, values of shape (2, 2). */
  public final FunctionSpace tp1 =
      new FunctionSpace(triangle,
          new FiniteElement("Lagrange", Cell.TRIANGLE, 1, Shape.of(2, 2)));

  /** Space of global scalar constants on the triangle mesh. */
  public final FunctionSpace real =
      new FunctionSpace(triangle,
          FiniteElement.real(Cell.TRIANGLE, Shape.SCALAR));

  /** Vector P1 space on the tetrahedron mesh. */
  public final FunctionSpace vp1Tet =
      new FunctionSpace(tetrahedron,
          FiniteElement.vectorLagrange(Cell.TETRAHEDRON, 1, 3));

  /** Test function. */
  public final Core.Argument v = core.argument(p1, 0);
  /** Trial function. */
  public final Core.Argument u = core.argument(p1, 1);
  /** Scalar coefficient. */
  public final Core.Coefficient f = core.coefficient(p1, 1);
  /** Another scalar coefficient. */
  public final Core.Coefficient g = core.coefficient(p1, 2);
  /** Vector coefficient. */
  public final Core.Coefficient w = core.coefficient(vp1, 3);
  /** Tensor coefficient. */
  public final Core.Coefficient a = core.coefficient(tp1, 4);
  /** Global constant. */
  public final Core.Coefficient k = core.coefficient(real, 5);

  /** Returns {@code as_tensor(A[i, k] * w[k], (i,))[j] * w[j]}, the
   * quadratic form {@code w . A . w}. The labels need not be distinct:
   * {@code k} is bound inside the component tensor and {@code j} outside
   * it. */
  public Core.Exp quadratic(Index i, Index k, Index j) {
    final Core.Exp aw =
        core.componentTensor(
            core.product(core.indexed(a, i, k), core.indexed(w, k)), i);
    return core.product(core.indexed(aw, j), core.indexed(w, j));
  }
}

// End Fixtures.java
