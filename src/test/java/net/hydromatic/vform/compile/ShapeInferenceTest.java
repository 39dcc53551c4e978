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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.Shape;
import org.junit.jupiter.api.Test;

/** Tests for {@link ShapeInference} and {@link Resolver}. */
class ShapeInferenceTest {
  private final Fixtures f = new Fixtures();

  private static void checkShape(Core.Exp e, Shape expected) {
    assertThat(e.toString(), e.shape, is(expected));
    assertThat(ShapeInference.recompute(e).shape, is(expected));
  }

  @Test
  void testTensorAlgebra() {
    checkShape(core.inner(f.a, f.a), Shape.SCALAR);
    checkShape(core.outer(f.w, f.w), Shape.of(2, 2));
    checkShape(core.outer(f.w, f.a), Shape.of(2, 2, 2));
    checkShape(core.dot(f.a, f.w), Shape.of(2));
    checkShape(core.dot(f.w, f.w), Shape.SCALAR);
    checkShape(core.transposed(core.zero(Shape.of(2, 3))), Shape.of(3, 2));
    checkShape(core.trace(f.a), Shape.SCALAR);
    checkShape(core.determinant(f.a), Shape.SCALAR);
    checkShape(core.inverse(f.a), Shape.of(2, 2));
    checkShape(core.deviatoric(f.a), Shape.of(2, 2));
    checkShape(core.listTensor(f.f, f.g, f.v), Shape.of(3));
    checkShape(core.listTensor(f.w, f.w), Shape.of(2, 2));
    final Core.Exp w3 = core.coefficient(f.vp1Tet, 30);
    checkShape(core.cross(w3, w3), Shape.of(3));
    assertThrows(ShapeMismatchException.class, () -> core.cross(f.w, f.w));
    assertThrows(ShapeMismatchException.class, () -> core.dot(f.f, f.w));
  }

  @Test
  void testDifferential() {
    checkShape(core.grad(f.f), Shape.of(2));
    checkShape(core.grad(f.w), Shape.of(2, 2));
    checkShape(core.grad(core.grad(f.f)), Shape.of(2, 2));
    checkShape(core.div(f.w), Shape.SCALAR);
    checkShape(core.div(f.a), Shape.of(2));
    checkShape(core.curl(f.w), Shape.SCALAR);
    final Core.Exp w3 = core.coefficient(f.vp1Tet, 31);
    checkShape(core.curl(w3), Shape.of(3));
    checkShape(core.timeDerivative(f.w), Shape.of(2));
    assertThrows(ShapeMismatchException.class, () -> core.div(f.f));

    // gradient of an expression with no domain
    assertThrows(ShapeMismatchException.class,
        () -> core.grad(core.constant(3)));
  }

  @Test
  void testRestrictions() {
    final Core.Exp n = core.facetNormal(f.triangle);
    checkShape(core.plusSide(f.w), Shape.of(2));
    checkShape(core.avg(f.a), Shape.of(2, 2));
    checkShape(core.jump(f.f), Shape.SCALAR);
    checkShape(core.jump(f.f, n), Shape.of(2));
    checkShape(core.jump(f.w, n), Shape.SCALAR);
    checkShape(core.jump(f.a, n), Shape.of(2));
  }

  @Test
  void testVariableDerivative() {
    final Core.Exp x = core.variable(f.a);
    checkShape(core.variableDerivative(core.trace(x), x), Shape.of(2, 2));
    checkShape(core.variableDerivative(x, x), Shape.of(2, 2, 2, 2));
    assertThrows(DifferentiationException.class,
        () -> core.variableDerivative(f.f, f.g));
  }

  @Test
  void testCoefficientDerivative() {
    checkShape(core.coefficientDerivative(f.a, f.w, f.w), Shape.of(2, 2));
    assertThrows(ShapeMismatchException.class,
        () -> core.coefficientDerivative(f.f, f.w, f.v));
    assertThrows(DifferentiationException.class,
        () -> core.coefficientDerivative(f.f, f.v, f.v));
  }

  @Test
  void testResolve() {
    final Index i = Index.create();
    final Index j = Index.create();
    final Core.Exp e =
        core.indexSum(
            core.product(core.indexed(f.a, i, j), core.indexed(f.w, j)), i);
    final Resolver.Resolution resolution = Resolver.resolve(e);
    assertThat(resolution.range(i), is(2));
    assertThat(resolution.range(j), is(2));
    Resolver.checkResolved(e);
    Resolver.validate(e);

    final Core.Exp wi = core.indexed(f.w, i);
    assertThrows(UnresolvedIndexException.class,
        () -> Resolver.checkResolved(wi));
    assertThrows(UnresolvedIndexException.class,
        () -> Resolver.validate(wi));
    assertThrows(UnresolvedIndexException.class,
        () -> Resolver.resolve(wi).range(Index.create()));
  }

  /** A label used with two different ranges fails. */
  @Test
  void testRangeConflict() {
    final Index i = Index.create();
    final Core.Exp w3 = core.coefficient(f.vp1Tet, 32);
    assertThrows(ShapeMismatchException.class,
        () -> core.product(core.indexed(f.w, i), core.indexed(w3, i)));
  }
}

// End ShapeInferenceTest.java
