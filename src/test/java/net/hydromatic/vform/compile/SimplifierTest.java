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
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.FixedIndex;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.Shape;
import net.hydromatic.vform.ast.Traversals;
import org.junit.jupiter.api.Test;

/** Tests for {@link Simplifier}. */
class SimplifierTest {
  private final Fixtures f = new Fixtures();

  private static void checkSimplify(String message, Core.Exp e,
      String expectedToString) {
    final Core.Exp e2 = Simplifier.simplify(e);
    assertThat(message, e2, hasToString(expectedToString));
  }

  private static void checkZero(Core.Exp e) {
    final Core.Exp e2 = Simplifier.simplify(e);
    assertThat(e.toString(), Simplifier.isZero(e2), is(true));
    assertThat(e2.shape, is(e.shape));
  }

  @Test
  void testIdentities() {
    checkSimplify("x + 0 => x", core.sum(f.f, core.zero(Shape.SCALAR)),
        "w_1");
    checkSimplify("x * 1 => x", core.product(f.f, core.one()), "w_1");
    checkSimplify("x / 1 => x", core.division(f.f, core.one()), "w_1");
    checkSimplify("x ** 1 => x", core.power(f.f, core.one()), "w_1");
    checkSimplify("x ** 0 => 1", core.power(f.f, core.constant(0)), "1");
    checkSimplify("x + x => 2 * x", core.sum(f.f, f.f), "2 * w_1");
    checkSimplify("2 * x * 3 => 6 * x",
        core.product(core.constant(2), f.f, core.constant(3)), "6 * w_1");
    checkZero(core.product(f.f, core.constant(0)));
    checkZero(core.product(f.f, core.zero(Shape.SCALAR), f.g));
    checkZero(core.sum(f.f, core.negate(f.f)));
    checkZero(core.division(core.zero(Shape.SCALAR), f.f));
  }

  @Test
  void testConstantFolding() {
    assertThat(Simplifier.simplify(core.sum(core.constant(2), core.constant(3))),
        is(core.constant(5)));
    assertThat(
        Simplifier.simplify(core.division(core.constant(6), core.constant(4))),
        is(core.constant(new BigDecimal("1.5"))));
    assertThat(
        Simplifier.simplify(core.power(core.constant(2), core.constant(10))),
        is(core.constant(1024)));
    assertThat(Simplifier.simplify(core.abs(core.constant(-3))),
        is(core.constant(3)));
    assertThat(Simplifier.simplify(core.sign(core.constant(-3))),
        is(core.constant(-1)));
    assertThat(Simplifier.simplify(core.sqrt(core.constant(4))),
        is(core.constant(2)));
    assertThat(
        Simplifier.simplify(
            core.sum(core.constant(1), f.f, core.constant(2))),
        hasToString("w_1 + 3"));
  }

  @Test
  void testDivisionByZero() {
    assertThrows(ArithmeticException.class,
        () -> Simplifier.simplify(core.division(f.f, core.constant(0))));
    assertThrows(ArithmeticException.class,
        () -> Simplifier.simplify(core.inverse(core.zero(Shape.of(2, 2)))));
  }

  @Test
  void testTensorAlgebra() {
    final Core.Identity i2 = core.identity(2);
    assertThat(Simplifier.simplify(core.trace(core.identity(3))),
        is(core.constant(3)));
    assertThat(Simplifier.simplify(core.determinant(i2)), is(core.one()));
    assertThat(Simplifier.simplify(core.inverse(i2)), is(i2));
    assertThat(Simplifier.simplify(core.transposed(core.transposed(f.a))),
        sameInstance(f.a));
    assertThat(Simplifier.simplify(core.dot(f.a, i2)), sameInstance(f.a));
    checkZero(core.deviatoric(i2));
    checkZero(core.inner(f.a, core.zero(Shape.of(2, 2))));
    checkZero(core.outer(f.w, core.zero(Shape.of(2))));
    checkZero(core.grad(core.product(f.f, core.constant(0))));
  }

  @Test
  void testIndexNotation() {
    final Index i = Index.create();
    final Index j = Index.create();
    final Index k = Index.create();
    final Index l = Index.create();

    // as_tensor(A[i, j], (i, j)) => A
    assertThat(
        Simplifier.simplify(
            core.componentTensor(core.indexed(f.a, i, j), i, j)),
        sameInstance(f.a));

    // as_tensor(A[i, j], (i, j))[k, l] => A[k, l]
    assertThat(
        Simplifier.simplify(
            core.indexed(core.componentTensor(core.indexed(f.a, i, j), i, j),
                k, l)),
        is(core.indexed(f.a, k, l)));

    // [w[0], w[1]] => w
    assertThat(
        Simplifier.simplify(
            core.listTensor(core.indexed(f.w, FixedIndex.of(0)),
                core.indexed(f.w, FixedIndex.of(1)))),
        sameInstance(f.w));

    // [f, g][1] => g
    assertThat(
        Simplifier.simplify(
            core.indexed(core.listTensor(f.f, f.g), FixedIndex.of(1))),
        sameInstance(f.g));

    // I[0, 1] => 0, I[1, 1] => 1
    checkZero(core.indexed(core.identity(2), FixedIndex.of(0),
        FixedIndex.of(1)));
    assertThat(
        Simplifier.simplify(
            core.indexed(core.identity(2), FixedIndex.of(1),
                FixedIndex.of(1))),
        is(core.one()));
  }

  /** Contractions are rewritten as compound operators only if index notation
   * is being lowered. */
  @Test
  void testLowerIndexNotation() {
    final Index i = Index.create();
    final Core.Exp wiwi =
        core.product(core.indexed(f.w, i), core.indexed(f.w, i));
    assertThat(Simplifier.simplify(wiwi, true), is(core.inner(f.w, f.w)));
    assertThat(Simplifier.simplify(wiwi, false).op, is(Op.PRODUCT));

    final Core.Exp aii = core.indexed(f.a, i, i);
    assertThat(Simplifier.simplify(aii, true), is(core.trace(f.a)));
    assertThat(Simplifier.simplify(aii, false).op, is(Op.INDEXED));
  }

  @Test
  void testConditions() {
    final Core.Exp lt = core.lt(core.constant(1), core.constant(2));
    assertThat(Simplifier.simplify(core.conditional(lt, f.f, f.g)),
        sameInstance(f.f));
    assertThat(
        Simplifier.simplify(core.conditional(core.not(lt), f.f, f.g)),
        sameInstance(f.g));
    final Core.Exp c = core.lt(f.f, f.g);
    assertThat(Simplifier.simplify(core.conditional(c, f.v, f.v)),
        sameInstance(f.v));
    assertThat(Simplifier.simplify(core.not(core.not(c))), is(c));
  }

  @Test
  void testRestrictions() {
    assertThat(Simplifier.simplify(core.avg(f.k)), sameInstance(f.k));
    assertThat(Simplifier.simplify(core.plusSide(core.constant(2))),
        is(core.constant(2)));
    checkZero(core.jump(f.k));
    checkZero(core.jump(core.constant(3)));
    assertThat(Simplifier.simplify(core.jump(f.f)).op, is(Op.JUMP));
    assertThat(Simplifier.simplify(core.avg(f.f)).op, is(Op.AVG));
  }

  /** A label that is contracted inside a component tensor may be used again
   * outside it; indexing the tensor must not capture it. */
  @Test
  void testReusedLabel() {
    final Index i = Index.create();
    final Index j = Index.create();
    final Index k = Index.create();
    final Core.Exp reused = Simplifier.simplify(f.quadratic(i, j, j));
    final Core.Exp distinct = Simplifier.simplify(f.quadratic(i, k, j));
    assertThat(reused.toString(), Traversals.containsOp(reused, Op.TRACE),
        is(false));
    assertThat(Signatures.signature(reused),
        is(Signatures.signature(distinct)));
    assertThat(reused.freeIndices.isEmpty(), is(true));

    // an index sum that reuses the label of the enclosing component tensor
    final Core.Exp t =
        core.componentTensor(
            core.product(core.indexed(f.w, i),
                core.indexSum(
                    core.product(core.indexed(f.a, i, j),
                        core.indexed(f.w, j)), i)),
            i);
    final Core.Exp e = core.indexed(t, k);
    final Core.Exp e2 = Simplifier.simplify(e);
    final Core.Exp expected =
        Simplifier.simplify(
            core.product(core.indexed(f.w, k),
                core.indexSum(
                    core.product(core.indexed(f.a, i, j),
                        core.indexed(f.w, j)), i)));
    assertThat(Signatures.signature(e2), is(Signatures.signature(expected)));
    assertThat(e2.freeIndices.keySet(), contains(k));
  }

  /** Simplification preserves shape and free indices. */
  @Test
  void testShapePreserved() {
    final Index i = Index.create();
    final Index j = Index.create();
    final List<Core.Exp> list =
        ImmutableList.of(
            core.sum(f.a, core.zero(Shape.of(2, 2))),
            core.product(core.constant(0), f.w),
            core.product(core.indexed(f.a, i, j), core.one()),
            core.sum(core.indexed(f.w, i), core.indexed(f.w, i)),
            core.componentTensor(
                core.product(core.indexed(f.a, i, j), core.constant(0)), j),
            core.dot(core.identity(2), f.w),
            core.transposed(core.zero(Shape.of(2, 3))),
            core.jump(f.k, core.facetNormal(f.triangle)),
            core.indexSum(
                core.product(core.indexed(f.w, i), core.indexed(f.a, i, j)),
                i));
    for (Core.Exp e : list) {
      final Core.Exp e2 = Simplifier.simplify(e);
      assertThat(e.toString(), e2.shape, is(e.shape));
      assertThat(e.toString(), e2.freeIndices, is(e.freeIndices));
    }
  }
}

// End SimplifierTest.java
