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

import static net.hydromatic.vform.ast.CoreBuilder.core;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.compile.ArityException;
import net.hydromatic.vform.compile.IndexRepetitionException;
import net.hydromatic.vform.compile.ShapeMismatchException;
import org.junit.jupiter.api.Test;

/** Tests for {@link CoreBuilder} and the nodes it creates. */
class CoreBuilderTest {
  private final Fixtures f = new Fixtures();

  @Test
  void testTerminals() {
    assertThat(f.v.shape, is(Shape.SCALAR));
    assertThat(f.w.shape, is(Shape.of(2)));
    assertThat(f.a.shape, is(Shape.of(2, 2)));
    assertThat(core.identity(3).shape, is(Shape.of(3, 3)));
    assertThat(core.spatialCoordinate(f.triangle).shape, is(Shape.of(2)));
    assertThat(core.cellVolume(f.triangle).shape, is(Shape.SCALAR));
    assertThat(f.v.isTerminal(), is(true));
    assertThat(core.constant(0), sameInstance(core.constant(0L)));
    assertThat(core.constant(1), sameInstance(core.one()));
  }

  /** Two structurally identical nodes constructed separately are equal but
   * have different identities. */
  @Test
  void testIdentityAndEquality() {
    final Core.Exp e1 = core.sum(f.f, core.product(core.constant(2), f.g));
    final Core.Exp e2 = core.sum(f.f, core.product(core.constant(2), f.g));
    assertThat(e1, is(e2));
    assertThat(e1.hashCode(), is(e2.hashCode()));
    assertThat(e1.id, not(is(e2.id)));
    assertThat(e1, not(sameInstance(e2)));
    assertThat(core.sum(f.g, f.f), not(is(core.sum(f.f, f.g))));
  }

  @Test
  void testToString() {
    final Core.Exp e = core.sum(f.f, core.product(core.constant(2), f.g));
    assertThat(e, hasToString("w_1 + 2 * w_2"));
    assertThat(core.grad(f.v), hasToString("grad(v_0)"));
  }

  @Test
  void testArity() {
    assertThrows(ArityException.class,
        () -> core.apply(Op.SUM, ImmutableList.of(f.f)));
    assertThrows(ArityException.class,
        () -> core.apply(Op.DIVISION, ImmutableList.of(f.f, f.g, f.f)));
    assertThrows(ArityException.class,
        () -> core.apply(Op.SIN, ImmutableList.of()));
    assertThat(core.apply(Op.SUM, ImmutableList.of(f.f, f.g, f.v)).operands
        .size(), is(3));
  }

  /** Adding tensors of shapes (2, 3) and (3, 2) fails. */
  @Test
  void testShapeMismatch() {
    final Core.Exp m23 = core.zero(Shape.of(2, 3));
    final Core.Exp m32 = core.zero(Shape.of(3, 2));
    assertThrows(ShapeMismatchException.class, () -> core.sum(m23, m32));
    assertThrows(ShapeMismatchException.class, () -> core.inner(m23, m32));
    assertThrows(ShapeMismatchException.class, () -> core.trace(m23));
    assertThrows(ShapeMismatchException.class, () -> core.product(f.w, f.a));
    assertThrows(ShapeMismatchException.class, () -> core.sqrt(f.w));
    assertThrows(ShapeMismatchException.class,
        () -> core.division(f.f, f.w));
  }

  /** An index label that occurs three times in a product fails. */
  @Test
  void testIndexRepetition() {
    final Index i = Index.create();
    final Core.Exp wi = core.indexed(f.w, i);
    assertThrows(IndexRepetitionException.class,
        () -> core.product(wi, wi, wi));
    final Index j = Index.create();
    final Core.Exp aij = core.indexed(f.a, i, j);
    assertThrows(IndexRepetitionException.class,
        () -> core.product(aij, wi, wi));
  }

  @Test
  void testFreeIndices() {
    final Index i = Index.create();
    final Index j = Index.create();
    final Core.Exp aij = core.indexed(f.a, i, j);
    assertThat(aij.shape, is(Shape.SCALAR));
    assertThat(aij.freeIndices.keySet(), contains(i, j));

    // repeated index in a product is contracted
    final Core.Exp wiwi =
        core.product(core.indexed(f.w, i), core.indexed(f.w, i));
    assertThat(wiwi.freeIndices.isEmpty(), is(true));

    // component tensor binds indices
    final Core.Exp t = core.componentTensor(aij, j, i);
    assertThat(t.shape, is(Shape.of(2, 2)));
    assertThat(t.freeIndices.isEmpty(), is(true));

    // index sum binds its index
    final Core.Exp s = core.indexSum(core.indexed(f.w, i), i);
    assertThat(s.freeIndices.isEmpty(), is(true));
  }

  @Test
  void testConditional() {
    final Core.Exp c = core.lt(f.f, f.g);
    final Core.Exp e = core.conditional(c, f.f, f.g);
    assertThat(e.shape, is(Shape.SCALAR));
    assertThrows(ShapeMismatchException.class,
        () -> core.conditional(c, f.f, f.w));
    assertThrows(ShapeMismatchException.class, () -> core.sum(c, f.f));
  }
}

// End CoreBuilderTest.java
