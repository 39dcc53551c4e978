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
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.Shape;
import org.junit.jupiter.api.Test;

/** Tests for {@link Signatures} and {@link ExprArena}. */
class SignatureTest {
  private final Fixtures f = new Fixtures();

  private static String sig(Core.Exp e) {
    return Signatures.signature(e);
  }

  @Test
  void testFormat() {
    final String s = sig(core.sum(f.f, f.g));
    assertThat(s.length(), is(64));
    assertThat(s.matches("[0-9a-f]+"), is(true));
    assertThat(sig(core.sum(f.f, f.g)), is(s));
  }

  /** Reordering the operands of a commutative operator does not change the
   * signature. */
  @Test
  void testCommutative() {
    assertThat(sig(core.sum(f.f, f.g)), is(sig(core.sum(f.g, f.f))));
    assertThat(sig(core.product(f.f, f.g, f.v)),
        is(sig(core.product(f.v, f.f, f.g))));
    assertThat(
        sig(core.sum(core.product(f.f, f.v), core.sin(f.g))),
        is(sig(core.sum(core.sin(f.g), core.product(f.v, f.f)))));
  }

  /** Reordering the operands of a non-commutative operator changes the
   * signature. */
  @Test
  void testNonCommutative() {
    assertThat(sig(core.division(f.f, f.g)),
        not(is(sig(core.division(f.g, f.f)))));
    assertThat(sig(core.power(f.f, f.g)),
        not(is(sig(core.power(f.g, f.f)))));
    assertThat(sig(core.dot(f.a, f.w)), not(is(sig(core.dot(f.w, f.a)))));
  }

  /** Structurally distinct expressions have distinct signatures. */
  @Test
  void testDistinct() {
    final List<Core.Exp> list =
        ImmutableList.of(f.f, f.g, f.v, f.u, core.constant(2),
            core.constant(3), core.sum(f.f, f.g), core.product(f.f, f.g),
            core.sum(f.f, f.f), core.product(f.f, f.f), core.sin(f.f),
            core.cos(f.f), core.grad(f.f), core.grad(f.g),
            core.grad(core.grad(f.f)), core.identity(2), core.identity(3),
            core.zero(Shape.of(2)), core.zero(Shape.of(3)),
            core.inner(f.a, f.a), core.trace(f.a), core.plusSide(f.f),
            core.minusSide(f.f), core.sum(f.f, core.constant(2)),
            core.sum(f.f, core.constant(3)));
    final Set<String> signatures = new HashSet<>();
    for (Core.Exp e : list) {
      signatures.add(sig(e));
    }
    assertThat(signatures.size(), is(list.size()));
  }

  /** Expressions that differ only in the choice of index labels have the
   * same signature. */
  @Test
  void testIndexRenumbering() {
    final Index i = Index.create();
    final Index j = Index.create();
    final Core.Exp e1 =
        core.product(core.indexed(f.w, i), core.indexed(f.w, i));
    final Core.Exp e2 =
        core.product(core.indexed(f.w, j), core.indexed(f.w, j));
    assertThat(sig(e1), is(sig(e2)));

    final Core.Exp t1 = core.componentTensor(core.indexed(f.a, i, j), i, j);
    final Core.Exp t2 = core.componentTensor(core.indexed(f.a, j, i), j, i);
    final Core.Exp t3 = core.componentTensor(core.indexed(f.a, i, j), j, i);
    assertThat(sig(t1), is(sig(t2)));
    assertThat(sig(t1), not(is(sig(t3))));
  }

  /** Reordering operands that differ only in their labels does not change
   * the signature. */
  @Test
  void testCommutativeWithLabels() {
    final Index i = Index.create();
    final Index j = Index.create();
    final Index k = Index.create();
    final Index l = Index.create();
    final Core.Exp wi = core.indexed(f.w, i);
    final Core.Exp wj = core.indexed(f.w, j);

    // as_tensor(w[i] * w[j], (i, j)) and as_tensor(w[j] * w[i], (i, j))
    final Core.Exp t1 = core.componentTensor(core.product(wi, wj), i, j);
    final Core.Exp t2 = core.componentTensor(core.product(wj, wi), i, j);
    assertThat(sig(t1), is(sig(t2)));

    // the transpose, as_tensor(w[i] * w[j], (j, i)), is different
    final Core.Exp t3 = core.componentTensor(core.product(wi, wj), j, i);
    assertThat(sig(t1), not(is(sig(t3))));

    // sum over k, l of A[k, l] * w[k] * w[l], with the vector factors in
    // either order; their labels are numbered only when A is rendered
    final Core.Exp akl = core.indexed(f.a, k, l);
    final Core.Exp wk = core.indexed(f.w, k);
    final Core.Exp wl = core.indexed(f.w, l);
    final Core.Exp q1 = core.product(wk, wl, akl);
    final Core.Exp q2 = core.product(wl, wk, akl);
    final Core.Exp q3 = core.product(akl, wl, wk);
    assertThat(sig(q1), is(sig(q2)));
    assertThat(sig(q1), is(sig(q3)));

    // sum over k, l of A[k, l] * w[l] * v[k] is a different expression from
    // A[k, l] * w[k] * v[l]
    final Core.Exp w2 = core.coefficient(f.vp1, 41);
    final Core.Exp r1 =
        core.product(akl, core.indexed(f.w, l), core.indexed(w2, k));
    final Core.Exp r2 =
        core.product(core.indexed(w2, k), akl, core.indexed(f.w, l));
    final Core.Exp r3 =
        core.product(akl, core.indexed(f.w, k), core.indexed(w2, l));
    assertThat(sig(r1), is(sig(r2)));
    assertThat(sig(r1), not(is(sig(r3))));
  }

  @Test
  void testArena() {
    final ExprArena arena = new ExprArena();
    final Core.Exp e1 = core.sum(core.sin(f.f), core.sin(f.f));
    final Core.Exp e2 = core.sum(core.sin(f.f), core.sin(f.f));
    final Core.Exp i1 = arena.intern(e1);
    final Core.Exp i2 = arena.intern(e2);
    assertThat(i1, sameInstance(i2));
    assertThat(i1, is(e1));

    // the two equal operands are shared after interning
    assertThat(i1.operand(0), sameInstance(i1.operand(1)));
    assertThat(arena.indexOf(e2), is(arena.indexOf(i1)));
    assertThat(arena.indexOf(core.cos(f.f)), is(-1));

    // f, sin(f), sin(f) + sin(f)
    assertThat(arena.size(), is(3));
  }
}

// End SignatureTest.java
