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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Index;
import org.junit.jupiter.api.Test;

/** Tests for {@link Analysis}. */
class AnalysisTest {
  private final Fixtures f = new Fixtures();

  @Test
  void testArity() {
    assertThat(Analysis.arity(core.product(f.u, f.v)), contains(f.v, f.u));
    assertThat(
        Analysis.arity(
            core.sum(core.product(f.f, f.v), core.product(f.g, f.v))),
        contains(f.v));
    assertThat(
        Analysis.arity(
            core.inner(core.grad(f.u), core.grad(f.v))),
        contains(f.v, f.u));
    assertThat(Analysis.arity(core.sin(f.f)), empty());
    assertThat(
        Analysis.arity(
            core.conditional(core.lt(f.f, f.g), f.v,
                core.product(core.constant(2), f.v))),
        contains(f.v));
  }

  /** Expressions that are not linear in their arguments fail. */
  @Test
  void testNotMultilinear() {
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(core.division(f.f, f.v)));
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(core.sum(f.v, f.u)));
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(core.sum(f.v, f.f)));
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(core.product(f.v, f.v)));
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(core.sin(f.v)));
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(core.power(f.v, core.constant(2))));
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(
            core.conditional(core.lt(f.v, f.f), f.f, f.g)));
  }

  /** Argument numbers must be consecutive from 0. */
  @Test
  void testArgumentNumbering() {
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(f.u));
    final Core.Exp v2 = core.argument(f.p1, 2);
    assertThrows(MultilinearityException.class,
        () -> Analysis.arity(core.product(f.v, v2)));
  }

  @Test
  void testExtract() {
    final Core.Exp e =
        core.sum(f.g, core.product(f.f, f.u, core.inner(f.w, f.w)), f.v);
    assertThat(Analysis.extractCoefficients(e), contains(f.f, f.g, f.w));
    assertThat(Analysis.extractArguments(e), contains(f.v, f.u));
    assertThat(Analysis.extractDomains(e), contains(f.triangle));
    assertThat(Analysis.extractTerminals(core.sum(f.g, f.f)),
        contains(f.g, f.f));

    final Index i = Index.create();
    final Index j = Index.create();
    final Core.Exp t =
        core.componentTensor(
            core.product(core.indexed(f.a, i, j), core.indexed(f.w, j)), i);
    assertThat(Analysis.extractIndices(t), contains(i, j));
  }

  @Test
  void testGlobalConstant() {
    assertThat(Analysis.isGlobalConstant(f.k), is(true));
    assertThat(
        Analysis.isGlobalConstant(
            core.product(core.constant(2), f.k, core.identity(2))),
        is(true));
    assertThat(Analysis.isGlobalConstant(f.f), is(false));
    assertThat(Analysis.isGlobalConstant(core.sum(f.k, f.f)), is(false));
    assertThat(Analysis.isGlobalConstant(core.cellVolume(f.triangle)),
        is(false));
  }
}

// End AnalysisTest.java
