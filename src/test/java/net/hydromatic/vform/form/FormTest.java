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
package net.hydromatic.vform.form;

import static net.hydromatic.vform.ast.CoreBuilder.core;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.compile.FormException;
import net.hydromatic.vform.compile.ShapeMismatchException;
import net.hydromatic.vform.compile.UnresolvedIndexException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Form}, {@link Measure}, {@link Integral} and
 * {@link Forms}. */
class FormTest {
  private final Fixtures f = new Fixtures();

  /** Creates the form
   * {@code f * v * dx(0) + g * v * dx(1) + v * ds}. */
  private Form subdomainForm() {
    return Measure.dx().subdomain(0).integrate(core.product(f.f, f.v))
        .plus(Measure.dx().subdomain(1).integrate(core.product(f.g, f.v)))
        .plus(Measure.ds().integrate(f.v));
  }

  @Test
  void testIntegrals() {
    final Form form = subdomainForm();
    assertThat(form.integrals, hasSize(3));
    final List<Integral> cell1 =
        form.integrals(IntegralType.CELL, SubdomainId.of(1));
    assertThat(cell1, hasSize(1));
    assertThat(cell1.get(0).integrand, is(core.product(f.g, f.v)));
    assertThat(form.integrals(IntegralType.CELL), hasSize(2));
    assertThat(form.integrals(IntegralType.EXTERIOR_FACET), hasSize(1));
    assertThat(form.integrals(IntegralType.INTERIOR_FACET), empty());
    assertThat(form.integrals(null, SubdomainId.EVERYWHERE), hasSize(1));
    assertThat(form.arguments(), contains(f.v));
    assertThat(form.coefficients(), contains(f.f, f.g));
    assertThat(form.domains(), contains(f.triangle));
  }

  @Test
  void testIntegralGroups() {
    final Form form =
        Measure.ds().integrate(f.v)
            .plus(subdomainForm())
            .plus(Measure.dx().subdomain(0).integrate(core.product(f.g, f.v)));
    final List<String> keys = new ArrayList<>();
    final List<Integer> sizes = new ArrayList<>();
    form.integralGroups().forEach((group, list) -> {
      keys.add(group.toString());
      sizes.add(list.size());
    });
    assertThat(keys,
        contains("dx(1, 0)", "dx(1, 1)", "ds(1, everywhere)"));
    assertThat(sizes, contains(2, 1, 2));
  }

  @Test
  void testPlus() {
    final Form a = Measure.dx().integrate(f.v);
    final Form b = Measure.ds().integrate(core.product(f.f, f.v));
    assertThat(Form.EMPTY.plus(a), sameInstance(a));
    assertThat(a.plus(Form.EMPTY), sameInstance(a));
    assertThat(a.plus(b).integrals, contains(a.integrals.get(0),
        b.integrals.get(0)));
    assertThat(a.plus(b), not(is(b.plus(a))));
    assertThat(Form.EMPTY.isEmpty(), is(true));
    assertThat(Form.EMPTY, hasToString("<empty form>"));
  }

  @Test
  void testScale() {
    final Form a = Measure.dx().integrate(core.product(f.f, f.v));
    final Form b = a.scale(core.constant(3));
    assertThat(b.integrals.get(0).integrand,
        is(core.product(core.constant(3), core.product(f.f, f.v))));
    assertThat(a.negate().integrals.get(0).integrand.op, is(Op.PRODUCT));
    assertThrows(ShapeMismatchException.class, () -> a.scale(f.w));
    final Core.Exp wi = core.indexed(f.w, Index.create());
    assertThrows(UnresolvedIndexException.class, () -> a.scale(wi));
  }

  @Test
  void testMeasure() {
    assertThat(Measure.dx(), hasToString("dx"));
    assertThat(Measure.ds().subdomain(3), hasToString("ds(3)"));
    assertThat(Measure.dS().type.isInteriorFacet(), is(true));
    assertThat(Measure.dx().withMetadata("degree", "2")
            .withMetadata("degree", "4").metadata,
        is(ImmutableMap.of("degree", "4")));
    assertThat(Measure.dx().subdomain(2), is(Measure.dx().subdomain(2)));

    // an integrand must be a scalar without free indices
    assertThrows(ShapeMismatchException.class,
        () -> Measure.dx().integrate(f.w));
    final Core.Exp wi = core.indexed(f.w, Index.create());
    assertThrows(UnresolvedIndexException.class,
        () -> Measure.dx().integrate(wi));

    // the domain of a constant cannot be inferred
    assertThrows(FormException.class,
        () -> Measure.dx().integrate(core.constant(1)));
    final Form form = Measure.dx().on(f.triangle).integrate(core.constant(1));
    assertThat(form.integrals.get(0).domain, is(f.triangle));
  }

  @Test
  void testSubdomainId() {
    assertThat(SubdomainId.EVERYWHERE.isEverywhere(), is(true));
    assertThat(SubdomainId.of(0).id(), is(0));
    assertThrows(IllegalStateException.class,
        () -> SubdomainId.EVERYWHERE.id());
    assertThrows(IllegalArgumentException.class, () -> SubdomainId.of(-2));
    final List<SubdomainId> list =
        new ArrayList<>(
            ImmutableList.of(SubdomainId.of(2), SubdomainId.EVERYWHERE,
                SubdomainId.of(0)));
    list.sort(null);
    assertThat(list, hasToString("[everywhere, 0, 2]"));
  }

  /** Forms that differ only in which coefficients they use have the same
   * signature; their integrals do not. */
  @Test
  void testSignature() {
    final Form a = Measure.dx().integrate(core.product(f.f, f.v));
    final Form b = Measure.dx().integrate(core.product(f.g, f.v));
    final Form c = Measure.dx().integrate(core.product(f.f, f.f, f.v));
    assertThat(a.signature(), is(b.signature()));
    assertThat(a.signature(), not(is(c.signature())));
    assertThat(a.integrals.get(0).signature(),
        not(is(b.integrals.get(0).signature())));
    assertThat(FormSignature.of(a, false).signature,
        not(is(FormSignature.of(b, false).signature)));
    assertThat(a.signature().length(), is(64));

    // subdomain and measure are part of the signature
    final Form d = Measure.dx().subdomain(1)
        .integrate(core.product(f.f, f.v));
    final Form e = Measure.ds().integrate(core.product(f.f, f.v));
    assertThat(a.signature(), not(is(d.signature())));
    assertThat(a.signature(), not(is(e.signature())));
    assertThat(FormSignature.of(subdomainForm(), true).integralSignatures,
        hasSize(3));
  }

  @Test
  void testDerivative() {
    final Form form = Measure.dx().integrate(core.product(f.f, f.f, f.v));
    final Form d = Forms.derivative(form, f.f, null);
    final Core.Exp integrand = d.integrals.get(0).integrand;
    assertThat(integrand.op, is(Op.COEFFICIENT_DERIVATIVE));
    assertThat(integrand.operand(2), is(f.u));
    assertThat(d.arguments(), contains(f.v, f.u));

    final Form d2 = Forms.derivative(form, f.f, f.g);
    assertThat(d2.integrals.get(0).integrand.operand(2), is(f.g));
    assertThrows(ShapeMismatchException.class,
        () -> Forms.derivative(form, f.f, f.w));
  }

  @Test
  void testAction() {
    final Form a = Measure.dx().integrate(core.product(f.u, f.v));
    final Form l = Forms.action(a, f.g);
    assertThat(l.integrals.get(0).integrand, is(core.product(f.g, f.v)));
    assertThat(l.arguments(), contains(f.v));
    assertThrows(FormException.class,
        () -> Forms.action(Measure.dx().integrate(f.f), f.g));
    assertThrows(IllegalArgumentException.class,
        () -> Forms.action(a, f.w));
  }

  @Test
  void testReplace() {
    final Form a = Measure.dx().integrate(core.product(f.f, f.v));
    final Form b = Forms.replace(a, ImmutableMap.of(f.f, core.sin(f.g)));
    assertThat(b.integrals.get(0).integrand,
        is(core.product(core.sin(f.g), f.v)));
    assertThat(Forms.replace(a, ImmutableMap.of()).integrals.get(0),
        sameInstance(a.integrals.get(0)));
    assertThrows(ShapeMismatchException.class,
        () -> Forms.replace(a, ImmutableMap.of(f.f, f.w)));
  }
}

// End FormTest.java
