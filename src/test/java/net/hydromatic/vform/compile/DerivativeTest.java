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
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.Traversals;
import org.junit.jupiter.api.Test;

/** Tests for {@link Derivatives}. */
class DerivativeTest {
  private final Fixtures f = new Fixtures();

  /** Resolves derivatives, then simplifies. */
  private static Core.Exp derive(Core.Exp e) {
    return Simplifier.simplify(Derivatives.resolve(e));
  }

  /** The derivative of {@code f * f} with respect to {@code f} in direction
   * {@code v} is {@code 2 * f * v}. */
  @Test
  void testProductRule() {
    final Core.Exp e =
        derive(core.coefficientDerivative(core.product(f.f, f.f), f.f, f.v));
    final Core.Exp expected =
        Simplifier.simplify(core.product(f.v, core.constant(2), f.f));
    assertThat(e, is(expected));
    assertThat(Signatures.signature(e), is(Signatures.signature(expected)));
  }

  @Test
  void testLinearity() {
    // d/df (f + g) [v] = v
    assertThat(derive(core.coefficientDerivative(core.sum(f.f, f.g), f.f, f.v)),
        is(f.v));

    // d/df (3 * f) [v] = 3 * v
    assertThat(
        derive(
            core.coefficientDerivative(core.product(core.constant(3), f.f),
                f.f, f.v)),
        is(core.product(core.constant(3), f.v)));

    // d/df f [v] = v
    assertThat(derive(core.coefficientDerivative(f.f, f.f, f.v)), is(f.v));
  }

  /** The derivative of a sum of non-trivial terms is the sum of their
   * derivatives, compared by signature after simplification. */
  @Test
  void testLinearityOfSum() {
    checkLinear(core.product(f.f, core.sin(f.f), f.g),
        core.division(f.f, core.sum(f.g, core.one())));
    checkLinear(core.inner(core.grad(f.f), core.grad(f.f)),
        core.product(f.f, core.cos(f.g)));
    checkLinear(core.exp(core.product(f.f, f.f)), core.sqrt(f.f));
  }

  private void checkLinear(Core.Exp a, Core.Exp b) {
    final Core.Exp sum =
        derive(core.coefficientDerivative(core.sum(a, b), f.f, f.v));
    final Core.Exp da = derive(core.coefficientDerivative(a, f.f, f.v));
    final Core.Exp db = derive(core.coefficientDerivative(b, f.f, f.v));
    assertThat(sum.toString(), Signatures.signature(sum),
        is(Signatures.signature(Simplifier.simplify(core.sum(da, db)))));
  }

  /** An expression that does not depend on the coefficient has a zero
   * derivative. */
  @Test
  void testIndependent() {
    final Core.Exp e =
        derive(core.coefficientDerivative(core.sin(f.g), f.f, f.v));
    assertThat(Simplifier.isZero(e), is(true));
    final Core.Exp e2 =
        derive(core.coefficientDerivative(core.grad(f.g), f.f, f.v));
    assertThat(Simplifier.isZero(e2), is(true));
    assertThat(e2.shape, is(core.grad(f.g).shape));
  }

  @Test
  void testChainRule() {
    // d/df sin(f) [v] = cos(f) * v
    assertThat(derive(core.coefficientDerivative(core.sin(f.f), f.f, f.v)),
        is(Simplifier.simplify(core.product(core.cos(f.f), f.v))));
  }

  /** The derivative of a gradient is the gradient of the direction. */
  @Test
  void testGradient() {
    assertThat(derive(core.coefficientDerivative(core.grad(f.f), f.f, f.v)),
        is(core.grad(f.v)));

    final Core.Exp e =
        derive(
            core.coefficientDerivative(
                core.inner(core.grad(f.f), core.grad(f.f)), f.f, f.v));
    assertThat(Traversals.containsOp(e, Op.COEFFICIENT_DERIVATIVE),
        is(false));
    assertThat(Traversals.containsOp(e, Op.GRAD), is(true));
    assertThat(Analysis.arity(e), contains(f.v));
  }

  @Test
  void testSpatialGradient() {
    // grad(x) = I
    assertThat(derive(core.grad(core.spatialCoordinate(f.triangle))),
        is(core.identity(2)));

    // the gradient of a global constant is zero
    final Core.Exp e = derive(core.grad(f.k));
    assertThat(Simplifier.isZero(e), is(true));

    // div(w) is rewritten in terms of grad(w)
    final Core.Exp d = Derivatives.resolve(core.div(f.w));
    assertThat(Analysis.extractKinds(d), not(hasItem(Op.DIV)));
    assertThat(Analysis.extractKinds(d), hasItem(Op.GRAD));
    assertThat(d.shape, is(core.div(f.w).shape));
  }

  @Test
  void testVariableDerivative() {
    final Core.Exp x = core.variable(f.f);
    assertThat(derive(core.variableDerivative(x, x)), is(core.one()));

    final Core.Exp y = core.variable(f.w);
    assertThat(derive(core.variableDerivative(y, y)), is(core.identity(2)));

    // a different variable is independent
    final Core.Exp z = core.variable(f.g);
    final Core.Exp e = derive(core.variableDerivative(core.sin(z), x));
    assertThat(Simplifier.isZero(e), is(true));
  }

  /** The sign function has no derivative where its operand depends on the
   * coefficient. */
  @Test
  void testSign() {
    assertThrows(DifferentiationException.class,
        () -> Derivatives.resolve(
            core.coefficientDerivative(core.sign(f.f), f.f, f.v)));
    final Core.Exp e =
        derive(core.coefficientDerivative(core.sign(f.g), f.f, f.v));
    assertThat(Simplifier.isZero(e), is(true));
  }
}

// End DerivativeTest.java
