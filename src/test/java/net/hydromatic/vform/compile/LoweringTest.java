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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.FixedIndex;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.Shape;
import net.hydromatic.vform.ast.Traversals;
import org.junit.jupiter.api.Test;

/** Tests for {@link CompoundLowering} and {@link IndexExpander}. */
class LoweringTest {
  private final Fixtures f = new Fixtures();

  private List<Core.Exp> compounds() {
    final Core.Exp w3 = core.coefficient(f.vp1Tet, 40);
    final Core.Exp n = core.facetNormal(f.triangle);
    return ImmutableList.of(
        core.inner(f.a, f.a),
        core.outer(f.w, f.w),
        core.dot(f.a, f.w),
        core.cross(w3, w3),
        core.transposed(f.a),
        core.trace(f.a),
        core.determinant(f.a),
        core.inverse(f.a),
        core.deviatoric(f.a),
        core.div(f.w),
        core.curl(w3),
        core.jump(f.f),
        core.jump(f.w, n),
        core.avg(core.sum(f.f, f.g)));
  }

  @Test
  void testLower() {
    for (Core.Exp e : compounds()) {
      final Core.Exp lowered = CompoundLowering.lower(e);
      assertThat(e.toString(), lowered.shape, is(e.shape));
      assertThat(e.toString(), lowered.freeIndices, is(e.freeIndices));
      for (Op op : Analysis.extractKinds(lowered)) {
        assertThat(e + " contains " + op, CompoundLowering.isCompound(op),
            is(false));
      }
    }
  }

  /** A node that is not compound is returned unchanged. */
  @Test
  void testLowerNode() {
    final Core.Exp e = core.sum(f.f, f.g);
    assertThat(CompoundLowering.lowerNode(e) == e, is(true));
    assertThat(CompoundLowering.isCompound(Op.SUM), is(false));
    assertThat(CompoundLowering.isCompound(Op.INNER), is(true));
  }

  @Test
  void testExpand() {
    for (Core.Exp e : compounds()) {
      if (e.op == Op.DIV || e.op == Op.CURL) {
        continue;
      }
      final Core.Exp expanded = IndexExpander.expand(e);
      assertThat(e.toString(), expanded.shape, is(e.shape));
      assertThat(e.toString(), IndexExpander.isExpanded(expanded), is(true));
    }
  }

  @Test
  void testExpandTrace() {
    final Core.Exp e = IndexExpander.expand(core.trace(core.identity(2)));
    assertThat(Simplifier.simplify(e), is(core.constant(2)));

    final Core.Exp e3 =
        IndexExpander.expand(core.inner(core.identity(3), core.identity(3)));
    assertThat(Simplifier.simplify(e3), is(core.constant(3)));
  }

  /** An expanded tensor is a list tensor of its components. */
  @Test
  void testExpandTensor() {
    final Core.Exp e = IndexExpander.expand(f.a);
    assertThat(e.op, is(Op.LIST_TENSOR));
    assertThat(e.shape, is(Shape.of(2, 2)));
    assertThat(e.operands.size(), is(2));
    assertThat(e.operand(0).op, is(Op.LIST_TENSOR));
  }

  @Test
  void testExpandIndexSum() {
    final Index i = Index.create();
    final Core.Exp e =
        core.indexSum(core.indexed(core.listTensor(f.f, f.g), i), i);
    final Core.Exp expanded = IndexExpander.expand(e);
    assertThat(IndexExpander.isExpanded(expanded), is(true));
    assertThat(Simplifier.simplify(expanded),
        is(Simplifier.simplify(core.sum(f.f, f.g))));
  }

  /** A label contracted inside a component tensor and used again outside it
   * is summed separately in each scope. */
  @Test
  void testExpandReusedLabel() {
    final Index i = Index.create();
    final Index j = Index.create();
    final Index k = Index.create();
    final Core.Exp reused = IndexExpander.expand(f.quadratic(i, j, j));
    final Core.Exp distinct = IndexExpander.expand(f.quadratic(i, k, j));
    assertThat(reused, is(distinct));

    // w . A . w has a term in each component of A, including A[0, 1]
    final Core.Exp a01 =
        core.indexed(f.a, FixedIndex.of(0), FixedIndex.of(1));
    assertThat(Traversals.contains(reused, e -> e.equals(a01)), is(true));

    // A[j, j] inside a component tensor that binds j sums over j
    final Core.Exp t =
        core.componentTensor(
            core.product(core.indexed(f.w, j), core.indexed(f.a, j, j)), j);
    final Core.Exp expanded =
        IndexExpander.expand(core.indexSum(core.indexed(t, j), j));
    final Core.Exp expected =
        IndexExpander.expand(
            core.indexSum(core.product(core.indexed(f.w, i), core.trace(f.a)),
                i));
    assertThat(Simplifier.simplify(expanded),
        is(Simplifier.simplify(expected)));
  }

  @Test
  void testExpandFreeIndex() {
    final Core.Exp wi = core.indexed(f.w, Index.create());
    assertThrows(UnresolvedIndexException.class,
        () -> IndexExpander.expand(wi));
  }
}

// End LoweringTest.java
