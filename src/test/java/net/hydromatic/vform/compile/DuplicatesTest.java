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
import static org.hamcrest.Matchers.empty;

import net.hydromatic.vform.Fixtures;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for {@link Duplicates}. */
class DuplicatesTest {
  private final Fixtures f = new Fixtures();

  @Test
  void testExtract() {
    final Core.Exp e =
        core.sum(core.sin(f.f), core.product(core.constant(2), core.sin(f.f)));
    assertThat(Duplicates.extractDuplications(e), contains(core.sin(f.f)));

    // terminals are not duplicates
    assertThat(Duplicates.extractDuplications(core.sum(f.f, f.f)), empty());

    // the operands of a duplicate are not searched again
    final Core.Exp s = core.sin(core.sum(f.f, f.g));
    assertThat(Duplicates.extractDuplications(core.product(s, s)),
        contains(s));
  }

  @Test
  void testMark() {
    final Core.Exp e =
        core.sum(core.sin(f.f), core.product(core.constant(2), core.sin(f.f)));
    final Core.Exp marked = Duplicates.markDuplications(e);
    assertThat(marked.op, is(Op.SUM));
    final Core.Exp v0 = marked.operand(0);
    assertThat(v0.op, is(Op.VARIABLE));
    assertThat(v0.operand(0), is(core.sin(f.f)));
    assertThat(marked.operand(1).operand(1), sameInstance(v0));
    assertThat(Duplicates.stripVariables(marked), is(e));

    final Core.Exp plain = core.sum(f.f, core.sin(f.g));
    assertThat(Duplicates.markDuplications(plain), sameInstance(plain));
  }
}

// End DuplicatesTest.java
