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

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.ReuseTransformer;
import net.hydromatic.vform.ast.Traversals;

/** Finds and marks sub-expressions that occur more than once. */
public final class Duplicates {
  private Duplicates() {}

  /** Returns the sub-expressions that occur more than once in an expression,
   * comparing structurally, in order of their second occurrence.
   *
   * <p>Terminals and conditions are not included. If a sub-expression is a
   * duplicate, its own sub-expressions are not searched again. */
  public static Set<Core.Exp> extractDuplications(Core.Exp e) {
    final Set<Core.Exp> seen = new HashSet<>();
    final Set<Core.Exp> duplicates = new LinkedHashSet<>();
    visit(e, seen, duplicates);
    return ImmutableSet.copyOf(duplicates);
  }

  private static void visit(Core.Exp e, Set<Core.Exp> seen,
      Set<Core.Exp> duplicates) {
    if (e.isTerminal() || e.op.isCondition()) {
      for (Core.Exp operand : e.operands) {
        visit(operand, seen, duplicates);
      }
      return;
    }
    if (!seen.add(e)) {
      duplicates.add(e);
      return;
    }
    for (Core.Exp operand : e.operands) {
      visit(operand, seen, duplicates);
    }
  }

  /** Wraps each sub-expression that occurs more than once in a variable.
   * Equal sub-expressions are wrapped in the same variable, so that a
   * consumer can evaluate them once. */
  public static Core.Exp markDuplications(Core.Exp e) {
    final Set<Core.Exp> duplicates = extractDuplications(e);
    if (duplicates.isEmpty()) {
      return e;
    }
    return Traversals.mapper(new ReuseTransformer() {
      @Override
      protected Core.Exp operator(Core.Exp e2, List<Core.Exp> operands) {
        final Core.Exp e3 = e2.copy(operands);
        return duplicates.contains(e2) ? core.variable(e3) : e3;
      }
    }, Traversals.Memo.STRUCTURAL).apply(e);
  }

  /** Replaces every variable by its expression. */
  public static Core.Exp stripVariables(Core.Exp e) {
    return Traversals.map(e, new ReuseTransformer() {
      @Override
      public Core.Exp variable(Core.Exp e2, Core.Exp expression,
          Core.Exp label) {
        return expression;
      }
    });
  }
}

// End Duplicates.java
