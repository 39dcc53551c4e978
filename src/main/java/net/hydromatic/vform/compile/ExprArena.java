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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.DefaultExprFunction;
import net.hydromatic.vform.ast.Traversals;

/**
 * Arena of interned expressions.
 *
 * <p>Interning an expression returns the canonical node that is structurally
 * equal to it. Every sub-expression is interned too, so two interned
 * expressions share every common sub-tree. Each canonical node has an arena
 * index, assigned when it is first interned.
 *
 * <p>The arena is safe for concurrent use. If two threads intern equal
 * expressions at the same time, one of them wins and both receive its
 * node.
 */
public class ExprArena {
  private final Map<Core.Exp, Entry> map = new ConcurrentHashMap<>();
  private final AtomicInteger nextIndex = new AtomicInteger();

  /** Returns the canonical node structurally equal to an expression. */
  public Core.Exp intern(Core.Exp e) {
    return Traversals.map(e, new Interner());
  }

  /** Returns the arena index of an expression, or -1 if no equal expression
   * has been interned. */
  public int indexOf(Core.Exp e) {
    final Entry entry = map.get(e);
    return entry == null ? -1 : entry.index;
  }

  /** Returns the number of distinct nodes in the arena. */
  public int size() {
    return map.size();
  }

  private Core.Exp canonical(Core.Exp e) {
    return map.computeIfAbsent(e,
        e2 -> new Entry(e2, nextIndex.getAndIncrement())).exp;
  }

  /** Canonical node and its arena index. */
  private static final class Entry {
    final Core.Exp exp;
    final int index;

    Entry(Core.Exp exp, int index) {
      this.exp = exp;
      this.index = index;
    }
  }

  /** Interns each node after its operands have been interned. */
  private class Interner extends DefaultExprFunction<Core.Exp> {
    @Override
    protected Core.Exp terminal(Core.Terminal e) {
      return canonical(e);
    }

    @Override
    protected Core.Exp operator(Core.Exp e, List<Core.Exp> operands) {
      return canonical(e.copy(operands));
    }
  }
}

// End ExprArena.java
