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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for traversing expression trees. */
public final class Traversals {
  private Traversals() {}

  /** Applies a function to every node of a tree, operands before the node,
   * and returns the result for the root.
   *
   * <p>Results are memoized by node identity, so a node that is shared
   * within the tree is processed once. */
  public static <R> R map(Core.Exp e, ExprFunction<R> f) {
    return mapper(f).apply(e);
  }

  /** Returns a memoizing mapper that applies a function. The mapper may be
   * applied to several expressions; they share the memo. */
  public static <R> Mapper<R> mapper(ExprFunction<R> f) {
    return new Mapper<>(f, Memo.IDENTITY);
  }

  /** Returns a memoizing mapper with a given kind of memo. */
  public static <R> Mapper<R> mapper(ExprFunction<R> f, Memo memo) {
    return new Mapper<>(f, memo);
  }

  /** Returns every distinct node of a tree, each before its operands.
   * Nodes are distinct by identity. */
  public static List<Core.Exp> uniquePreOrder(Core.Exp e) {
    final Set<Core.Exp> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    final List<Core.Exp> list = new ArrayList<>();
    final Deque<Core.Exp> stack = new ArrayDeque<>();
    stack.push(e);
    while (!stack.isEmpty()) {
      final Core.Exp node = stack.pop();
      if (!seen.add(node)) {
        continue;
      }
      list.add(node);
      for (int i = node.operands.size() - 1; i >= 0; i--) {
        stack.push(node.operands.get(i));
      }
    }
    return list;
  }

  /** Returns every distinct node of a tree, each after its operands. Nodes
   * are distinct by identity. */
  public static List<Core.Exp> uniquePostOrder(Core.Exp e) {
    final Set<Core.Exp> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    final ImmutableList.Builder<Core.Exp> b = ImmutableList.builder();
    addPostOrder(e, seen, b);
    return b.build();
  }

  private static void addPostOrder(Core.Exp e, Set<Core.Exp> seen,
      ImmutableList.Builder<Core.Exp> b) {
    if (!seen.add(e)) {
      return;
    }
    for (Core.Exp operand : e.operands) {
      addPostOrder(operand, seen, b);
    }
    b.add(e);
  }

  /** Returns whether any node in a tree satisfies a predicate. */
  public static boolean contains(Core.Exp e, Predicate<Core.Exp> predicate) {
    for (Core.Exp node : uniquePreOrder(e)) {
      if (predicate.test(node)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether a tree contains a node of a given kind. */
  public static boolean containsOp(Core.Exp e, Op op) {
    return contains(e, node -> node.op == op);
  }

  /** Kind of memo used by a {@link Mapper}. */
  public enum Memo {
    /** Nodes are the same if they are the same object. */
    IDENTITY,
    /** Nodes are the same if they are structurally equal. Use this to
     * deduplicate. */
    STRUCTURAL
  }

  /** Applies an {@link ExprFunction} to expression trees, memoizing the
   * result for each node.
   *
   * <p>A handler that needs the result for an expression other than its
   * operands (for example, a rewritten version of its node) can call
   * {@link #apply} re-entrantly.
   *
   * @param <R> Result type */
  public static class Mapper<R> {
    private final ExprFunction<R> f;
    private final Map<Core.Exp, @Nullable R> memo;

    Mapper(ExprFunction<R> f, Memo memo) {
      this.f = f;
      this.memo = memo == Memo.IDENTITY ? new IdentityHashMap<>()
          : new HashMap<>();
    }

    /** Returns the result for an expression, computing it if necessary. */
    public R apply(Core.Exp e) {
      if (memo.containsKey(e)) {
        return memo.get(e);
      }
      final List<@Nullable R> operands = new ArrayList<>(e.operands.size());
      if (f.isCutoff(e)) {
        for (int i = 0; i < e.operands.size(); i++) {
          operands.add(null);
        }
      } else {
        for (Core.Exp operand : e.operands) {
          operands.add(apply(operand));
        }
      }
      final R r = f.apply(e, Collections.unmodifiableList(operands));
      memo.put(e, r);
      return r;
    }
  }
}

// End Traversals.java
