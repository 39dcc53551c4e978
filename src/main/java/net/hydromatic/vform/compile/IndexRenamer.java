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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.ReuseTransformer;
import net.hydromatic.vform.ast.Traversals;

/**
 * Replaces index labels in an expression.
 *
 * <p>A label may be replaced by another label or by a fixed index. Only free
 * occurrences are replaced. A label that is bound inside the expression (by a
 * component tensor, an index sum, a contraction in a product, or a repeated
 * label in an indexed expression) and that clashes with a replaced or
 * replacing label is first renamed to a new label.
 */
public class IndexRenamer extends ReuseTransformer {
  private final ImmutableMap<Index, IndexBase> mapping;

  private IndexRenamer(Map<Index, ? extends IndexBase> mapping) {
    this.mapping = ImmutableMap.copyOf(mapping);
  }

  /** Replaces free occurrences of labels in an expression. */
  public static Core.Exp rename(Core.Exp e,
      Map<Index, ? extends IndexBase> mapping) {
    if (mapping.isEmpty()) {
      return e;
    }
    final Set<Index> clashes = new HashSet<>(mapping.keySet());
    mapping.values().forEach(target -> {
      if (!target.isFixed()) {
        clashes.add((Index) target);
      }
    });
    final Core.Exp e2 = Traversals.map(e, new Freshener(clashes));
    return Traversals.map(e2, new IndexRenamer(mapping));
  }

  private IndexBase map(IndexBase index) {
    if (index.isFixed()) {
      return index;
    }
    final IndexBase target = mapping.get((Index) index);
    return target == null ? index : target;
  }

  @Override
  public Core.Exp zero(Core.Zero e) {
    final SortedMap<Index, Integer> free = new TreeMap<>();
    e.freeIndices.forEach((index, range) -> {
      final IndexBase target = map(index);
      if (!target.isFixed()) {
        free.put((Index) target, range);
      }
    });
    if (free.equals(e.freeIndices)) {
      return e;
    }
    return core.zero(e.shape, free);
  }

  @Override
  public Core.Exp indexed(Core.Indexed e, Core.Exp operand) {
    final List<IndexBase> indices = new ArrayList<>();
    for (IndexBase index : e.indices) {
      indices.add(map(index));
    }
    if (operand == e.operand(0) && indices.equals(e.indices)) {
      return e;
    }
    return core.indexed(operand, indices);
  }

  /** Renames the labels bound at each node, if they are among a given set of
   * labels, to new labels. Works bottom-up, so that when a binder is renamed,
   * labels bound below it have already been renamed and only free occurrences
   * of its label remain. */
  private static class Freshener extends ReuseTransformer {
    private final Set<Index> clashes;

    Freshener(Set<Index> clashes) {
      this.clashes = clashes;
    }

    /** Allocates a new label for each clashing label in {@code bound}. */
    private Map<Index, Index> fresh(Iterable<Index> bound) {
      final Map<Index, Index> map = new LinkedHashMap<>();
      for (Index index : bound) {
        if (clashes.contains(index) && !map.containsKey(index)) {
          map.put(index, Index.create());
        }
      }
      return map;
    }

    private static Core.Exp renameFree(Core.Exp e, Map<Index, Index> map) {
      return map.isEmpty() ? e : Traversals.map(e, new IndexRenamer(map));
    }

    private static <E> List<E> replace(List<E> list,
        Map<?, ? extends E> map) {
      final List<E> list2 = new ArrayList<>();
      for (E e : list) {
        final E e2 = map.get(e);
        list2.add(e2 == null ? e : e2);
      }
      return list2;
    }

    @Override
    public Core.Exp product(Core.Exp e, List<Core.Exp> operands) {
      final Set<Index> contracted = new TreeSet<>();
      for (Core.Exp operand : e.operands) {
        contracted.addAll(operand.freeIndices.keySet());
      }
      contracted.removeAll(e.freeIndices.keySet());
      final Map<Index, Index> map = fresh(contracted);
      if (map.isEmpty()) {
        return super.product(e, operands);
      }
      final List<Core.Exp> operands2 = new ArrayList<>();
      for (Core.Exp operand : operands) {
        operands2.add(renameFree(operand, map));
      }
      return core.product(operands2);
    }

    @Override
    public Core.Exp indexed(Core.Indexed e, Core.Exp operand) {
      final List<Index> repeated = new ArrayList<>();
      for (IndexBase index : e.indices) {
        if (!index.isFixed()
            && e.indices.indexOf(index) != e.indices.lastIndexOf(index)) {
          repeated.add((Index) index);
        }
      }
      final Map<Index, Index> map = fresh(repeated);
      if (map.isEmpty()) {
        return super.indexed(e, operand);
      }
      return core.indexed(operand, replace(e.indices, map));
    }

    @Override
    public Core.Exp componentTensor(Core.ComponentTensor e,
        Core.Exp operand) {
      final Map<Index, Index> map = fresh(e.indices);
      if (map.isEmpty()) {
        return super.componentTensor(e, operand);
      }
      return core.componentTensor(renameFree(operand, map),
          replace(e.indices, map));
    }

    @Override
    public Core.Exp indexSum(Core.IndexSum e, Core.Exp operand) {
      final Map<Index, Index> map = fresh(ImmutableList.of(e.index));
      if (map.isEmpty()) {
        return super.indexSum(e, operand);
      }
      return core.indexSum(renameFree(operand, map), map.get(e.index));
    }
  }
}

// End IndexRenamer.java
