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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.Traversals;

/**
 * Resolves the ranges of the index labels in an expression.
 *
 * <p>The range of each label is recorded in a side table, {@link
 * Resolution#ranges}, keyed by label. Every node is re-validated on the way,
 * so consumers of a resolved expression never need to infer a range
 * themselves.
 */
public final class Resolver {
  private Resolver() {}

  /** Resolves an expression.
   *
   * @throws ShapeMismatchException if a label is used with two different
   * ranges, or if a node is inconsistent with its operands */
  public static Resolution resolve(Core.Exp e) {
    final SortedMap<Index, Integer> ranges = new TreeMap<>();
    for (Core.Exp node : Traversals.uniquePostOrder(e)) {
      ShapeInference.recompute(node);
      switch (node.op) {
      case INDEXED:
        final Core.Indexed indexed = (Core.Indexed) node;
        for (int i = 0; i < indexed.indices.size(); i++) {
          final IndexBase index = indexed.indices.get(i);
          if (!index.isFixed()) {
            record(ranges, (Index) index, node.operand(0).shape.dim(i), node);
          }
        }
        break;
      case INDEX_SUM:
        final Core.IndexSum indexSum = (Core.IndexSum) node;
        record(ranges, indexSum.index, indexSum.dimension, node);
        break;
      default:
        break;
      }
      node.freeIndices.forEach((index, range) ->
          record(ranges, index, range, node));
    }
    return new Resolution(e, ImmutableSortedMap.copyOfSorted(ranges));
  }

  /** Checks that every label in an expression has a single range and that
   * the expression has no free indices.
   *
   * @throws ShapeMismatchException if a label is used with two different
   * ranges
   * @throws UnresolvedIndexException if free indices remain */
  public static void validate(Core.Exp e) {
    resolve(e);
    checkResolved(e);
  }

  /** Checks that an expression has no free indices.
   *
   * @throws UnresolvedIndexException if it has */
  public static void checkResolved(Core.Exp e) {
    if (!e.freeIndices.isEmpty()) {
      throw new UnresolvedIndexException("free indices "
          + e.freeIndices.keySet() + " remain in " + e, e.op);
    }
  }

  private static void record(Map<Index, Integer> ranges, Index index,
      int range, Core.Exp node) {
    final Integer prev = ranges.put(index, range);
    if (prev != null && prev != range) {
      throw new ShapeMismatchException("index " + index + " has ranges "
          + prev + " and " + range, node.op);
    }
  }

  /** Expression together with the ranges of its index labels. */
  public static final class Resolution {
    public final Core.Exp exp;
    public final ImmutableSortedMap<Index, Integer> ranges;

    Resolution(Core.Exp exp, ImmutableSortedMap<Index, Integer> ranges) {
      this.exp = exp;
      this.ranges = ranges;
    }

    /** Returns the range of a label.
     *
     * @throws UnresolvedIndexException if the label does not occur */
    public int range(Index index) {
      final Integer range = ranges.get(index);
      if (range == null) {
        throw new UnresolvedIndexException("index " + index
            + " does not occur in " + exp, null);
      }
      return range;
    }
  }
}

// End Resolver.java
