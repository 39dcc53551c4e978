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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.FixedIndex;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.Shape;
import net.hydromatic.vform.util.Static;

/**
 * Expands index notation into explicit components.
 *
 * <p>The result contains no index labels, only fixed indices. Index sums and
 * implicit summations become explicit sums; list tensors are replaced by
 * the entry that is selected; compound operators are lowered on the way.
 *
 * <p>The expression must have no free indices and no unresolved derivative
 * markers.
 */
public final class IndexExpander {
  private final Map<Core.Exp, Boolean> labelFree = new HashMap<>();

  private IndexExpander() {}

  /** Expands an expression. If it is a tensor, returns a (nested) list tensor
   * of its expanded components. */
  public static Core.Exp expand(Core.Exp e) {
    Resolver.checkResolved(e);
    final IndexExpander expander = new IndexExpander();
    return expander.expandShape(e, e.shape, ImmutableList.of());
  }

  private Core.Exp expandShape(Core.Exp e, Shape shape,
      List<Integer> prefix) {
    if (shape.isScalar()) {
      return component(e, ImmutableMap.of(), prefix);
    }
    final List<Core.Exp> entries = new ArrayList<>();
    for (int i = 0; i < shape.dim(0); i++) {
      entries.add(
          expandShape(e, shape.skip(1), Static.append(prefix, i)));
    }
    return core.listTensor(entries);
  }

  /** Returns component {@code comp} of {@code e}, with each free index label
   * replaced by its value. */
  Core.Exp component(Core.Exp e, Map<Index, Integer> values,
      List<Integer> comp) {
    switch (e.op) {
    case ZERO:
      return core.zero(Shape.SCALAR);
    case IDENTITY:
      return comp.get(0).equals(comp.get(1)) ? core.one()
          : core.zero(Shape.SCALAR);
    case SUM:
      final List<Core.Exp> terms = new ArrayList<>();
      for (Core.Exp operand : e.operands) {
        terms.add(component(operand, values, comp));
      }
      return core.sum(terms);
    case PRODUCT:
      return product(e, values, comp);
    case DIVISION:
      return core.division(component(e.operand(0), values, comp),
          component(e.operand(1), values, ImmutableList.of()));
    case POWER:
    case ABS:
    case SIGN:
    case SQRT:
    case EXP:
    case LN:
    case SIN:
    case COS:
      final List<Core.Exp> scalars = new ArrayList<>();
      for (Core.Exp operand : e.operands) {
        scalars.add(component(operand, values, ImmutableList.of()));
      }
      return core.apply(e.op, scalars);
    case INDEXED:
      return indexed((Core.Indexed) e, values);
    case COMPONENT_TENSOR:
      final Core.ComponentTensor tensor = (Core.ComponentTensor) e;
      final Map<Index, Integer> values2 = new HashMap<>(values);
      for (int i = 0; i < tensor.indices.size(); i++) {
        values2.put(tensor.indices.get(i), comp.get(i));
      }
      return component(e.operand(0), values2, ImmutableList.of());
    case INDEX_SUM:
      final Core.IndexSum indexSum = (Core.IndexSum) e;
      final List<Core.Exp> summands = new ArrayList<>();
      for (int v = 0; v < indexSum.dimension; v++) {
        final Map<Index, Integer> values3 = new HashMap<>(values);
        values3.put(indexSum.index, v);
        summands.add(component(e.operand(0), values3, comp));
      }
      return summands.size() == 1 ? summands.get(0) : core.sum(summands);
    case LIST_TENSOR:
      return component(e.operand(comp.get(0)), values,
          comp.subList(1, comp.size()));
    case INNER:
    case OUTER:
    case DOT:
    case CROSS:
    case TRANSPOSED:
    case TRACE:
    case DETERMINANT:
    case INVERSE:
    case DEVIATORIC:
    case DIV:
    case CURL:
    case JUMP:
    case AVG:
      return component(CompoundLowering.lowerNode(e), values, comp);
    case POSITIVE_RESTRICTED:
    case NEGATIVE_RESTRICTED:
      return core.restricted(e.op, component(e.operand(0), values, comp));
    case VARIABLE:
      return component(e.operand(0), values, comp);
    case CONDITIONAL:
      return core.conditional(condition(e.operand(0), values),
          component(e.operand(1), values, comp),
          component(e.operand(2), values, comp));
    case COEFFICIENT_DERIVATIVE:
    case VARIABLE_DERIVATIVE:
      throw new DifferentiationException("derivatives must be resolved "
          + "before indices are expanded", e.op);
    default:
      return leaf(e, comp);
    }
  }

  /** Returns a component of an expression that contains no index labels,
   * such as a terminal or the gradient of a terminal. */
  private Core.Exp leaf(Core.Exp e, List<Integer> comp) {
    if (!isLabelFree(e)) {
      throw new DifferentiationException("derivatives must be resolved "
          + "before indices are expanded", e.op);
    }
    if (comp.isEmpty()) {
      return e;
    }
    final List<IndexBase> indices = new ArrayList<>();
    for (int c : comp) {
      indices.add(FixedIndex.of(c));
    }
    return core.indexed(e, indices);
  }

  private boolean isLabelFree(Core.Exp e) {
    final Boolean b = labelFree.get(e);
    if (b != null) {
      return b;
    }
    final boolean result = e.freeIndices.isEmpty()
        && Analysis.extractIndices(e).isEmpty();
    labelFree.put(e, result);
    return result;
  }

  private Core.Exp condition(Core.Exp c, Map<Index, Integer> values) {
    switch (c.op) {
    case AND:
    case OR:
      return core.condition(c.op, condition(c.operand(0), values),
          condition(c.operand(1), values));
    case NOT:
      return core.not(condition(c.operand(0), values));
    default:
      return core.condition(c.op,
          component(c.operand(0), values, ImmutableList.of()),
          component(c.operand(1), values, ImmutableList.of()));
    }
  }

  /** Expands {@code A[indices]}. A label that is repeated is summed, even if
   * an enclosing expression has given it a value. */
  private Core.Exp indexed(Core.Indexed e, Map<Index, Integer> values) {
    final Map<Index, Integer> summed = new LinkedHashMap<>();
    final Core.Exp a = e.operand(0);
    for (int i = 0; i < e.indices.size(); i++) {
      final IndexBase index = e.indices.get(i);
      if (index.isFixed()) {
        continue;
      }
      if (e.indices.indexOf(index) != e.indices.lastIndexOf(index)) {
        // a repeated label is summed here, hiding any outer value
        summed.put((Index) index, a.shape.dim(i));
      } else if (!values.containsKey((Index) index)) {
        throw new UnresolvedIndexException("index " + index
            + " has no value", e.op);
      }
    }
    final List<Core.Exp> terms = new ArrayList<>();
    for (Map<Index, Integer> assignment : assignments(summed, values)) {
      final List<Integer> comp = new ArrayList<>();
      for (IndexBase index : e.indices) {
        comp.add(index.isFixed() ? ((FixedIndex) index).value
            : assignment.get((Index) index));
      }
      terms.add(component(a, assignment, comp));
    }
    return terms.size() == 1 ? terms.get(0) : core.sum(terms);
  }

  /** Expands a product, summing over the labels that are contracted between
   * its factors. A contracted label takes precedence over a value of the same
   * label from an enclosing expression. */
  private Core.Exp product(Core.Exp e, Map<Index, Integer> values,
      List<Integer> comp) {
    final Map<Index, Integer> counts = new HashMap<>();
    final Map<Index, Integer> contracted = new LinkedHashMap<>();
    for (Core.Exp operand : e.operands) {
      operand.freeIndices.forEach((index, range) -> {
        if (counts.merge(index, 1, Integer::sum) == 2) {
          contracted.put(index, range);
        }
      });
    }
    final List<Core.Exp> terms = new ArrayList<>();
    for (Map<Index, Integer> assignment : assignments(contracted, values)) {
      final List<Core.Exp> factors = new ArrayList<>();
      for (Core.Exp operand : e.operands) {
        factors.add(
            component(operand, assignment,
                operand.shape.isScalar() ? ImmutableList.of() : comp));
      }
      terms.add(core.product(factors));
    }
    return terms.size() == 1 ? terms.get(0) : core.sum(terms);
  }

  /** Returns every extension of {@code values} that assigns a value to each
   * label in {@code ranges}. */
  private static List<Map<Index, Integer>> assignments(
      Map<Index, Integer> ranges, Map<Index, Integer> values) {
    List<Map<Index, Integer>> list = ImmutableList.of(values);
    for (Map.Entry<Index, Integer> entry : ranges.entrySet()) {
      final List<Map<Index, Integer>> list2 = new ArrayList<>();
      for (Map<Index, Integer> map : list) {
        for (int v = 0; v < entry.getValue(); v++) {
          final Map<Index, Integer> map2 = new HashMap<>(map);
          map2.put(entry.getKey(), v);
          list2.add(map2);
        }
      }
      list = list2;
    }
    return list;
  }

  /** Whether an expression contains only fixed indices. */
  public static boolean isExpanded(Core.Exp e) {
    return Analysis.extractIndices(e).isEmpty() && e.freeIndices.isEmpty()
        && !containsCompound(e);
  }

  private static boolean containsCompound(Core.Exp e) {
    for (Op op : Analysis.extractKinds(e)) {
      if (CompoundLowering.isCompound(op)) {
        return true;
      }
    }
    return false;
  }
}

// End IndexExpander.java
