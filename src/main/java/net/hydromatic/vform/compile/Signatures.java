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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.FixedIndex;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.Op;

/**
 * Computes structural signatures of expressions.
 *
 * <p>A signature is a SHA-256 digest of a canonical rendering of the
 * expression. The rendering has two properties:
 *
 * <ul>
 *   <li>operands of commutative kinds (sum, product) are sorted, so
 *   expressions that differ only in the order of such operands have the same
 *   rendering;
 *   <li>index labels and variable labels are numbered in order of first
 *   appearance, so expressions that differ only in the choice of labels have
 *   the same rendering.
 * </ul>
 *
 * <p>Operands are sorted by a "skeleton" digest in which every label is
 * anonymous, so that the sort order does not depend on the labels. Among
 * operands with equal skeletons, the next operand rendered is the one whose
 * rendering, with the labels numbered so far, is least. If several operands
 * have the same such rendering, each is tried in turn and the least complete
 * rendering of the operand list is kept.
 *
 * <p>Nothing in the rendering depends on object identity or on the order of
 * iteration over a hash table, so signatures are the same in every run.
 */
public final class Signatures {
  private Signatures() {}

  /** Returns the signature of an expression. */
  public static String signature(Core.Exp e) {
    return signature(e, Signatures::renderTerminal);
  }

  /** Returns the signature of an expression, rendering terminals with a
   * given function. Variable labels and the free indices of zeros are
   * rendered by the caller, not by {@code terminalRenderer}. */
  public static String signature(Core.Exp e,
      Function<Core.Terminal, String> terminalRenderer) {
    return Hashing.sha256()
        .hashString(canonicalString(e, terminalRenderer), UTF_8)
        .toString();
  }

  /** Returns the canonical rendering of an expression. Two expressions have
   * the same signature if and only if they have the same canonical
   * rendering. */
  public static String canonicalString(Core.Exp e) {
    return canonicalString(e, Signatures::renderTerminal);
  }

  /** Returns the canonical rendering of an expression, rendering terminals
   * with a given function. */
  public static String canonicalString(Core.Exp e,
      Function<Core.Terminal, String> terminalRenderer) {
    final Canonicalizer canonicalizer = new Canonicalizer(terminalRenderer);
    canonicalizer.render(e);
    return canonicalizer.b.toString();
  }

  /** Default rendering of a terminal. Includes all of its metadata. */
  public static String renderTerminal(Core.Terminal e) {
    switch (e.op) {
    case ARGUMENT:
      final Core.Argument argument = (Core.Argument) e;
      return "v(" + argument.number + ", " + argument.space + ")";
    case COEFFICIENT:
      final Core.Coefficient coefficient = (Core.Coefficient) e;
      return "w(" + coefficient.count + ", " + coefficient.space + ")";
    case CONSTANT:
      return "c(" + ((Core.Constant) e).value.toPlainString() + ")";
    case IDENTITY:
      return "I(" + ((Core.Identity) e).dim + ")";
    case ZERO:
      return "0" + e.shape;
    case LABEL:
      return "l";
    case SPATIAL_COORDINATE:
    case FACET_NORMAL:
    case CELL_VOLUME:
    case CIRCUMRADIUS:
    case FACET_AREA:
      return e.op.opName + "(" + ((Core.Geometric) e).mesh + ")";
    default:
      throw new AssertionError("not a terminal: " + e.op);
    }
  }

  /** Renders an expression canonically, in two passes. */
  private static class Canonicalizer {
    final Function<Core.Terminal, String> terminalRenderer;
    final StringBuilder b = new StringBuilder();

    /** Skeleton digest of each node. */
    final Map<Core.Exp, String> skeletons = new IdentityHashMap<>();
    /** Whether each node contains an index label or variable label. */
    final Map<Core.Exp, Boolean> labelled = new IdentityHashMap<>();
    /** Renderings of nodes that contain no labels. */
    final Map<Core.Exp, String> renderings = new IdentityHashMap<>();

    final Map<Index, Integer> indexNumbers = new HashMap<>();
    final Map<Integer, Integer> labelNumbers = new HashMap<>();

    Canonicalizer(Function<Core.Terminal, String> terminalRenderer) {
      this.terminalRenderer = terminalRenderer;
    }

    /** Creates a canonicalizer that shares this one's caches and starts with
     * a copy of its output and label numbers. */
    private Canonicalizer fork(boolean withOutput) {
      final Canonicalizer fork = new Canonicalizer(terminalRenderer);
      fork.skeletons.putAll(skeletons);
      fork.labelled.putAll(labelled);
      fork.renderings.putAll(renderings);
      fork.indexNumbers.putAll(indexNumbers);
      fork.labelNumbers.putAll(labelNumbers);
      if (withOutput) {
        fork.b.append(b);
      }
      return fork;
    }

    /** Takes the output and label numbers of a fork. */
    private void adopt(Canonicalizer fork) {
      b.setLength(0);
      b.append(fork.b);
      indexNumbers.clear();
      indexNumbers.putAll(fork.indexNumbers);
      labelNumbers.clear();
      labelNumbers.putAll(fork.labelNumbers);
    }

    /** First pass: computes the skeleton digest of a node. */
    String skeleton(Core.Exp e) {
      final String s = skeletons.get(e);
      if (s != null) {
        return s;
      }
      final Hasher hasher = Hashing.sha256().newHasher();
      hasher.putString(e.op.name(), UTF_8);
      boolean hasLabels = !e.freeIndices.isEmpty();
      switch (e.op) {
      case INDEXED:
        for (IndexBase index : ((Core.Indexed) e).indices) {
          hasher.putString(index.isFixed() ? index.toString() : "i", UTF_8);
          hasLabels |= !index.isFixed();
        }
        break;
      case COMPONENT_TENSOR:
        hasher.putInt(((Core.ComponentTensor) e).indices.size());
        hasLabels = true;
        break;
      case INDEX_SUM:
        hasher.putInt(((Core.IndexSum) e).dimension);
        hasLabels = true;
        break;
      case GRAD:
        hasher.putInt(((Core.Grad) e).dim);
        break;
      case LABEL:
        hasLabels = true;
        break;
      default:
        break;
      }
      if (e instanceof Core.Terminal) {
        hasher.putString(terminalRenderer.apply((Core.Terminal) e), UTF_8);
        e.freeIndices.values().forEach(hasher::putInt);
      }
      final List<String> operandSkeletons = new ArrayList<>();
      for (Core.Exp operand : e.operands) {
        operandSkeletons.add(skeleton(operand));
        hasLabels |= labelled.get(operand);
      }
      if (e.op.commutative) {
        operandSkeletons.sort(Ordering.natural());
      }
      operandSkeletons.forEach(s2 -> hasher.putString(s2, UTF_8));
      final String skeleton = hasher.hash().toString();
      skeletons.put(e, skeleton);
      labelled.put(e, hasLabels);
      return skeleton;
    }

    /** Returns the operands of a node in canonical order. */
    List<Core.Exp> sortedOperands(Core.Exp e) {
      if (!e.op.commutative) {
        return e.operands;
      }
      return Ordering.<String>natural().<Core.Exp>onResultOf(this::skeleton)
          .immutableSortedCopy(e.operands);
    }

    /** Second pass: renders a node, numbering labels as they are
     * encountered. */
    void render(Core.Exp e) {
      skeleton(e);
      if (!labelled.get(e)) {
        final String s = renderings.get(e);
        if (s != null) {
          b.append(s);
          return;
        }
        final int start = b.length();
        renderNode(e);
        renderings.put(e, b.substring(start));
        return;
      }
      renderNode(e);
    }

    private void renderNode(Core.Exp e) {
      if (e instanceof Core.Terminal) {
        if (e.op == Op.LABEL) {
          b.append("l").append(labelNumber((Core.Label) e));
          return;
        }
        b.append(terminalRenderer.apply((Core.Terminal) e));
        if (!e.freeIndices.isEmpty()) {
          b.append('{');
          e.freeIndices.forEach((index, range) ->
              b.append(indexName(index)).append(':').append(range)
                  .append(' '));
          b.append('}');
        }
        return;
      }
      b.append(e.op.opName);
      switch (e.op) {
      case INDEXED:
        b.append('[');
        for (IndexBase index : ((Core.Indexed) e).indices) {
          b.append(index.isFixed() ? Integer.toString(((FixedIndex) index).value)
              : indexName((Index) index)).append(' ');
        }
        b.append(']');
        break;
      case COMPONENT_TENSOR:
        b.append('[');
        for (Index index : ((Core.ComponentTensor) e).indices) {
          b.append(indexName(index)).append(' ');
        }
        b.append(']');
        break;
      case INDEX_SUM:
        final Core.IndexSum indexSum = (Core.IndexSum) e;
        b.append('[').append(indexName(indexSum.index)).append(' ')
            .append(indexSum.dimension).append(']');
        break;
      case GRAD:
        b.append('[').append(((Core.Grad) e).dim).append(']');
        break;
      default:
        break;
      }
      b.append('(');
      final List<Core.Exp> operands = sortedOperands(e);
      if (e.op.commutative) {
        renderOperands(operands, true);
      } else {
        for (int i = 0; i < operands.size(); i++) {
          if (i > 0) {
            b.append(", ");
          }
          render(operands.get(i));
        }
      }
      b.append(')');
    }

    /** Renders the remaining operands of a commutative node, which are
     * sorted by skeleton. */
    private void renderOperands(List<Core.Exp> remaining, boolean first) {
      if (remaining.isEmpty()) {
        return;
      }
      final List<Integer> candidates = candidates(remaining);
      if (candidates.size() == 1) {
        renderThen(remaining, candidates.get(0), first);
        return;
      }
      Canonicalizer best = null;
      String bestString = null;
      for (int candidate : candidates) {
        final Canonicalizer fork = fork(true);
        fork.renderThen(remaining, candidate, first);
        final String s = fork.b.toString();
        if (bestString == null || s.compareTo(bestString) < 0) {
          best = fork;
          bestString = s;
        }
      }
      adopt(best);
    }

    private void renderThen(List<Core.Exp> remaining, int i, boolean first) {
      if (!first) {
        b.append(", ");
      }
      render(remaining.get(i));
      final List<Core.Exp> rest = new ArrayList<>(remaining);
      rest.remove(i);
      renderOperands(rest, false);
    }

    /** Returns the positions of the operands that may be rendered next: those
     * that have the least skeleton and, among them, the least rendering with
     * the labels numbered so far. Structurally equal operands are returned
     * once. */
    private List<Integer> candidates(List<Core.Exp> remaining) {
      final Core.Exp e0 = remaining.get(0);
      final String skeleton = skeleton(e0);
      int end = 1;
      while (end < remaining.size()
          && skeleton(remaining.get(end)).equals(skeleton)) {
        ++end;
      }
      if (end == 1 || !labelled.get(e0)) {
        return ImmutableList.of(0);
      }
      final List<Integer> candidates = new ArrayList<>();
      final List<Core.Exp> distinct = new ArrayList<>();
      String least = null;
      for (int i = 0; i < end; i++) {
        final Core.Exp e = remaining.get(i);
        final Canonicalizer trial = fork(false);
        trial.render(e);
        final String s = trial.b.toString();
        final int c = least == null ? -1 : s.compareTo(least);
        if (c < 0) {
          least = s;
          candidates.clear();
          distinct.clear();
        }
        if (c <= 0 && !distinct.contains(e)) {
          candidates.add(i);
          distinct.add(e);
        }
      }
      return candidates;
    }

    private String indexName(Index index) {
      return "i" + indexNumbers.computeIfAbsent(index,
          i -> indexNumbers.size());
    }

    private int labelNumber(Core.Label label) {
      return labelNumbers.computeIfAbsent(label.count,
          i -> labelNumbers.size());
    }
  }
}

// End Signatures.java
