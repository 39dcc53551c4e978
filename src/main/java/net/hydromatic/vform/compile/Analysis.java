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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.ExprFunction;
import net.hydromatic.vform.ast.Index;
import net.hydromatic.vform.ast.IndexBase;
import net.hydromatic.vform.ast.Op;
import net.hydromatic.vform.ast.Traversals;
import net.hydromatic.vform.space.Mesh;

/** Extracts information from expressions. */
public final class Analysis {
  private Analysis() {}

  /** Orders arguments by number. */
  public static final Ordering<Core.Argument> ARGUMENT_ORDERING =
      Ordering.from(
          Comparator.<Core.Argument>comparingInt(a -> a.number)
              .thenComparing(a -> a.space.toString()));

  /** Orders coefficients by count. */
  public static final Ordering<Core.Coefficient> COEFFICIENT_ORDERING =
      Ordering.from(
          Comparator.<Core.Coefficient>comparingInt(c -> c.count)
              .thenComparing(c -> c.space.toString()));

  /** Dependency set of an expression that depends on no arguments. */
  static final ImmutableSet<ImmutableSet<Core.Argument>> NONE =
      ImmutableSet.of(ImmutableSet.of());

  /** Dependency set of a zero expression, which is compatible with any
   * other dependency set. */
  static final ImmutableSet<ImmutableSet<Core.Argument>> ZERO =
      ImmutableSet.of();

  /** Returns the distinct terminals in an expression, in order of first
   * occurrence. */
  public static List<Core.Terminal> extractTerminals(Core.Exp e) {
    final Set<Core.Terminal> set = new LinkedHashSet<>();
    for (Core.Exp node : Traversals.uniquePreOrder(e)) {
      if (node instanceof Core.Terminal) {
        set.add((Core.Terminal) node);
      }
    }
    return ImmutableList.copyOf(set);
  }

  /** Returns the distinct arguments in an expression, sorted by number. */
  public static List<Core.Argument> extractArguments(Core.Exp e) {
    final List<Core.Argument> list = new ArrayList<>();
    for (Core.Terminal terminal : extractTerminals(e)) {
      if (terminal.op == Op.ARGUMENT) {
        list.add((Core.Argument) terminal);
      }
    }
    return ARGUMENT_ORDERING.immutableSortedCopy(list);
  }

  /** Returns the distinct coefficients in an expression, sorted by
   * count. */
  public static List<Core.Coefficient> extractCoefficients(Core.Exp e) {
    final List<Core.Coefficient> list = new ArrayList<>();
    for (Core.Terminal terminal : extractTerminals(e)) {
      if (terminal.op == Op.COEFFICIENT) {
        list.add((Core.Coefficient) terminal);
      }
    }
    return COEFFICIENT_ORDERING.immutableSortedCopy(list);
  }

  /** Returns the kinds of node that occur in an expression. */
  public static Set<Op> extractKinds(Core.Exp e) {
    final Set<Op> set = EnumSet.noneOf(Op.class);
    for (Core.Exp node : Traversals.uniquePreOrder(e)) {
      set.add(node.op);
    }
    return set;
  }

  /** Returns every index label that occurs in an expression, free or
   * bound. */
  public static SortedSet<Index> extractIndices(Core.Exp e) {
    final SortedSet<Index> set = new TreeSet<>();
    for (Core.Exp node : Traversals.uniquePreOrder(e)) {
      switch (node.op) {
      case INDEXED:
        for (IndexBase index : ((Core.Indexed) node).indices) {
          if (!index.isFixed()) {
            set.add((Index) index);
          }
        }
        break;
      case COMPONENT_TENSOR:
        set.addAll(((Core.ComponentTensor) node).indices);
        break;
      case INDEX_SUM:
        set.add(((Core.IndexSum) node).index);
        break;
      default:
        break;
      }
    }
    return ImmutableSortedSet.copyOfSorted(set);
  }

  /** Returns the distinct domains of the terminals in an expression, sorted
   * by {@link Mesh#ORDERING}. */
  public static List<Mesh> extractDomains(Core.Exp e) {
    final List<Mesh> list = new ArrayList<>();
    for (Core.Terminal terminal : extractTerminals(e)) {
      final Mesh domain = terminal.domain();
      if (domain != null) {
        list.add(domain);
      }
    }
    return Mesh.ORDERING.immutableSortedCopy(Mesh.join(list));
  }

  /** Returns whether an expression has the same value everywhere in the
   * domain, and on both sides of every facet. */
  public static boolean isGlobalConstant(Core.Exp e) {
    for (Core.Terminal terminal : extractTerminals(e)) {
      switch (terminal.op) {
      case CONSTANT:
      case IDENTITY:
      case ZERO:
      case LABEL:
        break;
      case COEFFICIENT:
        if (!((Core.Coefficient) terminal).isGlobalConstant()) {
          return false;
        }
        break;
      default:
        return false;
      }
    }
    return true;
  }

  /** Returns the combinations of arguments on which an expression depends
   * linearly.
   *
   * <p>Each element of the result is one combination; a sum of terms that
   * depend on the same arguments has one combination. The result for an
   * expression that depends on no arguments is a set containing the empty
   * set; the result for zero is the empty set.
   *
   * @throws MultilinearityException if the expression is not linear in each
   * of its arguments */
  public static Set<ImmutableSet<Core.Argument>> argumentDependencies(
      Core.Exp e) {
    return Traversals.map(e, new ArgumentDependencies());
  }

  /** Returns the arguments of a multilinear expression, sorted by number.
   * Returns an empty list for zero.
   *
   * @throws MultilinearityException if the expression is not multilinear, or
   * if its argument numbers are not 0, 1, ..., n - 1 */
  public static List<Core.Argument> arity(Core.Exp e) {
    final Set<ImmutableSet<Core.Argument>> deps = argumentDependencies(e);
    if (deps.isEmpty()) {
      return ImmutableList.of();
    }
    if (deps.size() > 1) {
      throw new MultilinearityException("expression has terms with "
          + "different arguments " + deps, e.op);
    }
    final List<Core.Argument> arguments =
        ARGUMENT_ORDERING.immutableSortedCopy(deps.iterator().next());
    for (int i = 0; i < arguments.size(); i++) {
      if (arguments.get(i).number != i) {
        throw new MultilinearityException("arguments must be numbered 0 to "
            + (arguments.size() - 1) + ", found " + arguments, e.op);
      }
    }
    return arguments;
  }

  /** Computes the argument dependencies of each node. Every kind has an
   * explicit rule. */
  private static class ArgumentDependencies
      implements ExprFunction<Set<ImmutableSet<Core.Argument>>> {
    @Override
    public Set<ImmutableSet<Core.Argument>> argument(Core.Argument e) {
      return ImmutableSet.of(ImmutableSet.of(e));
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> coefficient(Core.Coefficient e) {
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> constant(Core.Constant e) {
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> identity(Core.Identity e) {
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> zero(Core.Zero e) {
      return ZERO;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> geometric(Core.Geometric e) {
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> label(Core.Label e) {
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> sum(Core.Exp e,
        List<Set<ImmutableSet<Core.Argument>>> operands) {
      return same(e, operands);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> product(Core.Exp e,
        List<Set<ImmutableSet<Core.Argument>>> operands) {
      return multiply(e, operands);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> division(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> numerator,
        Set<ImmutableSet<Core.Argument>> denominator) {
      requireNone(e, denominator, "denominator");
      return numerator;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> power(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> base,
        Set<ImmutableSet<Core.Argument>> exponent) {
      requireNone(e, base, "base");
      requireNone(e, exponent, "exponent");
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> abs(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return nonlinear(e, operand);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> sign(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return nonlinear(e, operand);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> mathFunction(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return nonlinear(e, operand);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> indexed(Core.Indexed e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> componentTensor(
        Core.ComponentTensor e, Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> indexSum(Core.IndexSum e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> listTensor(Core.Exp e,
        List<Set<ImmutableSet<Core.Argument>>> operands) {
      return same(e, operands);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> inner(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a,
        Set<ImmutableSet<Core.Argument>> b) {
      return multiply(e, ImmutableList.of(a, b));
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> outer(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a,
        Set<ImmutableSet<Core.Argument>> b) {
      return multiply(e, ImmutableList.of(a, b));
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> dot(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a,
        Set<ImmutableSet<Core.Argument>> b) {
      return multiply(e, ImmutableList.of(a, b));
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> cross(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a,
        Set<ImmutableSet<Core.Argument>> b) {
      return multiply(e, ImmutableList.of(a, b));
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> transposed(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a) {
      return a;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> trace(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a) {
      return a;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> determinant(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a) {
      return nonlinear(e, a);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> inverse(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a) {
      return nonlinear(e, a);
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> deviatoric(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> a) {
      return a;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> grad(Core.Grad e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> div(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> curl(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> timeDerivative(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> coefficientDerivative(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> integrand,
        Set<ImmutableSet<Core.Argument>> coefficient,
        Set<ImmutableSet<Core.Argument>> direction) {
      return multiply(e, ImmutableList.of(integrand, direction));
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> variable(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> expression,
        Set<ImmutableSet<Core.Argument>> label) {
      return expression;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> variableDerivative(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> f,
        Set<ImmutableSet<Core.Argument>> variable) {
      return f;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> condition(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> left,
        Set<ImmutableSet<Core.Argument>> right) {
      requireNone(e, left, "condition");
      requireNone(e, right, "condition");
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> not(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return NONE;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> conditional(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> condition,
        Set<ImmutableSet<Core.Argument>> ifTrue,
        Set<ImmutableSet<Core.Argument>> ifFalse) {
      requireNone(e, condition, "condition");
      return same(e, ImmutableList.of(ifTrue, ifFalse));
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> restricted(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> avg(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      return operand;
    }

    @Override
    public Set<ImmutableSet<Core.Argument>> jump(Core.Exp e,
        List<Set<ImmutableSet<Core.Argument>>> operands) {
      return multiply(e, operands);
    }

    /** Dependencies of terms that are added; every non-zero term must have
     * the same dependencies. */
    private static Set<ImmutableSet<Core.Argument>> same(Core.Exp e,
        List<Set<ImmutableSet<Core.Argument>>> operands) {
      Set<ImmutableSet<Core.Argument>> result = ZERO;
      for (Set<ImmutableSet<Core.Argument>> operand : operands) {
        if (operand.isEmpty()) {
          continue;
        }
        if (result.isEmpty()) {
          result = operand;
        } else if (!result.equals(operand)) {
          throw new MultilinearityException("adding expressions with "
              + "non-matching arguments " + result + " and " + operand, e.op);
        }
      }
      return result;
    }

    /** Dependencies of factors that are multiplied; no argument number may
     * occur in more than one factor. */
    private static Set<ImmutableSet<Core.Argument>> multiply(Core.Exp e,
        List<Set<ImmutableSet<Core.Argument>>> operands) {
      Set<ImmutableSet<Core.Argument>> result = NONE;
      for (Set<ImmutableSet<Core.Argument>> operand : operands) {
        if (operand.isEmpty()) {
          return ZERO;
        }
        final ImmutableSet.Builder<ImmutableSet<Core.Argument>> b =
            ImmutableSet.builder();
        for (ImmutableSet<Core.Argument> set0 : result) {
          for (ImmutableSet<Core.Argument> set1 : operand) {
            for (Core.Argument a0 : set0) {
              for (Core.Argument a1 : set1) {
                if (a0.number == a1.number) {
                  throw new MultilinearityException("multiplying "
                      + "expressions with overlapping argument number "
                      + a0.number, e.op);
                }
              }
            }
            b.add(
                ImmutableSet.<Core.Argument>builder().addAll(set0)
                    .addAll(set1).build());
          }
        }
        result = b.build();
      }
      return result;
    }

    private static void requireNone(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> deps, String role) {
      if (!deps.isEmpty() && !deps.equals(NONE)) {
        throw new MultilinearityException("argument in " + role + " of "
            + e.op.opName + " is not linear", e.op);
      }
    }

    private static Set<ImmutableSet<Core.Argument>> nonlinear(Core.Exp e,
        Set<ImmutableSet<Core.Argument>> operand) {
      requireNone(e, operand, "operand");
      return NONE;
    }
  }
}

// End Analysis.java
