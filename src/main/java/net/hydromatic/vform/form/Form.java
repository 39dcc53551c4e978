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
package net.hydromatic.vform.form;

import static net.hydromatic.vform.ast.CoreBuilder.core;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.compile.Analysis;
import net.hydromatic.vform.compile.ShapeMismatchException;
import net.hydromatic.vform.compile.UnresolvedIndexException;
import net.hydromatic.vform.space.Mesh;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Ordered collection of integrals.
 *
 * <p>A form is immutable. Adding two forms concatenates their integrals;
 * no integral is merged or removed.
 */
public final class Form {
  /** Form with no integrals. */
  public static final Form EMPTY = new Form(ImmutableList.of());

  public final ImmutableList<Integral> integrals;

  private final Supplier<String> signatureSupplier =
      Suppliers.memoize(() -> FormSignature.of(this, true).signature);

  private Form(ImmutableList<Integral> integrals) {
    this.integrals = integrals;
  }

  /** Creates a form from a list of integrals. */
  public static Form of(Iterable<Integral> integrals) {
    return new Form(ImmutableList.copyOf(integrals));
  }

  /** Creates a form with one integral. */
  public static Form of(Integral integral) {
    return new Form(ImmutableList.of(integral));
  }

  public boolean isEmpty() {
    return integrals.isEmpty();
  }

  /** Returns a form whose integrals are those of this form followed by those
   * of another. */
  public Form plus(Form form) {
    if (form.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return form;
    }
    return new Form(
        ImmutableList.<Integral>builder()
            .addAll(integrals)
            .addAll(form.integrals)
            .build());
  }

  /** Returns a form whose integrands are the negations of this form's. */
  public Form negate() {
    return scale(core.constant(-1));
  }

  /** Returns a form whose integrands are this form's multiplied by a scalar
   * expression.
   *
   * @throws ShapeMismatchException if the factor is not a scalar
   * @throws UnresolvedIndexException if the factor has free indices */
  public Form scale(Core.Exp factor) {
    if (!factor.shape.isScalar()) {
      throw new ShapeMismatchException("cannot scale form by a non-scalar "
          + "of shape " + factor.shape, factor.op);
    }
    if (!factor.freeIndices.isEmpty()) {
      throw new UnresolvedIndexException("cannot scale form by an "
          + "expression with free indices", factor.op);
    }
    final List<Integral> list = new ArrayList<>();
    for (Integral integral : integrals) {
      list.add(
          integral.withIntegrand(core.product(factor, integral.integrand)));
    }
    return of(list);
  }

  /** Returns the integrals of a given type and subdomain, in their original
   * order. A null type or subdomain matches every integral. */
  public List<Integral> integrals(@Nullable IntegralType type,
      @Nullable SubdomainId subdomain) {
    final ImmutableList.Builder<Integral> b = ImmutableList.builder();
    for (Integral integral : integrals) {
      if ((type == null || integral.type == type)
          && (subdomain == null || integral.subdomain.equals(subdomain))) {
        b.add(integral);
      }
    }
    return b.build();
  }

  /** Returns the integrals of a given type, in their original order. */
  public List<Integral> integrals(IntegralType type) {
    return integrals(type, null);
  }

  /** Returns the integrals grouped by domain, type and subdomain. Groups are
   * sorted; within a group, integrals are in their original order. */
  public Map<Group, List<Integral>> integralGroups() {
    final Map<Group, List<Integral>> map = new TreeMap<>();
    for (Integral integral : integrals) {
      map.computeIfAbsent(
              new Group(integral.domain, integral.type, integral.subdomain),
              g -> new ArrayList<>())
          .add(integral);
    }
    final ImmutableMap.Builder<Group, List<Integral>> b =
        ImmutableMap.builder();
    map.forEach((group, list) -> b.put(group, ImmutableList.copyOf(list)));
    return b.build();
  }

  /** Returns the arguments of this form, sorted by number. */
  public List<Core.Argument> arguments() {
    final Set<Core.Argument> set = new LinkedHashSet<>();
    for (Integral integral : integrals) {
      set.addAll(Analysis.extractArguments(integral.integrand));
    }
    return Analysis.ARGUMENT_ORDERING.immutableSortedCopy(set);
  }

  /** Returns the coefficients of this form, sorted by count. */
  public List<Core.Coefficient> coefficients() {
    final Set<Core.Coefficient> set = new LinkedHashSet<>();
    for (Integral integral : integrals) {
      set.addAll(Analysis.extractCoefficients(integral.integrand));
    }
    return Analysis.COEFFICIENT_ORDERING.immutableSortedCopy(set);
  }

  /** Returns the domains of the integrals of this form, sorted. */
  public List<Mesh> domains() {
    final List<Mesh> list = new ArrayList<>();
    for (Integral integral : integrals) {
      list.add(integral.domain);
    }
    return Mesh.ORDERING.immutableSortedCopy(Mesh.join(list));
  }

  /** Returns the signature of this form, with coefficients and domains
   * renumbered. */
  public String signature() {
    return signatureSupplier.get();
  }

  @Override
  public int hashCode() {
    return integrals.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Form
            && integrals.equals(((Form) o).integrals);
  }

  @Override
  public String toString() {
    if (integrals.isEmpty()) {
      return "<empty form>";
    }
    final StringBuilder b = new StringBuilder();
    for (Integral integral : integrals) {
      if (b.length() > 0) {
        b.append("\n  + ");
      }
      b.append(integral);
    }
    return b.toString();
  }

  /** Key of a group of integrals: domain, type and subdomain. */
  public static final class Group implements Comparable<Group> {
    private static final Ordering<Group> ORDERING =
        Ordering.from(
            Comparator.comparing((Group g) -> g.domain, Mesh.ORDERING)
                .thenComparing(g -> g.type)
                .thenComparing(g -> g.subdomain));

    public final Mesh domain;
    public final IntegralType type;
    public final SubdomainId subdomain;

    public Group(Mesh domain, IntegralType type, SubdomainId subdomain) {
      this.domain = domain;
      this.type = type;
      this.subdomain = subdomain;
    }

    @Override
    public int compareTo(Group o) {
      return ORDERING.compare(this, o);
    }

    @Override
    public int hashCode() {
      return Objects.hash(domain, type, subdomain);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Group
              && domain.equals(((Group) o).domain)
              && type == ((Group) o).type
              && subdomain.equals(((Group) o).subdomain);
    }

    @Override
    public String toString() {
      return type.measureName + "(" + domain.id + ", " + subdomain + ")";
    }
  }
}

// End Form.java
