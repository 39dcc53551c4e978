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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Objects;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.compile.Analysis;
import net.hydromatic.vform.compile.FormException;
import net.hydromatic.vform.space.Mesh;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integration measure, such as {@code dx} or {@code ds(3)}.
 *
 * <p>Multiplying an expression by a measure, via {@link #integrate}, creates a
 * form with one integral. If the measure has no domain, the domain is
 * inferred from the expression.
 */
public final class Measure {
  public final IntegralType type;
  public final @Nullable Mesh domain;
  public final SubdomainId subdomain;
  public final ImmutableSortedMap<String, String> metadata;

  private Measure(IntegralType type, @Nullable Mesh domain,
      SubdomainId subdomain, ImmutableSortedMap<String, String> metadata) {
    this.type = requireNonNull(type, "type");
    this.domain = domain;
    this.subdomain = requireNonNull(subdomain, "subdomain");
    this.metadata = requireNonNull(metadata, "metadata");
  }

  /** Creates a measure of a given type over the whole of an inferred
   * domain. */
  public static Measure of(IntegralType type) {
    return new Measure(type, null, SubdomainId.EVERYWHERE,
        ImmutableSortedMap.of());
  }

  /** Cell measure, {@code dx}. */
  public static Measure dx() {
    return of(IntegralType.CELL);
  }

  /** Exterior facet measure, {@code ds}. */
  public static Measure ds() {
    return of(IntegralType.EXTERIOR_FACET);
  }

  /** Interior facet measure, {@code dS}. */
  public static Measure dS() {
    return of(IntegralType.INTERIOR_FACET);
  }

  /** Returns a measure with a given domain. */
  public Measure on(Mesh domain) {
    return new Measure(type, requireNonNull(domain), subdomain, metadata);
  }

  /** Returns a measure restricted to a numbered subdomain. */
  public Measure subdomain(int id) {
    return new Measure(type, domain, SubdomainId.of(id), metadata);
  }

  /** Returns a measure with an additional metadata entry. */
  public Measure withMetadata(String key, String value) {
    return new Measure(type, domain, subdomain,
        ImmutableSortedMap.<String, String>naturalOrder()
            .putAll(metadata)
            .put(key, value)
            .buildKeepingLast());
  }

  /** Integrates an expression over this measure, returning a form with one
   * integral.
   *
   * @throws FormException if the measure has no domain and the expression
   * is not defined on exactly one domain */
  public Form integrate(Core.Exp integrand) {
    return Form.of(
        Integral.of(integrand, type, inferDomain(integrand), subdomain,
            metadata));
  }

  private Mesh inferDomain(Core.Exp integrand) {
    if (domain != null) {
      return domain;
    }
    final List<Mesh> domains = Analysis.extractDomains(integrand);
    if (domains.size() != 1) {
      throw new FormException("cannot infer domain of integrand; it is "
          + "defined on " + domains.size() + " domains", integrand.op);
    }
    return domains.get(0);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, domain, subdomain, metadata);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Measure
            && type == ((Measure) o).type
            && Objects.equals(domain, ((Measure) o).domain)
            && subdomain.equals(((Measure) o).subdomain)
            && metadata.equals(((Measure) o).metadata);
  }

  @Override
  public String toString() {
    return type.measureName
        + (subdomain.isEverywhere() ? "" : "(" + subdomain + ")");
  }
}

// End Measure.java
