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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hashing;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.compile.ShapeMismatchException;
import net.hydromatic.vform.compile.Signatures;
import net.hydromatic.vform.compile.UnresolvedIndexException;
import net.hydromatic.vform.space.Mesh;

/**
 * Integrand together with the domain, type and subdomain over which it is
 * integrated.
 *
 * <p>The integrand is a scalar with no free indices. An integral is
 * immutable; {@link #withIntegrand} creates a new one.
 */
public final class Integral {
  public final Core.Exp integrand;
  public final IntegralType type;
  public final Mesh domain;
  public final SubdomainId subdomain;
  public final ImmutableSortedMap<String, String> metadata;

  private final Supplier<String> signatureSupplier;

  private Integral(Core.Exp integrand, IntegralType type, Mesh domain,
      SubdomainId subdomain, ImmutableSortedMap<String, String> metadata) {
    this.integrand = requireNonNull(integrand, "integrand");
    this.type = requireNonNull(type, "type");
    this.domain = requireNonNull(domain, "domain");
    this.subdomain = requireNonNull(subdomain, "subdomain");
    this.metadata = requireNonNull(metadata, "metadata");
    this.signatureSupplier =
        Suppliers.memoize(() ->
            signature(Signatures::renderTerminal, domain.toString()));
  }

  /** Creates an integral.
   *
   * @throws ShapeMismatchException if the integrand is not scalar
   * @throws UnresolvedIndexException if the integrand has free indices */
  public static Integral of(Core.Exp integrand, IntegralType type,
      Mesh domain, SubdomainId subdomain, Map<String, String> metadata) {
    if (!integrand.shape.isScalar()) {
      throw new ShapeMismatchException("integrand must be scalar, but has "
          + "shape " + integrand.shape, integrand.op);
    }
    if (!integrand.freeIndices.isEmpty()) {
      throw new UnresolvedIndexException("integrand has free indices "
          + integrand.freeIndices.keySet(), integrand.op);
    }
    return new Integral(integrand, type, domain, subdomain,
        ImmutableSortedMap.copyOf(metadata));
  }

  /** Creates an integral with the same domain, type, subdomain and metadata
   * but a different integrand. */
  public Integral withIntegrand(Core.Exp integrand) {
    if (integrand == this.integrand) {
      return this;
    }
    return of(integrand, type, domain, subdomain, metadata);
  }

  /** Returns the signature of this integral. Two integrals with the same
   * signature have structurally equal integrands and are over the same
   * domain, type and subdomain. */
  public String signature() {
    return signatureSupplier.get();
  }

  /** Returns the signature of this integral, rendering terminals and the
   * domain with given functions. */
  String signature(Function<Core.Terminal, String> terminalRenderer,
      String domainName) {
    return Hashing.sha256()
        .hashString(header(domainName)
                + Signatures.canonicalString(integrand, terminalRenderer),
            UTF_8)
        .toString();
  }

  private String header(String domainName) {
    return type.measureName + "(" + domainName + ", " + subdomain + ", "
        + metadata + "):";
  }

  @Override
  public int hashCode() {
    return Objects.hash(integrand, type, domain, subdomain, metadata);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Integral
            && integrand.equals(((Integral) o).integrand)
            && type == ((Integral) o).type
            && domain.equals(((Integral) o).domain)
            && subdomain.equals(((Integral) o).subdomain)
            && metadata.equals(((Integral) o).metadata);
  }

  @Override
  public String toString() {
    return "{ " + integrand + " } * " + type.measureName + "(" + domain.id
        + ", " + subdomain + ")";
  }
}

// End Integral.java
