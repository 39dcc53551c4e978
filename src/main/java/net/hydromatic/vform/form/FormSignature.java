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

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.compile.Signatures;
import net.hydromatic.vform.space.FunctionSpace;
import net.hydromatic.vform.space.Mesh;

/**
 * Signature of a form and of each of its integrals.
 *
 * <p>If renumbering is enabled, coefficients are numbered 0, 1, ... in order
 * of their count, and domains are numbered in their sort order. Two forms
 * that differ only in which coefficients and meshes they use then have the
 * same signature.
 */
public final class FormSignature {
  /** Signature of the whole form. */
  public final String signature;

  /** Signature of each integral, in the order of
   * {@link Form#integralGroups()}. */
  public final ImmutableList<String> integralSignatures;

  private FormSignature(String signature,
      ImmutableList<String> integralSignatures) {
    this.signature = signature;
    this.integralSignatures = integralSignatures;
  }

  /** Computes the signature of a form. */
  public static FormSignature of(Form form, boolean renumber) {
    final Renumbering renumbering = renumber ? new Renumbering(form) : null;
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    final Hasher hasher = Hashing.sha256().newHasher();
    for (List<Integral> group : form.integralGroups().values()) {
      for (Integral integral : group) {
        final String s = renumbering == null
            ? integral.signature()
            : integral.signature(renumbering::render,
                renumbering.mesh(integral.domain));
        b.add(s);
        hasher.putString(s, UTF_8);
      }
    }
    return new FormSignature(hasher.hash().toString(), b.build());
  }

  @Override
  public String toString() {
    return signature;
  }

  /** Renders terminals with coefficients and meshes renumbered. */
  private static class Renumbering {
    final Map<Core.Coefficient, Integer> coefficients = new HashMap<>();
    final Map<Mesh, Integer> meshes = new HashMap<>();

    Renumbering(Form form) {
      for (Core.Coefficient coefficient : form.coefficients()) {
        coefficients.put(coefficient, coefficients.size());
      }
      for (Mesh mesh : form.domains()) {
        meshes.put(mesh, meshes.size());
      }
    }

    String mesh(Mesh mesh) {
      final Integer n = meshes.get(mesh);
      return "Mesh(" + mesh.coordinateElement + ", "
          + (n != null ? "#" + n : mesh.id) + ")";
    }

    String space(FunctionSpace space) {
      return "FunctionSpace(" + mesh(space.mesh) + ", " + space.element + ")";
    }

    String render(Core.Terminal e) {
      switch (e.op) {
      case ARGUMENT:
        final Core.Argument argument = (Core.Argument) e;
        return "v(" + argument.number + ", " + space(argument.space) + ")";
      case COEFFICIENT:
        final Core.Coefficient coefficient = (Core.Coefficient) e;
        return "w(" + coefficients.get(coefficient) + ", "
            + space(coefficient.space) + ")";
      case SPATIAL_COORDINATE:
      case FACET_NORMAL:
      case CELL_VOLUME:
      case CIRCUMRADIUS:
      case FACET_AREA:
        return e.op.opName + "(" + mesh(((Core.Geometric) e).mesh) + ")";
      default:
        return Signatures.renderTerminal(e);
      }
    }
  }
}

// End FormSignature.java
