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
package net.hydromatic.vform.space;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.vform.ast.Shape;

/**
 * Description of a finite element: family, cell, polynomial degree and the
 * shape of the values of functions in the element.
 *
 * <p>The engine never evaluates basis functions; the element only carries the
 * information that shape inference and signatures need.
 */
public class FiniteElement {
  /** Family name of the "Real" element, whose functions are global
   * constants. */
  public static final String REAL = "Real";

  public final String family;
  public final Cell cell;
  public final int degree;
  public final Shape valueShape;

  /** Creates a FiniteElement. */
  public FiniteElement(String family, Cell cell, int degree, Shape valueShape) {
    this.family = requireNonNull(family, "family");
    this.cell = requireNonNull(cell, "cell");
    this.degree = degree;
    this.valueShape = requireNonNull(valueShape, "valueShape");
    checkArgument(!family.isEmpty(), "empty family");
    checkArgument(degree >= 0, "negative degree %s", degree);
  }

  /** Creates a scalar Lagrange element. */
  public static FiniteElement lagrange(Cell cell, int degree) {
    return new FiniteElement("Lagrange", cell, degree, Shape.SCALAR);
  }

  /** Creates a vector-valued Lagrange element. */
  public static FiniteElement vectorLagrange(Cell cell, int degree, int dim) {
    return new FiniteElement("Lagrange", cell, degree, Shape.of(dim));
  }

  /** Creates an element of global constants of a given shape. */
  public static FiniteElement real(Cell cell, Shape valueShape) {
    return new FiniteElement(REAL, cell, 0, valueShape);
  }

  /** Whether functions in this element are constant over the whole domain. */
  public boolean isGlobalConstant() {
    return family.equals(REAL);
  }

  /** Whether functions in this element are constant within each cell. */
  public boolean isCellwiseConstant() {
    return degree == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(family, cell, degree, valueShape);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FiniteElement
            && family.equals(((FiniteElement) o).family)
            && cell == ((FiniteElement) o).cell
            && degree == ((FiniteElement) o).degree
            && valueShape.equals(((FiniteElement) o).valueShape);
  }

  @Override
  public String toString() {
    return "FiniteElement(\"" + family + "\", " + cell + ", " + degree + ", "
        + valueShape + ")";
  }
}

// End FiniteElement.java
