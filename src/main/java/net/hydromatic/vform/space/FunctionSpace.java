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

/** Function space: a finite element on a mesh. */
public class FunctionSpace {
  public final Mesh mesh;
  public final FiniteElement element;

  /** Creates a FunctionSpace. */
  public FunctionSpace(Mesh mesh, FiniteElement element) {
    this.mesh = requireNonNull(mesh, "mesh");
    this.element = requireNonNull(element, "element");
    checkArgument(mesh.cell() == element.cell,
        "element cell %s does not match mesh cell %s", element.cell,
        mesh.cell());
  }

  /** Shape of the values of functions in this space. */
  public Shape valueShape() {
    return element.valueShape;
  }

  @Override
  public int hashCode() {
    return Objects.hash(mesh, element);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FunctionSpace
            && mesh.equals(((FunctionSpace) o).mesh)
            && element.equals(((FunctionSpace) o).element);
  }

  @Override
  public String toString() {
    return "FunctionSpace(" + mesh + ", " + element + ")";
  }
}

// End FunctionSpace.java
