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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;

/** Reference cell of a mesh. */
public enum Cell {
  INTERVAL(1, true),
  TRIANGLE(2, true),
  TETRAHEDRON(3, true),
  QUADRILATERAL(2, false),
  HEXAHEDRON(3, false);

  /** Topological dimension, e.g. 2 for a triangle. */
  public final int topologicalDimension;

  /** Whether the cell is a simplex. */
  public final boolean simplex;

  /** Lower-case name, e.g. "triangle". */
  public final String cellName;

  private static final ImmutableMap<String, Cell> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Cell> b = ImmutableMap.builder();
    for (Cell cell : values()) {
      b.put(cell.cellName, cell);
    }
    BY_NAME = b.build();
  }

  Cell(int topologicalDimension, boolean simplex) {
    this.topologicalDimension = topologicalDimension;
    this.simplex = simplex;
    this.cellName = name().toLowerCase(Locale.ROOT);
  }

  /** Looks up a cell by name. Throws if not found; never returns null. */
  public static Cell lookup(String name) {
    final Cell cell = BY_NAME.get(name);
    if (cell == null) {
      throw new IllegalArgumentException("unknown cell: " + name);
    }
    return cell;
  }

  /** Number of facets, e.g. 3 for a triangle. */
  public int facetCount() {
    switch (this) {
    case INTERVAL:
      return 2;
    case TRIANGLE:
      return 3;
    case TETRAHEDRON:
    case QUADRILATERAL:
      return 4;
    case HEXAHEDRON:
      return 6;
    default:
      throw new AssertionError(this);
    }
  }

  @Override
  public String toString() {
    return cellName;
  }
}

// End Cell.java
