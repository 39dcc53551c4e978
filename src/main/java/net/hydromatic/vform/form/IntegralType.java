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

/** Type of an integral: over cells, over facets, or custom. */
public enum IntegralType {
  CELL("dx"),
  EXTERIOR_FACET("ds"),
  INTERIOR_FACET("dS"),
  CUSTOM("dc");

  /** Name of the measure, e.g. "dx". */
  public final String measureName;

  IntegralType(String measureName) {
    this.measureName = measureName;
  }

  /** Whether integrals of this type are over facets shared by two cells,
   * where restrictions are meaningful. */
  public boolean isInteriorFacet() {
    return this == INTERIOR_FACET;
  }
}

// End IntegralType.java
