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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Identifies the part of a domain over which an integral is computed.
 *
 * <p>Either a non-negative integer or {@link #EVERYWHERE}. {@code EVERYWHERE}
 * sorts before every numbered subdomain.
 */
public final class SubdomainId implements Comparable<SubdomainId> {
  /** The whole domain. */
  public static final SubdomainId EVERYWHERE = new SubdomainId(-1);

  private final int id;

  private SubdomainId(int id) {
    this.id = id;
  }

  /** Returns a numbered subdomain. */
  public static SubdomainId of(int id) {
    checkArgument(id >= 0, "negative subdomain id %s", id);
    return new SubdomainId(id);
  }

  public boolean isEverywhere() {
    return id < 0;
  }

  /** Returns the number of this subdomain. Throws if it is
   * {@link #EVERYWHERE}. */
  public int id() {
    if (isEverywhere()) {
      throw new IllegalStateException("subdomain 'everywhere' has no id");
    }
    return id;
  }

  @Override
  public int compareTo(SubdomainId o) {
    return Integer.compare(id, o.id);
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SubdomainId
            && id == ((SubdomainId) o).id;
  }

  @Override
  public String toString() {
    return isEverywhere() ? "everywhere" : Integer.toString(id);
  }
}

// End SubdomainId.java
