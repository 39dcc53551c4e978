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
package net.hydromatic.vform.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** Index that selects a single component along one axis. */
public final class FixedIndex extends IndexBase {
  private static final FixedIndex[] CACHE = new FixedIndex[16];

  static {
    for (int i = 0; i < CACHE.length; i++) {
      CACHE[i] = new FixedIndex(i);
    }
  }

  public final int value;

  private FixedIndex(int value) {
    this.value = value;
  }

  /** Returns a fixed index. */
  public static FixedIndex of(int value) {
    checkArgument(value >= 0, "negative fixed index %s", value);
    return value < CACHE.length ? CACHE[value] : new FixedIndex(value);
  }

  @Override
  public boolean isFixed() {
    return true;
  }

  @Override
  public int hashCode() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FixedIndex && value == ((FixedIndex) o).value;
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}

// End FixedIndex.java
