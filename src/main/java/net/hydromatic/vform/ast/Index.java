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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Index label.
 *
 * <p>Labels are compared by their count. {@link #create()} allocates a new
 * label; {@link #of(int)} refers to a label by count, for example when a test
 * needs to build the same expression twice.
 *
 * <p>The range of an index is not stored in the label; it is inferred from
 * the expression in which the label is used.
 */
public final class Index extends IndexBase implements Comparable<Index> {
  private static final AtomicInteger NEXT_COUNT = new AtomicInteger(100);

  public final int count;

  private Index(int count) {
    this.count = count;
  }

  /** Creates a new, unique, index label. */
  public static Index create() {
    return new Index(NEXT_COUNT.getAndIncrement());
  }

  /** Returns a list of {@code n} new index labels. */
  public static List<Index> create(int n) {
    final ImmutableList.Builder<Index> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(create());
    }
    return b.build();
  }

  /** Returns the index label with a given count. */
  public static Index of(int count) {
    checkArgument(count >= 0, "negative index count %s", count);
    return new Index(count);
  }

  @Override
  public boolean isFixed() {
    return false;
  }

  @Override
  public int compareTo(Index o) {
    return Integer.compare(count, o.count);
  }

  @Override
  public int hashCode() {
    return count;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Index && count == ((Index) o).count;
  }

  @Override
  public String toString() {
    return "i_" + count;
  }
}

// End Index.java
