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
package net.hydromatic.vform.util;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Returns the last element of a list.
   *
   * @throws java.lang.IndexOutOfBoundsException if the list is empty
   */
  public static <E> E last(List<E> list) {
    return list.get(list.size() - 1);
  }

  /** Returns all but the first {@code count} elements of a list. */
  public static <E> List<E> skip(List<E> list, int count) {
    return list.subList(count, list.size());
  }

  /** Returns a list with one element appended. */
  public static <E> List<E> append(List<? extends E> list, E e) {
    return ImmutableList.<E>builder().addAll(list).add(e).build();
  }

  /** Returns the concatenation of two lists. */
  public static <E> List<E> concat(List<? extends E> list0,
      List<? extends E> list1) {
    return ImmutableList.<E>builder().addAll(list0).addAll(list1).build();
  }

  /** Returns a list with the element at position {@code i} replaced. */
  public static <E> List<E> replace(List<? extends E> list, int i, E e) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    for (int j = 0; j < list.size(); j++) {
      b.add(j == i ? e : list.get(j));
    }
    return b.build();
  }

  /** Returns a list without the element at position {@code i}. */
  public static <E> List<E> remove(List<? extends E> list, int i) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    for (int j = 0; j < list.size(); j++) {
      if (j != i) {
        b.add(list.get(j));
      }
    }
    return b.build();
  }
}

// End Static.java
