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
package net.hydromatic.vform.compile;

import net.hydromatic.vform.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error occurred while building or transforming an expression or form.
 *
 * <p>Sub-classes distinguish the kinds of error. None of them is retried;
 * each aborts the processing of the expression in which it occurred.
 */
public class FormException extends RuntimeException {
  private final @Nullable Op op;

  public FormException(String message, @Nullable Op op) {
    super(message);
    this.op = op;
  }

  /** Returns the kind of the node at which the error was detected, or null if
   * the error is not specific to one node. */
  public @Nullable Op op() {
    return op;
  }

  @Override
  public String toString() {
    return op == null ? super.toString() : super.toString() + " in " + op;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error");
    if (op != null) {
      buf.append(" in ").append(op.opName);
    }
    return buf.append(": ").append(getMessage());
  }
}

// End FormException.java
