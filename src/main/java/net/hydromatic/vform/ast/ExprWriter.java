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

import java.util.List;

/**
 * Writes an expression as a string, for debugging and error messages.
 *
 * <p>Infix operators are written with the minimum of parentheses, using the
 * precedences in {@link Op}; everything else is written as a function
 * call. The output is not parsed by anything.
 */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();

  private ExprWriter() {}

  /** Returns the string form of an expression. */
  public static String write(Core.Exp e) {
    return new ExprWriter().append(e, 0, 0).b.toString();
  }

  private ExprWriter append(Core.Exp e, int left, int right) {
    switch (e.op) {
    case ARGUMENT:
      b.append(e.op.opName).append('_').append(((Core.Argument) e).number);
      return this;
    case COEFFICIENT:
      b.append(e.op.opName).append('_').append(((Core.Coefficient) e).count);
      return this;
    case LABEL:
      b.append(e.op.opName).append('_').append(((Core.Label) e).count);
      return this;
    case CONSTANT:
      b.append(((Core.Constant) e).value.toPlainString());
      return this;
    case IDENTITY:
    case ZERO:
    case SPATIAL_COORDINATE:
    case FACET_NORMAL:
    case CELL_VOLUME:
    case CIRCUMRADIUS:
    case FACET_AREA:
      b.append(e.op.opName);
      return this;
    case INDEXED:
      appendPostfix(e.operand(0));
      b.append('[');
      appendList(((Core.Indexed) e).indices);
      b.append(']');
      return this;
    case COMPONENT_TENSOR:
      b.append("as_tensor(");
      append(e.operand(0), 0, 0);
      b.append(", (");
      appendList(((Core.ComponentTensor) e).indices);
      b.append("))");
      return this;
    case INDEX_SUM:
      b.append("sum_{").append(((Core.IndexSum) e).index).append("}(");
      append(e.operand(0), 0, 0);
      b.append(')');
      return this;
    case LIST_TENSOR:
      b.append('[');
      appendOperands(e);
      b.append(']');
      return this;
    case POSITIVE_RESTRICTED:
    case NEGATIVE_RESTRICTED:
      appendPostfix(e.operand(0));
      b.append(e.op == Op.POSITIVE_RESTRICTED ? "('+')" : "('-')");
      return this;
    default:
      if (e.op.padded != null) {
        return appendInfix(e, left, right);
      }
      b.append(e.op.opName).append('(');
      appendOperands(e);
      b.append(')');
      return this;
    }
  }

  private ExprWriter appendInfix(Core.Exp e, int left, int right) {
    final Op op = e.op;
    if (left > op.left || op.right < right) {
      b.append('(');
      appendInfix(e, 0, 0);
      b.append(')');
      return this;
    }
    final int n = e.operands.size();
    for (int i = 0; i < n; i++) {
      if (i > 0) {
        b.append(op.padded);
      }
      append(e.operand(i),
          i == 0 ? left : op.right,
          i == n - 1 ? right : op.left);
    }
    return this;
  }

  private void appendPostfix(Core.Exp e) {
    if (e.op.padded != null) {
      b.append('(');
      append(e, 0, 0);
      b.append(')');
    } else {
      append(e, 0, 0);
    }
  }

  private void appendOperands(Core.Exp e) {
    for (int i = 0; i < e.operands.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      append(e.operand(i), 0, 0);
    }
  }

  private void appendList(List<? extends IndexBase> indices) {
    for (int i = 0; i < indices.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(indices.get(i));
    }
  }
}

// End ExprWriter.java
