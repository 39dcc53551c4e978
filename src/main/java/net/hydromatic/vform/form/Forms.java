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
import static net.hydromatic.vform.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.ast.ReuseTransformer;
import net.hydromatic.vform.ast.Traversals;
import net.hydromatic.vform.compile.FormException;
import net.hydromatic.vform.compile.ShapeMismatchException;
import net.hydromatic.vform.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Operations that create a form from another form. */
public final class Forms {
  private Forms() {}

  /** Returns the Gateaux derivative of a form with respect to a coefficient,
   * in a given direction.
   *
   * <p>If {@code direction} is null, it is a new argument in the
   * coefficient's space whose number is one more than the highest argument
   * number of the form. The derivative of a form of arity n is then a form
   * of arity n + 1.
   *
   * <p>The integrands of the result contain derivative markers; a
   * {@link net.hydromatic.vform.compile.Pipeline} resolves them. */
  public static Form derivative(Form form, Core.Coefficient coefficient,
      Core.@Nullable Exp direction) {
    final Core.Exp v = direction != null ? direction
        : core.argument(coefficient.space, form.arguments().size());
    if (!v.shape.equals(coefficient.shape)) {
      throw new ShapeMismatchException("direction has shape " + v.shape
          + " but coefficient has shape " + coefficient.shape,
          v.op);
    }
    final List<Integral> list = new ArrayList<>();
    for (Integral integral : form.integrals) {
      list.add(
          integral.withIntegrand(
              core.coefficientDerivative(integral.integrand, coefficient,
                  v)));
    }
    return Form.of(list);
  }

  /** Returns the action of a form on a coefficient: the form with its
   * highest-numbered argument replaced by the coefficient. The action of a
   * bilinear form is a linear form.
   *
   * @throws FormException if the form has no arguments */
  public static Form action(Form form, Core.Coefficient coefficient) {
    final List<Core.Argument> arguments = form.arguments();
    if (arguments.isEmpty()) {
      throw new FormException("cannot compute the action of a form with "
          + "no arguments", null);
    }
    final Core.Argument last = Static.last(arguments);
    checkArgument(last.space.equals(coefficient.space),
        "coefficient space %s does not match argument space %s",
        coefficient.space, last.space);
    return replace(form, ImmutableMap.of(last, coefficient));
  }

  /** Returns a form with each occurrence of some terminals replaced by
   * expressions.
   *
   * @throws ShapeMismatchException if an expression does not have the same
   * shape as the terminal it replaces */
  public static Form replace(Form form,
      Map<? extends Core.Terminal, ? extends Core.Exp> replacements) {
    replacements.forEach((terminal, e) -> {
      if (!terminal.shape.equals(e.shape)) {
        throw new ShapeMismatchException("cannot replace " + terminal
            + " of shape " + terminal.shape + " with expression of shape "
            + e.shape, e.op);
      }
    });
    final List<Integral> list = new ArrayList<>();
    for (Integral integral : form.integrals) {
      list.add(
          integral.withIntegrand(
              replace(integral.integrand, replacements)));
    }
    return Form.of(list);
  }

  /** Returns an expression with each occurrence of some terminals replaced
   * by expressions. */
  public static Core.Exp replace(Core.Exp e,
      Map<? extends Core.Terminal, ? extends Core.Exp> replacements) {
    return Traversals.map(e, new ReuseTransformer() {
      @Override
      protected Core.Exp terminal(Core.Terminal t) {
        final Core.Exp r = replacements.get(t);
        return r != null ? r : t;
      }
    });
  }
}

// End Forms.java
