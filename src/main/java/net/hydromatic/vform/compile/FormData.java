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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.form.Form;
import net.hydromatic.vform.form.FormSignature;

/** Result of processing a form with a {@link Pipeline}. */
public class FormData {
  /** The form before processing. */
  public final Form original;
  /** The processed form: derivatives resolved, integrands simplified, zero
   * integrals dropped. */
  public final Form form;
  /** The arguments of the processed form, sorted by number. */
  public final ImmutableList<Core.Argument> arguments;
  /** The coefficients of the processed form, sorted by count. */
  public final ImmutableList<Core.Coefficient> coefficients;
  public final FormSignature signature;

  FormData(Form original, Form form, List<Core.Argument> arguments,
      FormSignature signature) {
    this.original = original;
    this.form = form;
    this.arguments = ImmutableList.copyOf(arguments);
    this.coefficients = ImmutableList.copyOf(form.coefficients());
    this.signature = signature;
  }

  /** Returns the number of arguments: 0 for a functional, 1 for a linear
   * form, 2 for a bilinear form. */
  public int rank() {
    return arguments.size();
  }

  @Override
  public String toString() {
    return "FormData(rank " + rank() + ", " + form.integrals.size()
        + " integrals, " + signature + ")";
  }
}

// End FormData.java
