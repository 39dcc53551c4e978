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

import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.form.Integral;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events while a {@link Pipeline} processes a form. */
public interface Tracer {
  /** Called when the derivatives in an integrand have been resolved. */
  void onDerivative(Integral integral, Core.Exp e);

  /** Called when an integrand has been simplified. */
  void onSimplified(Integral integral, Core.Exp e);

  /** Called when the signature of a processed integral has been
   * computed. */
  void onSignature(Integral integral, String signature);

  /** Called with each processed integral, or with null in place of an
   * integral whose integrand is zero and is therefore dropped. */
  void onIntegral(Integral original, @Nullable Integral processed);

  /**
   * Called with the exception thrown while processing an integral. Returns
   * whether a handler was found. If no handler was found, the pipeline
   * rethrows the exception.
   */
  boolean handleException(FormException e);
}

// End Tracer.java
