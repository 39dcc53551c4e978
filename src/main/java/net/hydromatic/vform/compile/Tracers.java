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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.form.Integral;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that calls a consumer when the derivatives of an
   * integrand have been resolved. */
  public static Tracer withOnDerivative(Tracer tracer,
      BiConsumer<Integral, Core.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDerivative(Integral integral, Core.Exp e) {
        consumer.accept(integral, e);
        super.onDerivative(integral, e);
      }
    };
  }

  /** Returns a tracer that calls a consumer when an integrand has been
   * simplified. */
  public static Tracer withOnSimplified(Tracer tracer,
      BiConsumer<Integral, Core.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSimplified(Integral integral, Core.Exp e) {
        consumer.accept(integral, e);
        super.onSimplified(integral, e);
      }
    };
  }

  /** Returns a tracer that calls a consumer with each signature. */
  public static Tracer withOnSignature(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSignature(Integral integral, String signature) {
        consumer.accept(signature);
        super.onSignature(integral, signature);
      }
    };
  }

  /** Returns a tracer that calls a consumer with each processed integral.
   * The consumer is not called for integrals that were dropped. */
  public static Tracer withOnIntegral(Tracer tracer,
      Consumer<Integral> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onIntegral(Integral original,
          @Nullable Integral processed) {
        if (processed != null) {
          consumer.accept(processed);
        }
        super.onIntegral(original, processed);
      }
    };
  }

  /** Returns a tracer that handles exceptions by calling a predicate. If the
   * predicate returns false, the tracer's delegate may handle the
   * exception. */
  public static Tracer withOnException(Tracer tracer,
      Predicate<FormException> handler) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleException(FormException e) {
        return handler.test(e) || super.handleException(e);
      }
    };
  }

  /** Tracer that ignores all events. */
  private static class EmptyTracer implements Tracer {
    private static final EmptyTracer INSTANCE = new EmptyTracer();

    @Override
    public void onDerivative(Integral integral, Core.Exp e) {}

    @Override
    public void onSimplified(Integral integral, Core.Exp e) {}

    @Override
    public void onSignature(Integral integral, String signature) {}

    @Override
    public void onIntegral(Integral original, @Nullable Integral processed) {}

    @Override
    public boolean handleException(FormException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  public static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    protected DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onDerivative(Integral integral, Core.Exp e) {
      tracer.onDerivative(integral, e);
    }

    @Override
    public void onSimplified(Integral integral, Core.Exp e) {
      tracer.onSimplified(integral, e);
    }

    @Override
    public void onSignature(Integral integral, String signature) {
      tracer.onSignature(integral, signature);
    }

    @Override
    public void onIntegral(Integral original, @Nullable Integral processed) {
      tracer.onIntegral(original, processed);
    }

    @Override
    public boolean handleException(FormException e) {
      return tracer.handleException(e);
    }
  }
}

// End Tracers.java
