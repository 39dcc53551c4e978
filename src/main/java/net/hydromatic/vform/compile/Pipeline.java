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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import net.hydromatic.vform.ast.Core;
import net.hydromatic.vform.form.Form;
import net.hydromatic.vform.form.FormSignature;
import net.hydromatic.vform.form.Integral;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Processes a form so that it is ready for a code generator.
 *
 * <p>For each integral, the pipeline resolves derivatives, simplifies,
 * optionally lowers compound operators and expands indices, checks that no
 * index is unresolved and that the integrand is multilinear, interns the
 * integrand in an arena, and computes its signature. Integrals whose
 * integrand simplifies to zero are dropped.
 *
 * <p>Integrals are processed independently, and in parallel if property
 * {@link Prop#PARALLELISM} is greater than 1. The result is built only if
 * every integral succeeds.
 */
public class Pipeline {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  private final ExprArena arena;

  /** Creates a Pipeline. */
  public Pipeline(Map<Prop, Object> props, Tracer tracer, ExprArena arena) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer, "tracer");
    this.arena = requireNonNull(arena, "arena");
  }

  /** Creates a Pipeline with default properties, an empty tracer, and a new
   * arena. */
  public static Pipeline create() {
    return new Pipeline(ImmutableMap.of(), Tracers.empty(), new ExprArena());
  }

  /** Returns the arena in which integrands are interned. */
  public ExprArena arena() {
    return arena;
  }

  /** Processes a form.
   *
   * <p>Returns null if processing failed and the tracer handled the
   * exception.
   *
   * @throws FormException if processing failed and the tracer did not handle
   * the exception */
  public @Nullable FormData process(Form form) {
    try {
      return processForm(form);
    } catch (FormException e) {
      if (tracer.handleException(e)) {
        return null;
      }
      throw e;
    }
  }

  private FormData processForm(Form form) {
    final List<Result> results = processAll(form.integrals);
    final List<Integral> integrals = new ArrayList<>();
    List<Core.Argument> arguments = null;
    for (Result result : results) {
      if (result.integral == null) {
        continue;
      }
      integrals.add(result.integral);
      if (result.arguments == null) {
        continue;
      }
      if (arguments == null) {
        arguments = result.arguments;
      } else if (!arguments.equals(result.arguments)) {
        throw new MultilinearityException("integrals have different "
            + "arguments: " + arguments + " and " + result.arguments,
            result.integral.integrand.op);
      }
    }
    final Form processed = Form.of(integrals);
    if (arguments == null) {
      arguments = processed.arguments();
    }
    final FormSignature signature =
        FormSignature.of(processed,
            Prop.SIGNATURE_RENUMBERING.booleanValue(props));
    return new FormData(form, processed, arguments, signature);
  }

  private List<Result> processAll(List<Integral> integrals) {
    final int parallelism = Prop.PARALLELISM.intValue(props);
    if (parallelism <= 1 || integrals.size() <= 1) {
      final List<Result> results = new ArrayList<>();
      for (Integral integral : integrals) {
        results.add(processIntegral(integral));
      }
      return results;
    }
    final ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(parallelism, integrals.size()));
    try {
      final List<Future<Result>> futures = new ArrayList<>();
      for (Integral integral : integrals) {
        futures.add(executor.submit(() -> processIntegral(integral)));
      }
      final ImmutableList.Builder<Result> results = ImmutableList.builder();
      for (Future<Result> future : futures) {
        results.add(get(future));
      }
      return results.build();
    } finally {
      executor.shutdownNow();
    }
  }

  /** Returns the result of a future, rethrowing the exception with which
   * the task failed. */
  private static <T> T get(Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while processing form",
          e);
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException(cause);
    }
  }

  /** Processes one integral. */
  Result processIntegral(Integral integral) {
    Core.Exp e = Derivatives.resolve(integral.integrand);
    tracer.onDerivative(integral, e);

    final boolean simplify = Prop.SIMPLIFY.booleanValue(props);
    final boolean expand = Prop.EXPAND_INDICES.booleanValue(props);
    if (simplify) {
      e = Simplifier.simplify(e, !expand
          && !Prop.LOWER_COMPOUNDS.booleanValue(props));
    }
    if (expand || Prop.LOWER_COMPOUNDS.booleanValue(props)) {
      e = CompoundLowering.lower(e);
      if (simplify) {
        e = Simplifier.simplify(e, false);
      }
    }
    if (expand) {
      e = IndexExpander.expand(e);
      if (simplify) {
        e = Simplifier.simplify(e, false);
      }
    }
    switch (Prop.DUPLICATES.enumValue(props, Prop.DuplicateMode.class)) {
    case MARK:
      e = Duplicates.markDuplications(e);
      break;
    case STRIP:
      e = Duplicates.stripVariables(e);
      break;
    default:
      break;
    }
    tracer.onSimplified(integral, e);

    if (Simplifier.isZero(e)) {
      tracer.onIntegral(integral, null);
      return new Result(null, null);
    }
    Resolver.validate(e);
    e = arena.intern(e);
    final List<Core.Argument> arguments =
        Prop.CHECK_ARITY.booleanValue(props) ? Analysis.arity(e) : null;

    final Integral processed = integral.withIntegrand(e);
    tracer.onSignature(processed, processed.signature());
    tracer.onIntegral(integral, processed);
    return new Result(processed, arguments);
  }

  /** Result of processing an integral. */
  static class Result {
    /** The processed integral, or null if it was dropped. */
    final @Nullable Integral integral;
    /** The arguments of the integral, or null if arity was not checked. */
    final @Nullable List<Core.Argument> arguments;

    Result(@Nullable Integral integral,
        @Nullable List<Core.Argument> arguments) {
      this.integral = integral;
      this.arguments = arguments;
    }
  }
}

// End Pipeline.java
