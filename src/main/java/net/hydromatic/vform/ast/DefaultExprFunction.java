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

import java.util.Arrays;
import java.util.List;

/**
 * Implementation of {@link ExprFunction} in which every terminal handler calls
 * {@link #terminal} and every operator handler calls {@link #operator}.
 *
 * @param <R> Result type
 */
public abstract class DefaultExprFunction<R> implements ExprFunction<R> {
  /** Handles a terminal whose kind is not otherwise handled. */
  protected abstract R terminal(Core.Terminal e);

  /** Handles an operator whose kind is not otherwise handled. */
  protected abstract R operator(Core.Exp e, List<R> operands);

  @SafeVarargs
  private R operator(Core.Exp e, R... operands) {
    return operator(e, Arrays.asList(operands));
  }

  @Override
  public R argument(Core.Argument e) {
    return terminal(e);
  }

  @Override
  public R coefficient(Core.Coefficient e) {
    return terminal(e);
  }

  @Override
  public R constant(Core.Constant e) {
    return terminal(e);
  }

  @Override
  public R identity(Core.Identity e) {
    return terminal(e);
  }

  @Override
  public R zero(Core.Zero e) {
    return terminal(e);
  }

  @Override
  public R geometric(Core.Geometric e) {
    return terminal(e);
  }

  @Override
  public R label(Core.Label e) {
    return terminal(e);
  }

  @Override
  public R sum(Core.Exp e, List<R> operands) {
    return operator(e, operands);
  }

  @Override
  public R product(Core.Exp e, List<R> operands) {
    return operator(e, operands);
  }

  @Override
  public R division(Core.Exp e, R numerator, R denominator) {
    return operator(e, numerator, denominator);
  }

  @Override
  public R power(Core.Exp e, R base, R exponent) {
    return operator(e, base, exponent);
  }

  @Override
  public R abs(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R sign(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R mathFunction(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R indexed(Core.Indexed e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R componentTensor(Core.ComponentTensor e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R indexSum(Core.IndexSum e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R listTensor(Core.Exp e, List<R> operands) {
    return operator(e, operands);
  }

  @Override
  public R inner(Core.Exp e, R a, R b) {
    return operator(e, a, b);
  }

  @Override
  public R outer(Core.Exp e, R a, R b) {
    return operator(e, a, b);
  }

  @Override
  public R dot(Core.Exp e, R a, R b) {
    return operator(e, a, b);
  }

  @Override
  public R cross(Core.Exp e, R a, R b) {
    return operator(e, a, b);
  }

  @Override
  public R transposed(Core.Exp e, R a) {
    return operator(e, a);
  }

  @Override
  public R trace(Core.Exp e, R a) {
    return operator(e, a);
  }

  @Override
  public R determinant(Core.Exp e, R a) {
    return operator(e, a);
  }

  @Override
  public R inverse(Core.Exp e, R a) {
    return operator(e, a);
  }

  @Override
  public R deviatoric(Core.Exp e, R a) {
    return operator(e, a);
  }

  @Override
  public R grad(Core.Grad e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R div(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R curl(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R timeDerivative(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R coefficientDerivative(Core.Exp e, R integrand, R coefficient,
      R direction) {
    return operator(e, integrand, coefficient, direction);
  }

  @Override
  public R variable(Core.Exp e, R expression, R label) {
    return operator(e, expression, label);
  }

  @Override
  public R variableDerivative(Core.Exp e, R f, R variable) {
    return operator(e, f, variable);
  }

  @Override
  public R condition(Core.Exp e, R left, R right) {
    return operator(e, left, right);
  }

  @Override
  public R not(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R conditional(Core.Exp e, R condition, R ifTrue, R ifFalse) {
    return operator(e, condition, ifTrue, ifFalse);
  }

  @Override
  public R restricted(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R avg(Core.Exp e, R operand) {
    return operator(e, operand);
  }

  @Override
  public R jump(Core.Exp e, List<R> operands) {
    return operator(e, operands);
  }
}

// End DefaultExprFunction.java
