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
 * Function that transforms an expression tree, reusing every node whose
 * operands are unchanged.
 *
 * <p>By default, terminals map to themselves and operators are reconstructed
 * with their transformed operands. Sub-classes override the handlers of the
 * kinds they rewrite.
 */
public class ReuseTransformer extends DefaultExprFunction<Core.Exp> {
  @Override
  protected Core.Exp terminal(Core.Terminal e) {
    return e;
  }

  @Override
  protected Core.Exp operator(Core.Exp e, List<Core.Exp> operands) {
    return e.copy(operands);
  }
}

// End ReuseTransformer.java
