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
package net.hydromatic.cnf.ast;

/**
 * Visits and transforms formulas.
 *
 * <p>The default implementation rewrites children before their parent
 * (post-order), and returns the original node if none of its children
 * changed.
 */
public class Shuttle {
  protected Prop visit(Prop.Literal literal) {
    return literal; // leaf
  }

  protected Prop visit(Prop.Symbol symbol) {
    return symbol; // leaf
  }

  protected Prop visit(Prop.Not not) {
    return not.copy(not.arg.accept(this));
  }

  protected Prop visit(Prop.Binary binary) {
    return binary.copy(binary.lhs.accept(this), binary.rhs.accept(this));
  }
}

// End Shuttle.java
