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
package net.hydromatic.cnf.compile;

import static net.hydromatic.cnf.ast.PropBuilder.prop;

import net.hydromatic.cnf.ast.Prop;

/**
 * Distributes disjunction over conjunction.
 *
 * <ul>
 *   <li>{@code (a & b) | c} &rarr; {@code (a | c) & (b | c')}
 *   <li>{@code a | (b & c)} &rarr; {@code (a | b) & (a' | c)}
 * </ul>
 *
 * <p>where {@code a'} and {@code c'} are deep copies. If both operands of a
 * disjunction are conjunctions, the first rule applies. The new disjunctions
 * are distributed again, because an operand may itself be a conjunction.
 *
 * <p>The formula must be in negation normal form.
 */
class Distributor {
  private Distributor() {}

  static Prop distribute(Prop p) {
    switch (p.op) {
      case TRUE:
      case FALSE:
      case SYMBOL:
        return p;
      case NOT:
        final Prop.Not not = (Prop.Not) p;
        return not.copy(distribute(not.arg));
      case AND:
        final Prop.Binary and = (Prop.Binary) p;
        return and.copy(distribute(and.lhs), distribute(and.rhs));
      case OR:
        final Prop.Binary or = (Prop.Binary) p;
        final Prop lhs = distribute(or.lhs);
        final Prop rhs = distribute(or.rhs);
        if (lhs.isConjunction()) {
          final Prop.Binary inner = (Prop.Binary) lhs;
          return prop.and(distribute(prop.or(inner.lhs, rhs)),
              distribute(prop.or(inner.rhs, rhs.deepCopy())));
        }
        if (rhs.isConjunction()) {
          final Prop.Binary inner = (Prop.Binary) rhs;
          return prop.and(distribute(prop.or(lhs, inner.lhs)),
              distribute(prop.or(lhs.deepCopy(), inner.rhs)));
        }
        return or.copy(lhs, rhs);
      default:
        throw new AssertionError(
            "Must eliminate implic and iff before distributing");
    }
  }
}

// End Distributor.java
