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
 * Moves negation inward until every negation is applied to a symbol.
 *
 * <ul>
 *   <li>{@code ~~a} &rarr; {@code a}
 *   <li>{@code ~(a & b)} &rarr; {@code ~a | ~b}
 *   <li>{@code ~(a | b)} &rarr; {@code ~a & ~b}
 *   <li>{@code ~True} &rarr; {@code False}
 *   <li>{@code ~False} &rarr; {@code True}
 * </ul>
 *
 * <p>Each rewrite may create a new negation (or a double negation) one level
 * down, so the result of each rewrite is normalized again.
 *
 * <p>The formula must not contain {@code =>} or {@code <=>}; if it does, the
 * elimination passes were skipped, and this is an internal error.
 */
class NegationNormalizer {
  private NegationNormalizer() {}

  static Prop normalize(Prop p) {
    switch (p.op) {
      case TRUE:
      case FALSE:
      case SYMBOL:
        return p;
      case AND:
      case OR:
        final Prop.Binary binary = (Prop.Binary) p;
        return binary.copy(normalize(binary.lhs), normalize(binary.rhs));
      case NOT:
        return normalizeNot((Prop.Not) p);
      default:
        throw new AssertionError(
            "Must eliminate implic and iff before moving not inward");
    }
  }

  private static Prop normalizeNot(Prop.Not not) {
    switch (not.arg.op) {
      case NOT:
        // There may be another double negative inside
        return normalize(((Prop.Not) not.arg).arg);
      case AND:
        final Prop.Binary and = (Prop.Binary) not.arg;
        return prop.or(normalize(prop.not(and.lhs)),
            normalize(prop.not(and.rhs)));
      case OR:
        final Prop.Binary or = (Prop.Binary) not.arg;
        return prop.and(normalize(prop.not(or.lhs)),
            normalize(prop.not(or.rhs)));
      case TRUE:
        return prop.falseLiteral();
      case FALSE:
        return prop.trueLiteral();
      case SYMBOL:
        return not;
      default:
        throw new AssertionError(
            "Must eliminate implic and iff before moving not inward");
    }
  }
}

// End NegationNormalizer.java
