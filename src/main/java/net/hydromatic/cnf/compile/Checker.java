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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Predicate;
import net.hydromatic.cnf.ast.Op;
import net.hydromatic.cnf.ast.Prop;

/** Predicates that check the shape of a formula at each stage of conversion
 * to conjunctive normal form. */
public abstract class Checker {
  private Checker() {}

  /** Returns whether a formula contains no {@code <=>}. This holds after
   * {@link Cnf.Pass#BICONDITIONAL_ELIMINATION}. */
  public static boolean hasNoIff(Prop p) {
    return noneMatch(p, e -> e.op == Op.IFF);
  }

  /** Returns whether a formula contains no {@code =>} and no {@code <=>}.
   * This holds after {@link Cnf.Pass#IMPLICATION_ELIMINATION}. */
  public static boolean hasNoImplication(Prop p) {
    return noneMatch(p, e -> e.op == Op.IMPLIC || e.op == Op.IFF);
  }

  /** Returns whether a formula is in negation normal form: every negation
   * is applied to a symbol, and there is no {@code =>} or {@code <=>}. This
   * holds after {@link Cnf.Pass#NEGATION_NORMAL_FORM}. */
  public static boolean isNegationNormal(Prop p) {
    return noneMatch(p,
        e -> e.op == Op.IMPLIC
            || e.op == Op.IFF
            || e.op == Op.NOT && !e.isLiteral());
  }

  /** Returns whether a formula is in conjunctive normal form: it is in
   * negation normal form, and no disjunction has a conjunction as an
   * operand. This holds after {@link Cnf.Pass#DISTRIBUTION}. */
  public static boolean isCnf(Prop p) {
    return isNegationNormal(p)
        && noneMatch(p,
            e -> e.op == Op.OR
                && (e.args().get(0).isConjunction()
                    || e.args().get(1).isConjunction()));
  }

  /** Returns whether a formula is a single clause: a constant, a literal,
   * or a disjunction of constants and literals. */
  public static boolean isClause(Prop p) {
    return isNegationNormal(p) && noneMatch(p, Prop::isConjunction);
  }

  /** Returns whether no node of a formula matches a predicate. Walks the
   * tree with an explicit stack. */
  static boolean noneMatch(Prop p, Predicate<Prop> predicate) {
    final Deque<Prop> stack = new ArrayDeque<>();
    stack.push(p);
    while (!stack.isEmpty()) {
      final Prop e = stack.pop();
      if (predicate.test(e)) {
        return false;
      }
      e.args().forEach(stack::push);
    }
    return true;
  }
}

// End Checker.java
