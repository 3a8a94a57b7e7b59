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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import net.hydromatic.cnf.ast.Prop;

/**
 * Splits conjunctions into their conjuncts.
 *
 * <p>Uses an explicit stack, not recursion, because a long chain of
 * conjunctions may be nested deeply on either side. A node popped from the
 * stack is either collected, or (if it is a conjunction) replaced by its
 * operands; an operand that is a conjunction goes back on the stack, and any
 * other operand is collected. The result is deterministic.
 */
public abstract class ClauseSplitter {
  private ClauseSplitter() {}

  /** Splits a formula into the list of its top-level conjuncts. */
  public static ImmutableList<Prop> split(Prop p) {
    return split(ImmutableList.of(p));
  }

  /** Splits each of a list of formulas into top-level conjuncts, and returns
   * the concatenated list. Formulas that are not conjunctions keep their
   * relative order. */
  public static ImmutableList<Prop> split(List<? extends Prop> props) {
    final Deque<Prop> stack = new ArrayDeque<>();
    for (Prop p : Lists.reverse(props)) {
      stack.push(p);
    }
    final ImmutableList.Builder<Prop> clauses = ImmutableList.builder();
    while (!stack.isEmpty()) {
      final Prop p = stack.pop();
      if (!p.isConjunction()) {
        clauses.add(p);
        continue;
      }
      for (Prop arg : p.args()) {
        if (arg.isConjunction()) {
          stack.push(arg);
        } else {
          clauses.add(arg);
        }
      }
    }
    return clauses.build();
  }
}

// End ClauseSplitter.java
