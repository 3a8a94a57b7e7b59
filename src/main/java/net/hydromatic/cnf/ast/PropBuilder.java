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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/** Builds formulas. */
public enum PropBuilder {
  /**
   * The singleton instance of the formula builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  prop;

  private static final Prop.Literal TRUE = new Prop.Literal(Op.TRUE);
  private static final Prop.Literal FALSE = new Prop.Literal(Op.FALSE);

  public Prop.Literal trueLiteral() {
    return TRUE;
  }

  public Prop.Literal falseLiteral() {
    return FALSE;
  }

  public Prop.Symbol symbol(String name) {
    checkArgument(!name.isEmpty(), "empty symbol name");
    return new Prop.Symbol(name);
  }

  public Prop.Not not(Prop arg) {
    return new Prop.Not(arg);
  }

  public Prop.Binary and(Prop lhs, Prop rhs) {
    return new Prop.Binary(Op.AND, lhs, rhs);
  }

  public Prop.Binary or(Prop lhs, Prop rhs) {
    return new Prop.Binary(Op.OR, lhs, rhs);
  }

  public Prop.Binary implic(Prop lhs, Prop rhs) {
    return new Prop.Binary(Op.IMPLIC, lhs, rhs);
  }

  public Prop.Binary iff(Prop lhs, Prop rhs) {
    return new Prop.Binary(Op.IFF, lhs, rhs);
  }

  /** Creates a call to a binary connective. */
  public Prop.Binary binary(Op op, Prop lhs, Prop rhs) {
    return new Prop.Binary(op, lhs, rhs);
  }

  /**
   * Creates the conjunction of a list of formulas, nested to the right.
   * Returns {@code True} if the list is empty, and the sole element if it has
   * one element.
   */
  public Prop and(Iterable<? extends Prop> props) {
    return fold(Op.AND, TRUE, props);
  }

  /**
   * Creates the disjunction of a list of formulas, nested to the right.
   * Returns {@code False} if the list is empty, and the sole element if it has
   * one element.
   */
  public Prop or(Iterable<? extends Prop> props) {
    return fold(Op.OR, FALSE, props);
  }

  private Prop fold(Op op, Prop empty, Iterable<? extends Prop> props) {
    final ImmutableList<Prop> list = ImmutableList.copyOf(props);
    if (list.isEmpty()) {
      return empty;
    }
    Prop p = list.get(list.size() - 1);
    for (Prop e : Lists.reverse(list.subList(0, list.size() - 1))) {
      p = new Prop.Binary(op, e, p);
    }
    return p;
  }
}

// End PropBuilder.java
