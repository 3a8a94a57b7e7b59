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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sub-types of {@link Prop}.
 *
 * <p>Each binary operator has a token (as written in formulas), a print name
 * (as written by {@link Prop#printTree}), and left and right precedence. All
 * binary operators are right-associative, matching the parser.
 */
public enum Op {
  TRUE("True"),
  FALSE("False"),
  SYMBOL(""),
  NOT("Not", "~", "~", 5),
  AND("And", "&", " & ", 4),
  OR("Or", "|", " | ", 3),
  IMPLIC("Implic", "=>", " => ", 2),
  IFF("Iff", "<=>", " <=> ", 1);

  /** Name used when printing a tree. */
  public final String printName;

  /** Token in formula syntax, or null if this is not an operator. */
  public final @Nullable String token;

  /** Token as it is unparsed; binary operators are padded with spaces. */
  public final String padded;

  /** Binding strength in formula syntax; 0 for leaves. */
  public final int precedence;

  public final int left;
  public final int right;

  /** Operators, keyed by token. */
  private static final ImmutableMap<String, Op> BY_TOKEN;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.token != null) {
        b.put(op.token, op);
      }
    }
    BY_TOKEN = b.build();
  }

  Op(String printName) {
    this.printName = printName;
    this.token = null;
    this.padded = "";
    this.precedence = 0;
    this.left = 0;
    this.right = 0;
  }

  Op(String printName, String token, String padded, int precedence) {
    this.printName = printName;
    this.token = token;
    this.padded = padded;
    this.precedence = precedence;
    // right-associative: "a & b & c" is "a & (b & c)"
    this.left = precedence * 2 + 1;
    this.right = precedence * 2;
  }

  /** Returns whether this is one of the four binary connectives. */
  public boolean isBinary() {
    return this == AND || this == OR || this == IMPLIC || this == IFF;
  }

  /** Returns the operator with a given token, or null. */
  public static @Nullable Op ofToken(String token) {
    return BY_TOKEN.get(token);
  }
}

// End Op.java
