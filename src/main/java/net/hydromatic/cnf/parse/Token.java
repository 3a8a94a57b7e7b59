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
package net.hydromatic.cnf.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.cnf.ast.Op;
import net.hydromatic.cnf.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Token in the text of a formula. */
class Token {
  final Kind kind;
  final String text;
  final Pos pos;

  /** Operator, if {@link #kind} is {@link Kind#OPERATOR}. */
  final @Nullable Op op;

  private Token(Kind kind, String text, Pos pos, @Nullable Op op) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.pos = requireNonNull(pos);
    this.op = op;
  }

  /** Classifies a word that contains no parentheses. */
  static Token of(String text, Pos pos) {
    switch (text) {
      case "(":
        return new Token(Kind.LEFT_PAREN, text, pos, null);
      case ")":
        return new Token(Kind.RIGHT_PAREN, text, pos, null);
      case "!":
        // alternative spelling of "~"
        return new Token(Kind.OPERATOR, text, pos, Op.NOT);
      case "True":
        return new Token(Kind.TRUE, text, pos, null);
      case "False":
        return new Token(Kind.FALSE, text, pos, null);
      default:
        final Op op = Op.ofToken(text);
        if (op != null) {
          return new Token(Kind.OPERATOR, text, pos, op);
        }
        return new Token(Kind.SYMBOL, text, pos, null);
    }
  }

  /** Returns the operator of this token; throws if it is not an operator. */
  Op op() {
    return requireNonNull(op, "op");
  }

  @Override public String toString() {
    return text;
  }

  /** Kind of token. */
  enum Kind {
    SYMBOL,
    TRUE,
    FALSE,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN
  }
}

// End Token.java
