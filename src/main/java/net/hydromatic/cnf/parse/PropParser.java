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

import static net.hydromatic.cnf.ast.PropBuilder.prop;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.cnf.ast.Op;
import net.hydromatic.cnf.ast.Pos;
import net.hydromatic.cnf.ast.Prop;

/**
 * Parser of propositional formulas written in infix notation.
 *
 * <p>Tokens are separated by whitespace. The binary operators, from highest
 * to lowest precedence, are {@code &}, {@code |}, {@code =>} and
 * {@code <=>}; each groups to the right, so {@code p => q => r} is
 * {@code p => (q => r)}. Prefix {@code ~} (or {@code !}) is negation, and
 * binds tighter than any binary operator. {@code True} and {@code False} are
 * constants; any other token is a symbol.
 *
 * <p>Parentheses group. They may be written as separate tokens, or attached
 * to the start or end of a symbol, as in {@code (p & q)}. A parenthesis
 * inside a symbol, as in {@code p)(q}, is an error. Negation must come
 * before its operand.
 *
 * <p>The parser uses the shunting-yard algorithm: it converts the token
 * sequence to postfix, then evaluates the postfix sequence with a stack of
 * operands.
 */
public class PropParser {
  static final String EMPTY = "empty formula";
  static final String MALFORMED = "malformed formula";
  static final String MISPLACED_NEGATION = "misplaced negation";
  static final String MISSING_OPERAND = "missing operand";
  static final String UNBALANCED = "unbalanced parentheses";

  private final String file;
  private final int line;

  private PropParser(String file, int line) {
    this.file = file;
    this.line = line;
  }

  /**
   * Parses a formula.
   *
   * @param formula Text of formula
   * @return Formula
   * @throws PropParseException if the text is not a valid formula
   */
  public static Prop parse(String formula) {
    return parse(formula, "", 1);
  }

  /**
   * Parses a formula that occurs on a given line of a file. The file name
   * and line number are used only to describe errors.
   */
  public static Prop parse(String formula, String file, int line) {
    final PropParser parser = new PropParser(file, line);
    final List<Token> tokens = parser.tokenize(formula);
    if (tokens.isEmpty()) {
      throw new PropParseException(EMPTY, Pos.of(file, line, 0, 0));
    }
    return parser.evaluate(parser.toPostfix(tokens),
        tokens.get(0).pos.plus(tokens.get(tokens.size() - 1).pos));
  }

  /** Splits a formula into tokens. */
  ImmutableList<Token> tokenize(String formula) {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int i = 0;
    final int n = formula.length();
    for (;;) {
      while (i < n && Character.isWhitespace(formula.charAt(i))) {
        ++i;
      }
      if (i >= n) {
        return tokens.build();
      }
      int end = i;
      while (end < n && !Character.isWhitespace(formula.charAt(end))) {
        ++end;
      }
      word(formula, i, end, tokens);
      i = end;
    }
  }

  /** Converts a whitespace-delimited word into one or more tokens.
   *
   * <p>Leading "(", "~" and "!" characters and trailing ")" characters each
   * become a separate token, so that "(p" is "(" followed by "p", and "~(q)"
   * is "~", "(", "q", ")". */
  private void word(String formula, int start, int end,
      ImmutableList.Builder<Token> tokens) {
    int i = start;
    while (i < end && isPrefixChar(formula.charAt(i))) {
      tokens.add(token(formula, i, i + 1));
      ++i;
    }
    int j = end;
    while (j > i && formula.charAt(j - 1) == ')') {
      --j;
    }
    for (int k = i; k < j; k++) {
      final char c = formula.charAt(k);
      if (c == '(' || c == ')') {
        throw new PropParseException(UNBALANCED,
            Pos.of(file, line, k, k + 1));
      }
    }
    if (i < j) {
      tokens.add(token(formula, i, j));
    }
    for (int k = j; k < end; k++) {
      tokens.add(token(formula, k, k + 1));
    }
  }

  private static boolean isPrefixChar(char c) {
    return c == '(' || c == '~' || c == '!';
  }

  private Token token(String formula, int start, int end) {
    return Token.of(formula.substring(start, end),
        Pos.of(file, line, start, end));
  }

  /** Converts infix tokens to postfix. */
  List<Token> toPostfix(List<Token> tokens) {
    final List<Token> output = new ArrayList<>();
    final Deque<Token> ops = new ArrayDeque<>();
    // Whether the previous token ends an operand
    boolean afterOperand = false;
    for (Token token : tokens) {
      switch (token.kind) {
        case SYMBOL:
        case TRUE:
        case FALSE:
          output.add(token);
          afterOperand = true;
          break;

        case LEFT_PAREN:
          ops.push(token);
          afterOperand = false;
          break;

        case RIGHT_PAREN:
          for (;;) {
            final Token op = ops.poll();
            if (op == null) {
              throw new PropParseException(UNBALANCED, token.pos);
            }
            if (op.kind == Token.Kind.LEFT_PAREN) {
              break;
            }
            output.add(op);
          }
          afterOperand = true;
          break;

        case OPERATOR:
          if (token.op() == Op.NOT) {
            if (afterOperand) {
              throw new PropParseException(MISPLACED_NEGATION, token.pos);
            }
          } else {
            // Before pushing a binary operator, emit the pending operators
            // that bind more tightly. Equal precedence stays on the stack,
            // which makes the binary operators right-associative.
            while (!ops.isEmpty()
                && ops.peek().kind == Token.Kind.OPERATOR
                && ops.peek().op().precedence > token.op().precedence) {
              output.add(ops.pop());
            }
          }
          ops.push(token);
          afterOperand = false;
          break;

        default:
          throw new AssertionError(token.kind);
      }
    }
    while (!ops.isEmpty()) {
      final Token op = ops.pop();
      if (op.kind == Token.Kind.LEFT_PAREN) {
        throw new PropParseException(UNBALANCED, op.pos);
      }
      output.add(op);
    }
    return output;
  }

  /** Evaluates a postfix token list, and returns the sole remaining
   * operand. */
  Prop evaluate(List<Token> postfix, Pos pos) {
    final Deque<Prop> stack = new ArrayDeque<>();
    for (Token token : postfix) {
      switch (token.kind) {
        case SYMBOL:
          stack.push(prop.symbol(token.text));
          break;
        case TRUE:
          stack.push(prop.trueLiteral());
          break;
        case FALSE:
          stack.push(prop.falseLiteral());
          break;
        case OPERATOR:
          final Op op = token.op();
          if (op == Op.NOT) {
            stack.push(prop.not(pop(stack, token)));
          } else {
            // Operands were pushed in infix order, so rhs is on top.
            final Prop rhs = pop(stack, token);
            final Prop lhs = pop(stack, token);
            stack.push(prop.binary(op, lhs, rhs));
          }
          break;
        default:
          throw new AssertionError(token.kind);
      }
    }
    if (stack.size() != 1) {
      throw new PropParseException(MALFORMED, pos);
    }
    return stack.pop();
  }

  private static Prop pop(Deque<Prop> stack, Token token) {
    final Prop p = stack.poll();
    if (p == null) {
      throw new PropParseException(MISSING_OPERAND, token.pos);
    }
    return p;
  }
}

// End PropParser.java
