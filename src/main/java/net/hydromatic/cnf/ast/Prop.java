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
import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.PrintWriter;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.cnf.eval.Model;

/**
 * Propositional formula.
 *
 * <p>A formula is a tree. Each node owns its children; no node is reachable
 * from two parents. Nodes are immutable, so a rewrite replaces a node by
 * building a new node from the old node's children.
 *
 * <p>Use {@link PropBuilder#prop} to create instances.
 */
public abstract class Prop {
  public final Op op;

  Prop(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this formula to a string in the syntax accepted by the parser,
   * with as few parentheses as precedence allows.
   */
  @Override
  public final String toString() {
    return unparse(new PropWriter(), 0, 0).toString();
  }

  abstract PropWriter unparse(PropWriter w, int left, int right);

  /** Accepts a shuttle, and returns the rewritten formula. */
  public abstract Prop accept(Shuttle shuttle);

  /** Accepts a visitor. */
  public abstract void accept(Visitor visitor);

  /** Returns the operands of this node, in order. */
  public abstract ImmutableList<Prop> args();

  /**
   * Returns a structural copy of this formula. The copy is equal to this
   * formula but shares no {@link Not} or {@link Binary} node with it.
   */
  public abstract Prop deepCopy();

  /**
   * Evaluates this formula in a model. Symbols that are not assigned in the
   * model are false.
   */
  public abstract boolean eval(Model model);

  /** Returns whether this is a conjunction ({@link Op#AND}). */
  public boolean isConjunction() {
    return op == Op.AND;
  }

  /** Returns whether this is {@code True} or {@code False}. */
  public boolean isConstant() {
    return op == Op.TRUE || op == Op.FALSE;
  }

  /** Returns whether this is a symbol or the negation of a symbol. */
  public boolean isLiteral() {
    return op == Op.SYMBOL
        || op == Op.NOT && ((Not) this).arg.op == Op.SYMBOL;
  }

  /** Returns the names of the symbols in this formula, in order of first
   * occurrence. */
  public ImmutableList<String> symbols() {
    final Set<String> names = new LinkedHashSet<>();
    accept(
        new Visitor() {
          @Override
          protected void visit(Symbol symbol) {
            names.add(symbol.name);
          }
        });
    return ImmutableList.copyOf(names);
  }

  /**
   * Prints this formula as a tree, one node per line, each line indented by
   * {@code indent} once per level of depth.
   */
  public void printTree(PrintWriter out, String indent) {
    printTree(out, indent, 0);
  }

  private void printTree(PrintWriter out, String indent, int depth) {
    out.append(Strings.repeat(indent, depth))
        .append(op == Op.SYMBOL ? ((Symbol) this).name : op.printName)
        .println();
    for (Prop arg : args()) {
      arg.printTree(out, indent, depth + 1);
    }
  }

  /** Constant, {@code True} or {@code False}. */
  public static class Literal extends Prop {
    Literal(Op op) {
      super(op);
      checkArgument(op == Op.TRUE || op == Op.FALSE);
    }

    @Override
    PropWriter unparse(PropWriter w, int left, int right) {
      return w.append(op.printName);
    }

    @Override
    public Prop accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Prop> args() {
      return ImmutableList.of();
    }

    @Override
    public Prop deepCopy() {
      return this; // leaf
    }

    @Override
    public boolean eval(Model model) {
      return op == Op.TRUE;
    }

    @Override
    public int hashCode() {
      return op.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Literal && ((Literal) o).op == op;
    }
  }

  /** Atomic proposition. Two symbols with the same name are the same
   * variable. */
  public static class Symbol extends Prop {
    public final String name;

    Symbol(String name) {
      super(Op.SYMBOL);
      this.name = requireNonNull(name);
    }

    @Override
    PropWriter unparse(PropWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Prop accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Prop> args() {
      return ImmutableList.of();
    }

    @Override
    public Prop deepCopy() {
      return this; // leaf
    }

    @Override
    public boolean eval(Model model) {
      return model.get(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Symbol && ((Symbol) o).name.equals(name);
    }
  }

  /** Negation. */
  public static class Not extends Prop {
    public final Prop arg;

    Not(Prop arg) {
      super(Op.NOT);
      this.arg = requireNonNull(arg);
    }

    @Override
    PropWriter unparse(PropWriter w, int left, int right) {
      return w.prefix(left, op, arg, right);
    }

    @Override
    public Prop accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Prop> args() {
      return ImmutableList.of(arg);
    }

    @Override
    public Prop deepCopy() {
      return new Not(arg.deepCopy());
    }

    @Override
    public boolean eval(Model model) {
      return !arg.eval(model);
    }

    /** Creates a copy of this {@code Not} with a given argument, or
     * {@code this} if the argument is the same. */
    public Not copy(Prop arg) {
      return this.arg == arg ? this : new Not(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Not && ((Not) o).arg.equals(arg);
    }
  }

  /** Binary connective: {@link Op#AND}, {@link Op#OR}, {@link Op#IMPLIC} or
   * {@link Op#IFF}. */
  public static class Binary extends Prop {
    public final Prop lhs;
    public final Prop rhs;

    Binary(Op op, Prop lhs, Prop rhs) {
      super(op);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    PropWriter unparse(PropWriter w, int left, int right) {
      return w.infix(left, lhs, op, rhs, right);
    }

    @Override
    public Prop accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Prop> args() {
      return ImmutableList.of(lhs, rhs);
    }

    @Override
    public Prop deepCopy() {
      return new Binary(op, lhs.deepCopy(), rhs.deepCopy());
    }

    @Override
    public boolean eval(Model model) {
      switch (op) {
        case AND:
          return lhs.eval(model) && rhs.eval(model);
        case OR:
          return lhs.eval(model) || rhs.eval(model);
        case IMPLIC:
          return !lhs.eval(model) || rhs.eval(model);
        case IFF:
          return lhs.eval(model) == rhs.eval(model);
        default:
          throw new AssertionError(op);
      }
    }

    /** Creates a copy of this {@code Binary} with given operands, or
     * {@code this} if the operands are the same. */
    public Binary copy(Prop lhs, Prop rhs) {
      return this.lhs == lhs && this.rhs == rhs
          ? this
          : new Binary(op, lhs, rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && ((Binary) o).op == op
              && ((Binary) o).lhs.equals(lhs)
              && ((Binary) o).rhs.equals(rhs);
    }
  }
}

// End Prop.java
