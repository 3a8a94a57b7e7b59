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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.function.Predicate;
import net.hydromatic.cnf.ast.Prop;

/**
 * Converts a formula to conjunctive normal form (CNF), and splits it into
 * clauses.
 *
 * <p>Conversion runs four rewrite passes, in the order of {@link Pass}, then
 * splits the result into clauses. Each pass requires the postcondition of
 * the pass before it; the public entry points always run them in order.
 */
public class Cnf {
  private final Tracer tracer;

  /** Creates a Cnf that reports each pass to a tracer. */
  public Cnf(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /** Converts a formula to a list of clauses. */
  public static ImmutableList<Prop> cnf(Prop p) {
    return new Cnf(Tracers.empty()).convert(p);
  }

  /**
   * Converts a formula to a list of clauses.
   *
   * <p>The conjunction of the clauses is equivalent to the formula. Each
   * clause is a constant, a literal, or a disjunction of constants and
   * literals. Clauses are not simplified; a clause may contain the same
   * literal twice, or be a tautology.
   */
  public ImmutableList<Prop> convert(Prop p) {
    p = eliminateBiconditionals(p);
    tracer.onPass(Pass.BICONDITIONAL_ELIMINATION, p);
    p = eliminateImplications(p);
    tracer.onPass(Pass.IMPLICATION_ELIMINATION, p);
    p = moveNotInward(p);
    tracer.onPass(Pass.NEGATION_NORMAL_FORM, p);
    p = distributeOrOverAnd(p);
    tracer.onPass(Pass.DISTRIBUTION, p);
    final ImmutableList<Prop> clauses = splitClauses(p);
    tracer.onClauses(clauses);
    return clauses;
  }

  /** Rewrites every {@code a <=> b} to {@code (a => b) & (b => a)}. */
  public static Prop eliminateBiconditionals(Prop p) {
    return p.accept(new BiconditionalEliminator());
  }

  /** Rewrites every {@code a => b} to {@code ~a | b}. */
  public static Prop eliminateImplications(Prop p) {
    return p.accept(new ImplicationEliminator());
  }

  /** Converts a formula with no {@code =>} or {@code <=>} to negation normal
   * form.
   *
   * @throws AssertionError if the formula contains {@code =>} or
   *     {@code <=>} */
  public static Prop moveNotInward(Prop p) {
    return NegationNormalizer.normalize(p);
  }

  /** Converts a formula in negation normal form to conjunctive normal form.
   *
   * @throws AssertionError if the formula contains {@code =>} or
   *     {@code <=>} */
  public static Prop distributeOrOverAnd(Prop p) {
    return Distributor.distribute(p);
  }

  /** Splits a formula in conjunctive normal form into clauses. */
  public static ImmutableList<Prop> splitClauses(Prop p) {
    return ClauseSplitter.split(p);
  }

  /** Rewrite pass, with the condition that holds on the formula it
   * produces. */
  public enum Pass {
    BICONDITIONAL_ELIMINATION(Checker::hasNoIff),
    IMPLICATION_ELIMINATION(Checker::hasNoImplication),
    NEGATION_NORMAL_FORM(Checker::isNegationNormal),
    DISTRIBUTION(Checker::isCnf);

    public final Predicate<Prop> postcondition;

    Pass(Predicate<Prop> postcondition) {
      this.postcondition = postcondition;
    }
  }
}

// End Cnf.java
