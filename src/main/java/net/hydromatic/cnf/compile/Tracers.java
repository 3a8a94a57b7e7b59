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

import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.cnf.ast.Prop;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the result of a
   * given pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, Cnf.Pass pass,
      Consumer<Prop> consumer) {
    final Cnf.Pass expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override public void onPass(Cnf.Pass pass, Prop p) {
        if (pass == expectedPass) {
          consumer.accept(p);
        }
        super.onPass(pass, p);
      }
    };
  }

  /** Returns a tracer that performs the given action on the list of
   * clauses, then calls the underlying tracer. */
  public static Tracer withOnClauses(Tracer tracer,
      Consumer<List<Prop>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onClauses(List<Prop> clauses) {
        consumer.accept(clauses);
        super.onClauses(clauses);
      }
    };
  }

  /** Returns a tracer that checks the postcondition of each pass, and that
   * each result is a clause, then calls the underlying tracer.
   *
   * <p>A failed check means that the passes are broken, not that the input
   * was bad, so it throws {@link AssertionError}. */
  public static Tracer withPostconditionChecks(Tracer tracer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPass(Cnf.Pass pass, Prop p) {
        if (!pass.postcondition.test(p)) {
          throw new AssertionError("postcondition of " + pass
              + " does not hold: " + p);
        }
        super.onPass(pass, p);
      }

      @Override public void onClauses(List<Prop> clauses) {
        for (Prop clause : clauses) {
          if (!Checker.isClause(clause)) {
            throw new AssertionError("not a clause: " + clause);
          }
        }
        super.onClauses(clauses);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onPass(Cnf.Pass pass, Prop p) {
    }

    @Override public void onClauses(List<Prop> clauses) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onPass(Cnf.Pass pass, Prop p) {
      tracer.onPass(pass, p);
    }

    @Override public void onClauses(List<Prop> clauses) {
      tracer.onClauses(clauses);
    }
  }
}

// End Tracers.java
