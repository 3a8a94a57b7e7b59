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
package net.hydromatic.cnf;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.cnf.ast.Prop;
import net.hydromatic.cnf.compile.Checker;
import net.hydromatic.cnf.eval.Model;
import net.hydromatic.cnf.util.CnfException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a formula that is a single clause. */
  public static Matcher<Prop> isClause() {
    return new CustomTypeSafeMatcher<Prop>("clause") {
      @Override protected boolean matchesSafely(Prop p) {
        return Checker.isClause(p);
      }
    };
  }

  /** Matches a formula that has the same truth value as a given formula in
   * every model over the symbols of both. */
  public static Matcher<Prop> equivalentTo(Prop expected) {
    return new TypeSafeMatcher<Prop>() {
      @Override protected boolean matchesSafely(Prop actual) {
        return counterexample(expected, actual) == null;
      }

      @Override public void describeTo(Description description) {
        description.appendText("equivalent to ").appendValue(expected);
      }

      @Override protected void describeMismatchSafely(Prop actual,
          Description description) {
        description.appendValue(actual)
            .appendText(" differs in model ")
            .appendValue(counterexample(expected, actual));
      }
    };
  }

  /** Matches a list of clauses whose conjunction has the same truth value
   * as a given formula in every model. */
  public static Matcher<List<Prop>> equivalentClauses(Prop expected) {
    return new TypeSafeMatcher<List<Prop>>() {
      @Override protected boolean matchesSafely(List<Prop> clauses) {
        for (Model model : models(expected, clauses)) {
          boolean value = true;
          for (Prop clause : clauses) {
            value &= clause.eval(model);
          }
          if (value != expected.eval(model)) {
            return false;
          }
        }
        return true;
      }

      @Override public void describeTo(Description description) {
        description.appendText("clauses equivalent to ")
            .appendValue(expected);
      }
    };
  }

  /** Matches an error that has a given description, including its
   * position. */
  public static Matcher<Throwable> isError(String expected) {
    return new CustomTypeSafeMatcher<Throwable>("error " + expected) {
      @Override protected boolean matchesSafely(Throwable e) {
        return e instanceof CnfException
            && ((CnfException) e).describeTo(new StringBuilder()).toString()
                .equals(expected);
      }
    };
  }

  private static Model counterexample(Prop expected, Prop actual) {
    for (Model model : models(expected, ImmutableList.of(actual))) {
      if (expected.eval(model) != actual.eval(model)) {
        return model;
      }
    }
    return null;
  }

  private static List<Model> models(Prop p, List<Prop> others) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    names.addAll(p.symbols());
    others.forEach(other -> names.addAll(other.symbols()));
    return Model.allAssignments(names.build().asList());
  }
}

// End Matchers.java
