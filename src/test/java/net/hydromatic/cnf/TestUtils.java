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

import static net.hydromatic.cnf.ast.PropBuilder.prop;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.List;
import java.util.Random;
import net.hydromatic.cnf.ast.Op;
import net.hydromatic.cnf.ast.Prop;
import org.hamcrest.Matcher;

/** Utilities for tests. */
public abstract class TestUtils {
  private TestUtils() {}

  private static final Op[] BINARY_OPS = {Op.AND, Op.OR, Op.IMPLIC, Op.IFF};

  /** Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  public static void assertError(Runnable runnable,
      Matcher<? super Throwable> matcher) {
    try {
      runnable.run();
    } catch (Throwable e) {
      assertThat(e, matcher);
      return;
    }
    fail("expected error");
  }

  /** Generates a random formula over the given symbols, at most
   * {@code depth} levels deep. The same seed gives the same formula. */
  public static Prop randomProp(Random random, List<String> names,
      int depth) {
    if (depth == 0 || random.nextInt(5) == 0) {
      final int i = random.nextInt(names.size() + 2);
      if (i == names.size()) {
        return prop.trueLiteral();
      }
      if (i == names.size() + 1) {
        return prop.falseLiteral();
      }
      return prop.symbol(names.get(i));
    }
    final int k = random.nextInt(BINARY_OPS.length + 1);
    if (k == BINARY_OPS.length) {
      return prop.not(randomProp(random, names, depth - 1));
    }
    return prop.binary(BINARY_OPS[k], randomProp(random, names, depth - 1),
        randomProp(random, names, depth - 1));
  }
}

// End TestUtils.java
