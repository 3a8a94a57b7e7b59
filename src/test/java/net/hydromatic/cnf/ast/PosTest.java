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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import org.junit.jupiter.api.Test;

/** Tests for {@link Pos}. */
public class PosTest {
  @Test void testDescribe() {
    assertThat(Pos.of("", 3, 4, 5), hasToString("3.5"));
    assertThat(Pos.of("rules.txt", 3, 4, 7), hasToString("rules.txt:3.5-3.7"));
    assertThat(Pos.of("", 1, 0, 2).plus(Pos.of("", 1, 4, 5)),
        hasToString("1.1-1.5"));
  }

  /** Tests that positions in different files are not equal. */
  @Test void testEquals() {
    final Pos pos = Pos.of("a.txt", 2, 0, 3);
    assertThat(pos, is(Pos.of("a.txt", 2, 0, 3)));
    assertThat(pos.hashCode(), is(Pos.of("a.txt", 2, 0, 3).hashCode()));
    assertThat(pos, not(is(Pos.of("b.txt", 2, 0, 3))));
    assertThat(pos, not(is(Pos.of("a.txt", 3, 0, 3))));
    assertThat(pos, not(is(Pos.of("a.txt", 2, 0, 4))));
  }
}

// End PosTest.java
