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

import static net.hydromatic.cnf.TestUtils.assertError;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.hasProperty;

import com.google.common.collect.ImmutableList;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Main}. */
public class MainTest {
  /** Runs the command-line tool on some input and returns its output. */
  private static String run(List<String> args, String input) {
    final StringWriter w = new StringWriter();
    new Main(args, new StringReader(input), w).run();
    return w.toString().replace(System.lineSeparator(), "\n");
  }

  @Test void testRun() {
    final String input = "p & q => r\n"
        + "\n"
        + "# a comment\n"
        + "q | r\n"
        + "p |\n";
    final String expected = "5.3 Error: missing operand\n"
        + "(~p | ~q) | r\n"
        + "q | r\n";
    assertThat(run(ImmutableList.of(), input), is(expected));
  }

  @Test void testEcho() {
    final String input = "p <=> q\n"
        + "  ~(p | q)  \n"
        + "p & (q\n";
    final String expected = "> p <=> q\n"
        + "~p | q\n"
        + "~q | p\n"
        + "> ~(p | q)\n"
        + "~p\n"
        + "~q\n"
        + "3.5 Error: unbalanced parentheses\n";
    assertThat(run(ImmutableList.of("--echo"), input), is(expected));
  }

  @Test void testEmptyInput() {
    assertThat(run(ImmutableList.of(), ""), is(""));
    assertThat(run(ImmutableList.of("--echo"), "# nothing\n"), is(""));
  }

  @Test void testOutputTree() {
    final String expected = "Or\n"
        + "\tNot\n"
        + "\t\tp\n"
        + "\tq\n";
    assertThat(run(ImmutableList.of("--output=tree"), "~p | q\n"),
        is(expected));
    final String expected2 = "Or\n"
        + "..p\n"
        + "..Or\n"
        + "....q\n"
        + "....True\n";
    assertThat(
        run(ImmutableList.of("--output=tree", "--printIndent=.."),
            "p | q | True\n"),
        is(expected2));
  }

  @Test void testCheckPostconditions() {
    assertThat(
        run(ImmutableList.of("--checkPostconditions=true"),
            "~(p <=> q) | r\n"),
        is("(~q | q) | r\n"
            + "(~q | ~p) | r\n"
            + "(p | q) | r\n"
            + "(p | ~p) | r\n"));
  }

  @Test void testBadArguments() {
    assertError(() -> new Main(ImmutableList.of("--verbose"),
            new StringReader(""), new StringWriter()),
        allOf(instanceOf(IllegalArgumentException.class),
            hasProperty("message", is("unknown argument: --verbose"))));
    assertError(() -> new Main(ImmutableList.of("--color=red"),
            new StringReader(""), new StringWriter()),
        allOf(instanceOf(IllegalArgumentException.class),
            hasProperty("message", is("setting color not found"))));
    assertError(() -> new Main(ImmutableList.of("--splitOnTell=maybe"),
            new StringReader(""), new StringWriter()),
        instanceOf(IllegalArgumentException.class));
  }
}

// End MainTest.java
