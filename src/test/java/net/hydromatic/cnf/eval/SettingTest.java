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
package net.hydromatic.cnf.eval;

import static net.hydromatic.cnf.TestUtils.assertError;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.hasProperty;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests for {@link Setting}. */
public class SettingTest {
  private static Matcher<Throwable> isIllegal(String message) {
    return allOf(instanceOf(IllegalArgumentException.class),
        hasProperty("message", is(message)));
  }

  @Test void testDefaults() {
    final Map<Setting, Object> map = ImmutableMap.of();
    assertThat(Setting.CHECK_POSTCONDITIONS.booleanValue(map), is(false));
    assertThat(Setting.SPLIT_ON_TELL.booleanValue(map), is(false));
    assertThat(Setting.PRINT_INDENT.stringValue(map), is("\t"));
    assertThat(Setting.OUTPUT.enumValue(map, Setting.Output.class),
        is(Setting.Output.INFIX));
  }

  @Test void testLookup() {
    assertThat(Setting.lookup("splitOnTell"), is(Setting.SPLIT_ON_TELL));
    assertThat(Setting.lookup("SPLIT_ON_TELL"), is(Setting.SPLIT_ON_TELL));
    assertError(() -> Setting.lookup("splitontell"),
        isIllegal("setting splitontell not found"));
    assertThat(Setting.BY_CAMEL_NAME.get(0), is(Setting.CHECK_POSTCONDITIONS));
  }

  @Test void testSetLenient() {
    final Map<Setting, Object> map = new HashMap<>();
    Setting.SPLIT_ON_TELL.setLenient(map, "TRUE");
    assertThat(Setting.SPLIT_ON_TELL.booleanValue(map), is(true));
    Setting.OUTPUT.setLenient(map, "tree");
    assertThat(Setting.OUTPUT.enumValue(map, Setting.Output.class),
        is(Setting.Output.TREE));
    Setting.PRINT_INDENT.setLenient(map, "  ");
    assertThat(Setting.PRINT_INDENT.stringValue(map), is("  "));

    assertError(() -> Setting.SPLIT_ON_TELL.setLenient(map, "yes"),
        isIllegal("value for setting splitOnTell must be 'true' or 'false'"));
    assertError(() -> Setting.OUTPUT.setLenient(map, "json"),
        isIllegal("value must be one of: 'infix', 'tree'"));
    assertError(() -> Setting.PRINT_INDENT.set(map, 3),
        isIllegal("value for setting printIndent must have type "
            + "class java.lang.String"));
  }

  /** Tests that setting a null value restores the default. */
  @Test void testReset() {
    final Map<Setting, Object> map = new HashMap<>();
    Setting.PRINT_INDENT.set(map, "  ");
    Setting.SPLIT_ON_TELL.set(map, true);
    Setting.PRINT_INDENT.set(map, null);
    assertThat(map.containsKey(Setting.PRINT_INDENT), is(false));
    assertThat(Setting.PRINT_INDENT.stringValue(map), is("\t"));
    assertThat(Setting.SPLIT_ON_TELL.booleanValue(map), is(true));
  }

  /** Tests that asking for a value of the wrong type fails. */
  @Test void testWrongType() {
    assertError(() -> Setting.PRINT_INDENT.booleanValue(ImmutableMap.of()),
        isIllegal("invalid type class java.lang.String "
            + "for setting printIndent"));
  }
}

// End SettingTest.java
