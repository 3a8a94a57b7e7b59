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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assignment of truth values to symbols.
 *
 * <p>Uses the closed-world assumption: a symbol that has no value in the
 * model is false.
 */
public class Model {
  private static final Model EMPTY = new Model(ImmutableMap.of());

  private final ImmutableMap<String, Boolean> values;

  private Model(ImmutableMap<String, Boolean> values) {
    this.values = requireNonNull(values);
  }

  /** Returns a model in which every symbol is false. */
  public static Model empty() {
    return EMPTY;
  }

  /** Creates a model from a map. */
  public static Model of(Map<String, Boolean> values) {
    return new Model(ImmutableMap.copyOf(values));
  }

  /** Creates a model in which the given symbols are true, and all others
   * are false. */
  public static Model ofTrue(String... names) {
    final ImmutableMap.Builder<String, Boolean> b = ImmutableMap.builder();
    for (String name : names) {
      b.put(name, true);
    }
    return new Model(b.buildKeepingLast());
  }

  /**
   * Returns every model over a list of symbols; there are 2<sup>n</sup>
   * models for n symbols.
   */
  public static List<Model> allAssignments(List<String> names) {
    final List<List<Boolean>> valueLists = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      valueLists.add(ImmutableList.of(false, true));
    }
    final ImmutableList.Builder<Model> models = ImmutableList.builder();
    for (List<Boolean> values : Lists.cartesianProduct(valueLists)) {
      final ImmutableMap.Builder<String, Boolean> b = ImmutableMap.builder();
      for (int i = 0; i < names.size(); i++) {
        b.put(names.get(i), values.get(i));
      }
      models.add(new Model(b.buildKeepingLast()));
    }
    return models.build();
  }

  /** Returns the value of a symbol; false if it is not assigned. */
  public boolean get(String name) {
    return values.getOrDefault(name, false);
  }

  @Override public int hashCode() {
    return values.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Model && ((Model) o).values.equals(values);
  }

  @Override public String toString() {
    return ImmutableSortedMap.copyOf(values).toString();
  }
}

// End Model.java
