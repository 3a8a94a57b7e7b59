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
package net.hydromatic.cnf.kb;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cnf.ast.PropBuilder.prop;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.cnf.ast.Prop;
import net.hydromatic.cnf.compile.ClauseSplitter;
import net.hydromatic.cnf.compile.Cnf;
import net.hydromatic.cnf.compile.Tracer;
import net.hydromatic.cnf.compile.Tracers;
import net.hydromatic.cnf.eval.Setting;
import net.hydromatic.cnf.parse.PropParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Knowledge base of propositional clauses.
 *
 * <p>Every sentence that {@link #tell} adds is a clause: a constant, a
 * literal, or a disjunction of constants and literals. Sentences are kept in
 * the order they were added, and duplicates are kept.
 *
 * <p>Not thread-safe.
 */
public class KnowledgeBase {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(KnowledgeBase.class);

  private final List<Prop> sentences = new ArrayList<>();
  private final ImmutableMap<Setting, Object> settings;
  private final Cnf cnf;

  private KnowledgeBase(Map<Setting, Object> settings, Tracer tracer) {
    this.settings = ImmutableMap.copyOf(settings);
    this.cnf =
        new Cnf(
            Setting.CHECK_POSTCONDITIONS.booleanValue(this.settings)
                ? Tracers.withPostconditionChecks(tracer)
                : tracer);
  }

  /** Creates an empty knowledge base with default settings. */
  public static KnowledgeBase empty() {
    return empty(ImmutableMap.of());
  }

  /** Creates an empty knowledge base with the given settings. */
  public static KnowledgeBase empty(Map<Setting, Object> settings) {
    return new KnowledgeBase(settings, Tracers.empty());
  }

  /** Creates an empty knowledge base with the given settings that reports
   * each conversion to a tracer. */
  public static KnowledgeBase empty(Map<Setting, Object> settings,
      Tracer tracer) {
    return new KnowledgeBase(settings, requireNonNull(tracer));
  }

  /** Converts a formula to clauses and adds them. */
  public KnowledgeBase tell(Prop p) {
    final ImmutableList<Prop> clauses = cnf.convert(p);
    LOGGER.debug("tell {} added {} clause(s): {}", p, clauses.size(), clauses);
    sentences.addAll(clauses);
    if (Setting.SPLIT_ON_TELL.booleanValue(settings)) {
      splitClauses();
    }
    return this;
  }

  /**
   * Parses a formula, converts it to clauses, and adds them.
   *
   * @throws net.hydromatic.cnf.parse.PropParseException if the formula is
   *     not valid; the knowledge base is unchanged
   */
  public KnowledgeBase tell(String formula) {
    return tell(PropParser.parse(formula));
  }

  /** Adds a sentence without converting it to clauses. If it is not a
   * clause, call {@link #splitClauses()} to restore the invariant that every
   * sentence is a clause. */
  public KnowledgeBase add(Prop p) {
    sentences.add(requireNonNull(p));
    return this;
  }

  /** Replaces each sentence that is a conjunction with its conjuncts.
   * Sentences that are not conjunctions keep their relative order. */
  public void splitClauses() {
    final ImmutableList<Prop> clauses = ClauseSplitter.split(sentences);
    if (clauses.size() != sentences.size()) {
      LOGGER.debug("split {} sentence(s) into {} clause(s)",
          sentences.size(), clauses.size());
    }
    sentences.clear();
    sentences.addAll(clauses);
  }

  /** Returns the sentences, in the order they were added. */
  public List<Prop> sentences() {
    return ImmutableList.copyOf(sentences);
  }

  public int size() {
    return sentences.size();
  }

  public boolean isEmpty() {
    return sentences.isEmpty();
  }

  /** Returns the conjunction of copies of all sentences; {@code True} if
   * there are none. */
  public Prop asConjunction() {
    return prop.and(Lists.transform(sentences, Prop::deepCopy));
  }

  /** Returns the settings of this knowledge base. */
  public Map<Setting, Object> settings() {
    return settings;
  }

  @Override public String toString() {
    return sentences.toString();
  }
}

// End KnowledgeBase.java
