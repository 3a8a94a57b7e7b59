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

import java.util.List;
import net.hydromatic.cnf.ast.Prop;

/** Called on various events during conversion to conjunctive normal form. */
public interface Tracer {
  /** Called with the formula produced by a rewrite pass. */
  void onPass(Cnf.Pass pass, Prop p);

  /** Called with the clauses that the formula was split into. */
  void onClauses(List<Prop> clauses);
}

// End Tracer.java
