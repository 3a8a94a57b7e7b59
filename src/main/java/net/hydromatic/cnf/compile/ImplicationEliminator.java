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

import static net.hydromatic.cnf.ast.PropBuilder.prop;

import net.hydromatic.cnf.ast.Op;
import net.hydromatic.cnf.ast.Prop;
import net.hydromatic.cnf.ast.Shuttle;

/** Rewrites {@code a => b} to {@code ~a | b}, operands first. */
class ImplicationEliminator extends Shuttle {
  @Override protected Prop visit(Prop.Binary binary) {
    final Prop p = super.visit(binary);
    if (p.op != Op.IMPLIC) {
      return p;
    }
    final Prop.Binary implic = (Prop.Binary) p;
    return prop.or(prop.not(implic.lhs), implic.rhs);
  }
}

// End ImplicationEliminator.java
