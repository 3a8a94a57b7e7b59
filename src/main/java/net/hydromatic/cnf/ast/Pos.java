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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Position of a token in the text of a formula. */
public class Pos {
  public final String file;
  public final int line;
  public final int startColumn;
  public final int endColumn;

  /** Creates a Pos. Columns are 1-based; {@code endColumn} is the column
   * after the last character. */
  public Pos(String file, int line, int startColumn, int endColumn) {
    this.file = requireNonNull(file);
    this.line = line;
    this.startColumn = startColumn;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets into a line of text. */
  public static Pos of(String file, int line, int startOffset, int endOffset) {
    return new Pos(file, line, startOffset + 1, endOffset + 1);
  }

  /** Returns a position that spans from the start of this position to the
   * end of another. */
  public Pos plus(Pos pos) {
    return new Pos(file, line, Math.min(startColumn, pos.startColumn),
        Math.max(endColumn, pos.endColumn));
  }

  @Override public int hashCode() {
    return Objects.hash(file, line, startColumn, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.file.equals(((Pos) o).file)
        && this.line == ((Pos) o).line
        && this.startColumn == ((Pos) o).startColumn
        && this.endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(line)
        .append('.')
        .append(startColumn);
    if (endColumn > startColumn + 1) {
      buf.append('-')
          .append(line)
          .append('.')
          .append(endColumn - 1);
    }
    return buf;
  }
}

// End Pos.java
