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
package net.hydromatic.pddl.parse;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Position of a token in PDDL source text. */
public class Pos {
  public final String file;
  /** Line, 1-based. */
  public final int line;
  /** Column, 1-based. */
  public final int column;

  /** Creates a Pos. */
  public Pos(String file, int line, int column) {
    this.file = requireNonNull(file);
    this.line = line;
    this.column = column;
  }

  /** Creates a Pos from an offset into a string. */
  public static Pos of(String text, String file, int offset) {
    int line = 1;
    int column = 1;
    for (int i = 0; i < offset && i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        ++line;
        column = 1;
      } else {
        ++column;
      }
    }
    return new Pos(file, line, column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.file.equals(((Pos) o).file)
            && this.line == ((Pos) o).line
            && this.column == ((Pos) o).column;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(line)
        .append('.')
        .append(column);
  }
}

// End Pos.java
