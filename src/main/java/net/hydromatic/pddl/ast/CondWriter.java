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
package net.hydromatic.pddl.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** Builds the bracketed, indented PDDL text of a {@link Cond}. */
public class CondWriter {
  private final StringBuilder b = new StringBuilder();
  private final int indentWidth;

  /** Creates a writer that indents by two spaces per level. */
  public CondWriter() {
    this(2);
  }

  public CondWriter(int indentWidth) {
    checkArgument(indentWidth >= 0, "negative indent %s", indentWidth);
    this.indentWidth = indentWidth;
  }

  /** Appends leading space for a nesting level. */
  public CondWriter indent(int level) {
    for (int i = 0; i < level * indentWidth; i++) {
      b.append(' ');
    }
    return this;
  }

  public CondWriter append(String s) {
    b.append(s);
    return this;
  }

  public CondWriter append(char c) {
    b.append(c);
    return this;
  }

  public CondWriter newline() {
    b.append('\n');
    return this;
  }

  /**
   * Appends a number, omitting ".0" from integral values. Negative zero
   * keeps its sign.
   */
  public CondWriter number(double value) {
    if (Double.compare(value, -0D) == 0) {
      b.append("-0");
    } else if (value == Math.rint(value) && !Double.isInfinite(value)
        && Math.abs(value) < 1e15) {
      b.append((long) value);
    } else {
      b.append(value);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End CondWriter.java
