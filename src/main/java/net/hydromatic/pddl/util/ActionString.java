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
package net.hydromatic.pddl.util;

import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;
import java.util.Locale;

/**
 * Step of a plan, written as text such as {@code (move r2d2 kitchen
 * bedroom):5}.
 *
 * <p>The text is reduced before it is split: white space is collapsed,
 * spaces next to parentheses are removed, and letters are converted to lower
 * case. The optional suffix {@code :<time>} gives the start time of the
 * step; if absent, {@link #time} is -1.
 */
public final class ActionString {
  /** Expression without parentheses, e.g. "move r2d2 kitchen bedroom". */
  public final String expression;
  /** Action name, e.g. "move". */
  public final String name;
  /** Arguments, e.g. ["r2d2", "kitchen", "bedroom"]. */
  public final ImmutableList<String> params;
  public final int time;

  private ActionString(String expression, int time) {
    this.expression = requireNonNull(expression);
    final List<String> words = Splitter.on(' ').splitToList(expression);
    this.name = words.get(0);
    this.params = ImmutableList.copyOf(words.subList(1, words.size()));
    this.time = time;
  }

  /**
   * Parses a plan step.
   *
   * @throws IllegalArgumentException if the step is not enclosed in
   *     parentheses, or if its time is not an integer
   */
  public static ActionString parse(String input) {
    String action = reduce(input);
    int time = -1;
    final int colon = action.indexOf(':');
    if (colon >= 0) {
      final Integer t = Ints.tryParse(action.substring(colon + 1).trim());
      if (t == null) {
        throw new IllegalArgumentException("invalid time in '" + input + "'");
      }
      time = t;
      action = action.substring(0, colon).trim();
    }
    if (action.length() < 3
        || action.charAt(0) != '('
        || action.charAt(action.length() - 1) != ')') {
      throw new IllegalArgumentException(
          "expected '(name args...)', found '" + input + "'");
    }
    return new ActionString(
        action.substring(1, action.length() - 1).trim(), time);
  }

  /**
   * Collapses white space, removes spaces inside parentheses, and converts
   * to lower case; {@code " ( Move  R2D2 ) "} becomes {@code "(move r2d2)"}.
   */
  public static String reduce(String input) {
    return CharMatcher.whitespace()
        .trimAndCollapseFrom(input, ' ')
        .replace("( ", "(")
        .replace(" )", ")")
        .toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "(" + expression + ")" + (time >= 0 ? ":" + time : "");
  }
}

// End ActionString.java
