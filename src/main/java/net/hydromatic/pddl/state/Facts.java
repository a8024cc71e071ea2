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
package net.hydromatic.pddl.state;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.util.List;
import net.hydromatic.pddl.parse.PddlParseException;
import net.hydromatic.pddl.parse.PddlReader;
import net.hydromatic.pddl.parse.Pos;

/** Creates facts from their PDDL text. */
public class Facts {
  private Facts() {}

  /** Parses a predicate, e.g. {@code (robot_at r1 kitchen)}. */
  public static Predicate predicate(String text) {
    final PddlReader reader = new PddlReader(text);
    reader.expect("(");
    final String name = reader.symbol();
    final List<String> args = names(reader);
    end(reader);
    return new Predicate(name, args);
  }

  /**
   * Parses a function assignment, e.g. {@code (= (battery r1) 80)}, or a
   * function reference, e.g. {@code (battery r1)}, whose value is then 0.
   */
  public static Function function(String text) {
    final PddlReader reader = new PddlReader(text);
    reader.expect("(");
    final String first = reader.symbol();
    if (!first.equals("=")) {
      final Function function = new Function(first, names(reader), 0D);
      end(reader);
      return function;
    }
    reader.expect("(");
    final String name = reader.symbol();
    final List<String> args = names(reader);
    final Pos pos = reader.pos();
    final String token = reader.symbol();
    final Double value = Doubles.tryParse(token);
    if (value == null) {
      throw new PddlParseException("expected number, found '" + token + "'",
          pos);
    }
    reader.expect(")");
    end(reader);
    return new Function(name, args, value);
  }

  /** Reads object names up to and including ")". */
  private static List<String> names(PddlReader reader) {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    while (reader.peekChar() != ')') {
      if (reader.atEnd()) {
        throw reader.error("expected ')' but reached end of input");
      }
      names.add(reader.symbol());
    }
    reader.expect(")");
    return names.build();
  }

  private static void end(PddlReader reader) {
    if (!reader.atEnd()) {
      throw reader.error("unexpected text after fact");
    }
  }
}

// End Facts.java
