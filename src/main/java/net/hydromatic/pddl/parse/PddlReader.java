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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads tokens from PDDL text.
 *
 * <p>Tokens are "(", ")" and runs of characters delimited by white space or
 * parentheses. Comments run from ";" to the end of the line. Symbols are
 * converted to lower case, because PDDL is case-insensitive.
 */
public class PddlReader {
  private final String text;
  private final String file;
  private int offset;

  public PddlReader(String text) {
    this(text, "");
  }

  public PddlReader(String text, String file) {
    this.text = requireNonNull(text);
    this.file = requireNonNull(file);
  }

  /** Skips white space and comments. */
  public void skipSpace() {
    while (offset < text.length()) {
      final char c = text.charAt(offset);
      if (c == ';') {
        while (offset < text.length() && text.charAt(offset) != '\n') {
          ++offset;
        }
      } else if (Character.isWhitespace(c)) {
        ++offset;
      } else {
        return;
      }
    }
  }

  /** Whether only white space and comments remain. */
  public boolean atEnd() {
    skipSpace();
    return offset >= text.length();
  }

  /**
   * Returns the next non-space character without consuming it, or 0 at the
   * end of the text.
   */
  public char peekChar() {
    skipSpace();
    return offset < text.length() ? text.charAt(offset) : 0;
  }

  /** Reads the next token. */
  public String token() {
    skipSpace();
    if (offset >= text.length()) {
      throw error("unexpected end of input");
    }
    final char c = text.charAt(offset);
    if (c == '(' || c == ')') {
      ++offset;
      return String.valueOf(c);
    }
    final int start = offset;
    while (offset < text.length()) {
      final char d = text.charAt(offset);
      if (d == '(' || d == ')' || d == ';' || Character.isWhitespace(d)) {
        break;
      }
      ++offset;
    }
    return text.substring(start, offset).toLowerCase(Locale.ROOT);
  }

  /** Reads a token and throws if it is not the expected one. */
  public void expect(String expected) {
    final Pos pos = pos();
    if (atEnd()) {
      throw new PddlParseException(
          "expected '" + expected + "' but reached end of input", pos);
    }
    final String actual = token();
    if (!actual.equals(expected)) {
      throw new PddlParseException(
          "expected '" + expected + "' but found '" + actual + "'", pos);
    }
  }

  /** Reads a symbol; throws if the next token is a parenthesis. */
  public String symbol() {
    final Pos pos = pos();
    final String token = token();
    if (token.equals("(") || token.equals(")")) {
      throw new PddlParseException(
          "expected symbol, found '" + token + "'", pos);
    }
    return token;
  }

  /**
   * Reads a typed list such as {@code ?r - robot ?a ?b - room ?o} up to and
   * including the closing parenthesis. Names without a type get {@link
   * Scope#DEFAULT_TYPE}.
   *
   * @param variables Whether every name must be a variable ("?x")
   */
  public Scope typedList(boolean variables) {
    final List<String> names = new ArrayList<>();
    final List<String> types = new ArrayList<>();
    for (;;) {
      final Pos pos = pos();
      final String token = token();
      switch (token) {
        case ")":
          final Scope scope = new Scope();
          for (int i = 0; i < names.size(); i++) {
            scope.append(
                names.get(i),
                i < types.size() ? types.get(i) : Scope.DEFAULT_TYPE);
          }
          return scope;
        case "(":
          throw new PddlParseException("unexpected '(' in typed list", pos);
        case "-":
          if (types.size() == names.size()) {
            throw new PddlParseException("type without names", pos);
          }
          final String type = symbol();
          while (types.size() < names.size()) {
            types.add(type);
          }
          break;
        default:
          if (variables && !token.startsWith("?")) {
            throw new PddlParseException(
                "expected variable, found '" + token + "'", pos);
          }
          names.add(token);
      }
    }
  }

  /** Returns the position of the next token. */
  public Pos pos() {
    skipSpace();
    return Pos.of(text, file, offset);
  }

  /** Creates an exception at the current position. */
  public PddlParseException error(String message) {
    return new PddlParseException(message, Pos.of(text, file, offset));
  }
}

// End PddlReader.java
