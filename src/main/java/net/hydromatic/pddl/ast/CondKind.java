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

/** Kind of a {@link Cond}. */
public enum CondKind {
  AND,
  OR,
  NOT,
  EXISTS,
  /** Predicate applied to terms, e.g. {@code (robot_at ?r kitchen)}. */
  ATOM,
  COMPARISON,
  MODIFIER,
  NUMBER,
  FUNCTION,
  ARITHMETIC,
  VARIABLE,
  CONSTANT;

  /** Whether this kind is a numeric or symbolic term, printed inline. */
  public boolean isTerm() {
    switch (this) {
      case NUMBER:
      case FUNCTION:
      case ARITHMETIC:
      case VARIABLE:
      case CONSTANT:
        return true;
      default:
        return false;
    }
  }
}

// End CondKind.java
