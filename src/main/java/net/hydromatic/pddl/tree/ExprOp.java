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
package net.hydromatic.pddl.tree;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Operator of an {@link NodeKind#EXPRESSION} node. */
public enum ExprOp {
  COMP_GE(">=", true),
  COMP_GT(">", true),
  COMP_LE("<=", true),
  COMP_LT("<", true),
  COMP_EQ("=", true),
  ARITH_MULT("*", false),
  ARITH_DIV("/", false),
  ARITH_ADD("+", false),
  ARITH_SUB("-", false);

  /** PDDL spelling of the operator. */
  public final String symbol;

  /** Whether the operator yields a truth value rather than a number. */
  public final boolean comparison;

  private static final ImmutableMap<String, ExprOp> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, ExprOp> b = ImmutableMap.builder();
    for (ExprOp op : values()) {
      b.put(op.symbol, op);
    }
    BY_SYMBOL = b.build();
  }

  ExprOp(String symbol, boolean comparison) {
    this.symbol = symbol;
    this.comparison = comparison;
  }

  /** Returns the operator with a given symbol, or null. */
  public static @Nullable ExprOp lookup(String symbol) {
    return BY_SYMBOL.get(symbol);
  }

  @Override
  public String toString() {
    return symbol;
  }
}

// End ExprOp.java
