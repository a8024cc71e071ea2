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

/** Operator of a {@link NodeKind#FUNCTION_MODIFIER} node. */
public enum ModifierOp {
  ASSIGN("assign"),
  INCREASE("increase"),
  DECREASE("decrease"),
  SCALE_UP("scale-up"),
  SCALE_DOWN("scale-down");

  /** PDDL keyword. */
  public final String keyword;

  private static final ImmutableMap<String, ModifierOp> BY_KEYWORD;

  static {
    final ImmutableMap.Builder<String, ModifierOp> b = ImmutableMap.builder();
    for (ModifierOp op : values()) {
      b.put(op.keyword, op);
    }
    BY_KEYWORD = b.build();
  }

  ModifierOp(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the modifier with a given keyword, or null. */
  public static @Nullable ModifierOp lookup(String keyword) {
    return BY_KEYWORD.get(keyword);
  }

  @Override
  public String toString() {
    return keyword;
  }
}

// End ModifierOp.java
