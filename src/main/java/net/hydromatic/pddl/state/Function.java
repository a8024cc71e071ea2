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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.pddl.tree.Node;
import net.hydromatic.pddl.tree.NodeKind;

/**
 * Numeric fluent: a function applied to a list of objects, and its value,
 * e.g. {@code (= (battery r1) 80)}.
 *
 * <p>Identity is (name, object names); the value does not take part in
 * {@link #equals} or {@link #hashCode}, so a function can be located in a
 * collection regardless of its current value.
 */
public final class Function {
  public final String name;
  public final ImmutableList<String> args;
  public final double value;

  public Function(String name, List<String> args, double value) {
    checkArgument(!name.isEmpty(), "empty function name");
    this.name = name;
    this.args = ImmutableList.copyOf(args);
    this.value = value;
  }

  public static Function of(String name, double value, String... args) {
    return new Function(name, ImmutableList.copyOf(args), value);
  }

  /**
   * Creates the function that a {@link NodeKind#FUNCTION} node refers to,
   * with value 0.
   */
  public static Function of(Node node) {
    requireNonNull(node);
    checkArgument(node.kind == NodeKind.FUNCTION, "not a function: %s", node);
    return new Function(node.name, node.parameterNames(), 0D);
  }

  /** Returns a copy of this function with a different value. */
  public Function withValue(double value) {
    return new Function(name, args, value);
  }

  /** Returns the reference to this function, e.g. {@code (battery r1)}. */
  public String reference() {
    final StringBuilder b = new StringBuilder("(").append(name);
    args.forEach(arg -> b.append(' ').append(arg));
    return b.append(')').toString();
  }

  /** Returns the assignment, e.g. {@code (= (battery r1) 80.0)}. */
  @Override
  public String toString() {
    return "(= " + reference() + " " + value + ")";
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + args.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Function
            && name.equals(((Function) o).name)
            && args.equals(((Function) o).args);
  }
}

// End Function.java
