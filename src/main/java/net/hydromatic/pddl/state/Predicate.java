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
 * Fact that a predicate holds for a list of objects, e.g. {@code (robot_at r1
 * kitchen)}.
 *
 * <p>Two predicates are equal if they have the same name and the same object
 * names in the same order.
 */
public final class Predicate {
  public final String name;
  public final ImmutableList<String> args;

  public Predicate(String name, List<String> args) {
    checkArgument(!name.isEmpty(), "empty predicate name");
    this.name = name;
    this.args = ImmutableList.copyOf(args);
  }

  public static Predicate of(String name, String... args) {
    return new Predicate(name, ImmutableList.copyOf(args));
  }

  /** Creates the fact that a {@link NodeKind#PREDICATE} node refers to. */
  public static Predicate of(Node node) {
    requireNonNull(node);
    checkArgument(node.kind == NodeKind.PREDICATE, "not a predicate: %s", node);
    return new Predicate(node.name, node.parameterNames());
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + args.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Predicate
            && name.equals(((Predicate) o).name)
            && args.equals(((Predicate) o).args);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("(").append(name);
    args.forEach(arg -> b.append(' ').append(arg));
    return b.append(')').toString();
  }
}

// End Predicate.java
