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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Parameter binding of a {@link Node}.
 *
 * <p>A parameter is either resolved, in which case {@link #name} is the name
 * of an object or constant, or unbound, in which case {@link #name} is a
 * placeholder of the form {@code ?<slot>} that refers to a slot of the
 * variable scope in which the condition was parsed.
 */
public final class Param {
  /** Prefix of the name of an unbound parameter. */
  public static final String UNBOUND_PREFIX = "?";

  public final String name;
  public final String type;

  public Param(String name, String type) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
  }

  /** Creates a resolved parameter with no type. */
  public static Param of(String name) {
    return new Param(name, "");
  }

  /** Creates an unbound parameter that refers to a scope slot. */
  public static Param unbound(int slot, String type) {
    return new Param(placeholder(slot), type);
  }

  /** Returns the placeholder name for a scope slot, e.g. "?3". */
  public static String placeholder(int slot) {
    return UNBOUND_PREFIX + slot;
  }

  /** Whether this parameter is still a placeholder. */
  public boolean isUnbound() {
    return name.startsWith(UNBOUND_PREFIX);
  }

  /** Returns a copy of this parameter with a different name. */
  public Param withName(String name) {
    return name.equals(this.name) ? this : new Param(name, type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Param
            && name.equals(((Param) o).name)
            && type.equals(((Param) o).type);
  }

  @Override
  public String toString() {
    return type.isEmpty() ? name : name + " - " + type;
  }
}

// End Param.java
