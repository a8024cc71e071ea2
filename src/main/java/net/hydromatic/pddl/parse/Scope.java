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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only sequence of variable bindings.
 *
 * <p>Each binding is a (name, type) pair; its slot is its position in the
 * sequence. A nested scope is made by copying and extending, so a child scope
 * keeps all of its parent's slots at their original indices and an index
 * means the same variable throughout the scope chain.
 */
public final class Scope {
  /** Type of a variable declared without a type. */
  public static final String DEFAULT_TYPE = "object";

  private final List<String> names;
  private final List<String> types;

  /** Creates an empty scope. */
  public Scope() {
    this(new ArrayList<>(), new ArrayList<>());
  }

  private Scope(List<String> names, List<String> types) {
    this.names = names;
    this.types = types;
  }

  /** Creates a scope of untyped variables. */
  public static Scope of(String... names) {
    final Scope scope = new Scope();
    for (String name : names) {
      scope.append(name, DEFAULT_TYPE);
    }
    return scope;
  }

  /** Appends a binding and returns its slot. */
  public int append(String name, String type) {
    names.add(requireNonNull(name));
    types.add(requireNonNull(type));
    return names.size() - 1;
  }

  public int size() {
    return names.size();
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  public String name(int slot) {
    return names.get(slot);
  }

  public String type(int slot) {
    return types.get(slot);
  }

  /** Returns the names of all bindings, in slot order. */
  public List<String> names() {
    return ImmutableList.copyOf(names);
  }

  /**
   * Returns the slot of the innermost binding with a given name, or -1.
   *
   * <p>Inner bindings shadow outer ones because they are appended later.
   */
  public int indexOf(String name) {
    return names.lastIndexOf(name);
  }

  /** Returns a copy of this scope that can be extended independently. */
  public Scope copy() {
    return new Scope(new ArrayList<>(names), new ArrayList<>(types));
  }

  /**
   * Returns a new scope that contains this scope's bindings followed by
   * {@code other}'s. Slot {@code i} of {@code other} becomes slot {@code
   * size() + i} of the result. Neither scope is modified.
   */
  public Scope extend(Scope other) {
    checkArgument(other != this, "cannot extend a scope with itself");
    final Scope scope = copy();
    for (int i = 0; i < other.size(); i++) {
      scope.append(other.name(i), other.type(i));
    }
    return scope;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("[");
    for (int i = 0; i < names.size(); i++) {
      b.append(i > 0 ? ", " : "")
          .append(names.get(i))
          .append(" - ")
          .append(types.get(i));
    }
    return b.append(']').toString();
  }
}

// End Scope.java
