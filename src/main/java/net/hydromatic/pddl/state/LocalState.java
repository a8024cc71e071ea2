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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * In-memory snapshot of predicates and functions.
 *
 * <p>Not thread-safe. Callers that share one snapshot between evaluations
 * must serialize access.
 */
public final class LocalState implements StateBackend {
  private final List<Predicate> predicates;
  private final List<Function> functions;

  /** Creates an empty state. */
  public LocalState() {
    this(ImmutableList.of(), ImmutableList.of());
  }

  /** Creates a state holding copies of the given facts. */
  public LocalState(List<Predicate> predicates, List<Function> functions) {
    this.predicates = new ArrayList<>();
    this.functions = new ArrayList<>();
    predicates.forEach(this::add);
    functions.forEach(this::putFunction);
  }

  /** Returns the predicates that currently hold, in insertion order. */
  public List<Predicate> predicates() {
    return Collections.unmodifiableList(predicates);
  }

  /** Returns the functions and their current values. */
  public List<Function> functions() {
    return Collections.unmodifiableList(functions);
  }

  /** Defines a function, or changes the value of an existing one. */
  public LocalState putFunction(Function function) {
    final int i = functions.indexOf(requireNonNull(function));
    if (i >= 0) {
      functions.set(i, function);
    } else {
      functions.add(function);
    }
    return this;
  }

  @Override
  public boolean exists(Predicate predicate) {
    return predicates.contains(predicate);
  }

  @Override
  public boolean add(Predicate predicate) {
    if (!predicates.contains(requireNonNull(predicate))) {
      predicates.add(predicate);
    }
    return true;
  }

  @Override
  public boolean remove(Predicate predicate) {
    predicates.remove(predicate);
    return true;
  }

  @Override
  public @Nullable Double readFunction(Function function) {
    final int i = functions.indexOf(function);
    return i >= 0 ? functions.get(i).value : null;
  }

  /** Updates an existing function; returns false if it is not defined. */
  @Override
  public boolean writeFunction(Function assignment) {
    final int i = functions.indexOf(assignment);
    if (i < 0) {
      return false;
    }
    functions.set(i, assignment);
    return true;
  }

  /**
   * Returns every distinct object that is an argument of a predicate that
   * currently holds, in order of first appearance.
   */
  @Override
  public List<String> objects() {
    final Set<String> objects = new LinkedHashSet<>();
    for (Predicate predicate : predicates) {
      objects.addAll(predicate.args);
    }
    return ImmutableList.copyOf(objects);
  }

  @Override
  public String toString() {
    return "LocalState{predicates=" + predicates
        + ", functions=" + functions + "}";
  }
}

// End LocalState.java
