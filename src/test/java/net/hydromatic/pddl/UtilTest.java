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
package net.hydromatic.pddl;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.pddl.eval.Prop;
import net.hydromatic.pddl.util.ActionString;
import org.junit.jupiter.api.Test;

/** Tests {@link ActionString} and {@link Prop}. */
public class UtilTest {
  @Test
  void testActionString() {
    final ActionString a =
        ActionString.parse("(move r2d2 kitchen bedroom):5");
    assertThat(a.expression, is("move r2d2 kitchen bedroom"));
    assertThat(a.name, is("move"));
    assertThat(a.params, contains("r2d2", "kitchen", "bedroom"));
    assertThat(a.time, is(5));
    assertThat(a, hasToString("(move r2d2 kitchen bedroom):5"));

    final ActionString b = ActionString.parse(" ( Charge \t R2D2 ) ");
    assertThat(b.name, is("charge"));
    assertThat(b.params, contains("r2d2"));
    assertThat(b.time, is(-1));
    assertThat(b, hasToString("(charge r2d2)"));

    final ActionString c = ActionString.parse("(wait) : 12");
    assertThat(c.name, is("wait"));
    assertThat(c.params, empty());
    assertThat(c.time, is(12));
  }

  @Test
  void testActionStringErrors() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> ActionString.parse("(move r2d2):soon"));
    assertThat(e.getMessage(), is("invalid time in '(move r2d2):soon'"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> ActionString.parse("move r2d2"));
    assertThat(e2.getMessage(),
        is("expected '(name args...)', found 'move r2d2'"));
    assertThrows(IllegalArgumentException.class,
        () -> ActionString.parse("()"));
  }

  @Test
  void testReduce() {
    assertThat(ActionString.reduce(" ( Move  R2D2 ) "), is("(move r2d2)"));
    assertThat(ActionString.reduce("(a\n(b  c) )"), is("(a (b c))"));
  }

  @Test
  void testPropLookup() {
    assertThat(Prop.lookup("groundingLimit"), is(Prop.GROUNDING_LIMIT));
    assertThat(Prop.lookup("GROUNDING_LIMIT"), is(Prop.GROUNDING_LIMIT));
    assertThat(Prop.lookup("divisionEpsilon"), is(Prop.DIVISION_EPSILON));
    assertThat(Prop.BY_CAMEL_NAME,
        contains(Prop.DIVISION_EPSILON, Prop.GROUNDING_LIMIT));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("fooBar"));
    assertThat(e.getMessage(), is("property fooBar not found"));
  }

  @Test
  void testPropValues() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.DIVISION_EPSILON.doubleValue(map), is(1e-5));
    assertThat(Prop.GROUNDING_LIMIT.intValue(map), is(-1));

    Prop.DIVISION_EPSILON.setLenient(map, "1e-3");
    assertThat(Prop.DIVISION_EPSILON.doubleValue(map), is(1e-3));
    Prop.GROUNDING_LIMIT.setLenient(map, " 100 ");
    assertThat(Prop.GROUNDING_LIMIT.intValue(map), is(100));
    Prop.GROUNDING_LIMIT.set(map, 7);
    assertThat(Prop.GROUNDING_LIMIT.get(map), is(7));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.GROUNDING_LIMIT.setLenient(map, "many"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.GROUNDING_LIMIT.set(map, "7"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.GROUNDING_LIMIT.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.GROUNDING_LIMIT.doubleValue(map));

    assertThat(Prop.GROUNDING_LIMIT.remove(map), is(7));
    assertThat(Prop.GROUNDING_LIMIT.remove(map), nullValue());
    assertThat(Prop.GROUNDING_LIMIT.intValue(map), is(-1));
  }
}

// End UtilTest.java
