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
package net.hydromatic.newtype.ast;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link Span}. */
class SpanTest {
  private static final String SOURCE = "type A =\n  if X <: Y then 1";

  @Test void testLineAndColumn() {
    final Span span = Span.of(SOURCE, 11, 13);
    assertThat(span.startLine, is(2));
    assertThat(span.startColumn, is(3));
    assertThat(span.endLine, is(2));
    assertThat(span.endColumn, is(5));
    assertThat(span.length(), is(2));
    assertThat(span.text(SOURCE), is("if"));
    assertThat(span, hasToString("2.3-2.5"));
  }

  @Test void testToString() {
    assertThat(Span.of(SOURCE, 0, 4), hasToString("1.1-1.5"));
    assertThat(Span.of(SOURCE, "a.nt", 0, 4), hasToString("a.nt:1.1-1.5"));

    // A span of one character shows only its start
    assertThat(Span.of(SOURCE, 5, 6), hasToString("1.6"));

    // A span that crosses a line
    assertThat(Span.of(SOURCE, 5, 13), hasToString("1.6-2.5"));
  }

  @Test void testPlus() {
    final Span type = Span.of(SOURCE, 0, 4);
    final Span ifKeyword = Span.of(SOURCE, 11, 13);
    final Span both = type.plus(ifKeyword);
    assertThat(both, hasToString("1.1-2.5"));
    assertThat(both.text(SOURCE), is("type A =\n  if"));
    assertThat(ifKeyword.plus(type), is(both));

    final Span other = Span.of(SOURCE, "b.nt", 0, 4);
    assertThrows(IllegalArgumentException.class, () -> type.plus(other));
  }

  @Test void testInvalid() {
    assertThrows(IllegalArgumentException.class,
        () -> Span.of("abc", 0, 4));
    assertThrows(IllegalArgumentException.class,
        () -> Span.of("abc", 2, 1));
  }

  @Test void testEquals() {
    assertThat(Span.of(SOURCE, 0, 4), is(Span.of(SOURCE, 0, 4)));
    assertThat(Span.of(SOURCE, 0, 4).equals(Span.of(SOURCE, 0, 5)),
        is(false));
    assertThat(Span.of(SOURCE, 0, 4).equals(Span.of(SOURCE, "x", 0, 4)),
        is(false));
  }
}

// End SpanTest.java
