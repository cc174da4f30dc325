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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Region of source text from which a {@link Node} was parsed.
 *
 * <p>A span holds the character offsets of its start (inclusive) and end
 * (exclusive) in the source, and the 1-based line and column of each. Nodes
 * created by a compiler pass rather than by the parser have no span.
 */
public class Span {
  public final String file;
  public final int startOffset;
  public final int endOffset;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Span. */
  public Span(String file, int startOffset, int endOffset, int startLine,
      int startColumn, int endLine, int endColumn) {
    checkArgument(startOffset >= 0 && startOffset <= endOffset,
        "invalid offsets [%s, %s)", startOffset, endOffset);
    this.file = requireNonNull(file);
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Span from two offsets into a source string, computing the
   * line and column of each. */
  public static Span of(String source, String file, int startOffset,
      int endOffset) {
    final int[] start = lineCol(source, startOffset);
    final int[] end = lineCol(source, endOffset);
    return new Span(file, startOffset, endOffset, start[0], start[1], end[0],
        end[1]);
  }

  /** Creates a Span in a source string that has no file name. */
  public static Span of(String source, int startOffset, int endOffset) {
    return of(source, "", startOffset, endOffset);
  }

  @Override public int hashCode() {
    return Objects.hash(file, startOffset, endOffset);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Span
        && this.file.equals(((Span) o).file)
        && this.startOffset == ((Span) o).startOffset
        && this.endOffset == ((Span) o).endOffset
        && this.startLine == ((Span) o).startLine
        && this.startColumn == ((Span) o).startColumn
        && this.endLine == ((Span) o).endLine
        && this.endColumn == ((Span) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /** Returns the length of this span, in characters. */
  public int length() {
    return endOffset - startOffset;
  }

  /** Returns the text that this span covers in a given source string. */
  public String text(String source) {
    return source.substring(startOffset, endOffset);
  }

  /** Returns the smallest span that covers both this and another span. */
  public Span plus(Span span) {
    checkArgument(file.equals(span.file),
        "cannot combine spans from different files: %s, %s", this, span);
    final Span first = span.startOffset < startOffset ? span : this;
    final Span last = span.endOffset > endOffset ? span : this;
    return new Span(file, first.startOffset, last.endOffset, first.startLine,
        first.startColumn, last.endLine, last.endColumn);
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    int i;
    final int n = Math.min(s.length(), offset);
    for (i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    if (i == offset) {
      return new int[] {line, offset - lineStart + 1};
    } else {
      throw new IllegalArgumentException("offset " + offset
          + " is beyond end of source (length " + s.length() + ")");
    }
  }
}

// End Span.java
