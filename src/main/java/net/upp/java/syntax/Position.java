// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.upp.java.syntax;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * A zero-based row/column position in a source text, as used to describe edits to the incremental
 * parser. Columns count chars, not bytes.
 */
@AutoValue
public abstract class Position implements Comparable<Position> {

  public static final Position START = create(0, 0);

  public abstract int row();

  public abstract int column();

  public static Position create(int row, int column) {
    Preconditions.checkArgument(row >= 0 && column >= 0, "negative position %s:%s", row, column);
    return new AutoValue_Position(row, column);
  }

  /**
   * Computes the position of {@code offset} within {@code text}. Offsets past the end of the text
   * are clamped to its length.
   */
  public static Position of(CharSequence text, int offset) {
    int row = 0;
    int column = 0;
    int end = Math.min(offset, text.length());
    for (int i = 0; i < end; i++) {
      if (text.charAt(i) == '\n') {
        row++;
        column = 0;
      } else {
        column++;
      }
    }
    return create(row, column);
  }

  @Override
  public int compareTo(Position that) {
    int cmp = Integer.compare(row(), that.row());
    return cmp != 0 ? cmp : Integer.compare(column(), that.column());
  }

  @Override
  public final String toString() {
    // One-based, for humans.
    return (row() + 1) + ":" + (column() + 1);
  }
}
