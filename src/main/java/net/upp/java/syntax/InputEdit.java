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
 * Describes one splice of a source text, in the form the incremental parser needs: the changed
 * range before the edit ({@code [startIndex, oldEndIndex)}) and after it ({@code [startIndex,
 * newEndIndex)}), as offsets and as positions.
 */
@AutoValue
public abstract class InputEdit {

  public abstract int startIndex();

  public abstract int oldEndIndex();

  public abstract int newEndIndex();

  public abstract Position startPosition();

  public abstract Position oldEndPosition();

  public abstract Position newEndPosition();

  /** Returns the change in length caused by this edit. */
  public int delta() {
    return newEndIndex() - oldEndIndex();
  }

  /**
   * Maps an offset of the text before this edit to the corresponding offset after it, or returns -1
   * if the offset lies strictly inside the replaced range. A start offset at a pure insertion
   * point moves right with the inserted text; an end offset there stays put.
   */
  int mapOffset(int offset, boolean isEnd) {
    if (offset < startIndex()) {
      return offset;
    }
    if (isEnd && offset == startIndex()) {
      return offset;
    }
    if (!isEnd && offset == startIndex() && startIndex() < oldEndIndex()) {
      return offset;
    }
    if (offset >= oldEndIndex()) {
      return offset + delta();
    }
    return -1;
  }

  public static InputEdit create(
      int startIndex,
      int oldEndIndex,
      int newEndIndex,
      Position startPosition,
      Position oldEndPosition,
      Position newEndPosition) {
    Preconditions.checkArgument(
        0 <= startIndex && startIndex <= oldEndIndex && startIndex <= newEndIndex,
        "invalid edit range [%s, %s) -> [%s, %s)",
        startIndex,
        oldEndIndex,
        startIndex,
        newEndIndex);
    return new AutoValue_InputEdit(
        startIndex, oldEndIndex, newEndIndex, startPosition, oldEndPosition, newEndPosition);
  }

  /** Describes replacing {@code [start, oldEnd)} of {@code before} to produce {@code after}. */
  public static InputEdit between(String before, String after, int start, int oldEnd, int newEnd) {
    return create(
        start,
        oldEnd,
        newEnd,
        Position.of(before, start),
        Position.of(before, oldEnd),
        Position.of(after, newEnd));
  }
}
