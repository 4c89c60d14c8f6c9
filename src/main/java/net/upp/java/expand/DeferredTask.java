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

package net.upp.java.expand;

import java.util.Comparator;
import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/** A callback registered by {@code atRoot} or {@code inScope}, with the node it is anchored at. */
final class DeferredTask {

  /**
   * Orders tasks so that inner anchors come before the anchors enclosing them, which puts the
   * root last, and tasks sharing an anchor keep their registration order.
   */
  static final Comparator<DeferredTask> ORDER =
      Comparator.<DeferredTask>comparingInt(t -> t.anchor.endOffset())
          .thenComparingInt(t -> -t.anchor.startOffset())
          .thenComparingInt(t -> -t.depth)
          .thenComparingInt(t -> t.sequence);

  final DeferredCallback callback;
  final SyntaxNode anchor;
  @Nullable final MacroInvocation origin;
  final int sequence;
  private final int depth;

  DeferredTask(
      DeferredCallback callback,
      SyntaxNode anchor,
      @Nullable MacroInvocation origin,
      int sequence) {
    this.callback = callback;
    this.anchor = anchor;
    this.origin = origin;
    this.sequence = sequence;
    int d = 0;
    for (SyntaxNode n = anchor.parent(); n != null; n = n.parent()) {
      d++;
    }
    this.depth = d;
  }

  @Override
  public String toString() {
    return "task #" + sequence + " at " + anchor;
  }
}
