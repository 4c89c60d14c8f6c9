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

package net.upp.java.pattern;

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/**
 * What one wildcard bound to: a single node, or (for variadic wildcards) a run of sibling nodes.
 * A run keeps its raw slice of siblings, punctuation included, and exposes its named nodes
 * separately.
 */
public final class Capture {

  private final ImmutableList<SyntaxNode> raw;
  private final boolean sequence;

  private Capture(ImmutableList<SyntaxNode> raw, boolean sequence) {
    this.raw = raw;
    this.sequence = sequence;
  }

  static Capture single(SyntaxNode node) {
    return new Capture(ImmutableList.of(node), false);
  }

  static Capture sequence(ImmutableList<SyntaxNode> raw) {
    return new Capture(raw, true);
  }

  public boolean isSequence() {
    return sequence;
  }

  /** Returns the node of a single capture, or the first named node of a sequence, or null. */
  @Nullable
  public SyntaxNode node() {
    if (!sequence) {
      return raw.get(0);
    }
    ImmutableList<SyntaxNode> named = nodes();
    return named.isEmpty() ? null : named.get(0);
  }

  /** Returns the captured named nodes; a single capture yields a one-element list. */
  public ImmutableList<SyntaxNode> nodes() {
    if (!sequence) {
      return raw;
    }
    ImmutableList.Builder<SyntaxNode> named = ImmutableList.builder();
    for (SyntaxNode n : raw) {
      if (n.isNamed()) {
        named.add(n);
      }
    }
    return named.build();
  }

  /** Returns every captured sibling, anonymous tokens included. */
  public ImmutableList<SyntaxNode> rawNodes() {
    return raw;
  }

  /** Returns the source text spanned by the capture; empty for an empty sequence. */
  public String text() {
    if (raw.isEmpty()) {
      return "";
    }
    return SyntaxNode.spanText(raw.get(0), raw.get(raw.size() - 1));
  }

  /** Returns the source range {@code [start, end)} of a non-empty capture. */
  public int startOffset() {
    return raw.isEmpty() ? -1 : raw.get(0).startOffset();
  }

  public int endOffset() {
    return raw.isEmpty() ? -1 : raw.get(raw.size() - 1).endOffset();
  }

  @Override
  public String toString() {
    return sequence ? nodes().toString() : raw.get(0).toString();
  }
}
