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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/**
 * A node of a compiled pattern: either a {@link Wildcard}, or a literal node that must match a
 * target node of the same type with matching children (or, for a leaf, the same text).
 */
public final class PatternNode {

  @Nullable private final Wildcard wildcard;
  private final String type;
  private final boolean named;
  private final String text;
  private final ImmutableList<PatternNode> children;

  private PatternNode(
      @Nullable Wildcard wildcard,
      String type,
      boolean named,
      String text,
      ImmutableList<PatternNode> children) {
    this.wildcard = wildcard;
    this.type = type;
    this.named = named;
    this.text = text;
    this.children = children;
  }

  static PatternNode literal(SyntaxNode node, ImmutableList<PatternNode> children) {
    return new PatternNode(null, node.type(), node.isNamed(), node.text(), children);
  }

  static PatternNode wildcard(Wildcard wildcard, SyntaxNode node) {
    return new PatternNode(wildcard, node.type(), node.isNamed(), node.text(), ImmutableList.of());
  }

  public boolean isWildcard() {
    return wildcard != null;
  }

  /** Returns the wildcard of a wildcard node. */
  public Wildcard wildcard() {
    Preconditions.checkState(wildcard != null, "not a wildcard: %s", this);
    return wildcard;
  }

  /** Returns the type of the pattern syntax this node was compiled from. */
  public String type() {
    return type;
  }

  public boolean isNamed() {
    return named;
  }

  public String text() {
    return text;
  }

  /** Returns the children, comments excluded. */
  public ImmutableList<PatternNode> children() {
    return children;
  }

  @Override
  public String toString() {
    if (wildcard != null) {
      return wildcard.toString();
    }
    if (children.isEmpty()) {
      return named ? "(" + type + " " + text + ")" : "\"" + text + "\"";
    }
    StringBuilder buf = new StringBuilder("(").append(type);
    for (PatternNode child : children) {
      buf.append(' ').append(child);
    }
    return buf.append(')').toString();
  }
}
