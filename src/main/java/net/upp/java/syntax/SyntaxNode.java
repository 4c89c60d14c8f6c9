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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * A node of a concrete syntax tree.
 *
 * <p>Every token and every construct of the source is a node. Named nodes carry a grammar type
 * such as {@code call_expression} or {@code identifier}; anonymous nodes are punctuation and
 * keywords, and their type is their own text. A node's range {@code [startOffset, endOffset)}
 * indexes the source text of its tree.
 *
 * <p>Nodes are immutable once their tree is built. Each node has an id that is unique within the
 * process; the incremental parser gives a node the id of its counterpart in the previous tree when
 * the node survived the edit.
 */
public final class SyntaxNode {

  private static final AtomicInteger nextId = new AtomicInteger(1);

  /** Type of the nodes the parser creates for input it cannot parse. */
  public static final String ERROR = "ERROR";

  private final String type;
  private final boolean named;
  private final int start;
  private final int end;
  private final ImmutableList<SyntaxNode> children;
  private final String source;
  private final int sourceOffset;
  private final int id;
  private final boolean hasError;

  // Set once, while the enclosing node or tree is being assembled.
  @Nullable private String fieldName;
  @Nullable private SyntaxNode parent;
  private int indexInParent = -1;

  SyntaxNode(
      String type,
      boolean named,
      int start,
      int end,
      List<SyntaxNode> children,
      String source,
      int sourceOffset,
      int id) {
    Preconditions.checkArgument(start <= end, "bad range [%s, %s) for %s", start, end, type);
    this.type = type;
    this.named = named;
    this.start = start;
    this.end = end;
    this.children = ImmutableList.copyOf(children);
    this.source = source;
    this.sourceOffset = sourceOffset;
    this.id = id;
    boolean err = type.equals(ERROR);
    for (int i = 0; i < this.children.size(); i++) {
      SyntaxNode child = this.children.get(i);
      Preconditions.checkState(child.parent == null, "node %s already has a parent", child);
      child.parent = this;
      child.indexInParent = i;
      err |= child.hasError;
    }
    this.hasError = err;
  }

  /** Allocates a fresh node id. */
  static int newId() {
    return nextId.getAndIncrement();
  }

  /**
   * Returns a node that belongs to no tree, spanning {@code [start, start + text.length())} and
   * reading its text from {@code text}. Such nodes stand in for source that has already been
   * removed from the document, for example an invocation taken out of the text.
   */
  public static SyntaxNode detached(String type, int start, String text) {
    return new SyntaxNode(
        type, true, start, start + text.length(), ImmutableList.of(), text, start, newId());
  }

  void setFieldName(String fieldName) {
    Preconditions.checkState(parent == null, "field name set after attaching %s", this);
    this.fieldName = fieldName;
  }

  public String type() {
    return type;
  }

  public boolean isNamed() {
    return named;
  }

  /** Returns the field under which this node appears in its parent, or null. */
  @Nullable
  public String fieldName() {
    return fieldName;
  }

  public int id() {
    return id;
  }

  public int startOffset() {
    return start;
  }

  public int endOffset() {
    return end;
  }

  public Position startPosition() {
    return Position.of(source, start - sourceOffset);
  }

  public Position endPosition() {
    return Position.of(source, end - sourceOffset);
  }

  /** Returns the source text spanned by this node. */
  public String text() {
    return source.substring(start - sourceOffset, end - sourceOffset);
  }

  /**
   * Returns the source text from the start of {@code first} to the end of {@code last}, which must
   * index the same source.
   */
  public static String spanText(SyntaxNode first, SyntaxNode last) {
    Preconditions.checkArgument(first.source == last.source, "nodes of different sources");
    Preconditions.checkArgument(first.start <= last.end, "%s ends before %s", last, first);
    return first.source.substring(first.start - first.sourceOffset, last.end - first.sourceOffset);
  }

  /** Returns the complete source text this node indexes. */
  String source() {
    return source;
  }

  public boolean isError() {
    return type.equals(ERROR);
  }

  /** Returns true if this node is or contains an {@code ERROR} node. */
  public boolean hasError() {
    return hasError;
  }

  public boolean isComment() {
    return type.equals("comment");
  }

  @Nullable
  public SyntaxNode parent() {
    return parent;
  }

  /** Returns the topmost ancestor of this node (possibly itself). */
  public SyntaxNode root() {
    SyntaxNode n = this;
    while (n.parent != null) {
      n = n.parent;
    }
    return n;
  }

  public ImmutableList<SyntaxNode> children() {
    return children;
  }

  public int childCount() {
    return children.size();
  }

  /** Returns the ith child, or null if there is none. */
  @Nullable
  public SyntaxNode child(int i) {
    return i >= 0 && i < children.size() ? children.get(i) : null;
  }

  public ImmutableList<SyntaxNode> namedChildren() {
    ImmutableList.Builder<SyntaxNode> named = ImmutableList.builder();
    for (SyntaxNode child : children) {
      if (child.named) {
        named.add(child);
      }
    }
    return named.build();
  }

  public int namedChildCount() {
    int n = 0;
    for (SyntaxNode child : children) {
      if (child.named) {
        n++;
      }
    }
    return n;
  }

  /** Returns the ith named child, or null if there is none. */
  @Nullable
  public SyntaxNode namedChild(int i) {
    for (SyntaxNode child : children) {
      if (child.named && i-- == 0) {
        return child;
      }
    }
    return null;
  }

  @Nullable
  public SyntaxNode firstNamedChild() {
    return namedChild(0);
  }

  @Nullable
  public SyntaxNode lastNamedChild() {
    for (SyntaxNode child : children.reverse()) {
      if (child.named) {
        return child;
      }
    }
    return null;
  }

  /** Returns the first child with the given field name, or null. */
  @Nullable
  public SyntaxNode childByFieldName(String name) {
    for (SyntaxNode child : children) {
      if (name.equals(child.fieldName)) {
        return child;
      }
    }
    return null;
  }

  /** Returns all children with the given field name. */
  public ImmutableList<SyntaxNode> childrenByFieldName(String name) {
    ImmutableList.Builder<SyntaxNode> result = ImmutableList.builder();
    for (SyntaxNode child : children) {
      if (name.equals(child.fieldName)) {
        result.add(child);
      }
    }
    return result.build();
  }

  @Nullable
  public SyntaxNode nextSibling() {
    return parent == null ? null : parent.child(indexInParent + 1);
  }

  @Nullable
  public SyntaxNode prevSibling() {
    return parent == null ? null : parent.child(indexInParent - 1);
  }

  @Nullable
  public SyntaxNode nextNamedSibling() {
    if (parent == null) {
      return null;
    }
    for (int i = indexInParent + 1; i < parent.children.size(); i++) {
      if (parent.children.get(i).named) {
        return parent.children.get(i);
      }
    }
    return null;
  }

  @Nullable
  public SyntaxNode prevNamedSibling() {
    if (parent == null) {
      return null;
    }
    for (int i = indexInParent - 1; i >= 0; i--) {
      if (parent.children.get(i).named) {
        return parent.children.get(i);
      }
    }
    return null;
  }

  /** Returns true if this node is {@code other} or one of its descendants. */
  public boolean isDescendantOf(SyntaxNode other) {
    for (SyntaxNode n = this; n != null; n = n.parent) {
      if (n == other) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if {@code [start, end)} lies within this node's range. */
  public boolean covers(int start, int end) {
    return this.start <= start && end <= this.end;
  }

  /** Returns the smallest node within this subtree that spans {@code [start, end)}. */
  @Nullable
  public SyntaxNode descendantForRange(int start, int end) {
    return descendantForRange(start, end, false);
  }

  /** Returns the smallest named node within this subtree that spans {@code [start, end)}. */
  @Nullable
  public SyntaxNode namedDescendantForRange(int start, int end) {
    return descendantForRange(start, end, true);
  }

  @Nullable
  private SyntaxNode descendantForRange(int start, int end, boolean namedOnly) {
    if (!covers(start, end)) {
      return null;
    }
    SyntaxNode node = this;
    outer:
    while (true) {
      for (SyntaxNode child : node.children) {
        // A zero-width query at a child boundary belongs to the child that starts there.
        boolean contains =
            child.covers(start, end)
                && !(start == end && child.end == start && child.start < start);
        if (contains
            && (child.named || !namedOnly || child.hasNamedDescendantCovering(start, end))) {
          node = child;
          continue outer;
        }
      }
      return node;
    }
  }

  private boolean hasNamedDescendantCovering(int start, int end) {
    for (SyntaxNode child : children) {
      if (child.covers(start, end)
          && (child.named || child.hasNamedDescendantCovering(start, end))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the tree in s-expression form, listing named nodes only, with field names, for example
   * {@code (expression_statement (call_expression function: (identifier) arguments:
   * (argument_list)))}.
   */
  public String toSExpression() {
    StringBuilder buf = new StringBuilder();
    appendSExpression(buf);
    return buf.toString();
  }

  private void appendSExpression(StringBuilder buf) {
    buf.append('(').append(type);
    for (SyntaxNode child : children) {
      if (!child.named) {
        continue;
      }
      buf.append(' ');
      if (child.fieldName != null) {
        buf.append(child.fieldName).append(": ");
      }
      child.appendSExpression(buf);
    }
    buf.append(')');
  }

  @Override
  public String toString() {
    return type + "@" + start + ".." + end;
  }
}
