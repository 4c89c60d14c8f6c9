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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.upp.java.syntax.Position;
import net.upp.java.syntax.SyntaxNode;

/**
 * The read-only view of a syntax node handed to macro code. A context creates one view per node,
 * so views may be compared with {@code ==}.
 *
 * <p>Navigation forwards to the node and wraps the result. Moving up the tree with {@link
 * #parent} or {@link #root} reports a one-time advisory: a macro that needs to edit code outside
 * its invocation should do so from {@link ExpansionContext#atRoot} or {@link
 * ExpansionContext#inScope}.
 *
 * <p>{@link #text} is the current text of the node's document, in which invocations expanded
 * earlier in the pass are blank.
 */
public final class NodeView {

  private final SyntaxNode node;
  private final ExpansionContext ctx;

  NodeView(SyntaxNode node, ExpansionContext ctx) {
    this.node = node;
    this.ctx = ctx;
  }

  /** Returns the underlying node. */
  public SyntaxNode unwrap() {
    return node;
  }

  public String type() {
    return node.type();
  }

  public String text() {
    return ctx.textOf(node);
  }

  public int id() {
    return node.id();
  }

  public boolean isNamed() {
    return node.isNamed();
  }

  public boolean isError() {
    return node.isError();
  }

  public boolean hasError() {
    return node.hasError();
  }

  @Nullable
  public String fieldName() {
    return node.fieldName();
  }

  public int startOffset() {
    return node.startOffset();
  }

  public int endOffset() {
    return node.endOffset();
  }

  public Position startPosition() {
    return node.startPosition();
  }

  public Position endPosition() {
    return node.endPosition();
  }

  public int childCount() {
    return node.childCount();
  }

  @Nullable
  public NodeView child(int i) {
    return ctx.wrap(node.child(i));
  }

  public ImmutableList<NodeView> children() {
    return ctx.wrapAll(node.children());
  }

  public int namedChildCount() {
    return node.namedChildCount();
  }

  @Nullable
  public NodeView namedChild(int i) {
    return ctx.wrap(node.namedChild(i));
  }

  public ImmutableList<NodeView> namedChildren() {
    return ctx.wrapAll(node.namedChildren());
  }

  @Nullable
  public NodeView firstNamedChild() {
    return ctx.wrap(node.firstNamedChild());
  }

  @Nullable
  public NodeView lastNamedChild() {
    return ctx.wrap(node.lastNamedChild());
  }

  @Nullable
  public NodeView childByFieldName(String name) {
    return ctx.wrap(node.childByFieldName(name));
  }

  public ImmutableList<NodeView> childrenByFieldName(String name) {
    return ctx.wrapAll(node.childrenByFieldName(name));
  }

  @Nullable
  public NodeView nextSibling() {
    return ctx.wrap(node.nextSibling());
  }

  @Nullable
  public NodeView prevSibling() {
    return ctx.wrap(node.prevSibling());
  }

  @Nullable
  public NodeView nextNamedSibling() {
    return ctx.wrap(node.nextNamedSibling());
  }

  @Nullable
  public NodeView prevNamedSibling() {
    return ctx.wrap(node.prevNamedSibling());
  }

  @Nullable
  public NodeView descendantForRange(int start, int end) {
    return ctx.wrap(node.descendantForRange(start, end));
  }

  @Nullable
  public NodeView namedDescendantForRange(int start, int end) {
    return ctx.wrap(node.namedDescendantForRange(start, end));
  }

  public boolean isDescendantOf(NodeView other) {
    return node.isDescendantOf(other.node);
  }

  /** Returns the parent of the node, after reporting the upward access. */
  @Nullable
  public NodeView parent() {
    ctx.reportUpwardAccess(this);
    return ctx.wrap(node.parent());
  }

  /** Returns the root of the node's tree, after reporting the upward access. */
  public NodeView root() {
    ctx.reportUpwardAccess(this);
    return ctx.wrap(node.root());
  }

  public String toSExpression() {
    return node.toSExpression();
  }

  @Override
  public String toString() {
    return node.toString();
  }
}
