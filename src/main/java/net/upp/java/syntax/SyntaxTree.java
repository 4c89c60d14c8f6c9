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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * The result of parsing a source text: a root {@code translation_unit} node plus the syntax errors
 * found along the way. Parsing never fails; unparseable regions become {@code ERROR} nodes.
 *
 * <p>A tree may be told about edits to its text with {@link #edit}. Passing the edited tree to
 * {@link #parse(String, SyntaxTree)} lets the new tree keep the ids of nodes whose type and
 * edit-mapped range are unchanged.
 */
public final class SyntaxTree {

  private static final AtomicInteger nextTreeId = new AtomicInteger(1);

  private final int treeId;
  private final String text;
  private final SyntaxNode root;
  private final ImmutableList<SyntaxError> errors;
  private final List<InputEdit> edits = new ArrayList<>();
  private int editedLength;

  private SyntaxTree(String text, SyntaxNode root, ImmutableList<SyntaxError> errors) {
    this.treeId = nextTreeId.getAndIncrement();
    this.text = text;
    this.root = root;
    this.errors = errors;
    this.editedLength = text.length();
  }

  /** Parses {@code text} from scratch. */
  public static SyntaxTree parse(String text) {
    return parse(text, null);
  }

  /**
   * Parses {@code text}, which is the text of {@code oldTree} after the edits reported to it with
   * {@link #edit}. Nodes that survived the edits keep their ids.
   */
  public static SyntaxTree parse(String text, @Nullable SyntaxTree oldTree) {
    IdAllocator ids = oldTree == null ? IdAllocator.FRESH : new ReusingIdAllocator(oldTree);
    List<SyntaxError> errors = new ArrayList<>();
    SyntaxNode root = Parser.parseTranslationUnit(text, errors, ids);
    return new SyntaxTree(text, root, ImmutableList.copyOf(errors));
  }

  /**
   * Parses {@code text} and fails if it contains any syntax error.
   *
   * @throws SyntaxError.Exception listing every error found
   */
  public static SyntaxTree parseStrict(String text) throws SyntaxError.Exception {
    SyntaxTree tree = parse(text);
    if (!tree.errors.isEmpty()) {
      throw new SyntaxError.Exception(tree.errors);
    }
    return tree;
  }

  /** Returns an id that is unique to this tree among all trees in the process. */
  public int id() {
    return treeId;
  }

  public SyntaxNode root() {
    return root;
  }

  /** Returns the text this tree was parsed from. */
  public String text() {
    return text;
  }

  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Returns the edits reported since this tree was parsed, in order. */
  public ImmutableList<InputEdit> edits() {
    return ImmutableList.copyOf(edits);
  }

  /**
   * Records an edit of the tree's text. Edits are cumulative: each one describes offsets in the
   * text as left by the previous ones.
   *
   * @throws IllegalArgumentException if the edit does not fit the edited text
   */
  public void edit(InputEdit edit) {
    Preconditions.checkArgument(
        edit.oldEndIndex() <= editedLength,
        "edit [%s, %s) exceeds text length %s",
        edit.startIndex(),
        edit.oldEndIndex(),
        editedLength);
    edits.add(edit);
    editedLength += edit.delta();
  }

  /** Maps an offset in the original text through every recorded edit, or returns -1. */
  int mapOffset(int offset, boolean isEnd) {
    for (InputEdit edit : edits) {
      if (offset < 0) {
        break;
      }
      offset = edit.mapOffset(offset, isEnd);
    }
    return offset;
  }

  /** Hands out node ids during parsing. */
  interface IdAllocator {
    IdAllocator FRESH = (type, start, end) -> SyntaxNode.newId();

    int idFor(String type, int start, int end);
  }

  // Gives a new node the id of an old node with the same type and edit-mapped range.
  private static final class ReusingIdAllocator implements IdAllocator {
    private final Map<String, Deque<Integer>> available = new HashMap<>();

    ReusingIdAllocator(SyntaxTree oldTree) {
      index(oldTree, oldTree.root);
    }

    private void index(SyntaxTree oldTree, SyntaxNode node) {
      int start = oldTree.mapOffset(node.startOffset(), false);
      int end = oldTree.mapOffset(node.endOffset(), true);
      if (start >= 0 && end >= start) {
        available.computeIfAbsent(key(node.type(), start, end), k -> new ArrayDeque<>())
            .add(node.id());
      }
      for (SyntaxNode child : node.children()) {
        index(oldTree, child);
      }
    }

    private static String key(String type, int start, int end) {
      return type + "@" + start + ":" + end;
    }

    @Override
    public int idFor(String type, int start, int end) {
      Deque<Integer> ids = available.get(key(type, start, end));
      if (ids == null || ids.isEmpty()) {
        return SyntaxNode.newId();
      }
      // Children are built before their parents, so nested nodes of one type and range are
      // claimed innermost first; indexing is pre-order, so take from the tail.
      return ids.removeLast();
    }
  }

  @Override
  public String toString() {
    return root.toSExpression();
  }
}
