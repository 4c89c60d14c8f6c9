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

package net.upp.java.edit;

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import javax.annotation.Nullable;
import net.upp.java.syntax.InputEdit;
import net.upp.java.syntax.Position;
import net.upp.java.syntax.SyntaxNode;
import net.upp.java.syntax.SyntaxTree;

/**
 * A mutable source text together with its syntax tree and markers.
 *
 * <p>{@link #splice} is the only way to change the text. Each splice updates the markers and
 * reports the edit to the tree; the tree is reparsed incrementally the next time it is needed,
 * keeping the ids of untouched nodes, and the markers move with it.
 *
 * <p>A document created for a code fragment links to the document it was expanded within.
 */
public final class Document {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final String path;
  @Nullable private final Document parent;
  private final MarkerTable markers = new MarkerTable();

  private String text;
  private SyntaxTree tree;
  private boolean stale;

  public Document(String path, String text) {
    this(path, text, null);
  }

  public Document(String path, String text, @Nullable Document parent) {
    this.path = path;
    this.text = text;
    this.parent = parent;
    this.tree = SyntaxTree.parse(text);
  }

  public String path() {
    return path;
  }

  public String text() {
    return text;
  }

  /** Returns the document this one was created within, or null for a file. */
  @Nullable
  public Document parent() {
    return parent;
  }

  /** Returns the outermost document of the parent chain. */
  public Document root() {
    Document d = this;
    while (d.parent != null) {
      d = d.parent;
    }
    return d;
  }

  public MarkerTable markers() {
    return markers;
  }

  /** Returns the syntax tree of the current text, reparsing if the text has changed. */
  public SyntaxTree tree() {
    if (stale) {
      reparse();
    }
    return tree;
  }

  /** Reports whether edits have been made since the tree was last parsed. */
  public boolean isStale() {
    return stale;
  }

  /** Reparses the text incrementally against the current tree and migrates the markers. */
  public SyntaxTree reparse() {
    install(SyntaxTree.parse(text, tree));
    return tree;
  }

  /**
   * Replaces the tree by one parsed elsewhere, such as a parse of the text with some regions
   * blanked out. The tree's text must be as long as the document's.
   */
  public void installTree(SyntaxTree newTree) {
    Preconditions.checkArgument(
        newTree.text().length() == text.length(),
        "tree of %s chars installed for %s chars of text",
        newTree.text().length(),
        text.length());
    install(newTree);
  }

  private void install(SyntaxTree newTree) {
    markers.migrate(tree.id(), newTree.id());
    tree = newTree;
    stale = false;
  }

  /**
   * Replaces {@code deleteCount} chars at {@code offset} with {@code insert} and returns the new
   * text. The offset is clamped to the text and the count to what follows the offset.
   */
  public String splice(int offset, int deleteCount, String insert) {
    int length = text.length();
    offset = Math.max(0, Math.min(offset, length));
    deleteCount = Math.max(0, Math.min(deleteCount, length - offset));
    if (deleteCount == 0 && insert.isEmpty()) {
      return text;
    }
    String before = text;
    int oldEnd = offset + deleteCount;
    int newEnd = offset + insert.length();
    Position startPosition = Position.of(before, offset);
    Position oldEndPosition = Position.of(before, oldEnd);
    text = before.substring(0, offset) + insert + before.substring(oldEnd);
    Position newEndPosition = Position.of(text, newEnd);

    markers.adjust(tree.id(), offset, deleteCount, insert.length());
    try {
      tree.edit(
          InputEdit.create(
              offset, oldEnd, newEnd, startPosition, oldEndPosition, newEndPosition));
    } catch (IllegalArgumentException e) {
      logger.atWarning().withCause(e).log(
          "%s: could not report edit at %s to the syntax tree", path, startPosition);
    }
    stale = true;
    return text;
  }

  /** Registers a marker at {@code offset} of the current text. */
  public Marker createMarker(int offset, @Nullable Object payload) {
    return markers.create(tree.id(), Math.max(0, Math.min(offset, text.length())), payload);
  }

  public void destroyMarker(Marker marker) {
    markers.destroy(marker);
  }

  /**
   * Returns the deepest named node at a marker's position.
   *
   * @throws MarkerInvalidatedException if the marker's position was deleted
   */
  public SyntaxNode resolveNode(Marker marker) {
    return resolveNode(marker, null, null);
  }

  /**
   * Returns the nearest ancestor of the deepest named node at a marker's position whose type and
   * id match the given filters, or the deepest node itself if no ancestor matches.
   *
   * @throws MarkerInvalidatedException if the marker's position was deleted
   */
  public SyntaxNode resolveNode(Marker marker, @Nullable String type, @Nullable Integer id) {
    int offset = markers.offset(marker);
    SyntaxNode root = tree().root();
    offset = Math.min(offset, root.endOffset());
    SyntaxNode deepest = root.namedDescendantForRange(offset, offset);
    if (deepest == null) {
      deepest = root;
    }
    if (type == null && id == null) {
      return deepest;
    }
    for (SyntaxNode n = deepest; n != null; n = n.parent()) {
      if ((type == null || type.equals(n.type())) && (id == null || id == n.id())) {
        return n;
      }
    }
    return deepest;
  }

  @Override
  public String toString() {
    return parent == null ? path : path + " (within " + parent.path + ")";
  }
}
