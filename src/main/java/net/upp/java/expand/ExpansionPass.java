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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.upp.java.edit.Document;
import net.upp.java.edit.Marker;
import net.upp.java.syntax.SyntaxNode;
import net.upp.java.syntax.SyntaxTree;

/**
 * One pass over a document: the invocations found at its start, the tree of its text with those
 * invocations blanked out, and the edits, consumed nodes and deferred tasks gathered while the
 * invocations are expanded. The document's text does not change until the pass commits.
 */
final class ExpansionPass {

  private final Expander expander;
  private final Document document;
  @Nullable private final ExpansionPass parent;
  private final ImmutableList<MacroInvocation> invocations;
  private final SyntaxTree rawTree;
  private final SyntaxTree cleanTree;
  private final ReplacementLedger ledger;
  private final DeferredTaskQueue deferred = new DeferredTaskQueue();
  private final Set<Integer> consumed = new HashSet<>();
  private final Map<SyntaxNode, Marker> standIns = new IdentityHashMap<>();
  private final Map<MacroInvocation, String> results = new IdentityHashMap<>();
  private final Map<MacroInvocation, String> resultTokens = new IdentityHashMap<>();

  ExpansionPass(
      Expander expander,
      Document document,
      @Nullable ExpansionPass parent,
      ImmutableList<MacroInvocation> invocations,
      SyntaxTree rawTree,
      SyntaxTree cleanTree) {
    this.expander = expander;
    this.document = document;
    this.parent = parent;
    this.invocations = invocations;
    this.rawTree = rawTree;
    this.cleanTree = cleanTree;
    this.ledger = new ReplacementLedger(document);
  }

  Expander expander() {
    return expander;
  }

  Document document() {
    return document;
  }

  /** Returns the pass of the document a fragment is expanded within, or null for a file. */
  @Nullable
  ExpansionPass parent() {
    return parent;
  }

  ImmutableList<MacroInvocation> invocations() {
    return invocations;
  }

  SyntaxTree cleanTree() {
    return cleanTree;
  }

  SyntaxNode cleanRoot() {
    return cleanTree.root();
  }

  ReplacementLedger ledger() {
    return ledger;
  }

  DeferredTaskQueue deferred() {
    return deferred;
  }

  /** Reports whether {@code node} belongs to one of the trees of this pass's document. */
  boolean owns(SyntaxNode node) {
    if (standIns.containsKey(node)) {
      return true;
    }
    SyntaxNode root = node.root();
    return root == cleanTree.root() || root == rawTree.root();
  }

  /** Returns the pass, this one or one it is nested in, whose document {@code node} belongs to. */
  @Nullable
  ExpansionPass passFor(SyntaxNode node) {
    for (ExpansionPass p = this; p != null; p = p.parent) {
      if (p.owns(node)) {
        return p;
      }
    }
    return null;
  }

  /**
   * Returns the document text of {@code [start, end)} as the expansions of this pass have left it
   * so far. The edits registered within the range are applied, and an invocation expanded within
   * it shows its result, or a placeholder token for the result while its macro still runs. An
   * expanded invocation partly in the range is blanked out. Pending invocations, and those
   * consumed by another macro, are kept.
   */
  String textOf(int start, int end) {
    String text = document.text();
    start = Math.max(0, Math.min(start, text.length()));
    end = Math.max(start, Math.min(end, text.length()));
    char[] chars = text.substring(start, end).toCharArray();
    List<Replacement> pieces = new ArrayList<>();
    for (MacroInvocation inv : invocations) {
      if (inv.state() != MacroInvocation.State.EXPANDED || !inv.overlaps(start, end)) {
        continue;
      }
      if (start <= inv.startOffset() && inv.endOffset() <= end) {
        String result = results.get(inv);
        pieces.add(
            Replacement.create(
                inv.startOffset(),
                inv.endOffset(),
                result != null ? result : resultToken(inv),
                Replacement.Scope.LOCAL,
                inv.nodeId(),
                -1));
        continue;
      }
      for (int i = Math.max(start, inv.startOffset()); i < Math.min(end, inv.endOffset()); i++) {
        if (chars[i - start] != '\n') {
          chars[i - start] = ' ';
        }
      }
    }
    for (Replacement r : ReplacementLedger.merge(ledger.replacements())) {
      boolean within =
          start <= r.start()
              && r.end() <= end
              && !(r.start() == start && r.end() == end)
              && !(r.isInsertion() && (r.start() == start || r.start() == end));
      if (within && !isWithinExpandedInvocation(r)) {
        pieces.add(r);
      }
    }
    if (pieces.isEmpty()) {
      return new String(chars);
    }
    pieces.sort(
        Comparator.comparingInt(Replacement::start)
            .thenComparingInt(r -> r.isInsertion() ? 0 : 1)
            .thenComparing(Comparator.comparingInt(Replacement::end).reversed()));
    StringBuilder buf = new StringBuilder();
    int at = start;
    for (Replacement piece : pieces) {
      if (piece.start() < at) {
        continue;
      }
      buf.append(chars, at - start, piece.start() - at).append(piece.content());
      at = piece.end();
      ledger.markEmbedded(piece.start(), piece.end());
    }
    return buf.append(chars, at - start, end - at).toString();
  }

  // The result of an expanded invocation carries the edits registered within its span.
  private boolean isWithinExpandedInvocation(Replacement r) {
    for (MacroInvocation inv : invocations) {
      if (inv.state() == MacroInvocation.State.EXPANDED
          && inv.startOffset() <= r.start()
          && r.end() <= inv.endOffset()) {
        return true;
      }
    }
    return false;
  }

  // Returns the token standing for the result of an invocation whose macro is still running.
  private String resultToken(MacroInvocation inv) {
    String token = resultTokens.get(inv);
    if (token == null) {
      token = expander.placeholders().mint("");
      resultTokens.put(inv, token);
    }
    return token;
  }

  /** Records the text an expanded invocation is replaced by. */
  void recordResult(MacroInvocation inv, String result) {
    results.put(inv, result);
    String token = resultTokens.get(inv);
    if (token != null) {
      expander.placeholders().put(token, result);
    }
  }

  /** Reports whether the text of an invocation has been read while its macro was running. */
  boolean hasResultToken(MacroInvocation inv) {
    return resultTokens.containsKey(inv);
  }

  /** Returns the first pending invocation starting at or after {@code offset}. */
  @Nullable
  MacroInvocation nextPendingInvocation(int offset) {
    for (MacroInvocation inv : invocations) {
      if (inv.isPending() && inv.startOffset() >= offset) {
        return inv;
      }
    }
    return null;
  }

  /** Returns the invocation spanning exactly {@code [start, end)}, whatever its state. */
  @Nullable
  MacroInvocation invocationAt(int start, int end) {
    for (MacroInvocation inv : invocations) {
      if (inv.startOffset() == start && inv.endOffset() == end) {
        return inv;
      }
    }
    return null;
  }

  /** Reports whether {@code [start, end)} overlaps any invocation of the pass. */
  boolean isInsideInvocation(int start, int end) {
    for (MacroInvocation inv : invocations) {
      if (inv.overlaps(start, end)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Checks an edit of {@code [start, end)} against the pending invocations other than {@code
   * self}. An edit of exactly an invocation's range is admitted; an edit containing invocations
   * is admitted and marks them consumed, since their text moves with the edit; an edit partly
   * overlapping one, or lying within one, is rejected and reported.
   */
  boolean admit(int start, int end, @Nullable MacroInvocation self) {
    List<MacroInvocation> contained = new ArrayList<>();
    for (MacroInvocation inv : invocations) {
      if (inv == self || !inv.isPending() || !inv.overlaps(start, end)) {
        continue;
      }
      if (inv.startOffset() == start && inv.endOffset() == end) {
        continue;
      }
      if (start <= inv.startOffset() && inv.endOffset() <= end) {
        contained.add(inv);
        continue;
      }
      expander
          .diagnostics()
          .report(
              DiagnosticCode.UPP005,
              Diagnostic.Severity.WARNING,
              document.path(),
              document.text(),
              start,
              "edit of [%d, %d) overlaps the unexpanded invocation %s",
              start,
              end,
              inv.text());
      return false;
    }
    for (MacroInvocation inv : contained) {
      inv.setState(MacroInvocation.State.CONSUMED);
    }
    return true;
  }

  /** Reports whether {@code node} or one of its ancestors has been consumed. */
  boolean isConsumed(SyntaxNode node) {
    for (SyntaxNode n = node; n != null; n = n.parent()) {
      if (consumed.contains(n.id())) {
        return true;
      }
    }
    return false;
  }

  void markConsumed(SyntaxNode node) {
    consumed.add(node.id());
  }

  /** Returns the smallest named node of the clean tree that strictly encloses the range. */
  SyntaxNode enclosingScope(int start, int end) {
    SyntaxNode n = cleanTree.root().namedDescendantForRange(start, end);
    while (n != null && n.parent() != null && n.startOffset() == start && n.endOffset() == end) {
      n = n.parent();
    }
    return n == null ? cleanTree.root() : n;
  }

  void registerStandIn(SyntaxNode standIn, Marker marker) {
    standIns.put(standIn, marker);
  }

  @Nullable
  Marker standInMarker(SyntaxNode standIn) {
    return standIns.get(standIn);
  }

  @Override
  public String toString() {
    return "pass over " + document + " with " + invocations.size() + " invocations";
  }
}
