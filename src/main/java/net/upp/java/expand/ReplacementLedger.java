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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.upp.java.edit.Document;

/**
 * The edits registered against one document during a pass, and the record of which expansion, if
 * any, is running in it. The edits are applied together by {@link #commit}.
 */
final class ReplacementLedger {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final Comparator<Replacement> DESCENDING =
      Comparator.comparingInt(Replacement::start)
          .thenComparingInt(Replacement::end)
          .reversed()
          .thenComparingInt(Replacement::sequence);

  private final Document document;
  private final List<Replacement> pending = new ArrayList<>();
  // Ranges whose edits have been read into the text of an enclosing range.
  private final Set<Long> embedded = new HashSet<>();
  private int nextSequence;
  @Nullable private ExpansionContext active;

  ReplacementLedger(Document document) {
    this.document = document;
  }

  Document document() {
    return document;
  }

  void add(int start, int end, String content, Replacement.Scope scope, int ownerNodeId) {
    Preconditions.checkArgument(
        0 <= start && start <= end && end <= document.text().length(),
        "replacement [%s, %s) outside of %s chars",
        start,
        end,
        document.text().length());
    pending.add(Replacement.create(start, end, content, scope, ownerNodeId, nextSequence++));
  }

  /** Returns the edits registered since the last commit, in registration order. */
  ImmutableList<Replacement> replacements() {
    return ImmutableList.copyOf(pending);
  }

  /** Drops the edits registered after the first {@code count}. */
  void rollback(int count) {
    while (pending.size() > count) {
      pending.remove(pending.size() - 1);
    }
  }

  /**
   * Records that the edit of {@code [start, end)} is part of text read from the document, so an
   * enclosing edit made from that text carries it.
   */
  void markEmbedded(int start, int end) {
    embedded.add(key(start, end));
  }

  /** Records that {@code ctx} is expanding its invocation in this document. */
  void beginExpansion(ExpansionContext ctx) {
    Preconditions.checkState(active == null, "%s is already expanding", active);
    active = ctx;
  }

  void endExpansion(ExpansionContext ctx) {
    Preconditions.checkState(active == ctx, "%s is not expanding", ctx);
    active = null;
  }

  /** Returns the context whose invocation is being expanded, or null between expansions. */
  @Nullable
  ExpansionContext active() {
    return active;
  }

  /**
   * Applies the pending edits to the document, last in the text first, then substitutes the
   * placeholder tokens left in its text. Returns whether the text changed.
   *
   * <p>Of several edits of the same non-empty range, the last registered is applied. Insertions at
   * the same offset are applied together, in registration order. An edit within another is
   * dropped, as is one that partly overlaps an edit applied before it; both are reported, except
   * for a dropped edit that was read into the text of the edit containing it.
   */
  boolean commit(ExpansionOptions options, Diagnostics diagnostics, Placeholders placeholders) {
    String before = document.text();
    List<Replacement> merged = merge(pending);
    pending.clear();
    Set<Long> carried = new HashSet<>(embedded);
    embedded.clear();

    List<Replacement> kept = new ArrayList<>();
    for (Replacement r : merged) {
      Replacement container = null;
      for (Replacement other : merged) {
        if (other != r && r.isContainedIn(other)) {
          container = other;
          break;
        }
      }
      if (container == null) {
        kept.add(r);
      } else if (!carried.contains(key(r.start(), r.end()))) {
        diagnostics.report(
            DiagnosticCode.UPP008,
            Diagnostic.Severity.WARNING,
            document.path(),
            before,
            r.start(),
            "edit of [%d, %d) is discarded: it lies within the edit of [%d, %d)",
            r.start(),
            r.end(),
            container.start(),
            container.end());
      }
    }
    kept.sort(DESCENDING);

    int applied = 0;
    int lowest = Integer.MAX_VALUE;
    for (Replacement r : kept) {
      if (r.end() > lowest) {
        diagnostics.report(
            DiagnosticCode.UPP008,
            Diagnostic.Severity.WARNING,
            document.path(),
            before,
            r.start(),
            "edit of [%d, %d) overlaps another edit and is skipped",
            r.start(),
            r.end());
        continue;
      }
      lowest = r.start();
      String original = before.substring(r.start(), r.end());
      String content = placeholders.resolve(r.content());
      if (options.annotateReplacements() && !original.trim().isEmpty()) {
        content = "/* " + original.replace("*/", "* /") + " */ " + content;
      }
      document.splice(r.start(), r.end() - r.start(), content);
      applied++;
    }

    for (String token : placeholders.sweep(document)) {
      String text = document.text();
      diagnostics.report(
          DiagnosticCode.UPP008,
          Diagnostic.Severity.WARNING,
          document.path(),
          text,
          text.indexOf(token),
          "placeholder %s has no content",
          token);
    }
    logger.atFine().log("%s: applied %d of %d edits", document.path(), applied, merged.size());
    return !document.text().equals(before);
  }

  private static long key(int start, int end) {
    return ((long) start << 32) | end;
  }

  // Keeps the last edit of each non-empty range and joins the insertions at each offset.
  static List<Replacement> merge(List<Replacement> edits) {
    Map<Long, Replacement> byRange = new LinkedHashMap<>();
    for (Replacement r : edits) {
      long key = key(r.start(), r.end());
      Replacement previous = byRange.get(key);
      if (previous != null && r.isInsertion()) {
        byRange.put(key, previous.withContent(previous.content() + r.content()));
      } else {
        byRange.put(key, r);
      }
    }
    return new ArrayList<>(byRange.values());
  }
}
