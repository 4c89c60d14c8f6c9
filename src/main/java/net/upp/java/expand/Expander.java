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
import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.annotation.Nullable;
import net.upp.java.edit.Document;
import net.upp.java.pattern.PatternMatcher;
import net.upp.java.syntax.SyntaxError;
import net.upp.java.syntax.SyntaxNode;
import net.upp.java.syntax.SyntaxTree;

/**
 * Expands the macro invocations of a file, pass after pass, until a pass changes nothing.
 *
 * <p>Each pass parses the file, finds its invocations and parses the file again with them blanked
 * out. Each invocation is then expanded in source order by its macro, through an {@link
 * ExpansionContext}, unless another macro has consumed it. The deferred tasks registered during
 * the pass run next, inner scopes first, followed by the registered transforms. Finally the edits
 * of the pass are applied together.
 *
 * <p>An Expander is not thread-safe. Its macros, options and resolver may be shared by successive
 * calls to {@link #expand}; every other piece of state belongs to one call.
 */
public final class Expander {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final MacroRegistry registry;
  private final ExpansionOptions options;
  private final SymbolResolver resolver;
  private final PatternMatcher matcher = new PatternMatcher();

  // State of the current expansion.
  private final Set<Transform> transforms = new LinkedHashSet<>();
  private Diagnostics diagnostics;
  private Placeholders placeholders;
  private int nextUniqueId;
  private int nextFragment;

  public Expander(MacroRegistry registry, ExpansionOptions options) {
    this(registry, options, new DeclarationResolver());
  }

  public Expander(MacroRegistry registry, ExpansionOptions options, SymbolResolver resolver) {
    this.registry = registry;
    this.options = options;
    this.resolver = resolver;
    reset();
  }

  private void reset() {
    transforms.clear();
    diagnostics = new Diagnostics(options.suppressedDiagnostics());
    placeholders = new Placeholders();
    nextUniqueId = 0;
    nextFragment = 0;
  }

  public MacroRegistry registry() {
    return registry;
  }

  public ExpansionOptions options() {
    return options;
  }

  SymbolResolver resolver() {
    return resolver;
  }

  PatternMatcher matcher() {
    return matcher;
  }

  Diagnostics diagnostics() {
    return diagnostics;
  }

  Placeholders placeholders() {
    return placeholders;
  }

  int nextUniqueId() {
    return nextUniqueId++;
  }

  void registerTransform(Transform transform) {
    transforms.add(transform);
  }

  /**
   * Expands the macros of a file.
   *
   * @throws ExpansionException if a macro fails and {@link ExpansionOptions#fatalErrors} is set
   */
  public ExpansionResult expand(String path, String source) throws ExpansionException {
    reset();
    for (String name : registry.redefinitions()) {
      diagnostics.report(
          DiagnosticCode.UPP001,
          Diagnostic.Severity.WARNING,
          path,
          source,
          0,
          "macro @%s is defined more than once; the last definition is used",
          name);
    }
    Document doc = new Document(path, source);
    int passes;
    try {
      passes = run(doc, null, options.maxIterations());
    } catch (MacroException e) {
      throw new ExpansionException(
          path + ": expansion aborted: " + e.getMessage(), diagnostics.all(), e);
    }
    String text = doc.text();
    for (SyntaxError error : SyntaxTree.parse(text).errors()) {
      diagnostics.report(
          DiagnosticCode.UPP003,
          Diagnostic.Severity.WARNING,
          path,
          text,
          error.offset(),
          "%s",
          error.message());
    }
    logger.atFine().log("%s: expanded in %d passes", path, passes);
    return ExpansionResult.create(text, diagnostics.all(), passes);
  }

  /** Expands a fragment as a document nested in the document of {@code parent}. */
  String expandFragment(String fragment, ExpansionPass parent) throws MacroException {
    Document doc =
        new Document(
            parent.document().path() + "#fragment" + nextFragment++, fragment, parent.document());
    run(doc, parent, options.maxFragmentIterations());
    return doc.text();
  }

  // Runs passes over doc until one changes nothing, and returns the number of passes run.
  private int run(Document doc, @Nullable ExpansionPass parent, int maxPasses)
      throws MacroException {
    for (int i = 1; i <= maxPasses; i++) {
      if (!runPass(doc, parent)) {
        return i;
      }
    }
    ImmutableList<MacroInvocation> left =
        InvocationScanner.scan(doc.tree().root(), doc.text());
    if (!left.isEmpty()) {
      diagnostics.report(
          DiagnosticCode.UPP002,
          Diagnostic.Severity.WARNING,
          doc.path(),
          doc.text(),
          left.get(0).startOffset(),
          "%d invocations are left after %d passes",
          left.size(),
          maxPasses);
    }
    return maxPasses;
  }

  // Runs one pass and returns whether it changed the text.
  private boolean runPass(Document doc, @Nullable ExpansionPass parent) throws MacroException {
    SyntaxTree raw = doc.tree();
    ImmutableList<MacroInvocation> invocations = InvocationScanner.scan(raw.root(), doc.text());
    SyntaxTree clean = raw;
    if (!invocations.isEmpty()) {
      clean = SyntaxTree.parse(InvocationScanner.mask(doc.text(), invocations), raw);
      doc.installTree(clean);
    }
    logger.atFine().log("%s: pass with %d invocations", doc.path(), invocations.size());

    ExpansionPass pass = new ExpansionPass(this, doc, parent, invocations, raw, clean);
    for (MacroInvocation inv : invocations) {
      if (inv.isPending()) {
        evaluate(pass, inv);
      }
    }
    DeferredTask task;
    while ((task = pass.deferred().poll()) != null) {
      ExpansionContext ctx = ExpansionContext.forDeferredTask(this, pass, task);
      try {
        task.callback.run(ctx);
      } catch (MacroException e) {
        fail(pass, task.origin, e);
      }
    }
    if (parent == null) {
      for (Transform t : ImmutableList.copyOf(transforms)) {
        try {
          t.apply(ExpansionContext.forTransform(this, pass));
        } catch (MacroException e) {
          fail(pass, null, e);
        }
      }
    }
    boolean changed = pass.ledger().commit(options, diagnostics, placeholders);
    if (parent == null) {
      placeholders.clear();
    }
    return changed;
  }

  private void evaluate(ExpansionPass pass, MacroInvocation inv) throws MacroException {
    MacroDefinition def = registry.get(inv.name());
    if (def == null) {
      fail(
          pass,
          inv,
          new MacroException(
              MacroException.Kind.UNKNOWN_MACRO,
              null,
              inv.name(),
              "unknown macro @" + inv.name()));
      delete(pass, inv);
      return;
    }
    if (!def.acceptsArity(inv.args().size())) {
      fail(
          pass,
          inv,
          new MacroException(
              MacroException.Kind.ARITY,
              null,
              inv.name(),
              String.format(
                  "@%s expects %s, got %d",
                  inv.name(),
                  def.arityDescription(),
                  inv.args().size())));
      delete(pass, inv);
      return;
    }

    ExpansionContext ctx = ExpansionContext.forInvocation(this, pass, inv);
    ReplacementLedger ledger = pass.ledger();
    int mark = ledger.replacements().size();
    inv.setState(MacroInvocation.State.EXPANDED);
    String result;
    ledger.beginExpansion(ctx);
    try {
      result = def.macro().expand(ctx);
    } catch (MacroException e) {
      ledger.rollback(mark);
      fail(pass, inv, e);
      delete(pass, inv);
      return;
    } finally {
      ledger.endExpansion(ctx);
    }

    if (!ctx.hasReplacedOwnSpan() || result != null) {
      pass.recordResult(inv, result == null ? "" : result);
    }
    if (ctx.isCoveredByOutwardEdit()) {
      if (result != null && !result.isEmpty() && !pass.hasResultToken(inv)) {
        diagnostics.report(
            DiagnosticCode.UPP008,
            Diagnostic.Severity.WARNING,
            pass.document().path(),
            pass.document().text(),
            inv.startOffset(),
            "result of @%s is discarded: an edit enclosing the invocation replaces it",
            inv.name());
      }
      return;
    }
    if (result != null || !ctx.hasReplacedOwnSpan()) {
      ledger.add(
          inv.startOffset(),
          inv.endOffset(),
          result == null ? "" : result,
          Replacement.Scope.LOCAL,
          inv.nodeId());
    }
  }

  // Reports a failed macro, unless a nested expansion has, and rethrows it if errors are fatal.
  private void fail(ExpansionPass pass, @Nullable MacroInvocation inv, MacroException e)
      throws MacroException {
    if (!e.isReported()) {
      SyntaxNode node = e.node();
      ExpansionPass where = node == null ? null : pass.passFor(node);
      int offset;
      if (where != null) {
        offset = node.startOffset();
      } else {
        where = pass;
        offset = inv == null ? 0 : inv.startOffset();
      }
      diagnostics.report(
          e.kind() == MacroException.Kind.ARITY ? DiagnosticCode.UPP007 : DiagnosticCode.UPP006,
          Diagnostic.Severity.ERROR,
          where.document().path(),
          where.document().text(),
          offset,
          "%s",
          e.getMessage());
      e.markReported();
    }
    if (options.fatalErrors()) {
      throw e;
    }
  }

  // Deletes an invocation whose expansion failed, so that later passes do not retry it.
  private static void delete(ExpansionPass pass, MacroInvocation inv) {
    if (inv.state() == MacroInvocation.State.CONSUMED) {
      return;
    }
    inv.setState(MacroInvocation.State.EXPANDED);
    pass.recordResult(inv, "");
    pass.ledger()
        .add(inv.startOffset(), inv.endOffset(), "", Replacement.Scope.LOCAL, inv.nodeId());
  }
}
