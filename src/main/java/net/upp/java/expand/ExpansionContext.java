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
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import net.upp.java.edit.Document;
import net.upp.java.edit.Marker;
import net.upp.java.pattern.Capture;
import net.upp.java.pattern.CaptureSet;
import net.upp.java.pattern.PatternMatcher;
import net.upp.java.syntax.Fragment;
import net.upp.java.syntax.Query;
import net.upp.java.syntax.QueryMatch;
import net.upp.java.syntax.SyntaxNode;

/**
 * An ExpansionContext is what macro code sees of the expander: the invocation being expanded,
 * views of the document's syntax tree, and the operations that claim code and edit the document.
 *
 * <p>A context is created for each invocation, and for each deferred task and transform, which
 * run after the invocations of their pass. Edits registered through a context are applied when
 * the pass commits, so the text and trees seen through it do not change during the pass.
 *
 * <p>The tree seen through a context is the "clean" tree of the pass, parsed from the document
 * text with every invocation blanked out.
 */
public final class ExpansionContext {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The type of the node standing in for an invocation consumed by another macro. */
  public static final String MACRO_INVOCATION = "macro_invocation";

  private final Expander expander;
  private final ExpansionPass pass;
  @Nullable private final MacroInvocation invocation;
  // The anchor of a deferred task or transform; null while expanding an invocation.
  @Nullable private final SyntaxNode deferredAnchor;
  private final Map<SyntaxNode, NodeView> views = new IdentityHashMap<>();
  private boolean upwardAccessReported;

  // Consumption state.
  private int cursor;
  @Nullable private SyntaxNode anchor;
  private boolean anchorIsStandIn;
  private boolean firstConsume = true;

  private boolean coveredByOutwardEdit;
  private boolean ownSpanReplaced;

  private ExpansionContext(
      Expander expander,
      ExpansionPass pass,
      @Nullable MacroInvocation invocation,
      @Nullable SyntaxNode deferredAnchor) {
    this.expander = expander;
    this.pass = pass;
    this.invocation = invocation;
    this.deferredAnchor = deferredAnchor;
    this.cursor = invocation == null ? 0 : invocation.endOffset();
  }

  static ExpansionContext forInvocation(
      Expander expander, ExpansionPass pass, MacroInvocation invocation) {
    return new ExpansionContext(expander, pass, invocation, null);
  }

  static ExpansionContext forDeferredTask(
      Expander expander, ExpansionPass pass, DeferredTask task) {
    return new ExpansionContext(expander, pass, task.origin, task.anchor);
  }

  static ExpansionContext forTransform(Expander expander, ExpansionPass pass) {
    return new ExpansionContext(expander, pass, null, pass.cleanRoot());
  }

  // --- the invocation ---

  /**
   * Returns the invocation being expanded, or that whose macro registered the running deferred
   * task. Returns null in a transform.
   */
  @Nullable
  public MacroInvocation invocation() {
    return invocation;
  }

  /** Returns the name of the macro being expanded, or the empty string in a transform. */
  public String name() {
    return invocation == null ? "" : invocation.name();
  }

  public ImmutableList<String> args() {
    return invocation == null ? ImmutableList.of() : invocation.args();
  }

  public String arg(int i) {
    return args().get(i);
  }

  public int argCount() {
    return args().size();
  }

  /** Reports whether this context runs a deferred task or a transform. */
  public boolean isDeferred() {
    return deferredAnchor != null;
  }

  public Document document() {
    return pass.document();
  }

  public ExpansionOptions options() {
    return expander.options();
  }

  // --- nodes ---

  /** Returns the root of the document's tree. */
  public NodeView root() {
    return wrap(pass.cleanRoot());
  }

  /**
   * Returns the node this context works at: the smallest node enclosing the invocation, or the
   * anchor of a deferred task.
   */
  public NodeView node() {
    if (deferredAnchor != null) {
      return wrap(deferredAnchor);
    }
    SyntaxNode n =
        pass.cleanRoot()
            .namedDescendantForRange(invocation.startOffset(), invocation.endOffset());
    return wrap(n == null ? pass.cleanRoot() : n);
  }

  /** Returns the view of {@code node}, or null for a null node. */
  @Nullable
  public NodeView wrap(@Nullable SyntaxNode node) {
    if (node == null) {
      return null;
    }
    return views.computeIfAbsent(node, n -> new NodeView(n, this));
  }

  ImmutableList<NodeView> wrapAll(List<SyntaxNode> nodes) {
    ImmutableList.Builder<NodeView> result = ImmutableList.builderWithExpectedSize(nodes.size());
    for (SyntaxNode n : nodes) {
      result.add(wrap(n));
    }
    return result.build();
  }

  /**
   * Parses a code fragment: an expression, one or more statements, a declaration or a function.
   * Returns null if the fragment does not parse.
   */
  @Nullable
  public NodeView parseFragment(String text) {
    return wrap(Fragment.parse(text));
  }

  /** Returns the text of {@code node} as macro code sees it. */
  String textOf(SyntaxNode node) {
    ExpansionPass p = pass.passFor(node);
    if (p == null || p.standInMarker(node) != null) {
      return node.text();
    }
    return p.textOf(node.startOffset(), node.endOffset());
  }

  /** Returns the text of a capture as macro code sees it. */
  String textOf(Capture capture) {
    if (capture.rawNodes().isEmpty()) {
      return "";
    }
    SyntaxNode first = capture.rawNodes().get(0);
    ExpansionPass p = pass.passFor(first);
    if (p == null || p.standInMarker(first) != null) {
      return capture.text();
    }
    return p.textOf(capture.startOffset(), capture.endOffset());
  }

  void reportUpwardAccess(NodeView view) {
    if (isDeferred() || upwardAccessReported) {
      return;
    }
    upwardAccessReported = true;
    reportAt(
        view.unwrap(),
        DiagnosticCode.UPP004,
        Diagnostic.Severity.INFO,
        "@%s navigates up the tree; prefer atRoot or inScope for edits outside the invocation",
        name());
  }

  // --- edits ---

  /**
   * Registers the replacement of {@code [start, end)} of this context's document by {@code
   * content}.
   *
   * <p>An edit within the invocation being expanded is local to it. An edit enclosing the
   * invocation is an outward edit: the content is stored under a fresh placeholder token, the
   * token is registered in place of the range and returned. Text read from the document shows the
   * invocation as a token standing for the macro's result, so content built from that text
   * carries the result to the invocation's site, along with the results of invocations already
   * expanded in the range. Every other edit is global.
   *
   * <p>An edit that partly overlaps an invocation still pending in the pass is rejected with a
   * diagnostic. An edit enclosing pending invocations consumes them.
   *
   * @return the placeholder token of an outward edit, or null
   */
  @CanIgnoreReturnValue
  @Nullable
  public String replace(int start, int end, String content) {
    return replaceIn(pass, start, end, content);
  }

  /** Registers the replacement of a node, which may belong to an enclosing document. */
  @CanIgnoreReturnValue
  @Nullable
  public String replace(NodeView node, String content) {
    SyntaxNode n = node.unwrap();
    ExpansionPass target = pass.passFor(n);
    if (target == null) {
      reportAt(
          null,
          DiagnosticCode.UPP005,
          Diagnostic.Severity.WARNING,
          "@%s: cannot replace %s, which belongs to no document being expanded",
          name(),
          n);
      return null;
    }
    return replaceIn(target, n.startOffset(), n.endOffset(), content);
  }

  @CanIgnoreReturnValue
  @Nullable
  public String replace(NodeView node, Code code) {
    return replace(node, code.text());
  }

  @Nullable
  private String replaceIn(ExpansionPass target, int start, int end, String content) {
    int length = target.document().text().length();
    Preconditions.checkArgument(
        0 <= start && start <= end && end <= length,
        "range [%s, %s) outside of %s chars",
        start,
        end,
        length);
    ReplacementLedger ledger = target.ledger();
    int owner = invocation == null ? 0 : invocation.nodeId();
    MacroInvocation active =
        target == pass && !isDeferred() && ledger.active() == this ? invocation : null;

    if (active != null && active.overlaps(start, end)) {
      boolean inside = active.within(start, end);
      boolean encloses = start <= active.startOffset() && active.endOffset() <= end;
      if (!inside && !encloses) {
        reportAt(
            null,
            DiagnosticCode.UPP005,
            Diagnostic.Severity.WARNING,
            "@%s: edit of [%d, %d) partly overlaps the invocation",
            name(),
            start,
            end);
        return null;
      }
    }
    if (!target.admit(start, end, target == pass ? invocation : null)) {
      return null;
    }
    if (active != null && active.within(start, end)) {
      if (start == active.startOffset() && end == active.endOffset()) {
        ownSpanReplaced = true;
        target.recordResult(active, content);
      }
      ledger.add(start, end, content, Replacement.Scope.LOCAL, owner);
      return null;
    }
    if (active != null && start <= active.startOffset() && active.endOffset() <= end) {
      String token = expander.placeholders().mint(content);
      ledger.add(start, end, token, Replacement.Scope.GLOBAL, owner);
      coveredByOutwardEdit = true;
      logger.atFine().log("@%s: outward edit of [%d, %d) as %s", name(), start, end, token);
      return token;
    }
    ledger.add(start, end, content, Replacement.Scope.GLOBAL, owner);
    return null;
  }

  /** Inserts {@code content} before {@code node}. */
  public void insertBefore(NodeView node, String content) {
    SyntaxNode n = node.unwrap();
    insertAt(n, n.startOffset(), content);
  }

  /** Inserts {@code content} after {@code node}. */
  public void insertAfter(NodeView node, String content) {
    SyntaxNode n = node.unwrap();
    insertAt(n, n.endOffset(), content);
  }

  private void insertAt(SyntaxNode n, int offset, String content) {
    ExpansionPass target = pass.passFor(n);
    if (target == null) {
      reportAt(
          null,
          DiagnosticCode.UPP005,
          Diagnostic.Severity.WARNING,
          "@%s: cannot insert next to %s, which belongs to no document being expanded",
          name(),
          n);
      return;
    }
    replaceIn(target, offset, offset, content);
  }

  /**
   * Inserts {@code content}, as a line of its own, before the first item of the file that is not a
   * comment. A fragment's content goes to the file the fragment is expanded within.
   */
  public void hoist(String content) {
    ExpansionPass file = pass;
    while (file.parent() != null) {
      file = file.parent();
    }
    SyntaxNode root = file.cleanRoot();
    int offset = root.endOffset();
    for (SyntaxNode item : root.namedChildren()) {
      if (!item.isComment()) {
        offset = item.startOffset();
        break;
      }
    }
    replaceIn(file, offset, offset, content + "\n");
  }

  /**
   * Rewrites the references to a declaration at the end of this and every later pass, the name in
   * the declaration itself included. {@code rewrite} is given each reference and returns its new
   * text, or null to leave it. A rewritten reference is not offered again, even where the new text
   * still names the declaration.
   *
   * @param definition a declaration, parameter, function or typedef, or the identifier naming one
   */
  public void withReferences(NodeView definition, Function<NodeView, String> rewrite) {
    SyntaxNode def = definition.unwrap();
    String name = def.type().equals("identifier") ? def.text() : null;
    while (def != null && !ReferenceRewriter.isDefinition(def)) {
      def = def.parent();
    }
    Preconditions.checkArgument(def != null, "%s is not part of a declaration", definition);
    if (name == null) {
      name = DeclarationResolver.declaredName(def.childByFieldName("declarator"));
    }
    Preconditions.checkArgument(name != null, "%s declares no name", definition);
    ExpansionPass owner = pass.passFor(def);
    Preconditions.checkArgument(owner != null, "%s belongs to no document", definition);
    Document doc = owner.document();
    Marker marker = doc.createMarker(def.startOffset(), def.type());
    registerTransform(new ReferenceRewriter(doc, marker, def.type(), name, rewrite));
  }

  boolean isCoveredByOutwardEdit() {
    return coveredByOutwardEdit;
  }

  boolean hasReplacedOwnSpan() {
    return ownSpanReplaced;
  }

  // --- consumption ---

  /** Consumes the next piece of code, of any type. Returns null if there is none. */
  @Nullable
  public NodeView consume() throws MacroException {
    return consume(null, null, null);
  }

  /** Consumes the next piece of code, which must be of the given type. */
  public NodeView consume(String type) throws MacroException {
    return consume(type, null, null);
  }

  public NodeView consume(String type, Predicate<NodeView> validator) throws MacroException {
    return consume(type, validator, null);
  }

  /**
   * Consumes the next piece of code after the invocation, or after the code consumed last: its
   * text is deleted when the pass commits and it is never returned again.
   *
   * <p>The first call of a macro whose invocation has no arguments takes the node the invocation
   * directly precedes. An unexpanded invocation separated from the current position only by
   * whitespace, or by comments when they are transparent, is taken as it is: its text is deleted
   * and a {@value #MACRO_INVOCATION} node standing in for it is returned. Otherwise the next
   * named node is taken: the node following the code consumed last, or the first node after the
   * invocation.
   *
   * <p>A node found by forward traversal that does not have the requested type, or is an error,
   * is searched for a first descendant that does.
   *
   * @param type the type the node must have, or null for any type
   * @param validator a further check of the node, or null
   * @param message the message of the exception thrown if the node is rejected, or null
   * @return the consumed node, or null if there is nothing left and neither a type nor a
   *     validator was given
   * @throws MacroConsumptionException if the node is rejected, or if nothing is found where a
   *     type or validator was given
   * @throws IllegalStateException in a deferred task or transform
   */
  @Nullable
  public NodeView consume(
      @Nullable String type, @Nullable Predicate<NodeView> validator, @Nullable String message)
      throws MacroException {
    Preconditions.checkState(!isDeferred(), "consume() is only available during expansion");
    boolean first = firstConsume;
    firstConsume = false;

    if (first && !invocation.hasExplicitTarget()) {
      SyntaxNode implicit = contextNode();
      if (implicit != null) {
        MacroInvocation between = pass.nextPendingInvocation(cursor);
        if (between == null || between.startOffset() >= implicit.startOffset()) {
          return take(narrow(implicit, type), type, validator, message);
        }
      }
    }

    if (type == null || type.equals(MACRO_INVOCATION)) {
      MacroInvocation sibling = pass.nextPendingInvocation(cursor);
      if (sibling != null && isGap(cursor, sibling.startOffset())) {
        return takeInvocation(sibling, validator, message);
      }
      if (type != null) {
        throw new MacroConsumptionException(
            null,
            name(),
            message != null ? message : "@" + name() + " expected a macro invocation");
      }
    }

    SyntaxNode candidate = forwardCandidate();
    if (candidate == null) {
      if (type == null && validator == null) {
        return null;
      }
      throw new MacroConsumptionException(
          null,
          name(),
          message != null
              ? message
              : "@" + name() + " expected " + (type == null ? "more code" : type) + " after it");
    }
    return take(narrow(widen(candidate), type), type, validator, message);
  }

  /** Returns the node the next {@link #consume()} would take, without consuming it. */
  @Nullable
  public NodeView nextNode() {
    return nextNode(null);
  }

  /**
   * Returns the node the next {@link #consume(String)} of {@code type} would take, without
   * consuming it: nothing is deleted and a later consume still returns it. An unexpanded
   * invocation next in line is returned as a fresh {@value #MACRO_INVOCATION} node.
   *
   * @param type the type the node must have, or null for any type
   * @return the next node, or null if there is none or it does not have the type
   * @throws IllegalStateException in a deferred task or transform
   */
  @Nullable
  public NodeView nextNode(@Nullable String type) {
    Preconditions.checkState(!isDeferred(), "nextNode() is only available during expansion");
    SyntaxNode next = null;
    if (firstConsume && !invocation.hasExplicitTarget()) {
      SyntaxNode implicit = contextNode();
      MacroInvocation between = pass.nextPendingInvocation(cursor);
      if (implicit != null
          && (between == null || between.startOffset() >= implicit.startOffset())) {
        next = implicit;
      }
    }
    if (next == null) {
      MacroInvocation sibling = pass.nextPendingInvocation(cursor);
      if (sibling != null && isGap(cursor, sibling.startOffset())) {
        next = SyntaxNode.detached(MACRO_INVOCATION, sibling.startOffset(), sibling.text());
      }
    }
    if (next == null) {
      SyntaxNode candidate = forwardCandidate();
      next = candidate == null ? null : widen(candidate);
    }
    if (next == null) {
      return null;
    }
    next = narrow(next, type);
    return type == null || type.equals(next.type()) ? wrap(next) : null;
  }

  // The first node after the code consumed last, or after the invocation, that is not skipped.
  @Nullable
  private SyntaxNode forwardCandidate() {
    SyntaxNode candidate =
        anchor == null || anchorIsStandIn
            ? firstAfter(pass.enclosingScope(invocation.startOffset(), invocation.endOffset()))
            : nextCandidate(anchor);
    while (candidate != null && isSkipped(candidate)) {
      candidate = nextCandidate(candidate);
    }
    return candidate;
  }

  /** Returns the marker recording where a consumed invocation was, given its stand-in node. */
  @Nullable
  public Marker markerOf(NodeView standIn) {
    return pass.standInMarker(standIn.unwrap());
  }

  private NodeView take(
      SyntaxNode node,
      @Nullable String type,
      @Nullable Predicate<NodeView> validator,
      @Nullable String message)
      throws MacroException {
    if (node.isError()) {
      throw new MacroConsumptionException(
          node,
          name(),
          message != null ? message : "@" + name() + " cannot consume a syntax error");
    }
    if (type != null && !type.equals(node.type())) {
      throw new MacroConsumptionException(
          node,
          name(),
          message != null
              ? message
              : "@" + name() + " expected " + type + " but found " + node.type());
    }
    NodeView view = wrap(node);
    if (validator != null && !validator.test(view)) {
      throw new MacroConsumptionException(
          node, name(), message != null ? message : "@" + name() + " rejected " + node.type());
    }
    if (!pass.admit(node.startOffset(), node.endOffset(), invocation)) {
      throw new MacroConsumptionException(
          node, name(), "@" + name() + " cannot consume code that cuts through an invocation");
    }
    pass.ledger()
        .add(
            node.startOffset(),
            node.endOffset(),
            "",
            Replacement.Scope.GLOBAL,
            invocation.nodeId());
    pass.markConsumed(node);
    cursor = node.endOffset();
    anchor = node;
    anchorIsStandIn = false;
    return view;
  }

  private NodeView takeInvocation(
      MacroInvocation sibling, @Nullable Predicate<NodeView> validator, @Nullable String message)
      throws MacroException {
    SyntaxNode standIn =
        SyntaxNode.detached(MACRO_INVOCATION, sibling.startOffset(), sibling.text());
    NodeView view = wrap(standIn);
    if (validator != null && !validator.test(view)) {
      throw new MacroConsumptionException(
          null, name(), message != null ? message : "@" + name() + " rejected " + sibling.text());
    }
    sibling.setState(MacroInvocation.State.CONSUMED);
    pass.ledger()
        .add(
            sibling.startOffset(),
            sibling.endOffset(),
            "",
            Replacement.Scope.GLOBAL,
            invocation.nodeId());
    // The end of a deleted range survives the deletion, at the position the range had.
    Marker marker = pass.document().createMarker(sibling.endOffset(), sibling);
    pass.registerStandIn(standIn, marker);
    cursor = sibling.endOffset();
    anchor = standIn;
    anchorIsStandIn = true;
    return view;
  }

  // The node the invocation directly precedes, unless it encloses the invocation.
  @Nullable
  private SyntaxNode contextNode() {
    String clean = pass.cleanTree().text();
    int i = skipBlank(clean, invocation.endOffset(), /*comments=*/ true);
    if (i >= clean.length() || clean.charAt(i) == ';') {
      return null;
    }
    SyntaxNode root = pass.cleanRoot();
    SyntaxNode n = root.namedDescendantForRange(i, i);
    if (n == null || n == root || n.isComment() || n.startOffset() != i) {
      return null;
    }
    n = widen(n);
    if (n.covers(invocation.startOffset(), invocation.endOffset()) || pass.isConsumed(n)) {
      return null;
    }
    return n;
  }

  // The largest node starting where n starts that neither is the root nor encloses the invocation.
  private SyntaxNode widen(SyntaxNode n) {
    while (true) {
      SyntaxNode parent = n.parent();
      if (parent == null
          || parent.parent() == null
          || parent.startOffset() != n.startOffset()
          || parent.covers(invocation.startOffset(), invocation.endOffset())) {
        return n;
      }
      n = parent;
    }
  }

  // Descends to the first node of the requested type, or past an error.
  private static SyntaxNode narrow(SyntaxNode n, @Nullable String type) {
    SyntaxNode d = n;
    while (d != null && (d.isError() || (type != null && !type.equals(d.type())))) {
      d = firstItem(d);
    }
    return d == null ? n : d;
  }

  @Nullable
  private static SyntaxNode firstItem(SyntaxNode n) {
    for (SyntaxNode child : n.namedChildren()) {
      if (!child.isComment()) {
        return child;
      }
    }
    return null;
  }

  @Nullable
  private SyntaxNode firstAfter(SyntaxNode scope) {
    for (SyntaxNode child : scope.namedChildren()) {
      if (!child.isComment() && child.startOffset() >= cursor) {
        return child;
      }
    }
    return null;
  }

  @Nullable
  private static SyntaxNode nextCandidate(SyntaxNode n) {
    SyntaxNode next = n.nextNamedSibling();
    while (next != null && next.isComment()) {
      next = next.nextNamedSibling();
    }
    return next;
  }

  // Consumed code, empty statements, and the blanks left by invocations are not candidates.
  private boolean isSkipped(SyntaxNode n) {
    if (pass.isConsumed(n) || pass.invocationAt(n.startOffset(), n.endOffset()) != null) {
      return true;
    }
    return n.type().equals("expression_statement") && firstItem(n) == null;
  }

  private boolean isGap(int from, int to) {
    return skipBlank(pass.document().text(), from, options().commentsTransparent()) >= to;
  }

  private static int skipBlank(String text, int i, boolean comments) {
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (comments && text.startsWith("//", i)) {
        int nl = text.indexOf('\n', i);
        i = nl < 0 ? text.length() : nl + 1;
      } else if (comments && text.startsWith("/*", i)) {
        int close = text.indexOf("*/", i + 2);
        i = close < 0 ? text.length() : close + 2;
      } else {
        break;
      }
    }
    return i;
  }

  // --- deferred work ---

  /** Runs {@code callback} after every invocation of the pass, once all scoped tasks have run. */
  public void atRoot(DeferredCallback callback) {
    pass.deferred().add(callback, pass.cleanRoot(), invocation);
  }

  /**
   * Runs {@code callback} after every invocation of the pass, anchored at the innermost block
   * enclosing this context's node, or at the root if there is none. Tasks of inner blocks run
   * before those of the blocks enclosing them.
   */
  public void inScope(DeferredCallback callback) {
    SyntaxNode n =
        deferredAnchor != null
            ? deferredAnchor
            : pass.enclosingScope(invocation.startOffset(), invocation.endOffset());
    while (n != null && !n.type().equals("compound_statement")) {
      n = n.parent();
    }
    pass.deferred().add(callback, n == null ? pass.cleanRoot() : n, invocation);
  }

  /**
   * Registers a transform, run over the file at the end of this and every later pass. Registering
   * the same transform again has no effect.
   */
  public void registerTransform(Transform transform) {
    expander.registerTransform(transform);
  }

  // --- queries and matching ---

  /** Runs a tree query over the whole tree. */
  public ImmutableList<ImmutableMap<String, NodeView>> query(String query) {
    return query(query, root());
  }

  /**
   * Runs a tree query over the subtree of {@code node} and returns the captures of each match.
   *
   * @throws IllegalArgumentException if the query is malformed
   */
  public ImmutableList<ImmutableMap<String, NodeView>> query(String query, NodeView node) {
    ImmutableList.Builder<ImmutableMap<String, NodeView>> result = ImmutableList.builder();
    for (QueryMatch m : Query.compile(query).matches(node.unwrap())) {
      ImmutableMap.Builder<String, NodeView> captures = ImmutableMap.builder();
      for (Map.Entry<String, SyntaxNode> e : m.captures().entrySet()) {
        captures.put(e.getKey(), wrap(e.getValue()));
      }
      result.add(captures.build());
    }
    return result.build();
  }

  /**
   * Visits the subtree of {@code node} in pre-order. The visitor returns whether to visit the
   * children of the node it is given. A subtree whose visit fails is skipped and logged.
   */
  public void walk(NodeView node, Predicate<NodeView> visitor) {
    try {
      if (!visitor.test(node)) {
        return;
      }
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("walk failed at %s", node);
      return;
    }
    for (SyntaxNode child : node.unwrap().children()) {
      walk(wrap(child), visitor);
    }
  }

  private PatternMatcher matcher() {
    return expander.matcher();
  }

  /** Matches {@code target} itself against a pattern. */
  @Nullable
  public Match match(NodeView target, String pattern) {
    return match(target, pattern, false);
  }

  /**
   * Matches a pattern against {@code target}, or with {@code deep} against its subtree in
   * pre-order, returning the first match.
   *
   * @throws net.upp.java.pattern.InvalidPatternException if the pattern does not compile
   */
  @Nullable
  public Match match(NodeView target, String pattern, boolean deep) {
    CaptureSet captures = matcher().match(target.unwrap(), pattern, deep);
    return captures == null ? null : new Match(captures, this);
  }

  /** Returns every match of a pattern in the subtree of {@code target}, nested ones included. */
  public ImmutableList<Match> matchAll(NodeView target, String pattern) {
    ImmutableList.Builder<Match> result = ImmutableList.builder();
    for (CaptureSet captures : matcher().matchAll(target.unwrap(), pattern, true)) {
      result.add(new Match(captures, this));
    }
    return result.build();
  }

  /**
   * Replaces every outermost match of a pattern in the subtree of {@code target} by what {@code
   * replacer} returns for it; a null result leaves the match alone. Returns the number of
   * replacements registered.
   */
  @CanIgnoreReturnValue
  public int matchReplace(NodeView target, String pattern, Function<Match, String> replacer) {
    int count = 0;
    SyntaxNode last = null;
    for (Match m : matchAll(target, pattern)) {
      SyntaxNode n = m.node().unwrap();
      if (last != null && n.isDescendantOf(last)) {
        continue;
      }
      String content = replacer.apply(m);
      if (content != null) {
        replace(m.node(), content);
        last = n;
        count++;
      }
    }
    return count;
  }

  /**
   * Joins the text of the given parts: views, nodes, captures, matches and code by their text,
   * iterables by the text of their elements separated by {@code ", "}, null by nothing, and
   * anything else by {@link String#valueOf}.
   */
  public Code code(Object... parts) {
    StringBuilder buf = new StringBuilder();
    for (Object part : parts) {
      appendPart(buf, part);
    }
    return new Code(buf.toString());
  }

  private void appendPart(StringBuilder buf, @Nullable Object part) {
    if (part == null) {
      return;
    }
    if (part instanceof NodeView) {
      buf.append(((NodeView) part).text());
    } else if (part instanceof SyntaxNode) {
      buf.append(textOf((SyntaxNode) part));
    } else if (part instanceof Capture) {
      buf.append(textOf((Capture) part));
    } else if (part instanceof Match) {
      buf.append(((Match) part).node().text());
    } else if (part instanceof Iterable) {
      String sep = "";
      for (Object element : (Iterable<?>) part) {
        buf.append(sep);
        appendPart(buf, element);
        sep = ", ";
      }
    } else {
      buf.append(part);
    }
  }

  // --- errors ---

  /** Returns an exception, for the caller to throw, that aborts the expansion at the invocation. */
  public MacroException error(String message) {
    return new MacroException(MacroException.Kind.MACRO_ERROR, null, name(), message);
  }

  /** Returns an exception, for the caller to throw, that aborts the expansion at {@code node}. */
  public MacroException error(@Nullable NodeView node, String message) {
    return new MacroException(
        MacroException.Kind.MACRO_ERROR, node == null ? null : node.unwrap(), name(), message);
  }

  @FormatMethod
  public MacroException errorf(@Nullable NodeView node, String format, Object... args) {
    return error(node, String.format(format, args));
  }

  /** Reports a warning at {@code node}, or at the invocation, without aborting the expansion. */
  public void warn(@Nullable NodeView node, String message) {
    reportAt(
        node == null ? null : node.unwrap(),
        DiagnosticCode.UPP006,
        Diagnostic.Severity.WARNING,
        "%s",
        message);
  }

  @FormatMethod
  private void reportAt(
      @Nullable SyntaxNode node,
      DiagnosticCode code,
      Diagnostic.Severity severity,
      String format,
      Object... args) {
    ExpansionPass p = node == null ? null : pass.passFor(node);
    int offset;
    if (p != null) {
      offset = node.startOffset();
    } else {
      p = pass;
      offset = invocation != null ? invocation.startOffset() : 0;
    }
    expander
        .diagnostics()
        .report(code, severity, p.document().path(), p.document().text(), offset, format, args);
  }

  // --- helpers ---

  /** Returns an identifier starting with {@code prefix} that occurs nowhere in the file. */
  public String createUniqueIdentifier(String prefix) {
    String text = pass.document().root().text();
    String id;
    do {
      id = prefix + "_" + expander.nextUniqueId();
    } while (text.contains(id));
    return id;
  }

  /** Returns the nearest proper ancestor of {@code node} of the given type. */
  @Nullable
  public NodeView findEnclosing(NodeView node, String type) {
    for (SyntaxNode n = node.unwrap().parent(); n != null; n = n.parent()) {
      if (n.type().equals(type)) {
        return wrap(n);
      }
    }
    return null;
  }

  /** Returns the nearest ancestor of type {@code type} of the node enclosing the invocation. */
  @Nullable
  public NodeView findEnclosing(String type) {
    NodeView n = node();
    return n.type().equals(type) ? n : findEnclosing(n, type);
  }

  /** Returns the declaration of {@code name} visible at the invocation. */
  @Nullable
  public NodeView findDefinition(String name) {
    return isDeferred() ? findDefinition(name, node()) : findDefinition(name, wrap(usePoint()));
  }

  // The node at the invocation's position: the node it was blanked into, or else the first child
  // of the enclosing node that follows it.
  private SyntaxNode usePoint() {
    SyntaxNode n = node().unwrap();
    if (n.startOffset() >= invocation.startOffset()) {
      return n;
    }
    for (SyntaxNode child : n.children()) {
      if (child.startOffset() >= invocation.endOffset()) {
        return child;
      }
    }
    return n;
  }

  @Nullable
  public NodeView findDefinition(String name, NodeView from) {
    return wrap(expander.resolver().resolveSymbol(name, from.unwrap()));
  }

  /** Reports whether {@code node} overlaps a macro invocation of the current pass. */
  public boolean isInsideInvocation(NodeView node) {
    return pass.isInsideInvocation(node.startOffset(), node.endOffset());
  }

  /** Returns the identifiers named {@code name} in the whole tree. */
  public ImmutableList<NodeView> findReferences(String name) {
    return findReferences(name, root());
  }

  /** Returns the identifiers named {@code name} in the subtree of {@code scope}. */
  public ImmutableList<NodeView> findReferences(String name, NodeView scope) {
    if (!name.matches("[A-Za-z_$][A-Za-z0-9_$]*")) {
      return ImmutableList.of();
    }
    Query q = Query.compile("((identifier) @id (#eq? @id \"" + name + "\"))");
    return wrapAll(q.captures(scope.unwrap(), "id"));
  }

  /**
   * Expands the macro invocations in a code fragment and returns the result. The fragment is
   * expanded as a document of its own, within this context's document, for a bounded number of
   * passes.
   */
  public String expand(String fragment) throws MacroException {
    return expander.expandFragment(fragment, pass);
  }

  // --- defensive accessors: these return null, 0 or false instead of failing ---

  @Nullable
  public NodeView parent(@Nullable NodeView node) {
    try {
      return node == null ? null : wrap(node.unwrap().parent());
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("parent of %s", node);
      return null;
    }
  }

  @Nullable
  public NodeView child(@Nullable NodeView node, int i) {
    try {
      return node == null ? null : wrap(node.unwrap().child(i));
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("child %d of %s", i, node);
      return null;
    }
  }

  public int childCount(@Nullable NodeView node) {
    try {
      return node == null ? 0 : node.unwrap().childCount();
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("child count of %s", node);
      return 0;
    }
  }

  @Nullable
  public NodeView childForFieldName(@Nullable NodeView node, String field) {
    try {
      return node == null ? null : wrap(node.unwrap().childByFieldName(field));
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("field %s of %s", field, node);
      return null;
    }
  }

  @Nullable
  public NodeView nextNamedSibling(@Nullable NodeView node) {
    try {
      return node == null ? null : wrap(node.unwrap().nextNamedSibling());
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("next sibling of %s", node);
      return null;
    }
  }

  @Nullable
  public NodeView lastNamedChild(@Nullable NodeView node) {
    try {
      return node == null ? null : wrap(node.unwrap().lastNamedChild());
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("last child of %s", node);
      return null;
    }
  }

  /** Reports whether {@code node} lies within {@code ancestor}, or is it. */
  public boolean isDescendant(@Nullable NodeView node, @Nullable NodeView ancestor) {
    if (node == null || ancestor == null) {
      return false;
    }
    try {
      return node.unwrap().isDescendantOf(ancestor.unwrap());
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("descent of %s from %s", node, ancestor);
      return false;
    }
  }

  /**
   * Reports whether two views show the same node: the same object, or nodes of the same type and
   * range in the same tree.
   */
  public boolean isSameNode(@Nullable NodeView a, @Nullable NodeView b) {
    if (a == null || b == null) {
      return false;
    }
    if (a == b || a.unwrap() == b.unwrap()) {
      return true;
    }
    try {
      SyntaxNode x = a.unwrap();
      SyntaxNode y = b.unwrap();
      return x.root() == y.root()
          && x.type().equals(y.type())
          && x.startOffset() == y.startOffset()
          && x.endOffset() == y.endOffset();
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("comparing %s and %s", a, b);
      return false;
    }
  }

  @Override
  public String toString() {
    return isDeferred() ? "deferred context of @" + name() : "context of " + invocation;
  }
}
