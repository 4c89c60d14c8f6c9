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
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/**
 * Matches syntax trees against compiled patterns.
 *
 * <p>A literal pattern node matches a target node of the same type (declarations and parameter
 * declarations are interchangeable) whose non-comment children match its children positionally;
 * a leaf matches by text. A wildcard binds the target node after checking its constraints, and a
 * wildcard name used twice requires the same text both times. Optional and variadic wildcards are
 * matched by backtracking over split points, shortest first. {@code ERROR} nodes never match.
 *
 * <p>A failed match is a normal outcome and yields null or an empty list.
 */
public final class PatternMatcher {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final ImmutableSet<String> DECLARATION_TYPES =
      ImmutableSet.of("declaration", "parameter_declaration");

  private final PatternCompiler compiler;

  // Target nodes on the current match path.
  private final Set<SyntaxNode> path = Collections.newSetFromMap(new IdentityHashMap<>());

  public PatternMatcher() {
    this(new PatternCompiler());
  }

  public PatternMatcher(PatternCompiler compiler) {
    this.compiler = compiler;
  }

  public PatternCompiler compiler() {
    return compiler;
  }

  /** Matches {@code target} itself against {@code pattern}. */
  @Nullable
  public CaptureSet match(SyntaxNode target, String pattern) {
    return match(target, compiler.compile(pattern), false);
  }

  @Nullable
  public CaptureSet match(SyntaxNode target, String pattern, boolean deep) {
    return match(target, compiler.compile(pattern), deep);
  }

  /**
   * Matches {@code target} against {@code pattern}. If {@code deep}, searches the subtree in
   * pre-order and returns the first match.
   */
  @Nullable
  public CaptureSet match(SyntaxNode target, Pattern pattern, boolean deep) {
    CaptureSet result = matchHere(target, pattern);
    if (result != null || !deep) {
      return result;
    }
    for (SyntaxNode child : target.children()) {
      result = match(child, pattern, true);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  public ImmutableList<CaptureSet> matchAll(SyntaxNode target, String pattern, boolean deep) {
    return matchAll(target, compiler.compile(pattern), deep);
  }

  /**
   * Returns all matches of {@code pattern}. If {@code deep}, every node of the subtree is tried in
   * pre-order, nested matches included; a subtree whose matching fails unexpectedly is skipped.
   */
  public ImmutableList<CaptureSet> matchAll(SyntaxNode target, Pattern pattern, boolean deep) {
    ImmutableList.Builder<CaptureSet> result = ImmutableList.builder();
    if (deep) {
      collect(target, pattern, result);
    } else {
      CaptureSet m = matchHere(target, pattern);
      if (m != null) {
        result.add(m);
      }
    }
    return result.build();
  }

  private void collect(SyntaxNode node, Pattern pattern, ImmutableList.Builder<CaptureSet> result) {
    try {
      CaptureSet m = matchHere(node, pattern);
      if (m != null) {
        result.add(m);
      }
    } catch (RuntimeException e) {
      path.clear();
      logger.atFine().withCause(e).log("skipping %s while matching %s", node, pattern);
    }
    for (SyntaxNode child : node.children()) {
      collect(child, pattern, result);
    }
  }

  @Nullable
  private CaptureSet matchHere(SyntaxNode target, Pattern pattern) {
    Map<String, Capture> captures = new HashMap<>();
    if (!matchNode(pattern.root(), target, captures)) {
      return null;
    }
    return new CaptureSet(target, captures);
  }

  // structural match of a single pattern node against a single target node
  private boolean matchNode(PatternNode p, SyntaxNode t, Map<String, Capture> captures) {
    if (t.isError()) {
      return false;
    }
    if (p.isWildcard()) {
      Wildcard w = p.wildcard();
      return w.accepts(t) && bind(w.name(), Capture.single(t), captures);
    }
    if (p.type().equals(SyntaxNode.ERROR) || !sameType(p.type(), t.type())) {
      return false;
    }
    if (!path.add(t)) {
      return false;
    }
    try {
      boolean ignoreSemicolon = !p.type().equals(t.type());
      List<SyntaxNode> kids = significantChildren(t, ignoreSemicolon);
      List<PatternNode> pkids = p.children();
      if (ignoreSemicolon) {
        pkids = withoutSemicolon(pkids);
      }
      if (pkids.isEmpty()) {
        return kids.isEmpty() && p.text().equals(t.text());
      }
      return matchChildren(pkids, 0, kids, 0, captures);
    } finally {
      path.remove(t);
    }
  }

  private static boolean sameType(String a, String b) {
    return a.equals(b) || (DECLARATION_TYPES.contains(a) && DECLARATION_TYPES.contains(b));
  }

  private static List<SyntaxNode> significantChildren(SyntaxNode node, boolean ignoreSemicolon) {
    List<SyntaxNode> kids = new ArrayList<>(node.childCount());
    for (SyntaxNode child : node.children()) {
      if (child.isComment() || (ignoreSemicolon && !child.isNamed() && child.type().equals(";"))) {
        continue;
      }
      kids.add(child);
    }
    return kids;
  }

  private static List<PatternNode> withoutSemicolon(List<PatternNode> nodes) {
    List<PatternNode> result = new ArrayList<>(nodes.size());
    for (PatternNode n : nodes) {
      if (n.isWildcard() || n.isNamed() || !n.type().equals(";")) {
        result.add(n);
      }
    }
    return result;
  }

  // Matches pattern children ps[i:] against target children ts[j:], all of which must be used.
  // Captures are copied only where an alternative may have to be abandoned.
  private boolean matchChildren(
      List<PatternNode> ps, int i, List<SyntaxNode> ts, int j, Map<String, Capture> captures) {
    if (i == ps.size()) {
      return j == ts.size();
    }
    PatternNode p = ps.get(i);
    Cardinality cardinality = p.isWildcard() ? p.wildcard().cardinality() : Cardinality.SINGLE;
    switch (cardinality) {
      case SINGLE:
        return j < ts.size()
            && matchNode(p, ts.get(j), captures)
            && matchChildren(ps, i + 1, ts, j + 1, captures);

      case OPTIONAL:
        {
          Wildcard w = p.wildcard();
          if (j < ts.size()) {
            Map<String, Capture> trial = new HashMap<>(captures);
            SyntaxNode t = ts.get(j);
            if (!t.isError()
                && w.accepts(t)
                && bind(w.name(), Capture.single(t), trial)
                && matchChildren(ps, i + 1, ts, j + 1, trial)) {
              commit(trial, captures);
              return true;
            }
          }
          Map<String, Capture> trial = new HashMap<>(captures);
          if (matchChildren(ps, i + 1, ts, j, trial)) {
            commit(trial, captures);
            return true;
          }
          return false;
        }

      case VARIADIC_UNTIL:
      case VARIADIC_PLUS:
        {
          Wildcard w = p.wildcard();
          int min = cardinality == Cardinality.VARIADIC_PLUS ? 1 : 0;
          for (int k = j; k < j + min; k++) {
            if (k >= ts.size() || !acceptsElement(w, ts.get(k))) {
              return false;
            }
          }
          for (int k = j + min; k <= ts.size(); k++) {
            if (k > j + min && !acceptsElement(w, ts.get(k - 1))) {
              // Longer slices contain the same rejected node.
              return false;
            }
            Map<String, Capture> trial = new HashMap<>(captures);
            ImmutableList<SyntaxNode> slice = ImmutableList.copyOf(ts.subList(j, k));
            if (bind(w.name(), Capture.sequence(slice), trial)
                && matchChildren(ps, i + 1, ts, k, trial)) {
              commit(trial, captures);
              return true;
            }
          }
          return false;
        }
    }
    throw new IllegalStateException(cardinality.toString());
  }

  // Constraints apply to the named nodes of a slice; punctuation passes through.
  private static boolean acceptsElement(Wildcard w, SyntaxNode t) {
    if (t.isError()) {
      return false;
    }
    return !t.isNamed() || w.accepts(t);
  }

  private static void commit(Map<String, Capture> trial, Map<String, Capture> captures) {
    captures.clear();
    captures.putAll(trial);
  }

  // Binds name, or checks that an earlier binding has the same text.
  private static boolean bind(String name, Capture capture, Map<String, Capture> captures) {
    Capture previous = captures.get(name);
    if (previous != null) {
      return previous.text().equals(capture.text());
    }
    captures.put(name, capture);
    return true;
  }
}
