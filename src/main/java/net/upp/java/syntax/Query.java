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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.Nullable;

/**
 * A compiled tree query in s-expression form, in the style of tree-sitter queries.
 *
 * <pre>
 * query    = pattern {pattern}
 * pattern  = ('(' (type | '_') {child | predicate} ')' | '(' pattern {predicate} ')'
 *            | '[' pattern {pattern} ']' | '_' | string) {'@' name}
 * child    = [field ':'] pattern
 * predicate = '(' ('#eq?' | '#not-eq?' | '#match?') '@' name ('@' name | string) ')'
 * </pre>
 *
 * <p>{@code (type ...)} matches a named node of that type and {@code (_)} any named node; a bare
 * {@code _} matches any node and a string matches an anonymous node with that text. Child patterns
 * match an ordered subsequence of the node's children.
 */
public final class Query {

  private final String source;
  private final ImmutableList<Pat> patterns;

  private Query(String source, ImmutableList<Pat> patterns) {
    this.source = source;
    this.patterns = patterns;
  }

  /**
   * Compiles a query.
   *
   * @throws IllegalArgumentException if the query is malformed
   */
  public static Query compile(String source) {
    QueryParser p = new QueryParser(source);
    ImmutableList.Builder<Pat> patterns = ImmutableList.builder();
    p.skipSpace();
    while (!p.atEnd()) {
      patterns.add(p.parsePattern());
      p.skipSpace();
    }
    ImmutableList<Pat> list = patterns.build();
    if (list.isEmpty()) {
      throw new IllegalArgumentException("empty query");
    }
    return new Query(source, list);
  }

  public int patternCount() {
    return patterns.size();
  }

  /**
   * Returns every match of every pattern against the nodes of the subtree rooted at {@code root},
   * in pre-order; matches at the same node are ordered by pattern index.
   */
  public ImmutableList<QueryMatch> matches(SyntaxNode root) {
    ImmutableList.Builder<QueryMatch> result = ImmutableList.builder();
    collect(root, result);
    return result.build();
  }

  private void collect(SyntaxNode node, ImmutableList.Builder<QueryMatch> result) {
    for (int i = 0; i < patterns.size(); i++) {
      Map<String, SyntaxNode> captures = new LinkedHashMap<>();
      Pat pat = patterns.get(i);
      if (pat.match(node, captures)) {
        result.add(QueryMatch.create(i, ImmutableMap.copyOf(captures)));
      }
    }
    for (SyntaxNode child : node.children()) {
      collect(child, result);
    }
  }

  /** Returns the nodes captured as {@code name} across all matches under {@code root}. */
  public ImmutableList<SyntaxNode> captures(SyntaxNode root, String name) {
    ImmutableList.Builder<SyntaxNode> result = ImmutableList.builder();
    for (QueryMatch m : matches(root)) {
      SyntaxNode n = m.capture(name);
      if (n != null) {
        result.add(n);
      }
    }
    return result.build();
  }

  @Override
  public String toString() {
    return source;
  }

  // --- pattern representation ---

  private abstract static class Pat {
    final List<String> captureNames = new ArrayList<>();
    final List<Predicate> predicates = new ArrayList<>();

    final boolean match(SyntaxNode node, Map<String, SyntaxNode> captures) {
      if (!matchNode(node, captures)) {
        return false;
      }
      for (String name : captureNames) {
        captures.put(name, node);
      }
      return checkPredicates(captures);
    }

    abstract boolean matchNode(SyntaxNode node, Map<String, SyntaxNode> captures);

    boolean checkPredicates(Map<String, SyntaxNode> captures) {
      for (Predicate p : predicates) {
        if (!p.test(captures)) {
          return false;
        }
      }
      return true;
    }
  }

  private static final class Child {
    @Nullable final String field;
    final Pat pat;

    Child(@Nullable String field, Pat pat) {
      this.field = field;
      this.pat = pat;
    }
  }

  // (type child...) or (_ child...)
  private static final class NodePat extends Pat {
    @Nullable final String type; // null for (_)
    final List<Child> children = new ArrayList<>();

    NodePat(@Nullable String type) {
      this.type = type;
    }

    @Override
    boolean matchNode(SyntaxNode node, Map<String, SyntaxNode> captures) {
      if (!node.isNamed() || (type != null && !type.equals(node.type()))) {
        return false;
      }
      return matchChildren(0, node.children(), 0, captures);
    }

    private boolean matchChildren(
        int i, List<SyntaxNode> nodes, int j, Map<String, SyntaxNode> captures) {
      if (i == children.size()) {
        return true;
      }
      Child c = children.get(i);
      for (int k = j; k < nodes.size(); k++) {
        SyntaxNode n = nodes.get(k);
        if (c.field != null && !c.field.equals(n.fieldName())) {
          continue;
        }
        Map<String, SyntaxNode> trial = new LinkedHashMap<>(captures);
        if (c.pat.match(n, trial) && matchChildren(i + 1, nodes, k + 1, trial)) {
          captures.putAll(trial);
          return true;
        }
      }
      return false;
    }
  }

  // _
  private static final class AnyPat extends Pat {
    @Override
    boolean matchNode(SyntaxNode node, Map<String, SyntaxNode> captures) {
      return true;
    }
  }

  // "text"
  private static final class LiteralPat extends Pat {
    final String text;

    LiteralPat(String text) {
      this.text = text;
    }

    @Override
    boolean matchNode(SyntaxNode node, Map<String, SyntaxNode> captures) {
      return !node.isNamed() && node.type().equals(text);
    }
  }

  // [alt...]
  private static final class AltPat extends Pat {
    final List<Pat> alternatives = new ArrayList<>();

    @Override
    boolean matchNode(SyntaxNode node, Map<String, SyntaxNode> captures) {
      for (Pat alt : alternatives) {
        Map<String, SyntaxNode> trial = new LinkedHashMap<>(captures);
        if (alt.match(node, trial)) {
          captures.putAll(trial);
          return true;
        }
      }
      return false;
    }
  }

  private static final class Predicate {
    final String op;
    final String capture;
    @Nullable final String otherCapture;
    @Nullable final String literal;
    @Nullable final Pattern regex;

    Predicate(
        String op,
        String capture,
        @Nullable String otherCapture,
        @Nullable String literal,
        @Nullable Pattern regex) {
      this.op = op;
      this.capture = capture;
      this.otherCapture = otherCapture;
      this.literal = literal;
      this.regex = regex;
    }

    boolean test(Map<String, SyntaxNode> captures) {
      SyntaxNode n = captures.get(capture);
      if (n == null) {
        return true; // unbound captures do not constrain
      }
      String text = n.text();
      if (regex != null) {
        return regex.matcher(text).find();
      }
      String other;
      if (otherCapture != null) {
        SyntaxNode o = captures.get(otherCapture);
        if (o == null) {
          return true;
        }
        other = o.text();
      } else {
        other = literal;
      }
      boolean eq = text.equals(other);
      return op.equals("#eq?") ? eq : !eq;
    }
  }

  // --- parsing ---

  private static final class QueryParser {
    private final String src;
    private int pos;

    QueryParser(String src) {
      this.src = src;
    }

    boolean atEnd() {
      return pos >= src.length();
    }

    void skipSpace() {
      while (pos < src.length()) {
        char c = src.charAt(pos);
        if (Character.isWhitespace(c)) {
          pos++;
        } else if (c == ';') {
          while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
          }
        } else {
          break;
        }
      }
    }

    private IllegalArgumentException error(String message) {
      return new IllegalArgumentException(
          String.format("invalid query at offset %d: %s: %s", pos, message, src));
    }

    private char peek() {
      return pos < src.length() ? src.charAt(pos) : '\0';
    }

    private void expect(char c) {
      skipSpace();
      if (peek() != c) {
        throw error("expected '" + c + "'");
      }
      pos++;
    }

    private static boolean isNameChar(char c) {
      return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '?'
          || c == '!' || c == '#';
    }

    private String name() {
      int start = pos;
      while (pos < src.length() && isNameChar(src.charAt(pos))) {
        pos++;
      }
      if (start == pos) {
        throw error("expected name");
      }
      return src.substring(start, pos);
    }

    private String string() {
      expect('"');
      StringBuilder buf = new StringBuilder();
      while (pos < src.length() && src.charAt(pos) != '"') {
        char c = src.charAt(pos++);
        if (c == '\\' && pos < src.length()) {
          c = src.charAt(pos++);
          if (c == 'n') {
            c = '\n';
          } else if (c == 't') {
            c = '\t';
          }
        }
        buf.append(c);
      }
      if (atEnd()) {
        throw error("unclosed string");
      }
      pos++;
      return buf.toString();
    }

    Pat parsePattern() {
      skipSpace();
      Pat pat;
      char c = peek();
      if (c == '(' && isGroup()) {
        pos++;
        pat = parsePattern();
        while (true) {
          skipSpace();
          if (peek() == ')') {
            pos++;
            break;
          }
          if (peek() != '(') {
            throw error("expected predicate");
          }
          pat.predicates.add(parsePredicate());
        }
      } else if (c == '(') {
        pos++;
        skipSpace();
        String type = name();
        NodePat node = new NodePat(type.equals("_") ? null : type);
        while (true) {
          skipSpace();
          if (peek() == ')') {
            pos++;
            break;
          }
          if (atEnd()) {
            throw error("unclosed '('");
          }
          if (peek() == '(' && pos + 1 < src.length() && src.charAt(pos + 1) == '#') {
            node.predicates.add(parsePredicate());
            continue;
          }
          String field = null;
          if (Character.isLetter(peek())) {
            int save = pos;
            String word = name();
            skipSpace();
            if (peek() == ':') {
              pos++;
              field = word;
            } else {
              pos = save;
            }
          }
          node.children.add(new Child(field, parsePattern()));
        }
        pat = node;
      } else if (c == '[') {
        pos++;
        AltPat alt = new AltPat();
        while (true) {
          skipSpace();
          if (peek() == ']') {
            pos++;
            break;
          }
          if (atEnd()) {
            throw error("unclosed '['");
          }
          alt.alternatives.add(parsePattern());
        }
        if (alt.alternatives.isEmpty()) {
          throw error("empty alternation");
        }
        pat = alt;
      } else if (c == '_') {
        pos++;
        pat = new AnyPat();
      } else if (c == '"') {
        pat = new LiteralPat(string());
      } else {
        throw error("unexpected character '" + c + "'");
      }
      while (true) {
        skipSpace();
        if (peek() != '@') {
          break;
        }
        pos++;
        pat.captureNames.add(name());
      }
      return pat;
    }

    // Reports whether the '(' at pos opens a parenthesized pattern with predicates, as in
    // ((identifier) @id (#eq? @id "x")).
    private boolean isGroup() {
      int i = pos + 1;
      while (i < src.length() && Character.isWhitespace(src.charAt(i))) {
        i++;
      }
      return i < src.length() && src.charAt(i) == '(';
    }

    private Predicate parsePredicate() {
      expect('(');
      String op = name();
      if (!op.equals("#eq?") && !op.equals("#not-eq?") && !op.equals("#match?")) {
        throw error("unknown predicate " + op);
      }
      expect('@');
      String capture = name();
      skipSpace();
      Predicate p;
      if (peek() == '@') {
        if (op.equals("#match?")) {
          throw error("#match? needs a string");
        }
        pos++;
        p = new Predicate(op, capture, name(), null, null);
      } else {
        String arg = string();
        if (op.equals("#match?")) {
          try {
            p = new Predicate(op, capture, null, null, Pattern.compile(arg));
          } catch (PatternSyntaxException e) {
            throw error("bad regular expression: " + e.getDescription());
          }
        } else {
          p = new Predicate(op, capture, null, arg, null);
        }
      }
      expect(')');
      return p;
    }
  }
}
