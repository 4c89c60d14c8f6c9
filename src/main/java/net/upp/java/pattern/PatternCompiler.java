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
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import net.upp.java.syntax.Fragment;
import net.upp.java.syntax.SyntaxNode;

/**
 * Compiles pattern strings into {@link Pattern}s. Compiled patterns are cached for the lifetime of
 * the compiler.
 *
 * <p>A pattern is ordinary source text in which wildcards stand for code. The compiler rewrites
 * every wildcard to a plain {@code $name} identifier, parses the result, and turns each node whose
 * whole text is a wildcard (optionally followed by {@code ;}) into a wildcard node, the outermost
 * such node winning. The node the pattern stands for is chosen as for any {@link Fragment}.
 */
public final class PatternCompiler {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final java.util.regex.Pattern WILDCARD =
      java.util.regex.Pattern.compile("(?<![A-Za-z0-9_$])(opt)?\\$([A-Za-z_][A-Za-z0-9_]*)");

  private static final java.util.regex.Pattern WHOLE_WILDCARD =
      java.util.regex.Pattern.compile("^\\$([A-Za-z_][A-Za-z0-9_]*)\\s*;?$");

  private final Map<String, Pattern> cache = new HashMap<>();

  /**
   * Returns the compiled form of {@code text}.
   *
   * @throws InvalidPatternException if the text does not parse, even as a statement sequence, or
   *     declares a wildcard inconsistently
   */
  public Pattern compile(String text) {
    Pattern p = cache.get(text);
    if (p == null) {
      p = doCompile(text);
      cache.put(text, p);
    }
    return p;
  }

  /** Returns the number of cached patterns. */
  int cacheSize() {
    return cache.size();
  }

  private static Pattern doCompile(String text) {
    Map<String, Wildcard> wildcards = new LinkedHashMap<>();
    String plain = extractWildcards(text, wildcards);
    SyntaxNode root = Fragment.parse(plain);
    if (root == null) {
      throw new InvalidPatternException(text, "pattern does not parse");
    }
    logger.atFine().log("compiled pattern %s to %s", text, root.type());
    PatternNode compiled = convert(root, wildcards);
    if (compiled.isWildcard() && compiled.wildcard().cardinality() != Cardinality.SINGLE) {
      throw new InvalidPatternException(
          text, "optional and variadic wildcards may only appear among siblings");
    }
    return new Pattern(text, compiled, ImmutableMap.copyOf(wildcards));
  }

  // Replaces every wildcard by $name and records its declaration.
  private static String extractWildcards(String text, Map<String, Wildcard> wildcards) {
    StringBuilder plain = new StringBuilder();
    Matcher m = WILDCARD.matcher(text);
    int last = 0;
    while (m.find()) {
      Wildcard w = parseWildcard(text, m.group(1) != null, m.group(2));
      Wildcard previous = wildcards.get(w.name());
      if (previous == null) {
        wildcards.put(w.name(), w);
      } else if (!previous.equals(w) && !isBare(w)) {
        if (!isBare(previous)) {
          throw new InvalidPatternException(
              text, "wildcard $" + w.name() + " declared as both " + previous + " and " + w);
        }
        wildcards.put(w.name(), w);
      }
      plain.append(text, last, m.start()).append('$').append(w.name());
      last = m.end();
    }
    plain.append(text, last, text.length());
    return plain.toString();
  }

  private static boolean isBare(Wildcard w) {
    return w.constraints().isEmpty() && w.cardinality() == Cardinality.SINGLE;
  }

  private static Wildcard parseWildcard(String text, boolean opt, String body) {
    String[] parts = body.split("__", -1);
    String name = parts[0];
    if (name.isEmpty()) {
      throw new InvalidPatternException(text, "wildcard without a name: $" + body);
    }
    if (name.equals(CaptureSet.NODE)) {
      throw new InvalidPatternException(
          text, "wildcard name '" + CaptureSet.NODE + "' is reserved");
    }
    Cardinality cardinality = opt ? Cardinality.OPTIONAL : Cardinality.SINGLE;
    ImmutableList.Builder<ConstraintSpec> constraints = ImmutableList.builder();
    for (int i = 1; i < parts.length; i++) {
      String part = parts[i];
      if (part.isEmpty()) {
        throw new InvalidPatternException(text, "empty constraint in $" + body);
      }
      if (part.equals("until") || part.equals("plus")) {
        if (cardinality != Cardinality.SINGLE) {
          throw new InvalidPatternException(text, "conflicting repetition in $" + body);
        }
        cardinality =
            part.equals("until") ? Cardinality.VARIADIC_UNTIL : Cardinality.VARIADIC_PLUS;
      } else {
        constraints.add(ConstraintSpec.parse(part));
      }
    }
    return Wildcard.create(name, constraints.build(), cardinality);
  }

  private static PatternNode convert(SyntaxNode node, Map<String, Wildcard> wildcards) {
    Matcher m = WHOLE_WILDCARD.matcher(node.text().trim());
    if (m.matches() && wildcards.containsKey(m.group(1))) {
      return PatternNode.wildcard(wildcards.get(m.group(1)), node);
    }
    ImmutableList.Builder<PatternNode> children = ImmutableList.builder();
    for (SyntaxNode child : node.children()) {
      if (!child.isComment()) {
        children.add(convert(child, wildcards));
      }
    }
    return PatternNode.literal(node, children.build());
  }
}
