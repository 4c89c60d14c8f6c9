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
import javax.annotation.Nullable;

/**
 * Parses code fragments: an expression, a statement or a run of statements, a declaration or a
 * whole function.
 *
 * <p>A fragment is first parsed as a file. If that fails, or yields more than one item, it is
 * parsed as the body of a synthetic function {@code void __upp_pattern() { ... }}, with a {@code ;}
 * appended if the fragment does not end with one. An expression statement stands for its
 * expression unless the fragment ends with {@code ;}, and several statements stand for the
 * enclosing block.
 */
public final class Fragment {

  /** Text placed before a fragment to parse it as statements. */
  public static final String WRAPPER_PREFIX = "void __upp_pattern() {\n";

  private static final String WRAPPER_SUFFIX = "\n}";

  private Fragment() {}

  /** Returns the node the fragment stands for, or null if it does not parse cleanly. */
  @Nullable
  public static SyntaxNode parse(String text) {
    boolean endsWithSemi = text.trim().endsWith(";");

    SyntaxNode top = SyntaxTree.parse(text).root();
    ImmutableList<SyntaxNode> items = items(top);
    if (!top.hasError() && items.size() == 1) {
      return drill(items.get(0), endsWithSemi);
    }

    SyntaxNode body = wrappedBody(text);
    if (body == null && !endsWithSemi) {
      body = wrappedBody(text + ";");
    }
    if (body != null) {
      ImmutableList<SyntaxNode> statements = items(body);
      if (statements.size() == 1) {
        return drill(statements.get(0), endsWithSemi);
      }
      if (!statements.isEmpty()) {
        return body;
      }
    }
    if (!top.hasError() && !items.isEmpty()) {
      return drill(items.get(0), endsWithSemi);
    }
    return null;
  }

  // Returns the body of the wrapper function around text, or null if it does not parse cleanly.
  @Nullable
  private static SyntaxNode wrappedBody(String text) {
    SyntaxNode root = SyntaxTree.parse(WRAPPER_PREFIX + text + WRAPPER_SUFFIX).root();
    ImmutableList<SyntaxNode> items = items(root);
    if (root.hasError() || items.size() != 1) {
      return null;
    }
    SyntaxNode function = items.get(0);
    if (!function.type().equals("function_definition")) {
      return null;
    }
    return function.childByFieldName("body");
  }

  /** Returns the named children of a node, comments excluded. */
  public static ImmutableList<SyntaxNode> items(SyntaxNode node) {
    ImmutableList.Builder<SyntaxNode> items = ImmutableList.builder();
    for (SyntaxNode child : node.children()) {
      if (child.isNamed() && !child.isComment()) {
        items.add(child);
      }
    }
    return items.build();
  }

  // An expression statement stands for its expression unless the fragment ends with ';'.
  private static SyntaxNode drill(SyntaxNode item, boolean endsWithSemi) {
    if (item.type().equals("expression_statement") && !endsWithSemi) {
      ImmutableList<SyntaxNode> inner = items(item);
      if (inner.size() == 1) {
        return inner.get(0);
      }
    }
    return item;
  }
}
