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
import java.util.List;
import net.upp.java.syntax.SyntaxNode;

/**
 * Finds the macro invocations of a document in its parse tree, and blanks them out of its text.
 *
 * <p>The parser turns every invocation into an {@code ERROR} node, or into part of one when it
 * occurs where no statement, declaration or expression may begin. The scanner reads the leaves of
 * each outermost error node: an {@code @} leaf immediately followed by a name, itself optionally
 * followed at once by a parenthesized argument list, is an invocation.
 */
final class InvocationScanner {

  private InvocationScanner() {}

  /** Returns the invocations under {@code root}, in source order. */
  static ImmutableList<MacroInvocation> scan(SyntaxNode root, String text) {
    List<MacroInvocation> found = new ArrayList<>();
    collect(root, text, found);
    return ImmutableList.copyOf(found);
  }

  private static void collect(SyntaxNode node, String text, List<MacroInvocation> found) {
    if (node.isError()) {
      List<SyntaxNode> leaves = new ArrayList<>();
      leaves(node, leaves);
      scanLeaves(node, leaves, text, found);
      return;
    }
    for (SyntaxNode child : node.children()) {
      collect(child, text, found);
    }
  }

  private static void leaves(SyntaxNode node, List<SyntaxNode> out) {
    if (node.childCount() == 0) {
      out.add(node);
      return;
    }
    for (SyntaxNode child : node.children()) {
      leaves(child, out);
    }
  }

  private static void scanLeaves(
      SyntaxNode error, List<SyntaxNode> leaves, String text, List<MacroInvocation> found) {
    int i = 0;
    while (i < leaves.size()) {
      SyntaxNode at = leaves.get(i);
      if (!at.text().equals("@") || i + 1 >= leaves.size()) {
        i++;
        continue;
      }
      SyntaxNode name = leaves.get(i + 1);
      if (name.startOffset() != at.endOffset() || !isName(name.text())) {
        i++;
        continue;
      }
      int end = name.endOffset();
      int next = i + 2;
      ImmutableList<String> args = ImmutableList.of();
      if (next < leaves.size()
          && leaves.get(next).text().equals("(")
          && leaves.get(next).startOffset() == end) {
        int depth = 0;
        int j = next;
        for (; j < leaves.size(); j++) {
          String t = leaves.get(j).text();
          if (t.equals("(")) {
            depth++;
          } else if (t.equals(")") && --depth == 0) {
            break;
          }
        }
        if (j < leaves.size()) {
          end = leaves.get(j).endOffset();
          args = splitArgs(text.substring(leaves.get(next).endOffset(), end - 1));
          next = j + 1;
        } else {
          // Unterminated: the invocation runs to the end of the error.
          end = leaves.get(leaves.size() - 1).endOffset();
          args = splitArgs(text.substring(leaves.get(next).endOffset(), end));
          next = leaves.size();
        }
      }
      int start = at.startOffset();
      int nodeId =
          error.startOffset() == start && error.endOffset() == end ? error.id() : at.id();
      found.add(
          new MacroInvocation(
              name.text(), args, start, end, nodeId, text.substring(start, end)));
      i = next;
    }
  }

  private static boolean isName(String s) {
    if (s.isEmpty()
        || !(Character.isLetter(s.charAt(0)) || s.charAt(0) == '_' || s.charAt(0) == '$')) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      char c = s.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$')) {
        return false;
      }
    }
    return true;
  }

  /**
   * Splits an argument list at the commas outside brackets, string and char literals, and trims
   * each argument. An empty or blank list has no arguments.
   */
  static ImmutableList<String> splitArgs(String list) {
    if (list.trim().isEmpty()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> args = ImmutableList.builder();
    int depth = 0;
    int from = 0;
    char quote = 0;
    for (int i = 0; i < list.length(); i++) {
      char c = list.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      switch (c) {
        case '"':
        case '\'':
          quote = c;
          break;
        case '(':
        case '[':
        case '{':
          depth++;
          break;
        case ')':
        case ']':
        case '}':
          depth--;
          break;
        case ',':
          if (depth == 0) {
            args.add(list.substring(from, i).trim());
            from = i + 1;
          }
          break;
        default:
          break;
      }
    }
    args.add(list.substring(from).trim());
    return args.build();
  }

  /**
   * Returns {@code text} with every invocation replaced by a run of the same length: underscores,
   * which parse as an identifier, where an expression is expected, and spaces elsewhere. Newlines
   * are kept so that rows and columns are unchanged.
   */
  static String mask(String text, List<MacroInvocation> invocations) {
    char[] chars = text.toCharArray();
    for (MacroInvocation inv : invocations) {
      char fill = inExpressionPosition(text, inv.startOffset()) ? '_' : ' ';
      for (int i = inv.startOffset(); i < inv.endOffset(); i++) {
        if (chars[i] != '\n') {
          chars[i] = fill;
        }
      }
    }
    return new String(chars);
  }

  private static final String EXPRESSION_PRECEDERS = "=([,?:!~+-*/%<>&|^";

  // An invocation stands for an expression after an operator, an opening bracket, or 'return'.
  static boolean inExpressionPosition(String text, int offset) {
    int i = offset - 1;
    while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
      i--;
    }
    if (i < 0) {
      return false;
    }
    char c = text.charAt(i);
    if (EXPRESSION_PRECEDERS.indexOf(c) >= 0) {
      return true;
    }
    int wordEnd = i + 1;
    while (i >= 0
        && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
      i--;
    }
    return text.substring(i + 1, wordEnd).equals("return");
  }
}
