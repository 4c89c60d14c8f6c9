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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Query}. */
@RunWith(JUnit4.class)
public class QueryTest {

  private static final String SOURCE =
      "int f(int a) { return g(a) + g(1); }\nint h() { return f(2); }\n";

  private static ImmutableList<String> texts(ImmutableList<SyntaxNode> nodes) {
    ImmutableList.Builder<String> texts = ImmutableList.builder();
    for (SyntaxNode n : nodes) {
      texts.add(n.text());
    }
    return texts.build();
  }

  @Test
  public void testCapturesInPreOrder() throws Exception {
    SyntaxNode root = SyntaxTree.parseStrict(SOURCE).root();
    Query q = Query.compile("(call_expression function: (identifier) @fn)");
    assertThat(texts(q.captures(root, "fn"))).containsExactly("g", "g", "f").inOrder();
  }

  @Test
  public void testFieldMismatch() throws Exception {
    SyntaxNode root = SyntaxTree.parseStrict(SOURCE).root();
    Query q = Query.compile("(call_expression arguments: (identifier) @fn)");
    assertThat(q.matches(root)).isEmpty();
  }

  @Test
  public void testEqPredicate() throws Exception {
    SyntaxNode root = SyntaxTree.parseStrict(SOURCE).root();
    Query q =
        Query.compile(
            "((call_expression function: (identifier) @fn arguments: (argument_list (_) @arg))"
                + " (#eq? @fn \"g\"))");
    ImmutableList<QueryMatch> matches = q.matches(root);
    assertThat(matches).hasSize(2);
    assertThat(matches.get(0).capture("arg").text()).isEqualTo("a");
    assertThat(matches.get(1).capture("arg").text()).isEqualTo("1");
  }

  @Test
  public void testMatchPredicate() throws Exception {
    SyntaxNode root = SyntaxTree.parseStrict(SOURCE).root();
    Query q = Query.compile("((_) @v (#match? @v \"^[0-9]+$\"))");
    assertThat(texts(q.captures(root, "v"))).containsExactly("1", "2").inOrder();
  }

  @Test
  public void testAlternation() throws Exception {
    SyntaxNode root = SyntaxTree.parseStrict(SOURCE).root();
    Query q = Query.compile("[(number_literal) (parameter_declaration)] @v");
    assertThat(texts(q.captures(root, "v"))).containsExactly("int a", "1", "2").inOrder();
  }

  @Test
  public void testAnonymousLiteral() throws Exception {
    SyntaxNode root = SyntaxTree.parseStrict(SOURCE).root();
    Query q = Query.compile("(binary_expression \"+\" right: (_) @r)");
    assertThat(texts(q.captures(root, "r"))).containsExactly("g(1)");
  }

  @Test
  public void testSeveralPatterns() throws Exception {
    SyntaxNode root = SyntaxTree.parseStrict(SOURCE).root();
    Query q = Query.compile("; functions\n(function_definition) @def\n(return_statement) @ret");
    assertThat(q.patternCount()).isEqualTo(2);
    ImmutableList<QueryMatch> matches = q.matches(root);
    assertThat(matches).hasSize(4);
    assertThat(matches.get(0).patternIndex()).isEqualTo(0);
    assertThat(matches.get(1).patternIndex()).isEqualTo(1);
  }

  @Test
  public void testMalformedQueries() {
    assertThrows(IllegalArgumentException.class, () -> Query.compile(""));
    assertThrows(IllegalArgumentException.class, () -> Query.compile("(identifier"));
    assertThrows(
        IllegalArgumentException.class, () -> Query.compile("((identifier) @a (#foo? @a))"));
    assertThrows(IllegalArgumentException.class, () -> Query.compile("[]"));
  }
}
