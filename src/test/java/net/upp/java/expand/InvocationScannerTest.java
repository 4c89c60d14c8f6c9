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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.upp.java.syntax.SyntaxNode;
import net.upp.java.syntax.SyntaxTree;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link InvocationScanner}. */
@RunWith(JUnit4.class)
public class InvocationScannerTest {

  private static ImmutableList<MacroInvocation> scan(String text) {
    return InvocationScanner.scan(SyntaxTree.parse(text).root(), text);
  }

  @Test
  public void testFindsInvocationsInSourceOrder() {
    String text =
        "void f() {\n  @log(\"a, b\", g(x, y));\n  x = @twice(y) + 1;\n  @bare\n  int z;\n}";
    ImmutableList<MacroInvocation> invocations = scan(text);
    assertThat(invocations).hasSize(3);

    MacroInvocation log = invocations.get(0);
    assertThat(log.name()).isEqualTo("log");
    assertThat(log.text()).isEqualTo("@log(\"a, b\", g(x, y))");
    assertThat(log.args()).containsExactly("\"a, b\"", "g(x, y)").inOrder();
    assertThat(log.startOffset()).isEqualTo(text.indexOf("@log"));
    assertThat(log.endOffset()).isEqualTo(text.indexOf(";\n  x"));
    assertThat(log.isPending()).isTrue();

    MacroInvocation twice = invocations.get(1);
    assertThat(twice.name()).isEqualTo("twice");
    assertThat(twice.args()).containsExactly("y");

    MacroInvocation bare = invocations.get(2);
    assertThat(bare.text()).isEqualTo("@bare");
    assertThat(bare.args()).isEmpty();
    assertThat(bare.hasExplicitTarget()).isFalse();
  }

  @Test
  public void testNodeIdIsThatOfTheErrorNode() {
    String text = "void f() { @m(1); }";
    SyntaxTree tree = SyntaxTree.parse(text);
    SyntaxNode error = tree.root().namedChild(0).childByFieldName("body").namedChild(0);
    ImmutableList<MacroInvocation> invocations = InvocationScanner.scan(tree.root(), text);
    assertThat(invocations.get(0).nodeId()).isEqualTo(error.id());
  }

  @Test
  public void testInvocationInsideLargerError() {
    String text = "int x = @m(1) +;";
    SyntaxTree tree = SyntaxTree.parse(text);
    SyntaxNode error = tree.root().namedChild(0);
    assertThat(error.isError()).isTrue();
    assertThat(error.text()).isEqualTo(text);

    ImmutableList<MacroInvocation> invocations = InvocationScanner.scan(tree.root(), text);
    assertThat(invocations).hasSize(1);
    assertThat(invocations.get(0).text()).isEqualTo("@m(1)");
    assertThat(invocations.get(0).nodeId()).isEqualTo(error.child(3).id());
    assertThat(error.child(3).text()).isEqualTo("@");
  }

  @Test
  public void testSpaceAfterAtIsNotAnInvocation() {
    assertThat(scan("void f() { @ m(1); }")).isEmpty();
  }

  @Test
  public void testSpaceBeforeParenEndsInvocation() {
    ImmutableList<MacroInvocation> invocations = scan("@m (1);");
    assertThat(invocations).hasSize(1);
    assertThat(invocations.get(0).text()).isEqualTo("@m");
    assertThat(invocations.get(0).args()).isEmpty();
  }

  @Test
  public void testUnterminatedArgumentList() {
    ImmutableList<MacroInvocation> invocations = scan("@m(a, b");
    assertThat(invocations).hasSize(1);
    assertThat(invocations.get(0).text()).isEqualTo("@m(a, b");
    assertThat(invocations.get(0).args()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testSplitArgs() {
    assertThat(InvocationScanner.splitArgs("  ")).isEmpty();
    assertThat(InvocationScanner.splitArgs("a")).containsExactly("a");
    assertThat(InvocationScanner.splitArgs(" f(a, b) , [c, d], {e, f} "))
        .containsExactly("f(a, b)", "[c, d]", "{e, f}")
        .inOrder();
    assertThat(InvocationScanner.splitArgs("',', \"x\\\", y\", z"))
        .containsExactly("','", "\"x\\\", y\"", "z")
        .inOrder();
    assertThat(InvocationScanner.splitArgs("a,,b")).containsExactly("a", "", "b").inOrder();
  }

  @Test
  public void testMaskKeepsLayout() {
    String text = "void f() {\n  x = @t(1);\n  @m(a,\n    b);\n}";
    String masked = InvocationScanner.mask(text, scan(text));
    assertThat(masked).isEqualTo("void f() {\n  x = _____;\n       \n      ;\n}");
    assertThat(masked).hasLength(text.length());
    assertThat(SyntaxTree.parse(masked).errors()).isEmpty();
  }

  @Test
  public void testExpressionPosition() {
    assertThat(InvocationScanner.inExpressionPosition("return @x", 7)).isTrue();
    assertThat(InvocationScanner.inExpressionPosition("f(a, @x", 5)).isTrue();
    assertThat(InvocationScanner.inExpressionPosition("{ @x", 2)).isFalse();
    assertThat(InvocationScanner.inExpressionPosition("unreturn @x", 9)).isFalse();
    assertThat(InvocationScanner.inExpressionPosition("@x", 0)).isFalse();
  }
}
