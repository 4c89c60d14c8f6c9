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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FragmentTest {

  @Test
  public void testTopLevelDeclaration() {
    SyntaxNode node = Fragment.parse("int x = 1;");
    assertThat(node.type()).isEqualTo("declaration");
    assertThat(node.text()).isEqualTo("int x = 1;");
  }

  @Test
  public void testExpressionWithoutSemicolon() {
    SyntaxNode node = Fragment.parse("a + b");
    assertThat(node.type()).isEqualTo("binary_expression");
    assertThat(node.text()).isEqualTo("a + b");
  }

  @Test
  public void testStatementKeepsSemicolon() {
    SyntaxNode node = Fragment.parse("f(x);");
    assertThat(node.type()).isEqualTo("expression_statement");
  }

  @Test
  public void testControlStatement() {
    assertThat(Fragment.parse("while (x) x--;").type()).isEqualTo("while_statement");
  }

  @Test
  public void testSeveralStatements() {
    SyntaxNode node = Fragment.parse("a = 1; b = 2;");
    assertThat(node.type()).isEqualTo("compound_statement");
    assertThat(Fragment.items(node)).hasSize(2);
  }

  @Test
  public void testUnparsable() {
    assertThat(Fragment.parse("int = ) (")).isNull();
  }
}
