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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link SyntaxTree}, mostly its incremental reparse. */
@RunWith(JUnit4.class)
public class SyntaxTreeTest {

  @Test
  public void testRootSpansWholeText() {
    String text = "  int a;  /* tail */\n\n";
    SyntaxTree tree = SyntaxTree.parse(text);
    assertThat(tree.root().type()).isEqualTo("translation_unit");
    assertThat(tree.root().startOffset()).isEqualTo(0);
    assertThat(tree.root().endOffset()).isEqualTo(text.length());
    assertThat(tree.text()).isEqualTo(text);
  }

  @Test
  public void testEmptyText() {
    SyntaxTree tree = SyntaxTree.parse("");
    assertThat(tree.errors()).isEmpty();
    assertThat(tree.root().childCount()).isEqualTo(0);
  }

  @Test
  public void testTreesHaveDistinctIds() {
    assertThat(SyntaxTree.parse("int a;").id()).isNotEqualTo(SyntaxTree.parse("int a;").id());
  }

  @Test
  public void testReparseKeepsIdsOfUnchangedNodes() {
    String before = "int a;\nint b;\n";
    String after = "int z;\n" + before;
    SyntaxTree old = SyntaxTree.parse(before);
    SyntaxNode oldA = old.root().namedChild(0);
    SyntaxNode oldB = old.root().namedChild(1);

    old.edit(InputEdit.between(before, after, 0, 0, 7));
    SyntaxTree tree = SyntaxTree.parse(after, old);

    SyntaxNode z = tree.root().namedChild(0);
    SyntaxNode a = tree.root().namedChild(1);
    SyntaxNode b = tree.root().namedChild(2);
    assertThat(a.id()).isEqualTo(oldA.id());
    assertThat(b.id()).isEqualTo(oldB.id());
    assertThat(b.childByFieldName("declarator").id())
        .isEqualTo(oldB.childByFieldName("declarator").id());
    assertThat(z.id()).isNotEqualTo(oldA.id());
    assertThat(z.id()).isNotEqualTo(oldB.id());
  }

  @Test
  public void testReparseGivesEditedNodesFreshIds() {
    String before = "int a = 1;\nint b = 2;\n";
    String after = "int a = 10;\nint b = 2;\n";
    SyntaxTree old = SyntaxTree.parse(before);
    SyntaxNode oldValue =
        old.root().namedChild(0).childByFieldName("declarator").childByFieldName("value");
    SyntaxNode oldB = old.root().namedChild(1);

    // Append "0" to the literal.
    old.edit(InputEdit.between(before, after, 9, 9, 10));
    SyntaxTree tree = SyntaxTree.parse(after, old);

    SyntaxNode value =
        tree.root().namedChild(0).childByFieldName("declarator").childByFieldName("value");
    assertThat(value.text()).isEqualTo("10");
    assertThat(value.id()).isNotEqualTo(oldValue.id());
    assertThat(tree.root().namedChild(1).id()).isEqualTo(oldB.id());
  }

  @Test
  public void testEditsAreCumulative() {
    SyntaxTree tree = SyntaxTree.parse("int a;");
    tree.edit(InputEdit.between("int a;", "int abc;", 5, 5, 7));
    tree.edit(InputEdit.between("int abc;", "int abc; int d;", 8, 8, 15));
    assertThat(tree.edits()).hasSize(2);
    assertThat(tree.mapOffset(5, false)).isEqualTo(7);
    assertThat(tree.mapOffset(6, true)).isEqualTo(8);
  }

  @Test
  public void testEditBeyondTextFails() {
    SyntaxTree tree = SyntaxTree.parse("int a;");
    assertThrows(
        IllegalArgumentException.class,
        () -> tree.edit(InputEdit.between("int a;", "", 0, 7, 0)));
  }

  @Test
  public void testMapOffsetAtInsertionPoint() {
    InputEdit insert = InputEdit.between("ab", "aXb", 1, 1, 2);
    assertThat(insert.mapOffset(1, false)).isEqualTo(2);
    assertThat(insert.mapOffset(1, true)).isEqualTo(1);
    assertThat(insert.mapOffset(0, false)).isEqualTo(0);

    InputEdit replace = InputEdit.between("abcd", "aXd", 1, 3, 2);
    assertThat(replace.mapOffset(2, false)).isEqualTo(-1);
    assertThat(replace.mapOffset(3, true)).isEqualTo(2);
    assertThat(replace.delta()).isEqualTo(-1);
  }

  @Test
  public void testInvalidEditRange() {
    assertThrows(
        IllegalArgumentException.class,
        () -> InputEdit.create(3, 2, 3, Position.START, Position.START, Position.START));
  }

  @Test
  public void testPositionOf() {
    assertThat(Position.of("ab\ncd", 4)).isEqualTo(Position.create(1, 1));
    assertThat(Position.of("ab\ncd", 0)).isEqualTo(Position.START);
  }
}
