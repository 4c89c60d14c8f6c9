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

package net.upp.java.edit;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import net.upp.java.syntax.SyntaxNode;
import net.upp.java.syntax.SyntaxTree;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Document}. */
@RunWith(JUnit4.class)
public class DocumentTest {

  @Test
  public void testSpliceMovesMarkers() {
    Document doc = new Document("a.c", "abcdef");
    Marker atStart = doc.createMarker(0, null);
    Marker inside = doc.createMarker(2, null);
    Marker after = doc.createMarker(5, "payload");

    assertThat(doc.splice(2, 1, "XY")).isEqualTo("abXYdef");

    assertThat(doc.markers().offset(atStart)).isEqualTo(0);
    assertThat(doc.markers().isValid(inside)).isFalse();
    assertThat(doc.markers().offset(after)).isEqualTo(6);
    assertThat(doc.markers().payload(after)).isEqualTo("payload");
  }

  @Test
  public void testMarkerAtInsertionPointStays() {
    Document doc = new Document("a.c", "abc");
    Marker m = doc.createMarker(1, null);
    doc.splice(1, 0, "XYZ");
    assertThat(doc.text()).isEqualTo("aXYZbc");
    assertThat(doc.markers().offset(m)).isEqualTo(1);
  }

  @Test
  public void testMarkerAtEndOfDeletionShifts() {
    Document doc = new Document("a.c", "abcdef");
    Marker m = doc.createMarker(4, null);
    doc.splice(1, 3, "");
    assertThat(doc.text()).isEqualTo("aef");
    assertThat(doc.markers().offset(m)).isEqualTo(1);
  }

  @Test
  public void testInvalidatedMarkerThrows() {
    Document doc = new Document("a.c", "int a;");
    Marker m = doc.createMarker(4, null);
    doc.splice(3, 2, "");
    MarkerInvalidatedException e =
        assertThrows(MarkerInvalidatedException.class, () -> doc.resolveNode(m));
    assertThat(e.marker()).isEqualTo(m);
  }

  @Test
  public void testSpliceClampsArguments() {
    Document doc = new Document("a.c", "abc");
    assertThat(doc.splice(10, 5, "d")).isEqualTo("abcd");
    assertThat(doc.splice(-3, 1, "")).isEqualTo("bcd");
    assertThat(doc.splice(1, 0, "")).isEqualTo("bcd");
  }

  @Test
  public void testSpliceMarksTreeStale() {
    Document doc = new Document("a.c", "int a;");
    SyntaxTree before = doc.tree();
    doc.splice(5, 0, ", b");
    assertThat(doc.isStale()).isTrue();
    SyntaxTree after = doc.tree();
    assertThat(doc.isStale()).isFalse();
    assertThat(after).isNotSameInstanceAs(before);
    assertThat(after.root().namedChild(0).text()).isEqualTo("int a, b;");
  }

  @Test
  public void testResolveNodeFollowsEdits() {
    Document doc = new Document("a.c", "int a;\nint b;\n");
    Marker m = doc.createMarker(11, null);
    assertThat(doc.resolveNode(m).text()).isEqualTo("b");

    doc.splice(0, 0, "int z;\n");
    SyntaxNode b = doc.resolveNode(m);
    assertThat(b.type()).isEqualTo("identifier");
    assertThat(b.text()).isEqualTo("b");
    assertThat(doc.resolveNode(m, "declaration", null).text()).isEqualTo("int b;");
  }

  @Test
  public void testResolveNodeById() {
    Document doc = new Document("a.c", "void f() { g(x); }");
    SyntaxNode call =
        doc.tree().root().namedChild(0).childByFieldName("body").namedChild(0).namedChild(0);
    Marker m = doc.createMarker(call.startOffset() + 2, null);
    assertThat(doc.resolveNode(m, null, call.id()).type()).isEqualTo("call_expression");
    assertThat(doc.resolveNode(m, "while_statement", null).type()).isEqualTo("identifier");
  }

  @Test
  public void testMarkersMigrateOnReparse() {
    Document doc = new Document("a.c", "int a;");
    Marker m = doc.createMarker(4, null);
    int oldTree = doc.tree().id();
    doc.splice(0, 0, "\n");
    doc.reparse();
    assertThat(doc.markers().treeId(m)).isEqualTo(doc.tree().id());
    assertThat(doc.markers().markers(oldTree)).isEmpty();
    assertThat(doc.markers().markers(doc.tree().id())).containsExactly(m);
  }

  @Test
  public void testInstallTreeChecksLength() {
    Document doc = new Document("a.c", "int a;");
    assertThrows(IllegalArgumentException.class, () -> doc.installTree(SyntaxTree.parse("int")));
    doc.installTree(SyntaxTree.parse("int b;"));
    assertThat(doc.tree().root().namedChild(0).text()).isEqualTo("int b;");
    assertThat(doc.text()).isEqualTo("int a;");
  }

  @Test
  public void testDestroyMarker() {
    Document doc = new Document("a.c", "abc");
    Marker m = doc.createMarker(1, null);
    doc.destroyMarker(m);
    assertThat(doc.markers().contains(m)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> doc.destroyMarker(m));
  }

  @Test
  public void testParentChain() {
    Document file = new Document("a.c", "int a;");
    Document fragment = new Document("a.c#fragment1", "x", file);
    Document nested = new Document("a.c#fragment2", "y", fragment);
    assertThat(nested.root()).isSameInstanceAs(file);
    assertThat(file.parent()).isNull();
    assertThat(fragment.toString()).isEqualTo("a.c#fragment1 (within a.c)");
  }
}
