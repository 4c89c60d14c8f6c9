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

import java.util.ArrayList;
import java.util.List;
import net.upp.java.syntax.SyntaxNode;
import net.upp.java.syntax.SyntaxTree;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the order in which {@link DeferredTaskQueue} hands out tasks. */
@RunWith(JUnit4.class)
public class DeferredTaskQueueTest {

  private static final DeferredCallback NOOP = ctx -> {};

  private static List<Integer> drain(DeferredTaskQueue queue) {
    List<Integer> order = new ArrayList<>();
    DeferredTask task;
    while ((task = queue.poll()) != null) {
      order.add(task.sequence);
    }
    return order;
  }

  @Test
  public void testInnerScopesRunFirst() {
    SyntaxNode root = SyntaxTree.parse("void f() { { int a; } { int b; } }").root();
    SyntaxNode body = root.namedChild(0).childByFieldName("body");
    SyntaxNode first = body.namedChild(0);
    SyntaxNode second = body.namedChild(1);

    DeferredTaskQueue queue = new DeferredTaskQueue();
    queue.add(NOOP, root, null); // 0
    queue.add(NOOP, second, null); // 1
    queue.add(NOOP, body, null); // 2
    queue.add(NOOP, first, null); // 3
    queue.add(NOOP, second, null); // 4
    assertThat(queue.size()).isEqualTo(5);

    assertThat(drain(queue)).containsExactly(3, 1, 4, 2, 0).inOrder();
    assertThat(queue.isEmpty()).isTrue();
  }

  @Test
  public void testNestedNodesWithSameRangeRunDeepestFirst() {
    // The body of f ends where the function definition ends.
    SyntaxNode root = SyntaxTree.parse("void f() { }").root();
    SyntaxNode function = root.namedChild(0);
    SyntaxNode body = function.childByFieldName("body");
    assertThat(body.endOffset()).isEqualTo(function.endOffset());

    DeferredTaskQueue queue = new DeferredTaskQueue();
    queue.add(NOOP, function, null);
    queue.add(NOOP, body, null);
    assertThat(drain(queue)).containsExactly(1, 0).inOrder();
  }

  @Test
  public void testTasksAddedWhileDraining() {
    SyntaxNode root = SyntaxTree.parse("void f() { { } }").root();
    SyntaxNode inner = root.namedChild(0).childByFieldName("body").namedChild(0);
    DeferredTaskQueue queue = new DeferredTaskQueue();
    queue.add(NOOP, root, null);
    assertThat(queue.poll().sequence).isEqualTo(0);
    queue.add(NOOP, inner, null);
    queue.add(NOOP, root, null);
    assertThat(drain(queue)).containsExactly(1, 2).inOrder();
  }
}
