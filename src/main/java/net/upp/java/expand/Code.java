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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import net.upp.java.syntax.SyntaxNode;
import net.upp.java.syntax.SyntaxTree;

/** Generated source text, parsed on first request. */
public final class Code {

  private final String text;
  private final Supplier<SyntaxTree> tree;

  Code(String text) {
    this.text = text;
    this.tree = Suppliers.memoize(() -> SyntaxTree.parse(text));
  }

  public String text() {
    return text;
  }

  /** Returns the parse of the text as a file. */
  public SyntaxTree lazyTree() {
    return tree.get();
  }

  public SyntaxNode root() {
    return lazyTree().root();
  }

  @Override
  public String toString() {
    return text;
  }
}
