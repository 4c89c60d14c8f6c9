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

import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/** Finds the declaration a name refers to. */
public interface SymbolResolver {

  /**
   * Returns the node declaring {@code name} as seen from {@code context}, or null if the name is
   * not declared there.
   */
  @Nullable
  SyntaxNode resolveSymbol(String name, SyntaxNode context);
}
