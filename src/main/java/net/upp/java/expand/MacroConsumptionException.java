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

/**
 * Thrown by {@link ExpansionContext#consume} when no node is found where one is required, or when
 * the node found fails the caller's type filter or validator.
 */
public final class MacroConsumptionException extends MacroException {

  public MacroConsumptionException(@Nullable SyntaxNode node, String macroName, String message) {
    super(Kind.CONSUMPTION, node, macroName, message);
  }
}
