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
 * A MacroException aborts the expansion of one macro invocation. It records what went wrong, the
 * node the failure is about (if any) and the name of the macro being expanded.
 */
public class MacroException extends Exception {

  /** The kind of failure. */
  public enum Kind {
    /** A macro called {@code consume} and found no acceptable node. */
    CONSUMPTION,
    /** A macro reported an error through its context. */
    MACRO_ERROR,
    /** An invocation supplied the wrong number of arguments. */
    ARITY,
    /** An invocation names no registered macro. */
    UNKNOWN_MACRO
  }

  private final Kind kind;
  @Nullable private final SyntaxNode node;
  private final String macroName;
  private boolean reported;

  public MacroException(Kind kind, @Nullable SyntaxNode node, String macroName, String message) {
    super(message);
    this.kind = kind;
    this.node = node;
    this.macroName = macroName;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the node the failure is about, or null if it is about the invocation itself. */
  @Nullable
  public SyntaxNode node() {
    return node;
  }

  public String macroName() {
    return macroName;
  }

  // A fragment expansion reports the failure before it unwinds into the enclosing macro.
  boolean isReported() {
    return reported;
  }

  void markReported() {
    reported = true;
  }
}
