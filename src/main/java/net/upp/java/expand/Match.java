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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;
import net.upp.java.pattern.Capture;
import net.upp.java.pattern.CaptureSet;

/** A successful pattern match, with its captures seen through an expansion context. */
public final class Match {

  private final CaptureSet captures;
  private final ExpansionContext ctx;

  Match(CaptureSet captures, ExpansionContext ctx) {
    this.captures = captures;
    this.ctx = ctx;
  }

  /** Returns the node the pattern matched. */
  public NodeView node() {
    return ctx.wrap(captures.node());
  }

  public boolean has(String name) {
    return captures.has(name);
  }

  /** Returns the node captured by a single wildcard, or null if it captured none. */
  @Nullable
  public NodeView node(String name) {
    return ctx.wrap(captures.node(name));
  }

  /** Returns the named nodes captured by a wildcard. */
  public ImmutableList<NodeView> nodes(String name) {
    return ctx.wrapAll(captures.nodes(name));
  }

  /**
   * Returns the text captured by a wildcard, spanning the whole captured sequence for a variadic
   * one, or null if the name captured nothing.
   */
  @Nullable
  public String text(String name) {
    Capture c = captures.get(name);
    return c == null ? null : ctx.textOf(c);
  }

  public ImmutableSet<String> names() {
    return captures.names();
  }

  /** Returns the underlying captures. */
  public CaptureSet captures() {
    return captures;
  }

  @Override
  public String toString() {
    return captures.toString();
  }
}
