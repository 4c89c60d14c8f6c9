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

package net.upp.java.pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/**
 * The bindings of one successful match, by wildcard name. The reserved name {@value #NODE} is
 * always bound to the matched node itself.
 */
public final class CaptureSet {

  /** Name under which the matched node is recorded. */
  public static final String NODE = "node";

  private final ImmutableMap<String, Capture> captures;

  CaptureSet(SyntaxNode matched, Map<String, Capture> captures) {
    Preconditions.checkArgument(!captures.containsKey(NODE), "reserved capture name %s", NODE);
    this.captures =
        ImmutableMap.<String, Capture>builder()
            .put(NODE, Capture.single(matched))
            .putAll(captures)
            .buildOrThrow();
  }

  /** Returns the matched node. */
  public SyntaxNode node() {
    return captures.get(NODE).node();
  }

  public boolean has(String name) {
    return captures.containsKey(name);
  }

  @Nullable
  public Capture get(String name) {
    return captures.get(name);
  }

  /**
   * Returns the node bound to {@code name}: the node of a single capture or the first named node
   * of a sequence. Returns null if nothing is bound.
   */
  @Nullable
  public SyntaxNode node(String name) {
    Capture c = captures.get(name);
    return c == null ? null : c.node();
  }

  /** Returns the named nodes bound to {@code name}, or an empty list. */
  public ImmutableList<SyntaxNode> nodes(String name) {
    Capture c = captures.get(name);
    return c == null ? ImmutableList.of() : c.nodes();
  }

  /** Returns the source text bound to {@code name}, or null if nothing is bound. */
  @Nullable
  public String text(String name) {
    Capture c = captures.get(name);
    return c == null ? null : c.text();
  }

  public ImmutableSet<String> names() {
    return captures.keySet();
  }

  public ImmutableMap<String, Capture> asMap() {
    return captures;
  }

  @Override
  public String toString() {
    return captures.toString();
  }
}
