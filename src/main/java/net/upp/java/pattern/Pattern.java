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

import com.google.common.collect.ImmutableMap;

/** A compiled pattern: a template tree plus the wildcards it declares. */
public final class Pattern {

  private final String source;
  private final PatternNode root;
  private final ImmutableMap<String, Wildcard> wildcards;

  Pattern(String source, PatternNode root, ImmutableMap<String, Wildcard> wildcards) {
    this.source = source;
    this.root = root;
    this.wildcards = wildcards;
  }

  /** Returns the pattern text as written. */
  public String source() {
    return source;
  }

  public PatternNode root() {
    return root;
  }

  /** Returns the wildcards by name, in order of first appearance. */
  public ImmutableMap<String, Wildcard> wildcards() {
    return wildcards;
  }

  @Override
  public String toString() {
    return source;
  }
}
