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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/** One match of a {@link Query}: the index of the pattern that matched and its captures. */
@AutoValue
public abstract class QueryMatch {

  public abstract int patternIndex();

  public abstract ImmutableMap<String, SyntaxNode> captures();

  /** Returns the node captured under {@code name}, or null. */
  @Nullable
  public SyntaxNode capture(String name) {
    return captures().get(name);
  }

  static QueryMatch create(int patternIndex, ImmutableMap<String, SyntaxNode> captures) {
    return new AutoValue_QueryMatch(patternIndex, captures);
  }
}
