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

import com.google.auto.value.AutoValue;

/** A node-type constraint on a wildcard: {@code __Type} or {@code __NOT_Type}. */
@AutoValue
public abstract class ConstraintSpec {

  private static final String NOT_PREFIX = "NOT_";

  public abstract String typeTag();

  public abstract boolean negated();

  public static ConstraintSpec create(String typeTag, boolean negated) {
    return new AutoValue_ConstraintSpec(typeTag, negated);
  }

  /** Parses one {@code __}-separated suffix of a wildcard, such as {@code NOT_identifier}. */
  static ConstraintSpec parse(String suffix) {
    if (suffix.startsWith(NOT_PREFIX) && suffix.length() > NOT_PREFIX.length()) {
      return create(suffix.substring(NOT_PREFIX.length()), true);
    }
    return create(suffix, false);
  }

  @Override
  public final String toString() {
    return negated() ? NOT_PREFIX + typeTag() : typeTag();
  }
}
