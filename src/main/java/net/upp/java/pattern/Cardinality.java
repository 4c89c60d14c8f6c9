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

/** How many sibling nodes a wildcard stands for. */
public enum Cardinality {
  /** Exactly one node: {@code $name}. */
  SINGLE,
  /** Zero or one node: {@code opt$name}. */
  OPTIONAL,
  /** Zero or more nodes, as few as possible: {@code $name__until}. */
  VARIADIC_UNTIL,
  /** One or more nodes, as few as possible: {@code $name__plus}. */
  VARIADIC_PLUS;

  public boolean isVariadic() {
    return this == VARIADIC_UNTIL || this == VARIADIC_PLUS;
  }
}
