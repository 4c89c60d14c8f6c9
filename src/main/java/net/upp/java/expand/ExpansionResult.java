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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The outcome of expanding a file. */
@AutoValue
public abstract class ExpansionResult {

  /** Returns the expanded text. */
  public abstract String text();

  public abstract ImmutableList<Diagnostic> diagnostics();

  /** Returns the number of passes made over the file. */
  public abstract int passes();

  static ExpansionResult create(String text, ImmutableList<Diagnostic> diagnostics, int passes) {
    return new AutoValue_ExpansionResult(text, diagnostics, passes);
  }
}
