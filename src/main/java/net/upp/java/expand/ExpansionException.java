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

/** Thrown when a macro error aborts the expansion of a file. */
public final class ExpansionException extends Exception {

  private final ImmutableList<Diagnostic> diagnostics;

  ExpansionException(String message, ImmutableList<Diagnostic> diagnostics, Throwable cause) {
    super(message, cause);
    this.diagnostics = diagnostics;
  }

  /** Returns the diagnostics reported up to and including the fatal one. */
  public ImmutableList<Diagnostic> diagnostics() {
    return diagnostics;
  }
}
