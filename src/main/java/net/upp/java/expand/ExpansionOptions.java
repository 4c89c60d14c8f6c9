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
import com.google.common.collect.ImmutableSet;

/**
 * ExpansionOptions is a set of options that affect how macros are expanded.
 *
 * <p>It is a value class with an {@code equals} method, so options can be compared.
 */
@AutoValue
public abstract class ExpansionOptions {

  /** The default options, used when the caller supplies none. */
  public static final ExpansionOptions DEFAULT = builder().build();

  /**
   * During consumption, a comment between two macro invocations does not stop the second from
   * being consumed as a sibling of the first.
   */
  public abstract boolean commentsTransparent();

  /**
   * Each replaced non-blank piece of the original text is kept as a comment before its
   * replacement.
   */
  public abstract boolean annotateReplacements();

  /** An error raised by a macro aborts the expansion of the whole file. */
  public abstract boolean fatalErrors();

  /** The maximum number of passes over a file before expansion gives up. */
  public abstract int maxIterations();

  /** The maximum number of passes over a code fragment expanded by a macro. */
  public abstract int maxFragmentIterations();

  /** Codes of the diagnostics that are not reported, such as {@code "UPP004"}. */
  public abstract ImmutableSet<String> suppressedDiagnostics();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_ExpansionOptions.Builder()
        .commentsTransparent(false)
        .annotateReplacements(false)
        .fatalErrors(true)
        .maxIterations(100)
        .maxFragmentIterations(5)
        .suppressedDiagnostics(ImmutableSet.of());
  }

  public abstract Builder toBuilder();

  /** Builder for {@link ExpansionOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder commentsTransparent(boolean value);

    public abstract Builder annotateReplacements(boolean value);

    public abstract Builder fatalErrors(boolean value);

    public abstract Builder maxIterations(int value);

    public abstract Builder maxFragmentIterations(int value);

    public abstract Builder suppressedDiagnostics(ImmutableSet<String> value);

    public abstract ExpansionOptions build();
  }
}
