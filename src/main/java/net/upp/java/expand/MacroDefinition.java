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

/**
 * A registered macro: its name, the names of its parameters, and the code run for each
 * invocation. A final parameter spelled {@code ...name} collects any number of extra arguments.
 */
@AutoValue
public abstract class MacroDefinition {

  public abstract String name();

  public abstract ImmutableList<String> params();

  public abstract Macro macro();

  public static MacroDefinition create(String name, ImmutableList<String> params, Macro macro) {
    for (int i = 0; i < params.size() - 1; i++) {
      if (params.get(i).startsWith("...")) {
        throw new IllegalArgumentException(
            "macro " + name + ": only the last parameter may be variadic");
      }
    }
    return new AutoValue_MacroDefinition(name, params, macro);
  }

  public boolean isVariadic() {
    return !params().isEmpty() && params().get(params().size() - 1).startsWith("...");
  }

  /** Returns the number of arguments an invocation must supply at least. */
  public int minArgs() {
    return isVariadic() ? params().size() - 1 : params().size();
  }

  /**
   * Reports whether an invocation with {@code count} arguments is acceptable. An invocation without
   * parentheses supplies no arguments.
   */
  public boolean acceptsArity(int count) {
    return isVariadic() ? count >= minArgs() : count == params().size();
  }

  /** Returns a description of the accepted argument counts, for error messages. */
  String arityDescription() {
    if (isVariadic()) {
      return "at least " + minArgs() + " argument" + (minArgs() == 1 ? "" : "s");
    }
    return params().size() + " argument" + (params().size() == 1 ? "" : "s");
  }

  @Override
  public final String toString() {
    return "@" + name() + "(" + String.join(", ", params()) + ")";
  }
}
