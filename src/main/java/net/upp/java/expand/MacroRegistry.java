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
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The macros known to an {@link Expander}, by name. Registering a name a second time replaces
 * the earlier definition; the redefinition is remembered so that the expander can report it.
 */
public final class MacroRegistry {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Map<String, MacroDefinition> macros = new LinkedHashMap<>();
  private final List<String> redefined = new ArrayList<>();

  /** Registers a macro that takes the given parameters. */
  @CanIgnoreReturnValue
  public MacroDefinition register(String name, List<String> params, Macro macro) {
    MacroDefinition def = MacroDefinition.create(name, ImmutableList.copyOf(params), macro);
    if (macros.put(name, def) != null) {
      logger.atWarning().log("macro @%s redefined", name);
      redefined.add(name);
    }
    return def;
  }

  /** Registers a macro that takes no arguments. */
  @CanIgnoreReturnValue
  public MacroDefinition register(String name, Macro macro) {
    return register(name, ImmutableList.of(), macro);
  }

  @Nullable
  public MacroDefinition get(String name) {
    return macros.get(name);
  }

  public boolean contains(String name) {
    return macros.containsKey(name);
  }

  /** Returns the names of all registered macros, in registration order. */
  public ImmutableList<String> names() {
    return ImmutableList.copyOf(macros.keySet());
  }

  /** Returns the names registered more than once, once per redefinition. */
  public ImmutableList<String> redefinitions() {
    return ImmutableList.copyOf(redefined);
  }
}
