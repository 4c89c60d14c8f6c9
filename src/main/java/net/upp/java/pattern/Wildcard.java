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
import com.google.common.collect.ImmutableList;
import net.upp.java.syntax.SyntaxNode;

/**
 * A named placeholder in a pattern, written {@code $name}, {@code $name__Type},
 * {@code $name__NOT_Type}, {@code opt$name}, {@code $name__until} or {@code $name__plus}.
 */
@AutoValue
public abstract class Wildcard {

  public abstract String name();

  public abstract ImmutableList<ConstraintSpec> constraints();

  public abstract Cardinality cardinality();

  public static Wildcard create(
      String name, ImmutableList<ConstraintSpec> constraints, Cardinality cardinality) {
    return new AutoValue_Wildcard(name, constraints, cardinality);
  }

  /**
   * Reports whether {@code node}'s type satisfies the constraints. Negated constraints are checked
   * first and always win; if any positive constraint exists, at least one must match.
   */
  public boolean accepts(SyntaxNode node) {
    boolean hasPositive = false;
    for (ConstraintSpec c : constraints()) {
      if (c.negated() && c.typeTag().equals(node.type())) {
        return false;
      }
      hasPositive |= !c.negated();
    }
    if (!hasPositive) {
      return true;
    }
    for (ConstraintSpec c : constraints()) {
      if (!c.negated() && c.typeTag().equals(node.type())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder();
    if (cardinality() == Cardinality.OPTIONAL) {
      buf.append("opt");
    }
    buf.append('$').append(name());
    for (ConstraintSpec c : constraints()) {
      buf.append("__").append(c);
    }
    if (cardinality() == Cardinality.VARIADIC_UNTIL) {
      buf.append("__until");
    } else if (cardinality() == Cardinality.VARIADIC_PLUS) {
      buf.append("__plus");
    }
    return buf.toString();
  }
}
