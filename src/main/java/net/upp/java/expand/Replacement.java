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

/** A pending edit of a document: the text in {@code [start, end)} is to become {@code content}. */
@AutoValue
public abstract class Replacement {

  /** Whether an edit lies within the invocation being expanded. */
  public enum Scope {
    /** Within the span of the invocation whose macro registered it. */
    LOCAL,
    /** Anywhere else in the document, or registered outside of any expansion. */
    GLOBAL
  }

  public abstract int start();

  public abstract int end();

  public abstract String content();

  public abstract Scope scope();

  /** Returns the id of the node whose expansion registered the edit, or 0 if none. */
  public abstract int ownerNodeId();

  /** Returns the registration order of the edit within its ledger. */
  public abstract int sequence();

  static Replacement create(
      int start, int end, String content, Scope scope, int ownerNodeId, int sequence) {
    return new AutoValue_Replacement(start, end, content, scope, ownerNodeId, sequence);
  }

  public boolean isInsertion() {
    return start() == end();
  }

  /** Reports whether this edit lies strictly within {@code that} and cannot compose with it. */
  boolean isContainedIn(Replacement that) {
    if (start() == that.start() && end() == that.end()) {
      return false;
    }
    if (start() < that.start() || end() > that.end()) {
      return false;
    }
    // An insertion at either edge of a replacement composes with it.
    return !(isInsertion() && (start() == that.start() || start() == that.end()));
  }

  Replacement withContent(String content) {
    return create(start(), end(), content, scope(), ownerNodeId(), sequence());
  }
}
