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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/**
 * The deferred tasks of a pass. Tasks may register further tasks while the queue drains; each
 * runs exactly once.
 */
final class DeferredTaskQueue {

  private final List<DeferredTask> tasks = new ArrayList<>();
  private int nextSequence;

  void add(DeferredCallback callback, SyntaxNode anchor, @Nullable MacroInvocation origin) {
    tasks.add(new DeferredTask(callback, anchor, origin, nextSequence++));
  }

  boolean isEmpty() {
    return tasks.isEmpty();
  }

  int size() {
    return tasks.size();
  }

  /** Removes and returns the task to run next, or null if there is none. */
  @Nullable
  DeferredTask poll() {
    if (tasks.isEmpty()) {
      return null;
    }
    DeferredTask next = tasks.get(0);
    for (DeferredTask t : tasks) {
      if (DeferredTask.ORDER.compare(t, next) < 0) {
        next = t;
      }
    }
    tasks.remove(next);
    return next;
  }
}
