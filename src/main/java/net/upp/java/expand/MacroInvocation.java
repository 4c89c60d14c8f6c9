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

/**
 * One occurrence of {@code @name} or {@code @name(args)} in a document, found at the start of a
 * pass. Its range is in the text of that pass.
 */
public final class MacroInvocation {

  /** Where an invocation is in its lifecycle. */
  public enum State {
    /** Not yet evaluated. */
    PENDING,
    /** Its macro has run, or is running. */
    EXPANDED,
    /** Taken by another macro, which moves or deletes its text. */
    CONSUMED
  }

  private final String name;
  private final ImmutableList<String> args;
  private final int start;
  private final int end;
  private final int nodeId;
  private final String text;
  private State state = State.PENDING;

  MacroInvocation(
      String name, ImmutableList<String> args, int start, int end, int nodeId, String text) {
    this.name = name;
    this.args = args;
    this.start = start;
    this.end = end;
    this.nodeId = nodeId;
    this.text = text;
  }

  public String name() {
    return name;
  }

  /** Returns the argument texts, trimmed. An invocation without parentheses has none. */
  public ImmutableList<String> args() {
    return args;
  }

  public int startOffset() {
    return start;
  }

  public int endOffset() {
    return end;
  }

  /** Returns the id of the tree node holding the invocation. */
  public int nodeId() {
    return nodeId;
  }

  /** Returns the source text of the whole invocation, from {@code @} to its closing parenthesis. */
  public String text() {
    return text;
  }

  /** Reports whether the invocation names its target through arguments. */
  public boolean hasExplicitTarget() {
    return !args.isEmpty();
  }

  public State state() {
    return state;
  }

  void setState(State state) {
    this.state = state;
  }

  public boolean isPending() {
    return state == State.PENDING;
  }

  /** Reports whether {@code [start, end)} overlaps the invocation. */
  boolean overlaps(int start, int end) {
    return start < this.end && this.start < end;
  }

  /** Reports whether {@code [start, end)} lies within the invocation. */
  boolean within(int start, int end) {
    return this.start <= start && end <= this.end;
  }

  @Override
  public String toString() {
    return text + "@" + start + ".." + end + " " + state;
  }
}
