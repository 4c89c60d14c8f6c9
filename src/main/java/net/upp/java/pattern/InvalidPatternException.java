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

/** Thrown when a pattern string cannot be compiled. */
public final class InvalidPatternException extends IllegalArgumentException {

  private final String pattern;

  InvalidPatternException(String pattern, String message) {
    super(message + ": " + pattern);
    this.pattern = pattern;
  }

  /** Returns the pattern text that failed to compile. */
  public String pattern() {
    return pattern;
  }
}
