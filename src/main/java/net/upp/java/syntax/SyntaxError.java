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

package net.upp.java.syntax;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A SyntaxError represents a syntax error reported by the lexer or parser. */
public final class SyntaxError {

  private final int offset;
  private final Position position;
  private final String message;

  SyntaxError(int offset, Position position, String message) {
    this.offset = offset;
    this.position = position;
    this.message = message;
  }

  /** Returns the char offset of the error. */
  public int offset() {
    return offset;
  }

  /** Returns the position of the error. */
  public Position position() {
    return position;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form {@code "row:col: message"}. */
  @Override
  public String toString() {
    return position + ": " + message;
  }

  /**
   * A SyntaxError.Exception is an exception holding one or more syntax errors.
   *
   * <p>SyntaxError.Exception is thrown only by operations that require a clean parse, such as
   * {@link SyntaxTree#parseStrict}. Ordinary parsing records errors in the tree and produces
   * {@code ERROR} nodes instead.
   */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SyntaxError> errors;

    /** Constructs a SyntaxError.Exception from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      if (errors.isEmpty()) {
        throw new IllegalArgumentException("no errors");
      }
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    @Override
    public String getMessage() {
      return Joiner.on('\n').join(errors);
    }
  }
}
