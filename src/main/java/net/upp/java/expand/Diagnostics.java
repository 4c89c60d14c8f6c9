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
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import javax.annotation.Nullable;
import net.upp.java.syntax.Position;

/**
 * Collects the diagnostics of one expansion run. Diagnostics whose code is suppressed are dropped;
 * the rest are kept in report order and logged.
 */
public final class Diagnostics {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ImmutableSet<String> suppressed;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public Diagnostics(ImmutableSet<String> suppressed) {
    this.suppressed = suppressed;
  }

  /**
   * Reports a diagnostic at {@code offset} of {@code text}, the current text of {@code file}.
   * Returns the diagnostic, or null if its code is suppressed.
   */
  @CanIgnoreReturnValue
  @FormatMethod
  @Nullable
  public Diagnostic report(
      DiagnosticCode code,
      Diagnostic.Severity severity,
      String file,
      String text,
      int offset,
      String format,
      Object... args) {
    if (suppressed.contains(code.name())) {
      return null;
    }
    offset = Math.max(0, Math.min(offset, text.length()));
    Diagnostic d =
        Diagnostic.create(
            code,
            severity,
            String.format(format, args),
            file,
            Position.of(text, offset),
            lineAt(text, offset));
    diagnostics.add(d);
    logger.at(level(severity)).log("%s", d);
    return d;
  }

  private static Level level(Diagnostic.Severity severity) {
    switch (severity) {
      case ERROR:
        return Level.SEVERE;
      case WARNING:
        return Level.WARNING;
      default:
        return Level.INFO;
    }
  }

  private static String lineAt(String text, int offset) {
    int start = text.lastIndexOf('\n', offset - 1) + 1;
    int end = text.indexOf('\n', offset);
    return text.substring(start, end < 0 ? text.length() : end);
  }

  /** Returns the diagnostics reported so far, in report order. */
  public ImmutableList<Diagnostic> all() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns the diagnostics with the given code. */
  public ImmutableList<Diagnostic> withCode(DiagnosticCode code) {
    ImmutableList.Builder<Diagnostic> b = ImmutableList.builder();
    for (Diagnostic d : diagnostics) {
      if (d.code() == code) {
        b.add(d);
      }
    }
    return b.build();
  }

  public boolean hasErrors() {
    for (Diagnostic d : diagnostics) {
      if (d.severity() == Diagnostic.Severity.ERROR) {
        return true;
      }
    }
    return false;
  }

  /** Renders every diagnostic, one after another. */
  public String render() {
    StringBuilder buf = new StringBuilder();
    for (Diagnostic d : diagnostics) {
      buf.append(d.render()).append('\n');
    }
    return buf.toString();
  }
}
