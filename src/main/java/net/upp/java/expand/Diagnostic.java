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
import net.upp.java.syntax.Position;

/** A message about a source location reported while expanding macros. */
@AutoValue
public abstract class Diagnostic {

  /** How serious a diagnostic is. */
  public enum Severity {
    ERROR,
    WARNING,
    INFO;

    @Override
    public String toString() {
      return name().toLowerCase();
    }
  }

  public abstract DiagnosticCode code();

  public abstract Severity severity();

  public abstract String message();

  /** Returns the path of the document the diagnostic is about. */
  public abstract String file();

  /** Returns the zero-based position the diagnostic points at. */
  public abstract Position position();

  /** Returns the text of the source line containing the position, without its newline. */
  public abstract String sourceLine();

  public static Diagnostic create(
      DiagnosticCode code,
      Severity severity,
      String message,
      String file,
      Position position,
      String sourceLine) {
    return new AutoValue_Diagnostic(code, severity, message, file, position, sourceLine);
  }

  /**
   * Returns the diagnostic as {@code file:line:col: severity: [CODE] message}, followed by the
   * source line and a caret under the column when the line is known.
   */
  public String render() {
    StringBuilder buf = new StringBuilder();
    buf.append(file())
        .append(':')
        .append(position())
        .append(": ")
        .append(severity())
        .append(": [")
        .append(code())
        .append("] ")
        .append(message());
    if (!sourceLine().isEmpty()) {
      buf.append('\n').append(sourceLine()).append('\n');
      int column = Math.min(position().column(), sourceLine().length());
      for (int i = 0; i < column; i++) {
        buf.append(sourceLine().charAt(i) == '\t' ? '\t' : ' ');
      }
      buf.append('^');
    }
    return buf.toString();
  }

  @Override
  public final String toString() {
    return file() + ":" + position() + ": " + severity() + ": [" + code() + "] " + message();
  }
}
