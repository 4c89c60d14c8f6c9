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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import net.upp.java.syntax.Position;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Diagnostics} and {@link Diagnostic}. */
@RunWith(JUnit4.class)
public class DiagnosticsTest {

  private static final String TEXT = "int a;\n  @bad(1);\nint b;\n";

  @Test
  public void testReportComputesPositionAndLine() {
    Diagnostics diagnostics = new Diagnostics(ImmutableSet.of());
    Diagnostic d =
        diagnostics.report(
            DiagnosticCode.UPP006,
            Diagnostic.Severity.ERROR,
            "t.c",
            TEXT,
            TEXT.indexOf('@'),
            "unknown macro @%s",
            "bad");
    assertThat(d.position()).isEqualTo(Position.create(1, 2));
    assertThat(d.sourceLine()).isEqualTo("  @bad(1);");
    assertThat(d.message()).isEqualTo("unknown macro @bad");
    assertThat(d.toString()).isEqualTo("t.c:2:3: error: [UPP006] unknown macro @bad");
    assertThat(d.render())
        .isEqualTo("t.c:2:3: error: [UPP006] unknown macro @bad\n  @bad(1);\n  ^");
    assertThat(diagnostics.all()).containsExactly(d);
    assertThat(diagnostics.hasErrors()).isTrue();
  }

  @Test
  public void testSuppressedCodes() {
    Diagnostics diagnostics = new Diagnostics(ImmutableSet.of("UPP004"));
    assertThat(
            diagnostics.report(
                DiagnosticCode.UPP004, Diagnostic.Severity.INFO, "t.c", TEXT, 0, "upward"))
        .isNull();
    diagnostics.report(DiagnosticCode.UPP003, Diagnostic.Severity.WARNING, "t.c", TEXT, 0, "x");
    assertThat(diagnostics.all()).hasSize(1);
    assertThat(diagnostics.withCode(DiagnosticCode.UPP004)).isEmpty();
    assertThat(diagnostics.hasErrors()).isFalse();
  }

  @Test
  public void testOffsetIsClamped() {
    Diagnostics diagnostics = new Diagnostics(ImmutableSet.of());
    Diagnostic d =
        diagnostics.report(
            DiagnosticCode.UPP002, Diagnostic.Severity.WARNING, "t.c", "abc", 99, "late");
    assertThat(d.position()).isEqualTo(Position.create(0, 3));
    assertThat(d.render()).endsWith("abc\n   ^");
  }

  @Test
  public void testRenderAll() {
    Diagnostics diagnostics = new Diagnostics(ImmutableSet.of());
    diagnostics.report(DiagnosticCode.UPP001, Diagnostic.Severity.WARNING, "t.c", "", 0, "one");
    diagnostics.report(DiagnosticCode.UPP004, Diagnostic.Severity.INFO, "t.c", "", 0, "two");
    assertThat(diagnostics.render())
        .isEqualTo("t.c:1:1: warning: [UPP001] one\nt.c:1:1: info: [UPP004] two\n");
  }

  @Test
  public void testEveryCodeHasASummary() {
    for (DiagnosticCode code : DiagnosticCode.values()) {
      assertThat(code.summary()).isNotEmpty();
    }
  }
}
