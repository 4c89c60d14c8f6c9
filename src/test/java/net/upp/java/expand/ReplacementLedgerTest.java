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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import net.upp.java.edit.Document;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ReplacementLedger#commit} and {@link Placeholders}. */
@RunWith(JUnit4.class)
public class ReplacementLedgerTest {

  private Document doc;
  private ReplacementLedger ledger;
  private Diagnostics diagnostics;
  private Placeholders placeholders;

  @Before
  public void setUp() {
    doc = new Document("t.c", "abcdefgh");
    ledger = new ReplacementLedger(doc);
    diagnostics = new Diagnostics(ImmutableSet.of());
    placeholders = new Placeholders();
  }

  private boolean commit() {
    return commit(ExpansionOptions.DEFAULT);
  }

  private boolean commit(ExpansionOptions options) {
    return ledger.commit(options, diagnostics, placeholders);
  }

  private void add(int start, int end, String content) {
    ledger.add(start, end, content, Replacement.Scope.GLOBAL, 0);
  }

  @Test
  public void testEditsApplyIndependentlyOfRegistrationOrder() {
    add(1, 2, "B");
    add(6, 7, "G");
    assertThat(commit()).isTrue();
    assertThat(doc.text()).isEqualTo("aBcdefGh");
    assertThat(ledger.replacements()).isEmpty();
  }

  @Test
  public void testLastEditOfSameRangeWins() {
    add(2, 4, "X");
    add(2, 4, "Y");
    commit();
    assertThat(doc.text()).isEqualTo("abYefgh");
    assertThat(diagnostics.all()).isEmpty();
  }

  @Test
  public void testInsertionsAtSameOffsetKeepOrder() {
    add(3, 3, "1");
    add(3, 3, "2");
    add(3, 3, "3");
    commit();
    assertThat(doc.text()).isEqualTo("abc123defgh");
  }

  @Test
  public void testEditWithinAnotherIsDropped() {
    add(1, 6, "Z");
    add(2, 3, "q");
    commit();
    assertThat(doc.text()).isEqualTo("aZgh");
    assertThat(diagnostics.withCode(DiagnosticCode.UPP008)).hasSize(1);
  }

  @Test
  public void testInsertionsAtEdgesCompose() {
    add(2, 4, "X");
    add(4, 4, ">");
    add(2, 2, "<");
    commit();
    assertThat(doc.text()).isEqualTo("ab<X>efgh");
    assertThat(diagnostics.all()).isEmpty();
  }

  @Test
  public void testPartialOverlapIsSkipped() {
    add(1, 4, "P");
    add(3, 6, "Q");
    commit();
    assertThat(doc.text()).isEqualTo("abcQgh");
    assertThat(diagnostics.withCode(DiagnosticCode.UPP008)).hasSize(1);
    assertThat(diagnostics.all().get(0).message()).contains("[1, 4)");
  }

  @Test
  public void testUnchangedTextReportsNoChange() {
    assertThat(commit()).isFalse();
    add(1, 2, "b");
    assertThat(commit()).isFalse();
    assertThat(doc.text()).isEqualTo("abcdefgh");
  }

  @Test
  public void testPlaceholdersAreResolved() {
    String inner = placeholders.mint("x");
    String outer = placeholders.mint("<" + inner + ">");
    add(0, 1, outer);
    add(7, 8, "[" + inner + "]");
    commit();
    assertThat(doc.text()).isEqualTo("<x>bcdefg[x]");
    assertThat(placeholders.size()).isEqualTo(2);
  }

  @Test
  public void testUnknownPlaceholderIsReported() {
    add(0, 0, "__UPP_MARKER_99__");
    commit();
    assertThat(doc.text()).isEqualTo("__UPP_MARKER_99__abcdefgh");
    assertThat(diagnostics.withCode(DiagnosticCode.UPP008)).hasSize(1);
    assertThat(diagnostics.all().get(0).message()).contains("has no content");
  }

  @Test
  public void testPlaceholderContainingItself() {
    Placeholders cyclic = new Placeholders();
    String token = cyclic.mint("y __UPP_MARKER_0__");
    assertThat(token).isEqualTo("__UPP_MARKER_0__");
    assertThrows(IllegalStateException.class, () -> cyclic.resolve(token));
  }

  @Test
  public void testClearForgetsContents() {
    String token = placeholders.mint("x");
    placeholders.clear();
    assertThat(placeholders.isEmpty()).isTrue();
    assertThat(placeholders.resolve(token)).isEqualTo(token);
    assertThat(placeholders.mint("y")).isNotEqualTo(token);
  }

  @Test
  public void testAnnotatedReplacements() {
    add(1, 3, "Z");
    add(5, 5, "+");
    commit(ExpansionOptions.builder().annotateReplacements(true).build());
    assertThat(doc.text()).isEqualTo("a/* bc */ Zde+fgh");
  }

  @Test
  public void testRollback() {
    add(0, 1, "A");
    add(1, 2, "B");
    ledger.rollback(1);
    assertThat(ledger.replacements()).hasSize(1);
    commit();
    assertThat(doc.text()).isEqualTo("Abcdefgh");
  }

  @Test
  public void testRangeIsChecked() {
    assertThrows(IllegalArgumentException.class, () -> add(3, 2, ""));
    assertThrows(IllegalArgumentException.class, () -> add(0, 9, ""));
  }
}
