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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link PatternCompiler}. */
@RunWith(JUnit4.class)
public class PatternCompilerTest {

  private final PatternCompiler compiler = new PatternCompiler();

  @Test
  public void testWildcardDeclarations() {
    Pattern p = compiler.compile("f($args__until, $last__NOT_string_literal, opt$rest)");
    assertThat(p.wildcards().keySet()).containsExactly("args", "last", "rest").inOrder();
    assertThat(p.wildcards().get("args").cardinality()).isEqualTo(Cardinality.VARIADIC_UNTIL);
    assertThat(p.wildcards().get("last").constraints())
        .containsExactly(ConstraintSpec.create("string_literal", true));
    assertThat(p.wildcards().get("rest").cardinality()).isEqualTo(Cardinality.OPTIONAL);
    assertThat(p.root().type()).isEqualTo("call_expression");
  }

  @Test
  public void testWildcardToString() {
    Wildcard w =
        Wildcard.create(
            "v",
            ImmutableList.of(
                ConstraintSpec.create("identifier", false),
                ConstraintSpec.create("number_literal", true)),
            Cardinality.OPTIONAL);
    assertThat(w.toString()).isEqualTo("opt$v__identifier__NOT_number_literal");
  }

  @Test
  public void testLaterBareUseAdoptsDeclaration() {
    Pattern p = compiler.compile("$x__identifier = $x;");
    assertThat(p.wildcards().get("x").constraints())
        .containsExactly(ConstraintSpec.create("identifier", false));
  }

  @Test
  public void testWholeWildcardStatement() {
    Pattern p = compiler.compile("$s;");
    assertThat(p.root().isWildcard()).isTrue();
    assertThat(p.root().wildcard().name()).isEqualTo("s");
  }

  @Test
  public void testCompiledPatternsAreCached() {
    Pattern first = compiler.compile("$a + $b");
    assertThat(compiler.compile("$a + $b")).isSameInstanceAs(first);
    assertThat(compiler.cacheSize()).isEqualTo(1);
  }

  @Test
  public void testConflictingDeclarations() {
    InvalidPatternException e =
        assertThrows(
            InvalidPatternException.class,
            () -> compiler.compile("$a__identifier + $a__number_literal"));
    assertThat(e.pattern()).isEqualTo("$a__identifier + $a__number_literal");
    assertThat(e).hasMessageThat().contains("declared as both");
  }

  @Test
  public void testInvalidPatterns() {
    assertThrows(InvalidPatternException.class, () -> compiler.compile("$node + 1"));
    assertThrows(InvalidPatternException.class, () -> compiler.compile("f($a__until__plus)"));
    assertThrows(InvalidPatternException.class, () -> compiler.compile("f($a____x)"));
    assertThrows(InvalidPatternException.class, () -> compiler.compile("opt$x"));
    assertThrows(InvalidPatternException.class, () -> compiler.compile("int = ) ("));
  }
}
