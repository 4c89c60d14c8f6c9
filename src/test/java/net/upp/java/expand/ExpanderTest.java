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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.upp.java.syntax.Position;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End-to-end tests of {@link Expander}. */
@RunWith(JUnit4.class)
public class ExpanderTest {

  private final MacroRegistry registry = new MacroRegistry();
  private ExpansionOptions options = ExpansionOptions.DEFAULT;

  private ExpansionResult expand(String source) throws ExpansionException {
    return new Expander(registry, options).expand("t.c", source);
  }

  private static ImmutableList<DiagnosticCode> codes(List<Diagnostic> diagnostics) {
    ImmutableList.Builder<DiagnosticCode> codes = ImmutableList.builder();
    for (Diagnostic d : diagnostics) {
      codes.add(d.code());
    }
    return codes.build();
  }

  private void registerDouble() {
    registry.register(
        "double",
        ImmutableList.of("x"),
        ctx -> {
          Match m = ctx.match(ctx.parseFragment(ctx.arg(0)), "$n");
          return "(" + m.text("n") + ")*2";
        });
  }

  @Test
  public void testExpressionMacro() throws Exception {
    registerDouble();
    ExpansionResult result = expand("int f() { return @double(2+3); }");
    assertThat(result.text()).isEqualTo("int f() { return (2+3)*2; }");
    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.passes()).isEqualTo(2);
  }

  @Test
  public void testTopLevelExpressionLeavesSyntaxWarning() throws Exception {
    registerDouble();
    ExpansionResult result = expand("@double(2+3);");
    assertThat(result.text()).isEqualTo("(2+3)*2;");
    assertThat(codes(result.diagnostics())).containsExactly(DiagnosticCode.UPP003);
    assertThat(result.diagnostics().get(0).severity()).isEqualTo(Diagnostic.Severity.WARNING);
  }

  @Test
  public void testSuppressedDiagnostics() throws Exception {
    registerDouble();
    options = ExpansionOptions.builder().suppressedDiagnostics(ImmutableSet.of("UPP003")).build();
    assertThat(expand("@double(2+3);").diagnostics()).isEmpty();
  }

  @Test
  public void testConsumeTakesFollowingStatements() throws Exception {
    List<String> seen = new ArrayList<>();
    registry.register(
        "drop",
        ctx -> {
          NodeView n;
          while ((n = ctx.consume()) != null) {
            seen.add(n.text());
          }
          return "";
        });
    ExpansionResult result = expand("void f() {\n  @drop\n  a();\n  b();\n  c();\n}");
    assertThat(seen).containsExactly("a();", "b();", "c();").inOrder();
    assertThat(result.text()).isEqualTo("void f() {\n  \n  \n  \n  \n}");
  }

  @Test
  public void testConsumeRejectsWrongType() {
    registry.register(
        "needFor",
        ctx -> {
          ctx.consume("for_statement");
          return "";
        });
    ExpansionException e =
        assertThrows(
            ExpansionException.class, () -> expand("void f() {\n  @needFor\n  a();\n}"));
    assertThat(codes(e.diagnostics())).containsExactly(DiagnosticCode.UPP006);
    assertThat(e.diagnostics().get(0).message())
        .contains("expected for_statement but found expression_statement");
    assertThat(e).hasMessageThat().startsWith("t.c: expansion aborted");
    assertThat(e).hasCauseThat().isInstanceOf(MacroConsumptionException.class);
  }

  @Test
  public void testConsumesAdjacentInvocation() throws Exception {
    List<Boolean> marked = new ArrayList<>();
    registry.register(
        "outer",
        ctx -> {
          NodeView n = ctx.consume();
          marked.add(ctx.markerOf(n) != null);
          return "/* took " + n.type() + " " + n.text() + " */";
        });
    registry.register("inner", ImmutableList.of("x"), ctx -> "never();");
    ExpansionResult result = expand("void f() {\n  @outer @inner(1);\n}");
    assertThat(result.text())
        .isEqualTo("void f() {\n  /* took macro_invocation @inner(1) */ ;\n}");
    assertThat(marked).containsExactly(true);
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testCommentsBetweenInvocations() throws Exception {
    registry.register(
        "outer",
        ctx -> {
          NodeView n = ctx.consume();
          return n == null ? "/* none */" : "/* took " + n.text() + " */";
        });
    registry.register("inner", ImmutableList.of("x"), ctx -> "never()");
    String source = "void f() {\n  @outer /* c */ @inner(1);\n}";

    assertThat(expand(source).text()).isEqualTo("void f() {\n  /* none */ /* c */ never();\n}");

    options = ExpansionOptions.builder().commentsTransparent(true).build();
    assertThat(expand(source).text())
        .isEqualTo("void f() {\n  /* took @inner(1) */ /* c */ ;\n}");
  }

  @Test
  public void testDeferredTasksRunInnerScopesFirst() throws Exception {
    List<String> log = new ArrayList<>();
    registry.register(
        "mark",
        ImmutableList.of("tag"),
        ctx -> {
          String tag = ctx.arg(0);
          ctx.atRoot(c -> log.add("root " + tag));
          ctx.inScope(c -> log.add("scope " + tag));
          return "";
        });
    ExpansionResult result =
        expand("void f() {\n  @mark(a);\n  {\n    @mark(b);\n  }\n}\n");
    assertThat(log).containsExactly("scope b", "scope a", "root a", "root b").inOrder();
    assertThat(result.text()).isEqualTo("void f() {\n  ;\n  {\n    ;\n  }\n}\n");
  }

  @Test
  public void testAtRootAppendsDeclaration() throws Exception {
    registry.register(
        "addGlobal",
        ImmutableList.of("name"),
        ctx -> {
          String name = ctx.arg(0);
          ctx.atRoot(
              c -> {
                int end = c.root().endOffset();
                c.replace(end, end, c.code("int ", name, ";\n").text());
              });
          return "";
        });
    ExpansionResult result = expand("void f() {\n  @addGlobal(x);\n}\n");
    assertThat(result.text()).isEqualTo("void f() {\n  ;\n}\nint x;\n");
    assertThat(result.diagnostics()).isEmpty();
  }

  private void registerWrapFn(String result, List<String> tokens) {
    registry.register(
        "wrapFn",
        ctx -> {
          NodeView fn = ctx.findEnclosing("function_definition");
          tokens.add(ctx.replace(fn, "/* wrapped */\n" + fn.text()));
          return result;
        });
  }

  @Test
  public void testOutwardEditUsesPlaceholder() throws Exception {
    List<String> tokens = new ArrayList<>();
    registerWrapFn("/* here */", tokens);
    ExpansionResult result = expand("int f() {\n  @wrapFn\n  return 1;\n}\n");
    assertThat(result.text())
        .isEqualTo("/* wrapped */\nint f() {\n  /* here */\n  return 1;\n}\n");
    assertThat(tokens).hasSize(1);
    assertThat(tokens.get(0)).matches("__UPP_MARKER_\\d+__");
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testOutwardEditKeepsResultsExpandedBefore() throws Exception {
    registerDouble();
    registerWrapFn("", new ArrayList<>());
    ExpansionResult result =
        expand("int f() {\n  int a = @double(2+3);\n  @wrapFn\n  return a;\n}\n");
    assertThat(result.text())
        .isEqualTo("/* wrapped */\nint f() {\n  int a = (2+3)*2;\n  \n  return a;\n}\n");
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testOutwardEditKeepsInvocationsExpandedAfter() throws Exception {
    registerDouble();
    registerWrapFn("", new ArrayList<>());
    ExpansionResult result =
        expand("int f() {\n  @wrapFn\n  int a = @double(2+3);\n  return a;\n}\n");
    assertThat(result.text())
        .isEqualTo("/* wrapped */\nint f() {\n  \n  int a = (2+3)*2;\n  return a;\n}\n");
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testOutwardEditKeepsConsumedCodeDeleted() throws Exception {
    registry.register(
        "dropNext",
        ctx -> {
          ctx.consume();
          return "";
        });
    registerWrapFn("", new ArrayList<>());
    ExpansionResult result =
        expand("int f() {\n  @dropNext\n  gone();\n  @wrapFn\n  return 1;\n}\n");
    assertThat(result.text())
        .isEqualTo("/* wrapped */\nint f() {\n  \n  \n  \n  return 1;\n}\n");
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testArityMismatchIsFatal() {
    registry.register("one", ImmutableList.of("x"), ctx -> ctx.arg(0));
    ExpansionException e =
        assertThrows(ExpansionException.class, () -> expand("int a = @one(1, 2);"));
    assertThat(codes(e.diagnostics())).containsExactly(DiagnosticCode.UPP007);
    assertThat(e.diagnostics().get(0).message()).isEqualTo("@one expects 1 argument, got 2");
    assertThat(e.diagnostics().get(0).position()).isEqualTo(Position.create(0, 8));
  }

  @Test
  public void testVariadicMacro() throws Exception {
    registry.register(
        "sum", ImmutableList.of("first", "...rest"), ctx -> String.join(" + ", ctx.args()));
    assertThat(expand("int s = @sum(1, 2, 3);").text()).isEqualTo("int s = 1 + 2 + 3;");
    ExpansionException e = assertThrows(ExpansionException.class, () -> expand("int s = @sum();"));
    assertThat(e.diagnostics().get(0).message())
        .isEqualTo("@sum expects at least 1 argument, got 0");
  }

  @Test
  public void testNonFatalModeDeletesFailedInvocations() throws Exception {
    options = ExpansionOptions.builder().fatalErrors(false).build();
    registry.register(
        "fail",
        ctx -> {
          ctx.replace(0, 0, "/* never */");
          throw ctx.error("no way");
        });
    ExpansionResult result = expand("void f() {\n  @nope(1);\n  @fail;\n  g();\n}");
    assertThat(result.text()).isEqualTo("void f() {\n  ;\n  ;\n  g();\n}");
    assertThat(codes(result.diagnostics()))
        .containsExactly(DiagnosticCode.UPP006, DiagnosticCode.UPP006)
        .inOrder();
    assertThat(result.diagnostics().get(0).message()).isEqualTo("unknown macro @nope");
    assertThat(result.diagnostics().get(1).message()).isEqualTo("no way");
    assertThat(result.diagnostics().get(1).severity()).isEqualTo(Diagnostic.Severity.ERROR);
  }

  @Test
  public void testUnknownMacroIsFatalByDefault() {
    ExpansionException e =
        assertThrows(ExpansionException.class, () -> expand("void f() { @nope; }"));
    assertThat(codes(e.diagnostics())).containsExactly(DiagnosticCode.UPP006);
  }

  @Test
  public void testRedefinitionIsReported() throws Exception {
    registry.register("m", ctx -> "1");
    registry.register("m", ctx -> "2");
    ExpansionResult result = expand("int a = @m;");
    assertThat(result.text()).isEqualTo("int a = 2;");
    assertThat(codes(result.diagnostics())).containsExactly(DiagnosticCode.UPP001);
    assertThat(result.diagnostics().get(0).position()).isEqualTo(Position.START);
  }

  @Test
  public void testExpandFragment() throws Exception {
    registry.register("inc", ImmutableList.of("x"), ctx -> ctx.arg(0) + " + 1");
    registry.register(
        "twice", ImmutableList.of("x"), ctx -> "(" + ctx.expand(ctx.arg(0)) + ") * 2");
    ExpansionResult result = expand("int f(int y) { return @twice(@inc(y)); }");
    assertThat(result.text()).isEqualTo("int f(int y) { return (y + 1) * 2; }");
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testTransformRunsEveryPass() throws Exception {
    int[] runs = {0};
    Transform rename =
        c -> {
          runs[0]++;
          for (NodeView id : c.findReferences("old")) {
            c.replace(id, "fresh");
          }
        };
    registry.register(
        "useRename",
        ctx -> {
          ctx.registerTransform(rename);
          return null;
        });
    ExpansionResult result =
        expand("int old;\nvoid f() {\n  @useRename\n  @useRename\n  old = 1;\n}\n");
    assertThat(result.text()).isEqualTo("int fresh;\nvoid f() {\n  \n  \n  fresh = 1;\n}\n");
    assertThat(result.passes()).isEqualTo(2);
    assertThat(runs[0]).isEqualTo(2);
  }

  @Test
  public void testMatchReplaceFromRoot() throws Exception {
    registry.register(
        "square",
        ctx -> {
          ctx.atRoot(
              c ->
                  c.matchReplace(
                      c.root(),
                      "pow2($x)",
                      m -> "((" + m.text("x") + ") * (" + m.text("x") + "))"));
          return "";
        });
    ExpansionResult result = expand("void f() {\n  @square;\n  y = pow2(a + 1) + pow2(b);\n}\n");
    assertThat(result.text())
        .isEqualTo("void f() {\n  ;\n  y = ((a + 1) * (a + 1)) + ((b) * (b));\n}\n");
  }

  @Test
  public void testCreateUniqueIdentifier() throws Exception {
    registry.register("tmp", ctx -> ctx.createUniqueIdentifier("tmp"));
    Expander expander = new Expander(registry, options);
    String source = "int tmp_0;\nint f() { return @tmp; }";
    ExpansionResult first = expander.expand("t.c", source);
    assertThat(first.text()).isEqualTo("int tmp_0;\nint f() { return tmp_1; }");
    assertThat(expander.expand("t.c", source).text()).isEqualTo(first.text());
  }

  @Test
  public void testFindDefinition() throws Exception {
    registry.register(
        "typeOf",
        ImmutableList.of("name"),
        ctx -> {
          NodeView decl = ctx.findDefinition(ctx.arg(0));
          return decl == null ? "0" : "\"" + decl.childByFieldName("type").text() + "\"";
        });
    ExpansionResult result =
        expand(
            String.join(
                "\n",
                "long count;",
                "void f(double scale) {",
                "  char c;",
                "  int a = @typeOf(c);",
                "  int b = @typeOf(scale);",
                "  int d = @typeOf(count);",
                "  int e = @typeOf(nothing);",
                "}"));
    assertThat(result.text())
        .isEqualTo(
            String.join(
                "\n",
                "long count;",
                "void f(double scale) {",
                "  char c;",
                "  int a = \"char\";",
                "  int b = \"double\";",
                "  int d = \"long\";",
                "  int e = 0;",
                "}"));
  }

  @Test
  public void testUpwardAccessIsReportedOnce() throws Exception {
    registry.register(
        "up",
        ctx -> {
          ctx.node().parent();
          ctx.node().parent();
          return null;
        });
    ExpansionResult result = expand("void f() {\n  @up;\n}");
    assertThat(result.text()).isEqualTo("void f() {\n  ;\n}");
    assertThat(codes(result.diagnostics())).containsExactly(DiagnosticCode.UPP004);
    assertThat(result.diagnostics().get(0).severity()).isEqualTo(Diagnostic.Severity.INFO);
  }

  @Test
  public void testIterationLimit() throws Exception {
    options = ExpansionOptions.builder().maxIterations(3).build();
    registry.register(
        "forever",
        ImmutableList.of("n"),
        ctx -> "@forever(" + (Integer.parseInt(ctx.arg(0)) + 1) + ")");
    ExpansionResult result = expand("int f() { return @forever(0); }");
    assertThat(result.text()).isEqualTo("int f() { return @forever(3); }");
    assertThat(result.passes()).isEqualTo(3);
    assertThat(codes(result.diagnostics()))
        .containsExactly(DiagnosticCode.UPP002, DiagnosticCode.UPP003)
        .inOrder();
  }

  @Test
  public void testNodeAccessHelpers() throws Exception {
    List<Object> seen = new ArrayList<>();
    registry.register(
        "inspect",
        ImmutableList.of("a", "b"),
        ctx -> {
          NodeView fn = ctx.child(ctx.root(), 0);
          NodeView body = ctx.childForFieldName(fn, "body");
          NodeView last = ctx.lastNamedChild(body);
          seen.add(ctx.argCount());
          seen.add(body.type());
          seen.add(last.text());
          seen.add(ctx.nextNamedSibling(last) == null);
          seen.add(ctx.isDescendant(last, fn));
          seen.add(ctx.isSameNode(fn, ctx.findEnclosing("function_definition")));
          seen.add(ctx.parent(null) == null);
          seen.add(ctx.child(fn, 99) == null);
          seen.add(ctx.childCount(null));
          ctx.warn(null, "careful");
          return "";
        });
    ExpansionResult result = expand("void f() {\n  @inspect(a, b);\n  g();\n}");
    assertThat(seen)
        .containsExactly(2, "compound_statement", "g();", true, true, true, true, true, 0)
        .inOrder();
    assertThat(result.text()).isEqualTo("void f() {\n  ;\n  g();\n}");
    assertThat(codes(result.diagnostics())).containsExactly(DiagnosticCode.UPP006);
    assertThat(result.diagnostics().get(0).severity()).isEqualTo(Diagnostic.Severity.WARNING);
    assertThat(result.diagnostics().get(0).message()).isEqualTo("careful");
  }

  @Test
  public void testFormattedError() {
    registry.register(
        "bad",
        ImmutableList.of("x"),
        ctx -> {
          throw ctx.errorf(null, "cannot use %s here", ctx.arg(0));
        });
    ExpansionException e =
        assertThrows(ExpansionException.class, () -> expand("void f() {\n  @bad(q);\n}"));
    assertThat(e.diagnostics().get(0).message()).isEqualTo("cannot use q here");
    assertThat(e.diagnostics().get(0).position()).isEqualTo(Position.create(1, 2));
  }

  @Test
  public void testIsInsideInvocation() throws Exception {
    List<Boolean> seen = new ArrayList<>();
    registry.register("x", ImmutableList.of("v"), ctx -> ctx.arg(0));
    registry.register(
        "check",
        ctx -> {
          NodeView body = ctx.root().namedChild(0).childByFieldName("body");
          NodeView last = body.lastNamedChild();
          seen.add(ctx.isInsideInvocation(last.prevNamedSibling()));
          seen.add(ctx.isInsideInvocation(last));
          return null;
        });
    ExpansionResult result = expand("void f() {\n  @check;\n  g(@x(1));\n  h();\n}");
    assertThat(seen).containsExactly(true, false).inOrder();
    assertThat(result.text()).isEqualTo("void f() {\n  ;\n  g(1);\n  h();\n}");
  }

  @Test
  public void testConsumeOfTypeWithNothingLeft() {
    List<Boolean> untyped = new ArrayList<>();
    registry.register(
        "needFor",
        ctx -> {
          untyped.add(ctx.nextNode() == null);
          ctx.consume("for_statement");
          return "";
        });
    ExpansionException e =
        assertThrows(
            ExpansionException.class, () -> expand("void f() {\n  g();\n  @needFor\n}"));
    assertThat(untyped).containsExactly(true);
    assertThat(e).hasCauseThat().isInstanceOf(MacroConsumptionException.class);
    assertThat(e.diagnostics().get(0).message())
        .isEqualTo("@needFor expected for_statement after it");
  }

  @Test
  public void testViewsAreCachedPerNode() throws Exception {
    List<Boolean> same = new ArrayList<>();
    registry.register(
        "views",
        ctx -> {
          NodeView fn = ctx.root().namedChild(0);
          same.add(fn == ctx.root().namedChild(0));
          same.add(fn == ctx.wrap(fn.unwrap()));
          same.add(fn.childByFieldName("body") == ctx.childForFieldName(fn, "body"));
          NodeView next = ctx.nextNode();
          same.add(next == ctx.consume());
          return "";
        });
    expand("void f() {\n  @views\n  a();\n}");
    assertThat(same).containsExactly(true, true, true, true);
  }

  @Test
  public void testNextNodeDoesNotConsume() throws Exception {
    List<Object> seen = new ArrayList<>();
    registry.register(
        "peek",
        ctx -> {
          NodeView first = ctx.nextNode();
          seen.add(first.text());
          seen.add(ctx.nextNode() == first);
          seen.add(ctx.nextNode("for_statement") == null);
          seen.add(ctx.consume() == first);
          seen.add(ctx.nextNode().text());
          return "";
        });
    ExpansionResult result = expand("void f() {\n  @peek\n  a();\n  b();\n}");
    assertThat(seen).containsExactly("a();", true, true, true, "b();").inOrder();
    assertThat(result.text()).isEqualTo("void f() {\n  \n  \n  b();\n}");
  }

  @Test
  public void testNextNodeShowsAdjacentInvocation() throws Exception {
    List<String> seen = new ArrayList<>();
    registry.register(
        "outer",
        ctx -> {
          NodeView next = ctx.nextNode();
          seen.add(next.type() + " " + next.text());
          return null;
        });
    registry.register("inner", ImmutableList.of("x"), ctx -> "g(" + ctx.arg(0) + ")");
    ExpansionResult result = expand("void f() {\n  @outer @inner(1);\n}");
    assertThat(seen).containsExactly("macro_invocation @inner(1)");
    assertThat(result.text()).isEqualTo("void f() {\n   g(1);\n}");
  }

  @Test
  public void testInsertBeforeAndAfter() throws Exception {
    registry.register(
        "around",
        ctx -> {
          NodeView next = ctx.nextNode();
          ctx.insertBefore(next, "before();\n  ");
          ctx.insertAfter(next, "\n  after();");
          return "";
        });
    ExpansionResult result = expand("void f() {\n  @around\n  a();\n}");
    assertThat(result.text())
        .isEqualTo("void f() {\n  \n  before();\n  a();\n  after();\n}");
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testHoist() throws Exception {
    registry.register(
        "needsIo",
        ctx -> {
          ctx.hoist("#include <stdio.h>");
          return null;
        });
    ExpansionResult result = expand("// demo\nint main() {\n  @needsIo;\n  return 0;\n}\n");
    assertThat(result.text())
        .isEqualTo("// demo\n#include <stdio.h>\nint main() {\n  ;\n  return 0;\n}\n");
  }

  @Test
  public void testHoistFromFragment() throws Exception {
    registry.register(
        "needsIo",
        ctx -> {
          ctx.hoist("#include <stdio.h>");
          return "puts";
        });
    registry.register("call", ImmutableList.of("f"), ctx -> ctx.expand(ctx.arg(0)) + "(\"hi\")");
    ExpansionResult result = expand("int main() {\n  @call(@needsIo);\n  return 0;\n}\n");
    assertThat(result.text())
        .isEqualTo("#include <stdio.h>\nint main() {\n  puts(\"hi\");\n  return 0;\n}\n");
  }

  @Test
  public void testWithReferencesRenamesThroughScopes() throws Exception {
    List<String> offered = new ArrayList<>();
    registry.register(
        "renameGlobal",
        ctx -> {
          ctx.withReferences(
              ctx.findDefinition("count"),
              ref -> {
                offered.add(ref.parent().type());
                return "total";
              });
          return null;
        });
    ExpansionResult result =
        expand(
            String.join(
                "\n",
                "int count;",
                "void f(int count) {",
                "  count = 1;",
                "}",
                "void g() {",
                "  @renameGlobal;",
                "  count = count + 1;",
                "}",
                ""));
    assertThat(result.text())
        .isEqualTo(
            String.join(
                "\n",
                "int total;",
                "void f(int count) {",
                "  count = 1;",
                "}",
                "void g() {",
                "  ;",
                "  total = total + 1;",
                "}",
                ""));
    assertThat(offered).hasSize(3);
    assertThat(result.passes()).isEqualTo(2);
  }

  @Test
  public void testWithReferencesRewritesEachReferenceOnce() throws Exception {
    registry.register(
        "deref",
        ctx -> {
          ctx.withReferences(ctx.findDefinition("p"), ref -> "(*" + ref.text() + ")");
          return null;
        });
    ExpansionResult result = expand("int p;\nint g() {\n  @deref;\n  return p + p;\n}\n");
    assertThat(result.text())
        .isEqualTo("int (*p);\nint g() {\n  ;\n  return (*p) + (*p);\n}\n");
    assertThat(result.passes()).isEqualTo(2);
  }
}
