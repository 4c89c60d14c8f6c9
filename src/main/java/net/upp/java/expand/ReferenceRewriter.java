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
import java.util.function.Function;
import javax.annotation.Nullable;
import net.upp.java.edit.Document;
import net.upp.java.edit.Marker;
import net.upp.java.edit.MarkerTable;
import net.upp.java.syntax.SyntaxNode;

/**
 * The transform registered by {@link ExpansionContext#withReferences}. The declaration is tracked
 * by a marker at its start, which follows the edits of every pass.
 */
final class ReferenceRewriter implements Transform {

  private final Document document;
  private final Marker anchor;
  private final String type;
  private final String name;
  private final Function<NodeView, String> rewrite;
  // The ends of the texts written so far, and their lengths.
  private final List<Marker> rewrittenEnds = new ArrayList<>();
  private final List<Integer> rewrittenLengths = new ArrayList<>();

  ReferenceRewriter(
      Document document,
      Marker anchor,
      String type,
      String name,
      Function<NodeView, String> rewrite) {
    this.document = document;
    this.anchor = anchor;
    this.type = type;
    this.name = name;
    this.rewrite = rewrite;
  }

  static boolean isDefinition(SyntaxNode n) {
    switch (n.type()) {
      case "declaration":
      case "parameter_declaration":
      case "function_definition":
      case "type_definition":
        return true;
      default:
        return false;
    }
  }

  @Override
  public void apply(ExpansionContext ctx) {
    MarkerTable markers = document.markers();
    if (ctx.document() != document || !markers.isValid(anchor)) {
      return;
    }
    SyntaxNode definition = definitionAt(ctx.root().unwrap(), markers.offset(anchor));
    if (definition == null) {
      return;
    }
    for (NodeView ref : ctx.findReferences(name)) {
      SyntaxNode r = ref.unwrap();
      if (isRewritten(r) || !refersTo(ctx, r, definition)) {
        continue;
      }
      String text = rewrite.apply(ref);
      if (text == null || text.equals(r.text())) {
        continue;
      }
      ctx.replace(ref, text);
      // The end of a replaced range stays at the end of the text replacing it.
      rewrittenEnds.add(document.createMarker(r.endOffset(), name));
      rewrittenLengths.add(text.length());
    }
  }

  @Nullable
  private SyntaxNode definitionAt(SyntaxNode root, int offset) {
    for (SyntaxNode n = root.namedDescendantForRange(offset, offset); n != null; n = n.parent()) {
      if (n.startOffset() != offset) {
        return null;
      }
      if (n.type().equals(type)) {
        return n;
      }
    }
    return null;
  }

  private boolean isRewritten(SyntaxNode ref) {
    MarkerTable markers = document.markers();
    for (int i = 0; i < rewrittenEnds.size(); i++) {
      Marker end = rewrittenEnds.get(i);
      if (!markers.isValid(end)) {
        continue;
      }
      int e = markers.offset(end);
      if (e - rewrittenLengths.get(i) <= ref.startOffset() && ref.endOffset() <= e) {
        return true;
      }
    }
    return false;
  }

  // A reference is the declared name itself, or an identifier that resolves to the declaration.
  private boolean refersTo(ExpansionContext ctx, SyntaxNode ref, SyntaxNode definition) {
    if (ref.isDescendantOf(definition)) {
      for (SyntaxNode n = ref.parent(); n != definition; n = n.parent()) {
        if (n.type().equals("compound_statement")) {
          return resolvesTo(ctx, ref, definition);
        }
      }
      return true;
    }
    return resolvesTo(ctx, ref, definition);
  }

  private boolean resolvesTo(ExpansionContext ctx, SyntaxNode ref, SyntaxNode definition) {
    NodeView found = ctx.findDefinition(name, ctx.wrap(ref));
    return found != null && found.unwrap() == definition;
  }

  @Override
  public String toString() {
    return "references to " + name;
  }
}
