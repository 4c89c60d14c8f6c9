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

import javax.annotation.Nullable;
import net.upp.java.syntax.SyntaxNode;

/**
 * A {@link SymbolResolver} that searches the enclosing scopes of a node for the declaration of a
 * name: declarations and typedefs earlier in each enclosing block, the parameters of the
 * enclosing function, and the declarations, typedefs and functions of the file.
 *
 * <p>It knows nothing of struct members, labels or declarations in other files.
 */
public final class DeclarationResolver implements SymbolResolver {

  @Override
  @Nullable
  public SyntaxNode resolveSymbol(String name, SyntaxNode context) {
    SyntaxNode inner = context;
    for (SyntaxNode scope = context.parent(); scope != null; scope = scope.parent()) {
      switch (scope.type()) {
        case "translation_unit":
          // File-level names may be used before the point of declaration in a later function.
          for (SyntaxNode item : scope.namedChildren()) {
            SyntaxNode found = declares(item, name);
            if (found != null) {
              return found;
            }
          }
          break;
        case "compound_statement":
          for (SyntaxNode item : scope.namedChildren()) {
            if (item.startOffset() >= inner.startOffset()) {
              break;
            }
            SyntaxNode found = declares(item, name);
            if (found != null) {
              return found;
            }
          }
          break;
        case "for_statement":
          SyntaxNode init = scope.childByFieldName("initializer");
          if (init != null && init != inner) {
            SyntaxNode found = declares(init, name);
            if (found != null) {
              return found;
            }
          }
          break;
        case "function_definition":
          SyntaxNode parameters = parameterList(scope.childByFieldName("declarator"));
          if (parameters != null) {
            for (SyntaxNode p : parameters.namedChildren()) {
              if (p.type().equals("parameter_declaration")
                  && name.equals(declaredName(p.childByFieldName("declarator")))) {
                return p;
              }
            }
          }
          break;
        default:
          break;
      }
      inner = scope;
    }
    return null;
  }

  // Returns item if it is a declaration of name.
  @Nullable
  private static SyntaxNode declares(SyntaxNode item, String name) {
    switch (item.type()) {
      case "declaration":
      case "type_definition":
        for (SyntaxNode d : item.childrenByFieldName("declarator")) {
          if (name.equals(declaredName(d))) {
            return item;
          }
        }
        return null;
      case "function_definition":
        return name.equals(declaredName(item.childByFieldName("declarator"))) ? item : null;
      default:
        return null;
    }
  }

  /** Returns the identifier a declarator declares, or null for an abstract declarator. */
  @Nullable
  static String declaredName(@Nullable SyntaxNode declarator) {
    SyntaxNode d = declarator;
    while (d != null) {
      if (d.childCount() == 0) {
        return d.text();
      }
      SyntaxNode next = d.childByFieldName("declarator");
      if (next == null && d.type().equals("parenthesized_declarator")) {
        next = d.firstNamedChild();
      }
      d = next;
    }
    return null;
  }

  @Nullable
  private static SyntaxNode parameterList(@Nullable SyntaxNode declarator) {
    for (SyntaxNode d = declarator; d != null; d = d.childByFieldName("declarator")) {
      if (d.type().equals("function_declarator")) {
        return d.childByFieldName("parameters");
      }
    }
    return null;
  }
}
