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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Recursive descent parser for the C-like language. Produces a concrete syntax tree whose node
 * types and field names follow the tree-sitter C grammar.
 *
 * <p>The parser never fails: a statement or top-level item it cannot parse becomes an {@code ERROR}
 * node covering the tokens up to the next {@code ;} or {@code \}}, and macro invocations such as
 * {@code @name(args)} always become {@code ERROR} nodes that start with {@code @}.
 */
final class Parser {

  // A lexed token.
  private static final class Token {
    final TokenKind kind;
    final int start;
    final int end;
    final String raw;

    Token(TokenKind kind, int start, int end, String raw) {
      this.kind = kind;
      this.start = start;
      this.end = end;
      this.raw = raw;
    }
  }

  // Unwinds to the innermost statement or top-level item after a syntax error.
  private static final class ParseAbort extends RuntimeException {
    ParseAbort() {
      super(null, null, false, false);
    }
  }

  private static final EnumSet<TokenKind> ASSIGNMENT_OPERATORS =
      EnumSet.of(
          TokenKind.EQUALS,
          TokenKind.PLUS_EQUALS,
          TokenKind.MINUS_EQUALS,
          TokenKind.STAR_EQUALS,
          TokenKind.SLASH_EQUALS,
          TokenKind.PERCENT_EQUALS,
          TokenKind.AMPERSAND_EQUALS,
          TokenKind.CARET_EQUALS,
          TokenKind.PIPE_EQUALS,
          TokenKind.LESS_LESS_EQUALS,
          TokenKind.GREATER_GREATER_EQUALS);

  /** Highest precedence goes last. */
  private static final List<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.PIPE_PIPE),
          EnumSet.of(TokenKind.AMPERSAND_AMPERSAND),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.CARET),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.EQUALS_EQUALS, TokenKind.BANG_EQUALS),
          EnumSet.of(
              TokenKind.LESS, TokenKind.LESS_EQUALS, TokenKind.GREATER, TokenKind.GREATER_EQUALS),
          EnumSet.of(TokenKind.LESS_LESS, TokenKind.GREATER_GREATER),
          EnumSet.of(TokenKind.PLUS, TokenKind.MINUS),
          EnumSet.of(TokenKind.STAR, TokenKind.SLASH, TokenKind.PERCENT));

  private static final EnumSet<TokenKind> TYPE_KEYWORDS =
      EnumSet.of(
          TokenKind.PRIMITIVE_TYPE,
          TokenKind.STRUCT,
          TokenKind.UNION,
          TokenKind.ENUM,
          TokenKind.CONST,
          TokenKind.VOLATILE,
          TokenKind.RESTRICT);

  private static final EnumSet<TokenKind> DECLARATION_KEYWORDS =
      EnumSet.of(
          TokenKind.PRIMITIVE_TYPE,
          TokenKind.STRUCT,
          TokenKind.UNION,
          TokenKind.ENUM,
          TokenKind.CONST,
          TokenKind.VOLATILE,
          TokenKind.RESTRICT,
          TokenKind.STATIC,
          TokenKind.EXTERN,
          TokenKind.REGISTER,
          TokenKind.INLINE,
          TokenKind.TYPEDEF);

  private static final ImmutableList<String> SIZE_MODIFIERS =
      ImmutableList.of("signed", "unsigned", "long", "short");

  private final String text;
  private final List<SyntaxError> errors;
  private final SyntaxTree.IdAllocator ids;

  private final List<Token> allTokens = new ArrayList<>(); // including comments
  private final List<Token> tokens = new ArrayList<>(); // excluding comments, ends with EOF
  // Comments not yet attached to a node, by start offset.
  private final NavigableMap<Integer, Token> pendingComments = new TreeMap<>();
  // Names introduced by typedef, used to tell declarations and casts from expressions.
  private final Set<String> typedefNames = new HashSet<>();

  private int pos; // index of the lookahead token in tokens
  private Token token; // lookahead
  private int lastEnd; // end offset of the last consumed token

  private Parser(String text, List<SyntaxError> errors, SyntaxTree.IdAllocator ids) {
    this.text = text;
    this.errors = errors;
    this.ids = ids;
    Lexer lexer = new Lexer(text, errors);
    do {
      lexer.nextToken();
      Token t = new Token(lexer.kind, lexer.start, lexer.end, lexer.raw);
      if (t.kind != TokenKind.EOF) {
        allTokens.add(t);
      }
      if (t.kind == TokenKind.COMMENT) {
        pendingComments.put(t.start, t);
      } else {
        tokens.add(t);
      }
    } while (lexer.kind != TokenKind.EOF);
    this.token = tokens.get(0);
  }

  // Main entry point for parsing a file.
  static SyntaxNode parseTranslationUnit(
      String text, List<SyntaxError> errors, SyntaxTree.IdAllocator ids) {
    Parser parser = new Parser(text, errors, ids);
    try {
      return parser.parseTranslationUnit();
    } catch (StackOverflowError ex) {
      // Deeply nested input. Give up on structure but keep the text covered.
      parser.reportError(
          0, "internal error: stack overflow while parsing: %s", Throwables.getRootCause(ex));
      parser.pos = parser.tokens.size() - 1;
      parser.token = parser.tokens.get(parser.pos);
      parser.lastEnd = text.length();
      SyntaxNode error = parser.errorNode(0, text.length());
      return parser.makeNode("translation_unit", 0, text.length(), ImmutableList.of(error));
    }
  }

  // Builds a node, attaching any pending comments that lie within its range.
  private SyntaxNode makeNode(String type, int start, int end, List<SyntaxNode> children) {
    NavigableMap<Integer, Token> inside = pendingComments.subMap(start, true, end, false);
    if (!inside.isEmpty()) {
      List<SyntaxNode> merged = new ArrayList<>(children);
      for (Iterator<Token> it = inside.values().iterator(); it.hasNext(); ) {
        Token c = it.next();
        if (c.end <= end) {
          merged.add(leafFor(c));
          it.remove();
        }
      }
      merged.sort(Comparator.comparingInt(SyntaxNode::startOffset));
      children = merged;
    }
    return new SyntaxNode(
        type, true, start, end, children, text, 0, ids.idFor(type, start, end));
  }

  private SyntaxNode leaf(String type, boolean named, Token t) {
    return new SyntaxNode(
        type, named, t.start, t.end, ImmutableList.of(), text, 0, ids.idFor(type, t.start, t.end));
  }

  // Returns a leaf node for a token, named according to its kind.
  private SyntaxNode leafFor(Token t) {
    switch (t.kind) {
      case IDENTIFIER:
        return leaf("identifier", true, t);
      case NUMBER:
        return leaf("number_literal", true, t);
      case STRING:
        return leaf("string_literal", true, t);
      case CHAR:
        return leaf("char_literal", true, t);
      case COMMENT:
        return leaf("comment", true, t);
      case PRIMITIVE_TYPE:
        return leaf("primitive_type", true, t);
      case PREPROC:
        return leaf(preprocType(t.raw), true, t);
      default:
        return leaf(t.raw, false, t);
    }
  }

  private static String preprocType(String raw) {
    String directive = raw.substring(1).trim();
    if (directive.startsWith("include")) {
      return "preproc_include";
    } else if (directive.startsWith("define")) {
      return "preproc_def";
    }
    return "preproc_call";
  }

  /** Accumulates the children of a node under construction. */
  private final class NodeBuilder {
    private String type;
    private final int start;
    private final List<SyntaxNode> children = new ArrayList<>();

    NodeBuilder(String type, int start) {
      this.type = type;
      this.start = start;
    }

    @CanIgnoreReturnValue
    NodeBuilder add(@Nullable SyntaxNode child) {
      if (child != null) {
        children.add(child);
      }
      return this;
    }

    @CanIgnoreReturnValue
    NodeBuilder add(String field, @Nullable SyntaxNode child) {
      if (child != null) {
        child.setFieldName(field);
        children.add(child);
      }
      return this;
    }

    void setType(String type) {
      this.type = type;
    }

    SyntaxNode build() {
      int end = children.isEmpty() ? start : children.get(children.size() - 1).endOffset();
      return makeNode(type, start, Math.max(start, end), children);
    }
  }

  // --- token handling ---

  private Token consume() {
    Token t = token;
    lastEnd = t.end;
    if (t.kind != TokenKind.EOF) {
      pos++;
      token = tokens.get(pos);
    }
    return t;
  }

  // Consumes the lookahead as an anonymous node.
  private SyntaxNode anon() {
    return leaf(token.raw, false, consume());
  }

  // Consumes the lookahead as a named leaf.
  private SyntaxNode named(String type) {
    return leaf(type, true, consume());
  }

  // Consumes the lookahead as a named node wrapping the anonymous keyword.
  private SyntaxNode wrap(String type) {
    return new NodeBuilder(type, token.start).add(anon()).build();
  }

  private TokenKind peek(int i) {
    return tokens.get(Math.min(pos + i, tokens.size() - 1)).kind;
  }

  private Token peekToken(int i) {
    return tokens.get(Math.min(pos + i, tokens.size() - 1));
  }

  private SyntaxNode expect(TokenKind kind) {
    if (token.kind != kind) {
      throw syntaxError("expected " + kind);
    }
    return anon();
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errors.add(new SyntaxError(offset, Position.of(text, offset), String.format(format, args)));
  }

  private ParseAbort syntaxError(String message) {
    String tok = token.kind.hasVariableText() ? token.raw : token.kind.toString();
    reportError(token.start, "syntax error at '%s': %s", tok, message);
    return new ParseAbort();
  }

  // Skips to just past the next ';' or the end of the next block, or to the next unmatched '}',
  // and returns an ERROR node for everything since start. Consumes at least one token unless at
  // EOF.
  private SyntaxNode recover(int start, int startPos) {
    int depth = 0;
    if (pos == startPos && token.kind != TokenKind.EOF) {
      Token t = consume();
      if (t.kind == TokenKind.LBRACE) {
        depth++;
      } else if (t.kind == TokenKind.SEMI || t.kind == TokenKind.RBRACE) {
        return errorNode(start, lastEnd);
      }
    }
    while (token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.RBRACE) {
        if (depth == 0) {
          break;
        }
        consume();
        if (--depth == 0) {
          break; // a block closes the construct
        }
        continue;
      } else if (token.kind == TokenKind.LBRACE) {
        depth++;
      } else if (token.kind == TokenKind.SEMI && depth == 0) {
        consume();
        break;
      }
      consume();
    }
    return errorNode(start, Math.max(start, lastEnd));
  }

  // Returns an ERROR node whose children are leaves for every token in [start, end).
  private SyntaxNode errorNode(int start, int end) {
    List<SyntaxNode> children = new ArrayList<>();
    for (int i = firstTokenAtOrAfter(start); i < allTokens.size(); i++) {
      Token t = allTokens.get(i);
      if (t.end > end) {
        break;
      }
      if (t.kind == TokenKind.COMMENT) {
        pendingComments.remove(t.start);
      }
      children.add(leafFor(t));
    }
    return new SyntaxNode(
        SyntaxNode.ERROR,
        true,
        start,
        end,
        children,
        text,
        0,
        ids.idFor(SyntaxNode.ERROR, start, end));
  }

  private int firstTokenAtOrAfter(int offset) {
    int lo = 0;
    int hi = allTokens.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (allTokens.get(mid).start < offset) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  // --- top level ---

  // translation_unit = {top_level_item}
  private SyntaxNode parseTranslationUnit() {
    List<SyntaxNode> items = new ArrayList<>();
    while (token.kind != TokenKind.EOF) {
      items.add(parseTopLevelItem());
    }
    return makeNode("translation_unit", 0, text.length(), items);
  }

  // top_level_item = preproc | invocation | ';' | type_definition | declaration
  //                | function_definition
  private SyntaxNode parseTopLevelItem() {
    int start = token.start;
    int startPos = pos;
    try {
      switch (token.kind) {
        case PREPROC:
          return leafFor(consume());
        case AT:
          return parseInvocation();
        case SEMI:
          return new NodeBuilder("expression_statement", start).add(anon()).build();
        case TYPEDEF:
          return parseTypeDefinition();
        default:
          if (looksLikeDeclaration(/*topLevel=*/ true)) {
            return parseDeclaration(/*topLevel=*/ true);
          }
          throw syntaxError("expected declaration");
      }
    } catch (ParseAbort e) {
      return recover(start, startPos);
    }
  }

  private boolean isTypeStart(int i) {
    Token t = peekToken(i);
    return TYPE_KEYWORDS.contains(t.kind)
        || (t.kind == TokenKind.IDENTIFIER && typedefNames.contains(t.raw));
  }

  // Decides whether the lookahead starts a declaration rather than an expression statement.
  // At top level "T *x" is always a declaration; in a block it is one only if T is a known
  // typedef name or the declarator is followed by something only a declaration can have.
  private boolean looksLikeDeclaration(boolean topLevel) {
    if (DECLARATION_KEYWORDS.contains(token.kind)) {
      return true;
    }
    if (token.kind != TokenKind.IDENTIFIER) {
      return false;
    }
    TokenKind next = peek(1);
    if (next == TokenKind.IDENTIFIER) {
      return true;
    }
    if (next != TokenKind.STAR) {
      return false;
    }
    if (topLevel || typedefNames.contains(token.raw)) {
      return true;
    }
    int i = 2;
    while (peek(i) == TokenKind.STAR) {
      i++;
    }
    if (peek(i) != TokenKind.IDENTIFIER) {
      return false;
    }
    TokenKind after = peek(i + 1);
    return after == TokenKind.EQUALS
        || after == TokenKind.SEMI
        || after == TokenKind.COMMA
        || after == TokenKind.LBRACKET;
  }

  // declaration = specifiers [init_declarator {',' init_declarator}] ';'
  // function_definition = specifiers declarator compound_statement
  private SyntaxNode parseDeclaration(boolean topLevel) {
    NodeBuilder b = new NodeBuilder("declaration", token.start);
    parseSpecifiers(b);
    if (token.kind == TokenKind.SEMI) {
      return b.add(anon()).build();
    }
    SyntaxNode declarator = parseDeclarator("identifier", /*abstractOk=*/ false);
    if (topLevel && token.kind == TokenKind.LBRACE && isFunctionDeclarator(declarator)) {
      b.setType("function_definition");
      b.add("declarator", declarator);
      b.add("body", parseCompoundStatement());
      return b.build();
    }
    b.add("declarator", parseInitDeclaratorTail(declarator));
    while (token.kind == TokenKind.COMMA) {
      b.add(anon());
      b.add(
          "declarator",
          parseInitDeclaratorTail(parseDeclarator("identifier", /*abstractOk=*/ false)));
    }
    b.add(expect(TokenKind.SEMI));
    return b.build();
  }

  private static boolean isFunctionDeclarator(SyntaxNode declarator) {
    for (SyntaxNode d = declarator; d != null; d = d.childByFieldName("declarator")) {
      if (d.type().equals("function_declarator")) {
        return true;
      }
    }
    return false;
  }

  // init_declarator = declarator '=' initializer
  private SyntaxNode parseInitDeclaratorTail(SyntaxNode declarator) {
    if (token.kind != TokenKind.EQUALS) {
      return declarator;
    }
    return new NodeBuilder("init_declarator", declarator.startOffset())
        .add("declarator", declarator)
        .add(anon())
        .add("value", parseInitializer())
        .build();
  }

  private SyntaxNode parseInitializer() {
    return token.kind == TokenKind.LBRACE ? parseInitializerList() : parseAssignment();
  }

  // initializer_list = '{' [initializer {',' initializer} [',']] '}'
  // initializer = ['.' field_identifier '='] (expr | initializer_list)
  private SyntaxNode parseInitializerList() {
    NodeBuilder b = new NodeBuilder("initializer_list", token.start);
    b.add(expect(TokenKind.LBRACE));
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.DOT && peek(1) == TokenKind.IDENTIFIER) {
        NodeBuilder pair = new NodeBuilder("initializer_pair", token.start);
        NodeBuilder designator = new NodeBuilder("field_designator", token.start);
        designator.add(anon());
        designator.add(named("field_identifier"));
        pair.add("designator", designator.build());
        pair.add(expect(TokenKind.EQUALS));
        pair.add("value", parseInitializer());
        b.add(pair.build());
      } else {
        b.add(parseInitializer());
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      b.add(anon());
    }
    b.add(expect(TokenKind.RBRACE));
    return b.build();
  }

  // type_definition = 'typedef' specifiers declarator {',' declarator} ';'
  private SyntaxNode parseTypeDefinition() {
    NodeBuilder b = new NodeBuilder("type_definition", token.start);
    b.add(expect(TokenKind.TYPEDEF));
    parseSpecifiers(b);
    while (true) {
      SyntaxNode declarator = parseDeclarator("type_identifier", /*abstractOk=*/ false);
      SyntaxNode name = innermostName(declarator);
      if (name != null) {
        typedefNames.add(name.text());
      }
      b.add("declarator", declarator);
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      b.add(anon());
    }
    b.add(expect(TokenKind.SEMI));
    return b.build();
  }

  @Nullable
  private static SyntaxNode innermostName(SyntaxNode declarator) {
    SyntaxNode d = declarator;
    while (d.childByFieldName("declarator") != null) {
      d = d.childByFieldName("declarator");
    }
    if (d.type().equals("parenthesized_declarator")) {
      SyntaxNode inner = d.firstNamedChild();
      return inner == null ? null : innermostName(inner);
    }
    return d.childCount() == 0 ? d : null;
  }

  // specifiers = {storage_class | qualifier} type {qualifier}
  private void parseSpecifiers(NodeBuilder b) {
    boolean sawType = false;
    while (true) {
      switch (token.kind) {
        case STATIC:
        case EXTERN:
        case REGISTER:
        case INLINE:
          b.add(wrap("storage_class_specifier"));
          break;
        case CONST:
        case VOLATILE:
        case RESTRICT:
          b.add(wrap("type_qualifier"));
          break;
        case PRIMITIVE_TYPE:
          if (sawType) {
            return;
          }
          b.add("type", parsePrimitiveType());
          sawType = true;
          break;
        case STRUCT:
        case UNION:
        case ENUM:
          if (sawType) {
            return;
          }
          b.add("type", parseStructOrEnumSpecifier());
          sawType = true;
          break;
        case IDENTIFIER:
          if (sawType) {
            return;
          }
          b.add("type", named("type_identifier"));
          sawType = true;
          break;
        default:
          if (!sawType) {
            throw syntaxError("expected type");
          }
          return;
      }
    }
  }

  // primitive_type | sized_type_specifier
  private SyntaxNode parsePrimitiveType() {
    int start = token.start;
    if (peek(1) != TokenKind.PRIMITIVE_TYPE && !SIZE_MODIFIERS.contains(token.raw)) {
      return named("primitive_type");
    }
    NodeBuilder b = new NodeBuilder("sized_type_specifier", start);
    while (token.kind == TokenKind.PRIMITIVE_TYPE) {
      if (SIZE_MODIFIERS.contains(token.raw)) {
        b.add(anon());
      } else {
        b.add("type", named("primitive_type"));
      }
    }
    return b.build();
  }

  // struct_specifier = ('struct' | 'union') [type_identifier] [field_declaration_list]
  // enum_specifier = 'enum' [type_identifier] [enumerator_list]
  private SyntaxNode parseStructOrEnumSpecifier() {
    TokenKind kind = token.kind;
    String type =
        kind == TokenKind.STRUCT
            ? "struct_specifier"
            : kind == TokenKind.UNION ? "union_specifier" : "enum_specifier";
    NodeBuilder b = new NodeBuilder(type, token.start);
    b.add(anon());
    if (token.kind == TokenKind.IDENTIFIER) {
      b.add("name", named("type_identifier"));
    }
    if (token.kind == TokenKind.LBRACE) {
      b.add("body", kind == TokenKind.ENUM ? parseEnumeratorList() : parseFieldDeclarationList());
    }
    return b.build();
  }

  // field_declaration_list = '{' {field_declaration} '}'
  private SyntaxNode parseFieldDeclarationList() {
    NodeBuilder b = new NodeBuilder("field_declaration_list", token.start);
    b.add(expect(TokenKind.LBRACE));
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      int start = token.start;
      int startPos = pos;
      try {
        if (token.kind == TokenKind.PREPROC) {
          b.add(leafFor(consume()));
        } else if (token.kind == TokenKind.AT) {
          b.add(parseInvocation());
        } else {
          b.add(parseFieldDeclaration());
        }
      } catch (ParseAbort e) {
        b.add(recover(start, startPos));
      }
    }
    b.add(expect(TokenKind.RBRACE));
    return b.build();
  }

  // field_declaration = specifiers declarator [':' expr] {',' declarator} ';'
  private SyntaxNode parseFieldDeclaration() {
    NodeBuilder b = new NodeBuilder("field_declaration", token.start);
    parseSpecifiers(b);
    while (token.kind != TokenKind.SEMI) {
      if (token.kind != TokenKind.COLON) {
        b.add("declarator", parseDeclarator("field_identifier", /*abstractOk=*/ false));
      }
      if (token.kind == TokenKind.COLON) {
        b.add(
            new NodeBuilder("bitfield_clause", token.start)
                .add(anon())
                .add(parseConditional())
                .build());
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      b.add(anon());
    }
    b.add(expect(TokenKind.SEMI));
    return b.build();
  }

  // enumerator_list = '{' [enumerator {',' enumerator} [',']] '}'
  // enumerator = identifier ['=' expr]
  private SyntaxNode parseEnumeratorList() {
    NodeBuilder b = new NodeBuilder("enumerator_list", token.start);
    b.add(expect(TokenKind.LBRACE));
    while (token.kind == TokenKind.IDENTIFIER) {
      NodeBuilder e = new NodeBuilder("enumerator", token.start);
      e.add("name", named("identifier"));
      if (token.kind == TokenKind.EQUALS) {
        e.add(anon());
        e.add("value", parseConditional());
      }
      b.add(e.build());
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      b.add(anon());
    }
    b.add(expect(TokenKind.RBRACE));
    return b.build();
  }

  // declarator = '*' {qualifier} declarator
  //            | (name | '(' declarator ')') {parameter_list | '[' [expr] ']'}
  // Returns null only for an empty abstract declarator.
  @Nullable
  private SyntaxNode parseDeclarator(String nameType, boolean abstractOk) {
    if (token.kind == TokenKind.STAR) {
      NodeBuilder b = new NodeBuilder("pointer_declarator", token.start);
      b.add(anon());
      while (token.kind == TokenKind.CONST
          || token.kind == TokenKind.VOLATILE
          || token.kind == TokenKind.RESTRICT) {
        b.add(wrap("type_qualifier"));
      }
      SyntaxNode inner = parseDeclarator(nameType, abstractOk);
      if (inner == null || inner.type().startsWith("abstract_")) {
        b.setType("abstract_pointer_declarator");
      }
      b.add("declarator", inner);
      return b.build();
    }

    SyntaxNode d;
    if (token.kind == TokenKind.IDENTIFIER) {
      d = named(nameType);
    } else if (token.kind == TokenKind.LPAREN && peek(1) == TokenKind.STAR) {
      NodeBuilder b = new NodeBuilder("parenthesized_declarator", token.start);
      b.add(anon());
      b.add(parseDeclarator(nameType, abstractOk));
      b.add(expect(TokenKind.RPAREN));
      d = b.build();
    } else if (abstractOk) {
      d = null;
    } else {
      throw syntaxError("expected declarator");
    }

    while (true) {
      if (token.kind == TokenKind.LPAREN) {
        int start = d != null ? d.startOffset() : token.start;
        NodeBuilder b =
            new NodeBuilder(
                d == null ? "abstract_function_declarator" : "function_declarator", start);
        b.add("declarator", d);
        b.add("parameters", parseParameterList());
        d = b.build();
      } else if (token.kind == TokenKind.LBRACKET) {
        int start = d != null ? d.startOffset() : token.start;
        NodeBuilder b =
            new NodeBuilder(d == null ? "abstract_array_declarator" : "array_declarator", start);
        b.add("declarator", d);
        b.add(anon());
        if (token.kind != TokenKind.RBRACKET) {
          b.add("size", parseExpression());
        }
        b.add(expect(TokenKind.RBRACKET));
        d = b.build();
      } else {
        return d;
      }
    }
  }

  // parameter_list = '(' [parameter {',' parameter}] ')'
  // parameter = '...' | specifiers [declarator]
  private SyntaxNode parseParameterList() {
    NodeBuilder b = new NodeBuilder("parameter_list", token.start);
    b.add(expect(TokenKind.LPAREN));
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.AT) {
        b.add(parseInvocation());
        continue;
      }
      if (token.kind == TokenKind.ELLIPSIS) {
        b.add(new NodeBuilder("variadic_parameter", token.start).add(anon()).build());
      } else {
        NodeBuilder p = new NodeBuilder("parameter_declaration", token.start);
        parseSpecifiers(p);
        p.add("declarator", parseDeclarator("identifier", /*abstractOk=*/ true));
        b.add(p.build());
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      b.add(anon());
    }
    b.add(expect(TokenKind.RPAREN));
    return b.build();
  }

  // type_descriptor = specifiers [abstract_declarator]
  private SyntaxNode parseTypeDescriptor() {
    NodeBuilder b = new NodeBuilder("type_descriptor", token.start);
    parseSpecifiers(b);
    b.add("declarator", parseDeclarator("identifier", /*abstractOk=*/ true));
    return b.build();
  }

  // --- statements ---

  // block_item = preproc | invocation | declaration | statement
  private SyntaxNode parseBlockItem() {
    int start = token.start;
    int startPos = pos;
    try {
      if (token.kind == TokenKind.PREPROC) {
        return leafFor(consume());
      } else if (token.kind == TokenKind.AT) {
        return parseInvocation();
      } else if (token.kind == TokenKind.TYPEDEF) {
        return parseTypeDefinition();
      } else if (looksLikeDeclaration(/*topLevel=*/ false)) {
        return parseDeclaration(/*topLevel=*/ false);
      }
      return parseStatementInternal();
    } catch (ParseAbort e) {
      return recover(start, startPos);
    }
  }

  // Parses a statement in a position that allows exactly one (a loop body, say).
  private SyntaxNode parseStatement() {
    int start = token.start;
    int startPos = pos;
    try {
      if (token.kind == TokenKind.AT) {
        return parseInvocation();
      }
      return parseStatementInternal();
    } catch (ParseAbort e) {
      return recover(start, startPos);
    }
  }

  private SyntaxNode parseStatementInternal() {
    int start = token.start;
    switch (token.kind) {
      case LBRACE:
        return parseCompoundStatement();
      case IF:
        return parseIfStatement();
      case WHILE:
        {
          NodeBuilder b = new NodeBuilder("while_statement", start);
          b.add(anon());
          b.add("condition", parseParenthesizedExpression());
          b.add("body", parseStatement());
          return b.build();
        }
      case DO:
        {
          NodeBuilder b = new NodeBuilder("do_statement", start);
          b.add(anon());
          b.add("body", parseStatement());
          b.add(expect(TokenKind.WHILE));
          b.add("condition", parseParenthesizedExpression());
          b.add(expect(TokenKind.SEMI));
          return b.build();
        }
      case FOR:
        return parseForStatement();
      case SWITCH:
        {
          NodeBuilder b = new NodeBuilder("switch_statement", start);
          b.add(anon());
          b.add("condition", parseParenthesizedExpression());
          b.add("body", parseCompoundStatement());
          return b.build();
        }
      case CASE:
      case DEFAULT:
        return parseCaseStatement();
      case RETURN:
        {
          NodeBuilder b = new NodeBuilder("return_statement", start);
          b.add(anon());
          if (token.kind != TokenKind.SEMI) {
            b.add(parseExpression());
          }
          b.add(expect(TokenKind.SEMI));
          return b.build();
        }
      case BREAK:
        return new NodeBuilder("break_statement", start)
            .add(anon())
            .add(expect(TokenKind.SEMI))
            .build();
      case CONTINUE:
        return new NodeBuilder("continue_statement", start)
            .add(anon())
            .add(expect(TokenKind.SEMI))
            .build();
      case GOTO:
        {
          NodeBuilder b = new NodeBuilder("goto_statement", start);
          b.add(anon());
          if (token.kind != TokenKind.IDENTIFIER) {
            throw syntaxError("expected label");
          }
          b.add("label", named("statement_identifier"));
          b.add(expect(TokenKind.SEMI));
          return b.build();
        }
      case SEMI:
        return new NodeBuilder("expression_statement", start).add(anon()).build();
      case IDENTIFIER:
        if (peek(1) == TokenKind.COLON) {
          NodeBuilder b = new NodeBuilder("labeled_statement", start);
          b.add("label", named("statement_identifier"));
          b.add(anon());
          b.add(parseStatement());
          return b.build();
        }
        break;
      default:
        break;
    }
    NodeBuilder b = new NodeBuilder("expression_statement", start);
    b.add(parseExpression());
    b.add(expect(TokenKind.SEMI));
    return b.build();
  }

  // compound_statement = '{' {block_item} '}'
  private SyntaxNode parseCompoundStatement() {
    NodeBuilder b = new NodeBuilder("compound_statement", token.start);
    b.add(expect(TokenKind.LBRACE));
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      b.add(parseBlockItem());
    }
    if (token.kind == TokenKind.EOF) {
      // Keep what was parsed rather than discarding the whole block.
      reportError(token.start, "syntax error at EOF: expected %s", TokenKind.RBRACE);
    } else {
      b.add(anon());
    }
    return b.build();
  }

  // if_statement = 'if' parenthesized_expression statement ['else' statement]
  private SyntaxNode parseIfStatement() {
    NodeBuilder b = new NodeBuilder("if_statement", token.start);
    b.add(expect(TokenKind.IF));
    b.add("condition", parseParenthesizedExpression());
    b.add("consequence", parseStatement());
    if (token.kind == TokenKind.ELSE) {
      NodeBuilder e = new NodeBuilder("else_clause", token.start);
      e.add(anon());
      e.add(parseStatement());
      b.add("alternative", e.build());
    }
    return b.build();
  }

  // for_statement = 'for' '(' (declaration | [expr] ';') [expr] ';' [expr] ')' statement
  private SyntaxNode parseForStatement() {
    NodeBuilder b = new NodeBuilder("for_statement", token.start);
    b.add(expect(TokenKind.FOR));
    b.add(expect(TokenKind.LPAREN));
    if (looksLikeDeclaration(/*topLevel=*/ false)) {
      b.add("initializer", parseDeclaration(/*topLevel=*/ false));
    } else {
      if (token.kind != TokenKind.SEMI) {
        b.add("initializer", parseExpression());
      }
      b.add(expect(TokenKind.SEMI));
    }
    if (token.kind != TokenKind.SEMI) {
      b.add("condition", parseExpression());
    }
    b.add(expect(TokenKind.SEMI));
    if (token.kind != TokenKind.RPAREN) {
      b.add("update", parseExpression());
    }
    b.add(expect(TokenKind.RPAREN));
    b.add("body", parseStatement());
    return b.build();
  }

  // case_statement = ('case' expr | 'default') ':' {block_item}
  private SyntaxNode parseCaseStatement() {
    NodeBuilder b = new NodeBuilder("case_statement", token.start);
    if (token.kind == TokenKind.CASE) {
      b.add(anon());
      b.add("value", parseConditional());
    } else {
      b.add(expect(TokenKind.DEFAULT));
    }
    b.add(expect(TokenKind.COLON));
    while (token.kind != TokenKind.CASE
        && token.kind != TokenKind.DEFAULT
        && token.kind != TokenKind.RBRACE
        && token.kind != TokenKind.EOF) {
      b.add(parseBlockItem());
    }
    return b.build();
  }

  // --- expressions ---

  // invocation = '@' [name ['(' balanced ')']]
  private SyntaxNode parseInvocation() {
    int start = token.start;
    consume(); // '@'
    if (token.start == lastEnd
        && !token.raw.isEmpty()
        && Lexer.isIdentifierStart(token.raw.charAt(0))) {
      consume();
      if (token.kind == TokenKind.LPAREN && token.start == lastEnd) {
        int depth = 0;
        do {
          if (token.kind == TokenKind.LPAREN) {
            depth++;
          } else if (token.kind == TokenKind.RPAREN) {
            depth--;
          }
          consume();
        } while (depth > 0 && token.kind != TokenKind.EOF);
        if (depth > 0) {
          reportError(start, "unterminated argument list of macro invocation");
        }
      }
    }
    reportError(start, "unexpanded macro invocation '%s'", text.substring(start, lastEnd));
    return errorNode(start, lastEnd);
  }

  // parenthesized_expression = '(' expr ')'
  private SyntaxNode parseParenthesizedExpression() {
    NodeBuilder b = new NodeBuilder("parenthesized_expression", token.start);
    b.add(expect(TokenKind.LPAREN));
    b.add(parseExpression());
    b.add(expect(TokenKind.RPAREN));
    return b.build();
  }

  // expr = assignment {',' assignment}
  private SyntaxNode parseExpression() {
    SyntaxNode e = parseAssignment();
    while (token.kind == TokenKind.COMMA) {
      e =
          new NodeBuilder("comma_expression", e.startOffset())
              .add("left", e)
              .add(anon())
              .add("right", parseAssignment())
              .build();
    }
    return e;
  }

  // assignment = conditional [assign_op assignment]
  private SyntaxNode parseAssignment() {
    SyntaxNode left = parseConditional();
    if (!ASSIGNMENT_OPERATORS.contains(token.kind)) {
      return left;
    }
    return new NodeBuilder("assignment_expression", left.startOffset())
        .add("left", left)
        .add("operator", anon())
        .add("right", parseAssignment())
        .build();
  }

  // conditional = binary ['?' expr ':' conditional]
  private SyntaxNode parseConditional() {
    SyntaxNode cond = parseBinary(0);
    if (token.kind != TokenKind.QUESTION) {
      return cond;
    }
    NodeBuilder b = new NodeBuilder("conditional_expression", cond.startOffset());
    b.add("condition", cond);
    b.add(anon());
    b.add("consequence", parseExpression());
    b.add(expect(TokenKind.COLON));
    b.add("alternative", parseConditional());
    return b.build();
  }

  private SyntaxNode parseBinary(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parseUnary();
    }
    SyntaxNode x = parseBinary(prec + 1);
    while (operatorPrecedence.get(prec).contains(token.kind)) {
      x =
          new NodeBuilder("binary_expression", x.startOffset())
              .add("left", x)
              .add("operator", anon())
              .add("right", parseBinary(prec + 1))
              .build();
    }
    return x;
  }

  // unary = ('!' | '~' | '-' | '+') unary | ('*' | '&') unary | ('++' | '--') unary
  //       | 'sizeof' (unary | '(' type_descriptor ')') | '(' type_descriptor ')' unary
  //       | postfix
  private SyntaxNode parseUnary() {
    int start = token.start;
    switch (token.kind) {
      case BANG:
      case TILDE:
      case MINUS:
      case PLUS:
        return prefix("unary_expression", start);
      case STAR:
      case AMPERSAND:
        return prefix("pointer_expression", start);
      case PLUS_PLUS:
      case MINUS_MINUS:
        return prefix("update_expression", start);
      case SIZEOF:
        {
          NodeBuilder b = new NodeBuilder("sizeof_expression", start);
          b.add(anon());
          if (token.kind == TokenKind.LPAREN && isTypeStart(1)) {
            b.add(anon());
            b.add("type", parseTypeDescriptor());
            b.add(expect(TokenKind.RPAREN));
          } else {
            b.add("value", parseUnary());
          }
          return b.build();
        }
      case LPAREN:
        if (isCast()) {
          NodeBuilder b = new NodeBuilder("cast_expression", start);
          b.add(anon());
          b.add("type", parseTypeDescriptor());
          b.add(expect(TokenKind.RPAREN));
          if (token.kind == TokenKind.LBRACE) {
            b.setType("compound_literal_expression");
            b.add("value", parseInitializerList());
          } else {
            b.add("value", parseUnary());
          }
          return b.build();
        }
        break;
      default:
        break;
    }
    return parsePostfix();
  }

  private SyntaxNode prefix(String type, int start) {
    return new NodeBuilder(type, start)
        .add("operator", anon())
        .add("argument", parseUnary())
        .build();
  }

  private boolean isCast() {
    if (isTypeStart(1)) {
      return true;
    }
    // (T *) with T not known to be a type.
    return peek(1) == TokenKind.IDENTIFIER
        && peek(2) == TokenKind.STAR
        && (peek(3) == TokenKind.RPAREN || peek(3) == TokenKind.STAR);
  }

  // postfix = primary {argument_list | '[' expr ']' | ('.' | '->') field | '++' | '--'}
  private SyntaxNode parsePostfix() {
    SyntaxNode e = parsePrimary();
    while (true) {
      int start = e.startOffset();
      switch (token.kind) {
        case LPAREN:
          e =
              new NodeBuilder("call_expression", start)
                  .add("function", e)
                  .add("arguments", parseArgumentList())
                  .build();
          break;
        case LBRACKET:
          {
            NodeBuilder b = new NodeBuilder("subscript_expression", start);
            b.add("argument", e);
            b.add(anon());
            b.add("index", parseExpression());
            b.add(expect(TokenKind.RBRACKET));
            e = b.build();
            break;
          }
        case DOT:
        case ARROW:
          {
            NodeBuilder b = new NodeBuilder("field_expression", start);
            b.add("argument", e);
            b.add("operator", anon());
            if (token.kind != TokenKind.IDENTIFIER) {
              throw syntaxError("expected field name");
            }
            b.add("field", named("field_identifier"));
            e = b.build();
            break;
          }
        case PLUS_PLUS:
        case MINUS_MINUS:
          e =
              new NodeBuilder("update_expression", start)
                  .add("argument", e)
                  .add("operator", anon())
                  .build();
          break;
        default:
          return e;
      }
    }
  }

  // argument_list = '(' [assignment {',' assignment}] ')'
  private SyntaxNode parseArgumentList() {
    NodeBuilder b = new NodeBuilder("argument_list", token.start);
    b.add(expect(TokenKind.LPAREN));
    while (token.kind != TokenKind.RPAREN) {
      b.add(parseAssignment());
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      b.add(anon());
    }
    b.add(expect(TokenKind.RPAREN));
    return b.build();
  }

  // primary = identifier | number | char | string {string} | '(' expr ')' | initializer_list
  //         | invocation
  private SyntaxNode parsePrimary() {
    switch (token.kind) {
      case IDENTIFIER:
        return named("identifier");
      case NUMBER:
        return named("number_literal");
      case CHAR:
        return named("char_literal");
      case STRING:
        {
          if (peek(1) != TokenKind.STRING) {
            return named("string_literal");
          }
          NodeBuilder b = new NodeBuilder("concatenated_string", token.start);
          while (token.kind == TokenKind.STRING) {
            b.add(named("string_literal"));
          }
          return b.build();
        }
      case LPAREN:
        return parseParenthesizedExpression();
      case LBRACE:
        return parseInitializerList();
      case AT:
        return parseInvocation();
      default:
        throw syntaxError("expected expression");
    }
  }
}
