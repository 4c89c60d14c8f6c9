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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  AMPERSAND("&"),
  AMPERSAND_AMPERSAND("&&"),
  AMPERSAND_EQUALS("&="),
  ARROW("->"),
  AT("@"),
  BANG("!"),
  BANG_EQUALS("!="),
  CARET("^"),
  CARET_EQUALS("^="),
  CHAR("char literal"),
  COLON(":"),
  COMMA(","),
  COMMENT("comment"),
  DOT("."),
  ELLIPSIS("..."),
  EOF("EOF"),
  EQUALS("="),
  EQUALS_EQUALS("=="),
  GREATER(">"),
  GREATER_EQUALS(">="),
  GREATER_GREATER(">>"),
  GREATER_GREATER_EQUALS(">>="),
  IDENTIFIER("identifier"),
  ILLEGAL("illegal character"),
  LBRACE("{"),
  LBRACKET("["),
  LESS("<"),
  LESS_EQUALS("<="),
  LESS_LESS("<<"),
  LESS_LESS_EQUALS("<<="),
  LPAREN("("),
  MINUS("-"),
  MINUS_EQUALS("-="),
  MINUS_MINUS("--"),
  NUMBER("number"),
  PERCENT("%"),
  PERCENT_EQUALS("%="),
  PIPE("|"),
  PIPE_EQUALS("|="),
  PIPE_PIPE("||"),
  PLUS("+"),
  PLUS_EQUALS("+="),
  PLUS_PLUS("++"),
  PREPROC("preprocessor directive"),
  QUESTION("?"),
  RBRACE("}"),
  RBRACKET("]"),
  RPAREN(")"),
  SEMI(";"),
  SLASH("/"),
  SLASH_EQUALS("/="),
  STAR("*"),
  STAR_EQUALS("*="),
  STRING("string literal"),
  TILDE("~"),

  // keywords
  BREAK("break"),
  CASE("case"),
  CONST("const"),
  CONTINUE("continue"),
  DEFAULT("default"),
  DO("do"),
  ELSE("else"),
  ENUM("enum"),
  EXTERN("extern"),
  FOR("for"),
  GOTO("goto"),
  IF("if"),
  INLINE("inline"),
  REGISTER("register"),
  RESTRICT("restrict"),
  RETURN("return"),
  SIZEOF("sizeof"),
  STATIC("static"),
  STRUCT("struct"),
  SWITCH("switch"),
  TYPEDEF("typedef"),
  UNION("union"),
  VOLATILE("volatile"),
  WHILE("while"),

  // primitive type names; see Lexer.PRIMITIVE_TYPES
  PRIMITIVE_TYPE("primitive type");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  /** Returns true if tokens of this kind carry text that varies from token to token. */
  boolean hasVariableText() {
    return this == IDENTIFIER
        || this == NUMBER
        || this == STRING
        || this == CHAR
        || this == COMMENT
        || this == PREPROC
        || this == PRIMITIVE_TYPE
        || this == ILLEGAL;
  }

  @Override
  public String toString() {
    return name;
  }
}
