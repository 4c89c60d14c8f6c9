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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** A scanner for the C-like language accepted by the macro preprocessor. */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Information about current token. Updated by nextToken.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw; // source text of token

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // True if only whitespace has been seen since the last newline (or the start of input).
  // Preprocessor directives are recognized only there.
  private boolean atLineStart = true;

  // Characters that can come immediately prior to an '=' character to generate
  // a different token
  private static final ImmutableMap<Character, TokenKind> EQUAL_TOKENS =
      ImmutableMap.<Character, TokenKind>builder()
          .put('=', TokenKind.EQUALS_EQUALS)
          .put('!', TokenKind.BANG_EQUALS)
          .put('>', TokenKind.GREATER_EQUALS)
          .put('<', TokenKind.LESS_EQUALS)
          .put('+', TokenKind.PLUS_EQUALS)
          .put('-', TokenKind.MINUS_EQUALS)
          .put('*', TokenKind.STAR_EQUALS)
          .put('/', TokenKind.SLASH_EQUALS)
          .put('%', TokenKind.PERCENT_EQUALS)
          .put('^', TokenKind.CARET_EQUALS)
          .put('&', TokenKind.AMPERSAND_EQUALS)
          .put('|', TokenKind.PIPE_EQUALS)
          .buildOrThrow();

  /** Names scanned as {@link TokenKind#PRIMITIVE_TYPE}. */
  static final ImmutableSet<String> PRIMITIVE_TYPES =
      ImmutableSet.of(
          "_Bool",
          "bool",
          "char",
          "char16_t",
          "char32_t",
          "double",
          "float",
          "int",
          "int8_t",
          "int16_t",
          "int32_t",
          "int64_t",
          "intptr_t",
          "long",
          "ptrdiff_t",
          "short",
          "signed",
          "size_t",
          "ssize_t",
          "uint8_t",
          "uint16_t",
          "uint32_t",
          "uint64_t",
          "uintptr_t",
          "unsigned",
          "void");

  Lexer(String input, List<SyntaxError> errors) {
    this.buffer = input.toCharArray();
    this.pos = 0;
    this.errors = errors;
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    Preconditions.checkState(kind != TokenKind.EOF, "nextToken after EOF");
    tokenize();
    Preconditions.checkState(kind != null);
  }

  private void error(String message, int pos) {
    errors.add(new SyntaxError(pos, Position.of(new String(buffer), pos), message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.raw = bufferSlice(start, end);
  }

  /**
   * Scans a string or char literal delimited by 'quot'. Escapes are skipped, not decoded: the
   * preprocessor only ever needs the raw text.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first delimiter. ON EXIT: 'pos' is 1 + the index of
   * the last delimiter.
   */
  private void quotedLiteral(char quot) {
    int literalStartPos = pos - 1;
    TokenKind kind = quot == '"' ? TokenKind.STRING : TokenKind.CHAR;
    while (pos < buffer.length) {
      char c = buffer[pos++];
      switch (c) {
        case '\\':
          if (pos < buffer.length) {
            pos++;
          }
          break;
        case '\n':
          error("unclosed " + kind, literalStartPos);
          setToken(kind, literalStartPos, pos - 1);
          pos--;
          return;
        default:
          if (c == quot) {
            setToken(kind, literalStartPos, pos);
            return;
          }
          break;
      }
    }
    error("unclosed " + kind, literalStartPos);
    setToken(kind, literalStartPos, pos);
  }

  private static final Map<String, TokenKind> keywordMap = new HashMap<>();

  static {
    keywordMap.put("break", TokenKind.BREAK);
    keywordMap.put("case", TokenKind.CASE);
    keywordMap.put("const", TokenKind.CONST);
    keywordMap.put("continue", TokenKind.CONTINUE);
    keywordMap.put("default", TokenKind.DEFAULT);
    keywordMap.put("do", TokenKind.DO);
    keywordMap.put("else", TokenKind.ELSE);
    keywordMap.put("enum", TokenKind.ENUM);
    keywordMap.put("extern", TokenKind.EXTERN);
    keywordMap.put("for", TokenKind.FOR);
    keywordMap.put("goto", TokenKind.GOTO);
    keywordMap.put("if", TokenKind.IF);
    keywordMap.put("inline", TokenKind.INLINE);
    keywordMap.put("register", TokenKind.REGISTER);
    keywordMap.put("restrict", TokenKind.RESTRICT);
    keywordMap.put("return", TokenKind.RETURN);
    keywordMap.put("sizeof", TokenKind.SIZEOF);
    keywordMap.put("static", TokenKind.STATIC);
    keywordMap.put("struct", TokenKind.STRUCT);
    keywordMap.put("switch", TokenKind.SWITCH);
    keywordMap.put("typedef", TokenKind.TYPEDEF);
    keywordMap.put("union", TokenKind.UNION);
    keywordMap.put("volatile", TokenKind.VOLATILE);
    keywordMap.put("while", TokenKind.WHILE);
    for (String name : PRIMITIVE_TYPES) {
      keywordMap.put(name, TokenKind.PRIMITIVE_TYPE);
    }
  }

  /**
   * Scans an identifier or keyword. Identifiers may contain '$', which is how pattern wildcards
   * such as {@code $x__until} survive tokenization.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier. ON EXIT: 'pos' is 1 +
   * the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    String id = bufferSlice(oldPos, pos);
    TokenKind kind = keywordMap.get(id);
    setToken(kind == null ? TokenKind.IDENTIFIER : kind, oldPos, pos);
  }

  static boolean isIdentifierStart(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
  }

  static boolean isIdentifierPart(int c) {
    return isIdentifierStart(c) || isdigit(c);
  }

  private static boolean isTrailingBlank(char c) {
    return c == ' ' || c == '\t' || c == '\r';
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  // Scans a "//" or "/*" comment. ON ENTRY: 'pos' is the index of the second char.
  private void comment(int commentStart) {
    if (buffer[pos] == '/') {
      while (pos < buffer.length && buffer[pos] != '\n') {
        pos++;
      }
    } else {
      pos++; // consume '*'
      boolean closed = false;
      while (pos < buffer.length) {
        if (buffer[pos] == '*' && peek(1) == '/') {
          pos += 2;
          closed = true;
          break;
        }
        pos++;
      }
      if (!closed) {
        error("unclosed comment", commentStart);
      }
    }
    setToken(TokenKind.COMMENT, commentStart, pos);
  }

  // Scans a preprocessor directive up to the end of its (possibly continued) line.
  private void directive(int directiveStart) {
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '\\' && peek(1) == '\n') {
        pos += 2;
      } else if (c == '\\' && peek(1) == '\r' && peek(2) == '\n') {
        pos += 3;
      } else if (c == '\n') {
        break;
      } else {
        pos++;
      }
    }
    int end = pos;
    while (end > directiveStart && isTrailingBlank(buffer[end - 1])) {
      end--;
    }
    setToken(TokenKind.PREPROC, directiveStart, end);
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor.
   */
  private void tokenize() {
    kind = null;
    while (pos < buffer.length) {
      char c = buffer[pos];
      boolean lineStart = atLineStart;
      if (c == '\n') {
        atLineStart = true;
        pos++;
        continue;
      }
      if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
        pos++;
        continue;
      }
      atLineStart = false;

      if (tokenizeTwoChars()) {
        pos += 2;
        return;
      }
      pos++;
      switch (c) {
        case '{':
          setToken(TokenKind.LBRACE, pos - 1, pos);
          break;
        case '}':
          setToken(TokenKind.RBRACE, pos - 1, pos);
          break;
        case '(':
          setToken(TokenKind.LPAREN, pos - 1, pos);
          break;
        case ')':
          setToken(TokenKind.RPAREN, pos - 1, pos);
          break;
        case '[':
          setToken(TokenKind.LBRACKET, pos - 1, pos);
          break;
        case ']':
          setToken(TokenKind.RBRACKET, pos - 1, pos);
          break;
        case '>':
          if (peek(0) == '>' && peek(1) == '=') {
            setToken(TokenKind.GREATER_GREATER_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '>') {
            setToken(TokenKind.GREATER_GREATER, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.GREATER, pos - 1, pos);
          }
          break;
        case '<':
          if (peek(0) == '<' && peek(1) == '=') {
            setToken(TokenKind.LESS_LESS_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '<') {
            setToken(TokenKind.LESS_LESS, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.LESS, pos - 1, pos);
          }
          break;
        case ':':
          setToken(TokenKind.COLON, pos - 1, pos);
          break;
        case ',':
          setToken(TokenKind.COMMA, pos - 1, pos);
          break;
        case '?':
          setToken(TokenKind.QUESTION, pos - 1, pos);
          break;
        case '@':
          setToken(TokenKind.AT, pos - 1, pos);
          break;
        case '+':
          if (peek(0) == '+') {
            setToken(TokenKind.PLUS_PLUS, pos - 1, ++pos);
          } else {
            setToken(TokenKind.PLUS, pos - 1, pos);
          }
          break;
        case '-':
          if (peek(0) == '-') {
            setToken(TokenKind.MINUS_MINUS, pos - 1, ++pos);
          } else if (peek(0) == '>') {
            setToken(TokenKind.ARROW, pos - 1, ++pos);
          } else {
            setToken(TokenKind.MINUS, pos - 1, pos);
          }
          break;
        case '|':
          if (peek(0) == '|') {
            setToken(TokenKind.PIPE_PIPE, pos - 1, ++pos);
          } else {
            setToken(TokenKind.PIPE, pos - 1, pos);
          }
          break;
        case '&':
          if (peek(0) == '&') {
            setToken(TokenKind.AMPERSAND_AMPERSAND, pos - 1, ++pos);
          } else {
            setToken(TokenKind.AMPERSAND, pos - 1, pos);
          }
          break;
        case '=':
          setToken(TokenKind.EQUALS, pos - 1, pos);
          break;
        case '!':
          setToken(TokenKind.BANG, pos - 1, pos);
          break;
        case '%':
          setToken(TokenKind.PERCENT, pos - 1, pos);
          break;
        case '~':
          setToken(TokenKind.TILDE, pos - 1, pos);
          break;
        case '^':
          setToken(TokenKind.CARET, pos - 1, pos);
          break;
        case '/':
          if (peek(0) == '/' || peek(0) == '*') {
            comment(pos - 1);
          } else {
            // /= is handled by tokenizeTwoChars.
            setToken(TokenKind.SLASH, pos - 1, pos);
          }
          break;
        case ';':
          setToken(TokenKind.SEMI, pos - 1, pos);
          break;
        case '*':
          setToken(TokenKind.STAR, pos - 1, pos);
          break;
        case '#':
          if (lineStart) {
            directive(pos - 1);
          } else {
            error("invalid character: '#'", pos - 1);
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
          }
          break;
        case '\\':
          // Backslash character is valid only at the end of a line (or in a literal)
          if (peek(0) == '\n') {
            pos += 1; // skip the end of line character
          } else if (peek(0) == '\r' && peek(1) == '\n') {
            pos += 2; // skip the CRLF at the end of line
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
          }
          break;
        case '\'':
        case '"':
          quotedLiteral(c);
          break;
        default:
          // number literal, ellipsis, or dot
          if (c == '.' || isdigit(c)) {
            pos--; // unconsume
            scanNumberOrDot(c);
            break;
          }

          if (isIdentifierStart(c)) {
            // L"wide" and u8"..." prefixes
            if ((c == 'L' || c == 'u' || c == 'U') && (peek(0) == '"' || peek(0) == '\'')) {
              int prefixStart = pos - 1;
              char quot = buffer[pos++];
              quotedLiteral(quot);
              setToken(kind, prefixStart, end);
              break;
            }
            identifierOrKeyword();
          } else {
            error("invalid character: '" + c + "'", pos - 1);
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
          }
          break;
      } // switch
      if (kind != null) { // stop here if we scanned a token
        return;
      }
    } // while

    setToken(TokenKind.EOF, pos, pos);
  }

  /**
   * Tokenizes a two-char operator.
   *
   * @return true if it tokenized an operator
   */
  private boolean tokenizeTwoChars() {
    if (pos + 1 >= buffer.length) {
      return false;
    }
    char c1 = buffer[pos];
    char c2 = buffer[pos + 1];
    if (c2 != '=') {
      return false;
    }
    TokenKind tok = EQUAL_TOKENS.get(c1);
    if (tok == null) {
      return false;
    }
    setToken(tok, pos, pos + 2);
    return true;
  }

  // Scans a number literal, an ellipsis, or DOT.
  // Precondition: c == peek(0) (a dot or digit)
  private void scanNumberOrDot(int c) {
    int start = this.pos;
    if (c == '.') {
      if (peek(1) == '.' && peek(2) == '.') {
        pos += 3;
        setToken(TokenKind.ELLIPSIS, start, pos);
        return;
      }
      if (!isdigit(peek(1))) {
        pos++; // consume '.'
        setToken(TokenKind.DOT, start, pos);
        return;
      }
    }
    // Accept the usual pp-number shape: digits, letters (hex digits, exponents, suffixes), dots,
    // and signs following an exponent.
    int prev = -1;
    while (pos < buffer.length) {
      char ch = buffer[pos];
      if (isIdentifierPart(ch) && ch != '$' || ch == '.') {
        prev = ch;
        pos++;
      } else if ((ch == '+' || ch == '-') && isExponent(prev, isHex(start))) {
        prev = ch;
        pos++;
      } else {
        break;
      }
    }
    setToken(TokenKind.NUMBER, start, pos);
  }

  private boolean isHex(int start) {
    return buffer[start] == '0'
        && start + 1 < buffer.length
        && (buffer[start + 1] == 'x' || buffer[start + 1] == 'X');
  }

  // In hex literals 'e' is a digit; only 'p' introduces a signed exponent.
  private static boolean isExponent(int c, boolean hex) {
    if (c == 'p' || c == 'P') {
      return true;
    }
    return !hex && (c == 'e' || c == 'E');
  }

  private static boolean isdigit(int c) {
    return '0' <= c && c <= '9';
  }

  /**
   * Returns parts of the source buffer based on offsets
   *
   * @param start the beginning offset for the slice
   * @param end the offset immediately following the slice
   * @return the text at offset start with length end - start
   */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }
}
