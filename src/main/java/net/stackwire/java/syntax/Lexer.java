// Copyright 2026 The Stackwire Authors. All rights reserved.
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
package net.stackwire.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.List;

/** A scanner for declaration files. */
final class Lexer {

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  // raw and value are defined only for STRING, INT, FLOAT and IDENTIFIER.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw; // source text of token
  Object value; // String, Long, or Double value of token

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // The number of unclosed open-parens ("(", '{', '[') at the current point in
  // the stream. Newlines are not tokens when this is nonzero.
  private int openParenStackDepth = 0;

  private static final ImmutableMap<String, TokenKind> keywordMap =
      ImmutableMap.<String, TokenKind>builder()
          .put("chan", TokenKind.CHAN)
          .put("const", TokenKind.CONST)
          .put("func", TokenKind.FUNC)
          .put("import", TokenKind.IMPORT)
          .put("interface", TokenKind.INTERFACE)
          .put("map", TokenKind.MAP)
          .put("package", TokenKind.PACKAGE)
          .put("struct", TokenKind.STRUCT)
          .put("type", TokenKind.TYPE)
          .put("var", TokenKind.VAR)
          .buildOrThrow();

  // Characters that can come immediately prior to an '=' character to generate
  // a different token
  private static final ImmutableMap<Character, TokenKind> EQUAL_TOKENS =
      ImmutableMap.of(
          '=', TokenKind.EQUALS_EQUALS,
          '!', TokenKind.NOT_EQUALS,
          '>', TokenKind.GREATER_EQUALS,
          '<', TokenKind.LESS_EQUALS);

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.errors = errors;
  }

  /**
   * Reads the next token, updating the Lexer's token fields. Once EOF is reached, further calls
   * return EOF again.
   */
  void nextToken() {
    tokenize();
    Preconditions.checkState(kind != null);
  }

  private void popParen() {
    if (openParenStackDepth == 0) {
      error("unbalanced closing bracket", pos - 1);
    } else {
      openParenStackDepth--;
    }
  }

  private void error(String message, int pos) {
    errors.add(new SyntaxError(locs.getLocation(pos), message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = null;
    this.raw = null;
  }

  // setValue sets the value associated with a STRING, FLOAT, INT,
  // or IDENTIFIER token, and records the raw text of the token.
  private void setValue(Object value) {
    this.value = value;
    this.raw = bufferSlice(start, end);
  }

  private void newline() {
    if (openParenStackDepth == 0) {
      setToken(TokenKind.NEWLINE, pos - 1, pos);
    }
  }

  /**
   * Scans an interpreted string literal delimited by double quotes.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the opening quote. ON EXIT: 'pos' is 1 + the index of
   * the closing quote, or the end of the line if the literal is unclosed.
   */
  private void stringLiteral() {
    int literalStartPos = pos - 1;
    StringBuilder literal = new StringBuilder();
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '\n') {
        break;
      }
      pos++;
      if (c == '"') {
        setToken(TokenKind.STRING, literalStartPos, pos);
        setValue(literal.toString());
        return;
      }
      if (c == '\\') {
        escape(literal, '"');
      } else {
        literal.append(c);
      }
    }
    error("unclosed string literal", literalStartPos);
    setToken(TokenKind.STRING, literalStartPos, pos);
    setValue(literal.toString());
  }

  /** Scans a raw string literal delimited by backquotes. Carriage returns are discarded. */
  private void rawStringLiteral() {
    int literalStartPos = pos - 1;
    StringBuilder literal = new StringBuilder();
    while (pos < buffer.length) {
      char c = buffer[pos++];
      if (c == '`') {
        setToken(TokenKind.STRING, literalStartPos, pos);
        setValue(literal.toString());
        return;
      }
      if (c != '\r') {
        literal.append(c);
      }
    }
    error("unclosed raw string literal", literalStartPos);
    setToken(TokenKind.STRING, literalStartPos, pos);
    setValue(literal.toString());
  }

  /** Scans a rune literal, yielding an INT token whose value is the code point. */
  private void runeLiteral() {
    int literalStartPos = pos - 1;
    StringBuilder literal = new StringBuilder();
    while (pos < buffer.length && buffer[pos] != '\'' && buffer[pos] != '\n') {
      char c = buffer[pos++];
      if (c == '\\') {
        escape(literal, '\'');
      } else {
        literal.append(c);
      }
    }
    if (pos < buffer.length && buffer[pos] == '\'') {
      pos++;
    } else {
      error("unclosed rune literal", literalStartPos);
    }
    if (literal.length() == 0 || literal.codePointCount(0, literal.length()) != 1) {
      error("rune literal must contain exactly one character", literalStartPos);
    }
    setToken(TokenKind.INT, literalStartPos, pos);
    setValue(literal.length() == 0 ? 0L : (long) literal.codePointAt(0));
  }

  /**
   * Decodes the escape sequence following a backslash and appends it to the literal.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the backslash.
   */
  private void escape(StringBuilder literal, char quote) {
    if (pos >= buffer.length) {
      error("unterminated escape sequence", pos - 1);
      return;
    }
    int escapePos = pos - 1;
    char c = buffer[pos++];
    switch (c) {
      case 'a':
        literal.append('\u0007');
        break;
      case 'b':
        literal.append('\b');
        break;
      case 'f':
        literal.append('\f');
        break;
      case 'n':
        literal.append('\n');
        break;
      case 'r':
        literal.append('\r');
        break;
      case 't':
        literal.append('\t');
        break;
      case 'v':
        literal.append('\u000b');
        break;
      case '\\':
        literal.append('\\');
        break;
      case 'x':
        appendCodePoint(literal, scanDigits(2, 16, escapePos), escapePos);
        break;
      case 'u':
        appendCodePoint(literal, scanDigits(4, 16, escapePos), escapePos);
        break;
      case 'U':
        appendCodePoint(literal, scanDigits(8, 16, escapePos), escapePos);
        break;
      case '0':
      case '1':
      case '2':
      case '3':
      case '4':
      case '5':
      case '6':
      case '7':
        pos--;
        appendCodePoint(literal, scanDigits(3, 8, escapePos), escapePos);
        break;
      default:
        if (c == quote) {
          literal.append(c);
        } else {
          error(String.format("invalid escape sequence: \\%c", c), escapePos);
        }
    }
  }

  // Reads exactly n digits in the given radix, or returns -1 after reporting an error.
  private int scanDigits(int n, int radix, int escapePos) {
    if (pos + n > buffer.length) {
      error("truncated escape sequence", escapePos);
      pos = buffer.length;
      return -1;
    }
    try {
      int value = Integer.parseUnsignedInt(bufferSlice(pos, pos + n), radix);
      pos += n;
      return value;
    } catch (NumberFormatException e) {
      error("invalid escape sequence: " + bufferSlice(escapePos, pos + n), escapePos);
      pos += n;
      return -1;
    }
  }

  private void appendCodePoint(StringBuilder literal, int codePoint, int escapePos) {
    if (codePoint < 0) {
      return;
    }
    if (!Character.isValidCodePoint(codePoint)) {
      error("escape sequence is not a valid code point", escapePos);
      return;
    }
    literal.appendCodePoint(codePoint);
  }

  /**
   * Scans an identifier or keyword.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier. ON EXIT: 'pos' is 1
   * + the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    String id = bufferSlice(oldPos, pos);
    TokenKind kind = keywordMap.get(id);
    if (kind == null) {
      setToken(TokenKind.IDENTIFIER, oldPos, pos);
      setValue(id);
    } else {
      setToken(kind, oldPos, pos);
    }
  }

  private static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  private static boolean isIdentifierPart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  /**
   * Tokenizes a two-char comparison operator.
   *
   * @return true if it tokenized an operator
   */
  private boolean tokenizeTwoChars() {
    if (pos + 1 >= buffer.length || buffer[pos + 1] != '=') {
      return false;
    }
    TokenKind tok = EQUAL_TOKENS.get(buffer[pos]);
    if (tok == null) {
      return false;
    }
    setToken(tok, pos, pos + 2);
    return true;
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor.
   * Exactly one token is produced.
   */
  private void tokenize() {
    kind = null;
    while (pos < buffer.length) {
      if (tokenizeTwoChars()) {
        pos += 2;
        return;
      }
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '{':
          setToken(TokenKind.LBRACE, pos - 1, pos);
          openParenStackDepth++;
          break;
        case '}':
          setToken(TokenKind.RBRACE, pos - 1, pos);
          popParen();
          break;
        case '(':
          setToken(TokenKind.LPAREN, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ')':
          setToken(TokenKind.RPAREN, pos - 1, pos);
          popParen();
          break;
        case '[':
          setToken(TokenKind.LBRACKET, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ']':
          setToken(TokenKind.RBRACKET, pos - 1, pos);
          popParen();
          break;
        case ',':
          setToken(TokenKind.COMMA, pos - 1, pos);
          break;
        case ';':
          setToken(TokenKind.SEMI, pos - 1, pos);
          break;
        case ':':
          setToken(TokenKind.COLON, pos - 1, pos);
          break;
        case '=':
          setToken(TokenKind.EQUALS, pos - 1, pos);
          break;
        case '!':
          setToken(TokenKind.EXCLAMATION, pos - 1, pos);
          break;
        case '+':
          setToken(TokenKind.PLUS, pos - 1, pos);
          break;
        case '-':
          setToken(TokenKind.MINUS, pos - 1, pos);
          break;
        case '*':
          setToken(TokenKind.STAR, pos - 1, pos);
          break;
        case '%':
          setToken(TokenKind.PERCENT, pos - 1, pos);
          break;
        case '^':
          setToken(TokenKind.CARET, pos - 1, pos);
          break;
        case '~':
          setToken(TokenKind.TILDE, pos - 1, pos);
          break;
        case '<':
          if (peek(0) == '<') {
            pos++;
            setToken(TokenKind.LESS_LESS, pos - 2, pos);
          } else {
            setToken(TokenKind.LESS, pos - 1, pos);
          }
          break;
        case '>':
          if (peek(0) == '>') {
            pos++;
            setToken(TokenKind.GREATER_GREATER, pos - 2, pos);
          } else {
            setToken(TokenKind.GREATER, pos - 1, pos);
          }
          break;
        case '&':
          if (peek(0) == '&') {
            pos++;
            setToken(TokenKind.AMPERSAND_AMPERSAND, pos - 2, pos);
          } else {
            setToken(TokenKind.AMPERSAND, pos - 1, pos);
          }
          break;
        case '|':
          if (peek(0) == '|') {
            pos++;
            setToken(TokenKind.PIPE_PIPE, pos - 2, pos);
          } else {
            setToken(TokenKind.PIPE, pos - 1, pos);
          }
          break;
        case '/':
          if (peek(0) == '/') {
            // Line comment: skip to, but not past, the newline.
            while (pos < buffer.length && buffer[pos] != '\n') {
              pos++;
            }
          } else if (peek(0) == '*') {
            int commentStart = pos - 1;
            pos++;
            while (pos < buffer.length && !(buffer[pos] == '*' && peek(1) == '/')) {
              pos++;
            }
            if (pos < buffer.length) {
              pos += 2;
            } else {
              error("unclosed block comment", commentStart);
            }
          } else {
            setToken(TokenKind.SLASH, pos - 1, pos);
          }
          break;
        case '.':
          if (peek(0) == '.' && peek(1) == '.') {
            pos += 2;
            setToken(TokenKind.ELLIPSIS, pos - 3, pos);
          } else if (peek(0) >= '0' && peek(0) <= '9') {
            pos--;
            scanNumber();
          } else {
            setToken(TokenKind.DOT, pos - 1, pos);
          }
          break;
        case ' ':
        case '\t':
        case '\r':
        case '\f':
          /* ignore whitespace */
          break;
        case '\n':
          newline();
          break;
        case '"':
          stringLiteral();
          break;
        case '`':
          rawStringLiteral();
          break;
        case '\'':
          runeLiteral();
          break;
        default:
          if (c >= '0' && c <= '9') {
            pos--;
            scanNumber();
          } else if (isIdentifierStart(c)) {
            identifierOrKeyword();
          } else {
            error(String.format("invalid character: '%c'", c), pos - 1);
          }
          break;
      }

      if (kind != null) {
        return;
      }
    }

    setToken(TokenKind.EOF, pos, pos);
  }

  /**
   * Scans an integer or floating-point literal.
   *
   * <p>ON ENTRY: 'pos' is the index of the first char of the literal. ON EXIT: 'pos' is 1 + the
   * index of the last char of the literal.
   */
  private void scanNumber() {
    int start = pos;
    int radix = 10;
    boolean isFloat = false;
    if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      radix = 16;
      pos += 2;
    } else if (peek(0) == '0' && (peek(1) == 'o' || peek(1) == 'O')) {
      radix = 8;
      pos += 2;
    } else if (peek(0) == '0' && (peek(1) == 'b' || peek(1) == 'B')) {
      radix = 2;
      pos += 2;
    }
    int digitsStart = pos;
    if (radix == 10) {
      skipDecimalDigits();
      if (peek(0) == '.' && peek(1) != '.') {
        isFloat = true;
        pos++;
        skipDecimalDigits();
      }
      if (peek(0) == 'e' || peek(0) == 'E') {
        isFloat = true;
        pos++;
        if (peek(0) == '+' || peek(0) == '-') {
          pos++;
        }
        skipDecimalDigits();
      }
    } else {
      while (pos < buffer.length
          && (buffer[pos] == '_' || Character.digit(buffer[pos], 16) >= 0)) {
        pos++;
      }
    }

    setToken(isFloat ? TokenKind.FLOAT : TokenKind.INT, start, pos);
    String digits = bufferSlice(digitsStart, pos).replace("_", "");
    if (isFloat) {
      double value;
      try {
        value = Double.parseDouble(digits);
      } catch (NumberFormatException e) {
        error("invalid float literal", start);
        value = 0.0;
      }
      if (Double.isInfinite(value)) {
        error("float literal out of range", start);
        value = 0.0;
      }
      setValue(value);
      return;
    }
    // A leading zero denotes a legacy octal literal.
    if (radix == 10 && digits.length() > 1 && digits.charAt(0) == '0') {
      radix = 8;
      digits = digits.substring(1);
    }
    long value;
    try {
      value = Long.parseLong(digits, radix);
    } catch (NumberFormatException e) {
      error(
          digits.isEmpty()
              ? "invalid integer literal"
              : "invalid integer literal: " + bufferSlice(start, pos),
          start);
      value = 0L;
    }
    setValue(value);
  }

  private void skipDecimalDigits() {
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c != '_' && (c < '0' || c > '9')) {
        return;
      }
      pos++;
    }
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
