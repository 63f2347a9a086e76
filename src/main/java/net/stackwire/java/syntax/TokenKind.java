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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  AMPERSAND("&"),
  AMPERSAND_AMPERSAND("&&"),
  CARET("^"),
  CHAN("chan"),
  COLON(":"),
  COMMA(","),
  CONST("const"),
  DOT("."),
  ELLIPSIS("..."),
  EOF("EOF"),
  EQUALS("="),
  EQUALS_EQUALS("=="),
  EXCLAMATION("!"),
  FLOAT("float literal"),
  FUNC("func"),
  GREATER(">"),
  GREATER_EQUALS(">="),
  GREATER_GREATER(">>"),
  IDENTIFIER("identifier"),
  IMPORT("import"),
  INT("integer literal"),
  INTERFACE("interface"),
  LBRACE("{"),
  LBRACKET("["),
  LESS("<"),
  LESS_EQUALS("<="),
  LESS_LESS("<<"),
  LPAREN("("),
  MAP("map"),
  MINUS("-"),
  NEWLINE("newline"),
  NOT_EQUALS("!="),
  PACKAGE("package"),
  PERCENT("%"),
  PIPE("|"),
  PIPE_PIPE("||"),
  PLUS("+"),
  RBRACE("}"),
  RBRACKET("]"),
  RPAREN(")"),
  SEMI(";"),
  SLASH("/"),
  STAR("*"),
  STRING("string literal"),
  STRUCT("struct"),
  TILDE("~"),
  TYPE("type"),
  VAR("var");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
