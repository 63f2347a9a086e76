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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Recursive descent parser for declaration files.
 *
 * <p>Only top-level package, import, var and const declarations are represented in the syntax
 * tree. Function and type declarations are skipped, as are the bodies of function literals, since
 * declaration files are analyzed but never executed.
 */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    /** The top-level declarations of the parsed file. */
    final ImmutableList<Statement> statements;

    // Errors encountered during scanning or parsing.
    // These lists are ultimately owned by SourceFile.
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
      this.locs = locs;
      this.statements = Preconditions.checkNotNull(statements);
      this.errors = errors;
    }
  }

  private static final EnumSet<TokenKind> STATEMENT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> VALUE_SPEC_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI, TokenKind.RPAREN);

  private static final EnumSet<TokenKind> EXPR_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  private static final EnumSet<TokenKind> UNARY_OPERATORS =
      EnumSet.of(
          TokenKind.AMPERSAND,
          TokenKind.CARET,
          TokenKind.EXCLAMATION,
          TokenKind.MINUS,
          TokenKind.PLUS,
          TokenKind.STAR);

  // Binary operator precedence; higher binds tighter.
  private static final ImmutableMap<TokenKind, Integer> BINARY_PRECEDENCE =
      ImmutableMap.<TokenKind, Integer>builder()
          .put(TokenKind.PIPE_PIPE, 1)
          .put(TokenKind.AMPERSAND_AMPERSAND, 2)
          .put(TokenKind.EQUALS_EQUALS, 3)
          .put(TokenKind.NOT_EQUALS, 3)
          .put(TokenKind.LESS, 3)
          .put(TokenKind.LESS_EQUALS, 3)
          .put(TokenKind.GREATER, 3)
          .put(TokenKind.GREATER_EQUALS, 3)
          .put(TokenKind.PLUS, 4)
          .put(TokenKind.MINUS, 4)
          .put(TokenKind.PIPE, 4)
          .put(TokenKind.CARET, 4)
          .put(TokenKind.STAR, 5)
          .put(TokenKind.SLASH, 5)
          .put(TokenKind.PERCENT, 5)
          .put(TokenKind.LESS_LESS, 5)
          .put(TokenKind.GREATER_GREATER, 5)
          .put(TokenKind.AMPERSAND, 5)
          .buildOrThrow();

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next declaration

  // End offset of the most recently consumed token.
  private int lastTokenEnd;

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.errors = errors;
    this.locs = lexer.locs;
    this.token = lexer;
    nextToken();
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors);
    ImmutableList<Statement> statements;
    try {
      statements = parser.parseFileInput();
    } catch (StackOverflowError ex) {
      // See the comment in parseExpression.
      parser.reportError(
          lexer.end,
          "internal error: stack overflow in parser while parsing %s",
          input.getFile());
      statements = ImmutableList.of();
    }
    return new ParseResult(lexer.locs, statements, errors);
  }

  /** Parses an expression, possibly followed by newlines. */
  static Expression parseExpression(ParserInput input) throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors);
    Expression result = null;
    try {
      result = parser.parseExpr();
      while (parser.token.kind == TokenKind.NEWLINE) {
        parser.nextToken();
      }
      parser.expect(TokenKind.EOF);
    } catch (StackOverflowError ex) {
      // Deeply nested literals can exhaust the stack; report this as a syntax error rather
      // than crashing the scan.
      parser.reportError(
          lexer.end,
          "internal error: stack overflow in parser while parsing %s",
          input.getFile());
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      Location location = locs.getLocation(offset);
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    if (!recoveryMode) {
      reportError(
          token.start, "syntax error at '%s': %s", tokenString(token.kind, token.value), message);
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Consumes tokens past the first token belonging to terminatingTokens.
  // It returns the end offset of the terminating token.
  private int syncPast(EnumSet<TokenKind> terminatingTokens) {
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
    }
    int end = token.end;
    // read past the synchronization token
    nextToken();
    return end;
  }

  /**
   * Consume tokens until we reach the first token that has a kind that is in the set of
   * terminatingTokens.
   *
   * @return the end offset of the last token consumed.
   */
  private int syncTo(EnumSet<TokenKind> terminatingTokens) {
    // EOF must be in the set to prevent an infinite loop
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    // read past the problematic token
    int previous = token.end;
    nextToken();
    while (!terminatingTokens.contains(token.kind)) {
      previous = token.end;
      nextToken();
    }
    return previous;
  }

  private static String tokenString(TokenKind kind, @Nullable Object value) {
    if (kind == TokenKind.STRING) {
      return "\"" + value + "\"";
    }
    return value == null ? kind.toString() : value.toString();
  }

  // Consumes the current token and returns its start offset.
  private int nextToken() {
    int prev = token.start;
    lastTokenEnd = token.end;
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
    return prev;
  }

  // Returns an "Identifier" whose content is the input from start to end.
  private Identifier makeErrorExpression(int start, int end) {
    // A dedicated bad-expression type would complicate every consumer of parseIdent,
    // which is convenient to keep returning an Identifier even when it fails.
    return new Identifier(locs, lexer.bufferSlice(start, Math.max(start, end)), start);
  }

  // file_input = ('\n' | ';' | decl)* EOF
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    while (token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.NEWLINE || token.kind == TokenKind.SEMI) {
        nextToken();
        continue;
      }
      parseTopLevelDeclaration(list);
    }
    return list.build();
  }

  // decl = package_clause | import_decl | var_decl | const_decl | func_decl | type_decl
  private void parseTopLevelDeclaration(ImmutableList.Builder<Statement> list) {
    switch (token.kind) {
      case PACKAGE:
        list.add(parsePackageClause());
        break;
      case IMPORT:
        list.add(parseImportDeclaration());
        break;
      case VAR:
      case CONST:
        list.add(parseBindingStatement());
        break;
      case FUNC:
      case TYPE:
        skipDeclaration();
        break;
      default:
        syntaxError("expected declaration");
        syncPast(STATEMENT_TERMINATOR_SET);
        recoveryMode = false;
        return;
    }
    expectDeclarationEnd();
  }

  // Each declaration ends at a newline, a semicolon, or the end of the file.
  private void expectDeclarationEnd() {
    if (token.kind == TokenKind.NEWLINE || token.kind == TokenKind.SEMI) {
      nextToken();
    } else if (token.kind != TokenKind.EOF) {
      syntaxError("expected newline after declaration");
      syncPast(STATEMENT_TERMINATOR_SET);
    }
    recoveryMode = false;
  }

  // The bodies of function and type declarations are bracketed, and the lexer reports no
  // newlines within brackets, so the declaration ends at the first top-level terminator.
  private void skipDeclaration() {
    while (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      nextToken();
    }
  }

  // package_clause = 'package' IDENTIFIER
  private PackageClause parsePackageClause() {
    int packageOffset = expect(TokenKind.PACKAGE);
    Identifier name = parseIdent();
    return new PackageClause(locs, packageOffset, name);
  }

  // import_decl = 'import' (import_spec | '(' (import_spec ';'?)* ')')
  private ImportDeclaration parseImportDeclaration() {
    int importOffset = expect(TokenKind.IMPORT);
    ImmutableList.Builder<ImportDeclaration.ImportSpec> specs = ImmutableList.builder();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.SEMI) {
          nextToken();
          continue;
        }
        specs.add(parseImportSpec());
      }
      expect(TokenKind.RPAREN);
    } else {
      specs.add(parseImportSpec());
    }
    return new ImportDeclaration(locs, importOffset, specs.build(), lastTokenEnd);
  }

  // import_spec = [IDENTIFIER | '.'] STRING
  private ImportDeclaration.ImportSpec parseImportSpec() {
    int start = token.start;
    String alias = null;
    if (token.kind == TokenKind.IDENTIFIER) {
      alias = (String) token.value;
      nextToken();
    } else if (token.kind == TokenKind.DOT) {
      alias = ".";
      nextToken();
    }
    if (token.kind != TokenKind.STRING) {
      int offset = token.start;
      expect(TokenKind.STRING);
      return new ImportDeclaration.ImportSpec(
          locs, start, alias, new StringLiteral(locs, offset, "", offset));
    }
    return new ImportDeclaration.ImportSpec(locs, start, alias, parseStringLiteral());
  }

  // binding_decl = ('var' | 'const') (value_spec | '(' (value_spec ';'?)* ')')
  private BindingStatement parseBindingStatement() {
    TokenKind keyword = token.kind;
    int keywordOffset = nextToken();
    ImmutableList.Builder<BindingStatement.ValueSpec> specs = ImmutableList.builder();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.SEMI) {
          nextToken();
          continue;
        }
        specs.add(parseValueSpec());
      }
      expect(TokenKind.RPAREN);
    } else {
      specs.add(parseValueSpec());
    }
    return new BindingStatement(locs, keyword, keywordOffset, specs.build(), lastTokenEnd);
  }

  // value_spec = IDENTIFIER (',' IDENTIFIER)* [type] ['=' expr (',' expr)*]
  private BindingStatement.ValueSpec parseValueSpec() {
    ImmutableList.Builder<Identifier> names = ImmutableList.builder();
    names.add(parseIdent());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      names.add(parseIdent());
    }
    Expression type = null;
    if (token.kind != TokenKind.EQUALS && !VALUE_SPEC_TERMINATOR_SET.contains(token.kind)) {
      type = parseType();
    }
    ImmutableList<Expression> values = ImmutableList.of();
    if (token.kind == TokenKind.EQUALS) {
      nextToken();
      values = parseExprList();
    }
    return new BindingStatement.ValueSpec(locs, names.build(), type, values);
  }

  // expr_list = expr (',' expr)*
  private ImmutableList<Expression> parseExprList() {
    ImmutableList.Builder<Expression> list = ImmutableList.builder();
    list.add(parseExpr());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      list.add(parseExpr());
    }
    return list.build();
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      int start = token.start;
      int end = expect(TokenKind.IDENTIFIER);
      return makeErrorExpression(start, end);
    }
    Identifier ident = new Identifier(locs, (String) token.value, token.start);
    nextToken();
    return ident;
  }

  private StringLiteral parseStringLiteral() {
    Preconditions.checkState(token.kind == TokenKind.STRING);
    StringLiteral literal = new StringLiteral(locs, token.start, (String) token.value, token.end);
    nextToken();
    return literal;
  }

  // type = IDENTIFIER ['.' IDENTIFIER]
  //      | '[' [expr | '...'] ']' type
  //      | 'map' '[' type ']' type
  //      | '*' type
  //      | 'interface' '{' ... '}'
  //      | 'struct' '{' ... '}'
  //      | '(' type ')'
  private Expression parseType() {
    switch (token.kind) {
      case IDENTIFIER:
        {
          Identifier id = parseIdent();
          if (token.kind == TokenKind.DOT) {
            int dotOffset = nextToken();
            return new SelectorExpression(locs, id, dotOffset, parseIdent());
          }
          return id;
        }
      case LBRACKET:
        {
          int lbracketOffset = nextToken();
          Expression length = null;
          if (token.kind == TokenKind.ELLIPSIS) {
            nextToken();
          } else if (token.kind != TokenKind.RBRACKET) {
            length = parseExpr();
          }
          expect(TokenKind.RBRACKET);
          return new ArrayTypeExpression(locs, lbracketOffset, length, parseType());
        }
      case MAP:
        {
          int mapOffset = nextToken();
          expect(TokenKind.LBRACKET);
          Expression keyType = parseType();
          expect(TokenKind.RBRACKET);
          return new MapTypeExpression(locs, mapOffset, keyType, parseType());
        }
      case STAR:
        {
          int starOffset = nextToken();
          return new UnaryOperatorExpression(locs, TokenKind.STAR, starOffset, parseType());
        }
      case INTERFACE:
      case STRUCT:
        {
          // Anonymous interface and struct types are opaque; interface{} denotes "any".
          String name = token.kind == TokenKind.INTERFACE ? "any" : "struct";
          int offset = nextToken();
          skipBracketed(TokenKind.LBRACE, TokenKind.RBRACE);
          return new Identifier(locs, name, offset);
        }
      case LPAREN:
        {
          nextToken();
          Expression type = parseType();
          expect(TokenKind.RPAREN);
          return type;
        }
      default:
        {
          int start = token.start;
          syntaxError("expected type");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  // Skips a balanced open...close token sequence.
  private void skipBracketed(TokenKind open, TokenKind close) {
    if (token.kind != open) {
      syntaxError("expected " + open);
      return;
    }
    int depth = 0;
    do {
      if (token.kind == open) {
        depth++;
      } else if (token.kind == close) {
        depth--;
      }
      nextToken();
    } while (depth > 0 && token.kind != TokenKind.EOF);
  }

  // expr = unary_expr | expr binary_op expr
  private Expression parseExpr() {
    return parseBinaryExpr(1);
  }

  // Precedence climbing: operators of equal precedence associate to the left.
  private Expression parseBinaryExpr(int minPrecedence) {
    Expression x = parseUnaryExpr();
    while (true) {
      Integer prec = BINARY_PRECEDENCE.get(token.kind);
      if (prec == null || prec < minPrecedence) {
        return x;
      }
      TokenKind op = token.kind;
      int opOffset = nextToken();
      Expression y = parseBinaryExpr(prec + 1);
      x = new BinaryOperatorExpression(locs, x, op, opOffset, y);
    }
  }

  // unary_expr = primary_expr | unary_op unary_expr
  private Expression parseUnaryExpr() {
    if (UNARY_OPERATORS.contains(token.kind)) {
      TokenKind op = token.kind;
      int opOffset = nextToken();
      return new UnaryOperatorExpression(locs, op, opOffset, parseUnaryExpr());
    }
    return parsePrimaryWithSuffix();
  }

  // primary_with_suffix = primary
  //                     | primary_with_suffix '.' IDENTIFIER
  //                     | primary_with_suffix call_suffix
  //                     | primary_with_suffix index_or_slice_suffix
  //                     | literal_type literal_value
  private Expression parsePrimaryWithSuffix() {
    Expression e = parsePrimary();
    while (true) {
      switch (token.kind) {
        case DOT:
          {
            int dotOffset = nextToken();
            if (token.kind != TokenKind.IDENTIFIER) {
              syntaxError("expected identifier after dot");
              int end = syncTo(EXPR_TERMINATOR_SET);
              return makeErrorExpression(e.getStartOffset(), end);
            }
            e = new SelectorExpression(locs, e, dotOffset, parseIdent());
            break;
          }
        case LPAREN:
          e = parseCallSuffix(e);
          break;
        case LBRACKET:
          e = parseIndexOrSliceSuffix(e);
          break;
        case LBRACE:
          if (!isLiteralType(e)) {
            return e;
          }
          e = parseCompositeLiteral(e);
          break;
        default:
          return e;
      }
    }
  }

  // Reports whether e may be the type of a composite literal.
  private static boolean isLiteralType(Expression e) {
    switch (e.kind()) {
      case IDENTIFIER:
      case ARRAY_TYPE:
      case MAP_TYPE:
        return true;
      case SELECTOR:
        return ((SelectorExpression) e).getObject().kind() == Expression.Kind.IDENTIFIER;
      default:
        return false;
    }
  }

  // primary = INT | FLOAT | STRING | IDENTIFIER
  //         | '(' expr ')'
  //         | literal_type
  //         | literal_value
  //         | function_literal
  private Expression parsePrimary() {
    switch (token.kind) {
      case INT:
        {
          IntLiteral literal = new IntLiteral(locs, token.raw, token.start, (Long) token.value);
          nextToken();
          return literal;
        }
      case FLOAT:
        {
          FloatLiteral literal =
              new FloatLiteral(locs, token.raw, token.start, (Double) token.value);
          nextToken();
          return literal;
        }
      case STRING:
        return parseStringLiteral();
      case IDENTIFIER:
        return parseIdent();
      case LPAREN:
        {
          nextToken();
          Expression e = parseExpr();
          expect(TokenKind.RPAREN);
          return e;
        }
      case LBRACKET:
      case MAP:
      case STRUCT:
      case INTERFACE:
        return parseType();
      case LBRACE:
        return parseCompositeLiteral(null);
      case FUNC:
        return parseFunctionLiteral();
      default:
        {
          int start = token.start;
          syntaxError("expected expression");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  // call_suffix = '(' [expr (',' expr)* ['...'] [',']] ')'
  private Expression parseCallSuffix(Expression fn) {
    int lparenOffset = expect(TokenKind.LPAREN);
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      args.add(parseExpr());
      if (token.kind == TokenKind.ELLIPSIS) {
        nextToken();
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rparenEnd = token.end;
    expect(TokenKind.RPAREN);
    return new CallExpression(locs, fn, lparenOffset, args.build(), rparenEnd);
  }

  // index_or_slice_suffix = '[' expr ']'
  //                       | '[' [expr] ':' [expr] [':' expr] ']'
  private Expression parseIndexOrSliceSuffix(Expression object) {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    Expression lo = null;
    if (token.kind != TokenKind.COLON) {
      lo = parseExpr();
    }
    if (token.kind == TokenKind.COLON) {
      nextToken();
      Expression hi = null;
      Expression max = null;
      if (token.kind != TokenKind.RBRACKET && token.kind != TokenKind.COLON) {
        hi = parseExpr();
      }
      if (token.kind == TokenKind.COLON) {
        nextToken();
        max = parseExpr();
      }
      int rbracketEnd = token.end;
      expect(TokenKind.RBRACKET);
      return new SliceExpression(locs, object, lbracketOffset, lo, hi, max, rbracketEnd);
    }
    int rbracketEnd = token.end;
    expect(TokenKind.RBRACKET);
    return new IndexExpression(locs, object, lbracketOffset, lo, rbracketEnd);
  }

  // literal_value = '{' [element (',' element)* [',']] '}'
  // element = [key ':'] value
  private CompositeLiteral parseCompositeLiteral(@Nullable Expression type) {
    int lbraceOffset = expect(TokenKind.LBRACE);
    ImmutableList.Builder<CompositeLiteral.Element> elements = ImmutableList.builder();
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      Expression first = parseExpr();
      if (token.kind == TokenKind.COLON) {
        nextToken();
        elements.add(new CompositeLiteral.Element(locs, first, parseExpr()));
      } else {
        elements.add(new CompositeLiteral.Element(locs, null, first));
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rbraceEnd = token.end;
    expect(TokenKind.RBRACE);
    return new CompositeLiteral(locs, type, lbraceOffset, elements.build(), rbraceEnd);
  }

  // function_literal = 'func' signature '{' ... '}'
  private FunctionLiteral parseFunctionLiteral() {
    int funcOffset = expect(TokenKind.FUNC);
    // The signature ends at the first brace outside parentheses.
    int parenDepth = 0;
    while (token.kind != TokenKind.EOF && !(token.kind == TokenKind.LBRACE && parenDepth == 0)) {
      if (token.kind == TokenKind.LPAREN) {
        parenDepth++;
      } else if (token.kind == TokenKind.RPAREN) {
        parenDepth--;
      }
      nextToken();
    }
    skipBracketed(TokenKind.LBRACE, TokenKind.RBRACE);
    return new FunctionLiteral(locs, funcOffset, lastTokenEnd);
  }
}
