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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Syntax tree for a declaration file: its package clause, imports, and top-level bindings.
 *
 * <p>A SourceFile is produced even when the file contains syntax errors; clients must check {@link
 * #ok} before relying on its contents.
 */
public final class SourceFile extends Node {

  private final ImmutableList<Statement> statements;
  final List<SyntaxError> errors; // appended to by clients

  private SourceFile(
      FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
    super(locs);
    this.statements = statements;
    this.errors = errors;
  }

  /**
   * Parse the specified file, returning its syntax tree with the errors list populated with any
   * scan or parse errors.
   */
  public static SourceFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new SourceFile(result.locs, result.statements, result.errors);
  }

  /** Parses an expression, such as a value fragment in a test or a tool. */
  public static Expression parseExpression(ParserInput input) throws SyntaxError.Exception {
    return Parser.parseExpression(input);
  }

  /** Returns an unmodifiable view of the list of scanner and parser errors. */
  public List<SyntaxError> errors() {
    return Collections.unmodifiableList(errors);
  }

  /** Returns true if there were no errors during scanning and parsing. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the top-level declarations of the file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns the declared package name, or null if the file has no package clause. */
  @Nullable
  public String getPackageName() {
    for (Statement stmt : statements) {
      if (stmt instanceof PackageClause clause) {
        return clause.getName().getName();
      }
    }
    return null;
  }

  /** Returns the import specs of all import declarations, in source order. */
  public ImmutableList<ImportDeclaration.ImportSpec> getImports() {
    ImmutableList.Builder<ImportDeclaration.ImportSpec> imports = ImmutableList.builder();
    for (Statement stmt : statements) {
      if (stmt instanceof ImportDeclaration decl) {
        imports.addAll(decl.getSpecs());
      }
    }
    return imports.build();
  }

  /** Returns the var and const declarations, in source order. */
  public ImmutableList<BindingStatement> getBindings() {
    List<BindingStatement> bindings = new ArrayList<>();
    for (Statement stmt : statements) {
      if (stmt instanceof BindingStatement binding) {
        bindings.add(binding);
      }
    }
    return ImmutableList.copyOf(bindings);
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return statements.isEmpty() ? 0 : statements.get(statements.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visitAll(statements);
  }

  @Override
  public String toString() {
    return "<SourceFile " + getFile() + ">";
  }
}
