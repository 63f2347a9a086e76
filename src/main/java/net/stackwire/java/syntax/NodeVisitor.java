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

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order.
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)} or {@link #visitAll} on child fields.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  /** Visits each node of the list in order. */
  public void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  // ==== Statements ====

  public void visit(PackageClause node) {
    visit(node.getName());
  }

  public void visit(ImportDeclaration node) {
    visitAll(node.getSpecs());
  }

  public void visit(ImportDeclaration.ImportSpec node) {
    visit(node.getPath());
  }

  public void visit(BindingStatement node) {
    visitAll(node.getSpecs());
  }

  public void visit(BindingStatement.ValueSpec node) {
    visitAll(node.getNames());
    if (node.getType() != null) {
      visit(node.getType());
    }
    visitAll(node.getValues());
  }

  // ==== Expressions ====

  public void visit(ArrayTypeExpression node) {
    if (node.getLength() != null) {
      visit(node.getLength());
    }
    visit(node.getElementType());
  }

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(CompositeLiteral node) {
    if (node.getType() != null) {
      visit(node.getType());
    }
    visitAll(node.getElements());
  }

  public void visit(CompositeLiteral.Element node) {
    if (node.getKey() != null) {
      visit(node.getKey());
    }
    visit(node.getValue());
  }

  public void visit(@SuppressWarnings("unused") FloatLiteral node) {}

  public void visit(@SuppressWarnings("unused") FunctionLiteral node) {}

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(MapTypeExpression node) {
    visit(node.getKeyType());
    visit(node.getValueType());
  }

  public void visit(SelectorExpression node) {
    visit(node.getObject());
    visit(node.getField());
  }

  public void visit(SliceExpression node) {
    visit(node.getObject());
    if (node.getLo() != null) {
      visit(node.getLo());
    }
    if (node.getHi() != null) {
      visit(node.getHi());
    }
    if (node.getMax() != null) {
      visit(node.getMax());
    }
  }

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }
}
