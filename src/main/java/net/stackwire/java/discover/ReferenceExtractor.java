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
package net.stackwire.java.discover;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.stackwire.java.config.ReservedIdentifiers;
import net.stackwire.java.syntax.ArrayTypeExpression;
import net.stackwire.java.syntax.BinaryOperatorExpression;
import net.stackwire.java.syntax.CallExpression;
import net.stackwire.java.syntax.CompositeLiteral;
import net.stackwire.java.syntax.FunctionLiteral;
import net.stackwire.java.syntax.Identifier;
import net.stackwire.java.syntax.MapTypeExpression;
import net.stackwire.java.syntax.NodeVisitor;
import net.stackwire.java.syntax.SelectorExpression;
import net.stackwire.java.syntax.SliceExpression;
import net.stackwire.java.syntax.StringLiteral;

/**
 * Finds the names a structured literal refers to, by naming convention: a capitalized identifier
 * that is neither an import nor reserved refers to another binding, and {@code X.Y} with a
 * capitalized non-import {@code X} refers to attribute {@code Y} of {@code X}.
 *
 * <p>The walk threads the current field path: a keyed element extends it by the field name, or by
 * the key of a map entry keyed by a string literal, and a positional element leaves it unchanged.
 * Only the top-level keyed elements of the literal are walked. The heuristic over-approximates;
 * references to names that are not bindings are caught by {@link DependencyValidator}.
 */
final class ReferenceExtractor extends NodeVisitor {

  /** The references found in one literal. */
  @AutoValue
  abstract static class Extraction {

    /** Referenced names, each once, in first-use order. */
    abstract ImmutableList<String> dependencies();

    abstract VariableReferences variableReferences();
  }

  private final ImportTable imports;
  private final ReservedIdentifiers reserved;

  private final Set<String> dependencies = new LinkedHashSet<>();
  private final ImmutableList.Builder<AttributeReference> attributeReferences =
      ImmutableList.builder();
  private final Map<String, String> fieldReferences = new LinkedHashMap<>();

  private String currentPath = "";

  private ReferenceExtractor(ImportTable imports, ReservedIdentifiers reserved) {
    this.imports = imports;
    this.reserved = reserved;
  }

  static Extraction extract(
      CompositeLiteral literal, ImportTable imports, ReservedIdentifiers reserved) {
    ReferenceExtractor extractor = new ReferenceExtractor(imports, reserved);
    for (CompositeLiteral.Element element : literal.getElements()) {
      if (!element.isKeyed()) {
        continue;
      }
      String field = pathElement(element);
      extractor.currentPath = field != null ? field : "";
      extractor.visit(element.getValue());
    }
    return new AutoValue_ReferenceExtractor_Extraction(
        ImmutableList.copyOf(extractor.dependencies),
        VariableReferences.create(
            ImmutableMap.copyOf(extractor.fieldReferences),
            extractor.attributeReferences.build()));
  }

  @Override
  public void visit(Identifier node) {
    String name = node.getName();
    if (imports.isAlias(name) || reserved.isReserved(name) || !node.isCapitalized()) {
      return;
    }
    dependencies.add(name);
    if (!currentPath.isEmpty()) {
      fieldReferences.put(currentPath, name);
    }
  }

  @Override
  public void visit(SelectorExpression node) {
    if (!(node.getObject() instanceof Identifier object)) {
      return;
    }
    String name = object.getName();
    if (imports.isAlias(name) || !object.isCapitalized()) {
      return;
    }
    dependencies.add(name);
    attributeReferences.add(
        AttributeReference.create(name, node.getField().getName(), currentPath));
  }

  // Types and keys are never references; only element values are walked.
  @Override
  public void visit(CompositeLiteral node) {
    for (CompositeLiteral.Element element : node.getElements()) {
      String field = pathElement(element);
      if (field == null) {
        visit(element.getValue());
        continue;
      }
      String saved = currentPath;
      currentPath = currentPath.isEmpty() ? field : currentPath + "." + field;
      visit(element.getValue());
      currentPath = saved;
    }
  }

  // A field name, or the key of a map entry keyed by a string literal.
  @Nullable
  private static String pathElement(CompositeLiteral.Element element) {
    if (element.getKey() instanceof StringLiteral key) {
      return key.getValue();
    }
    return element.getFieldName();
  }

  @Override
  public void visit(CallExpression node) {
    visitAll(node.getArguments());
  }

  @Override
  public void visit(SliceExpression node) {
    visit(node.getObject());
  }

  // Operands of binary expressions, type expressions and function literals are not walked.

  @Override
  public void visit(BinaryOperatorExpression node) {}

  @Override
  public void visit(ArrayTypeExpression node) {}

  @Override
  public void visit(MapTypeExpression node) {}

  @Override
  public void visit(FunctionLiteral node) {}
}
