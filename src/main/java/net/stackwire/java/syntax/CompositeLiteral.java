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
import javax.annotation.Nullable;

/**
 * Syntax node for a composite literal, {@code Type{key: value, ...}} or {@code Type{a, b}}.
 *
 * <p>The type is absent for literals nested in an enclosing literal whose element type is implied,
 * as in {@code []Tag{{Key: "a", Value: "b"}}}.
 */
public final class CompositeLiteral extends Expression {

  /** An element of a composite literal: an optional key, and a value. */
  public static final class Element extends Node {

    @Nullable private final Expression key;
    private final Expression value;

    Element(FileLocations locs, @Nullable Expression key, Expression value) {
      super(locs);
      this.key = key;
      this.value = value;
    }

    /** Returns the key of a keyed element, or null for a positional one. */
    @Nullable
    public Expression getKey() {
      return key;
    }

    public Expression getValue() {
      return value;
    }

    public boolean isKeyed() {
      return key != null;
    }

    /** Returns the field name of an element keyed by an identifier, or null otherwise. */
    @Nullable
    public String getFieldName() {
      return key instanceof Identifier id ? id.getName() : null;
    }

    @Override
    public int getStartOffset() {
      return key != null ? key.getStartOffset() : value.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return value.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  @Nullable private final Expression type;
  private final int lbraceOffset;
  private final ImmutableList<Element> elements;
  private final int rbraceEndOffset;

  CompositeLiteral(
      FileLocations locs,
      @Nullable Expression type,
      int lbraceOffset,
      ImmutableList<Element> elements,
      int rbraceEndOffset) {
    super(locs, Kind.COMPOSITE_LITERAL);
    this.type = type;
    this.lbraceOffset = lbraceOffset;
    this.elements = elements;
    this.rbraceEndOffset = rbraceEndOffset;
  }

  /** Returns the literal's type expression, or null if the type is elided. */
  @Nullable
  public Expression getType() {
    return type;
  }

  public ImmutableList<Element> getElements() {
    return elements;
  }

  /** Reports whether every element is keyed. An empty literal is keyed. */
  public boolean isKeyed() {
    for (Element element : elements) {
      if (!element.isKeyed()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int getStartOffset() {
    return type != null ? type.getStartOffset() : lbraceOffset;
  }

  @Override
  public int getEndOffset() {
    return rbraceEndOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return (type != null ? type.toString() : "") + "{...}";
  }
}
