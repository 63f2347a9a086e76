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

import javax.annotation.Nullable;

/** Syntax node for a slice or array type, {@code []T} or {@code [N]T}. */
public final class ArrayTypeExpression extends Expression {

  private final int lbracketOffset;
  @Nullable private final Expression length;
  private final Expression elementType;

  ArrayTypeExpression(
      FileLocations locs, int lbracketOffset, @Nullable Expression length, Expression elementType) {
    super(locs, Kind.ARRAY_TYPE);
    this.lbracketOffset = lbracketOffset;
    this.length = length;
    this.elementType = elementType;
  }

  /** Returns the array length, or null for a slice type. */
  @Nullable
  public Expression getLength() {
    return length;
  }

  public Expression getElementType() {
    return elementType;
  }

  @Override
  public int getStartOffset() {
    return lbracketOffset;
  }

  @Override
  public int getEndOffset() {
    return elementType.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "[" + (length != null ? length.toString() : "") + "]" + elementType;
  }
}
