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

/** Syntax node for a slice expression, {@code object[lo:hi]} or {@code object[lo:hi:max]}. */
public final class SliceExpression extends Expression {

  private final Expression object;
  private final int lbracketOffset;
  @Nullable private final Expression lo;
  @Nullable private final Expression hi;
  @Nullable private final Expression max;
  private final int rbracketEndOffset;

  SliceExpression(
      FileLocations locs,
      Expression object,
      int lbracketOffset,
      @Nullable Expression lo,
      @Nullable Expression hi,
      @Nullable Expression max,
      int rbracketEndOffset) {
    super(locs, Kind.SLICE);
    this.object = object;
    this.lbracketOffset = lbracketOffset;
    this.lo = lo;
    this.hi = hi;
    this.max = max;
    this.rbracketEndOffset = rbracketEndOffset;
  }

  public Expression getObject() {
    return object;
  }

  @Nullable
  public Expression getLo() {
    return lo;
  }

  @Nullable
  public Expression getHi() {
    return hi;
  }

  @Nullable
  public Expression getMax() {
    return max;
  }

  public Location getLbracketLocation() {
    return locs.getLocation(lbracketOffset);
  }

  @Override
  public int getStartOffset() {
    return object.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rbracketEndOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
