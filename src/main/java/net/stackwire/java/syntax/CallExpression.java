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

/** Syntax node for a function call or conversion, {@code f(a, b)}. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final int lparenOffset;
  private final ImmutableList<Expression> arguments;
  private final int rparenEndOffset;

  CallExpression(
      FileLocations locs,
      Expression function,
      int lparenOffset,
      ImmutableList<Expression> arguments,
      int rparenEndOffset) {
    super(locs, Kind.CALL);
    this.function = function;
    this.lparenOffset = lparenOffset;
    this.arguments = arguments;
    this.rparenEndOffset = rparenEndOffset;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  /** Returns the arguments, in source order. */
  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  public Location getLparenLocation() {
    return locs.getLocation(lparenOffset);
  }

  @Override
  public int getStartOffset() {
    return function.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rparenEndOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return function + "(...)";
  }
}
