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

/**
 * Syntax node for a function literal. Declaration files are never executed, so the parser skips
 * the signature and body and records only the extent of the literal.
 */
public final class FunctionLiteral extends Expression {

  private final int startOffset;
  private final int endOffset;

  FunctionLiteral(FileLocations locs, int startOffset, int endOffset) {
    super(locs, Kind.FUNCTION_LITERAL);
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "func(...)";
  }
}
