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

/** Syntax node for a map type, {@code map[K]V}. */
public final class MapTypeExpression extends Expression {

  private final int mapOffset;
  private final Expression keyType;
  private final Expression valueType;

  MapTypeExpression(FileLocations locs, int mapOffset, Expression keyType, Expression valueType) {
    super(locs, Kind.MAP_TYPE);
    this.mapOffset = mapOffset;
    this.keyType = keyType;
    this.valueType = valueType;
  }

  public Expression getKeyType() {
    return keyType;
  }

  public Expression getValueType() {
    return valueType;
  }

  @Override
  public int getStartOffset() {
    return mapOffset;
  }

  @Override
  public int getEndOffset() {
    return valueType.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "map[" + keyType + "]" + valueType;
  }
}
