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

/** Syntax node for the package clause, {@code package name}. */
public final class PackageClause extends Statement {

  private final int packageOffset;
  private final Identifier name;

  PackageClause(FileLocations locs, int packageOffset, Identifier name) {
    super(locs, Kind.PACKAGE);
    this.packageOffset = packageOffset;
    this.name = name;
  }

  public Identifier getName() {
    return name;
  }

  @Override
  public int getStartOffset() {
    return packageOffset;
  }

  @Override
  public int getEndOffset() {
    return name.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
