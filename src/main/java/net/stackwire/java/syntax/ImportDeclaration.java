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
 * Syntax node for an import declaration, either a single {@code import "path"} or a parenthesized
 * group of import specs.
 */
public final class ImportDeclaration extends Statement {

  /**
   * A single import spec: an optional alias and the imported path. The alias is {@code "."} for a
   * dot import, {@code "_"} for a blank import, and null when the path's last element names the
   * package.
   */
  public static final class ImportSpec extends Node {

    private final int startOffset;
    @Nullable private final String alias;
    private final StringLiteral path;

    ImportSpec(FileLocations locs, int startOffset, @Nullable String alias, StringLiteral path) {
      super(locs);
      this.startOffset = startOffset;
      this.alias = alias;
      this.path = path;
    }

    @Nullable
    public String getAlias() {
      return alias;
    }

    public StringLiteral getPath() {
      return path;
    }

    /** Returns the name by which the imported package is referred to in the file. */
    public String getLocalName() {
      if (alias != null) {
        return alias;
      }
      String p = path.getValue();
      return p.substring(p.lastIndexOf('/') + 1);
    }

    public boolean isDotImport() {
      return ".".equals(alias);
    }

    public boolean isBlankImport() {
      return "_".equals(alias);
    }

    @Override
    public int getStartOffset() {
      return startOffset;
    }

    @Override
    public int getEndOffset() {
      return path.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int importOffset;
  private final ImmutableList<ImportSpec> specs;
  private final int endOffset;

  ImportDeclaration(
      FileLocations locs, int importOffset, ImmutableList<ImportSpec> specs, int endOffset) {
    super(locs, Kind.IMPORT);
    this.importOffset = importOffset;
    this.specs = specs;
    this.endOffset = endOffset;
  }

  public ImmutableList<ImportSpec> getSpecs() {
    return specs;
  }

  @Override
  public int getStartOffset() {
    return importOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
