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
 * Syntax node for a top-level {@code var} or {@code const} declaration, either a single value spec
 * or a parenthesized group of them.
 */
public final class BindingStatement extends Statement {

  /** A value spec: {@code a, b T = x, y}. The type and the values are both optional. */
  public static final class ValueSpec extends Node {

    private final ImmutableList<Identifier> names;
    @Nullable private final Expression type;
    private final ImmutableList<Expression> values;

    ValueSpec(
        FileLocations locs,
        ImmutableList<Identifier> names,
        @Nullable Expression type,
        ImmutableList<Expression> values) {
      super(locs);
      this.names = names;
      this.type = type;
      this.values = values;
    }

    public ImmutableList<Identifier> getNames() {
      return names;
    }

    @Nullable
    public Expression getType() {
      return type;
    }

    public ImmutableList<Expression> getValues() {
      return values;
    }

    /**
     * Returns the initializer of the i'th name, or null if the spec has no value for it. A spec
     * whose value count differs from its name count has no initializer for any of its names.
     */
    @Nullable
    public Expression getInitializer(int i) {
      return values.size() == names.size() ? values.get(i) : null;
    }

    @Override
    public int getStartOffset() {
      return names.get(0).getStartOffset();
    }

    @Override
    public int getEndOffset() {
      if (!values.isEmpty()) {
        return values.get(values.size() - 1).getEndOffset();
      }
      return type != null ? type.getEndOffset() : names.get(names.size() - 1).getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final TokenKind keyword;
  private final int keywordOffset;
  private final ImmutableList<ValueSpec> specs;
  private final int endOffset;

  BindingStatement(
      FileLocations locs,
      TokenKind keyword,
      int keywordOffset,
      ImmutableList<ValueSpec> specs,
      int endOffset) {
    super(locs, Kind.BINDING);
    this.keyword = keyword;
    this.keywordOffset = keywordOffset;
    this.specs = specs;
    this.endOffset = endOffset;
  }

  /** Returns {@link TokenKind#VAR} or {@link TokenKind#CONST}. */
  public TokenKind getKeyword() {
    return keyword;
  }

  public boolean isConst() {
    return keyword == TokenKind.CONST;
  }

  public ImmutableList<ValueSpec> getSpecs() {
    return specs;
  }

  @Override
  public int getStartOffset() {
    return keywordOffset;
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
