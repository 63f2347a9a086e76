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
 * Base class for all expression nodes in the syntax tree.
 *
 * <p>Type expressions such as {@code []T} or {@code map[K]V} are expressions too: they appear as
 * the type of a composite literal and, occasionally, as a call argument.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    ARRAY_TYPE,
    BINARY_OPERATOR,
    CALL,
    COMPOSITE_LITERAL,
    FLOAT_LITERAL,
    FUNCTION_LITERAL,
    IDENTIFIER,
    INDEX,
    INT_LITERAL,
    MAP_TYPE,
    SELECTOR,
    SLICE,
    STRING_LITERAL,
    UNARY_OPERATOR,
  }

  private final Kind kind;

  Expression(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  /** Returns the expression's kind. */
  public final Kind kind() {
    return kind;
  }
}
