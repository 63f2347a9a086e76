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
package net.stackwire.java.discover;

import com.google.auto.value.AutoValue;

/**
 * Identifies the shape of a structured literal: the namespace of its type, and the type's local
 * name. The namespace is empty for unqualified shapes.
 */
@AutoValue
public abstract class ShapeId {

  public abstract String namespace();

  public abstract String localName();

  public static ShapeId create(String namespace, String localName) {
    return new AutoValue_ShapeId(namespace, localName);
  }

  public boolean isQualified() {
    return !namespace().isEmpty();
  }

  @Override
  public final String toString() {
    return isQualified() ? namespace() + "." + localName() : localName();
  }
}
