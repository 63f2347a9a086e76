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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The references made by one structured-literal binding: the bindings it names at each field
 * path, and its own direct attribute references. Field references keep their source order.
 */
@AutoValue
public abstract class VariableReferences {

  /** Field path to the name of the binding used there. */
  public abstract ImmutableMap<String, String> fieldReferences();

  public abstract ImmutableList<AttributeReference> attributeReferences();

  public static VariableReferences create(
      ImmutableMap<String, String> fieldReferences,
      ImmutableList<AttributeReference> attributeReferences) {
    return new AutoValue_VariableReferences(fieldReferences, attributeReferences);
  }
}
