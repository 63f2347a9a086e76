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

/** A top-level binding recognized as one of the template's declaration kinds. */
@AutoValue
public abstract class Declaration {

  /** The template section a declaration belongs to. */
  public enum Kind {
    RESOURCE,
    PARAMETER,
    OUTPUT,
    MAPPING,
    CONDITION,
  }

  public abstract Kind kind();

  /** The binding name, unique within a scan. */
  public abstract String name();

  public abstract ShapeId shape();

  public abstract String file();

  /** The 1-based line of the binding's name. */
  public abstract int line();

  /** Names referenced from the declaration's field values, in first-use order. */
  public abstract ImmutableList<String> dependencies();

  /** Direct attribute references in the declaration's field values. */
  public abstract ImmutableList<AttributeReference> attributeReferences();

  /** Returns {@code file:line}. */
  public String location() {
    return file() + ":" + line();
  }

  public static Builder builder() {
    return new AutoValue_Declaration.Builder()
        .dependencies(ImmutableList.of())
        .attributeReferences(ImmutableList.of());
  }

  public abstract Builder toBuilder();

  /** Builder for {@link Declaration}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder kind(Kind value);

    public abstract Builder name(String value);

    public abstract Builder shape(ShapeId value);

    public abstract Builder file(String value);

    public abstract Builder line(int value);

    public abstract Builder dependencies(Iterable<String> value);

    public abstract Builder attributeReferences(Iterable<AttributeReference> value);

    public abstract Declaration build();
  }
}
