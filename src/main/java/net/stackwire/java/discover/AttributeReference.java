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
 * A use of an attribute of another declaration, {@code Role.Arn}, at a dot-separated field path
 * of the referencing declaration. The path is empty when the use is not under a named field.
 */
@AutoValue
public abstract class AttributeReference {

  /** The referenced declaration. */
  public abstract String resource();

  /** The attribute name. */
  public abstract String attribute();

  /** The field path within the referencing declaration. */
  public abstract String fieldPath();

  public static AttributeReference create(String resource, String attribute, String fieldPath) {
    return new AutoValue_AttributeReference(resource, attribute, fieldPath);
  }
}
