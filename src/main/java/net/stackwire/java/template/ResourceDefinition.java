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
package net.stackwire.java.template;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** A resource of the template: its backend type and properties. */
@AutoValue
public abstract class ResourceDefinition {

  public abstract String type();

  public abstract ImmutableMap<String, Object> properties();

  public static ResourceDefinition create(String type, Map<String, Object> properties) {
    return new AutoValue_ResourceDefinition(type, ImmutableMap.copyOf(properties));
  }

  /** Returns the structured form. Empty properties are omitted. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("Type", type());
    if (!properties().isEmpty()) {
      map.put("Properties", properties());
    }
    return map;
  }
}
