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
import javax.annotation.Nullable;

/**
 * A template output: a description, a value, and the name under which it is exported. The export
 * name is a string or an intrinsic function.
 */
@AutoValue
public abstract class OutputDefinition {

  @Nullable
  public abstract String description();

  @Nullable
  public abstract Object value();

  @Nullable
  public abstract Object exportName();

  public static OutputDefinition create(
      @Nullable String description, @Nullable Object value, @Nullable Object exportName) {
    return new AutoValue_OutputDefinition(description, value, exportName);
  }

  /**
   * Reads an output from its structured form. The export name is taken from {@code Export.Name},
   * and {@code ExportName} overrides it when both are present.
   */
  public static OutputDefinition fromMap(Map<String, ?> fields) {
    Object exportName = null;
    if (fields.get("Export") instanceof Map<?, ?> export) {
      exportName = export.get("Name");
    }
    if (fields.get("ExportName") != null) {
      exportName = fields.get("ExportName");
    }
    return create(Values.stringOrNull(fields.get("Description")), fields.get("Value"), exportName);
  }

  /** Returns the structured form, in the template's field order. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (description() != null) {
      map.put("Description", description());
    }
    if (value() != null) {
      map.put("Value", value());
    }
    if (exportName() != null) {
      map.put("Export", ImmutableMap.of("Name", exportName()));
    }
    return map;
  }
}
