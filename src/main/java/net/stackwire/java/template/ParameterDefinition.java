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
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The definition of a template parameter. Absent fields are null and are not encoded. */
@AutoValue
public abstract class ParameterDefinition {

  /** The parameter type used when a definition does not name one. */
  public static final String DEFAULT_TYPE = "String";

  public abstract String type();

  @Nullable
  public abstract String description();

  @Nullable
  public abstract Object defaultValue();

  @Nullable
  public abstract ImmutableList<Object> allowedValues();

  @Nullable
  public abstract String allowedPattern();

  @Nullable
  public abstract String constraintDescription();

  @Nullable
  public abstract Long minLength();

  @Nullable
  public abstract Long maxLength();

  @Nullable
  public abstract Double minValue();

  @Nullable
  public abstract Double maxValue();

  public abstract boolean noEcho();

  public static Builder builder() {
    return new AutoValue_ParameterDefinition.Builder().type(DEFAULT_TYPE).noEcho(false);
  }

  /** Builder for {@link ParameterDefinition}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder type(String value);

    public abstract Builder description(@Nullable String value);

    public abstract Builder defaultValue(@Nullable Object value);

    public abstract Builder allowedValues(@Nullable List<Object> value);

    public abstract Builder allowedPattern(@Nullable String value);

    public abstract Builder constraintDescription(@Nullable String value);

    public abstract Builder minLength(@Nullable Long value);

    public abstract Builder maxLength(@Nullable Long value);

    public abstract Builder minValue(@Nullable Double value);

    public abstract Builder maxValue(@Nullable Double value);

    public abstract Builder noEcho(boolean value);

    public abstract ParameterDefinition build();
  }

  /**
   * Reads a definition from its structured form. Fields of the wrong type are ignored, and a
   * missing or non-string {@code Type} defaults to {@value #DEFAULT_TYPE}.
   */
  public static ParameterDefinition fromMap(Map<String, ?> fields) {
    Builder builder = builder();
    if (fields.get("Type") instanceof String type) {
      builder.type(type);
    }
    builder.description(Values.stringOrNull(fields.get("Description")));
    builder.defaultValue(fields.get("Default"));
    if (fields.get("AllowedValues") instanceof List<?> values && !values.isEmpty()) {
      builder.allowedValues(ImmutableList.copyOf(values));
    }
    builder.allowedPattern(Values.stringOrNull(fields.get("AllowedPattern")));
    builder.constraintDescription(Values.stringOrNull(fields.get("ConstraintDescription")));
    if (fields.get("MinLength") instanceof Number n) {
      builder.minLength(n.longValue());
    }
    if (fields.get("MaxLength") instanceof Number n) {
      builder.maxLength(n.longValue());
    }
    if (fields.get("MinValue") instanceof Number n) {
      builder.minValue(n.doubleValue());
    }
    if (fields.get("MaxValue") instanceof Number n) {
      builder.maxValue(n.doubleValue());
    }
    if (fields.get("NoEcho") instanceof Boolean b) {
      builder.noEcho(b);
    }
    return builder.build();
  }

  /** Returns the structured form, in the template's field order. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("Type", type());
    putIfPresent(map, "Description", description());
    putIfPresent(map, "Default", defaultValue());
    putIfPresent(map, "AllowedValues", allowedValues());
    putIfPresent(map, "AllowedPattern", allowedPattern());
    putIfPresent(map, "ConstraintDescription", constraintDescription());
    putIfPresent(map, "MinLength", minLength());
    putIfPresent(map, "MaxLength", maxLength());
    putIfPresent(map, "MinValue", minValue());
    putIfPresent(map, "MaxValue", maxValue());
    if (noEcho()) {
      map.put("NoEcho", true);
    }
    return map;
  }

  private static void putIfPresent(Map<String, Object> map, String key, @Nullable Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
