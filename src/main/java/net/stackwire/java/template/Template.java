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
 * A deployment template. The resources are kept in deployment order: every resource follows the
 * resources it depends on. All other sections are ordered by name.
 */
@AutoValue
public abstract class Template {

  public abstract String formatVersion();

  @Nullable
  public abstract String transform();

  @Nullable
  public abstract String description();

  public abstract ImmutableMap<String, ParameterDefinition> parameters();

  public abstract ImmutableMap<String, Object> mappings();

  public abstract ImmutableMap<String, Object> conditions();

  public abstract ImmutableMap<String, ResourceDefinition> resources();

  public abstract ImmutableMap<String, OutputDefinition> outputs();

  public static Builder builder() {
    return new AutoValue_Template.Builder()
        .parameters(ImmutableMap.of())
        .mappings(ImmutableMap.of())
        .conditions(ImmutableMap.of())
        .resources(ImmutableMap.of())
        .outputs(ImmutableMap.of());
  }

  /** Builder for {@link Template}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder formatVersion(String value);

    public abstract Builder transform(@Nullable String value);

    public abstract Builder description(@Nullable String value);

    public abstract Builder parameters(Map<String, ParameterDefinition> value);

    public abstract Builder mappings(Map<String, Object> value);

    public abstract Builder conditions(Map<String, Object> value);

    public abstract Builder resources(Map<String, ResourceDefinition> value);

    public abstract Builder outputs(Map<String, OutputDefinition> value);

    public abstract Template build();
  }

  /**
   * Returns the structured form of the template. Empty optional sections are omitted; the
   * resources section is always present.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("AWSTemplateFormatVersion", formatVersion());
    if (transform() != null) {
      map.put("Transform", transform());
    }
    if (description() != null) {
      map.put("Description", description());
    }
    if (!parameters().isEmpty()) {
      Map<String, Object> section = new LinkedHashMap<>();
      parameters().forEach((name, parameter) -> section.put(name, parameter.toMap()));
      map.put("Parameters", section);
    }
    if (!mappings().isEmpty()) {
      map.put("Mappings", mappings());
    }
    if (!conditions().isEmpty()) {
      map.put("Conditions", conditions());
    }
    Map<String, Object> resources = new LinkedHashMap<>();
    resources().forEach((name, resource) -> resources.put(name, resource.toMap()));
    map.put("Resources", resources);
    if (!outputs().isEmpty()) {
      Map<String, Object> section = new LinkedHashMap<>();
      outputs().forEach((name, output) -> section.put(name, output.toMap()));
      map.put("Outputs", section);
    }
    return map;
  }
}
