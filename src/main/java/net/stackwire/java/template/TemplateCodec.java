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

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Encodes templates as JSON or YAML, and decodes them back. Encoding the same template always
 * yields the same text.
 */
public final class TemplateCodec {

  /** A template encoding. */
  public enum Format {
    JSON,
    YAML;

    /** Returns the format with the given name, ignoring case. */
    public static Format parse(String name) {
      try {
        return valueOf(name.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("unknown template format: " + name, e);
      }
    }
  }

  /** Indicates that a text is not a well-formed template. */
  public static final class FormatException extends Exception {
    public FormatException(String message) {
      super(message);
    }

    public FormatException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  static final Gson GSON =
      new GsonBuilder()
          .setPrettyPrinting()
          .disableHtmlEscaping()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .create();

  private TemplateCodec() {}

  public static String encode(Template template, Format format) {
    switch (format) {
      case JSON:
        return toJson(template);
      case YAML:
        return toYaml(template);
    }
    throw new IllegalArgumentException(format.toString());
  }

  public static Template decode(String text, Format format) throws FormatException {
    switch (format) {
      case JSON:
        return fromJson(text);
      case YAML:
        return fromYaml(text);
    }
    throw new IllegalArgumentException(format.toString());
  }

  public static String toJson(Template template) {
    return GSON.toJson(template.toMap()) + "\n";
  }

  public static String toYaml(Template template) {
    return newYaml().dump(fresh(template.toMap()));
  }

  /** Copies the tree so that no two nodes are shared, which would make YAML emit aliases. */
  private static Object fresh(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> copy.put(k, fresh(v)));
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      list.forEach(element -> copy.add(fresh(element)));
      return copy;
    }
    return value;
  }

  public static Template fromJson(String json) throws FormatException {
    Object document;
    try {
      document = GSON.fromJson(json, Object.class);
    } catch (JsonParseException e) {
      throw new FormatException("malformed JSON template: " + e.getMessage(), e);
    }
    return fromDocument(document);
  }

  public static Template fromYaml(String yaml) throws FormatException {
    Object document;
    try {
      document = newYaml().load(yaml);
    } catch (YAMLException e) {
      throw new FormatException("malformed YAML template: " + e.getMessage(), e);
    }
    return fromDocument(document);
  }

  private static Yaml newYaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setIndicatorIndent(0);
    options.setWidth(120);
    options.setSplitLines(false);
    LoaderOptions loaderOptions = new LoaderOptions();
    return new Yaml(
        new SafeConstructor(loaderOptions), new Representer(options), options, loaderOptions);
  }

  private static Template fromDocument(Object document) throws FormatException {
    if (!(document instanceof Map<?, ?> root)) {
      throw new FormatException("template must be a mapping");
    }
    Template.Builder template = Template.builder();
    if (!(root.get("AWSTemplateFormatVersion") instanceof String version)) {
      throw new FormatException("template has no AWSTemplateFormatVersion");
    }
    template.formatVersion(version);
    template.transform(Values.stringOrNull(root.get("Transform")));
    template.description(Values.stringOrNull(root.get("Description")));

    Map<String, ParameterDefinition> parameters = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : section(root, "Parameters").entrySet()) {
      parameters.put(entry.getKey(), ParameterDefinition.fromMap(mapping(entry)));
    }
    template.parameters(parameters);
    template.mappings(section(root, "Mappings"));
    template.conditions(section(root, "Conditions"));

    Map<String, ResourceDefinition> resources = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : section(root, "Resources").entrySet()) {
      Map<String, Object> resource = mapping(entry);
      if (!(resource.get("Type") instanceof String type)) {
        throw new FormatException("resource " + entry.getKey() + " has no Type");
      }
      Object properties = resource.getOrDefault("Properties", ImmutableMap.of());
      if (!(properties instanceof Map<?, ?> propertyMap)) {
        throw new FormatException("properties of " + entry.getKey() + " must be a mapping");
      }
      resources.put(
          entry.getKey(), ResourceDefinition.create(type, Values.normalizeMap(propertyMap)));
    }
    template.resources(resources);

    Map<String, OutputDefinition> outputs = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : section(root, "Outputs").entrySet()) {
      outputs.put(entry.getKey(), OutputDefinition.fromMap(mapping(entry)));
    }
    template.outputs(outputs);
    return template.build();
  }

  private static ImmutableMap<String, Object> section(Map<?, ?> root, String name)
      throws FormatException {
    Object section = root.get(name);
    if (section == null) {
      return ImmutableMap.of();
    }
    if (!(section instanceof Map<?, ?> map)) {
      throw new FormatException(name + " must be a mapping");
    }
    try {
      return Values.normalizeMap(map);
    } catch (IllegalArgumentException e) {
      throw new FormatException(name + ": " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mapping(Map.Entry<String, Object> entry)
      throws FormatException {
    if (!(entry.getValue() instanceof Map)) {
      throw new FormatException(entry.getKey() + " must be a mapping");
    }
    // Sections are normalized, so nested mappings are string-keyed.
    return (Map<String, Object>) entry.getValue();
  }
}
