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
package net.stackwire.java.config;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.Map;
import javax.annotation.Nullable;
import org.tomlj.TomlParseResult;

/**
 * The shape registry maps the namespace of a declaration's shape to the provisioning backend's
 * type prefix, so that shape {@code s3.Bucket} becomes type {@code AWS::S3::Bucket}. It also
 * carries the template constants that depend on the backend: the format version, the transform
 * family and marker, the nested-property marker, and the keys that identify intrinsic functions.
 *
 * <p>A registry is immutable. The bundled default is loaded from {@code shape-registry.toml};
 * tests and tools may load their own table with {@link #parse} or assemble one with {@link
 * #builder}.
 */
@AutoValue
public abstract class ShapeRegistry {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Name of the bundled registry resource. */
  public static final String DEFAULT_RESOURCE = "shape-registry.toml";

  /** Namespace to type prefix, e.g. {@code s3 -> AWS::S3}. */
  public abstract ImmutableMap<String, String> namespaces();

  /** The template format version marker, e.g. {@code 2010-09-09}. */
  public abstract String formatVersion();

  /** The namespace whose shapes require the transform marker. */
  public abstract String transformFamily();

  /** The transform marker set when a shape of the transform family is present. */
  public abstract String transform();

  /** Local names containing this marker denote nested property types, never resources. */
  public abstract String nestedMarker();

  /** Keys that identify a map as an already-resolved intrinsic function. */
  public abstract ImmutableSet<String> intrinsicKeys();

  public static Builder builder() {
    return new AutoValue_ShapeRegistry.Builder()
        .formatVersion("2010-09-09")
        .transformFamily("serverless")
        .transform("AWS::Serverless-2016-10-31")
        .nestedMarker("_")
        .intrinsicKeys(ImmutableSet.of("Ref", "Fn::GetAtt", "Fn::Sub"));
  }

  public abstract Builder toBuilder();

  /** Builder for {@link ShapeRegistry}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder namespaces(Map<String, String> value);

    public abstract Builder formatVersion(String value);

    public abstract Builder transformFamily(String value);

    public abstract Builder transform(String value);

    public abstract Builder nestedMarker(String value);

    public abstract Builder intrinsicKeys(Iterable<String> value);

    public abstract ShapeRegistry build();
  }

  /** Loads the bundled registry. */
  public static ShapeRegistry loadDefault() throws ConfigException {
    return parse(TomlTables.readResource(ShapeRegistry.class, DEFAULT_RESOURCE), DEFAULT_RESOURCE);
  }

  /**
   * Parses a registry from TOML text. The {@code [namespaces]} table is required; every key of
   * the {@code [template]} table is optional and defaults to the values of {@link #builder}.
   *
   * @param source names the text in error messages
   */
  public static ShapeRegistry parse(String toml, String source) throws ConfigException {
    TomlParseResult root = TomlTables.parse(toml, source);
    if (root.getTable("namespaces") == null) {
      throw new ConfigException(source + ": missing [namespaces] table");
    }
    ShapeRegistry defaults = builder().namespaces(ImmutableMap.of()).build();
    Builder builder =
        builder()
            .namespaces(TomlTables.stringTable(root, "namespaces", source))
            .formatVersion(
                TomlTables.string(
                    root, "template.format_version", defaults.formatVersion(), source))
            .transformFamily(
                TomlTables.string(
                    root, "template.transform_family", defaults.transformFamily(), source))
            .transform(TomlTables.string(root, "template.transform", defaults.transform(), source))
            .nestedMarker(
                TomlTables.string(root, "template.nested_marker", defaults.nestedMarker(), source));
    if (root.getArray("template.intrinsic_keys") != null) {
      builder.intrinsicKeys(TomlTables.stringList(root, "template.intrinsic_keys", source));
    }
    ShapeRegistry registry = builder.build();
    logger.atFine().log(
        "loaded shape registry %s with %d namespaces", source, registry.namespaces().size());
    return registry;
  }

  /** Reports whether shapes in the namespace may be resources. */
  public boolean isKnownNamespace(String namespace) {
    return namespaces().containsKey(namespace);
  }

  /** Reports whether the local name denotes a nested property type. */
  public boolean isNestedType(String localName) {
    return localName.contains(nestedMarker());
  }

  /** Reports whether shapes in the namespace require the transform marker. */
  public boolean requiresTransform(String namespace) {
    return namespace.equals(transformFamily());
  }

  /**
   * Returns the backend type of shape {@code namespace.localName}, or null if the namespace is
   * not registered.
   */
  @Nullable
  public String resourceType(String namespace, String localName) {
    String prefix = namespaces().get(namespace);
    return prefix == null ? null : prefix + "::" + localName;
  }

  /** Reports whether the map carries an intrinsic-function key. */
  public boolean isIntrinsic(Map<?, ?> map) {
    for (String key : intrinsicKeys()) {
      if (map.containsKey(key)) {
        return true;
      }
    }
    return false;
  }
}
