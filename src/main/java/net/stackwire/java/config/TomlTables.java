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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/** Helpers for reading the bundled TOML configuration tables. */
final class TomlTables {

  private TomlTables() {}

  /** Reads a UTF-8 resource located next to the given class. */
  static String readResource(Class<?> owner, String name) throws ConfigException {
    try (InputStream stream = owner.getResourceAsStream(name)) {
      if (stream == null) {
        throw new ConfigException("resource " + name + " not found");
      }
      return new String(ByteStreams.toByteArray(stream), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigException("reading " + name + ": " + e.getMessage(), e);
    }
  }

  /** Parses TOML text, failing with every parse error joined into one message. */
  static TomlParseResult parse(String content, String source) throws ConfigException {
    TomlParseResult result = Toml.parse(content);
    if (result.hasErrors()) {
      String errorMsg =
          result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
      throw new ConfigException(String.format("%s: TOML decode error: %s", source, errorMsg));
    }
    return result;
  }

  /** Returns the named table, or an empty map if it is absent. All values must be strings. */
  static ImmutableMap<String, String> stringTable(TomlTable root, String key, String source)
      throws ConfigException {
    TomlTable table = root.getTable(key);
    if (table == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (String name : table.keySet()) {
      Object value = table.get(name);
      if (!(value instanceof String s)) {
        throw new ConfigException(
            String.format("%s: %s.%s must be a string, got %s", source, key, name, value));
      }
      builder.put(name, s);
    }
    return builder.buildOrThrow();
  }

  /** Returns the named array of strings, or an empty list if it is absent. */
  static ImmutableList<String> stringList(TomlTable root, String dottedKey, String source)
      throws ConfigException {
    TomlArray array = root.getArray(dottedKey);
    if (array == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Object value : array.toList()) {
      if (!(value instanceof String s)) {
        throw new ConfigException(
            String.format("%s: %s must contain only strings, got %s", source, dottedKey, value));
      }
      builder.add(s);
    }
    return builder.build();
  }

  /** Returns the named string, or the default if it is absent. */
  static String string(
      TomlTable root, String dottedKey, @Nullable String defaultValue, String source)
      throws ConfigException {
    Object value = root.get(dottedKey);
    if (value == null) {
      if (defaultValue == null) {
        throw new ConfigException(String.format("%s: missing required key %s", source, dottedKey));
      }
      return defaultValue;
    }
    if (!(value instanceof String s)) {
      throw new ConfigException(
          String.format("%s: %s must be a string, got %s", source, dottedKey, value));
    }
    return s;
  }
}
