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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;
import org.tomlj.TomlParseResult;

/**
 * Identifiers that never denote references to declarations: literals, builtin and intrinsic type
 * names, and pseudo-parameters. Pseudo-parameters also carry the backend name they refer to.
 */
public final class ReservedIdentifiers {

  /** Name of the bundled resource. */
  public static final String DEFAULT_RESOURCE = "reserved-identifiers.toml";

  private final ImmutableSet<String> reserved;
  private final ImmutableMap<String, String> pseudoParameters;

  private ReservedIdentifiers(
      ImmutableSet<String> reserved, ImmutableMap<String, String> pseudoParameters) {
    this.reserved = reserved;
    this.pseudoParameters = pseudoParameters;
  }

  /** Loads the bundled table. */
  public static ReservedIdentifiers loadDefault() throws ConfigException {
    return parse(
        TomlTables.readResource(ReservedIdentifiers.class, DEFAULT_RESOURCE), DEFAULT_RESOURCE);
  }

  /** Parses a table from TOML text. */
  public static ReservedIdentifiers parse(String toml, String source) throws ConfigException {
    TomlParseResult root = TomlTables.parse(toml, source);
    ImmutableMap<String, String> pseudo =
        TomlTables.stringTable(root, "pseudo_parameters", source);
    ImmutableSet<String> reserved =
        ImmutableSet.<String>builder()
            .addAll(TomlTables.stringList(root, "identifiers.literals", source))
            .addAll(TomlTables.stringList(root, "identifiers.builtin_types", source))
            .addAll(TomlTables.stringList(root, "identifiers.intrinsic_types", source))
            .addAll(pseudo.keySet())
            .build();
    return new ReservedIdentifiers(reserved, pseudo);
  }

  /** Returns a table with exactly the given reserved names and pseudo-parameters. */
  public static ReservedIdentifiers of(
      Iterable<String> reserved, ImmutableMap<String, String> pseudoParameters) {
    return new ReservedIdentifiers(
        ImmutableSet.<String>builder().addAll(reserved).addAll(pseudoParameters.keySet()).build(),
        pseudoParameters);
  }

  /** Reports whether the identifier is reserved. */
  public boolean isReserved(String name) {
    return reserved.contains(name);
  }

  /** Returns the backend name of a pseudo-parameter, or null if the name is not one. */
  @Nullable
  public String pseudoParameter(String name) {
    return pseudoParameters.get(name);
  }

  public ImmutableSet<String> names() {
    return reserved;
  }
}
