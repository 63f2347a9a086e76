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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.stackwire.java.syntax.ImportDeclaration.ImportSpec;

/** The imports of one declaration file: the local names it binds to imported paths. */
public final class ImportTable {

  /** The local name of the intrinsic namespace when it is imported under its own name. */
  public static final String INTRINSICS = "intrinsics";

  public static final ImportTable EMPTY = new ImportTable(ImmutableMap.of(), ImmutableList.of());

  private final ImmutableMap<String, String> aliases; // local name -> path
  private final ImmutableList<String> dotImports;

  private ImportTable(ImmutableMap<String, String> aliases, ImmutableList<String> dotImports) {
    this.aliases = aliases;
    this.dotImports = dotImports;
  }

  public static ImportTable of(List<ImportSpec> specs) {
    Map<String, String> aliases = new LinkedHashMap<>();
    ImmutableList.Builder<String> dotImports = ImmutableList.builder();
    for (ImportSpec spec : specs) {
      String path = spec.getPath().getValue();
      if (spec.isDotImport()) {
        dotImports.add(path);
      } else if (!spec.isBlankImport()) {
        aliases.put(spec.getLocalName(), path);
      }
    }
    return new ImportTable(ImmutableMap.copyOf(aliases), dotImports.build());
  }

  /** Reports whether the name is the local name of an import. */
  public boolean isAlias(String name) {
    return aliases.containsKey(name);
  }

  /** Returns the path imported under the local name, or null. */
  @Nullable
  public String path(String alias) {
    return aliases.get(alias);
  }

  /**
   * Returns the namespace denoted by a qualifier: the last element of the path it imports, or the
   * qualifier itself if nothing is imported under that name.
   */
  public String namespaceOf(String qualifier) {
    String path = aliases.get(qualifier);
    return path == null ? qualifier : lastElement(path);
  }

  /**
   * Reports whether the qualifier denotes the intrinsic namespace. The empty qualifier denotes it
   * when the intrinsics are dot-imported.
   */
  public boolean isIntrinsicNamespace(String qualifier) {
    if (qualifier.isEmpty()) {
      return dotImports.stream().anyMatch(ImportTable::isIntrinsicPath);
    }
    if (qualifier.equals(INTRINSICS)) {
      return true;
    }
    String path = aliases.get(qualifier);
    return path != null && isIntrinsicPath(path);
  }

  private static boolean isIntrinsicPath(String path) {
    return path.equals(INTRINSICS) || path.endsWith("/" + INTRINSICS);
  }

  private static String lastElement(String path) {
    return path.substring(path.lastIndexOf('/') + 1);
  }
}
