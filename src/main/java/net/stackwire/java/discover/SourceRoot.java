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
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A directory to scan for declaration files. A recursive root also scans every directory below
 * it. Roots are written {@code path} or, for a recursive root, {@code path/...}.
 */
@AutoValue
public abstract class SourceRoot {

  private static final String RECURSIVE_SUFFIX = "...";

  public abstract Path path();

  public abstract boolean recursive();

  public static SourceRoot create(Path path, boolean recursive) {
    return new AutoValue_SourceRoot(path, recursive);
  }

  /** Parses a root pattern such as {@code infra} or {@code infra/...}. */
  public static SourceRoot parse(String pattern) {
    if (pattern.equals(RECURSIVE_SUFFIX)) {
      return create(Paths.get("."), true);
    }
    if (pattern.endsWith("/" + RECURSIVE_SUFFIX)) {
      String dir = pattern.substring(0, pattern.length() - RECURSIVE_SUFFIX.length() - 1);
      return create(Paths.get(dir.isEmpty() ? "/" : dir), true);
    }
    return create(Paths.get(pattern), false);
  }

  @Override
  public final String toString() {
    return recursive() ? path() + "/" + RECURSIVE_SUFFIX : path().toString();
  }
}
