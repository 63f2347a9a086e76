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
package net.stackwire.java.extract;

import com.google.auto.value.AutoValue;
import net.stackwire.java.discover.Declaration;

/** A declaration whose value is requested from a {@link ValueExtractor}. */
@AutoValue
public abstract class DeclarationSite {

  public abstract String name();

  public abstract Declaration.Kind kind();

  public abstract String file();

  public abstract int line();

  public static DeclarationSite create(String name, Declaration.Kind kind, String file, int line) {
    return new AutoValue_DeclarationSite(name, kind, file, line);
  }

  public static DeclarationSite of(Declaration declaration) {
    return create(declaration.name(), declaration.kind(), declaration.file(), declaration.line());
  }
}
