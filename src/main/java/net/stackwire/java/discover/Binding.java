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
import javax.annotation.Nullable;
import net.stackwire.java.syntax.Expression;

/**
 * A top-level binding of a declaration file, with its initializer and the imports of the file that
 * declares it. Bindings without an initializer, such as {@code var X T}, have a null initializer.
 */
@AutoValue
public abstract class Binding {

  public abstract String name();

  public abstract String file();

  public abstract int line();

  @Nullable
  public abstract Expression initializer();

  public abstract ImportTable imports();

  public abstract boolean isConst();

  public static Binding create(
      String name,
      String file,
      int line,
      @Nullable Expression initializer,
      ImportTable imports,
      boolean isConst) {
    return new AutoValue_Binding(name, file, line, initializer, imports, isConst);
  }

  /** Returns {@code file:line}. */
  public String location() {
    return file() + ":" + line();
  }
}
