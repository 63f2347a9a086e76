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

/** A non-fatal problem found while validating discovered declarations. */
@AutoValue
public abstract class DiscoveryError {

  public abstract String file();

  public abstract int line();

  public abstract String message();

  public static DiscoveryError create(String file, int line, String message) {
    return new AutoValue_DiscoveryError(file, line, message);
  }

  /** Returns {@code file:line: message}. */
  @Override
  public final String toString() {
    return String.format("%s:%d: %s", file(), line(), message());
  }
}
