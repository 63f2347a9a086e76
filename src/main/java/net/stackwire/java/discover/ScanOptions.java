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

/** Options that control which files a scan reads and how roots are scanned. */
@AutoValue
public abstract class ScanOptions {

  /** The default options. */
  public static final ScanOptions DEFAULT = builder().build();

  /** Suffix of declaration files. */
  public abstract String sourceSuffix();

  /** Suffix of files that are never scanned, even though they carry the source suffix. */
  public abstract String skippedSuffix();

  /** Number of roots scanned concurrently. One scans the roots in the calling thread. */
  public abstract int parallelism();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_ScanOptions.Builder()
        .sourceSuffix(".wire")
        .skippedSuffix("_test.wire")
        .parallelism(1);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link ScanOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder sourceSuffix(String value);

    public abstract Builder skippedSuffix(String value);

    public abstract Builder parallelism(int value);

    abstract ScanOptions autoBuild();

    public ScanOptions build() {
      ScanOptions options = autoBuild();
      if (options.parallelism() < 1) {
        throw new IllegalArgumentException(
            "parallelism must be positive: " + options.parallelism());
      }
      return options;
    }
  }

  /** Reports whether a file of the given name is a declaration file. */
  public boolean isSourceFile(String fileName) {
    return fileName.endsWith(sourceSuffix()) && !fileName.endsWith(skippedSuffix());
  }
}
