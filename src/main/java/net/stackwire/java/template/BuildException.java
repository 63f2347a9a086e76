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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Indicates that a template could not be built. No partial template is produced. */
public final class BuildException extends Exception {

  /** The reason a build failed. */
  public enum Kind {
    /** A resource's shape has no backend type. */
    UNKNOWN_TYPE,
    /** The resources depend on each other cyclically. */
    DEPENDENCY_CYCLE,
    /** The values of the declarations could not be obtained. */
    VALUE_EXTRACTION,
    /** A supplied value has the wrong structure. */
    INVALID_VALUE,
  }

  private final Kind kind;
  private final ImmutableList<String> participants;

  public BuildException(Kind kind, String message) {
    this(kind, message, ImmutableList.of(), null);
  }

  public BuildException(Kind kind, String message, Throwable cause) {
    this(kind, message, ImmutableList.of(), cause);
  }

  BuildException(
      Kind kind, String message, ImmutableList<String> participants, @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.participants = participants;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * For {@link Kind#DEPENDENCY_CYCLE}, the names of the resources on the cycle in dependency
   * order, starting with the smallest name from which the cycle was found; empty otherwise.
   */
  public ImmutableList<String> participants() {
    return participants;
  }
}
