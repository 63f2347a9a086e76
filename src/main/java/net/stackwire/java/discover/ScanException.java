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
import javax.annotation.Nullable;
import net.stackwire.java.syntax.SyntaxError;

/**
 * Indicates that a source root could not be scanned, because a file in it could not be read or
 * does not parse. The root's partial results are discarded; other roots are unaffected.
 */
public final class ScanException extends Exception {

  private final SourceRoot root;
  private final ImmutableList<SyntaxError> syntaxErrors;

  ScanException(SourceRoot root, String message, @Nullable Throwable cause) {
    super(root + ": " + message, cause);
    this.root = root;
    this.syntaxErrors = ImmutableList.of();
  }

  ScanException(SourceRoot root, String file, ImmutableList<SyntaxError> syntaxErrors) {
    super(root + ": " + file + ": " + SyntaxError.toString(syntaxErrors));
    this.root = root;
    this.syntaxErrors = syntaxErrors;
  }

  /** The root whose scan was aborted. */
  public SourceRoot root() {
    return root;
  }

  /** The syntax errors of the offending file, or empty if it could not be read. */
  public ImmutableList<SyntaxError> syntaxErrors() {
    return syntaxErrors;
  }
}
